/*
 * Copyright 2025 AxonOps
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.axonops.hashid.cache;

import com.axonops.hashid.api.HasherConfig;
import com.axonops.hashid.api.HasherType;
import com.axonops.hashid.util.ConfigFingerprint;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Canonical identifier of a (type, effective configuration) pair.
 *
 * <p>The configuration is serialized with its fields sorted by name, each written as {@code
 * name=<length>:<value>;}, and the result is hashed with SHA-256. Equivalent configurations
 * therefore always map to the same key whatever order the caller supplied them in, and the key can
 * be logged or returned without revealing the salt.
 *
 * @param type hasher type
 * @param digest hex SHA-256 of the canonical configuration
 * @since 1.0.0
 */
public record CacheKey(HasherType type, String digest) {

  public CacheKey {
    Objects.requireNonNull(type, "type cannot be null");
    Objects.requireNonNull(digest, "digest cannot be null");
  }

  /**
   * Computes the key for an effective configuration.
   *
   * @param type hasher type
   * @param config effective (merged and validated) configuration
   * @return canonical key
   */
  public static CacheKey of(HasherType type, HasherConfig config) {
    return new CacheKey(type, sha256(canonicalForm(config)));
  }

  /** Canonical serialization of a configuration, independent of field order. */
  static String canonicalForm(HasherConfig config) {
    Map<String, Object> sorted = new TreeMap<>(config.toMap());
    StringBuilder sb = new StringBuilder();
    sorted.forEach(
        (name, value) -> {
          String text = String.valueOf(value);
          sb.append(name).append('=').append(text.length()).append(':').append(text).append(';');
        });
    return sb.toString();
  }

  private static String sha256(String text) {
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      return HexFormat.of().formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
    } catch (NoSuchAlgorithmException e) {
      // Every Java platform is required to support SHA-256
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }

  /** String form {@code type:digest}. */
  public String value() {
    return type.typeName() + ":" + digest;
  }

  @Override
  public String toString() {
    return type.typeName() + ":" + ConfigFingerprint.of(digest);
  }
}
