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

package com.axonops.hashid.api;

import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Closed set of hasher strategies.
 *
 * <p>Type names coming from callers are resolved with {@link #fromName(String)}, an exact match
 * against this enum. There is no reflective or string-built class lookup; anything not listed here
 * is rejected with {@link UnknownHasherTypeException}.
 *
 * <p>Each type carries its own partial defaults. A field a type leaves unset falls back to the
 * factory defaults.
 *
 * @since 1.0.0
 */
public enum HasherType {

  /** Plain codec with the factory defaults. */
  DEFAULT("default", null, null),

  /** Longer hashes over a richer alphabet, timestamp mixed in, random salt when none is given. */
  SECURE("secure", 20, HasherConfig.SECURE_ALPHABET),

  /** Plain codec with its own minimum length; intended for caller-supplied overrides. */
  CUSTOM("custom", 15, null);

  private static final List<String> NAMES =
      List.of(DEFAULT.typeName, SECURE.typeName, CUSTOM.typeName);

  private final String typeName;
  private final Integer defaultMinLength;
  private final String defaultAlphabet;

  HasherType(String typeName, Integer defaultMinLength, String defaultAlphabet) {
    this.typeName = typeName;
    this.defaultMinLength = defaultMinLength;
    this.defaultAlphabet = defaultAlphabet;
  }

  /** Lower-case name used in configuration and by {@link #fromName(String)}. */
  public String typeName() {
    return typeName;
  }

  public OptionalInt defaultMinLength() {
    return defaultMinLength == null ? OptionalInt.empty() : OptionalInt.of(defaultMinLength);
  }

  public Optional<String> defaultAlphabet() {
    return Optional.ofNullable(defaultAlphabet);
  }

  /**
   * Resolves a caller-supplied type name.
   *
   * @param name type name, matched exactly (case-sensitive)
   * @return the matching type
   * @throws UnknownHasherTypeException for any other input, including {@code null}
   */
  public static HasherType fromName(String name) {
    if (name != null) {
      for (HasherType type : values()) {
        if (type.typeName.equals(name)) {
          return type;
        }
      }
    }
    throw new UnknownHasherTypeException();
  }

  /** Names of all types, in declaration order. */
  public static List<String> names() {
    return NAMES;
  }

  @Override
  public String toString() {
    return typeName;
  }
}
