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

/**
 * Encodes identifiers to hashes and back.
 *
 * <p>Neither operation throws for out-of-domain input. Values that are not encodable numbers are
 * returned from {@link #encode(Object)} as their string form, and hashes that do not decode are
 * returned from {@link #decode(String)} unchanged. Valid and forged hashes therefore produce the
 * same kind of outcome.
 *
 * <p>Implementations are immutable and thread-safe.
 *
 * @since 1.0.0
 */
public interface Converter {

  /**
   * Encodes a value.
   *
   * @param value number to encode; anything else is passed through
   * @return the hash, or {@code String.valueOf(value)} ({@code ""} for null) for non-numeric input
   */
  String encode(Object value);

  /**
   * Decodes a hash.
   *
   * @param hash hash to decode
   * @return the decoded {@link Long}, or {@code hash} itself if it cannot be decoded
   */
  Object decode(String hash);
}
