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

package com.axonops.hashid.codec;

/**
 * Adapter interface for the reversible integer/string transform.
 *
 * <p>Implementations are pure, deterministic and thread-safe. The production implementation is
 * {@link HashidsCodec}; tests can supply their own.
 *
 * @since 1.0.0
 */
public interface Codec {

  /**
   * Encodes a sequence of non-negative numbers into one hash.
   *
   * @param numbers values to encode
   * @return hash, or an empty string if the values cannot be encoded
   */
  String encode(long... numbers);

  /**
   * Decodes a hash back into the numbers it was built from.
   *
   * @param hash hash to decode
   * @return decoded numbers, empty if the hash is not valid for this codec
   */
  long[] decode(String hash);
}
