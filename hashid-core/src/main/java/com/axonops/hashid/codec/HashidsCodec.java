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

import com.axonops.hashid.api.ConfigurationValidationException;
import com.axonops.hashid.api.HasherConfig;
import org.hashids.Hashids;

/**
 * {@link Codec} backed by the Hashids library.
 *
 * @since 1.0.0
 */
public final class HashidsCodec implements Codec {

  /** Largest value the Hashids transform accepts (2^53). */
  public static final long MAX_VALUE = 9_007_199_254_740_992L;

  private final Hashids hashids;

  private HashidsCodec(Hashids hashids) {
    this.hashids = hashids;
  }

  /**
   * Creates a codec for a validated configuration.
   *
   * @param config codec parameters
   * @return new codec
   * @throws ConfigurationValidationException if the Hashids library rejects the parameters
   */
  public static HashidsCodec of(HasherConfig config) {
    try {
      return new HashidsCodec(new Hashids(config.salt(), config.minLength(), config.alphabet()));
    } catch (IllegalArgumentException e) {
      throw new ConfigurationValidationException(HasherConfig.KEY_ALPHABET, e.getMessage(), e);
    }
  }

  @Override
  public String encode(long... numbers) {
    return hashids.encode(numbers);
  }

  @Override
  public long[] decode(String hash) {
    return hashids.decode(hash);
  }
}
