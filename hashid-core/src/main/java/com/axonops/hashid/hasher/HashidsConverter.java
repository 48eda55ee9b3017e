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

package com.axonops.hashid.hasher;

import com.axonops.hashid.api.Converter;
import com.axonops.hashid.codec.Codec;
import com.axonops.hashid.util.NumericValues;
import java.util.Objects;
import java.util.OptionalLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link Converter} over a single {@link Codec}.
 *
 * <p>Used as-is for converters built by {@code HasherFactory.createConverter} and the registry;
 * the hasher strategies extend it.
 *
 * @since 1.0.0
 */
public class HashidsConverter implements Converter {
  private static final Logger logger = LoggerFactory.getLogger(HashidsConverter.class);

  private final Codec codec;

  public HashidsConverter(Codec codec) {
    this.codec = Objects.requireNonNull(codec, "codec cannot be null");
  }

  @Override
  public final String encode(Object value) {
    OptionalLong number = NumericValues.toEncodable(value);
    if (number.isEmpty()) {
      return value == null ? "" : String.valueOf(value);
    }
    return encodeNumber(number.getAsLong());
  }

  @Override
  public final Object decode(String hash) {
    if (hash == null || hash.isEmpty()) {
      return hash;
    }
    long[] decoded;
    try {
      decoded = codec.decode(hash);
    } catch (RuntimeException e) {
      // Same outcome as any other undecodable input
      logger.trace("HashId: Codec rejected hash, passing through ({})", e.getClass().getSimpleName());
      return hash;
    }
    return decoded.length > 0 ? Long.valueOf(decoded[0]) : hash;
  }

  /** Encodes one validated, in-range number. */
  protected String encodeNumber(long number) {
    return codec.encode(number);
  }

  protected final Codec codec() {
    return codec;
  }
}
