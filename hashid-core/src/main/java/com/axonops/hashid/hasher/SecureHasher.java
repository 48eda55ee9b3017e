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

import com.axonops.hashid.api.Hasher;
import com.axonops.hashid.api.HasherType;
import com.axonops.hashid.codec.Codec;
import java.time.Clock;
import java.util.Objects;

/**
 * Strategy that mixes the current time into every hash.
 *
 * <p>{@code encode(v)} encodes the pair {@code (v, epochSeconds)}, so the same value yields
 * different hashes over time. {@code decode} returns only the first component and discards the
 * timestamp.
 *
 * @since 1.0.0
 */
public final class SecureHasher extends HashidsConverter implements Hasher {

  private final Clock clock;

  public SecureHasher(Codec codec) {
    this(codec, Clock.systemUTC());
  }

  public SecureHasher(Codec codec, Clock clock) {
    super(codec);
    this.clock = Objects.requireNonNull(clock, "clock cannot be null");
  }

  @Override
  protected String encodeNumber(long number) {
    return codec().encode(number, clock.instant().getEpochSecond());
  }

  @Override
  public HasherType type() {
    return HasherType.SECURE;
  }
}
