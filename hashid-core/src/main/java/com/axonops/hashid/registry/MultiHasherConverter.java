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

package com.axonops.hashid.registry;

import com.axonops.hashid.api.Converter;
import java.util.Objects;

/**
 * Converter that delegates to a named hasher of a {@link HasherRegistry}.
 *
 * <p>The named converter is looked up on every call, so re-registering the name takes effect
 * immediately. Instances are immutable; {@link #withHasher(String)} returns a copy.
 *
 * @since 1.0.0
 */
public final class MultiHasherConverter implements Converter {

  private final HasherRegistry registry;
  private final String hasherName;

  /** Creates a converter bound to the {@code default} hasher. */
  public MultiHasherConverter(HasherRegistry registry) {
    this(registry, HasherRegistry.DEFAULT_HASHER);
  }

  private MultiHasherConverter(HasherRegistry registry, String hasherName) {
    this.registry = Objects.requireNonNull(registry, "registry cannot be null");
    this.hasherName = hasherName;
  }

  /**
   * Returns a converter using another named hasher.
   *
   * @param name hasher name; resolved lazily, so an unknown name fails on first use
   * @return new converter
   */
  public MultiHasherConverter withHasher(String name) {
    return new MultiHasherConverter(registry, name);
  }

  public String getCurrentHasher() {
    return hasherName;
  }

  @Override
  public String encode(Object value) {
    return registry.getConverter(hasherName).encode(value);
  }

  @Override
  public Object decode(String hash) {
    return registry.getConverter(hasherName).decode(hash);
  }
}
