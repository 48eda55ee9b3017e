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

package com.axonops.hashid.factory;

import com.axonops.hashid.api.ConfigurationValidationException;
import com.axonops.hashid.api.HasherConfig;
import com.axonops.hashid.metrics.HashIdMetricsRegistry;
import com.axonops.hashid.metrics.NoOpMetricsRegistry;
import java.util.Objects;

/**
 * Configuration for a {@link HasherFactory}: default codec parameters, cache bound and metrics.
 *
 * <p>Immutable; validated in the compact constructor. The default salt, length and alphabet are
 * used for any field that neither the per-call overrides nor the {@link
 * com.axonops.hashid.api.HasherType} supply.
 *
 * <h2>Configuration Examples</h2>
 *
 * <pre>{@code
 * // Defaults: empty salt, length 10, alphanumeric alphabet, 10 cached hashers
 * HasherFactory factory = new HasherFactory(HasherFactoryConfig.DEFAULT);
 *
 * // Application salt, larger cache, Dropwizard metrics
 * HasherFactoryConfig config = HasherFactoryConfig.builder()
 *     .salt(System.getenv("HASHID_SALT"))
 *     .minLength(12)
 *     .maxCacheSize(100)
 *     .metricsRegistry(new DropwizardMetricsAdapter(registry, "myapp.hashid"))
 *     .build();
 * }</pre>
 *
 * @param defaults default codec parameters (validated by {@link HasherConfig})
 * @param maxCacheSize maximum hasher instances kept in the cache (must be &gt; 0)
 * @param metricsRegistry metrics implementation (use {@link NoOpMetricsRegistry} for none)
 * @since 1.0.0
 * @see HasherFactory
 */
public record HasherFactoryConfig(
    HasherConfig defaults, int maxCacheSize, HashIdMetricsRegistry metricsRegistry) {

  /** Default maximum number of cached hasher instances. */
  public static final int DEFAULT_MAX_CACHE_SIZE = 10;

  /** Default configuration: {@link HasherConfig#DEFAULT}, 10 cached hashers, metrics disabled. */
  public static final HasherFactoryConfig DEFAULT =
      new HasherFactoryConfig(
          HasherConfig.DEFAULT, DEFAULT_MAX_CACHE_SIZE, NoOpMetricsRegistry.INSTANCE);

  public HasherFactoryConfig {
    Objects.requireNonNull(defaults, "defaults cannot be null");
    Objects.requireNonNull(metricsRegistry, "metricsRegistry cannot be null");
    if (maxCacheSize <= 0) {
      throw new ConfigurationValidationException(
          "maxCacheSize", "must be positive, got " + maxCacheSize);
    }
  }

  /**
   * Creates a builder starting from {@link #DEFAULT}.
   *
   * @return new builder with default values
   */
  public static Builder builder() {
    return new Builder();
  }

  /** Builder for custom factory configuration. */
  public static class Builder {
    private String salt = HasherConfig.DEFAULT_SALT;
    private int minLength = HasherConfig.DEFAULT_MIN_LENGTH;
    private String alphabet = HasherConfig.DEFAULT_ALPHABET;
    private int maxCacheSize = DEFAULT_MAX_CACHE_SIZE;
    private HashIdMetricsRegistry metricsRegistry = NoOpMetricsRegistry.INSTANCE;

    /**
     * Default salt. {@code null} is treated as empty.
     *
     * @param salt default salt
     * @return this builder
     */
    public Builder salt(String salt) {
      this.salt = salt;
      return this;
    }

    /**
     * Default minimum hash length.
     *
     * <p><b>Default: 10</b>
     *
     * @param minLength minimum length (0 to 255)
     * @return this builder
     */
    public Builder minLength(int minLength) {
      this.minLength = minLength;
      return this;
    }

    /**
     * Default alphabet; needs at least 16 unique characters.
     *
     * @param alphabet default alphabet
     * @return this builder
     */
    public Builder alphabet(String alphabet) {
      this.alphabet = alphabet;
      return this;
    }

    /**
     * Maximum number of cached hasher instances before LRU eviction.
     *
     * <p><b>Default: 10</b>
     *
     * @param size maximum cached hashers (must be &gt; 0)
     * @return this builder
     */
    public Builder maxCacheSize(int size) {
      this.maxCacheSize = size;
      return this;
    }

    /**
     * Set metrics registry for instrumentation.
     *
     * @param metricsRegistry metrics implementation (must not be null)
     * @return this builder
     * @throws NullPointerException if metricsRegistry is null
     */
    public Builder metricsRegistry(HashIdMetricsRegistry metricsRegistry) {
      this.metricsRegistry =
          Objects.requireNonNull(metricsRegistry, "metricsRegistry cannot be null");
      return this;
    }

    /**
     * Build immutable configuration.
     *
     * @return validated configuration
     * @throws ConfigurationValidationException if any value is invalid
     */
    public HasherFactoryConfig build() {
      return new HasherFactoryConfig(
          new HasherConfig(salt, minLength, alphabet), maxCacheSize, metricsRegistry);
    }
  }
}
