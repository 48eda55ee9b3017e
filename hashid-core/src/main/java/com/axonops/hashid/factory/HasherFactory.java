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

import com.axonops.hashid.api.ConfigOverrides;
import com.axonops.hashid.api.ConfigurationValidationException;
import com.axonops.hashid.api.Converter;
import com.axonops.hashid.api.Hasher;
import com.axonops.hashid.api.HasherConfig;
import com.axonops.hashid.api.HasherType;
import com.axonops.hashid.api.UnknownHasherTypeException;
import com.axonops.hashid.cache.CacheKey;
import com.axonops.hashid.cache.CacheStatistics;
import com.axonops.hashid.cache.HasherInstanceCache;
import com.axonops.hashid.codec.Codec;
import com.axonops.hashid.codec.HashidsCodec;
import com.axonops.hashid.hasher.CustomHasher;
import com.axonops.hashid.hasher.DefaultHasher;
import com.axonops.hashid.hasher.HashidsConverter;
import com.axonops.hashid.hasher.SecureHasher;
import com.axonops.hashid.metrics.HashIdMetricsRegistry;
import com.axonops.hashid.metrics.MetricNames;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates, validates and caches hashers.
 *
 * <p>Every request goes through the same pipeline:
 *
 * <ol>
 *   <li>resolve the type name against the closed {@link HasherType} set
 *   <li>merge the configuration: per-call overrides, then type defaults, then factory defaults
 *   <li>validate the merged configuration (a bad override fails even with valid defaults)
 *   <li>for {@link HasherType#SECURE} with an empty salt, generate a fresh random salt
 *   <li>compute the canonical {@link CacheKey} and get or build the instance in the LRU cache
 * </ol>
 *
 * <p>Thread-safe. A factory may be shared as a singleton; the instance cache guarantees one
 * instance per distinct key under concurrent first access.
 *
 * <pre>{@code
 * HasherFactory factory = new HasherFactory("app-salt", 10, HasherConfig.DEFAULT_ALPHABET, 50);
 * Hasher hasher = factory.create("default", Map.of("min_length", 12));
 * String hash = hasher.encode(123);
 * Object id = hasher.decode(hash); // 123L
 * }</pre>
 *
 * @since 1.0.0
 */
public final class HasherFactory {
  private static final Logger logger = LoggerFactory.getLogger(HasherFactory.class);

  private final HasherFactoryConfig config;
  private final HasherInstanceCache cache;
  private final SecureSaltGenerator saltGenerator;
  private final HashIdMetricsRegistry metrics;

  /** Creates a factory with {@link HasherFactoryConfig#DEFAULT}. */
  public HasherFactory() {
    this(HasherFactoryConfig.DEFAULT);
  }

  /**
   * Creates a factory with the given defaults and the default cache size.
   *
   * @param salt default salt, may be null
   * @param minLength default minimum length
   * @param alphabet default alphabet
   * @throws ConfigurationValidationException if any default is invalid
   */
  public HasherFactory(String salt, int minLength, String alphabet) {
    this(salt, minLength, alphabet, HasherFactoryConfig.DEFAULT_MAX_CACHE_SIZE);
  }

  /**
   * Creates a factory with the given defaults.
   *
   * @param salt default salt, may be null
   * @param minLength default minimum length (&ge; 0)
   * @param alphabet default alphabet (&ge; 16 unique characters)
   * @param maxCacheSize maximum cached instances (&gt; 0)
   * @throws ConfigurationValidationException if any argument is invalid
   */
  public HasherFactory(String salt, int minLength, String alphabet, int maxCacheSize) {
    this(
        HasherFactoryConfig.builder()
            .salt(salt)
            .minLength(minLength)
            .alphabet(alphabet)
            .maxCacheSize(maxCacheSize)
            .build());
  }

  /** Creates a factory with its own instance cache sized by {@code config.maxCacheSize()}. */
  public HasherFactory(HasherFactoryConfig config) {
    this(config, new HasherInstanceCache(config.maxCacheSize(), config.metricsRegistry()));
  }

  /**
   * Creates a factory around an existing cache.
   *
   * <p>The cache's own bound applies; {@code config.maxCacheSize()} is ignored. Sharing one cache
   * between factories with different defaults is safe because defaults are part of every key.
   *
   * @param config factory configuration
   * @param cache instance cache to use
   */
  public HasherFactory(HasherFactoryConfig config, HasherInstanceCache cache) {
    this(config, cache, new SecureSaltGenerator());
  }

  HasherFactory(
      HasherFactoryConfig config, HasherInstanceCache cache, SecureSaltGenerator saltGenerator) {
    this.config = Objects.requireNonNull(config, "config cannot be null");
    this.cache = Objects.requireNonNull(cache, "cache cannot be null");
    this.saltGenerator = Objects.requireNonNull(saltGenerator, "saltGenerator cannot be null");
    this.metrics = config.metricsRegistry();

    logger.debug(
        "HashId: Hasher factory initialized - minLength: {}, alphabetSize: {}, maxCacheSize: {}",
        config.defaults().minLength(),
        HasherConfig.uniqueCharCount(config.defaults().alphabet()),
        cache.maxSize());
  }

  /**
   * Returns a hasher for a type and configuration, from the cache when possible.
   *
   * @param type type name: {@code default}, {@code secure} or {@code custom}
   * @param overrides configuration overrides, may be null or empty
   * @return cached or new hasher; equal configurations return the same instance
   * @throws UnknownHasherTypeException if the type is not in the closed set
   * @throws ConfigurationValidationException if the merged configuration is invalid
   */
  public Hasher create(String type, Map<String, ?> overrides) {
    return create(resolveType(type), overrides);
  }

  /** Same as {@code create(type, Map.of())}. */
  public Hasher create(String type) {
    return create(type, null);
  }

  /**
   * Returns a hasher for a type and configuration, from the cache when possible.
   *
   * @param type hasher type
   * @param overrides configuration overrides, may be null or empty
   * @return cached or new hasher
   * @throws ConfigurationValidationException if the merged configuration is invalid
   */
  public Hasher create(HasherType type, Map<String, ?> overrides) {
    Objects.requireNonNull(type, "type cannot be null");
    HasherConfig effective = effectiveConfig(type, overrides);
    CacheKey key = CacheKey.of(type, effective);
    return cache.getOrCreate(key, () -> instantiate(type, effective));
  }

  /**
   * Builds a fresh converter, bypassing the instance cache and its statistics.
   *
   * <p>Validation and merging are the same as for {@link #create(String, Map)}, including salt
   * generation for {@code secure}. The result is a plain codec converter; no timestamp is mixed in.
   *
   * @param type type name
   * @param overrides configuration overrides, may be null or empty
   * @return new converter
   * @throws UnknownHasherTypeException if the type is not in the closed set
   * @throws ConfigurationValidationException if the merged configuration is invalid
   */
  public Converter createConverter(String type, Map<String, ?> overrides) {
    return createConverter(resolveType(type), overrides);
  }

  /** Same as {@link #createConverter(String, Map)} for an already resolved type. */
  public Converter createConverter(HasherType type, Map<String, ?> overrides) {
    Objects.requireNonNull(type, "type cannot be null");
    HasherConfig effective = effectiveConfig(type, overrides);
    Converter converter = new HashidsConverter(HashidsCodec.of(effective));
    metrics.incrementCounter(MetricNames.CONVERTERS_CREATED);
    return converter;
  }

  /**
   * Validates a configuration and warms the cache with it, exactly as {@link #create(String, Map)}
   * would.
   *
   * @param type type name
   * @param overrides configuration overrides, may be null or empty
   * @return key under which the hasher is cached
   * @throws UnknownHasherTypeException if the type is not in the closed set
   * @throws ConfigurationValidationException if the merged configuration is invalid
   */
  public CacheKey preloadConfiguration(String type, Map<String, ?> overrides) {
    HasherType resolved = resolveType(type);
    HasherConfig effective = effectiveConfig(resolved, overrides);
    CacheKey key = CacheKey.of(resolved, effective);
    cache.getOrCreate(key, () -> instantiate(resolved, effective));
    logger.debug("HashId: Preloaded hasher configuration - key: {}", key);
    return key;
  }

  /** Supported type names: {@code default}, {@code secure}, {@code custom}. */
  public List<String> getAvailableTypes() {
    return HasherType.names();
  }

  /** Snapshot of the instance cache counters. */
  public CacheStatistics getCacheStatistics() {
    return cache.getStatistics();
  }

  /** Empties the instance cache. Statistics are kept. */
  public void clearInstanceCache() {
    cache.clear();
  }

  /** Zeroes the cache statistics. Cached instances are kept. */
  public void resetCacheStatistics() {
    cache.resetStatistics();
  }

  /** Factory-level defaults used for fields nobody else supplies. */
  public HasherConfig getDefaults() {
    return config.defaults();
  }

  public HasherFactoryConfig getConfig() {
    return config;
  }

  private HasherType resolveType(String name) {
    try {
      return HasherType.fromName(name);
    } catch (UnknownHasherTypeException e) {
      metrics.incrementCounter(MetricNames.ERRORS_UNKNOWN_TYPE);
      logger.debug("HashId: Rejected unknown hasher type");
      throw e;
    }
  }

  private HasherConfig effectiveConfig(HasherType type, Map<String, ?> overrides) {
    HasherConfig merged;
    try {
      merged = merge(type, ConfigOverrides.fromMap(overrides));
    } catch (ConfigurationValidationException e) {
      metrics.incrementCounter(MetricNames.ERRORS_VALIDATION);
      logger.debug("HashId: Rejected {} configuration - field: {}", type, e.getField());
      throw e;
    }

    if (type == HasherType.SECURE && merged.hasEmptySalt()) {
      metrics.incrementCounter(MetricNames.SALTS_GENERATED);
      logger.debug("HashId: Generated random salt for secure hasher");
      return merged.withSalt(saltGenerator.generate());
    }
    return merged;
  }

  private HasherConfig merge(HasherType type, ConfigOverrides overrides) {
    HasherConfig defaults = config.defaults();

    String salt = overrides.salt() != null ? overrides.salt() : defaults.salt();
    int minLength =
        overrides.minLength() != null
            ? overrides.minLength()
            : type.defaultMinLength().orElse(defaults.minLength());
    String alphabet =
        overrides.alphabet() != null
            ? overrides.alphabet()
            : type.defaultAlphabet().orElse(defaults.alphabet());

    return new HasherConfig(salt, minLength, alphabet);
  }

  private Hasher instantiate(HasherType type, HasherConfig effective) {
    long start = System.nanoTime();
    Codec codec = HashidsCodec.of(effective);
    Hasher hasher =
        switch (type) {
          case DEFAULT -> new DefaultHasher(codec);
          case SECURE -> new SecureHasher(codec);
          case CUSTOM -> new CustomHasher(codec);
        };
    metrics.recordTimer(MetricNames.HASHERS_CREATION_LATENCY, System.nanoTime() - start);
    metrics.incrementCounter(MetricNames.HASHERS_CREATED);
    return hasher;
  }
}
