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

package com.axonops.hashid.metrics;

/**
 * Metric name constants for hasher factory and registry instrumentation.
 *
 * <h2>Metric Types</h2>
 *
 * <ul>
 *   <li><b>Counter</b> - Monotonically increasing count (suffix: {@code .total.count})
 *   <li><b>Timer</b> - Latency histogram with percentiles (suffix: {@code .latency})
 *   <li><b>Gauge</b> - Current value (suffix: {@code .current.count})
 * </ul>
 *
 * <h2>Monitoring Recommendations</h2>
 *
 * <ul>
 *   <li><b>Cache Hit Rate:</b> HASHERS_CACHE_HITS / (HASHERS_CACHE_HITS + HASHERS_CACHE_MISSES).
 *       Secure hashers created without a salt always miss, since each gets a fresh salt.
 *   <li><b>Evictions:</b> a steadily rising CACHE_EVICTIONS_LRU means the working set of
 *       configurations is larger than {@code maxCacheSize}
 *   <li><b>Errors:</b> ERRORS_UNKNOWN_TYPE should be zero unless type names come from untrusted
 *       input
 * </ul>
 *
 * @since 1.0.0
 * @see com.axonops.hashid.factory.HasherFactory
 * @see com.axonops.hashid.registry.HasherRegistry
 */
public final class MetricNames {
  private MetricNames() {}

  // ========================================
  // Factory / instance cache
  // ========================================

  /** Counter: {@code create} calls answered from the instance cache. */
  public static final String HASHERS_CACHE_HITS = "hashers.cache.hits.total.count";

  /** Counter: {@code create} calls that had to build a new hasher. */
  public static final String HASHERS_CACHE_MISSES = "hashers.cache.misses.total.count";

  /** Counter: hasher instances constructed (cache misses). */
  public static final String HASHERS_CREATED = "hashers.created.total.count";

  /** Timer: time to construct one hasher and its codec. */
  public static final String HASHERS_CREATION_LATENCY = "hashers.creation.latency";

  /** Counter: entries evicted because the cache was full. */
  public static final String CACHE_EVICTIONS_LRU = "cache.evictions.lru.total.count";

  /** Gauge: hashers currently held by the instance cache. */
  public static final String CACHE_INSTANCES_COUNT = "cache.instances.current.count";

  /** Counter: uncached converters built by {@code createConverter}. */
  public static final String CONVERTERS_CREATED = "converters.created.total.count";

  /** Counter: random salts generated for secure hashers. */
  public static final String SALTS_GENERATED = "salts.generated.total.count";

  // ========================================
  // Registry
  // ========================================

  /** Counter: named converters built on first use (or after re-registration). */
  public static final String REGISTRY_MATERIALIZED = "registry.converters.materialized.total.count";

  /** Gauge: named hashers currently registered. */
  public static final String REGISTRY_HASHERS_COUNT = "registry.hashers.current.count";

  // ========================================
  // Errors
  // ========================================

  /** Counter: configurations rejected by validation. */
  public static final String ERRORS_VALIDATION = "errors.validation.total.count";

  /** Counter: requests for a type outside the closed set. */
  public static final String ERRORS_UNKNOWN_TYPE = "errors.unknown_type.total.count";

  /** Counter: registry lookups for names that were never registered. */
  public static final String ERRORS_HASHER_NOT_FOUND = "errors.hasher_not_found.total.count";
}
