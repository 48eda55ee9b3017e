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

package com.axonops.hashid.cache;

import com.axonops.hashid.api.ConfigurationValidationException;
import com.axonops.hashid.api.Hasher;
import com.axonops.hashid.metrics.HashIdMetricsRegistry;
import com.axonops.hashid.metrics.MetricNames;
import com.axonops.hashid.metrics.NoOpMetricsRegistry;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bounded LRU cache of hasher instances.
 *
 * <p>Entries live in an access-ordered map guarded by this object's monitor. A lookup touches the
 * entry; inserting into a full cache first evicts the least recently used entry, so the size never
 * exceeds {@code maxSize}. Hasher construction runs inside the monitor: concurrent first requests
 * for the same key build exactly one instance and every caller gets that instance.
 *
 * <p>Counters are atomic and can be read or reset without taking the monitor. Clearing entries and
 * resetting counters are independent operations.
 *
 * @since 1.0.0
 */
public final class HasherInstanceCache {
  private static final Logger logger = LoggerFactory.getLogger(HasherInstanceCache.class);

  private final int maxSize;
  private final HashIdMetricsRegistry metrics;

  // Guarded by this
  private final LinkedHashMap<CacheKey, Hasher> entries;

  private final AtomicLong hits = new AtomicLong(0);
  private final AtomicLong misses = new AtomicLong(0);
  private final AtomicLong evictions = new AtomicLong(0);

  public HasherInstanceCache(int maxSize) {
    this(maxSize, NoOpMetricsRegistry.INSTANCE);
  }

  /**
   * Creates an empty cache.
   *
   * @param maxSize maximum number of instances (must be &gt; 0)
   * @param metrics metrics sink
   * @throws ConfigurationValidationException if maxSize is not positive
   */
  public HasherInstanceCache(int maxSize, HashIdMetricsRegistry metrics) {
    if (maxSize <= 0) {
      throw new ConfigurationValidationException(
          "maxCacheSize", "must be positive, got " + maxSize);
    }
    this.maxSize = maxSize;
    this.metrics = Objects.requireNonNull(metrics, "metrics cannot be null");
    this.entries = new LinkedHashMap<>(16, 0.75f, true);

    metrics.registerGauge(MetricNames.CACHE_INSTANCES_COUNT, this::size);
    logger.debug("HashId: Instance cache initialized - maxSize: {}", maxSize);
  }

  /**
   * Returns the cached hasher for a key, building and inserting it on a miss.
   *
   * @param key canonical key
   * @param factory builds the hasher on a miss; called at most once per call
   * @return cached or newly built hasher
   */
  public synchronized Hasher getOrCreate(CacheKey key, Supplier<? extends Hasher> factory) {
    Hasher cached = entries.get(key);
    if (cached != null) {
      hits.incrementAndGet();
      metrics.incrementCounter(MetricNames.HASHERS_CACHE_HITS);
      logger.trace("HashId: Cache hit - key: {}", key);
      return cached;
    }

    misses.incrementAndGet();
    metrics.incrementCounter(MetricNames.HASHERS_CACHE_MISSES);
    logger.trace("HashId: Cache miss - key: {}, creating", key);

    Hasher created = Objects.requireNonNull(factory.get(), "factory returned null");

    if (entries.size() >= maxSize) {
      evictEldest();
    }
    entries.put(key, created);
    return created;
  }

  private void evictEldest() {
    Iterator<Map.Entry<CacheKey, Hasher>> it = entries.entrySet().iterator();
    if (it.hasNext()) {
      CacheKey eldest = it.next().getKey();
      it.remove();
      evictions.incrementAndGet();
      metrics.incrementCounter(MetricNames.CACHE_EVICTIONS_LRU);
      logger.trace("HashId: LRU evicting hasher - key: {}", eldest);
    }
  }

  /** True if the key is cached. Does not count as an access. */
  public synchronized boolean contains(CacheKey key) {
    return entries.containsKey(key);
  }

  public synchronized int size() {
    return entries.size();
  }

  public int maxSize() {
    return maxSize;
  }

  /** Cached keys from least to most recently used. */
  public synchronized List<CacheKey> keys() {
    return new ArrayList<>(entries.keySet());
  }

  /** Removes all entries. Statistics are kept. */
  public synchronized void clear() {
    int size = entries.size();
    entries.clear();
    logger.debug("HashId: Instance cache cleared - {} hashers removed", size);
  }

  /** Zeroes hit, miss and eviction counters. Entries are kept. */
  public void resetStatistics() {
    hits.set(0);
    misses.set(0);
    evictions.set(0);
    logger.trace("HashId: Cache statistics reset");
  }

  /** Gets cache statistics snapshot. */
  public CacheStatistics getStatistics() {
    return new CacheStatistics(hits.get(), misses.get(), evictions.get(), size(), maxSize);
  }
}
