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

import java.util.function.Supplier;

/**
 * Abstract metrics registry interface for hashid-java.
 *
 * <p>Allows the library to work with or without a Dropwizard Metrics registry. Implementations can
 * use Dropwizard Metrics, custom metrics systems, or no-op.
 *
 * <p><strong>Thread Safety:</strong> All implementations must be thread-safe.
 *
 * @since 1.0.0
 */
public interface HashIdMetricsRegistry {

  /**
   * Increment a counter by 1.
   *
   * @param name metric name (see {@link MetricNames})
   */
  void incrementCounter(String name);

  /**
   * Record a timer measurement in nanoseconds.
   *
   * @param name metric name (e.g. {@link MetricNames#HASHERS_CREATION_LATENCY})
   * @param durationNanos duration in nanoseconds
   */
  void recordTimer(String name, long durationNanos);

  /**
   * Register a gauge that computes its value on demand.
   *
   * <p>If a gauge with this name already exists, it is replaced.
   *
   * @param name metric name
   * @param valueSupplier function that returns the current value; must be fast and non-blocking
   */
  void registerGauge(String name, Supplier<Number> valueSupplier);

  /**
   * Remove a previously registered gauge. No-op if absent.
   *
   * @param name metric name to remove
   */
  void removeGauge(String name);
}
