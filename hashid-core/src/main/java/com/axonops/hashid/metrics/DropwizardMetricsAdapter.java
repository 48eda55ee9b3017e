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

import com.codahale.metrics.Gauge;
import com.codahale.metrics.MetricRegistry;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Dropwizard Metrics adapter for hashid-java.
 *
 * <p>Wraps a Dropwizard {@link MetricRegistry} and delegates all metric operations to it.
 *
 * <pre>{@code
 * MetricRegistry registry = new MetricRegistry();
 * HashIdMetricsRegistry metrics = new DropwizardMetricsAdapter(registry, "com.myapp.hashid");
 * HasherFactory factory = new HasherFactory(
 *     HasherFactoryConfig.builder().metricsRegistry(metrics).build());
 * }</pre>
 *
 * @since 1.0.0
 */
public final class DropwizardMetricsAdapter implements HashIdMetricsRegistry {

  /** Prefix used when none is given. */
  public static final String DEFAULT_PREFIX = "com.axonops.hashid";

  private final MetricRegistry registry;
  private final String prefix;

  /**
   * Creates adapter with default metric prefix {@value #DEFAULT_PREFIX}.
   *
   * @param registry the Dropwizard MetricRegistry to register metrics with
   * @throws NullPointerException if registry is null
   */
  public DropwizardMetricsAdapter(MetricRegistry registry) {
    this(registry, DEFAULT_PREFIX);
  }

  /**
   * Creates adapter with custom metric prefix.
   *
   * <p>With prefix {@code "com.myapp.hashid"} the cache hit counter appears as {@code
   * com.myapp.hashid.hashers.cache.hits.total.count}.
   *
   * @param registry the Dropwizard MetricRegistry to register metrics with
   * @param prefix the metric name prefix
   * @throws NullPointerException if registry or prefix is null
   */
  public DropwizardMetricsAdapter(MetricRegistry registry, String prefix) {
    this.registry = Objects.requireNonNull(registry, "registry cannot be null");
    this.prefix = Objects.requireNonNull(prefix, "prefix cannot be null");
  }

  @Override
  public void incrementCounter(String name) {
    registry.counter(metricName(name)).inc();
  }

  @Override
  public void recordTimer(String name, long durationNanos) {
    registry.timer(metricName(name)).update(durationNanos, TimeUnit.NANOSECONDS);
  }

  @Override
  public void registerGauge(String name, Supplier<Number> valueSupplier) {
    String fullName = metricName(name);

    // Idempotent registration: a second factory on the same registry takes over the gauge
    registry.remove(fullName);
    registry.register(fullName, (Gauge<Number>) valueSupplier::get);
  }

  @Override
  public void removeGauge(String name) {
    registry.remove(metricName(name));
  }

  private String metricName(String name) {
    return MetricRegistry.name(prefix, name);
  }
}
