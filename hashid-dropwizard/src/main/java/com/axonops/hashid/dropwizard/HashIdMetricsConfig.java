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

package com.axonops.hashid.dropwizard;

import com.axonops.hashid.factory.HasherFactoryConfig;
import com.axonops.hashid.metrics.DropwizardMetricsAdapter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.jmx.JmxReporter;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Convenience factory for {@link HasherFactoryConfig} with Dropwizard Metrics integration.
 *
 * <p>Sets up JMX exposure for the given registry on first use unless told not to.
 *
 * <pre>{@code
 * MetricRegistry registry = new MetricRegistry();
 * HasherFactory factory = new HasherFactory(
 *     HashIdMetricsConfig.withMetrics(registry, "com.myapp.hashid"));
 * HasherRegistry hashers = new HasherRegistry(factory);
 * }</pre>
 *
 * @since 1.0.0
 */
public final class HashIdMetricsConfig {
  private static final Logger logger = LoggerFactory.getLogger(HashIdMetricsConfig.class);
  private static volatile JmxReporter jmxReporter;

  private HashIdMetricsConfig() {
    // Utility class
  }

  /**
   * Creates a factory configuration with Dropwizard metrics and automatic JMX.
   *
   * @param registry the Dropwizard MetricRegistry to use
   * @param metricPrefix the metric namespace prefix
   * @return factory configuration with default codec settings and metrics enabled
   */
  public static HasherFactoryConfig withMetrics(MetricRegistry registry, String metricPrefix) {
    return withMetrics(registry, metricPrefix, true);
  }

  /**
   * Creates a factory configuration with Dropwizard metrics using the default prefix {@value
   * DropwizardMetricsAdapter#DEFAULT_PREFIX}.
   *
   * @param registry the Dropwizard MetricRegistry to use
   * @return factory configuration with metrics enabled
   */
  public static HasherFactoryConfig withMetrics(MetricRegistry registry) {
    return withMetrics(registry, DropwizardMetricsAdapter.DEFAULT_PREFIX, true);
  }

  /**
   * Creates a factory configuration with Dropwizard metrics.
   *
   * @param registry the Dropwizard MetricRegistry to use
   * @param metricPrefix the metric namespace prefix
   * @param enableJmx whether to set up JMX exposure
   * @return factory configuration with metrics enabled
   */
  public static HasherFactoryConfig withMetrics(
      MetricRegistry registry, String metricPrefix, boolean enableJmx) {
    return builder(registry, metricPrefix, enableJmx).build();
  }

  /**
   * Starts a factory configuration builder with Dropwizard metrics already set, for callers that
   * also need their own salt, alphabet or cache size.
   *
   * @param registry the Dropwizard MetricRegistry to use
   * @param metricPrefix the metric namespace prefix
   * @param enableJmx whether to set up JMX exposure
   * @return builder with the metrics registry set
   */
  public static HasherFactoryConfig.Builder builder(
      MetricRegistry registry, String metricPrefix, boolean enableJmx) {
    Objects.requireNonNull(registry, "registry cannot be null");
    Objects.requireNonNull(metricPrefix, "metricPrefix cannot be null");

    if (enableJmx) {
      ensureJmxReporter(registry);
    }

    return HasherFactoryConfig.builder()
        .metricsRegistry(new DropwizardMetricsAdapter(registry, metricPrefix));
  }

  /** True while a JMX reporter started by this class is running. */
  public static boolean isJmxReporterRunning() {
    return jmxReporter != null;
  }

  private static synchronized void ensureJmxReporter(MetricRegistry registry) {
    if (jmxReporter == null) {
      try {
        logger.info("HashId: Registering JmxReporter for metrics");
        jmxReporter = JmxReporter.forRegistry(registry).build();
        jmxReporter.start();
        logger.info("HashId: JmxReporter started - metrics available via JMX");
      } catch (RuntimeException e) {
        // Not fatal: the registry may already be exposed
        logger.warn("HashId: Failed to start JmxReporter (may already be configured)", e);
      }
    }
  }

  /** Stops the JMX reporter started by this class, if any. */
  public static synchronized void shutdown() {
    if (jmxReporter != null) {
      logger.info("HashId: Stopping JmxReporter");
      jmxReporter.stop();
      jmxReporter = null;
    }
  }
}
