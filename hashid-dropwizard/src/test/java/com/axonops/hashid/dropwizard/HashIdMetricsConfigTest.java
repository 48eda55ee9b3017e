package com.axonops.hashid.dropwizard;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.axonops.hashid.api.HasherConfig;
import com.axonops.hashid.factory.HasherFactory;
import com.axonops.hashid.factory.HasherFactoryConfig;
import com.axonops.hashid.metrics.DropwizardMetricsAdapter;
import com.codahale.metrics.MetricRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

/** Tests for HashIdMetricsConfig factory methods. */
class HashIdMetricsConfigTest {

  @AfterEach
  void cleanup() {
    HashIdMetricsConfig.shutdown();
  }

  @Test
  void testWithMetrics_CustomPrefix() {
    MetricRegistry registry = new MetricRegistry();

    HasherFactoryConfig config = HashIdMetricsConfig.withMetrics(registry, "com.myapp.hashid");
    new HasherFactory(config).create("default");

    assertThat(config.metricsRegistry()).isInstanceOf(DropwizardMetricsAdapter.class);
    assertThat(config.defaults()).isEqualTo(HasherConfig.DEFAULT);
    assertThat(registry.getCounters()).containsKey("com.myapp.hashid.hashers.created.total.count");
    assertThat(HashIdMetricsConfig.isJmxReporterRunning()).isTrue();
  }

  @Test
  void testWithMetrics_DefaultPrefix() {
    MetricRegistry registry = new MetricRegistry();

    HasherFactoryConfig config = HashIdMetricsConfig.withMetrics(registry);
    new HasherFactory(config).create("custom");

    assertThat(registry.getCounters()).containsKey("com.axonops.hashid.hashers.created.total.count");
  }

  @Test
  void testWithMetrics_DisableJmx() {
    MetricRegistry registry = new MetricRegistry();

    HasherFactoryConfig config = HashIdMetricsConfig.withMetrics(registry, "test", false);

    assertThat(config).isNotNull();
    assertThat(HashIdMetricsConfig.isJmxReporterRunning()).isFalse();
  }

  @Test
  void testBuilder_KeepsCustomDefaults() {
    MetricRegistry registry = new MetricRegistry();

    HasherFactoryConfig config = HashIdMetricsConfig.builder(registry, "test", false)
        .salt("app-salt")
        .maxCacheSize(100)
        .build();

    assertThat(config.defaults().salt()).isEqualTo("app-salt");
    assertThat(config.maxCacheSize()).isEqualTo(100);
    assertThat(config.metricsRegistry()).isInstanceOf(DropwizardMetricsAdapter.class);
  }

  @Test
  void testShutdown_Idempotent() {
    HashIdMetricsConfig.withMetrics(new MetricRegistry(), "test");

    HashIdMetricsConfig.shutdown();
    HashIdMetricsConfig.shutdown();

    assertThat(HashIdMetricsConfig.isJmxReporterRunning()).isFalse();
  }

  @Test
  void testNullRegistry_ThrowsException() {
    assertThatThrownBy(() -> HashIdMetricsConfig.withMetrics(null, "test"))
        .isInstanceOf(NullPointerException.class)
        .hasMessageContaining("registry");
  }

  @Test
  void testNullPrefix_ThrowsException() {
    MetricRegistry registry = new MetricRegistry();

    assertThatThrownBy(() -> HashIdMetricsConfig.withMetrics(registry, null))
        .isInstanceOf(NullPointerException.class)
        .hasMessageContaining("metricPrefix");
  }
}
