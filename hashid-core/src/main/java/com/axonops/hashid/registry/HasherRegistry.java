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

import com.axonops.hashid.api.ConfigOverrides;
import com.axonops.hashid.api.ConfigurationValidationException;
import com.axonops.hashid.api.Converter;
import com.axonops.hashid.api.HasherConfig;
import com.axonops.hashid.api.HasherNotFoundException;
import com.axonops.hashid.api.HasherType;
import com.axonops.hashid.factory.HasherFactory;
import com.axonops.hashid.metrics.HashIdMetricsRegistry;
import com.axonops.hashid.metrics.MetricNames;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Named hasher configurations with lazily built, memoized converters.
 *
 * <p>Callers register configurations under stable names once (for example {@code "default"} and
 * {@code "secure-api"}) and later ask for converters by name. A name moves through {@link
 * HasherState}: registering stores a validated configuration, the first {@link
 * #getConverter(String)} builds the converter through {@link HasherFactory#createConverter}, and
 * re-registering discards the built converter.
 *
 * <p>The {@code "default"} hasher is registered on construction with the factory defaults.
 *
 * <p>A salt may be given as {@code %env(VAR)%}; the variable is resolved through the {@link
 * EnvironmentResolver} when the converter is built, not at registration.
 *
 * <p>Thread-safe. Registration is serialized; the lazy build runs atomically per name, so
 * concurrent first lookups of a name produce exactly one converter.
 *
 * @since 1.0.0
 */
public final class HasherRegistry {
  private static final Logger logger = LoggerFactory.getLogger(HasherRegistry.class);

  /** Name of the built-in hasher. */
  public static final String DEFAULT_HASHER = "default";

  /** Maximum length of a hasher name. */
  public static final int MAX_NAME_LENGTH = 50;

  private static final Pattern NAME_PATTERN = Pattern.compile("[A-Za-z0-9_.\\-]+");

  private final HasherFactory factory;
  private final EnvironmentResolver environment;
  private final HashIdMetricsRegistry metrics;

  private final ConcurrentHashMap<String, Entry> entries = new ConcurrentHashMap<>();

  /** Creates a registry backed by a default {@link HasherFactory} and the process environment. */
  public HasherRegistry() {
    this(new HasherFactory());
  }

  public HasherRegistry(HasherFactory factory) {
    this(factory, SystemEnvironmentResolver.INSTANCE);
  }

  public HasherRegistry(HasherFactory factory, EnvironmentResolver environment) {
    this.factory = Objects.requireNonNull(factory, "factory cannot be null");
    this.environment = Objects.requireNonNull(environment, "environment cannot be null");
    this.metrics = factory.getConfig().metricsRegistry();

    registerHasher(DEFAULT_HASHER, Map.of());
    metrics.registerGauge(MetricNames.REGISTRY_HASHERS_COUNT, entries::size);
  }

  /**
   * Registers or replaces a named configuration.
   *
   * <p>Fields missing from {@code config} take the factory defaults. A previously built converter
   * for the name is discarded.
   *
   * @param name hasher name: letters, digits, {@code _ - .}, at most 50 characters
   * @param config configuration map ({@code salt}, {@code min_length}, {@code alphabet})
   * @throws ConfigurationValidationException if the name or configuration is invalid
   */
  public synchronized void registerHasher(String name, Map<String, ?> config) {
    Registered registered = prepare(name, config);
    Entry previous = entries.put(name, registered);
    logger.debug(
        "HashId: Registered hasher '{}'{}", name, previous == null ? "" : " (replaced previous)");
  }

  /**
   * Registers several configurations, all or nothing.
   *
   * <p>Every entry is validated before any is stored. If one is invalid the exception is thrown
   * and the registry is left unchanged.
   *
   * @param configs configurations by name
   * @throws ConfigurationValidationException if any name or configuration is invalid
   */
  public synchronized void registerHashers(Map<String, ? extends Map<String, ?>> configs) {
    Map<String, Registered> prepared = new LinkedHashMap<>();
    configs.forEach((name, config) -> prepared.put(name, prepare(name, config)));
    entries.putAll(prepared);
    logger.debug("HashId: Registered {} hashers: {}", prepared.size(), prepared.keySet());
  }

  /**
   * Returns the converter for a name, building it on first use.
   *
   * @param name hasher name
   * @return memoized converter; the same instance until the name is re-registered
   * @throws HasherNotFoundException if the name was never registered
   * @throws ConfigurationValidationException if the salt placeholder cannot be resolved
   */
  public Converter getConverter(String name) {
    Entry entry = name == null ? null : entries.get(name);
    if (entry instanceof Materialized) {
      return ((Materialized) entry).converter();
    }
    if (entry == null) {
      throw notFound(name);
    }

    Entry result =
        entries.computeIfPresent(
            name,
            (key, current) ->
                current instanceof Materialized ? current : materialize(key, current.config()));
    if (result == null) {
      throw notFound(name);
    }
    return ((Materialized) result).converter();
  }

  /** Returns the default hasher's converter. */
  public Converter getConverter() {
    return getConverter(DEFAULT_HASHER);
  }

  public boolean hasHasher(String name) {
    return name != null && entries.containsKey(name);
  }

  /** Registered names, sorted. Always contains {@code "default"}. */
  public List<String> getHasherNames() {
    List<String> names = new ArrayList<>(entries.keySet());
    Collections.sort(names);
    return Collections.unmodifiableList(names);
  }

  /**
   * Registered configuration for a name. A placeholder salt is returned unresolved.
   *
   * @param name hasher name
   * @return configuration, or empty if not registered
   */
  public Optional<HasherConfig> getHasherConfiguration(String name) {
    Entry entry = name == null ? null : entries.get(name);
    return entry == null ? Optional.empty() : Optional.of(entry.config());
  }

  /** Current lifecycle state of a name. */
  public HasherState getState(String name) {
    Entry entry = name == null ? null : entries.get(name);
    if (entry == null) {
      return HasherState.UNREGISTERED;
    }
    return entry instanceof Materialized ? HasherState.MATERIALIZED : HasherState.REGISTERED;
  }

  /** Discards every built converter. Registrations are kept and rebuilt on next use. */
  public synchronized void clearCaches() {
    entries.replaceAll(
        (name, entry) -> entry instanceof Materialized ? new Registered(entry.config()) : entry);
    logger.debug("HashId: Registry converter caches cleared");
  }

  private Registered prepare(String name, Map<String, ?> config) {
    try {
      validateName(name);
      ConfigOverrides overrides = ConfigOverrides.fromMap(config);
      HasherConfig defaults = factory.getDefaults();

      String salt = overrides.salt() != null ? overrides.salt() : defaults.salt();
      Optional<EnvPlaceholder> placeholder = EnvPlaceholder.parse(salt);
      if (placeholder.isPresent() && !placeholder.get().isStringValued()) {
        throw new ConfigurationValidationException(
            HasherConfig.KEY_SALT, "environment placeholder must resolve to a string");
      }

      return new Registered(
          new HasherConfig(
              salt,
              overrides.minLength() != null ? overrides.minLength() : defaults.minLength(),
              overrides.alphabet() != null ? overrides.alphabet() : defaults.alphabet()));
    } catch (ConfigurationValidationException e) {
      metrics.incrementCounter(MetricNames.ERRORS_VALIDATION);
      logger.debug("HashId: Rejected registration of hasher '{}' - field: {}", name, e.getField());
      throw e;
    }
  }

  private static void validateName(String name) {
    if (name == null || name.isEmpty()) {
      throw new ConfigurationValidationException("hasher_name", "cannot be empty");
    }
    if (name.length() > MAX_NAME_LENGTH) {
      throw new ConfigurationValidationException(
          "hasher_name", "too long (max " + MAX_NAME_LENGTH + " characters)");
    }
    if (!NAME_PATTERN.matcher(name).matches()) {
      throw new ConfigurationValidationException(
          "hasher_name",
          "can only contain letters, numbers, underscores, hyphens, and dots");
    }
  }

  private Materialized materialize(String name, HasherConfig config) {
    HasherConfig resolved = resolveSalt(name, config);
    Converter converter = factory.createConverter(HasherType.DEFAULT, resolved.toMap());
    metrics.incrementCounter(MetricNames.REGISTRY_MATERIALIZED);
    logger.debug("HashId: Built converter for hasher '{}'", name);
    return new Materialized(config, converter);
  }

  private HasherConfig resolveSalt(String name, HasherConfig config) {
    Optional<EnvPlaceholder> placeholder = EnvPlaceholder.parse(config.salt());
    if (placeholder.isEmpty()) {
      return config;
    }
    String variable = placeholder.get().variable();
    String value =
        environment
            .resolve(variable)
            .orElseThrow(
                () ->
                    new ConfigurationValidationException(
                        HasherConfig.KEY_SALT,
                        "environment variable '"
                            + variable
                            + "' for hasher '"
                            + name
                            + "' is not set"));
    return config.withSalt(value);
  }

  private HasherNotFoundException notFound(String name) {
    metrics.incrementCounter(MetricNames.ERRORS_HASHER_NOT_FOUND);
    return new HasherNotFoundException(name, getHasherNames());
  }

  /** Per-name state: a stored configuration, optionally with its built converter. */
  private sealed interface Entry permits Registered, Materialized {
    HasherConfig config();
  }

  private record Registered(HasherConfig config) implements Entry {}

  private record Materialized(HasherConfig config, Converter converter) implements Entry {}
}
