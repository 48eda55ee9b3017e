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

package com.axonops.hashid.api;

import java.math.BigInteger;
import java.util.Map;
import java.util.Set;

/**
 * Partial configuration supplied by a caller: any field may be absent ({@code null}).
 *
 * <p>Parsed from a configuration map with keys {@code salt}, {@code min_length} (alias {@code
 * min_hash_length}) and {@code alphabet}. The order of keys in the map has no effect on the result.
 * Values are only type-checked here; range and alphabet rules are enforced when the overrides are
 * merged into a {@link HasherConfig}.
 *
 * @param salt salt override, or null
 * @param minLength minimum length override, or null
 * @param alphabet alphabet override, or null
 * @since 1.0.0
 */
public record ConfigOverrides(String salt, Integer minLength, String alphabet) {

  /** Alias for {@code min_length} accepted for compatibility with older configuration files. */
  public static final String KEY_MIN_HASH_LENGTH = "min_hash_length";

  public static final ConfigOverrides NONE = new ConfigOverrides(null, null, null);

  private static final Set<String> KNOWN_KEYS =
      Set.of(
          HasherConfig.KEY_SALT,
          HasherConfig.KEY_MIN_LENGTH,
          KEY_MIN_HASH_LENGTH,
          HasherConfig.KEY_ALPHABET);

  /**
   * Parses a configuration map.
   *
   * @param config configuration map, may be null or empty
   * @return parsed overrides
   * @throws ConfigurationValidationException on unknown keys or wrongly typed values
   */
  public static ConfigOverrides fromMap(Map<String, ?> config) {
    if (config == null || config.isEmpty()) {
      return NONE;
    }

    for (String key : config.keySet()) {
      if (!KNOWN_KEYS.contains(key)) {
        throw new ConfigurationValidationException(
            String.valueOf(key), "unknown configuration key, expected one of " + KNOWN_KEYS);
      }
    }
    if (config.containsKey(HasherConfig.KEY_MIN_LENGTH)
        && config.containsKey(KEY_MIN_HASH_LENGTH)) {
      throw new ConfigurationValidationException(
          HasherConfig.KEY_MIN_LENGTH,
          "specify either min_length or min_hash_length, not both");
    }

    String salt = stringValue(config, HasherConfig.KEY_SALT);
    String alphabet = stringValue(config, HasherConfig.KEY_ALPHABET);
    Integer minLength =
        config.containsKey(KEY_MIN_HASH_LENGTH)
            ? intValue(config, KEY_MIN_HASH_LENGTH)
            : intValue(config, HasherConfig.KEY_MIN_LENGTH);

    return new ConfigOverrides(salt, minLength, alphabet);
  }

  /** Overrides carrying every field of a complete configuration. */
  public static ConfigOverrides of(HasherConfig config) {
    return new ConfigOverrides(config.salt(), config.minLength(), config.alphabet());
  }

  public boolean isEmpty() {
    return salt == null && minLength == null && alphabet == null;
  }

  private static String stringValue(Map<String, ?> config, String key) {
    Object value = config.get(key);
    if (value == null) {
      return null;
    }
    if (!(value instanceof String)) {
      throw new ConfigurationValidationException(
          key, "must be a string, got " + value.getClass().getSimpleName());
    }
    return (String) value;
  }

  private static Integer intValue(Map<String, ?> config, String key) {
    Object value = config.get(key);
    if (value == null) {
      return null;
    }
    if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
      return ((Number) value).intValue();
    }
    if (value instanceof Long || value instanceof BigInteger) {
      return toInt(key, new BigInteger(value.toString()));
    }
    if (value instanceof String) {
      try {
        return toInt(key, new BigInteger(((String) value).trim()));
      } catch (NumberFormatException e) {
        throw new ConfigurationValidationException(key, "must be an integer", e);
      }
    }
    throw new ConfigurationValidationException(
        key, "must be an integer, got " + value.getClass().getSimpleName());
  }

  private static int toInt(String key, BigInteger value) {
    try {
      return value.intValueExact();
    } catch (ArithmeticException e) {
      throw new ConfigurationValidationException(key, "out of range: " + value, e);
    }
  }

  @Override
  public String toString() {
    return "ConfigOverrides[salt="
        + (salt == null ? "<unset>" : "<redacted>")
        + ", minLength="
        + minLength
        + ", alphabet="
        + alphabet
        + "]";
  }
}
