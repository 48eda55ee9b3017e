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

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A deferred environment reference: {@code %env(VAR)%} or {@code %env(processor:VAR)%}.
 *
 * @param processor type processor such as {@code string} or {@code int}, or null if none was given
 * @param variable variable name
 * @since 1.0.0
 */
record EnvPlaceholder(String processor, String variable) {

  private static final Pattern PLACEHOLDER = Pattern.compile("^%env\\(([^)]+)\\)%$");

  /**
   * Parses a configuration value.
   *
   * @param value configuration value
   * @return the placeholder, or empty if the value is a literal
   */
  static Optional<EnvPlaceholder> parse(String value) {
    if (value == null) {
      return Optional.empty();
    }
    Matcher m = PLACEHOLDER.matcher(value);
    if (!m.matches()) {
      return Optional.empty();
    }
    String reference = m.group(1);
    int colon = reference.indexOf(':');
    if (colon < 0) {
      return Optional.of(new EnvPlaceholder(null, reference));
    }
    return Optional.of(
        new EnvPlaceholder(reference.substring(0, colon), reference.substring(colon + 1)));
  }

  /** True if the placeholder yields a string value. */
  boolean isStringValued() {
    return processor == null || processor.equals("string");
  }
}
