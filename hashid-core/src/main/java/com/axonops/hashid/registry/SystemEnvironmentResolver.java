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

/**
 * Resolves placeholders from process environment variables, then from system properties.
 *
 * @since 1.0.0
 */
public final class SystemEnvironmentResolver implements EnvironmentResolver {

  /** Singleton instance. */
  public static final SystemEnvironmentResolver INSTANCE = new SystemEnvironmentResolver();

  private SystemEnvironmentResolver() {
    // Singleton - use INSTANCE
  }

  @Override
  public Optional<String> resolve(String variableName) {
    String value = System.getenv(variableName);
    if (value == null) {
      value = System.getProperty(variableName);
    }
    return Optional.ofNullable(value);
  }
}
