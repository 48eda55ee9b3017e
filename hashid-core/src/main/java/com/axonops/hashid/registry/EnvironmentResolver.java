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
 * Looks up environment values for {@code %env(VAR)%} placeholders.
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface EnvironmentResolver {

  /**
   * Resolves a variable.
   *
   * @param variableName variable name, e.g. {@code HASHID_SALT}
   * @return the value, or empty if the variable is not set
   */
  Optional<String> resolve(String variableName);
}
