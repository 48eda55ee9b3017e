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

/**
 * Thrown when a hasher configuration violates its invariants.
 *
 * <p>Raised at the point of validation only: factory construction, registration, or the merge of
 * per-call overrides. Never raised from {@code encode}/{@code decode}.
 *
 * @since 1.0.0
 */
public final class ConfigurationValidationException extends HashIdException {

  private final String field;

  public ConfigurationValidationException(String field, String message) {
    super("HashId: Invalid configuration for '" + field + "': " + message);
    this.field = field;
  }

  public ConfigurationValidationException(String field, String message, Throwable cause) {
    super("HashId: Invalid configuration for '" + field + "': " + message, cause);
    this.field = field;
  }

  /** Name of the rejected field (e.g. {@code alphabet}, {@code min_length}). */
  public String getField() {
    return field;
  }
}
