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

package com.axonops.hashid.util;

/**
 * Compact fingerprints of configuration identifiers for logging.
 *
 * <p>Cache keys are logged as fingerprints so that log lines stay short and never
 * carry configuration values. The same input always gives the same fingerprint, which keeps logs
 * greppable.
 *
 * @since 1.0.0
 */
public final class ConfigFingerprint {

  private static final int LENGTH = 8;

  private ConfigFingerprint() {
    // Utility class
  }

  /**
   * Shortens a digest or identifier to its first eight characters.
   *
   * @param value identifier, e.g. a cache key digest
   * @return at most eight characters, or {@code "null"}
   */
  public static String of(String value) {
    if (value == null) {
      return "null";
    }
    return value.length() <= LENGTH ? value : value.substring(0, LENGTH);
  }
}
