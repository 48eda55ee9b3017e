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

import java.util.Collection;
import java.util.List;

/**
 * Thrown by the registry when a hasher name was never registered.
 *
 * @since 1.0.0
 */
public final class HasherNotFoundException extends HashIdException {

  private final String hasherName;
  private final List<String> availableHashers;

  public HasherNotFoundException(String hasherName, Collection<String> availableHashers) {
    super(buildMessage(hasherName, availableHashers));
    this.hasherName = hasherName;
    this.availableHashers = List.copyOf(availableHashers);
  }

  public String getHasherName() {
    return hasherName;
  }

  public List<String> getAvailableHashers() {
    return availableHashers;
  }

  private static String buildMessage(String hasherName, Collection<String> available) {
    if (available.isEmpty()) {
      return "HashId: Hasher '" + hasherName + "' not found. No hashers are configured.";
    }
    return "HashId: Hasher '"
        + hasherName
        + "' not found. Available hashers: "
        + String.join(", ", available);
  }
}
