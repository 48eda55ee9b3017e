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
 * Thrown when a requested hasher type is outside the closed {@link HasherType} set.
 *
 * <p>The message is identical for every rejected input and never echoes it back, so malformed and
 * merely unrecognized names cannot be told apart.
 *
 * @since 1.0.0
 */
public final class UnknownHasherTypeException extends HashIdException {

  public UnknownHasherTypeException() {
    super("HashId: Unknown hasher type. Available types: " + String.join(", ", HasherType.names()));
  }
}
