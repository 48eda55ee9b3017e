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

package com.axonops.hashid.factory;

import java.security.SecureRandom;
import java.util.HexFormat;

/**
 * Generates random salts for secure hashers.
 *
 * <p>Each salt is 32 bytes (256 bits) from {@link SecureRandom}, hex encoded to 64 characters.
 * Salts are never cached: every call returns a fresh value.
 *
 * @since 1.0.0
 */
public final class SecureSaltGenerator {

  /** Entropy per salt in bytes. */
  public static final int SALT_BYTES = 32;

  private final SecureRandom random;

  public SecureSaltGenerator() {
    this(new SecureRandom());
  }

  public SecureSaltGenerator(SecureRandom random) {
    this.random = random;
  }

  /** Returns a new 64-character hex salt. */
  public String generate() {
    byte[] bytes = new byte[SALT_BYTES];
    random.nextBytes(bytes);
    return HexFormat.of().formatHex(bytes);
  }
}
