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

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One codec instantiation: salt, minimum hash length and alphabet.
 *
 * <p>Immutable and validated on construction, so an invalid instance cannot exist:
 *
 * <ul>
 *   <li>{@code minLength} between 0 and {@value #MAX_MIN_LENGTH}
 *   <li>{@code alphabet} with at least {@value #MIN_UNIQUE_ALPHABET_CHARS} <b>unique</b> characters
 *       (repeated characters do not count), no whitespace and none of {@value
 *       #RESERVED_ALPHABET_CHARS}
 *   <li>{@code salt} may be empty; {@code null} is stored as {@code ""}
 * </ul>
 *
 * <p>The salt is a secret. It is left out of {@link #toString()} and must never be logged.
 *
 * @param salt codec salt
 * @param minLength minimum length of produced hashes
 * @param alphabet characters hashes are built from
 * @since 1.0.0
 */
public record HasherConfig(String salt, int minLength, String alphabet) {

  public static final String DEFAULT_ALPHABET =
      "abcdefghijklmnopqrstuvwxyzABCDEFGHIJKLMNOPQRSTUVWXYZ1234567890";

  public static final String SECURE_ALPHABET =
      "abcdefghijklmnopqrstuvwxyzABCDEFGHIJKLMNOPQRSTUVWXYZ1234567890!@#%*";

  /**
   * Characters an alphabet may not contain. The codec splits hashes with a regex character class
   * built from alphabet characters, so these would change its meaning.
   */
  public static final String RESERVED_ALPHABET_CHARS = "^[]\\&-$";

  public static final String DEFAULT_SALT = "";

  public static final int DEFAULT_MIN_LENGTH = 10;

  public static final int MAX_MIN_LENGTH = 255;

  public static final int MIN_UNIQUE_ALPHABET_CHARS = 16;

  /** Configuration key for the salt. */
  public static final String KEY_SALT = "salt";

  /** Configuration key for the minimum hash length. */
  public static final String KEY_MIN_LENGTH = "min_length";

  /** Configuration key for the alphabet. */
  public static final String KEY_ALPHABET = "alphabet";

  /** Default configuration: empty salt, length 10, alphanumeric alphabet. */
  public static final HasherConfig DEFAULT =
      new HasherConfig(DEFAULT_SALT, DEFAULT_MIN_LENGTH, DEFAULT_ALPHABET);

  public HasherConfig {
    salt = salt == null ? DEFAULT_SALT : salt;
    validateMinLength(minLength);
    validateAlphabet(alphabet);
  }

  /** Returns a copy with a different salt. */
  public HasherConfig withSalt(String newSalt) {
    return new HasherConfig(newSalt, minLength, alphabet);
  }

  /** True if the salt is empty. */
  public boolean hasEmptySalt() {
    return salt.isEmpty();
  }

  /**
   * Renders this configuration as an override map ({@code salt}, {@code min_length}, {@code
   * alphabet}).
   */
  public Map<String, Object> toMap() {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put(KEY_SALT, salt);
    map.put(KEY_MIN_LENGTH, minLength);
    map.put(KEY_ALPHABET, alphabet);
    return map;
  }

  /**
   * Number of distinct characters (code points) in an alphabet.
   *
   * @param alphabet alphabet to inspect
   * @return distinct character count, 0 for {@code null}
   */
  public static int uniqueCharCount(String alphabet) {
    if (alphabet == null) {
      return 0;
    }
    return (int) alphabet.codePoints().distinct().count();
  }

  static void validateMinLength(int minLength) {
    if (minLength < 0) {
      throw new ConfigurationValidationException(
          KEY_MIN_LENGTH, "must be non-negative, got " + minLength);
    }
    if (minLength > MAX_MIN_LENGTH) {
      throw new ConfigurationValidationException(
          KEY_MIN_LENGTH, "cannot exceed " + MAX_MIN_LENGTH + ", got " + minLength);
    }
  }

  static void validateAlphabet(String alphabet) {
    if (alphabet == null) {
      throw new ConfigurationValidationException(KEY_ALPHABET, "cannot be null");
    }
    int unique = uniqueCharCount(alphabet);
    if (unique < MIN_UNIQUE_ALPHABET_CHARS) {
      throw new ConfigurationValidationException(
          KEY_ALPHABET,
          "must contain at least "
              + MIN_UNIQUE_ALPHABET_CHARS
              + " unique characters, got "
              + unique);
    }
    if (alphabet.codePoints().anyMatch(Character::isWhitespace)) {
      throw new ConfigurationValidationException(KEY_ALPHABET, "cannot contain whitespace");
    }
    if (alphabet.codePoints().anyMatch(c -> RESERVED_ALPHABET_CHARS.indexOf(c) >= 0)) {
      throw new ConfigurationValidationException(
          KEY_ALPHABET, "cannot contain any of " + RESERVED_ALPHABET_CHARS);
    }
  }

  @Override
  public String toString() {
    return "HasherConfig[salt="
        + (salt.isEmpty() ? "<empty>" : "<redacted>")
        + ", minLength="
        + minLength
        + ", alphabet="
        + alphabet
        + "]";
  }
}
