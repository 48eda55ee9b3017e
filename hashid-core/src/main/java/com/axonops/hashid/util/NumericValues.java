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

import com.axonops.hashid.codec.HashidsCodec;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.OptionalLong;
import java.util.regex.Pattern;

/**
 * Decides whether a value passed to {@code encode} is a number the codec can represent.
 *
 * <p>Accepted: integral {@link Number} types, {@link BigDecimal}/{@code double}/{@code float}
 * values with no fractional part, and strings made only of ASCII digits (no sign, no surrounding
 * whitespace). The value must lie in {@code [0,
 * }{@value HashidsCodec#MAX_VALUE}{@code ]}. Everything else is reported as not encodable and the
 * caller passes it through unchanged.
 *
 * @since 1.0.0
 */
public final class NumericValues {

  private static final Pattern DECIMAL_DIGITS = Pattern.compile("\\d+");

  private static final BigInteger MAX = BigInteger.valueOf(HashidsCodec.MAX_VALUE);

  private static final BigDecimal MAX_DECIMAL = BigDecimal.valueOf(HashidsCodec.MAX_VALUE);

  private static final int MAX_DIGITS = String.valueOf(HashidsCodec.MAX_VALUE).length();

  private NumericValues() {
    // Utility class
  }

  /**
   * Converts a value to an encodable number.
   *
   * <p>Range checks happen before any conversion, so oversized input costs no more than a
   * comparison.
   *
   * @param value candidate value, may be null
   * @return the number, or empty if {@code value} must be passed through
   */
  public static OptionalLong toEncodable(Object value) {
    BigInteger number = toBigInteger(value);
    if (number == null || number.signum() < 0 || number.compareTo(MAX) > 0) {
      return OptionalLong.empty();
    }
    return OptionalLong.of(number.longValue());
  }

  private static BigInteger toBigInteger(Object value) {
    if (value instanceof Long
        || value instanceof Integer
        || value instanceof Short
        || value instanceof Byte) {
      return BigInteger.valueOf(((Number) value).longValue());
    }
    if (value instanceof BigInteger) {
      return (BigInteger) value;
    }
    if (value instanceof BigDecimal) {
      return wholeValue((BigDecimal) value);
    }
    if (value instanceof Double || value instanceof Float) {
      double d = ((Number) value).doubleValue();
      return Double.isFinite(d) ? wholeValue(BigDecimal.valueOf(d)) : null;
    }
    if (value instanceof CharSequence) {
      return digitsValue(value.toString());
    }
    return null;
  }

  private static BigInteger wholeValue(BigDecimal decimal) {
    if (decimal.signum() < 0 || decimal.compareTo(MAX_DECIMAL) > 0) {
      return null;
    }
    // In range, so at most MAX_DIGITS integer digits remain after stripping
    BigDecimal stripped = decimal.stripTrailingZeros();
    return stripped.scale() > 0 ? null : stripped.toBigIntegerExact();
  }

  private static BigInteger digitsValue(String s) {
    if (!DECIMAL_DIGITS.matcher(s).matches()) {
      return null;
    }
    int start = 0;
    while (start < s.length() - 1 && s.charAt(start) == '0') {
      start++;
    }
    return s.length() - start > MAX_DIGITS ? null : new BigInteger(s.substring(start));
  }
}
