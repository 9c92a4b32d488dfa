/*
 * Copyright 2025 The Exprc Authors
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

package org.exprc.literals;

import com.google.common.base.Ascii;
import com.google.common.base.CharMatcher;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.io.BaseEncoding;
import java.math.BigInteger;
import java.util.regex.Pattern;
import org.jspecify.annotations.Nullable;

/**
 * The standard literal forms. Accepted grammar:
 *
 * <ul>
 *   <li>boolean: {@code true} or {@code false}, in any case
 *   <li>integer: one or more ASCII digits, fitting in a signed 64-bit long
 *   <li>floating: ASCII digits with at most one {@code .}, at least one digit; always uses {@code
 *       .} as the decimal separator. Digit strings too large for a long also read as floating.
 *       Exponents are not supported.
 *   <li>hex: the hex prefix followed by one or more hex digits (either case); an odd number of
 *       digits is padded with a leading zero. Produces a byte sequence.
 *   <li>binary: the binary prefix followed by one or more {@code 0}/{@code 1} digits, grouped
 *       into bytes from the right. Produces a byte sequence.
 * </ul>
 *
 * Signs are not part of a literal; {@code -5} is the negation operator applied to {@code 5}.
 */
public class StandardInterpreters {

  private static final CharMatcher DIGITS = CharMatcher.inRange('0', '9');
  private static final CharMatcher HEX_DIGITS =
      DIGITS.or(CharMatcher.inRange('a', 'f')).or(CharMatcher.inRange('A', 'F'));
  private static final CharMatcher BINARY_DIGITS = CharMatcher.anyOf("01");

  private static final Pattern FLOATING = Pattern.compile("[0-9]+(\\.[0-9]*)?|\\.[0-9]+");

  /** Case-insensitive {@code true} / {@code false}. */
  public static final ConstantInterpreter BOOLEAN =
      text -> {
        if (Ascii.equalsIgnoreCase(text, "true")) {
          return Boolean.TRUE;
        } else if (Ascii.equalsIgnoreCase(text, "false")) {
          return Boolean.FALSE;
        }
        return null;
      };

  /** Decimal integers that fit in a long. */
  public static final ConstantInterpreter INTEGER =
      text -> {
        if (text.isEmpty() || !DIGITS.matchesAllOf(text)) {
          return null;
        }
        BigInteger value = new BigInteger(text);
        return (value.bitLength() < Long.SIZE) ? (Object) value.longValue() : null;
      };

  /** Decimal numbers with an optional fractional part. */
  public static final ConstantInterpreter FLOATING_POINT =
      text -> FLOATING.matcher(text).matches() ? (Object) Double.parseDouble(text) : null;

  /** Returns an interpreter for hexadecimal byte sequences introduced by {@code prefix}. */
  public static ConstantInterpreter hex(String prefix) {
    Preconditions.checkArgument(!prefix.isEmpty(), "Hex prefix may not be empty");
    return text -> {
      String digits = digitsAfter(prefix, text, HEX_DIGITS);
      if (digits == null) {
        return null;
      }
      if (digits.length() % 2 != 0) {
        digits = "0" + digits;
      }
      return BaseEncoding.base16().decode(Ascii.toUpperCase(digits));
    };
  }

  /** Returns an interpreter for binary byte sequences introduced by {@code prefix}. */
  public static ConstantInterpreter binary(String prefix) {
    Preconditions.checkArgument(!prefix.isEmpty(), "Binary prefix may not be empty");
    return text -> {
      String digits = digitsAfter(prefix, text, BINARY_DIGITS);
      if (digits == null) {
        return null;
      }
      int numBytes = (digits.length() + 7) / 8;
      digits = Strings.padStart(digits, numBytes * 8, '0');
      byte[] result = new byte[numBytes];
      for (int i = 0; i < numBytes; i++) {
        result[i] = (byte) Integer.parseInt(digits.substring(8 * i, 8 * i + 8), 2);
      }
      return result;
    };
  }

  /**
   * Returns the standard interpreters in the order they are tried: boolean, integer, floating,
   * hex, binary.
   */
  public static ImmutableList<ConstantInterpreter> standard(String hexPrefix, String binaryPrefix) {
    return ImmutableList.of(BOOLEAN, INTEGER, FLOATING_POINT, hex(hexPrefix), binary(binaryPrefix));
  }

  /**
   * If {@code text} is {@code prefix} (compared case-insensitively) followed by at least one
   * character matching {@code digits}, returns the part after the prefix; otherwise null.
   */
  private static @Nullable String digitsAfter(String prefix, String text, CharMatcher digits) {
    if (text.length() <= prefix.length()
        || !text.regionMatches(true, 0, prefix, 0, prefix.length())) {
      return null;
    }
    String rest = text.substring(prefix.length());
    return digits.matchesAllOf(rest) ? rest : null;
  }

  private StandardInterpreters() {}
}
