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

package org.exprc.nodes;

import com.google.common.io.BaseEncoding;
import java.math.BigDecimal;
import org.jspecify.annotations.Nullable;

/**
 * A static-only class for working with runtime values.
 *
 * <p>Values are represented by a small set of Java classes, one per {@link ValueType}: {@code
 * Boolean}, {@code Long}, {@code Double}, {@code byte[]} and {@code String}.
 */
public class Values {

  /** Returns the ValueType of a value in canonical representation. */
  public static ValueType typeOf(Object value) {
    if (value instanceof Boolean) {
      return ValueType.BOOLEAN;
    } else if (value instanceof Long) {
      return ValueType.INTEGER;
    } else if (value instanceof Double) {
      return ValueType.FLOAT;
    } else if (value instanceof byte[]) {
      return ValueType.BINARY;
    } else if (value instanceof String) {
      return ValueType.STRING;
    }
    throw new IllegalArgumentException("Not a canonical value: " + value.getClass().getName());
  }

  /**
   * Converts a value supplied by a caller to its canonical representation, or returns null if its
   * class isn't supported. Narrower integral classes are widened to {@code Long}, {@code Float} to
   * {@code Double}, and any CharSequence to String.
   */
  public static @Nullable Object normalize(Object value) {
    if (value instanceof Long
        || value instanceof Double
        || value instanceof Boolean
        || value instanceof byte[]
        || value instanceof String) {
      return value;
    } else if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
      return ((Number) value).longValue();
    } else if (value instanceof Float) {
      return ((Float) value).doubleValue();
    } else if (value instanceof CharSequence) {
      return value.toString();
    }
    return null;
  }

  /** Returns an integral value as a long (false and true convert to 0 and 1). */
  public static long asLong(Object value) {
    if (value instanceof Boolean b) {
      return b ? 1 : 0;
    }
    return (Long) value;
  }

  /** Returns a numeric value as a double (false and true convert to 0 and 1). */
  public static double asDouble(Object value) {
    if (value instanceof Double d) {
      return d;
    }
    return asLong(value);
  }

  /** Returns the text used when a value is concatenated to a string. */
  public static String toText(Object value) {
    if (value instanceof byte[] bytes) {
      return "0x" + BaseEncoding.base16().encode(bytes);
    }
    return String.valueOf(value);
  }

  /**
   * Returns text that compiles back to the given value under the default definition. Strings use
   * the default string indicator and escape character. Doubles are written in plain decimal form
   * with a fractional part; values with no literal form (NaN, the infinities and the smallest
   * long) are written as constant expressions that fold to them.
   */
  public static String render(Object value) {
    if (value instanceof String s) {
      return '"' + s.replace("\\", "\\\\").replace("\"", "\\\"") + '"';
    } else if (value instanceof Double d) {
      return renderDouble(d);
    } else if (value instanceof Long l && l == Long.MIN_VALUE) {
      return "(-9223372036854775807 - 1)";
    }
    return toText(value);
  }

  private static String renderDouble(double d) {
    if (Double.isNaN(d)) {
      return "(0.0 / 0.0)";
    } else if (Double.isInfinite(d)) {
      return (d > 0) ? "(1.0 / 0.0)" : "(-1.0 / 0.0)";
    } else if (d == 0) {
      return (Double.compare(d, 0.0) < 0) ? "-0.0" : "0.0";
    }
    String plain = BigDecimal.valueOf(d).toPlainString();
    return plain.contains(".") ? plain : plain + ".0";
  }

  /** Compares two numeric values, exactly if both are integral. */
  public static int compareNumbers(Object x, Object y) {
    if (x instanceof Double || y instanceof Double) {
      return Double.compare(asDouble(x), asDouble(y));
    }
    return Long.compare(asLong(x), asLong(y));
  }

  private Values() {}
}
