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

import static org.exprc.nodes.Values.asDouble;
import static org.exprc.nodes.Values.asLong;

import java.util.Arrays;
import java.util.function.LongBinaryOperator;
import org.jspecify.annotations.Nullable;

/**
 * The binary operators, each with its typing rule and its implementation.
 *
 * <p>{@link #resultType} defines which operand types an operator accepts and what it produces;
 * {@link #apply} may only be called with operands for which resultType returned non-null, and must
 * be passed that result. Integer arithmetic that overflows throws ArithmeticException.
 *
 * <p>Precedence levels run from 1 (binds loosest) upwards; the expression text is split at the
 * loosest operator first.
 */
public enum BinaryOperator {
  OR(1, "|") {
    @Override
    public @Nullable ValueType resultType(ValueType x, ValueType y) {
      return logicalResult(x, y);
    }

    @Override
    public Object apply(ValueType result, Object x, Object y) {
      return logical(result, x, y, (a, b) -> a | b);
    }
  },

  XOR(2, "#") {
    @Override
    public @Nullable ValueType resultType(ValueType x, ValueType y) {
      return logicalResult(x, y);
    }

    @Override
    public Object apply(ValueType result, Object x, Object y) {
      return logical(result, x, y, (a, b) -> a ^ b);
    }
  },

  AND(3, "&") {
    @Override
    public @Nullable ValueType resultType(ValueType x, ValueType y) {
      return logicalResult(x, y);
    }

    @Override
    public Object apply(ValueType result, Object x, Object y) {
      return logical(result, x, y, (a, b) -> a & b);
    }
  },

  EQUALS(4, "=") {
    @Override
    public @Nullable ValueType resultType(ValueType x, ValueType y) {
      return equalityResult(x, y);
    }

    @Override
    public Object apply(ValueType result, Object x, Object y) {
      return areEqual(x, y);
    }
  },

  NOT_EQUALS(4, "!=") {
    @Override
    public @Nullable ValueType resultType(ValueType x, ValueType y) {
      return equalityResult(x, y);
    }

    @Override
    public Object apply(ValueType result, Object x, Object y) {
      return !areEqual(x, y);
    }
  },

  LESS_THAN(5, "<") {
    @Override
    public @Nullable ValueType resultType(ValueType x, ValueType y) {
      return orderingResult(x, y);
    }

    @Override
    public Object apply(ValueType result, Object x, Object y) {
      return compare(x, y) < 0;
    }
  },

  LESS_THAN_OR_EQUAL(5, "<=") {
    @Override
    public @Nullable ValueType resultType(ValueType x, ValueType y) {
      return orderingResult(x, y);
    }

    @Override
    public Object apply(ValueType result, Object x, Object y) {
      return compare(x, y) <= 0;
    }
  },

  GREATER_THAN(5, ">") {
    @Override
    public @Nullable ValueType resultType(ValueType x, ValueType y) {
      return orderingResult(x, y);
    }

    @Override
    public Object apply(ValueType result, Object x, Object y) {
      return compare(x, y) > 0;
    }
  },

  GREATER_THAN_OR_EQUAL(5, ">=") {
    @Override
    public @Nullable ValueType resultType(ValueType x, ValueType y) {
      return orderingResult(x, y);
    }

    @Override
    public Object apply(ValueType result, Object x, Object y) {
      return compare(x, y) >= 0;
    }
  },

  LEFT_SHIFT(6, "<<") {
    @Override
    public @Nullable ValueType resultType(ValueType x, ValueType y) {
      return (x.isIntegral() && y.isIntegral()) ? ValueType.INTEGER : null;
    }

    @Override
    public Object apply(ValueType result, Object x, Object y) {
      return asLong(x) << asLong(y);
    }
  },

  RIGHT_SHIFT(6, ">>") {
    @Override
    public @Nullable ValueType resultType(ValueType x, ValueType y) {
      return (x.isIntegral() && y.isIntegral()) ? ValueType.INTEGER : null;
    }

    @Override
    public Object apply(ValueType result, Object x, Object y) {
      return asLong(x) >> asLong(y);
    }
  },

  ADD(7, "+") {
    @Override
    public @Nullable ValueType resultType(ValueType x, ValueType y) {
      if (x == ValueType.STRING || y == ValueType.STRING) {
        return ValueType.STRING;
      } else if (x == ValueType.BINARY && y == ValueType.BINARY) {
        return ValueType.BINARY;
      }
      return arithmeticResult(x, y);
    }

    @Override
    public Object apply(ValueType result, Object x, Object y) {
      switch (result) {
        case STRING:
          return Values.toText(x) + Values.toText(y);
        case BINARY:
          byte[] left = (byte[]) x;
          byte[] right = (byte[]) y;
          byte[] joined = Arrays.copyOf(left, left.length + right.length);
          System.arraycopy(right, 0, joined, left.length, right.length);
          return joined;
        case INTEGER:
          return Math.addExact(asLong(x), asLong(y));
        default:
          return asDouble(x) + asDouble(y);
      }
    }
  },

  SUBTRACT(7, "-") {
    @Override
    public @Nullable ValueType resultType(ValueType x, ValueType y) {
      return arithmeticResult(x, y);
    }

    @Override
    public Object apply(ValueType result, Object x, Object y) {
      if (result == ValueType.INTEGER) {
        return Math.subtractExact(asLong(x), asLong(y));
      }
      return asDouble(x) - asDouble(y);
    }
  },

  MULTIPLY(8, "*") {
    @Override
    public @Nullable ValueType resultType(ValueType x, ValueType y) {
      return arithmeticResult(x, y);
    }

    @Override
    public Object apply(ValueType result, Object x, Object y) {
      if (result == ValueType.INTEGER) {
        return Math.multiplyExact(asLong(x), asLong(y));
      }
      return asDouble(x) * asDouble(y);
    }
  },

  /** Division always produces a FLOAT, even when both operands are integers. */
  DIVIDE(8, "/") {
    @Override
    public @Nullable ValueType resultType(ValueType x, ValueType y) {
      return (x.isNumeric() && y.isNumeric()) ? ValueType.FLOAT : null;
    }

    @Override
    public Object apply(ValueType result, Object x, Object y) {
      return asDouble(x) / asDouble(y);
    }
  },

  POWER(9, "^") {
    @Override
    public @Nullable ValueType resultType(ValueType x, ValueType y) {
      return (x.isNumeric() && y.isNumeric()) ? ValueType.FLOAT : null;
    }

    @Override
    public Object apply(ValueType result, Object x, Object y) {
      return Math.pow(asDouble(x), asDouble(y));
    }

    @Override
    public boolean isRightAssociative() {
      return true;
    }
  };

  /** 1 for the loosest-binding operators, increasing for tighter ones. */
  public final int precedence;

  /** The symbol used for this operator unless a MathDefinition overrides it. */
  public final String defaultSymbol;

  BinaryOperator(int precedence, String defaultSymbol) {
    this.precedence = precedence;
    this.defaultSymbol = defaultSymbol;
  }

  /**
   * Returns the type this operator produces for operands of the given types, or null if it cannot
   * be applied to them.
   */
  public abstract @Nullable ValueType resultType(ValueType x, ValueType y);

  /** Applies this operator; {@code result} must be {@code resultType(typeOf(x), typeOf(y))}. */
  public abstract Object apply(ValueType result, Object x, Object y);

  /** True if {@code a op b op c} means {@code a op (b op c)}. */
  public boolean isRightAssociative() {
    return false;
  }

  private static @Nullable ValueType arithmeticResult(ValueType x, ValueType y) {
    return (x.isNumeric() && y.isNumeric()) ? ValueType.arithmetic(x, y) : null;
  }

  private static @Nullable ValueType logicalResult(ValueType x, ValueType y) {
    if (x == ValueType.BOOLEAN && y == ValueType.BOOLEAN) {
      return ValueType.BOOLEAN;
    } else if (x.isIntegral() && y.isIntegral()) {
      return ValueType.INTEGER;
    } else if (x == ValueType.BINARY && y == ValueType.BINARY) {
      return ValueType.BINARY;
    }
    return null;
  }

  private static @Nullable ValueType equalityResult(ValueType x, ValueType y) {
    if ((x.isNumeric() && y.isNumeric()) || (x == y)) {
      return ValueType.BOOLEAN;
    }
    return null;
  }

  private static @Nullable ValueType orderingResult(ValueType x, ValueType y) {
    if ((x.isNumeric() && y.isNumeric()) || (x == ValueType.STRING && y == ValueType.STRING)) {
      return ValueType.BOOLEAN;
    }
    return null;
  }

  private static Object logical(ValueType result, Object x, Object y, LongBinaryOperator op) {
    switch (result) {
      case BOOLEAN:
        return op.applyAsLong(asLong(x), asLong(y)) != 0;
      case INTEGER:
        return op.applyAsLong(asLong(x), asLong(y));
      default:
        // Byte sequences of different lengths are aligned on their last byte.
        byte[] left = (byte[]) x;
        byte[] right = (byte[]) y;
        byte[] combined = new byte[Math.max(left.length, right.length)];
        for (int i = 1; i <= combined.length; i++) {
          long a = (i <= left.length) ? left[left.length - i] & 0xff : 0;
          long b = (i <= right.length) ? right[right.length - i] & 0xff : 0;
          combined[combined.length - i] = (byte) op.applyAsLong(a, b);
        }
        return combined;
    }
  }

  private static boolean areEqual(Object x, Object y) {
    if (x instanceof byte[] xBytes) {
      return Arrays.equals(xBytes, (byte[]) y);
    } else if (x instanceof String) {
      return x.equals(y);
    } else if (x instanceof Double || y instanceof Double) {
      return asDouble(x) == asDouble(y);
    }
    return asLong(x) == asLong(y);
  }

  private static int compare(Object x, Object y) {
    if (x instanceof String xString) {
      return xString.compareTo((String) y);
    }
    return Values.compareNumbers(x, y);
  }
}
