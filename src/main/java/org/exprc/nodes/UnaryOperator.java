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

import org.jspecify.annotations.Nullable;

/** The prefix operators. See {@link BinaryOperator} for the contract of the methods. */
public enum UnaryOperator {
  NEGATE("-") {
    @Override
    public @Nullable ValueType resultType(ValueType x) {
      return x.isNumeric() ? ValueType.arithmetic(x, x) : null;
    }

    @Override
    public Object apply(ValueType result, Object x) {
      if (result == ValueType.INTEGER) {
        return Math.negateExact(Values.asLong(x));
      }
      return -Values.asDouble(x);
    }
  },

  /** Logical not for booleans, bitwise complement for integers and byte sequences. */
  NOT("!") {
    @Override
    public @Nullable ValueType resultType(ValueType x) {
      return (x.isIntegral() || x == ValueType.BINARY) ? x : null;
    }

    @Override
    public Object apply(ValueType result, Object x) {
      switch (result) {
        case BOOLEAN:
          return !((Boolean) x);
        case INTEGER:
          return ~Values.asLong(x);
        default:
          byte[] bytes = ((byte[]) x).clone();
          for (int i = 0; i < bytes.length; i++) {
            bytes[i] = (byte) ~bytes[i];
          }
          return bytes;
      }
    }
  };

  /** The symbol used for this operator unless a MathDefinition overrides it. */
  public final String defaultSymbol;

  UnaryOperator(String defaultSymbol) {
    this.defaultSymbol = defaultSymbol;
  }

  public abstract @Nullable ValueType resultType(ValueType x);

  public abstract Object apply(ValueType result, Object x);
}
