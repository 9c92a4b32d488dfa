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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.testing.junit.testparameterinjector.TestParameter;
import com.google.testing.junit.testparameterinjector.TestParameterInjector;
import org.junit.Test;
import org.junit.runner.RunWith;

@RunWith(TestParameterInjector.class)
public class BinaryOperatorTest {

  /** Applies {@code op} to two values, as the evaluator does. */
  private static Object apply(BinaryOperator op, Object x, Object y) {
    ValueType result = op.resultType(Values.typeOf(x), Values.typeOf(y));
    assertThat(result).isNotNull();
    return op.apply(result, x, y);
  }

  @Test
  public void everyOperatorAcceptsIntegers(@TestParameter BinaryOperator op) {
    assertThat(op.resultType(ValueType.INTEGER, ValueType.INTEGER)).isNotNull();
  }

  @Test
  public void noOperatorAcceptsBinaryWithBoolean(@TestParameter BinaryOperator op) {
    assertThat(op.resultType(ValueType.BINARY, ValueType.BOOLEAN)).isNull();
    assertThat(op.resultType(ValueType.BOOLEAN, ValueType.BINARY)).isNull();
  }

  @Test
  public void onlyAddAcceptsStringWithNumber(@TestParameter BinaryOperator op) {
    ValueType result = op.resultType(ValueType.STRING, ValueType.FLOAT);
    if (op == BinaryOperator.ADD) {
      assertThat(result).isEqualTo(ValueType.STRING);
    } else {
      assertThat(result).isNull();
    }
  }

  @Test
  public void precedenceLevels(@TestParameter BinaryOperator op) {
    assertThat(op.precedence).isAtLeast(1);
    assertThat(op.precedence).isAtMost(BinaryOperator.POWER.precedence);
    assertThat(op.isRightAssociative()).isEqualTo(op == BinaryOperator.POWER);
  }

  @Test
  public void arithmetic() {
    assertThat(apply(BinaryOperator.ADD, 2L, 3L)).isEqualTo(5L);
    assertThat(apply(BinaryOperator.ADD, 2L, 0.5)).isEqualTo(2.5);
    assertThat(apply(BinaryOperator.ADD, true, true)).isEqualTo(2L);
    assertThat(apply(BinaryOperator.SUBTRACT, 2L, 3L)).isEqualTo(-1L);
    assertThat(apply(BinaryOperator.MULTIPLY, 4L, 2.5)).isEqualTo(10.0);
    assertThat(apply(BinaryOperator.DIVIDE, 6L, 3L)).isEqualTo(2.0);
    assertThat(apply(BinaryOperator.DIVIDE, 1L, 0L)).isEqualTo(Double.POSITIVE_INFINITY);
    assertThat(apply(BinaryOperator.POWER, 2L, 10L)).isEqualTo(1024.0);
  }

  @Test
  public void integerOverflow() {
    assertThrows(
        ArithmeticException.class, () -> apply(BinaryOperator.ADD, Long.MAX_VALUE, 1L));
    assertThrows(
        ArithmeticException.class, () -> apply(BinaryOperator.MULTIPLY, Long.MIN_VALUE, -1L));
  }

  @Test
  public void concatenation() {
    assertThat(apply(BinaryOperator.ADD, "n=", 5L)).isEqualTo("n=5");
    assertThat(apply(BinaryOperator.ADD, 1.5, "!")).isEqualTo("1.5!");
    assertThat(apply(BinaryOperator.ADD, "b=", new byte[] {0x1f})).isEqualTo("b=0x1F");
    assertThat((byte[]) apply(BinaryOperator.ADD, new byte[] {1}, new byte[] {2, 3}))
        .isEqualTo(new byte[] {1, 2, 3});
  }

  @Test
  public void logical() {
    assertThat(apply(BinaryOperator.AND, true, false)).isEqualTo(false);
    assertThat(apply(BinaryOperator.OR, true, false)).isEqualTo(true);
    assertThat(apply(BinaryOperator.XOR, true, true)).isEqualTo(false);
    assertThat(apply(BinaryOperator.AND, 12L, 10L)).isEqualTo(8L);
    assertThat(apply(BinaryOperator.OR, true, 4L)).isEqualTo(5L);
    assertThat(apply(BinaryOperator.XOR, 12L, 10L)).isEqualTo(6L);
    assertThat(BinaryOperator.AND.resultType(ValueType.FLOAT, ValueType.INTEGER)).isNull();
  }

  @Test
  public void bytesAlignOnTheLastByte() {
    byte[] result = (byte[]) apply(BinaryOperator.OR, new byte[] {0x01, 0x00}, new byte[] {0x02});
    assertThat(result).isEqualTo(new byte[] {0x01, 0x02});
    result = (byte[]) apply(BinaryOperator.AND, new byte[] {0x0f}, new byte[] {(byte) 0xff, 0x3c});
    assertThat(result).isEqualTo(new byte[] {0x00, 0x0c});
  }

  @Test
  public void comparisons() {
    assertThat(apply(BinaryOperator.EQUALS, 2L, 2.0)).isEqualTo(true);
    assertThat(apply(BinaryOperator.NOT_EQUALS, "a", "b")).isEqualTo(true);
    assertThat(apply(BinaryOperator.EQUALS, new byte[] {1}, new byte[] {1})).isEqualTo(true);
    assertThat(apply(BinaryOperator.LESS_THAN, 1L, 1.5)).isEqualTo(true);
    assertThat(apply(BinaryOperator.GREATER_THAN_OR_EQUAL, "b", "a")).isEqualTo(true);
    assertThat(apply(BinaryOperator.LESS_THAN_OR_EQUAL, false, true)).isEqualTo(true);
    assertThat(BinaryOperator.EQUALS.resultType(ValueType.STRING, ValueType.INTEGER)).isNull();
    assertThat(BinaryOperator.LESS_THAN.resultType(ValueType.BINARY, ValueType.BINARY)).isNull();
  }

  @Test
  public void shifts() {
    assertThat(apply(BinaryOperator.LEFT_SHIFT, 1L, 4L)).isEqualTo(16L);
    assertThat(apply(BinaryOperator.RIGHT_SHIFT, -16L, 2L)).isEqualTo(-4L);
    assertThat(BinaryOperator.LEFT_SHIFT.resultType(ValueType.FLOAT, ValueType.INTEGER)).isNull();
  }

  @Test
  public void unaryOperators() {
    assertThat(UnaryOperator.NEGATE.apply(ValueType.INTEGER, 5L)).isEqualTo(-5L);
    assertThat(UnaryOperator.NEGATE.apply(ValueType.FLOAT, 0.5)).isEqualTo(-0.5);
    assertThat(UnaryOperator.NEGATE.resultType(ValueType.BOOLEAN)).isEqualTo(ValueType.INTEGER);
    assertThat(UnaryOperator.NEGATE.resultType(ValueType.STRING)).isNull();
    assertThat(UnaryOperator.NOT.apply(ValueType.BOOLEAN, true)).isEqualTo(false);
    assertThat(UnaryOperator.NOT.apply(ValueType.INTEGER, 0L)).isEqualTo(-1L);
    assertThat(UnaryOperator.NOT.resultType(ValueType.FLOAT)).isNull();
    assertThrows(
        ArithmeticException.class,
        () -> UnaryOperator.NEGATE.apply(ValueType.INTEGER, Long.MIN_VALUE));
  }
}
