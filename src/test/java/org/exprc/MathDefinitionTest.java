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

package org.exprc;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import org.exprc.compiler.CompileError;
import org.exprc.functions.FunctionLibrary;
import org.exprc.literals.StandardInterpreters;
import org.exprc.nodes.BinaryOperator;
import org.exprc.nodes.UnaryOperator;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of expressions compiled with non-default definitions. */
@RunWith(JUnit4.class)
public class MathDefinitionTest {

  private static CompiledExpression compile(MathDefinition definition, String text) {
    return new StandardExpressionService(definition, FunctionLibrary.standard()).compile(text);
  }

  @Test
  public void defaults() {
    MathDefinition standard = MathDefinition.standard();
    assertThat(standard.openParenthesis).isEqualTo("(");
    assertThat(standard.closeParenthesis).isEqualTo(")");
    assertThat(standard.parameterSeparator).isEqualTo(",");
    assertThat(standard.binaryOperators.get(BinaryOperator.XOR)).isEqualTo("#");
    assertThat(standard.unaryOperators.get(UnaryOperator.NOT)).isEqualTo("!");
    assertThat(standard.foldConstants).isTrue();
    assertThat(standard.namedConstants.get(1).name).isEqualTo("π");
    assertThat(standard.namedConstants.get(1).aliases).containsExactly("[pi]");
    assertThat(standard.interpreters).hasSize(5);
  }

  @Test
  public void customParenthesesAndSeparator() {
    MathDefinition definition =
        MathDefinition.builder().parentheses("[", "]").parameterSeparator(";").build();
    CompiledExpression compiled = compile(definition, "max[x; 2] * [1 + 1]");
    assertThat(compiled.compute(5)).isEqualTo(10L);
    // Ordinary parentheses are part of a name here
    CompileError e = assertThrows(CompileError.class, () -> compile(definition, "(1 + 2)"));
    assertThat(e.text).isEqualTo("(1");
  }

  @Test
  public void multiCharacterParentheses() {
    MathDefinition definition = MathDefinition.builder().parentheses("{{", "}}").build();
    assertThat(compile(definition, "{{1 + 2}} * abs{{-3}}").compute()).isEqualTo(9L);
  }

  @Test
  public void customOperators() {
    MathDefinition definition =
        MathDefinition.builder()
            .operator(BinaryOperator.POWER, "**")
            .operator(BinaryOperator.XOR, "^")
            .operator(BinaryOperator.EQUALS, "==")
            .operator(UnaryOperator.NOT, "~")
            .build();
    assertThat(compile(definition, "2 ** 3").compute()).isEqualTo(8.0);
    assertThat(compile(definition, "6 ^ 3").compute()).isEqualTo(5L);
    assertThat(compile(definition, "2 * 3 == 6").compute()).isEqualTo(true);
    assertThat(compile(definition, "~0").compute()).isEqualTo(-1L);
  }

  @Test
  public void customStringLiterals() {
    MathDefinition definition = MathDefinition.builder().stringLiterals("'", "'").build();
    assertThat(compile(definition, "'it''s' + x").compute(1)).isEqualTo("it's1");
  }

  @Test
  public void customPrefixes() {
    MathDefinition definition = MathDefinition.builder().hexPrefix("$").binaryPrefix("%").build();
    assertThat((byte[]) compile(definition, "$0f | %11110000").compute())
        .isEqualTo(new byte[] {(byte) 0xff});
  }

  @Test
  public void customInterpreters() {
    MathDefinition definition =
        MathDefinition.builder()
            .interpreters(ImmutableList.of(StandardInterpreters.INTEGER))
            .build();
    assertThat(compile(definition, "1 + 2").compute()).isEqualTo(3L);
    // Without the boolean interpreter, true is a parameter name
    assertThat(compile(definition, "x & true").parameterNames()).containsExactly("x", "true");
    assertThrows(CompileError.class, () -> compile(definition, "x + 1.5"));
  }

  @Test
  public void namedConstants() {
    MathDefinition definition =
        MathDefinition.builder()
            .clearNamedConstants()
            .namedConstant("τ", 2 * Math.PI, "tau")
            .build();
    assertThat(compile(definition, "τ / 2").compute()).isEqualTo(Math.PI);
    assertThat(compile(definition, "tau / 2").compute()).isEqualTo(Math.PI);
    // π is no longer a constant, so it is a parameter
    assertThat(compile(definition, "π * 2").parameterNames()).containsExactly("π");
  }

  @Test
  public void toBuilderKeepsSettings() {
    MathDefinition definition =
        MathDefinition.builder()
            .parentheses("[", "]")
            .foldConstants(false)
            .build()
            .toBuilder()
            .parameterSeparator(";")
            .build();
    assertThat(definition.openParenthesis).isEqualTo("[");
    assertThat(definition.foldConstants).isFalse();
    assertThat(definition.parameterSeparator).isEqualTo(";");
    assertThat(definition.namedConstants).hasSize(MathDefinition.standard().namedConstants.size());
  }

  @Test
  public void invalidDefinitions() {
    assertThrows(
        IllegalArgumentException.class,
        () -> MathDefinition.builder().parentheses("", ")").build());
    assertThrows(
        IllegalArgumentException.class,
        () -> MathDefinition.builder().parentheses("|", "|").build());
    assertThrows(
        IllegalArgumentException.class,
        () -> MathDefinition.builder().parameterSeparator("(").build());
    assertThrows(
        IllegalArgumentException.class,
        () -> MathDefinition.builder().operator(BinaryOperator.ADD, "-").build());
    assertThrows(
        IllegalArgumentException.class,
        () -> MathDefinition.builder().operator(UnaryOperator.NOT, "").build());
  }

  @Test
  public void errorsDependOnTheDefinition() {
    MathDefinition definition =
        MathDefinition.builder().operator(BinaryOperator.ADD, "&+").build();
    // "+" is no longer an operator, so "a+b" is one (invalid) name
    CompileError e = assertThrows(CompileError.class, () -> compile(definition, "a+b"));
    assertThat(e.kind).isEqualTo(CompileError.Kind.INVALID_IDENTIFIER);
    assertThat(compile(definition, "2 &+ 3").compute()).isEqualTo(5L);
  }
}
