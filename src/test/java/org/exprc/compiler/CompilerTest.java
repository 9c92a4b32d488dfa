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

package org.exprc.compiler;

import static com.google.common.truth.Truth.assertThat;
import static com.google.common.truth.Truth.assertWithMessage;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableMap;
import org.exprc.CompiledExpression;
import org.exprc.MathDefinition;
import org.exprc.functions.FunctionLibrary;
import org.exprc.nodes.BinaryOperationNode;
import org.exprc.nodes.ConstantNode;
import org.exprc.nodes.FunctionCallNode;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of the extraction passes and of the tables they build. */
@RunWith(JUnit4.class)
public class CompilerTest {

  private static CompilationContext prepare(String text) {
    return Compiler.prepare(text, MathDefinition.standard(), FunctionLibrary.standard());
  }

  private static CompiledExpression compile(String text) {
    return Compiler.compile(text, MathDefinition.standard(), FunctionLibrary.standard());
  }

  /** Asserts that no non-call symbol still contains an open parenthesis. */
  private static void assertFullyExtracted(CompilationContext context) {
    for (ExpressionSymbol symbol : context.symbols.symbols()) {
      if (!symbol.isFunctionCall) {
        assertWithMessage("Residual parenthesis in %s", symbol)
            .that(symbol.expression())
            .doesNotContain("(");
      }
    }
  }

  @Test
  public void groupingBecomesOneSymbol() {
    CompilationContext context = prepare("3 + (4 * 5)");
    assertThat(context.symbols.count()).isEqualTo(2);
    ExpressionSymbol group = context.symbols.get("item0001");
    assertThat(group.expression()).isEqualTo("4*5");
    assertThat(group.isFunctionCall).isFalse();
    assertThat(context.symbols.get(SymbolTable.ROOT).expression()).isEqualTo("3+item0001");
    assertThat(compile("3 + (4 * 5)").compute()).isEqualTo(23L);
  }

  @Test
  public void functionCallBecomesSymbol() {
    CompilationContext context = prepare("max(x, 5) + 1");
    ExpressionSymbol call = context.symbols.get("item0001");
    assertThat(call.isFunctionCall).isTrue();
    assertThat(call.expression()).isEqualTo("max(x,const0001)");
    assertThat(context.expand(call.key)).isEqualTo("max(x,5)");
    assertThat(context.symbols.get(SymbolTable.ROOT).expression()).isEqualTo("item0001+1");
    assertThat(compile("max(x, 5) + 1").compute(ImmutableMap.of("x", 10))).isEqualTo(11L);
  }

  @Test
  public void nestedCallsAreExtractedInnermostFirst() {
    CompilationContext context = prepare("max(min(a, b), 2)");
    assertThat(context.symbols.count()).isEqualTo(3);
    assertThat(context.symbols.get("item0001").expression()).isEqualTo("min(a,b)");
    assertThat(context.symbols.get("item0002").expression())
        .isEqualTo("max(item0001,const0001)");
    assertThat(context.symbols.get(SymbolTable.ROOT).expression()).isEqualTo("item0002");
    assertThat(context.expand("item0002")).isEqualTo("max(min(a,b),2)");
    assertThat(compile("max(min(a, b), 2)").compute(5, 7)).isEqualTo(5L);
  }

  @Test
  public void nestedGroupings() {
    CompilationContext context = prepare("((1 + 2) * 3)");
    assertThat(context.symbols.count()).isEqualTo(3);
    assertThat(context.symbols.get("item0001").expression()).isEqualTo("item0002*3");
    assertThat(context.symbols.get("item0002").expression()).isEqualTo("1+2");
    assertFullyExtracted(context);
    assertThat(compile("((1 + 2) * 3)").compute()).isEqualTo(9L);
  }

  @Test
  public void deeplyNestedExtractionTerminates() {
    String text = "1";
    for (int i = 0; i < 12; i++) {
      text = (i % 2 == 0) ? "abs(" + text + " - x)" : "(" + text + " + 1)";
    }
    CompilationContext context = prepare(text);
    assertFullyExtracted(context);
    assertThat(compile(text).isRecognized()).isTrue();
  }

  @Test
  public void groupingInsideCallArgument() {
    CompilationContext context = prepare("max((a + b), 2) * 2");
    assertFullyExtracted(context);
    assertThat(context.symbols.count()).isEqualTo(3);
    assertThat(context.symbols.get("item0001").expression()).isEqualTo("a+b");
    assertThat(context.symbols.get("item0002").expression())
        .isEqualTo("max(item0001,const0001)");
    assertThat(prepare("max(((a + b)), (a + b))").symbols.count()).isEqualTo(3);
    assertThat(compile("max((a + b), 2) * 2").compute(1, 2)).isEqualTo(6L);
  }

  @Test
  public void prefixOperatorsBindTighterThanPower() {
    CompiledExpression compiled = compile("-x ^ 2");
    assertThat(compiled.body().root).isInstanceOf(BinaryOperationNode.class);
    assertThat(compiled.compute(3)).isEqualTo(9.0);
    assertThat(compile("-2 ^ 2").compute()).isEqualTo(4.0);
    assertThat(compile("-(2) ^ 2").compute()).isEqualTo(4.0);
    assertThat(compile("0 - 2 ^ 2").compute()).isEqualTo(-4.0);
    assertThat(compile("2 ^ -1").compute()).isEqualTo(0.5);
  }

  @Test
  public void repeatedCallsShareOneSymbol() {
    CompilationContext context = prepare("abs(x) + abs(x)");
    assertThat(context.symbols.count()).isEqualTo(2);
    assertThat(context.symbols.get(SymbolTable.ROOT).expression())
        .isEqualTo("item0001+item0001");
    assertThat(compile("abs(x) + abs(x)").compute(-3)).isEqualTo(6L);
  }

  @Test
  public void repeatedLiteralsShareOneConstant() {
    CompilationContext context = prepare("2 + max(2, x) * 2");
    assertThat(context.constants.size()).isEqualTo(1);
  }

  @Test
  public void unbalancedInputIsUnrecognized() {
    CompiledExpression compiled = compile("foo(1, 2");
    assertThat(compiled.isRecognized()).isFalse();
    assertThat(compiled.parameterNames()).isEmpty();
    assertThat(compiled.compute()).isEqualTo("foo(1, 2");
    assertThat(compile("(1 + 2").compute()).isEqualTo("(1 + 2");
  }

  @Test
  public void unbalancedOuterCallStillExtractsInnerCall() {
    CompilationContext context = prepare("f(abs(1)");
    assertThat(context.symbols.get(SymbolTable.ROOT).expression()).isEqualTo("f(item0001");
    assertThat(context.symbols.get("item0001").isFunctionCall).isTrue();
  }

  @Test
  public void emptyExpressionIsUnrecognized() {
    assertThat(compile("").isRecognized()).isFalse();
    assertThat(compile("  ").compute()).isEqualTo("  ");
  }

  @Test
  public void parametersArePositionedByFirstAppearance() {
    CompilationContext context = prepare("b - max(a, b) + c");
    assertThat(context.parameters.exists("a")).isTrue();
    assertThat(context.parameters.get("b").position()).isEqualTo(0);
    assertThat(context.parameters.get("a").position()).isEqualTo(1);
    assertThat(context.parameters.get("c").position()).isEqualTo(2);
    assertThat(compile("b - max(a, b) + c").parameterNames()).containsExactly("b", "a", "c");
  }

  @Test
  public void stringLiteralsAreExtractedFirst() {
    CompilationContext context = prepare("\"a (b), c\" + x");
    assertThat(context.symbols.count()).isEqualTo(1);
    assertThat(context.symbols.get(SymbolTable.ROOT).expression()).isEqualTo("const0001+x");
    assertThat(context.constants.get("const0001").value()).isEqualTo("a (b), c");
    assertThat(compile("\"a (b), c\" + x").compute(1)).isEqualTo("a (b), c1");
  }

  @Test
  public void escapedIndicatorInsideLiteral() {
    assertThat(compile("\"say \\\"hi\\\"\"").compute()).isEqualTo("say \"hi\"");
    assertThat(compile("\"back\\\\slash\"").compute()).isEqualTo("back\\slash");
  }

  @Test
  public void unterminatedLiteralIsLeftAlone() {
    CompileError e = assertThrows(CompileError.class, () -> compile("\"abc + 1"));
    assertThat(e.kind).isEqualTo(CompileError.Kind.INVALID_IDENTIFIER);
    assertThat(e.text).isEqualTo("\"abc");
  }

  @Test
  public void constantsAreFolded() {
    CompiledExpression compiled = compile("2 * (3 + 4)");
    assertThat(compiled.body().root).isInstanceOf(ConstantNode.class);
    assertThat(compiled.compute()).isEqualTo(14L);
  }

  @Test
  public void foldingCanBeDisabled() {
    MathDefinition definition = MathDefinition.standard().toBuilder().foldConstants(false).build();
    CompiledExpression compiled =
        Compiler.compile("2 * (3 + 4)", definition, FunctionLibrary.standard());
    assertThat(compiled.body().root).isInstanceOf(BinaryOperationNode.class);
    assertThat(compiled.body().root.toString()).isEqualTo("(2 * (3 + 4))");
    assertThat(compiled.compute()).isEqualTo(14L);
  }

  @Test
  public void failedFoldKeepsOperation() {
    CompiledExpression compiled = compile("9223372036854775807 + 1");
    assertThat(compiled.body().root).isInstanceOf(BinaryOperationNode.class);
  }

  @Test
  public void nondeterministicFunctionsAreNotFolded() {
    CompiledExpression compiled = compile("randomint(1, 2)");
    assertThat(compiled.body().root).isInstanceOf(FunctionCallNode.class);
    assertThat(compiled.compute()).isEqualTo(1L);
  }

  @Test
  public void invalidIdentifier() {
    CompileError e = assertThrows(CompileError.class, () -> compile("2x + 1"));
    assertThat(e.kind).isEqualTo(CompileError.Kind.INVALID_IDENTIFIER);
    assertThat(e.text).isEqualTo("2x");
    assertThat(e.getMessage()).isEqualTo("Invalid identifier (2x)");
  }

  @Test
  public void placeholderNamesAreReserved() {
    CompileError e = assertThrows(CompileError.class, () -> compile("item0001 + 1"));
    assertThat(e.kind).isEqualTo(CompileError.Kind.INVALID_IDENTIFIER);
    e = assertThrows(CompileError.class, () -> compile("const0001 * 2"));
    assertThat(e.kind).isEqualTo(CompileError.Kind.INVALID_IDENTIFIER);
    // Even when a string literal has already been given that key
    e = assertThrows(CompileError.class, () -> compile("\"a\" + const0001"));
    assertThat(e.kind).isEqualTo(CompileError.Kind.INVALID_IDENTIFIER);
    assertThat(e.text).isEqualTo("const0001");
    e = assertThrows(CompileError.class, () -> compile("max(abs(x), 1) + item0001"));
    assertThat(e.text).isEqualTo("item0001");
    // Inside a literal it's just text
    assertThat(compile("\"const0001\" + 1").compute()).isEqualTo("const00011");
  }

  @Test
  public void unknownFunction() {
    CompileError e = assertThrows(CompileError.class, () -> compile("foo(1) + 2"));
    assertThat(e.kind).isEqualTo(CompileError.Kind.UNKNOWN_FUNCTION);
    assertThat(e.text).isEqualTo("foo(1)");
    // Known name, wrong arity
    e = assertThrows(CompileError.class, () -> compile("sqrt(1, 2)"));
    assertThat(e.kind).isEqualTo(CompileError.Kind.UNKNOWN_FUNCTION);
  }

  @Test
  public void incompatibleOperands() {
    CompileError e = assertThrows(CompileError.class, () -> compile("\"abc\" - 1"));
    assertThat(e.kind).isEqualTo(CompileError.Kind.INCOMPATIBLE_OPERAND_TYPES);
    assertThat(e.text).isEqualTo("\"abc\"-1");
    e = assertThrows(CompileError.class, () -> compile("sqrt(\"abc\")"));
    assertThat(e.kind).isEqualTo(CompileError.Kind.INCOMPATIBLE_OPERAND_TYPES);
  }

  @Test
  public void conflictingParameterUses() {
    CompileError e = assertThrows(CompileError.class, () -> compile("strlen(x) * x"));
    assertThat(e.kind).isEqualTo(CompileError.Kind.INCOMPATIBLE_OPERAND_TYPES);
  }
}
