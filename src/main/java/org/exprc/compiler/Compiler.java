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

import com.google.common.base.CharMatcher;
import com.google.common.base.Preconditions;
import org.exprc.CompiledExpression;
import org.exprc.MathDefinition;
import org.exprc.functions.FunctionLibrary;
import org.exprc.nodes.ExpressionNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compiles expression text into a {@link CompiledExpression}.
 *
 * <p>Compilation is done in a series of passes over a fresh {@link CompilationContext}:
 *
 * <ul>
 *   <li>string literals are replaced by constant placeholders ({@link StringLiteralExtractor});
 *   <li>whitespace is removed, and the result is stored as the root symbol;
 *   <li>function calls are replaced by symbol placeholders ({@link FunctionCallExtractor});
 *   <li>parenthesized groups are replaced by symbol placeholders ({@link GroupingExtractor});
 *   <li>the remaining leaves are registered as constants or parameters ({@link TablePopulator});
 *   <li>parameters are numbered in order of first appearance;
 *   <li>an expression tree is built for each symbol ({@link TreeBuilder}).
 * </ul>
 */
public class Compiler {
  private static final Logger logger = LoggerFactory.getLogger(Compiler.class);

  private Compiler() {}

  /**
   * Compiles {@code text}. Text that can't be made sense of yields an unrecognized
   * CompiledExpression rather than an error.
   *
   * @throws CompileError if the expression is recognized but invalid
   */
  public static CompiledExpression compile(
      String text, MathDefinition definition, FunctionLibrary functions) {
    Preconditions.checkNotNull(text);
    CompilationContext context = prepare(text, definition, functions);
    ExpressionNode root = TreeBuilder.build(context);
    if (root == null) {
      logger.debug("Unrecognized expression: {}", text);
      return CompiledExpression.unrecognized(text, definition);
    }
    context.parameters.seal();
    ComputationBody body = new ComputationBody(root, context.parameters);
    logger.debug("Compiled {} to {}", text, body);
    return CompiledExpression.of(text, definition, body);
  }

  /** Runs every pass except tree building and returns the populated context. */
  static CompilationContext prepare(
      String text, MathDefinition definition, FunctionLibrary functions) {
    CompilationContext context = new CompilationContext(definition, functions);
    // Placeholder names may only come from the passes themselves
    String userText =
        CharMatcher.whitespace()
            .removeFrom(StringLiteralExtractor.outsideLiterals(definition, text));
    for (String fragment : context.structure.split(userText)) {
      if (ParameterRegistry.isReserved(fragment)) {
        throw new CompileError(
            CompileError.Kind.INVALID_IDENTIFIER, "Reserved for internal use", fragment);
      }
    }
    String stripped =
        CharMatcher.whitespace().removeFrom(StringLiteralExtractor.extract(context, text));
    context.symbols.add(SymbolTable.ROOT, stripped, false, 0);
    FunctionCallExtractor.extract(context);
    GroupingExtractor.extract(context);
    TablePopulator.populateAll(context);
    context.parameters.assignPositions(context.structure.split(stripped));
    logger.debug(
        "{} symbols, {} constants, {} parameters:\n{}",
        context.symbols.count(),
        context.constants.size(),
        context.parameters.size(),
        context.symbols);
    return context;
  }
}
