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

/**
 * Registers the leaves of a piece of expression text: each run of text between structural symbols
 * becomes a constant or a parameter unless it is already a known placeholder.
 *
 * <p>Populating the same text twice has no further effect.
 */
class TablePopulator {

  /**
   * Registers every leaf of {@code token}. A leading open parenthesis is stripped (with its close,
   * if the token ends with one) before the rest is examined.
   *
   * @throws CompileError of kind INVALID_IDENTIFIER if a leaf is neither a literal nor a valid
   *     parameter name
   */
  static void populate(CompilationContext context, String token) {
    StructuralSymbols structure = context.structure;
    if (token.startsWith(structure.open)) {
      String inner = token.substring(structure.open.length());
      if (inner.endsWith(structure.close)) {
        inner = inner.substring(0, inner.length() - structure.close.length());
      }
      populate(context, inner);
      return;
    }
    for (String fragment : structure.split(token)) {
      populateLeaf(context, fragment);
    }
  }

  /** Populates the text of every symbol that isn't a function call. */
  static void populateAll(CompilationContext context) {
    for (ExpressionSymbol symbol : context.symbols.symbols()) {
      if (!symbol.isFunctionCall) {
        populate(context, symbol.expression());
      }
    }
  }

  private static void populateLeaf(CompilationContext context, String leaf) {
    if (context.symbols.contains(leaf) || context.constants.containsKey(leaf)) {
      return;
    } else if (context.constants.checkAndAdd(leaf) != null) {
      return;
    }
    context.parameters.getOrCreate(leaf);
  }

  private TablePopulator() {}
}
