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

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Replaces each parenthesized group in the symbol texts with a placeholder for its contents.
 *
 * <p>Runs after {@link FunctionCallExtractor}. An open parenthesis is a grouping if it is at the
 * start of the text or directly follows a structural symbol. A group whose contents are already a
 * placeholder or parameter name is replaced by that directly; otherwise its contents become a new
 * symbol, which is itself processed later in the same pass. Empty and unbalanced groups are left
 * in place.
 */
class GroupingExtractor {
  private static final Logger logger = LoggerFactory.getLogger(GroupingExtractor.class);

  static void extract(CompilationContext context) {
    SymbolTable symbols = context.symbols;
    for (int i = 0; i < symbols.count(); i++) {
      ExpressionSymbol symbol = symbols.get(i);
      if (symbol.isFunctionCall) {
        continue;
      }
      for (; ; ) {
        String replaced = replaceOne(context, symbol);
        if (replaced == null) {
          break;
        }
        logger.debug("{} -> {}", symbol.key, replaced);
        symbols.setExpression(symbol.key, replaced);
      }
    }
  }

  private static @Nullable String replaceOne(CompilationContext context, ExpressionSymbol symbol) {
    StructuralSymbols structure = context.structure;
    String text = symbol.expression();
    int open = text.indexOf(structure.open);
    while (open >= 0) {
      int innerStart = open + structure.open.length();
      int close = structure.closeFor(text, open);
      boolean isGrouping = (open == 0) || structure.isPrecededBySymbol(text, open);
      if (isGrouping && close > innerStart) {
        String inner = text.substring(innerStart, close);
        Classification classification = context.classify(inner);
        String replacement =
            (classification.kind == Classification.Kind.UNRECOGNIZED)
                ? context.symbols.keyFor(inner, false, symbol.level + 1)
                : classification.value;
        return text.substring(0, open)
            + replacement
            + text.substring(close + structure.close.length());
      }
      open = text.indexOf(structure.open, innerStart);
    }
    return null;
  }

  private GroupingExtractor() {}
}
