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

import org.exprc.MathDefinition;
import org.exprc.functions.FunctionLibrary;

/**
 * All the mutable state of a single compilation: the constants, symbols and parameters found so
 * far, plus the definition and function library being compiled against.
 *
 * <p>Each compilation creates its own CompilationContext and every pass receives it explicitly;
 * there are no shared tables, so different expressions can be compiled concurrently.
 */
public final class CompilationContext {
  public final MathDefinition definition;
  public final FunctionLibrary functions;
  public final StructuralSymbols structure;
  public final ConstantsTable constants;
  public final SymbolTable symbols = new SymbolTable();
  public final ParameterRegistry parameters = new ParameterRegistry();

  public CompilationContext(MathDefinition definition, FunctionLibrary functions) {
    this.definition = definition;
    this.functions = functions;
    this.structure = new StructuralSymbols(definition);
    this.constants = new ConstantsTable(definition);
  }

  /**
   * Determines what {@code text} refers to. Checked in order: a constant key or a registered
   * literal text, a parameter name, a symbol key or the text of an existing symbol.
   */
  public Classification classify(String text) {
    if (text.isEmpty()) {
      return Classification.unrecognized(text);
    } else if (constants.containsKey(text)) {
      return Classification.constant(text);
    }
    String key = constants.findKey(text);
    if (key != null) {
      return Classification.constant(key);
    } else if (parameters.exists(text)) {
      return Classification.parameter(text);
    } else if (symbols.contains(text)) {
      return Classification.symbol(text);
    }
    key = symbols.findKey(text);
    if (key != null && !key.equals(SymbolTable.ROOT)) {
      return Classification.symbol(key);
    }
    return Classification.unrecognized(text);
  }

  /**
   * Returns the text for which {@code text} is a placeholder form: constant keys are replaced by
   * their literal text, function-call symbols by their call and other symbols by their text in
   * parentheses, recursively.
   */
  public String expand(String text) {
    StringBuilder sb = new StringBuilder();
    for (StructuralSymbols.Token token : structure.tokenize(text)) {
      if (token.isSymbol) {
        sb.append(token.text);
      } else if (constants.containsKey(token.text)) {
        sb.append(constants.get(token.text).text);
      } else if (symbols.contains(token.text)) {
        ExpressionSymbol symbol = symbols.get(token.text);
        String expanded = expand(symbol.expression());
        if (symbol.isFunctionCall) {
          sb.append(expanded);
        } else {
          sb.append(structure.open).append(expanded).append(structure.close);
        }
      } else {
        sb.append(token.text);
      }
    }
    return sb.toString();
  }
}
