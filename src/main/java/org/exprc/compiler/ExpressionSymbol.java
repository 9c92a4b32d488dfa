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
 * One sub-expression discovered during compilation, stored in the {@link SymbolTable} under a
 * placeholder key.
 *
 * <p>The expression text is rewritten as the calls and groupings inside it are replaced by
 * placeholders. A function-call symbol's text is the canonical call ({@code name(arg,...)} with
 * each argument already a placeholder or parameter name) and is never rewritten.
 */
public final class ExpressionSymbol {
  public final String key;
  public final boolean isFunctionCall;

  /** Higher levels were discovered later, nested more deeply. */
  public final int level;

  private String expression;

  ExpressionSymbol(String key, String expression, boolean isFunctionCall, int level) {
    this.key = key;
    this.expression = expression;
    this.isFunctionCall = isFunctionCall;
    this.level = level;
  }

  public String expression() {
    return expression;
  }

  void setExpression(String expression) {
    assert !isFunctionCall;
    this.expression = expression;
  }

  @Override
  public String toString() {
    return String.format("%s%s: %s", key, isFunctionCall ? "()" : "", expression);
  }
}
