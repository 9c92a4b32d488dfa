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

import com.google.common.base.Preconditions;
import org.exprc.compiler.Compiler;
import org.exprc.functions.FunctionLibrary;

/** An ExpressionService that compiles each expression afresh. */
public class StandardExpressionService implements ExpressionService {
  private final MathDefinition definition;
  private final FunctionLibrary functions;

  /** Uses the standard definition and functions. */
  public StandardExpressionService() {
    this(MathDefinition.standard(), FunctionLibrary.standard());
  }

  public StandardExpressionService(MathDefinition definition, FunctionLibrary functions) {
    this.definition = Preconditions.checkNotNull(definition);
    this.functions = Preconditions.checkNotNull(functions);
  }

  @Override
  public CompiledExpression compile(String expression) {
    return Compiler.compile(expression, definition, functions);
  }

  @Override
  public MathDefinition definition() {
    return definition;
  }

  @Override
  public FunctionLibrary functions() {
    return functions;
  }
}
