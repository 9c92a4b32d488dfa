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

import com.google.common.collect.ImmutableList;
import org.exprc.compiler.CompileError;
import org.exprc.functions.FunctionLibrary;

/** Compiles expressions against a fixed MathDefinition and FunctionLibrary. */
public interface ExpressionService {

  /**
   * Compiles {@code expression}.
   *
   * @throws CompileError if the expression is recognized but invalid
   */
  CompiledExpression compile(String expression);

  MathDefinition definition();

  FunctionLibrary functions();

  /** Describes each function that can be called, e.g. {@code "min(a, b)"}. */
  default ImmutableList<String> registeredFunctions() {
    return functions().signatures();
  }
}
