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

package org.exprc.literals;

import org.jspecify.annotations.Nullable;

/**
 * Recognizes one form of literal.
 *
 * <p>A MathDefinition holds an ordered list of interpreters; the first one that accepts a token
 * determines its value. Tokens reaching an interpreter never contain whitespace or any of the
 * definition's structural symbols.
 */
@FunctionalInterface
public interface ConstantInterpreter {

  /**
   * Returns the value denoted by {@code text} in one of the canonical representations (Boolean,
   * Long, Double, byte[] or String), or null if {@code text} is not a literal of this form.
   */
  @Nullable Object interpret(String text);
}
