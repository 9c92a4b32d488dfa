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
import com.google.common.collect.ImmutableList;
import java.util.Map;
import org.exprc.compiler.ComputationBody;
import org.exprc.eval.EvaluationException;
import org.exprc.eval.Evaluator;
import org.exprc.nodes.ValueType;
import org.jspecify.annotations.Nullable;

/**
 * The result of compiling an expression.
 *
 * <p>An expression that couldn't be made sense of (for example, one with unbalanced parentheses)
 * still compiles, but is <i>unrecognized</i>: it has no parameters, and computing it returns the
 * original text unchanged.
 *
 * <p>CompiledExpressions are immutable and may be computed concurrently.
 */
public final class CompiledExpression {
  private final String text;
  private final MathDefinition definition;
  private final @Nullable ComputationBody body;

  private CompiledExpression(
      String text, MathDefinition definition, @Nullable ComputationBody body) {
    this.text = text;
    this.definition = definition;
    this.body = body;
  }

  public static CompiledExpression of(
      String text, MathDefinition definition, ComputationBody body) {
    return new CompiledExpression(text, definition, Preconditions.checkNotNull(body));
  }

  public static CompiledExpression unrecognized(String text, MathDefinition definition) {
    return new CompiledExpression(text, definition, null);
  }

  /** The text this expression was compiled from. */
  public String text() {
    return text;
  }

  public MathDefinition definition() {
    return definition;
  }

  public boolean isRecognized() {
    return body != null;
  }

  /** The compiled body, or null if the expression is unrecognized. */
  public @Nullable ComputationBody body() {
    return body;
  }

  /**
   * The type of the result, or null if it depends on the parameter values (or the expression is
   * unrecognized).
   */
  public @Nullable ValueType type() {
    return (body == null) ? null : body.root.type();
  }

  /** The names of the parameters, in the order used by {@link #compute(Object...)}. */
  public ImmutableList<String> parameterNames() {
    return (body == null) ? ImmutableList.of() : body.parameterNames();
  }

  /**
   * Computes the expression with parameters bound by name.
   *
   * @throws EvaluationException if a parameter has no value or an unsuitable one, or if the
   *     computation fails (e.g. integer overflow)
   */
  public Object compute(Map<String, ?> bindings) {
    return (body == null) ? text : Evaluator.evaluate(body, bindings);
  }

  /**
   * Computes the expression with parameters bound by position: the order in which each parameter
   * first appears in the text.
   *
   * @throws EvaluationException if the number of arguments is wrong, a value is unsuitable, or
   *     the computation fails
   */
  public Object compute(Object... args) {
    return (body == null) ? text : Evaluator.evaluate(body, args);
  }

  @Override
  public String toString() {
    return (body == null) ? "unrecognized: " + text : body.toString();
  }
}
