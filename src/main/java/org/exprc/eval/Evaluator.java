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

package org.exprc.eval;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Supplier;
import org.exprc.compiler.ComputationBody;
import org.exprc.nodes.BinaryOperationNode;
import org.exprc.nodes.ConstantNode;
import org.exprc.nodes.FunctionCallNode;
import org.exprc.nodes.NodeVisitor;
import org.exprc.nodes.ParameterNode;
import org.exprc.nodes.UnaryOperationNode;
import org.exprc.nodes.ValueType;
import org.exprc.nodes.Values;

/**
 * Evaluates a {@link ComputationBody} with values bound to its parameters.
 *
 * <p>A bound value may be a {@code Supplier}, which is called the first time the parameter's value
 * is needed. All state is local to one evaluation, so a body may be evaluated by many threads at
 * once.
 */
public final class Evaluator implements NodeVisitor<Object> {
  /** Indexed by parameter position. */
  private final Object[] values;

  private final boolean[] resolved;

  private Evaluator(Object[] values) {
    this.values = values;
    this.resolved = new boolean[values.length];
  }

  /** Evaluates {@code body} with parameters bound by name; extra names are ignored. */
  public static Object evaluate(ComputationBody body, Map<String, ?> bindings) {
    Object[] values = new Object[body.parameters.size()];
    for (ParameterNode param : body.parameters) {
      Object value = bindings.get(param.name);
      if (value == null) {
        throw new EvaluationException("No value for parameter '%s'", param.name);
      }
      values[param.position()] = value;
    }
    return run(body, values);
  }

  /** Evaluates {@code body} with parameters bound by position. */
  public static Object evaluate(ComputationBody body, Object... args) {
    int numParams = body.parameters.size();
    if (args.length > numParams) {
      throw new EvaluationException(
          "Too many arguments (expected %s, got %s)", numParams, args.length);
    } else if (args.length < numParams) {
      throw new EvaluationException(
          "No value for parameter '%s'", body.parameters.get(args.length).name);
    }
    Object[] values = args.clone();
    for (int i = 0; i < values.length; i++) {
      if (values[i] == null) {
        throw new EvaluationException("No value for parameter '%s'", body.parameters.get(i).name);
      }
    }
    return run(body, values);
  }

  private static Object run(ComputationBody body, Object[] values) {
    try {
      return body.root.accept(new Evaluator(values));
    } catch (ArithmeticException | IndexOutOfBoundsException e) {
      throw new EvaluationException(e.getMessage(), e);
    }
  }

  @Override
  public Object visitConstant(ConstantNode node) {
    return node.value();
  }

  @Override
  public Object visitParameter(ParameterNode node) {
    int position = node.position();
    if (!resolved[position]) {
      values[position] = bind(node, values[position]);
      resolved[position] = true;
    }
    return values[position];
  }

  /** Converts a caller-supplied value to canonical form and checks that the parameter allows it. */
  private static Object bind(ParameterNode param, Object value) {
    if (value instanceof Supplier<?> supplier) {
      value = supplier.get();
      if (value == null) {
        throw new EvaluationException("Supplier for parameter '%s' returned null", param.name);
      }
    }
    Object normalized = Values.normalize(value);
    if (normalized == null) {
      throw new EvaluationException(
          "Unsupported value for parameter '%s': %s", param.name, value.getClass().getName());
    }
    ValueType type = Values.typeOf(normalized);
    if (!param.allows(type)) {
      throw new EvaluationException(
          "Parameter '%s' can't be %s (allowed: %s)", param.name, type, param.possibleTypes());
    }
    return normalized;
  }

  @Override
  public Object visitUnaryOperation(UnaryOperationNode node) {
    Object operand = node.operand.accept(this);
    ValueType result = node.op.resultType(Values.typeOf(operand));
    if (result == null) {
      throw new EvaluationException("Can't apply %s to %s", node.op, Values.typeOf(operand));
    }
    return node.op.apply(result, operand);
  }

  @Override
  public Object visitBinaryOperation(BinaryOperationNode node) {
    Object left = node.left.accept(this);
    Object right = node.right.accept(this);
    ValueType leftType = Values.typeOf(left);
    ValueType rightType = Values.typeOf(right);
    ValueType result = node.op.resultType(leftType, rightType);
    if (result == null) {
      throw new EvaluationException("Can't apply %s to %s and %s", node.op, leftType, rightType);
    }
    return node.op.apply(result, left, right);
  }

  @Override
  public Object visitFunctionCall(FunctionCallNode node) {
    Object[] args = new Object[node.args.size()];
    ValueType[] types = new ValueType[args.length];
    for (int i = 0; i < args.length; i++) {
      args[i] = node.args.get(i).accept(this);
      types[i] = Values.typeOf(args[i]);
    }
    ValueType result = node.function.resultType(types);
    if (result == null) {
      throw new EvaluationException(
          "Can't apply %s to %s", node.function, Arrays.toString(types));
    }
    return node.function.apply(result, args);
  }
}
