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

package org.exprc.nodes;

import java.util.stream.Collectors;

/** Renders a tree as text; used by {@link ExpressionNode#toString}. */
final class NodeRenderer implements NodeVisitor<String> {
  static final NodeRenderer INSTANCE = new NodeRenderer();

  private NodeRenderer() {}

  @Override
  public String visitConstant(ConstantNode node) {
    return node.text;
  }

  @Override
  public String visitParameter(ParameterNode node) {
    return node.name;
  }

  @Override
  public String visitUnaryOperation(UnaryOperationNode node) {
    return node.op.defaultSymbol + node.operand.accept(this);
  }

  @Override
  public String visitBinaryOperation(BinaryOperationNode node) {
    return String.format(
        "(%s %s %s)", node.left.accept(this), node.op.defaultSymbol, node.right.accept(this));
  }

  @Override
  public String visitFunctionCall(FunctionCallNode node) {
    return node.args.stream()
        .map(arg -> arg.accept(this))
        .collect(Collectors.joining(", ", node.function.name + "(", ")"));
  }
}
