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

import com.google.common.base.Preconditions;
import com.google.common.collect.Sets;
import java.util.Set;

/** A prefix operator applied to one operand. */
public final class UnaryOperationNode extends ExpressionNode {
  public final UnaryOperator op;
  public final ExpressionNode operand;
  private final Set<ValueType> types;

  /**
   * Creates a UnaryOperationNode.
   *
   * @param types the types this operation may produce, as determined by {@link TypeRules}
   */
  public UnaryOperationNode(UnaryOperator op, ExpressionNode operand, Set<ValueType> types) {
    Preconditions.checkArgument(!types.isEmpty());
    this.op = op;
    this.operand = operand;
    this.types = Sets.immutableEnumSet(types);
  }

  @Override
  public Set<ValueType> possibleTypes() {
    return types;
  }

  @Override
  public <T> T accept(NodeVisitor<T> visitor) {
    return visitor.visitUnaryOperation(this);
  }
}
