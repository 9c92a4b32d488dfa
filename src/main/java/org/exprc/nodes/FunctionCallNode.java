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
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Sets;
import java.util.List;
import java.util.Set;
import org.exprc.functions.MathFunction;

/** A call to one of the functions in a FunctionLibrary. */
public final class FunctionCallNode extends ExpressionNode {
  public final MathFunction function;
  public final ImmutableList<ExpressionNode> args;
  private final Set<ValueType> types;

  public FunctionCallNode(MathFunction function, List<ExpressionNode> args, Set<ValueType> types) {
    Preconditions.checkArgument(function.arity == args.size());
    Preconditions.checkArgument(!types.isEmpty());
    this.function = function;
    this.args = ImmutableList.copyOf(args);
    this.types = Sets.immutableEnumSet(types);
  }

  @Override
  public Set<ValueType> possibleTypes() {
    return types;
  }

  @Override
  public <T> T accept(NodeVisitor<T> visitor) {
    return visitor.visitFunctionCall(this);
  }
}
