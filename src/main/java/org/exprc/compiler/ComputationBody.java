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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.exprc.nodes.ExpressionNode;
import org.exprc.nodes.ParameterNode;
import org.jspecify.annotations.Nullable;

/**
 * The result of a successful compilation: the root of the expression tree and the parameters it
 * refers to. Immutable.
 */
public final class ComputationBody {
  public final ExpressionNode root;

  /** Ordered by position; {@code parameters.get(i).position() == i}. */
  public final ImmutableList<ParameterNode> parameters;

  private final ImmutableMap<String, ParameterNode> byName;

  ComputationBody(ExpressionNode root, ParameterRegistry registry) {
    this.root = root;
    this.parameters = registry.inPositionOrder();
    this.byName = registry.byName();
  }

  public @Nullable ParameterNode parameter(String name) {
    return byName.get(name);
  }

  public ImmutableList<String> parameterNames() {
    return parameters.stream().map(p -> p.name).collect(ImmutableList.toImmutableList());
  }

  @Override
  public String toString() {
    return parameterNames() + " -> " + root;
  }
}
