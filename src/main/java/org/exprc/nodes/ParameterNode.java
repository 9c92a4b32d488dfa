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
import java.util.Collections;
import java.util.Set;

/**
 * A named input, bound to a value when the expression is evaluated.
 *
 * <p>There is exactly one ParameterNode per distinct name in a compilation; every reference to the
 * name in the tree is the same instance. While the tree is being built the set of types the
 * parameter may take is narrowed by each use; once the compilation is sealed neither the types nor
 * the position can change.
 */
public final class ParameterNode extends ExpressionNode {
  public final String name;

  private Set<ValueType> allowed = ValueType.all();
  private int position = -1;
  private boolean sealed;

  public ParameterNode(String name) {
    this.name = Preconditions.checkNotNull(name);
  }

  /**
   * Restricts this parameter to types in {@code types}. Returns false (and leaves the parameter
   * unchanged) if that would leave no type at all.
   */
  public boolean narrow(Set<ValueType> types) {
    Preconditions.checkState(!sealed, "Parameter '%s' is sealed", name);
    Set<ValueType> narrowed = ValueType.intersection(allowed, types);
    if (narrowed.isEmpty()) {
      return false;
    }
    allowed = narrowed;
    return true;
  }

  /** True if a value of the given type may be bound to this parameter. */
  public boolean allows(ValueType type) {
    return allowed.contains(type);
  }

  /**
   * This parameter's slot: the rank of its first appearance in the expression, starting from 0.
   * Positional arguments are matched to parameters by slot.
   */
  public int position() {
    Preconditions.checkState(position >= 0, "Parameter '%s' has no position yet", name);
    return position;
  }

  /** Sets {@link #position}; called once per parameter when the compilation is sealed. */
  public void assignPosition(int position) {
    Preconditions.checkState(!sealed, "Parameter '%s' is sealed", name);
    Preconditions.checkArgument(position >= 0);
    this.position = position;
  }

  /** Prevents any further change to this parameter. */
  public void seal() {
    sealed = true;
  }

  @Override
  public Set<ValueType> possibleTypes() {
    return Collections.unmodifiableSet(allowed);
  }

  @Override
  public <T> T accept(NodeVisitor<T> visitor) {
    return visitor.visitParameter(this);
  }

  /** Two parameters are the same if they have the same name. */
  @Override
  public boolean equals(Object obj) {
    return (obj instanceof ParameterNode other) && name.equals(other.name);
  }

  @Override
  public int hashCode() {
    return name.hashCode();
  }
}
