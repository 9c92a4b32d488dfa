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

import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * A node of a compiled expression tree.
 *
 * <p>Nodes are immutable once the compilation that built them has finished. The only exception
 * during compilation is {@link ParameterNode}, whose set of allowed types may be narrowed as
 * further uses of the parameter are discovered.
 */
public abstract class ExpressionNode {

  /** The types this node may produce; never empty. */
  public abstract Set<ValueType> possibleTypes();

  /** Returns the type of this node's value, or null if it depends on how parameters are bound. */
  public @Nullable ValueType type() {
    Set<ValueType> types = possibleTypes();
    return (types.size() == 1) ? types.iterator().next() : null;
  }

  /** True if this node always produces the same value. */
  public boolean isConstant() {
    return false;
  }

  public abstract <T> T accept(NodeVisitor<T> visitor);

  /** Renders this node with the default operator symbols, fully parenthesized. */
  @Override
  public String toString() {
    return accept(NodeRenderer.INSTANCE);
  }
}
