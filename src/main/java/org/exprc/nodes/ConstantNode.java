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
import java.util.EnumSet;
import java.util.Set;

/**
 * A literal value.
 *
 * <p>Within one compilation every occurrence of the same literal text resolves to the same
 * ConstantNode instance (see ConstantsTable).
 */
public final class ConstantNode extends ExpressionNode {
  private final Object value;
  private final ValueType valueType;

  /** The literal text this constant was recognized from; also used to render it. */
  public final String text;

  /**
   * Creates a ConstantNode.
   *
   * @param value the value, in one of the canonical representations listed in {@link Values}
   * @param text the text this constant is written as
   */
  public ConstantNode(Object value, String text) {
    Preconditions.checkNotNull(value);
    this.valueType = Values.typeOf(value);
    this.value = (value instanceof byte[] bytes) ? bytes.clone() : value;
    this.text = Preconditions.checkNotNull(text);
  }

  /** Creates a ConstantNode for a computed value, rendered as a literal. */
  public static ConstantNode of(Object value) {
    return new ConstantNode(value, Values.render(value));
  }

  /** Returns this constant's value; byte sequences are returned as a copy. */
  public Object value() {
    return (value instanceof byte[] bytes) ? bytes.clone() : value;
  }

  @Override
  public Set<ValueType> possibleTypes() {
    return EnumSet.of(valueType);
  }

  @Override
  public ValueType type() {
    return valueType;
  }

  @Override
  public boolean isConstant() {
    return true;
  }

  @Override
  public <T> T accept(NodeVisitor<T> visitor) {
    return visitor.visitConstant(this);
  }
}
