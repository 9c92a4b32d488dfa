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

import com.google.common.collect.Sets;
import java.util.EnumSet;
import java.util.Set;

/**
 * The kinds of value an expression can produce.
 *
 * <p>BOOLEAN, INTEGER and FLOAT form the numeric lattice (in that order, narrowest first); BINARY
 * and STRING stand outside it.
 */
public enum ValueType {
  BOOLEAN(0),
  INTEGER(1),
  FLOAT(2),
  BINARY(-1),
  STRING(-1);

  /** Position in the numeric lattice, or -1 for non-numeric types. */
  private final int rank;

  ValueType(int rank) {
    this.rank = rank;
  }

  public boolean isNumeric() {
    return rank >= 0;
  }

  /** True for BOOLEAN and INTEGER, the types that support bitwise operations and shifts. */
  public boolean isIntegral() {
    return this == BOOLEAN || this == INTEGER;
  }

  /** Returns the wider of two numeric types. */
  public static ValueType wider(ValueType x, ValueType y) {
    assert x.isNumeric() && y.isNumeric();
    return (x.rank >= y.rank) ? x : y;
  }

  /**
   * Returns the result type of an arithmetic operation on two numeric types: the wider of the two,
   * but never narrower than INTEGER.
   */
  public static ValueType arithmetic(ValueType x, ValueType y) {
    return wider(INTEGER, wider(x, y));
  }

  /** Every type; the initial allowed set of a parameter nothing has constrained yet. */
  public static Set<ValueType> all() {
    return EnumSet.allOf(ValueType.class);
  }

  /** The numeric types. */
  public static Set<ValueType> numeric() {
    return EnumSet.of(BOOLEAN, INTEGER, FLOAT);
  }

  /** Returns a new mutable set holding the members of both {@code x} and {@code y}. */
  static Set<ValueType> intersection(Set<ValueType> x, Set<ValueType> y) {
    Set<ValueType> result = EnumSet.noneOf(ValueType.class);
    result.addAll(Sets.intersection(x, y));
    return result;
  }
}
