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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Sets;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * Lifts a typing rule over concrete operand types to sets of possible operand types.
 *
 * <p>An operand whose type is not yet known (a parameter that hasn't been narrowed to a single
 * type, or an operation on such a parameter) is described by the set of types it may still have.
 * Applying a rule to every combination tells us both what the operation may produce and which
 * operand types can take part in a valid application at all.
 */
public class TypeRules {

  /** A typing rule for an operation with a fixed number of operands. */
  @FunctionalInterface
  public interface Rule {
    /** Returns the result type for the given operand types, or null if they're not accepted. */
    @Nullable ValueType resultType(ValueType[] operands);
  }

  /** The outcome of applying a rule to sets of operand types. */
  public static final class Resolution {
    /** Every type some valid combination produces; empty if there is none. */
    public final Set<ValueType> results;

    /** For each operand, the types that take part in at least one valid combination. */
    public final ImmutableList<Set<ValueType>> usable;

    Resolution(Set<ValueType> results, ImmutableList<Set<ValueType>> usable) {
      this.results = results;
      this.usable = usable;
    }

    public boolean isValid() {
      return !results.isEmpty();
    }
  }

  /** Applies {@code rule} to every combination of types drawn from {@code operands}. */
  public static Resolution resolve(Rule rule, List<Set<ValueType>> operands) {
    int n = operands.size();
    Set<ValueType> results = EnumSet.noneOf(ValueType.class);
    ImmutableList.Builder<Set<ValueType>> usable = ImmutableList.builder();
    List<Set<ValueType>> usableSets = new ArrayList<>(n);
    for (int i = 0; i < n; i++) {
      usableSets.add(EnumSet.noneOf(ValueType.class));
    }
    if (n == 0) {
      ValueType result = rule.resultType(new ValueType[0]);
      if (result != null) {
        results.add(result);
      }
    } else {
      for (List<ValueType> combination : Sets.cartesianProduct(operands)) {
        ValueType result = rule.resultType(combination.toArray(new ValueType[n]));
        if (result != null) {
          results.add(result);
          for (int i = 0; i < n; i++) {
            usableSets.get(i).add(combination.get(i));
          }
        }
      }
    }
    usableSets.forEach(usable::add);
    return new Resolution(results, usable.build());
  }

  /** Resolves a binary operator applied to operands of the given possible types. */
  public static Resolution resolve(
      BinaryOperator op, Set<ValueType> left, Set<ValueType> right) {
    return resolve(types -> op.resultType(types[0], types[1]), ImmutableList.of(left, right));
  }

  /** Resolves a unary operator applied to an operand of the given possible types. */
  public static Resolution resolve(UnaryOperator op, Set<ValueType> operand) {
    return resolve(types -> op.resultType(types[0]), ImmutableList.of(operand));
  }

  private TypeRules() {}
}
