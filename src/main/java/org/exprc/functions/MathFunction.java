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

package org.exprc.functions;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import org.exprc.nodes.TypeRules;
import org.exprc.nodes.ValueType;
import org.jspecify.annotations.Nullable;

/**
 * A function that can be called from an expression, identified by its name and its arity.
 *
 * <p>As with the operators, {@link #resultType} says which argument types are accepted and what
 * they produce, and {@link #apply} must only be called with arguments that were accepted.
 */
public final class MathFunction {

  /** Computes a function's value. */
  @FunctionalInterface
  public interface Implementation {
    /**
     * Applies the function to canonical values.
     *
     * @param result the type computed by the function's typing rule for these arguments
     */
    Object apply(ValueType result, Object[] args);
  }

  public final String name;
  public final int arity;

  /** Argument names, used only to describe the function. */
  public final ImmutableList<String> argNames;

  /** False if the function may return different results for the same arguments. */
  public final boolean deterministic;

  private final TypeRules.Rule rule;
  private final Implementation implementation;

  private MathFunction(
      String name,
      ImmutableList<String> argNames,
      boolean deterministic,
      TypeRules.Rule rule,
      Implementation implementation) {
    Preconditions.checkArgument(!name.isEmpty(), "Function name may not be empty");
    this.name = name;
    this.arity = argNames.size();
    this.argNames = argNames;
    this.deterministic = deterministic;
    this.rule = rule;
    this.implementation = implementation;
  }

  /** Returns a deterministic function with the given argument names. */
  public static MathFunction of(
      String name, ImmutableList<String> argNames, TypeRules.Rule rule, Implementation impl) {
    return new MathFunction(name, argNames, true, rule, impl);
  }

  /** Returns a function that may produce a different result on each call. */
  public static MathFunction nondeterministic(
      String name, ImmutableList<String> argNames, TypeRules.Rule rule, Implementation impl) {
    return new MathFunction(name, argNames, false, rule, impl);
  }

  /** Returns the type produced for the given argument types, or null if they're not accepted. */
  public @Nullable ValueType resultType(ValueType... argTypes) {
    Preconditions.checkArgument(argTypes.length == arity);
    return rule.resultType(argTypes);
  }

  /** The typing rule, for use with {@link TypeRules#resolve(TypeRules.Rule, java.util.List)}. */
  public TypeRules.Rule rule() {
    return rule;
  }

  public Object apply(ValueType result, Object... args) {
    Preconditions.checkArgument(args.length == arity);
    return implementation.apply(result, args);
  }

  /** Returns a description of this function's signature, e.g. {@code "min(a, b)"}. */
  public String signature() {
    return name + "(" + String.join(", ", argNames) + ")";
  }

  /** The key used to look up a function by name and arity. */
  static String key(String name, int arity) {
    return name + ":" + arity;
  }

  @Override
  public String toString() {
    return signature();
  }
}
