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

import static org.exprc.nodes.Values.asDouble;
import static org.exprc.nodes.Values.asLong;

import com.google.common.base.CharMatcher;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleUnaryOperator;
import java.util.function.LongUnaryOperator;
import org.exprc.nodes.ValueType;
import org.exprc.nodes.Values;
import org.jspecify.annotations.Nullable;

/**
 * The functions that can be called from an expression, keyed by name and arity (so e.g. {@code
 * round(x)} and {@code round(x, digits)} are two different functions).
 *
 * <p>FunctionLibraries are immutable; use a {@link Builder} to create one, or {@link #standard} for
 * the built-in set.
 */
public final class FunctionLibrary {

  /** Keyed by "name:arity"; linked to preserve registration order. */
  private final ImmutableMap<String, MathFunction> functions;

  private FunctionLibrary(ImmutableMap<String, MathFunction> functions) {
    this.functions = functions;
  }

  /** Returns the function with the given name and arity, or null if there is none. */
  public @Nullable MathFunction lookup(String name, int arity) {
    return functions.get(MathFunction.key(name, arity));
  }

  /** Returns the signature of each function, in registration order. */
  public ImmutableList<String> signatures() {
    return functions.values().stream()
        .map(MathFunction::signature)
        .collect(ImmutableList.toImmutableList());
  }

  public int size() {
    return functions.size();
  }

  /** Returns a Builder initialized with the functions of this library. */
  public Builder toBuilder() {
    Builder builder = new Builder();
    builder.functions.putAll(functions);
    return builder;
  }

  /** Accumulates functions for a new FunctionLibrary. */
  public static final class Builder {
    private final Map<String, MathFunction> functions = new LinkedHashMap<>();

    /** Adds a function, replacing any previous function with the same name and arity. */
    @CanIgnoreReturnValue
    public Builder add(MathFunction fn) {
      functions.put(MathFunction.key(fn.name, fn.arity), fn);
      return this;
    }

    public FunctionLibrary build() {
      return new FunctionLibrary(ImmutableMap.copyOf(functions));
    }
  }

  private static final FunctionLibrary STANDARD = createStandard();

  /** Returns the built-in functions. */
  public static FunctionLibrary standard() {
    return STANDARD;
  }

  private static FunctionLibrary createStandard() {
    Builder builder = new Builder();

    builder.add(
        MathFunction.nondeterministic(
            "random",
            ImmutableList.of(),
            types -> ValueType.FLOAT,
            (result, args) -> ThreadLocalRandom.current().nextDouble()));

    builder.add(preservingNumeric("abs", Math::absExact, Math::abs));
    builder.add(preservingNumeric("ceiling", LongUnaryOperator.identity(), Math::ceil));
    builder.add(preservingNumeric("floor", LongUnaryOperator.identity(), Math::floor));
    // Midpoints round to even.
    builder.add(preservingNumeric("round", LongUnaryOperator.identity(), Math::rint));
    builder.add(floating("sqrt", Math::sqrt));
    builder.add(floating("exp", Math::exp));
    builder.add(floating("ln", Math::log));
    builder.add(floating("lg", Math::log10));
    builder.add(floating("sin", Math::sin));
    builder.add(floating("cos", Math::cos));
    builder.add(floating("tan", Math::tan));
    builder.add(floating("asin", Math::asin));
    builder.add(floating("acos", Math::acos));
    builder.add(floating("atan", Math::atan));
    builder.add(floating("sinh", Math::sinh));
    builder.add(floating("cosh", Math::cosh));
    builder.add(floating("tanh", Math::tanh));
    builder.add(
        MathFunction.of(
            "trim",
            ImmutableList.of("text"),
            types -> (types[0] == ValueType.STRING) ? ValueType.STRING : null,
            (result, args) -> CharMatcher.whitespace().trimFrom((String) args[0])));
    builder.add(
        MathFunction.of(
            "strlen",
            ImmutableList.of("text"),
            types -> (types[0] == ValueType.STRING) ? ValueType.INTEGER : null,
            (result, args) -> (long) ((String) args[0]).length()));

    builder.add(
        MathFunction.of(
            "min",
            ImmutableList.of("a", "b"),
            FunctionLibrary::promoted,
            (result, args) -> pick(result, args, Values.compareNumbers(args[0], args[1]) <= 0)));
    builder.add(
        MathFunction.of(
            "max",
            ImmutableList.of("a", "b"),
            FunctionLibrary::promoted,
            (result, args) -> pick(result, args, Values.compareNumbers(args[0], args[1]) >= 0)));
    builder.add(
        MathFunction.of(
            "pow",
            ImmutableList.of("base", "exponent"),
            FunctionLibrary::allNumericToFloat,
            (result, args) -> Math.pow(asDouble(args[0]), asDouble(args[1]))));
    builder.add(
        MathFunction.of(
            "log",
            ImmutableList.of("x", "base"),
            FunctionLibrary::allNumericToFloat,
            (result, args) -> Math.log(asDouble(args[0])) / Math.log(asDouble(args[1]))));
    builder.add(
        MathFunction.of(
            "round",
            ImmutableList.of("x", "digits"),
            types -> (types[0].isNumeric() && types[1].isIntegral()) ? ValueType.FLOAT : null,
            (result, args) -> roundToDigits(asDouble(args[0]), asLong(args[1]))));
    builder.add(
        MathFunction.nondeterministic(
            "randomint",
            ImmutableList.of("min", "max"),
            types -> (types[0].isIntegral() && types[1].isIntegral()) ? ValueType.INTEGER : null,
            (result, args) -> randomInt(asLong(args[0]), asLong(args[1]))));
    builder.add(
        MathFunction.of(
            "substring",
            ImmutableList.of("text", "start"),
            types ->
                (types[0] == ValueType.STRING && types[1].isIntegral()) ? ValueType.STRING : null,
            (result, args) -> ((String) args[0]).substring(Math.toIntExact(asLong(args[1])))));
    builder.add(
        MathFunction.of(
            "trim",
            ImmutableList.of("text", "chars"),
            types -> allStrings(types) ? ValueType.STRING : null,
            (result, args) -> CharMatcher.anyOf((String) args[1]).trimFrom((String) args[0])));

    builder.add(
        MathFunction.of(
            "substring",
            ImmutableList.of("text", "start", "length"),
            types ->
                (types[0] == ValueType.STRING && types[1].isIntegral() && types[2].isIntegral())
                    ? ValueType.STRING
                    : null,
            (result, args) -> substring((String) args[0], asLong(args[1]), asLong(args[2]))));
    builder.add(
        MathFunction.of(
            "replace",
            ImmutableList.of("text", "find", "replacement"),
            types -> allStrings(types) ? ValueType.STRING : null,
            (result, args) -> ((String) args[0]).replace((String) args[1], (String) args[2])));

    return builder.build();
  }

  /** A one-argument numeric function that always produces a FLOAT. */
  private static MathFunction floating(String name, DoubleUnaryOperator fn) {
    return MathFunction.of(
        name,
        ImmutableList.of("x"),
        types -> types[0].isNumeric() ? ValueType.FLOAT : null,
        (result, args) -> fn.applyAsDouble(asDouble(args[0])));
  }

  /**
   * A one-argument numeric function that produces an INTEGER from an integral argument and a FLOAT
   * from a FLOAT.
   */
  private static MathFunction preservingNumeric(
      String name, LongUnaryOperator integerFn, DoubleUnaryOperator floatFn) {
    return MathFunction.of(
        name,
        ImmutableList.of("x"),
        types -> types[0].isNumeric() ? ValueType.arithmetic(types[0], types[0]) : null,
        (result, args) -> {
          if (result == ValueType.INTEGER) {
            return integerFn.applyAsLong(asLong(args[0]));
          }
          return floatFn.applyAsDouble(asDouble(args[0]));
        });
  }

  private static @Nullable ValueType promoted(ValueType[] types) {
    return (types[0].isNumeric() && types[1].isNumeric())
        ? ValueType.arithmetic(types[0], types[1])
        : null;
  }

  private static @Nullable ValueType allNumericToFloat(ValueType[] types) {
    for (ValueType type : types) {
      if (!type.isNumeric()) {
        return null;
      }
    }
    return ValueType.FLOAT;
  }

  private static boolean allStrings(ValueType[] types) {
    for (ValueType type : types) {
      if (type != ValueType.STRING) {
        return false;
      }
    }
    return true;
  }

  /** Returns {@code args[0]} if {@code first} is true, otherwise {@code args[1]}. */
  private static Object pick(ValueType result, Object[] args, boolean first) {
    Object chosen = first ? args[0] : args[1];
    if (result == ValueType.INTEGER) {
      return asLong(chosen);
    }
    return asDouble(chosen);
  }

  private static double roundToDigits(double x, long digits) {
    if (Double.isNaN(x) || Double.isInfinite(x)) {
      return x;
    }
    return BigDecimal.valueOf(x)
        .setScale(Math.toIntExact(digits), RoundingMode.HALF_EVEN)
        .doubleValue();
  }

  /** Returns a random integer in [min, max), or min if the range is empty. */
  private static long randomInt(long min, long max) {
    return (max <= min) ? min : ThreadLocalRandom.current().nextLong(min, max);
  }

  private static String substring(String text, long start, long length) {
    int from = Math.toIntExact(start);
    return text.substring(from, Math.addExact(from, Math.toIntExact(length)));
  }
}
