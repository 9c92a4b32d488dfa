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

package org.exprc;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.exprc.literals.ConstantInterpreter;
import org.exprc.literals.StandardInterpreters;
import org.exprc.nodes.BinaryOperator;
import org.exprc.nodes.UnaryOperator;
import org.jspecify.annotations.Nullable;

/**
 * The lexical conventions of an expression language: its structural tokens, operator symbols,
 * named constants, and the literal forms it accepts.
 *
 * <p>Every token may be more than one character long. MathDefinitions are immutable; use {@link
 * #builder} (or {@link #toBuilder} to start from an existing one).
 */
public final class MathDefinition {

  /** A constant referred to by name, such as {@code π}, optionally with alternate spellings. */
  public static final class NamedConstant {
    public final String name;
    public final ImmutableList<String> aliases;
    public final Object value;

    NamedConstant(String name, ImmutableList<String> aliases, Object value) {
      this.name = name;
      this.aliases = aliases;
      this.value = value;
    }

    @Override
    public String toString() {
      return name;
    }
  }

  public final String openParenthesis;
  public final String closeParenthesis;
  public final String parameterSeparator;
  public final String stringIndicator;
  public final String escapeCharacter;
  public final String hexPrefix;
  public final String binaryPrefix;
  public final ImmutableMap<BinaryOperator, String> binaryOperators;
  public final ImmutableMap<UnaryOperator, String> unaryOperators;
  public final ImmutableList<NamedConstant> namedConstants;
  public final ImmutableList<ConstantInterpreter> interpreters;

  /** If true, operations whose operands are all constant are replaced by their value. */
  public final boolean foldConstants;

  private MathDefinition(Builder builder, ImmutableList<ConstantInterpreter> interpreters) {
    this.openParenthesis = builder.openParenthesis;
    this.closeParenthesis = builder.closeParenthesis;
    this.parameterSeparator = builder.parameterSeparator;
    this.stringIndicator = builder.stringIndicator;
    this.escapeCharacter = builder.escapeCharacter;
    this.hexPrefix = builder.hexPrefix;
    this.binaryPrefix = builder.binaryPrefix;
    this.binaryOperators = ImmutableMap.copyOf(builder.binaryOperators);
    this.unaryOperators = ImmutableMap.copyOf(builder.unaryOperators);
    this.namedConstants = ImmutableList.copyOf(builder.namedConstants.values());
    this.interpreters = interpreters;
    this.foldConstants = builder.foldConstants;
  }

  private static final MathDefinition STANDARD = builder().build();

  /** Returns the default definition. */
  public static MathDefinition standard() {
    return STANDARD;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Returns a Builder initialized with this definition's settings. */
  public Builder toBuilder() {
    Builder builder = new Builder();
    builder.openParenthesis = openParenthesis;
    builder.closeParenthesis = closeParenthesis;
    builder.parameterSeparator = parameterSeparator;
    builder.stringIndicator = stringIndicator;
    builder.escapeCharacter = escapeCharacter;
    builder.hexPrefix = hexPrefix;
    builder.binaryPrefix = binaryPrefix;
    builder.binaryOperators.putAll(binaryOperators);
    builder.unaryOperators.putAll(unaryOperators);
    builder.namedConstants.clear();
    namedConstants.forEach(c -> builder.namedConstants.put(c.name, c));
    builder.interpreters = interpreters;
    builder.foldConstants = foldConstants;
    return builder;
  }

  /** Accumulates settings for a new MathDefinition; starts with the defaults. */
  public static final class Builder {
    private String openParenthesis = "(";
    private String closeParenthesis = ")";
    private String parameterSeparator = ",";
    private String stringIndicator = "\"";
    private String escapeCharacter = "\\";
    private String hexPrefix = "0x";
    private String binaryPrefix = "0b";
    private final Map<BinaryOperator, String> binaryOperators = new EnumMap<>(BinaryOperator.class);
    private final Map<UnaryOperator, String> unaryOperators = new EnumMap<>(UnaryOperator.class);
    private final Map<String, NamedConstant> namedConstants = new LinkedHashMap<>();
    // Null means the standard interpreters for the configured prefixes.
    private @Nullable ImmutableList<ConstantInterpreter> interpreters;
    private boolean foldConstants = true;

    private Builder() {
      for (BinaryOperator op : BinaryOperator.values()) {
        binaryOperators.put(op, op.defaultSymbol);
      }
      for (UnaryOperator op : UnaryOperator.values()) {
        unaryOperators.put(op, op.defaultSymbol);
      }
      namedConstant("e", Math.E);
      namedConstant("π", Math.PI, "[pi]");
      namedConstant("φ", 1.618033988749894848, "[phi]");
      namedConstant("β", 0.280169499023869133, "[beta]");
      namedConstant("γ", 0.577215664901532860, "[gamma]");
      namedConstant("λ", 0.303663002898732658, "[lambda]");
    }

    @CanIgnoreReturnValue
    public Builder parentheses(String open, String close) {
      this.openParenthesis = open;
      this.closeParenthesis = close;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder parameterSeparator(String separator) {
      this.parameterSeparator = separator;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder stringLiterals(String indicator, String escape) {
      this.stringIndicator = indicator;
      this.escapeCharacter = escape;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder hexPrefix(String prefix) {
      this.hexPrefix = prefix;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder binaryPrefix(String prefix) {
      this.binaryPrefix = prefix;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder operator(BinaryOperator op, String symbol) {
      binaryOperators.put(op, symbol);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder operator(UnaryOperator op, String symbol) {
      unaryOperators.put(op, symbol);
      return this;
    }

    /** Adds (or replaces) a named constant; each alias is an alternate spelling of the name. */
    @CanIgnoreReturnValue
    public Builder namedConstant(String name, Object value, String... aliases) {
      Preconditions.checkArgument(!name.isEmpty(), "Constant name may not be empty");
      namedConstants.put(name, new NamedConstant(name, ImmutableList.copyOf(aliases), value));
      return this;
    }

    @CanIgnoreReturnValue
    public Builder clearNamedConstants() {
      namedConstants.clear();
      return this;
    }

    /**
     * Replaces the literal forms accepted, in the order they are tried. If never called, the
     * standard interpreters are used with the configured hex and binary prefixes.
     */
    @CanIgnoreReturnValue
    public Builder interpreters(List<ConstantInterpreter> interpreters) {
      this.interpreters = ImmutableList.copyOf(interpreters);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder foldConstants(boolean foldConstants) {
      this.foldConstants = foldConstants;
      return this;
    }

    public MathDefinition build() {
      checkToken(openParenthesis, "open parenthesis");
      checkToken(closeParenthesis, "close parenthesis");
      checkToken(parameterSeparator, "parameter separator");
      checkToken(stringIndicator, "string indicator");
      checkToken(escapeCharacter, "escape character");
      Preconditions.checkArgument(
          !openParenthesis.equals(closeParenthesis)
              && !openParenthesis.equals(parameterSeparator)
              && !closeParenthesis.equals(parameterSeparator),
          "Parentheses and separator must be distinct (%s %s %s)",
          openParenthesis,
          closeParenthesis,
          parameterSeparator);
      Set<String> seen = new HashSet<>();
      binaryOperators.forEach(
          (op, symbol) -> {
            checkToken(symbol, op.name());
            Preconditions.checkArgument(
                seen.add(symbol), "Symbol '%s' is used by more than one binary operator", symbol);
          });
      unaryOperators.forEach((op, symbol) -> checkToken(symbol, op.name()));
      ImmutableList<ConstantInterpreter> interpreters = this.interpreters;
      if (interpreters == null) {
        interpreters = StandardInterpreters.standard(hexPrefix, binaryPrefix);
      }
      return new MathDefinition(this, interpreters);
    }

    private static void checkToken(String token, String what) {
      Preconditions.checkArgument(!token.isEmpty(), "The %s may not be empty", what);
    }
  }
}
