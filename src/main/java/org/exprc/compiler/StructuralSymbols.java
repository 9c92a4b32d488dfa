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
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.Set;
import org.exprc.MathDefinition;
import org.exprc.nodes.BinaryOperator;
import org.exprc.nodes.UnaryOperator;
import org.jspecify.annotations.Nullable;

/**
 * The tokens that separate the pieces of an expression: every operator symbol, the parentheses and
 * the parameter separator.
 *
 * <p>At each position the longest matching symbol wins, so with the default definition {@code
 * a<=b} contains the single symbol {@code <=}.
 */
public final class StructuralSymbols {

  /** A piece of text that is either a single symbol or a run of text between symbols. */
  public static final class Token {
    public final String text;
    public final int start;
    public final boolean isSymbol;

    Token(String text, int start, boolean isSymbol) {
      this.text = text;
      this.start = start;
      this.isSymbol = isSymbol;
    }

    public int end() {
      return start + text.length();
    }

    @Override
    public String toString() {
      return isSymbol ? "'" + text + "'" : text;
    }
  }

  public final String open;
  public final String close;
  public final String separator;

  /** Longest first. */
  private final ImmutableList<String> symbols;

  private final ImmutableMap<String, BinaryOperator> binaryOperators;
  private final ImmutableMap<String, UnaryOperator> unaryOperators;

  public StructuralSymbols(MathDefinition definition) {
    this.open = definition.openParenthesis;
    this.close = definition.closeParenthesis;
    this.separator = definition.parameterSeparator;
    Set<String> all = new LinkedHashSet<>();
    all.add(open);
    all.add(close);
    all.add(separator);
    all.addAll(definition.binaryOperators.values());
    all.addAll(definition.unaryOperators.values());
    this.symbols =
        all.stream()
            .sorted(Comparator.comparingInt(String::length).reversed())
            .collect(ImmutableList.toImmutableList());
    this.binaryOperators =
        definition.binaryOperators.entrySet().stream()
            .collect(ImmutableMap.toImmutableMap(e -> e.getValue(), e -> e.getKey()));
    this.unaryOperators =
        definition.unaryOperators.entrySet().stream()
            .collect(ImmutableMap.toImmutableMap(e -> e.getValue(), e -> e.getKey()));
  }

  /** Returns the length of the longest symbol starting at {@code pos}, or 0 if there is none. */
  public int symbolLengthAt(String text, int pos) {
    for (String symbol : symbols) {
      if (text.startsWith(symbol, pos)) {
        return symbol.length();
      }
    }
    return 0;
  }

  /** True if the text before {@code pos} ends with a symbol. */
  public boolean isPrecededBySymbol(String text, int pos) {
    for (String symbol : symbols) {
      int start = pos - symbol.length();
      if (start >= 0 && text.startsWith(symbol, start)) {
        return true;
      }
    }
    return false;
  }

  /** Splits {@code text} into symbols and the (non-empty) runs of text between them. */
  public ImmutableList<Token> tokenize(String text) {
    ImmutableList.Builder<Token> tokens = ImmutableList.builder();
    int fragmentStart = 0;
    int pos = 0;
    while (pos < text.length()) {
      int length = symbolLengthAt(text, pos);
      if (length == 0) {
        pos++;
        continue;
      }
      if (pos > fragmentStart) {
        tokens.add(new Token(text.substring(fragmentStart, pos), fragmentStart, false));
      }
      tokens.add(new Token(text.substring(pos, pos + length), pos, true));
      pos += length;
      fragmentStart = pos;
    }
    if (text.length() > fragmentStart) {
      tokens.add(new Token(text.substring(fragmentStart), fragmentStart, false));
    }
    return tokens.build();
  }

  /** Returns the non-empty runs of text between symbols. */
  public ImmutableList<String> split(String text) {
    return tokenize(text).stream()
        .filter(t -> !t.isSymbol)
        .map(t -> t.text)
        .collect(ImmutableList.toImmutableList());
  }

  /** Returns the text after the last symbol in {@code text}, or "" if it ends with a symbol. */
  public String lastFragment(String text) {
    ImmutableList<Token> tokens = tokenize(text);
    if (tokens.isEmpty()) {
      return "";
    }
    Token last = tokens.get(tokens.size() - 1);
    return last.isSymbol ? "" : last.text;
  }

  /**
   * Returns the index of the close parenthesis matching the open parenthesis at {@code openIndex},
   * or -1 if it has none.
   *
   * <p>Each open found before the next close pushes the search for both one step further.
   */
  public int closeFor(String text, int openIndex) {
    int start = openIndex + open.length();
    int nextOpen = text.indexOf(open, start);
    int nextClose = text.indexOf(close, start);
    while (nextOpen != -1 && nextClose != -1 && nextOpen < nextClose) {
      nextOpen = text.indexOf(open, nextOpen + open.length());
      nextClose = text.indexOf(close, nextClose + close.length());
    }
    return nextClose;
  }

  public @Nullable BinaryOperator binaryOperator(String symbol) {
    return binaryOperators.get(symbol);
  }

  public @Nullable UnaryOperator unaryOperator(String symbol) {
    return unaryOperators.get(symbol);
  }
}
