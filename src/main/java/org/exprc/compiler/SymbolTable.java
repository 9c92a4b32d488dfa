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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ListMultimap;
import com.google.common.collect.MultimapBuilder;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * The sub-expressions of one compilation, keyed by placeholder.
 *
 * <p>The top-level expression is stored under the empty key at level 0; every other symbol has a
 * key of the form {@code item0001}, numbered in order of creation. Symbols can be enumerated in
 * creation order (by index, so that a pass may keep processing symbols added while it runs) or in
 * ascending level order.
 *
 * <p>A reverse index maps each symbol's current text to its key, so that the same sub-expression
 * discovered twice is given the same placeholder.
 */
public final class SymbolTable {
  /** The key of the top-level expression. */
  public static final String ROOT = "";

  static final String KEY_PREFIX = "item";

  private final Map<String, ExpressionSymbol> byKey = new HashMap<>();
  private final List<ExpressionSymbol> inOrder = new ArrayList<>();
  private final Map<String, String> keyByText = new HashMap<>();
  private final ListMultimap<Integer, ExpressionSymbol> byLevel =
      MultimapBuilder.treeKeys().arrayListValues().build();

  /**
   * Adds a symbol.
   *
   * @throws CompileError of kind DUPLICATE_SYMBOL_KEY if {@code key} is already in use
   */
  @CanIgnoreReturnValue
  public ExpressionSymbol add(String key, String expression, boolean isFunctionCall, int level) {
    Preconditions.checkArgument(level >= 0);
    if (byKey.containsKey(key)) {
      throw new CompileError(CompileError.Kind.DUPLICATE_SYMBOL_KEY, key);
    }
    ExpressionSymbol symbol = new ExpressionSymbol(key, expression, isFunctionCall, level);
    byKey.put(key, symbol);
    inOrder.add(symbol);
    byLevel.put(level, symbol);
    keyByText.putIfAbsent(expression, key);
    return symbol;
  }

  /** Returns the key the next symbol should be given. */
  public String nextKey() {
    // The root takes no number, so the first generated key is item0001.
    return String.format("%s%04d", KEY_PREFIX, inOrder.size());
  }

  /**
   * Returns the key of the symbol whose text is {@code expression}, adding a new symbol if there is
   * none.
   */
  public String keyFor(String expression, boolean isFunctionCall, int level) {
    String key = keyByText.get(expression);
    if (key == null || key.equals(ROOT)) {
      key = nextKey();
      add(key, expression, isFunctionCall, level);
    }
    return key;
  }

  /** Returns the key of an existing symbol whose text is {@code expression}, or null. */
  public @Nullable String findKey(String expression) {
    return keyByText.get(expression);
  }

  public boolean contains(String key) {
    return byKey.containsKey(key);
  }

  public ExpressionSymbol get(String key) {
    ExpressionSymbol result = byKey.get(key);
    Preconditions.checkArgument(result != null, "No symbol '%s'", key);
    return result;
  }

  /** Returns the {@code index}th symbol in creation order. */
  public ExpressionSymbol get(int index) {
    return inOrder.get(index);
  }

  public void setExpression(String key, String expression) {
    ExpressionSymbol symbol = get(key);
    if (key.equals(keyByText.get(symbol.expression()))) {
      keyByText.remove(symbol.expression());
    }
    symbol.setExpression(expression);
    keyByText.putIfAbsent(expression, key);
  }

  public int count() {
    return inOrder.size();
  }

  /** Returns all symbols in ascending level order, in creation order within a level. */
  public ImmutableList<ExpressionSymbol> inLevelOrder() {
    return ImmutableList.copyOf(byLevel.values());
  }

  /** Returns all symbols in creation order. */
  public ImmutableList<ExpressionSymbol> symbols() {
    return ImmutableList.copyOf(inOrder);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    inOrder.forEach(s -> sb.append(s).append('\n'));
    return sb.toString();
  }
}
