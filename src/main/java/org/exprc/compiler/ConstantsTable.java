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
import com.google.common.collect.ImmutableMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import org.exprc.MathDefinition;
import org.exprc.literals.ConstantInterpreter;
import org.exprc.nodes.ConstantNode;
import org.jspecify.annotations.Nullable;

/**
 * The constants of one compilation, keyed by placeholder, together with the recognizer that
 * decides whether a token is a literal.
 *
 * <p>Literals are given keys of the form {@code const0001}; a named constant is keyed by its name.
 * Each distinct literal text maps to exactly one key and one ConstantNode.
 */
public final class ConstantsTable {
  static final String KEY_PREFIX = "const";

  private final MathDefinition definition;

  /** Maps each name and alias of a named constant to its definition. */
  private final ImmutableMap<String, MathDefinition.NamedConstant> named;

  private final Map<String, ConstantNode> byKey = new LinkedHashMap<>();
  private final Map<String, String> keyByText = new HashMap<>();
  private int numGenerated;

  ConstantsTable(MathDefinition definition) {
    this.definition = definition;
    ImmutableMap.Builder<String, MathDefinition.NamedConstant> builder = ImmutableMap.builder();
    for (MathDefinition.NamedConstant c : definition.namedConstants) {
      builder.put(c.name, c);
      c.aliases.forEach(alias -> builder.put(alias, c));
    }
    this.named = builder.buildKeepingLast();
  }

  /**
   * If {@code text} is a literal or a named constant, returns its key (registering it if this is
   * the first time it has been seen); otherwise returns null.
   *
   * <p>Repeated calls with the same text return the same key and add nothing.
   */
  public @Nullable String checkAndAdd(String text) {
    String key = keyByText.get(text);
    if (key != null) {
      return key;
    }
    MathDefinition.NamedConstant namedConstant = named.get(text);
    if (namedConstant != null) {
      key = namedConstant.name;
      byKey.computeIfAbsent(key, k -> new ConstantNode(namedConstant.value, k));
      keyByText.put(text, key);
      return key;
    }
    for (ConstantInterpreter interpreter : definition.interpreters) {
      Object value = interpreter.interpret(text);
      if (value != null) {
        return register(text, value);
      }
    }
    return null;
  }

  /**
   * Registers a string literal.
   *
   * @param literal the literal as written, including its delimiters
   * @param value the string it denotes
   */
  public String addString(String literal, String value) {
    String key = keyByText.get(literal);
    return (key != null) ? key : register(literal, value);
  }

  private String register(String text, Object value) {
    String key = String.format("%s%04d", KEY_PREFIX, ++numGenerated);
    Preconditions.checkState(!byKey.containsKey(key));
    byKey.put(key, new ConstantNode(value, text));
    keyByText.put(text, key);
    return key;
  }

  public boolean containsKey(String key) {
    return byKey.containsKey(key);
  }

  /** Returns the key already assigned to a literal text, or null. */
  public @Nullable String findKey(String text) {
    return keyByText.get(text);
  }

  public ConstantNode get(String key) {
    ConstantNode result = byKey.get(key);
    Preconditions.checkArgument(result != null, "No constant '%s'", key);
    return result;
  }

  public int size() {
    return byKey.size();
  }
}
