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
import com.google.common.collect.ImmutableMap;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;
import org.exprc.nodes.ParameterNode;

/**
 * The parameters of one compilation. There is one ParameterNode per distinct name; names are
 * compared by value.
 */
public final class ParameterRegistry {

  /** A letter or underscore, followed by letters, digits, underscores and dots. */
  private static final Pattern IDENTIFIER = Pattern.compile("[\\p{L}_][\\p{L}\\p{N}_.]*");

  /** Names of this form are used for placeholders and may not be used as parameter names. */
  private static final Pattern RESERVED =
      Pattern.compile(
          "(" + SymbolTable.KEY_PREFIX + "|" + ConstantsTable.KEY_PREFIX + ")[0-9]{4,}");

  private final Map<String, ParameterNode> byName = new LinkedHashMap<>();
  private boolean sealed;

  public boolean exists(String name) {
    return byName.containsKey(name);
  }

  /**
   * Returns the parameter with the given name, creating it if necessary.
   *
   * @throws CompileError of kind INVALID_IDENTIFIER if {@code name} is not a valid identifier
   */
  public ParameterNode getOrCreate(String name) {
    ParameterNode result = byName.get(name);
    if (result == null) {
      checkIdentifier(name);
      Preconditions.checkState(!sealed);
      result = new ParameterNode(name);
      byName.put(name, result);
    }
    return result;
  }

  public ParameterNode get(String name) {
    ParameterNode result = byName.get(name);
    Preconditions.checkArgument(result != null, "No parameter '%s'", name);
    return result;
  }

  public int size() {
    return byName.size();
  }

  /**
   * Gives each parameter a position: the rank of its first appearance in {@code tokens}.
   * Parameters that don't appear are numbered after those that do, in order of creation.
   */
  void assignPositions(Iterable<String> tokens) {
    int next = 0;
    Map<String, Integer> positions = new LinkedHashMap<>();
    for (String token : tokens) {
      if (byName.containsKey(token) && !positions.containsKey(token)) {
        positions.put(token, next++);
      }
    }
    for (String name : byName.keySet()) {
      if (!positions.containsKey(name)) {
        positions.put(name, next++);
      }
    }
    positions.forEach((name, position) -> byName.get(name).assignPosition(position));
  }

  /** Prevents further changes to the registry and to each of its parameters. */
  void seal() {
    sealed = true;
    byName.values().forEach(ParameterNode::seal);
  }

  /** Returns the parameters ordered by position; only valid after positions are assigned. */
  public ImmutableList<ParameterNode> inPositionOrder() {
    return byName.values().stream()
        .sorted(Comparator.comparingInt(ParameterNode::position))
        .collect(ImmutableList.toImmutableList());
  }

  public ImmutableMap<String, ParameterNode> byName() {
    return ImmutableMap.copyOf(byName);
  }

  static boolean isReserved(String name) {
    return RESERVED.matcher(name).matches();
  }

  private static void checkIdentifier(String name) {
    if (name.isEmpty()) {
      throw new CompileError(CompileError.Kind.INVALID_IDENTIFIER, "Empty parameter name", name);
    } else if (!IDENTIFIER.matcher(name).matches()) {
      throw new CompileError(CompileError.Kind.INVALID_IDENTIFIER, name);
    } else if (isReserved(name)) {
      throw new CompileError(
          CompileError.Kind.INVALID_IDENTIFIER, "Reserved for internal use", name);
    }
  }
}
