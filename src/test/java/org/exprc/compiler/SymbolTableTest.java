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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.Lists;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class SymbolTableTest {

  @Test
  public void keysAreNumberedAfterTheRoot() {
    SymbolTable symbols = new SymbolTable();
    symbols.add(SymbolTable.ROOT, "a+b", false, 0);
    assertThat(symbols.nextKey()).isEqualTo("item0001");
    assertThat(symbols.keyFor("c*d", false, 1)).isEqualTo("item0001");
    assertThat(symbols.keyFor("max(a,b)", true, 1)).isEqualTo("item0002");
    assertThat(symbols.count()).isEqualTo(3);
    assertThat(symbols.get(2).key).isEqualTo("item0002");
  }

  @Test
  public void keyForReusesExistingText() {
    SymbolTable symbols = new SymbolTable();
    symbols.add(SymbolTable.ROOT, "x", false, 0);
    String key = symbols.keyFor("x+1", false, 1);
    assertThat(symbols.keyFor("x+1", false, 2)).isEqualTo(key);
    assertThat(symbols.count()).isEqualTo(2);
    assertThat(symbols.findKey("x+1")).isEqualTo(key);
    assertThat(symbols.findKey("x+2")).isNull();
  }

  @Test
  public void keyForNeverReturnsTheRoot() {
    SymbolTable symbols = new SymbolTable();
    symbols.add(SymbolTable.ROOT, "x+1", false, 0);
    assertThat(symbols.keyFor("x+1", false, 1)).isEqualTo("item0001");
  }

  @Test
  public void duplicateKey() {
    SymbolTable symbols = new SymbolTable();
    symbols.add(SymbolTable.ROOT, "x", false, 0);
    symbols.add("item0001", "y", false, 1);
    CompileError e =
        assertThrows(CompileError.class, () -> symbols.add("item0001", "z", false, 1));
    assertThat(e.kind).isEqualTo(CompileError.Kind.DUPLICATE_SYMBOL_KEY);
    assertThat(e.text).isEqualTo("item0001");
  }

  @Test
  public void setExpressionUpdatesLookup() {
    SymbolTable symbols = new SymbolTable();
    symbols.add(SymbolTable.ROOT, "(a)+1", false, 0);
    symbols.setExpression(SymbolTable.ROOT, "item0001+1");
    assertThat(symbols.get(SymbolTable.ROOT).expression()).isEqualTo("item0001+1");
    assertThat(symbols.findKey("(a)+1")).isNull();
    assertThat(symbols.findKey("item0001+1")).isEqualTo(SymbolTable.ROOT);
  }

  @Test
  public void levelOrder() {
    SymbolTable symbols = new SymbolTable();
    symbols.add(SymbolTable.ROOT, "r", false, 0);
    symbols.add("item0001", "a", false, 2);
    symbols.add("item0002", "b", false, 1);
    symbols.add("item0003", "c", false, 2);
    assertThat(Lists.transform(symbols.inLevelOrder(), s -> s.key))
        .containsExactly(SymbolTable.ROOT, "item0002", "item0001", "item0003")
        .inOrder();
  }

  @Test
  public void missingKey() {
    SymbolTable symbols = new SymbolTable();
    assertThat(symbols.contains("item0001")).isFalse();
    assertThrows(IllegalArgumentException.class, () -> symbols.get("item0001"));
  }
}
