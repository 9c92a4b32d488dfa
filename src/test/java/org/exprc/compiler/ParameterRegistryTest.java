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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import junitparams.JUnitParamsRunner;
import junitparams.Parameters;
import org.exprc.nodes.ParameterNode;
import org.junit.Test;
import org.junit.runner.RunWith;

@RunWith(JUnitParamsRunner.class)
public class ParameterRegistryTest {

  @Test
  @Parameters({"x", "_tmp", "row.count", "größe", "a1_b2"})
  public void validNames(String name) {
    ParameterRegistry parameters = new ParameterRegistry();
    ParameterNode param = parameters.getOrCreate(name);
    assertThat(param.name).isEqualTo(name);
    assertThat(parameters.getOrCreate(name)).isSameInstanceAs(param);
    assertThat(parameters.exists(name)).isTrue();
  }

  @Test
  @Parameters({"2x", "a$b", ".x", "item0001", "const0012", "item12345"})
  public void invalidNames(String name) {
    ParameterRegistry parameters = new ParameterRegistry();
    CompileError e = assertThrows(CompileError.class, () -> parameters.getOrCreate(name));
    assertThat(e.kind).isEqualTo(CompileError.Kind.INVALID_IDENTIFIER);
    assertThat(e.text).isEqualTo(name);
    assertThat(parameters.size()).isEqualTo(0);
  }

  @Test
  public void emptyName() {
    CompileError e =
        assertThrows(CompileError.class, () -> new ParameterRegistry().getOrCreate(""));
    assertThat(e.msg).isEqualTo("Empty parameter name");
  }

  @Test
  public void placeholderLikeNamesThatAreNotReserved() {
    assertThat(ParameterRegistry.isReserved("item1")).isFalse();
    assertThat(ParameterRegistry.isReserved("items0001")).isFalse();
    assertThat(ParameterRegistry.isReserved("item0001")).isTrue();
  }

  @Test
  public void positions() {
    ParameterRegistry parameters = new ParameterRegistry();
    parameters.getOrCreate("z");
    parameters.getOrCreate("y");
    parameters.getOrCreate("unused");
    parameters.assignPositions(ImmutableList.of("y", "3", "z", "y"));
    assertThat(parameters.get("y").position()).isEqualTo(0);
    assertThat(parameters.get("z").position()).isEqualTo(1);
    assertThat(parameters.get("unused").position()).isEqualTo(2);
    assertThat(Lists.transform(parameters.inPositionOrder(), p -> p.name))
        .containsExactly("y", "z", "unused")
        .inOrder();
  }

  @Test
  public void sealed() {
    ParameterRegistry parameters = new ParameterRegistry();
    parameters.getOrCreate("x");
    parameters.assignPositions(ImmutableList.of("x"));
    parameters.seal();
    assertThat(parameters.getOrCreate("x").position()).isEqualTo(0);
    assertThrows(IllegalStateException.class, () -> parameters.getOrCreate("y"));
  }
}
