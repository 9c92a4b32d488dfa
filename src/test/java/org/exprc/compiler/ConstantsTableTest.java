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

import com.google.common.collect.ImmutableList;
import org.exprc.MathDefinition;
import org.exprc.literals.StandardInterpreters;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class ConstantsTableTest {

  @Test
  public void literalsGetGeneratedKeys() {
    ConstantsTable constants = new ConstantsTable(MathDefinition.standard());
    assertThat(constants.checkAndAdd("42")).isEqualTo("const0001");
    assertThat(constants.checkAndAdd("1.5")).isEqualTo("const0002");
    assertThat(constants.checkAndAdd("42")).isEqualTo("const0001");
    assertThat(constants.size()).isEqualTo(2);
    assertThat(constants.get("const0001").value()).isEqualTo(42L);
    assertThat(constants.get("const0001").text).isEqualTo("42");
    assertThat(constants.get("const0002").value()).isEqualTo(1.5);
  }

  @Test
  public void nonLiteralsAreNotAdded() {
    ConstantsTable constants = new ConstantsTable(MathDefinition.standard());
    assertThat(constants.checkAndAdd("x")).isNull();
    assertThat(constants.checkAndAdd("0xZZ")).isNull();
    assertThat(constants.size()).isEqualTo(0);
  }

  @Test
  public void namedConstantsAreKeyedByName() {
    ConstantsTable constants = new ConstantsTable(MathDefinition.standard());
    assertThat(constants.checkAndAdd("π")).isEqualTo("π");
    assertThat(constants.checkAndAdd("[pi]")).isEqualTo("π");
    assertThat(constants.size()).isEqualTo(1);
    assertThat(constants.get("π").value()).isEqualTo(Math.PI);
    assertThat(constants.findKey("[pi]")).isEqualTo("π");
  }

  @Test
  public void stringLiterals() {
    ConstantsTable constants = new ConstantsTable(MathDefinition.standard());
    String key = constants.addString("\"a,b\"", "a,b");
    assertThat(constants.addString("\"a,b\"", "a,b")).isEqualTo(key);
    assertThat(constants.get(key).value()).isEqualTo("a,b");
    assertThat(constants.get(key).text).isEqualTo("\"a,b\"");
    assertThat(constants.containsKey(key)).isTrue();
  }

  @Test
  public void interpretersAreTriedInOrder() {
    MathDefinition definition =
        MathDefinition.builder()
            .interpreters(
                ImmutableList.of(StandardInterpreters.FLOATING_POINT, StandardInterpreters.INTEGER))
            .build();
    ConstantsTable constants = new ConstantsTable(definition);
    String key = constants.checkAndAdd("7");
    assertThat(constants.get(key).value()).isEqualTo(7.0);
    // No boolean interpreter
    assertThat(constants.checkAndAdd("true")).isNull();
  }
}
