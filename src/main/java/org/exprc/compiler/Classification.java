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

/** What a piece of expression text refers to; returned by {@link CompilationContext#classify}. */
public final class Classification {

  public enum Kind {
    /** {@link #value} is a key in the ConstantsTable. */
    CONSTANT,
    /** {@link #value} is the name of a registered parameter. */
    PARAMETER,
    /** {@link #value} is a key in the SymbolTable. */
    SYMBOL,
    /** None of the above; {@link #value} is the text itself. */
    UNRECOGNIZED
  }

  public final Kind kind;
  public final String value;

  private Classification(Kind kind, String value) {
    this.kind = kind;
    this.value = value;
  }

  static Classification constant(String key) {
    return new Classification(Kind.CONSTANT, key);
  }

  static Classification parameter(String name) {
    return new Classification(Kind.PARAMETER, name);
  }

  static Classification symbol(String key) {
    return new Classification(Kind.SYMBOL, key);
  }

  static Classification unrecognized(String text) {
    return new Classification(Kind.UNRECOGNIZED, text);
  }

  @Override
  public String toString() {
    return kind + ":" + value;
  }
}
