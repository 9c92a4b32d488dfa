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

/** All errors detected while compiling an expression throw a CompileError. */
public class CompileError extends RuntimeException {

  public enum Kind {
    /** A parameter name that is empty, malformed, or reserved for placeholders. */
    INVALID_IDENTIFIER("Invalid identifier"),
    /** Two symbols were registered under the same key; indicates a compiler bug. */
    DUPLICATE_SYMBOL_KEY("Duplicate symbol key"),
    INCOMPATIBLE_OPERAND_TYPES("Incompatible operand types"),
    /** No function with the given name takes the given number of arguments. */
    UNKNOWN_FUNCTION("Unknown function");

    final String description;

    Kind(String description) {
      this.description = description;
    }
  }

  public final Kind kind;
  public final String msg;

  /** The offending text: a sub-expression, parameter name, symbol key or function call. */
  public final String text;

  public CompileError(Kind kind, String text) {
    this(kind, kind.description, text);
  }

  public CompileError(Kind kind, String msg, String text) {
    super(msg);
    this.kind = kind;
    this.msg = msg;
    this.text = text;
  }

  @Override
  public String getMessage() {
    return String.format("%s (%s)", msg, text);
  }
}
