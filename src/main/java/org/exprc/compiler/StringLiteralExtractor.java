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

import org.exprc.MathDefinition;
import org.jspecify.annotations.Nullable;

/**
 * The first compilation pass: replaces each string literal with a constant placeholder, so that
 * later passes never see the literal's contents (which may include whitespace, parentheses or
 * operator symbols).
 *
 * <p>Within a literal, the escape character followed by the string indicator stands for the
 * indicator, and the escape character followed by itself stands for one escape character; any
 * other escape character is kept as is. An unterminated literal is left in the text unchanged.
 */
class StringLiteralExtractor {

  static String extract(CompilationContext context, String text) {
    String indicator = context.definition.stringIndicator;
    String escape = context.definition.escapeCharacter;
    StringBuilder result = new StringBuilder();
    int pos = 0;
    while (pos < text.length()) {
      if (!text.startsWith(indicator, pos)) {
        result.append(text.charAt(pos++));
        continue;
      }
      StringBuilder value = new StringBuilder();
      int end = literalEnd(text, pos, indicator, escape, value);
      if (end < 0) {
        result.append(text, pos, text.length());
        break;
      }
      result.append(context.constants.addString(text.substring(pos, end), value.toString()));
      pos = end;
    }
    return result.toString();
  }

  /**
   * Returns {@code text} with each string literal replaced by the parameter separator, i.e. the
   * text the user wrote outside of literals.
   */
  static String outsideLiterals(MathDefinition definition, String text) {
    String indicator = definition.stringIndicator;
    StringBuilder result = new StringBuilder();
    int pos = 0;
    while (pos < text.length()) {
      if (!text.startsWith(indicator, pos)) {
        result.append(text.charAt(pos++));
        continue;
      }
      int end = literalEnd(text, pos, indicator, definition.escapeCharacter, null);
      if (end < 0) {
        result.append(text, pos, text.length());
        break;
      }
      result.append(definition.parameterSeparator);
      pos = end;
    }
    return result.toString();
  }

  /**
   * Returns the index just past the literal that starts at {@code start}, or -1 if it is
   * unterminated. If {@code value} is non-null the unescaped contents are appended to it.
   */
  private static int literalEnd(
      String text, int start, String indicator, String escape, @Nullable StringBuilder value) {
    int i = start + indicator.length();
    while (i < text.length()) {
      if (text.startsWith(escape, i)) {
        int next = i + escape.length();
        if (text.startsWith(indicator, next)) {
          append(value, indicator);
          i = next + indicator.length();
          continue;
        } else if (text.startsWith(escape, next)) {
          append(value, escape);
          i = next + escape.length();
          continue;
        }
      }
      if (text.startsWith(indicator, i)) {
        return i + indicator.length();
      }
      append(value, text.substring(i, i + 1));
      i++;
    }
    return -1;
  }

  private static void append(@Nullable StringBuilder value, String s) {
    if (value != null) {
      value.append(s);
    }
  }

  private StringLiteralExtractor() {}
}
