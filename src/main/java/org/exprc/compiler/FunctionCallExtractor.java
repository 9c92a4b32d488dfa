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

import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Replaces each function call {@code name(args)} in the symbol texts with a placeholder for a
 * function-call symbol.
 *
 * <p>An open parenthesis starts a call if it is not at the start of the text and does not directly
 * follow a structural symbol; the function name is the text between it and the preceding symbol.
 * Calls inside the arguments are replaced first. Each argument is then reduced to a constant key,
 * a parameter name or a symbol key, and the canonical call built from those is registered as a
 * function-call symbol. The original call text is replaced by that symbol's key, and the scan
 * restarts on the shortened text; a repeated call resolves to the same key.
 *
 * <p>A call whose close parenthesis can't be found is left in place.
 */
class FunctionCallExtractor {
  private static final Logger logger = LoggerFactory.getLogger(FunctionCallExtractor.class);

  private final CompilationContext context;
  private final StructuralSymbols structure;
  private final Splitter argSplitter;
  private final Joiner argJoiner;

  private FunctionCallExtractor(CompilationContext context) {
    this.context = context;
    this.structure = context.structure;
    this.argSplitter = Splitter.on(structure.separator).omitEmptyStrings();
    this.argJoiner = Joiner.on(structure.separator);
  }

  /**
   * Processes the root symbol and then every other non-function symbol, including those created
   * while this pass runs.
   */
  static void extract(CompilationContext context) {
    FunctionCallExtractor extractor = new FunctionCallExtractor(context);
    SymbolTable symbols = context.symbols;
    for (int i = 0; i < symbols.count(); i++) {
      ExpressionSymbol symbol = symbols.get(i);
      if (!symbol.isFunctionCall) {
        extractor.replaceAll(symbol);
      }
    }
  }

  private void replaceAll(ExpressionSymbol symbol) {
    for (; ; ) {
      String replaced = replaceOne(symbol.expression(), symbol.level);
      if (replaced == null) {
        return;
      }
      logger.debug("{} -> {}", symbol.key, replaced);
      context.symbols.setExpression(symbol.key, replaced);
    }
  }

  /** Replaces calls in {@code text} until none are left; returns the result. */
  private String replaceNested(String text, int level) {
    for (; ; ) {
      String replaced = replaceOne(text, level);
      if (replaced == null) {
        return text;
      }
      text = replaced;
    }
  }

  /**
   * Finds the first complete call in {@code source} and returns {@code source} with that call
   * replaced by a placeholder, or returns null if there are no complete calls.
   */
  private @Nullable String replaceOne(String source, int level) {
    int open = findCallOpen(source, 0);
    while (open >= 0) {
      int close = structure.closeFor(source, open);
      if (close < 0) {
        open = findCallOpen(source, open + structure.open.length());
        continue;
      }
      String header = structure.lastFragment(source.substring(0, open));
      assert !header.isEmpty();
      String rawArgs = source.substring(open + structure.open.length(), close);
      String args = replaceNested(rawArgs, level + 1);
      List<String> resolved = new ArrayList<>();
      for (String arg : argSplitter.split(args)) {
        TablePopulator.populate(context, arg);
        resolved.add(resolveArgument(arg, level + 2));
      }
      String call = header + structure.open + argJoiner.join(resolved) + structure.close;
      String key = context.symbols.keyFor(call, true, level + 1);
      logger.debug("call {} registered as {}", call, key);
      return source.substring(0, open - header.length())
          + key
          + source.substring(close + structure.close.length());
    }
    return null;
  }

  /**
   * Returns the index of the first open parenthesis at or after {@code from} that starts a call,
   * or -1.
   */
  private int findCallOpen(String source, int from) {
    int open = source.indexOf(structure.open, from);
    while (open >= 0) {
      if (open > 0 && !structure.isPrecededBySymbol(source, open)) {
        return open;
      }
      open = source.indexOf(structure.open, open + structure.open.length());
    }
    return -1;
  }

  /**
   * Returns the constant key, parameter name or symbol key that stands for {@code arg}. Parentheses
   * enclosing the whole argument are dropped, so {@code (a+b)} is registered once, as {@code a+b}.
   */
  private String resolveArgument(String arg, int level) {
    int innerEnd = arg.length() - structure.close.length();
    if (arg.startsWith(structure.open)
        && innerEnd > structure.open.length()
        && structure.closeFor(arg, 0) == innerEnd) {
      return resolveArgument(arg.substring(structure.open.length(), innerEnd), level);
    }
    Classification classification = context.classify(arg);
    switch (classification.kind) {
      case CONSTANT:
      case PARAMETER:
      case SYMBOL:
        return classification.value;
      case UNRECOGNIZED:
        return context.symbols.keyFor(arg, false, level);
    }
    throw new AssertionError();
  }
}
