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

package org.exprc.tools;

import java.io.PrintStream;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;
import org.exprc.CompiledExpression;
import org.exprc.MathDefinition;
import org.exprc.StandardExpressionService;
import org.exprc.compiler.CompileError;
import org.exprc.eval.EvaluationException;
import org.exprc.functions.FunctionLibrary;
import org.exprc.literals.ConstantInterpreter;
import org.exprc.nodes.Values;
import org.jspecify.annotations.Nullable;

/**
 * A simple command-line tool for compiling and computing a single expression.
 *
 * <p>Options are read from system properties: {@code -DfoldConstants=false} disables constant
 * folding, and {@code -DshowTree=true} prints the compiled tree before the result.
 */
public class Run {
  private Run() {}

  private static void checkUsage(boolean condition) {
    if (!condition) {
      System.err.println("Use: run <expression> [ <var>=<val> ...]");
      System.exit(1);
    }
  }

  public static void main(String[] args) {
    boolean foldConstants = Boolean.parseBoolean(System.getProperty("foldConstants", "true"));
    boolean showTree = Boolean.parseBoolean(System.getProperty("showTree", "false"));
    checkUsage(args.length != 0);
    MathDefinition definition =
        MathDefinition.standard().toBuilder().foldConstants(foldConstants).build();
    Map<String, Object> bindings = new LinkedHashMap<>();
    for (int i = 1; i < args.length; i++) {
      int eq = args[i].indexOf('=');
      checkUsage(eq > 0);
      String name = args[i].substring(0, eq).trim();
      bindings.put(name, parseValue(definition, args[i].substring(eq + 1).trim()));
    }
    String argsAsString = Arrays.stream(args, 1, args.length).collect(Collectors.joining(", "));
    StandardExpressionService service =
        new StandardExpressionService(definition, FunctionLibrary.standard());
    System.exit(run(service, args[0], bindings, argsAsString, showTree, System.out));
  }

  /**
   * Converts a command-line value using the definition's literal forms; a leading {@code -} negates
   * a number. Anything else is passed as a string.
   */
  static Object parseValue(MathDefinition definition, String text) {
    boolean negate = text.startsWith("-");
    Object value = interpret(definition, negate ? text.substring(1) : text);
    if (value instanceof Long n && negate) {
      return -n;
    } else if (value instanceof Double d && negate) {
      return -d;
    } else if (value == null || negate) {
      return text;
    }
    return value;
  }

  private static @Nullable Object interpret(MathDefinition definition, String text) {
    for (ConstantInterpreter interpreter : definition.interpreters) {
      Object value = interpreter.interpret(text);
      if (value != null) {
        return value;
      }
    }
    return null;
  }

  /** Compiles and computes {@code expression}, printing the outcome; returns an exit status. */
  static int run(
      StandardExpressionService service,
      String expression,
      Map<String, Object> bindings,
      String argsAsString,
      boolean showTree,
      PrintStream out) {
    CompiledExpression compiled;
    try {
      compiled = service.compile(expression);
    } catch (CompileError e) {
      out.printf("/* COMPILE ERROR\n  %s\n*/\n", e.getMessage());
      return 2;
    }
    if (showTree) {
      out.printf("/* TREE\n  %s\n*/\n", compiled);
    }
    try {
      Object result = compiled.compute(bindings);
      out.printf("/* RUN (%s) RETURNS\n  %s\n*/\n", argsAsString, Values.render(result));
      return 0;
    } catch (EvaluationException e) {
      out.printf("/* RUN (%s) ERRORS\n  %s\n*/\n", argsAsString, e.getMessage());
      return 3;
    }
  }
}
