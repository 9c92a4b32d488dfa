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

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;
import com.google.common.collect.Lists;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.exprc.functions.MathFunction;
import org.exprc.nodes.BinaryOperationNode;
import org.exprc.nodes.BinaryOperator;
import org.exprc.nodes.ConstantNode;
import org.exprc.nodes.ExpressionNode;
import org.exprc.nodes.FunctionCallNode;
import org.exprc.nodes.ParameterNode;
import org.exprc.nodes.TypeRules;
import org.exprc.nodes.UnaryOperationNode;
import org.exprc.nodes.UnaryOperator;
import org.exprc.nodes.ValueType;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The final compilation pass: builds an expression tree for each symbol, after the text of every
 * symbol has been reduced to operators applied to placeholders and parameter names.
 *
 * <p>Text is split at the loosest-binding binary operator first. Within a precedence level the
 * rightmost occurrence is tried first (the leftmost, for a right-associative operator); an
 * occurrence at the start of the text, or one whose sides can't both be built, is skipped in favor
 * of the next. Text that has no usable binary operator may be a prefix operator applied to the
 * rest.
 *
 * <p>Since a prefix operator at the start of the text is never a split point, prefix operators
 * bind tighter than every binary operator, {@code ^} included: {@code -2 ^ 2} is {@code (-2) ^ 2},
 * which is 4.
 *
 * <p>Each method that builds a node returns null if the text can't be made sense of; that isn't an
 * error, but the symbol (and anything using it) is then unrecognized. Type errors and unknown
 * functions are errors and throw a CompileError.
 */
class TreeBuilder {
  private static final Logger logger = LoggerFactory.getLogger(TreeBuilder.class);

  private final CompilationContext context;
  private final StructuralSymbols structure;

  /** Each symbol that has been built; empty if it was unrecognized. */
  private final Map<String, Optional<ExpressionNode>> built = new HashMap<>();

  /** Symbols currently being built, to stop a symbol being used to build itself. */
  private final Set<String> inProgress = new HashSet<>();

  private TreeBuilder(CompilationContext context) {
    this.context = context;
    this.structure = context.structure;
  }

  /**
   * Builds every symbol, in ascending level order, and returns the tree for the top-level
   * expression (or null if it is unrecognized).
   */
  static @Nullable ExpressionNode build(CompilationContext context) {
    TreeBuilder builder = new TreeBuilder(context);
    for (ExpressionSymbol symbol : context.symbols.inLevelOrder()) {
      builder.buildSymbol(symbol.key);
    }
    return builder.built.get(SymbolTable.ROOT).orElse(null);
  }

  private @Nullable ExpressionNode buildSymbol(String key) {
    Optional<ExpressionNode> previous = built.get(key);
    if (previous != null) {
      return previous.orElse(null);
    }
    inProgress.add(key);
    ExpressionSymbol symbol = context.symbols.get(key);
    ExpressionNode result =
        symbol.isFunctionCall ? buildCall(symbol) : buildExpression(symbol.expression());
    inProgress.remove(key);
    logger.debug("{} built as {}", key, result);
    built.put(key, Optional.ofNullable(result));
    return result;
  }

  private @Nullable ExpressionNode buildExpression(String text) {
    if (text.isEmpty()) {
      return null;
    }
    Classification classification = context.classify(text);
    switch (classification.kind) {
      case CONSTANT:
        return context.constants.get(classification.value);
      case PARAMETER:
        return context.parameters.get(classification.value);
      case SYMBOL:
        if (!inProgress.contains(classification.value)) {
          return buildSymbol(classification.value);
        }
        break;
      case UNRECOGNIZED:
        break;
    }
    return buildOperation(text);
  }

  private @Nullable ExpressionNode buildOperation(String text) {
    ImmutableList<StructuralSymbols.Token> tokens = structure.tokenize(text);
    List<StructuralSymbols.Token> binaryOps = new ArrayList<>();
    for (StructuralSymbols.Token token : tokens) {
      if (token.isSymbol && token.start > 0 && structure.binaryOperator(token.text) != null) {
        binaryOps.add(token);
      }
    }
    for (int level = 1; level <= BinaryOperator.POWER.precedence; level++) {
      for (StructuralSymbols.Token token : candidates(binaryOps, level)) {
        BinaryOperator op = structure.binaryOperator(token.text);
        String left = text.substring(0, token.start);
        String right = text.substring(token.end());
        if (right.isEmpty()) {
          continue;
        }
        ExpressionNode leftNode = buildExpression(left);
        if (leftNode == null) {
          continue;
        }
        ExpressionNode rightNode = buildExpression(right);
        if (rightNode == null) {
          continue;
        }
        return binaryOperation(op, leftNode, rightNode, text);
      }
    }
    if (!tokens.isEmpty() && tokens.get(0).isSymbol) {
      UnaryOperator op = structure.unaryOperator(tokens.get(0).text);
      if (op != null) {
        ExpressionNode operand = buildExpression(text.substring(tokens.get(0).end()));
        if (operand != null) {
          return unaryOperation(op, operand, text);
        }
      }
    }
    return null;
  }

  /** Returns the operators at the given precedence level, in the order they should be tried. */
  private List<StructuralSymbols.Token> candidates(List<StructuralSymbols.Token> ops, int level) {
    List<StructuralSymbols.Token> result = new ArrayList<>();
    boolean rightAssociative = false;
    for (StructuralSymbols.Token token : ops) {
      BinaryOperator op = structure.binaryOperator(token.text);
      if (op.precedence == level) {
        result.add(token);
        rightAssociative = op.isRightAssociative();
      }
    }
    return rightAssociative ? result : Lists.reverse(result);
  }

  private ExpressionNode binaryOperation(
      BinaryOperator op, ExpressionNode left, ExpressionNode right, String text) {
    TypeRules.Resolution resolution =
        TypeRules.resolve(op, left.possibleTypes(), right.possibleTypes());
    checkResolution(resolution, text);
    narrow(left, resolution.usable.get(0));
    narrow(right, resolution.usable.get(1));
    if (context.definition.foldConstants && left.isConstant() && right.isConstant()) {
      ValueType type = Iterables.getOnlyElement(resolution.results);
      try {
        return ConstantNode.of(
            op.apply(type, ((ConstantNode) left).value(), ((ConstantNode) right).value()));
      } catch (ArithmeticException e) {
        logger.debug("Not folding {}: {}", text, e.getMessage());
      }
    }
    return new BinaryOperationNode(op, left, right, resolution.results);
  }

  private ExpressionNode unaryOperation(UnaryOperator op, ExpressionNode operand, String text) {
    TypeRules.Resolution resolution = TypeRules.resolve(op, operand.possibleTypes());
    checkResolution(resolution, text);
    narrow(operand, resolution.usable.get(0));
    if (context.definition.foldConstants && operand.isConstant()) {
      ValueType type = Iterables.getOnlyElement(resolution.results);
      try {
        return ConstantNode.of(op.apply(type, ((ConstantNode) operand).value()));
      } catch (ArithmeticException e) {
        logger.debug("Not folding {}: {}", text, e.getMessage());
      }
    }
    return new UnaryOperationNode(op, operand, resolution.results);
  }

  /** Builds a function-call symbol, whose text is {@code name(arg,...)}. */
  private @Nullable ExpressionNode buildCall(ExpressionSymbol symbol) {
    String text = symbol.expression();
    int open = text.indexOf(structure.open);
    assert open > 0 && text.endsWith(structure.close);
    String name = text.substring(0, open);
    String argText =
        text.substring(open + structure.open.length(), text.length() - structure.close.length());
    List<ExpressionNode> args = new ArrayList<>();
    if (!argText.isEmpty()) {
      for (String arg : Splitter.on(structure.separator).split(argText)) {
        ExpressionNode node = buildExpression(arg);
        if (node == null) {
          return null;
        }
        args.add(node);
      }
    }
    MathFunction fn = context.functions.lookup(name, args.size());
    if (fn == null) {
      throw new CompileError(CompileError.Kind.UNKNOWN_FUNCTION, context.expand(text));
    }
    TypeRules.Resolution resolution =
        TypeRules.resolve(fn.rule(), Lists.transform(args, ExpressionNode::possibleTypes));
    checkResolution(resolution, text);
    for (int i = 0; i < args.size(); i++) {
      narrow(args.get(i), resolution.usable.get(i));
    }
    if (context.definition.foldConstants
        && fn.deterministic
        && args.stream().allMatch(ExpressionNode::isConstant)) {
      ValueType type = Iterables.getOnlyElement(resolution.results);
      Object[] values = args.stream().map(arg -> ((ConstantNode) arg).value()).toArray();
      try {
        return ConstantNode.of(fn.apply(type, values));
      } catch (ArithmeticException | IndexOutOfBoundsException e) {
        logger.debug("Not folding {}: {}", text, e.getMessage());
      }
    }
    return new FunctionCallNode(fn, args, resolution.results);
  }

  /** Throws if no combination of operand types is valid; the error shows the expanded text. */
  private void checkResolution(TypeRules.Resolution resolution, String text) {
    if (!resolution.isValid()) {
      throw new CompileError(CompileError.Kind.INCOMPATIBLE_OPERAND_TYPES, context.expand(text));
    }
  }

  /** If {@code node} is a parameter, restricts it to the given types. */
  private static void narrow(ExpressionNode node, Set<ValueType> usable) {
    if (node instanceof ParameterNode param && !param.narrow(usable)) {
      throw new CompileError(CompileError.Kind.INCOMPATIBLE_OPERAND_TYPES, param.name);
    }
  }
}
