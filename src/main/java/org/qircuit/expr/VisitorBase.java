/*
 * Copyright 2025 The Qircuit Authors
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

package org.qircuit.expr;

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.errorprone.annotations.FormatMethod;
import java.util.function.Function;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.tree.ParseTree;
import org.qircuit.expr.ExpressionParser.ParenExpressionContext;

/**
 * A base class for expression visitors that provides two useful functions:
 *
 * <ul>
 *   <li>It disables the default "do nothing" behavior for node types that haven't been overridden.
 *       Visiting a node that doesn't have an explicit visit* method will throw an AssertionError.
 *   <li>It provides error() methods that automatically fill in the node currently being visited as
 *       the location of the error.
 * </ul>
 */
abstract class VisitorBase<T> extends ExpressionBaseVisitor<T> {

  /** The complete text being visited; included in errors. */
  final String source;

  /** The node currently being visited. */
  private ParseTree currentNode;

  VisitorBase(String source) {
    this.source = source;
  }

  @Override
  protected final T defaultResult() {
    // Every reachable visitXXX() method is overridden, so we should never get here.
    throw new AssertionError();
  }

  @Override
  public final T visit(ParseTree tree) {
    return visitWithCurrentNode(tree, super::visit);
  }

  /**
   * Calls {@code visitor} with the given node, binding {@link #currentNode} for the duration of the
   * call.
   *
   * <p>Assumes that if the function throws an exception, this Visitor will not be used again (no
   * attempt is made to restore the correct currentNode state).
   */
  @CanIgnoreReturnValue
  T visitWithCurrentNode(ParseTree node, Function<ParseTree, T> visitor) {
    ParseTree prevNode = currentNode;
    currentNode = node;
    T result = visitor.apply(node);
    currentNode = prevNode;
    return result;
  }

  @Override
  public final T visitParenExpression(ParenExpressionContext ctx) {
    return visit(ctx.expression());
  }

  /** Returns an {@link ExpressionError} pointing at the current node. */
  ExpressionError error(String msg) {
    int position =
        (currentNode == null) ? 0 : ((ParserRuleContext) currentNode).start.getStartIndex();
    return new ExpressionError(msg, source, position);
  }

  /** Returns an {@link ExpressionError} pointing at the current node. */
  @FormatMethod
  ExpressionError error(String fmt, Object... fmtArgs) {
    return error(String.format(fmt, fmtArgs));
  }
}
