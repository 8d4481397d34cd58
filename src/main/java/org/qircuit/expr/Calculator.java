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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.Map;
import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.qircuit.expr.ExpressionParser.ProgramContext;

/**
 * Parses and evaluates the small arithmetic language used for symbolic parameters.
 *
 * <p>A program is a sequence of statements separated by semicolons. A statement is either an
 * assignment ({@code name = expression}) or an expression; the value of a program is the value of
 * its last expression statement. Empty statements are ignored, so {@code "x=1; ; 2*x"} evaluates to
 * 2.
 */
public final class Calculator {

  // Static methods only
  private Calculator() {}

  /** Parses a program, throwing an {@link ExpressionError} if it is not well formed. */
  public static ProgramContext parse(String text) {
    // Throw ExpressionErrors in response to parsing errors.
    BaseErrorListener errorListener =
        new BaseErrorListener() {
          @Override
          public void syntaxError(
              Recognizer<?, ?> recognizer,
              Object offendingSymbol,
              int lineNum,
              int charPositionInLine,
              String msg,
              RecognitionException e) {
            throw new ExpressionError(msg, text, charPositionInLine);
          }
        };
    ExpressionLexer lexer = new ExpressionLexer(CharStreams.fromString(text));
    lexer.removeErrorListeners();
    lexer.addErrorListener(errorListener);
    ExpressionParser parser = new ExpressionParser(new CommonTokenStream(lexer));
    parser.removeErrorListeners();
    parser.addErrorListener(errorListener);
    return parser.program();
  }

  /**
   * Evaluates a program that refers to no unbound variables.
   *
   * @throws UnresolvedParameterException if the program reads a variable it never assigns
   */
  public static double evaluate(String text) {
    return evaluate(text, ImmutableMap.of());
  }

  /**
   * Evaluates a program with the given variables already bound.
   *
   * @throws UnresolvedParameterException if the program reads a variable that is neither bound nor
   *     assigned
   */
  public static double evaluate(String text, Map<String, Double> bindings) {
    return new Evaluator(text, bindings).run(parse(text));
  }

  /** Returns the variables that {@code text} reads without assigning them, in first-use order. */
  public static ImmutableSet<String> freeVariables(String text) {
    return new FreeVariables(text, ImmutableSet.of()).run(parse(text));
  }

  /**
   * Returns {@code "k1=v1; k2=v2; "} for the given bindings; prefixing this to an expression (and a
   * separating {@code "; "}) binds the variables for the expression.
   */
  public static String assignments(Map<String, Double> bindings) {
    StringBuilder sb = new StringBuilder();
    bindings.forEach(
        (name, value) -> {
          Preconditions.checkArgument(
              Double.isFinite(value), "Cannot substitute %s for %s", value, name);
          sb.append(name).append('=').append(value).append("; ");
        });
    return sb.toString();
  }
}
