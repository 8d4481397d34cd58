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

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.qircuit.expr.ExpressionParser.AdditiveContext;
import org.qircuit.expr.ExpressionParser.AssignmentContext;
import org.qircuit.expr.ExpressionParser.ExpressionContext;
import org.qircuit.expr.ExpressionParser.FunctionCallContext;
import org.qircuit.expr.ExpressionParser.MultiplicativeContext;
import org.qircuit.expr.ExpressionParser.NumberContext;
import org.qircuit.expr.ExpressionParser.PowerContext;
import org.qircuit.expr.ExpressionParser.ProgramContext;
import org.qircuit.expr.ExpressionParser.StatementContext;
import org.qircuit.expr.ExpressionParser.UnaryContext;
import org.qircuit.expr.ExpressionParser.ValueContext;
import org.qircuit.expr.ExpressionParser.VariableContext;

/**
 * Computes the numeric value of a parsed program. Assignments update the variable scope; the
 * result is the value of the last expression statement.
 *
 * <p>An Evaluator is used for a single program and then discarded.
 */
class Evaluator extends VisitorBase<Double> {

  /** Predefined constants; assignments may shadow them. */
  static final Map<String, Double> CONSTANTS = Map.of("pi", Math.PI, "e", Math.E);

  private final Map<String, Double> scope = new HashMap<>();

  /** The value of the most recent expression statement, or null if there hasn't been one. */
  private Double lastValue;

  Evaluator(String source, Map<String, Double> bindings) {
    super(source);
    scope.putAll(CONSTANTS);
    scope.putAll(bindings);
  }

  /** Evaluates the whole program. */
  double run(ProgramContext program) {
    for (StatementContext statement : program.statement()) {
      visit(statement);
    }
    if (lastValue == null) {
      throw new ExpressionError("Expression has no value", source, 0);
    }
    return lastValue;
  }

  @Override
  public Double visitAssignment(AssignmentContext ctx) {
    double value = visit(ctx.expression());
    scope.put(ctx.ID().getText(), value);
    return value;
  }

  @Override
  public Double visitValue(ValueContext ctx) {
    lastValue = visit(ctx.expression());
    return lastValue;
  }

  @Override
  public Double visitNumber(NumberContext ctx) {
    return Double.parseDouble(ctx.NUMBER().getText());
  }

  @Override
  public Double visitVariable(VariableContext ctx) {
    String name = ctx.ID().getText();
    Double value = scope.get(name);
    if (value == null) {
      throw new UnresolvedParameterException(source);
    }
    return value;
  }

  @Override
  public Double visitFunctionCall(FunctionCallContext ctx) {
    String name = ctx.ID().getText();
    MathFunction fn = MathFunction.forName(name);
    if (fn == null) {
      throw error("Unknown function '%s'", name);
    }
    List<ExpressionContext> argNodes = ctx.expression();
    if (argNodes.size() != fn.numArgs) {
      throw error("%s expects %s argument(s), got %s", name, fn.numArgs, argNodes.size());
    }
    double[] args = new double[argNodes.size()];
    for (int i = 0; i < args.length; i++) {
      args[i] = visit(argNodes.get(i));
    }
    return fn.apply(args);
  }

  @Override
  public Double visitPower(PowerContext ctx) {
    return Math.pow(visit(ctx.expression(0)), visit(ctx.expression(1)));
  }

  @Override
  public Double visitUnary(UnaryContext ctx) {
    double operand = visit(ctx.expression());
    return (ctx.op.getType() == ExpressionLexer.MINUS) ? -operand : operand;
  }

  @Override
  public Double visitMultiplicative(MultiplicativeContext ctx) {
    double left = visit(ctx.expression(0));
    double right = visit(ctx.expression(1));
    return (ctx.op.getType() == ExpressionLexer.STAR) ? left * right : left / right;
  }

  @Override
  public Double visitAdditive(AdditiveContext ctx) {
    double left = visit(ctx.expression(0));
    double right = visit(ctx.expression(1));
    return (ctx.op.getType() == ExpressionLexer.PLUS) ? left + right : left - right;
  }
}
