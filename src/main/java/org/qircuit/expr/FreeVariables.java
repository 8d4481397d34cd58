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

import com.google.common.collect.ImmutableSet;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Set;
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
 * Collects the variables that a program reads before (or without) assigning them, in order of first
 * use. Constants and names bound by the caller are not free.
 */
class FreeVariables extends VisitorBase<Void> {
  private final Set<String> bound = new HashSet<>();
  private final Set<String> free = new LinkedHashSet<>();

  FreeVariables(String source, Set<String> preBound) {
    super(source);
    bound.addAll(Evaluator.CONSTANTS.keySet());
    bound.addAll(preBound);
  }

  ImmutableSet<String> run(ProgramContext program) {
    for (StatementContext statement : program.statement()) {
      visit(statement);
    }
    return ImmutableSet.copyOf(free);
  }

  private Void visitAll(Iterable<ExpressionContext> nodes) {
    for (ExpressionContext node : nodes) {
      visit(node);
    }
    return null;
  }

  @Override
  public Void visitAssignment(AssignmentContext ctx) {
    visit(ctx.expression());
    bound.add(ctx.ID().getText());
    return null;
  }

  @Override
  public Void visitValue(ValueContext ctx) {
    return visit(ctx.expression());
  }

  @Override
  public Void visitNumber(NumberContext ctx) {
    return null;
  }

  @Override
  public Void visitVariable(VariableContext ctx) {
    String name = ctx.ID().getText();
    if (!bound.contains(name)) {
      free.add(name);
    }
    return null;
  }

  @Override
  public Void visitFunctionCall(FunctionCallContext ctx) {
    return visitAll(ctx.expression());
  }

  @Override
  public Void visitPower(PowerContext ctx) {
    return visitAll(ctx.expression());
  }

  @Override
  public Void visitUnary(UnaryContext ctx) {
    return visit(ctx.expression());
  }

  @Override
  public Void visitMultiplicative(MultiplicativeContext ctx) {
    return visitAll(ctx.expression());
  }

  @Override
  public Void visitAdditive(AdditiveContext ctx) {
    return visitAll(ctx.expression());
  }
}
