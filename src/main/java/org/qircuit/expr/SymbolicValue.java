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
import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * A numeric field that is either a literal number or a symbolic expression that will only have a
 * value once its variables are bound.
 *
 * <p>There are exactly two subclasses, {@link Literal} and {@link Symbolic}. SymbolicValues are
 * immutable; arithmetic on them folds literals and otherwise builds the text of a new expression.
 */
public abstract class SymbolicValue {

  /** Only Literal and Symbolic. */
  private SymbolicValue() {}

  public static final SymbolicValue ZERO = new Literal(0);
  public static final SymbolicValue ONE = new Literal(1);

  /** Returns a literal value. */
  public static SymbolicValue of(double value) {
    return new Literal(value);
  }

  /** Returns a symbolic value for the given expression, e.g. {@code "theta / 2"}. */
  public static SymbolicValue of(String expression) {
    Preconditions.checkArgument(!expression.isBlank(), "Empty symbolic expression");
    return new Symbolic(expression.trim());
  }

  /**
   * Converts a value read from a configuration tree: a Number becomes a literal, a String becomes a
   * symbolic expression.
   */
  public static SymbolicValue fromObject(Object value) {
    if (value instanceof Number n) {
      return of(n.doubleValue());
    } else if (value instanceof String s) {
      return of(s);
    } else if (value instanceof SymbolicValue sv) {
      return sv;
    }
    throw new IllegalArgumentException("Not a number or expression: " + value);
  }

  /** True if this is a {@link Literal}. */
  public abstract boolean isLiteral();

  /**
   * Returns the numeric value.
   *
   * @throws UnresolvedParameterException if this is {@link Symbolic}
   */
  public abstract double value();

  /**
   * Binds the given variables and returns a Literal if nothing remains unbound. Otherwise the bound
   * variables are replaced by their values in the expression text, leaving the unbound ones free;
   * if none of them occur the result is this. Literals return themselves.
   */
  public abstract SymbolicValue resolve(Map<String, Double> bindings);

  /** Returns a Double for a literal or the expression String for a symbolic value. */
  public abstract Object toConfig();

  public SymbolicValue add(SymbolicValue other) {
    if (isLiteral() && other.isLiteral()) {
      return of(value() + other.value());
    }
    return binary(this, " + ", other);
  }

  public SymbolicValue add(double other) {
    return add(of(other));
  }

  public SymbolicValue subtract(SymbolicValue other) {
    if (isLiteral() && other.isLiteral()) {
      return of(value() - other.value());
    }
    return binary(this, " - ", other);
  }

  public SymbolicValue subtract(double other) {
    return subtract(of(other));
  }

  public SymbolicValue multiply(SymbolicValue other) {
    if (isLiteral() && other.isLiteral()) {
      return of(value() * other.value());
    }
    return binary(this, " * ", other);
  }

  public SymbolicValue multiply(double other) {
    return multiply(of(other));
  }

  public SymbolicValue divide(SymbolicValue other) {
    if (isLiteral() && other.isLiteral()) {
      return of(value() / other.value());
    }
    return binary(this, " / ", other);
  }

  public SymbolicValue divide(double other) {
    return divide(of(other));
  }

  public SymbolicValue negate() {
    return isLiteral() ? of(-value()) : new Symbolic("(-" + this + ")");
  }

  /** Applies a named function, folding it if every argument is a literal. */
  public static SymbolicValue apply(MathFunction fn, SymbolicValue... args) {
    if (Arrays.stream(args).allMatch(SymbolicValue::isLiteral)) {
      return of(fn.apply(Arrays.stream(args).mapToDouble(SymbolicValue::value).toArray()));
    }
    String argList = Arrays.stream(args).map(Object::toString).collect(Collectors.joining(", "));
    return new Symbolic(fn.name + "(" + argList + ")");
  }

  private static SymbolicValue binary(SymbolicValue x, String op, SymbolicValue y) {
    return new Symbolic("(" + x + op + y + ")");
  }

  /** A number. */
  public static final class Literal extends SymbolicValue {
    private final double value;

    private Literal(double value) {
      this.value = value;
    }

    @Override
    public boolean isLiteral() {
      return true;
    }

    @Override
    public double value() {
      return value;
    }

    @Override
    public SymbolicValue resolve(Map<String, Double> bindings) {
      return this;
    }

    @Override
    public Object toConfig() {
      return value;
    }

    @Override
    public boolean equals(Object other) {
      return other instanceof Literal literal
          && Double.doubleToLongBits(value) == Double.doubleToLongBits(literal.value);
    }

    @Override
    public int hashCode() {
      return Double.hashCode(value);
    }

    @Override
    public String toString() {
      return Double.toString(value);
    }
  }

  /** An expression in the language parsed by {@link Calculator}. */
  public static final class Symbolic extends SymbolicValue {
    /** Matches {@code name} as a whole identifier that is not a function name. */
    private static final Function<String, Pattern> OCCURRENCE =
        name -> Pattern.compile("(?<![A-Za-z0-9_.])" + name + "(?![A-Za-z0-9_]|\\s*\\()");

    private static final Function<String, Pattern> ASSIGNMENT =
        name -> Pattern.compile("(?<![A-Za-z0-9_.])" + name + "\\s*=");

    private final String expression;

    private Symbolic(String expression) {
      this.expression = expression;
    }

    public String expression() {
      return expression;
    }

    @Override
    public boolean isLiteral() {
      return false;
    }

    @Override
    public double value() {
      throw new UnresolvedParameterException(expression);
    }

    @Override
    public SymbolicValue resolve(Map<String, Double> bindings) {
      String program = Calculator.assignments(bindings) + "; " + expression;
      if (Calculator.freeVariables(program).isEmpty()) {
        return of(Calculator.evaluate(program));
      }
      String substituted = expression;
      for (String name : Calculator.freeVariables(expression)) {
        Double value = bindings.get(name);
        if (value == null || ASSIGNMENT.apply(name).matcher(substituted).find()) {
          continue;
        }
        Preconditions.checkArgument(
            Double.isFinite(value), "Cannot substitute %s for %s", value, name);
        substituted =
            OCCURRENCE
                .apply(name)
                .matcher(substituted)
                .replaceAll(Matcher.quoteReplacement("(" + value + ")"));
      }
      return substituted.equals(expression) ? this : new Symbolic(substituted);
    }

    @Override
    public Object toConfig() {
      return expression;
    }

    @Override
    public boolean equals(Object other) {
      return other instanceof Symbolic symbolic && expression.equals(symbolic.expression);
    }

    @Override
    public int hashCode() {
      return expression.hashCode();
    }

    @Override
    public String toString() {
      return expression;
    }
  }
}
