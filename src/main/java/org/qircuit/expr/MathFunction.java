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

import com.google.common.base.Ascii;
import com.google.common.collect.ImmutableMap;
import java.util.Arrays;
import java.util.function.DoubleBinaryOperator;
import java.util.function.DoubleUnaryOperator;
import org.jspecify.annotations.Nullable;

/** The named functions that may be called from an expression. */
public enum MathFunction {
  SIN(Math::sin),
  COS(Math::cos),
  TAN(Math::tan),
  ASIN(Math::asin),
  ACOS(Math::acos),
  ATAN(Math::atan),
  SINH(Math::sinh),
  COSH(Math::cosh),
  TANH(Math::tanh),
  EXP(Math::exp),
  LOG(Math::log),
  SQRT(Math::sqrt),
  ABS(Math::abs),
  SIGN(Math::signum),
  FLOOR(Math::floor),
  CEIL(Math::ceil),
  ATAN2(Math::atan2),
  MAX(Math::max),
  MIN(Math::min),
  POW(Math::pow);

  /** The name used to call this function, e.g. "atan2". */
  public final String name;

  /** 1 or 2. */
  public final int numArgs;

  private final DoubleUnaryOperator unary;
  private final DoubleBinaryOperator binary;

  MathFunction(DoubleUnaryOperator unary) {
    this.name = Ascii.toLowerCase(name());
    this.numArgs = 1;
    this.unary = unary;
    this.binary = null;
  }

  MathFunction(DoubleBinaryOperator binary) {
    this.name = Ascii.toLowerCase(name());
    this.numArgs = 2;
    this.unary = null;
    this.binary = binary;
  }

  private static final ImmutableMap<String, MathFunction> BY_NAME =
      Arrays.stream(values()).collect(ImmutableMap.toImmutableMap(f -> f.name, f -> f));

  /** Returns the function with the given name, or null if there is none. */
  public static @Nullable MathFunction forName(String name) {
    return BY_NAME.get(name);
  }

  /** Applies this function; {@code args.length} must equal {@link #numArgs}. */
  public double apply(double... args) {
    if (args.length != numArgs) {
      throw new IllegalArgumentException(
          String.format("%s expects %s argument(s), got %s", name, numArgs, args.length));
    }
    return (numArgs == 1) ? unary.applyAsDouble(args[0]) : binary.applyAsDouble(args[0], args[1]);
  }
}
