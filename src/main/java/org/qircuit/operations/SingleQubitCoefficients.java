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

package org.qircuit.operations;

import org.qircuit.expr.SymbolicValue;
import org.qircuit.util.Complex;
import org.qircuit.util.ComplexMatrix;

/**
 * Every single-qubit unitary can be written as
 *
 * <pre>
 *   U = exp(i * globalPhase) * [[alpha, -conj(beta)], [beta, conj(alpha)]]
 * </pre>
 *
 * with {@code |alpha|^2 + |beta|^2 = 1}. Each of the five real quantities may be symbolic.
 */
public final class SingleQubitCoefficients {
  public final SymbolicValue alphaR;
  public final SymbolicValue alphaI;
  public final SymbolicValue betaR;
  public final SymbolicValue betaI;
  public final SymbolicValue globalPhase;

  public SingleQubitCoefficients(
      SymbolicValue alphaR,
      SymbolicValue alphaI,
      SymbolicValue betaR,
      SymbolicValue betaI,
      SymbolicValue globalPhase) {
    this.alphaR = alphaR;
    this.alphaI = alphaI;
    this.betaR = betaR;
    this.betaI = betaI;
    this.globalPhase = globalPhase;
  }

  static SingleQubitCoefficients of(
      double alphaR, double alphaI, double betaR, double betaI, double globalPhase) {
    return new SingleQubitCoefficients(
        SymbolicValue.of(alphaR),
        SymbolicValue.of(alphaI),
        SymbolicValue.of(betaR),
        SymbolicValue.of(betaI),
        SymbolicValue.of(globalPhase));
  }

  /**
   * Returns the coefficients of {@code this * other}, i.e. the gate that applies {@code other} and
   * then this.
   */
  SingleQubitCoefficients times(SingleQubitCoefficients other) {
    // alpha' = alpha * oalpha - obeta * conj(beta)
    SymbolicValue ar =
        alphaR
            .multiply(other.alphaR)
            .subtract(alphaI.multiply(other.alphaI))
            .subtract(other.betaR.multiply(betaR).add(other.betaI.multiply(betaI)));
    SymbolicValue ai =
        alphaR
            .multiply(other.alphaI)
            .add(alphaI.multiply(other.alphaR))
            .subtract(other.betaI.multiply(betaR).subtract(other.betaR.multiply(betaI)));
    // beta' = beta * oalpha + obeta * conj(alpha)
    SymbolicValue br =
        betaR
            .multiply(other.alphaR)
            .subtract(betaI.multiply(other.alphaI))
            .add(other.betaR.multiply(alphaR).add(other.betaI.multiply(alphaI)));
    SymbolicValue bi =
        betaR
            .multiply(other.alphaI)
            .add(betaI.multiply(other.alphaR))
            .add(other.betaI.multiply(alphaR).subtract(other.betaR.multiply(alphaI)));
    return new SingleQubitCoefficients(ar, ai, br, bi, globalPhase.add(other.globalPhase));
  }

  boolean isLiteral() {
    return alphaR.isLiteral()
        && alphaI.isLiteral()
        && betaR.isLiteral()
        && betaI.isLiteral()
        && globalPhase.isLiteral();
  }

  /** Returns the 2x2 unitary; all coefficients must be literal. */
  ComplexMatrix matrix() {
    Complex alpha = Complex.of(alphaR.value(), alphaI.value());
    Complex beta = Complex.of(betaR.value(), betaI.value());
    Complex phase = Complex.expI(globalPhase.value());
    return ComplexMatrix.of(
            new Complex[] {alpha, beta.conjugate().negate()},
            new Complex[] {beta, alpha.conjugate()})
        .times(phase);
  }

  @Override
  public String toString() {
    return String.format(
        "alpha=(%s, %s) beta=(%s, %s) phase=%s", alphaR, alphaI, betaR, betaI, globalPhase);
  }
}
