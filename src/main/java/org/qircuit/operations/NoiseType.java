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

import org.jspecify.annotations.Nullable;
import org.qircuit.expr.MathFunction;
import org.qircuit.expr.SymbolicValue;
import org.qircuit.util.ComplexMatrix;

/**
 * The closed set of single-qubit noise channels. Each acts for {@code gate_time} at some rate;
 * {@code gate_time} is the rotation-strength parameter, so raising a noise pragma to a power
 * scales how long the noise acts.
 *
 * <p>Superoperators act on the vectorised density matrix in the order rho00, rho01, rho10, rho11.
 */
public enum NoiseType {
  /** Amplitude damping towards |0>, i.e. relaxation at zero temperature. */
  DAMPING("PragmaDamping") {
    @Override
    SymbolicValue probability(GateParameters p) {
      return decay(p.symbolic("gate_time").multiply(p.symbolic("rate"))).negate().add(1);
    }

    @Override
    ComplexMatrix superoperator(GateParameters p) {
      double prob = 1 - Math.exp(-p.value("gate_time") * p.value("rate"));
      double sqmp = Math.sqrt(1 - prob);
      return ComplexMatrix.ofReal(
          new double[] {1, 0, 0, prob},
          new double[] {0, sqmp, 0, 0},
          new double[] {0, 0, sqmp, 0},
          new double[] {0, 0, 0, 1 - prob});
    }
  },

  /** Depolarisation, i.e. relaxation at infinite temperature. */
  DEPOLARISE("PragmaDepolarise") {
    @Override
    SymbolicValue probability(GateParameters p) {
      return decay(p.symbolic("gate_time").multiply(p.symbolic("rate")))
          .negate()
          .add(1)
          .multiply(0.75);
    }

    @Override
    ComplexMatrix superoperator(GateParameters p) {
      return depolarise(p.value("gate_time"), p.value("rate"));
    }
  },

  /** Pure dephasing. */
  DEPHASING("PragmaDephasing") {
    @Override
    SymbolicValue probability(GateParameters p) {
      return dephasingProbability(p.symbolic("gate_time"), p.symbolic("rate"));
    }

    @Override
    ComplexMatrix superoperator(GateParameters p) {
      return dephase(p.value("gate_time"), p.value("rate"));
    }
  },

  /**
   * A stochastically unravelled combination of depolarisation and dephasing; backends that support
   * it apply random Pauli errors instead of evolving a density matrix.
   */
  RANDOM_NOISE(
      GateTemplate.single("PragmaRandomNoise")
          .rotation("gate_time", Double.POSITIVE_INFINITY)
          .param("depolarisation_rate", 0)
          .param("dephasing_rate", 0)) {
    @Override
    SymbolicValue probability(GateParameters p) {
      return dephasingProbability(
          p.symbolic("gate_time"),
          p.symbolic("depolarisation_rate").add(p.symbolic("dephasing_rate")));
    }

    @Override
    ComplexMatrix superoperator(GateParameters p) {
      double gateTime = p.value("gate_time");
      return depolarise(gateTime, p.value("depolarisation_rate"))
          .times(dephase(gateTime, p.value("dephasing_rate")));
    }
  };

  /**
   * How two Pauli operators (0 = identity, 1 = X, 2 = Y, 3 = Z) combine, ignoring phase: {@code
   * PAULI_PRODUCT[a][b]} is the Pauli proportional to {@code a * b}.
   */
  private static final int[][] PAULI_PRODUCT = {
    {0, 1, 2, 3},
    {1, 0, 3, 2},
    {2, 3, 0, 1},
    {3, 2, 1, 0}
  };

  public final GateTemplate template;

  NoiseType(String name) {
    this(
        GateTemplate.single(name)
            .rotation("gate_time", Double.POSITIVE_INFINITY)
            .param("rate", 0));
  }

  NoiseType(GateTemplate.Builder template) {
    this.template = template.build();
  }

  public static @Nullable NoiseType forName(String name) {
    for (NoiseType type : values()) {
      if (type.template.name.equals(name)) {
        return type;
      }
    }
    return null;
  }

  /** Returns the Pauli operator proportional to the product of two Pauli operators. */
  public static int pauliProduct(int left, int right) {
    return PAULI_PRODUCT[left][right];
  }

  /** The probability that the channel acts; symbolic if any parameter is. */
  abstract SymbolicValue probability(GateParameters p);

  /** The 4x4 superoperator; every parameter must be a literal. */
  abstract ComplexMatrix superoperator(GateParameters p);

  private static SymbolicValue decay(SymbolicValue exponent) {
    return SymbolicValue.apply(MathFunction.EXP, exponent.negate());
  }

  private static SymbolicValue dephasingProbability(SymbolicValue gateTime, SymbolicValue rate) {
    return decay(gateTime.multiply(rate).multiply(2)).negate().add(1).multiply(0.5);
  }

  private static ComplexMatrix depolarise(double gateTime, double rate) {
    double prob = 0.75 * (1 - Math.exp(-gateTime * rate));
    double onePlus = 1 - 2 * prob / 3;
    double oneMinus = 1 - 4 * prob / 3;
    double twoThirds = 2 * prob / 3;
    return ComplexMatrix.ofReal(
        new double[] {onePlus, 0, 0, twoThirds},
        new double[] {0, oneMinus, 0, 0},
        new double[] {0, 0, oneMinus, 0},
        new double[] {twoThirds, 0, 0, onePlus});
  }

  private static ComplexMatrix dephase(double gateTime, double rate) {
    double prob = 0.5 * (1 - Math.exp(-2 * gateTime * rate));
    return ComplexMatrix.ofReal(
        new double[] {1, 0, 0, 0},
        new double[] {0, 1 - 2 * prob, 0, 0},
        new double[] {0, 0, 1 - 2 * prob, 0},
        new double[] {0, 0, 0, 1});
  }
}
