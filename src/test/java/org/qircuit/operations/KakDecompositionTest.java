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

import static com.google.common.truth.Truth.assertWithMessage;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import junitparams.JUnitParamsRunner;
import junitparams.Parameters;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.qircuit.expr.SymbolicValue;
import org.qircuit.util.Complex;
import org.qircuit.util.ComplexMatrix;

/**
 * Checks every two-qubit gate's unitary against its own canonical decomposition, and a few of
 * them against matrices built directly from their Hamiltonians.
 */
@RunWith(JUnitParamsRunner.class)
public class KakDecompositionTest {
  private static final double TOLERANCE = 1e-9;

  private static final ComplexMatrix IDENTITY = ComplexMatrix.identity(2);
  private static final ComplexMatrix X =
      ComplexMatrix.ofReal(new double[] {0, 1}, new double[] {1, 0});
  private static final ComplexMatrix Y =
      ComplexMatrix.of(
          new Complex[] {Complex.ZERO, Complex.imaginary(-1)},
          new Complex[] {Complex.I, Complex.ZERO});
  private static final ComplexMatrix Z =
      ComplexMatrix.ofReal(new double[] {1, 0}, new double[] {0, -1});

  private static Object[] twoQubitGateCases() {
    return Arrays.stream(GateType.values())
        .filter(type -> !type.isSingleQubit())
        .map(type -> new Object[] {type})
        .toArray();
  }

  /** Returns the gate on its default qubits with every parameter set to a value in [-2, 2). */
  private static GateOperation withRandomParameters(GateType type, long seed) {
    Random random = new Random(seed);
    Map<String, SymbolicValue> parameters = new LinkedHashMap<>();
    for (String name : type.template.defaultParameters.keySet()) {
      parameters.put(name, SymbolicValue.of(random.nextDouble() * 4 - 2));
    }
    return GateOperation.of(type, type.template.defaultQubits, parameters);
  }

  @Test
  @Parameters(method = "twoQubitGateCases")
  public void decompositionRebuildsUnitary(GateType type) {
    for (long seed = 0; seed < 5; seed++) {
      GateOperation gate = withRandomParameters(type, 31 * type.ordinal() + seed);
      KakDecomposition kak = gate.kakDecomposition();
      ComplexMatrix rebuilt =
          apply(kak.after0, apply(kak.after1, interaction(kak.k)))
              .times(apply(kak.before1, apply(kak.before0, ComplexMatrix.identity(4))))
              .times(Complex.expI(kak.globalPhase.value()));
      assertWithMessage("%s: %s", gate, kak)
          .that(rebuilt.isClose(gate.unitaryMatrix(), TOLERANCE))
          .isTrue();
    }
  }

  @Test
  @Parameters(method = "twoQubitGateCases")
  public void unitaryIsUnitary(GateType type) {
    ComplexMatrix u = withRandomParameters(type, type.ordinal()).unitaryMatrix();
    assertWithMessage("%s", type)
        .that(u.times(u.conjugateTranspose()).isClose(ComplexMatrix.identity(4), TOLERANCE))
        .isTrue();
  }

  @Test
  public void hamiltonianReferences() {
    double theta = 0.7;
    assertClose(
        GateOperation.of(GateType.VARIABLE_MSXX, 1, 0).withParameter("theta", theta),
        interaction(-theta / 2, 0, 0));
    assertClose(
        GateOperation.of(GateType.PM_INTERACTION, 0, 1).withParameter("theta", theta),
        interaction(-theta / 2, -theta / 2, 0));
    assertClose(
        GateOperation.of(GateType.SPIN_INTERACTION, 0, 1)
            .withParameter("x", 0.3)
            .withParameter("y", -0.4)
            .withParameter("z", 1.1),
        interaction(-0.3, 0.4, -1.1));
    assertClose(
        GateOperation.of(GateType.MOLMER_SORENSEN_XX, 1, 0), interaction(-Math.PI / 4, 0, 0));
    assertClose(
        GateOperation.of(GateType.CONTROLLED_PHASE_SHIFT, 1, 0).withParameter("theta", theta),
        ComplexMatrix.diagonal(Complex.ONE, Complex.ONE, Complex.ONE, Complex.expI(theta)));
  }

  private static void assertClose(GateOperation gate, ComplexMatrix expected) {
    assertWithMessage("%s", gate)
        .that(gate.unitaryMatrix().isClose(expected, TOLERANCE))
        .isTrue();
  }

  /** Left-multiplies {@code m} by each gate in turn, so the first gate in the list acts first. */
  private static ComplexMatrix apply(List<GateOperation> gates, ComplexMatrix m) {
    for (GateOperation gate : gates) {
      m = onQubit(gate.unitaryMatrix(), gate.qubit("qubit")).times(m);
    }
    return m;
  }

  /** Qubit 1 is the most significant. */
  private static ComplexMatrix onQubit(ComplexMatrix m, int qubit) {
    return (qubit == 1) ? kron(m, IDENTITY) : kron(IDENTITY, m);
  }

  private static ComplexMatrix interaction(List<SymbolicValue> k) {
    return interaction(k.get(0).value(), k.get(1).value(), k.get(2).value());
  }

  /** exp(i (k0 XX + k1 YY + k2 ZZ)), as a product of three commuting factors. */
  private static ComplexMatrix interaction(double k0, double k1, double k2) {
    return pauliExp(X, k0).times(pauliExp(Y, k1)).times(pauliExp(Z, k2));
  }

  /** exp(i k PP) = cos(k) + i sin(k) PP, since PP squares to the identity. */
  private static ComplexMatrix pauliExp(ComplexMatrix pauli, double k) {
    ComplexMatrix pp = kron(pauli, pauli);
    Complex[][] rows = new Complex[4][4];
    for (int r = 0; r < 4; r++) {
      for (int c = 0; c < 4; c++) {
        Complex diagonal = Complex.real(r == c ? Math.cos(k) : 0);
        rows[r][c] = diagonal.plus(pp.get(r, c).times(Complex.imaginary(Math.sin(k))));
      }
    }
    return ComplexMatrix.of(rows);
  }

  private static ComplexMatrix kron(ComplexMatrix a, ComplexMatrix b) {
    Complex[][] rows = new Complex[4][4];
    for (int r = 0; r < 4; r++) {
      for (int c = 0; c < 4; c++) {
        rows[r][c] = a.get(r / 2, c / 2).times(b.get(r % 2, c % 2));
      }
    }
    return ComplexMatrix.of(rows);
  }
}
