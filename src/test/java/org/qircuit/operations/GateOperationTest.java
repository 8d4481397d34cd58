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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableMap;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.qircuit.expr.SymbolicValue;
import org.qircuit.util.Complex;
import org.qircuit.util.ComplexMatrix;

@RunWith(JUnit4.class)
public class GateOperationTest {

  private static GateOperation rotateX(int qubit, double theta) {
    return GateOperation.of(GateType.ROTATE_X, qubit).withParameter("theta", theta);
  }

  @Test
  public void dialect() {
    assertThat(rotateX(0, 0.5).toDialect()).isEqualTo("RotateX(0.5) 0");
    assertThat(GateOperation.of(GateType.HADAMARD, 0).toDialect()).isEqualTo("Hadamard 0");
    assertThat(GateOperation.of(GateType.CNOT, 1, 0).toDialect()).isEqualTo("CNOT 1 0");
    assertThat(
            GateOperation.of(GateType.ROTATE_Z, 2).withParameter("theta", "phi / 2").toDialect())
        .isEqualTo("RotateZ(phi / 2) 2");
  }

  @Test
  public void qubitRoles() {
    GateOperation cnot = GateOperation.of(GateType.CNOT, 1, 0);
    assertThat(cnot.qubit("control")).isEqualTo(1);
    assertThat(cnot.qubit("qubit")).isEqualTo(0);
    assertThrows(IllegalArgumentException.class, () -> cnot.qubit("target"));
    assertThrows(IllegalArgumentException.class, () -> GateOperation.of(GateType.CNOT, 0));
    assertThrows(
        IllegalArgumentException.class,
        () -> GateOperation.of(GateType.HADAMARD, 0).withParameter("theta", 1));
  }

  @Test
  public void defaultsAndForName() {
    GateOperation rx = GateOperation.of(GateType.ROTATE_X, 3);
    assertThat(rx.parameter("theta")).isEqualTo(SymbolicValue.ZERO);
    assertThat(GateType.forName("RotateX")).isEqualTo(GateType.ROTATE_X);
    assertThat(GateType.forName("Unknown")).isNull();
  }

  @Test
  public void tags() {
    assertThat(GateOperation.of(GateType.HADAMARD, 0).tags())
        .containsExactly("Operation", "GateOperation", "SingleQubitGateOperation", "Hadamard")
        .inOrder();
    GateOperation cnot = GateOperation.of(GateType.CNOT, 1, 0);
    assertThat(cnot.is(Family.TWO_QUBIT_GATE_OPERATION)).isTrue();
    assertThat(cnot.is(Family.PRAGMA)).isFalse();
  }

  @Test
  public void remap() {
    GateOperation cnot =
        GateOperation.of(
            GateType.CNOT, ImmutableMap.of("control", 1, "qubit", 0), ImmutableMap.of());
    GateOperation remapped = cnot.remapQubits(ImmutableMap.of(0, 2, 1, 3));
    assertThat(remapped.qubit("control")).isEqualTo(3);
    assertThat(remapped.qubit("qubit")).isEqualTo(2);
    assertThat(remapped.involvedQubits()).isEqualTo(InvolvedQubits.of(2, 3));
    assertThat(cnot.sameQubits(GateOperation.of(GateType.CNOT, 1, 0))).isTrue();

    OperationError e =
        assertThrows(OperationError.class, () -> cnot.remapQubits(ImmutableMap.of(0, 2)));
    assertThat(e.kind).isEqualTo(OperationError.Kind.MISSING_QUBIT_MAPPING);
    assertThat(e.operation).isEqualTo("CNOT");
  }

  @Test
  public void unitaryMatrices() {
    ComplexMatrix h = GateOperation.of(GateType.HADAMARD, 0).unitaryMatrix();
    double s = Math.sqrt(0.5);
    assertThat(h.isClose(ComplexMatrix.ofReal(new double[] {s, s}, new double[] {s, -s})))
        .isTrue();
    assertThat(h.times(h).isClose(ComplexMatrix.identity(2))).isTrue();

    ComplexMatrix x = GateOperation.of(GateType.PAULI_X, 0).unitaryMatrix();
    assertThat(x.isClose(ComplexMatrix.ofReal(new double[] {0, 1}, new double[] {1, 0})))
        .isTrue();

    ComplexMatrix rx = rotateX(0, Math.PI).unitaryMatrix();
    Complex minusI = Complex.of(0, -1);
    assertThat(
            rx.isClose(
                ComplexMatrix.of(
                    new Complex[] {Complex.ZERO, minusI}, new Complex[] {minusI, Complex.ZERO})))
        .isTrue();

    ComplexMatrix cnot = GateOperation.of(GateType.CNOT, 1, 0).unitaryMatrix();
    assertThat(cnot.rows()).isEqualTo(4);
    assertThat(cnot.get(2, 3)).isEqualTo(Complex.ONE);
  }

  @Test
  public void symbolicGateHasNoMatrix() {
    GateOperation gate = GateOperation.of(GateType.ROTATE_X, 0).withParameter("theta", "a");
    assertThat(gate.isParametrized()).isTrue();
    OperationError e = assertThrows(OperationError.class, gate::unitaryMatrix);
    assertThat(e.kind).isEqualTo(OperationError.Kind.UNRESOLVED_PARAMETER);

    GateOperation bound = gate.substituteParameters(ImmutableMap.of("a", 0.5));
    assertThat(bound).isEqualTo(rotateX(0, 0.5));
    assertThat(gate.substituteParameters(ImmutableMap.of("b", 1.0))).isEqualTo(gate);
  }

  @Test
  public void partialSubstitutionKeepsBoundValues() {
    GateOperation gate = GateOperation.of(GateType.ROTATE_X, 0).withParameter("theta", "a + b");
    GateOperation partial = gate.substituteParameters(ImmutableMap.of("a", 1.0));
    assertThat(partial.isParametrized()).isTrue();
    assertThat(partial).isNotEqualTo(gate);
    assertThat(partial.substituteParameters(ImmutableMap.of("b", 2.0)))
        .isEqualTo(rotateX(0, 3.0));
  }

  @Test
  public void multiply() {
    GateOperation product = rotateX(0, 0.3).multiply(rotateX(0, 0.5));
    assertThat(product.type).isEqualTo(GateType.SINGLE_QUBIT_GATE);
    assertThat(product.unitaryMatrix().isClose(rotateX(0, 0.8).unitaryMatrix())).isTrue();

    GateOperation h = GateOperation.of(GateType.HADAMARD, 1);
    assertThat(h.multiply(h).unitaryMatrix().isClose(ComplexMatrix.identity(2))).isTrue();

    GateOperation z = GateOperation.of(GateType.PAULI_Z, 0);
    GateOperation rz = GateOperation.of(GateType.ROTATE_Z, 0).withParameter("theta", 0.7);
    assertThat(
            z.multiply(rz)
                .unitaryMatrix()
                .isClose(z.unitaryMatrix().times(rz.unitaryMatrix())))
        .isTrue();
  }

  @Test
  public void multiplyDomainMismatch() {
    OperationError otherQubit =
        assertThrows(OperationError.class, () -> rotateX(0, 0.1).multiply(rotateX(1, 0.1)));
    assertThat(otherQubit.kind).isEqualTo(OperationError.Kind.DOMAIN_MISMATCH);
    OperationError twoQubit =
        assertThrows(
            OperationError.class,
            () -> GateOperation.of(GateType.CNOT, 1, 0).multiply(rotateX(0, 0.1)));
    assertThat(twoQubit.kind).isEqualTo(OperationError.Kind.DOMAIN_MISMATCH);
  }

  @Test
  public void singleQubitGateEquivalent() {
    GateOperation h = GateOperation.of(GateType.HADAMARD, 0);
    GateOperation generic = h.toSingleQubitGate();
    assertThat(generic.unitaryMatrix().isClose(h.unitaryMatrix())).isTrue();
    // Literal parameters of generic gates compare with a tolerance
    GateOperation nudged =
        generic.withParameter("global_phase", generic.parameter("global_phase").value() + 1e-12);
    assertThat(nudged).isEqualTo(generic);
  }

  @Test
  public void pow() {
    assertThat(rotateX(0, 0.5).pow(2)).isEqualTo(rotateX(0, 1.0));
    GateOperation symbolic = GateOperation.of(GateType.ROTATE_X, 0).withParameter("theta", "t");
    assertThat(symbolic.pow(2).toDialect()).isEqualTo("RotateX((t * 2.0)) 0");
    OperationError e =
        assertThrows(OperationError.class, () -> GateOperation.of(GateType.HADAMARD, 0).pow(0.5));
    assertThat(e.kind).isEqualTo(OperationError.Kind.NOT_EXPONENTIABLE);
  }

  @Test
  public void kakDecomposition() {
    KakDecomposition kak = GateOperation.of(GateType.CNOT, 1, 0).kakDecomposition();
    assertThat(kak.k.get(0).value()).isWithin(1e-12).of(Math.PI / 4);
    assertThat(kak.k.get(1).value()).isEqualTo(0.0);
    assertThat(kak.k.get(2).value()).isEqualTo(0.0);
    assertThat(kak.before1).containsExactly(rotateX(0, Math.PI / 2));

    KakDecomposition xy =
        GateOperation.of(GateType.XY, 1, 0).withParameter("theta", "t").kakDecomposition();
    assertThat(xy.k.get(0).isLiteral()).isFalse();
    assertThrows(IllegalStateException.class, () -> rotateX(0, 1).kakDecomposition());
  }
}
