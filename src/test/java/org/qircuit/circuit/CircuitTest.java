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

package org.qircuit.circuit;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.qircuit.config.ConfigException;
import org.qircuit.operations.BackendTarget;
import org.qircuit.operations.Definition;
import org.qircuit.operations.Family;
import org.qircuit.operations.GateOperation;
import org.qircuit.operations.GateType;
import org.qircuit.operations.MeasureQubit;
import org.qircuit.operations.NoiseType;
import org.qircuit.operations.Operation;
import org.qircuit.operations.OperationError;
import org.qircuit.operations.PragmaActiveReset;
import org.qircuit.operations.PragmaNoise;
import org.qircuit.operations.PragmaParameterSubstitution;
import org.qircuit.operations.PragmaRepeatedMeasurement;
import org.qircuit.operations.PragmaSetNumberOfMeasurements;
import org.qircuit.operations.VarType;

@RunWith(JUnit4.class)
public class CircuitTest {
  private static final Operation H0 = GateOperation.of(GateType.HADAMARD, 0);
  private static final Operation X1 = GateOperation.of(GateType.PAULI_X, 1);
  private static final Operation CNOT = GateOperation.of(GateType.CNOT, 0, 1);

  @Test
  public void definitionsComeFirst() {
    Circuit circuit = new Circuit();
    circuit.add(new Definition("ro", VarType.BIT, 1));
    circuit.add(H0);
    circuit.add(new MeasureQubit(0, "ro", 0));
    circuit.add(new Definition("test", VarType.FLOAT, 3));
    assertThat(circuit.toDialectLines())
        .containsExactly(
            "Definition ro BIT[1]", "Definition test REAL[3]", "Hadamard 0", "MeasureQubit 0 ro[0]")
        .inOrder();
    assertThat(circuit.size()).isEqualTo(4);
    assertThat(circuit.numDefinitions()).isEqualTo(2);
    assertThat(circuit.toString()).endsWith("MeasureQubit 0 ro[0]\n");
  }

  @Test
  public void duplicateDefinitionsAreDropped() {
    Circuit circuit =
        Circuit.of(new Definition("ro", VarType.BIT, 2), H0, new Definition("ro", VarType.BIT, 2));
    assertThat(circuit.definitions()).hasSize(1);
    assertThat(circuit.size()).isEqualTo(2);
  }

  @Test
  public void indexing() {
    Circuit circuit = Circuit.of(new Definition("ro", VarType.BIT, 1), H0, X1);
    assertThat(circuit.get(0)).isInstanceOf(Definition.class);
    assertThat(circuit.get(2)).isEqualTo(X1);
    assertThrows(IndexOutOfBoundsException.class, () -> circuit.get(3));

    circuit.insert(1, CNOT);
    assertThat(circuit.operations()).containsExactly(CNOT, H0, X1).inOrder();
    // Indices inside the definitions insert at the start of the operations
    circuit.insert(0, X1);
    assertThat(circuit.get(1)).isEqualTo(X1);

    assertThat(circuit.set(1, H0)).isEqualTo(X1);
    assertThrows(IllegalArgumentException.class, () -> circuit.set(0, H0));
    assertThrows(
        IllegalArgumentException.class,
        () -> circuit.set(1, new Definition("other", VarType.BIT, 1)));

    assertThat(circuit.remove(1)).isEqualTo(H0);
    assertThat(circuit.operations()).containsExactly(CNOT, H0, X1).inOrder();
  }

  @Test
  public void insertAllKeepsOrder() {
    Circuit circuit = Circuit.of(H0);
    circuit.insertAll(0, ImmutableList.of(X1, CNOT));
    assertThat(circuit.operations()).containsExactly(X1, CNOT, H0).inOrder();
  }

  @Test
  public void slices() {
    Circuit circuit = Circuit.of(H0, X1, CNOT, H0);
    assertThat(circuit.slice(0, 4, 2)).containsExactly(H0, CNOT).inOrder();
    assertThat(circuit.slice(3, 0, -1)).containsExactly(H0, CNOT, X1).inOrder();
    assertThrows(IllegalArgumentException.class, () -> circuit.slice(0, 4, 0));

    circuit.removeRange(1, 3);
    assertThat(circuit.operations()).containsExactly(H0, H0).inOrder();
    assertThrows(IndexOutOfBoundsException.class, () -> circuit.removeRange(1, 5));
  }

  @Test
  public void sliceBoundsAreClamped() {
    Circuit circuit = Circuit.of(H0, X1, CNOT);
    assertThat(circuit.slice(1, 10, 1)).containsExactly(X1, CNOT).inOrder();
    assertThat(circuit.slice(-2, Integer.MAX_VALUE, 1)).containsExactly(X1, CNOT).inOrder();
    assertThat(circuit.slice(-10, -1, 1)).containsExactly(H0, X1).inOrder();
    assertThat(circuit.slice(10, -10, -1)).containsExactly(CNOT, X1, H0).inOrder();
    assertThat(circuit.slice(5, 10, 1)).isEmpty();
    assertThat(circuit.slice(-5, -4, 1)).isEmpty();
  }

  @Test
  public void setRejectsSecondDefinitionOfRegister() {
    Definition ro = new Definition("ro", VarType.BIT, 1);
    Circuit circuit = Circuit.of(ro, new Definition("x", VarType.FLOAT, 1));
    assertThrows(IllegalArgumentException.class, () -> circuit.set(1, ro));
    assertThrows(
        IllegalArgumentException.class,
        () -> circuit.set(1, new Definition("ro", VarType.FLOAT, 2)));
    assertThat(circuit.definitions()).hasSize(2);

    // Redefining a register in its own slot is allowed
    Definition wider = new Definition("ro", VarType.BIT, 4);
    assertThat(circuit.set(0, wider)).isEqualTo(ro);
    assertThat(circuit.definitions().get(0)).isEqualTo(wider);
  }

  @Test
  public void plusCopies() {
    Circuit circuit = Circuit.of(H0);
    Circuit longer = circuit.plus(ImmutableList.of(X1, CNOT));
    assertThat(longer.size()).isEqualTo(3);
    assertThat(circuit.size()).isEqualTo(1);
    assertThat(circuit.plus(circuit).operations()).containsExactly(H0, H0);
    // Adding a circuit to itself copies before iterating
    circuit.addAll(circuit);
    assertThat(circuit.size()).isEqualTo(2);
  }

  @Test
  public void familiesAndTypes() {
    Circuit circuit =
        Circuit.of(
            new Definition("ro", VarType.BIT, 2),
            H0,
            CNOT,
            PragmaNoise.of(NoiseType.DAMPING, 0, 1, 0.1),
            new PragmaActiveReset(0),
            new MeasureQubit(0, "ro", 0),
            H0);
    assertThat(circuit.countOccurrences(ImmutableSet.of(Family.GATE_OPERATION))).isEqualTo(4);
    assertThat(circuit.countOccurrences(ImmutableSet.of(Family.PRAGMA, Family.DEFINITION)))
        .isEqualTo(3);
    assertThat(circuit.operationTypes(true)).containsExactly("Hadamard", "CNOT").inOrder();
    assertThat(circuit.operationTypes(false))
        .containsExactly(
            "Definition", "Hadamard", "CNOT", "PragmaDamping", "PragmaActiveReset", "MeasureQubit")
        .inOrder();
  }

  @Test
  public void substituteParameters() {
    Circuit circuit =
        Circuit.of(GateOperation.of(GateType.ROTATE_X, 0).withParameter("theta", "2 * t"));
    assertThat(circuit.isParametrized()).isTrue();
    circuit.substituteParameters(ImmutableMap.of("t", 0.25));
    assertThat(circuit.isParametrized()).isFalse();
    assertThat(circuit.toDialectLines()).containsExactly("RotateX(0.5) 0");
  }

  @Test
  public void remapQubits() {
    Circuit circuit = Circuit.of(new Definition("ro", VarType.BIT, 1), CNOT);
    circuit.remapQubits(ImmutableMap.of(0, 5, 1, 6));
    assertThat(circuit.operations()).containsExactly(GateOperation.of(GateType.CNOT, 5, 6));
  }

  @Test
  public void failedRemapLeavesCircuitUnchanged() {
    Circuit circuit = Circuit.of(CNOT, new PragmaActiveReset(0));
    Circuit before = circuit.copy();
    OperationError e =
        assertThrows(
            OperationError.class, () -> circuit.remapQubits(ImmutableMap.of(0, 1, 1, 0)));
    assertThat(e.kind).isEqualTo(OperationError.Kind.REMAP_NOT_SUPPORTED);
    assertThat(circuit).isEqualTo(before);
  }

  @Test
  public void backendInstructions() {
    Circuit circuit =
        Circuit.of(
            H0,
            new PragmaSetNumberOfMeasurements(10, "ro"),
            new PragmaRepeatedMeasurement("ro", 20),
            new PragmaParameterSubstitution(ImmutableMap.of("a", 1.0)),
            new PragmaSetNumberOfMeasurements(30, "ro"));
    assertThat(circuit.backendInstructions(BackendTarget.AQT))
        .containsExactly(
            "number_measurements", 30,
            "readout", "ro",
            "substitution_dict", ImmutableMap.of("a", 1.0));
    assertThat(circuit.backendInstructions(BackendTarget.SIMULATOR))
        .containsExactly("substitution_dict", ImmutableMap.of("a", 1.0));
  }

  @Test
  public void config() {
    Circuit circuit =
        Circuit.of(
            new Definition("ro", VarType.BIT, 1, false, true),
            GateOperation.of(GateType.ROTATE_Z, 0).withParameter("theta", "phi"),
            new MeasureQubit(0, "ro", 0));
    assertThat(Circuit.fromConfig(circuit.toConfig())).isEqualTo(circuit);
    assertThrows(
        ConfigException.class,
        () -> Circuit.fromConfig(ImmutableMap.of("type", "Measurement")));
  }
}
