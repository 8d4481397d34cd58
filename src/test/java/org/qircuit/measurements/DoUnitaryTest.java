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

package org.qircuit.measurements;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Map;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.qircuit.circuit.Circuit;
import org.qircuit.config.ConfigJson;
import org.qircuit.config.ConfigReader;
import org.qircuit.expr.SymbolicValue;
import org.qircuit.operations.BackendTarget;
import org.qircuit.operations.Definition;
import org.qircuit.operations.GateOperation;
import org.qircuit.operations.GateType;
import org.qircuit.operations.MeasureQubit;
import org.qircuit.operations.PragmaParameterSubstitution;
import org.qircuit.operations.VarType;
import org.qircuit.registers.BitRegisterOutput;
import org.qircuit.util.Complex;
import org.qircuit.util.ComplexMatrix;

@RunWith(JUnit4.class)
public class DoUnitaryTest {
  private static final Circuit CIRCUIT =
      Circuit.of(
          new Definition("ro", VarType.BIT, 1),
          GateOperation.of(
              GateType.ROTATE_X,
              ImmutableMap.of("qubit", 0),
              ImmutableMap.of("theta", SymbolicValue.of("theta"))),
          new MeasureQubit(0, "ro", 0));

  private static BasisRotationMeasurement measurement(FakeBackend backend) {
    BasisRotationMeasurementInput input =
        new BasisRotationMeasurementInput(
            ImmutableMap.of("ro", ImmutableMap.of(0, ImmutableList.of(0))),
            ComplexMatrix.ofReal(new double[] {1}),
            1,
            1,
            ImmutableList.of("z"),
            false);
    return new BasisRotationMeasurement(backend, input, List.of(CIRCUIT));
  }

  private static FakeBackend allZeros() {
    BitRegisterOutput ro = new BitRegisterOutput("ro", 1);
    ro.addShot(false);
    return FakeBackend.returning(ro);
  }

  @Test
  public void bindsParametersForOneRun() {
    FakeBackend backend = allZeros();
    BasisRotationMeasurement measurement = measurement(null);
    DoUnitary unitary = new DoUnitary(backend, measurement, List.of("theta"));

    Map<String, Complex> result = unitary.call(List.of(0.25));
    assertThat(result.keySet()).containsExactly("exp_val_z", "unitary_parameter_theta").inOrder();
    assertThat(result.get("unitary_parameter_theta")).isEqualTo(Complex.real(0.25));
    assertThat(measurement.backend()).isSameInstanceAs(backend);

    Circuit submitted = backend.circuits.get(0);
    assertThat(submitted.operations())
        .contains(new PragmaParameterSubstitution(ImmutableMap.of("theta", 0.25)));
    assertThat(backend.overrides.get(0))
        .containsEntry("substitution_dict", ImmutableMap.of("theta", 0.25));
    // The substitution only applies to the call that added it.
    assertThat(measurement.constantCircuit().size()).isEqualTo(0);
  }

  @Test
  public void bindingsByName() {
    FakeBackend backend = allZeros();
    DoUnitary unitary = new DoUnitary(null, measurement(backend), List.of("theta"));
    Map<String, Complex> result = unitary.call(ImmutableMap.of("theta", 1.5, "extra", 2.0));
    assertThat(result).containsEntry("unitary_parameter_extra", Complex.real(2.0));
    assertThat(unitary.measurement().backend()).isSameInstanceAs(backend);
  }

  @Test
  public void everyFreeParameterNeedsAValue() {
    DoUnitary unitary = new DoUnitary(allZeros(), measurement(null), List.of("theta", "phi"));
    assertThrows(IllegalArgumentException.class, () -> unitary.call(List.of(0.25)));
    assertThrows(
        IllegalArgumentException.class, () -> unitary.call(ImmutableMap.of("theta", 0.25)));
  }

  @Test
  public void notReady() {
    FakeBackend backend = new FakeBackend(BackendTarget.PYQUEST_CFFI, c -> null);
    DoUnitary unitary = new DoUnitary(backend, measurement(null), List.of("theta"));
    assertThat(unitary.call(List.of(0.25))).isNull();
  }

  @Test
  public void backendFailureRestoresConstantCircuit() {
    FakeBackend backend =
        new FakeBackend(
            BackendTarget.PYQUEST_CFFI,
            c -> {
              throw new IllegalStateException("device offline");
            });
    BasisRotationMeasurement measurement = measurement(null);
    DoUnitary unitary = new DoUnitary(backend, measurement, List.of("theta"));
    assertThrows(IllegalStateException.class, () -> unitary.call(List.of(0.25)));
    assertThat(measurement.constantCircuit().size()).isEqualTo(0);
  }

  @Test
  public void config() {
    DoUnitary unitary = new DoUnitary(allZeros(), measurement(null), List.of("theta"));
    DoUnitary read =
        DoUnitary.fromConfig(ConfigReader.of(ConfigJson.fromJson(ConfigJson.toJson(unitary))));
    assertThat(read.freeParameters).containsExactly("theta");
    assertThat(read.measurement()).isEqualTo(unitary.measurement());
    assertThat(read.backend()).isNull();
  }
}
