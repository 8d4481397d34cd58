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

import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Map;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.qircuit.circuit.Circuit;
import org.qircuit.config.ConfigJson;
import org.qircuit.config.ConfigReader;
import org.qircuit.operations.GateOperation;
import org.qircuit.operations.GateType;
import org.qircuit.registers.ComplexRegisterOutput;
import org.qircuit.util.Complex;
import org.qircuit.util.ComplexMatrix;
import org.qircuit.util.SparseComplexMatrix;

@RunWith(JUnit4.class)
public class CheatedMeasurementTest {
  private static final Circuit CIRCUIT = Circuit.of(GateOperation.of(GateType.HADAMARD, 0));
  private static final SparseComplexMatrix X =
      SparseComplexMatrix.fromDense(
          ComplexMatrix.ofReal(new double[] {0, 1}, new double[] {1, 0}));
  private static final SparseComplexMatrix Z =
      SparseComplexMatrix.fromDense(
          ComplexMatrix.ofReal(new double[] {1, 0}, new double[] {0, -1}));

  private static final double H = Math.sqrt(0.5);

  @Test
  public void stateVector() {
    ComplexRegisterOutput state = new ComplexRegisterOutput("psi", 2);
    state.addShot(Complex.real(H), Complex.real(H));
    CheatedMeasurementInput input =
        new CheatedMeasurementInput(ImmutableMap.of("psi", ImmutableMap.of("x", X, "z", Z)), false);
    Map<String, Complex> result =
        new CheatedMeasurement(FakeBackend.returning(state), input, List.of(CIRCUIT), null).run();
    assertThat(result.keySet()).containsExactly("exp_val_x", "exp_val_z").inOrder();
    assertThat(result.get("exp_val_x").re).isWithin(1e-12).of(1.0);
    assertThat(result.get("exp_val_x").im).isEqualTo(0.0);
    assertThat(result.get("exp_val_z").isClose(Complex.ZERO)).isTrue();
  }

  @Test
  public void densityMatrix() {
    // |+><+| flattened row by row
    ComplexRegisterOutput rho = new ComplexRegisterOutput("rho", 4);
    Complex half = Complex.real(0.5);
    rho.addShot(half, half, half, half);
    CheatedMeasurementInput input =
        new CheatedMeasurementInput(ImmutableMap.of("rho", ImmutableMap.of("x", X)), true);
    Map<String, Complex> result =
        new CheatedMeasurement(FakeBackend.returning(rho), input, List.of(CIRCUIT), null).run();
    assertThat(result.get("exp_val_x").re).isWithin(1e-12).of(1.0);
  }

  @Test
  public void keepsLargeImaginaryParts() {
    SparseComplexMatrix y =
        SparseComplexMatrix.fromDense(
            ComplexMatrix.of(
                new Complex[] {Complex.ZERO, Complex.ONE},
                new Complex[] {Complex.I, Complex.ZERO}));
    ComplexRegisterOutput state = new ComplexRegisterOutput("psi", 2);
    state.addShot(Complex.real(H), Complex.real(H));
    CheatedMeasurementInput input =
        new CheatedMeasurementInput(ImmutableMap.of("psi", ImmutableMap.of("y", y)), false);
    Complex value =
        new CheatedMeasurement(FakeBackend.returning(state), input, List.of(CIRCUIT), null)
            .run()
            .get("exp_val_y");
    assertThat(value.isClose(Complex.of(0.5, 0.5))).isTrue();
  }

  @Test
  public void operatorsMustShareDimension() {
    SparseComplexMatrix one = SparseComplexMatrix.fromDense(ComplexMatrix.identity(1));
    assertThrows(
        IllegalArgumentException.class,
        () ->
            new CheatedMeasurementInput(
                ImmutableMap.of("a", ImmutableMap.of("x", X), "b", ImmutableMap.of("one", one)),
                false));
  }

  @Test
  public void missingStateRegister() {
    CheatedMeasurementInput input =
        new CheatedMeasurementInput(ImmutableMap.of("psi", ImmutableMap.of("x", X)), false);
    CheatedMeasurement measurement =
        new CheatedMeasurement(FakeBackend.returning(), input, List.of(CIRCUIT), null);
    IncompleteMeasurementException e =
        assertThrows(IncompleteMeasurementException.class, measurement::run);
    assertThat(e.register).isEqualTo("psi");
    assertThat(e.available).isEmpty();
  }

  @Test
  public void config() {
    CheatedMeasurementInput input =
        new CheatedMeasurementInput(ImmutableMap.of("psi", ImmutableMap.of("x", X, "z", Z)), true);
    CheatedMeasurement measurement = new CheatedMeasurement(null, input, List.of(CIRCUIT), null);
    String json = ConfigJson.toJson(measurement);
    Measurement read = Measurement.fromConfig(ConfigReader.of(ConfigJson.fromJson(json)));
    assertThat(read).isEqualTo(measurement);
  }
}
