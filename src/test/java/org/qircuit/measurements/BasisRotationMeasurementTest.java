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
import org.qircuit.Hardware.Device;
import org.qircuit.Hardware.ReadoutError;
import org.qircuit.circuit.Circuit;
import org.qircuit.config.ConfigException;
import org.qircuit.config.ConfigJson;
import org.qircuit.config.ConfigReader;
import org.qircuit.operations.BackendTarget;
import org.qircuit.operations.Definition;
import org.qircuit.operations.GateOperation;
import org.qircuit.operations.GateType;
import org.qircuit.operations.MeasureQubit;
import org.qircuit.operations.PragmaSetNumberOfMeasurements;
import org.qircuit.operations.VarType;
import org.qircuit.registers.BitRegisterOutput;
import org.qircuit.registers.FloatRegisterOutput;
import org.qircuit.util.Complex;
import org.qircuit.util.ComplexMatrix;

@RunWith(JUnit4.class)
public class BasisRotationMeasurementTest {
  private static final Circuit MEASURE_0 =
      Circuit.of(
          new Definition("ro", VarType.BIT, 1),
          GateOperation.of(GateType.HADAMARD, 0),
          new MeasureQubit(0, "ro", 0));

  private static final ImmutableList<Integer> NO_QUBITS = ImmutableList.of();

  private static BasisRotationMeasurementInput singleProduct(
      Map<Integer, ? extends List<Integer>> mask) {
    return new BasisRotationMeasurementInput(
        ImmutableMap.of("ro", mask),
        ComplexMatrix.ofReal(new double[] {1}),
        1,
        1,
        ImmutableList.of("example"),
        false);
  }

  private static BitRegisterOutput bits(String name, int length, boolean[]... shots) {
    BitRegisterOutput output = new BitRegisterOutput(name, length);
    for (boolean[] shot : shots) {
      output.addShot(shot);
    }
    return output;
  }

  @Test
  public void emptyMaskMeasuresIdentity() {
    FakeBackend backend =
        FakeBackend.returning(bits("ro", 1, new boolean[] {false}, new boolean[] {false}));
    BasisRotationMeasurement measurement =
        new BasisRotationMeasurement(
            backend, singleProduct(ImmutableMap.of(0, NO_QUBITS)), List.of(MEASURE_0));
    Map<String, Complex> result = measurement.run();
    assertThat(result.keySet()).containsExactly("exp_val_example");
    assertThat(result.get("exp_val_example").re).isEqualTo(1.0);
  }

  @Test
  public void parityOfMaskedQubits() {
    BasisRotationMeasurementInput input =
        new BasisRotationMeasurementInput(
            ImmutableMap.of("ro", ImmutableMap.of(0, List.of(0), 1, List.of(0, 1))),
            ComplexMatrix.ofReal(new double[] {0.5, 0.5}, new double[] {0, 1}),
            2,
            2,
            ImmutableList.of("mixed", "zz"),
            false);
    FakeBackend backend =
        FakeBackend.returning(
            bits(
                "ro",
                2,
                new boolean[] {false, false},
                new boolean[] {true, false},
                new boolean[] {true, true},
                new boolean[] {false, false}));
    Map<String, Complex> result =
        new BasisRotationMeasurement(backend, input, List.of(MEASURE_0)).run();
    // <Z0> = 0, <Z0 Z1> = 0.5
    assertThat(result.get("exp_val_mixed").re).isWithin(1e-12).of(0.25);
    assertThat(result.get("exp_val_zz").re).isWithin(1e-12).of(0.5);
  }

  @Test
  public void flippedMeasurementCorrectsReadoutError() {
    BasisRotationMeasurementInput input =
        new BasisRotationMeasurementInput(
            ImmutableMap.of(
                "ro", ImmutableMap.of(0, List.of(0)),
                "ro_flipped", ImmutableMap.of(0, List.of(0))),
            ComplexMatrix.ofReal(new double[] {1}),
            1,
            1,
            ImmutableList.of("z"),
            true);
    boolean[] zero = {false};
    boolean[] one = {true};
    // Nine of ten shots read correctly in both registers; the flipped register sees the complement.
    BitRegisterOutput plain =
        bits("ro", 1, zero, zero, zero, zero, zero, zero, zero, zero, zero, one);
    BitRegisterOutput flipped =
        bits("ro_flipped", 1, one, one, one, one, one, one, one, one, one, zero);
    Device device =
        new Device() {
          @Override
          public int numberQubits() {
            return 1;
          }

          @Override
          public ReadoutError measurementError(int qubit) {
            return new ReadoutError(0.1, 0.1);
          }
        };
    BasisRotationMeasurement measurement =
        new BasisRotationMeasurement(
            FakeBackend.returning(plain, flipped), input, List.of(MEASURE_0), null, device);
    assertThat(measurement.run().get("exp_val_z").re).isWithin(1e-12).of(0.8 / 0.9);

    measurement.setDevice(null);
    assertThat(measurement.run().get("exp_val_z").re).isWithin(1e-12).of(0.8);
  }

  @Test
  public void flippedMeasurementNeedsCompanionRegister() {
    assertThrows(
        IllegalArgumentException.class,
        () ->
            new BasisRotationMeasurementInput(
                ImmutableMap.of("ro", ImmutableMap.of(0, List.of(0))),
                ComplexMatrix.ofReal(new double[] {1}),
                1,
                1,
                ImmutableList.of("z"),
                true));
  }

  @Test
  public void inputShapeIsChecked() {
    assertThrows(
        IllegalArgumentException.class,
        () ->
            new BasisRotationMeasurementInput(
                ImmutableMap.of("ro", ImmutableMap.of(0, List.of(3))),
                ComplexMatrix.ofReal(new double[] {1}),
                2,
                1,
                ImmutableList.of("z"),
                false));
    assertThrows(
        IllegalArgumentException.class,
        () ->
            new BasisRotationMeasurementInput(
                ImmutableMap.of("ro", ImmutableMap.of(1, List.of(0))),
                ComplexMatrix.ofReal(new double[] {1}),
                1,
                1,
                ImmutableList.of("z"),
                false));
    assertThrows(
        IllegalArgumentException.class,
        () ->
            new BasisRotationMeasurementInput(
                ImmutableMap.of(),
                ComplexMatrix.ofReal(new double[] {1, 0}),
                1,
                1,
                ImmutableList.of("z"),
                false));
  }

  @Test
  public void nothingToRun() {
    BasisRotationMeasurementInput input = singleProduct(ImmutableMap.of(0, NO_QUBITS));
    assertThat(new BasisRotationMeasurement(null, input, List.of(MEASURE_0)).run()).isEmpty();
    FakeBackend backend = FakeBackend.returning();
    assertThat(new BasisRotationMeasurement(backend, input, List.of()).run()).isEmpty();
    assertThat(backend.circuits).isEmpty();
  }

  @Test
  public void notReadyStillSubmitsEveryCircuit() {
    FakeBackend backend = new FakeBackend(BackendTarget.PYQUEST_CFFI, c -> null);
    backend.resumeInfo = ImmutableMap.of("job", "pending");
    BasisRotationMeasurement measurement =
        new BasisRotationMeasurement(
            backend,
            singleProduct(ImmutableMap.of(0, NO_QUBITS)),
            List.of(MEASURE_0, MEASURE_0));
    assertThat(measurement.run()).isNull();
    assertThat(backend.circuits).hasSize(2);
    assertThat(measurement.resumeInfo())
        .containsExactly(ImmutableMap.of("job", "pending"), ImmutableMap.of("job", "pending"));
  }

  @Test
  public void missingRegister() {
    FakeBackend backend = FakeBackend.returning(bits("other", 1, new boolean[] {false}));
    BasisRotationMeasurement measurement =
        new BasisRotationMeasurement(
            backend, singleProduct(ImmutableMap.of(0, List.of(0))), List.of(MEASURE_0));
    IncompleteMeasurementException e =
        assertThrows(IncompleteMeasurementException.class, measurement::run);
    assertThat(e.register).isEqualTo("ro");
    assertThat(e.available).containsExactly("other");
  }

  @Test
  public void registerMustHoldBits() {
    FloatRegisterOutput floats = new FloatRegisterOutput("ro", 1);
    floats.addShot(0.5);
    BasisRotationMeasurement measurement =
        new BasisRotationMeasurement(
            FakeBackend.returning(floats),
            singleProduct(ImmutableMap.of(0, List.of(0))),
            List.of(MEASURE_0));
    assertThrows(IllegalStateException.class, measurement::run);
  }

  @Test
  public void constantCircuitAndOverrides() {
    FakeBackend backend =
        FakeBackend.returning(bits("ro", 1, new boolean[] {false}), phase(0.25));
    PragmaSetNumberOfMeasurements shots = new PragmaSetNumberOfMeasurements(100, "ro");
    BasisRotationMeasurement measurement =
        new BasisRotationMeasurement(
            backend,
            singleProduct(ImmutableMap.of(0, List.of(0))),
            List.of(MEASURE_0),
            Circuit.of(shots),
            null);
    measurement.setResumeList(List.of(ImmutableMap.of("job", "abc")));

    Map<String, Complex> result = measurement.run();
    assertThat(result.get("exp_val_example").re).isEqualTo(1.0);
    assertThat(result.get("global_phase")).isEqualTo(Complex.real(0.25));

    Circuit submitted = backend.circuits.get(0);
    assertThat(submitted.size()).isEqualTo(MEASURE_0.size() + 1);
    assertThat(submitted.operations()).contains(shots);
    assertThat(backend.overrides.get(0))
        .containsExactly("number_measurements", 100, "job", "abc");
    // The measured circuit itself is not modified.
    assertThat(measurement.circuits().get(0)).isEqualTo(MEASURE_0);
  }

  @Test
  public void resumeListMustMatchCircuits() {
    BasisRotationMeasurement measurement =
        new BasisRotationMeasurement(
            FakeBackend.returning(),
            singleProduct(ImmutableMap.of(0, NO_QUBITS)),
            List.of(MEASURE_0));
    measurement.setResumeList(List.of(ImmutableMap.of(), ImmutableMap.of()));
    assertThrows(IllegalStateException.class, measurement::run);
  }

  @Test
  public void config() {
    BasisRotationMeasurement measurement =
        new BasisRotationMeasurement(
            null,
            singleProduct(ImmutableMap.of(0, List.of(0))),
            List.of(MEASURE_0),
            Circuit.of(new PragmaSetNumberOfMeasurements(10, "ro")),
            null);
    measurement.setResumeList(List.of(ImmutableMap.of("job", "abc")));
    String json = ConfigJson.toJson(measurement);
    Measurement read = Measurement.fromConfig(ConfigReader.of(ConfigJson.fromJson(json)));
    assertThat(read).isEqualTo(measurement);
    assertThat(read.backend()).isNull();

    Map<String, Object> tree = ConfigJson.fromJson(json);
    tree.put("type", "Tomography");
    ConfigException e =
        assertThrows(ConfigException.class, () -> Measurement.fromConfig(ConfigReader.of(tree)));
    assertThat(e).hasMessageThat().contains("type");
  }

  private static FloatRegisterOutput phase(double value) {
    FloatRegisterOutput output = new FloatRegisterOutput(Measurement.GLOBAL_PHASE, 1);
    output.addShot(value);
    return output;
  }
}
