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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.jspecify.annotations.Nullable;
import org.qircuit.Hardware;
import org.qircuit.Hardware.Backend;
import org.qircuit.Hardware.Device;
import org.qircuit.circuit.Circuit;
import org.qircuit.config.ConfigReader;
import org.qircuit.registers.BitRegisterOutput;
import org.qircuit.registers.RegisterOutput;
import org.qircuit.util.Complex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reconstructs expectation values from projective measurements in the computational basis.
 *
 * <p>The circuits must already rotate each measured Pauli product into the Z basis and measure the
 * relevant qubits into bit registers. For each register and each Pauli product of its mask the
 * per-shot value is {@code (-1)^(sum of the masked bits)}, averaged over shots. The averages of all
 * registers are summed and multiplied by the input's matrix.
 *
 * <p>With flipped measurement enabled every register {@code r} has a companion {@code r_flipped}
 * measured after complementing the qubits; its bits are complemented back, the pair is averaged,
 * and the result is divided by the product of the readout fidelities of the masked qubits.
 */
public final class BasisRotationMeasurement extends Measurement {
  private static final Logger LOG = LoggerFactory.getLogger(BasisRotationMeasurement.class);

  public static final String TYPE = "BasisRotationMeasurement";

  public final BasisRotationMeasurementInput input;

  public BasisRotationMeasurement(
      @Nullable Backend backend,
      BasisRotationMeasurementInput input,
      List<Circuit> circuits,
      @Nullable Circuit constantCircuit,
      @Nullable Device device) {
    super(backend, device, circuits, constantCircuit);
    this.input = input;
  }

  public BasisRotationMeasurement(
      @Nullable Backend backend, BasisRotationMeasurementInput input, List<Circuit> circuits) {
    this(backend, input, circuits, null, null);
  }

  @Override
  public @Nullable ImmutableMap<String, Complex> run() {
    Backend backend = backend();
    if (backend == null || circuits().isEmpty()) {
      return ImmutableMap.of();
    }
    Map<String, RegisterOutput<?>> outputs = dispatch(backend);
    if (outputs == null) {
      return null;
    }
    ImmutableMap.Builder<String, Complex> result = ImmutableMap.builder();
    if (input.matrix.rows() != 0) {
      Complex[] values = input.matrix.times(pauliProducts(outputs));
      for (int i = 0; i < values.length; i++) {
        result.put(EXP_VAL_PREFIX + input.names.get(i), values[i]);
      }
      LOG.debug("Reconstructed {} expectation values", values.length);
    }
    addGlobalPhase(outputs, result);
    return result.buildOrThrow();
  }

  /** Returns the sum over all (mitigated) registers of the averaged Pauli products. */
  private double[] pauliProducts(Map<String, RegisterOutput<?>> outputs) {
    Map<String, double[]> byRegister = new LinkedHashMap<>();
    input.masks.forEach(
        (register, mask) ->
            byRegister.put(register, averagePauliProducts(register, mask, outputs)));
    if (input.useFlippedMeasurement) {
      double[] fidelities = new double[input.numberQubits];
      for (int q = 0; q < fidelities.length; q++) {
        fidelities[q] = Hardware.measurementFidelity(device(), q);
      }
      input.masks.forEach(
          (register, mask) -> {
            if (!BasisRotationMeasurementInput.isFlipped(register)) {
              double[] plain = byRegister.get(register);
              double[] flipped =
                  byRegister.get(register + BasisRotationMeasurementInput.FLIPPED_SUFFIX);
              for (int i = 0; i < plain.length; i++) {
                double factor = correctionFactor(mask.get(i), fidelities);
                plain[i] = ((plain[i] + flipped[i]) / 2) / factor;
              }
            }
          });
    }
    double[] sum = new double[input.numberPauliProducts];
    byRegister.forEach(
        (register, values) -> {
          if (!BasisRotationMeasurementInput.isFlipped(register)) {
            for (int i = 0; i < sum.length; i++) {
              sum[i] += values[i];
            }
          }
        });
    return sum;
  }

  private static double correctionFactor(@Nullable List<Integer> qubits, double[] fidelities) {
    double factor = 1;
    if (qubits != null) {
      for (int q : qubits) {
        factor *= fidelities[q];
      }
    }
    return factor;
  }

  /**
   * Returns the shot average of each Pauli product in {@code mask}; products not in the mask are
   * zero.
   */
  private double[] averagePauliProducts(
      String register,
      ImmutableMap<Integer, ImmutableList<Integer>> mask,
      Map<String, RegisterOutput<?>> outputs) {
    RegisterOutput<?> output = require(outputs, register);
    if (!(output instanceof BitRegisterOutput bits)) {
      throw new IllegalStateException(
          String.format("Register %s holds %s values, not bits", register, output.type.configName));
    }
    boolean flipped = BasisRotationMeasurementInput.isFlipped(register);
    int shots = bits.numberOfShots();
    double[] result = new double[input.numberPauliProducts];
    mask.forEach(
        (index, qubits) -> {
          if (qubits.isEmpty()) {
            result[index] = 1;
            return;
          }
          double sum = 0;
          for (int shot = 0; shot < shots; shot++) {
            ImmutableList<Boolean> row = bits.row(shot);
            boolean odd = false;
            for (int q : qubits) {
              // Flipped registers measured the complement of each qubit.
              odd ^= (row.get(q) != flipped);
            }
            sum += odd ? -1 : 1;
          }
          result[index] = sum / shots;
        });
    return result;
  }

  @Override
  public Map<String, Object> toConfig() {
    Map<String, Object> config = new LinkedHashMap<>();
    config.put(TYPE_KEY, TYPE);
    config.put("measurement_input", input.toConfig());
    putCommonConfig(config);
    return config;
  }

  /** The result has no backend or device; set them before running it. */
  public static BasisRotationMeasurement fromConfig(ConfigReader config) {
    config.requireType(TYPE);
    return withResumeList(
        new BasisRotationMeasurement(
            null,
            BasisRotationMeasurementInput.fromConfig(config.getChild("measurement_input")),
            circuitsFromConfig(config),
            constantCircuitFromConfig(config),
            null),
        config);
  }

  public static BasisRotationMeasurement fromConfig(Map<String, ?> config) {
    return fromConfig(ConfigReader.of(config));
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof BasisRotationMeasurement m
        && input.equals(m.input)
        && sameCommonFields(m);
  }

  @Override
  public int hashCode() {
    return Objects.hash(TYPE, input);
  }
}
