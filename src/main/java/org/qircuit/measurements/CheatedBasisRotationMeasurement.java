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

import com.google.common.collect.ImmutableMap;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.jspecify.annotations.Nullable;
import org.qircuit.Hardware.Backend;
import org.qircuit.circuit.Circuit;
import org.qircuit.config.ConfigReader;
import org.qircuit.registers.RegisterOutput;
import org.qircuit.util.Complex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Combines Pauli product expectation values that a simulator computed exactly, e.g. with {@link
 * org.qircuit.operations.PragmaGetPauliProduct}. A register named {@code
 * <anything>_pauli_product_i} supplies Pauli product {@code i} in its first entry; registers with
 * other names are ignored except {@code global_phase}.
 */
public final class CheatedBasisRotationMeasurement extends Measurement {
  private static final Logger LOG = LoggerFactory.getLogger(CheatedBasisRotationMeasurement.class);

  public static final String TYPE = "CheatedBasisRotationMeasurement";

  static final String PAULI_PRODUCT_MARKER = "_pauli_product_";

  public final CheatedBasisRotationMeasurementInput input;

  public CheatedBasisRotationMeasurement(
      @Nullable Backend backend,
      CheatedBasisRotationMeasurementInput input,
      List<Circuit> circuits,
      @Nullable Circuit constantCircuit) {
    super(backend, null, circuits, constantCircuit);
    this.input = input;
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
    Complex[] products = new Complex[input.numberPauliProducts];
    Arrays.fill(products, Complex.ZERO);
    outputs.forEach(
        (name, output) -> {
          int marker = name.lastIndexOf(PAULI_PRODUCT_MARKER);
          if (marker >= 0) {
            int index = pauliProductIndex(name, marker + PAULI_PRODUCT_MARKER.length());
            products[index] = output.complexValue(0, 0);
          }
        });
    ImmutableMap.Builder<String, Complex> result = ImmutableMap.builder();
    if (input.matrix.rows() != 0) {
      Complex[] values = input.matrix.times(products);
      for (int i = 0; i < values.length; i++) {
        result.put(EXP_VAL_PREFIX + input.names.get(i), values[i]);
      }
      LOG.debug("Reconstructed {} expectation values", values.length);
    }
    addGlobalPhase(outputs, result);
    return result.buildOrThrow();
  }

  private int pauliProductIndex(String register, int start) {
    int index;
    try {
      index = Integer.parseInt(register.substring(start));
    } catch (NumberFormatException e) {
      throw new IllegalStateException("Malformed Pauli product register name " + register, e);
    }
    if (index < 0 || index >= input.numberPauliProducts) {
      throw new IllegalStateException(
          String.format(
              "Register %s: Pauli product %s out of range [0, %s)",
              register,
              index,
              input.numberPauliProducts));
    }
    return index;
  }

  @Override
  public Map<String, Object> toConfig() {
    Map<String, Object> config = new LinkedHashMap<>();
    config.put(TYPE_KEY, TYPE);
    config.put("measurement_input", input.toConfig());
    putCommonConfig(config);
    return config;
  }

  public static CheatedBasisRotationMeasurement fromConfig(ConfigReader config) {
    config.requireType(TYPE);
    return withResumeList(
        new CheatedBasisRotationMeasurement(
            null,
            CheatedBasisRotationMeasurementInput.fromConfig(config.getChild("measurement_input")),
            circuitsFromConfig(config),
            constantCircuitFromConfig(config)),
        config);
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof CheatedBasisRotationMeasurement m
        && input.equals(m.input)
        && sameCommonFields(m);
  }

  @Override
  public int hashCode() {
    return Objects.hash(TYPE, input);
  }
}
