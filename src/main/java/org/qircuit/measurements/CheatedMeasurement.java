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
import org.qircuit.Hardware.Backend;
import org.qircuit.circuit.Circuit;
import org.qircuit.config.ConfigReader;
import org.qircuit.registers.RegisterOutput;
import org.qircuit.util.Complex;
import org.qircuit.util.SparseComplexMatrix;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Evaluates operators directly on the state a simulator returns (e.g. from {@link
 * org.qircuit.operations.PragmaGetState}): {@code <psi|O|psi>} for a state vector, {@code
 * trace(O rho)} for a density matrix. Only the first row of each register is read.
 */
public final class CheatedMeasurement extends Measurement {
  private static final Logger LOG = LoggerFactory.getLogger(CheatedMeasurement.class);

  public static final String TYPE = "CheatedMeasurement";

  public final CheatedMeasurementInput input;

  public CheatedMeasurement(
      @Nullable Backend backend,
      CheatedMeasurementInput input,
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
    ImmutableMap.Builder<String, Complex> result = ImmutableMap.builder();
    input.operators.forEach(
        (register, named) -> {
          ImmutableList<Complex> state = firstRow(require(outputs, register));
          named.forEach(
              (name, op) -> result.put(EXP_VAL_PREFIX + name, expectationValue(op, state)));
        });
    addGlobalPhase(outputs, result);
    ImmutableMap<String, Complex> values = result.buildOrThrow();
    LOG.debug("Computed {} expectation values", values.size());
    return values;
  }

  private Complex expectationValue(SparseComplexMatrix op, List<Complex> state) {
    Complex value = input.useDensityMatrix ? op.traceWith(state) : op.expectation(state);
    return (Math.abs(value.im) < Complex.TOLERANCE) ? Complex.real(value.re) : value;
  }

  private static ImmutableList<Complex> firstRow(RegisterOutput<?> output) {
    ImmutableList.Builder<Complex> row = ImmutableList.builderWithExpectedSize(output.length);
    for (int i = 0; i < output.length; i++) {
      row.add(output.complexValue(0, i));
    }
    return row.build();
  }

  @Override
  public Map<String, Object> toConfig() {
    Map<String, Object> config = new LinkedHashMap<>();
    config.put(TYPE_KEY, TYPE);
    config.put("measurement_input", input.toConfig());
    putCommonConfig(config);
    return config;
  }

  public static CheatedMeasurement fromConfig(ConfigReader config) {
    config.requireType(TYPE);
    return withResumeList(
        new CheatedMeasurement(
            null,
            CheatedMeasurementInput.fromConfig(config.getChild("measurement_input")),
            circuitsFromConfig(config),
            constantCircuitFromConfig(config)),
        config);
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof CheatedMeasurement m && input.equals(m.input) && sameCommonFields(m);
  }

  @Override
  public int hashCode() {
    return Objects.hash(TYPE, input);
  }
}
