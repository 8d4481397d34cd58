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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.qircuit.config.ConfigReader;
import org.qircuit.config.Configurable;
import org.qircuit.util.SparseComplexMatrix;

/**
 * The operators a {@link CheatedMeasurement} evaluates: for each register holding a state vector
 * (or, if {@link #useDensityMatrix}, a flattened density matrix), the named operators to take the
 * expectation value of. All operators have the same dimension.
 */
public final class CheatedMeasurementInput implements Configurable {
  public static final String TYPE = "CheatedMeasurementInput";

  public final ImmutableMap<String, ImmutableMap<String, SparseComplexMatrix>> operators;
  public final boolean useDensityMatrix;

  public CheatedMeasurementInput(
      Map<String, ? extends Map<String, SparseComplexMatrix>> operators,
      boolean useDensityMatrix) {
    ImmutableMap.Builder<String, ImmutableMap<String, SparseComplexMatrix>> builder =
        ImmutableMap.builder();
    int[] dimension = {-1};
    operators.forEach(
        (register, named) -> {
          named.forEach(
              (name, op) -> {
                Preconditions.checkArgument(
                    dimension[0] < 0 || dimension[0] == op.dimension(),
                    "Operator %s has dimension %s, expected %s",
                    name,
                    op.dimension(),
                    dimension[0]);
                dimension[0] = op.dimension();
              });
          builder.put(register, ImmutableMap.copyOf(named));
        });
    this.operators = builder.buildOrThrow();
    this.useDensityMatrix = useDensityMatrix;
  }

  @Override
  public Map<String, Object> toConfig() {
    Map<String, Object> config = new LinkedHashMap<>();
    config.put(TYPE_KEY, TYPE);
    Map<String, Object> registers = new LinkedHashMap<>();
    operators.forEach(
        (register, named) -> {
          Map<String, Object> ops = new LinkedHashMap<>();
          named.forEach((name, op) -> ops.put(name, op.toConfig()));
          registers.put(register, ops);
        });
    config.put("operator_matrices", registers);
    config.put("use_density_matrix", useDensityMatrix);
    return config;
  }

  public static CheatedMeasurementInput fromConfig(ConfigReader config) {
    config.requireType(TYPE);
    Map<String, Map<String, SparseComplexMatrix>> operators = new LinkedHashMap<>();
    ConfigReader registers = config.getChild("operator_matrices");
    for (String register : registers.asMap().keySet()) {
      ConfigReader named = registers.getChild(register);
      Map<String, SparseComplexMatrix> ops = new LinkedHashMap<>();
      for (String name : named.asMap().keySet()) {
        ops.put(name, SparseComplexMatrix.fromConfig(named.getChild(name)));
      }
      operators.put(register, ops);
    }
    return new CheatedMeasurementInput(
        operators, config.getBoolean("use_density_matrix", false));
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof CheatedMeasurementInput m
        && operators.equals(m.operators)
        && useDensityMatrix == m.useDensityMatrix;
  }

  @Override
  public int hashCode() {
    return Objects.hash(operators, useDensityMatrix);
  }
}
