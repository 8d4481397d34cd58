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
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.qircuit.config.ConfigReader;
import org.qircuit.config.Configurable;
import org.qircuit.util.ComplexMatrix;

/** The matrix and names a {@link CheatedBasisRotationMeasurement} needs. */
public final class CheatedBasisRotationMeasurementInput implements Configurable {
  public static final String TYPE = "CheatedBasisRotationMeasurementInput";

  public final ComplexMatrix matrix;
  public final int numberPauliProducts;
  public final ImmutableList<String> names;

  public CheatedBasisRotationMeasurementInput(
      ComplexMatrix matrix, int numberPauliProducts, List<String> names) {
    Preconditions.checkArgument(
        matrix.rows() == names.size(),
        "Matrix has %s rows for %s expectation values",
        matrix.rows(),
        names.size());
    Preconditions.checkArgument(
        matrix.rows() == 0 || matrix.columns() == numberPauliProducts,
        "Matrix has %s columns for %s Pauli products",
        matrix.columns(),
        numberPauliProducts);
    this.matrix = matrix;
    this.numberPauliProducts = numberPauliProducts;
    this.names = ImmutableList.copyOf(names);
  }

  @Override
  public Map<String, Object> toConfig() {
    Map<String, Object> config = new LinkedHashMap<>();
    config.put(TYPE_KEY, TYPE);
    config.put("pp_to_exp_val_matrix", matrix.toConfig());
    config.put("number_pauli_products", numberPauliProducts);
    config.put("measured_exp_vals", new ArrayList<>(names));
    return config;
  }

  public static CheatedBasisRotationMeasurementInput fromConfig(ConfigReader config) {
    config.requireType(TYPE);
    return new CheatedBasisRotationMeasurementInput(
        ComplexMatrix.fromConfig(config.getChild("pp_to_exp_val_matrix")),
        config.getInt("number_pauli_products"),
        config.getStringList("measured_exp_vals"));
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof CheatedBasisRotationMeasurementInput m
        && matrix.equals(m.matrix)
        && numberPauliProducts == m.numberPauliProducts
        && names.equals(m.names);
  }

  @Override
  public int hashCode() {
    return Objects.hash(matrix, numberPauliProducts, names);
  }
}
