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
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.qircuit.config.ConfigReader;
import org.qircuit.config.Configurable;
import org.qircuit.util.ComplexMatrix;

/**
 * Describes which Pauli products a {@link BasisRotationMeasurement} reads from each register and
 * how it combines them into expectation values.
 *
 * <p>For example, to measure {@code 3 <Z0> + <Z0 Z1>} from register "ro" use the masks {@code
 * {ro: {0: [0], 1: [0, 1]}}}, the 1x2 matrix {@code [[3, 1]]}, two qubits, two Pauli products and
 * one name. A Pauli product with an empty qubit list is the identity and always measures 1.
 */
public final class BasisRotationMeasurementInput implements Configurable {
  public static final String TYPE = "BasisRotationMeasurementInput";

  /** Registers whose name ends with this hold bit-complemented companion measurements. */
  public static final String FLIPPED_SUFFIX = "_flipped";

  /** Register name to (Pauli product index to the qubits whose parity gives that product). */
  public final ImmutableMap<String, ImmutableMap<Integer, ImmutableList<Integer>>> masks;

  /** Maps the vector of Pauli products to the vector of expectation values. */
  public final ComplexMatrix matrix;

  public final int numberQubits;
  public final int numberPauliProducts;

  /** The names of the expectation values, one per matrix row. */
  public final ImmutableList<String> names;

  public final boolean useFlippedMeasurement;

  /**
   * @throws IllegalArgumentException if the matrix is not {@code names x numberPauliProducts}, a
   *     mask refers to a Pauli product or qubit out of range, or flipped measurement is enabled
   *     and some register has no flipped companion
   */
  public BasisRotationMeasurementInput(
      Map<String, ? extends Map<Integer, ? extends List<Integer>>> masks,
      ComplexMatrix matrix,
      int numberQubits,
      int numberPauliProducts,
      List<String> names,
      boolean useFlippedMeasurement) {
    ImmutableMap.Builder<String, ImmutableMap<Integer, ImmutableList<Integer>>> builder =
        ImmutableMap.builder();
    masks.forEach(
        (register, mask) -> {
          ImmutableMap.Builder<Integer, ImmutableList<Integer>> m = ImmutableMap.builder();
          mask.forEach((index, qubits) -> m.put(index, ImmutableList.copyOf(qubits)));
          builder.put(register, m.buildOrThrow());
        });
    this.masks = builder.buildOrThrow();
    this.matrix = matrix;
    this.numberQubits = numberQubits;
    this.numberPauliProducts = numberPauliProducts;
    this.names = ImmutableList.copyOf(names);
    this.useFlippedMeasurement = useFlippedMeasurement;
    validate();
  }

  private void validate() {
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
    masks.forEach(
        (register, mask) ->
            mask.forEach(
                (index, qubits) -> {
                  Preconditions.checkArgument(
                      index >= 0 && index < numberPauliProducts,
                      "Register %s: Pauli product %s out of range [0, %s)",
                      register,
                      index,
                      numberPauliProducts);
                  for (int q : qubits) {
                    Preconditions.checkArgument(
                        q >= 0 && q < numberQubits,
                        "Register %s: qubit %s out of range [0, %s)",
                        register,
                        q,
                        numberQubits);
                  }
                }));
    if (useFlippedMeasurement) {
      for (String register : masks.keySet()) {
        if (!isFlipped(register)) {
          Preconditions.checkArgument(
              masks.containsKey(register + FLIPPED_SUFFIX),
              "Register %s has no flipped companion %s%s",
              register,
              register,
              FLIPPED_SUFFIX);
        }
      }
    }
  }

  static boolean isFlipped(String register) {
    return register.endsWith(FLIPPED_SUFFIX);
  }

  @Override
  public Map<String, Object> toConfig() {
    Map<String, Object> config = new LinkedHashMap<>();
    config.put(TYPE_KEY, TYPE);
    Map<String, Object> maskConfig = new LinkedHashMap<>();
    masks.forEach(
        (register, mask) -> {
          Map<String, Object> m = new LinkedHashMap<>();
          mask.forEach((index, qubits) -> m.put(String.valueOf(index), new ArrayList<>(qubits)));
          maskConfig.put(register, m);
        });
    config.put("pauli_product_qubit_masks", maskConfig);
    config.put("pp_to_exp_val_matrix", matrix.toConfig());
    config.put("number_qubits", numberQubits);
    config.put("number_pauli_products", numberPauliProducts);
    config.put("measured_exp_vals", new ArrayList<>(names));
    config.put("use_flipped_measurement", useFlippedMeasurement);
    return config;
  }

  public static BasisRotationMeasurementInput fromConfig(ConfigReader config) {
    config.requireType(TYPE);
    Map<String, Map<Integer, List<Integer>>> masks = new LinkedHashMap<>();
    ConfigReader maskConfig = config.getChild("pauli_product_qubit_masks");
    for (String register : maskConfig.asMap().keySet()) {
      ConfigReader mask = maskConfig.getChild(register);
      Map<Integer, List<Integer>> m = new LinkedHashMap<>();
      for (String index : mask.asMap().keySet()) {
        m.put(ConfigReader.parseKey(register, index), mask.getIntList(index));
      }
      masks.put(register, m);
    }
    return new BasisRotationMeasurementInput(
        masks,
        ComplexMatrix.fromConfig(config.getChild("pp_to_exp_val_matrix")),
        config.getInt("number_qubits"),
        config.getInt("number_pauli_products"),
        config.getStringList("measured_exp_vals"),
        config.getBoolean("use_flipped_measurement", false));
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof BasisRotationMeasurementInput m
        && masks.equals(m.masks)
        && matrix.equals(m.matrix)
        && numberQubits == m.numberQubits
        && numberPauliProducts == m.numberPauliProducts
        && names.equals(m.names)
        && useFlippedMeasurement == m.useFlippedMeasurement;
  }

  @Override
  public int hashCode() {
    return Objects.hash(masks, matrix, numberQubits, numberPauliProducts, names);
  }
}
