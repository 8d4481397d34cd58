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

package org.qircuit.operations;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Map;
import java.util.Objects;
import org.jspecify.annotations.Nullable;
import org.qircuit.circuit.Circuit;
import org.qircuit.config.ConfigReader;

/**
 * Reads the expectation value of the product of Pauli Z operators on {@link #pauliProduct}, after
 * the basis rotation given by {@link #circuit()}.
 */
public final class PragmaGetPauliProduct extends ReadoutPragma {
  public static final String NAME = "PragmaGetPauliProduct";

  /** The qubits in the product; empty for the identity. */
  public final ImmutableList<Integer> pauliProduct;

  private final @Nullable Circuit circuit;

  public PragmaGetPauliProduct(
      Iterable<Integer> pauliProduct, String readout, @Nullable Circuit circuit) {
    super(readout);
    this.pauliProduct = ImmutableList.copyOf(pauliProduct);
    this.circuit = copyOf(circuit);
  }

  @Override
  public String name() {
    return NAME;
  }

  public @Nullable Circuit circuit() {
    return copyOf(circuit);
  }

  @Override
  public boolean supportsRemap() {
    return false;
  }

  @Override
  public PragmaGetPauliProduct remapQubits(Map<Integer, Integer> mapping) {
    throw OperationError.remapNotSupported(NAME);
  }

  @Override
  public String toDialect() {
    return NAME + " " + readout;
  }

  @Override
  public Map<String, Object> toConfig() {
    Map<String, Object> config = baseConfig();
    config.put("pauli_product", new ArrayList<>(pauliProduct));
    putCircuit(config, circuit);
    return config;
  }

  public static PragmaGetPauliProduct fromConfig(ConfigReader config) {
    return new PragmaGetPauliProduct(
        config.getIntList("pauli_product"),
        config.getString("readout"),
        circuitFromConfig(config));
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof PragmaGetPauliProduct p
        && pauliProduct.equals(p.pauliProduct)
        && readout.equals(p.readout)
        && Objects.equals(circuit, p.circuit);
  }

  @Override
  public int hashCode() {
    return Objects.hash(pauliProduct, readout, circuit);
  }
}
