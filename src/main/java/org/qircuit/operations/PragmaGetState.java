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

import com.google.common.collect.ImmutableMap;
import java.util.Map;
import java.util.Objects;
import org.jspecify.annotations.Nullable;
import org.qircuit.circuit.Circuit;
import org.qircuit.config.ConfigReader;

/**
 * Reads the full state vector, the density matrix, or the occupation probabilities of the
 * simulated quantum register into the readout register, after optionally running {@link
 * #circuit()} on a copy of the state. An optional qubit mapping reorders the qubits in the result.
 */
public final class PragmaGetState extends ReadoutPragma {

  /** What is read out. */
  public enum Quantity {
    STATE_VECTOR("PragmaGetStateVector"),
    DENSITY_MATRIX("PragmaGetDensityMatrix"),
    OCCUPATION_PROBABILITY("PragmaGetOccupationProbability");

    public final String operationName;

    Quantity(String operationName) {
      this.operationName = operationName;
    }

    public static @Nullable Quantity forName(String name) {
      for (Quantity q : values()) {
        if (q.operationName.equals(name)) {
          return q;
        }
      }
      return null;
    }
  }

  public final Quantity quantity;

  /** Qubit to position in the result, or null to keep the qubit order. */
  public final @Nullable ImmutableMap<Integer, Integer> qubitMapping;

  private final @Nullable Circuit circuit;

  public PragmaGetState(
      Quantity quantity,
      String readout,
      @Nullable Map<Integer, Integer> qubitMapping,
      @Nullable Circuit circuit) {
    super(readout);
    this.quantity = quantity;
    this.qubitMapping = (qubitMapping == null) ? null : ImmutableMap.copyOf(qubitMapping);
    this.circuit = copyOf(circuit);
  }

  public PragmaGetState(Quantity quantity, String readout) {
    this(quantity, readout, null, null);
  }

  @Override
  public String name() {
    return quantity.operationName;
  }

  /** Returns a copy of the circuit applied before readout, or null if there is none. */
  public @Nullable Circuit circuit() {
    return copyOf(circuit);
  }

  /** Remaps the keys of the qubit mapping and the qubits of the circuit. */
  @Override
  public PragmaGetState remapQubits(Map<Integer, Integer> mapping) {
    if (qubitMapping == null) {
      return this;
    }
    Circuit remapped = (circuit == null) ? null : circuit.copy().remapQubits(mapping);
    return new PragmaGetState(
        quantity, readout, remapKeys(name(), qubitMapping, mapping), remapped);
  }

  @Override
  public String toDialect() {
    String mapping = (qubitMapping == null) ? "" : mappingDialect(qubitMapping);
    return name() + mapping + " " + readout;
  }

  @Override
  public Map<String, Object> toConfig() {
    Map<String, Object> config = baseConfig();
    putMapping(config, qubitMapping);
    putCircuit(config, circuit);
    return config;
  }

  public static PragmaGetState fromConfig(Quantity quantity, ConfigReader config) {
    return new PragmaGetState(
        quantity,
        config.getString("readout"),
        mappingFromConfig(config),
        circuitFromConfig(config));
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof PragmaGetState p
        && quantity == p.quantity
        && readout.equals(p.readout)
        && Objects.equals(qubitMapping, p.qubitMapping)
        && Objects.equals(circuit, p.circuit);
  }

  @Override
  public int hashCode() {
    return Objects.hash(quantity, readout, qubitMapping, circuit);
  }
}
