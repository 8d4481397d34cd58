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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Map;
import java.util.Objects;
import org.qircuit.config.ConfigReader;

/**
 * A single cheated measurement of a product of Pauli operators, written to one entry of the
 * readout register. Paulis are encoded as 0 (identity), 1 (X), 2 (Y) and 3 (Z).
 */
public final class PragmaPauliProdMeasurement extends ReadoutPragma {
  public static final String NAME = "PragmaPauliProdMeasurement";

  public final ImmutableList<Integer> qubits;
  public final ImmutableList<Integer> paulis;
  public final int readoutIndex;

  public PragmaPauliProdMeasurement(
      Iterable<Integer> qubits, Iterable<Integer> paulis, String readout, int readoutIndex) {
    super(readout);
    this.qubits = ImmutableList.copyOf(qubits);
    this.paulis = ImmutableList.copyOf(paulis);
    Preconditions.checkArgument(
        this.qubits.size() == this.paulis.size(),
        "%s qubits but %s Pauli operators",
        this.qubits.size(),
        this.paulis.size());
    for (int p : this.paulis) {
      Preconditions.checkArgument(p >= 0 && p <= 3, "Invalid Pauli operator %s", p);
    }
    this.readoutIndex = readoutIndex;
  }

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public InvolvedQubits involvedQubits() {
    return InvolvedQubits.of(qubits);
  }

  @Override
  public boolean supportsRemap() {
    return false;
  }

  @Override
  public PragmaPauliProdMeasurement remapQubits(Map<Integer, Integer> mapping) {
    throw OperationError.remapNotSupported(NAME);
  }

  /** Renders as {@code Name q, p q, p ro[i]}. */
  @Override
  public String toDialect() {
    StringBuilder sb = new StringBuilder(NAME).append(' ');
    for (int i = 0; i < qubits.size(); i++) {
      sb.append(qubits.get(i)).append(", ").append(paulis.get(i)).append(' ');
    }
    return sb.append(readout).append('[').append(readoutIndex).append(']').toString();
  }

  @Override
  public Map<String, Object> toConfig() {
    Map<String, Object> config = baseConfig();
    config.put("qubits", new ArrayList<>(qubits));
    config.put("paulis", new ArrayList<>(paulis));
    config.put("readout_index", readoutIndex);
    return config;
  }

  public static PragmaPauliProdMeasurement fromConfig(ConfigReader config) {
    return new PragmaPauliProdMeasurement(
        config.getIntList("qubits"),
        config.getIntList("paulis"),
        config.getString("readout"),
        config.getInt("readout_index"));
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof PragmaPauliProdMeasurement p
        && qubits.equals(p.qubits)
        && paulis.equals(p.paulis)
        && readout.equals(p.readout)
        && readoutIndex == p.readoutIndex;
  }

  @Override
  public int hashCode() {
    return Objects.hash(qubits, paulis, readout, readoutIndex);
  }
}
