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

import java.util.Map;
import java.util.Objects;
import org.jspecify.annotations.Nullable;
import org.qircuit.circuit.Circuit;
import org.qircuit.config.ConfigReader;

/**
 * Reads the occupation probabilities of the quantum register after a basis rotation given by
 * {@link #circuit()}.
 */
public final class PragmaGetRotatedOccupationProbability extends ReadoutPragma {
  public static final String NAME = "PragmaGetRotatedOccupationProbability";

  private final @Nullable Circuit circuit;

  public PragmaGetRotatedOccupationProbability(String readout, @Nullable Circuit circuit) {
    super(readout);
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
  public PragmaGetRotatedOccupationProbability remapQubits(Map<Integer, Integer> mapping) {
    throw OperationError.remapNotSupported(NAME);
  }

  @Override
  public String toDialect() {
    return NAME + " " + readout;
  }

  @Override
  public Map<String, Object> toConfig() {
    Map<String, Object> config = baseConfig();
    putCircuit(config, circuit);
    return config;
  }

  public static PragmaGetRotatedOccupationProbability fromConfig(ConfigReader config) {
    return new PragmaGetRotatedOccupationProbability(
        config.getString("readout"), circuitFromConfig(config));
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof PragmaGetRotatedOccupationProbability p
        && readout.equals(p.readout)
        && Objects.equals(circuit, p.circuit);
  }

  @Override
  public int hashCode() {
    return Objects.hash(NAME, readout, circuit);
  }
}
