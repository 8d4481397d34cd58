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
import com.google.common.collect.ImmutableMap;
import java.util.Map;
import java.util.Objects;
import org.jspecify.annotations.Nullable;
import org.qircuit.config.ConfigReader;

/**
 * Measures all qubits (or the qubits in {@link #qubitMapping}) {@link #numberMeasurements} times,
 * writing one row of the readout register per measurement.
 */
public final class PragmaRepeatedMeasurement extends ReadoutPragma {
  public static final String NAME = "PragmaRepeatedMeasurement";

  public final int numberMeasurements;

  /** Qubit to readout index, or null to measure every qubit into the index of the same number. */
  public final @Nullable ImmutableMap<Integer, Integer> qubitMapping;

  public PragmaRepeatedMeasurement(
      String readout, int numberMeasurements, @Nullable Map<Integer, Integer> qubitMapping) {
    super(readout);
    Preconditions.checkArgument(
        numberMeasurements >= 0, "Negative number of measurements %s", numberMeasurements);
    this.numberMeasurements = numberMeasurements;
    this.qubitMapping = (qubitMapping == null) ? null : ImmutableMap.copyOf(qubitMapping);
  }

  public PragmaRepeatedMeasurement(String readout, int numberMeasurements) {
    this(readout, numberMeasurements, null);
  }

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public PragmaRepeatedMeasurement remapQubits(Map<Integer, Integer> mapping) {
    if (qubitMapping == null) {
      return this;
    }
    return new PragmaRepeatedMeasurement(
        readout, numberMeasurements, remapKeys(NAME, qubitMapping, mapping));
  }

  /** AQT backends take the readout register name from the circuit. */
  @Override
  public @Nullable ImmutableMap<String, Object> backendInstruction(BackendTarget target) {
    if (target != BackendTarget.AQT) {
      return null;
    }
    return ImmutableMap.of("readout", readout);
  }

  /** Renders as {@code Name(N) ALL ro}, or {@code Name(N) q ro[i] q ro[i]} with a mapping. */
  @Override
  public String toDialect() {
    StringBuilder sb = new StringBuilder(NAME).append('(').append(numberMeasurements).append(')');
    if (qubitMapping == null) {
      sb.append(" ALL ").append(readout);
    } else {
      qubitMapping.forEach(
          (qubit, index) -> sb.append(String.format(" %s %s[%s]", qubit, readout, index)));
    }
    return sb.toString();
  }

  @Override
  public Map<String, Object> toConfig() {
    Map<String, Object> config = baseConfig();
    config.put("number_measurements", numberMeasurements);
    putMapping(config, qubitMapping);
    return config;
  }

  public static PragmaRepeatedMeasurement fromConfig(ConfigReader config) {
    return new PragmaRepeatedMeasurement(
        config.getString("readout"),
        config.getInt("number_measurements"),
        mappingFromConfig(config));
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof PragmaRepeatedMeasurement p
        && readout.equals(p.readout)
        && numberMeasurements == p.numberMeasurements
        && Objects.equals(qubitMapping, p.qubitMapping);
  }

  @Override
  public int hashCode() {
    return Objects.hash(readout, numberMeasurements, qubitMapping);
  }
}
