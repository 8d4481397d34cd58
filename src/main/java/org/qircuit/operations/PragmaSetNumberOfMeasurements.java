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

/** Sets how many times the circuit is run (shots) when filling {@link #readout}. */
public final class PragmaSetNumberOfMeasurements extends AbstractPragma {
  public static final String NAME = "PragmaSetNumberOfMeasurements";

  public final int numberMeasurements;
  public final String readout;

  public PragmaSetNumberOfMeasurements(int numberMeasurements, String readout) {
    Preconditions.checkArgument(
        numberMeasurements >= 0, "Negative number of measurements %s", numberMeasurements);
    this.numberMeasurements = numberMeasurements;
    this.readout = readout;
  }

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public InvolvedQubits involvedQubits() {
    return InvolvedQubits.NONE;
  }

  @Override
  public PragmaSetNumberOfMeasurements remapQubits(Map<Integer, Integer> mapping) {
    return this;
  }

  /** Every backend except the simulator takes its number of shots from this pragma. */
  @Override
  public @Nullable ImmutableMap<String, Object> backendInstruction(BackendTarget target) {
    if (target == BackendTarget.SIMULATOR) {
      return null;
    }
    return ImmutableMap.of("number_measurements", numberMeasurements);
  }

  @Override
  public String toDialect() {
    return String.format("%s(%s) %s", NAME, numberMeasurements, readout);
  }

  @Override
  public Map<String, Object> toConfig() {
    Map<String, Object> config = baseConfig();
    config.put("number_measurements", numberMeasurements);
    config.put("readout", readout);
    return config;
  }

  public static PragmaSetNumberOfMeasurements fromConfig(ConfigReader config) {
    return new PragmaSetNumberOfMeasurements(
        config.getInt("number_measurements"), config.getString("readout"));
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof PragmaSetNumberOfMeasurements p
        && numberMeasurements == p.numberMeasurements
        && readout.equals(p.readout);
  }

  @Override
  public int hashCode() {
    return Objects.hash(numberMeasurements, readout);
  }
}
