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
import com.google.common.collect.ImmutableSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.qircuit.config.ConfigReader;

/** Measures one qubit in the Z basis and stores the result in one bit of a readout register. */
public final class MeasureQubit implements Operation {
  public static final String NAME = "MeasureQubit";

  private static final ImmutableSet<Family> FAMILIES =
      ImmutableSet.of(Family.OPERATION, Family.MEASUREMENT);

  public final int qubit;
  public final String readout;
  public final int readoutIndex;

  public MeasureQubit(int qubit, String readout, int readoutIndex) {
    Preconditions.checkArgument(readoutIndex >= 0, "Negative readout index %s", readoutIndex);
    this.qubit = qubit;
    this.readout = readout;
    this.readoutIndex = readoutIndex;
  }

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public ImmutableSet<Family> families() {
    return FAMILIES;
  }

  @Override
  public boolean isParametrized() {
    return false;
  }

  @Override
  public InvolvedQubits involvedQubits() {
    return InvolvedQubits.of(qubit);
  }

  @Override
  public MeasureQubit substituteParameters(Map<String, Double> bindings) {
    return this;
  }

  @Override
  public MeasureQubit remapQubits(Map<Integer, Integer> mapping) {
    return new MeasureQubit(InvolvedQubits.remap(NAME, qubit, mapping), readout, readoutIndex);
  }

  @Override
  public boolean sameQubits(Operation other) {
    return other instanceof MeasureQubit m && m.qubit == qubit;
  }

  @Override
  public String toDialect() {
    return String.format("%s %s %s[%s]", NAME, qubit, readout, readoutIndex);
  }

  @Override
  public Map<String, Object> toConfig() {
    Map<String, Object> config = new LinkedHashMap<>();
    config.put(TYPE_KEY, NAME);
    config.put("qubit", qubit);
    config.put("readout", readout);
    config.put("readout_index", readoutIndex);
    return config;
  }

  public static MeasureQubit fromConfig(ConfigReader config) {
    return new MeasureQubit(
        config.getInt("qubit"), config.getString("readout"), config.getInt("readout_index"));
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof MeasureQubit m
        && qubit == m.qubit
        && readout.equals(m.readout)
        && readoutIndex == m.readoutIndex;
  }

  @Override
  public int hashCode() {
    return Objects.hash(qubit, readout, readoutIndex);
  }

  @Override
  public String toString() {
    return toDialect();
  }
}
