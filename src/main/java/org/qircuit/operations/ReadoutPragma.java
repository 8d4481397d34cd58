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
import com.google.common.collect.ImmutableSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;
import org.jspecify.annotations.Nullable;
import org.qircuit.circuit.Circuit;
import org.qircuit.config.ConfigReader;
import org.qircuit.config.Configurable;

/**
 * Base class for the measurement pragmas, which read some property of the (simulated) quantum
 * state into the register named {@link #readout}. Unless a subclass says otherwise they act on
 * every qubit and have no symbolic parameters.
 */
public abstract class ReadoutPragma implements Pragma {
  private static final ImmutableSet<Family> FAMILIES =
      ImmutableSet.of(Family.OPERATION, Family.MEASUREMENT, Family.PRAGMA);

  public final String readout;

  ReadoutPragma(String readout) {
    this.readout = readout;
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
    return InvolvedQubits.ALL;
  }

  @Override
  public ReadoutPragma substituteParameters(Map<String, Double> bindings) {
    return this;
  }

  @Override
  public String toString() {
    return toDialect();
  }

  /** Starts a config tree with the type and readout entries. */
  Map<String, Object> baseConfig() {
    Map<String, Object> config = new LinkedHashMap<>();
    config.put(TYPE_KEY, name());
    config.put("readout", readout);
    return config;
  }

  static @Nullable Circuit copyOf(@Nullable Circuit circuit) {
    return (circuit == null) ? null : circuit.copy();
  }

  /** Adds the optional circuit to a config tree. */
  static void putCircuit(Map<String, Object> config, @Nullable Circuit circuit) {
    if (circuit != null) {
      config.put("circuit", circuit.toConfig());
    }
  }

  static @Nullable Circuit circuitFromConfig(ConfigReader config) {
    ConfigReader child = config.getOptionalChild("circuit");
    return (child == null) ? null : Circuit.fromConfig(child);
  }

  /** Adds the optional qubit mapping to a config tree. */
  static void putMapping(
      Map<String, Object> config, @Nullable ImmutableMap<Integer, Integer> qubitMapping) {
    if (qubitMapping != null) {
      config.put("qubit_mapping", Configurable.intKeyed(qubitMapping));
    }
  }

  static @Nullable ImmutableMap<Integer, Integer> mappingFromConfig(ConfigReader config) {
    return config.has("qubit_mapping") ? config.getIntMap("qubit_mapping") : null;
  }

  /**
   * Returns a qubit mapping (from qubit to readout index) whose keys have been sent through {@code
   * mapping}.
   */
  static ImmutableMap<Integer, Integer> remapKeys(
      String operation,
      ImmutableMap<Integer, Integer> qubitMapping,
      Map<Integer, Integer> mapping) {
    ImmutableMap.Builder<Integer, Integer> builder = ImmutableMap.builder();
    qubitMapping.forEach(
        (qubit, index) -> builder.put(InvolvedQubits.remap(operation, qubit, mapping), index));
    return builder.buildOrThrow();
  }

  /** Renders a qubit mapping as {@code (q:i,q:i,)}. */
  static String mappingDialect(ImmutableMap<Integer, Integer> qubitMapping) {
    return qubitMapping.entrySet().stream()
        .map(e -> e.getKey() + ":" + e.getValue() + ",")
        .collect(Collectors.joining("", "(", ")"));
  }
}
