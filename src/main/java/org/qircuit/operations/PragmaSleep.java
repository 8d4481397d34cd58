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
import org.qircuit.config.ConfigReader;

/** Idles the given qubits (or all qubits) for {@link #executionTime} seconds. */
public final class PragmaSleep extends QubitsPragma {
  public static final String NAME = "PragmaSleep";

  public final double executionTime;

  /**
   * @param qubits the sleeping qubits, or null for all qubits
   */
  public PragmaSleep(@Nullable Iterable<Integer> qubits, double executionTime) {
    super(qubits);
    this.executionTime = executionTime;
  }

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public PragmaSleep remapQubits(Map<Integer, Integer> mapping) {
    return new PragmaSleep(remappedQubits(mapping), executionTime);
  }

  @Override
  public String toDialect() {
    return NAME + "(" + executionTime + ")" + qubitsDialect();
  }

  @Override
  public Map<String, Object> toConfig() {
    Map<String, Object> config = baseConfig();
    putQubits(config);
    config.put("execution_time", executionTime);
    return config;
  }

  public static PragmaSleep fromConfig(ConfigReader config) {
    return new PragmaSleep(qubitsFromConfig(config), config.getDouble("execution_time"));
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof PragmaSleep p && sameQubitList(p) && executionTime == p.executionTime;
  }

  @Override
  public int hashCode() {
    return Objects.hash(NAME, qubitsHash(), executionTime);
  }
}
