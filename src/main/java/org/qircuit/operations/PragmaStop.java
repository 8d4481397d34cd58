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

/** Ends a block of operations that are executed in parallel, optionally giving its duration. */
public final class PragmaStop extends QubitsPragma {
  public static final String NAME = "PragmaStop";

  /** Duration of the block in seconds, if known. */
  public final @Nullable Double executionTime;

  /**
   * @param qubits the qubits of the block, or null for all qubits
   */
  public PragmaStop(@Nullable Iterable<Integer> qubits, @Nullable Double executionTime) {
    super(qubits);
    this.executionTime = executionTime;
  }

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public PragmaStop remapQubits(Map<Integer, Integer> mapping) {
    return new PragmaStop(remappedQubits(mapping), executionTime);
  }

  @Override
  public String toDialect() {
    String time = (executionTime == null) ? "" : "(" + executionTime + ")";
    return NAME + time + qubitsDialect();
  }

  @Override
  public Map<String, Object> toConfig() {
    Map<String, Object> config = baseConfig();
    putQubits(config);
    if (executionTime != null) {
      config.put("execution_time", executionTime);
    }
    return config;
  }

  public static PragmaStop fromConfig(ConfigReader config) {
    return new PragmaStop(
        qubitsFromConfig(config),
        config.has("execution_time") ? config.getDouble("execution_time") : null);
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof PragmaStop p
        && sameQubitList(p)
        && Objects.equals(executionTime, p.executionTime);
  }

  @Override
  public int hashCode() {
    return Objects.hash(NAME, qubitsHash(), executionTime);
  }
}
