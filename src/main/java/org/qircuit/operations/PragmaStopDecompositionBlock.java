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

/** Ends a block started by {@link PragmaStartDecompositionBlock}. */
public final class PragmaStopDecompositionBlock extends QubitsPragma {
  public static final String NAME = "PragmaStopDecompositionBlock";

  /**
   * @param qubits the qubits of the block, or null for all qubits
   */
  public PragmaStopDecompositionBlock(@Nullable Iterable<Integer> qubits) {
    super(qubits);
  }

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public PragmaStopDecompositionBlock remapQubits(Map<Integer, Integer> mapping) {
    return new PragmaStopDecompositionBlock(remappedQubits(mapping));
  }

  @Override
  public String toDialect() {
    return NAME + qubitsDialect();
  }

  @Override
  public Map<String, Object> toConfig() {
    Map<String, Object> config = baseConfig();
    putQubits(config);
    return config;
  }

  public static PragmaStopDecompositionBlock fromConfig(ConfigReader config) {
    return new PragmaStopDecompositionBlock(qubitsFromConfig(config));
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof PragmaStopDecompositionBlock p && sameQubitList(p);
  }

  @Override
  public int hashCode() {
    return Objects.hash(NAME, qubitsHash());
  }
}
