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
import org.qircuit.config.ConfigReader;
import org.qircuit.config.Configurable;

/**
 * Starts a block of operations that a compiler should decompose as a unit. The optional reordering
 * dictionary says how qubits are permuted inside the block.
 */
public final class PragmaStartDecompositionBlock extends QubitsPragma {
  public static final String NAME = "PragmaStartDecompositionBlock";

  public final ImmutableMap<Integer, Integer> reorderingDictionary;

  /**
   * @param qubits the qubits of the block, or null for all qubits
   */
  public PragmaStartDecompositionBlock(
      @Nullable Iterable<Integer> qubits, Map<Integer, Integer> reorderingDictionary) {
    super(qubits);
    this.reorderingDictionary = ImmutableMap.copyOf(reorderingDictionary);
  }

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public PragmaStartDecompositionBlock remapQubits(Map<Integer, Integer> mapping) {
    return new PragmaStartDecompositionBlock(remappedQubits(mapping), reorderingDictionary);
  }

  /** Renders as {@code Name({0=1, 1=0}) q q}. */
  @Override
  public String toDialect() {
    return NAME + "(" + reorderingDictionary + ")" + qubitsDialect();
  }

  @Override
  public Map<String, Object> toConfig() {
    Map<String, Object> config = baseConfig();
    putQubits(config);
    config.put("reordering_dictionary", Configurable.intKeyed(reorderingDictionary));
    return config;
  }

  public static PragmaStartDecompositionBlock fromConfig(ConfigReader config) {
    return new PragmaStartDecompositionBlock(
        qubitsFromConfig(config),
        config.has("reordering_dictionary")
            ? config.getIntMap("reordering_dictionary")
            : ImmutableMap.of());
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof PragmaStartDecompositionBlock p
        && sameQubitList(p)
        && reorderingDictionary.equals(p.reorderingDictionary);
  }

  @Override
  public int hashCode() {
    return Objects.hash(NAME, qubitsHash(), reorderingDictionary);
  }
}
