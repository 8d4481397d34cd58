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

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.qircuit.config.ConfigReader;

/**
 * Base class for pragmas that apply to an explicit list of qubits or to all of them. Remapping is
 * supported only for an explicit list.
 */
public abstract class QubitsPragma extends AbstractPragma {
  static final String ALL = "ALL";

  /** The qubits, or null for all qubits. */
  private final @Nullable ImmutableList<Integer> qubits;

  QubitsPragma(@Nullable Iterable<Integer> qubits) {
    this.qubits = (qubits == null) ? null : ImmutableList.copyOf(qubits);
  }

  /** True if this pragma applies to every qubit. */
  public boolean isAll() {
    return qubits == null;
  }

  /** The explicit qubits; may not be called if {@link #isAll}. */
  public ImmutableList<Integer> qubits() {
    if (qubits == null) {
      throw new IllegalStateException(name() + " applies to ALL qubits");
    }
    return qubits;
  }

  @Override
  public InvolvedQubits involvedQubits() {
    return (qubits == null) ? InvolvedQubits.ALL : InvolvedQubits.of(qubits);
  }

  @Override
  public boolean supportsRemap() {
    return qubits != null;
  }

  /** Returns the remapped qubit list; throws if this pragma applies to all qubits. */
  ImmutableList<Integer> remappedQubits(Map<Integer, Integer> mapping) {
    if (qubits == null) {
      throw OperationError.remapNotSupported(name());
    }
    return qubits.stream()
        .map(q -> InvolvedQubits.remap(name(), q, mapping))
        .collect(ImmutableList.toImmutableList());
  }

  /** Renders the qubits as {@code " ALL"} or {@code " q1 q2"}. */
  String qubitsDialect() {
    if (qubits == null) {
      return " " + ALL;
    }
    StringBuilder sb = new StringBuilder();
    qubits.forEach(q -> sb.append(' ').append(q));
    return sb.toString();
  }

  /** Adds the qubits to a config tree, as a list of ints or the string {@code "ALL"}. */
  void putQubits(Map<String, Object> config) {
    config.put("qubits", (qubits == null) ? ALL : new ArrayList<>(qubits));
  }

  static @Nullable ImmutableList<Integer> qubitsFromConfig(ConfigReader config) {
    if (!config.has("qubits") || ALL.equals(config.asMap().get("qubits"))) {
      return null;
    }
    return config.getIntList("qubits");
  }

  boolean sameQubitList(QubitsPragma other) {
    return (qubits == null) ? other.qubits == null : qubits.equals(other.qubits);
  }

  int qubitsHash() {
    return (qubits == null) ? 0 : qubits.hashCode();
  }
}
