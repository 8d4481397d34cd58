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
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.primitives.Ints;
import java.util.Map;

/**
 * The qubits an operation acts on: either a set of qubit indices or {@link #ALL}, which stands for
 * every qubit of the device.
 */
public final class InvolvedQubits {
  /** The operation acts on every qubit. */
  public static final InvolvedQubits ALL = new InvolvedQubits(null);

  /** The operation acts on no qubits (e.g. a Definition). */
  public static final InvolvedQubits NONE = new InvolvedQubits(ImmutableSortedSet.of());

  /** Null iff this is {@link #ALL}. */
  private final ImmutableSortedSet<Integer> qubits;

  private InvolvedQubits(ImmutableSortedSet<Integer> qubits) {
    this.qubits = qubits;
  }

  public static InvolvedQubits of(int... qubits) {
    return of(Ints.asList(qubits));
  }

  public static InvolvedQubits of(Iterable<Integer> qubits) {
    ImmutableSortedSet<Integer> set = ImmutableSortedSet.copyOf(qubits);
    return set.isEmpty() ? NONE : new InvolvedQubits(set);
  }

  public boolean isAll() {
    return qubits == null;
  }

  /** Returns the qubit indices; may not be called on {@link #ALL}. */
  public ImmutableSortedSet<Integer> qubits() {
    Preconditions.checkState(qubits != null, "ALL has no explicit qubits");
    return qubits;
  }

  /** True if the operation acts on the given qubit; always true for {@link #ALL}. */
  public boolean contains(int qubit) {
    return qubits == null || qubits.contains(qubit);
  }

  /**
   * Returns the index that {@code mapping} sends {@code qubit} to.
   *
   * @throws OperationError if the mapping has no entry for {@code qubit}
   */
  static int remap(String operation, int qubit, Map<Integer, Integer> mapping) {
    Integer result = mapping.get(qubit);
    if (result == null) {
      throw OperationError.of(
          OperationError.Kind.MISSING_QUBIT_MAPPING,
          operation,
          "Qubit mapping for %s has no entry for qubit %s",
          operation,
          qubit);
    }
    return result;
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    return other instanceof InvolvedQubits q && qubits != null && qubits.equals(q.qubits);
  }

  @Override
  public int hashCode() {
    return (qubits == null) ? -1 : qubits.hashCode();
  }

  @Override
  public String toString() {
    return (qubits == null) ? "ALL" : qubits.toString();
  }
}
