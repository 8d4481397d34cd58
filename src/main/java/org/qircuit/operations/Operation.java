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
import com.google.common.collect.ImmutableSet;
import java.util.Map;
import org.qircuit.config.Configurable;

/**
 * One instruction in a circuit: a Definition, a unitary gate, a measurement or a pragma.
 *
 * <p>Operations are immutable. Methods that change an operation ({@link #substituteParameters},
 * {@link #remapQubits}) return a new operation, or this one if nothing changed.
 */
public interface Operation extends Configurable {

  /** The variant name; also the first word of its dialect rendering and its config type. */
  String name();

  /** The families this operation belongs to; always includes {@link Family#OPERATION}. */
  ImmutableSet<Family> families();

  /** Returns the family tags followed by the variant name. */
  default ImmutableList<String> tags() {
    ImmutableList.Builder<String> builder = ImmutableList.builder();
    families().forEach(f -> builder.add(f.tag));
    return builder.add(name()).build();
  }

  default boolean is(Family family) {
    return families().contains(family);
  }

  /** True if any numeric field of this operation is still a symbolic expression. */
  boolean isParametrized();

  InvolvedQubits involvedQubits();

  /**
   * Returns a copy of this operation in which every symbolic field has been re-evaluated with the
   * given bindings. Fields that still contain unbound variables are left symbolic.
   */
  Operation substituteParameters(Map<String, Double> bindings);

  /** False if {@link #remapQubits} will always throw a REMAP_NOT_SUPPORTED OperationError. */
  default boolean supportsRemap() {
    return true;
  }

  /**
   * Returns a copy of this operation with every qubit index {@code q} replaced by {@code
   * mapping.get(q)}.
   *
   * @throws OperationError if remapping is not supported or the mapping lacks an involved qubit
   */
  Operation remapQubits(Map<Integer, Integer> mapping);

  /**
   * True if {@code other} is the same variant as this and, for variants with named qubit roles,
   * assigns each role to the same qubit.
   */
  default boolean sameQubits(Operation other) {
    return name().equals(other.name());
  }

  /** Returns the single-line dialect rendering of this operation. */
  String toDialect();
}
