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
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.Map;
import org.qircuit.expr.SymbolicValue;

/**
 * The fixed domain of a gate-like variant: its name, the names of its qubit roles and their
 * default indices, the names of its parameters and their defaults, and which parameters measure
 * rotation strength (and so are scaled by exponentiation).
 */
public final class GateTemplate {
  public final String name;

  /** Qubit role names, in rendering order, with their default indices. */
  public final ImmutableMap<String, Integer> defaultQubits;

  /** Parameter names, in rendering order, with their default values. */
  public final ImmutableMap<String, SymbolicValue> defaultParameters;

  /** Rotation-strength parameter names with the modulus of their period. */
  public final ImmutableMap<String, Double> rotationModulo;

  /** True if applying the gate twice is the identity. */
  public final boolean selfInverse;

  private GateTemplate(Builder builder) {
    this.name = builder.name;
    this.defaultQubits = builder.qubits.buildOrThrow();
    this.defaultParameters = builder.parameters.buildOrThrow();
    this.rotationModulo = builder.rotations.buildOrThrow();
    this.selfInverse = builder.selfInverse;
  }

  /** A single-qubit variant with role {@code qubit}. */
  static Builder single(String name) {
    return new Builder(name).role("qubit", 0);
  }

  /** A two-qubit variant whose most significant qubit is {@code control}. */
  static Builder controlled(String name) {
    return new Builder(name).role("control", 1).role("qubit", 0);
  }

  /** Same roles as {@link #controlled}, but rendered and stored with {@code qubit} first. */
  static Builder targetFirst(String name) {
    return new Builder(name).role("qubit", 0).role("control", 1);
  }

  /** A two-qubit variant that is symmetric under exchange of its qubits {@code i} and {@code j}. */
  static Builder symmetric(String name) {
    return new Builder(name).role("i", 0).role("j", 1);
  }

  /**
   * Returns the complete qubit mapping for a new operation: every role must be given, and no other
   * names are allowed.
   */
  ImmutableMap<String, Integer> checkQubits(Map<String, Integer> qubits) {
    Preconditions.checkArgument(
        qubits.keySet().equals(defaultQubits.keySet()),
        "%s expects qubits %s, got %s",
        name,
        defaultQubits.keySet(),
        qubits.keySet());
    ImmutableMap.Builder<String, Integer> builder = ImmutableMap.builder();
    defaultQubits.keySet().forEach(role -> builder.put(role, qubits.get(role)));
    return builder.buildOrThrow();
  }

  /**
   * Returns the complete parameter mapping for a new operation, filling in defaults for missing
   * parameters. Unknown parameter names are an error.
   */
  ImmutableMap<String, SymbolicValue> withDefaults(Map<String, SymbolicValue> parameters) {
    for (String key : parameters.keySet()) {
      Preconditions.checkArgument(
          defaultParameters.containsKey(key), "%s has no parameter \"%s\"", name, key);
    }
    ImmutableMap.Builder<String, SymbolicValue> builder = ImmutableMap.builder();
    defaultParameters.forEach((key, dflt) -> builder.put(key, parameters.getOrDefault(key, dflt)));
    return builder.buildOrThrow();
  }

  static class Builder {
    final String name;
    final ImmutableMap.Builder<String, Integer> qubits = ImmutableMap.builder();
    final ImmutableMap.Builder<String, SymbolicValue> parameters = ImmutableMap.builder();
    final ImmutableMap.Builder<String, Double> rotations = ImmutableMap.builder();
    boolean selfInverse;

    Builder(String name) {
      this.name = name;
    }

    @CanIgnoreReturnValue
    Builder role(String role, int defaultQubit) {
      qubits.put(role, defaultQubit);
      return this;
    }

    @CanIgnoreReturnValue
    Builder param(String param, double defaultValue) {
      parameters.put(param, SymbolicValue.of(defaultValue));
      return this;
    }

    /** Adds a parameter that defaults to zero and is scaled by exponentiation. */
    @CanIgnoreReturnValue
    Builder rotation(String param, double modulo) {
      param(param, 0);
      rotations.put(param, modulo);
      return this;
    }

    @CanIgnoreReturnValue
    Builder selfInverse() {
      selfInverse = true;
      return this;
    }

    GateTemplate build() {
      return new GateTemplate(this);
    }
  }
}
