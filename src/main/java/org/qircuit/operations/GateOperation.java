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
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.qircuit.config.ConfigReader;
import org.qircuit.expr.SymbolicValue;
import org.qircuit.util.Complex;
import org.qircuit.util.ComplexMatrix;

/** A unitary gate: one of the {@link GateType} variants applied to specific qubits. */
public final class GateOperation extends GateLikeOperation {
  private static final ImmutableSet<Family> SINGLE_QUBIT_FAMILIES =
      ImmutableSet.of(Family.OPERATION, Family.GATE_OPERATION, Family.SINGLE_QUBIT_GATE_OPERATION);

  private static final ImmutableSet<Family> TWO_QUBIT_FAMILIES =
      ImmutableSet.of(Family.OPERATION, Family.GATE_OPERATION, Family.TWO_QUBIT_GATE_OPERATION);

  public final GateType type;

  GateOperation(
      GateType type, Map<String, Integer> qubits, Map<String, SymbolicValue> parameters) {
    super(type.template, qubits, parameters);
    this.type = type;
  }

  /**
   * Returns a gate of the given type on the given qubits (in the type's role order), with every
   * parameter at its default.
   */
  public static GateOperation of(GateType type, int... qubits) {
    ImmutableList<String> roles = type.template.defaultQubits.keySet().asList();
    Preconditions.checkArgument(
        qubits.length == roles.size(),
        "%s expects %s qubits, got %s",
        type.template.name,
        roles.size(),
        qubits.length);
    Map<String, Integer> qubitMap = new LinkedHashMap<>();
    for (int i = 0; i < qubits.length; i++) {
      qubitMap.put(roles.get(i), qubits[i]);
    }
    return new GateOperation(type, qubitMap, ImmutableMap.of());
  }

  public static GateOperation of(
      GateType type, Map<String, Integer> qubits, Map<String, SymbolicValue> parameters) {
    return new GateOperation(type, qubits, parameters);
  }

  /** Returns a copy of this gate with one parameter changed. */
  public GateOperation withParameter(String name, SymbolicValue value) {
    Preconditions.checkArgument(
        parameters().containsKey(name), "%s has no parameter \"%s\"", name(), name);
    Map<String, SymbolicValue> updated = new LinkedHashMap<>(parameters());
    updated.put(name, value);
    return new GateOperation(type, qubits(), updated);
  }

  public GateOperation withParameter(String name, double value) {
    return withParameter(name, SymbolicValue.of(value));
  }

  /** Sets a parameter to a symbolic expression, e.g. {@code "theta / 2"}. */
  public GateOperation withParameter(String name, String expression) {
    return withParameter(name, SymbolicValue.of(expression));
  }

  @Override
  GateOperation with(
      ImmutableMap<String, Integer> qubits, ImmutableMap<String, SymbolicValue> parameters) {
    return new GateOperation(type, qubits, parameters);
  }

  @Override
  public ImmutableSet<Family> families() {
    return type.isSingleQubit() ? SINGLE_QUBIT_FAMILIES : TWO_QUBIT_FAMILIES;
  }

  public boolean isSelfInverse() {
    return type.template.selfInverse;
  }

  /**
   * Returns the gate's unitary matrix (2x2 or 4x4).
   *
   * @throws OperationError if any parameter is symbolic
   */
  public ComplexMatrix unitaryMatrix() {
    if (isParametrized()) {
      throw OperationError.unresolved(name());
    }
    return type.matrix(new GateParameters(parameters()));
  }

  /** Returns the alpha/beta/global phase form of a single-qubit gate; entries may be symbolic. */
  public SingleQubitCoefficients coefficients() {
    Preconditions.checkState(type.isSingleQubit(), "%s is not a single-qubit gate", name());
    return type.coefficients(new GateParameters(parameters()));
  }

  /** Returns the equivalent generic {@link GateType#SINGLE_QUBIT_GATE}. */
  public GateOperation toSingleQubitGate() {
    return fromCoefficients(qubit("qubit"), coefficients());
  }

  private static GateOperation fromCoefficients(int qubit, SingleQubitCoefficients c) {
    return new GateOperation(
        GateType.SINGLE_QUBIT_GATE,
        ImmutableMap.of("qubit", qubit),
        ImmutableMap.of(
            "alpha_r", c.alphaR,
            "alpha_i", c.alphaI,
            "beta_r", c.betaR,
            "beta_i", c.betaI,
            "global_phase", c.globalPhase));
  }

  /**
   * Returns the single-qubit gate whose matrix is {@code this.unitaryMatrix() *
   * other.unitaryMatrix()}, i.e. the result of applying {@code other} first.
   *
   * @throws OperationError if either gate is not a single-qubit gate or they act on different
   *     qubits
   */
  public GateOperation multiply(GateOperation other) {
    if (!type.isSingleQubit() || !other.type.isSingleQubit()) {
      throw OperationError.of(
          OperationError.Kind.DOMAIN_MISMATCH,
          name(),
          "Multiplication is only defined for single-qubit gates, not %s and %s",
          name(),
          other.name());
    }
    if (qubit("qubit") != other.qubit("qubit")) {
      throw OperationError.of(
          OperationError.Kind.DOMAIN_MISMATCH,
          name(),
          "Cannot multiply gates on qubit %s and qubit %s",
          qubit("qubit"),
          other.qubit("qubit"));
    }
    return fromCoefficients(qubit("qubit"), coefficients().times(other.coefficients()));
  }

  /** Returns the canonical decomposition of a two-qubit gate; its parts may be symbolic. */
  public KakDecomposition kakDecomposition() {
    Preconditions.checkState(!type.isSingleQubit(), "%s is not a two-qubit gate", name());
    return type.kak(this);
  }

  @Override
  public GateOperation substituteParameters(Map<String, Double> bindings) {
    return (GateOperation) super.substituteParameters(bindings);
  }

  @Override
  public GateOperation remapQubits(Map<Integer, Integer> mapping) {
    return (GateOperation) super.remapQubits(mapping);
  }

  @Override
  public GateOperation pow(SymbolicValue exponent) {
    return (GateOperation) super.pow(exponent);
  }

  @Override
  public GateOperation pow(double exponent) {
    return pow(SymbolicValue.of(exponent));
  }

  public static GateOperation fromConfig(GateType type, ConfigReader config) {
    return new GateOperation(
        type, qubitsFromConfig(config), parametersFromConfig(config));
  }

  /** Generic single-qubit gates compare their literal parameters with a tolerance. */
  @Override
  public boolean equals(Object other) {
    if (type != GateType.SINGLE_QUBIT_GATE) {
      return super.equals(other);
    }
    if (!(other instanceof GateOperation g && g.type == type && qubits().equals(g.qubits()))) {
      return false;
    }
    for (Map.Entry<String, SymbolicValue> entry : parameters().entrySet()) {
      SymbolicValue x = entry.getValue();
      SymbolicValue y = g.parameter(entry.getKey());
      if (x.isLiteral() && y.isLiteral()) {
        if (Math.abs(x.value() - y.value()) > Complex.TOLERANCE) {
          return false;
        }
      } else if (!x.equals(y)) {
        return false;
      }
    }
    return true;
  }

  @Override
  public int hashCode() {
    return (type == GateType.SINGLE_QUBIT_GATE)
        ? Objects.hash(type, qubits())
        : super.hashCode();
  }
}
