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
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.qircuit.config.ConfigReader;
import org.qircuit.expr.SymbolicValue;
import org.qircuit.util.ComplexMatrix;

/** A noise channel of one of the {@link NoiseType}s acting on a single qubit. */
public final class PragmaNoise extends GateLikeOperation implements Pragma {
  private static final ImmutableSet<Family> FAMILIES =
      ImmutableSet.of(Family.OPERATION, Family.PRAGMA, Family.GATE_OPERATION, Family.PRAGMA_NOISE);

  public final NoiseType type;

  PragmaNoise(NoiseType type, Map<String, Integer> qubits, Map<String, SymbolicValue> parameters) {
    super(type.template, qubits, parameters);
    this.type = type;
  }

  /** Damping, depolarisation or dephasing of {@code qubit} for {@code gateTime} at {@code rate}. */
  public static PragmaNoise of(
      NoiseType type, int qubit, SymbolicValue gateTime, SymbolicValue rate) {
    return new PragmaNoise(
        type,
        ImmutableMap.of("qubit", qubit),
        ImmutableMap.of("gate_time", gateTime, "rate", rate));
  }

  public static PragmaNoise of(NoiseType type, int qubit, double gateTime, double rate) {
    return of(type, qubit, SymbolicValue.of(gateTime), SymbolicValue.of(rate));
  }

  public static PragmaNoise randomNoise(
      int qubit, double gateTime, double depolarisationRate, double dephasingRate) {
    return new PragmaNoise(
        NoiseType.RANDOM_NOISE,
        ImmutableMap.of("qubit", qubit),
        ImmutableMap.of(
            "gate_time", SymbolicValue.of(gateTime),
            "depolarisation_rate", SymbolicValue.of(depolarisationRate),
            "dephasing_rate", SymbolicValue.of(dephasingRate)));
  }

  @Override
  PragmaNoise with(
      ImmutableMap<String, Integer> qubits, ImmutableMap<String, SymbolicValue> parameters) {
    return new PragmaNoise(type, qubits, parameters);
  }

  @Override
  public ImmutableSet<Family> families() {
    return FAMILIES;
  }

  /** The probability that the noise acts during the gate time. */
  public SymbolicValue probability() {
    return type.probability(new GateParameters(parameters()));
  }

  /**
   * Returns the channel's 4x4 superoperator.
   *
   * @throws OperationError if any parameter is symbolic
   */
  public ComplexMatrix superoperator() {
    if (isParametrized()) {
      throw OperationError.unresolved(name());
    }
    return type.superoperator(new GateParameters(parameters()));
  }

  /** Noise is not unitary; always throws. */
  public ComplexMatrix unitaryMatrix() {
    throw OperationError.of(
        OperationError.Kind.NOT_UNITARY, name(), "%s is a noise channel, not a unitary", name());
  }

  @Override
  public @Nullable ImmutableMap<String, Object> backendInstruction(BackendTarget target) {
    if (target != BackendTarget.PYQUEST_CFFI) {
      return null;
    }
    return (type == NoiseType.RANDOM_NOISE)
        ? ImmutableMap.<String, Object>of("random_pauli_errors", true)
        : ImmutableMap.<String, Object>of("use_density_matrix", true);
  }

  @Override
  public PragmaNoise substituteParameters(Map<String, Double> bindings) {
    return (PragmaNoise) super.substituteParameters(bindings);
  }

  @Override
  public PragmaNoise remapQubits(Map<Integer, Integer> mapping) {
    return (PragmaNoise) super.remapQubits(mapping);
  }

  @Override
  public PragmaNoise pow(SymbolicValue exponent) {
    return (PragmaNoise) super.pow(exponent);
  }

  @Override
  public PragmaNoise pow(double exponent) {
    return pow(SymbolicValue.of(exponent));
  }

  public static PragmaNoise fromConfig(NoiseType type, ConfigReader config) {
    return new PragmaNoise(type, qubitsFromConfig(config), parametersFromConfig(config));
  }
}
