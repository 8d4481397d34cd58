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
import com.google.common.collect.Maps;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;
import org.qircuit.config.ConfigReader;
import org.qircuit.expr.SymbolicValue;

/**
 * Shared behavior of the operations whose domain is fixed by a {@link GateTemplate}: an ordered
 * mapping from qubit role to qubit index and an ordered mapping from parameter name to value.
 * Unitary gates and the single-qubit noise pragmas are gate-like.
 */
public abstract class GateLikeOperation implements Operation {
  final GateTemplate template;
  private final ImmutableMap<String, Integer> qubits;
  private final ImmutableMap<String, SymbolicValue> parameters;

  GateLikeOperation(
      GateTemplate template, Map<String, Integer> qubits, Map<String, SymbolicValue> parameters) {
    this.template = template;
    this.qubits = template.checkQubits(qubits);
    this.parameters = template.withDefaults(parameters);
  }

  /** Returns an operation of the same variant with the given qubits and parameters. */
  abstract GateLikeOperation with(
      ImmutableMap<String, Integer> qubits, ImmutableMap<String, SymbolicValue> parameters);

  @Override
  public String name() {
    return template.name;
  }

  public GateTemplate template() {
    return template;
  }

  /** Qubit role to qubit index, in the variant's role order. */
  public ImmutableMap<String, Integer> qubits() {
    return qubits;
  }

  public int qubit(String role) {
    Integer result = qubits.get(role);
    Preconditions.checkArgument(result != null, "%s has no qubit role \"%s\"", name(), role);
    return result;
  }

  /** Parameter name to value, in the variant's parameter order. */
  public ImmutableMap<String, SymbolicValue> parameters() {
    return parameters;
  }

  public SymbolicValue parameter(String name) {
    SymbolicValue result = parameters.get(name);
    Preconditions.checkArgument(result != null, "%s has no parameter \"%s\"", name(), name);
    return result;
  }

  @Override
  public boolean isParametrized() {
    return parameters.values().stream().anyMatch(p -> !p.isLiteral());
  }

  @Override
  public InvolvedQubits involvedQubits() {
    return InvolvedQubits.of(qubits.values());
  }

  /** True if {@link #pow} is defined for this variant. */
  public boolean isExponentiable() {
    return !template.rotationModulo.isEmpty();
  }

  @Override
  public GateLikeOperation substituteParameters(Map<String, Double> bindings) {
    if (!isParametrized()) {
      return this;
    }
    return with(
        qubits, ImmutableMap.copyOf(Maps.transformValues(parameters, p -> p.resolve(bindings))));
  }

  @Override
  public GateLikeOperation remapQubits(Map<Integer, Integer> mapping) {
    ImmutableMap.Builder<String, Integer> builder = ImmutableMap.builder();
    qubits.forEach((role, q) -> builder.put(role, InvolvedQubits.remap(name(), q, mapping)));
    return with(builder.buildOrThrow(), parameters);
  }

  /**
   * Returns this operation raised to the given power, by scaling each rotation-strength parameter.
   *
   * @throws OperationError if the variant has no rotation-strength parameters
   */
  public GateLikeOperation pow(SymbolicValue exponent) {
    if (!isExponentiable()) {
      throw OperationError.of(
          OperationError.Kind.NOT_EXPONENTIABLE, name(), "%s cannot be exponentiated", name());
    }
    ImmutableMap.Builder<String, SymbolicValue> builder = ImmutableMap.builder();
    parameters.forEach(
        (key, value) ->
            builder.put(
                key,
                template.rotationModulo.containsKey(key) ? value.multiply(exponent) : value));
    return with(qubits, builder.buildOrThrow());
  }

  public GateLikeOperation pow(double exponent) {
    return pow(SymbolicValue.of(exponent));
  }

  @Override
  public boolean sameQubits(Operation other) {
    return other instanceof GateLikeOperation g
        && name().equals(g.name())
        && qubits.equals(g.qubits);
  }

  /** Renders as {@code Name(p1, p2) q1 q2}, omitting the parentheses if there are no parameters. */
  @Override
  public String toDialect() {
    StringBuilder sb = new StringBuilder(name());
    if (!parameters.isEmpty()) {
      sb.append(
          parameters.values().stream()
              .map(Object::toString)
              .collect(Collectors.joining(", ", "(", ")")));
    }
    qubits.values().forEach(q -> sb.append(' ').append(q));
    return sb.toString();
  }

  @Override
  public Map<String, Object> toConfig() {
    Map<String, Object> config = new LinkedHashMap<>();
    config.put(TYPE_KEY, name());
    config.put("qubits", new LinkedHashMap<>(qubits));
    Map<String, Object> params = new LinkedHashMap<>();
    parameters.forEach((key, value) -> params.put(key, value.toConfig()));
    config.put("parameters", params);
    return config;
  }

  /** Reads the {@code qubits} entry written by {@link #toConfig}. */
  static ImmutableMap<String, Integer> qubitsFromConfig(ConfigReader config) {
    ImmutableMap.Builder<String, Integer> builder = ImmutableMap.builder();
    config.getMap("qubits").forEach((k, v) -> builder.put(k, ConfigReader.toInt("qubits", v)));
    return builder.buildOrThrow();
  }

  /** Reads the optional {@code parameters} entry written by {@link #toConfig}. */
  static ImmutableMap<String, SymbolicValue> parametersFromConfig(ConfigReader config) {
    ConfigReader params = config.getOptionalChild("parameters");
    if (params == null) {
      return ImmutableMap.of();
    }
    ImmutableMap.Builder<String, SymbolicValue> builder = ImmutableMap.builder();
    params.asMap().keySet().forEach(k -> builder.put(k, params.getSymbolic(k)));
    return builder.buildOrThrow();
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof GateLikeOperation g
        && g.getClass() == getClass()
        && template == g.template
        && qubits.equals(g.qubits)
        && parameters.equals(g.parameters);
  }

  @Override
  public int hashCode() {
    return Objects.hash(template.name, qubits, parameters);
  }

  @Override
  public String toString() {
    return toDialect();
  }
}
