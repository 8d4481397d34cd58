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
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.qircuit.config.ConfigReader;
import org.qircuit.expr.SymbolicValue;

/**
 * Applies a static or statistical overrotation to the next gate of type {@link #gate} acting on
 * {@link #qubits}. The overrotation of {@link #parameter} is drawn with the given mean and
 * variance.
 */
public final class PragmaOverrotation extends AbstractPragma {
  public static final String NAME = "PragmaOverrotation";

  public final String gate;

  /** "static" or "statistic". */
  public final String statisticType;

  /** The overrotated gate's qubit roles, in role order. */
  public final ImmutableMap<String, Integer> qubits;

  public final String parameter;
  public final String overrotationParameter;
  public final SymbolicValue variance;
  public final SymbolicValue mean;

  public PragmaOverrotation(
      String gate,
      String statisticType,
      Map<String, Integer> qubits,
      String parameter,
      String overrotationParameter,
      SymbolicValue variance,
      SymbolicValue mean) {
    this.gate = gate;
    this.statisticType = statisticType;
    this.qubits = ImmutableMap.copyOf(qubits);
    this.parameter = parameter;
    this.overrotationParameter = overrotationParameter;
    this.variance = variance;
    this.mean = mean;
  }

  private PragmaOverrotation with(
      Map<String, Integer> qubits, SymbolicValue variance, SymbolicValue mean) {
    return new PragmaOverrotation(
        gate, statisticType, qubits, parameter, overrotationParameter, variance, mean);
  }

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public boolean isParametrized() {
    return !(variance.isLiteral() && mean.isLiteral());
  }

  @Override
  public InvolvedQubits involvedQubits() {
    return InvolvedQubits.of(qubits.values());
  }

  @Override
  public PragmaOverrotation substituteParameters(Map<String, Double> bindings) {
    if (!isParametrized()) {
      return this;
    }
    return with(qubits, variance.resolve(bindings), mean.resolve(bindings));
  }

  @Override
  public PragmaOverrotation remapQubits(Map<Integer, Integer> mapping) {
    ImmutableMap.Builder<String, Integer> remapped = ImmutableMap.builder();
    qubits.forEach((role, q) -> remapped.put(role, InvolvedQubits.remap(NAME, q, mapping)));
    return with(remapped.buildOrThrow(), variance, mean);
  }

  @Override
  public boolean sameQubits(Operation other) {
    return other instanceof PragmaOverrotation p && qubits.equals(p.qubits);
  }

  /** Scales both the mean and the variance by {@code exponent}. */
  public PragmaOverrotation pow(SymbolicValue exponent) {
    return with(qubits, variance.multiply(exponent), mean.multiply(exponent));
  }

  public PragmaOverrotation pow(double exponent) {
    return pow(SymbolicValue.of(exponent));
  }

  /** Renders as {@code PragmaOverrotation static (RotateX,theta,0.1,0.01) 0}. */
  @Override
  public String toDialect() {
    StringBuilder sb = new StringBuilder(NAME);
    sb.append(' ').append(statisticType);
    sb.append(" (")
        .append(gate)
        .append(',')
        .append(parameter)
        .append(',')
        .append(mean)
        .append(',')
        .append(variance)
        .append(')');
    qubits.values().forEach(q -> sb.append(' ').append(q));
    return sb.toString();
  }

  @Override
  public Map<String, Object> toConfig() {
    Map<String, Object> config = baseConfig();
    config.put("gate", gate);
    config.put("statistic_type", statisticType);
    config.put("ordered_qubits_dict", new LinkedHashMap<>(qubits));
    config.put("parameter", parameter);
    config.put("overrotation_parameter", overrotationParameter);
    config.put("variance", variance.toConfig());
    config.put("mean", mean.toConfig());
    return config;
  }

  public static PragmaOverrotation fromConfig(ConfigReader config) {
    ImmutableMap.Builder<String, Integer> qubits = ImmutableMap.builder();
    config
        .getMap("ordered_qubits_dict")
        .forEach((role, q) -> qubits.put(role, ConfigReader.toInt("ordered_qubits_dict", q)));
    return new PragmaOverrotation(
        config.getString("gate"),
        config.getString("statistic_type", "static"),
        qubits.buildOrThrow(),
        config.getString("parameter", ""),
        config.getString("overrotation_parameter", ""),
        config.has("variance") ? config.getSymbolic("variance") : SymbolicValue.ZERO,
        config.has("mean") ? config.getSymbolic("mean") : SymbolicValue.ZERO);
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof PragmaOverrotation p
        && gate.equals(p.gate)
        && statisticType.equals(p.statisticType)
        && qubits.equals(p.qubits)
        && parameter.equals(p.parameter)
        && overrotationParameter.equals(p.overrotationParameter)
        && variance.equals(p.variance)
        && mean.equals(p.mean);
  }

  @Override
  public int hashCode() {
    return Objects.hash(gate, statisticType, qubits, parameter, variance, mean);
  }
}
