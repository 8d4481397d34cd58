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
import java.util.Map;
import java.util.Objects;
import org.qircuit.config.ConfigReader;
import org.qircuit.expr.SymbolicValue;
import org.qircuit.util.ComplexMatrix;

/**
 * Noise on one qubit described by a 3x3 rate matrix {@link #operators} over the operators sigma+,
 * sigma- and sigma_z, acting for {@link #gateTime} with overall {@link #rate}.
 */
public final class PragmaGeneralNoise extends AbstractPragma {
  public static final String NAME = "PragmaGeneralNoise";

  public final int qubit;
  public final SymbolicValue gateTime;
  public final SymbolicValue rate;
  public final ComplexMatrix operators;

  public PragmaGeneralNoise(
      int qubit, SymbolicValue gateTime, SymbolicValue rate, ComplexMatrix operators) {
    Preconditions.checkArgument(
        operators.rows() == 3 && operators.columns() == 3,
        "Noise operators must be 3x3, not %sx%s",
        operators.rows(),
        operators.columns());
    this.qubit = qubit;
    this.gateTime = gateTime;
    this.rate = rate;
    this.operators = operators;
  }

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public boolean isParametrized() {
    return !(gateTime.isLiteral() && rate.isLiteral());
  }

  @Override
  public InvolvedQubits involvedQubits() {
    return InvolvedQubits.of(qubit);
  }

  @Override
  public PragmaGeneralNoise substituteParameters(Map<String, Double> bindings) {
    if (!isParametrized()) {
      return this;
    }
    return new PragmaGeneralNoise(
        qubit, gateTime.resolve(bindings), rate.resolve(bindings), operators);
  }

  @Override
  public PragmaGeneralNoise remapQubits(Map<Integer, Integer> mapping) {
    return new PragmaGeneralNoise(
        InvolvedQubits.remap(NAME, qubit, mapping), gateTime, rate, operators);
  }

  @Override
  public String toDialect() {
    return String.format("%s(%s, %s, %s) %s", NAME, gateTime, rate, operators, qubit);
  }

  @Override
  public Map<String, Object> toConfig() {
    Map<String, Object> config = baseConfig();
    config.put("qubit", qubit);
    config.put("gate_time", gateTime.toConfig());
    config.put("rate", rate.toConfig());
    config.put("operators", operators.toConfig());
    return config;
  }

  public static PragmaGeneralNoise fromConfig(ConfigReader config) {
    return new PragmaGeneralNoise(
        config.getInt("qubit"),
        config.getSymbolic("gate_time"),
        config.getSymbolic("rate"),
        ComplexMatrix.fromConfig(config.getChild("operators")));
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof PragmaGeneralNoise p
        && qubit == p.qubit
        && gateTime.equals(p.gateTime)
        && rate.equals(p.rate)
        && operators.equals(p.operators);
  }

  @Override
  public int hashCode() {
    return Objects.hash(qubit, gateTime, rate, operators);
  }
}
