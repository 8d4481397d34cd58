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

import java.util.Map;
import java.util.Objects;
import org.jspecify.annotations.Nullable;
import org.qircuit.config.ConfigReader;
import org.qircuit.expr.SymbolicValue;

/**
 * A pragma whose only field is one symbolic-or-literal number and which has no qubit list of its
 * own: {@link Kind#REPEAT_GATE}, {@link Kind#BOOST_NOISE} or {@link Kind#GLOBAL_PHASE}.
 */
public final class ScalarPragma extends AbstractPragma {

  public enum Kind {
    /** Repeats the following gate {@code repetition_coefficient} times to amplify its error. */
    REPEAT_GATE("PragmaRepeatGate", "repetition_coefficient", InvolvedQubits.ALL, false),
    /** Scales noise and overrotations in the circuit by {@code noise_coefficient}. */
    BOOST_NOISE("PragmaBoostNoise", "noise_coefficient", InvolvedQubits.NONE, false),
    /** Records that the quantum register picked up the global phase {@code phase}. */
    GLOBAL_PHASE("PragmaGlobalPhase", "phase", InvolvedQubits.NONE, true);

    public final String operationName;
    final String key;
    final InvolvedQubits involvedQubits;
    // Rendered as "Name value" rather than "Name(value)".
    final boolean bare;

    Kind(String operationName, String key, InvolvedQubits involvedQubits, boolean bare) {
      this.operationName = operationName;
      this.key = key;
      this.involvedQubits = involvedQubits;
      this.bare = bare;
    }

    public static @Nullable Kind forName(String name) {
      for (Kind kind : values()) {
        if (kind.operationName.equals(name)) {
          return kind;
        }
      }
      return null;
    }
  }

  public final Kind kind;
  public final SymbolicValue value;

  public ScalarPragma(Kind kind, SymbolicValue value) {
    this.kind = kind;
    this.value = value;
  }

  public static ScalarPragma repeatGate(int repetitionCoefficient) {
    return new ScalarPragma(Kind.REPEAT_GATE, SymbolicValue.of(repetitionCoefficient));
  }

  public static ScalarPragma boostNoise(double noiseCoefficient) {
    return new ScalarPragma(Kind.BOOST_NOISE, SymbolicValue.of(noiseCoefficient));
  }

  public static ScalarPragma globalPhase(SymbolicValue phase) {
    return new ScalarPragma(Kind.GLOBAL_PHASE, phase);
  }

  @Override
  public String name() {
    return kind.operationName;
  }

  @Override
  public boolean isParametrized() {
    return !value.isLiteral();
  }

  @Override
  public InvolvedQubits involvedQubits() {
    return kind.involvedQubits;
  }

  @Override
  public ScalarPragma substituteParameters(Map<String, Double> bindings) {
    return isParametrized() ? new ScalarPragma(kind, value.resolve(bindings)) : this;
  }

  /** Has no qubits to remap. */
  @Override
  public ScalarPragma remapQubits(Map<Integer, Integer> mapping) {
    return this;
  }

  @Override
  public String toDialect() {
    return kind.bare ? name() + " " + value : name() + "(" + value + ")";
  }

  @Override
  public Map<String, Object> toConfig() {
    Map<String, Object> config = baseConfig();
    config.put(kind.key, value.toConfig());
    return config;
  }

  public static ScalarPragma fromConfig(Kind kind, ConfigReader config) {
    return new ScalarPragma(kind, config.getSymbolic(kind.key));
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof ScalarPragma p && kind == p.kind && value.equals(p.value);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, value);
  }
}
