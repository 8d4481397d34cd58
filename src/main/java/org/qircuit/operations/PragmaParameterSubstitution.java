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
import org.qircuit.config.ConfigReader;

/**
 * Asks the backend to substitute the given values for symbolic parameters before it runs the
 * circuit.
 */
public final class PragmaParameterSubstitution extends AbstractPragma {
  public static final String NAME = "PragmaParameterSubstitution";

  public final ImmutableMap<String, Double> substitutions;

  public PragmaParameterSubstitution(Map<String, Double> substitutions) {
    this.substitutions = ImmutableMap.copyOf(substitutions);
  }

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public InvolvedQubits involvedQubits() {
    return InvolvedQubits.NONE;
  }

  @Override
  public PragmaParameterSubstitution remapQubits(Map<Integer, Integer> mapping) {
    return this;
  }

  /** Every backend honours parameter substitutions. */
  @Override
  public ImmutableMap<String, Object> backendInstruction(BackendTarget target) {
    return ImmutableMap.of("substitution_dict", substitutions);
  }

  /** Renders as {@code PragmaParameterSubstitution a=1.0; b=2.0;}. */
  @Override
  public String toDialect() {
    StringBuilder sb = new StringBuilder(NAME);
    substitutions.forEach((k, v) -> sb.append(' ').append(k).append('=').append(v).append(';'));
    return sb.toString();
  }

  @Override
  public Map<String, Object> toConfig() {
    Map<String, Object> config = baseConfig();
    config.put("substitution_dict", new LinkedHashMap<>(substitutions));
    return config;
  }

  public static PragmaParameterSubstitution fromConfig(ConfigReader config) {
    return new PragmaParameterSubstitution(config.getDoubleMap("substitution_dict"));
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof PragmaParameterSubstitution p && substitutions.equals(p.substitutions);
  }

  @Override
  public int hashCode() {
    return substitutions.hashCode();
  }
}
