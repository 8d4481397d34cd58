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
import org.qircuit.config.ConfigReader;

/** Resets one qubit to |0>. */
public final class PragmaActiveReset extends AbstractPragma {
  public static final String NAME = "PragmaActiveReset";

  public final int qubit;

  public PragmaActiveReset(int qubit) {
    this.qubit = qubit;
  }

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public InvolvedQubits involvedQubits() {
    return InvolvedQubits.of(qubit);
  }

  @Override
  public boolean supportsRemap() {
    return false;
  }

  @Override
  public PragmaActiveReset remapQubits(Map<Integer, Integer> mapping) {
    throw OperationError.remapNotSupported(NAME);
  }

  @Override
  public String toDialect() {
    return NAME + " " + qubit;
  }

  @Override
  public Map<String, Object> toConfig() {
    Map<String, Object> config = baseConfig();
    config.put("qubit", qubit);
    return config;
  }

  public static PragmaActiveReset fromConfig(ConfigReader config) {
    return new PragmaActiveReset(config.getInt("qubit"));
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof PragmaActiveReset p && qubit == p.qubit;
  }

  @Override
  public int hashCode() {
    return Integer.hashCode(qubit);
  }
}
