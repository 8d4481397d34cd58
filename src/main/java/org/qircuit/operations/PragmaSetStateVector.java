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
import java.util.Map;
import org.qircuit.config.ConfigReader;
import org.qircuit.util.Complex;
import org.qircuit.util.ComplexMatrix;

/** Sets the state of the simulated quantum register to {@link #statevector}. */
public final class PragmaSetStateVector extends AbstractPragma {
  public static final String NAME = "PragmaSetStateVector";

  public final ImmutableList<Complex> statevector;

  public PragmaSetStateVector(Iterable<Complex> statevector) {
    this.statevector = ImmutableList.copyOf(statevector);
  }

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public InvolvedQubits involvedQubits() {
    return InvolvedQubits.ALL;
  }

  @Override
  public boolean supportsRemap() {
    return false;
  }

  @Override
  public PragmaSetStateVector remapQubits(Map<Integer, Integer> mapping) {
    throw OperationError.remapNotSupported(NAME);
  }

  @Override
  public String toDialect() {
    StringBuilder sb = new StringBuilder(NAME);
    statevector.forEach(amp -> sb.append(' ').append(amp));
    return sb.toString();
  }

  @Override
  public Map<String, Object> toConfig() {
    Map<String, Object> config = baseConfig();
    config.put("statevector", ComplexMatrix.vectorToConfig(statevector));
    return config;
  }

  public static PragmaSetStateVector fromConfig(ConfigReader config) {
    return new PragmaSetStateVector(ComplexMatrix.vectorFromConfig(config.getChild("statevector")));
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof PragmaSetStateVector p && statevector.equals(p.statevector);
  }

  @Override
  public int hashCode() {
    return statevector.hashCode();
  }
}
