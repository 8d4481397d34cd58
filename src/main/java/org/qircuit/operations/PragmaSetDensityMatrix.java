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
import org.qircuit.config.ConfigReader;
import org.qircuit.util.ComplexMatrix;

/** Sets the state of the simulated quantum register to the density matrix {@link #density}. */
public final class PragmaSetDensityMatrix extends AbstractPragma {
  public static final String NAME = "PragmaSetDensityMatrix";

  public final ComplexMatrix density;

  public PragmaSetDensityMatrix(ComplexMatrix density) {
    Preconditions.checkArgument(
        density.rows() == density.columns(),
        "Density matrix must be square, not %sx%s",
        density.rows(),
        density.columns());
    this.density = density;
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
  public PragmaSetDensityMatrix remapQubits(Map<Integer, Integer> mapping) {
    throw OperationError.remapNotSupported(NAME);
  }

  /** Lists the entries in row-major order. */
  @Override
  public String toDialect() {
    StringBuilder sb = new StringBuilder(NAME);
    for (int r = 0; r < density.rows(); r++) {
      for (int c = 0; c < density.columns(); c++) {
        sb.append(' ').append(density.get(r, c));
      }
    }
    return sb.toString();
  }

  @Override
  public Map<String, Object> toConfig() {
    Map<String, Object> config = baseConfig();
    config.put("density_matrix", density.toConfig());
    return config;
  }

  public static PragmaSetDensityMatrix fromConfig(ConfigReader config) {
    return new PragmaSetDensityMatrix(ComplexMatrix.fromConfig(config.getChild("density_matrix")));
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof PragmaSetDensityMatrix p && density.equals(p.density);
  }

  @Override
  public int hashCode() {
    return density.hashCode();
  }
}
