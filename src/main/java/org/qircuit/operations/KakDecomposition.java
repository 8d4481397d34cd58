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
import org.qircuit.expr.SymbolicValue;

/**
 * The canonical decomposition of a two-qubit gate:
 *
 * <pre>
 *   U = exp(i*g) * (A0 x A1) * exp(i * (k0 XX + k1 YY + k2 ZZ)) * (B0 x B1)
 * </pre>
 *
 * Each of the before/after factors is a (possibly empty) sequence of single-qubit gates, applied
 * in list order; the gates carry their own qubit indices.
 */
public final class KakDecomposition {
  public final SymbolicValue globalPhase;
  public final ImmutableList<GateOperation> before0;
  public final ImmutableList<GateOperation> before1;

  /** The three interaction strengths. */
  public final ImmutableList<SymbolicValue> k;

  public final ImmutableList<GateOperation> after0;
  public final ImmutableList<GateOperation> after1;

  KakDecomposition(
      SymbolicValue globalPhase,
      ImmutableList<GateOperation> before0,
      ImmutableList<GateOperation> before1,
      ImmutableList<SymbolicValue> k,
      ImmutableList<GateOperation> after0,
      ImmutableList<GateOperation> after1) {
    Preconditions.checkArgument(k.size() == 3, "KAK vector must have three components");
    this.globalPhase = globalPhase;
    this.before0 = before0;
    this.before1 = before1;
    this.k = k;
    this.after0 = after0;
    this.after1 = after1;
  }

  /** A decomposition with no single-qubit factors. */
  static KakDecomposition interaction(
      SymbolicValue globalPhase, SymbolicValue k0, SymbolicValue k1, SymbolicValue k2) {
    return new KakDecomposition(
        globalPhase,
        ImmutableList.of(),
        ImmutableList.of(),
        ImmutableList.of(k0, k1, k2),
        ImmutableList.of(),
        ImmutableList.of());
  }

  static KakDecomposition interaction(double k0, double k1, double k2) {
    return interaction(
        SymbolicValue.ZERO, SymbolicValue.of(k0), SymbolicValue.of(k1), SymbolicValue.of(k2));
  }

  @Override
  public String toString() {
    return String.format(
        "g=%s B0=%s B1=%s k=%s A0=%s A1=%s", globalPhase, before0, before1, k, after0, after1);
  }
}
