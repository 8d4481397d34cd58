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
import org.qircuit.expr.SymbolicValue;

/** Named access to the parameters of a gate-like operation. */
final class GateParameters {
  private final ImmutableMap<String, SymbolicValue> values;

  GateParameters(ImmutableMap<String, SymbolicValue> values) {
    this.values = values;
  }

  SymbolicValue symbolic(String name) {
    SymbolicValue result = values.get(name);
    Preconditions.checkArgument(result != null, "No parameter \"%s\"", name);
    return result;
  }

  /** Returns a parameter's numeric value; callers must have checked that none is symbolic. */
  double value(String name) {
    return symbolic(name).value();
  }
}
