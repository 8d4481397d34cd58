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

package org.qircuit.measurements;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import org.jspecify.annotations.Nullable;
import org.qircuit.Hardware.Backend;
import org.qircuit.circuit.Circuit;
import org.qircuit.operations.BackendTarget;
import org.qircuit.registers.RegisterOutput;

/** A backend that answers every circuit from a fixed function and records what it was given. */
final class FakeBackend implements Backend {
  final List<Circuit> circuits = new ArrayList<>();
  final List<Map<String, Object>> overrides = new ArrayList<>();
  private final BackendTarget target;
  private final Function<Circuit, @Nullable Map<String, RegisterOutput<?>>> results;
  @Nullable Map<String, Object> resumeInfo;

  FakeBackend(
      BackendTarget target, Function<Circuit, @Nullable Map<String, RegisterOutput<?>>> results) {
    this.target = target;
    this.results = results;
  }

  /** Returns the same registers for every circuit. */
  static FakeBackend returning(RegisterOutput<?>... outputs) {
    Map<String, RegisterOutput<?>> byName = new LinkedHashMap<>();
    for (RegisterOutput<?> output : outputs) {
      byName.put(output.name, output);
    }
    return new FakeBackend(BackendTarget.PYQUEST_CFFI, c -> byName);
  }

  @Override
  public BackendTarget target() {
    return target;
  }

  @Override
  public int numberQubits() {
    return 4;
  }

  @Override
  public @Nullable Map<String, RegisterOutput<?>> run(
      Circuit circuit, Map<String, Object> overrides) {
    circuits.add(circuit);
    this.overrides.add(overrides);
    return results.apply(circuit);
  }

  @Override
  public @Nullable Map<String, Object> resumeInfo() {
    return resumeInfo;
  }
}
