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

package org.qircuit.registers;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.qircuit.operations.Definition;
import org.qircuit.operations.VarType;

/**
 * The classical register a backend writes into while running one shot of a circuit. Created from
 * the circuit's {@link Definition}; {@link #reset} clears it between shots.
 */
public abstract class Register<T> {
  public final String name;
  public final VarType type;
  public final int length;
  public final boolean isOutput;

  private final T zero;
  private final List<T> values;

  Register(Definition definition, VarType expected, T zero) {
    Preconditions.checkArgument(
        definition.type == expected,
        "%s can only be created from a %s Definition, got %s",
        getClass().getSimpleName(),
        expected.configName,
        definition.type.configName);
    this.name = definition.registerName;
    this.type = expected;
    this.length = definition.length;
    this.isOutput = definition.isOutput;
    this.zero = zero;
    this.values = new ArrayList<>(Collections.nCopies(length, zero));
  }

  public T get(int index) {
    return values.get(index);
  }

  public void set(int index, T value) {
    values.set(index, Preconditions.checkNotNull(value));
  }

  /** Returns a snapshot of the current contents. */
  public ImmutableList<T> values() {
    return ImmutableList.copyOf(values);
  }

  public void reset() {
    Collections.fill(values, zero);
  }

  @Override
  public String toString() {
    return name + values;
  }
}
