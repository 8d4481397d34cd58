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
import java.util.List;
import org.qircuit.operations.Definition;
import org.qircuit.operations.VarType;
import org.qircuit.util.Complex;

/**
 * The rows a backend returns for one output register: one row of {@link #length} values per shot,
 * in shot order.
 */
public abstract class RegisterOutput<T> {
  public final String name;
  public final VarType type;
  public final int length;

  private final List<ImmutableList<T>> rows = new ArrayList<>();

  RegisterOutput(String name, VarType type, int length) {
    Preconditions.checkArgument(length >= 0, "Negative register length %s", length);
    this.name = name;
    this.type = type;
    this.length = length;
  }

  RegisterOutput(Definition definition, VarType expected) {
    this(definition.registerName, expected, definition.length);
    Preconditions.checkArgument(
        definition.type == expected,
        "%s can only be created from a %s Definition, got %s",
        getClass().getSimpleName(),
        expected.configName,
        definition.type.configName);
    Preconditions.checkArgument(
        definition.isOutput,
        "Output register %s can only be created from an output Definition",
        definition.registerName);
  }

  /** Converts one stored value to a complex number. */
  abstract Complex toComplex(T value);

  public int numberOfShots() {
    return rows.size();
  }

  public ImmutableList<T> row(int shot) {
    return rows.get(shot);
  }

  public ImmutableList<ImmutableList<T>> rows() {
    return ImmutableList.copyOf(rows);
  }

  public T get(int shot, int index) {
    return rows.get(shot).get(index);
  }

  /** Returns {@code get(shot, index)} as a complex number. */
  public Complex complexValue(int shot, int index) {
    return toComplex(get(shot, index));
  }

  /** Adds one shot. */
  public void addRow(List<T> row) {
    Preconditions.checkArgument(
        row.size() == length, "Row of length %s for register %s[%s]", row.size(), name, length);
    rows.add(ImmutableList.copyOf(row));
  }

  /**
   * Adds the current contents of {@code register} as one shot.
   *
   * @throws IllegalArgumentException if the register differs in name, type or length
   */
  public void append(Register<T> register) {
    checkCompatible(register.name, register.type, register.length);
    rows.add(register.values());
  }

  /**
   * Adds every shot of {@code other}, in order.
   *
   * @throws IllegalArgumentException if the outputs differ in name, type or length
   */
  public void extend(RegisterOutput<T> other) {
    checkCompatible(other.name, other.type, other.length);
    rows.addAll(other.rows);
  }

  private void checkCompatible(String otherName, VarType otherType, int otherLength) {
    Preconditions.checkArgument(
        name.equals(otherName) && type == otherType && length == otherLength,
        "Register %s %s[%s] is not compatible with output register %s %s[%s]",
        otherName,
        otherType.configName,
        otherLength,
        name,
        type.configName,
        length);
  }

  @Override
  public String toString() {
    return name + rows;
  }
}
