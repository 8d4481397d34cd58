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

package org.qircuit.circuit;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Iterables;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Stream;
import org.qircuit.config.ConfigReader;
import org.qircuit.config.Configurable;
import org.qircuit.operations.BackendTarget;
import org.qircuit.operations.Definition;
import org.qircuit.operations.Family;
import org.qircuit.operations.Operation;
import org.qircuit.operations.Operations;
import org.qircuit.operations.Pragma;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A quantum program: a linear sequence of operations.
 *
 * <p>A Circuit keeps its {@link Definition}s apart from its other operations and always presents
 * them first; index {@code k} refers to a Definition iff {@code k < numDefinitions()}. Adding a
 * Definition that is already present (by value) has no effect, and Definitions are always added
 * after the existing ones regardless of the index requested. All other operations keep the order
 * in which they were added.
 *
 * <p>Circuits are mutable, but the operations they hold are not, so {@link #copy} is enough to get
 * an independent circuit.
 */
public final class Circuit implements Configurable, Iterable<Operation> {
  private static final Logger LOG = LoggerFactory.getLogger(Circuit.class);

  public static final String TYPE = "Circuit";

  private final List<Definition> definitions = new ArrayList<>();
  private final List<Operation> operations = new ArrayList<>();

  public Circuit() {}

  public static Circuit of(Operation... ops) {
    return new Circuit().addAll(ImmutableList.copyOf(ops));
  }

  public int size() {
    return definitions.size() + operations.size();
  }

  public int numDefinitions() {
    return definitions.size();
  }

  public ImmutableList<Definition> definitions() {
    return ImmutableList.copyOf(definitions);
  }

  /** The operations that are not Definitions, in order. */
  public ImmutableList<Operation> operations() {
    return ImmutableList.copyOf(operations);
  }

  /** Appends an operation (or, for a Definition not yet present, adds it to the definitions). */
  @CanIgnoreReturnValue
  public Circuit add(Operation op) {
    if (op instanceof Definition d) {
      addDefinition(d);
    } else {
      operations.add(Objects.requireNonNull(op));
    }
    return this;
  }

  @CanIgnoreReturnValue
  public Circuit addAll(Iterable<? extends Operation> ops) {
    // Copy first, in case ops is this circuit.
    ImmutableList.copyOf(ops).forEach(this::add);
    return this;
  }

  private void addDefinition(Definition d) {
    if (definitions.contains(d)) {
      LOG.trace("Dropping duplicate {}", d);
    } else {
      definitions.add(d);
    }
  }

  /**
   * Inserts an operation so that it has the given combined index. Definitions are added as by
   * {@link #add}; an index that falls among the definitions inserts at the start of the other
   * operations.
   *
   * @throws IndexOutOfBoundsException if {@code index > size()}
   */
  @CanIgnoreReturnValue
  public Circuit insert(int index, Operation op) {
    Preconditions.checkPositionIndex(index, size());
    if (op instanceof Definition d) {
      addDefinition(d);
    } else {
      operations.add(Math.max(0, index - definitions.size()), Objects.requireNonNull(op));
    }
    return this;
  }

  /** Inserts a sequence of operations, keeping their order, starting at the given index. */
  @CanIgnoreReturnValue
  public Circuit insertAll(int index, Iterable<? extends Operation> ops) {
    for (Operation op : ImmutableList.copyOf(ops).reverse()) {
      insert(index, op);
    }
    return this;
  }

  public Operation get(int index) {
    Preconditions.checkElementIndex(index, size());
    return (index < definitions.size())
        ? definitions.get(index)
        : operations.get(index - definitions.size());
  }

  /**
   * Returns the elements at {@code start}, {@code start + step}, ... up to but not including
   * {@code stop}. A negative step walks backwards. Negative indices count from the end, and indices
   * past either end are clamped, so {@code slice(-2, Integer.MAX_VALUE, 1)} is the last two
   * elements.
   */
  public ImmutableList<Operation> slice(int start, int stop, int step) {
    Preconditions.checkArgument(step != 0, "Slice step may not be zero");
    int from = clampSliceIndex(start, step);
    int to = clampSliceIndex(stop, step);
    ImmutableList.Builder<Operation> builder = ImmutableList.builder();
    if (step > 0) {
      for (int i = from; i < to; i += step) {
        builder.add(get(i));
      }
    } else {
      for (int i = from; i > to; i += step) {
        builder.add(get(i));
      }
    }
    return builder.build();
  }

  /** Maps a slice bound into {@code [-1, size()]}, where -1 is only reachable walking backwards. */
  private int clampSliceIndex(int index, int step) {
    int size = size();
    if (index < 0) {
      index = (index < -size) ? -1 : index + size;
      return (index < 0 && step > 0) ? 0 : index;
    }
    return (index >= size) ? ((step < 0) ? size - 1 : size) : index;
  }

  /**
   * Replaces the element at {@code index}.
   *
   * @throws IllegalArgumentException if the index refers to a Definition and {@code op} is not one,
   *     or if {@code op} is a Definition of a register already defined at another index
   */
  @CanIgnoreReturnValue
  public Operation set(int index, Operation op) {
    Preconditions.checkElementIndex(index, size());
    if (index < definitions.size()) {
      if (!(op instanceof Definition d)) {
        throw new IllegalArgumentException(
            String.format("Index %s holds a Definition, cannot replace it with %s", index, op));
      }
      for (int i = 0; i < definitions.size(); i++) {
        Preconditions.checkArgument(
            i == index || !definitions.get(i).registerName.equals(d.registerName),
            "Register %s is already defined at index %s",
            d.registerName,
            i);
      }
      return definitions.set(index, d);
    }
    Preconditions.checkArgument(
        !(op instanceof Definition),
        "Index %s does not hold a Definition, cannot replace it with %s",
        index,
        op);
    return operations.set(index - definitions.size(), op);
  }

  @CanIgnoreReturnValue
  public Operation remove(int index) {
    Preconditions.checkElementIndex(index, size());
    return (index < definitions.size())
        ? definitions.remove(index)
        : operations.remove(index - definitions.size());
  }

  /** Removes the elements with indices {@code start <= i < stop}. */
  public void removeRange(int start, int stop) {
    Preconditions.checkPositionIndexes(start, stop, size());
    for (int i = stop - 1; i >= start; i--) {
      remove(i);
    }
  }

  /** Returns a new circuit holding this circuit's operations followed by {@code others}. */
  public Circuit plus(Iterable<? extends Operation> others) {
    return copy().addAll(others);
  }

  public Circuit plus(Operation op) {
    return copy().add(op);
  }

  @Override
  public Iterator<Operation> iterator() {
    return Iterables.unmodifiableIterable(Iterables.concat(definitions, operations)).iterator();
  }

  public Stream<Operation> stream() {
    return Stream.concat(definitions.stream(), operations.stream());
  }

  /** Counts the operations that belong to at least one of the given families. */
  public int countOccurrences(Set<Family> families) {
    return (int) stream().filter(op -> families.stream().anyMatch(op::is)).count();
  }

  /**
   * Returns the names of the variants in this circuit, in order of first appearance. If {@code
   * gatesOnly} is true, only unitary gates are included.
   */
  public ImmutableSet<String> operationTypes(boolean gatesOnly) {
    Set<String> result = new LinkedHashSet<>();
    stream()
        .filter(op -> !gatesOnly || op.is(Family.GATE_OPERATION) && !op.is(Family.PRAGMA))
        .forEach(op -> result.add(op.name()));
    return ImmutableSet.copyOf(result);
  }

  public boolean isParametrized() {
    return stream().anyMatch(Operation::isParametrized);
  }

  /** Returns a new circuit with the same operations. */
  public Circuit copy() {
    Circuit result = new Circuit();
    result.definitions.addAll(definitions);
    result.operations.addAll(operations);
    return result;
  }

  /** Same as {@link #copy}, since operations are immutable. */
  public Circuit deepCopy() {
    return copy();
  }

  /** Replaces each operation with the result of substituting {@code bindings} into it. */
  @CanIgnoreReturnValue
  public Circuit substituteParameters(Map<String, Double> bindings) {
    definitions.replaceAll(d -> d.substituteParameters(bindings));
    operations.replaceAll(op -> op.substituteParameters(bindings));
    return this;
  }

  /**
   * Replaces each operation with its remapped version. If any operation cannot be remapped the
   * circuit is left unchanged.
   *
   * @throws org.qircuit.operations.OperationError if an operation does not support remapping, or
   *     the mapping does not cover one of its qubits
   */
  @CanIgnoreReturnValue
  public Circuit remapQubits(Map<Integer, Integer> mapping) {
    List<Operation> remapped = new ArrayList<>(operations.size());
    for (Operation op : operations) {
      remapped.add(op.remapQubits(mapping));
    }
    operations.clear();
    operations.addAll(remapped);
    return this;
  }

  /**
   * Returns the settings overridden by this circuit's pragmas on the given target. When several
   * pragmas set the same key the last one wins.
   */
  public ImmutableMap<String, Object> backendInstructions(BackendTarget target) {
    Map<String, Object> result = new LinkedHashMap<>();
    for (Operation op : operations) {
      if (op instanceof Pragma pragma) {
        Map<String, Object> instruction = pragma.backendInstruction(target);
        if (instruction != null) {
          result.putAll(instruction);
        }
      }
    }
    return ImmutableMap.copyOf(result);
  }

  /** Returns one dialect line per element, definitions first. */
  public ImmutableList<String> toDialectLines() {
    return stream().map(Operation::toDialect).collect(ImmutableList.toImmutableList());
  }

  @Override
  public Map<String, Object> toConfig() {
    Map<String, Object> config = new LinkedHashMap<>();
    config.put(TYPE_KEY, TYPE);
    List<Object> defs = new ArrayList<>();
    definitions.forEach(d -> defs.add(d.toConfig()));
    List<Object> ops = new ArrayList<>();
    operations.forEach(op -> ops.add(op.toConfig()));
    config.put("definitions", defs);
    config.put("operations", ops);
    return config;
  }

  public static Circuit fromConfig(Map<String, ?> config) {
    return fromConfig(ConfigReader.of(config));
  }

  public static Circuit fromConfig(ConfigReader config) {
    config.requireType(TYPE);
    Circuit result = new Circuit();
    for (String key : ImmutableList.of("definitions", "operations")) {
      for (Object element : config.getList(key)) {
        result.add(Operations.fromConfig(ConfigReader.of(element)));
      }
    }
    return result;
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof Circuit c
        && definitions.equals(c.definitions)
        && operations.equals(c.operations);
  }

  @Override
  public int hashCode() {
    return Objects.hash(definitions, operations);
  }

  /** Returns the dialect lines, each followed by a newline. */
  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    toDialectLines().forEach(line -> sb.append(line).append('\n'));
    return sb.toString();
  }
}
