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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.jspecify.annotations.Nullable;
import org.qircuit.Hardware.Backend;
import org.qircuit.Hardware.Device;
import org.qircuit.circuit.Circuit;
import org.qircuit.config.ConfigException;
import org.qircuit.config.ConfigReader;
import org.qircuit.config.Configurable;
import org.qircuit.registers.RegisterOutput;
import org.qircuit.util.Complex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a list of circuits on a backend and turns the returned registers into named expectation
 * values.
 *
 * <p>Each circuit is run with the constant circuit prepended. A measurement borrows its backend
 * and device; neither is part of its config.
 */
public abstract class Measurement implements Configurable {
  private static final Logger LOG = LoggerFactory.getLogger(Measurement.class);

  /** Prefix of the result key for each named expectation value. */
  public static final String EXP_VAL_PREFIX = "exp_val_";

  /** A register with this name is copied into the result unchanged. */
  public static final String GLOBAL_PHASE = "global_phase";

  private @Nullable Backend backend;
  private @Nullable Device device;
  private ImmutableList<Circuit> circuits;
  private final Circuit constantCircuit;
  private @Nullable ImmutableList<ImmutableMap<String, Object>> resumeList;
  private final List<@Nullable Map<String, Object>> resumeInfo = new ArrayList<>();

  Measurement(
      @Nullable Backend backend,
      @Nullable Device device,
      List<Circuit> circuits,
      @Nullable Circuit constantCircuit) {
    this.backend = backend;
    this.device = device;
    this.circuits = copyCircuits(circuits);
    this.constantCircuit = (constantCircuit == null) ? new Circuit() : constantCircuit.copy();
  }

  private static ImmutableList<Circuit> copyCircuits(List<Circuit> circuits) {
    return circuits.stream().map(Circuit::copy).collect(ImmutableList.toImmutableList());
  }

  public @Nullable Backend backend() {
    return backend;
  }

  public void setBackend(@Nullable Backend backend) {
    this.backend = backend;
  }

  public @Nullable Device device() {
    return device;
  }

  public void setDevice(@Nullable Device device) {
    this.device = device;
  }

  /** Returns copies of the measured circuits. */
  public ImmutableList<Circuit> circuits() {
    return copyCircuits(circuits);
  }

  public void setCircuits(List<Circuit> circuits) {
    this.circuits = copyCircuits(circuits);
  }

  public Circuit constantCircuit() {
    return constantCircuit.copy();
  }

  /** The live constant circuit; {@link DoUnitary} appends to it for the duration of one run. */
  Circuit mutableConstantCircuit() {
    return constantCircuit;
  }

  /**
   * Sets per-circuit backend overrides used to pick up an earlier asynchronous run; element
   * {@code i} applies to circuit {@code i}.
   */
  public void setResumeList(@Nullable List<? extends Map<String, Object>> resumeList) {
    if (resumeList == null) {
      this.resumeList = null;
    } else {
      this.resumeList =
          resumeList.stream().map(ImmutableMap::copyOf).collect(ImmutableList.toImmutableList());
    }
  }

  public @Nullable ImmutableList<ImmutableMap<String, Object>> resumeList() {
    return resumeList;
  }

  /**
   * Returns the resume information the backend reported for each circuit of the most recent run;
   * entries are null for backends that cannot resume.
   */
  public List<@Nullable Map<String, Object>> resumeInfo() {
    return Collections.unmodifiableList(new ArrayList<>(resumeInfo));
  }

  /**
   * Runs the measurement.
   *
   * @return the expectation values keyed by {@code "exp_val_<name>"} (plus {@code "global_phase"}
   *     if the circuits produce one), an empty map if there is no backend, or null if the backend
   *     has not finished running the circuits yet
   * @throws IncompleteMeasurementException if a register the measurement reads was not returned
   */
  public abstract @Nullable ImmutableMap<String, Complex> run();

  /**
   * Runs every circuit on {@code backend}, in order, and merges the returned registers; a register
   * returned for a later circuit replaces one of the same name from an earlier circuit. Returns
   * null if the backend reported any circuit as not ready; the remaining circuits are still
   * submitted.
   */
  @Nullable Map<String, RegisterOutput<?>> dispatch(Backend backend) {
    Preconditions.checkState(
        resumeList == null || resumeList.size() == circuits.size(),
        "Resume list has %s entries for %s circuits",
        resumeList == null ? 0 : resumeList.size(),
        circuits.size());
    resumeInfo.clear();
    Map<String, RegisterOutput<?>> outputs = new LinkedHashMap<>();
    boolean notReady = false;
    for (int i = 0; i < circuits.size(); i++) {
      Circuit circuit = constantCircuit.plus(circuits.get(i));
      Map<String, Object> overrides =
          new LinkedHashMap<>(circuit.backendInstructions(backend.target()));
      if (resumeList != null) {
        overrides.putAll(resumeList.get(i));
      }
      LOG.debug("Dispatching circuit {} ({} operations)", i, circuit.size());
      Map<String, RegisterOutput<?>> result = backend.run(circuit, overrides);
      resumeInfo.add(backend.resumeInfo());
      if (result == null) {
        notReady = true;
      } else {
        outputs.putAll(result);
      }
    }
    if (notReady) {
      LOG.info("Backend results are not ready yet; {} circuits submitted", circuits.size());
      return null;
    }
    return outputs;
  }

  /** Returns the named output register, or throws if the backend did not produce it. */
  static RegisterOutput<?> require(Map<String, RegisterOutput<?>> outputs, String name) {
    RegisterOutput<?> output = outputs.get(name);
    if (output == null) {
      throw new IncompleteMeasurementException(name, outputs.keySet());
    }
    return output;
  }

  /** Adds the {@code global_phase} entry if the backend returned that register. */
  static void addGlobalPhase(
      Map<String, RegisterOutput<?>> outputs, ImmutableMap.Builder<String, Complex> result) {
    RegisterOutput<?> phase = outputs.get(GLOBAL_PHASE);
    if (phase != null) {
      result.put(GLOBAL_PHASE, phase.complexValue(0, 0));
    }
  }

  /** Writes the fields shared by every measurement after the {@code "type"} entry. */
  void putCommonConfig(Map<String, Object> config) {
    List<Object> circuitConfigs = new ArrayList<>();
    circuits.forEach(c -> circuitConfigs.add(c.toConfig()));
    config.put("circuit_list", circuitConfigs);
    config.put("constant_circuit", constantCircuit.toConfig());
    if (resumeList != null) {
      List<Object> resume = new ArrayList<>();
      resumeList.forEach(r -> resume.add(new LinkedHashMap<>(r)));
      config.put("resume_list", resume);
    }
  }

  /**
   * Returns the measurement described by {@code config}, with no backend or device.
   *
   * @throws ConfigException if the type is not a known measurement or the tree is malformed
   */
  public static Measurement fromConfig(ConfigReader config) {
    String type = config.type();
    switch (type) {
      case BasisRotationMeasurement.TYPE:
        return BasisRotationMeasurement.fromConfig(config);
      case CheatedBasisRotationMeasurement.TYPE:
        return CheatedBasisRotationMeasurement.fromConfig(config);
      case CheatedMeasurement.TYPE:
        return CheatedMeasurement.fromConfig(config);
      default:
        throw ConfigException.of(TYPE_KEY, "Unknown measurement type %s", type);
    }
  }

  static ImmutableList<Circuit> circuitsFromConfig(ConfigReader config) {
    if (!config.has("circuit_list")) {
      return ImmutableList.of();
    }
    return config.getList("circuit_list").stream()
        .map(c -> Circuit.fromConfig(ConfigReader.of(c)))
        .collect(ImmutableList.toImmutableList());
  }

  static @Nullable Circuit constantCircuitFromConfig(ConfigReader config) {
    ConfigReader child = config.getOptionalChild("constant_circuit");
    return (child == null) ? null : Circuit.fromConfig(child);
  }

  /** Reads the optional resume list into {@code measurement}. */
  static <M extends Measurement> M withResumeList(M measurement, ConfigReader config) {
    if (config.has("resume_list")) {
      List<Map<String, Object>> resume = new ArrayList<>();
      for (Object element : config.getList("resume_list")) {
        resume.add(new LinkedHashMap<>(ConfigReader.of(element).asMap()));
      }
      measurement.setResumeList(resume);
    }
    return measurement;
  }

  boolean sameCommonFields(Measurement other) {
    return circuits.equals(other.circuits)
        && constantCircuit.equals(other.constantCircuit)
        && Objects.equals(resumeList, other.resumeList);
  }
}
