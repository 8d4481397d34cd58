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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.qircuit.Hardware.Backend;
import org.qircuit.circuit.Circuit;
import org.qircuit.config.ConfigReader;
import org.qircuit.config.Configurable;
import org.qircuit.operations.PragmaParameterSubstitution;
import org.qircuit.util.Complex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a parametrized measurement for concrete values of its free parameters.
 *
 * <p>The circuits typically prepare an initial state, apply a unitary evolution whose gates refer
 * to the free parameters, and rotate into the measured basis. Each call appends a {@link
 * PragmaParameterSubstitution} to the measurement's constant circuit, runs the measurement, and
 * removes the pragma again.
 */
public final class DoUnitary implements Configurable {
  private static final Logger LOG = LoggerFactory.getLogger(DoUnitary.class);

  public static final String TYPE = "DoUnitary";

  /** Prefix of the result key under which each parameter value is reported. */
  public static final String PARAMETER_PREFIX = "unitary_parameter_";

  public final ImmutableList<String> freeParameters;
  private final Measurement measurement;
  private @Nullable Backend backend;

  public DoUnitary(
      @Nullable Backend backend, Measurement measurement, List<String> freeParameters) {
    this.freeParameters = ImmutableList.copyOf(freeParameters);
    this.measurement = measurement;
    this.backend = backend;
  }

  public Measurement measurement() {
    return measurement;
  }

  public @Nullable Backend backend() {
    return backend;
  }

  public void setBackend(@Nullable Backend backend) {
    this.backend = backend;
  }

  /**
   * Runs the measurement with the free parameters set, in order, to {@code values}.
   *
   * @throws IllegalArgumentException if the number of values differs from the number of free
   *     parameters
   */
  public @Nullable ImmutableMap<String, Complex> call(List<Double> values) {
    Preconditions.checkArgument(
        values.size() == freeParameters.size(),
        "Got %s values for free parameters %s",
        values.size(),
        freeParameters);
    Map<String, Double> bindings = new LinkedHashMap<>();
    for (int i = 0; i < values.size(); i++) {
      bindings.put(freeParameters.get(i), values.get(i));
    }
    return call(bindings);
  }

  /**
   * Runs the measurement with the free parameters bound by name. Extra names are passed on to the
   * backend too.
   *
   * @return the measurement's results followed by {@code "unitary_parameter_<name>"} for each
   *     binding, or null if the backend has not finished yet
   * @throws IllegalArgumentException if a free parameter has no value
   */
  public @Nullable ImmutableMap<String, Complex> call(Map<String, Double> bindings) {
    for (String name : freeParameters) {
      Preconditions.checkArgument(
          bindings.containsKey(name), "No value for free parameter %s", name);
    }
    LOG.debug("Running with parameters {}", bindings);
    if (backend != null) {
      measurement.setBackend(backend);
    }
    Circuit constant = measurement.mutableConstantCircuit();
    constant.add(new PragmaParameterSubstitution(bindings));
    ImmutableMap<String, Complex> results;
    try {
      results = measurement.run();
    } finally {
      constant.remove(constant.size() - 1);
    }
    if (results == null) {
      return null;
    }
    ImmutableMap.Builder<String, Complex> builder = ImmutableMap.builder();
    builder.putAll(results);
    bindings.forEach((name, value) -> builder.put(PARAMETER_PREFIX + name, Complex.real(value)));
    return builder.buildOrThrow();
  }

  @Override
  public Map<String, Object> toConfig() {
    Map<String, Object> config = new LinkedHashMap<>();
    config.put(TYPE_KEY, TYPE);
    config.put("free_parameters", new ArrayList<>(freeParameters));
    config.put("measurement", measurement.toConfig());
    return config;
  }

  /** The result has no backend; set one before calling it. */
  public static DoUnitary fromConfig(ConfigReader config) {
    config.requireType(TYPE);
    return new DoUnitary(
        null,
        Measurement.fromConfig(config.getChild("measurement")),
        config.getStringList("free_parameters"));
  }
}
