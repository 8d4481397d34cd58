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
import com.google.common.collect.ImmutableSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.qircuit.config.ConfigReader;

/**
 * Declares a classical register that measurements write into. A circuit holds at most one
 * Definition for each distinct (name, type, length).
 *
 * <p>Equality ignores the input/output flags.
 */
public final class Definition implements Operation {
  public static final String NAME = "Definition";

  private static final ImmutableSet<Family> FAMILIES =
      ImmutableSet.of(Family.OPERATION, Family.DEFINITION);

  public final String registerName;
  public final VarType type;
  public final int length;
  public final boolean isInput;
  public final boolean isOutput;

  public Definition(
      String registerName, VarType type, int length, boolean isInput, boolean isOutput) {
    Preconditions.checkArgument(!registerName.isEmpty(), "Register name may not be empty");
    Preconditions.checkArgument(length >= 0, "Negative register length %s", length);
    this.registerName = registerName;
    this.type = type;
    this.length = length;
    this.isInput = isInput;
    this.isOutput = isOutput;
  }

  public Definition(String registerName, VarType type, int length) {
    this(registerName, type, length, false, false);
  }

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public ImmutableSet<Family> families() {
    return FAMILIES;
  }

  @Override
  public boolean isParametrized() {
    return false;
  }

  @Override
  public InvolvedQubits involvedQubits() {
    return InvolvedQubits.NONE;
  }

  @Override
  public Definition substituteParameters(Map<String, Double> bindings) {
    return this;
  }

  @Override
  public Definition remapQubits(Map<Integer, Integer> mapping) {
    return this;
  }

  @Override
  public String toDialect() {
    String decl = String.format("%s %s[%s]", registerName, type.dialectName, length);
    if (isInput || isOutput) {
      return String.format("%s(%s,%s) %s", NAME, dialectBool(isInput), dialectBool(isOutput), decl);
    }
    return NAME + " " + decl;
  }

  /** The dialect spells booleans the way the register declarations were first written. */
  private static String dialectBool(boolean b) {
    return b ? "True" : "False";
  }

  @Override
  public Map<String, Object> toConfig() {
    Map<String, Object> config = new LinkedHashMap<>();
    config.put(TYPE_KEY, NAME);
    config.put("register_name", registerName);
    config.put("vartype", type.configName);
    config.put("length", length);
    config.put("is_input", isInput);
    config.put("is_output", isOutput);
    return config;
  }

  public static Definition fromConfig(ConfigReader config) {
    return new Definition(
        config.getString("register_name"),
        VarType.fromConfigName(config.getString("vartype", "float")),
        config.getInt("length", 1),
        config.getBoolean("is_input", false),
        config.getBoolean("is_output", false));
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof Definition d
        && registerName.equals(d.registerName)
        && type == d.type
        && length == d.length;
  }

  @Override
  public int hashCode() {
    return Objects.hash(registerName, type, length);
  }

  @Override
  public String toString() {
    return toDialect();
  }
}
