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

import com.google.common.collect.ImmutableMap;
import java.util.Map;
import java.util.function.Function;
import org.qircuit.config.ConfigException;
import org.qircuit.config.ConfigReader;
import org.qircuit.config.Configurable;

/** Rebuilds operations from their config trees, dispatching on the {@code "type"} entry. */
public final class Operations {

  private static final ImmutableMap<String, Function<ConfigReader, Operation>> READERS =
      buildReaders();

  private static ImmutableMap<String, Function<ConfigReader, Operation>> buildReaders() {
    ImmutableMap.Builder<String, Function<ConfigReader, Operation>> builder =
        ImmutableMap.builder();
    for (GateType type : GateType.values()) {
      builder.put(type.template.name, config -> GateOperation.fromConfig(type, config));
    }
    for (NoiseType type : NoiseType.values()) {
      builder.put(type.template.name, config -> PragmaNoise.fromConfig(type, config));
    }
    for (PragmaGetState.Quantity quantity : PragmaGetState.Quantity.values()) {
      builder.put(quantity.operationName, config -> PragmaGetState.fromConfig(quantity, config));
    }
    for (ScalarPragma.Kind kind : ScalarPragma.Kind.values()) {
      builder.put(kind.operationName, config -> ScalarPragma.fromConfig(kind, config));
    }
    builder.put(Definition.NAME, Definition::fromConfig);
    builder.put(MeasureQubit.NAME, MeasureQubit::fromConfig);
    builder.put(
        PragmaGetRotatedOccupationProbability.NAME,
        PragmaGetRotatedOccupationProbability::fromConfig);
    builder.put(PragmaGetPauliProduct.NAME, PragmaGetPauliProduct::fromConfig);
    builder.put(PragmaRepeatedMeasurement.NAME, PragmaRepeatedMeasurement::fromConfig);
    builder.put(PragmaPauliProdMeasurement.NAME, PragmaPauliProdMeasurement::fromConfig);
    builder.put(PragmaSetNumberOfMeasurements.NAME, PragmaSetNumberOfMeasurements::fromConfig);
    builder.put(PragmaSetStateVector.NAME, PragmaSetStateVector::fromConfig);
    builder.put(PragmaSetDensityMatrix.NAME, PragmaSetDensityMatrix::fromConfig);
    builder.put(PragmaGeneralNoise.NAME, PragmaGeneralNoise::fromConfig);
    builder.put(PragmaOverrotation.NAME, PragmaOverrotation::fromConfig);
    builder.put(PragmaStop.NAME, PragmaStop::fromConfig);
    builder.put(PragmaSleep.NAME, PragmaSleep::fromConfig);
    builder.put(PragmaParameterSubstitution.NAME, PragmaParameterSubstitution::fromConfig);
    builder.put(PragmaActiveReset.NAME, PragmaActiveReset::fromConfig);
    builder.put(PragmaStartDecompositionBlock.NAME, PragmaStartDecompositionBlock::fromConfig);
    builder.put(PragmaStopDecompositionBlock.NAME, PragmaStopDecompositionBlock::fromConfig);
    return builder.buildOrThrow();
  }

  private Operations() {}

  /** True if {@code name} is the config type of some operation variant. */
  public static boolean isKnown(String name) {
    return READERS.containsKey(name);
  }

  /**
   * Returns the operation described by {@code config}.
   *
   * @throws ConfigException if the type is unknown or the tree is malformed
   */
  public static Operation fromConfig(ConfigReader config) {
    String type = config.type();
    Function<ConfigReader, Operation> reader = READERS.get(type);
    if (reader == null) {
      throw ConfigException.of(Configurable.TYPE_KEY, "Unknown operation type %s", type);
    }
    return reader.apply(config);
  }

  public static Operation fromConfig(Map<String, ?> config) {
    return fromConfig(ConfigReader.of(config));
  }
}
