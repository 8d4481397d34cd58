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

import com.google.common.collect.ImmutableSet;
import java.util.LinkedHashMap;
import java.util.Map;

/** Base class for the pragmas that are neither noise channels nor measurements. */
public abstract class AbstractPragma implements Pragma {
  private static final ImmutableSet<Family> FAMILIES =
      ImmutableSet.of(Family.OPERATION, Family.PRAGMA);

  @Override
  public ImmutableSet<Family> families() {
    return FAMILIES;
  }

  /** Most pragmas have no symbolic fields. */
  @Override
  public boolean isParametrized() {
    return false;
  }

  @Override
  public Operation substituteParameters(Map<String, Double> bindings) {
    return this;
  }

  /** Starts a config tree with the type entry. */
  Map<String, Object> baseConfig() {
    Map<String, Object> config = new LinkedHashMap<>();
    config.put(TYPE_KEY, name());
    return config;
  }

  @Override
  public String toString() {
    return toDialect();
  }
}
