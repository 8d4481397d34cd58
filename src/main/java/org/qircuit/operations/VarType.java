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

import org.qircuit.config.ConfigException;

/** The element type of a classical register. */
public enum VarType {
  FLOAT("float", "REAL"),
  BIT("bit", "BIT"),
  INT("int", "INT"),
  COMPLEX("complex", "COMPLEX");

  /** The name used in configuration trees. */
  public final String configName;

  /** The name used in dialect text. */
  public final String dialectName;

  VarType(String configName, String dialectName) {
    this.configName = configName;
    this.dialectName = dialectName;
  }

  public static VarType fromConfigName(String name) {
    for (VarType type : values()) {
      if (type.configName.equals(name)) {
        return type;
      }
    }
    throw ConfigException.of("vartype", "Unknown register type \"%s\"", name);
  }
}
