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

import java.util.Map;
import org.qircuit.operations.Definition;

/** Static helpers for backends that allocate registers from a circuit's Definitions. */
public final class Registers {
  private Registers() {}

  /**
   * Adds a register for {@code definition} to {@code registers} and, if the definition is an
   * output, an empty output register to {@code outputs}. Either entry replaces any previous one
   * with the same name.
   *
   * @throws IllegalArgumentException for an {@code int} Definition, which has no register type
   */
  public static void add(
      Map<String, Register<?>> registers,
      Map<String, RegisterOutput<?>> outputs,
      Definition definition) {
    String name = definition.registerName;
    switch (definition.type) {
      case BIT:
        registers.put(name, new BitRegister(definition));
        if (definition.isOutput) {
          outputs.put(name, new BitRegisterOutput(definition));
        }
        break;
      case FLOAT:
        registers.put(name, new FloatRegister(definition));
        if (definition.isOutput) {
          outputs.put(name, new FloatRegisterOutput(definition));
        }
        break;
      case COMPLEX:
        registers.put(name, new ComplexRegister(definition));
        if (definition.isOutput) {
          outputs.put(name, new ComplexRegisterOutput(definition));
        }
        break;
      default:
        throw new IllegalArgumentException("No register type for Definition " + definition);
    }
  }
}
