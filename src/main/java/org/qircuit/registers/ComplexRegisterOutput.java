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

import java.util.Arrays;
import org.qircuit.operations.Definition;
import org.qircuit.operations.VarType;
import org.qircuit.util.Complex;

public final class ComplexRegisterOutput extends RegisterOutput<Complex> {
  public ComplexRegisterOutput(Definition definition) {
    super(definition, VarType.COMPLEX);
  }

  public ComplexRegisterOutput(String name, int length) {
    super(name, VarType.COMPLEX, length);
  }

  public void addShot(Complex... values) {
    addRow(Arrays.asList(values));
  }

  @Override
  Complex toComplex(Complex value) {
    return value;
  }
}
