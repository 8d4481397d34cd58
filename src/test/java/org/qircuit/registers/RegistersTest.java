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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.qircuit.operations.Definition;
import org.qircuit.operations.VarType;
import org.qircuit.util.Complex;

@RunWith(JUnit4.class)
public class RegistersTest {

  @Test
  public void registersStartAtZero() {
    BitRegister bits = new BitRegister(new Definition("ro", VarType.BIT, 3));
    assertThat(bits.values()).containsExactly(false, false, false);
    bits.set(1, true);
    assertThat(bits.get(1)).isTrue();
    bits.reset();
    assertThat(bits.values()).doesNotContain(true);

    FloatRegister floats = new FloatRegister(new Definition("f", VarType.FLOAT, 2));
    assertThat(floats.values()).containsExactly(0.0, 0.0);
    ComplexRegister complex = new ComplexRegister(new Definition("c", VarType.COMPLEX, 1));
    assertThat(complex.get(0)).isEqualTo(Complex.ZERO);
  }

  @Test
  public void typeMustMatchDefinition() {
    Definition floatDefinition = new Definition("f", VarType.FLOAT, 2, false, true);
    assertThrows(IllegalArgumentException.class, () -> new BitRegister(floatDefinition));
    assertThrows(IllegalArgumentException.class, () -> new ComplexRegisterOutput(floatDefinition));
    // An output register needs an output Definition
    assertThrows(
        IllegalArgumentException.class,
        () -> new FloatRegisterOutput(new Definition("f", VarType.FLOAT, 2)));
  }

  @Test
  public void outputRows() {
    BitRegisterOutput output =
        new BitRegisterOutput(new Definition("ro", VarType.BIT, 2, false, true));
    output.addShot(true, false);
    output.addShot(false, false);
    assertThat(output.numberOfShots()).isEqualTo(2);
    assertThat(output.row(0)).containsExactly(true, false).inOrder();
    assertThat(output.complexValue(0, 0)).isEqualTo(Complex.ONE);
    assertThat(output.complexValue(1, 0)).isEqualTo(Complex.ZERO);
    assertThrows(IllegalArgumentException.class, () -> output.addShot(true));

    FloatRegisterOutput floats = new FloatRegisterOutput("exp", 1);
    floats.addShot(0.25);
    assertThat(floats.complexValue(0, 0)).isEqualTo(Complex.real(0.25));
  }

  @Test
  public void appendAndExtend() {
    BitRegister register = new BitRegister(new Definition("ro", VarType.BIT, 2));
    BitRegisterOutput output = new BitRegisterOutput("ro", 2);
    register.set(0, true);
    output.append(register);
    register.reset();
    output.append(register);
    assertThat(output.rows())
        .containsExactly(ImmutableList.of(true, false), ImmutableList.of(false, false))
        .inOrder();

    BitRegisterOutput more = new BitRegisterOutput("ro", 2);
    more.addShot(true, true);
    output.extend(more);
    assertThat(output.numberOfShots()).isEqualTo(3);

    assertThrows(
        IllegalArgumentException.class, () -> output.extend(new BitRegisterOutput("other", 2)));
    assertThrows(
        IllegalArgumentException.class,
        () -> output.append(new BitRegister(new Definition("ro", VarType.BIT, 3))));
  }

  @Test
  public void addFromDefinition() {
    Map<String, Register<?>> registers = new LinkedHashMap<>();
    Map<String, RegisterOutput<?>> outputs = new LinkedHashMap<>();
    Registers.add(registers, outputs, new Definition("ro", VarType.BIT, 2, false, true));
    Registers.add(registers, outputs, new Definition("scratch", VarType.FLOAT, 1));
    Registers.add(registers, outputs, new Definition("psi", VarType.COMPLEX, 4, false, true));
    assertThat(registers.keySet()).containsExactly("ro", "scratch", "psi").inOrder();
    assertThat(outputs.keySet()).containsExactly("ro", "psi").inOrder();
    assertThat(outputs.get("psi")).isInstanceOf(ComplexRegisterOutput.class);

    assertThrows(
        IllegalArgumentException.class,
        () -> Registers.add(registers, outputs, new Definition("n", VarType.INT, 1)));
  }
}
