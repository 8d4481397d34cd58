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

package org.qircuit.util;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.qircuit.config.ConfigReader;

@RunWith(JUnit4.class)
public class ComplexMatrixTest {
  static final ComplexMatrix PAULI_Y =
      ComplexMatrix.of(
          new Complex[] {Complex.ZERO, Complex.of(0, -1)}, new Complex[] {Complex.I, Complex.ZERO});

  @Test
  public void complexArithmetic() {
    Complex x = Complex.of(1, 2);
    Complex y = Complex.of(3, -1);
    assertThat(x.times(y)).isEqualTo(Complex.of(5, 5));
    assertThat(x.plus(y).minus(x)).isEqualTo(y);
    assertThat(x.conjugate()).isEqualTo(Complex.of(1, -2));
    assertThat(Complex.of(3, 4).abs()).isEqualTo(5.0);
    assertThat(Complex.expI(Math.PI).isClose(Complex.real(-1))).isTrue();
    assertThat(Complex.I.arg()).isWithin(1e-15).of(Math.PI / 2);
  }

  @Test
  public void complexToString() {
    assertThat(Complex.of(1, 2).toString()).isEqualTo("(1.0+2.0j)");
    assertThat(Complex.of(1, -2).toString()).isEqualTo("(1.0-2.0j)");
    assertThat(Complex.real(0.5).toString()).isEqualTo("0.5");
  }

  @Test
  public void products() {
    ComplexMatrix y = PAULI_Y;
    assertThat(y.times(y).isClose(ComplexMatrix.identity(2))).isTrue();
    assertThat(y.conjugateTranspose().isClose(y)).isTrue();
    assertThat(y.trace().isClose(Complex.ZERO)).isTrue();

    Complex[] applied = y.times(new double[] {1, 0});
    assertThat(applied[0].isClose(Complex.ZERO)).isTrue();
    assertThat(applied[1].isClose(Complex.I)).isTrue();
    Complex[] appliedToComplex = y.times(new Complex[] {Complex.I, Complex.ONE});
    assertThat(appliedToComplex[0].isClose(Complex.I.negate())).isTrue();
    assertThat(appliedToComplex[1].isClose(Complex.real(-1))).isTrue();
  }

  @Test
  public void nonSquareProduct() {
    ComplexMatrix row = ComplexMatrix.ofReal(new double[] {1, 2, 3});
    ComplexMatrix column =
        ComplexMatrix.ofReal(new double[] {1}, new double[] {1}, new double[] {1});
    ComplexMatrix product = row.times(column);
    assertThat(product.rows()).isEqualTo(1);
    assertThat(product.columns()).isEqualTo(1);
    assertThat(product.get(0, 0).isClose(Complex.real(6))).isTrue();
    assertThrows(IllegalArgumentException.class, () -> row.times(row));
    assertThrows(IllegalArgumentException.class, () -> row.times(new double[] {1, 2}));
  }

  @Test
  public void shapeErrors() {
    assertThrows(
        IllegalArgumentException.class,
        () -> ComplexMatrix.ofReal(new double[] {1, 2}, new double[] {3}));
    assertThrows(IndexOutOfBoundsException.class, () -> ComplexMatrix.identity(2).get(2, 0));
    assertThrows(IllegalStateException.class, () -> ComplexMatrix.zeros(1, 2).trace());
  }

  @Test
  public void diagonal() {
    ComplexMatrix d = ComplexMatrix.diagonal(Complex.ONE, Complex.I);
    assertThat(d.get(1, 1)).isEqualTo(Complex.I);
    assertThat(d.get(0, 1)).isEqualTo(Complex.ZERO);
    assertThat(d.isClose(ComplexMatrix.identity(2))).isFalse();
  }

  @Test
  public void config() {
    ComplexMatrix m = PAULI_Y.times(Complex.of(0.5, 0.25));
    assertThat(ComplexMatrix.fromConfig(ConfigReader.of(m.toConfig()))).isEqualTo(m);

    ImmutableList<Complex> v = ImmutableList.of(Complex.of(0.6, 0), Complex.of(0, 0.8));
    assertThat(ComplexMatrix.vectorFromConfig(ConfigReader.of(ComplexMatrix.vectorToConfig(v))))
        .isEqualTo(v);
  }
}
