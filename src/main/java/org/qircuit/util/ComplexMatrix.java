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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.qircuit.config.ConfigReader;

/** An immutable dense matrix of complex numbers, stored in row-major order. */
public final class ComplexMatrix {
  private final int rows;
  private final int columns;
  private final Complex[] elements;

  private ComplexMatrix(int rows, int columns, Complex[] elements) {
    this.rows = rows;
    this.columns = columns;
    this.elements = elements;
  }

  /** Returns a matrix with the given rows; all rows must have the same length. */
  public static ComplexMatrix of(Complex[]... rowArrays) {
    int columns = (rowArrays.length == 0) ? 0 : rowArrays[0].length;
    Complex[] elements = new Complex[rowArrays.length * columns];
    for (int r = 0; r < rowArrays.length; r++) {
      Preconditions.checkArgument(rowArrays[r].length == columns, "Ragged matrix");
      System.arraycopy(rowArrays[r], 0, elements, r * columns, columns);
    }
    return new ComplexMatrix(rowArrays.length, columns, elements);
  }

  /** Returns a matrix with the given real entries. */
  public static ComplexMatrix ofReal(double[]... rowArrays) {
    Complex[][] complexRows = new Complex[rowArrays.length][];
    for (int r = 0; r < rowArrays.length; r++) {
      complexRows[r] = Arrays.stream(rowArrays[r]).mapToObj(Complex::real).toArray(Complex[]::new);
    }
    return of(complexRows);
  }

  /** Returns a rows x columns matrix of zeros. */
  public static ComplexMatrix zeros(int rows, int columns) {
    Complex[] elements = new Complex[rows * columns];
    Arrays.fill(elements, Complex.ZERO);
    return new ComplexMatrix(rows, columns, elements);
  }

  public static ComplexMatrix identity(int size) {
    Complex[] elements = new Complex[size * size];
    Arrays.fill(elements, Complex.ZERO);
    for (int i = 0; i < size; i++) {
      elements[i * size + i] = Complex.ONE;
    }
    return new ComplexMatrix(size, size, elements);
  }

  /** Returns a square matrix with the given diagonal. */
  public static ComplexMatrix diagonal(Complex... diagonal) {
    ComplexMatrix result = zeros(diagonal.length, diagonal.length);
    for (int i = 0; i < diagonal.length; i++) {
      result.elements[i * diagonal.length + i] = diagonal[i];
    }
    return result;
  }

  public int rows() {
    return rows;
  }

  public int columns() {
    return columns;
  }

  public Complex get(int row, int column) {
    Preconditions.checkElementIndex(row, rows);
    Preconditions.checkElementIndex(column, columns);
    return elements[row * columns + column];
  }

  public ComplexMatrix times(ComplexMatrix other) {
    Preconditions.checkArgument(
        columns == other.rows,
        "Cannot multiply %sx%s by %sx%s",
        rows,
        columns,
        other.rows,
        other.columns);
    Complex[] result = new Complex[rows * other.columns];
    for (int r = 0; r < rows; r++) {
      for (int c = 0; c < other.columns; c++) {
        Complex sum = Complex.ZERO;
        for (int k = 0; k < columns; k++) {
          sum = sum.plus(elements[r * columns + k].times(other.elements[k * other.columns + c]));
        }
        result[r * other.columns + c] = sum;
      }
    }
    return new ComplexMatrix(rows, other.columns, result);
  }

  /** Returns this matrix applied to a real vector. */
  public Complex[] times(double[] vector) {
    Preconditions.checkArgument(
        vector.length == columns, "Vector of length %s for %s columns", vector.length, columns);
    Complex[] result = new Complex[rows];
    for (int r = 0; r < rows; r++) {
      Complex sum = Complex.ZERO;
      for (int c = 0; c < columns; c++) {
        sum = sum.plus(elements[r * columns + c].times(vector[c]));
      }
      result[r] = sum;
    }
    return result;
  }

  public Complex[] times(Complex[] vector) {
    Preconditions.checkArgument(
        vector.length == columns, "Vector of length %s for %s columns", vector.length, columns);
    Complex[] result = new Complex[rows];
    for (int r = 0; r < rows; r++) {
      Complex sum = Complex.ZERO;
      for (int c = 0; c < columns; c++) {
        sum = sum.plus(elements[r * columns + c].times(vector[c]));
      }
      result[r] = sum;
    }
    return result;
  }

  public ComplexMatrix times(Complex scale) {
    return new ComplexMatrix(
        rows, columns, Arrays.stream(elements).map(x -> x.times(scale)).toArray(Complex[]::new));
  }

  public ComplexMatrix conjugateTranspose() {
    Complex[] result = new Complex[elements.length];
    for (int r = 0; r < rows; r++) {
      for (int c = 0; c < columns; c++) {
        result[c * rows + r] = elements[r * columns + c].conjugate();
      }
    }
    return new ComplexMatrix(columns, rows, result);
  }

  public Complex trace() {
    Preconditions.checkState(rows == columns, "Trace of non-square matrix");
    Complex sum = Complex.ZERO;
    for (int i = 0; i < rows; i++) {
      sum = sum.plus(elements[i * columns + i]);
    }
    return sum;
  }

  /** True if the shapes match and every element is within {@code tolerance}. */
  public boolean isClose(ComplexMatrix other, double tolerance) {
    if (rows != other.rows || columns != other.columns) {
      return false;
    }
    for (int i = 0; i < elements.length; i++) {
      if (!elements[i].isClose(other.elements[i], tolerance)) {
        return false;
      }
    }
    return true;
  }

  public boolean isClose(ComplexMatrix other) {
    return isClose(other, Complex.TOLERANCE);
  }

  /** Writes {@code rows}, {@code columns} and row-major {@code real} / {@code imag} arrays. */
  public Map<String, Object> toConfig() {
    Map<String, Object> config = new LinkedHashMap<>();
    List<Double> real = new ArrayList<>();
    List<Double> imag = new ArrayList<>();
    for (Complex x : elements) {
      real.add(x.re);
      imag.add(x.im);
    }
    config.put("rows", rows);
    config.put("columns", columns);
    config.put("real", real);
    config.put("imag", imag);
    return config;
  }

  public static ComplexMatrix fromConfig(ConfigReader config) {
    int rows = config.getInt("rows");
    int columns = config.getInt("columns");
    double[] real = config.getDoubleArray("real");
    double[] imag = config.getDoubleArray("imag");
    Preconditions.checkArgument(
        real.length == rows * columns && imag.length == real.length,
        "Matrix data does not match %sx%s",
        rows,
        columns);
    Complex[] elements = new Complex[real.length];
    for (int i = 0; i < elements.length; i++) {
      elements[i] = Complex.of(real[i], imag[i]);
    }
    return new ComplexMatrix(rows, columns, elements);
  }

  /** Writes a vector as separate {@code real} and {@code imag} arrays. */
  public static Map<String, Object> vectorToConfig(List<Complex> vector) {
    Map<String, Object> config = new LinkedHashMap<>();
    List<Double> real = new ArrayList<>();
    List<Double> imag = new ArrayList<>();
    for (Complex x : vector) {
      real.add(x.re);
      imag.add(x.im);
    }
    config.put("real", real);
    config.put("imag", imag);
    return config;
  }

  public static ImmutableList<Complex> vectorFromConfig(ConfigReader config) {
    double[] real = config.getDoubleArray("real");
    double[] imag = config.getDoubleArray("imag");
    Preconditions.checkArgument(real.length == imag.length, "Vector data differ in length");
    ImmutableList.Builder<Complex> builder = ImmutableList.builderWithExpectedSize(real.length);
    for (int i = 0; i < real.length; i++) {
      builder.add(Complex.of(real[i], imag[i]));
    }
    return builder.build();
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof ComplexMatrix m
        && rows == m.rows
        && columns == m.columns
        && Arrays.equals(elements, m.elements);
  }

  @Override
  public int hashCode() {
    return 31 * (31 * rows + columns) + Arrays.hashCode(elements);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("[");
    for (int r = 0; r < rows; r++) {
      if (r != 0) {
        sb.append(", ");
      }
      sb.append(Arrays.toString(Arrays.copyOfRange(elements, r * columns, (r + 1) * columns)));
    }
    return sb.append(']').toString();
  }
}
