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
import com.google.common.primitives.Doubles;
import com.google.common.primitives.Ints;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.qircuit.config.ConfigReader;

/**
 * An immutable square complex matrix in compressed sparse row form: the non-zero entries of row
 * {@code r} are at positions {@code indptr[r] <= i < indptr[r+1]}, in column {@code indices[i]}.
 */
public final class SparseComplexMatrix {
  private final int dimension;
  private final double[] real;
  private final double[] imag;
  private final int[] indices;
  private final int[] indptr;

  private SparseComplexMatrix(
      int dimension, double[] real, double[] imag, int[] indices, int[] indptr) {
    Preconditions.checkArgument(
        real.length == imag.length && real.length == indices.length,
        "Sparse matrix arrays differ in length");
    Preconditions.checkArgument(
        indptr.length == dimension + 1 && indptr[dimension] == real.length,
        "Row pointers do not match dimension %s",
        dimension);
    for (int column : indices) {
      Preconditions.checkElementIndex(column, dimension, "column index");
    }
    this.dimension = dimension;
    this.real = real;
    this.imag = imag;
    this.indices = indices;
    this.indptr = indptr;
  }

  /** Returns the CSR form of a dense square matrix, dropping exact zeros. */
  public static SparseComplexMatrix fromDense(ComplexMatrix dense) {
    Preconditions.checkArgument(dense.rows() == dense.columns(), "Matrix must be square");
    int n = dense.rows();
    List<Double> re = new ArrayList<>();
    List<Double> im = new ArrayList<>();
    List<Integer> cols = new ArrayList<>();
    int[] indptr = new int[n + 1];
    for (int r = 0; r < n; r++) {
      for (int c = 0; c < n; c++) {
        Complex x = dense.get(r, c);
        if (x.re != 0 || x.im != 0) {
          re.add(x.re);
          im.add(x.im);
          cols.add(c);
        }
      }
      indptr[r + 1] = cols.size();
    }
    return new SparseComplexMatrix(
        n, Doubles.toArray(re), Doubles.toArray(im), Ints.toArray(cols), indptr);
  }

  public int dimension() {
    return dimension;
  }

  public ComplexMatrix toDense() {
    Complex[][] rows = new Complex[dimension][dimension];
    for (Complex[] row : rows) {
      Arrays.fill(row, Complex.ZERO);
    }
    for (int r = 0; r < dimension; r++) {
      for (int i = indptr[r]; i < indptr[r + 1]; i++) {
        rows[r][indices[i]] = Complex.of(real[i], imag[i]);
      }
    }
    return ComplexMatrix.of(rows);
  }

  /** Returns {@code <state| this |state>}. */
  public Complex expectation(List<Complex> state) {
    Preconditions.checkArgument(
        state.size() == dimension, "State of size %s for dimension %s", state.size(), dimension);
    Complex sum = Complex.ZERO;
    for (int r = 0; r < dimension; r++) {
      Complex rowSum = Complex.ZERO;
      for (int i = indptr[r]; i < indptr[r + 1]; i++) {
        rowSum = rowSum.plus(Complex.of(real[i], imag[i]).times(state.get(indices[i])));
      }
      sum = sum.plus(state.get(r).conjugate().times(rowSum));
    }
    return sum;
  }

  /**
   * Returns {@code trace(this * rho)}, where {@code rho} is given as a row-major flattened
   * dimension x dimension matrix.
   */
  public Complex traceWith(List<Complex> rho) {
    Preconditions.checkArgument(
        rho.size() == dimension * dimension,
        "Density matrix of size %s for dimension %s",
        rho.size(),
        dimension);
    Complex sum = Complex.ZERO;
    for (int r = 0; r < dimension; r++) {
      for (int i = indptr[r]; i < indptr[r + 1]; i++) {
        // (this * rho)[r][r] = sum over k of this[r][k] * rho[k][r]
        sum = sum.plus(Complex.of(real[i], imag[i]).times(rho.get(indices[i] * dimension + r)));
      }
    }
    return sum;
  }

  public Map<String, Object> toConfig() {
    Map<String, Object> config = new LinkedHashMap<>();
    config.put("dimension", dimension);
    config.put("real", new ArrayList<>(Doubles.asList(real)));
    config.put("imag", new ArrayList<>(Doubles.asList(imag)));
    config.put("indices", new ArrayList<>(Ints.asList(indices)));
    config.put("indptr", new ArrayList<>(Ints.asList(indptr)));
    return config;
  }

  public static SparseComplexMatrix fromConfig(ConfigReader config) {
    return new SparseComplexMatrix(
        config.getInt("dimension"),
        config.getDoubleArray("real"),
        config.getDoubleArray("imag"),
        Ints.toArray(config.getIntList("indices")),
        Ints.toArray(config.getIntList("indptr")));
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof SparseComplexMatrix m
        && dimension == m.dimension
        && Arrays.equals(real, m.real)
        && Arrays.equals(imag, m.imag)
        && Arrays.equals(indices, m.indices)
        && Arrays.equals(indptr, m.indptr);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(new int[] {dimension, Arrays.hashCode(real), Arrays.hashCode(indices)});
  }
}
