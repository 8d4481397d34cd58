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

/** An immutable complex number. */
public final class Complex {
  public static final Complex ZERO = new Complex(0, 0);
  public static final Complex ONE = new Complex(1, 0);
  public static final Complex I = new Complex(0, 1);

  /** The default absolute tolerance used by {@link #isClose(Complex)}. */
  public static final double TOLERANCE = 1e-8;

  public final double re;
  public final double im;

  private Complex(double re, double im) {
    this.re = re;
    this.im = im;
  }

  public static Complex of(double re, double im) {
    return new Complex(re, im);
  }

  public static Complex real(double re) {
    return new Complex(re, 0);
  }

  public static Complex imaginary(double im) {
    return new Complex(0, im);
  }

  /** Returns {@code e^(i * phase)}. */
  public static Complex expI(double phase) {
    return new Complex(Math.cos(phase), Math.sin(phase));
  }

  public Complex plus(Complex other) {
    return new Complex(re + other.re, im + other.im);
  }

  public Complex minus(Complex other) {
    return new Complex(re - other.re, im - other.im);
  }

  public Complex times(Complex other) {
    return new Complex(re * other.re - im * other.im, re * other.im + im * other.re);
  }

  public Complex times(double scale) {
    return new Complex(re * scale, im * scale);
  }

  public Complex dividedBy(double scale) {
    return new Complex(re / scale, im / scale);
  }

  public Complex negate() {
    return new Complex(-re, -im);
  }

  public Complex conjugate() {
    return new Complex(re, -im);
  }

  public double abs() {
    return Math.hypot(re, im);
  }

  /** The argument, in (-pi, pi]. */
  public double arg() {
    return Math.atan2(im, re);
  }

  /** True if both components are within {@link #TOLERANCE} of {@code other}'s. */
  public boolean isClose(Complex other) {
    return isClose(other, TOLERANCE);
  }

  public boolean isClose(Complex other, double tolerance) {
    return Math.abs(re - other.re) <= tolerance && Math.abs(im - other.im) <= tolerance;
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof Complex c
        && Double.doubleToLongBits(re) == Double.doubleToLongBits(c.re)
        && Double.doubleToLongBits(im) == Double.doubleToLongBits(c.im);
  }

  @Override
  public int hashCode() {
    return 31 * Double.hashCode(re) + Double.hashCode(im);
  }

  @Override
  public String toString() {
    if (im == 0) {
      return Double.toString(re);
    }
    return String.format("(%s%s%sj)", re, (im < 0 || Double.isNaN(im)) ? "" : "+", im);
  }
}
