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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.Arrays;
import org.jspecify.annotations.Nullable;
import org.qircuit.expr.MathFunction;
import org.qircuit.expr.SymbolicValue;
import org.qircuit.util.Complex;
import org.qircuit.util.ComplexMatrix;

/**
 * The closed set of unitary gate variants. Each constant fixes the gate's domain (its {@link
 * GateTemplate}) and supplies its algebra: single-qubit gates provide their {@link
 * SingleQubitCoefficients}, two-qubit gates provide their numeric matrix and their {@link
 * KakDecomposition}.
 *
 * <p>Two-qubit matrices use the basis order |00>, |01>, |10>, |11> where the left bit is the most
 * significant qubit ({@code control}, or {@code j} for symmetric gates).
 */
public enum GateType {
  SINGLE_QUBIT_GATE(
      GateTemplate.single("SingleQubitGate")
          .param("alpha_r", 1)
          .param("alpha_i", 0)
          .param("beta_r", 0)
          .param("beta_i", 0)
          .param("global_phase", 0)) {
    @Override
    SingleQubitCoefficients coefficients(GateParameters p) {
      return new SingleQubitCoefficients(
          p.symbolic("alpha_r"),
          p.symbolic("alpha_i"),
          p.symbolic("beta_r"),
          p.symbolic("beta_i"),
          p.symbolic("global_phase"));
    }
  },

  HADAMARD(GateTemplate.single("Hadamard")) {
    @Override
    SingleQubitCoefficients coefficients(GateParameters p) {
      return SingleQubitCoefficients.of(0, -SQRT_HALF, 0, -SQRT_HALF, Math.PI / 2);
    }
  },

  PAULI_X(GateTemplate.single("PauliX").selfInverse()) {
    @Override
    SingleQubitCoefficients coefficients(GateParameters p) {
      return SingleQubitCoefficients.of(0, 0, 0, -1, Math.PI / 2);
    }
  },

  PAULI_Y(GateTemplate.single("PauliY").selfInverse()) {
    @Override
    SingleQubitCoefficients coefficients(GateParameters p) {
      return SingleQubitCoefficients.of(0, 0, 1, 0, Math.PI / 2);
    }
  },

  PAULI_Z(GateTemplate.single("PauliZ").selfInverse()) {
    @Override
    SingleQubitCoefficients coefficients(GateParameters p) {
      return SingleQubitCoefficients.of(0, -1, 0, 0, Math.PI / 2);
    }
  },

  S_GATE(GateTemplate.single("SGate")) {
    @Override
    SingleQubitCoefficients coefficients(GateParameters p) {
      return SingleQubitCoefficients.of(SQRT_HALF, -SQRT_HALF, 0, 0, Math.PI / 4);
    }
  },

  T_GATE(GateTemplate.single("TGate")) {
    @Override
    SingleQubitCoefficients coefficients(GateParameters p) {
      return SingleQubitCoefficients.of(
          Math.cos(Math.PI / 8), -Math.sin(Math.PI / 8), 0, 0, Math.PI / 8);
    }
  },

  SQRT_PAULI_X(GateTemplate.single("SqrtPauliX")) {
    @Override
    SingleQubitCoefficients coefficients(GateParameters p) {
      return SingleQubitCoefficients.of(Math.cos(Math.PI / 4), 0, 0, -Math.sin(Math.PI / 4), 0);
    }
  },

  INV_SQRT_PAULI_X(GateTemplate.single("InvSqrtPauliX")) {
    @Override
    SingleQubitCoefficients coefficients(GateParameters p) {
      return SingleQubitCoefficients.of(Math.cos(Math.PI / 4), 0, 0, Math.sin(Math.PI / 4), 0);
    }
  },

  ROTATE_X(GateTemplate.single("RotateX").rotation("theta", 4 * Math.PI)) {
    @Override
    SingleQubitCoefficients coefficients(GateParameters p) {
      SymbolicValue half = p.symbolic("theta").divide(2);
      SymbolicValue zero = SymbolicValue.ZERO;
      return new SingleQubitCoefficients(cos(half), zero, zero, sin(half).negate(), zero);
    }
  },

  ROTATE_Y(GateTemplate.single("RotateY").rotation("theta", 4 * Math.PI)) {
    @Override
    SingleQubitCoefficients coefficients(GateParameters p) {
      SymbolicValue half = p.symbolic("theta").divide(2);
      return new SingleQubitCoefficients(
          cos(half), SymbolicValue.ZERO, sin(half), SymbolicValue.ZERO, SymbolicValue.ZERO);
    }
  },

  ROTATE_Z(GateTemplate.single("RotateZ").rotation("theta", 4 * Math.PI)) {
    @Override
    SingleQubitCoefficients coefficients(GateParameters p) {
      SymbolicValue half = p.symbolic("theta").divide(2);
      SymbolicValue zero = SymbolicValue.ZERO;
      return new SingleQubitCoefficients(cos(half), sin(half).negate(), zero, zero, zero);
    }
  },

  /** A rotation by {@code theta} around the unit vector with the given spherical angles. */
  ROTATE_AROUND_SPHERICAL_AXIS(
      GateTemplate.single("RotateAroundSphericalAxis")
          .rotation("theta", 4 * Math.PI)
          .param("spherical_theta", Math.PI / 2)
          .param("spherical_phi", 0)) {
    @Override
    SingleQubitCoefficients coefficients(GateParameters p) {
      SymbolicValue half = p.symbolic("theta").divide(2);
      SymbolicValue s = sin(half);
      SymbolicValue sinTheta = sin(p.symbolic("spherical_theta"));
      SymbolicValue phi = p.symbolic("spherical_phi");
      return new SingleQubitCoefficients(
          cos(half),
          s.multiply(cos(p.symbolic("spherical_theta"))).negate(),
          s.multiply(sin(phi)).multiply(sinTheta),
          s.multiply(cos(phi)).multiply(sinTheta).negate(),
          SymbolicValue.ZERO);
    }
  },

  /** A rotation by {@code theta} around an axis in the x-y plane. */
  W(GateTemplate.single("W").rotation("theta", 4 * Math.PI).param("spherical_phi", 0)) {
    @Override
    SingleQubitCoefficients coefficients(GateParameters p) {
      SymbolicValue s = sin(p.symbolic("theta").divide(2));
      SymbolicValue phi = p.symbolic("spherical_phi");
      return new SingleQubitCoefficients(
          cos(p.symbolic("theta").divide(2)),
          SymbolicValue.ZERO,
          s.multiply(sin(phi)),
          s.multiply(cos(phi)).negate(),
          SymbolicValue.ZERO);
    }
  },

  CNOT(GateTemplate.controlled("CNOT").selfInverse()) {
    @Override
    ComplexMatrix matrix(GateParameters p) {
      return ComplexMatrix.ofReal(
          new double[] {1, 0, 0, 0},
          new double[] {0, 1, 0, 0},
          new double[] {0, 0, 0, 1},
          new double[] {0, 0, 1, 0});
    }

    @Override
    KakDecomposition kak(GateOperation gate) {
      int control = gate.qubit("control");
      int target = gate.qubit("qubit");
      return new KakDecomposition(
          SymbolicValue.of(Math.PI / 4),
          ImmutableList.of(
              rotate(ROTATE_Z, control, Math.PI / 2), rotate(ROTATE_Y, control, Math.PI / 2)),
          ImmutableList.of(rotate(ROTATE_X, target, Math.PI / 2)),
          literals(Math.PI / 4, 0, 0),
          ImmutableList.of(rotate(ROTATE_Y, control, -Math.PI / 2)),
          ImmutableList.of());
    }
  },

  ISWAP(GateTemplate.controlled("ISwap")) {
    @Override
    ComplexMatrix matrix(GateParameters p) {
      return matrix4(
          ONE, ZERO, ZERO, ZERO,
          ZERO, ZERO, Complex.I, ZERO,
          ZERO, Complex.I, ZERO, ZERO,
          ZERO, ZERO, ZERO, ONE);
    }

    @Override
    KakDecomposition kak(GateOperation gate) {
      return KakDecomposition.interaction(Math.PI / 4, Math.PI / 4, 0);
    }
  },

  FSWAP(GateTemplate.controlled("FSwap")) {
    @Override
    ComplexMatrix matrix(GateParameters p) {
      return ComplexMatrix.ofReal(
          new double[] {1, 0, 0, 0},
          new double[] {0, 0, 1, 0},
          new double[] {0, 1, 0, 0},
          new double[] {0, 0, 0, -1});
    }

    @Override
    KakDecomposition kak(GateOperation gate) {
      return new KakDecomposition(
          SymbolicValue.of(-Math.PI / 2),
          ImmutableList.of(rotate(ROTATE_Z, gate.qubit("control"), -Math.PI / 2)),
          ImmutableList.of(rotate(ROTATE_Z, gate.qubit("qubit"), -Math.PI / 2)),
          literals(Math.PI / 4, Math.PI / 4, 0),
          ImmutableList.of(),
          ImmutableList.of());
    }
  },

  SQRT_ISWAP(GateTemplate.controlled("SqrtISwap")) {
    @Override
    ComplexMatrix matrix(GateParameters p) {
      Complex d = Complex.real(SQRT_HALF);
      Complex o = Complex.imaginary(SQRT_HALF);
      return matrix4(
          ONE, ZERO, ZERO, ZERO,
          ZERO, d, o, ZERO,
          ZERO, o, d, ZERO,
          ZERO, ZERO, ZERO, ONE);
    }

    @Override
    KakDecomposition kak(GateOperation gate) {
      return KakDecomposition.interaction(Math.PI / 8, Math.PI / 8, 0);
    }
  },

  INV_SQRT_ISWAP(GateTemplate.controlled("InvSqrtISwap")) {
    @Override
    ComplexMatrix matrix(GateParameters p) {
      Complex d = Complex.real(SQRT_HALF);
      Complex o = Complex.imaginary(-SQRT_HALF);
      return matrix4(
          ONE, ZERO, ZERO, ZERO,
          ZERO, d, o, ZERO,
          ZERO, o, d, ZERO,
          ZERO, ZERO, ZERO, ONE);
    }

    @Override
    KakDecomposition kak(GateOperation gate) {
      return KakDecomposition.interaction(-Math.PI / 8, -Math.PI / 8, 0);
    }
  },

  MOLMER_SORENSEN_XX(GateTemplate.controlled("MolmerSorensenXX")) {
    @Override
    ComplexMatrix matrix(GateParameters p) {
      Complex d = Complex.real(SQRT_HALF);
      Complex o = Complex.imaginary(-SQRT_HALF);
      return matrix4(
          d, ZERO, ZERO, o,
          ZERO, d, o, ZERO,
          ZERO, o, d, ZERO,
          o, ZERO, ZERO, d);
    }

    @Override
    KakDecomposition kak(GateOperation gate) {
      return KakDecomposition.interaction(-Math.PI / 4, 0, 0);
    }
  },

  VARIABLE_MSXX(GateTemplate.controlled("VariableMSXX").rotation("theta", 4 * Math.PI)) {
    @Override
    ComplexMatrix matrix(GateParameters p) {
      double theta = p.value("theta");
      Complex c = Complex.real(Math.cos(theta / 2));
      Complex s = Complex.imaginary(-Math.sin(theta / 2));
      return matrix4(
          c, ZERO, ZERO, s,
          ZERO, c, s, ZERO,
          ZERO, s, c, ZERO,
          s, ZERO, ZERO, c);
    }

    @Override
    KakDecomposition kak(GateOperation gate) {
      return KakDecomposition.interaction(
          SymbolicValue.ZERO,
          gate.parameter("theta").divide(-2),
          SymbolicValue.ZERO,
          SymbolicValue.ZERO);
    }
  },

  SWAP(GateTemplate.controlled("SWAP").selfInverse()) {
    @Override
    ComplexMatrix matrix(GateParameters p) {
      return ComplexMatrix.ofReal(
          new double[] {1, 0, 0, 0},
          new double[] {0, 0, 1, 0},
          new double[] {0, 1, 0, 0},
          new double[] {0, 0, 0, 1});
    }

    @Override
    KakDecomposition kak(GateOperation gate) {
      double k = Math.PI / 4;
      return KakDecomposition.interaction(
          SymbolicValue.of(-k), SymbolicValue.of(k), SymbolicValue.of(k), SymbolicValue.of(k));
    }
  },

  CONTROLLED_PHASE_SHIFT(
      GateTemplate.controlled("ControlledPhaseShift").rotation("theta", 2 * Math.PI)) {
    @Override
    ComplexMatrix matrix(GateParameters p) {
      return ComplexMatrix.diagonal(ONE, ONE, ONE, Complex.expI(p.value("theta")));
    }

    @Override
    KakDecomposition kak(GateOperation gate) {
      SymbolicValue theta = gate.parameter("theta");
      return new KakDecomposition(
          theta.divide(4),
          ImmutableList.of(rotate(ROTATE_Z, gate.qubit("control"), theta.divide(2))),
          ImmutableList.of(rotate(ROTATE_Z, gate.qubit("qubit"), theta.divide(2))),
          ImmutableList.of(SymbolicValue.ZERO, SymbolicValue.ZERO, theta.divide(4)),
          ImmutableList.of(),
          ImmutableList.of());
    }
  },

  CONTROLLED_PAULI_Y(GateTemplate.controlled("ControlledPauliY").selfInverse()) {
    @Override
    ComplexMatrix matrix(GateParameters p) {
      return matrix4(
          ONE, ZERO, ZERO, ZERO,
          ZERO, ONE, ZERO, ZERO,
          ZERO, ZERO, ZERO, Complex.I.negate(),
          ZERO, ZERO, Complex.I, ZERO);
    }

    @Override
    KakDecomposition kak(GateOperation gate) {
      int control = gate.qubit("control");
      int target = gate.qubit("qubit");
      return new KakDecomposition(
          SymbolicValue.of(Math.PI / 4),
          ImmutableList.of(rotate(ROTATE_Z, control, Math.PI / 2)),
          ImmutableList.of(
              rotate(ROTATE_Y, target, Math.PI / 2), rotate(ROTATE_X, target, Math.PI / 2)),
          literals(0, 0, Math.PI / 4),
          ImmutableList.of(),
          ImmutableList.of(rotate(ROTATE_X, target, -Math.PI / 2)));
    }
  },

  CONTROLLED_PAULI_Z(GateTemplate.controlled("ControlledPauliZ").selfInverse()) {
    @Override
    ComplexMatrix matrix(GateParameters p) {
      return ComplexMatrix.diagonal(ONE, ONE, ONE, ONE.negate());
    }

    @Override
    KakDecomposition kak(GateOperation gate) {
      return new KakDecomposition(
          SymbolicValue.of(Math.PI / 4),
          ImmutableList.of(rotate(ROTATE_Z, gate.qubit("control"), Math.PI / 2)),
          ImmutableList.of(rotate(ROTATE_Z, gate.qubit("qubit"), Math.PI / 2)),
          literals(0, 0, Math.PI / 4),
          ImmutableList.of(),
          ImmutableList.of());
    }
  },

  /** The fermionic simulation gate with interaction {@code U}, hopping {@code t} and pairing. */
  FSIM(GateTemplate.targetFirst("Fsim").param("U", 0).param("t", 0).param("Delta", 0)) {
    @Override
    ComplexMatrix matrix(GateParameters p) {
      double u = p.value("U");
      double t = p.value("t");
      double delta = p.value("Delta");
      Complex eu = Complex.expI(-u);
      return matrix4(
          Complex.real(Math.cos(delta)), ZERO, ZERO, Complex.imaginary(Math.sin(delta)),
          ZERO, Complex.imaginary(-Math.sin(t)), Complex.real(Math.cos(t)), ZERO,
          ZERO, Complex.real(Math.cos(t)), Complex.imaginary(-Math.sin(t)), ZERO,
          eu.times(Complex.imaginary(-Math.sin(delta))), ZERO, ZERO, eu.times(-Math.cos(delta)));
    }

    @Override
    KakDecomposition kak(GateOperation gate) {
      SymbolicValue u = gate.parameter("U");
      SymbolicValue t = gate.parameter("t");
      SymbolicValue delta = gate.parameter("Delta");
      SymbolicValue theta = u.divide(-2).add(-Math.PI / 2);
      SymbolicValue base = t.divide(-2).add(Math.PI / 4);
      return new KakDecomposition(
          u.divide(-4).add(-Math.PI / 2),
          ImmutableList.of(),
          ImmutableList.of(),
          ImmutableList.of(base.add(delta.divide(2)), base.subtract(delta.divide(2)), u.divide(-4)),
          ImmutableList.of(rotate(ROTATE_Z, gate.qubit("control"), theta)),
          ImmutableList.of(rotate(ROTATE_Z, gate.qubit("qubit"), theta)));
    }
  },

  /** XX, YY and ZZ interactions with a swap of the middle basis states. */
  QSIM(GateTemplate.targetFirst("Qsim").param("x", 0).param("y", 0).param("z", 0)) {
    @Override
    ComplexMatrix matrix(GateParameters p) {
      return spinMatrix(p.value("x"), p.value("y"), p.value("z"), true);
    }

    @Override
    KakDecomposition kak(GateOperation gate) {
      return KakDecomposition.interaction(
          SymbolicValue.of(-Math.PI / 4),
          gate.parameter("x").negate().add(Math.PI / 4),
          gate.parameter("y").negate().add(Math.PI / 4),
          gate.parameter("z").negate().add(Math.PI / 4));
    }
  },

  SPIN_INTERACTION(
      GateTemplate.targetFirst("SpinInteraction").param("x", 0).param("y", 0).param("z", 0)) {
    @Override
    ComplexMatrix matrix(GateParameters p) {
      return spinMatrix(p.value("x"), p.value("y"), p.value("z"), false);
    }

    @Override
    KakDecomposition kak(GateOperation gate) {
      return KakDecomposition.interaction(
          SymbolicValue.ZERO,
          gate.parameter("x").negate(),
          gate.parameter("y").negate(),
          gate.parameter("z").negate());
    }
  },

  /** Pairing with complex gap {@code Delta_real + i Delta_imag}. */
  BOGOLIUBOV(
      GateTemplate.symmetric("Bogoliubov").rotation("Delta_real", 1).rotation("Delta_imag", 1)) {
    @Override
    ComplexMatrix matrix(GateParameters p) {
      Complex delta = Complex.of(p.value("Delta_real"), p.value("Delta_imag"));
      double d = delta.abs();
      double arg = delta.arg();
      Complex c = Complex.real(Math.cos(d));
      return matrix4(
          c, ZERO, ZERO, Complex.I.times(Complex.expI(arg)).times(Math.sin(d)),
          ZERO, ONE, ZERO, ZERO,
          ZERO, ZERO, ONE, ZERO,
          Complex.I.times(Complex.expI(-arg)).times(Math.sin(d)), ZERO, ZERO, c);
    }

    @Override
    KakDecomposition kak(GateOperation gate) {
      SymbolicValue abs = complexAbs(gate.parameter("Delta_real"), gate.parameter("Delta_imag"));
      SymbolicValue arg = complexArg(gate.parameter("Delta_real"), gate.parameter("Delta_imag"));
      int i = gate.qubit("i");
      return new KakDecomposition(
          SymbolicValue.ZERO,
          ImmutableList.of(rotate(ROTATE_Z, i, arg)),
          ImmutableList.of(),
          ImmutableList.of(abs.divide(2), abs.divide(-2), SymbolicValue.ZERO),
          ImmutableList.of(rotate(ROTATE_Z, i, arg.negate())),
          ImmutableList.of());
    }
  },

  GIVENS_ROTATION(GateTemplate.targetFirst("GivensRotation").param("theta", 0).param("phi", 0)) {
    @Override
    ComplexMatrix matrix(GateParameters p) {
      double theta = p.value("theta");
      Complex phase = Complex.expI(p.value("phi"));
      return matrix4(
          ONE, ZERO, ZERO, ZERO,
          ZERO, phase.times(Math.cos(theta)), Complex.real(Math.sin(theta)), ZERO,
          ZERO, phase.times(-Math.sin(theta)), Complex.real(Math.cos(theta)), ZERO,
          ZERO, ZERO, ZERO, phase);
    }

    @Override
    KakDecomposition kak(GateOperation gate) {
      SymbolicValue theta = gate.parameter("theta");
      SymbolicValue phi = gate.parameter("phi");
      int target = gate.qubit("qubit");
      return new KakDecomposition(
          phi.divide(2),
          ImmutableList.of(rotate(ROTATE_Z, target, phi.add(Math.PI / 2))),
          ImmutableList.of(),
          ImmutableList.of(theta.divide(2), theta.divide(2), SymbolicValue.ZERO),
          ImmutableList.of(rotate(ROTATE_Z, target, -Math.PI / 2)),
          ImmutableList.of());
    }
  },

  GIVENS_ROTATION_LITTLE_ENDIAN(
      GateTemplate.targetFirst("GivensRotationLittleEndian").param("theta", 0).param("phi", 0)) {
    @Override
    ComplexMatrix matrix(GateParameters p) {
      double theta = p.value("theta");
      Complex phase = Complex.expI(p.value("phi"));
      return matrix4(
          ONE, ZERO, ZERO, ZERO,
          ZERO, Complex.real(Math.cos(theta)), Complex.real(Math.sin(theta)), ZERO,
          ZERO, phase.times(-Math.sin(theta)), phase.times(Math.cos(theta)), ZERO,
          ZERO, ZERO, ZERO, phase);
    }

    @Override
    KakDecomposition kak(GateOperation gate) {
      SymbolicValue theta = gate.parameter("theta");
      SymbolicValue phi = gate.parameter("phi");
      int control = gate.qubit("control");
      return new KakDecomposition(
          phi.divide(2),
          ImmutableList.of(),
          ImmutableList.of(rotate(ROTATE_Z, control, -Math.PI / 2)),
          ImmutableList.of(theta.divide(2), theta.divide(2), SymbolicValue.ZERO),
          ImmutableList.of(),
          ImmutableList.of(rotate(ROTATE_Z, control, phi.add(Math.PI / 2))));
    }
  },

  /** Hopping between two sites with real amplitude {@code theta}. */
  PM_INTERACTION(GateTemplate.symmetric("PMInteraction").rotation("theta", 2 * Math.PI)) {
    @Override
    ComplexMatrix matrix(GateParameters p) {
      double theta = p.value("theta");
      Complex c = Complex.real(Math.cos(theta));
      Complex s = Complex.imaginary(-Math.sin(theta));
      return matrix4(
          ONE, ZERO, ZERO, ZERO,
          ZERO, c, s, ZERO,
          ZERO, s, c, ZERO,
          ZERO, ZERO, ZERO, ONE);
    }

    @Override
    KakDecomposition kak(GateOperation gate) {
      SymbolicValue k = gate.parameter("theta").divide(-2);
      return KakDecomposition.interaction(SymbolicValue.ZERO, k, k, SymbolicValue.ZERO);
    }
  },

  /** Hopping between two sites with complex amplitude {@code theta_real + i theta_imag}. */
  COMPLEX_PM_INTERACTION(
      GateTemplate.symmetric("ComplexPMInteraction")
          .rotation("theta_real", 2 * Math.PI)
          .rotation("theta_imag", 2 * Math.PI)) {
    @Override
    ComplexMatrix matrix(GateParameters p) {
      Complex theta = Complex.of(p.value("theta_real"), p.value("theta_imag"));
      double abs = theta.abs();
      double arg = theta.arg();
      Complex c = Complex.real(Math.cos(abs));
      Complex minusI = Complex.I.negate();
      return matrix4(
          ONE, ZERO, ZERO, ZERO,
          ZERO, c, minusI.times(Complex.expI(-arg)).times(Math.sin(abs)), ZERO,
          ZERO, minusI.times(Complex.expI(arg)).times(Math.sin(abs)), c, ZERO,
          ZERO, ZERO, ZERO, ONE);
    }

    @Override
    KakDecomposition kak(GateOperation gate) {
      SymbolicValue re = gate.parameter("theta_real");
      SymbolicValue im = gate.parameter("theta_imag");
      SymbolicValue k = complexAbs(re, im).divide(-2);
      SymbolicValue arg = complexArg(re, im);
      int i = gate.qubit("i");
      return new KakDecomposition(
          SymbolicValue.ZERO,
          ImmutableList.of(rotate(ROTATE_Z, i, arg)),
          ImmutableList.of(),
          ImmutableList.of(k, k, SymbolicValue.ZERO),
          ImmutableList.of(rotate(ROTATE_Z, i, arg.negate())),
          ImmutableList.of());
    }
  },

  XY(GateTemplate.controlled("XY").rotation("theta", 4 * Math.PI)) {
    @Override
    ComplexMatrix matrix(GateParameters p) {
      double theta = p.value("theta");
      Complex c = Complex.real(Math.cos(theta / 2));
      Complex s = Complex.imaginary(Math.sin(theta / 2));
      return matrix4(
          ONE, ZERO, ZERO, ZERO,
          ZERO, c, s, ZERO,
          ZERO, s, c, ZERO,
          ZERO, ZERO, ZERO, ONE);
    }

    @Override
    KakDecomposition kak(GateOperation gate) {
      SymbolicValue k = gate.parameter("theta").divide(4);
      return KakDecomposition.interaction(SymbolicValue.ZERO, k, k, SymbolicValue.ZERO);
    }
  };

  private static final double SQRT_HALF = Math.sqrt(0.5);
  private static final Complex ZERO = Complex.ZERO;
  private static final Complex ONE = Complex.ONE;

  private static final ImmutableMap<String, GateType> BY_NAME =
      Arrays.stream(values()).collect(ImmutableMap.toImmutableMap(t -> t.template.name, t -> t));

  public final GateTemplate template;

  GateType(GateTemplate.Builder builder) {
    this.template = builder.build();
  }

  /** Returns the gate type with the given variant name, or null if there is none. */
  public static @Nullable GateType forName(String name) {
    return BY_NAME.get(name);
  }

  public boolean isSingleQubit() {
    return template.defaultQubits.size() == 1;
  }

  /** Only defined for single-qubit gates. */
  SingleQubitCoefficients coefficients(GateParameters p) {
    throw new UnsupportedOperationException(template.name + " is not a single-qubit gate");
  }

  /** Returns the unitary matrix; every parameter must be a literal. */
  ComplexMatrix matrix(GateParameters p) {
    return coefficients(p).matrix();
  }

  /** Only defined for two-qubit gates. */
  KakDecomposition kak(GateOperation gate) {
    throw new UnsupportedOperationException(template.name + " is not a two-qubit gate");
  }

  private static SymbolicValue sin(SymbolicValue x) {
    return SymbolicValue.apply(MathFunction.SIN, x);
  }

  private static SymbolicValue cos(SymbolicValue x) {
    return SymbolicValue.apply(MathFunction.COS, x);
  }

  private static SymbolicValue complexAbs(SymbolicValue re, SymbolicValue im) {
    return SymbolicValue.apply(MathFunction.SQRT, re.multiply(re).add(im.multiply(im)));
  }

  private static SymbolicValue complexArg(SymbolicValue re, SymbolicValue im) {
    return SymbolicValue.apply(MathFunction.ATAN2, im, re);
  }

  private static ImmutableList<SymbolicValue> literals(double k0, double k1, double k2) {
    return ImmutableList.of(SymbolicValue.of(k0), SymbolicValue.of(k1), SymbolicValue.of(k2));
  }

  private static GateOperation rotate(GateType rotation, int qubit, SymbolicValue theta) {
    return new GateOperation(
        rotation, ImmutableMap.of("qubit", qubit), ImmutableMap.of("theta", theta));
  }

  private static GateOperation rotate(GateType rotation, int qubit, double theta) {
    return rotate(rotation, qubit, SymbolicValue.of(theta));
  }

  /** Builds a 4x4 matrix from its 16 entries in row-major order. */
  private static ComplexMatrix matrix4(Complex... entries) {
    Complex[][] rows = new Complex[4][];
    for (int r = 0; r < 4; r++) {
      rows[r] = Arrays.copyOfRange(entries, 4 * r, 4 * r + 4);
    }
    return ComplexMatrix.of(rows);
  }

  /**
   * The matrix of {@code exp(-i (x XX + y YY + z ZZ))}; if {@code swapped}, the two middle basis
   * states are exchanged.
   */
  private static ComplexMatrix spinMatrix(double x, double y, double z, boolean swapped) {
    Complex outerPhase = Complex.expI(-z);
    Complex innerPhase = Complex.expI(z);
    Complex oc = outerPhase.times(Math.cos(x - y));
    Complex os = outerPhase.times(Complex.imaginary(-Math.sin(x - y)));
    Complex ic = innerPhase.times(Math.cos(x + y));
    Complex is = innerPhase.times(Complex.imaginary(-Math.sin(x + y)));
    Complex diag = swapped ? is : ic;
    Complex offDiag = swapped ? ic : is;
    return matrix4(
        oc, ZERO, ZERO, os,
        ZERO, diag, offDiag, ZERO,
        ZERO, offDiag, diag, ZERO,
        os, ZERO, ZERO, oc);
  }
}
