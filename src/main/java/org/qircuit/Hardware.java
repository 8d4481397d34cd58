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

package org.qircuit;

import com.google.common.base.Preconditions;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.qircuit.circuit.Circuit;
import org.qircuit.operations.BackendTarget;
import org.qircuit.registers.RegisterOutput;

/**
 * The Hardware class is just a namespace for the interfaces through which measurements reach the
 * simulators and quantum processors that run their circuits. No implementations live in this
 * library.
 */
public class Hardware {

  // Just a namespace for the contained interfaces.
  private Hardware() {}

  /** Runs circuits, either on a simulator or on a real device. */
  public interface Backend {

    /** Selects which pragma backend instructions apply to this backend. */
    BackendTarget target();

    /** The number of qubits this backend can run circuits on. */
    int numberQubits();

    /**
     * Runs the given circuit and returns its output registers by name, or null if the backend
     * executes asynchronously and the results are not available yet.
     *
     * <p>Any exception thrown here propagates to the caller unchanged.
     *
     * @param overrides backend settings to use for this run only, merged from the circuit's pragma
     *     instructions and any resume information
     */
    @Nullable Map<String, RegisterOutput<?>> run(Circuit circuit, Map<String, Object> overrides);

    /**
     * Returns whatever the backend needs to pick up the most recent {@link #run} later, or null if
     * it does not support resuming.
     */
    default @Nullable Map<String, Object> resumeInfo() {
      return null;
    }
  }

  /** The error properties of a physical device. */
  public interface Device {

    int numberQubits();

    /** Returns the readout error of the given qubit, or null if its readout is ideal. */
    @Nullable ReadoutError measurementError(int qubit);
  }

  /** The probabilities that measuring a qubit reports the wrong value. */
  public static final class ReadoutError {
    public final double prob0As1;
    public final double prob1As0;

    public ReadoutError(double prob0As1, double prob1As0) {
      Preconditions.checkArgument(
          prob0As1 >= 0 && prob0As1 <= 1 && prob1As0 >= 0 && prob1As0 <= 1,
          "Readout error probabilities must be in [0, 1], got %s and %s",
          prob0As1,
          prob1As0);
      this.prob0As1 = prob0As1;
      this.prob1As0 = prob1As0;
    }

    /** One minus the average of the two error probabilities. */
    public double fidelity() {
      return (2 - prob0As1 - prob1As0) / 2;
    }

    @Override
    public boolean equals(Object other) {
      return other instanceof ReadoutError e && prob0As1 == e.prob0As1 && prob1As0 == e.prob1As0;
    }

    @Override
    public int hashCode() {
      return Double.hashCode(prob0As1) * 31 + Double.hashCode(prob1As0);
    }

    @Override
    public String toString() {
      return String.format("ReadoutError(%s, %s)", prob0As1, prob1As0);
    }
  }

  /** Returns the measurement fidelity of {@code qubit}, or 1 if no device is given. */
  public static double measurementFidelity(@Nullable Device device, int qubit) {
    if (device == null) {
      return 1;
    }
    ReadoutError error = device.measurementError(qubit);
    return (error == null) ? 1 : error.fidelity();
  }

  /** The depolarisation rate implied by a device's T1 time. */
  public static double depolarisationFromT1T2(double t1, double t2) {
    return 1 / t1;
  }

  /** The dephasing rate {@code 1/T2 - 1/(2 T1)} implied by a device's T1 and T2 times. */
  public static double dephasingFromT1T2(double t1, double t2) {
    return 1 / t2 - 1 / (2 * t1);
  }
}
