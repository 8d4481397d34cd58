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

import com.google.errorprone.annotations.FormatMethod;

/**
 * Thrown when an operation is asked to do something its variant or current state does not allow.
 * These are programming errors; retrying the same call will fail the same way.
 */
public class OperationError extends RuntimeException {

  /** What went wrong. */
  public enum Kind {
    /** Combining operations that act on different qubits. */
    DOMAIN_MISMATCH,
    /** Raising to a power a gate that has no rotation-strength parameters. */
    NOT_EXPONENTIABLE,
    /** Asking for a numeric result while some parameter is still symbolic. */
    UNRESOLVED_PARAMETER,
    /** Asking a non-unitary operation for its unitary matrix. */
    NOT_UNITARY,
    /** Remapping the qubits of an operation that does not support it. */
    REMAP_NOT_SUPPORTED,
    /** Remapping with a mapping that does not cover every involved qubit. */
    MISSING_QUBIT_MAPPING
  }

  public final Kind kind;

  /** The name of the operation variant, e.g. "RotateX". */
  public final String operation;

  public OperationError(Kind kind, String operation, String msg) {
    super(msg);
    this.kind = kind;
    this.operation = operation;
  }

  @FormatMethod
  static OperationError of(Kind kind, String operation, String fmt, Object... fmtArgs) {
    return new OperationError(kind, operation, String.format(fmt, fmtArgs));
  }

  static OperationError remapNotSupported(String operation) {
    return of(
        Kind.REMAP_NOT_SUPPORTED, operation, "%s does not support qubit remapping", operation);
  }

  static OperationError unresolved(String operation) {
    return of(
        Kind.UNRESOLVED_PARAMETER,
        operation,
        "%s has symbolic parameters and cannot be evaluated numerically",
        operation);
  }
}
