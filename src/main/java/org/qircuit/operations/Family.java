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

/**
 * The families an operation may belong to. Every operation belongs to {@link #OPERATION}; the
 * others are used for fast membership tests such as "is this a Pragma".
 */
public enum Family {
  OPERATION("Operation"),
  DEFINITION("Definition"),
  GATE_OPERATION("GateOperation"),
  SINGLE_QUBIT_GATE_OPERATION("SingleQubitGateOperation"),
  TWO_QUBIT_GATE_OPERATION("TwoQubitGateOperation"),
  MEASUREMENT("Measurement"),
  PRAGMA("Pragma"),
  PRAGMA_NOISE("PragmaNoise");

  /** The name of this family when listed among an operation's tags. */
  public final String tag;

  Family(String tag) {
    this.tag = tag;
  }
}
