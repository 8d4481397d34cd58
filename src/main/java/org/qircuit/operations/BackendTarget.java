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

import java.util.Arrays;
import java.util.Comparator;
import org.jspecify.annotations.Nullable;

/** The kinds of backend a circuit can be dispatched to. */
public enum BackendTarget {
  PYQUEST_CFFI("pyquest_cffi"),
  BRAKET("braket"),
  PYQUIL("pyquil"),
  AQT("aqt"),
  CIRQ("cirq"),
  CIRQ_CODE("cirq_code"),
  SIMULATOR("simulator");

  /** Backend names that start with this prefix select this target. */
  public final String prefix;

  BackendTarget(String prefix) {
    this.prefix = prefix;
  }

  // Longest prefix first, so that "cirq_code" is not taken for "cirq".
  private static final BackendTarget[] BY_PREFIX_LENGTH =
      Arrays.stream(values())
          .sorted(Comparator.comparingInt((BackendTarget t) -> t.prefix.length()).reversed())
          .toArray(BackendTarget[]::new);

  /** Returns the target whose prefix starts {@code backendName}, or null if there is none. */
  public static @Nullable BackendTarget forName(String backendName) {
    for (BackendTarget target : BY_PREFIX_LENGTH) {
      if (backendName.startsWith(target.prefix)) {
        return target;
      }
    }
    return null;
  }
}
