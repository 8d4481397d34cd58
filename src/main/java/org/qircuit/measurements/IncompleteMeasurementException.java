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

package org.qircuit.measurements;

import com.google.common.collect.ImmutableSet;
import java.util.Set;

/** Thrown when the backend results lack a register that a measurement reads. */
public class IncompleteMeasurementException extends RuntimeException {
  /** The name of the missing register. */
  public final String register;

  /** The registers the backend did return. */
  public final ImmutableSet<String> available;

  public IncompleteMeasurementException(String register, Set<String> available) {
    super(String.format("No results for register %s (have %s)", register, available));
    this.register = register;
    this.available = ImmutableSet.copyOf(available);
  }
}
