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

import com.google.common.collect.ImmutableMap;
import org.jspecify.annotations.Nullable;

/**
 * A non-physical directive to the backend or simulator. Pragmas may ask a backend to override some
 * of its settings for the circuit that contains them.
 */
public interface Pragma extends Operation {

  /**
   * Returns the backend settings this pragma overrides when the circuit is run on {@code target},
   * or null if it has no effect there.
   */
  default @Nullable ImmutableMap<String, Object> backendInstruction(BackendTarget target) {
    return null;
  }
}
