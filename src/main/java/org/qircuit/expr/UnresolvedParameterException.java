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

package org.qircuit.expr;

/**
 * Thrown when a numeric value is required but the expression still refers to a variable that has
 * not been bound.
 */
public class UnresolvedParameterException extends RuntimeException {
  /** The expression that could not be resolved. */
  public final String expression;

  public UnresolvedParameterException(String expression) {
    super(String.format("Symbolic parameter \"%s\" has no numeric value", expression));
    this.expression = expression;
  }
}
