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
 * Thrown when the text of a symbolic expression cannot be parsed or evaluated (syntax errors,
 * unknown functions, calls with the wrong number of arguments).
 */
public class ExpressionError extends RuntimeException {
  public final String msg;
  public final String expression;
  public final int charPosition;

  public ExpressionError(String msg, String expression, int charPosition) {
    super(msg);
    this.msg = msg;
    this.expression = expression;
    this.charPosition = charPosition;
  }

  @Override
  public String getMessage() {
    return String.format("%s (at %s in \"%s\")", msg, charPosition, expression);
  }
}
