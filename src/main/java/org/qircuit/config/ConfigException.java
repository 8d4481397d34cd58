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

package org.qircuit.config;

import com.google.errorprone.annotations.FormatMethod;
import org.jspecify.annotations.Nullable;

/** Thrown when a configuration tree is missing a key or has a value of the wrong shape. */
public class ConfigException extends RuntimeException {
  /** The key being read when the problem was found, or null if the problem is not key-specific. */
  public final @Nullable String key;

  public ConfigException(@Nullable String key, String msg) {
    super(format(key, msg));
    this.key = key;
  }

  public ConfigException(@Nullable String key, String msg, Throwable cause) {
    super(format(key, msg), cause);
    this.key = key;
  }

  private static String format(@Nullable String key, String msg) {
    return (key == null) ? msg : String.format("%s (key \"%s\")", msg, key);
  }

  @FormatMethod
  public static ConfigException of(@Nullable String key, String fmt, Object... fmtArgs) {
    return new ConfigException(key, String.format(fmt, fmtArgs));
  }
}
