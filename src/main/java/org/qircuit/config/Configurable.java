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

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Implemented by everything that can be saved as a configuration tree.
 *
 * <p>A configuration tree is built only from Strings, Numbers, Booleans, nulls, Lists and
 * insertion-ordered Maps with String keys, so that it can be written as JSON by {@link ConfigJson}.
 * Every tree has a {@code "type"} entry, and each implementing class provides a static {@code
 * fromConfig(Map)} that inverts {@link #toConfig}.
 */
public interface Configurable {
  /** The key under which every configuration tree records what it is. */
  String TYPE_KEY = "type";

  /** Returns a new, mutable configuration tree describing this object. */
  Map<String, Object> toConfig();

  /** Copies an int-keyed map into a tree node; {@link ConfigReader#getIntMap} reads it back. */
  static Map<String, Object> intKeyed(Map<Integer, ?> map) {
    Map<String, Object> result = new LinkedHashMap<>();
    map.forEach((k, v) -> result.put(Integer.toString(k), v));
    return result;
  }
}
