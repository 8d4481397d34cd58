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

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;
import java.lang.reflect.Type;
import java.util.Map;

/** Converts configuration trees to and from JSON text. */
public final class ConfigJson {

  // Static methods only
  private ConfigJson() {}

  private static final Gson GSON = new GsonBuilder().setPrettyPrinting().serializeNulls().create();

  private static final Type TREE_TYPE = new TypeToken<Map<String, Object>>() {}.getType();

  public static String toJson(Configurable value) {
    return toJson(value.toConfig());
  }

  public static String toJson(Map<String, ?> tree) {
    return GSON.toJson(tree);
  }

  /**
   * Parses JSON text into a configuration tree. Objects become insertion-ordered Maps, arrays
   * become Lists and all numbers become Doubles.
   */
  public static Map<String, Object> fromJson(String json) {
    try {
      Map<String, Object> tree = GSON.fromJson(json, TREE_TYPE);
      if (tree == null) {
        throw new ConfigException(null, "Empty JSON document");
      }
      return tree;
    } catch (JsonParseException e) {
      throw new ConfigException(null, "Malformed JSON: " + e.getMessage(), e);
    }
  }
}
