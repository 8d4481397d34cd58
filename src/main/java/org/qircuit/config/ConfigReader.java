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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.qircuit.expr.SymbolicValue;

/**
 * Typed access to one level of a configuration tree. Numbers are accepted in any boxed form, since
 * trees read back from JSON hold only Doubles.
 */
public final class ConfigReader {
  private final Map<String, ?> map;

  private ConfigReader(Map<String, ?> map) {
    this.map = map;
  }

  /** Wraps a tree; throws a ConfigException if it is not a Map. */
  public static ConfigReader of(Object tree) {
    return new ConfigReader(asMap(null, tree));
  }

  /** Returns the tree's {@code "type"} entry. */
  public String type() {
    return getString(Configurable.TYPE_KEY);
  }

  /** Throws a ConfigException unless the tree's {@code "type"} is {@code expected}. */
  public ConfigReader requireType(String expected) {
    String type = type();
    if (!type.equals(expected)) {
      throw ConfigException.of(Configurable.TYPE_KEY, "Expected %s, got %s", expected, type);
    }
    return this;
  }

  /** True if the key is present with a non-null value. */
  public boolean has(String key) {
    return map.get(key) != null;
  }

  private Object require(String key) {
    Object value = map.get(key);
    if (value == null) {
      throw new ConfigException(key, "Missing value");
    }
    return value;
  }

  public String getString(String key) {
    Object value = require(key);
    if (value instanceof String s) {
      return s;
    }
    throw ConfigException.of(key, "Expected a string, got %s", value);
  }

  public @Nullable String getOptionalString(String key) {
    return has(key) ? getString(key) : null;
  }

  public String getString(String key, String defaultValue) {
    return has(key) ? getString(key) : defaultValue;
  }

  public int getInt(String key) {
    return toInt(key, require(key));
  }

  public int getInt(String key, int defaultValue) {
    return has(key) ? getInt(key) : defaultValue;
  }

  public double getDouble(String key) {
    return toDouble(key, require(key));
  }

  public boolean getBoolean(String key, boolean defaultValue) {
    if (!has(key)) {
      return defaultValue;
    }
    Object value = map.get(key);
    if (value instanceof Boolean b) {
      return b;
    }
    throw ConfigException.of(key, "Expected a boolean, got %s", value);
  }

  /** Reads a number (literal) or string (symbolic expression). */
  public SymbolicValue getSymbolic(String key) {
    Object value = require(key);
    if (value instanceof Number || value instanceof String) {
      return SymbolicValue.fromObject(value);
    }
    throw ConfigException.of(key, "Expected a number or expression, got %s", value);
  }

  public @Nullable SymbolicValue getOptionalSymbolic(String key) {
    return has(key) ? getSymbolic(key) : null;
  }

  public List<?> getList(String key) {
    Object value = require(key);
    if (value instanceof List<?> list) {
      return list;
    }
    throw ConfigException.of(key, "Expected a list, got %s", value);
  }

  public ImmutableList<Integer> getIntList(String key) {
    return getList(key).stream().map(x -> toInt(key, x)).collect(ImmutableList.toImmutableList());
  }

  public double[] getDoubleArray(String key) {
    return getList(key).stream().mapToDouble(x -> toDouble(key, x)).toArray();
  }

  public ImmutableList<String> getStringList(String key) {
    ImmutableList.Builder<String> builder = ImmutableList.builder();
    for (Object x : getList(key)) {
      if (!(x instanceof String s)) {
        throw ConfigException.of(key, "Expected a string, got %s", x);
      }
      builder.add(s);
    }
    return builder.build();
  }

  /** Returns a reader for the nested tree stored under {@code key}. */
  public ConfigReader getChild(String key) {
    return new ConfigReader(asMap(key, require(key)));
  }

  public @Nullable ConfigReader getOptionalChild(String key) {
    return has(key) ? getChild(key) : null;
  }

  /** Returns the raw nested map stored under {@code key}, preserving its order. */
  public Map<String, ?> getMap(String key) {
    return asMap(key, require(key));
  }

  /** Reads a map whose keys are decimal integers and whose values are integers. */
  public ImmutableMap<Integer, Integer> getIntMap(String key) {
    ImmutableMap.Builder<Integer, Integer> builder = ImmutableMap.builder();
    getMap(key).forEach((k, v) -> builder.put(parseKey(key, k), toInt(key, v)));
    return builder.buildOrThrow();
  }

  /** Reads a map with string keys and numeric values. */
  public ImmutableMap<String, Double> getDoubleMap(String key) {
    ImmutableMap.Builder<String, Double> builder = ImmutableMap.builder();
    getMap(key).forEach((k, v) -> builder.put(k, toDouble(key, v)));
    return builder.buildOrThrow();
  }

  /** Returns the entries of this level, in order. */
  public Map<String, ?> asMap() {
    return map;
  }

  /** Parses a map key that was written from an int. */
  public static int parseKey(String key, String mapKey) {
    try {
      return Integer.parseInt(mapKey);
    } catch (NumberFormatException e) {
      throw new ConfigException(key, "Expected an integer map key, got " + mapKey, e);
    }
  }

  public static int toInt(@Nullable String key, Object value) {
    if (value instanceof Number n) {
      double d = n.doubleValue();
      if (d == Math.rint(d) && Math.abs(d) <= Integer.MAX_VALUE) {
        return (int) d;
      }
    }
    throw ConfigException.of(key, "Expected an integer, got %s", value);
  }

  public static double toDouble(@Nullable String key, Object value) {
    if (value instanceof Number n) {
      return n.doubleValue();
    }
    throw ConfigException.of(key, "Expected a number, got %s", value);
  }

  @SuppressWarnings("unchecked")
  private static Map<String, ?> asMap(@Nullable String key, Object value) {
    if (value instanceof Map<?, ?> m) {
      for (Object k : m.keySet()) {
        if (!(k instanceof String)) {
          throw ConfigException.of(key, "Expected string keys, got %s", k);
        }
      }
      return (Map<String, ?>) m;
    }
    throw ConfigException.of(key, "Expected a map, got %s", value);
  }
}
