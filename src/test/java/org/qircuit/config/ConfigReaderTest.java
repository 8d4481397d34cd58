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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.qircuit.expr.SymbolicValue;

@RunWith(JUnit4.class)
public class ConfigReaderTest {
  private static final ConfigReader READER =
      ConfigReader.of(
          ImmutableMap.of(
              "type", "Example",
              "count", 3.0,
              "theta", "phi / 2",
              "flag", true,
              "qubits", ImmutableList.of(0.0, 2.0),
              "mapping", ImmutableMap.of("0", 1.0, "1", 0.0),
              "child", ImmutableMap.of("name", "inner")));

  @Test
  public void scalars() {
    assertThat(READER.type()).isEqualTo("Example");
    assertThat(READER.getInt("count")).isEqualTo(3);
    assertThat(READER.getDouble("count")).isEqualTo(3.0);
    assertThat(READER.getInt("missing", 7)).isEqualTo(7);
    assertThat(READER.getBoolean("flag", false)).isTrue();
    assertThat(READER.getBoolean("missing", true)).isTrue();
    assertThat(READER.getString("missing", "x")).isEqualTo("x");
    assertThat(READER.getOptionalString("missing")).isNull();
  }

  @Test
  public void symbolic() {
    assertThat(READER.getSymbolic("theta")).isEqualTo(SymbolicValue.of("phi / 2"));
    assertThat(READER.getSymbolic("count")).isEqualTo(SymbolicValue.of(3));
    assertThat(READER.getOptionalSymbolic("missing")).isNull();
    assertThrows(ConfigException.class, () -> READER.getSymbolic("flag"));
  }

  @Test
  public void collections() {
    assertThat(READER.getIntList("qubits")).containsExactly(0, 2).inOrder();
    assertThat(READER.getIntMap("mapping")).containsExactly(0, 1, 1, 0);
    assertThat(READER.getChild("child").getString("name")).isEqualTo("inner");
    assertThat(READER.getOptionalChild("missing")).isNull();
  }

  @Test
  public void errorsNameTheKey() {
    ConfigException missing = assertThrows(ConfigException.class, () -> READER.getInt("missing"));
    assertThat(missing.key).isEqualTo("missing");
    assertThat(missing).hasMessageThat().isEqualTo("Missing value (key \"missing\")");

    ConfigException wrongType = assertThrows(ConfigException.class, () -> READER.getInt("theta"));
    assertThat(wrongType.key).isEqualTo("theta");
    assertThrows(ConfigException.class, () -> READER.getString("count"));
    assertThrows(ConfigException.class, () -> READER.getBoolean("count", false));
    assertThrows(ConfigException.class, () -> READER.getChild("qubits"));
  }

  @Test
  public void integersMustBeWhole() {
    assertThat(ConfigReader.toInt("k", 4.0)).isEqualTo(4);
    assertThrows(ConfigException.class, () -> ConfigReader.toInt("k", 4.5));
    assertThrows(ConfigException.class, () -> ConfigReader.toInt("k", "4"));
    assertThrows(ConfigException.class, () -> ConfigReader.parseKey("k", "four"));
  }

  @Test
  public void requireType() {
    assertThat(READER.requireType("Example")).isSameInstanceAs(READER);
    ConfigException e = assertThrows(ConfigException.class, () -> READER.requireType("Other"));
    assertThat(e.key).isEqualTo("type");
  }

  @Test
  public void rootMustBeStringKeyedMap() {
    assertThrows(ConfigException.class, () -> ConfigReader.of(ImmutableList.of()));
    Map<Object, Object> intKeys = new LinkedHashMap<>();
    intKeys.put(1, "x");
    assertThrows(ConfigException.class, () -> ConfigReader.of(intKeys));
  }

  @Test
  public void intKeyed() {
    Map<String, Object> tree = new LinkedHashMap<>();
    tree.put("m", Configurable.intKeyed(ImmutableMap.of(3, 4, 5, 6)));
    assertThat(ConfigReader.of(tree).getIntMap("m")).containsExactly(3, 4, 5, 6).inOrder();
  }
}
