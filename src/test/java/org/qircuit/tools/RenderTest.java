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

package org.qircuit.tools;

import static com.google.common.truth.Truth.assertThat;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.qircuit.circuit.Circuit;
import org.qircuit.config.ConfigJson;
import org.qircuit.operations.Definition;
import org.qircuit.operations.GateOperation;
import org.qircuit.operations.GateType;
import org.qircuit.operations.MeasureQubit;
import org.qircuit.operations.VarType;

@RunWith(JUnit4.class)
public class RenderTest {
  @Rule public final TemporaryFolder folder = new TemporaryFolder();

  private final ByteArrayOutputStream out = new ByteArrayOutputStream();
  private PrintStream savedOut;
  private String circuitFile;

  @Before
  public void setUp() throws IOException {
    savedOut = System.out;
    System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
    Circuit circuit =
        Circuit.of(
            GateOperation.of(GateType.ROTATE_X, 0).withParameter("theta", "2 * t"),
            new MeasureQubit(0, "ro", 0),
            new Definition("ro", VarType.BIT, 1));
    File file = folder.newFile("circuit.json");
    Files.writeString(file.toPath(), ConfigJson.toJson(circuit), StandardCharsets.UTF_8);
    circuitFile = file.getPath();
  }

  @After
  public void tearDown() {
    System.setOut(savedOut);
    System.clearProperty("gatesOnly");
  }

  private String output() {
    return out.toString(StandardCharsets.UTF_8).replace(System.lineSeparator(), "\n");
  }

  @Test
  public void rendersDialect() throws IOException {
    Render.main(new String[] {circuitFile});
    String[] lines = output().split("\n");
    assertThat(lines).hasLength(3);
    assertThat(lines[0]).isEqualTo("Definition ro BIT[1]");
    assertThat(lines[1]).startsWith("RotateX(");
    assertThat(lines[1]).contains("t");
    assertThat(lines[2]).isEqualTo("MeasureQubit 0 ro[0]");
  }

  @Test
  public void substitutesParameters() throws IOException {
    Render.main(new String[] {circuitFile, "t = 0.25"});
    assertThat(output()).contains("RotateX(0.5) 0\n");
  }

  @Test
  public void gatesOnly() throws IOException {
    System.setProperty("gatesOnly", "true");
    Render.main(new String[] {circuitFile});
    assertThat(output()).isEqualTo("RotateX\n");
  }
}
