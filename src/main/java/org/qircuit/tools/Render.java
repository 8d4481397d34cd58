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

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import org.qircuit.circuit.Circuit;
import org.qircuit.config.ConfigJson;

/**
 * A simple command-line tool that prints the dialect rendering of a circuit saved as JSON, after
 * substituting any parameter values given on the command line.
 *
 * <p>With {@code -DgatesOnly=true} it prints the names of the unitary gates used instead.
 */
public class Render {
  private Render() {}

  private static void checkUsage(boolean condition) {
    if (!condition) {
      System.err.println("Use: render <fileName> [ <var>=<val> ...]");
      System.exit(1);
    }
  }

  public static void main(String[] args) throws IOException {
    boolean gatesOnly = Boolean.parseBoolean(System.getProperty("gatesOnly", "false"));
    checkUsage(args.length != 0);
    Map<String, Double> bindings = new LinkedHashMap<>();
    for (int i = 1; i < args.length; i++) {
      int eq = args[i].indexOf('=');
      checkUsage(eq > 0);
      String value = args[i].substring(eq + 1).trim();
      try {
        bindings.put(args[i].substring(0, eq).trim(), Double.parseDouble(value));
      } catch (NumberFormatException e) {
        System.err.printf("Not a number: %s%n", value);
        checkUsage(false);
      }
    }
    String json = Files.readString(Path.of(args[0]), StandardCharsets.UTF_8);
    Circuit circuit = Circuit.fromConfig(ConfigJson.fromJson(json));
    if (!bindings.isEmpty()) {
      circuit.substituteParameters(bindings);
    }
    if (gatesOnly) {
      circuit.operationTypes(true).forEach(System.out::println);
    } else {
      circuit.toDialectLines().forEach(System.out::println);
    }
  }
}
