/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to you under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.apache.calcite.adapter.floodcontrol;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link FloodControlConfig} and {@link ConfigReader}.
 */
@Tag("unit")
public class FloodControlConfigTest {

  @TempDir
  File tempDir;

  @Test void testDefaults() {
    FloodControlConfig config = FloodControlConfig.fromMap(null);

    assertEquals(FloodControlConfig.DEFAULT_INPUT, config.getInput());
    assertEquals(FloodControlConfig.DEFAULT_OUTPUT_DIRECTORY, config.getOutputDirectory());
    assertFalse(config.isDisplayTables());
    assertFalse(config.isParallelReports());
    assertTrue(config.isRunLog());
  }

  @Test void testFromMapOverrides() {
    Map<String, Object> map = new HashMap<String, Object>();
    map.put("input", "data/projects.csv");
    map.put("outputDirectory", "out");
    map.put("displayTables", true);
    map.put("parallelReports", "TRUE");
    map.put("runLog", "false");

    FloodControlConfig config = FloodControlConfig.fromMap(map);

    assertEquals("data/projects.csv", config.getInput());
    assertEquals("out", config.getOutputDirectory());
    assertTrue(config.isDisplayTables());
    assertTrue(config.isParallelReports());
    assertFalse(config.isRunLog());
  }

  @Test void testWrongTypeIsRejected() {
    Map<String, Object> map = new HashMap<String, Object>();
    map.put("displayTables", "sometimes");
    assertThrows(FloodControlException.class, () -> FloodControlConfig.fromMap(map));

    Map<String, Object> numericInput = new HashMap<String, Object>();
    numericInput.put("input", 42);
    assertThrows(FloodControlException.class, () -> FloodControlConfig.fromMap(numericInput));
  }

  @Test void testToBuilderKeepsValues() {
    FloodControlConfig config = FloodControlConfig.builder()
        .input("a.csv")
        .runLog(false)
        .build()
        .toBuilder()
        .outputDirectory("reports")
        .build();

    assertEquals("a.csv", config.getInput());
    assertEquals("reports", config.getOutputDirectory());
    assertFalse(config.isRunLog());
  }

  @Test void testReadYaml() throws IOException {
    File file = write("run.yaml", "input: in.csv\n"
        + "outputDirectory: out\n"
        + "displayTables: true\n");

    FloodControlConfig config = ConfigReader.read(file);

    assertEquals("in.csv", config.getInput());
    assertEquals("out", config.getOutputDirectory());
    assertTrue(config.isDisplayTables());
    assertTrue(config.isRunLog());
  }

  @Test void testYamlExtensionIgnoresCase() throws IOException {
    File file = write("run.YAML", "input: upper.csv\nparallelReports: true\n");

    FloodControlConfig config = ConfigReader.read(file);

    assertEquals("upper.csv", config.getInput());
    assertTrue(config.isParallelReports());
  }

  @Test void testReadJson() throws IOException {
    File file = write("run.json", "{\"input\": \"in.csv\", \"parallelReports\": true}");

    FloodControlConfig config = ConfigReader.read(file);

    assertEquals("in.csv", config.getInput());
    assertTrue(config.isParallelReports());
  }

  @Test void testEmptyYamlUsesDefaults() throws IOException {
    FloodControlConfig config = ConfigReader.read(write("empty.yml", ""));

    assertEquals(FloodControlConfig.DEFAULT_INPUT, config.getInput());
  }

  @Test void testInvalidFiles() throws IOException {
    File list = write("list.yaml", "- input\n- output\n");
    assertThrows(FloodControlException.class, () -> ConfigReader.read(list));

    File badJson = write("bad.json", "{input: ");
    assertThrows(FloodControlException.class, () -> ConfigReader.read(badJson));

    File missing = new File(tempDir, "missing.yaml");
    assertThrows(FloodControlException.class, () -> ConfigReader.read(missing));
  }

  private File write(String name, String content) throws IOException {
    File file = new File(tempDir, name);
    Files.write(file.toPath(), content.getBytes(StandardCharsets.UTF_8));
    return file;
  }
}
