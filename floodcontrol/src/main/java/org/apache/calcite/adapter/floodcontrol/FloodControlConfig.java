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

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Map;

/**
 * Configuration for a report run.
 *
 * <p>Only the input and output locations and a few output switches are
 * configurable. Report formulas, thresholds and the funding-year window are
 * fixed.
 *
 * <h3>YAML Configuration Example</h3>
 * <pre>{@code
 * input: data/dpwh_flood_control_projects.csv
 * outputDirectory: out
 * displayTables: true
 * parallelReports: false
 * runLog: true
 * }</pre>
 *
 * @see ConfigReader
 * @see FloodControlPipeline
 */
public class FloodControlConfig {

  public static final String DEFAULT_INPUT = "dpwh_flood_control_projects.csv";
  public static final String DEFAULT_OUTPUT_DIRECTORY = ".";

  private final String input;
  private final String outputDirectory;
  private final boolean displayTables;
  private final boolean parallelReports;
  private final boolean runLog;

  private FloodControlConfig(Builder builder) {
    this.input = builder.input != null ? builder.input : DEFAULT_INPUT;
    this.outputDirectory = builder.outputDirectory != null
        ? builder.outputDirectory
        : DEFAULT_OUTPUT_DIRECTORY;
    this.displayTables = builder.displayTables;
    this.parallelReports = builder.parallelReports;
    this.runLog = builder.runLog;
  }

  /**
   * Returns the path of the input CSV file.
   */
  public String getInput() {
    return input;
  }

  /**
   * Returns the directory that receives the report files.
   */
  public String getOutputDirectory() {
    return outputDirectory;
  }

  /**
   * Returns whether to also write pipe-aligned {@code .txt} tables.
   */
  public boolean isDisplayTables() {
    return displayTables;
  }

  /**
   * Returns whether the report builders run concurrently.
   */
  public boolean isParallelReports() {
    return parallelReports;
  }

  /**
   * Returns whether to write {@code run.log}.
   */
  public boolean isRunLog() {
    return runLog;
  }

  /**
   * Returns a builder initialized from this configuration.
   */
  public Builder toBuilder() {
    return builder()
        .input(input)
        .outputDirectory(outputDirectory)
        .displayTables(displayTables)
        .parallelReports(parallelReports)
        .runLog(runLog);
  }

  /**
   * Creates a new builder for FloodControlConfig.
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns a configuration with every default.
   */
  public static FloodControlConfig defaults() {
    return builder().build();
  }

  /**
   * Creates a FloodControlConfig from a YAML/JSON map. Absent keys keep
   * their defaults.
   *
   * @throws FloodControlException if a key has a value of the wrong type
   */
  public static FloodControlConfig fromMap(@Nullable Map<String, Object> map) {
    if (map == null) {
      return defaults();
    }

    Builder builder = builder();

    Object inputObj = map.get("input");
    if (inputObj != null) {
      builder.input(stringValue("input", inputObj));
    }

    Object outputObj = map.get("outputDirectory");
    if (outputObj != null) {
      builder.outputDirectory(stringValue("outputDirectory", outputObj));
    }

    Object displayObj = map.get("displayTables");
    if (displayObj != null) {
      builder.displayTables(booleanValue("displayTables", displayObj));
    }

    Object parallelObj = map.get("parallelReports");
    if (parallelObj != null) {
      builder.parallelReports(booleanValue("parallelReports", parallelObj));
    }

    Object runLogObj = map.get("runLog");
    if (runLogObj != null) {
      builder.runLog(booleanValue("runLog", runLogObj));
    }

    return builder.build();
  }

  private static String stringValue(String key, Object value) {
    if (value instanceof String) {
      return (String) value;
    }
    throw new FloodControlException("Configuration key '" + key
        + "' must be a string, got: " + value);
  }

  private static boolean booleanValue(String key, Object value) {
    if (value instanceof Boolean) {
      return (Boolean) value;
    }
    if (value instanceof String) {
      String text = ((String) value).trim();
      if ("true".equalsIgnoreCase(text)) {
        return true;
      }
      if ("false".equalsIgnoreCase(text)) {
        return false;
      }
    }
    throw new FloodControlException("Configuration key '" + key
        + "' must be true or false, got: " + value);
  }

  @Override public String toString() {
    return "FloodControlConfig{input='" + input + "', outputDirectory='" + outputDirectory
        + "', displayTables=" + displayTables + ", parallelReports=" + parallelReports
        + ", runLog=" + runLog + "}";
  }

  /**
   * Builder for FloodControlConfig.
   */
  public static class Builder {
    private @Nullable String input;
    private @Nullable String outputDirectory;
    private boolean displayTables;
    private boolean parallelReports;
    private boolean runLog = true;

    public Builder input(String input) {
      this.input = input;
      return this;
    }

    public Builder outputDirectory(String outputDirectory) {
      this.outputDirectory = outputDirectory;
      return this;
    }

    public Builder displayTables(boolean displayTables) {
      this.displayTables = displayTables;
      return this;
    }

    public Builder parallelReports(boolean parallelReports) {
      this.parallelReports = parallelReports;
      return this;
    }

    public Builder runLog(boolean runLog) {
      this.runLog = runLog;
      return this;
    }

    public FloodControlConfig build() {
      return new FloodControlConfig(this);
    }
  }
}
