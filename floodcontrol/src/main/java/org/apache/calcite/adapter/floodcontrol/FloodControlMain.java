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

import org.apache.calcite.adapter.floodcontrol.summary.SummaryWriter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Command-line entry point.
 *
 * <pre>
 * FloodControlMain [--config file] [--input csv] [--output-dir dir]
 *                  [--display-tables] [--parallel]
 * </pre>
 *
 * <p>Flags override values from the configuration file. Exit status is 0 on
 * success, 1 when the run fails and 2 for bad usage.
 */
public class FloodControlMain {

  private static final Logger LOGGER = LoggerFactory.getLogger(FloodControlMain.class);

  static final int EXIT_OK = 0;
  static final int EXIT_FAILURE = 1;
  static final int EXIT_USAGE = 2;

  static final String USAGE = "Usage: FloodControlMain [--config <file>] [--input <csv>]"
      + " [--output-dir <dir>] [--display-tables] [--parallel]";

  private FloodControlMain() {
  }

  public static void main(String[] args) {
    System.exit(run(args));
  }

  /**
   * Runs the tool and returns the process exit status.
   */
  static int run(String[] args) {
    FloodControlConfig config;
    try {
      config = parseArgs(args);
    } catch (UsageException e) {
      System.err.println(e.getMessage());
      System.err.println(USAGE);
      return EXIT_USAGE;
    } catch (FloodControlException e) {
      LOGGER.error("Invalid configuration: {}", e.getMessage(), e);
      return EXIT_FAILURE;
    }

    try {
      PipelineResult result = new FloodControlPipeline(config).execute();
      LOGGER.info("\n{}", SummaryWriter.toConsoleText(result.getSummary()));
      return EXIT_OK;
    } catch (FloodControlException e) {
      LOGGER.error("Report run failed: {}", e.getMessage(), e);
      return EXIT_FAILURE;
    }
  }

  /**
   * Builds the configuration from command-line arguments.
   *
   * @throws UsageException on an unknown flag or a flag missing its value
   * @throws FloodControlException if the configuration file is invalid
   */
  static FloodControlConfig parseArgs(String[] args) throws UsageException {
    String configFile = null;
    String input = null;
    String outputDir = null;
    boolean displayTables = false;
    boolean parallel = false;

    for (int i = 0; i < args.length; i++) {
      String arg = args[i];
      switch (arg) {
      case "--config":
        configFile = value(args, ++i, arg);
        break;
      case "--input":
        input = value(args, ++i, arg);
        break;
      case "--output-dir":
        outputDir = value(args, ++i, arg);
        break;
      case "--display-tables":
        displayTables = true;
        break;
      case "--parallel":
        parallel = true;
        break;
      default:
        throw new UsageException("Unknown argument: " + arg);
      }
    }

    FloodControlConfig base = configFile == null
        ? FloodControlConfig.defaults()
        : ConfigReader.read(new File(configFile));
    FloodControlConfig.Builder builder = base.toBuilder();
    if (input != null) {
      builder.input(input);
    }
    if (outputDir != null) {
      builder.outputDirectory(outputDir);
    }
    if (displayTables) {
      builder.displayTables(true);
    }
    if (parallel) {
      builder.parallelReports(true);
    }
    return builder.build();
  }

  private static String value(String[] args, int index, String flag) throws UsageException {
    if (index >= args.length) {
      throw new UsageException("Missing value for " + flag);
    }
    return args[index];
  }

  /**
   * Bad command-line usage.
   */
  static class UsageException extends Exception {
    UsageException(String message) {
      super(message);
    }
  }
}
