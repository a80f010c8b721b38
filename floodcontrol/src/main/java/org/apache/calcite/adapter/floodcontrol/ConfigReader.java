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

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Reads a {@link FloodControlConfig} from a YAML or JSON file.
 *
 * <p>Files ending in {@code .yaml} or {@code .yml}, in any case, are parsed
 * with SnakeYAML;
 * anything else is parsed as JSON with Jackson.
 */
public final class ConfigReader {

  private static final Logger LOGGER = LoggerFactory.getLogger(ConfigReader.class);
  private static final ObjectMapper JSON_MAPPER = new ObjectMapper();

  private ConfigReader() {
  }

  /**
   * Reads configuration from a file.
   *
   * @throws FloodControlException if the file cannot be read or is not a
   *     YAML/JSON object
   */
  public static FloodControlConfig read(File file) {
    try (InputStream stream = new FileInputStream(file)) {
      FloodControlConfig config = FloodControlConfig.fromMap(parse(stream, file.getName()));
      LOGGER.debug("Loaded configuration from {}: {}", file, config);
      return config;
    } catch (IOException e) {
      throw new FloodControlException("Cannot read configuration file " + file, e);
    }
  }

  /**
   * Parses YAML or JSON into a map, choosing the format by resource name.
   */
  @SuppressWarnings("unchecked")
  static Map<String, Object> parse(InputStream stream, String resourceName) throws IOException {
    String lowerName = resourceName.toLowerCase(Locale.ROOT);
    if (lowerName.endsWith(".yaml") || lowerName.endsWith(".yml")) {
      Object parsed;
      try {
        parsed = new Yaml(new LoaderOptions()).load(stream);
      } catch (YAMLException e) {
        throw new FloodControlException("Invalid YAML in " + resourceName, e);
      }
      if (parsed == null) {
        return new LinkedHashMap<String, Object>();
      }
      if (!(parsed instanceof Map)) {
        throw new FloodControlException("Configuration " + resourceName
            + " must be a mapping of keys to values");
      }
      return (Map<String, Object>) parsed;
    }
    return JSON_MAPPER.readValue(stream, new TypeReference<Map<String, Object>>() { });
  }
}
