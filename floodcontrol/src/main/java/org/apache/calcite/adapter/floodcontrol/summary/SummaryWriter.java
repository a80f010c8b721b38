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
package org.apache.calcite.adapter.floodcontrol.summary;

import org.apache.calcite.adapter.floodcontrol.FloodControlException;
import org.apache.calcite.adapter.floodcontrol.aggregate.Decimals;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Renders a {@link SummaryDigest} as {@code summary.json} text and as the
 * console block printed at the end of a run.
 */
public final class SummaryWriter {

  private static final ObjectMapper MAPPER = new ObjectMapper()
      .configure(JsonGenerator.Feature.WRITE_BIGDECIMAL_AS_PLAIN, true);

  // Two-space indent with \n on every platform.
  private static final ObjectWriter WRITER = MAPPER.writer(
      new DefaultPrettyPrinter()
          .withObjectIndenter(new DefaultIndenter("  ", "\n")));

  private SummaryWriter() {
  }

  /**
   * Returns pretty-printed JSON ending in a line break. Averages and totals
   * are rounded to two decimals; an undefined average is {@code null}.
   */
  public static String toJson(SummaryDigest digest) {
    Map<String, @Nullable Object> fields = new LinkedHashMap<String, @Nullable Object>();
    fields.put("totalProjects", digest.getTotalProjects());
    fields.put("totalContractors", digest.getTotalContractors());
    fields.put("totalProvinces", digest.getTotalProvinces());
    fields.put("globalAvgDelay", Decimals.round2(digest.getGlobalAvgDelay()));
    fields.put("globalTotalSavings", Decimals.round2(digest.getGlobalTotalSavings()));
    try {
      return WRITER.writeValueAsString(fields) + "\n";
    } catch (JsonProcessingException e) {
      throw new FloodControlException("Failed to serialize summary", e);
    }
  }

  /**
   * Returns the summary block in the layout of the interactive tool.
   */
  public static String toConsoleText(SummaryDigest digest) {
    StringBuilder sb = new StringBuilder();
    sb.append("==================== Summary Report ====================\n");
    sb.append("Total Projects        : ").append(digest.getTotalProjects()).append('\n');
    sb.append("Unique Contractors    : ").append(digest.getTotalContractors()).append('\n');
    sb.append("Unique Provinces      : ").append(digest.getTotalProvinces()).append('\n');
    sb.append("Avg Delay (days)      : ")
        .append(Decimals.grouped(digest.getGlobalAvgDelay())).append('\n');
    sb.append("Total Savings (\u20B1)     : ")
        .append(Decimals.grouped(digest.getGlobalTotalSavings())).append('\n');
    sb.append("========================================================\n");
    return sb.toString();
  }
}
