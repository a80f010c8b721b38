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
package org.apache.calcite.adapter.floodcontrol.report;

import org.apache.calcite.adapter.floodcontrol.aggregate.AggregateRow;
import org.apache.calcite.adapter.floodcontrol.aggregate.GroupKey;

import com.google.common.collect.ImmutableList;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link ReportCsvWriter} and {@link DisplayTableFormatter}.
 */
@Tag("unit")
public class ReportRenderingTest {

  private static final List<ReportColumn> COLUMNS = ImmutableList.of(
      ReportColumn.keyText("Contractor", 0),
      ReportColumn.count("NumProjects"),
      ReportColumn.decimal("TotalCost"));

  private static ReportTable table(String contractor, double cost) {
    AggregateRow row = AggregateRow.builder(GroupKey.of(contractor), 7)
        .metric("TotalCost", cost)
        .build();
    return new ReportTable("Sample", "Sample Report", COLUMNS, ImmutableList.of(row));
  }

  @Test void testCsvQuotesOnlyWhenNeeded() {
    assertEquals("Contractor,NumProjects,TotalCost\n"
            + "Plain Builders,7,1234567.89\n",
        ReportCsvWriter.render(table("Plain Builders", 1234567.891)));
    assertEquals("Contractor,NumProjects,TotalCost\n"
            + "\"ACME, INC.\",7,10.00\n",
        ReportCsvWriter.render(table("ACME, INC.", 10)));
    assertEquals("Contractor,NumProjects,TotalCost\n"
            + "\"The \"\"Best\"\" Co\",7,10.00\n",
        ReportCsvWriter.render(table("The \"Best\" Co", 10)));
  }

  @Test void testDisplayTable() {
    String text = DisplayTableFormatter.format(table("Acme", 1234567.891));

    assertEquals("Sample Report\n"
        + "| Contractor | NumProjects | TotalCost    |\n"
        + "|------------|-------------|--------------|\n"
        + "| Acme       |           7 | 1,234,567.89 |\n", text);
  }

  @Test void testDisplayTruncatesLongText() {
    String name = "Consolidated Flood Control and Drainage Builders Corporation";
    String text = DisplayTableFormatter.format(table(name, 1));

    String truncated = DisplayTableFormatter.truncate(name);
    assertEquals(DisplayTableFormatter.MAX_TEXT_WIDTH, truncated.length());
    assertTrue(truncated.endsWith("\u2026"));
    assertTrue(text.contains(truncated));
    // canonical output is never truncated
    assertTrue(ReportCsvWriter.render(table(name, 1)).contains(name));
  }
}
