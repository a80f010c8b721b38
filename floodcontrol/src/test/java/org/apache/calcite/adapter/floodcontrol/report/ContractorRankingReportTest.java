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

import org.apache.calcite.adapter.floodcontrol.RunLog;
import org.apache.calcite.adapter.floodcontrol.aggregate.AggregateRow;
import org.apache.calcite.adapter.floodcontrol.aggregate.GroupKey;
import org.apache.calcite.adapter.floodcontrol.clean.ProjectRecord;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.apache.calcite.adapter.floodcontrol.ProjectFixtures.record;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

/**
 * Tests for {@link ContractorRankingReport}.
 */
@Tag("unit")
public class ContractorRankingReportTest {

  private final ContractorRankingReport report = new ContractorRankingReport();

  private static void addProjects(List<ProjectRecord> records, String contractor, int count,
      double budget, double cost, int delay) {
    for (int i = 0; i < count; i++) {
      records.add(record(contractor, budget, cost, delay));
    }
  }

  @Test void testMinimumProjectCount() {
    List<ProjectRecord> records = new ArrayList<ProjectRecord>();
    addProjects(records, "Four", 4, 1000, 900, 10);
    addProjects(records, "Five", 5, 100, 90, 10);

    ReportTable table = report.build(records, new RunLog());

    assertEquals(1, table.getRows().size());
    assertEquals("Five", table.getRows().get(0).getKey().getString(0));
    assertEquals(5, table.getRows().get(0).getCount());
  }

  @Test void testKeepsTopFifteenByTotalCost() {
    List<ProjectRecord> records = new ArrayList<ProjectRecord>();
    for (int i = 1; i <= 16; i++) {
      addProjects(records, String.format("C%02d", i), 5, 200.0 * i, 100.0 * i, 10);
    }

    List<AggregateRow> rows = report.build(records, new RunLog()).getRows();

    assertEquals(15, rows.size());
    assertEquals("C16", rows.get(0).getKey().getString(0));
    assertEquals(1.0, rows.get(0).getDouble(ContractorRankingReport.RANK));
    assertEquals("C02", rows.get(14).getKey().getString(0));
    assertEquals(15.0, rows.get(14).getDouble(ContractorRankingReport.RANK));
  }

  @Test void testReliabilityIndexAndLabel() {
    List<ProjectRecord> records = new ArrayList<ProjectRecord>();
    addProjects(records, "Slow", 5, 110, 100, 9);
    addProjects(records, "Thrifty", 5, 300, 100, 0);

    ReportTable table = report.build(records, new RunLog());
    List<AggregateRow> rows = table.getRows();

    // equal cost, higher reliability first
    assertEquals("Thrifty", rows.get(0).getKey().getString(0));
    assertEquals(100.0, rows.get(0).getDouble(ContractorRankingReport.RELIABILITY_INDEX));
    assertEquals("Slow", rows.get(1).getKey().getString(0));
    assertEquals(9.0, rows.get(1).getDouble(ContractorRankingReport.RELIABILITY_INDEX), 1e-9);

    List<String[]> lines = table.canonicalRows();
    assertEquals(Arrays.asList("1", "Thrifty", "5", "500.00", "0.00", "1000.00", "100.00",
        "Normal"), Arrays.asList(lines.get(0)));
    assertEquals(Arrays.asList("2", "Slow", "5", "500.00", "9.00", "50.00", "9.00",
        "High Risk"), Arrays.asList(lines.get(1)));
  }

  @Test void testNegativeIndexHasNoFloor() {
    List<ProjectRecord> records = new ArrayList<ProjectRecord>();
    addProjects(records, "Late", 5, 100, 100, 180);
    addProjects(records, "Over", 5, 100, 200, 0);

    List<AggregateRow> rows = report.build(records, new RunLog()).getRows();

    assertEquals("Over", rows.get(0).getKey().getString(0));
    assertEquals(-50.0, rows.get(0).getDouble(ContractorRankingReport.RELIABILITY_INDEX), 1e-9);
    // zero savings times a negative delay factor
    assertEquals(0.0, rows.get(1).getDouble(ContractorRankingReport.RELIABILITY_INDEX), 1e-9);
  }

  @Test void testZeroTotalCost() {
    RunLog log = new RunLog();
    List<ProjectRecord> records = new ArrayList<ProjectRecord>();
    addProjects(records, "Free", 5, 10, 0, 5);

    ReportTable table = report.build(records, log);
    AggregateRow row = table.getRows().get(0);

    assertNull(row.get(ContractorRankingReport.RELIABILITY_INDEX));
    assertEquals("", table.canonicalRows().get(0)[6]);
    assertEquals(ContractorRankingReport.HIGH_RISK, table.canonicalRows().get(0)[7]);
    assertEquals("ZERO_TOTAL_COST", log.getEntries().get(0).getCode());
  }

  @Test void testOrderPutsUndefinedReliabilityLast() {
    AggregateRow undefined = AggregateRow.builder(GroupKey.of("A"), 5)
        .metric(ContractorRankingReport.TOTAL_COST, 100.0)
        .metric(ContractorRankingReport.RELIABILITY_INDEX, null)
        .build();
    AggregateRow low = AggregateRow.builder(GroupKey.of("B"), 5)
        .metric(ContractorRankingReport.TOTAL_COST, 100.0)
        .metric(ContractorRankingReport.RELIABILITY_INDEX, -10.0)
        .build();
    AggregateRow tie = AggregateRow.builder(GroupKey.of("C"), 5)
        .metric(ContractorRankingReport.TOTAL_COST, 100.0)
        .metric(ContractorRankingReport.RELIABILITY_INDEX, -10.0)
        .build();

    List<AggregateRow> rows = new ArrayList<AggregateRow>(Arrays.asList(undefined, tie, low));
    rows.sort(ContractorRankingReport.ORDER);

    assertEquals(Arrays.asList(low, tie, undefined), rows);
  }

  @Test void testRiskLabel() {
    assertEquals("High Risk", ContractorRankingReport.riskLabel(49.99));
    assertEquals("Normal", ContractorRankingReport.riskLabel(50.0));
    assertEquals("High Risk", ContractorRankingReport.riskLabel(null));
  }
}
