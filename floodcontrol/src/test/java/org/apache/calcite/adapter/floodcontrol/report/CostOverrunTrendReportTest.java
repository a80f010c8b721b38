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
import org.apache.calcite.adapter.floodcontrol.clean.ProjectRecord;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.apache.calcite.adapter.floodcontrol.ProjectFixtures.project;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

/**
 * Tests for {@link CostOverrunTrendReport}.
 */
@Tag("unit")
public class CostOverrunTrendReportTest {

  private final CostOverrunTrendReport report = new CostOverrunTrendReport();

  private static ProjectRecord typed(int year, String type, double budget, double cost) {
    return project("Acme", budget, cost, 10).fundingYear(year).typeOfWork(type).build();
  }

  @Test void testYearOverYearAgainstBaseline() {
    RunLog log = new RunLog();
    List<ProjectRecord> records = Arrays.asList(
        typed(2021, "Dredging", 110, 100),
        typed(2022, "Dredging", 120, 100),
        typed(2022, "Dredging", 110, 100),
        typed(2023, "Dredging", 100, 105));

    List<AggregateRow> rows = report.build(records, log).getRows();

    assertEquals(3, rows.size());
    assertNull(rows.get(0).get(CostOverrunTrendReport.YOY_CHANGE));
    assertEquals(15.0, rows.get(1).getDouble(CostOverrunTrendReport.AVG_SAVINGS));
    assertEquals(50.0, rows.get(1).getDouble(CostOverrunTrendReport.YOY_CHANGE), 1e-9);
    assertEquals(-150.0, rows.get(2).getDouble(CostOverrunTrendReport.YOY_CHANGE), 1e-9);
    assertEquals(100.0, rows.get(2).getDouble(CostOverrunTrendReport.OVERRUN_RATE));
    assertEquals(0, log.size());
  }

  @Test void testMissingOrZeroBaseline() {
    RunLog log = new RunLog();
    List<ProjectRecord> records = Arrays.asList(
        typed(2022, "Seawall", 120, 100),
        typed(2021, "Revetment", 100, 100),
        typed(2023, "Revetment", 130, 100));

    ReportTable table = report.build(records, log);

    for (AggregateRow row : table.getRows()) {
      assertNull(row.get(CostOverrunTrendReport.YOY_CHANGE), row.toString());
    }
    assertEquals(2, log.size());
    assertEquals("NO_BASELINE", log.getEntries().get(0).getCode());
    assertEquals("ZERO_BASELINE", log.getEntries().get(1).getCode());
  }

  @Test void testOrdering() {
    List<ProjectRecord> records = Arrays.asList(
        typed(2023, "Dredging", 100, 90),
        typed(2022, "Seawall", 100, 95),
        typed(2022, "Dredging", 100, 80),
        typed(2022, "Bridge", 100, 95),
        typed(2021, "Seawall", 100, 100));

    ReportTable table = report.build(records, new RunLog());
    List<String[]> lines = table.canonicalRows();

    assertEquals(Arrays.asList("2021", "Seawall"), Arrays.asList(lines.get(0)).subList(0, 2));
    assertEquals(Arrays.asList("2022", "Dredging"), Arrays.asList(lines.get(1)).subList(0, 2));
    assertEquals(Arrays.asList("2022", "Bridge"), Arrays.asList(lines.get(2)).subList(0, 2));
    assertEquals(Arrays.asList("2022", "Seawall"), Arrays.asList(lines.get(3)).subList(0, 2));
    assertEquals(Arrays.asList("2023", "Dredging"), Arrays.asList(lines.get(4)).subList(0, 2));
    assertEquals("FundingYear,TypeOfWork,TotalProjects,AvgSavings,OverrunRate,YoYChange",
        String.join(",", table.header()));
  }
}
