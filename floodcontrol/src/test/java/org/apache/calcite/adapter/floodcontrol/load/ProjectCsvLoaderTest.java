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
package org.apache.calcite.adapter.floodcontrol.load;

import org.apache.calcite.adapter.floodcontrol.FloodControlException;
import org.apache.calcite.util.Sources;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link ProjectCsvLoader}.
 */
@Tag("unit")
public class ProjectCsvLoaderTest {

  static final String HEADER = "Region,MainIsland,Province,Contractor,TypeOfWork,FundingYear,"
      + "ApprovedBudgetForContract,ContractCost,StartDate,ActualCompletionDate,"
      + "ProjectLatitude,ProjectLongitude\n";

  @TempDir
  Path tempDir;

  private LoadResult load(String content) throws IOException {
    File file = tempDir.resolve("projects.csv").toFile();
    Files.write(file.toPath(), content.getBytes(StandardCharsets.UTF_8));
    return new ProjectCsvLoader(Sources.of(file)).load();
  }

  @Test void testLoadsValidRows() throws IOException {
    LoadResult result = load(HEADER
        + "NCR,Luzon,Metro Manila,\"ACME, INC.\",Dredging,2022,\"1,000.00\",900,"
        + "2022-01-01,2022-02-01,14.6,121.0\n"
        + "Region VII,Visayas,Cebu,Beta,Seawall,2023,500,450,01/02/2023,15/03/2023,,\n");

    assertEquals(2, result.getTotalRows());
    assertEquals(2, result.getRecords().size());
    assertEquals(0, result.getRejectedCount());

    RawRecord first = result.getRecords().get(0);
    assertEquals(1, first.getRowNumber());
    assertEquals("ACME, INC.", first.get(ProjectColumn.CONTRACTOR));
    assertEquals("1,000.00", first.get(ProjectColumn.APPROVED_BUDGET));
    assertEquals("14.6", first.get(ProjectColumn.LATITUDE));
    assertEquals("", first.get(ProjectColumn.PROJECT_ID));

    RawRecord second = result.getRecords().get(1);
    assertEquals(2, second.getRowNumber());
    assertTrue(second.isBlank(ProjectColumn.LONGITUDE));
  }

  @Test void testRejectsWithReasonCodes() throws IOException {
    LoadResult result = load(HEADER
        + "NCR,Luzon,Metro Manila,Acme,Dredging,2022,100,90,2022-01-01,2022-02-01,14.6,121.0\n"
        + "NCR,Luzon,Metro Manila,,Dredging,2022,100,90,2022-01-01,2022-02-01,14.6,121.0\n"
        + "NCR,Luzon,Metro Manila,Acme,Dredging,2022,lots,90,2022-01-01,2022-02-01,14.6,121.0\n"
        + "NCR,Luzon,Metro Manila,Acme,Dredging,2022,100,90,someday,2022-02-01,14.6,121.0\n"
        + "NCR,Luzon,Metro Manila,Acme\n");

    assertEquals(5, result.getTotalRows());
    assertEquals(1, result.getRecords().size());
    assertEquals(4, result.getRejectedCount());

    assertEquals(2, result.getRejections().get(0).getRowNumber());
    assertEquals(RejectReason.MISSING_REQUIRED_FIELD, result.getRejections().get(0).getReason());
    assertEquals(RejectReason.NON_NUMERIC_CURRENCY, result.getRejections().get(1).getReason());
    assertEquals(RejectReason.MALFORMED_DATE, result.getRejections().get(2).getReason());
    assertEquals(RejectReason.MISSING_REQUIRED_FIELD, result.getRejections().get(3).getReason());

    Map<RejectReason, Integer> expected = new EnumMap<RejectReason, Integer>(RejectReason.class);
    expected.put(RejectReason.MALFORMED_DATE, 1);
    expected.put(RejectReason.MISSING_REQUIRED_FIELD, 2);
    expected.put(RejectReason.NON_NUMERIC_CURRENCY, 1);
    assertEquals(expected, result.getRejectionCounts());
  }

  @Test void testShortRowWithOnlyOptionalCellsMissingIsAccepted() throws IOException {
    LoadResult result = load(HEADER
        + "NCR,Luzon,Metro Manila,Acme,Dredging,2022,100,90,2022-01-01,2022-02-01\n"
        + "NCR,Luzon,Metro Manila,Acme,Dredging,2022,100,90\n");

    assertEquals(2, result.getTotalRows());
    assertEquals(1, result.getRecords().size());
    RawRecord accepted = result.getRecords().get(0);
    assertTrue(accepted.isBlank(ProjectColumn.LATITUDE));
    assertTrue(accepted.isBlank(ProjectColumn.LONGITUDE));

    assertEquals(1, result.getRejectedCount());
    assertEquals(2, result.getRejections().get(0).getRowNumber());
    assertEquals(RejectReason.MISSING_REQUIRED_FIELD, result.getRejections().get(0).getReason());
  }

  @Test void testBlankLinesAreNotRows() throws IOException {
    LoadResult result = load(HEADER
        + "NCR,Luzon,Metro Manila,Acme,Dredging,2022,100,90,2022-01-01,2022-02-01,14.6,121.0\n"
        + "\n"
        + "NCR,Luzon,Metro Manila,Acme,Dredging,2022,100,90,2022-01-01,2022-02-01,14.6,121.0\n"
        + "\n\n");

    assertEquals(2, result.getTotalRows());
    assertEquals(2, result.getRecords().get(1).getRowNumber());
  }

  @Test void testHeaderIsCaseInsensitiveWithExtraColumns() throws IOException {
    LoadResult result = load("\uFEFFregion, MAINISLAND ,Province,Contractor,TypeOfWork,"
        + "FundingYear,ApprovedBudgetForContract,ContractCost,StartDate,"
        + "ActualCompletionDate,Latitude,Longitude,Remarks\n"
        + "NCR,Luzon,Metro Manila,Acme,Dredging,2022,100,90,2022-01-01,2022-02-01,14.6,121.0,"
        + "none\n");

    assertEquals(1, result.getRecords().size());
    assertEquals("NCR", result.getRecords().get(0).get(ProjectColumn.REGION));
    assertEquals("Luzon", result.getRecords().get(0).get(ProjectColumn.MAIN_ISLAND));
  }

  @Test void testMissingRequiredColumnIsFatal() {
    FloodControlException e = assertThrows(FloodControlException.class,
        () -> load("Region,MainIsland,Province\nNCR,Luzon,Metro Manila\n"));
    assertTrue(e.getMessage().contains("Contractor"), e.getMessage());
  }

  @Test void testEmptyFileIsFatal() {
    assertThrows(FloodControlException.class, () -> load(""));
    assertThrows(FloodControlException.class, () -> load("\n\n"));
  }

  @Test void testMissingFileIsFatal() {
    File missing = tempDir.resolve("absent.csv").toFile();
    assertThrows(FloodControlException.class,
        () -> new ProjectCsvLoader(Sources.of(missing)).load());
  }

  @Test void testCheckOrder() {
    Map<ProjectColumn, String> values = new EnumMap<ProjectColumn, String>(ProjectColumn.class);
    values.put(ProjectColumn.REGION, "NCR");
    values.put(ProjectColumn.MAIN_ISLAND, "Luzon");
    values.put(ProjectColumn.PROVINCE, "Metro Manila");
    values.put(ProjectColumn.CONTRACTOR, "Acme");
    values.put(ProjectColumn.TYPE_OF_WORK, "Dredging");
    values.put(ProjectColumn.FUNDING_YEAR, "2022");
    values.put(ProjectColumn.APPROVED_BUDGET, "abc");
    values.put(ProjectColumn.CONTRACT_COST, "90");
    values.put(ProjectColumn.START_DATE, "bad");
    values.put(ProjectColumn.ACTUAL_COMPLETION_DATE, "2022-02-01");
    ProjectCsvLoader loader = new ProjectCsvLoader(Sources.of(new File("unused.csv")));

    RowCheck check = loader.check(new RawRecord(1, values));
    assertEquals(RejectReason.NON_NUMERIC_CURRENCY, check.getReason());

    values.put(ProjectColumn.APPROVED_BUDGET, "100");
    check = loader.check(new RawRecord(1, values));
    assertEquals(RejectReason.MALFORMED_DATE, check.getReason());

    values.put(ProjectColumn.START_DATE, "2022-01-01");
    assertTrue(loader.check(new RawRecord(1, values)).isAccepted());
  }
}
