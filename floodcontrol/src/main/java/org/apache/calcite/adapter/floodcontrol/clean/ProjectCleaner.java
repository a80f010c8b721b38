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
package org.apache.calcite.adapter.floodcontrol.clean;

import org.apache.calcite.adapter.floodcontrol.load.FieldParsers;
import org.apache.calcite.adapter.floodcontrol.load.ProjectColumn;
import org.apache.calcite.adapter.floodcontrol.load.RawRecord;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Turns raw rows into {@link ProjectRecord}s.
 *
 * <p>The steps run in a fixed order, each over the survivors of the previous
 * one:
 * <ol>
 *   <li>Type coercion. A row whose fields do not coerce is dropped.</li>
 *   <li>Year filter. Only funding years {@value #MIN_YEAR}–{@value #MAX_YEAR}
 *       are kept.</li>
 *   <li>Coordinate imputation from provincial means ({@link CoordinateImputer}).</li>
 *   <li>Derivation of cost savings and completion delay.</li>
 * </ol>
 *
 * <p>Surviving rows keep their input order.
 */
public class ProjectCleaner {

  private static final Logger LOGGER = LoggerFactory.getLogger(ProjectCleaner.class);

  /** First funding year analysed. */
  public static final int MIN_YEAR = 2021;

  /** Last funding year analysed. */
  public static final int MAX_YEAR = 2023;

  private final CoordinateImputer imputer;

  public ProjectCleaner() {
    this(new CoordinateImputer());
  }

  public ProjectCleaner(CoordinateImputer imputer) {
    this.imputer = imputer;
  }

  /**
   * Cleans the loaded rows.
   *
   * @param rows Raw rows in file order
   * @return Retained records in file order, plus drop diagnostics
   */
  public CleanResult clean(List<RawRecord> rows) {
    long startTime = System.currentTimeMillis();
    List<CleanResult.Drop> drops = new ArrayList<CleanResult.Drop>();

    // 1. Type coercion
    List<ProjectRecord.Builder> coerced = new ArrayList<ProjectRecord.Builder>(rows.size());
    for (RawRecord row : rows) {
      ProjectRecord.Builder builder = coerce(row, drops);
      if (builder != null) {
        coerced.add(builder);
      }
    }

    // 2. Year filter
    List<ProjectRecord.Builder> inWindow = new ArrayList<ProjectRecord.Builder>(coerced.size());
    for (ProjectRecord.Builder builder : coerced) {
      int year = builder.getFundingYear();
      if (year >= MIN_YEAR && year <= MAX_YEAR) {
        inWindow.add(builder);
      } else {
        drops.add(new CleanResult.Drop(builder.getRowNumber(), DropReason.YEAR_OUT_OF_RANGE,
            "FundingYear " + year + " outside " + MIN_YEAR + "-" + MAX_YEAR));
      }
    }

    // 3. Coordinate imputation
    Map<String, CoordinateImputer.ProvinceCentroid> centroids =
        imputer.computeCentroids(inWindow);
    List<ProjectRecord.Builder> located = imputer.impute(inWindow, centroids, drops);

    // 4. Derived fields
    List<ProjectRecord> records = new ArrayList<ProjectRecord>(located.size());
    List<Long> negativeDelayRows = new ArrayList<Long>();
    int imputed = 0;
    for (ProjectRecord.Builder builder : located) {
      ProjectRecord record = builder.build();
      if (record.isCoordinatesImputed()) {
        imputed++;
      }
      if (record.getCompletionDelayDays() < 0) {
        LOGGER.warn("Row {}: ActualCompletionDate {} precedes StartDate {}; delay kept as {} days",
            record.getRowNumber(), record.getActualCompletionDate(), record.getStartDate(),
            record.getCompletionDelayDays());
        negativeDelayRows.add(record.getRowNumber());
      }
      records.add(record);
    }

    CleanResult result = new CleanResult(records, drops, imputed, negativeDelayRows);
    LOGGER.info("Cleaned {} rows: {} retained, {} outside {}-{}, {} invalid, {} without "
            + "coordinate fallback, {} imputed in {}ms",
        rows.size(), records.size(), result.getDropCount(DropReason.YEAR_OUT_OF_RANGE),
        MIN_YEAR, MAX_YEAR, result.getDropCount(DropReason.INVALID_FIELD),
        result.getDropCount(DropReason.NO_COORDINATE_FALLBACK), imputed,
        System.currentTimeMillis() - startTime);
    return result;
  }

  /**
   * Coerces the cells of one row, or records a drop and returns null.
   */
  ProjectRecord.@Nullable Builder coerce(RawRecord row, List<CleanResult.Drop> drops) {
    Integer year = FieldParsers.parseInt(row.get(ProjectColumn.FUNDING_YEAR));
    if (year == null) {
      return invalid(row, drops, "FundingYear is not an integer: '"
          + row.get(ProjectColumn.FUNDING_YEAR) + "'");
    }
    Double budget = FieldParsers.parseCurrency(row.get(ProjectColumn.APPROVED_BUDGET));
    Double cost = FieldParsers.parseCurrency(row.get(ProjectColumn.CONTRACT_COST));
    if (budget == null || cost == null) {
      return invalid(row, drops, "ApprovedBudgetForContract or ContractCost is not numeric");
    }
    if (budget < 0 || cost < 0) {
      return invalid(row, drops, "Negative ApprovedBudgetForContract or ContractCost");
    }
    LocalDate start = FieldParsers.parseDate(row.get(ProjectColumn.START_DATE));
    LocalDate completion = FieldParsers.parseDate(row.get(ProjectColumn.ACTUAL_COMPLETION_DATE));
    if (start == null || completion == null) {
      return invalid(row, drops, "StartDate or ActualCompletionDate is not a date");
    }

    Double latitude = FieldParsers.parseCoordinate(row.get(ProjectColumn.LATITUDE), 90.0);
    Double longitude = FieldParsers.parseCoordinate(row.get(ProjectColumn.LONGITUDE), 180.0);
    return ProjectRecord.builder()
        .rowNumber(row.getRowNumber())
        .projectId(blankToNull(row.get(ProjectColumn.PROJECT_ID)))
        .contractId(blankToNull(row.get(ProjectColumn.CONTRACT_ID)))
        .region(row.get(ProjectColumn.REGION))
        .mainIsland(row.get(ProjectColumn.MAIN_ISLAND))
        .province(row.get(ProjectColumn.PROVINCE))
        .contractor(row.get(ProjectColumn.CONTRACTOR))
        .typeOfWork(row.get(ProjectColumn.TYPE_OF_WORK))
        .fundingYear(year)
        .approvedBudget(budget)
        .contractCost(cost)
        .startDate(start)
        .actualCompletionDate(completion)
        .latitude(latitude)
        .longitude(longitude);
  }

  private static ProjectRecord.@Nullable Builder invalid(RawRecord row,
      List<CleanResult.Drop> drops, String message) {
    LOGGER.warn("Row {} dropped ({}): {}", row.getRowNumber(), DropReason.INVALID_FIELD, message);
    drops.add(new CleanResult.Drop(row.getRowNumber(), DropReason.INVALID_FIELD, message));
    return null;
  }

  private static @Nullable String blankToNull(String value) {
    return value.isEmpty() ? null : value;
  }
}
