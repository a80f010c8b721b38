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
import org.apache.calcite.util.Source;

import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.RFC4180ParserBuilder;
import com.opencsv.exceptions.CsvMalformedLineException;
import com.opencsv.exceptions.CsvValidationException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Reads the project dataset into raw records.
 *
 * <p>The header row is resolved against {@link ProjectColumn}; a missing
 * header row or a missing required column is fatal. Each data row is then
 * checked for blank required cells, non-numeric currency and unparseable
 * dates. A failing row is logged and excluded; loading continues.
 *
 * <h3>Usage Example</h3>
 * <pre>{@code
 * ProjectCsvLoader loader = new ProjectCsvLoader(Sources.of(new File("projects.csv")));
 * LoadResult result = loader.load();
 * LOGGER.info("{} of {} rows accepted", result.getRecords().size(), result.getTotalRows());
 * }</pre>
 */
public class ProjectCsvLoader {

  private static final Logger LOGGER = LoggerFactory.getLogger(ProjectCsvLoader.class);

  private final Source source;

  public ProjectCsvLoader(Source source) {
    this.source = source;
  }

  /**
   * Loads every data row.
   *
   * @return accepted rows, row count and rejections
   * @throws FloodControlException if the file cannot be read or the header is
   *     absent or incomplete
   */
  public LoadResult load() {
    LOGGER.info("Loading project dataset: {}", source.path());
    long startTime = System.currentTimeMillis();

    try (CSVReader reader = new CSVReaderBuilder(source.reader())
        .withCSVParser(new RFC4180ParserBuilder().build())
        .build()) {
      String[] header = readHeader(reader);
      Map<ProjectColumn, Integer> columnIndex = resolveHeader(header);

      List<RawRecord> records = new ArrayList<RawRecord>();
      List<LoadResult.Rejection> rejections = new ArrayList<LoadResult.Rejection>();
      long rowNumber = 0;

      while (true) {
        String[] cells;
        try {
          cells = reader.readNext();
        } catch (CsvMalformedLineException e) {
          rowNumber++;
          reject(rejections, rowNumber, RejectReason.MISSING_REQUIRED_FIELD,
              "Malformed CSV line: " + e.getMessage());
          continue;
        }
        if (cells == null) {
          break;
        }
        if (isBlankLine(cells)) {
          continue;
        }
        rowNumber++;

        RawRecord record = toRecord(rowNumber, cells, columnIndex);
        RowCheck check = check(record);
        if (check.isAccepted()) {
          records.add(record);
        } else {
          reject(rejections, rowNumber, check.getReason(), check.getMessage());
        }
      }

      LoadResult result = new LoadResult(records, rowNumber, rejections);
      LOGGER.info("Loaded {} rows from {}: {} accepted, {} rejected {} in {}ms",
          result.getTotalRows(), source.path(), records.size(), rejections.size(),
          result.getRejectionCounts(), System.currentTimeMillis() - startTime);
      return result;
    } catch (IOException | CsvValidationException e) {
      throw new FloodControlException("Cannot read dataset " + source.path() + ": "
          + e.getMessage(), e);
    }
  }

  /**
   * Checks one raw row. Blank required cells are reported first, then
   * currency, then dates.
   */
  public RowCheck check(RawRecord record) {
    for (ProjectColumn column : ProjectColumn.values()) {
      if (column.isRequiredValue() && record.isBlank(column)) {
        return RowCheck.reject(RejectReason.MISSING_REQUIRED_FIELD,
            "Missing " + column.getHeaderName());
      }
    }
    for (ProjectColumn column
        : new ProjectColumn[] {ProjectColumn.APPROVED_BUDGET, ProjectColumn.CONTRACT_COST}) {
      if (FieldParsers.parseCurrency(record.get(column)) == null) {
        return RowCheck.reject(RejectReason.NON_NUMERIC_CURRENCY,
            column.getHeaderName() + " is not numeric: '" + record.get(column) + "'");
      }
    }
    for (ProjectColumn column
        : new ProjectColumn[] {ProjectColumn.START_DATE, ProjectColumn.ACTUAL_COMPLETION_DATE}) {
      if (FieldParsers.parseDate(record.get(column)) == null) {
        return RowCheck.reject(RejectReason.MALFORMED_DATE,
            column.getHeaderName() + " is not a date: '" + record.get(column) + "'");
      }
    }
    return RowCheck.accepted();
  }

  private String[] readHeader(CSVReader reader) throws IOException, CsvValidationException {
    String[] header;
    do {
      header = reader.readNext();
    } while (header != null && isBlankLine(header));
    if (header == null) {
      throw new FloodControlException("Dataset " + source.path() + " has no header row");
    }
    return header;
  }

  /**
   * Maps each known column to its index in the header.
   *
   * @throws FloodControlException if a required column is absent
   */
  static Map<ProjectColumn, Integer> resolveHeader(String[] header) {
    Map<ProjectColumn, Integer> index = new EnumMap<ProjectColumn, Integer>(ProjectColumn.class);
    for (int i = 0; i < header.length; i++) {
      for (ProjectColumn column : ProjectColumn.values()) {
        if (!index.containsKey(column) && column.matches(header[i])) {
          index.put(column, i);
        }
      }
    }
    List<String> missing = new ArrayList<String>();
    for (ProjectColumn column : ProjectColumn.values()) {
      if (column.isRequiredInHeader() && !index.containsKey(column)) {
        missing.add(column.getHeaderName());
      }
    }
    if (!missing.isEmpty()) {
      throw new FloodControlException("Unexpected header: missing columns " + missing);
    }
    return index;
  }

  private static RawRecord toRecord(long rowNumber, String[] cells,
      Map<ProjectColumn, Integer> columnIndex) {
    Map<ProjectColumn, String> values = new EnumMap<ProjectColumn, String>(ProjectColumn.class);
    for (Map.Entry<ProjectColumn, Integer> e : columnIndex.entrySet()) {
      // cells missing from a short row read as blank
      int i = e.getValue();
      String cell = i < cells.length ? cells[i] : null;
      values.put(e.getKey(), cell == null ? "" : cell.trim());
    }
    return new RawRecord(rowNumber, values);
  }

  private static boolean isBlankLine(String[] cells) {
    return cells.length == 1 && cells[0].trim().isEmpty();
  }

  private static void reject(List<LoadResult.Rejection> rejections, long rowNumber,
      RejectReason reason, String message) {
    LOGGER.warn("Row {} rejected ({}): {}", rowNumber, reason, message);
    rejections.add(new LoadResult.Rejection(rowNumber, reason, message));
  }
}
