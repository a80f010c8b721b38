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

import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.List;

/**
 * A finished report: ordered aggregate rows plus the columns that render
 * them.
 */
public final class ReportTable {

  private final String name;
  private final String title;
  private final ImmutableList<ReportColumn> columns;
  private final ImmutableList<AggregateRow> rows;

  public ReportTable(String name, String title, List<ReportColumn> columns,
      List<AggregateRow> rows) {
    this.name = name;
    this.title = title;
    this.columns = ImmutableList.copyOf(columns);
    this.rows = ImmutableList.copyOf(rows);
  }

  /**
   * Returns the file base name, such as {@code Report1}.
   */
  public String getName() {
    return name;
  }

  public String getTitle() {
    return title;
  }

  public List<ReportColumn> getColumns() {
    return columns;
  }

  /**
   * Returns the rows in output order.
   */
  public List<AggregateRow> getRows() {
    return rows;
  }

  public String[] header() {
    String[] header = new String[columns.size()];
    for (int i = 0; i < header.length; i++) {
      header[i] = columns.get(i).getName();
    }
    return header;
  }

  /**
   * Returns the rows rendered for the canonical CSV file.
   */
  public List<String[]> canonicalRows() {
    List<String[]> lines = new ArrayList<String[]>(rows.size());
    for (AggregateRow row : rows) {
      String[] cells = new String[columns.size()];
      for (int i = 0; i < cells.length; i++) {
        cells[i] = columns.get(i).canonical(row);
      }
      lines.add(cells);
    }
    return lines;
  }

  /**
   * Returns the rows rendered for human-readable display.
   */
  public List<String[]> displayRows() {
    List<String[]> lines = new ArrayList<String[]>(rows.size());
    for (AggregateRow row : rows) {
      String[] cells = new String[columns.size()];
      for (int i = 0; i < cells.length; i++) {
        cells[i] = columns.get(i).display(row);
      }
      lines.add(cells);
    }
    return lines;
  }

  @Override public String toString() {
    return "ReportTable{" + name + ", rows=" + rows.size() + "}";
  }
}
