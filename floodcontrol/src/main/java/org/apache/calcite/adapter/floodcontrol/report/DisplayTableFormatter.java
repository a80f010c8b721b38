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

import java.util.List;

/**
 * Formats a {@link ReportTable} as a pipe-aligned text table for people to
 * read.
 *
 * <pre>
 * Regional Flood Mitigation Efficiency Summary
 * | Region  | MainIsland | TotalBudget | ...
 * |---------|------------|-------------|
 * | NCR     | Luzon      |  123,456.00 | ...
 * </pre>
 *
 * <p>Text cells longer than {@value #MAX_TEXT_WIDTH} characters are cut and
 * end in an ellipsis. Numbers are right-aligned and use thousands separators.
 */
public final class DisplayTableFormatter {

  public static final int MAX_TEXT_WIDTH = 45;

  private static final String ELLIPSIS = "\u2026";

  private DisplayTableFormatter() {
  }

  public static String format(ReportTable table) {
    List<ReportColumn> columns = table.getColumns();
    String[] header = table.header();
    List<String[]> rows = table.displayRows();

    int[] widths = new int[columns.size()];
    for (int i = 0; i < widths.length; i++) {
      widths[i] = header[i].length();
    }
    for (String[] row : rows) {
      for (int i = 0; i < row.length; i++) {
        if (columns.get(i).getKind() == ReportColumn.Kind.TEXT) {
          row[i] = truncate(row[i]);
        }
        widths[i] = Math.max(widths[i], row[i].length());
      }
    }

    StringBuilder sb = new StringBuilder();
    sb.append(table.getTitle()).append('\n');
    appendLine(sb, header, widths, columns, true);
    sb.append('|');
    for (int width : widths) {
      for (int j = 0; j < width + 2; j++) {
        sb.append('-');
      }
      sb.append('|');
    }
    sb.append('\n');
    for (String[] row : rows) {
      appendLine(sb, row, widths, columns, false);
    }
    return sb.toString();
  }

  static String truncate(String text) {
    if (text.length() <= MAX_TEXT_WIDTH) {
      return text;
    }
    return text.substring(0, MAX_TEXT_WIDTH - 1) + ELLIPSIS;
  }

  private static void appendLine(StringBuilder sb, String[] cells, int[] widths,
      List<ReportColumn> columns, boolean header) {
    sb.append('|');
    for (int i = 0; i < cells.length; i++) {
      boolean right = !header && columns.get(i).getKind() != ReportColumn.Kind.TEXT;
      sb.append(' ').append(pad(cells[i], widths[i], right)).append(" |");
    }
    sb.append('\n');
  }

  private static String pad(String text, int width, boolean right) {
    StringBuilder sb = new StringBuilder(width);
    if (right) {
      for (int i = text.length(); i < width; i++) {
        sb.append(' ');
      }
      sb.append(text);
    } else {
      sb.append(text);
      for (int i = text.length(); i < width; i++) {
        sb.append(' ');
      }
    }
    return sb.toString();
  }
}
