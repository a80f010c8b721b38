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

import org.apache.calcite.adapter.floodcontrol.FloodControlException;

import com.opencsv.CSVWriter;

import java.io.IOException;
import java.io.StringWriter;

/**
 * Renders a {@link ReportTable} as canonical CSV text.
 *
 * <p>Comma separated, {@code \n} line endings, fields quoted only when they
 * contain a comma, quote or line break, embedded quotes doubled.
 * Numbers are plain two-decimal text.
 */
public final class ReportCsvWriter {

  private ReportCsvWriter() {
  }

  /**
   * Returns the CSV text for a report, header first.
   */
  public static String render(ReportTable table) {
    StringWriter out = new StringWriter();
    try (CSVWriter csvWriter = new CSVWriter(out,
        CSVWriter.DEFAULT_SEPARATOR,
        CSVWriter.DEFAULT_QUOTE_CHARACTER,
        CSVWriter.DEFAULT_ESCAPE_CHARACTER,
        "\n")) {
      csvWriter.writeNext(table.header(), false);
      for (String[] line : table.canonicalRows()) {
        csvWriter.writeNext(line, false);
      }
    } catch (IOException e) {
      throw new FloodControlException("Failed to render " + table.getName() + " as CSV", e);
    }
    return out.toString();
  }
}
