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

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * One data row as text, keyed by column, with its 1-based position among
 * the data rows of the file.
 */
public final class RawRecord {

  private final long rowNumber;
  private final Map<ProjectColumn, String> values;

  public RawRecord(long rowNumber, Map<ProjectColumn, String> values) {
    this.rowNumber = rowNumber;
    Map<ProjectColumn, String> copy = new EnumMap<ProjectColumn, String>(ProjectColumn.class);
    copy.putAll(values);
    this.values = Collections.unmodifiableMap(copy);
  }

  /**
   * Returns the data row number; the header is row 0.
   */
  public long getRowNumber() {
    return rowNumber;
  }

  /**
   * Returns the trimmed cell text, or the empty string when the column is
   * absent from the file or the row.
   */
  public String get(ProjectColumn column) {
    String value = values.get(column);
    return value == null ? "" : value;
  }

  public boolean isBlank(ProjectColumn column) {
    return get(column).isEmpty();
  }

  public Map<ProjectColumn, String> getValues() {
    return values;
  }

  @Override public String toString() {
    return "RawRecord{row=" + rowNumber + ", values=" + values + "}";
  }
}
