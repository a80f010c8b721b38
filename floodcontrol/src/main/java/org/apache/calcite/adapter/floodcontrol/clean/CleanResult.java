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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Output of {@link ProjectCleaner}: the retained records in input order, the
 * dropped rows, and the rows whose coordinates were imputed.
 */
public final class CleanResult {

  private final List<ProjectRecord> records;
  private final List<Drop> drops;
  private final int imputedCount;
  private final List<Long> negativeDelayRows;

  public CleanResult(List<ProjectRecord> records, List<Drop> drops, int imputedCount,
      List<Long> negativeDelayRows) {
    this.records = Collections.unmodifiableList(new ArrayList<ProjectRecord>(records));
    this.drops = Collections.unmodifiableList(new ArrayList<Drop>(drops));
    this.imputedCount = imputedCount;
    this.negativeDelayRows = Collections.unmodifiableList(new ArrayList<Long>(negativeDelayRows));
  }

  /**
   * Returns the cleaned records, in the order of the source rows.
   */
  public List<ProjectRecord> getRecords() {
    return records;
  }

  public List<Drop> getDrops() {
    return drops;
  }

  /**
   * Returns the number of drops with the given reason.
   */
  public int getDropCount(DropReason reason) {
    int count = 0;
    for (Drop drop : drops) {
      if (drop.getReason() == reason) {
        count++;
      }
    }
    return count;
  }

  /**
   * Returns the number of retained records whose coordinates were imputed.
   */
  public int getImputedCount() {
    return imputedCount;
  }

  /**
   * Returns the rows whose completion date precedes their start date. They
   * are retained with a negative delay.
   */
  public List<Long> getNegativeDelayRows() {
    return negativeDelayRows;
  }

  @Override public String toString() {
    return "CleanResult{retained=" + records.size() + ", dropped=" + drops.size()
        + ", imputed=" + imputedCount + "}";
  }

  /**
   * A loaded row that the cleaner removed.
   */
  public static final class Drop {
    private final long rowNumber;
    private final DropReason reason;
    private final String message;

    public Drop(long rowNumber, DropReason reason, String message) {
      this.rowNumber = rowNumber;
      this.reason = reason;
      this.message = message;
    }

    public long getRowNumber() {
      return rowNumber;
    }

    public DropReason getReason() {
      return reason;
    }

    public String getMessage() {
      return message;
    }

    @Override public String toString() {
      return "row " + rowNumber + " " + reason + ": " + message;
    }
  }
}
