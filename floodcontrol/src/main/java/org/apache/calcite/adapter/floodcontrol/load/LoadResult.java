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

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Output of {@link ProjectCsvLoader}: accepted rows in file order, the number
 * of data rows seen and the rejected rows.
 */
public final class LoadResult {

  private final List<RawRecord> records;
  private final long totalRows;
  private final List<Rejection> rejections;

  public LoadResult(List<RawRecord> records, long totalRows, List<Rejection> rejections) {
    this.records = Collections.unmodifiableList(new ArrayList<RawRecord>(records));
    this.totalRows = totalRows;
    this.rejections = Collections.unmodifiableList(new ArrayList<Rejection>(rejections));
  }

  /**
   * Returns the accepted rows, in file order.
   */
  public List<RawRecord> getRecords() {
    return records;
  }

  /**
   * Returns the number of data rows seen, including rejected ones.
   */
  public long getTotalRows() {
    return totalRows;
  }

  public List<Rejection> getRejections() {
    return rejections;
  }

  public int getRejectedCount() {
    return rejections.size();
  }

  /**
   * Returns the number of rejections per reason; reasons with none are omitted.
   */
  public Map<RejectReason, Integer> getRejectionCounts() {
    Map<RejectReason, Integer> counts = new EnumMap<RejectReason, Integer>(RejectReason.class);
    for (Rejection rejection : rejections) {
      Integer current = counts.get(rejection.getReason());
      counts.put(rejection.getReason(), current == null ? 1 : current + 1);
    }
    return counts;
  }

  @Override public String toString() {
    return "LoadResult{total=" + totalRows + ", accepted=" + records.size()
        + ", rejected=" + rejections.size() + "}";
  }

  /**
   * A row the loader excluded.
   */
  public static final class Rejection {
    private final long rowNumber;
    private final RejectReason reason;
    private final String message;

    public Rejection(long rowNumber, RejectReason reason, String message) {
      this.rowNumber = rowNumber;
      this.reason = reason;
      this.message = message;
    }

    public long getRowNumber() {
      return rowNumber;
    }

    public RejectReason getReason() {
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
