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
package org.apache.calcite.adapter.floodcontrol;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Accumulates the row-level and computation-level issues of one run, in
 * detection order, for the {@code run.log} file written next to the reports.
 *
 * <p>Each stage that may run concurrently gets its own RunLog; the pipeline
 * merges them in a fixed stage order so the file is the same on every run.
 */
public final class RunLog {

  private final List<Entry> entries = new ArrayList<Entry>();

  /**
   * Records an issue tied to a source row.
   */
  public synchronized void row(String stage, long rowNumber, String code, String message) {
    entries.add(new Entry(stage, rowNumber, code, message));
  }

  /**
   * Records an issue not tied to a single row, such as a division policy
   * applied to a group.
   */
  public synchronized void computation(String stage, String code, String message) {
    entries.add(new Entry(stage, null, code, message));
  }

  /**
   * Appends all entries of another log, preserving their order.
   */
  public synchronized void merge(RunLog other) {
    entries.addAll(other.getEntries());
  }

  public synchronized List<Entry> getEntries() {
    return Collections.unmodifiableList(new ArrayList<Entry>(entries));
  }

  public synchronized int size() {
    return entries.size();
  }

  /**
   * Returns the log as text, one entry per line, each line ending in
   * {@code \n}.
   */
  public synchronized String render() {
    StringBuilder sb = new StringBuilder();
    for (Entry entry : entries) {
      sb.append(entry).append('\n');
    }
    return sb.toString();
  }

  /**
   * One logged issue.
   */
  public static final class Entry {
    private final String stage;
    private final @Nullable Long rowNumber;
    private final String code;
    private final String message;

    Entry(String stage, @Nullable Long rowNumber, String code, String message) {
      this.stage = stage;
      this.rowNumber = rowNumber;
      this.code = code;
      this.message = message;
    }

    public String getStage() {
      return stage;
    }

    /**
     * Returns the source row, or null for computation-level entries.
     */
    public @Nullable Long getRowNumber() {
      return rowNumber;
    }

    public String getCode() {
      return code;
    }

    public String getMessage() {
      return message;
    }

    @Override public String toString() {
      StringBuilder sb = new StringBuilder();
      sb.append('[').append(stage).append(']');
      if (rowNumber != null) {
        sb.append(" row ").append(rowNumber);
      }
      sb.append(' ').append(code).append(": ").append(message);
      return sb.toString();
    }
  }
}
