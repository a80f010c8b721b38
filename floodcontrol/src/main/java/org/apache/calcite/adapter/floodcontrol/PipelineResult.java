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

import org.apache.calcite.adapter.floodcontrol.report.ReportTable;
import org.apache.calcite.adapter.floodcontrol.summary.SummaryDigest;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.io.File;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Result of a completed {@link FloodControlPipeline} run.
 *
 * <h3>Usage Example</h3>
 * <pre>{@code
 * PipelineResult result = new FloodControlPipeline(config).execute();
 * System.out.println("Rows read: " + result.getTotalRows());
 * System.out.println("Rows kept: " + result.getCleanedRows());
 * for (File file : result.getWrittenFiles()) {
 *   System.out.println("  wrote " + file);
 * }
 * }</pre>
 *
 * <p>A fatal failure raises {@link FloodControlException} instead of
 * returning a result.
 */
public class PipelineResult {

  private final long totalRows;
  private final int rejectedRows;
  private final int droppedRows;
  private final int yearFilteredRows;
  private final int imputedRows;
  private final int cleanedRows;
  private final List<ReportTable> reports;
  private final SummaryDigest summary;
  private final RunLog runLog;
  private final List<File> writtenFiles;
  private final long elapsedMs;

  private PipelineResult(Builder builder) {
    this.totalRows = builder.totalRows;
    this.rejectedRows = builder.rejectedRows;
    this.droppedRows = builder.droppedRows;
    this.yearFilteredRows = builder.yearFilteredRows;
    this.imputedRows = builder.imputedRows;
    this.cleanedRows = builder.cleanedRows;
    this.reports = Collections.unmodifiableList(new ArrayList<ReportTable>(builder.reports));
    if (builder.summary == null || builder.runLog == null) {
      throw new IllegalStateException("summary and runLog are required");
    }
    this.summary = builder.summary;
    this.runLog = builder.runLog;
    this.writtenFiles = Collections.unmodifiableList(new ArrayList<File>(builder.writtenFiles));
    this.elapsedMs = builder.elapsedMs;
  }

  /**
   * Returns the number of data rows seen in the input, malformed ones
   * included.
   */
  public long getTotalRows() {
    return totalRows;
  }

  /**
   * Returns the number of rows the loader rejected.
   */
  public int getRejectedRows() {
    return rejectedRows;
  }

  /**
   * Returns the number of rows the cleaner dropped as errors.
   */
  public int getDroppedRows() {
    return droppedRows;
  }

  /**
   * Returns the number of valid rows outside the funding-year window.
   */
  public int getYearFilteredRows() {
    return yearFilteredRows;
  }

  public int getImputedRows() {
    return imputedRows;
  }

  /**
   * Returns the number of records all reports were computed from.
   */
  public int getCleanedRows() {
    return cleanedRows;
  }

  public List<ReportTable> getReports() {
    return reports;
  }

  public SummaryDigest getSummary() {
    return summary;
  }

  public RunLog getRunLog() {
    return runLog;
  }

  /**
   * Returns the files written, in write order.
   */
  public List<File> getWrittenFiles() {
    return writtenFiles;
  }

  public long getElapsedMs() {
    return elapsedMs;
  }

  @Override public String toString() {
    return "PipelineResult{rows=" + totalRows
        + ", rejected=" + rejectedRows
        + ", dropped=" + droppedRows
        + ", yearFiltered=" + yearFilteredRows
        + ", imputed=" + imputedRows
        + ", cleaned=" + cleanedRows
        + ", files=" + writtenFiles.size()
        + ", elapsedMs=" + elapsedMs + "}";
  }

  /**
   * Creates a new builder for PipelineResult.
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Builder for PipelineResult.
   */
  public static class Builder {
    private long totalRows;
    private int rejectedRows;
    private int droppedRows;
    private int yearFilteredRows;
    private int imputedRows;
    private int cleanedRows;
    private List<ReportTable> reports = new ArrayList<ReportTable>();
    private @Nullable SummaryDigest summary;
    private @Nullable RunLog runLog;
    private List<File> writtenFiles = new ArrayList<File>();
    private long elapsedMs;

    public Builder totalRows(long totalRows) {
      this.totalRows = totalRows;
      return this;
    }

    public Builder rejectedRows(int rejectedRows) {
      this.rejectedRows = rejectedRows;
      return this;
    }

    public Builder droppedRows(int droppedRows) {
      this.droppedRows = droppedRows;
      return this;
    }

    public Builder yearFilteredRows(int yearFilteredRows) {
      this.yearFilteredRows = yearFilteredRows;
      return this;
    }

    public Builder imputedRows(int imputedRows) {
      this.imputedRows = imputedRows;
      return this;
    }

    public Builder cleanedRows(int cleanedRows) {
      this.cleanedRows = cleanedRows;
      return this;
    }

    public Builder reports(List<ReportTable> reports) {
      this.reports = reports;
      return this;
    }

    public Builder summary(SummaryDigest summary) {
      this.summary = summary;
      return this;
    }

    public Builder runLog(RunLog runLog) {
      this.runLog = runLog;
      return this;
    }

    public Builder writtenFiles(List<File> writtenFiles) {
      this.writtenFiles = writtenFiles;
      return this;
    }

    public Builder elapsedMs(long elapsedMs) {
      this.elapsedMs = elapsedMs;
      return this;
    }

    public PipelineResult build() {
      return new PipelineResult(this);
    }
  }
}
