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

import org.apache.calcite.adapter.floodcontrol.clean.CleanResult;
import org.apache.calcite.adapter.floodcontrol.clean.DropReason;
import org.apache.calcite.adapter.floodcontrol.clean.ProjectCleaner;
import org.apache.calcite.adapter.floodcontrol.clean.ProjectRecord;
import org.apache.calcite.adapter.floodcontrol.load.LoadResult;
import org.apache.calcite.adapter.floodcontrol.load.ProjectCsvLoader;
import org.apache.calcite.adapter.floodcontrol.report.ContractorRankingReport;
import org.apache.calcite.adapter.floodcontrol.report.CostOverrunTrendReport;
import org.apache.calcite.adapter.floodcontrol.report.DisplayTableFormatter;
import org.apache.calcite.adapter.floodcontrol.report.RegionalEfficiencyReport;
import org.apache.calcite.adapter.floodcontrol.report.ReportBuilder;
import org.apache.calcite.adapter.floodcontrol.report.ReportCsvWriter;
import org.apache.calcite.adapter.floodcontrol.report.ReportTable;
import org.apache.calcite.adapter.floodcontrol.summary.SummaryBuilder;
import org.apache.calcite.adapter.floodcontrol.summary.SummaryDigest;
import org.apache.calcite.adapter.floodcontrol.summary.SummaryWriter;
import org.apache.calcite.util.Source;
import org.apache.calcite.util.Sources;

import com.google.common.collect.ImmutableList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Supplier;

/**
 * Runs the report pipeline: load, clean, build reports and summary, write.
 *
 * <p>The pipeline executes these phases:
 * <ol>
 *   <li>Load the CSV into raw rows, rejecting malformed ones</li>
 *   <li>Clean: coerce types, filter funding years, impute coordinates,
 *       derive savings and delay</li>
 *   <li>Build the three reports and the summary from the cleaned records,
 *       optionally in parallel</li>
 *   <li>Write every output file</li>
 * </ol>
 *
 * <p>Nothing is written until phase 3 has finished for every report. Outputs
 * are then staged under temporary names and renamed once all of them are on
 * disk, so a fatal error leaves no partial set of outputs behind. Each report records its
 * computation issues in its own {@link RunLog}; the logs are merged in report
 * order, which keeps {@code run.log} identical between sequential and
 * parallel runs.
 *
 * <h3>Usage Example</h3>
 * <pre>{@code
 * FloodControlConfig config = FloodControlConfig.builder()
 *     .input("dpwh_flood_control_projects.csv")
 *     .outputDirectory("out")
 *     .build();
 * PipelineResult result = new FloodControlPipeline(config).execute();
 * }</pre>
 */
public class FloodControlPipeline {

  private static final Logger LOGGER = LoggerFactory.getLogger(FloodControlPipeline.class);

  public static final String SUMMARY_FILE = "summary.json";
  public static final String RUN_LOG_FILE = "run.log";

  static final String TEMP_SUFFIX = ".tmp";

  static final String LOAD_STAGE = "load";
  static final String CLEAN_STAGE = "clean";

  private final FloodControlConfig config;
  private final List<ReportBuilder> reportBuilders;
  private final ProjectCleaner cleaner;
  private final SummaryBuilder summaryBuilder;

  public FloodControlPipeline(FloodControlConfig config) {
    this(config, defaultReports());
  }

  public FloodControlPipeline(FloodControlConfig config, List<ReportBuilder> reportBuilders) {
    this.config = config;
    this.reportBuilders = ImmutableList.copyOf(reportBuilders);
    this.cleaner = new ProjectCleaner();
    this.summaryBuilder = new SummaryBuilder();
  }

  /**
   * Returns the three standard reports in output order.
   */
  public static List<ReportBuilder> defaultReports() {
    return ImmutableList.<ReportBuilder>of(
        new RegionalEfficiencyReport(),
        new ContractorRankingReport(),
        new CostOverrunTrendReport());
  }

  /**
   * Executes the pipeline.
   *
   * @return Counts, reports and written files
   * @throws FloodControlException if the input cannot be read, its header is
   *     incomplete, or outputs cannot be written
   */
  public PipelineResult execute() {
    LOGGER.info("Starting flood control report run: {}", config);
    long startTime = System.currentTimeMillis();
    RunLog runLog = new RunLog();

    LOGGER.info("Phase 1: Loading {}", config.getInput());
    LoadResult loaded = load();
    for (LoadResult.Rejection rejection : loaded.getRejections()) {
      runLog.row(LOAD_STAGE, rejection.getRowNumber(), rejection.getReason().name(),
          rejection.getMessage());
    }

    LOGGER.info("Phase 2: Cleaning {} rows", loaded.getRecords().size());
    CleanResult cleaned = cleaner.clean(loaded.getRecords());
    for (CleanResult.Drop drop : cleaned.getDrops()) {
      if (drop.getReason().isError()) {
        runLog.row(CLEAN_STAGE, drop.getRowNumber(), drop.getReason().name(),
            drop.getMessage());
      }
    }
    for (Long row : cleaned.getNegativeDelayRows()) {
      runLog.row(CLEAN_STAGE, row, "NEGATIVE_DELAY",
          "ActualCompletionDate precedes StartDate; negative delay kept");
    }
    List<ProjectRecord> records = Collections.unmodifiableList(cleaned.getRecords());

    LOGGER.info("Phase 3: Building {} reports from {} records{}", reportBuilders.size(),
        records.size(), config.isParallelReports() ? " in parallel" : "");
    List<RunLog> reportLogs = new ArrayList<RunLog>();
    List<ReportTable> reports = buildReports(records, reportLogs);
    SummaryDigest summary = summaryBuilder.build(records);
    for (RunLog reportLog : reportLogs) {
      runLog.merge(reportLog);
    }

    LOGGER.info("Phase 4: Writing outputs to {}", config.getOutputDirectory());
    Map<String, String> outputs = render(reports, summary, runLog);
    List<File> written = write(outputs);

    long elapsed = System.currentTimeMillis() - startTime;
    PipelineResult result = PipelineResult.builder()
        .totalRows(loaded.getTotalRows())
        .rejectedRows(loaded.getRejectedCount())
        .droppedRows(cleaned.getDropCount(DropReason.INVALID_FIELD)
            + cleaned.getDropCount(DropReason.NO_COORDINATE_FALLBACK))
        .yearFilteredRows(cleaned.getDropCount(DropReason.YEAR_OUT_OF_RANGE))
        .imputedRows(cleaned.getImputedCount())
        .cleanedRows(records.size())
        .reports(reports)
        .summary(summary)
        .runLog(runLog)
        .writtenFiles(written)
        .elapsedMs(elapsed)
        .build();
    LOGGER.info("Flood control report run complete: {} rows read, {} kept, {} files in {}ms",
        result.getTotalRows(), result.getCleanedRows(), written.size(), elapsed);
    return result;
  }

  private LoadResult load() {
    File input = new File(config.getInput());
    if (!input.isFile()) {
      throw new FloodControlException("Input file not found: " + input.getAbsolutePath());
    }
    if (!input.canRead()) {
      throw new FloodControlException("Input file is not readable: " + input.getAbsolutePath());
    }
    Source source = Sources.of(input);
    return new ProjectCsvLoader(source).load();
  }

  /**
   * Builds every report, each with its own log. On return {@code logs} holds
   * one log per report, in report order.
   */
  List<ReportTable> buildReports(final List<ProjectRecord> records, List<RunLog> logs) {
    List<Supplier<ReportTable>> tasks = new ArrayList<Supplier<ReportTable>>();
    for (final ReportBuilder builder : reportBuilders) {
      final RunLog log = new RunLog();
      logs.add(log);
      tasks.add(new Supplier<ReportTable>() {
        @Override public ReportTable get() {
          long start = System.currentTimeMillis();
          ReportTable table = builder.build(records, log);
          LOGGER.debug("{} built with {} rows in {}ms", builder.getName(),
              table.getRows().size(), System.currentTimeMillis() - start);
          return table;
        }
      });
    }

    List<ReportTable> tables = new ArrayList<ReportTable>(tasks.size());
    if (!config.isParallelReports() || tasks.size() < 2) {
      for (Supplier<ReportTable> task : tasks) {
        tables.add(task.get());
      }
      return tables;
    }

    ExecutorService executor = Executors.newFixedThreadPool(tasks.size());
    try {
      List<CompletableFuture<ReportTable>> futures =
          new ArrayList<CompletableFuture<ReportTable>>();
      for (Supplier<ReportTable> task : tasks) {
        futures.add(CompletableFuture.supplyAsync(task, executor));
      }
      for (CompletableFuture<ReportTable> future : futures) {
        tables.add(future.join());
      }
      return tables;
    } catch (CompletionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof RuntimeException) {
        throw (RuntimeException) cause;
      }
      throw new FloodControlException("Report computation failed", cause);
    } finally {
      executor.shutdownNow();
    }
  }

  /**
   * Renders every output file in memory, keyed by file name in write order.
   */
  Map<String, String> render(List<ReportTable> reports, SummaryDigest summary,
      RunLog runLog) {
    Map<String, String> outputs = new LinkedHashMap<String, String>();
    for (ReportTable report : reports) {
      outputs.put(report.getName() + ".csv", ReportCsvWriter.render(report));
    }
    outputs.put(SUMMARY_FILE, SummaryWriter.toJson(summary));
    if (config.isRunLog()) {
      outputs.put(RUN_LOG_FILE, runLog.render());
    }
    if (config.isDisplayTables()) {
      for (ReportTable report : reports) {
        String text = DisplayTableFormatter.format(report);
        LOGGER.info("{}:\n{}", report.getName(), text);
        outputs.put(report.getName() + ".txt", text);
      }
    }
    return outputs;
  }

  /**
   * Writes every output under a temporary name, then renames them all into
   * place. On failure every staged or renamed file is removed.
   */
  private List<File> write(Map<String, String> outputs) {
    File directory = new File(config.getOutputDirectory());
    if (!directory.isDirectory() && !directory.mkdirs()) {
      throw new FloodControlException("Cannot create output directory "
          + directory.getAbsolutePath());
    }
    if (!directory.canWrite()) {
      throw new FloodControlException("Output directory is not writable: "
          + directory.getAbsolutePath());
    }

    List<String> names = new ArrayList<String>(outputs.keySet());
    List<File> staged = new ArrayList<File>(names.size());
    List<File> written = new ArrayList<File>(names.size());
    try {
      for (String name : names) {
        File temp = new File(directory, name + TEMP_SUFFIX);
        staged.add(temp);
        Files.write(temp.toPath(), outputs.get(name).getBytes(StandardCharsets.UTF_8));
      }
      for (int i = 0; i < names.size(); i++) {
        File file = new File(directory, names.get(i));
        Files.move(staged.get(i).toPath(), file.toPath(), StandardCopyOption.REPLACE_EXISTING);
        LOGGER.debug("Wrote {}", file);
        written.add(file);
      }
    } catch (IOException e) {
      removeAll(staged, e);
      removeAll(written, e);
      throw new FloodControlException("Failed to write outputs to "
          + directory.getAbsolutePath(), e);
    }
    return written;
  }

  private static void removeAll(List<File> files, IOException failure) {
    for (File file : files) {
      try {
        Files.deleteIfExists(file.toPath());
      } catch (IOException e) {
        failure.addSuppressed(e);
      }
    }
  }
}
