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

import org.apache.calcite.adapter.floodcontrol.RunLog;
import org.apache.calcite.adapter.floodcontrol.aggregate.AggregateRow;
import org.apache.calcite.adapter.floodcontrol.aggregate.Aggregations;
import org.apache.calcite.adapter.floodcontrol.aggregate.GroupBy;
import org.apache.calcite.adapter.floodcontrol.aggregate.GroupKey;
import org.apache.calcite.adapter.floodcontrol.clean.ProjectCleaner;
import org.apache.calcite.adapter.floodcontrol.clean.ProjectRecord;

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Report 3: Annual Project Type Cost Overrun Trends.
 *
 * <p>Groups by (FundingYear, TypeOfWork). YoYChange compares each group's
 * average savings with the {@value #BASELINE_YEAR} average of the same type
 * of work, so it needs the whole grouping before any row can be finished.
 */
public class CostOverrunTrendReport implements ReportBuilder {

  private static final Logger LOGGER = LoggerFactory.getLogger(CostOverrunTrendReport.class);

  public static final String NAME = "Report3";
  public static final String TITLE = "Annual Project Type Cost Overrun Trends";

  public static final String AVG_SAVINGS = "AvgSavings";
  public static final String OVERRUN_RATE = "OverrunRate";
  public static final String YOY_CHANGE = "YoYChange";

  public static final int BASELINE_YEAR = ProjectCleaner.MIN_YEAR;

  static final Comparator<AggregateRow> ORDER =
      Comparator.<AggregateRow>comparingInt(r -> r.getKey().getInt(0))
          .thenComparing(
              Comparator.<AggregateRow>comparingDouble(r -> r.getDouble(AVG_SAVINGS)).reversed())
          .thenComparing(r -> r.getKey().getString(1));

  private static final List<ReportColumn> COLUMNS = ImmutableList.of(
      ReportColumn.keyInteger("FundingYear", 0),
      ReportColumn.keyText("TypeOfWork", 1),
      ReportColumn.count("TotalProjects"),
      ReportColumn.decimal(AVG_SAVINGS),
      ReportColumn.decimal(OVERRUN_RATE),
      ReportColumn.decimal(YOY_CHANGE));

  @Override public String getName() {
    return NAME;
  }

  @Override public ReportTable build(List<ProjectRecord> records, RunLog runLog) {
    List<AggregateRow> groups = GroupBy.aggregate(records,
        r -> GroupKey.of(r.getFundingYear(), r.getTypeOfWork()),
        (key, members) -> AggregateRow.builder(key, members.size())
            .metric(AVG_SAVINGS, Aggregations.mean(members, ProjectRecord::getCostSavings))
            .metric(OVERRUN_RATE,
                Aggregations.percentage(s -> s < 0, members, ProjectRecord::getCostSavings))
            .build());

    Map<String, Double> baselines = baselines(groups);

    List<AggregateRow> rows = new ArrayList<AggregateRow>(groups.size());
    for (AggregateRow group : groups) {
      rows.add(group.with(YOY_CHANGE, yoyChange(group, baselines, runLog)));
    }
    rows.sort(ORDER);

    LOGGER.info("{}: {} year/type groups, {} types with a {} baseline", NAME, rows.size(),
        baselines.size(), BASELINE_YEAR);
    return new ReportTable(NAME, TITLE, COLUMNS, rows);
  }

  /**
   * Returns type of work to baseline-year average savings.
   */
  static Map<String, Double> baselines(List<AggregateRow> groups) {
    Map<String, Double> baselines = new HashMap<String, Double>();
    for (AggregateRow group : groups) {
      if (group.getKey().getInt(0) == BASELINE_YEAR) {
        baselines.put(group.getKey().getString(1), group.getDouble(AVG_SAVINGS));
      }
    }
    return baselines;
  }

  private static @Nullable Double yoyChange(AggregateRow group, Map<String, Double> baselines,
      RunLog runLog) {
    int year = group.getKey().getInt(0);
    if (year == BASELINE_YEAR) {
      return null;
    }
    String typeOfWork = group.getKey().getString(1);
    Double baseline = baselines.get(typeOfWork);
    if (baseline == null) {
      runLog.computation(NAME, "NO_BASELINE", "No " + BASELINE_YEAR + " rows for type '"
          + typeOfWork + "'; YoYChange for " + year + " left empty");
      return null;
    }
    if (baseline == 0.0) {
      runLog.computation(NAME, "ZERO_BASELINE", "Baseline average savings for type '"
          + typeOfWork + "' is zero; YoYChange for " + year + " left empty");
      return null;
    }
    return Aggregations.percentChange(group.getDouble(AVG_SAVINGS), baseline);
  }
}
