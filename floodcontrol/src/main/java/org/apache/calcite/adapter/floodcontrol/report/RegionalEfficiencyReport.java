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
import org.apache.calcite.adapter.floodcontrol.clean.ProjectRecord;

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Report 1: Regional Flood Mitigation Efficiency Summary.
 *
 * <p>Groups projects by (Region, MainIsland) and computes total approved
 * budget, median cost savings, average completion delay and the share of
 * projects delayed more than {@value #HIGH_DELAY_DAYS} days.
 *
 * <p>The efficiency score is computed in two passes. Pass 1 computes each
 * group's raw score, (median savings / average delay) × 100. Pass 2 rescales
 * all raw scores so that the lowest maps to 0 and the highest to 100. A group
 * with zero average delay takes the highest finite raw score of the other
 * groups. When every raw score is equal the scores are all 0.
 */
public class RegionalEfficiencyReport implements ReportBuilder {

  private static final Logger LOGGER = LoggerFactory.getLogger(RegionalEfficiencyReport.class);

  public static final String NAME = "Report1";
  public static final String TITLE = "Regional Flood Mitigation Efficiency Summary";

  public static final String TOTAL_BUDGET = "TotalBudget";
  public static final String MEDIAN_SAVINGS = "MedianSavings";
  public static final String AVG_DELAY = "AvgDelay";
  public static final String HIGH_DELAY_PCT = "HighDelayPct";
  public static final String EFFICIENCY_SCORE = "EfficiencyScore";

  /** Delay, in days, above which a project counts as highly delayed. */
  public static final int HIGH_DELAY_DAYS = 30;

  static final Comparator<AggregateRow> ORDER =
      Comparator.<AggregateRow>comparingDouble(r -> r.getDouble(EFFICIENCY_SCORE)).reversed()
          .thenComparing(
              Comparator.<AggregateRow>comparingDouble(r -> r.getDouble(TOTAL_BUDGET)).reversed())
          .thenComparing(r -> r.getKey().getString(0))
          .thenComparing(r -> r.getKey().getString(1));

  private static final List<ReportColumn> COLUMNS = ImmutableList.of(
      ReportColumn.keyText("Region", 0),
      ReportColumn.keyText("MainIsland", 1),
      ReportColumn.decimal(TOTAL_BUDGET),
      ReportColumn.decimal(MEDIAN_SAVINGS),
      ReportColumn.decimal(AVG_DELAY),
      ReportColumn.decimal(HIGH_DELAY_PCT),
      ReportColumn.decimal(EFFICIENCY_SCORE));

  @Override public String getName() {
    return NAME;
  }

  @Override public ReportTable build(List<ProjectRecord> records, RunLog runLog) {
    List<AggregateRow> groups = GroupBy.aggregate(records,
        r -> GroupKey.of(r.getRegion(), r.getMainIsland()),
        (key, members) -> AggregateRow.builder(key, members.size())
            .metric(TOTAL_BUDGET, Aggregations.sum(members, ProjectRecord::getApprovedBudget))
            .metric(MEDIAN_SAVINGS, Aggregations.median(members, ProjectRecord::getCostSavings))
            .metric(AVG_DELAY, Aggregations.mean(members, ProjectRecord::getDelay))
            .metric(HIGH_DELAY_PCT,
                Aggregations.percentage(d -> d > HIGH_DELAY_DAYS, members,
                    ProjectRecord::getDelay))
            .build());

    Map<GroupKey, Double> rawScores = rawScores(groups, runLog);
    List<AggregateRow> scored = normalize(groups, rawScores, runLog);
    scored.sort(ORDER);

    LOGGER.info("{}: {} region/island groups from {} projects", NAME, scored.size(),
        records.size());
    return new ReportTable(NAME, TITLE, COLUMNS, scored);
  }

  /**
   * Pass 1: raw efficiency score per group, with the zero-delay fallback
   * applied.
   *
   * @return Map of group key to raw score, in group order
   */
  Map<GroupKey, Double> rawScores(List<AggregateRow> groups, RunLog runLog) {
    Map<GroupKey, @Nullable Double> computed = new LinkedHashMap<GroupKey, @Nullable Double>();
    Double maxFinite = null;
    for (AggregateRow group : groups) {
      double avgDelay = group.getDouble(AVG_DELAY);
      Double raw = null;
      if (avgDelay != 0.0) {
        double value = group.getDouble(MEDIAN_SAVINGS) / avgDelay * 100.0;
        if (!Double.isNaN(value) && !Double.isInfinite(value)) {
          raw = value;
          if (maxFinite == null || value > maxFinite) {
            maxFinite = value;
          }
        }
      }
      computed.put(group.getKey(), raw);
    }

    Map<GroupKey, Double> resolved = new LinkedHashMap<GroupKey, Double>();
    for (Map.Entry<GroupKey, @Nullable Double> e : computed.entrySet()) {
      Double raw = e.getValue();
      if (raw == null) {
        double substitute = maxFinite == null ? 0.0 : maxFinite;
        LOGGER.info("{}: group {} has zero average delay; raw efficiency set to {}",
            NAME, e.getKey(), substitute);
        runLog.computation(NAME, "ZERO_AVERAGE_DELAY", "Group " + e.getKey()
            + " has zero average delay; raw efficiency score set to the highest finite score "
            + (maxFinite == null ? "(none, using 0)" : String.valueOf(substitute)));
        raw = substitute;
      }
      resolved.put(e.getKey(), raw);
    }
    return resolved;
  }

  /**
   * Pass 2: min-max rescale of raw scores to [0, 100] over the whole report.
   */
  List<AggregateRow> normalize(List<AggregateRow> groups, Map<GroupKey, Double> rawScores,
      RunLog runLog) {
    double min = Double.POSITIVE_INFINITY;
    double max = Double.NEGATIVE_INFINITY;
    for (double raw : rawScores.values()) {
      min = Math.min(min, raw);
      max = Math.max(max, raw);
    }
    double range = max - min;
    if (!groups.isEmpty() && range == 0.0) {
      runLog.computation(NAME, "DEGENERATE_SCORE_RANGE",
          "All raw efficiency scores equal " + min + "; every score set to 0");
    }

    List<AggregateRow> scored = new ArrayList<AggregateRow>(groups.size());
    for (AggregateRow group : groups) {
      double raw = rawScores.get(group.getKey());
      double score = range == 0.0
          ? 0.0
          : Aggregations.cappedRatio((raw - min) / range * 100.0, 0.0, 100.0);
      scored.add(group.with(EFFICIENCY_SCORE, score));
    }
    return scored;
  }
}
