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
import java.util.List;

/**
 * Report 2: Top Contractors Performance Ranking.
 *
 * <p>Contractors with at least {@value #MIN_PROJECTS} projects are ranked by
 * total contract cost. The reliability index rewards savings and penalizes
 * delay:
 *
 * <pre>
 *   ReliabilityIndex = (1 - AvgDelay / 90) * (TotalSavings / TotalCost) * 100
 * </pre>
 *
 * <p>capped above at 100 with no floor. A contractor with zero total cost has
 * no index and is labelled high risk.
 */
public class ContractorRankingReport implements ReportBuilder {

  private static final Logger LOGGER = LoggerFactory.getLogger(ContractorRankingReport.class);

  public static final String NAME = "Report2";
  public static final String TITLE = "Top Contractors Performance Ranking";

  public static final String RANK = "Rank";
  public static final String TOTAL_COST = "TotalCost";
  public static final String AVG_DELAY = "AvgDelay";
  public static final String TOTAL_SAVINGS = "TotalSavings";
  public static final String RELIABILITY_INDEX = "ReliabilityIndex";

  public static final int MIN_PROJECTS = 5;
  public static final int TOP_N = 15;
  public static final double DELAY_HORIZON_DAYS = 90.0;
  public static final double HIGH_RISK_THRESHOLD = 50.0;

  public static final String HIGH_RISK = "High Risk";
  public static final String NORMAL = "Normal";

  static final Comparator<AggregateRow> ORDER =
      Comparator.<AggregateRow>comparingDouble(r -> r.getDouble(TOTAL_COST)).reversed()
          .thenComparing(r -> r.get(RELIABILITY_INDEX),
              Comparator.nullsLast(Comparator.<Double>reverseOrder()))
          .thenComparing(r -> r.getKey().getString(0));

  private static final List<ReportColumn> COLUMNS = ImmutableList.of(
      ReportColumn.integerMetric(RANK),
      ReportColumn.keyText("Contractor", 0),
      ReportColumn.count("NumProjects"),
      ReportColumn.decimal(TOTAL_COST),
      ReportColumn.decimal(AVG_DELAY),
      ReportColumn.decimal(TOTAL_SAVINGS),
      ReportColumn.decimal(RELIABILITY_INDEX),
      ReportColumn.derived("RiskLabel", r -> riskLabel(r.get(RELIABILITY_INDEX))));

  @Override public String getName() {
    return NAME;
  }

  @Override public ReportTable build(List<ProjectRecord> records, RunLog runLog) {
    List<AggregateRow> groups = GroupBy.aggregate(records,
        r -> GroupKey.of(r.getContractor()),
        (key, members) -> AggregateRow.builder(key, members.size())
            .metric(TOTAL_COST, Aggregations.sum(members, ProjectRecord::getContractCost))
            .metric(AVG_DELAY, Aggregations.mean(members, ProjectRecord::getDelay))
            .metric(TOTAL_SAVINGS, Aggregations.sum(members, ProjectRecord::getCostSavings))
            .build());

    List<AggregateRow> eligible = new ArrayList<AggregateRow>();
    for (AggregateRow group : groups) {
      if (group.getCount() >= MIN_PROJECTS) {
        eligible.add(group.with(RELIABILITY_INDEX, reliabilityIndex(group, runLog)));
      }
    }
    eligible.sort(ORDER);

    List<AggregateRow> ranked = new ArrayList<AggregateRow>();
    for (int i = 0; i < eligible.size() && i < TOP_N; i++) {
      ranked.add(eligible.get(i).with(RANK, (double) (i + 1)));
    }

    LOGGER.info("{}: {} of {} contractors have at least {} projects; keeping top {}",
        NAME, eligible.size(), groups.size(), MIN_PROJECTS, ranked.size());
    return new ReportTable(NAME, TITLE, COLUMNS, ranked);
  }

  /**
   * Computes the reliability index, or null when the contractor's total cost
   * is zero.
   */
  static @Nullable Double reliabilityIndex(AggregateRow group, RunLog runLog) {
    double totalCost = group.getDouble(TOTAL_COST);
    if (totalCost == 0.0) {
      LOGGER.debug("{}: contractor {} has zero total cost; reliability index undefined",
          NAME, group.getKey());
      runLog.computation(NAME, "ZERO_TOTAL_COST", "Contractor " + group.getKey()
          + " has zero total cost; reliability index left empty and labelled "
          + HIGH_RISK);
      return null;
    }
    double avgDelay = group.getDouble(AVG_DELAY);
    double totalSavings = group.getDouble(TOTAL_SAVINGS);
    double index = (1.0 - avgDelay / DELAY_HORIZON_DAYS) * (totalSavings / totalCost) * 100.0;
    return Aggregations.cappedRatio(index, null, 100.0);
  }

  /**
   * Returns the risk label for a reliability index; an undefined index is
   * high risk.
   */
  public static String riskLabel(@Nullable Double reliabilityIndex) {
    if (reliabilityIndex == null || reliabilityIndex < HIGH_RISK_THRESHOLD) {
      return HIGH_RISK;
    }
    return NORMAL;
  }
}
