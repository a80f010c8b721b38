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

import org.apache.calcite.adapter.floodcontrol.clean.ProjectRecord;

import java.time.LocalDate;

/**
 * Builders for cleaned project records used across tests.
 */
public final class ProjectFixtures {

  public static final LocalDate START = LocalDate.of(2022, 1, 1);

  private ProjectFixtures() {
  }

  /**
   * Returns a builder with every field set; delay is measured from
   * {@link #START}.
   */
  public static ProjectRecord.Builder project(String contractor, double budget, double cost,
      int delayDays) {
    return ProjectRecord.builder()
        .rowNumber(1)
        .region("NCR")
        .mainIsland("Luzon")
        .province("Metro Manila")
        .contractor(contractor)
        .typeOfWork("Construction of Flood Mitigation Structure")
        .fundingYear(2022)
        .approvedBudget(budget)
        .contractCost(cost)
        .startDate(START)
        .actualCompletionDate(START.plusDays(delayDays))
        .latitude(14.6)
        .longitude(121.0);
  }

  public static ProjectRecord record(String contractor, double budget, double cost,
      int delayDays) {
    return project(contractor, budget, cost, delayDays).build();
  }
}
