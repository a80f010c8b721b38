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
package org.apache.calcite.adapter.floodcontrol.summary;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Dataset-wide digest written to {@code summary.json}.
 *
 * <p>Holds unrounded values; {@link SummaryWriter} rounds them.
 */
public final class SummaryDigest {

  private final int totalProjects;
  private final int totalContractors;
  private final int totalProvinces;
  private final @Nullable Double globalAvgDelay;
  private final double globalTotalSavings;

  public SummaryDigest(int totalProjects, int totalContractors, int totalProvinces,
      @Nullable Double globalAvgDelay, double globalTotalSavings) {
    this.totalProjects = totalProjects;
    this.totalContractors = totalContractors;
    this.totalProvinces = totalProvinces;
    this.globalAvgDelay = globalAvgDelay;
    this.globalTotalSavings = globalTotalSavings;
  }

  public int getTotalProjects() {
    return totalProjects;
  }

  public int getTotalContractors() {
    return totalContractors;
  }

  public int getTotalProvinces() {
    return totalProvinces;
  }

  /**
   * Returns the mean completion delay in days, or null when there are no
   * records.
   */
  public @Nullable Double getGlobalAvgDelay() {
    return globalAvgDelay;
  }

  public double getGlobalTotalSavings() {
    return globalTotalSavings;
  }

  @Override public String toString() {
    return "SummaryDigest{projects=" + totalProjects
        + ", contractors=" + totalContractors
        + ", provinces=" + totalProvinces
        + ", avgDelay=" + globalAvgDelay
        + ", totalSavings=" + globalTotalSavings + "}";
  }
}
