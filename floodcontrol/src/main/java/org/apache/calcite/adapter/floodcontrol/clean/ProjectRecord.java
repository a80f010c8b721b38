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

import org.checkerframework.checker.nullness.qual.Nullable;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * A cleaned flood-control project.
 *
 * <p>Every instance has a funding year in the analysed window, non-negative
 * budget and cost, and both coordinates (possibly imputed). Cost savings and
 * completion delay are derived when the record is built.
 */
public final class ProjectRecord {

  private final long rowNumber;
  private final @Nullable String projectId;
  private final @Nullable String contractId;
  private final String region;
  private final String mainIsland;
  private final String province;
  private final String contractor;
  private final String typeOfWork;
  private final int fundingYear;
  private final double approvedBudget;
  private final double contractCost;
  private final LocalDate startDate;
  private final LocalDate actualCompletionDate;
  private final double latitude;
  private final double longitude;
  private final boolean coordinatesImputed;
  private final double costSavings;
  private final long completionDelayDays;

  private ProjectRecord(Builder builder) {
    this.rowNumber = builder.rowNumber;
    this.projectId = builder.projectId;
    this.contractId = builder.contractId;
    this.region = Objects.requireNonNull(builder.region, "region");
    this.mainIsland = Objects.requireNonNull(builder.mainIsland, "mainIsland");
    this.province = Objects.requireNonNull(builder.province, "province");
    this.contractor = Objects.requireNonNull(builder.contractor, "contractor");
    this.typeOfWork = Objects.requireNonNull(builder.typeOfWork, "typeOfWork");
    this.fundingYear = builder.fundingYear;
    this.approvedBudget = builder.approvedBudget;
    this.contractCost = builder.contractCost;
    this.startDate = Objects.requireNonNull(builder.startDate, "startDate");
    this.actualCompletionDate =
        Objects.requireNonNull(builder.actualCompletionDate, "actualCompletionDate");
    if (builder.latitude == null || builder.longitude == null) {
      throw new IllegalStateException("Row " + builder.rowNumber + " has no coordinates");
    }
    this.latitude = builder.latitude;
    this.longitude = builder.longitude;
    this.coordinatesImputed = builder.coordinatesImputed;
    this.costSavings = approvedBudget - contractCost;
    this.completionDelayDays = ChronoUnit.DAYS.between(startDate, actualCompletionDate);
  }

  /**
   * Returns the 1-based data row this record came from.
   */
  public long getRowNumber() {
    return rowNumber;
  }

  public @Nullable String getProjectId() {
    return projectId;
  }

  public @Nullable String getContractId() {
    return contractId;
  }

  public String getRegion() {
    return region;
  }

  public String getMainIsland() {
    return mainIsland;
  }

  public String getProvince() {
    return province;
  }

  public String getContractor() {
    return contractor;
  }

  public String getTypeOfWork() {
    return typeOfWork;
  }

  public int getFundingYear() {
    return fundingYear;
  }

  public double getApprovedBudget() {
    return approvedBudget;
  }

  public double getContractCost() {
    return contractCost;
  }

  public LocalDate getStartDate() {
    return startDate;
  }

  public LocalDate getActualCompletionDate() {
    return actualCompletionDate;
  }

  public double getLatitude() {
    return latitude;
  }

  public double getLongitude() {
    return longitude;
  }

  /**
   * Returns whether the coordinates are a provincial mean rather than source
   * values.
   */
  public boolean isCoordinatesImputed() {
    return coordinatesImputed;
  }

  /**
   * Returns approved budget minus contract cost. Negative means overrun.
   */
  public double getCostSavings() {
    return costSavings;
  }

  /**
   * Returns the calendar days from start to actual completion.
   */
  public long getCompletionDelayDays() {
    return completionDelayDays;
  }

  /**
   * Returns the completion delay as a double, for aggregation.
   */
  public double getDelay() {
    return completionDelayDays;
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override public String toString() {
    return "ProjectRecord{row=" + rowNumber
        + ", region='" + region + "'"
        + ", province='" + province + "'"
        + ", contractor='" + contractor + "'"
        + ", year=" + fundingYear
        + ", savings=" + costSavings
        + ", delay=" + completionDelayDays
        + (coordinatesImputed ? ", imputed" : "")
        + "}";
  }

  /**
   * Builder for ProjectRecord.
   */
  public static final class Builder {
    private long rowNumber;
    private @Nullable String projectId;
    private @Nullable String contractId;
    private @Nullable String region;
    private @Nullable String mainIsland;
    private @Nullable String province;
    private @Nullable String contractor;
    private @Nullable String typeOfWork;
    private int fundingYear;
    private double approvedBudget;
    private double contractCost;
    private @Nullable LocalDate startDate;
    private @Nullable LocalDate actualCompletionDate;
    private @Nullable Double latitude;
    private @Nullable Double longitude;
    private boolean coordinatesImputed;

    public Builder rowNumber(long rowNumber) {
      this.rowNumber = rowNumber;
      return this;
    }

    public Builder projectId(@Nullable String projectId) {
      this.projectId = projectId;
      return this;
    }

    public Builder contractId(@Nullable String contractId) {
      this.contractId = contractId;
      return this;
    }

    public Builder region(String region) {
      this.region = region;
      return this;
    }

    public Builder mainIsland(String mainIsland) {
      this.mainIsland = mainIsland;
      return this;
    }

    public Builder province(String province) {
      this.province = province;
      return this;
    }

    public Builder contractor(String contractor) {
      this.contractor = contractor;
      return this;
    }

    public Builder typeOfWork(String typeOfWork) {
      this.typeOfWork = typeOfWork;
      return this;
    }

    public Builder fundingYear(int fundingYear) {
      this.fundingYear = fundingYear;
      return this;
    }

    public Builder approvedBudget(double approvedBudget) {
      this.approvedBudget = approvedBudget;
      return this;
    }

    public Builder contractCost(double contractCost) {
      this.contractCost = contractCost;
      return this;
    }

    public Builder startDate(LocalDate startDate) {
      this.startDate = startDate;
      return this;
    }

    public Builder actualCompletionDate(LocalDate actualCompletionDate) {
      this.actualCompletionDate = actualCompletionDate;
      return this;
    }

    public Builder latitude(@Nullable Double latitude) {
      this.latitude = latitude;
      return this;
    }

    public Builder longitude(@Nullable Double longitude) {
      this.longitude = longitude;
      return this;
    }

    public Builder coordinatesImputed(boolean coordinatesImputed) {
      this.coordinatesImputed = coordinatesImputed;
      return this;
    }

    public long getRowNumber() {
      return rowNumber;
    }

    public @Nullable String getProvince() {
      return province;
    }

    public int getFundingYear() {
      return fundingYear;
    }

    public @Nullable Double getLatitude() {
      return latitude;
    }

    public @Nullable Double getLongitude() {
      return longitude;
    }

    /**
     * Returns whether both coordinates are set.
     */
    public boolean hasCoordinates() {
      return latitude != null && longitude != null;
    }

    /**
     * Builds the record and derives cost savings and completion delay.
     *
     * @throws IllegalStateException if a coordinate is still missing
     */
    public ProjectRecord build() {
      return new ProjectRecord(this);
    }
  }
}
