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

import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Locale;

/**
 * Columns of the flood-control project dataset that the pipeline reads.
 *
 * <p>Header names are matched case-insensitively after trimming. Columns not
 * listed here are ignored.
 */
public enum ProjectColumn {
  REGION("Region", true, true),
  MAIN_ISLAND("MainIsland", true, true),
  PROVINCE("Province", true, true),
  CONTRACTOR("Contractor", true, true),
  TYPE_OF_WORK("TypeOfWork", true, true),
  FUNDING_YEAR("FundingYear", true, true),
  APPROVED_BUDGET("ApprovedBudgetForContract", true, true),
  CONTRACT_COST("ContractCost", true, true),
  START_DATE("StartDate", true, true),
  ACTUAL_COMPLETION_DATE("ActualCompletionDate", true, true),
  /** Present in the header, but a blank value is imputed later. */
  LATITUDE("Latitude", true, false, "ProjectLatitude"),
  LONGITUDE("Longitude", true, false, "ProjectLongitude"),
  PROJECT_ID("ProjectId", false, false),
  CONTRACT_ID("ContractId", false, false);

  private final String headerName;
  private final boolean requiredInHeader;
  private final boolean requiredValue;
  private final ImmutableList<String> aliases;

  ProjectColumn(String headerName, boolean requiredInHeader, boolean requiredValue,
      String... aliases) {
    this.headerName = headerName;
    this.requiredInHeader = requiredInHeader;
    this.requiredValue = requiredValue;
    this.aliases = ImmutableList.copyOf(aliases);
  }

  /**
   * Returns the canonical header name, also used in log messages.
   */
  public String getHeaderName() {
    return headerName;
  }

  /**
   * Returns whether the load fails when the header lacks this column.
   */
  public boolean isRequiredInHeader() {
    return requiredInHeader;
  }

  /**
   * Returns whether a row with a blank value in this column is rejected.
   */
  public boolean isRequiredValue() {
    return requiredValue;
  }

  public List<String> getAliases() {
    return aliases;
  }

  /**
   * Returns whether a raw header cell names this column.
   */
  public boolean matches(String header) {
    String normalized = normalize(header);
    if (normalized.equals(normalize(headerName))) {
      return true;
    }
    for (String alias : aliases) {
      if (normalized.equals(normalize(alias))) {
        return true;
      }
    }
    return false;
  }

  private static String normalize(String header) {
    // Strip a UTF-8 byte order mark left on the first header cell
    String s = header.startsWith("\uFEFF") ? header.substring(1) : header;
    return s.trim().toLowerCase(Locale.ROOT);
  }
}
