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

import org.apache.calcite.adapter.floodcontrol.aggregate.Aggregations;
import org.apache.calcite.adapter.floodcontrol.clean.ProjectRecord;

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Computes the {@link SummaryDigest} from the cleaned record set.
 *
 * <p>Reads the cleaned records directly, so no report filter (such as the
 * contractor project minimum) affects it. Contractor and province names are
 * compared after trimming and upper-casing. Contractor cells that only
 * point at another contract or project are not counted as contractors.
 */
public class SummaryBuilder {

  private static final Logger LOGGER = LoggerFactory.getLogger(SummaryBuilder.class);

  /** Lower-case fragments marking a contractor cell that names no contractor. */
  static final List<String> CONTRACTOR_PLACEHOLDERS = ImmutableList.of(
      "clustered with contract id",
      "myca with project id");

  public SummaryDigest build(List<ProjectRecord> records) {
    Set<String> contractors = new HashSet<String>();
    Set<String> provinces = new HashSet<String>();
    for (ProjectRecord record : records) {
      String contractor = contractorKey(record.getContractor());
      if (contractor != null) {
        contractors.add(contractor);
      }
      String province = nameKey(record.getProvince());
      if (province != null) {
        provinces.add(province);
      }
    }

    SummaryDigest digest = new SummaryDigest(records.size(), contractors.size(),
        provinces.size(),
        Aggregations.mean(records, ProjectRecord::getDelay),
        Aggregations.sum(records, ProjectRecord::getCostSavings));
    LOGGER.debug("Summary: {}", digest);
    return digest;
  }

  /**
   * Returns the comparison key for a name, or null if it is blank.
   */
  static @Nullable String nameKey(String name) {
    String trimmed = name.trim();
    if (trimmed.isEmpty()) {
      return null;
    }
    return trimmed.toUpperCase(Locale.ROOT);
  }

  /**
   * Returns the comparison key for a contractor, or null if the cell is
   * blank or a placeholder.
   */
  static @Nullable String contractorKey(String contractor) {
    String lower = contractor.toLowerCase(Locale.ROOT);
    for (String placeholder : CONTRACTOR_PLACEHOLDERS) {
      if (lower.contains(placeholder)) {
        return null;
      }
    }
    return nameKey(contractor);
  }
}
