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
import org.apache.calcite.adapter.floodcontrol.clean.ProjectRecord;

import java.util.List;

/**
 * Builds one report from the cleaned record set.
 *
 * <p>Implementations must not modify the records, so several builders can
 * read the same list at once.
 */
public interface ReportBuilder {

  /**
   * Returns the report file base name, such as {@code Report1}.
   */
  String getName();

  /**
   * Computes the report.
   *
   * @param records Cleaned records in source order (read-only)
   * @param runLog Receives policy decisions such as zero-division fallbacks
   * @return The ordered report
   */
  ReportTable build(List<ProjectRecord> records, RunLog runLog);
}
