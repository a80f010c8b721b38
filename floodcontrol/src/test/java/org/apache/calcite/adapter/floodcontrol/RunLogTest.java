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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

/**
 * Tests for {@link RunLog}.
 */
@Tag("unit")
public class RunLogTest {

  @Test void testRenderAndMerge() {
    RunLog log = new RunLog();
    log.row("load", 4, "MALFORMED_DATE", "StartDate is not a date: 'soon'");

    RunLog reportLog = new RunLog();
    reportLog.computation("Report2", "ZERO_TOTAL_COST", "Contractor [Free] has zero total cost");
    log.merge(reportLog);

    assertEquals(2, log.size());
    assertNull(log.getEntries().get(1).getRowNumber());
    assertEquals("[load] row 4 MALFORMED_DATE: StartDate is not a date: 'soon'\n"
        + "[Report2] ZERO_TOTAL_COST: Contractor [Free] has zero total cost\n", log.render());
  }

  @Test void testEmptyLogRendersNothing() {
    assertEquals("", new RunLog().render());
  }
}
