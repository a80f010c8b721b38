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

/**
 * Why the cleaner removed a loaded row.
 */
public enum DropReason {
  /** A field failed type coercion, or a budget or cost is negative. */
  INVALID_FIELD(true),
  /** Funding year outside 2021–2023. Expected filtering, not an error. */
  YEAR_OUT_OF_RANGE(false),
  /** Coordinates missing and no row in the province has any. */
  NO_COORDINATE_FALLBACK(true);

  private final boolean error;

  DropReason(boolean error) {
    this.error = error;
  }

  /**
   * Returns whether this drop indicates bad data rather than filtering.
   */
  public boolean isError() {
    return error;
  }
}
