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

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Outcome of checking one raw row at load time.
 *
 * <p>A row is either accepted or rejected with a {@link RejectReason} and a
 * message naming the offending column and value.
 *
 * <h3>Usage Example</h3>
 * <pre>{@code
 * RowCheck check = loader.check(record);
 * if (!check.isAccepted()) {
 *   LOGGER.warn("Row {} rejected ({}): {}", record.getRowNumber(),
 *       check.getReason(), check.getMessage());
 * }
 * }</pre>
 */
public final class RowCheck {

  private static final RowCheck ACCEPTED = new RowCheck(null, null);

  private final @Nullable RejectReason reason;
  private final @Nullable String message;

  private RowCheck(@Nullable RejectReason reason, @Nullable String message) {
    this.reason = reason;
    this.message = message;
  }

  /**
   * Returns the shared accepted result.
   */
  public static RowCheck accepted() {
    return ACCEPTED;
  }

  /**
   * Returns a rejection.
   *
   * @param reason Reason code
   * @param message Description of the offending value
   */
  public static RowCheck reject(RejectReason reason, String message) {
    return new RowCheck(reason, message);
  }

  public boolean isAccepted() {
    return reason == null;
  }

  /**
   * Returns the reason code, or null for an accepted row.
   */
  public @Nullable RejectReason getReason() {
    return reason;
  }

  /**
   * Returns the rejection message, or null for an accepted row.
   */
  public @Nullable String getMessage() {
    return message;
  }

  @Override public String toString() {
    if (reason == null) {
      return "RowCheck{ACCEPTED}";
    }
    return "RowCheck{" + reason + ", message='" + message + "'}";
  }
}
