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
package org.apache.calcite.adapter.floodcontrol.aggregate;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.Locale;

/**
 * Serialization-time rounding and number formatting.
 *
 * <p>Values are converted through their shortest decimal representation
 * ({@link Double#toString(double)}) and rounded half away from zero to two
 * places. Null, NaN and infinite values have no rounded form.
 */
public final class Decimals {

  /** Number of fractional digits in every output value. */
  public static final int SCALE = 2;

  private static final DecimalFormatSymbols SYMBOLS = DecimalFormatSymbols.getInstance(Locale.US);

  private Decimals() {
  }

  /**
   * Rounds to two decimals, half away from zero.
   *
   * @return the rounded value, or null if the input is null or not finite
   */
  public static @Nullable BigDecimal round2(@Nullable Double value) {
    if (value == null || value.isNaN() || value.isInfinite()) {
      return null;
    }
    return new BigDecimal(Double.toString(value)).setScale(SCALE, RoundingMode.HALF_UP);
  }

  /**
   * Formats a value for the canonical output files: plain digits, two
   * decimals, no grouping. Undefined values become the empty string.
   */
  public static String plain(@Nullable Double value) {
    BigDecimal rounded = round2(value);
    return rounded == null ? "" : rounded.toPlainString();
  }

  /**
   * Formats a value for human-readable tables, with thousands separators.
   * Undefined values become {@code "-"}.
   */
  public static String grouped(@Nullable Double value) {
    BigDecimal rounded = round2(value);
    if (rounded == null) {
      return "-";
    }
    // DecimalFormat is not thread-safe
    DecimalFormat format = new DecimalFormat("#,##0.00", SYMBOLS);
    format.setRoundingMode(RoundingMode.HALF_UP);
    return format.format(rounded);
  }
}
