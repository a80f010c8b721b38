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

import org.checkerframework.checker.nullness.qual.Nullable;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.List;
import java.util.Locale;

/**
 * Text-to-value conversions for dataset cells.
 *
 * <p>All parsers return null instead of throwing, so that callers can turn a
 * failure into a row-level rejection.
 */
public final class FieldParsers {

  /**
   * Accepted date layouts, tried in order. ISO comes first so an ISO value is
   * never reinterpreted; day-first precedes month-first for slash dates.
   */
  static final List<String> DATE_PATTERNS = ImmutableList.of(
      "uuuu-MM-dd",
      "d/M/uuuu",
      "M/d/uuuu",
      "d-MMM-uu",
      "MMM d, uuuu",
      "MMMM d, uuuu");

  private static final List<DateTimeFormatter> DATE_FORMATTERS = buildFormatters();

  private FieldParsers() {
  }

  private static List<DateTimeFormatter> buildFormatters() {
    ImmutableList.Builder<DateTimeFormatter> builder = ImmutableList.builder();
    for (String pattern : DATE_PATTERNS) {
      builder.add(new DateTimeFormatterBuilder()
          .parseCaseInsensitive()
          .appendPattern(pattern)
          .toFormatter(Locale.ENGLISH)
          .withResolverStyle(ResolverStyle.STRICT));
    }
    return builder.build();
  }

  /**
   * Parses a currency amount, ignoring thousands separators.
   *
   * @return the amount, or null if blank or not a finite number
   */
  public static @Nullable Double parseCurrency(String text) {
    String cleaned = text.trim().replace(",", "");
    if (cleaned.isEmpty()) {
      return null;
    }
    try {
      double value = Double.parseDouble(cleaned);
      if (Double.isNaN(value) || Double.isInfinite(value)) {
        return null;
      }
      return value;
    } catch (NumberFormatException e) {
      return null;
    }
  }

  /**
   * Parses a decimal-degree coordinate.
   *
   * @return the coordinate, or null if blank, not a number or outside
   *     [-limit, limit]
   */
  public static @Nullable Double parseCoordinate(String text, double limit) {
    String cleaned = text.trim();
    if (cleaned.isEmpty()) {
      return null;
    }
    try {
      double value = Double.parseDouble(cleaned);
      if (Double.isNaN(value) || value < -limit || value > limit) {
        return null;
      }
      return value;
    } catch (NumberFormatException e) {
      return null;
    }
  }

  /**
   * Parses an integer such as a funding year.
   *
   * @return the value, or null if blank or not an integer
   */
  public static @Nullable Integer parseInt(String text) {
    String cleaned = text.trim();
    if (cleaned.isEmpty()) {
      return null;
    }
    try {
      return Integer.parseInt(cleaned);
    } catch (NumberFormatException e) {
      return null;
    }
  }

  /**
   * Parses a calendar date using the first matching layout.
   *
   * @return the date, or null if blank or no layout matches
   */
  public static @Nullable LocalDate parseDate(String text) {
    String cleaned = text.trim();
    if (cleaned.isEmpty()) {
      return null;
    }
    for (DateTimeFormatter formatter : DATE_FORMATTERS) {
      try {
        return LocalDate.parse(cleaned, formatter);
      } catch (DateTimeParseException e) {
        // try the next layout
      }
    }
    return null;
  }
}
