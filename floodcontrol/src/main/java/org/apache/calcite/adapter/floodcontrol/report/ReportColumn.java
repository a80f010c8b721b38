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

import org.apache.calcite.adapter.floodcontrol.aggregate.AggregateRow;
import org.apache.calcite.adapter.floodcontrol.aggregate.Decimals;

import java.util.function.Function;

/**
 * One output column of a report: a header name and how to render a cell
 * from an {@link AggregateRow}.
 *
 * <p>Canonical cells are what the CSV files contain. Display cells are for
 * the human-readable tables and may use thousands separators.
 */
public final class ReportColumn {

  /**
   * Kind of value in a column; decides alignment in display tables.
   */
  public enum Kind {
    TEXT, INTEGER, DECIMAL
  }

  private final String name;
  private final Kind kind;
  private final Function<AggregateRow, String> canonical;
  private final Function<AggregateRow, String> display;

  private ReportColumn(String name, Kind kind, Function<AggregateRow, String> canonical,
      Function<AggregateRow, String> display) {
    this.name = name;
    this.kind = kind;
    this.canonical = canonical;
    this.display = display;
  }

  /**
   * Column showing a text component of the group key.
   */
  public static ReportColumn keyText(String name, int keyIndex) {
    Function<AggregateRow, String> f = row -> row.getKey().getString(keyIndex);
    return new ReportColumn(name, Kind.TEXT, f, f);
  }

  /**
   * Column showing an integer component of the group key, such as a year.
   */
  public static ReportColumn keyInteger(String name, int keyIndex) {
    Function<AggregateRow, String> f = row -> Integer.toString(row.getKey().getInt(keyIndex));
    return new ReportColumn(name, Kind.INTEGER, f, f);
  }

  /**
   * Column showing the number of records in the group.
   */
  public static ReportColumn count(String name) {
    Function<AggregateRow, String> f = row -> Integer.toString(row.getCount());
    return new ReportColumn(name, Kind.INTEGER, f, f);
  }

  /**
   * Column showing a metric that holds a whole number, such as a rank.
   */
  public static ReportColumn integerMetric(String name) {
    Function<AggregateRow, String> f = row -> {
      Double value = row.get(name);
      return value == null ? "" : Long.toString(value.longValue());
    };
    return new ReportColumn(name, Kind.INTEGER, f, f);
  }

  /**
   * Column showing a metric rounded to two decimals. Undefined values are
   * empty in canonical output.
   */
  public static ReportColumn decimal(String name) {
    return new ReportColumn(name, Kind.DECIMAL,
        row -> Decimals.plain(row.get(name)),
        row -> Decimals.grouped(row.get(name)));
  }

  /**
   * Column whose text is computed from the whole row.
   */
  public static ReportColumn derived(String name, Function<AggregateRow, String> f) {
    return new ReportColumn(name, Kind.TEXT, f, f);
  }

  public String getName() {
    return name;
  }

  public Kind getKind() {
    return kind;
  }

  public String canonical(AggregateRow row) {
    return canonical.apply(row);
  }

  public String display(AggregateRow row) {
    return display.apply(row);
  }

  @Override public String toString() {
    return "ReportColumn{" + name + ", " + kind + "}";
  }
}
