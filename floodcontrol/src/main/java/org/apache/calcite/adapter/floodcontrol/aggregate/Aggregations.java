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

import java.util.Arrays;
import java.util.List;
import java.util.function.DoublePredicate;
import java.util.function.ToDoubleFunction;

/**
 * Numeric reduction primitives used by every report.
 *
 * <p>Each primitive has a fixed contract so that independent implementations
 * of the same reports produce identical numbers:
 * <ul>
 *   <li>{@link #sum} accumulates strictly left to right in input order</li>
 *   <li>{@link #mean} and {@link #median} are undefined (null) for an empty input</li>
 *   <li>{@link #percentage} is 0 for an empty input</li>
 *   <li>{@link #percentChange} is undefined (null) for a zero baseline</li>
 * </ul>
 *
 * <p>Nothing here rounds. Rounding happens once, at serialization, in
 * {@link Decimals}.
 */
public final class Aggregations {

  private Aggregations() {
  }

  /**
   * Sums values in iteration order.
   */
  public static double sum(double[] values) {
    double total = 0.0;
    for (double value : values) {
      total += value;
    }
    return total;
  }

  /**
   * Sums a projected field over items in iteration order.
   */
  public static <T> double sum(List<T> items, ToDoubleFunction<? super T> field) {
    double total = 0.0;
    for (T item : items) {
      total += field.applyAsDouble(item);
    }
    return total;
  }

  /**
   * Returns the arithmetic mean, or null when there are no values.
   */
  public static @Nullable Double mean(double[] values) {
    if (values.length == 0) {
      return null;
    }
    return sum(values) / values.length;
  }

  /**
   * Returns the mean of a projected field, or null when there are no items.
   */
  public static <T> @Nullable Double mean(List<T> items, ToDoubleFunction<? super T> field) {
    if (items.isEmpty()) {
      return null;
    }
    return sum(items, field) / items.size();
  }

  /**
   * Returns the median: the middle element for an odd count, the average of
   * the two middle elements for an even count, null when empty.
   *
   * <p>The input array is not modified.
   */
  public static @Nullable Double median(double[] values) {
    int n = values.length;
    if (n == 0) {
      return null;
    }
    double[] sorted = Arrays.copyOf(values, n);
    Arrays.sort(sorted);
    if (n % 2 == 1) {
      return sorted[n / 2];
    }
    return (sorted[n / 2 - 1] + sorted[n / 2]) / 2.0;
  }

  /**
   * Returns the median of a projected field.
   */
  public static <T> @Nullable Double median(List<T> items, ToDoubleFunction<? super T> field) {
    return median(project(items, field));
  }

  /**
   * Returns 100 × (values matching the predicate) / (all values), or 0 when
   * there are no values.
   */
  public static double percentage(DoublePredicate predicate, double[] values) {
    if (values.length == 0) {
      return 0.0;
    }
    int matches = 0;
    for (double value : values) {
      if (predicate.test(value)) {
        matches++;
      }
    }
    return 100.0 * matches / values.length;
  }

  /**
   * Returns the percentage of items whose projected field matches the predicate.
   */
  public static <T> double percentage(DoublePredicate predicate, List<T> items,
      ToDoubleFunction<? super T> field) {
    return percentage(predicate, project(items, field));
  }

  /**
   * Clamps a value into [lo, hi]. A null bound leaves that side open.
   */
  public static double cappedRatio(double x, @Nullable Double lo, @Nullable Double hi) {
    double result = x;
    if (hi != null && result > hi) {
      result = hi;
    }
    if (lo != null && result < lo) {
      result = lo;
    }
    return result;
  }

  /**
   * Returns 100 × (current − baseline) / |baseline|.
   *
   * @return the change, or null when the baseline is zero or either side is
   *     undefined
   */
  public static @Nullable Double percentChange(@Nullable Double current,
      @Nullable Double baseline) {
    if (current == null || baseline == null || baseline == 0.0) {
      return null;
    }
    return 100.0 * (current - baseline) / Math.abs(baseline);
  }

  /**
   * Projects a field of each item into an array, preserving order.
   */
  public static <T> double[] project(List<T> items, ToDoubleFunction<? super T> field) {
    double[] values = new double[items.size()];
    for (int i = 0; i < values.length; i++) {
      values[i] = field.applyAsDouble(items.get(i));
    }
    return values;
  }
}
