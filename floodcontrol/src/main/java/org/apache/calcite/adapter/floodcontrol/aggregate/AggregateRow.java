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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable result of folding one group of records.
 *
 * <p>Carries the group key, the number of records folded into it and an
 * insertion-ordered map of metric name to value. A metric value is null when
 * its definition is undefined for the group (for example a percent change
 * against a zero baseline).
 *
 * <h3>Usage Example</h3>
 * <pre>{@code
 * AggregateRow row = AggregateRow.builder(GroupKey.of("NCR", "Luzon"), group.size())
 *     .metric("TotalBudget", Aggregations.sum(group, ProjectRecord::getApprovedBudget))
 *     .metric("MedianSavings", Aggregations.median(group, ProjectRecord::getCostSavings))
 *     .build();
 * }</pre>
 */
public final class AggregateRow {

  private final GroupKey key;
  private final int count;
  private final Map<String, Double> metrics;

  private AggregateRow(Builder builder) {
    this.key = builder.key;
    this.count = builder.count;
    this.metrics = Collections.unmodifiableMap(new LinkedHashMap<String, Double>(builder.metrics));
  }

  public GroupKey getKey() {
    return key;
  }

  /**
   * Returns the number of records folded into this row.
   */
  public int getCount() {
    return count;
  }

  /**
   * Returns all metrics in insertion order. Values may be null.
   */
  public Map<String, Double> getMetrics() {
    return metrics;
  }

  public boolean hasMetric(String name) {
    return metrics.containsKey(name);
  }

  /**
   * Returns a metric value, or null if it is undefined.
   *
   * @throws IllegalArgumentException if the row has no metric of that name
   */
  public @Nullable Double get(String name) {
    if (!metrics.containsKey(name)) {
      throw new IllegalArgumentException("Unknown metric '" + name + "' for group " + key);
    }
    return metrics.get(name);
  }

  /**
   * Returns a metric value that is known to be defined.
   *
   * @throws IllegalStateException if the metric is undefined
   */
  public double getDouble(String name) {
    Double value = get(name);
    if (value == null) {
      throw new IllegalStateException("Metric '" + name + "' is undefined for group " + key);
    }
    return value;
  }

  /**
   * Returns a copy of this row with one metric added or replaced.
   */
  public AggregateRow with(String name, @Nullable Double value) {
    Builder builder = builder(key, count);
    builder.metrics.putAll(metrics);
    builder.metric(name, value);
    return builder.build();
  }

  public static Builder builder(GroupKey key, int count) {
    return new Builder(key, count);
  }

  @Override public String toString() {
    return "AggregateRow{key=" + key + ", count=" + count + ", metrics=" + metrics + "}";
  }

  /**
   * Builder for AggregateRow.
   */
  public static final class Builder {
    private final GroupKey key;
    private final int count;
    private final Map<String, Double> metrics = new LinkedHashMap<String, Double>();

    private Builder(GroupKey key, int count) {
      this.key = key;
      this.count = count;
    }

    public Builder metric(String name, @Nullable Double value) {
      metrics.put(name, value);
      return this;
    }

    public AggregateRow build() {
      return new AggregateRow(this);
    }
  }
}
