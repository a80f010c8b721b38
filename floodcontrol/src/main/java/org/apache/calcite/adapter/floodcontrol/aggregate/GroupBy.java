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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Order-preserving group-by.
 *
 * <p>Groups appear in the order of their first member, and members keep the
 * order they had in the input. Later sums over a group therefore accumulate
 * in source-row order.
 */
public final class GroupBy {

  private GroupBy() {
  }

  /**
   * Partitions items by key.
   *
   * @param items Items in input order
   * @param keyFunction Extracts the group key of an item
   * @return Unmodifiable map of key to members, in first-occurrence order
   */
  public static <T> Map<GroupKey, List<T>> group(List<T> items,
      Function<? super T, GroupKey> keyFunction) {
    Map<GroupKey, List<T>> groups = new LinkedHashMap<GroupKey, List<T>>();
    for (T item : items) {
      GroupKey key = keyFunction.apply(item);
      List<T> members = groups.get(key);
      if (members == null) {
        members = new ArrayList<T>();
        groups.put(key, members);
      }
      members.add(item);
    }
    Map<GroupKey, List<T>> frozen = new LinkedHashMap<GroupKey, List<T>>();
    for (Map.Entry<GroupKey, List<T>> e : groups.entrySet()) {
      frozen.put(e.getKey(), Collections.unmodifiableList(e.getValue()));
    }
    return Collections.unmodifiableMap(frozen);
  }

  /**
   * Groups items and folds every group into an {@link AggregateRow}.
   *
   * @return Aggregate rows in first-occurrence order of their keys
   */
  public static <T> List<AggregateRow> aggregate(List<T> items,
      Function<? super T, GroupKey> keyFunction, GroupReducer<T> reducer) {
    List<AggregateRow> rows = new ArrayList<AggregateRow>();
    for (Map.Entry<GroupKey, List<T>> e : group(items, keyFunction).entrySet()) {
      rows.add(reducer.reduce(e.getKey(), e.getValue()));
    }
    return rows;
  }

  /**
   * Folds the members of one group into an aggregate row.
   *
   * @param <T> Record type
   */
  @FunctionalInterface
  public interface GroupReducer<T> {
    AggregateRow reduce(GroupKey key, List<T> members);
  }
}
