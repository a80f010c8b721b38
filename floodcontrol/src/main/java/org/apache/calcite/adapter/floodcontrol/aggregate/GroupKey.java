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

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Tuple of grouping values, such as (Region, MainIsland) or
 * (FundingYear, TypeOfWork).
 *
 * <p>Keys compare by value, so two records with equal components fold into
 * the same group.
 */
public final class GroupKey {

  private final ImmutableList<Object> values;

  private GroupKey(ImmutableList<Object> values) {
    this.values = values;
  }

  /**
   * Creates a key from its components. Components must be non-null.
   */
  public static GroupKey of(Object... values) {
    return new GroupKey(ImmutableList.copyOf(values));
  }

  public List<Object> getValues() {
    return values;
  }

  public int size() {
    return values.size();
  }

  public Object get(int index) {
    return values.get(index);
  }

  /**
   * Returns a component as a string.
   */
  public String getString(int index) {
    return String.valueOf(values.get(index));
  }

  /**
   * Returns a component as an int. The component must be a number.
   */
  public int getInt(int index) {
    return ((Number) values.get(index)).intValue();
  }

  @Override public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    return o instanceof GroupKey && values.equals(((GroupKey) o).values);
  }

  @Override public int hashCode() {
    return values.hashCode();
  }

  @Override public String toString() {
    return values.toString();
  }
}
