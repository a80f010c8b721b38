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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

/**
 * Tests for {@link Aggregations}.
 */
@Tag("unit")
public class AggregationsTest {

  @Test void testSumIsLeftToRight() {
    // 0.1 + 0.2 + 0.3 accumulated in order differs from 0.3 + 0.2 + 0.1
    assertEquals(((0.1 + 0.2) + 0.3), Aggregations.sum(new double[] {0.1, 0.2, 0.3}));
    assertEquals(((0.3 + 0.2) + 0.1), Aggregations.sum(new double[] {0.3, 0.2, 0.1}));
    assertEquals(0.0, Aggregations.sum(new double[0]));
  }

  @Test void testMean() {
    assertEquals(2.0, Aggregations.mean(new double[] {1, 2, 3}));
    assertNull(Aggregations.mean(new double[0]));
  }

  @Test void testMedianOddAndEven() {
    assertEquals(2.0, Aggregations.median(new double[] {3, 1, 2}));
    assertEquals(2.5, Aggregations.median(new double[] {4, 1, 3, 2}));
    assertEquals(-5.0, Aggregations.median(new double[] {-5}));
    assertNull(Aggregations.median(new double[0]));
  }

  @Test void testMedianDoesNotReorderInput() {
    double[] values = {3, 1, 2};
    Aggregations.median(values);
    assertArrayEquals(new double[] {3, 1, 2}, values);
  }

  @Test void testPercentage() {
    assertEquals(50.0, Aggregations.percentage(d -> d > 30, new double[] {10, 31, 30, 45}));
    assertEquals(0.0, Aggregations.percentage(d -> d > 30, new double[0]));
  }

  @Test void testPercentageOverProjectedField() {
    List<String> words = Arrays.asList("a", "bb", "ccc", "dddd");
    assertEquals(25.0, Aggregations.percentage(d -> d >= 4, words, String::length));
  }

  @Test void testCappedRatio() {
    assertEquals(100.0, Aggregations.cappedRatio(150.0, null, 100.0));
    assertEquals(-40.0, Aggregations.cappedRatio(-40.0, null, 100.0));
    assertEquals(0.0, Aggregations.cappedRatio(-1.0, 0.0, 100.0));
    assertEquals(7.0, Aggregations.cappedRatio(7.0, null, null));
  }

  @Test void testPercentChange() {
    assertEquals(50.0, Aggregations.percentChange(150.0, 100.0));
    assertEquals(-50.0, Aggregations.percentChange(50.0, 100.0));
    // negative baseline divides by its magnitude
    assertEquals(200.0, Aggregations.percentChange(100.0, -100.0));
    assertNull(Aggregations.percentChange(10.0, 0.0));
    assertNull(Aggregations.percentChange(null, 10.0));
    assertNull(Aggregations.percentChange(10.0, null));
  }
}
