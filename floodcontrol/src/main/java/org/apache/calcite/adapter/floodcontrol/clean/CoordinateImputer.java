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

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fills missing coordinates with the mean coordinates of the same province.
 *
 * <p>Runs in two passes over an explicit intermediate map:
 * <ol>
 *   <li>{@link #computeCentroids} sums, per province and in input order, every
 *       latitude and every longitude present in the input. Latitude and
 *       longitude are counted separately, so a row that knows only one of
 *       them still contributes that one.</li>
 *   <li>{@link #impute} fills each missing coordinate with the province mean
 *       for that coordinate. A coordinate that is present is never
 *       replaced.</li>
 * </ol>
 *
 * <p>Centroids are fixed before any row is filled, so imputed values never
 * feed other imputations and the result does not depend on row order. A row
 * missing a coordinate for which its province has no known values is
 * dropped.
 */
public class CoordinateImputer {

  private static final Logger LOGGER = LoggerFactory.getLogger(CoordinateImputer.class);

  /**
   * Pass 1: builds per-province coordinate sums from the coordinates present
   * in the input.
   *
   * @return Unmodifiable map of province to centroid, in first-seen order
   */
  public Map<String, ProvinceCentroid> computeCentroids(List<ProjectRecord.Builder> rows) {
    Map<String, ProvinceCentroid> centroids = new LinkedHashMap<String, ProvinceCentroid>();
    for (ProjectRecord.Builder row : rows) {
      Double latitude = row.getLatitude();
      Double longitude = row.getLongitude();
      if (latitude == null && longitude == null) {
        continue;
      }
      ProvinceCentroid centroid = centroids.get(row.getProvince());
      if (centroid == null) {
        centroid = new ProvinceCentroid();
        centroids.put(row.getProvince(), centroid);
      }
      if (latitude != null) {
        centroid.addLatitude(latitude);
      }
      if (longitude != null) {
        centroid.addLongitude(longitude);
      }
    }
    LOGGER.debug("Computed coordinate centroids for {} provinces", centroids.size());
    return Collections.unmodifiableMap(centroids);
  }

  /**
   * Pass 2: fills missing coordinates from the centroids.
   *
   * @param rows Rows in input order; rows with both coordinates pass through
   * @param centroids Result of {@link #computeCentroids}
   * @param drops Receives rows that cannot be imputed
   * @return Surviving rows, in input order
   */
  public List<ProjectRecord.Builder> impute(List<ProjectRecord.Builder> rows,
      Map<String, ProvinceCentroid> centroids, List<CleanResult.Drop> drops) {
    List<ProjectRecord.Builder> survivors = new ArrayList<ProjectRecord.Builder>(rows.size());
    for (ProjectRecord.Builder row : rows) {
      if (row.hasCoordinates()) {
        survivors.add(row);
        continue;
      }
      ProvinceCentroid centroid = centroids.get(row.getProvince());
      Double latitude = row.getLatitude();
      Double longitude = row.getLongitude();
      if (latitude == null) {
        latitude = centroid == null ? null : centroid.getMeanLatitude();
      }
      if (longitude == null) {
        longitude = centroid == null ? null : centroid.getMeanLongitude();
      }
      if (latitude == null || longitude == null) {
        String message = "No known " + (latitude == null ? "latitude" : "longitude")
            + " in province '" + row.getProvince() + "'";
        LOGGER.warn("Row {} dropped ({}): {}", row.getRowNumber(),
            DropReason.NO_COORDINATE_FALLBACK, message);
        drops.add(new CleanResult.Drop(row.getRowNumber(), DropReason.NO_COORDINATE_FALLBACK,
            message));
        continue;
      }
      row.latitude(latitude)
          .longitude(longitude)
          .coordinatesImputed(true);
      survivors.add(row);
    }
    return survivors;
  }

  /**
   * Running coordinate sums for one province. Latitude and longitude keep
   * their own counts.
   */
  public static final class ProvinceCentroid {
    private double latitudeSum;
    private int latitudeCount;
    private double longitudeSum;
    private int longitudeCount;

    void addLatitude(double latitude) {
      latitudeSum += latitude;
      latitudeCount++;
    }

    void addLongitude(double longitude) {
      longitudeSum += longitude;
      longitudeCount++;
    }

    public int getLatitudeCount() {
      return latitudeCount;
    }

    public int getLongitudeCount() {
      return longitudeCount;
    }

    /**
     * Returns the mean known latitude, or null if the province has none.
     */
    public @Nullable Double getMeanLatitude() {
      return latitudeCount == 0 ? null : latitudeSum / latitudeCount;
    }

    /**
     * Returns the mean known longitude, or null if the province has none.
     */
    public @Nullable Double getMeanLongitude() {
      return longitudeCount == 0 ? null : longitudeSum / longitudeCount;
    }

    @Override public String toString() {
      return "ProvinceCentroid{lat=" + getMeanLatitude() + " (" + latitudeCount + ")"
          + ", lon=" + getMeanLongitude() + " (" + longitudeCount + ")}";
    }
  }
}
