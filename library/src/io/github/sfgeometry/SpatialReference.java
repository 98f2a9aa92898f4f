/*
 * Copyright 2026 Google Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.github.sfgeometry;

import com.google.common.base.Objects;
import com.google.common.base.Preconditions;
import com.google.errorprone.annotations.Immutable;
import jsinterop.annotations.JsType;

/**
 * An opaque spatial reference tag: an integer SRID and a {@link CoordinateSystem}. Geometries carry
 * a SpatialReference and propagate it to copies and to the results of operations, but nothing in
 * this package interprets the SRID.
 */
@Immutable
@JsType
public final class SpatialReference {
  /** SRID 0 in a 2D cartesian coordinate system. */
  public static final SpatialReference DEFAULT =
      new SpatialReference(0, CoordinateSystem.CARTESIAN_2D);

  /** EPSG:4326, longitude/latitude on WGS 84. */
  public static final SpatialReference WGS84 =
      new SpatialReference(4326, CoordinateSystem.GEOGRAPHIC_2D);

  private final int srid;
  private final CoordinateSystem coordinateSystem;

  public SpatialReference(int srid, CoordinateSystem coordinateSystem) {
    this.srid = srid;
    this.coordinateSystem = Preconditions.checkNotNull(coordinateSystem);
  }

  public int srid() {
    return srid;
  }

  public CoordinateSystem coordinateSystem() {
    return coordinateSystem;
  }

  /** Returns this reference with the coordinate system switched to the given dimensionality. */
  public SpatialReference withDimension(boolean threeDimensional) {
    CoordinateSystem cs = coordinateSystem.withDimension(threeDimensional);
    return cs == coordinateSystem ? this : new SpatialReference(srid, cs);
  }

  @Override
  public boolean equals(Object other) {
    if (!(other instanceof SpatialReference)) {
      return false;
    }
    SpatialReference that = (SpatialReference) other;
    return srid == that.srid && coordinateSystem == that.coordinateSystem;
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(srid, coordinateSystem);
  }

  @Override
  public String toString() {
    return "SRID=" + srid + " " + coordinateSystem;
  }
}
