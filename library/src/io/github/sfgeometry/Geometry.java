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

/**
 * The root of the Simple Features type hierarchy. Every geometry carries a {@link
 * SpatialReference} and a {@link Tolerance}, both of which propagate to copies and to derived
 * geometries such as boundaries.
 *
 * <p>Geometries are either immutable ({@link Point}) or expose explicit mutators that validate
 * before changing state. Containers never share mutable state with callers: values are copied on
 * insert and on retrieval.
 */
public interface Geometry {
  /** Returns the upper-case OGC type name, e.g. "POINT" or "MULTIPOLYGON". */
  String getGeometryType();

  /**
   * Returns the topological dimension: 0 for points, 1 for curves, 2 for surfaces. For
   * collections this is the largest member dimension, or -1 for an empty collection.
   */
  int dimension();

  /** Returns the number of ordinates per coordinate: 2, plus one each for z and m. */
  default int coordinateDimension() {
    return 2 + (is3D() ? 1 : 0) + (isMeasured() ? 1 : 0);
  }

  /** Returns true if this geometry has no points. */
  boolean isEmpty();

  /** Returns true if this geometry has no anomalous points such as self-intersections. */
  boolean isSimple();

  /** Returns true if this geometry has z coordinates. */
  boolean is3D();

  /** Returns true if this geometry has m coordinates. */
  boolean isMeasured();

  SpatialReference getSpatialReference();

  /** Returns the SRID of this geometry's spatial reference. */
  default int getSRID() {
    return getSpatialReference().srid();
  }

  /** Returns the coordinate system of this geometry's spatial reference. */
  default CoordinateSystem getCoordinateSystem() {
    return getSpatialReference().coordinateSystem();
  }

  /** Returns the tolerance this geometry uses for coordinate comparisons. */
  Tolerance tolerance();

  /** Returns a new bounding box of this geometry, which is empty if the geometry is. */
  Envelope getEnvelope();

  /** Returns the combinatorial boundary of this geometry. */
  Geometry boundary();

  /**
   * Returns true if the given point lies in the interior or on the boundary of this geometry,
   * within this geometry's tolerance.
   */
  boolean contains(Point point);

  /**
   * Returns true if this geometry has the same type and the same coordinates as {@code other}, in
   * the same order, within this geometry's tolerance.
   */
  boolean approxEquals(Geometry other);

  /**
   * Returns a deep copy of this geometry that shares no mutable state with it. Immutable
   * geometries may return themselves.
   */
  Geometry copy();

  /** Returns the Well-Known Text form of this geometry. */
  default String asText() {
    return WktWriter.write(this);
  }
}
