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

import it.unimi.dsi.fastutil.ints.IntArrayList;
import java.util.List;
import jsinterop.annotations.JsIgnore;
import jsinterop.annotations.JsType;

/** A collection of polygons whose interiors are pairwise disjoint. */
@JsType
public strictfp class MultiPolygon extends MultiSurface<Polygon> {
  /** Constructs an empty MultiPolygon. */
  public MultiPolygon() {
    this(SpatialReference.DEFAULT, Tolerance.DEFAULT);
  }

  @JsIgnore
  public MultiPolygon(SpatialReference reference, Tolerance tolerance) {
    super(reference, tolerance);
  }

  /**
   * Constructs a MultiPolygon of copies of the given polygons.
   *
   * @throws GeometryException with code OVERLAPPING_GEOMETRY if two of the polygons overlap
   */
  @JsIgnore
  public MultiPolygon(List<? extends Polygon> polygons) {
    this(polygons, SpatialReference.DEFAULT, Tolerance.DEFAULT);
  }

  @JsIgnore
  public MultiPolygon(
      List<? extends Polygon> polygons, SpatialReference reference, Tolerance tolerance) {
    super(polygons, reference, tolerance);
  }

  @Override
  public String getGeometryType() {
    return "MULTIPOLYGON";
  }

  /**
   * Adds a copy of the polygon.
   *
   * @throws GeometryException with code OVERLAPPING_GEOMETRY if its interior overlaps the interior
   *     of an existing member
   */
  public void addPolygon(Polygon polygon) {
    add(polygon);
  }

  /**
   * Returns the 1-based indices of the members that share a stretch of boundary with the n-th
   * member, in increasing order. Members that meet only at isolated points are not adjacent.
   *
   * @throws GeometryException with code INDEX_OUT_OF_RANGE if n is not in [1, numGeometries()]
   */
  public int[] findAdjacentPolygons(int n) {
    if (n < 1 || n > numGeometries()) {
      throw new GeometryException(
          GeometryError.Code.INDEX_OUT_OF_RANGE,
          "Polygon index %d is outside [1, %d]",
          n,
          numGeometries());
    }
    List<Polygon> polygons = geometryList();
    Polygon polygon = polygons.get(n - 1);
    IntArrayList result = new IntArrayList();
    for (int i = 0; i < polygons.size(); i++) {
      if (i != n - 1 && shareBoundary(polygon, polygons.get(i))) {
        result.add(i + 1);
      }
    }
    return result.toIntArray();
  }

  private boolean shareBoundary(Polygon a, Polygon b) {
    if (a.isEmpty()
        || b.isEmpty()
        || !a.getEnvelope().intersects(b.getEnvelope(), tolerance())) {
      return false;
    }
    for (List<Point> ringA : a.ringCoordinates()) {
      for (List<Point> ringB : b.ringCoordinates()) {
        for (int i = 0; i + 1 < ringA.size(); i++) {
          for (int j = 0; j + 1 < ringB.size(); j++) {
            List<Point> meets =
                PlanarAlgorithms.segmentIntersections(
                    ringA.get(i), ringA.get(i + 1), ringB.get(j), ringB.get(j + 1), tolerance());
            // Two meeting points mean the segments overlap along a stretch.
            if (meets.size() > 1) {
              return true;
            }
          }
        }
      }
    }
    return false;
  }

  @Override
  protected MultiPolygon newInstance() {
    return new MultiPolygon(getSpatialReference(), tolerance());
  }

  @Override
  public MultiPolygon copy() {
    return (MultiPolygon) super.copy();
  }
}
