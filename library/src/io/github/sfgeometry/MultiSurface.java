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

import java.util.List;
import jsinterop.annotations.JsIgnore;
import jsinterop.annotations.JsType;

/**
 * A collection of surfaces whose interiors are pairwise disjoint. Members may touch along their
 * boundaries. A surface whose interior overlaps an existing member is rejected when added.
 *
 * @param <T> the type of the member surfaces
 */
@JsType
public strictfp class MultiSurface<T extends Surface> extends GeometryCollection<T> {
  /** Constructs an empty MultiSurface. */
  public MultiSurface() {
    this(SpatialReference.DEFAULT, Tolerance.DEFAULT);
  }

  @JsIgnore
  public MultiSurface(SpatialReference reference, Tolerance tolerance) {
    super(reference, tolerance);
  }

  @JsIgnore
  public MultiSurface(
      List<? extends T> surfaces, SpatialReference reference, Tolerance tolerance) {
    super(surfaces, reference, tolerance);
  }

  @Override
  public String getGeometryType() {
    return "MULTISURFACE";
  }

  /** Adds a copy of the surface. */
  public void addSurface(T surface) {
    add(surface);
  }

  /**
   * Rejects surfaces whose interior overlaps the interior of an existing member, with code
   * OVERLAPPING_GEOMETRY.
   */
  @Override
  protected boolean findMemberError(T surface, GeometryError error) {
    if (super.findMemberError(surface, error)) {
      return true;
    }
    List<T> members = geometryList();
    for (int i = 0; i < members.size(); i++) {
      if (interiorsIntersect(members.get(i), surface)) {
        error.init(
            GeometryError.Code.OVERLAPPING_GEOMETRY,
            "Surface overlaps the interior of member %d",
            i + 1);
        return true;
      }
    }
    return false;
  }

  private boolean interiorsIntersect(Surface a, Surface b) {
    for (Polygon p : GeometryComponents.polygons(a)) {
      for (Polygon q : GeometryComponents.polygons(b)) {
        if (PolygonOverlay.interiorsIntersect(p, q, tolerance())) {
          return true;
        }
      }
    }
    return false;
  }

  /** Returns the sum of the member areas. */
  public double area() {
    double area = 0;
    for (T surface : geometryList()) {
      area += surface.area();
    }
    return area;
  }

  /**
   * Returns the average of the member centroids weighted by member area, or their plain average if
   * every member has zero area.
   *
   * @throws GeometryException with code EMPTY_GEOMETRY if there are no non-empty members
   */
  public Point centroid() {
    double area = 0;
    double x = 0;
    double y = 0;
    double meanX = 0;
    double meanY = 0;
    int count = 0;
    for (T surface : geometryList()) {
      if (surface.isEmpty()) {
        continue;
      }
      Point c = surface.centroid();
      double a = surface.area();
      area += a;
      x += a * c.x();
      y += a * c.y();
      meanX += c.x();
      meanY += c.y();
      count++;
    }
    if (count == 0) {
      throw new GeometryException(
          GeometryError.Code.EMPTY_GEOMETRY, "centroid requires a non-empty %s",
          getGeometryType());
    }
    if (tolerance().isZero(area)) {
      return new Point(meanX / count, meanY / count, getSpatialReference());
    }
    return new Point(x / area, y / area, getSpatialReference());
  }

  /**
   * Returns a point on the surface of the member with the largest area.
   *
   * @throws GeometryException with code EMPTY_GEOMETRY if there are no non-empty members
   */
  public Point pointOnSurface() {
    T largest = null;
    for (T surface : geometryList()) {
      if (!surface.isEmpty() && (largest == null || surface.area() > largest.area())) {
        largest = surface;
      }
    }
    if (largest == null) {
      throw new GeometryException(
          GeometryError.Code.EMPTY_GEOMETRY, "pointOnSurface requires a non-empty %s",
          getGeometryType());
    }
    return largest.pointOnSurface();
  }

  /** Returns the boundary curves of every member. */
  @Override
  public MultiLineString boundary() {
    MultiLineString result = new MultiLineString(getSpatialReference(), tolerance());
    for (T surface : geometryList()) {
      for (LineString line : surface.boundary().geometryList()) {
        result.addLineString(line);
      }
    }
    return result;
  }

  /** Returns true if every member is simple and no two member interiors overlap. */
  @Override
  public boolean isSimple() {
    List<T> members = geometryList();
    for (int i = 0; i < members.size(); i++) {
      if (!members.get(i).isSimple()) {
        return false;
      }
      for (int j = i + 1; j < members.size(); j++) {
        if (interiorsIntersect(members.get(i), members.get(j))) {
          return false;
        }
      }
    }
    return true;
  }

  @Override
  protected MultiSurface<T> newInstance() {
    return new MultiSurface<>(getSpatialReference(), tolerance());
  }

  @Override
  public MultiSurface<T> copy() {
    return (MultiSurface<T>) super.copy();
  }
}
