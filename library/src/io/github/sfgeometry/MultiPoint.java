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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.List;
import jsinterop.annotations.JsIgnore;
import jsinterop.annotations.JsType;

/** A collection of points. A MultiPoint is simple if no two of its points are equal. */
@JsType
public strictfp class MultiPoint extends GeometryCollection<Point> {
  /** Constructs an empty MultiPoint. */
  public MultiPoint() {
    this(SpatialReference.DEFAULT, Tolerance.DEFAULT);
  }

  @JsIgnore
  public MultiPoint(SpatialReference reference, Tolerance tolerance) {
    super(reference, tolerance);
  }

  @JsIgnore
  public MultiPoint(List<Point> points) {
    this(points, SpatialReference.DEFAULT, Tolerance.DEFAULT);
  }

  @JsIgnore
  public MultiPoint(List<Point> points, SpatialReference reference, Tolerance tolerance) {
    super(points, reference, tolerance);
  }

  @Override
  public String getGeometryType() {
    return "MULTIPOINT";
  }

  /** Adds a point. Duplicates are allowed, but make the MultiPoint non-simple. */
  public void addPoint(Point point) {
    add(point);
  }

  /** Returns the number of points. */
  public int numPoints() {
    return numGeometries();
  }

  /** Returns true if no two points are approximately equal. */
  @Override
  public boolean isSimple() {
    List<Point> points = geometryList();
    for (int i = 0; i < points.size(); i++) {
      for (int j = i + 1; j < points.size(); j++) {
        if (points.get(i).approxEquals(points.get(j), tolerance())) {
          return false;
        }
      }
    }
    return true;
  }

  /** Returns the empty MultiPoint: points have no boundary. */
  @Override
  public MultiPoint boundary() {
    return new MultiPoint(getSpatialReference(), tolerance());
  }

  /**
   * Returns the mean of the points.
   *
   * @throws GeometryException with code EMPTY_GEOMETRY if there are no points
   */
  public Point centroid() {
    List<Point> points = geometryList();
    if (points.isEmpty()) {
      throw new GeometryException(
          GeometryError.Code.EMPTY_GEOMETRY, "centroid requires a non-empty MULTIPOINT");
    }
    return Polygon.vertexMean(points);
  }

  /** Returns the points whose distance from the given point is at most {@code distance}. */
  public ImmutableList<Point> getPointsWithinDistance(Point point, double distance) {
    Preconditions.checkArgument(distance >= 0, "Negative distance: %s", distance);
    ImmutableList.Builder<Point> result = ImmutableList.builder();
    for (Point p : geometryList()) {
      if (p.distance(point) <= distance + tolerance().epsilon()) {
        result.add(p);
      }
    }
    return result.build();
  }

  @Override
  protected MultiPoint newInstance() {
    return new MultiPoint(getSpatialReference(), tolerance());
  }

  @Override
  public MultiPoint copy() {
    return (MultiPoint) super.copy();
  }
}
