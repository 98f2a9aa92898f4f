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
import com.google.common.collect.Lists;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import jsinterop.annotations.JsIgnore;
import jsinterop.annotations.JsType;

/**
 * A LineString is a curve made of straight segments between consecutive points. It may be empty,
 * open, or closed, and it may cross itself; see {@link #isSimple()}.
 *
 * <p>LineStrings are mutable only through {@link #addPoint(Point)}. Points are immutable, so the
 * lists returned by {@link #points()} never alias mutable state.
 */
@JsType
public strictfp class LineString extends AbstractGeometry implements Curve {
  private final List<Point> points;

  /** Constructs an empty LineString. */
  public LineString() {
    this(ImmutableList.<Point>of());
  }

  /** Constructs a LineString through the given points. */
  @JsIgnore
  public LineString(List<Point> points) {
    this(points, SpatialReference.DEFAULT, Tolerance.DEFAULT);
  }

  /** Constructs a LineString through the given points, with the given reference and tolerance. */
  @JsIgnore
  public LineString(List<Point> points, SpatialReference reference, Tolerance tolerance) {
    super(reference, tolerance);
    this.points = new ArrayList<>(points.size());
    for (Point p : points) {
      this.points.add(Preconditions.checkNotNull(p));
    }
  }

  /** Appends a point to the end of this LineString. */
  public void addPoint(Point point) {
    points.add(Preconditions.checkNotNull(point));
  }

  /** Inserts a point at the given 0-based position, for subclasses that maintain closure. */
  void insertPoint(int index, Point point) {
    points.add(index, Preconditions.checkNotNull(point));
  }

  /** Returns a read-only view of the points, for use within the package without copying. */
  List<Point> coordinates() {
    return Collections.unmodifiableList(points);
  }

  @Override
  public String getGeometryType() {
    return "LINESTRING";
  }

  @Override
  public int numPoints() {
    return points.size();
  }

  @Override
  public Point pointN(int n) {
    if (n < 1 || n > points.size()) {
      throw new GeometryException(
          GeometryError.Code.INDEX_OUT_OF_RANGE,
          "Point index %d is outside [1, %d]",
          n,
          points.size());
    }
    return points.get(n - 1);
  }

  @Override
  public ImmutableList<Point> points() {
    return ImmutableList.copyOf(points);
  }

  @Override
  public Point startPoint() {
    checkNotEmpty("startPoint");
    return points.get(0);
  }

  @Override
  public Point endPoint() {
    checkNotEmpty("endPoint");
    return points.get(points.size() - 1);
  }

  private void checkNotEmpty(String operation) {
    if (points.isEmpty()) {
      throw new GeometryException(
          GeometryError.Code.EMPTY_GEOMETRY, "%s requires a non-empty %s", operation,
          getGeometryType());
    }
  }

  @Override
  public boolean isEmpty() {
    return points.isEmpty();
  }

  @Override
  public boolean isClosed() {
    return points.size() >= 2
        && points.get(0).approxEquals(points.get(points.size() - 1), tolerance());
  }

  /**
   * Returns true if no two segments intersect except adjacent segments at their shared vertex,
   * and, for closed curves, the first and last segments at the closing vertex.
   */
  @Override
  public boolean isSimple() {
    return PlanarAlgorithms.isSimple(points, tolerance());
  }

  /** Returns true if every point has a z coordinate. Empty curves are 2D. */
  @Override
  public boolean is3D() {
    if (points.isEmpty()) {
      return false;
    }
    for (Point p : points) {
      if (!p.is3D()) {
        return false;
      }
    }
    return true;
  }

  /** Returns true if every point has a measure. Empty curves are not measured. */
  @Override
  public boolean isMeasured() {
    if (points.isEmpty()) {
      return false;
    }
    for (Point p : points) {
      if (!p.isMeasured()) {
        return false;
      }
    }
    return true;
  }

  @Override
  public double length() {
    double length = 0;
    for (int i = 1; i < points.size(); i++) {
      length += points.get(i - 1).distance(points.get(i));
    }
    return length;
  }

  @Override
  public Envelope getEnvelope() {
    return Envelope.fromPoints(points);
  }

  @Override
  public MultiPoint boundary() {
    MultiPoint boundary = new MultiPoint(getSpatialReference(), tolerance());
    if (points.size() < 2 || isClosed()) {
      return boundary;
    }
    boundary.addPoint(startPoint());
    boundary.addPoint(endPoint());
    return boundary;
  }

  @Override
  public Point interpolatePoint(double distance) {
    checkNotEmpty("interpolatePoint");
    double total = length();
    if (!(distance >= 0 && distance <= total)) {
      throw new GeometryException(
          GeometryError.Code.OUT_OF_RANGE, "Distance %s is outside [0, %s]", distance, total);
    }
    double walked = 0;
    for (int i = 1; i < points.size(); i++) {
      Point a = points.get(i - 1);
      Point b = points.get(i);
      double segment = a.distance(b);
      if (segment > 0 && walked + segment >= distance) {
        return interpolate(a, b, (distance - walked) / segment);
      }
      walked += segment;
    }
    return points.get(points.size() - 1);
  }

  /**
   * Returns the point at fraction t along segment ab. The z and m coordinates are interpolated
   * when both endpoints have them.
   */
  static Point interpolate(Point a, Point b, double t) {
    double x = a.x() + t * (b.x() - a.x());
    double y = a.y() + t * (b.y() - a.y());
    boolean hasZ = a.is3D() && b.is3D();
    boolean hasM = a.isMeasured() && b.isMeasured();
    double z = hasZ ? a.z() + t * (b.z() - a.z()) : 0;
    double m = hasM ? a.m() + t * (b.m() - a.m()) : 0;
    if (hasZ && hasM) {
      return Point.measured(x, y, z, m);
    } else if (hasZ) {
      return new Point(x, y, z);
    } else if (hasM) {
      return Point.measured(x, y, m);
    }
    return new Point(x, y);
  }

  /** Returns true if the point lies on some segment of this curve, within tolerance. */
  public boolean isPointOnCurve(Point point) {
    if (points.size() == 1) {
      return points.get(0).approxEquals(point, tolerance());
    }
    for (int i = 1; i < points.size(); i++) {
      if (PlanarAlgorithms.isPointOnSegment(point, points.get(i - 1), points.get(i), tolerance())) {
        return true;
      }
    }
    return false;
  }

  /** A point is contained by a curve if it lies on the curve. */
  @Override
  public boolean contains(Point point) {
    return isPointOnCurve(point);
  }

  /**
   * Returns the point of this curve closest to the given point, in the plane.
   *
   * @throws GeometryException with code EMPTY_GEOMETRY if the curve has no points
   */
  public Point closestPoint(Point point) {
    checkNotEmpty("closestPoint");
    Point best = points.get(0);
    double bestDistance = best.distance2D(point);
    for (int i = 1; i < points.size(); i++) {
      Point candidate =
          PlanarAlgorithms.closestPointOnSegment(point, points.get(i - 1), points.get(i));
      double d = candidate.distance2D(point);
      if (d < bestDistance) {
        best = candidate;
        bestDistance = d;
      }
    }
    return best;
  }

  /** Returns the planar distance from the given point to this curve. */
  public double distance(Point point) {
    return closestPoint(point).distance2D(point);
  }

  /** Returns a new LineString with the points in reverse order. */
  public LineString reverse() {
    return new LineString(Lists.reverse(points), getSpatialReference(), tolerance());
  }

  @Override
  public LineString copy() {
    return new LineString(points, getSpatialReference(), tolerance());
  }

  @Override
  public boolean approxEquals(Geometry other) {
    if (!(other instanceof LineString)
        || !getGeometryType().equals(other.getGeometryType())) {
      return false;
    }
    List<Point> otherPoints = ((LineString) other).points;
    if (otherPoints.size() != points.size()) {
      return false;
    }
    for (int i = 0; i < points.size(); i++) {
      if (!points.get(i).approxEquals(otherPoints.get(i), tolerance())) {
        return false;
      }
    }
    return true;
  }

  @Override
  public boolean equals(Object other) {
    return other != null
        && other.getClass() == getClass()
        && points.equals(((LineString) other).points);
  }

  @Override
  public int hashCode() {
    return getClass().hashCode() * 31 + points.hashCode();
  }
}
