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

import static java.lang.Math.PI;
import static java.lang.Math.abs;
import static java.lang.Math.atan2;
import static java.lang.Math.hypot;
import static java.lang.Math.toDegrees;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.OptionalDouble;
import jsinterop.annotations.JsIgnore;
import jsinterop.annotations.JsType;
import org.jspecify.annotations.Nullable;

/**
 * A Triangle is a Polygon with exactly three distinct, non-collinear vertices and no holes. The
 * vertices are stored counter-clockwise, so {@link #getVertices()} may return them in a different
 * order than they were given.
 */
@JsType
public final strictfp class Triangle extends Polygon {

  /** Constructs an empty triangle. */
  public Triangle() {
    this(SpatialReference.DEFAULT, Tolerance.DEFAULT);
  }

  /** Constructs an empty triangle with the given reference and tolerance. */
  @JsIgnore
  public Triangle(SpatialReference reference, Tolerance tolerance) {
    super(reference, tolerance);
  }

  /**
   * Constructs a triangle with the given vertices.
   *
   * @throws GeometryException with code DEGENERATE_TRIANGLE if the vertices are collinear
   */
  @JsIgnore
  public Triangle(Point a, Point b, Point c) {
    this(a, b, c, SpatialReference.DEFAULT, Tolerance.DEFAULT);
  }

  /** As {@link #Triangle(Point, Point, Point)}, with the given reference and tolerance. */
  @JsIgnore
  public Triangle(Point a, Point b, Point c, SpatialReference reference, Tolerance tolerance) {
    super(reference, tolerance);
    setVertices(a, b, c);
  }

  @Override
  public String getGeometryType() {
    return "TRIANGLE";
  }

  /**
   * Replaces the vertices of this triangle.
   *
   * @throws GeometryException with code DEGENERATE_TRIANGLE if the points are collinear or
   *     coincident
   */
  public void setVertices(Point a, Point b, Point c) {
    if (isDegenerate(a, b, c, tolerance())) {
      throw new GeometryException(
          GeometryError.Code.DEGENERATE_TRIANGLE,
          "Triangle vertices %s, %s, %s are collinear",
          a,
          b,
          c);
    }
    super.setExteriorRing(
        new LinearRing(ImmutableList.of(a, b, c, a), getSpatialReference(), tolerance()));
  }

  /** Returns true if the three points are collinear or coincident within the tolerance. */
  static boolean isDegenerate(Point a, Point b, Point c, Tolerance tolerance) {
    return a.approxEquals(b, tolerance)
        || b.approxEquals(c, tolerance)
        || c.approxEquals(a, tolerance)
        || PlanarAlgorithms.orientation(a, b, c, tolerance) == 0;
  }

  /**
   * Replaces the vertices with the first three points of the ring, which must have exactly four
   * points.
   *
   * @throws GeometryException with code INVALID_RING if the ring does not have four points, or
   *     DEGENERATE_TRIANGLE if its points are collinear
   */
  @Override
  public void setExteriorRing(LinearRing ring) {
    if (ring.numPoints() != 4) {
      throw new GeometryException(
          GeometryError.Code.INVALID_RING,
          "A triangle ring has 4 points, got %d",
          ring.numPoints());
    }
    setVertices(ring.pointN(1), ring.pointN(2), ring.pointN(3));
  }

  /**
   * Triangles have no holes.
   *
   * @throws GeometryException with code UNSUPPORTED_OPERATION, always
   */
  @Override
  public void addInteriorRing(LinearRing ring) {
    throw new GeometryException(
        GeometryError.Code.UNSUPPORTED_OPERATION, "Triangles cannot have interior rings");
  }

  /** Returns the three vertices in counter-clockwise order, or an empty list. */
  public ImmutableList<Point> getVertices() {
    if (isEmpty()) {
      return ImmutableList.of();
    }
    return ImmutableList.copyOf(exteriorCoordinates().subList(0, 3));
  }

  /** Returns the 1-based vertex n. */
  Point vertex(int n) {
    return exteriorCoordinates().get(n - 1);
  }

  /** Returns true if this triangle has vertices, which are never degenerate. */
  @Override
  public boolean isValid() {
    return !isEmpty();
  }

  @Override
  public double area() {
    if (isEmpty()) {
      return 0;
    }
    return PlanarAlgorithms.triangleArea(vertex(1), vertex(2), vertex(3));
  }

  /** Returns the mean of the three vertices, which is exact for triangles. */
  @Override
  public Point centroid() {
    if (isEmpty()) {
      throw new GeometryException(
          GeometryError.Code.EMPTY_GEOMETRY, "centroid requires a non-empty TRIANGLE");
    }
    List<Point> v = getVertices();
    return Polygon.vertexMean(v);
  }

  /** The centroid of a triangle is always interior. */
  @Override
  public Point pointOnSurface() {
    return centroid();
  }

  /**
   * Returns the interior angles in radians at the first, second and third vertex. Each angle is
   * {@code atan2(|cross|, dot)} of the two edge vectors leaving its vertex, and they sum to pi.
   */
  public double[] getAngles() {
    if (isEmpty()) {
      return new double[0];
    }
    Point a = vertex(1);
    Point b = vertex(2);
    Point c = vertex(3);
    return new double[] {angleAt(a, b, c), angleAt(b, c, a), angleAt(c, a, b)};
  }

  private static double angleAt(Point vertex, Point next, Point previous) {
    double ux = next.x() - vertex.x();
    double uy = next.y() - vertex.y();
    double vx = previous.x() - vertex.x();
    double vy = previous.y() - vertex.y();
    return atan2(abs(ux * vy - uy * vx), ux * vx + uy * vy);
  }

  /** Returns the center of the circle through the three vertices, or null if empty. */
  public @Nullable Point circumcenter() {
    if (isEmpty()) {
      return null;
    }
    return PlanarAlgorithms.circumcenter(vertex(1), vertex(2), vertex(3));
  }

  /** Returns true if the point is inside or on the circle through the three vertices. */
  public boolean inCircumcircle(Point point) {
    return !isEmpty()
        && PlanarAlgorithms.inCircumcircle(vertex(1), vertex(2), vertex(3), point, tolerance());
  }

  /** Returns true if the point is strictly inside this triangle, not on an edge. */
  public boolean containsInInterior(Point point) {
    if (isEmpty()) {
      return false;
    }
    Point a = vertex(1);
    Point b = vertex(2);
    Point c = vertex(3);
    // Vertices are counter-clockwise, so interior points are strictly left of every edge.
    return PlanarAlgorithms.orientation(a, b, point, tolerance()) > 0
        && PlanarAlgorithms.orientation(b, c, point, tolerance()) > 0
        && PlanarAlgorithms.orientation(c, a, point, tolerance()) > 0
        && !PlanarAlgorithms.isPointOnSegment(point, a, b, tolerance())
        && !PlanarAlgorithms.isPointOnSegment(point, b, c, tolerance())
        && !PlanarAlgorithms.isPointOnSegment(point, c, a, tolerance());
  }

  /**
   * Returns the z value of the plane through the three vertices at the given location, using
   * barycentric weights from sub-triangle areas. Returns empty if this triangle is not 3D.
   */
  public OptionalDouble interpolateZ(Point point) {
    if (isEmpty() || !is3D()) {
      return OptionalDouble.empty();
    }
    Point a = vertex(1);
    Point b = vertex(2);
    Point c = vertex(3);
    double total = PlanarAlgorithms.triangleArea(a, b, c);
    double wa = PlanarAlgorithms.triangleArea(point, b, c) / total;
    double wb = PlanarAlgorithms.triangleArea(a, point, c) / total;
    double wc = PlanarAlgorithms.triangleArea(a, b, point) / total;
    return OptionalDouble.of(wa * a.z() + wb * b.z() + wc * c.z());
  }

  /** Returns the normal (b - a) x (c - a) of the plane through a 3D triangle's vertices. */
  private double[] normal() {
    Point a = vertex(1);
    Point b = vertex(2);
    Point c = vertex(3);
    double ux = b.x() - a.x();
    double uy = b.y() - a.y();
    double uz = b.z() - a.z();
    double vx = c.x() - a.x();
    double vy = c.y() - a.y();
    double vz = c.z() - a.z();
    return new double[] {uy * vz - uz * vy, uz * vx - ux * vz, ux * vy - uy * vx};
  }

  /**
   * Returns the slope of a 3D triangle in degrees from horizontal, between 0 (flat) and 90
   * (vertical). Returns empty for 2D or empty triangles.
   */
  public OptionalDouble getSlope() {
    if (isEmpty() || !is3D()) {
      return OptionalDouble.empty();
    }
    double[] n = normal();
    return OptionalDouble.of(toDegrees(atan2(hypot(n[0], n[1]), abs(n[2]))));
  }

  /**
   * Returns the direction a 3D triangle faces downhill, in degrees clockwise from the +y axis, in
   * [0, 360). Returns empty for 2D, empty, or flat triangles.
   */
  public OptionalDouble getAspect() {
    if (isEmpty() || !is3D()) {
      return OptionalDouble.empty();
    }
    double[] n = normal();
    if (tolerance().isZero(hypot(n[0], n[1]))) {
      return OptionalDouble.empty();
    }
    // The vertices are counter-clockwise, so n[2] > 0 and the horizontal part of the normal
    // points downhill.
    double aspect = atan2(n[0], n[1]);
    if (aspect < 0) {
      aspect += 2 * PI;
    }
    return OptionalDouble.of(toDegrees(aspect));
  }

  @Override
  public Triangle copy() {
    Triangle result = new Triangle(getSpatialReference(), tolerance());
    if (!isEmpty()) {
      result.setVertices(vertex(1), vertex(2), vertex(3));
    }
    return result;
  }
}
