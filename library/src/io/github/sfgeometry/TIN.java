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

import static java.lang.Math.abs;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;
import java.util.logging.Logger;
import jsinterop.annotations.JsIgnore;
import jsinterop.annotations.JsType;
import org.jspecify.annotations.Nullable;

/**
 * A triangulated irregular network: a PolyhedralSurface whose patches are all triangles. A TIN
 * usually represents a height field, with z as the height at each vertex, and is queried in the xy
 * plane.
 *
 * <p>Triangles added one at a time must connect to the existing triangles through a shared edge
 * and must not overlap them. {@link #fromPoints(List)} builds a TIN from scattered points with a
 * Delaunay triangulation.
 */
@JsType
public final strictfp class TIN extends PolyhedralSurface {
  private static final Logger log = Platform.getLoggerForClass(TIN.class);

  /** Constructs an empty TIN. */
  public TIN() {
    this(SpatialReference.DEFAULT, Tolerance.DEFAULT);
  }

  /** Constructs an empty TIN with the given reference and tolerance. */
  @JsIgnore
  public TIN(SpatialReference reference, Tolerance tolerance) {
    super(reference, tolerance);
  }

  /**
   * Constructs a TIN by adding each triangle in turn with {@link #addTriangle(Triangle)}.
   *
   * @throws GeometryException if any triangle is rejected
   */
  @JsIgnore
  public TIN(List<Triangle> triangles) {
    this(triangles, SpatialReference.DEFAULT, Tolerance.DEFAULT);
  }

  /** As {@link #TIN(List)}, with the given reference and tolerance. */
  @JsIgnore
  public TIN(List<Triangle> triangles, SpatialReference reference, Tolerance tolerance) {
    this(reference, tolerance);
    for (Triangle triangle : triangles) {
      addTriangle(triangle);
    }
  }

  /**
   * Returns the Delaunay triangulation of the points as a TIN, with the points' spatial reference
   * and the default tolerance.
   *
   * @throws GeometryException with code DUPLICATE_POINT if two points are approximately equal, or
   *     INVALID_ARGUMENT if there are fewer than 3 points or they are all collinear
   */
  public static TIN fromPoints(List<Point> points) {
    SpatialReference reference =
        points.isEmpty() ? SpatialReference.DEFAULT : points.get(0).getSpatialReference();
    return fromPoints(points, reference, Tolerance.DEFAULT);
  }

  /** As {@link #fromPoints(List)}, with the given reference and tolerance. */
  @JsIgnore
  public static TIN fromPoints(
      List<Point> points, SpatialReference reference, Tolerance tolerance) {
    if (points.size() < 3) {
      throw new GeometryException(
          GeometryError.Code.INVALID_ARGUMENT,
          "A TIN requires at least 3 points, got %d",
          points.size());
    }
    ImmutableList<Triangle> triangles = new DelaunayTriangulator(tolerance).triangulate(points);
    if (triangles.isEmpty()) {
      throw new GeometryException(
          GeometryError.Code.INVALID_ARGUMENT, "All %d points are collinear", points.size());
    }
    TIN result = new TIN(reference, tolerance);
    result.appendPatches(triangles);
    return result;
  }

  @Override
  public String getGeometryType() {
    return "TIN";
  }

  /**
   * Adds the patch, which must be a Triangle.
   *
   * @throws GeometryException with code UNSUPPORTED_OPERATION if the patch is not a Triangle, or
   *     any error of {@link #addTriangle(Triangle)}
   */
  @Override
  public void addPatch(Polygon patch) {
    if (!(patch instanceof Triangle)) {
      throw new GeometryException(
          GeometryError.Code.UNSUPPORTED_OPERATION,
          "TIN patches must be triangles, got %s",
          patch.getGeometryType());
    }
    addTriangle((Triangle) patch);
  }

  /**
   * Adds a copy of the triangle. Once the TIN is non-empty, the triangle must share an edge with
   * an existing triangle, and must not overlap any existing triangle.
   *
   * @throws GeometryException with code DEGENERATE_TRIANGLE if the triangle is empty,
   *     TOPOLOGY_ERROR if it shares no edge with the TIN, or OVERLAPPING_GEOMETRY if it overlaps an
   *     existing triangle
   */
  public void addTriangle(Triangle triangle) {
    Preconditions.checkNotNull(triangle);
    if (!triangle.isValid()) {
      throw new GeometryException(
          GeometryError.Code.DEGENERATE_TRIANGLE, "Cannot add an empty triangle to a TIN");
    }
    List<Polygon> existing = patchList();
    if (!existing.isEmpty()) {
      boolean sharesEdge = false;
      for (int i = 0; i < existing.size(); i++) {
        Triangle other = (Triangle) existing.get(i);
        if (overlaps(triangle, other)) {
          throw new GeometryException(
              GeometryError.Code.OVERLAPPING_GEOMETRY, "Triangle overlaps triangle %d", i + 1);
        }
        sharesEdge |= sharedVertices(triangle, other) == 2;
      }
      if (!sharesEdge) {
        throw new GeometryException(
            GeometryError.Code.TOPOLOGY_ERROR, "Triangle shares no edge with the TIN");
      }
    }
    appendPatch(triangle.copy());
  }

  /**
   * Removes the n-th triangle, 1-based. The remaining triangles must still be connected through
   * shared edges.
   *
   * @throws GeometryException with code INDEX_OUT_OF_RANGE if n is not in [1, numTriangles()], or
   *     TOPOLOGY_ERROR if the removal would split the TIN
   */
  @Override
  public void removePatch(int n) {
    super.removePatch(n);
  }

  @Override
  void checkRemoval(int numRemaining, SurfaceTopology remainingTopology) {
    if (!isConnected(remainingTopology, numRemaining)) {
      throw new GeometryException(
          GeometryError.Code.TOPOLOGY_ERROR,
          "Removing the triangle would leave the TIN disconnected");
    }
  }

  private int sharedVertices(Triangle a, Triangle b) {
    int shared = 0;
    for (Point p : a.getVertices()) {
      for (Point q : b.getVertices()) {
        if (p.approxEquals(q, tolerance())) {
          shared++;
          break;
        }
      }
    }
    return shared;
  }

  /**
   * Returns true if the interiors of the triangles intersect: a vertex or the centroid of one lies
   * strictly inside the other, or two edges properly cross.
   */
  private boolean overlaps(Triangle a, Triangle b) {
    if (sharedVertices(a, b) == 3) {
      return true;
    }
    for (Point p : a.getVertices()) {
      if (b.containsInInterior(p)) {
        return true;
      }
    }
    for (Point p : b.getVertices()) {
      if (a.containsInInterior(p)) {
        return true;
      }
    }
    if (a.containsInInterior(b.centroid()) || b.containsInInterior(a.centroid())) {
      return true;
    }
    List<Point> va = a.getVertices();
    List<Point> vb = b.getVertices();
    for (int i = 0; i < 3; i++) {
      for (int j = 0; j < 3; j++) {
        if (PlanarAlgorithms.segmentsIntersect(
            va.get(i), va.get((i + 1) % 3), vb.get(j), vb.get((j + 1) % 3), tolerance())) {
          return true;
        }
      }
    }
    return false;
  }

  /** Returns the number of triangles. */
  public int numTriangles() {
    return numPatches();
  }

  /**
   * Returns a copy of the n-th triangle, 1-based.
   *
   * @throws GeometryException with code INDEX_OUT_OF_RANGE if n is not in [1, numTriangles()]
   */
  public Triangle triangleN(int n) {
    return (Triangle) patchN(n);
  }

  /** Returns copies of all triangles. */
  public ImmutableList<Triangle> getTriangles() {
    ImmutableList.Builder<Triangle> result = ImmutableList.builder();
    for (Polygon patch : patchList()) {
      result.add((Triangle) patch.copy());
    }
    return result.build();
  }

  /** Returns the first triangle whose xy projection contains the point, or null if none does. */
  public @Nullable Triangle getTriangleAt(Point point) {
    Triangle triangle = findTriangle(point);
    return triangle == null ? null : triangle.copy();
  }

  private @Nullable Triangle findTriangle(Point point) {
    for (Polygon patch : patchList()) {
      if (patch.getEnvelope().expanded(tolerance().epsilon()).contains(point)
          && patch.contains(point)) {
        return (Triangle) patch;
      }
    }
    return null;
  }

  /**
   * Returns the height of the surface at the point's xy location, interpolated linearly within the
   * containing triangle. Returns empty if the TIN is not 3D or no triangle contains the point.
   */
  public OptionalDouble interpolateZ(Point point) {
    if (!is3D()) {
      return OptionalDouble.empty();
    }
    Triangle triangle = findTriangle(point);
    if (triangle == null) {
      return OptionalDouble.empty();
    }
    return triangle.interpolateZ(point);
  }

  /** Returns the total area of the triangles, each measured in its own plane. */
  public double getSurfaceArea() {
    return area();
  }

  /**
   * Returns the slope in degrees of the triangle containing the point. Returns empty if the TIN is
   * not 3D or no triangle contains the point.
   */
  public OptionalDouble getSteepestSlope(Point point) {
    if (!is3D()) {
      return OptionalDouble.empty();
    }
    Triangle triangle = findTriangle(point);
    return triangle == null ? OptionalDouble.empty() : triangle.getSlope();
  }

  /** Returns each triangle as a plain Polygon. */
  public ImmutableList<Polygon> toPolygons() {
    ImmutableList.Builder<Polygon> result = ImmutableList.builder();
    for (Polygon patch : patchList()) {
      result.add(new Polygon(patch.exteriorRing()));
    }
    return result.build();
  }

  /** Returns the vertices within the given distance of the center, inclusive. */
  public ImmutableList<Point> findPointsWithinRadius(Point center, double radius) {
    ImmutableList.Builder<Point> result = ImmutableList.builder();
    for (Point p : topology().vertices()) {
      if (p.distance(center) <= radius) {
        result.add(p);
      }
    }
    return result.build();
  }

  /**
   * Returns a simplified TIN over the same vertices, with the fewest vertices this greedy
   * heuristic finds such that interpolating the simplified surface at every dropped vertex is
   * within maxError of that vertex's height.
   *
   * <p>The simplified TIN starts from the vertices of the convex hull, so that it covers the same
   * area. While some dropped vertex is out of tolerance, the dropped vertex with the largest error
   * is restored, ties going to the vertex with the larger importance: the mean absolute height
   * difference to its neighbors in this TIN. This is not a globally optimal simplification.
   *
   * @throws GeometryException with code INVALID_ARGUMENT if the TIN is not 3D
   */
  public TIN simplify(double maxError) {
    Preconditions.checkArgument(maxError >= 0, "maxError must be non-negative: %s", maxError);
    if (!is3D()) {
      throw new GeometryException(
          GeometryError.Code.INVALID_ARGUMENT, "Simplification requires a 3D TIN");
    }
    List<Point> vertices = topology().vertices();
    double[] importance = new double[vertices.size()];
    for (int i = 0; i < vertices.size(); i++) {
      importance[i] = importance(i);
    }

    boolean[] kept = new boolean[vertices.size()];
    Geometry hull = ConvexHullQuery.convexHull(vertices, tolerance());
    for (int i = 0; i < vertices.size(); i++) {
      kept[i] = isHullVertex(hull, vertices.get(i));
    }

    while (true) {
      TIN candidate = fromPoints(keptPoints(vertices, kept), getSpatialReference(), tolerance());
      int worst = -1;
      double worstError = maxError;
      for (int i = 0; i < vertices.size(); i++) {
        if (kept[i]) {
          continue;
        }
        Point p = vertices.get(i);
        OptionalDouble z = candidate.interpolateZ(p);
        double error = z.isPresent() ? abs(z.getAsDouble() - p.z()) : Double.POSITIVE_INFINITY;
        if (error > worstError
            || (worst >= 0 && error == worstError && importance[i] > importance[worst])) {
          worst = i;
          worstError = error;
        }
      }
      if (worst < 0) {
        log.fine(
            Platform.formatString(
                "Simplified TIN keeps %s of %s vertices",
                candidate.getVertices().size(),
                vertices.size()));
        return candidate;
      }
      kept[worst] = true;
    }
  }

  private static boolean isHullVertex(Geometry hull, Point p) {
    if (hull instanceof Polygon) {
      for (Point v : ((Polygon) hull).exteriorCoordinates()) {
        if (v.x() == p.x() && v.y() == p.y()) {
          return true;
        }
      }
      return false;
    }
    return true;
  }

  private static List<Point> keptPoints(List<Point> vertices, boolean[] kept) {
    List<Point> result = new ArrayList<>();
    for (int i = 0; i < vertices.size(); i++) {
      if (kept[i]) {
        result.add(vertices.get(i));
      }
    }
    return result;
  }

  /** Returns the mean absolute height difference between vertex i and its neighbors. */
  private double importance(int i) {
    List<Point> vertices = topology().vertices();
    Point p = vertices.get(i);
    List<Point> neighbors = new ArrayList<>();
    for (Polygon patch : patchList()) {
      List<Point> triangle = ((Triangle) patch).getVertices();
      boolean incident = false;
      for (Point v : triangle) {
        incident |= v.approxEquals(p, tolerance());
      }
      if (!incident) {
        continue;
      }
      for (Point v : triangle) {
        if (!v.approxEquals(p, tolerance()) && !containsApprox(neighbors, v)) {
          neighbors.add(v);
        }
      }
    }
    if (neighbors.isEmpty()) {
      return 0;
    }
    double sum = 0;
    for (Point q : neighbors) {
      sum += abs(p.z() - q.z());
    }
    return sum / neighbors.size();
  }

  private boolean containsApprox(List<Point> points, Point p) {
    for (Point q : points) {
      if (q.approxEquals(p, tolerance())) {
        return true;
      }
    }
    return false;
  }

  /**
   * Returns true if this TIN is invalid, in which case the error describes the first problem. In
   * addition to the checks of a PolyhedralSurface, no two triangles may overlap.
   */
  @Override
  public boolean findValidationError(GeometryError error) {
    if (super.findValidationError(error)) {
      return true;
    }
    List<Polygon> triangles = patchList();
    for (int i = 0; i < triangles.size(); i++) {
      for (int j = i + 1; j < triangles.size(); j++) {
        if (overlaps((Triangle) triangles.get(i), (Triangle) triangles.get(j))) {
          error.init(
              GeometryError.Code.OVERLAPPING_GEOMETRY,
              "Triangles %d and %d overlap",
              i + 1,
              j + 1);
          return true;
        }
      }
    }
    return false;
  }

  @Override
  public TIN copy() {
    TIN result = new TIN(getSpatialReference(), tolerance());
    copyPatchesInto(result);
    return result;
  }
}
