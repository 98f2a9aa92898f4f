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

import com.google.common.collect.ImmutableList;
import io.github.sfgeometry.GeometryComponents.Parts;
import java.util.ArrayList;
import java.util.List;

/**
 * Spatial predicates between two geometries of any type, evaluated in the xy-plane with the
 * tolerance of the first geometry.
 *
 * <p>Every geometry is treated as the union of its primitive parts: points, curves, and polygons
 * (including the patches of polyhedral surfaces). The interior of a point is the point itself, the
 * interior of an open curve excludes its two endpoints, and the interior of a polygon excludes its
 * rings.
 *
 * <p>{@link #covers} is the core predicate: every point of the second geometry lies in the first,
 * interior or boundary. Boundary contact counts for {@link #intersects} and {@link #covers} but not
 * for interior tests, so two squares sharing an edge intersect and touch, but do not overlap.
 *
 * <p>Both geometries must have the same SRID and the same kind of coordinate system; otherwise the
 * predicates throw a {@link GeometryException} with code INVALID_ARGUMENT.
 */
public final strictfp class GeometricPredicates {
  private GeometricPredicates() {}

  /** Returns true if the geometries have at least one point in common. */
  public static boolean intersects(Geometry a, Geometry b) {
    checkCompatible(a, b);
    Parts pa = GeometryComponents.parts(a);
    Parts pb = GeometryComponents.parts(b);
    if (pa.isEmpty() || pb.isEmpty()) {
      return false;
    }
    for (Point p : pa.points) {
      if (pb.covers(p)) {
        return true;
      }
    }
    for (Point p : pb.points) {
      if (pa.covers(p)) {
        return true;
      }
    }
    Tolerance tolerance = a.tolerance();
    for (List<Point> c : pa.cutters()) {
      for (List<Point> d : pb.cutters()) {
        if (curvesMeet(c, d, tolerance)) {
          return true;
        }
      }
    }
    // With no boundary contact, one geometry can still lie entirely inside a polygon of the other.
    for (List<Point> c : pa.cutters()) {
      if (pb.covers(c.get(0))) {
        return true;
      }
    }
    for (List<Point> d : pb.cutters()) {
      if (pa.covers(d.get(0))) {
        return true;
      }
    }
    return false;
  }

  /** Returns true if the geometries have no point in common. */
  public static boolean disjoint(Geometry a, Geometry b) {
    return !intersects(a, b);
  }

  /**
   * Returns true if every point of {@code b} lies in {@code a}, in its interior or on its boundary.
   * An empty geometry covers nothing and is covered by nothing.
   */
  public static boolean covers(Geometry a, Geometry b) {
    checkCompatible(a, b);
    return covers(GeometryComponents.parts(a), GeometryComponents.parts(b), a);
  }

  private static boolean covers(Parts pa, Parts pb, Geometry a) {
    if (pa.isEmpty() || pb.isEmpty()) {
      return false;
    }
    for (Point p : pb.points) {
      if (!pa.covers(p)) {
        return false;
      }
    }
    for (LineString line : pb.lines) {
      if (!pa.covers(line.startPoint())) {
        return false;
      }
      for (Point[] piece :
          PlanarAlgorithms.splitAgainst(line.coordinates(), pa.cutters(), pa.tolerance)) {
        if (!pa.covers(piece[1]) || !pa.covers(PlanarAlgorithms.midpoint(piece[0], piece[1]))) {
          return false;
        }
      }
    }
    if (!pb.polygons.isEmpty()) {
      if (pa.polygons.isEmpty()) {
        return false;
      }
      List<Polygon> region =
          PolygonOverlay.unionAll(pa.polygons, a.getSpatialReference(), pa.tolerance);
      for (Polygon polygon : pb.polygons) {
        double uncovered = 0;
        for (Polygon rest :
            PolygonOverlay.compute(
                PolygonOverlay.OpType.DIFFERENCE,
                ImmutableList.of(polygon),
                region,
                a.getSpatialReference(),
                pa.tolerance)) {
          uncovered += rest.area();
        }
        if (uncovered > pa.tolerance.epsilon() * Math.max(1, polygon.area())) {
          return false;
        }
      }
    }
    return true;
  }

  /** Returns true if every point of {@code a} lies in {@code b}. */
  public static boolean coveredBy(Geometry a, Geometry b) {
    return covers(b, a);
  }

  /**
   * Returns true if {@code a} covers {@code b} and their interiors intersect. A polygon does not
   * contain a curve that runs along its boundary.
   */
  public static boolean contains(Geometry a, Geometry b) {
    checkCompatible(a, b);
    Parts pa = GeometryComponents.parts(a);
    Parts pb = GeometryComponents.parts(b);
    return covers(pa, pb, a) && interiorsIntersect(pa, pb);
  }

  /** Returns true if {@code b} contains {@code a}. */
  public static boolean within(Geometry a, Geometry b) {
    return contains(b, a);
  }

  /** Returns true if the geometries cover each other, i.e. they are the same point set. */
  public static boolean equals(Geometry a, Geometry b) {
    checkCompatible(a, b);
    Parts pa = GeometryComponents.parts(a);
    Parts pb = GeometryComponents.parts(b);
    if (pa.isEmpty() && pb.isEmpty()) {
      return true;
    }
    return covers(pa, pb, a) && covers(pb, pa, b);
  }

  /** Returns true if the geometries intersect, but only on their boundaries. */
  public static boolean touches(Geometry a, Geometry b) {
    if (!intersects(a, b)) {
      return false;
    }
    return !interiorsIntersect(GeometryComponents.parts(a), GeometryComponents.parts(b));
  }

  /**
   * Returns true if the geometries have the same dimension, their interiors intersect in a set of
   * that dimension, and neither covers the other.
   */
  public static boolean overlaps(Geometry a, Geometry b) {
    checkCompatible(a, b);
    Parts pa = GeometryComponents.parts(a);
    Parts pb = GeometryComponents.parts(b);
    int dimension = pa.dimension();
    if (dimension < 0 || dimension != pb.dimension()) {
      return false;
    }
    if (covers(pa, pb, a) || covers(pb, pa, b)) {
      return false;
    }
    switch (dimension) {
      case 0:
        return interiorsIntersect(pa, pb);
      case 1:
        for (LineString line : pa.lines) {
          for (Point[] piece :
              PlanarAlgorithms.splitAgainst(line.coordinates(), pb.cutters(), pa.tolerance)) {
            if (pb.onLine(PlanarAlgorithms.midpoint(piece[0], piece[1]))) {
              return true;
            }
          }
        }
        return false;
      default:
        return polygonInteriorsIntersect(pa, pb);
    }
  }

  /**
   * Returns true if some point lies in the interior of both sets of parts. Candidate points are
   * the points, vertices, and curve crossings of both, and the midpoints of curve pieces split
   * where they meet the other geometry.
   */
  static boolean interiorsIntersect(Parts pa, Parts pb) {
    if (pa.isEmpty() || pb.isEmpty()) {
      return false;
    }
    if (polygonInteriorsIntersect(pa, pb)) {
      return true;
    }
    List<Point> candidates = new ArrayList<>(pa.points);
    candidates.addAll(pb.points);
    addPieceMidpoints(pa, pb, candidates);
    addPieceMidpoints(pb, pa, candidates);
    for (List<Point> c : pa.cutters()) {
      for (List<Point> d : pb.cutters()) {
        addCrossings(c, d, pa.tolerance, candidates);
      }
    }
    for (Point p : candidates) {
      if (pa.interiorContains(p) && pb.interiorContains(p)) {
        return true;
      }
    }
    return false;
  }

  private static boolean polygonInteriorsIntersect(Parts pa, Parts pb) {
    for (Polygon p : pa.polygons) {
      for (Polygon q : pb.polygons) {
        if (PolygonOverlay.interiorsIntersect(p, q, pa.tolerance)) {
          return true;
        }
      }
    }
    return false;
  }

  private static void addPieceMidpoints(Parts lines, Parts cutters, List<Point> candidates) {
    for (LineString line : lines.lines) {
      candidates.addAll(line.coordinates());
      for (Point[] piece :
          PlanarAlgorithms.splitAgainst(line.coordinates(), cutters.cutters(), lines.tolerance)) {
        candidates.add(PlanarAlgorithms.midpoint(piece[0], piece[1]));
      }
    }
  }

  private static void addCrossings(
      List<Point> c, List<Point> d, Tolerance tolerance, List<Point> candidates) {
    for (int i = 0; i + 1 < c.size(); i++) {
      for (int j = 0; j + 1 < d.size(); j++) {
        candidates.addAll(
            PlanarAlgorithms.segmentIntersections(
                c.get(i), c.get(i + 1), d.get(j), d.get(j + 1), tolerance));
      }
    }
  }

  private static boolean curvesMeet(List<Point> c, List<Point> d, Tolerance tolerance) {
    for (int i = 0; i + 1 < c.size(); i++) {
      for (int j = 0; j + 1 < d.size(); j++) {
        if (PlanarAlgorithms.segmentsTouchOrCross(
            c.get(i), c.get(i + 1), d.get(j), d.get(j + 1), tolerance)) {
          return true;
        }
      }
    }
    return false;
  }

  /**
   * @throws GeometryException with code INVALID_ARGUMENT if the geometries have different SRIDs or
   *     one is geographic and the other is not
   */
  static void checkCompatible(Geometry a, Geometry b) {
    if (a.getSRID() != b.getSRID()
        || a.getCoordinateSystem().isGeographic() != b.getCoordinateSystem().isGeographic()) {
      throw new GeometryException(
          GeometryError.Code.INVALID_ARGUMENT,
          "Geometries have incompatible spatial references %s and %s",
          a.getSpatialReference(),
          b.getSpatialReference());
    }
  }
}
