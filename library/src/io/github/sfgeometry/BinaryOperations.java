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

import io.github.sfgeometry.GeometryComponents.Parts;
import io.github.sfgeometry.PolygonOverlay.OpType;
import java.util.ArrayList;
import java.util.List;

/**
 * Set operations between two geometries of any type, computed in the xy-plane with the tolerance
 * and spatial reference of the first geometry. Results are 2D.
 *
 * <p>Each geometry is decomposed into points, curves, and polygons. The polygonal parts are
 * combined by {@link PolygonOverlay}; curves are split wherever they meet the other geometry and
 * each piece is kept or dropped by where its midpoint lies; points are kept or dropped by where
 * they lie. Lower dimensional results that lie on a higher dimensional result are dropped, so the
 * union of a square and one of its diagonals is just the square.
 *
 * <p>The result is the simplest geometry that holds it: an empty GeometryCollection, a single
 * Point, LineString or Polygon, a homogeneous MultiPoint, MultiLineString or MultiPolygon, or a
 * GeometryCollection when the result mixes dimensions.
 */
public final strictfp class BinaryOperations {
  private BinaryOperations() {}

  /** Returns the points common to both geometries. */
  public static Geometry intersection(Geometry a, Geometry b) {
    GeometricPredicates.checkCompatible(a, b);
    Parts pa = GeometryComponents.parts(a);
    Parts pb = GeometryComponents.parts(b);
    Result result = new Result(a);
    if (pa.isEmpty() || pb.isEmpty()) {
      return result.toGeometry();
    }
    result.polygons.addAll(
        PolygonOverlay.compute(
            OpType.INTERSECTION, region(pa, a), region(pb, a), a.getSpatialReference(),
            pa.tolerance));

    // Curves, including polygon rings, where they lie on the other geometry.
    for (List<Point> curve : pa.cutters()) {
      result.addPieces(curve, pb.cutters(), mid -> pb.covers(mid) && !result.coversByArea(mid));
    }
    for (List<Point> curve : pb.cutters()) {
      result.addPieces(
          curve,
          pa.cutters(),
          mid -> pa.covers(mid) && !onCurve(pa, mid) && !result.coversByArea(mid));
    }

    for (Point p : pa.points) {
      if (pb.covers(p)) {
        result.addPoint(p);
      }
    }
    for (Point p : pb.points) {
      if (pa.covers(p)) {
        result.addPoint(p);
      }
    }
    for (List<Point> c : pa.cutters()) {
      for (List<Point> d : pb.cutters()) {
        for (int i = 0; i + 1 < c.size(); i++) {
          for (int j = 0; j + 1 < d.size(); j++) {
            for (Point p :
                PlanarAlgorithms.segmentIntersections(
                    c.get(i), c.get(i + 1), d.get(j), d.get(j + 1), pa.tolerance)) {
              result.addPoint(p);
            }
          }
        }
      }
    }
    return result.toGeometry();
  }

  /** Returns the points in either geometry. */
  public static Geometry union(Geometry a, Geometry b) {
    GeometricPredicates.checkCompatible(a, b);
    Parts pa = GeometryComponents.parts(a);
    Parts pb = GeometryComponents.parts(b);
    Result result = new Result(a);
    result.polygons.addAll(
        PolygonOverlay.compute(
            OpType.UNION, region(pa, a), region(pb, a), a.getSpatialReference(), pa.tolerance));
    for (LineString line : pa.lines) {
      result.addPieces(line.coordinates(), pb.cutters(), mid -> !result.coversByArea(mid));
    }
    for (LineString line : pb.lines) {
      result.addPieces(
          line.coordinates(),
          pa.cutters(),
          mid -> !pa.onLine(mid) && !result.coversByArea(mid));
    }
    for (Point p : pa.points) {
      result.addPoint(p);
    }
    for (Point p : pb.points) {
      result.addPoint(p);
    }
    return result.toGeometry();
  }

  /** Returns the points of {@code a} that are not in {@code b}. */
  public static Geometry difference(Geometry a, Geometry b) {
    GeometricPredicates.checkCompatible(a, b);
    Parts pa = GeometryComponents.parts(a);
    Parts pb = GeometryComponents.parts(b);
    Result result = new Result(a);
    addDifference(pa, pb, a, result);
    return result.toGeometry();
  }

  /** Returns the points that are in exactly one of the geometries. */
  public static Geometry symDifference(Geometry a, Geometry b) {
    GeometricPredicates.checkCompatible(a, b);
    Parts pa = GeometryComponents.parts(a);
    Parts pb = GeometryComponents.parts(b);
    Result result = new Result(a);
    addDifference(pa, pb, a, result);
    addDifference(pb, pa, a, result);
    return result.toGeometry();
  }

  private static void addDifference(Parts pa, Parts pb, Geometry reference, Result result) {
    List<Polygon> polygons =
        PolygonOverlay.compute(
            OpType.DIFFERENCE,
            region(pa, reference),
            region(pb, reference),
            reference.getSpatialReference(),
            result.tolerance);
    Result own = new Result(reference);
    own.polygons.addAll(polygons);
    for (LineString line : pa.lines) {
      own.addPieces(
          line.coordinates(), pb.cutters(), mid -> !pb.covers(mid) && !own.coversByArea(mid));
    }
    for (Point p : pa.points) {
      if (!pb.covers(p)) {
        own.addPoint(p);
      }
    }
    result.polygons.addAll(own.polygons);
    result.lines.addAll(own.lines);
    result.points.addAll(own.points);
  }

  /** Returns the polygons of the parts, merged so that their interiors are disjoint. */
  private static List<Polygon> region(Parts parts, Geometry reference) {
    if (parts.polygons.size() <= 1) {
      return parts.polygons;
    }
    return PolygonOverlay.unionAll(
        parts.polygons, reference.getSpatialReference(), parts.tolerance);
  }

  private static boolean onCurve(Parts parts, Point p) {
    if (parts.onLine(p)) {
      return true;
    }
    for (Polygon polygon : parts.polygons) {
      if (polygon.locate(p) == PlanarAlgorithms.Location.BOUNDARY) {
        return true;
      }
    }
    return false;
  }

  /** Decides whether a curve piece, given by its midpoint, belongs to the result. */
  private interface PieceFilter {
    boolean keep(Point midpoint);
  }

  /** The parts of a result, by dimension. */
  private static final class Result {
    final SpatialReference reference;
    final Tolerance tolerance;
    final List<Polygon> polygons = new ArrayList<>();
    final List<LineString> lines = new ArrayList<>();
    final List<Point> points = new ArrayList<>();

    Result(Geometry geometry) {
      this.reference = geometry.getSpatialReference();
      this.tolerance = geometry.tolerance();
    }

    boolean coversByArea(Point p) {
      for (Polygon polygon : polygons) {
        if (polygon.contains(p)) {
          return true;
        }
      }
      return false;
    }

    boolean coversByLine(Point p) {
      for (LineString line : lines) {
        if (line.isPointOnCurve(p)) {
          return true;
        }
      }
      return false;
    }

    /**
     * Splits the curve against the cutters and adds the pieces the filter keeps, joining pieces
     * that follow each other into one LineString.
     */
    void addPieces(List<Point> curve, List<List<Point>> cutters, PieceFilter filter) {
      List<Point> chain = new ArrayList<>();
      for (Point[] piece : PlanarAlgorithms.splitAgainst(curve, cutters, tolerance)) {
        if (!filter.keep(PlanarAlgorithms.midpoint(piece[0], piece[1]))
            || coversByLine(PlanarAlgorithms.midpoint(piece[0], piece[1]))) {
          flush(chain);
          continue;
        }
        Point start = piece[0].to2D();
        if (chain.isEmpty() || !chain.get(chain.size() - 1).approxEquals(start, tolerance)) {
          flush(chain);
          chain.add(start);
        }
        chain.add(piece[1].to2D());
      }
      flush(chain);
    }

    private void flush(List<Point> chain) {
      if (chain.size() >= 2) {
        lines.add(new LineString(new ArrayList<>(chain), reference, tolerance));
      }
      chain.clear();
    }

    /** Adds the point unless it duplicates a result point or lies on a result curve or area. */
    void addPoint(Point p) {
      Point point = p.to2D();
      if (coversByArea(point) || coversByLine(point)) {
        return;
      }
      for (Point q : points) {
        if (q.approxEquals(point, tolerance)) {
          return;
        }
      }
      points.add(point);
    }

    Geometry toGeometry() {
      // Points may have been added before the curves that cover them.
      List<Point> isolated = new ArrayList<>();
      for (Point p : points) {
        if (!coversByArea(p) && !coversByLine(p)) {
          isolated.add(p);
        }
      }
      int kinds =
          (polygons.isEmpty() ? 0 : 1) + (lines.isEmpty() ? 0 : 1) + (isolated.isEmpty() ? 0 : 1);
      if (kinds == 0) {
        return new GeometryCollection<Geometry>(reference, tolerance);
      }
      if (kinds > 1) {
        GeometryCollection<Geometry> result = new GeometryCollection<>(reference, tolerance);
        for (Polygon polygon : polygons) {
          result.add(polygon);
        }
        for (LineString line : lines) {
          result.add(line);
        }
        for (Point p : isolated) {
          result.add(p);
        }
        return result;
      }
      if (!polygons.isEmpty()) {
        return polygons.size() == 1
            ? polygons.get(0)
            : new MultiPolygon(polygons, reference, tolerance);
      }
      if (!lines.isEmpty()) {
        return lines.size() == 1 ? lines.get(0) : new MultiLineString(lines, reference, tolerance);
      }
      return isolated.size() == 1
          ? isolated.get(0)
          : new MultiPoint(isolated, reference, tolerance);
    }
  }
}
