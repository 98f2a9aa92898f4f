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
import static java.lang.Math.max;
import static java.lang.Math.sqrt;

import com.google.common.collect.LinkedHashMultiset;
import com.google.common.collect.Multiset;
import com.google.common.primitives.Doubles;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Stateless planar algorithms shared by the geometry types: orientation and segment intersection
 * tests, shoelace area and centroid, ray casting containment, curve simplicity, the mod-2
 * boundary rule, and circumcircles.
 *
 * <p>Rings are passed as point lists whose first and last points are equal. Every method that
 * compares coordinates takes an explicit {@link Tolerance}. Results near the tolerance are
 * approximate; no exact arithmetic is attempted.
 */
public final strictfp class PlanarAlgorithms {

  /** The position of a point relative to a region. */
  public enum Location {
    INTERIOR,
    BOUNDARY,
    EXTERIOR
  }

  private PlanarAlgorithms() {}

  /**
   * Returns {@code (c.y - a.y) * (b.x - a.x) - (b.y - a.y) * (c.x - a.x)}, twice the signed area of
   * triangle abc. The value is positive if a, b, c turn counter-clockwise, negative if they turn
   * clockwise, and zero if they are collinear.
   */
  public static double ccw(Point a, Point b, Point c) {
    return (c.y() - a.y()) * (b.x() - a.x()) - (b.y() - a.y()) * (c.x() - a.x());
  }

  /** Returns the sign of {@link #ccw}, where values within the tolerance are treated as zero. */
  public static int orientation(Point a, Point b, Point c, Tolerance tolerance) {
    return tolerance.sign(ccw(a, b, c));
  }

  /**
   * Returns true if segments p1p2 and p3p4 properly cross: p3 and p4 lie strictly on opposite
   * sides of p1p2, and p1 and p2 lie strictly on opposite sides of p3p4. Collinear and touching
   * configurations, including segments that share an endpoint, are not crossings.
   */
  public static boolean segmentsIntersect(
      Point p1, Point p2, Point p3, Point p4, Tolerance tolerance) {
    int d1 = orientation(p1, p2, p3, tolerance);
    int d2 = orientation(p1, p2, p4, tolerance);
    int d3 = orientation(p3, p4, p1, tolerance);
    int d4 = orientation(p3, p4, p2, tolerance);
    return d1 * d2 < 0 && d3 * d4 < 0;
  }

  /**
   * Returns true if segments p1p2 and p3p4 have any point in common: they cross, touch, share an
   * endpoint, or overlap collinearly.
   */
  public static boolean segmentsTouchOrCross(
      Point p1, Point p2, Point p3, Point p4, Tolerance tolerance) {
    return segmentsIntersect(p1, p2, p3, p4, tolerance)
        || isPointOnSegment(p1, p3, p4, tolerance)
        || isPointOnSegment(p2, p3, p4, tolerance)
        || isPointOnSegment(p3, p1, p2, tolerance)
        || isPointOnSegment(p4, p1, p2, tolerance);
  }

  /**
   * Returns the points where segments a0a1 and b0b1 meet: none, a single crossing or touching
   * point, or the two endpoints of a collinear overlap. Endpoints that lie on the other segment are
   * returned exactly as given, so that callers splitting edges at these points produce identical
   * vertices on both sides.
   */
  public static List<Point> segmentIntersections(
      Point a0, Point a1, Point b0, Point b1, Tolerance tolerance) {
    List<Point> result = new ArrayList<>(2);
    if (isPointOnSegment(a0, b0, b1, tolerance)) {
      addDistinct(result, a0, tolerance);
    }
    if (isPointOnSegment(a1, b0, b1, tolerance)) {
      addDistinct(result, a1, tolerance);
    }
    if (isPointOnSegment(b0, a0, a1, tolerance)) {
      addDistinct(result, b0, tolerance);
    }
    if (isPointOnSegment(b1, a0, a1, tolerance)) {
      addDistinct(result, b1, tolerance);
    }
    if (!result.isEmpty()) {
      return result;
    }
    if (segmentsIntersect(a0, a1, b0, b1, tolerance)) {
      Point crossing = lineIntersection(a0, a1, b0, b1);
      if (crossing != null) {
        result.add(crossing);
      }
    }
    return result;
  }

  /**
   * Returns the intersection of the infinite lines through a0a1 and b0b1, or null if they are
   * parallel.
   */
  static @Nullable Point lineIntersection(Point a0, Point a1, Point b0, Point b1) {
    double rx = a1.x() - a0.x();
    double ry = a1.y() - a0.y();
    double sx = b1.x() - b0.x();
    double sy = b1.y() - b0.y();
    double denom = rx * sy - ry * sx;
    if (denom == 0) {
      return null;
    }
    double t = ((b0.x() - a0.x()) * sy - (b0.y() - a0.y()) * sx) / denom;
    return new Point(a0.x() + t * rx, a0.y() + t * ry);
  }

  private static void addDistinct(List<Point> points, Point p, Tolerance tolerance) {
    for (Point q : points) {
      if (q.approxEquals(p, tolerance)) {
        return;
      }
    }
    points.add(p);
  }

  /** Returns the point of segment ab closest to p. */
  public static Point closestPointOnSegment(Point p, Point a, Point b) {
    double dx = b.x() - a.x();
    double dy = b.y() - a.y();
    double len2 = dx * dx + dy * dy;
    if (len2 == 0) {
      return a;
    }
    double t = ((p.x() - a.x()) * dx + (p.y() - a.y()) * dy) / len2;
    if (t <= 0) {
      return a;
    }
    if (t >= 1) {
      return b;
    }
    return new Point(a.x() + t * dx, a.y() + t * dy);
  }

  /** Returns the planar distance from p to segment ab. */
  public static double distancePointSegment(Point p, Point a, Point b) {
    return p.distance2D(closestPointOnSegment(p, a, b));
  }

  /** Returns true if p is within the tolerance of segment ab. */
  public static boolean isPointOnSegment(Point p, Point a, Point b, Tolerance tolerance) {
    return distancePointSegment(p, a, b) <= tolerance.epsilon();
  }

  /**
   * Returns the shoelace area {@code 1/2 * sum(x[i] * y[i+1] - x[i+1] * y[i])} of the ring. The
   * result is positive for counter-clockwise rings and negative for clockwise rings.
   */
  public static double signedArea(List<Point> ring) {
    int n = ring.size();
    if (n < 3) {
      return 0;
    }
    // Translate to the first vertex to reduce cancellation for rings far from the origin.
    Point origin = ring.get(0);
    double sum = 0;
    for (int i = 0; i < n; i++) {
      Point a = ring.get(i);
      Point b = ring.get((i + 1) % n);
      double ax = a.x() - origin.x();
      double ay = a.y() - origin.y();
      double bx = b.x() - origin.x();
      double by = b.y() - origin.y();
      sum += ax * by - bx * ay;
    }
    return 0.5 * sum;
  }

  /**
   * Returns the orientation sum {@code sum((x[i+1] - x[i]) * (y[i+1] + y[i]))} of the ring. This
   * equals {@code -2 * signedArea(ring)}, so it is negative for counter-clockwise rings.
   */
  public static double orientationSum(List<Point> ring) {
    int n = ring.size();
    double sum = 0;
    for (int i = 0; i < n; i++) {
      Point a = ring.get(i);
      Point b = ring.get((i + 1) % n);
      sum += (b.x() - a.x()) * (b.y() + a.y());
    }
    return sum;
  }

  /** Returns true if the ring has positive signed area. */
  public static boolean isCounterClockwise(List<Point> ring) {
    return signedArea(ring) > 0;
  }

  /**
   * Returns the unsigned area of the ring and its area centroid, computed from the same cross terms
   * as the shoelace formula. The centroid is null if the ring has zero area.
   */
  public static AreaCentroid ringAreaCentroid(List<Point> ring, Tolerance tolerance) {
    int n = ring.size();
    if (n < 3) {
      return new AreaCentroid(0, null);
    }
    Point origin = ring.get(0);
    double area2 = 0;
    double cx = 0;
    double cy = 0;
    for (int i = 0; i < n; i++) {
      Point a = ring.get(i);
      Point b = ring.get((i + 1) % n);
      double ax = a.x() - origin.x();
      double ay = a.y() - origin.y();
      double bx = b.x() - origin.x();
      double by = b.y() - origin.y();
      double cross = ax * by - bx * ay;
      area2 += cross;
      cx += (ax + bx) * cross;
      cy += (ay + by) * cross;
    }
    if (tolerance.isZero(area2)) {
      return new AreaCentroid(0, null);
    }
    Point centroid = new Point(origin.x() + cx / (3 * area2), origin.y() + cy / (3 * area2));
    return new AreaCentroid(abs(0.5 * area2), centroid);
  }

  /**
   * Returns true if a horizontal ray cast from p towards +x crosses the ring an odd number of
   * times. Points exactly on the boundary may go either way; use {@link #locatePointInRing} when
   * the boundary matters.
   */
  public static boolean isPointInRing(Point p, List<Point> ring) {
    boolean inside = false;
    int n = ring.size();
    for (int i = 0, j = n - 1; i < n; j = i++) {
      Point a = ring.get(i);
      Point b = ring.get(j);
      if ((a.y() > p.y()) != (b.y() > p.y())) {
        double xCross = (b.x() - a.x()) * (p.y() - a.y()) / (b.y() - a.y()) + a.x();
        if (p.x() < xCross) {
          inside = !inside;
        }
      }
    }
    return inside;
  }

  /** Classifies p as inside, on the boundary of, or outside the ring. */
  public static Location locatePointInRing(Point p, List<Point> ring, Tolerance tolerance) {
    for (int i = 0; i + 1 < ring.size(); i++) {
      if (isPointOnSegment(p, ring.get(i), ring.get(i + 1), tolerance)) {
        return Location.BOUNDARY;
      }
    }
    return isPointInRing(p, ring) ? Location.INTERIOR : Location.EXTERIOR;
  }

  /**
   * Classifies p against a region bounded by an exterior ring and holes. Points on any ring are on
   * the boundary; points inside a hole are exterior.
   */
  public static Location locatePointInPolygon(
      Point p, List<Point> exterior, List<List<Point>> holes, Tolerance tolerance) {
    Location location = locatePointInRing(p, exterior, tolerance);
    if (location != Location.INTERIOR) {
      return location;
    }
    for (List<Point> hole : holes) {
      Location inHole = locatePointInRing(p, hole, tolerance);
      if (inHole == Location.BOUNDARY) {
        return Location.BOUNDARY;
      }
      if (inHole == Location.INTERIOR) {
        return Location.EXTERIOR;
      }
    }
    return Location.INTERIOR;
  }

  /** Returns a copy of the points with consecutive approximately equal points collapsed. */
  public static List<Point> removeRepeatedPoints(List<Point> points, Tolerance tolerance) {
    List<Point> result = new ArrayList<>(points.size());
    for (Point p : points) {
      if (result.isEmpty() || !result.get(result.size() - 1).approxEquals(p, tolerance)) {
        result.add(p);
      }
    }
    return result;
  }

  /**
   * Returns true if the curve through the given points has no self-intersections. Adjacent
   * segments may only share their common vertex, and for closed curves the first and last segments
   * may only share the closing vertex. Any other pair of segments must not cross, touch, or
   * overlap. Repeated consecutive points are ignored.
   */
  public static boolean isSimple(List<Point> points, Tolerance tolerance) {
    List<Point> pts = removeRepeatedPoints(points, tolerance);
    int n = pts.size();
    if (n < 3) {
      return true;
    }
    boolean closed = pts.get(0).approxEquals(pts.get(n - 1), tolerance);
    int segments = n - 1;
    for (int i = 0; i < segments; i++) {
      Point a0 = pts.get(i);
      Point a1 = pts.get(i + 1);
      for (int j = i + 1; j < segments; j++) {
        Point b0 = pts.get(j);
        Point b1 = pts.get(j + 1);
        if (j == i + 1) {
          // Shared vertex a1 == b0. The segments must not fold back onto each other.
          if (isPointOnSegment(b1, a0, a1, tolerance) || isPointOnSegment(a0, b0, b1, tolerance)) {
            return false;
          }
        } else if (closed && i == 0 && j == segments - 1) {
          // Shared closing vertex a0 == b1.
          if (isPointOnSegment(b0, a0, a1, tolerance) || isPointOnSegment(a1, b0, b1, tolerance)) {
            return false;
          }
        } else if (segmentsTouchOrCross(a0, a1, b0, b1, tolerance)) {
          return false;
        }
      }
    }
    return true;
  }

  /**
   * Returns true if the points form a valid ring: either no points at all, or at least 4 points
   * where the first equals the last and the ring does not intersect itself.
   */
  public static boolean isValidRing(List<Point> ring, Tolerance tolerance) {
    if (ring.isEmpty()) {
      return true;
    }
    return ring.size() >= 4
        && ring.get(0).approxEquals(ring.get(ring.size() - 1), tolerance)
        && isSimple(ring, tolerance);
  }

  /**
   * Applies the mod-2 rule: returns, in order of first appearance, the distinct points that occur
   * an odd number of times among the given endpoints. Approximately equal points are counted as
   * the same point, represented by its first occurrence.
   */
  public static List<Point> mod2Boundary(List<Point> endpoints, Tolerance tolerance) {
    List<Point> representatives = new ArrayList<>();
    Multiset<Point> counts = LinkedHashMultiset.create();
    for (Point p : endpoints) {
      Point representative = null;
      for (Point r : representatives) {
        if (r.approxEquals(p, tolerance)) {
          representative = r;
          break;
        }
      }
      if (representative == null) {
        representative = p;
        representatives.add(p);
      }
      counts.add(representative);
    }
    List<Point> result = new ArrayList<>();
    for (Multiset.Entry<Point> entry : counts.entrySet()) {
      if (entry.getCount() % 2 == 1) {
        result.add(entry.getElement());
      }
    }
    return result;
  }

  /** Returns the center of the circle through a, b, and c, or null if they are collinear. */
  public static @Nullable Point circumcenter(Point a, Point b, Point c) {
    double bx = b.x() - a.x();
    double by = b.y() - a.y();
    double cx = c.x() - a.x();
    double cy = c.y() - a.y();
    double d = 2 * (bx * cy - by * cx);
    if (d == 0) {
      return null;
    }
    double b2 = bx * bx + by * by;
    double c2 = cx * cx + cy * cy;
    double ux = (cy * b2 - by * c2) / d;
    double uy = (bx * c2 - cx * b2) / d;
    return new Point(a.x() + ux, a.y() + uy);
  }

  /**
   * Returns true if p lies inside or on the circumcircle of triangle abc. The comparison is
   * inclusive within the tolerance, scaled by the circumradius. Collinear triangles have no
   * circumcircle and contain nothing.
   */
  public static boolean inCircumcircle(Point a, Point b, Point c, Point p, Tolerance tolerance) {
    Point center = circumcenter(a, b, c);
    if (center == null) {
      return false;
    }
    double radius = center.distance2D(a);
    return center.distance2D(p) <= radius + tolerance.epsilon() * max(1, radius);
  }

  /** Returns the unsigned area of triangle abc. */
  public static double triangleArea(Point a, Point b, Point c) {
    return 0.5 * abs(ccw(a, b, c));
  }

  /**
   * Returns a point strictly inside the region bounded by the exterior ring and holes, or null if
   * the region has no interior. A horizontal scan line is placed between vertex y-coordinates near
   * the middle of the region, and the midpoint of the widest interior span on it is returned.
   */
  public static @Nullable Point interiorPoint(
      List<Point> exterior, List<List<Point>> holes, Tolerance tolerance) {
    Envelope bound = Envelope.fromPoints(exterior);
    if (bound.isEmpty() || tolerance.isZero(bound.getHeight())) {
      return null;
    }
    double center = 0.5 * (bound.minY() + bound.maxY());
    double below = bound.minY();
    double above = bound.maxY();
    List<List<Point>> rings = new ArrayList<>();
    rings.add(exterior);
    rings.addAll(holes);
    for (List<Point> ring : rings) {
      for (Point p : ring) {
        double y = p.y();
        if (y <= center && y > below) {
          below = y;
        }
        if (y > center && y < above) {
          above = y;
        }
      }
    }
    // No vertex lies strictly between below and above, so the scan line misses every vertex.
    double scanY = 0.5 * (below + above);
    List<Double> crossings = new ArrayList<>();
    for (List<Point> ring : rings) {
      for (int i = 0; i + 1 < ring.size(); i++) {
        Point a = ring.get(i);
        Point b = ring.get(i + 1);
        if ((a.y() > scanY) != (b.y() > scanY)) {
          crossings.add(a.x() + (scanY - a.y()) * (b.x() - a.x()) / (b.y() - a.y()));
        }
      }
    }
    double[] xs = Doubles.toArray(crossings);
    Arrays.sort(xs);
    double bestWidth = -1;
    double bestX = 0;
    for (int i = 0; i + 1 < xs.length; i += 2) {
      double width = xs[i + 1] - xs[i];
      if (width > bestWidth) {
        bestWidth = width;
        bestX = 0.5 * (xs[i] + xs[i + 1]);
      }
    }
    if (bestWidth <= 0) {
      return null;
    }
    return new Point(bestX, scanY);
  }

  /**
   * Returns the Newell normal of the ring: a vector perpendicular to the plane of the ring whose
   * length is twice the area the ring encloses in that plane, pointing towards the side from which
   * the ring appears counter-clockwise. Missing z coordinates are treated as 0.
   */
  public static double[] newellNormal(List<Point> ring) {
    double nx = 0;
    double ny = 0;
    double nz = 0;
    int n = ring.size();
    if (n < 3) {
      return new double[] {0, 0, 0};
    }
    Point origin = ring.get(0);
    double oz = zOrZero(origin);
    for (int i = 0; i < n; i++) {
      Point a = ring.get(i);
      Point b = ring.get((i + 1) % n);
      double ax = a.x() - origin.x();
      double ay = a.y() - origin.y();
      double az = zOrZero(a) - oz;
      double bx = b.x() - origin.x();
      double by = b.y() - origin.y();
      double bz = zOrZero(b) - oz;
      nx += (ay - by) * (az + bz);
      ny += (az - bz) * (ax + bx);
      nz += (ax - bx) * (ay + by);
    }
    return new double[] {nx, ny, nz};
  }

  static double zOrZero(Point p) {
    return p.is3D() ? p.z() : 0;
  }

  /**
   * Returns the index (0 for x, 1 for y, 2 for z) of the largest absolute component of the normal.
   * Dropping that coordinate projects a planar ring onto an axis plane without collapsing it. Ties
   * prefer z, so rings that are not vertical project onto the xy plane.
   */
  public static int dominantAxis(double[] normal) {
    double ax = abs(normal[0]);
    double ay = abs(normal[1]);
    double az = abs(normal[2]);
    if (az >= ax && az >= ay) {
      return 2;
    }
    return ax >= ay ? 0 : 1;
  }

  /**
   * Projects the points onto the axis plane that drops the given coordinate, returning 2D points.
   * Dropping z returns the points unchanged.
   */
  public static List<Point> projectDroppingAxis(List<Point> points, int axis) {
    if (axis == 2) {
      return points;
    }
    List<Point> result = new ArrayList<>(points.size());
    for (Point p : points) {
      double z = zOrZero(p);
      result.add(axis == 0 ? new Point(p.y(), z) : new Point(z, p.x()));
    }
    return result;
  }

  /** Returns the area enclosed by a planar ring in 3D, measured in the ring's own plane. */
  public static double vectorArea(List<Point> ring) {
    double[] n = newellNormal(ring);
    return 0.5 * sqrt(n[0] * n[0] + n[1] * n[1] + n[2] * n[2]);
  }

  /**
   * Returns true if every point of the ring lies within the tolerance of the plane through the
   * ring, as given by its Newell normal. Rings with no area are planar.
   */
  public static boolean isPlanar(List<Point> ring, Tolerance tolerance) {
    double[] n = newellNormal(ring);
    double length = sqrt(n[0] * n[0] + n[1] * n[1] + n[2] * n[2]);
    if (tolerance.isZero(length)) {
      return true;
    }
    Point origin = ring.get(0);
    for (Point p : ring) {
      double d =
          (n[0] * (p.x() - origin.x())
                  + n[1] * (p.y() - origin.y())
                  + n[2] * (zOrZero(p) - zOrZero(origin)))
              / length;
      if (abs(d) > tolerance.epsilon() * max(1, sqrt(length))) {
        return false;
      }
    }
    return true;
  }

  /** Returns the midpoint of the segment ab in the plane. */
  public static Point midpoint(Point a, Point b) {
    return new Point(0.5 * (a.x() + b.x()), 0.5 * (a.y() + b.y()), a.getSpatialReference());
  }

  /**
   * Splits the curve through the given points wherever it meets a segment of one of the cutting
   * curves, and returns the pieces in order along the curve, each as a two-element array of its
   * start and end point. Pieces shorter than the tolerance are dropped, so no piece crosses a
   * cutting curve and every piece either overlaps a cutting segment entirely or meets the cutting
   * curves only at its ends.
   */
  public static List<Point[]> splitAgainst(
      List<Point> curve, List<List<Point>> cutters, Tolerance tolerance) {
    List<Point[]> pieces = new ArrayList<>();
    for (int i = 0; i + 1 < curve.size(); i++) {
      final Point a = curve.get(i);
      Point b = curve.get(i + 1);
      if (a.approxEquals(b, tolerance)) {
        continue;
      }
      Envelope bound = Envelope.fromPoints(Arrays.asList(a, b)).expanded(tolerance.epsilon());
      List<Point> splits = new ArrayList<>();
      splits.add(a);
      splits.add(b);
      for (List<Point> cutter : cutters) {
        for (int j = 0; j + 1 < cutter.size(); j++) {
          Point c = cutter.get(j);
          Point d = cutter.get(j + 1);
          if (bound.intersects(Envelope.fromPoints(Arrays.asList(c, d)))) {
            splits.addAll(segmentIntersections(a, b, c, d, tolerance));
          }
        }
      }
      final double dx = b.x() - a.x();
      final double dy = b.y() - a.y();
      splits.sort(
          (p, q) ->
              Double.compare(
                  (p.x() - a.x()) * dx + (p.y() - a.y()) * dy,
                  (q.x() - a.x()) * dx + (q.y() - a.y()) * dy));
      Point start = splits.get(0);
      for (int k = 1; k < splits.size(); k++) {
        Point end = splits.get(k);
        if (!start.approxEquals(end, tolerance)) {
          pieces.add(new Point[] {start, end});
          start = end;
        }
      }
    }
    return pieces;
  }

  /** Returns the length of the segment ab in the plane. */
  static double segmentLength(Point a, Point b) {
    double dx = b.x() - a.x();
    double dy = b.y() - a.y();
    return sqrt(dx * dx + dy * dy);
  }
}
