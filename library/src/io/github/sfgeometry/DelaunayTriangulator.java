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

import static java.lang.Math.max;

import com.google.common.collect.ImmutableList;
import it.unimi.dsi.fastutil.longs.LongIterator;
import it.unimi.dsi.fastutil.longs.LongLinkedOpenHashSet;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Computes the Delaunay triangulation of a set of points in the plane with the Bowyer-Watson
 * incremental algorithm.
 *
 * <p>The triangulation starts from a triangle of three non-collinear input points. Each edge of the
 * convex hull is closed off by a "ghost" face whose third vertex is a symbolic point at infinity;
 * the circumcircle of a ghost face is the open half-plane outside its hull edge together with the
 * open edge itself. Each insertion removes the faces whose circumcircle contains the new point,
 * and fills the resulting cavity with faces fanning out from the point to each edge of the cavity
 * boundary. Since no finite enclosing triangle is used, the real faces always cover the convex
 * hull of the input, however thin it is.
 *
 * <p>The circumcircle test is inclusive, so points exactly on a circumcircle are treated as
 * inside it. Points that are approximately equal are rejected up front. The running time is
 * O(n^2) in the worst case, so callers with latency bounds should limit the input size.
 *
 * <p>Z and M coordinates are carried through to the output triangles but play no part in the
 * triangulation.
 */
public final strictfp class DelaunayTriangulator {
  private static final Logger log = Platform.getLoggerForClass(DelaunayTriangulator.class);

  /** The vertex index of the point at infinity shared by all ghost faces. */
  private static final int GHOST = -1;

  private final Tolerance tolerance;

  /** Constructs a triangulator with the default tolerance. */
  public DelaunayTriangulator() {
    this(Tolerance.DEFAULT);
  }

  /** Constructs a triangulator that compares points and circumcircles with the given tolerance. */
  public DelaunayTriangulator(Tolerance tolerance) {
    this.tolerance = tolerance;
  }

  /**
   * A face of vertex indices in counter-clockwise order. For a ghost face {@code c} is GHOST and
   * the directed edge from {@code a} to {@code b} has the exterior of the hull on its left.
   */
  private static final class Face {
    final int a;
    final int b;
    final int c;
    final double centerX;
    final double centerY;
    final double radius;

    Face(int a, int b, int c, List<Point> points) {
      this.a = a;
      this.b = b;
      this.c = c;
      if (c == GHOST) {
        centerX = 0;
        centerY = 0;
        radius = Double.POSITIVE_INFINITY;
        return;
      }
      Point center = PlanarAlgorithms.circumcenter(points.get(a), points.get(b), points.get(c));
      if (center == null) {
        // Collinear faces are never created, see addFace().
        throw new GeometryException(
            GeometryError.Code.INTERNAL, "Collinear face %d, %d, %d", a, b, c);
      }
      this.centerX = center.x();
      this.centerY = center.y();
      this.radius = center.distance2D(points.get(a));
    }

    boolean isGhost() {
      return c == GHOST;
    }
  }

  /**
   * Returns the Delaunay triangles of the given points, each with its vertices in
   * counter-clockwise order. Fewer than three points, or points that are all collinear, produce no
   * triangles.
   *
   * @throws GeometryException with code DUPLICATE_POINT if two points are approximately equal
   */
  public ImmutableList<Triangle> triangulate(List<Point> points) {
    checkNoDuplicates(points);
    if (points.size() < 3) {
      return ImmutableList.of();
    }
    int[] seed = findSeed(points);
    if (seed == null) {
      log.fine("All points are collinear, no Delaunay triangles");
      return ImmutableList.of();
    }

    List<Face> faces = new ArrayList<>();
    addFace(faces, seed[0], seed[1], seed[2], points);
    Face first = faces.get(0);
    faces.add(new Face(first.b, first.a, GHOST, points));
    faces.add(new Face(first.c, first.b, GHOST, points));
    faces.add(new Face(first.a, first.c, GHOST, points));
    for (int i = 0; i < points.size(); i++) {
      if (i != seed[0] && i != seed[1] && i != seed[2]) {
        insert(i, faces, points);
      }
    }

    ImmutableList.Builder<Triangle> result = ImmutableList.builder();
    for (Face face : faces) {
      if (face.isGhost()) {
        continue;
      }
      Point a = points.get(face.a);
      Point b = points.get(face.b);
      Point c = points.get(face.c);
      if (Triangle.isDegenerate(a, b, c, tolerance)) {
        log.fine("Skipping a degenerate Delaunay triangle");
        continue;
      }
      result.add(new Triangle(a, b, c, a.getSpatialReference(), tolerance));
    }
    return result.build();
  }

  private void checkNoDuplicates(List<Point> points) {
    for (int i = 0; i < points.size(); i++) {
      Point p = points.get(i);
      for (int j = i + 1; j < points.size(); j++) {
        Point q = points.get(j);
        if (tolerance.equal(p.x(), q.x()) && tolerance.equal(p.y(), q.y())) {
          throw new GeometryException(
              GeometryError.Code.DUPLICATE_POINT,
              "Points %d and %d are both at %s",
              i + 1,
              j + 1,
              p);
        }
      }
    }
  }

  /**
   * Returns the indices of the first point, the point farthest from it, and the point farthest
   * from the line through both, or null if every point is collinear with the first two.
   */
  private int @Nullable [] findSeed(List<Point> points) {
    Point a = points.get(0);
    int far = 1;
    for (int i = 2; i < points.size(); i++) {
      if (a.distance2D(points.get(i)) > a.distance2D(points.get(far))) {
        far = i;
      }
    }
    Point b = points.get(far);
    int apex = -1;
    double best = 0;
    for (int i = 1; i < points.size(); i++) {
      double area = Math.abs(PlanarAlgorithms.ccw(a, b, points.get(i)));
      if (i != far && area > best) {
        best = area;
        apex = i;
      }
    }
    if (apex < 0 || Triangle.isDegenerate(a, b, points.get(apex), tolerance)) {
      return null;
    }
    return new int[] {0, far, apex};
  }

  /** Inserts point i, replacing the faces whose circumcircle contains it. */
  private void insert(int i, List<Face> faces, List<Point> points) {
    Point p = points.get(i);
    // Directed edges of the faces being removed; an edge whose reverse is absent bounds the cavity.
    LongLinkedOpenHashSet cavityEdges = new LongLinkedOpenHashSet();
    List<Face> kept = new ArrayList<>(faces.size());
    for (Face face : faces) {
      if (inCircumcircle(face, p, points)) {
        cavityEdges.add(edgeKey(face.a, face.b));
        cavityEdges.add(edgeKey(face.b, face.c));
        cavityEdges.add(edgeKey(face.c, face.a));
      } else {
        kept.add(face);
      }
    }
    faces.clear();
    faces.addAll(kept);
    for (LongIterator it = cavityEdges.iterator(); it.hasNext(); ) {
      long key = it.nextLong();
      int from = (int) (key >> 32);
      int to = (int) key;
      if (cavityEdges.contains(edgeKey(to, from))) {
        continue;
      }
      if (to == GHOST) {
        faces.add(new Face(i, from, GHOST, points));
      } else if (from == GHOST) {
        faces.add(new Face(to, i, GHOST, points));
      } else {
        addFace(faces, from, to, i, points);
      }
    }
  }

  private boolean inCircumcircle(Face face, Point p, List<Point> points) {
    if (face.isGhost()) {
      Point a = points.get(face.a);
      Point b = points.get(face.b);
      int side = PlanarAlgorithms.orientation(a, b, p, tolerance);
      return side > 0 || (side == 0 && isStrictlyBetween(p, a, b));
    }
    double dx = p.x() - face.centerX;
    double dy = p.y() - face.centerY;
    double distance = Math.sqrt(dx * dx + dy * dy);
    return distance <= face.radius + tolerance.epsilon() * max(1, face.radius);
  }

  /** Returns true if p, known to be collinear with a and b, lies strictly inside segment ab. */
  private static boolean isStrictlyBetween(Point p, Point a, Point b) {
    double ux = b.x() - a.x();
    double uy = b.y() - a.y();
    return (p.x() - a.x()) * ux + (p.y() - a.y()) * uy > 0
        && (p.x() - b.x()) * ux + (p.y() - b.y()) * uy < 0;
  }

  private static long edgeKey(int from, int to) {
    return ((long) from << 32) | (to & 0xffffffffL);
  }

  /** Adds the face if it is not collinear, with its vertices in counter-clockwise order. */
  private void addFace(List<Face> faces, int a, int b, int c, List<Point> points) {
    double ccw = PlanarAlgorithms.ccw(points.get(a), points.get(b), points.get(c));
    if (ccw == 0) {
      return;
    }
    faces.add(ccw > 0 ? new Face(a, b, c, points) : new Face(a, c, b, points));
  }
}
