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
import com.google.common.collect.Iterables;
import com.google.common.collect.Lists;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * ConvexHullQuery builds the convex hull of any collection of points, curves, and surfaces in the
 * plane. Only x and y take part, and the hull is always a 2D geometry: z and m values are dropped.
 *
 * <p>The hull is returned as the simplest geometry that represents it:
 *
 * <ul>
 *   <li>an empty {@link Polygon} if no points were added;
 *   <li>a {@link Point} if every input point is approximately the same point;
 *   <li>a two-point {@link LineString} between the extreme points if the input is collinear;
 *   <li>otherwise a {@link Polygon} whose exterior ring is counter-clockwise and has no collinear
 *       vertices.
 * </ul>
 *
 * <p>Hull vertices have exactly the x and y of the input points they come from, so callers can
 * identify which inputs lie on the hull by comparing coordinates.
 */
public final strictfp class ConvexHullQuery {
  private static final Comparator<Point> BY_X_THEN_Y =
      new Comparator<Point>() {
        @Override
        public int compare(Point a, Point b) {
          int result = Double.compare(a.x(), b.x());
          return result != 0 ? result : Double.compare(a.y(), b.y());
        }
      };

  private final SpatialReference reference;
  private final Tolerance tolerance;
  private final List<Point> points = new ArrayList<>();

  /** Constructs a query with the default reference and tolerance. */
  public ConvexHullQuery() {
    this(SpatialReference.DEFAULT, Tolerance.DEFAULT);
  }

  /** Constructs a query whose result has the given reference, and that uses the tolerance. */
  public ConvexHullQuery(SpatialReference reference, Tolerance tolerance) {
    this.reference = Preconditions.checkNotNull(reference);
    this.tolerance = Preconditions.checkNotNull(tolerance);
  }

  /** Adds a point to the input geometry. */
  public void addPoint(Point point) {
    points.add(Preconditions.checkNotNull(point));
  }

  /** Adds the vertices of a curve to the input geometry. */
  public void addLineString(LineString line) {
    points.addAll(line.coordinates());
  }

  /** Adds a polygon to the input geometry. Only its exterior ring can contribute to the hull. */
  public void addPolygon(Polygon polygon) {
    points.addAll(polygon.exteriorCoordinates());
  }

  /** Adds every vertex of an arbitrary geometry to the input geometry. */
  public void addGeometry(Geometry geometry) {
    if (geometry instanceof Polygon) {
      addPolygon((Polygon) geometry);
    } else {
      points.addAll(GeometryComponents.vertices(geometry));
    }
  }

  /**
   * Computes the convex hull of the input geometry provided.
   *
   * <p>Note that this method does not clear the geometry; you can continue adding to it and call
   * this method again if desired.
   */
  public Geometry getConvexHull() {
    // Andrew's monotone chain: sort by x and then y, and build the lower and upper chains.
    List<Point> sorted = new ArrayList<>(points);
    Collections.sort(sorted, BY_X_THEN_Y);
    List<Point> unique = new ArrayList<>(sorted.size());
    for (Point p : sorted) {
      if (!containsApprox(unique, p)) {
        unique.add(p.to2D());
      }
    }

    if (unique.isEmpty()) {
      return new Polygon(reference, tolerance);
    }
    if (unique.size() == 1) {
      return unique.get(0);
    }

    List<Point> lower = getMonotoneChain(unique);
    List<Point> upper = getMonotoneChain(Lists.reverse(unique));
    // Both chains run between the two extreme points.
    lower.remove(lower.size() - 1);
    upper.remove(upper.size() - 1);
    lower.addAll(upper);
    if (lower.size() < 3) {
      return new LineString(
          ImmutableList.of(unique.get(0), Iterables.getLast(unique)), reference, tolerance);
    }
    lower.add(lower.get(0));
    return new Polygon(
        new LinearRing(lower, reference, tolerance), ImmutableList.of(), reference, tolerance);
  }

  /** Returns the convex hull of the given points, with the reference of the first point. */
  public static Geometry convexHull(List<Point> points, Tolerance tolerance) {
    SpatialReference reference =
        points.isEmpty() ? SpatialReference.DEFAULT : points.get(0).getSpatialReference();
    ConvexHullQuery query = new ConvexHullQuery(reference, tolerance);
    for (Point p : points) {
      query.addPoint(p);
    }
    return query.getConvexHull();
  }

  /**
   * Iterate through the given points, selecting the maximal subset of points such that the edge
   * chain makes only left (CCW) turns.
   */
  private List<Point> getMonotoneChain(List<Point> sortedPoints) {
    List<Point> output = new ArrayList<>();
    for (Point p : sortedPoints) {
      // Remove any points that would cause the chain to make a clockwise or straight turn.
      while (output.size() >= 2
          && PlanarAlgorithms.orientation(
                  output.get(output.size() - 2), Iterables.getLast(output), p, tolerance)
              <= 0) {
        output.remove(output.size() - 1);
      }
      output.add(p);
    }
    return output;
  }

  private boolean containsApprox(List<Point> list, Point p) {
    // Sorted input, so approximate duplicates are near the end.
    for (int i = list.size() - 1; i >= 0; i--) {
      Point q = list.get(i);
      if (tolerance.equal(q.x(), p.x()) && tolerance.equal(q.y(), p.y())) {
        return true;
      }
      if (p.x() - q.x() > tolerance.epsilon()) {
        return false;
      }
    }
    return false;
  }
}
