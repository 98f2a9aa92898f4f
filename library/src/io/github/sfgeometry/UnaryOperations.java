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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static java.lang.Math.PI;
import static java.lang.Math.cos;
import static java.lang.Math.sin;

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import io.github.sfgeometry.GeometryComponents.Parts;
import io.github.sfgeometry.PolygonOverlay.OpType;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Operations that derive a new geometry from a single one: its envelope, boundary, convex hull,
 * and buffer. Like {@link BinaryOperations}, these work in the xy-plane and return 2D results with
 * the spatial reference and tolerance of the input.
 */
public final strictfp class UnaryOperations {
  private static final Logger log = Platform.getLoggerForClass(UnaryOperations.class);

  private UnaryOperations() {}

  /** Options for {@link #buffer(Geometry, double, BufferOptions)}. */
  public static class BufferOptions {
    /** The fewest segments a full circle may be approximated with. */
    public static final int MIN_SEGMENTS = 8;

    private int segments = 32;

    /** Constructor that sets default options. */
    public BufferOptions() {}

    /** Options copy constructor. */
    public BufferOptions(BufferOptions other) {
      this.segments = other.segments;
    }

    /** Returns the number of segments per full circle. See {@link #setSegments(int)}. */
    public int segments() {
      return segments;
    }

    /**
     * Specifies the number of segments used to approximate a full circle around a point. Round
     * caps at the ends of line segments use half as many. The approximating polygon is inscribed
     * in the true circle, so more segments give a result closer to the exact buffer.
     *
     * <p>DEFAULT: 32
     *
     * @throws IllegalArgumentException if segments is less than {@link #MIN_SEGMENTS}
     */
    @CanIgnoreReturnValue
    public BufferOptions setSegments(int segments) {
      checkArgument(
          segments >= MIN_SEGMENTS, "segments must be at least %s, was %s", MIN_SEGMENTS, segments);
      this.segments = segments;
      return this;
    }
  }

  /**
   * Returns the bounding box of the geometry as the simplest geometry that holds it: an empty
   * Polygon for an empty geometry, a Point if the box has no extent, a LineString if it is flat
   * along one axis, and otherwise a counterclockwise rectangle.
   */
  public static Geometry envelope(Geometry geometry) {
    SpatialReference reference = geometry.getSpatialReference();
    Tolerance tolerance = geometry.tolerance();
    Envelope box = geometry.getEnvelope();
    if (box.isEmpty()) {
      return new Polygon(reference, tolerance);
    }
    Point low = new Point(box.minX(), box.minY(), reference);
    Point high = new Point(box.maxX(), box.maxY(), reference);
    boolean flatX = tolerance.isZero(box.getWidth());
    boolean flatY = tolerance.isZero(box.getHeight());
    if (flatX && flatY) {
      return low;
    }
    if (flatX || flatY) {
      return new LineString(ImmutableList.of(low, high), reference, tolerance);
    }
    List<Point> ring =
        ImmutableList.of(
            low,
            new Point(box.maxX(), box.minY(), reference),
            high,
            new Point(box.minX(), box.maxY(), reference),
            low);
    return new Polygon(
        new LinearRing(ring, reference, tolerance), ImmutableList.of(), reference, tolerance);
  }

  /** Returns the combinatorial boundary of the geometry. */
  public static Geometry boundary(Geometry geometry) {
    return geometry.boundary();
  }

  /** Returns the smallest convex geometry that contains every vertex of the geometry. */
  public static Geometry convexHull(Geometry geometry) {
    ConvexHullQuery query =
        new ConvexHullQuery(geometry.getSpatialReference(), geometry.tolerance());
    query.addGeometry(geometry);
    return query.getConvexHull();
  }

  /** As {@link #buffer(Geometry, double, BufferOptions)}, with default options. */
  public static Geometry buffer(Geometry geometry, double distance) {
    return buffer(geometry, distance, new BufferOptions());
  }

  /**
   * Returns the points within {@code distance} of the geometry, approximated by polygons. Points
   * become circles, and curves become the union of round-capped strips along their segments.
   *
   * <p>A zero distance returns the polygonal part of the geometry. A negative distance erodes the
   * polygonal part by removing the points within {@code -distance} of its rings; points and curves
   * have no interior to erode, so they contribute nothing.
   *
   * @return a Polygon, a MultiPolygon, or an empty Polygon
   */
  public static Geometry buffer(Geometry geometry, double distance, BufferOptions options) {
    checkNotNull(options);
    checkArgument(Double.isFinite(distance), "distance must be finite, was %s", distance);
    SpatialReference reference = geometry.getSpatialReference();
    Tolerance tolerance = geometry.tolerance();
    Parts parts = GeometryComponents.parts(geometry);
    List<Polygon> region =
        parts.polygons.isEmpty()
            ? ImmutableList.of()
            : PolygonOverlay.unionAll(parts.polygons, reference, tolerance);

    List<Polygon> result;
    if (tolerance.isZero(distance)) {
      result = region;
    } else if (distance > 0) {
      List<Polygon> pieces = new ArrayList<>(region);
      for (Point p : parts.points) {
        pieces.add(circle(p, distance, options.segments(), reference, tolerance));
      }
      for (List<Point> curve : parts.cutters()) {
        addCapsules(curve, distance, options.segments(), reference, tolerance, pieces);
      }
      result = PolygonOverlay.unionAll(pieces, reference, tolerance);
    } else {
      List<Polygon> eroded = new ArrayList<>();
      for (Polygon polygon : region) {
        for (List<Point> ring : polygon.ringCoordinates()) {
          addCapsules(ring, -distance, options.segments(), reference, tolerance, eroded);
        }
      }
      result =
          eroded.isEmpty()
              ? region
              : PolygonOverlay.compute(
                  OpType.DIFFERENCE,
                  region,
                  PolygonOverlay.unionAll(eroded, reference, tolerance),
                  reference,
                  tolerance);
    }
    log.fine(
        Platform.formatString(
            "Buffer of %s by %s has %d polygons", geometry.getGeometryType(), distance,
            result.size()));

    if (result.isEmpty()) {
      return new Polygon(reference, tolerance);
    }
    if (result.size() == 1) {
      return result.get(0);
    }
    return new MultiPolygon(result, reference, tolerance);
  }

  /** Returns a regular polygon with the given number of vertices inscribed in the circle. */
  static Polygon circle(
      Point center, double radius, int segments, SpatialReference reference, Tolerance tolerance) {
    List<Point> ring = new ArrayList<>(segments + 1);
    for (int i = 0; i < segments; i++) {
      double angle = 2 * PI * i / segments;
      ring.add(
          new Point(
              center.x() + radius * cos(angle), center.y() + radius * sin(angle), reference));
    }
    ring.add(ring.get(0));
    return new Polygon(
        new LinearRing(ring, reference, tolerance), ImmutableList.of(), reference, tolerance);
  }

  /**
   * Adds, for each segment of the curve, the strip of points within {@code radius} of it: a
   * rectangle along the segment closed by a half circle at each end. Zero length segments add a
   * circle.
   */
  private static void addCapsules(
      List<Point> curve,
      double radius,
      int segments,
      SpatialReference reference,
      Tolerance tolerance,
      List<Polygon> output) {
    if (curve.size() == 1) {
      output.add(circle(curve.get(0), radius, segments, reference, tolerance));
    }
    int steps = segments / 2;
    for (int i = 0; i + 1 < curve.size(); i++) {
      Point a = curve.get(i);
      Point b = curve.get(i + 1);
      double length = PlanarAlgorithms.segmentLength(a, b);
      if (tolerance.isZero(length)) {
        output.add(circle(a, radius, segments, reference, tolerance));
        continue;
      }
      // The start angle points to the right of the direction a -> b.
      double start = Math.atan2(-(b.x() - a.x()), b.y() - a.y());
      List<Point> ring = new ArrayList<>(2 * steps + 3);
      for (int j = 0; j <= steps; j++) {
        double angle = start + PI * j / steps;
        ring.add(new Point(b.x() + radius * cos(angle), b.y() + radius * sin(angle), reference));
      }
      for (int j = 0; j <= steps; j++) {
        double angle = start + PI + PI * j / steps;
        ring.add(new Point(a.x() + radius * cos(angle), a.y() + radius * sin(angle), reference));
      }
      ring.add(ring.get(0));
      output.add(
          new Polygon(
              new LinearRing(ring, reference, tolerance),
              ImmutableList.of(),
              reference,
              tolerance));
    }
  }
}
