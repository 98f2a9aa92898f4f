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

import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Decomposes geometries into their primitive parts: points, curves, and polygons. Collections are
 * expanded recursively and polyhedral surfaces are expanded into their patches. The parts are the
 * geometries' own internal objects and must not be modified.
 */
final class GeometryComponents {
  private GeometryComponents() {}

  /** Returns every vertex of the geometry, in order, including ring closing points. */
  static List<Point> vertices(Geometry geometry) {
    List<Point> result = new ArrayList<>();
    addVertices(geometry, result);
    return result;
  }

  private static void addVertices(Geometry geometry, List<Point> result) {
    if (geometry instanceof Point) {
      result.add((Point) geometry);
    } else if (geometry instanceof LineString) {
      result.addAll(((LineString) geometry).coordinates());
    } else if (geometry instanceof Polygon) {
      for (List<Point> ring : ((Polygon) geometry).ringCoordinates()) {
        result.addAll(ring);
      }
    } else if (geometry instanceof PolyhedralSurface) {
      for (Polygon patch : ((PolyhedralSurface) geometry).patchList()) {
        addVertices(patch, result);
      }
    } else if (geometry instanceof GeometryCollection) {
      for (Geometry member : ((GeometryCollection<?>) geometry).geometryList()) {
        addVertices(member, result);
      }
    } else {
      throw unsupported(geometry);
    }
  }

  /** Returns the non-empty two-dimensional parts of the geometry. */
  static List<Polygon> polygons(Geometry geometry) {
    List<Polygon> result = new ArrayList<>();
    addParts(geometry, null, null, result);
    return result;
  }

  private static void addParts(
      Geometry geometry,
      @Nullable List<Point> points,
      @Nullable List<LineString> lines,
      @Nullable List<Polygon> polygons) {
    if (geometry instanceof Point) {
      if (points != null) {
        points.add((Point) geometry);
      }
    } else if (geometry instanceof LineString) {
      if (lines != null && !geometry.isEmpty()) {
        lines.add((LineString) geometry);
      }
    } else if (geometry instanceof Polygon) {
      if (polygons != null && !geometry.isEmpty()) {
        polygons.add((Polygon) geometry);
      }
    } else if (geometry instanceof PolyhedralSurface) {
      if (polygons != null) {
        polygons.addAll(((PolyhedralSurface) geometry).patchList());
      }
    } else if (geometry instanceof GeometryCollection) {
      for (Geometry member : ((GeometryCollection<?>) geometry).geometryList()) {
        addParts(member, points, lines, polygons);
      }
    } else {
      throw unsupported(geometry);
    }
  }

  /** Returns the primitive parts of the geometry, grouped by dimension. */
  static Parts parts(Geometry geometry) {
    Parts parts = new Parts(geometry.tolerance());
    addParts(geometry, parts.points, parts.lines, parts.polygons);
    return parts;
  }

  /**
   * The primitive parts of a geometry, grouped by dimension, with point location queries against
   * their union.
   */
  static final class Parts {
    final Tolerance tolerance;
    final List<Point> points = new ArrayList<>();
    final List<LineString> lines = new ArrayList<>();
    final List<Polygon> polygons = new ArrayList<>();
    private @Nullable List<List<Point>> cutters;

    private Parts(Tolerance tolerance) {
      this.tolerance = tolerance;
    }

    boolean isEmpty() {
      return points.isEmpty() && lines.isEmpty() && polygons.isEmpty();
    }

    /** Returns the largest dimension of any part, or -1 if there are none. */
    int dimension() {
      if (!polygons.isEmpty()) {
        return 2;
      }
      return !lines.isEmpty() ? 1 : points.isEmpty() ? -1 : 0;
    }

    /** Returns the points of every line and every polygon ring. */
    List<List<Point>> cutters() {
      if (cutters == null) {
        cutters = new ArrayList<>();
        for (LineString line : lines) {
          cutters.add(line.coordinates());
        }
        for (Polygon polygon : polygons) {
          cutters.addAll(polygon.ringCoordinates());
        }
      }
      return cutters;
    }

    /** Returns true if the point is on some part, including the boundaries of lines and areas. */
    boolean covers(Point p) {
      return onPoint(p) || onLine(p) || inPolygon(p, false);
    }

    /**
     * Returns true if the point is in the interior of some part: on a point, on a line other than
     * at the endpoints of an open line, or strictly inside a polygon.
     */
    boolean interiorContains(Point p) {
      if (onPoint(p) || inPolygon(p, true)) {
        return true;
      }
      for (LineString line : lines) {
        if (line.isPointOnCurve(p)
            && (line.isClosed()
                || (!line.startPoint().approxEquals(p, tolerance)
                    && !line.endPoint().approxEquals(p, tolerance)))) {
          return true;
        }
      }
      return false;
    }

    boolean onPoint(Point p) {
      for (Point q : points) {
        if (q.approxEquals(p, tolerance)) {
          return true;
        }
      }
      return false;
    }

    boolean onLine(Point p) {
      for (LineString line : lines) {
        if (line.isPointOnCurve(p)) {
          return true;
        }
      }
      return false;
    }

    boolean inPolygon(Point p, boolean strictly) {
      for (Polygon polygon : polygons) {
        PlanarAlgorithms.Location location = polygon.locate(p);
        if (location == PlanarAlgorithms.Location.INTERIOR
            || (!strictly && location == PlanarAlgorithms.Location.BOUNDARY)) {
          return true;
        }
      }
      return false;
    }
  }

  static GeometryException unsupported(Geometry geometry) {
    return new GeometryException(
        GeometryError.Code.UNSUPPORTED_OPERATION,
        "Unsupported geometry type %s",
        geometry.getGeometryType());
  }
}
