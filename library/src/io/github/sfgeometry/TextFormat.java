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

import static java.lang.Double.parseDouble;

import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Builds geometries from a compact text format, mostly for tests and examples. A point is written
 * as two or three space separated numbers, "x y" or "x y z"; a sequence of points is written with
 * commas between them:
 *
 * <pre>
 *     "1 2"                          // a point
 *     "0 0, 10 0, 10 10"             // a line string
 *     "0 0, 10 0, 10 10, 0 10; 4 4, 4 6, 6 6, 6 4"  // a polygon with one hole
 *     "0 0, 1 0, 0 1 | 5 5, 6 5, 5 6"  // a multipolygon of two triangles
 * </pre>
 *
 * <p>Polygon rings are separated by semicolons and need not repeat their first point; members of
 * multi-geometries are separated by vertical bars. The empty string makes an empty geometry.
 *
 * <p>Every method throws {@link IllegalArgumentException} on text it cannot parse, and {@link
 * GeometryException} if the parsed coordinates do not make a valid geometry.
 */
public final class TextFormat {
  private static final Splitter POINT_SPLITTER = Splitter.on(',').trimResults().omitEmptyStrings();
  private static final Splitter RING_SPLITTER = Splitter.on(';').trimResults().omitEmptyStrings();
  private static final Splitter MEMBER_SPLITTER = Splitter.on('|').trimResults();
  private static final Splitter ORDINATE_SPLITTER =
      Splitter.on(' ').trimResults().omitEmptyStrings();

  private TextFormat() {}

  /**
   * Returns the point for text such as "1 2" or "1 2 3".
   *
   * @throws IllegalArgumentException on unparsable input
   */
  public static Point makePoint(String str) {
    List<Point> points = parsePoints(str);
    Preconditions.checkArgument(points.size() == 1, "Expected one point: str == \"%s\"", str);
    return points.get(0);
  }

  /**
   * Parses a comma separated list of points. Returns an empty list for a blank string.
   *
   * @throws IllegalArgumentException on unparsable input
   */
  public static ImmutableList<Point> parsePoints(String str) {
    ImmutableList.Builder<Point> points = ImmutableList.builder();
    for (String token : POINT_SPLITTER.split(str)) {
      Point point = parsePoint(token);
      Preconditions.checkArgument(point != null, "Unparsable point \"%s\" in \"%s\"", token, str);
      points.add(point);
    }
    return points.build();
  }

  private static @Nullable Point parsePoint(String token) {
    List<String> ordinates = ORDINATE_SPLITTER.splitToList(token);
    if (ordinates.size() < 2 || ordinates.size() > 3) {
      return null;
    }
    try {
      double x = parseDouble(ordinates.get(0));
      double y = parseDouble(ordinates.get(1));
      if (ordinates.size() == 2) {
        return new Point(x, y);
      }
      return new Point(x, y, parseDouble(ordinates.get(2)));
    } catch (NumberFormatException e) {
      return null;
    }
  }

  /** Returns the line string through the points. */
  public static LineString makeLineString(String str) {
    return new LineString(parsePoints(str));
  }

  /** Returns the ring through the points, closing it if the last point is not the first. */
  public static LinearRing makeLinearRing(String str) {
    return new LinearRing(closed(parsePoints(str)));
  }

  private static List<Point> closed(List<Point> points) {
    if (points.isEmpty() || points.get(0).equals(points.get(points.size() - 1))) {
      return points;
    }
    List<Point> result = new ArrayList<>(points);
    result.add(points.get(0));
    return result;
  }

  /** Returns the polygon whose rings are separated by semicolons, the exterior ring first. */
  public static Polygon makePolygon(String str) {
    List<String> rings = RING_SPLITTER.splitToList(str);
    if (rings.isEmpty()) {
      return new Polygon();
    }
    List<LinearRing> holes = new ArrayList<>();
    for (String ring : rings.subList(1, rings.size())) {
      holes.add(makeLinearRing(ring));
    }
    return new Polygon(makeLinearRing(rings.get(0)), holes);
  }

  /** Returns the triangle through three points, e.g. "0 0, 1 0, 0 1". */
  public static Triangle makeTriangle(String str) {
    List<Point> points = parsePoints(str);
    Preconditions.checkArgument(points.size() == 3, "Expected three points: str == \"%s\"", str);
    return new Triangle(points.get(0), points.get(1), points.get(2));
  }

  /** Returns the multipoint of the comma separated points. */
  public static MultiPoint makeMultiPoint(String str) {
    return new MultiPoint(parsePoints(str));
  }

  /** Returns the multilinestring of the line strings separated by vertical bars. */
  public static MultiLineString makeMultiLineString(String str) {
    MultiLineString result = new MultiLineString();
    if (!str.trim().isEmpty()) {
      for (String line : MEMBER_SPLITTER.split(str)) {
        result.addLineString(makeLineString(line));
      }
    }
    return result;
  }

  /** Returns the multipolygon of the polygons separated by vertical bars. */
  public static MultiPolygon makeMultiPolygon(String str) {
    MultiPolygon result = new MultiPolygon();
    if (!str.trim().isEmpty()) {
      for (String polygon : MEMBER_SPLITTER.split(str)) {
        result.addPolygon(makePolygon(polygon));
      }
    }
    return result;
  }

  /** Returns the polyhedral surface of the polygon patches separated by vertical bars. */
  public static PolyhedralSurface makePolyhedralSurface(String str) {
    PolyhedralSurface result = new PolyhedralSurface();
    if (!str.trim().isEmpty()) {
      for (String patch : MEMBER_SPLITTER.split(str)) {
        result.addPatch(makePolygon(patch));
      }
    }
    return result;
  }

  /** Returns the Delaunay triangulation of the comma separated points. */
  public static TIN makeTin(String str) {
    return TIN.fromPoints(parsePoints(str));
  }
}
