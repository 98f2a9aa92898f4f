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

import java.util.Iterator;
import java.util.List;

/**
 * Writes geometries in the Well-Known Text format, e.g. {@code "POINT (1 2)"}, {@code "POLYGON
 * ((0 0, 1 0, 0 1, 0 0))"} or {@code "LINESTRING Z (0 0 1, 1 1 2)"}.
 *
 * <p>The type tag is followed by {@code Z}, {@code M} or {@code ZM} when the geometry has those
 * coordinates, and by {@code EMPTY} when it has no points. Coordinates are written with {@link
 * Platform#formatDouble}, so the output is the same on every platform.
 */
public final class WktWriter {
  private WktWriter() {}

  /** Returns the Well-Known Text form of the geometry. */
  public static String write(Geometry geometry) {
    StringBuilder out = new StringBuilder();
    appendGeometry(geometry, out);
    return out.toString();
  }

  private static void appendGeometry(Geometry geometry, StringBuilder out) {
    boolean hasZ = geometry.is3D();
    boolean hasM = geometry.isMeasured();
    out.append(geometry.getGeometryType());
    if (hasZ || hasM) {
      out.append(' ').append(hasZ ? "Z" : "").append(hasM ? "M" : "");
    }
    if (isEmpty(geometry)) {
      out.append(" EMPTY");
      return;
    }
    out.append(' ');
    if (geometry instanceof Point) {
      out.append('(');
      appendCoordinate((Point) geometry, hasZ, hasM, out);
      out.append(')');
    } else if (geometry instanceof LineString) {
      appendPoints(((LineString) geometry).coordinates(), hasZ, hasM, out);
    } else if (geometry instanceof Polygon) {
      appendPolygon((Polygon) geometry, hasZ, hasM, out);
    } else if (geometry instanceof PolyhedralSurface) {
      out.append('(');
      List<Polygon> patches = ((PolyhedralSurface) geometry).patchList();
      for (int i = 0; i < patches.size(); i++) {
        if (i > 0) {
          out.append(", ");
        }
        appendPolygon(patches.get(i), hasZ, hasM, out);
      }
      out.append(')');
    } else if (geometry instanceof GeometryCollection) {
      appendCollection((GeometryCollection<?>) geometry, hasZ, hasM, out);
    } else {
      throw GeometryComponents.unsupported(geometry);
    }
  }

  /** Collections are written EMPTY only if they have no members at all. */
  private static boolean isEmpty(Geometry geometry) {
    if (geometry instanceof GeometryCollection) {
      return ((GeometryCollection<?>) geometry).numGeometries() == 0;
    }
    return geometry.isEmpty();
  }

  private static void appendCollection(
      GeometryCollection<?> collection, boolean hasZ, boolean hasM, StringBuilder out) {
    boolean tagged = collection.getClass() == GeometryCollection.class;
    out.append('(');
    Iterator<? extends Geometry> i = collection.geometryList().iterator();
    while (i.hasNext()) {
      Geometry member = i.next();
      if (tagged) {
        // Members of a heterogeneous collection carry their own type tags.
        appendGeometry(member, out);
      } else if (member.isEmpty()) {
        out.append("EMPTY");
      } else if (member instanceof Point) {
        out.append('(');
        appendCoordinate((Point) member, hasZ, hasM, out);
        out.append(')');
      } else if (member instanceof LineString) {
        appendPoints(((LineString) member).coordinates(), hasZ, hasM, out);
      } else if (member instanceof Polygon) {
        appendPolygon((Polygon) member, hasZ, hasM, out);
      } else {
        // A MultiSurface member that is not a Polygon, such as a PolyhedralSurface.
        appendGeometry(member, out);
      }
      if (i.hasNext()) {
        out.append(", ");
      }
    }
    out.append(')');
  }

  private static void appendPolygon(
      Polygon polygon, boolean hasZ, boolean hasM, StringBuilder out) {
    out.append('(');
    List<List<Point>> rings = polygon.ringCoordinates();
    for (int i = 0; i < rings.size(); i++) {
      if (i > 0) {
        out.append(", ");
      }
      appendPoints(rings.get(i), hasZ, hasM, out);
    }
    out.append(')');
  }

  private static void appendPoints(
      List<Point> points, boolean hasZ, boolean hasM, StringBuilder out) {
    out.append('(');
    Iterator<Point> i = points.iterator();
    while (i.hasNext()) {
      appendCoordinate(i.next(), hasZ, hasM, out);
      if (i.hasNext()) {
        out.append(", ");
      }
    }
    out.append(')');
  }

  private static void appendCoordinate(Point p, boolean hasZ, boolean hasM, StringBuilder out) {
    out.append(Platform.formatDouble(p.x())).append(' ').append(Platform.formatDouble(p.y()));
    if (hasZ) {
      out.append(' ').append(Platform.formatDouble(p.z()));
    }
    if (hasM) {
      out.append(' ').append(Platform.formatDouble(p.m()));
    }
  }
}
