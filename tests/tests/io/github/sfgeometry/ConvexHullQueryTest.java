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

import static io.github.sfgeometry.TextFormat.makeLineString;
import static io.github.sfgeometry.TextFormat.makePolygon;
import static io.github.sfgeometry.TextFormat.parsePoints;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link ConvexHullQuery}. */
@RunWith(JUnit4.class)
public class ConvexHullQueryTest extends GeometryTestCase {
  @Test
  public void testNoPoints() {
    Geometry hull = new ConvexHullQuery().getConvexHull();
    assertEquals("POLYGON", hull.getGeometryType());
    assertTrue(hull.isEmpty());
  }

  @Test
  public void testOnePoint() {
    ConvexHullQuery query = new ConvexHullQuery();
    query.addPoint(new Point(1, 2));
    query.addPoint(new Point(1, 2 + 1e-12));
    assertEquals(new Point(1, 2), query.getConvexHull());
  }

  @Test
  public void testCollinearPoints() {
    Geometry hull =
        ConvexHullQuery.convexHull(parsePoints("1 1, 3 3, 0 0, 2 2"), Tolerance.DEFAULT);
    assertEquals(makeLineString("0 0, 3 3"), hull);
  }

  @Test
  public void testSquareWithInteriorAndEdgePoints() {
    Geometry hull =
        ConvexHullQuery.convexHull(
            parsePoints("0 0, 2 0, 4 0, 4 4, 1 1, 0 4, 3 2, 2 4"), Tolerance.DEFAULT);
    assertTrue(hull instanceof Polygon);
    Polygon polygon = (Polygon) hull;
    // Points along the edges are not hull vertices.
    assertEquals("POLYGON ((0 0, 4 0, 4 4, 0 4, 0 0))", polygon.asText());
    assertTrue(polygon.exteriorRing().isCounterClockwise());
    assertExactly(16, polygon.area());
  }

  @Test
  public void testHullIsTwoDimensional() {
    Geometry hull =
        ConvexHullQuery.convexHull(parsePoints("0 0 5, 1 0 6, 0 1 7"), Tolerance.DEFAULT);
    assertFalse(hull.is3D());
    assertExactly(0.5, ((Polygon) hull).area());
  }

  @Test
  public void testAddGeometry() {
    ConvexHullQuery query = new ConvexHullQuery();
    query.addGeometry(makePolygon("0 0, 2 0, 2 2, 0 2; 0.5 0.5, 1.5 0.5, 1.5 1.5, 0.5 1.5"));
    query.addGeometry(makeLineString("2 0, 4 1"));
    query.addGeometry(new MultiPoint(parsePoints("1 -1, 1 1")));
    Polygon hull = (Polygon) query.getConvexHull();
    // The corner at (2 0) is inside the hull of (1 -1) and (4 1).
    assertEquals("POLYGON ((0 0, 1 -1, 4 1, 2 2, 0 2, 0 0))", hull.asText());
    // More input can be added after a query.
    query.addPoint(new Point(10, 10));
    assertTrue(query.getConvexHull().contains(new Point(5, 5)));
  }

  @Test
  public void testRandomPointsAreInsideTheHull() {
    for (int iter = 0; iter < 20; iter++) {
      List<Point> points = data.getRandomPoints(3 + data.uniform(50), 100);
      Geometry hull = ConvexHullQuery.convexHull(points, Tolerance.DEFAULT);
      for (Point p : points) {
        assertTrue(hull.contains(p));
      }
      if (hull instanceof Polygon) {
        LinearRing ring = ((Polygon) hull).exteriorRing();
        assertTrue(ring.isCounterClockwise());
        for (Point v : ring.points()) {
          assertTrue(points.contains(v));
        }
        // Every turn of a convex ring is to the left.
        List<Point> vertices = ring.points();
        for (int i = 0; i + 2 < vertices.size(); i++) {
          assertEquals(
              1,
              PlanarAlgorithms.orientation(
                  vertices.get(i), vertices.get(i + 1), vertices.get(i + 2), Tolerance.DEFAULT));
        }
      }
    }
  }
}
