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

import static io.github.sfgeometry.TextFormat.parsePoints;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link DelaunayTriangulator}. */
@RunWith(JUnit4.class)
public class DelaunayTriangulatorTest extends GeometryTestCase {
  private final DelaunayTriangulator triangulator = new DelaunayTriangulator();

  /** Returns the corners of a 100x100 square followed by n random points well inside it. */
  private List<Point> squareWithInteriorPoints(int n) {
    List<Point> points = new ArrayList<>(parsePoints("0 0, 100 0, 100 100, 0 100"));
    for (int i = 0; i < n; i++) {
      points.add(data.getRandomPoint(5, 5, 95, 95));
    }
    return points;
  }

  @Test
  public void testSingleTriangle() {
    ImmutableList<Triangle> triangles = triangulator.triangulate(parsePoints("0 0, 0 1, 1 0"));
    assertEquals(1, triangles.size());
    assertTrue(triangles.get(0).exteriorRing().isCounterClockwise());
    assertExactly(0.5, triangles.get(0).area());
  }

  @Test
  public void testTooFewOrCollinearPointsGiveNoTriangles() {
    assertTrue(triangulator.triangulate(ImmutableList.of()).isEmpty());
    assertTrue(triangulator.triangulate(parsePoints("0 0, 1 1")).isEmpty());
    assertTrue(triangulator.triangulate(parsePoints("0 0, 1 1, 2 2, 3 3")).isEmpty());
  }

  @Test
  public void testCocircularSquare() {
    ImmutableList<Triangle> triangles =
        triangulator.triangulate(parsePoints("0 0, 10 0, 0 10, 10 10"));
    assertEquals(2, triangles.size());
    assertDoubleNear(100, triangles.get(0).area() + triangles.get(1).area());
  }

  @Test
  public void testDuplicatePointsAreRejected() {
    assertThrowsCode(
        GeometryError.Code.DUPLICATE_POINT,
        () -> triangulator.triangulate(parsePoints("0 0, 1 0, 0 1, 1 0")));
    assertThrowsCode(
        GeometryError.Code.DUPLICATE_POINT,
        () ->
            triangulator.triangulate(
                ImmutableList.of(
                    new Point(0, 0), new Point(1, 0), new Point(0, 1), new Point(1e-12, 1))));
  }

  @Test
  public void testZIsCarriedThrough() {
    ImmutableList<Triangle> triangles =
        triangulator.triangulate(parsePoints("0 0 5, 1 0 6, 0 1 7"));
    assertEquals(1, triangles.size());
    assertTrue(triangles.get(0).is3D());
    for (Point p : triangles.get(0).getVertices()) {
      assertExactly(p.x() + 2 * p.y() + 5, p.z());
    }
  }

  @Test
  public void testRandomPointsAreDelaunay() {
    for (int iter = 0; iter < 10; iter++) {
      List<Point> points = squareWithInteriorPoints(10 + data.uniform(40));
      ImmutableList<Triangle> triangles = triangulator.triangulate(points);
      // Every point is a vertex, and all four hull vertices are corners of the square.
      assertEquals(2 * points.size() - 6, triangles.size());
      double area = 0;
      for (Triangle t : triangles) {
        assertTrue(t.exteriorRing().isCounterClockwise());
        area += t.area();
        Point center = t.circumcenter();
        double radius = center.distance(t.getVertices().get(0));
        for (Point p : points) {
          if (!t.getVertices().contains(p)) {
            assertTrue(
                "Point " + p + " is inside the circumcircle of " + t.asText(),
                center.distance(p) >= radius - 1e-7);
          }
        }
      }
      assertDoubleNear(10000, area, 1e-6);
    }
  }

  private static double totalArea(List<Triangle> triangles) {
    double area = 0;
    for (Triangle t : triangles) {
      area += t.area();
    }
    return area;
  }

  @Test
  public void testNearlyCollinearPointsCoverTheHull() {
    List<Point> points = new ArrayList<>();
    for (int i = 0; i < 30; i++) {
      points.add(new Point(10 * i, 0));
    }
    points.add(new Point(150, 1));
    ImmutableList<Triangle> triangles = triangulator.triangulate(points);
    assertEquals(29, triangles.size());
    assertDoubleNear(145, totalArea(triangles), 1e-9);
  }

  @Test
  public void testThinStripsCoverTheHull() {
    for (int iter = 0; iter < 10; iter++) {
      List<Point> points = new ArrayList<>();
      int n = 10 + data.uniform(40);
      for (int i = 0; i < n; i++) {
        points.add(data.getRandomPoint(0, 0, 1000, 1));
      }
      Geometry hull = ConvexHullQuery.convexHull(points, Tolerance.DEFAULT);
      double hullArea = ((Polygon) hull).area();
      assertDoubleNear(hullArea, totalArea(triangulator.triangulate(points)), 1e-6 * hullArea);
    }
  }
}
