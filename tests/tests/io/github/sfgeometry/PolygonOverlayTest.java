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

import static io.github.sfgeometry.PolygonOverlay.OpType.DIFFERENCE;
import static io.github.sfgeometry.PolygonOverlay.OpType.INTERSECTION;
import static io.github.sfgeometry.PolygonOverlay.OpType.SYMMETRIC_DIFFERENCE;
import static io.github.sfgeometry.PolygonOverlay.OpType.UNION;
import static io.github.sfgeometry.TextFormat.makePolygon;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link PolygonOverlay}. */
@RunWith(JUnit4.class)
public class PolygonOverlayTest extends GeometryTestCase {
  private static final Polygon A = makePolygon("0 0, 2 0, 2 2, 0 2");
  private static final Polygon B = makePolygon("1 1, 3 1, 3 3, 1 3");

  private static ImmutableList<Polygon> compute(
      PolygonOverlay.OpType op, Polygon a, Polygon b) {
    return PolygonOverlay.compute(
        op, ImmutableList.of(a), ImmutableList.of(b), SpatialReference.DEFAULT, Tolerance.DEFAULT);
  }

  private static double area(List<Polygon> polygons) {
    double area = 0;
    for (Polygon p : polygons) {
      area += p.area();
    }
    return area;
  }

  @Test
  public void testOverlappingSquares() {
    ImmutableList<Polygon> intersection = compute(INTERSECTION, A, B);
    assertEquals(1, intersection.size());
    assertDoubleNear(1, intersection.get(0).area());
    assertPointsNear(new Point(1.5, 1.5), intersection.get(0).centroid());

    ImmutableList<Polygon> union = compute(UNION, A, B);
    assertEquals(1, union.size());
    assertDoubleNear(7, union.get(0).area());
    assertEquals(0, union.get(0).numInteriorRing());

    assertDoubleNear(3, area(compute(DIFFERENCE, A, B)));
    ImmutableList<Polygon> symDifference = compute(SYMMETRIC_DIFFERENCE, A, B);
    assertEquals(2, symDifference.size());
    assertDoubleNear(6, area(symDifference));
  }

  @Test
  public void testResultsAreValidPolygons() {
    for (Polygon p : compute(UNION, A, B)) {
      assertTrue(p.isValid());
      assertFalse(p.is3D());
      assertTrue(p.hasValidRingOrientations());
    }
  }

  @Test
  public void testDisjointSquares() {
    Polygon far = makePolygon("5 5, 6 5, 6 6, 5 6");
    assertTrue(compute(INTERSECTION, A, far).isEmpty());
    assertEquals(2, compute(UNION, A, far).size());
    assertDoubleNear(4, area(compute(DIFFERENCE, A, far)));
  }

  @Test
  public void testDifferenceMakesAHole() {
    Polygon big = makePolygon("0 0, 4 0, 4 4, 0 4");
    Polygon small = makePolygon("1 1, 3 1, 3 3, 1 3");
    ImmutableList<Polygon> difference = compute(DIFFERENCE, big, small);
    assertEquals(1, difference.size());
    assertEquals(1, difference.get(0).numInteriorRing());
    assertDoubleNear(12, difference.get(0).area());
    assertTrue(compute(DIFFERENCE, small, big).isEmpty());
  }

  @Test
  public void testSharedEdgeIsDissolved() {
    Polygon right = makePolygon("2 0, 4 0, 4 2, 2 2");
    ImmutableList<Polygon> union = compute(UNION, A, right);
    assertEquals(1, union.size());
    assertDoubleNear(8, union.get(0).area());
    assertTrue(compute(INTERSECTION, A, right).isEmpty());
    assertFalse(PolygonOverlay.interiorsIntersect(A, right, Tolerance.DEFAULT));
  }

  @Test
  public void testIdenticalPolygons() {
    ImmutableList<Polygon> intersection = compute(INTERSECTION, A, A.copy());
    assertEquals(1, intersection.size());
    assertDoubleNear(4, intersection.get(0).area());
    assertTrue(compute(DIFFERENCE, A, A.copy()).isEmpty());
    assertDoubleNear(4, area(compute(UNION, A, A.copy())));
  }

  @Test
  public void testUnionAll() {
    ImmutableList<Polygon> union =
        PolygonOverlay.unionAll(
            ImmutableList.of(A, B, makePolygon("2 -1, 4 -1, 4 0.5, 2 0.5")),
            SpatialReference.DEFAULT,
            Tolerance.DEFAULT);
    assertEquals(1, union.size());
    assertDoubleNear(10, union.get(0).area());
  }

  @Test
  public void testInteriorsIntersect() {
    assertTrue(PolygonOverlay.interiorsIntersect(A, B, Tolerance.DEFAULT));
    Polygon corner = makePolygon("2 2, 3 2, 3 3, 2 3");
    assertFalse(PolygonOverlay.interiorsIntersect(A, corner, Tolerance.DEFAULT));
    assertFalse(PolygonOverlay.interiorsIntersect(A, new Polygon(), Tolerance.DEFAULT));
  }

  @Test
  public void testRandomStarsSatisfyInclusionExclusion() {
    for (int iter = 0; iter < 10; iter++) {
      Polygon a = new Polygon(data.getRandomStarRing(new Point(0, 0), 10, 6 + data.uniform(10)));
      Polygon b = new Polygon(data.getRandomStarRing(new Point(4, 1), 10, 6 + data.uniform(10)));
      double intersection = area(compute(INTERSECTION, a, b));
      double union = area(compute(UNION, a, b));
      assertDoubleNear(a.area() + b.area(), intersection + union, 1e-6);
      assertDoubleNear(a.area() - intersection, area(compute(DIFFERENCE, a, b)), 1e-6);
      assertDoubleNear(
          union - intersection, area(compute(SYMMETRIC_DIFFERENCE, a, b)), 1e-6);
    }
  }
}
