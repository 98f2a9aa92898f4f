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

import static io.github.sfgeometry.TextFormat.makeLinearRing;
import static io.github.sfgeometry.TextFormat.makeTriangle;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import com.google.common.collect.ImmutableList;
import java.util.OptionalDouble;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link Triangle}. */
@RunWith(JUnit4.class)
public class TriangleTest extends GeometryTestCase {
  @Test
  public void testBasicProperties() {
    Triangle t = makeTriangle("0 0, 4 0, 0 3");
    assertEquals("TRIANGLE", t.getGeometryType());
    assertExactly(6, t.area());
    assertTrue(t.isValid());
    assertEquals(0, t.numInteriorRing());
    assertEquals("TRIANGLE ((0 0, 4 0, 0 3, 0 0))", t.asText());
  }

  @Test
  public void testVerticesAreCounterClockwise() {
    Triangle t = new Triangle(new Point(0, 0), new Point(0, 3), new Point(4, 0));
    assertEquals(
        ImmutableList.of(new Point(0, 0), new Point(4, 0), new Point(0, 3)), t.getVertices());
    assertTrue(t.exteriorRing().isCounterClockwise());
  }

  @Test
  public void testDegenerateTrianglesAreRejected() {
    assertThrowsCode(
        GeometryError.Code.DEGENERATE_TRIANGLE,
        () -> new Triangle(new Point(0, 0), new Point(1, 1), new Point(2, 2)));
    assertThrowsCode(
        GeometryError.Code.DEGENERATE_TRIANGLE,
        () -> new Triangle(new Point(0, 0), new Point(0, 0), new Point(2, 2)));
    Triangle t = makeTriangle("0 0, 1 0, 0 1");
    assertThrowsCode(
        GeometryError.Code.DEGENERATE_TRIANGLE,
        () -> t.setVertices(new Point(0, 0), new Point(1, 0), new Point(2, 0)));
    // A failed update leaves the triangle unchanged.
    assertExactly(0.5, t.area());
  }

  @Test
  public void testRingsMustHaveFourPoints() {
    Triangle t = new Triangle();
    assertThrowsCode(
        GeometryError.Code.INVALID_RING,
        () -> t.setExteriorRing(makeLinearRing("0 0, 1 0, 1 1, 0 1")));
    t.setExteriorRing(makeLinearRing("0 0, 2 0, 0 2"));
    assertExactly(2, t.area());
    assertThrowsCode(
        GeometryError.Code.UNSUPPORTED_OPERATION,
        () -> t.addInteriorRing(makeLinearRing("0.1 0.1, 0.2 0.1, 0.1 0.2")));
  }

  @Test
  public void testEmptyTriangle() {
    Triangle t = new Triangle();
    assertTrue(t.isEmpty());
    assertFalse(t.isValid());
    assertExactly(0, t.area());
    assertTrue(t.getVertices().isEmpty());
    assertEquals(0, t.getAngles().length);
    assertNull(t.circumcenter());
    assertFalse(t.inCircumcircle(new Point(0, 0)));
    assertThrowsCode(GeometryError.Code.EMPTY_GEOMETRY, t::centroid);
    assertEquals("TRIANGLE EMPTY", t.asText());
  }

  @Test
  public void testAnglesSumToPi() {
    Triangle right = makeTriangle("0 0, 1 0, 0 1");
    double[] angles = right.getAngles();
    assertDoubleNear(Math.PI / 2, angles[0]);
    assertDoubleNear(Math.PI / 4, angles[1]);
    assertDoubleNear(Math.PI / 4, angles[2]);
    for (int i = 0; i < 50; i++) {
      Point a = data.getRandomPoint(0, 0, 10, 10);
      Point b = data.getRandomPoint(0, 0, 10, 10);
      Point c = data.getRandomPoint(0, 0, 10, 10);
      if (Triangle.isDegenerate(a, b, c, Tolerance.of(1e-6))) {
        continue;
      }
      double[] random = new Triangle(a, b, c).getAngles();
      assertDoubleNear(Math.PI, random[0] + random[1] + random[2]);
    }
  }

  @Test
  public void testCentroidAndPointOnSurface() {
    Triangle t = makeTriangle("0 0, 3 0, 0 3");
    assertPointsNear(new Point(1, 1), t.centroid());
    assertEquals(t.centroid(), t.pointOnSurface());
    assertTrue(t.containsInInterior(t.pointOnSurface()));
  }

  @Test
  public void testCircumcircle() {
    Triangle t = makeTriangle("0 0, 2 0, 0 2");
    assertPointsNear(new Point(1, 1), t.circumcenter());
    assertTrue(t.inCircumcircle(new Point(1, 1)));
    // The fourth corner of the square is on the circle, which counts as inside.
    assertTrue(t.inCircumcircle(new Point(2, 2)));
    assertFalse(t.inCircumcircle(new Point(2.1, 2.1)));
  }

  @Test
  public void testContainsInInterior() {
    Triangle t = makeTriangle("0 0, 4 0, 0 4");
    assertTrue(t.containsInInterior(new Point(1, 1)));
    assertFalse(t.containsInInterior(new Point(2, 0)));
    assertFalse(t.containsInInterior(new Point(0, 0)));
    assertFalse(t.containsInInterior(new Point(3, 3)));
    // The boundary is still part of the polygon.
    assertTrue(t.contains(new Point(2, 0)));
  }

  @Test
  public void testInterpolateZ() {
    Triangle flat = makeTriangle("0 0, 1 0, 0 1");
    assertFalse(flat.interpolateZ(new Point(0.25, 0.25)).isPresent());
    Triangle t = makeTriangle("0 0 0, 1 0 1, 0 1 0");
    assertDoubleNear(0.25, t.interpolateZ(new Point(0.25, 0.25)).getAsDouble());
    assertDoubleNear(1, t.interpolateZ(new Point(1, 0)).getAsDouble());
  }

  @Test
  public void testSlopeAndAspect() {
    // The plane z = x rises to the east at 45 degrees, so it faces west.
    Triangle t = makeTriangle("0 0 0, 1 0 1, 0 1 0");
    assertDoubleNear(45, t.getSlope().getAsDouble());
    assertDoubleNear(270, t.getAspect().getAsDouble());

    // The plane z = -y faces north.
    Triangle north = makeTriangle("0 0 0, 1 0 0, 0 1 -1");
    assertDoubleNear(0, north.getAspect().getAsDouble());

    Triangle level = makeTriangle("0 0 5, 1 0 5, 0 1 5");
    assertDoubleNear(0, level.getSlope().getAsDouble());
    assertEquals(OptionalDouble.empty(), level.getAspect());
    assertEquals(OptionalDouble.empty(), makeTriangle("0 0, 1 0, 0 1").getSlope());
  }

  @Test
  public void testCopy() {
    Triangle t = makeTriangle("0 0, 1 0, 0 1");
    Triangle copy = t.copy();
    assertEquals(t, copy);
    copy.setVertices(new Point(0, 0), new Point(2, 0), new Point(0, 2));
    assertExactly(0.5, t.area());
    assertExactly(2, copy.area());
  }
}
