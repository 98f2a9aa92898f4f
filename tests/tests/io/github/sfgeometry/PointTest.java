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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import com.google.common.collect.ImmutableSet;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link Point}. */
@RunWith(JUnit4.class)
public class PointTest extends GeometryTestCase {
  @Test
  public void testBasicProperties() {
    Point p = new Point(1, 2);
    assertEquals("POINT", p.getGeometryType());
    assertEquals(0, p.dimension());
    assertEquals(2, p.coordinateDimension());
    assertFalse(p.isEmpty());
    assertTrue(p.isSimple());
    assertFalse(p.is3D());
    assertFalse(p.isMeasured());
    assertTrue(Double.isNaN(p.z()));
    assertTrue(p.boundary().isEmpty());
    assertEquals(0, p.getSRID());
  }

  @Test
  public void testThreeDimensionalAndMeasured() {
    Point p = new Point(1, 2, 3);
    assertTrue(p.is3D());
    assertExactly(3, p.z());
    assertEquals(3, p.coordinateDimension());
    assertEquals(CoordinateSystem.CARTESIAN_3D, p.getCoordinateSystem());

    Point m = Point.measured(1, 2, 7);
    assertFalse(m.is3D());
    assertTrue(m.isMeasured());
    assertExactly(7, m.m());

    Point zm = Point.measured(1, 2, 3, 4);
    assertEquals(4, zm.coordinateDimension());
    assertEquals(new Point(1, 2), zm.to2D());
  }

  @Test
  public void testNonFiniteCoordinatesAreRejected() {
    assertThrowsCode(GeometryError.Code.INVALID_COORDINATE, () -> new Point(Double.NaN, 0));
    assertThrowsCode(
        GeometryError.Code.INVALID_COORDINATE, () -> new Point(0, Double.POSITIVE_INFINITY));
    assertThrowsCode(GeometryError.Code.INVALID_COORDINATE, () -> new Point(0, 0, Double.NaN));
  }

  @Test
  public void testGeographicRangeIsChecked() {
    Point london = new Point(-0.1278, 51.5074, SpatialReference.WGS84);
    assertEquals(4326, london.getSRID());
    assertTrue(london.getCoordinateSystem().isGeographic());
    assertThrowsCode(
        GeometryError.Code.INVALID_COORDINATE, () -> new Point(181, 0, SpatialReference.WGS84));
    assertThrowsCode(
        GeometryError.Code.INVALID_COORDINATE, () -> new Point(0, -91, SpatialReference.WGS84));
  }

  @Test
  public void testDistance() {
    Point a = new Point(0, 0);
    Point b = new Point(3, 4);
    assertExactly(5, a.distance(b));
    assertExactly(0, a.distance(a));
    assertExactly(13, new Point(0, 0, 0).distance(new Point(3, 4, 12)));
    // Mixed dimensions fall back to the plane.
    assertExactly(5, new Point(0, 0, 0).distance(b));
    assertThrowsCode(GeometryError.Code.INVALID_ARGUMENT, () -> a.distance3D(b));
  }

  @Test
  public void testDistanceIsSymmetric() {
    for (int i = 0; i < 100; i++) {
      Point a = data.getRandomPoint(-100, -100, 100, 100);
      Point b = data.getRandomPoint(-100, -100, 100, 100);
      assertExactly(a.distance(b), b.distance(a));
      assertExactly(0, a.distance(a));
    }
  }

  @Test
  public void testGreatCircleDistance() {
    Point a = new Point(0, 0, SpatialReference.WGS84);
    Point b = new Point(90, 0, SpatialReference.WGS84);
    assertDoubleNear(Math.PI / 2 * Point.EARTH_RADIUS_METERS, a.greatCircleDistance(b), 1e-6);
    assertExactly(0, a.greatCircleDistance(a));
  }

  @Test
  public void testEqualityIsExactAndApproxEqualsIsTolerant() {
    Point a = new Point(1, 1);
    Point b = new Point(1 + 1e-12, 1);
    assertNotEquals(a, b);
    assertTrue(a.approxEquals(b));
    assertFalse(a.approxEquals(new Point(1 + 1e-6, 1)));
    assertTrue(a.approxEquals(new Point(1 + 1e-6, 1), Tolerance.of(1e-5)));
    assertEquals(a, new Point(1, 1));
    assertEquals(a.hashCode(), new Point(1, 1).hashCode());
    assertEquals(new Point(0.0, 1), new Point(-0.0, 1));
    assertEquals(new Point(0.0, 1).hashCode(), new Point(-0.0, 1).hashCode());
    // A 2D point is not equal to a 3D point at the same location.
    assertNotEquals(new Point(1, 1), new Point(1, 1, 0));
  }

  @Test
  public void testCompareTo() {
    assertTrue(new Point(0, 5).compareTo(new Point(1, 0)) < 0);
    assertTrue(new Point(1, 1).compareTo(new Point(1, 0)) > 0);
    assertEquals(0, new Point(2, 2).compareTo(new Point(2, 2)));
  }

  @Test
  public void testCopyAndDerivedPoints() {
    Point p = new Point(1, 2, 3);
    assertSame(p, p.copy());
    assertEquals(new Point(1, 2, 9), p.withZ(9));
    Point q = p.withSpatialReference(new SpatialReference(3857, CoordinateSystem.CARTESIAN_2D));
    assertEquals(3857, q.getSRID());
    // The coordinate system follows the point's dimension.
    assertTrue(q.getCoordinateSystem().is3D());
    assertThrows(
        GeometryException.class,
        () -> new Point(200, 0).withSpatialReference(SpatialReference.WGS84));
  }

  @Test
  public void testEnvelopeAndContains() {
    Point p = new Point(1, 2);
    Envelope e = p.getEnvelope();
    assertExactly(1, e.minX());
    assertExactly(2, e.maxY());
    assertTrue(p.contains(new Point(1, 2)));
    assertFalse(p.contains(new Point(1, 2.5)));
  }

  @Test
  public void testAsText() {
    assertEquals("POINT (1 2)", new Point(1, 2).asText());
    assertEquals("POINT Z (1 2 3)", new Point(1, 2, 3).asText());
    assertEquals("POINT M (1 2 4)", Point.measured(1, 2, 4).asText());
    assertEquals("POINT ZM (1 2 3 4)", Point.measured(1, 2, 3, 4).asText());
    assertEquals("POINT (0.5 -2.25)", new Point(0.5, -2.25).asText());
  }

  @Test
  public void testWithTolerance() {
    Point p = new Point(1, 1);
    Point q = new Point(1, 1.001);
    assertFalse(p.approxEquals(q));
    Point loose = p.withTolerance(Tolerance.of(0.01));
    assertEquals(Tolerance.of(0.01), loose.tolerance());
    assertTrue(loose.approxEquals(q));
    assertEquals(p, loose);
  }

  @Test
  public void testEqualsIsExactButApproxEqualsIsTolerant() {
    Point computed = new Point(0.1 + 0.2, 1);
    Point literal = new Point(0.3, 1);
    assertNotEquals(literal, computed);
    assertFalse(ImmutableSet.of(literal).contains(computed));
    assertTrue(literal.approxEquals(computed));
    assertTrue(literal.approxEquals((Geometry) computed));
  }
}
