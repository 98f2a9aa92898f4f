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
import static io.github.sfgeometry.TextFormat.makePolygon;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;

import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link Polygon}. */
@RunWith(JUnit4.class)
public class PolygonTest extends GeometryTestCase {
  private static final String SQUARE = "0 0, 10 0, 10 10, 0 10";
  private static final String HOLE = "4 4, 6 4, 6 6, 4 6";

  @Test
  public void testSimplePolygonArea() {
    Polygon polygon = makePolygon(SQUARE);
    assertExactly(100, polygon.area());
    assertEquals(0, polygon.numInteriorRing());
    assertEquals(2, polygon.dimension());
    assertTrue(polygon.isValid());
  }

  @Test
  public void testPolygonWithHole() {
    Polygon polygon = makePolygon(SQUARE + "; " + HOLE);
    assertExactly(96, polygon.area());
    assertEquals(1, polygon.numInteriorRing());
    assertExactly(
        polygon.exteriorRing().area() - polygon.interiorRingN(1).area(), polygon.area());
    assertTrue(polygon.hasValidRingOrientations());
  }

  @Test
  public void testRingsAreNormalized() {
    // Exterior given clockwise, hole given counter-clockwise.
    Polygon polygon =
        new Polygon(
            makeLinearRing("0 0, 0 10, 10 10, 10 0"), ImmutableList.of(makeLinearRing(HOLE)));
    assertTrue(polygon.exteriorRing().isCounterClockwise());
    assertTrue(polygon.interiorRingN(1).isClockwise());
    assertTrue(polygon.hasValidRingOrientations());
    assertExactly(96, polygon.area());
  }

  @Test
  public void testEmptyPolygon() {
    Polygon polygon = new Polygon();
    assertTrue(polygon.isEmpty());
    assertExactly(0, polygon.area());
    assertEquals("POLYGON EMPTY", polygon.asText());
    assertTrue(polygon.boundary().isEmpty());
    assertFalse(polygon.contains(new Point(0, 0)));
    assertThrowsCode(GeometryError.Code.EMPTY_GEOMETRY, polygon::centroid);
    assertThrowsCode(
        GeometryError.Code.INVALID_RING, () -> polygon.addInteriorRing(makeLinearRing(HOLE)));
  }

  @Test
  public void testAsText() {
    assertEquals("POLYGON ((0 0, 1 0, 0 1, 0 0))", makePolygon("0 0, 1 0, 0 1").asText());
    assertEquals(
        "POLYGON ((0 0, 10 0, 10 10, 0 10, 0 0), (4 4, 4 6, 6 6, 6 4, 4 4))",
        makePolygon(SQUARE + "; " + HOLE).asText());
  }

  @Test
  public void testInvalidHolesAreRejected() {
    Polygon polygon = makePolygon(SQUARE);
    // Outside the shell.
    assertThrowsCode(
        GeometryError.Code.INVALID_RING,
        () -> polygon.addInteriorRing(makeLinearRing("20 20, 21 20, 21 21")));
    // Touching the shell.
    assertThrowsCode(
        GeometryError.Code.INVALID_RING,
        () -> polygon.addInteriorRing(makeLinearRing("0 5, 2 4, 2 6")));
    // Crossing the shell.
    assertThrowsCode(
        GeometryError.Code.INVALID_RING,
        () -> polygon.addInteriorRing(makeLinearRing("8 4, 12 4, 12 6, 8 6")));
    polygon.addInteriorRing(makeLinearRing(HOLE));
    // Overlapping an existing hole.
    assertThrowsCode(
        GeometryError.Code.INVALID_RING,
        () -> polygon.addInteriorRing(makeLinearRing("5 5, 7 5, 7 7, 5 7")));
    // Containing an existing hole.
    assertThrowsCode(
        GeometryError.Code.INVALID_RING,
        () -> polygon.addInteriorRing(makeLinearRing("2 2, 8 2, 8 8, 2 8")));
    // A disjoint hole is fine.
    polygon.addInteriorRing(makeLinearRing("1 1, 2 1, 2 2, 1 2"));
    assertEquals(2, polygon.numInteriorRing());
    assertExactly(95, polygon.area());
    assertTrue(polygon.isValid());
  }

  @Test
  public void testInvalidExteriorIsRejected() {
    assertThrowsCode(
        GeometryError.Code.INVALID_RING, () -> makePolygon("0 0, 2 2, 2 0, 0 2"));
    Polygon polygon = makePolygon(SQUARE + "; " + HOLE);
    // The new exterior would no longer contain the hole.
    assertThrowsCode(
        GeometryError.Code.INVALID_RING,
        () -> polygon.setExteriorRing(makeLinearRing("0 0, 3 0, 3 3, 0 3")));
    assertExactly(96, polygon.area());
  }

  @Test
  public void testCentroid() {
    assertPointsNear(new Point(5, 5), makePolygon(SQUARE).centroid());
    assertPointsNear(new Point(5, 5), makePolygon(SQUARE + "; " + HOLE).centroid());
    // An L shape: a 2x1 bar and a 1x1 square on top of its left end.
    Polygon l = makePolygon("0 0, 2 0, 2 1, 1 1, 1 2, 0 2");
    assertPointsNear(new Point(5.0 / 6, 5.0 / 6), l.centroid());
    AreaCentroid ac = l.getAreaCentroid();
    assertExactly(3, ac.getArea());
  }

  @Test
  public void testPointOnSurface() {
    // The centroid of this square with a hole is in the hole.
    Polygon polygon = makePolygon(SQUARE + "; " + HOLE);
    Point p = polygon.pointOnSurface();
    assertEquals(PlanarAlgorithms.Location.INTERIOR, polygon.locate(p));

    Polygon u = makePolygon("0 0, 3 0, 3 3, 2 3, 2 1, 1 1, 1 3, 0 3");
    assertEquals(PlanarAlgorithms.Location.INTERIOR, u.locate(u.pointOnSurface()));
  }

  @Test
  public void testContainsAndLocate() {
    Polygon polygon = makePolygon(SQUARE + "; " + HOLE);
    assertTrue(polygon.contains(new Point(1, 1)));
    assertTrue(polygon.contains(new Point(0, 5)));
    assertTrue(polygon.contains(new Point(4, 5)));
    assertFalse(polygon.contains(new Point(5, 5)));
    assertFalse(polygon.contains(new Point(11, 5)));
    assertEquals(PlanarAlgorithms.Location.BOUNDARY, polygon.locate(new Point(6, 5)));
  }

  @Test
  public void testBoundary() {
    MultiLineString boundary = makePolygon(SQUARE + "; " + HOLE).boundary();
    assertEquals(2, boundary.numGeometries());
    assertExactly(48, boundary.length());
    assertTrue(boundary.isClosed());
  }

  @Test
  public void testCopyAndEquality() {
    Polygon polygon = makePolygon(SQUARE);
    Polygon copy = polygon.copy();
    assertEquals(polygon, copy);
    assertEquals(polygon.hashCode(), copy.hashCode());
    copy.addInteriorRing(makeLinearRing(HOLE));
    assertNotEquals(polygon, copy);
    assertEquals(0, polygon.numInteriorRing());
    // Returned rings are copies.
    polygon.exteriorRing().addPoint(new Point(20, 20));
    assertExactly(100, polygon.area());
  }

  @Test
  public void testInteriorRingIndex() {
    Polygon polygon = makePolygon(SQUARE + "; " + HOLE);
    assertThrowsCode(GeometryError.Code.INDEX_OUT_OF_RANGE, () -> polygon.interiorRingN(0));
    assertThrowsCode(GeometryError.Code.INDEX_OUT_OF_RANGE, () -> polygon.interiorRingN(2));
    assertEquals(1, polygon.getInteriorRings().size());
  }
}
