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

import static io.github.sfgeometry.BinaryOperations.difference;
import static io.github.sfgeometry.BinaryOperations.intersection;
import static io.github.sfgeometry.BinaryOperations.symDifference;
import static io.github.sfgeometry.BinaryOperations.union;
import static io.github.sfgeometry.TextFormat.makeLineString;
import static io.github.sfgeometry.TextFormat.makeMultiPoint;
import static io.github.sfgeometry.TextFormat.makePolygon;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link BinaryOperations}. */
@RunWith(JUnit4.class)
public class BinaryOperationsTest extends GeometryTestCase {
  private static final Polygon SQUARE = makePolygon("0 0, 2 0, 2 2, 0 2");
  private static final Polygon SHIFTED = makePolygon("1 1, 3 1, 3 3, 1 3");

  @Test
  public void testOverlappingSquares() {
    Geometry intersection = intersection(SQUARE, SHIFTED);
    assertEquals("POLYGON", intersection.getGeometryType());
    assertDoubleNear(1, ((Polygon) intersection).area());

    Geometry union = union(SQUARE, SHIFTED);
    assertEquals("POLYGON", union.getGeometryType());
    assertDoubleNear(7, ((Polygon) union).area());

    Geometry difference = difference(SQUARE, SHIFTED);
    assertEquals("POLYGON", difference.getGeometryType());
    assertDoubleNear(3, ((Polygon) difference).area());

    Geometry symDifference = symDifference(SQUARE, SHIFTED);
    assertEquals("MULTIPOLYGON", symDifference.getGeometryType());
    assertDoubleNear(6, ((MultiPolygon) symDifference).area());
  }

  @Test
  public void testSharedEdgeIntersectsInALine() {
    Geometry intersection = intersection(SQUARE, makePolygon("2 0, 4 0, 4 2, 2 2"));
    assertTrue(intersection instanceof LineString);
    LineString edge = (LineString) intersection;
    assertExactly(2, edge.length());
    assertTrue(edge.isPointOnCurve(new Point(2, 0)));
    assertTrue(edge.isPointOnCurve(new Point(2, 2)));
  }

  @Test
  public void testSharedCornerIntersectsInAPoint() {
    Geometry intersection = intersection(SQUARE, makePolygon("2 2, 3 2, 3 3, 2 3"));
    assertEquals(new Point(2, 2), intersection);
  }

  @Test
  public void testEmptyResult() {
    Geometry intersection = intersection(SQUARE, makePolygon("5 5, 6 5, 6 6, 5 6"));
    assertTrue(intersection.isEmpty());
    assertEquals("GEOMETRYCOLLECTION EMPTY", intersection.asText());
    assertEquals("GEOMETRYCOLLECTION EMPTY", intersection(SQUARE, new Polygon()).asText());
    assertTrue(difference(SQUARE, SQUARE.copy()).isEmpty());
  }

  @Test
  public void testLineAndPolygon() {
    LineString line = makeLineString("-1 1, 3 1");
    Geometry inside = intersection(line, SQUARE);
    assertEquals("LINESTRING", inside.getGeometryType());
    assertDoubleNear(2, ((LineString) inside).length());
    assertTrue(((LineString) inside).isPointOnCurve(new Point(1, 1)));

    Geometry outside = difference(line, SQUARE);
    assertEquals("MULTILINESTRING", outside.getGeometryType());
    assertEquals(2, ((MultiLineString) outside).numGeometries());
    assertDoubleNear(2, ((MultiLineString) outside).length());

    // A curve has no area to remove from a polygon.
    Geometry unchanged = difference(SQUARE, line);
    assertEquals("POLYGON", unchanged.getGeometryType());
    assertDoubleNear(4, ((Polygon) unchanged).area());
  }

  @Test
  public void testUnionDropsCoveredParts() {
    Geometry union = union(SQUARE, makeLineString("0 0, 2 2"));
    assertEquals("POLYGON", union.getGeometryType());
    assertDoubleNear(4, ((Polygon) union).area());

    assertEquals(SQUARE.getGeometryType(), union(SQUARE, new Point(1, 1)).getGeometryType());
  }

  @Test
  public void testMixedDimensionResult() {
    Geometry union = union(SQUARE, makeLineString("1 1, 3 1"));
    assertEquals("GEOMETRYCOLLECTION", union.getGeometryType());
    GeometryCollection<?> collection = (GeometryCollection<?>) union;
    assertEquals(2, collection.numGeometries());
    assertEquals(2, collection.dimension());
    assertTrue(collection.geometryN(1) instanceof Polygon);
    assertTrue(collection.geometryN(2) instanceof LineString);
    assertDoubleNear(1, ((LineString) collection.geometryN(2)).length());
  }

  @Test
  public void testPoints() {
    MultiPoint a = makeMultiPoint("0 0, 1 1");
    MultiPoint b = makeMultiPoint("1 1, 2 2");
    assertEquals(new Point(1, 1), intersection(a, b));
    assertEquals(3, ((MultiPoint) union(a, b)).numPoints());
    assertEquals(new Point(0, 0), difference(a, b));
    Geometry symDifference = symDifference(a, b);
    assertEquals("MULTIPOINT ((0 0), (2 2))", symDifference.asText());
  }

  @Test
  public void testResultsAreTwoDimensional() {
    Geometry union = union(new Point(0, 0, 5), new Point(1, 1, 5));
    assertEquals("MULTIPOINT", union.getGeometryType());
    assertFalse(union.is3D());
  }

  @Test
  public void testIncompatibleReferences() {
    Point geographic = new Point(1, 1, SpatialReference.WGS84);
    assertThrowsCode(GeometryError.Code.INVALID_ARGUMENT, () -> union(SQUARE, geographic));
    assertThrowsCode(GeometryError.Code.INVALID_ARGUMENT, () -> intersection(geographic, SQUARE));
  }

  @Test
  public void testSpatialReferenceIsPropagated() {
    SpatialReference reference = new SpatialReference(3857, CoordinateSystem.CARTESIAN_2D);
    Geometry union = union(new Point(0, 0, reference), new Point(1, 0, reference));
    assertEquals(3857, union.getSRID());
  }
}
