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
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;

import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link GeometryCollection}. */
@RunWith(JUnit4.class)
public class GeometryCollectionTest extends GeometryTestCase {
  private static GeometryCollection<Geometry> mixed() {
    GeometryCollection<Geometry> collection = new GeometryCollection<>();
    collection.add(new Point(1, 2));
    collection.add(makeLineString("0 0, 1 1"));
    collection.add(makePolygon("2 2, 4 2, 4 4, 2 4"));
    return collection;
  }

  @Test
  public void testEmpty() {
    GeometryCollection<Geometry> collection = new GeometryCollection<>();
    assertTrue(collection.isEmpty());
    assertEquals(-1, collection.dimension());
    assertEquals(0, collection.numGeometries());
    assertFalse(collection.is3D());
    assertTrue(collection.getEnvelope().isEmpty());
    assertEquals("GEOMETRYCOLLECTION EMPTY", collection.asText());
  }

  @Test
  public void testCollectionOfEmptyMembers() {
    GeometryCollection<Geometry> collection = new GeometryCollection<>();
    collection.add(new LineString());
    assertTrue(collection.isEmpty());
    assertEquals(1, collection.dimension());
    // Only collections without members are written as EMPTY.
    assertEquals("GEOMETRYCOLLECTION (LINESTRING EMPTY)", collection.asText());
  }

  @Test
  public void testMembers() {
    GeometryCollection<Geometry> collection = mixed();
    assertEquals(3, collection.numGeometries());
    assertEquals(2, collection.dimension());
    assertFalse(collection.isEmpty());
    assertEquals(new Point(1, 2), collection.geometryN(1));
    assertEquals("POLYGON", collection.geometryN(3).getGeometryType());
    assertThrowsCode(GeometryError.Code.INDEX_OUT_OF_RANGE, () -> collection.geometryN(4));
    assertEquals(
        "GEOMETRYCOLLECTION (POINT (1 2), LINESTRING (0 0, 1 1), "
            + "POLYGON ((2 2, 4 2, 4 4, 2 4, 2 2)))",
        collection.asText());
  }

  @Test
  public void testMembersAreCopies() {
    LineString line = makeLineString("0 0, 1 1");
    GeometryCollection<Geometry> collection = new GeometryCollection<>();
    collection.add(line);
    line.addPoint(new Point(2, 2));
    assertEquals(2, ((LineString) collection.geometryN(1)).numPoints());
    ((LineString) collection.geometryN(1)).addPoint(new Point(5, 5));
    assertEquals(2, ((LineString) collection.geometryN(1)).numPoints());
  }

  @Test
  public void testRemoveAndContains() {
    GeometryCollection<Geometry> collection = mixed();
    assertTrue(collection.containsGeometry(new Point(1, 2 + 1e-12)));
    assertFalse(collection.containsGeometry(new Point(1, 3)));
    assertTrue(collection.remove(makeLineString("0 0, 1 1")));
    assertFalse(collection.remove(makeLineString("0 0, 1 1")));
    assertEquals(2, collection.numGeometries());
    collection.removeGeometryN(1);
    assertEquals("POLYGON", collection.geometryN(1).getGeometryType());
    assertThrowsCode(GeometryError.Code.INDEX_OUT_OF_RANGE, () -> collection.removeGeometryN(2));
    collection.clear();
    assertEquals(0, collection.numGeometries());
  }

  @Test
  public void testFlatten() {
    GeometryCollection<Geometry> inner = new GeometryCollection<>();
    inner.add(new Point(5, 5));
    inner.add(new MultiPoint(ImmutableList.of(new Point(6, 6), new Point(7, 7))));
    GeometryCollection<Geometry> outer = mixed();
    outer.add(inner);
    ImmutableList<Geometry> flat = outer.flatten();
    assertEquals(6, flat.size());
    for (Geometry g : flat) {
      assertFalse(g instanceof GeometryCollection);
    }
    assertEquals(new Point(7, 7), flat.get(5));
  }

  @Test
  public void testGetAllPoints() {
    ImmutableList<Point> points = mixed().getAllPoints();
    // One point, two line vertices, and five ring vertices including the closing point.
    assertEquals(8, points.size());
    assertEquals(new Point(1, 2), points.get(0));
    assertEquals(new Point(2, 2), points.get(7));
  }

  @Test
  public void testBoundaryAndContains() {
    GeometryCollection<Geometry> collection = mixed();
    Geometry boundary = collection.boundary();
    // The point has no boundary, so only the line and the polygon contribute.
    assertEquals(2, ((GeometryCollection<?>) boundary).numGeometries());
    assertTrue(collection.contains(new Point(0.5, 0.5)));
    assertTrue(collection.contains(new Point(3, 3)));
    assertFalse(collection.contains(new Point(1.5, 1)));
  }

  @Test
  public void testEnvelope() {
    Envelope envelope = mixed().getEnvelope();
    assertExactly(0, envelope.minX());
    assertExactly(0, envelope.minY());
    assertExactly(4, envelope.maxX());
    assertExactly(4, envelope.maxY());
  }

  @Test
  public void testCopyAndEquality() {
    GeometryCollection<Geometry> collection = mixed();
    GeometryCollection<Geometry> copy = collection.copy();
    assertEquals(collection, copy);
    assertTrue(collection.approxEquals(copy));
    copy.removeGeometryN(1);
    assertNotEquals(collection, copy);
    assertEquals(3, collection.numGeometries());
    // Different collection types are never equal.
    MultiPoint points = new MultiPoint(ImmutableList.of(new Point(1, 2)));
    GeometryCollection<Geometry> generic = new GeometryCollection<>();
    generic.add(new Point(1, 2));
    assertFalse(points.approxEquals(generic));
    assertNotEquals(points, generic);
  }

  @Test
  public void testThreeDimensional() {
    GeometryCollection<Geometry> collection = new GeometryCollection<>();
    collection.add(new Point(1, 2, 3));
    assertTrue(collection.is3D());
    collection.add(new Point(1, 2));
    assertFalse(collection.is3D());
  }

  @Test
  public void testGetGeometries() {
    GeometryCollection<Geometry> collection = new GeometryCollection<>();
    collection.add(new Point(1, 2));
    collection.add(makeLineString("0 0, 1 1"));
    ImmutableList<Geometry> members = collection.getGeometries();
    assertEquals(2, members.size());
    assertEquals(new Point(1, 2), members.get(0));
    assertEquals("LINESTRING", members.get(1).getGeometryType());
    assertThrowsCode(GeometryError.Code.INDEX_OUT_OF_RANGE, () -> collection.geometryN(3));
  }
}
