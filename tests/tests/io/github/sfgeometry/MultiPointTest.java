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

import static io.github.sfgeometry.TextFormat.makeMultiPoint;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link MultiPoint}. */
@RunWith(JUnit4.class)
public class MultiPointTest extends GeometryTestCase {
  @Test
  public void testBasics() {
    MultiPoint points = makeMultiPoint("0 0, 2 0, 2 2, 0 2");
    assertEquals("MULTIPOINT", points.getGeometryType());
    assertEquals(4, points.numPoints());
    assertEquals(0, points.dimension());
    assertTrue(points.isSimple());
    assertTrue(points.boundary().isEmpty());
    assertEquals("MULTIPOINT ((0 0), (2 0), (2 2), (0 2))", points.asText());
  }

  @Test
  public void testCentroidIsTheMean() {
    assertPointsNear(new Point(1, 1), makeMultiPoint("0 0, 2 0, 2 2, 0 2").centroid());
    assertPointsNear(new Point(1, 0), makeMultiPoint("0 0, 3 0, 0 0").centroid());
    assertThrowsCode(GeometryError.Code.EMPTY_GEOMETRY, () -> new MultiPoint().centroid());
  }

  @Test
  public void testDuplicatesAreNotSimple() {
    MultiPoint points = makeMultiPoint("0 0, 1 1");
    points.addPoint(new Point(1, 1 + 1e-12));
    assertEquals(3, points.numPoints());
    assertFalse(points.isSimple());
  }

  @Test
  public void testPointsWithinDistance() {
    MultiPoint points = makeMultiPoint("0 0, 3 4, 6 8, 1 1");
    ImmutableList<Point> near = points.getPointsWithinDistance(new Point(0, 0), 5);
    assertEquals(ImmutableList.of(new Point(0, 0), new Point(3, 4), new Point(1, 1)), near);
    assertTrue(points.getPointsWithinDistance(new Point(100, 100), 1).isEmpty());
  }

  @Test
  public void testContains() {
    MultiPoint points = makeMultiPoint("0 0, 3 4");
    assertTrue(points.contains(new Point(3, 4)));
    assertFalse(points.contains(new Point(1, 1)));
  }

  @Test
  public void testThreeDimensional() {
    MultiPoint points = makeMultiPoint("0 0 1, 3 4 5");
    assertTrue(points.is3D());
    assertEquals("MULTIPOINT Z ((0 0 1), (3 4 5))", points.asText());
  }
}
