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

import static io.github.sfgeometry.TextFormat.makeMultiLineString;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link MultiLineString} and the {@link MultiCurve} rules it inherits. */
@RunWith(JUnit4.class)
public class MultiLineStringTest extends GeometryTestCase {
  @Test
  public void testLength() {
    MultiLineString lines = makeMultiLineString("0 0, 3 0 | 0 1, 0 5");
    assertEquals("MULTILINESTRING", lines.getGeometryType());
    assertEquals(1, lines.dimension());
    assertExactly(7, lines.length());
    assertEquals("MULTILINESTRING ((0 0, 3 0), (0 1, 0 5))", lines.asText());
  }

  @Test
  public void testJoinedEndpointsLeaveTheBoundary() {
    MultiPoint boundary = makeMultiLineString("0 0, 1 0 | 1 0, 2 0").boundary();
    assertEquals(2, boundary.numPoints());
    assertEquals(new Point(0, 0), boundary.geometryN(1));
    assertEquals(new Point(2, 0), boundary.geometryN(2));
  }

  @Test
  public void testOddJunctionIsOnTheBoundary() {
    MultiPoint boundary = makeMultiLineString("0 0, 1 0 | 1 0, 2 0 | 1 0, 1 1").boundary();
    assertEquals(4, boundary.numPoints());
    assertTrue(boundary.containsGeometry(new Point(1, 0)));
    assertTrue(boundary.containsGeometry(new Point(1, 1)));
  }

  @Test
  public void testClosedMembersHaveNoBoundary() {
    MultiLineString lines = makeMultiLineString("0 0, 1 0, 1 1, 0 0 | 5 5, 6 5, 6 6, 5 5");
    assertTrue(lines.isClosed());
    assertTrue(lines.boundary().isEmpty());
    assertFalse(makeMultiLineString("0 0, 1 0, 1 1, 0 0 | 5 5, 6 5").isClosed());
    assertFalse(new MultiLineString().isClosed());
  }

  @Test
  public void testIsSimple() {
    assertTrue(makeMultiLineString("0 0, 1 0 | 1 0, 2 0").isSimple());
    assertTrue(makeMultiLineString("0 0, 1 0 | 0 1, 1 1").isSimple());
    // Crossing members.
    assertFalse(makeMultiLineString("0 0, 2 2 | 0 2, 2 0").isSimple());
    // One member ends in the interior of the other.
    assertFalse(makeMultiLineString("0 0, 2 0 | 1 0, 1 1").isSimple());
    // Overlapping members.
    assertFalse(makeMultiLineString("0 0, 2 0 | 1 0, 3 0").isSimple());
    // A member that is not simple itself.
    assertFalse(makeMultiLineString("0 0, 2 2, 2 0, 0 2").isSimple());
  }

  @Test
  public void testCopyIsIndependent() {
    MultiLineString lines = makeMultiLineString("0 0, 3 0");
    MultiLineString copy = lines.copy();
    copy.addLineString(TextFormat.makeLineString("0 1, 0 5"));
    assertEquals(1, lines.numGeometries());
    assertExactly(7, copy.length());
    assertEquals("MULTILINESTRING", copy.getGeometryType());
  }
}
