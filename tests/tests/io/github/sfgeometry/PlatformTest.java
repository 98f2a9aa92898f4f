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

import junit.framework.TestCase;

/** Verifies Platform methods. */
public class PlatformTest extends TestCase {
  private static final double NEGATIVE_ZERO = Double.parseDouble("-0");

  public void testFormatDouble() {
    assertEquals("0", Platform.formatDouble(0));
    assertEquals("0", Platform.formatDouble(NEGATIVE_ZERO));
    assertEquals("10", Platform.formatDouble(10));
    assertEquals("-2.5", Platform.formatDouble(-2.5));
    assertEquals("0.1", Platform.formatDouble(0.1));
    assertEquals("0.0001", Platform.formatDouble(0.0001));
    assertEquals("0.333333333333333", Platform.formatDouble(1.0 / 3));
    assertEquals("123456.789", Platform.formatDouble(123456.789));
    assertEquals("100000000000000", Platform.formatDouble(1e14));
  }

  public void testFormatDoubleExponents() {
    assertEquals("1e-05", Platform.formatDouble(1e-5));
    assertEquals("1.5e-20", Platform.formatDouble(1.5e-20));
    assertEquals("1e+20", Platform.formatDouble(1e20));
    assertEquals("1e+100", Platform.formatDouble(1e100));
    assertEquals("-2.25e+300", Platform.formatDouble(-2.25e300));
  }

  public void testFormatString() {
    assertEquals("1.5 and 2", Platform.formatString("%s and %d", 1.5, 2));
    assertEquals("0.50", Platform.formatString("%.2f", 0.5));
  }

  public void testDoubleHash() {
    assertEquals(Platform.doubleHash(0.0), Platform.doubleHash(NEGATIVE_ZERO));
    assertFalse(Platform.doubleHash(1.0) == Platform.doubleHash(-1.0));
  }

  public void testLoggerName() {
    assertEquals(
        "io.github.sfgeometry.PlatformTest",
        Platform.getLoggerForClass(PlatformTest.class).getName());
  }
}
