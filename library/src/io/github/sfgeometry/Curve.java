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

import java.util.List;

/**
 * A one-dimensional geometry: an ordered sequence of points joined by straight segments.
 *
 * <p>Invariants: {@code isEmpty() == (numPoints() == 0)}; {@code isClosed()} holds iff there are
 * at least two points and the first equals the last; {@code isRing() == isClosed() &&
 * isSimple()}.
 */
public interface Curve extends Geometry {
  /** Returns the sum of the lengths of the segments, or 0 if there are fewer than two points. */
  double length();

  /** Returns the number of points. */
  int numPoints();

  /**
   * Returns the n-th point, 1-based.
   *
   * @throws GeometryException with code INDEX_OUT_OF_RANGE if n is not in [1, numPoints()]
   */
  Point pointN(int n);

  /** Returns an immutable list of the points, in order. */
  List<Point> points();

  /**
   * Returns the first point.
   *
   * @throws GeometryException with code EMPTY_GEOMETRY if there are no points
   */
  Point startPoint();

  /**
   * Returns the last point.
   *
   * @throws GeometryException with code EMPTY_GEOMETRY if there are no points
   */
  Point endPoint();

  /** Returns true if there are at least two points and the first equals the last. */
  boolean isClosed();

  /** Returns true if this curve is closed and simple. */
  default boolean isRing() {
    return isClosed() && isSimple();
  }

  /**
   * Returns the point at the given distance along the curve from its start.
   *
   * @throws GeometryException with code OUT_OF_RANGE if distance is not in [0, length()], or
   *     EMPTY_GEOMETRY if the curve has no points
   */
  Point interpolatePoint(double distance);

  @Override
  default int dimension() {
    return 1;
  }

  /** Returns the start and end points of an open curve, and nothing for a closed curve. */
  @Override
  MultiPoint boundary();
}
