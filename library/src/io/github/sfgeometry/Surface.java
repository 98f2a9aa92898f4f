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

/** A two-dimensional geometry: a region with an area, bounded by curves. */
public interface Surface extends Geometry {
  /** Returns the non-negative area of this surface, or 0 if it is empty. */
  double area();

  /**
   * Returns the area centroid of this surface, which may lie outside a concave surface.
   *
   * @throws GeometryException with code EMPTY_GEOMETRY if the surface is empty
   */
  Point centroid();

  /**
   * Returns a point guaranteed to lie on this surface.
   *
   * @throws GeometryException with code EMPTY_GEOMETRY if the surface is empty
   */
  Point pointOnSurface();

  /** Returns the curves bounding this surface. */
  @Override
  MultiLineString boundary();

  @Override
  default int dimension() {
    return 2;
  }
}
