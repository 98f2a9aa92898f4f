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

import com.google.common.base.Preconditions;

/** Holds the spatial reference and tolerance shared by every geometry implementation. */
abstract class AbstractGeometry implements Geometry {
  private final SpatialReference spatialReference;
  private final Tolerance tolerance;

  AbstractGeometry(SpatialReference spatialReference, Tolerance tolerance) {
    this.spatialReference = Preconditions.checkNotNull(spatialReference);
    this.tolerance = Preconditions.checkNotNull(tolerance);
  }

  @Override
  public SpatialReference getSpatialReference() {
    return spatialReference;
  }

  @Override
  public Tolerance tolerance() {
    return tolerance;
  }

  @Override
  public String toString() {
    return asText();
  }
}
