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

import jsinterop.annotations.JsType;

/** The kind of coordinate space a geometry's coordinates live in. */
@JsType
public enum CoordinateSystem {
  CARTESIAN_2D(false, false),
  CARTESIAN_3D(true, false),
  /** Longitude in x, latitude in y, both in degrees. */
  GEOGRAPHIC_2D(false, true),
  /** Longitude in x, latitude in y, ellipsoidal height in z. */
  GEOGRAPHIC_3D(true, true);

  private final boolean is3D;
  private final boolean isGeographic;

  private CoordinateSystem(boolean is3D, boolean isGeographic) {
    this.is3D = is3D;
    this.isGeographic = isGeographic;
  }

  /** Returns true if this coordinate system has a third, vertical axis. */
  public boolean is3D() {
    return is3D;
  }

  /** Returns true if coordinates are longitude/latitude degrees. */
  public boolean isGeographic() {
    return isGeographic;
  }

  /** Returns the system of the same family with the given dimensionality. */
  public CoordinateSystem withDimension(boolean threeDimensional) {
    if (isGeographic) {
      return threeDimensional ? GEOGRAPHIC_3D : GEOGRAPHIC_2D;
    }
    return threeDimensional ? CARTESIAN_3D : CARTESIAN_2D;
  }
}
