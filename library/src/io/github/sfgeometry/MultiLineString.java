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
import jsinterop.annotations.JsIgnore;
import jsinterop.annotations.JsType;

/** A collection of LineStrings, which may include LinearRings. */
@JsType
public strictfp class MultiLineString extends MultiCurve<LineString> {
  /** Constructs an empty MultiLineString. */
  public MultiLineString() {
    this(SpatialReference.DEFAULT, Tolerance.DEFAULT);
  }

  @JsIgnore
  public MultiLineString(SpatialReference reference, Tolerance tolerance) {
    super(reference, tolerance);
  }

  @JsIgnore
  public MultiLineString(List<? extends LineString> lines) {
    this(lines, SpatialReference.DEFAULT, Tolerance.DEFAULT);
  }

  @JsIgnore
  public MultiLineString(
      List<? extends LineString> lines, SpatialReference reference, Tolerance tolerance) {
    super(lines, reference, tolerance);
  }

  @Override
  public String getGeometryType() {
    return "MULTILINESTRING";
  }

  /** Adds a copy of the line. */
  public void addLineString(LineString line) {
    add(line);
  }

  @Override
  protected MultiLineString newInstance() {
    return new MultiLineString(getSpatialReference(), tolerance());
  }

  @Override
  public MultiLineString copy() {
    return (MultiLineString) super.copy();
  }
}
