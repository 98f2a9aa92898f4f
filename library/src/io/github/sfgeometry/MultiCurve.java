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

import java.util.ArrayList;
import java.util.List;
import jsinterop.annotations.JsIgnore;
import jsinterop.annotations.JsType;

/**
 * A collection of curves.
 *
 * <p>The boundary follows the mod-2 rule: a point is on the boundary if it is the start or end
 * point of an odd number of member curves. Two open curves that meet end to end therefore have no
 * boundary at their junction, and a closed curve contributes nothing to the boundary.
 *
 * <p>A MultiCurve is simple if every member is simple and two members meet only at points that
 * are on the boundary of both.
 *
 * @param <T> the type of the member curves
 */
@JsType
public strictfp class MultiCurve<T extends Curve> extends GeometryCollection<T> {
  /** Constructs an empty MultiCurve. */
  public MultiCurve() {
    this(SpatialReference.DEFAULT, Tolerance.DEFAULT);
  }

  @JsIgnore
  public MultiCurve(SpatialReference reference, Tolerance tolerance) {
    super(reference, tolerance);
  }

  @JsIgnore
  public MultiCurve(List<? extends T> curves, SpatialReference reference, Tolerance tolerance) {
    super(curves, reference, tolerance);
  }

  @Override
  public String getGeometryType() {
    return "MULTICURVE";
  }

  /** Returns the sum of the member lengths. */
  public double length() {
    double length = 0;
    for (T curve : geometryList()) {
      length += curve.length();
    }
    return length;
  }

  /** Returns true if there is at least one member and every member is closed. */
  public boolean isClosed() {
    List<T> curves = geometryList();
    if (curves.isEmpty()) {
      return false;
    }
    for (T curve : curves) {
      if (!curve.isClosed()) {
        return false;
      }
    }
    return true;
  }

  /** Returns the points that are an endpoint of an odd number of members. */
  @Override
  public MultiPoint boundary() {
    List<Point> endpoints = new ArrayList<>();
    for (T curve : geometryList()) {
      if (!curve.isEmpty()) {
        endpoints.add(curve.startPoint());
        endpoints.add(curve.endPoint());
      }
    }
    return new MultiPoint(
        PlanarAlgorithms.mod2Boundary(endpoints, tolerance()), getSpatialReference(), tolerance());
  }

  @Override
  public boolean isSimple() {
    List<T> curves = geometryList();
    for (T curve : curves) {
      if (!curve.isSimple()) {
        return false;
      }
    }
    for (int i = 0; i < curves.size(); i++) {
      for (int j = i + 1; j < curves.size(); j++) {
        if (!meetOnlyAtBoundaries(curves.get(i), curves.get(j))) {
          return false;
        }
      }
    }
    return true;
  }

  private boolean meetOnlyAtBoundaries(Curve a, Curve b) {
    if (!a.getEnvelope().intersects(b.getEnvelope(), tolerance())) {
      return true;
    }
    List<Point> pa = a.points();
    List<Point> pb = b.points();
    for (int i = 0; i + 1 < pa.size(); i++) {
      for (int j = 0; j + 1 < pb.size(); j++) {
        List<Point> crossings =
            PlanarAlgorithms.segmentIntersections(
                pa.get(i), pa.get(i + 1), pb.get(j), pb.get(j + 1), tolerance());
        if (crossings.size() > 1) {
          // The segments overlap along a stretch.
          return false;
        }
        for (Point p : crossings) {
          if (!isBoundaryPoint(a, p) || !isBoundaryPoint(b, p)) {
            return false;
          }
        }
      }
    }
    return true;
  }

  private boolean isBoundaryPoint(Curve curve, Point p) {
    return !curve.isClosed()
        && (curve.startPoint().approxEquals(p, tolerance())
            || curve.endPoint().approxEquals(p, tolerance()));
  }

  @Override
  protected MultiCurve<T> newInstance() {
    return new MultiCurve<>(getSpatialReference(), tolerance());
  }

  @Override
  public MultiCurve<T> copy() {
    return (MultiCurve<T>) super.copy();
  }
}
