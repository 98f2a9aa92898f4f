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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import java.util.List;
import java.util.logging.Logger;
import jsinterop.annotations.JsIgnore;
import jsinterop.annotations.JsType;

/**
 * A LinearRing is a closed LineString. A valid ring is either empty, or has at least 4 points, the
 * first equal to the last, and no self-intersections.
 *
 * <p>Closure is maintained eagerly: a non-empty ring is always closed, and {@link
 * #addPoint(Point)} inserts new points before the closing point. The remaining conditions, point
 * count and simplicity, are validated lazily by {@link #isValid()} and {@link
 * #findValidationError(GeometryError)}, and are enforced by {@link Polygon} before a ring is used
 * as a boundary. This allows a ring to be built up point by point.
 */
@JsType
public strictfp class LinearRing extends LineString {
  private static final Logger log = Platform.getLoggerForClass(LinearRing.class);

  /** Constructs an empty ring. */
  public LinearRing() {
    super();
  }

  /**
   * Constructs a ring through the given points.
   *
   * @throws GeometryException with code INVALID_RING if the points are non-empty and the first
   *     point does not equal the last
   */
  @JsIgnore
  public LinearRing(List<Point> points) {
    this(points, SpatialReference.DEFAULT, Tolerance.DEFAULT);
  }

  /** As {@link #LinearRing(List)}, with the given reference and tolerance. */
  @JsIgnore
  public LinearRing(List<Point> points, SpatialReference reference, Tolerance tolerance) {
    super(points, reference, tolerance);
    if (!points.isEmpty() && (points.size() < 2 || !isClosed())) {
      throw new GeometryException(
          GeometryError.Code.INVALID_RING,
          "Ring is not closed: first point %s, last point %s",
          points.get(0),
          points.get(points.size() - 1));
    }
  }

  /**
   * Inserts a point before the closing point, so the ring stays closed. The first point added to
   * an empty ring becomes both its first and last point.
   */
  @Override
  public void addPoint(Point point) {
    if (isEmpty()) {
      super.addPoint(point);
      super.addPoint(point);
    } else {
      insertPoint(numPoints() - 1, point);
    }
  }

  @Override
  public String getGeometryType() {
    return "LINEARRING";
  }

  /** Returns true if this ring is empty, or has at least 4 points and does not self-intersect. */
  public boolean isValid() {
    GeometryError error = new GeometryError();
    if (findValidationError(error)) {
      log.info(error.toString());
      return false;
    }
    return true;
  }

  /**
   * Returns true if this ring is invalid, in which case the error is set to INVALID_RING with a
   * description of the problem.
   */
  public boolean findValidationError(GeometryError error) {
    if (isEmpty()) {
      return false;
    }
    if (numPoints() < 4) {
      error.init(
          GeometryError.Code.INVALID_RING,
          "Ring has %d points, at least 4 are required",
          numPoints());
      return true;
    }
    if (!isClosed()) {
      error.init(GeometryError.Code.INVALID_RING, "Ring is not closed");
      return true;
    }
    if (!isSimple()) {
      error.init(GeometryError.Code.INVALID_RING, "Ring has a self-intersection");
      return true;
    }
    return false;
  }

  /**
   * Returns true if the ring does not intersect itself. A 3D ring is checked in the axis plane onto
   * which it projects with the largest area, so rings in vertical planes are handled too.
   */
  @Override
  public boolean isSimple() {
    List<Point> points = coordinates();
    if (is3D()) {
      points =
          PlanarAlgorithms.projectDroppingAxis(
              points, PlanarAlgorithms.dominantAxis(PlanarAlgorithms.newellNormal(points)));
    }
    return PlanarAlgorithms.isSimple(points, tolerance());
  }

  /** Returns true if the points of this ring lie in one plane. 2D rings are always planar. */
  public boolean isPlanar() {
    return !is3D() || PlanarAlgorithms.isPlanar(coordinates(), tolerance());
  }

  /**
   * Returns the shoelace area of this ring: positive if the ring is counter-clockwise, negative if
   * it is clockwise.
   */
  public double signedArea() {
    return PlanarAlgorithms.signedArea(coordinates());
  }

  /** Returns the unsigned area enclosed by this ring. */
  public double area() {
    return Math.abs(signedArea());
  }

  /**
   * Returns true if the ring winds counter-clockwise, i.e. its orientation sum {@code
   * sum((x[i+1] - x[i]) * (y[i+1] + y[i]))} is negative and its shoelace area is positive.
   */
  public boolean isCounterClockwise() {
    return PlanarAlgorithms.orientationSum(coordinates()) < 0;
  }

  /** Returns true if the ring winds clockwise. */
  public boolean isClockwise() {
    return PlanarAlgorithms.orientationSum(coordinates()) > 0;
  }

  /** Returns this ring if it is counter-clockwise, or its reverse otherwise. */
  public LinearRing toCounterClockwise() {
    return isClockwise() ? reverse() : this;
  }

  /** Returns this ring if it is clockwise, or its reverse otherwise. */
  public LinearRing toClockwise() {
    return isCounterClockwise() ? reverse() : this;
  }

  /**
   * Returns where the point lies relative to the region this ring encloses: on the ring itself,
   * inside it by ray casting, or outside.
   */
  public PlanarAlgorithms.Location locate(Point point) {
    return PlanarAlgorithms.locatePointInRing(point, coordinates(), tolerance());
  }

  @Override
  public LinearRing reverse() {
    return new LinearRing(
        ImmutableList.copyOf(Lists.reverse(coordinates())), getSpatialReference(), tolerance());
  }

  @Override
  public LinearRing copy() {
    return new LinearRing(coordinates(), getSpatialReference(), tolerance());
  }
}
