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

import static java.lang.Math.asin;
import static java.lang.Math.cos;
import static java.lang.Math.min;
import static java.lang.Math.sin;
import static java.lang.Math.sqrt;
import static java.lang.Math.toRadians;

import com.google.common.collect.ComparisonChain;
import com.google.errorprone.annotations.Immutable;
import jsinterop.annotations.JsIgnore;
import jsinterop.annotations.JsMethod;
import jsinterop.annotations.JsType;

/**
 * A Point is an immutable location with x and y coordinates, and optionally a z coordinate and a
 * measure m. Points are never empty.
 *
 * <p>{@link #equals(Object)} compares coordinates exactly so that Points can be used as hash keys.
 * The tolerant comparison used throughout the geometry model, where coordinates are equal if they
 * differ by at most 1e-10 by default, is {@link #approxEquals(Point)}. Callers looking up a
 * computed location in a collection of Points should therefore scan it with {@code approxEquals}
 * rather than rely on {@code contains} or a hash lookup.
 */
@Immutable
@JsType
public final strictfp class Point extends AbstractGeometry implements Comparable<Point> {
  /** Mean radius of the Earth in meters, used by {@link #greatCircleDistance(Point)}. */
  public static final double EARTH_RADIUS_METERS = 6371008.8;

  private final double x;
  private final double y;
  private final double z;
  private final double m;
  private final boolean hasZ;
  private final boolean hasM;

  /** Constructs a 2D point. */
  public Point(double x, double y) {
    this(x, y, Double.NaN, Double.NaN, false, false, SpatialReference.DEFAULT, Tolerance.DEFAULT);
  }

  /** Constructs a 3D point. */
  @JsIgnore
  public Point(double x, double y, double z) {
    this(x, y, z, Double.NaN, true, false, SpatialReference.DEFAULT, Tolerance.DEFAULT);
  }

  /**
   * Constructs a 2D point in the given spatial reference. If the reference is geographic, x is the
   * longitude and y the latitude, in degrees.
   */
  @JsIgnore
  public Point(double x, double y, SpatialReference reference) {
    this(x, y, Double.NaN, Double.NaN, false, false, reference, Tolerance.DEFAULT);
  }

  /** Constructs a 3D point in the given spatial reference. */
  @JsIgnore
  public Point(double x, double y, double z, SpatialReference reference) {
    this(x, y, z, Double.NaN, true, false, reference, Tolerance.DEFAULT);
  }

  private Point(
      double x,
      double y,
      double z,
      double m,
      boolean hasZ,
      boolean hasM,
      SpatialReference reference,
      Tolerance tolerance) {
    super(reference.withDimension(hasZ), tolerance);
    checkCoordinate("x", x);
    checkCoordinate("y", y);
    if (hasZ) {
      checkCoordinate("z", z);
    }
    if (hasM) {
      checkCoordinate("m", m);
    }
    if (reference.coordinateSystem().isGeographic()) {
      if (x < -180 || x > 180) {
        throw new GeometryException(
            GeometryError.Code.INVALID_COORDINATE, "Longitude %s is outside [-180, 180]", x);
      }
      if (y < -90 || y > 90) {
        throw new GeometryException(
            GeometryError.Code.INVALID_COORDINATE, "Latitude %s is outside [-90, 90]", y);
      }
    }
    this.x = x;
    this.y = y;
    this.z = hasZ ? z : Double.NaN;
    this.m = hasM ? m : Double.NaN;
    this.hasZ = hasZ;
    this.hasM = hasM;
  }

  private static void checkCoordinate(String name, double value) {
    if (!Double.isFinite(value)) {
      throw new GeometryException(
          GeometryError.Code.INVALID_COORDINATE, "Coordinate %s is not finite: %s", name, value);
    }
  }

  /** Returns a 2D point with a measure. */
  public static Point measured(double x, double y, double m) {
    return new Point(x, y, Double.NaN, m, false, true, SpatialReference.DEFAULT, Tolerance.DEFAULT);
  }

  /** Returns a 3D point with a measure. */
  @JsMethod(name = "measuredZ")
  public static Point measured(double x, double y, double z, double m) {
    return new Point(x, y, z, m, true, true, SpatialReference.DEFAULT, Tolerance.DEFAULT);
  }

  /** Returns a copy of this point in the given spatial reference, revalidating the coordinates. */
  public Point withSpatialReference(SpatialReference reference) {
    return new Point(x, y, z, m, hasZ, hasM, reference, tolerance());
  }

  /** Returns a copy of this point that compares coordinates with the given tolerance. */
  public Point withTolerance(Tolerance tolerance) {
    return new Point(x, y, z, m, hasZ, hasM, getSpatialReference(), tolerance);
  }

  /** Returns a copy of this point with the given z coordinate, keeping x, y, and any measure. */
  public Point withZ(double z) {
    return new Point(x, y, z, m, true, hasM, getSpatialReference(), tolerance());
  }

  /** Returns a 2D copy of this point, without z or m. */
  public Point to2D() {
    if (!hasZ && !hasM) {
      return this;
    }
    return new Point(
        x, y, Double.NaN, Double.NaN, false, false, getSpatialReference(), tolerance());
  }

  public double x() {
    return x;
  }

  public double y() {
    return y;
  }

  /** Returns the z coordinate, or NaN if this point is 2D. */
  public double z() {
    return z;
  }

  /** Returns the measure, or NaN if this point is not measured. */
  public double m() {
    return m;
  }

  @Override
  public boolean is3D() {
    return hasZ;
  }

  @Override
  public boolean isMeasured() {
    return hasM;
  }

  @Override
  public String getGeometryType() {
    return "POINT";
  }

  @Override
  public int dimension() {
    return 0;
  }

  @Override
  public boolean isEmpty() {
    return false;
  }

  @Override
  public boolean isSimple() {
    return true;
  }

  @Override
  public Envelope getEnvelope() {
    return Envelope.fromPoint(this);
  }

  /** The boundary of a point is empty. */
  @Override
  public MultiPoint boundary() {
    return new MultiPoint(getSpatialReference(), tolerance());
  }

  @Override
  public boolean contains(Point point) {
    return approxEquals(point);
  }

  @Override
  public Point copy() {
    return this;
  }

  /**
   * Returns the Euclidean distance to {@code other}. The distance is measured in 3D if both points
   * have z coordinates, and in the xy-plane otherwise.
   */
  public double distance(Point other) {
    if (hasZ && other.hasZ) {
      return distance3D(other);
    }
    return distance2D(other);
  }

  /** Returns the distance to {@code other} in the xy-plane, ignoring any z coordinates. */
  public double distance2D(Point other) {
    double dx = x - other.x;
    double dy = y - other.y;
    return sqrt(dx * dx + dy * dy);
  }

  /** Returns the 3D distance to {@code other}. Both points must have z coordinates. */
  public double distance3D(Point other) {
    if (!hasZ || !other.hasZ) {
      throw new GeometryException(
          GeometryError.Code.INVALID_ARGUMENT, "3D distance requires two 3D points");
    }
    double dx = x - other.x;
    double dy = y - other.y;
    double dz = z - other.z;
    return sqrt(dx * dx + dy * dy + dz * dz);
  }

  /**
   * Returns the haversine distance in meters to {@code other}, treating x as longitude and y as
   * latitude in degrees on a sphere of radius {@link #EARTH_RADIUS_METERS}.
   */
  public double greatCircleDistance(Point other) {
    double lat1 = toRadians(y);
    double lat2 = toRadians(other.y);
    double dLat = lat2 - lat1;
    double dLon = toRadians(other.x - x);
    double sinLat = sin(0.5 * dLat);
    double sinLon = sin(0.5 * dLon);
    double h = sinLat * sinLat + cos(lat1) * cos(lat2) * sinLon * sinLon;
    return 2 * EARTH_RADIUS_METERS * asin(min(1.0, sqrt(h)));
  }

  /** Returns true if the coordinates of this point are within this point's tolerance of other's. */
  public boolean approxEquals(Point other) {
    return approxEquals(other, tolerance());
  }

  /**
   * Returns true if x and y differ from {@code other}'s by at most the tolerance. The z and m
   * coordinates are compared only when both points have them.
   */
  @JsMethod(name = "approxEqualsWithTolerance")
  public boolean approxEquals(Point other, Tolerance tolerance) {
    if (!tolerance.equal(x, other.x) || !tolerance.equal(y, other.y)) {
      return false;
    }
    if (hasZ && other.hasZ && !tolerance.equal(z, other.z)) {
      return false;
    }
    return !(hasM && other.hasM && !tolerance.equal(m, other.m));
  }

  @Override
  @JsMethod(name = "approxEqualsGeometry")
  public boolean approxEquals(Geometry other) {
    return other instanceof Point && approxEquals((Point) other);
  }

  /** Lexicographic order by x, then y, then z. */
  @Override
  public int compareTo(Point other) {
    return ComparisonChain.start()
        .compare(x, other.x)
        .compare(y, other.y)
        .compare(hasZ ? z : 0, other.hasZ ? other.z : 0)
        .result();
  }

  @Override
  public boolean equals(Object other) {
    if (!(other instanceof Point)) {
      return false;
    }
    Point p = (Point) other;
    return x == p.x
        && y == p.y
        && hasZ == p.hasZ
        && hasM == p.hasM
        && (!hasZ || z == p.z)
        && (!hasM || m == p.m);
  }

  @Override
  public int hashCode() {
    long value = 17;
    value += 37 * value + Platform.doubleHash(x);
    value += 37 * value + Platform.doubleHash(y);
    if (hasZ) {
      value += 37 * value + Platform.doubleHash(z);
    }
    if (hasM) {
      value += 37 * value + Platform.doubleHash(m);
    }
    return (int) (value ^ (value >>> 32));
  }
}
