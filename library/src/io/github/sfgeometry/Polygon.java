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
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;
import jsinterop.annotations.JsIgnore;
import jsinterop.annotations.JsType;
import org.jspecify.annotations.Nullable;

/**
 * A Polygon is a planar region bounded by one exterior ring and zero or more interior rings
 * (holes).
 *
 * <p>Every mutator validates before changing state, so a Polygon is always valid:
 *
 * <ul>
 *   <li>the exterior ring is a valid ring, stored counter-clockwise;
 *   <li>every interior ring is a valid non-empty ring, stored clockwise;
 *   <li>every interior ring lies strictly inside the exterior ring and does not touch it;
 *   <li>interior rings neither touch, cross, nor contain each other.
 * </ul>
 *
 * <p>Rings given with the opposite orientation are reversed, not rejected. Rings are copied on the
 * way in and on the way out.
 */
@JsType
public strictfp class Polygon extends AbstractGeometry implements Surface {
  private static final Logger log = Platform.getLoggerForClass(Polygon.class);

  private LinearRing exterior;
  private final List<LinearRing> holes = new ArrayList<>();

  /** Constructs an empty polygon. */
  public Polygon() {
    this(SpatialReference.DEFAULT, Tolerance.DEFAULT);
  }

  /** Constructs an empty polygon with the given reference and tolerance. */
  @JsIgnore
  public Polygon(SpatialReference reference, Tolerance tolerance) {
    super(reference, tolerance);
    this.exterior = new LinearRing(ImmutableList.of(), reference, tolerance);
  }

  /**
   * Constructs a polygon with the given exterior ring and no holes.
   *
   * @throws GeometryException with code INVALID_RING if the ring is not valid
   */
  @JsIgnore
  public Polygon(LinearRing exterior) {
    this(exterior, ImmutableList.of());
  }

  /**
   * Constructs a polygon with the given exterior and interior rings.
   *
   * @throws GeometryException with code INVALID_RING if any ring is invalid or the rings are not
   *     properly nested
   */
  @JsIgnore
  public Polygon(LinearRing exterior, List<LinearRing> holes) {
    this(exterior, holes, exterior.getSpatialReference(), exterior.tolerance());
  }

  /** As {@link #Polygon(LinearRing, List)}, with the given reference and tolerance. */
  @JsIgnore
  public Polygon(
      LinearRing exterior,
      List<LinearRing> holes,
      SpatialReference reference,
      Tolerance tolerance) {
    this(reference, tolerance);
    setExteriorRing(exterior);
    for (LinearRing hole : holes) {
      addInteriorRing(hole);
    }
  }

  @Override
  public String getGeometryType() {
    return "POLYGON";
  }

  /**
   * Replaces the exterior ring. Existing interior rings must still lie strictly inside the new
   * exterior ring. An empty ring empties the polygon, which requires that it has no holes.
   *
   * @throws GeometryException with code INVALID_RING if the ring is invalid or would no longer
   *     contain the existing holes
   */
  public void setExteriorRing(LinearRing ring) {
    Preconditions.checkNotNull(ring);
    GeometryError error = new GeometryError();
    if (ring.findValidationError(error)) {
      error.init(error.code(), "Exterior ring: %s", error.text());
      throw new GeometryException(error);
    }
    LinearRing candidate = ring.toCounterClockwise().copy();
    int axis = projectionAxis(candidate);
    for (int i = 0; i < holes.size(); i++) {
      if (candidate.isEmpty()
          || !liesStrictlyInside(
              PlanarAlgorithms.projectDroppingAxis(holes.get(i).coordinates(), axis),
              PlanarAlgorithms.projectDroppingAxis(candidate.coordinates(), axis))) {
        throw new GeometryException(
            GeometryError.Code.INVALID_RING,
            "Existing interior ring %d is not inside the new exterior ring",
            i + 1);
      }
    }
    exterior = candidate;
  }

  /**
   * Adds a hole. The ring must be valid and non-empty, lie strictly inside the exterior ring, and
   * neither touch nor nest with any existing hole.
   *
   * @throws GeometryException with code INVALID_RING if any of these conditions fails
   */
  public void addInteriorRing(LinearRing ring) {
    Preconditions.checkNotNull(ring);
    GeometryError error = new GeometryError();
    if (findInteriorRingError(ring, holes, error)) {
      throw new GeometryException(error);
    }
    holes.add(ring.toClockwise().copy());
  }

  private boolean findInteriorRingError(
      LinearRing ring, List<LinearRing> existingHoles, GeometryError error) {
    if (exterior.isEmpty()) {
      error.init(GeometryError.Code.INVALID_RING, "Cannot add a hole to an empty polygon");
      return true;
    }
    if (ring.isEmpty()) {
      error.init(GeometryError.Code.INVALID_RING, "Interior ring is empty");
      return true;
    }
    if (ring.findValidationError(error)) {
      error.init(error.code(), "Interior ring: %s", error.text());
      return true;
    }
    int axis = projectionAxis(exterior);
    List<Point> projected = PlanarAlgorithms.projectDroppingAxis(ring.coordinates(), axis);
    if (!liesStrictlyInside(
        projected, PlanarAlgorithms.projectDroppingAxis(exterior.coordinates(), axis))) {
      error.init(GeometryError.Code.INVALID_RING, "Interior ring is not inside the exterior ring");
      return true;
    }
    for (int i = 0; i < existingHoles.size(); i++) {
      List<Point> hole =
          PlanarAlgorithms.projectDroppingAxis(existingHoles.get(i).coordinates(), axis);
      if (ringsTouch(projected, hole)
          || PlanarAlgorithms.locatePointInRing(projected.get(0), hole, tolerance())
              != PlanarAlgorithms.Location.EXTERIOR
          || PlanarAlgorithms.locatePointInRing(hole.get(0), projected, tolerance())
              != PlanarAlgorithms.Location.EXTERIOR) {
        error.init(
            GeometryError.Code.INVALID_RING, "Interior ring intersects interior ring %d", i + 1);
        return true;
      }
    }
    return false;
  }

  /**
   * Returns the coordinate to drop when projecting rings onto a plane: z, unless the exterior ring
   * stands vertically in 3D.
   */
  private static int projectionAxis(LinearRing exterior) {
    if (!exterior.is3D()) {
      return 2;
    }
    return PlanarAlgorithms.dominantAxis(PlanarAlgorithms.newellNormal(exterior.coordinates()));
  }

  /** Returns true if every point of inner is in the interior of outer and the rings don't meet. */
  private boolean liesStrictlyInside(List<Point> inner, List<Point> outer) {
    for (Point p : inner) {
      if (PlanarAlgorithms.locatePointInRing(p, outer, tolerance())
          != PlanarAlgorithms.Location.INTERIOR) {
        return false;
      }
    }
    return !ringsTouch(inner, outer);
  }

  private boolean ringsTouch(List<Point> pa, List<Point> pb) {
    if (!Envelope.fromPoints(pa).intersects(Envelope.fromPoints(pb), tolerance())) {
      return false;
    }
    for (int i = 1; i < pa.size(); i++) {
      for (int j = 1; j < pb.size(); j++) {
        if (PlanarAlgorithms.segmentsTouchOrCross(
            pa.get(i - 1), pa.get(i), pb.get(j - 1), pb.get(j), tolerance())) {
          return true;
        }
      }
    }
    return false;
  }

  /** Returns a copy of the exterior ring, which is empty if the polygon is. */
  public LinearRing exteriorRing() {
    return exterior.copy();
  }

  /** Returns the number of holes. */
  public int numInteriorRing() {
    return holes.size();
  }

  /**
   * Returns a copy of the n-th hole, 1-based.
   *
   * @throws GeometryException with code INDEX_OUT_OF_RANGE if n is not in [1,
   *     numInteriorRing()]
   */
  public LinearRing interiorRingN(int n) {
    if (n < 1 || n > holes.size()) {
      throw new GeometryException(
          GeometryError.Code.INDEX_OUT_OF_RANGE,
          "Interior ring index %d is outside [1, %d]",
          n,
          holes.size());
    }
    return holes.get(n - 1).copy();
  }

  /** Returns copies of all holes. */
  public ImmutableList<LinearRing> getInteriorRings() {
    ImmutableList.Builder<LinearRing> result = ImmutableList.builder();
    for (LinearRing hole : holes) {
      result.add(hole.copy());
    }
    return result.build();
  }

  /** Returns the exterior ring points without copying, for use within the package. */
  List<Point> exteriorCoordinates() {
    return exterior.coordinates();
  }

  /** Returns the points of every hole without copying, for use within the package. */
  List<List<Point>> holeCoordinates() {
    List<List<Point>> result = new ArrayList<>(holes.size());
    for (LinearRing hole : holes) {
      result.add(hole.coordinates());
    }
    return result;
  }

  /** Returns the points of every ring, exterior first, for use within the package. */
  List<List<Point>> ringCoordinates() {
    List<List<Point>> result = new ArrayList<>(holes.size() + 1);
    if (!exterior.isEmpty()) {
      result.add(exterior.coordinates());
    }
    result.addAll(holeCoordinates());
    return result;
  }

  @Override
  public boolean isEmpty() {
    return exterior.isEmpty();
  }

  /** Valid polygons are always simple. */
  @Override
  public boolean isSimple() {
    return true;
  }

  @Override
  public boolean is3D() {
    return exterior.is3D();
  }

  @Override
  public boolean isMeasured() {
    return exterior.isMeasured();
  }

  @Override
  public Envelope getEnvelope() {
    return exterior.getEnvelope();
  }

  /** Returns the area of the exterior ring minus the areas of the holes. */
  @Override
  public double area() {
    double area = exterior.area();
    for (LinearRing hole : holes) {
      area -= hole.area();
    }
    return area;
  }

  /**
   * Returns the area measured in the plane of the polygon rather than its xy projection. The two
   * agree for 2D polygons.
   */
  double planeArea() {
    double area = PlanarAlgorithms.vectorArea(exterior.coordinates());
    for (LinearRing hole : holes) {
      area -= PlanarAlgorithms.vectorArea(hole.coordinates());
    }
    return area;
  }

  /** Returns the area and centroid together, holes subtracted. */
  public AreaCentroid getAreaCentroid() {
    AreaCentroid result = PlanarAlgorithms.ringAreaCentroid(exterior.coordinates(), tolerance());
    for (LinearRing hole : holes) {
      result = result.combine(
          PlanarAlgorithms.ringAreaCentroid(hole.coordinates(), tolerance()), true);
    }
    return result;
  }

  @Override
  public Point centroid() {
    checkNotEmpty("centroid");
    Point centroid = getAreaCentroid().getCentroid();
    if (centroid == null) {
      // Zero area: fall back to the mean of the distinct exterior vertices.
      return vertexMean(exterior.coordinates().subList(0, exterior.numPoints() - 1));
    }
    return centroid;
  }

  static Point vertexMean(List<Point> points) {
    double x = 0;
    double y = 0;
    for (Point p : points) {
      x += p.x();
      y += p.y();
    }
    return new Point(x / points.size(), y / points.size());
  }

  /**
   * Returns the centroid if it lies in the interior, which is always the case for convex polygons
   * without holes. Otherwise returns the midpoint of the widest interior span of a horizontal scan
   * line through the middle of the polygon.
   */
  @Override
  public Point pointOnSurface() {
    checkNotEmpty("pointOnSurface");
    Point centroid = centroid();
    if (locate(centroid) == PlanarAlgorithms.Location.INTERIOR) {
      return centroid;
    }
    @Nullable Point interior =
        PlanarAlgorithms.interiorPoint(exterior.coordinates(), holeCoordinates(), tolerance());
    if (interior == null) {
      log.fine("Polygon has no interior point, returning its first vertex");
      return exterior.startPoint();
    }
    return interior;
  }

  private void checkNotEmpty(String operation) {
    if (isEmpty()) {
      throw new GeometryException(
          GeometryError.Code.EMPTY_GEOMETRY, "%s requires a non-empty %s", operation,
          getGeometryType());
    }
  }

  /** Classifies the point as in the interior, on the boundary, or outside of this polygon. */
  public PlanarAlgorithms.Location locate(Point point) {
    if (isEmpty()) {
      return PlanarAlgorithms.Location.EXTERIOR;
    }
    return PlanarAlgorithms.locatePointInPolygon(
        point, exterior.coordinates(), holeCoordinates(), tolerance());
  }

  /** Returns true if the point is on the boundary or, by ray casting, in the interior. */
  @Override
  public boolean contains(Point point) {
    return locate(point) != PlanarAlgorithms.Location.EXTERIOR;
  }

  /** Returns the exterior ring followed by the holes, or an empty aggregate. */
  @Override
  public MultiLineString boundary() {
    MultiLineString boundary = new MultiLineString(getSpatialReference(), tolerance());
    if (isEmpty()) {
      return boundary;
    }
    boundary.addLineString(exterior);
    for (LinearRing hole : holes) {
      boundary.addLineString(hole);
    }
    return boundary;
  }

  /**
   * Returns true if the exterior ring is counter-clockwise and every hole is clockwise. Rings
   * standing vertically in 3D have no orientation in the xy plane and keep the winding they were
   * given, since that winding defines which way the face points.
   */
  public boolean hasValidRingOrientations() {
    if (exterior.isClockwise()) {
      return false;
    }
    for (LinearRing hole : holes) {
      if (hole.isCounterClockwise()) {
        return false;
      }
    }
    return true;
  }

  /** Returns true if this polygon satisfies all of its invariants. */
  public boolean isValid() {
    GeometryError error = new GeometryError();
    if (findValidationError(error)) {
      log.info(error.toString());
      return false;
    }
    return true;
  }

  /**
   * Returns true if this polygon is invalid, in which case the error describes the first problem.
   * Polygons built through the public API are always valid; this re-checks every invariant.
   */
  public boolean findValidationError(GeometryError error) {
    if (exterior.findValidationError(error)) {
      error.init(error.code(), "Exterior ring: %s", error.text());
      return true;
    }
    if (!hasValidRingOrientations()) {
      error.init(GeometryError.Code.INVALID_RING, "Rings have inconsistent orientations");
      return true;
    }
    for (int i = 0; i < holes.size(); i++) {
      if (findInteriorRingError(holes.get(i), holes.subList(0, i), error)) {
        error.init(error.code(), "Interior ring %d: %s", i + 1, error.text());
        return true;
      }
    }
    return false;
  }

  @Override
  public Polygon copy() {
    Polygon result = new Polygon(getSpatialReference(), tolerance());
    result.exterior = exterior.copy();
    for (LinearRing hole : holes) {
      result.holes.add(hole.copy());
    }
    return result;
  }

  @Override
  public boolean approxEquals(Geometry other) {
    if (!(other instanceof Polygon) || !getGeometryType().equals(other.getGeometryType())) {
      return false;
    }
    Polygon that = (Polygon) other;
    if (!exterior.approxEquals(that.exterior) || holes.size() != that.holes.size()) {
      return false;
    }
    for (int i = 0; i < holes.size(); i++) {
      if (!holes.get(i).approxEquals(that.holes.get(i))) {
        return false;
      }
    }
    return true;
  }

  @Override
  public boolean equals(Object other) {
    if (other == null || other.getClass() != getClass()) {
      return false;
    }
    Polygon that = (Polygon) other;
    return exterior.equals(that.exterior) && holes.equals(that.holes);
  }

  @Override
  public int hashCode() {
    return exterior.hashCode() * 31 + holes.hashCode();
  }
}
