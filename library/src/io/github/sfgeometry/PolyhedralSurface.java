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

import static java.lang.Math.abs;
import static java.lang.Math.sqrt;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import it.unimi.dsi.fastutil.ints.IntList;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.OptionalDouble;
import java.util.logging.Logger;
import jsinterop.annotations.JsIgnore;
import jsinterop.annotations.JsType;
import org.jspecify.annotations.Nullable;

/**
 * A PolyhedralSurface is a surface made of planar polygonal patches that meet along shared edges.
 * Patches may lie anywhere in 3D space, including vertical planes.
 *
 * <p>Two patches are neighbors if they share an edge: an unordered pair of approximately equal
 * endpoints. The adjacency index is rebuilt whenever patches are added or removed, and the
 * relation it records is always symmetric.
 *
 * <p>Adding a patch validates the patch itself, but not how it fits with the existing patches;
 * use {@link #isValid()} to check that the patches form a connected two-manifold.
 */
@JsType
public strictfp class PolyhedralSurface extends AbstractGeometry implements Surface {
  private static final Logger log = Platform.getLoggerForClass(PolyhedralSurface.class);

  private final List<Polygon> patches = new ArrayList<>();
  private SurfaceTopology topology;

  /** Constructs an empty surface. */
  public PolyhedralSurface() {
    this(SpatialReference.DEFAULT, Tolerance.DEFAULT);
  }

  /** Constructs an empty surface with the given reference and tolerance. */
  @JsIgnore
  public PolyhedralSurface(SpatialReference reference, Tolerance tolerance) {
    super(reference, tolerance);
    topology = new SurfaceTopology(patches, tolerance);
  }

  /**
   * Constructs a surface from the given patches.
   *
   * @throws GeometryException if any patch is rejected by {@link #addPatch(Polygon)}
   */
  @JsIgnore
  public PolyhedralSurface(List<? extends Polygon> patches) {
    this(patches, SpatialReference.DEFAULT, Tolerance.DEFAULT);
  }

  /** As {@link #PolyhedralSurface(List)}, with the given reference and tolerance. */
  @JsIgnore
  public PolyhedralSurface(
      List<? extends Polygon> patches, SpatialReference reference, Tolerance tolerance) {
    this(reference, tolerance);
    for (Polygon patch : patches) {
      addPatch(patch);
    }
  }

  @Override
  public String getGeometryType() {
    return "POLYHEDRALSURFACE";
  }

  /**
   * Adds a copy of the patch and rebuilds the adjacency index.
   *
   * @throws GeometryException with code EMPTY_GEOMETRY if the patch is empty, or TOPOLOGY_ERROR if
   *     its vertices do not lie in one plane
   */
  public void addPatch(Polygon patch) {
    GeometryError error = new GeometryError();
    if (findPatchError(patch, error)) {
      throw new GeometryException(error);
    }
    appendPatch(patch.copy());
  }

  /** Adds an already validated patch, owned by this surface, and rebuilds the index. */
  final void appendPatch(Polygon patch) {
    patches.add(patch);
    rebuildTopology();
  }

  /** Adds already validated patches, owned by this surface, rebuilding the index once. */
  final void appendPatches(List<? extends Polygon> newPatches) {
    patches.addAll(newPatches);
    rebuildTopology();
  }

  private static boolean findPatchError(Polygon patch, GeometryError error) {
    Preconditions.checkNotNull(patch);
    if (patch.isEmpty()) {
      error.init(GeometryError.Code.EMPTY_GEOMETRY, "Patches must not be empty");
      return true;
    }
    for (List<Point> ring : patch.ringCoordinates()) {
      if (!PlanarAlgorithms.isPlanar(ring, patch.tolerance())) {
        error.init(GeometryError.Code.TOPOLOGY_ERROR, "Patch is not planar");
        return true;
      }
    }
    return false;
  }

  /**
   * Removes the n-th patch, 1-based, and rebuilds the adjacency index.
   *
   * @throws GeometryException with code INDEX_OUT_OF_RANGE if n is not in [1, numPatches()]
   */
  public void removePatch(int n) {
    checkPatchIndex(n);
    List<Polygon> remaining = new ArrayList<>(patches);
    remaining.remove(n - 1);
    SurfaceTopology remainingTopology = new SurfaceTopology(remaining, tolerance());
    checkRemoval(remaining.size(), remainingTopology);
    patches.remove(n - 1);
    topology = remainingTopology;
  }

  /**
   * Throws if the patches left after a removal, described by their adjacency index, would not
   * form an acceptable surface. A general surface accepts any removal.
   */
  void checkRemoval(int numRemaining, SurfaceTopology remainingTopology) {}

  private void rebuildTopology() {
    topology = new SurfaceTopology(patches, tolerance());
  }

  private void checkPatchIndex(int n) {
    if (n < 1 || n > patches.size()) {
      throw new GeometryException(
          GeometryError.Code.INDEX_OUT_OF_RANGE,
          "Patch index %d is outside [1, %d]",
          n,
          patches.size());
    }
  }

  /** Returns the number of patches. */
  public int numPatches() {
    return patches.size();
  }

  /**
   * Returns a copy of the n-th patch, 1-based.
   *
   * @throws GeometryException with code INDEX_OUT_OF_RANGE if n is not in [1, numPatches()]
   */
  public Polygon patchN(int n) {
    checkPatchIndex(n);
    return patches.get(n - 1).copy();
  }

  /** Returns copies of all patches. */
  public ImmutableList<Polygon> getPatches() {
    ImmutableList.Builder<Polygon> result = ImmutableList.builder();
    for (Polygon patch : patches) {
      result.add(patch.copy());
    }
    return result.build();
  }

  /** Returns the patches without copying, for use within the package. */
  List<Polygon> patchList() {
    return Collections.unmodifiableList(patches);
  }

  SurfaceTopology topology() {
    return topology;
  }

  /**
   * Returns the 1-based indices of the patches that share an edge with the n-th patch, in
   * increasing order.
   *
   * @throws GeometryException with code INDEX_OUT_OF_RANGE if n is not in [1, numPatches()]
   */
  public int[] getNeighbors(int n) {
    checkPatchIndex(n);
    IntList neighbors = topology.neighbors(n - 1);
    int[] result = new int[neighbors.size()];
    for (int i = 0; i < result.length; i++) {
      result[i] = neighbors.getInt(i) + 1;
    }
    return result;
  }

  /** Returns every distinct edge of the patches as a two-point LineString. */
  public ImmutableList<LineString> getEdges() {
    return ImmutableList.copyOf(topology.edges(getSpatialReference()));
  }

  /** Returns the edges used by exactly one patch, directed as that patch traverses them. */
  public ImmutableList<LineString> getBoundaryEdges() {
    return ImmutableList.copyOf(topology.boundaryEdges(getSpatialReference()));
  }

  /** Returns the distinct vertices of the patches, in order of first appearance. */
  public ImmutableList<Point> getVertices() {
    return ImmutableList.copyOf(topology.vertices());
  }

  /** Returns true if the surface is non-empty and every edge is shared by two or more patches. */
  public boolean isClosed() {
    return !patches.isEmpty() && topology.numBoundaryEdges() == 0;
  }

  @Override
  public boolean isEmpty() {
    return patches.isEmpty();
  }

  /** Returns true if no edge is shared by more than two patches. */
  @Override
  public boolean isSimple() {
    return isManifold();
  }

  @Override
  public boolean is3D() {
    if (patches.isEmpty()) {
      return false;
    }
    for (Polygon patch : patches) {
      if (!patch.is3D()) {
        return false;
      }
    }
    return true;
  }

  @Override
  public boolean isMeasured() {
    if (patches.isEmpty()) {
      return false;
    }
    for (Polygon patch : patches) {
      if (!patch.isMeasured()) {
        return false;
      }
    }
    return true;
  }

  @Override
  public Envelope getEnvelope() {
    Envelope result = Envelope.empty();
    for (Polygon patch : patches) {
      result.addEnvelope(patch.getEnvelope());
    }
    return result;
  }

  /** Returns the sum of the patch areas, each measured in the plane of its patch. */
  @Override
  public double area() {
    double area = 0;
    for (Polygon patch : patches) {
      area += patch.planeArea();
    }
    return area;
  }

  /** Returns the total length of the boundary edges. */
  public double getPerimeter() {
    double perimeter = 0;
    for (LineString edge : topology.boundaryEdges(getSpatialReference())) {
      perimeter += edge.length();
    }
    return perimeter;
  }

  /**
   * Returns the area-weighted mean of the patch centroids, computed in each patch's own plane. The
   * result has a z coordinate if every patch is 3D.
   */
  @Override
  public Point centroid() {
    checkNotEmpty("centroid");
    double area = 0;
    double x = 0;
    double y = 0;
    double z = 0;
    for (Polygon patch : patches) {
      double[] c = patchCentroid(patch);
      area += c[3];
      x += c[0] * c[3];
      y += c[1] * c[3];
      z += c[2] * c[3];
    }
    if (tolerance().isZero(area)) {
      List<Point> vertices = topology.vertices();
      for (Point p : vertices) {
        x += p.x();
        y += p.y();
        z += PlanarAlgorithms.zOrZero(p);
      }
      area = vertices.size();
    }
    return is3D() ? new Point(x / area, y / area, z / area) : new Point(x / area, y / area);
  }

  /**
   * Returns {cx, cy, cz, area} for the patch, from fan triangles of each ring measured along the
   * patch normal. Holes are subtracted.
   */
  private static double[] patchCentroid(Polygon patch) {
    double[] normal = PlanarAlgorithms.newellNormal(patch.exteriorCoordinates());
    double length = sqrt(dot(normal, normal));
    double[] result = new double[4];
    boolean first = true;
    for (List<Point> ring : patch.ringCoordinates()) {
      boolean exterior = first;
      first = false;
      double ringArea = 0;
      double[] sum = new double[3];
      Point p0 = ring.get(0);
      for (int i = 1; i + 2 < ring.size(); i++) {
        Point p1 = ring.get(i);
        Point p2 = ring.get(i + 1);
        double[] cross = cross(difference(p1, p0), difference(p2, p0));
        double w = length == 0 ? 0 : 0.5 * dot(cross, normal) / length;
        ringArea += w;
        sum[0] += w * (p0.x() + p1.x() + p2.x()) / 3;
        sum[1] += w * (p0.y() + p1.y() + p2.y()) / 3;
        sum[2] +=
            w
                * (PlanarAlgorithms.zOrZero(p0)
                    + PlanarAlgorithms.zOrZero(p1)
                    + PlanarAlgorithms.zOrZero(p2))
                / 3;
      }
      if (ringArea == 0) {
        continue;
      }
      double sign = exterior ? 1 : -1;
      double weight = abs(ringArea) * sign;
      for (int k = 0; k < 3; k++) {
        result[k] += sum[k] / ringArea * weight;
      }
      result[3] += weight;
    }
    if (result[3] != 0) {
      for (int k = 0; k < 3; k++) {
        result[k] /= result[3];
      }
    }
    return result;
  }

  /**
   * Returns a point in the interior of the largest patch. The patch is projected onto the axis
   * plane where it has the largest area, an interior point is found there, and it is lifted back
   * onto the patch's plane.
   */
  @Override
  public Point pointOnSurface() {
    checkNotEmpty("pointOnSurface");
    Polygon largest = patches.get(0);
    for (Polygon patch : patches) {
      if (patch.planeArea() > largest.planeArea()) {
        largest = patch;
      }
    }
    if (!largest.is3D()) {
      return largest.pointOnSurface();
    }
    List<Point> exterior = largest.exteriorCoordinates();
    double[] normal = PlanarAlgorithms.newellNormal(exterior);
    int axis = PlanarAlgorithms.dominantAxis(normal);
    List<List<Point>> holes = new ArrayList<>();
    for (List<Point> hole : largest.holeCoordinates()) {
      holes.add(PlanarAlgorithms.projectDroppingAxis(hole, axis));
    }
    @Nullable Point interior =
        PlanarAlgorithms.interiorPoint(
            PlanarAlgorithms.projectDroppingAxis(exterior, axis), holes, tolerance());
    if (interior == null) {
      log.fine("Largest patch has no interior point, returning its first vertex");
      return exterior.get(0);
    }
    return liftToPlane(interior, axis, exterior.get(0), normal);
  }

  /** Inverts {@link PlanarAlgorithms#projectDroppingAxis} onto the plane through origin. */
  private static Point liftToPlane(Point projected, int axis, Point origin, double[] normal) {
    double u = projected.x();
    double v = projected.y();
    double ox = origin.x();
    double oy = origin.y();
    double oz = PlanarAlgorithms.zOrZero(origin);
    switch (axis) {
      case 0:
        return new Point(ox - (normal[1] * (u - oy) + normal[2] * (v - oz)) / normal[0], u, v);
      case 1:
        return new Point(v, oy - (normal[0] * (v - ox) + normal[2] * (u - oz)) / normal[1], u);
      default:
        return new Point(u, v, oz - (normal[0] * (u - ox) + normal[1] * (v - oy)) / normal[2]);
    }
  }

  private void checkNotEmpty(String operation) {
    if (patches.isEmpty()) {
      throw new GeometryException(
          GeometryError.Code.EMPTY_GEOMETRY, "%s requires a non-empty %s", operation,
          getGeometryType());
    }
  }

  /**
   * Returns true if the point lies on some patch. Points with a z coordinate are tested against
   * 3D patches in the patch's plane, other points against the xy projection of each patch.
   */
  @Override
  public boolean contains(Point point) {
    for (Polygon patch : patches) {
      if (patchContains(patch, point)) {
        return true;
      }
    }
    return false;
  }

  /** Returns true if the point lies on the patch. */
  boolean patchContains(Polygon patch, Point point) {
    if (!point.is3D() || !patch.is3D()) {
      return patch.contains(point);
    }
    List<Point> exterior = patch.exteriorCoordinates();
    double[] normal = PlanarAlgorithms.newellNormal(exterior);
    double length = sqrt(dot(normal, normal));
    if (length == 0) {
      return false;
    }
    double distance = dot(difference(point, exterior.get(0)), normal) / length;
    if (abs(distance) > tolerance().epsilon()) {
      return false;
    }
    int axis = PlanarAlgorithms.dominantAxis(normal);
    List<List<Point>> holes = new ArrayList<>();
    for (List<Point> hole : patch.holeCoordinates()) {
      holes.add(PlanarAlgorithms.projectDroppingAxis(hole, axis));
    }
    Point projected =
        PlanarAlgorithms.projectDroppingAxis(ImmutableList.of(point), axis).get(0);
    return PlanarAlgorithms.locatePointInPolygon(
            projected, PlanarAlgorithms.projectDroppingAxis(exterior, axis), holes, tolerance())
        != PlanarAlgorithms.Location.EXTERIOR;
  }

  /**
   * Returns the boundary edges chained into curves. Each closed chain becomes a closed
   * LineString. A closed surface has an empty boundary.
   */
  @Override
  public MultiLineString boundary() {
    MultiLineString result = new MultiLineString(getSpatialReference(), tolerance());
    for (List<Point> chain : boundaryChains()) {
      result.addLineString(new LineString(chain, getSpatialReference(), tolerance()));
    }
    return result;
  }

  private List<List<Point>> boundaryChains() {
    List<LineString> remaining = new ArrayList<>(topology.boundaryEdges(getSpatialReference()));
    List<List<Point>> chains = new ArrayList<>();
    while (!remaining.isEmpty()) {
      LineString first = remaining.remove(0);
      List<Point> chain = new ArrayList<>(first.coordinates());
      // Patches may be wound either way, so edges are linked regardless of direction.
      boolean reversed = false;
      while (!chain.get(0).approxEquals(chain.get(chain.size() - 1), tolerance())) {
        if (!extendChain(chain, remaining)) {
          if (reversed) {
            break;
          }
          Collections.reverse(chain);
          reversed = true;
        }
      }
      chains.add(chain);
    }
    return chains;
  }

  /**
   * Appends to the chain the far end of an edge in {@code remaining} that touches its last point,
   * and removes that edge. Returns false if no edge touches the last point.
   */
  private boolean extendChain(List<Point> chain, List<LineString> remaining) {
    Point end = chain.get(chain.size() - 1);
    for (int i = 0; i < remaining.size(); i++) {
      LineString edge = remaining.get(i);
      if (edge.startPoint().approxEquals(end, tolerance())) {
        chain.add(edge.endPoint());
      } else if (edge.endPoint().approxEquals(end, tolerance())) {
        chain.add(edge.startPoint());
      } else {
        continue;
      }
      remaining.remove(i);
      return true;
    }
    return false;
  }

  /**
   * Returns the volume enclosed by a closed, orientable 3D surface, using the divergence theorem:
   * the sum over fan triangles of the signed tetrahedron volumes {@code p0 . (p1 x p2) / 6}, after
   * the patches are oriented consistently. Returns empty for other surfaces.
   */
  public OptionalDouble getVolume() {
    if (!isClosed() || !is3D()) {
      return OptionalDouble.empty();
    }
    boolean[] flips = topology.consistentFlips();
    if (flips == null) {
      return OptionalDouble.empty();
    }
    // Translate to a vertex to reduce cancellation.
    Point origin = topology.vertices().get(0);
    double volume = 0;
    for (int i = 0; i < patches.size(); i++) {
      double patchVolume = 0;
      for (List<Point> ring : patches.get(i).ringCoordinates()) {
        double[] p0 = difference(ring.get(0), origin);
        for (int k = 1; k + 2 < ring.size(); k++) {
          double[] p1 = difference(ring.get(k), origin);
          double[] p2 = difference(ring.get(k + 1), origin);
          patchVolume += dot(p0, cross(p1, p2)) / 6;
        }
      }
      volume += flips[i] ? -patchVolume : patchVolume;
    }
    return OptionalDouble.of(abs(volume));
  }

  /**
   * Returns the genus g of the surface from its Euler characteristic {@code V - E + F = 2 - 2g -
   * b}, where b is the number of boundary curves. A sphere-like closed surface has genus 0.
   */
  public int getGenus() {
    if (patches.isEmpty()) {
      return 0;
    }
    int boundaries = boundaryChains().size();
    return (2 - topology.eulerCharacteristic() - boundaries) / 2;
  }

  /**
   * Returns true if the patches can be oriented so that every shared edge is traversed in opposite
   * directions by its two patches. Surfaces with an edge shared by three or more patches are not
   * orientable.
   */
  public boolean isOrientable() {
    return topology.consistentFlips() != null;
  }

  /** Returns true if every patch lies in a single plane. */
  public boolean isPlanar() {
    for (Polygon patch : patches) {
      for (List<Point> ring : patch.ringCoordinates()) {
        if (!PlanarAlgorithms.isPlanar(ring, tolerance())) {
          return false;
        }
      }
    }
    return true;
  }

  /** Returns true if this surface satisfies {@link #findValidationError}. */
  public boolean isValid() {
    GeometryError error = new GeometryError();
    if (findValidationError(error)) {
      log.info(error.toString());
      return false;
    }
    return true;
  }

  /**
   * Returns true if this surface is invalid, in which case the error describes the first problem.
   * A valid surface has valid, planar patches, no edge shared by more than two patches, and, if it
   * has more than one patch, every patch reachable from every other through shared edges.
   */
  public boolean findValidationError(GeometryError error) {
    for (int i = 0; i < patches.size(); i++) {
      Polygon patch = patches.get(i);
      if (patch.findValidationError(error)) {
        error.init(error.code(), "Patch %d: %s", i + 1, error.text());
        return true;
      }
      if (findPatchError(patch, error)) {
        error.init(error.code(), "Patch %d: %s", i + 1, error.text());
        return true;
      }
      for (int neighbor : topology.neighbors(i)) {
        if (!topology.neighbors(neighbor).contains(i)) {
          error.init(
              GeometryError.Code.TOPOLOGY_ERROR,
              "Patches %d and %d have an inconsistent neighbor relationship",
              i + 1,
              neighbor + 1);
          return true;
        }
      }
    }
    if (!isManifold()) {
      error.init(GeometryError.Code.TOPOLOGY_ERROR, "An edge is shared by more than two patches");
      return true;
    }
    if (patches.size() > 1 && !isConnected(topology, patches.size())) {
      error.init(GeometryError.Code.TOPOLOGY_ERROR, "Patches are not connected by shared edges");
      return true;
    }
    return false;
  }

  private boolean isManifold() {
    return topology.maxEdgeValence() <= 2;
  }

  /** Returns true if every patch is reachable from the first through shared edges. */
  static boolean isConnected(SurfaceTopology topology, int numPatches) {
    if (numPatches == 0) {
      return true;
    }
    boolean[] seen = new boolean[numPatches];
    List<Integer> stack = new ArrayList<>();
    stack.add(0);
    seen[0] = true;
    int count = 1;
    while (!stack.isEmpty()) {
      int patch = stack.remove(stack.size() - 1);
      for (int neighbor : topology.neighbors(patch)) {
        if (!seen[neighbor]) {
          seen[neighbor] = true;
          count++;
          stack.add(neighbor);
        }
      }
    }
    return count == numPatches;
  }

  private static double[] difference(Point a, Point b) {
    return new double[] {
      a.x() - b.x(), a.y() - b.y(), PlanarAlgorithms.zOrZero(a) - PlanarAlgorithms.zOrZero(b)
    };
  }

  private static double[] cross(double[] u, double[] v) {
    return new double[] {
      u[1] * v[2] - u[2] * v[1], u[2] * v[0] - u[0] * v[2], u[0] * v[1] - u[1] * v[0]
    };
  }

  private static double dot(double[] u, double[] v) {
    return u[0] * v[0] + u[1] * v[1] + u[2] * v[2];
  }

  @Override
  public PolyhedralSurface copy() {
    PolyhedralSurface result = new PolyhedralSurface(getSpatialReference(), tolerance());
    copyPatchesInto(result);
    return result;
  }

  /** Copies every patch into the given empty surface, rebuilding its index once. */
  final void copyPatchesInto(PolyhedralSurface target) {
    List<Polygon> copies = new ArrayList<>(patches.size());
    for (Polygon patch : patches) {
      copies.add(patch.copy());
    }
    target.appendPatches(copies);
  }

  /** Returns true if the other surface has the same type and approximately equal patches. */
  @Override
  public boolean approxEquals(Geometry other) {
    if (!(other instanceof PolyhedralSurface)
        || !getGeometryType().equals(other.getGeometryType())) {
      return false;
    }
    List<Polygon> otherPatches = ((PolyhedralSurface) other).patches;
    if (otherPatches.size() != patches.size()) {
      return false;
    }
    for (int i = 0; i < patches.size(); i++) {
      if (!patches.get(i).approxEquals(otherPatches.get(i))) {
        return false;
      }
    }
    return true;
  }

  @Override
  public boolean equals(Object other) {
    return other != null
        && other.getClass() == getClass()
        && patches.equals(((PolyhedralSurface) other).patches);
  }

  @Override
  public int hashCode() {
    return getClass().hashCode() * 31 + patches.hashCode();
  }
}
