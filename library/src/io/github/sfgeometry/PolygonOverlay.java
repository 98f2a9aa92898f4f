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

import static java.lang.Math.PI;
import static java.lang.Math.atan2;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.longs.LongOpenHashSet;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.logging.Logger;

/**
 * Computes boolean operations between two regions, each given as a list of polygons with pairwise
 * disjoint interiors, such as the members of a MultiPolygon.
 *
 * <p>The algorithm classifies edges:
 *
 * <ol>
 *   <li>Every edge of both regions is split at every point where it meets another edge, so that
 *       split edges meet only at their endpoints. Approximately equal endpoints become one node.
 *   <li>Each split edge is classified against the other region by its midpoint: inside, outside,
 *       or shared with an edge of the other region running in the same or the opposite direction.
 *   <li>The edges that bound the result are selected according to the operation. Polygon rings are
 *       oriented with the interior on the left, so the selected edges also have the result's
 *       interior on their left.
 *   <li>The selected edges are linked into rings, taking the most-left turn wherever a node has
 *       several outgoing edges, and rings that touch themselves are split at the repeated node.
 *   <li>Counter-clockwise rings become polygon shells and clockwise rings become holes of the
 *       smallest shell that contains them.
 * </ol>
 *
 * <p>Only x and y take part; the result is 2D. Polygons without area in the xy-plane, such as
 * vertical patches, contribute nothing. The arithmetic is floating point with the given
 * tolerance, so results for nearly degenerate inputs are approximate.
 */
public final strictfp class PolygonOverlay {
  private static final Logger log = Platform.getLoggerForClass(PolygonOverlay.class);

  /** The boolean operations. */
  public enum OpType {
    /** The region covered by both inputs. */
    INTERSECTION,
    /** The region covered by either input. */
    UNION,
    /** The region covered by the first input but not the second. */
    DIFFERENCE,
    /** The region covered by exactly one of the inputs. */
    SYMMETRIC_DIFFERENCE
  }

  /** The position of a split edge relative to the other region. */
  private enum Position {
    INSIDE,
    OUTSIDE,
    SHARED_SAME,
    SHARED_OPPOSITE
  }

  private final SpatialReference reference;
  private final Tolerance tolerance;
  private final List<List<Polygon>> regions = new ArrayList<>(2);

  /** Nodes, by id. */
  private final List<Point> nodes = new ArrayList<>();

  private final Object2IntOpenHashMap<Point> nodeIds = new Object2IntOpenHashMap<>();

  /** Split edges, as parallel lists of start node, end node, and source region. */
  private final IntArrayList edgeFrom = new IntArrayList();

  private final IntArrayList edgeTo = new IntArrayList();
  private final IntArrayList edgeSource = new IntArrayList();

  /** Directed edge keys of each region. */
  private final LongOpenHashSet[] directedEdges = {new LongOpenHashSet(), new LongOpenHashSet()};

  private PolygonOverlay(
      List<Polygon> a, List<Polygon> b, SpatialReference reference, Tolerance tolerance) {
    this.reference = reference;
    this.tolerance = tolerance;
    this.regions.add(withArea(a, tolerance));
    this.regions.add(withArea(b, tolerance));
    nodeIds.defaultReturnValue(-1);
    buildEdges();
  }

  /**
   * Returns the polygons of the region computed by the operation. Each input list must consist of
   * polygons with pairwise disjoint interiors.
   *
   * @throws GeometryException with code INVALID_RING if the result has a hole that touches its
   *     shell, which a Polygon cannot represent
   */
  public static ImmutableList<Polygon> compute(
      OpType op,
      List<Polygon> a,
      List<Polygon> b,
      SpatialReference reference,
      Tolerance tolerance) {
    Preconditions.checkNotNull(op);
    if (op == OpType.SYMMETRIC_DIFFERENCE) {
      return ImmutableList.<Polygon>builder()
          .addAll(compute(OpType.DIFFERENCE, a, b, reference, tolerance))
          .addAll(compute(OpType.DIFFERENCE, b, a, reference, tolerance))
          .build();
    }
    return new PolygonOverlay(a, b, reference, tolerance).run(op);
  }

  /**
   * Returns the union of polygons whose interiors may overlap, as polygons with pairwise disjoint
   * interiors.
   */
  public static ImmutableList<Polygon> unionAll(
      List<Polygon> polygons, SpatialReference reference, Tolerance tolerance) {
    ImmutableList<Polygon> result = ImmutableList.of();
    for (Polygon polygon : polygons) {
      result =
          compute(OpType.UNION, result, ImmutableList.of(polygon), reference, tolerance);
    }
    return result;
  }

  /** Returns true if the interiors of the two polygons overlap in a region with positive area. */
  public static boolean interiorsIntersect(Polygon a, Polygon b, Tolerance tolerance) {
    if (a.isEmpty()
        || b.isEmpty()
        || !a.getEnvelope().intersects(b.getEnvelope(), tolerance)) {
      return false;
    }
    double area = 0;
    for (Polygon p :
        compute(
            OpType.INTERSECTION,
            ImmutableList.of(a),
            ImmutableList.of(b),
            a.getSpatialReference(),
            tolerance)) {
      area += p.area();
    }
    return area > tolerance.epsilon();
  }

  private static List<Polygon> withArea(List<Polygon> polygons, Tolerance tolerance) {
    List<Polygon> result = new ArrayList<>(polygons.size());
    for (Polygon polygon : polygons) {
      if (!polygon.isEmpty() && !tolerance.isZero(polygon.area())) {
        result.add(polygon);
      }
    }
    return result;
  }

  /** A segment of an input ring, with the points where other segments meet it. */
  private static final class Segment {
    final Point start;
    final Point end;
    final int source;
    final List<Point> splits = new ArrayList<>();

    Segment(Point start, Point end, int source) {
      this.start = start;
      this.end = end;
      this.source = source;
    }

    double parameter(Point p) {
      double dx = end.x() - start.x();
      double dy = end.y() - start.y();
      return ((p.x() - start.x()) * dx + (p.y() - start.y()) * dy) / (dx * dx + dy * dy);
    }
  }

  private void buildEdges() {
    List<Segment> segments = new ArrayList<>();
    for (int source = 0; source < 2; source++) {
      for (Polygon polygon : regions.get(source)) {
        for (List<Point> ring : polygon.ringCoordinates()) {
          for (int i = 0; i + 1 < ring.size(); i++) {
            Point start = ring.get(i).to2D();
            Point end = ring.get(i + 1).to2D();
            if (!start.approxEquals(end, tolerance)) {
              segments.add(new Segment(start, end, source));
            }
          }
        }
      }
    }

    for (int i = 0; i < segments.size(); i++) {
      Segment s = segments.get(i);
      Envelope bound = Envelope.fromPoints(ImmutableList.of(s.start, s.end));
      for (int j = i + 1; j < segments.size(); j++) {
        Segment t = segments.get(j);
        if (!bound.intersects(Envelope.fromPoints(ImmutableList.of(t.start, t.end)), tolerance)) {
          continue;
        }
        // Computed once per pair, so both segments are split at the same points.
        List<Point> meets =
            PlanarAlgorithms.segmentIntersections(s.start, s.end, t.start, t.end, tolerance);
        s.splits.addAll(meets);
        t.splits.addAll(meets);
      }
    }

    for (Segment s : segments) {
      List<Point> points = new ArrayList<>(s.splits.size() + 2);
      points.add(s.start);
      points.addAll(s.splits);
      points.add(s.end);
      points.sort(Comparator.comparingDouble(s::parameter));
      int previous = nodeId(s.start);
      for (int k = 1; k < points.size(); k++) {
        int next = nodeId(points.get(k));
        if (next != previous) {
          addEdge(previous, next, s.source);
          previous = next;
        }
      }
    }
  }

  private int nodeId(Point p) {
    int id = nodeIds.getInt(p);
    if (id >= 0) {
      return id;
    }
    for (int i = 0; i < nodes.size(); i++) {
      if (nodes.get(i).approxEquals(p, tolerance)) {
        nodeIds.put(p, i);
        return i;
      }
    }
    id = nodes.size();
    nodes.add(p);
    nodeIds.put(p, id);
    return id;
  }

  private static long key(int from, int to) {
    return ((long) from << 32) | (to & 0xffffffffL);
  }

  private void addEdge(int from, int to, int source) {
    if (directedEdges[source].add(key(from, to))) {
      edgeFrom.add(from);
      edgeTo.add(to);
      edgeSource.add(source);
    }
  }

  private Position classify(int edge) {
    int from = edgeFrom.getInt(edge);
    int to = edgeTo.getInt(edge);
    int other = 1 - edgeSource.getInt(edge);
    if (directedEdges[other].contains(key(from, to))) {
      return Position.SHARED_SAME;
    }
    if (directedEdges[other].contains(key(to, from))) {
      return Position.SHARED_OPPOSITE;
    }
    Point a = nodes.get(from);
    Point b = nodes.get(to);
    Point mid = new Point(0.5 * (a.x() + b.x()), 0.5 * (a.y() + b.y()));
    PlanarAlgorithms.Location location = locate(mid, regions.get(other));
    if (location == PlanarAlgorithms.Location.BOUNDARY) {
      // On the other boundary without a matching edge; decide by the side the interior is on.
      log.fine("Overlay edge lies on the other boundary without a matching edge");
      double length = a.distance2D(b);
      double offset = 100 * tolerance.epsilon() * Math.max(1, length);
      Point left =
          new Point(
              mid.x() - offset * (b.y() - a.y()) / length,
              mid.y() + offset * (b.x() - a.x()) / length);
      return locate(left, regions.get(other)) == PlanarAlgorithms.Location.INTERIOR
          ? Position.SHARED_SAME
          : Position.SHARED_OPPOSITE;
    }
    return location == PlanarAlgorithms.Location.INTERIOR ? Position.INSIDE : Position.OUTSIDE;
  }

  private PlanarAlgorithms.Location locate(Point p, List<Polygon> region) {
    PlanarAlgorithms.Location result = PlanarAlgorithms.Location.EXTERIOR;
    for (Polygon polygon : region) {
      PlanarAlgorithms.Location location = polygon.locate(p);
      if (location == PlanarAlgorithms.Location.BOUNDARY) {
        return location;
      }
      if (location == PlanarAlgorithms.Location.INTERIOR) {
        result = location;
      }
    }
    return result;
  }

  private ImmutableList<Polygon> run(OpType op) {
    // Selected edges, as node pairs with the result interior on the left.
    IntArrayList from = new IntArrayList();
    IntArrayList to = new IntArrayList();
    for (int e = 0; e < edgeFrom.size(); e++) {
      Position position = classify(e);
      boolean first = edgeSource.getInt(e) == 0;
      boolean keep;
      boolean reverse = false;
      switch (op) {
        case INTERSECTION:
          keep =
              position == Position.INSIDE || (first && position == Position.SHARED_SAME);
          break;
        case UNION:
          keep =
              position == Position.OUTSIDE || (first && position == Position.SHARED_SAME);
          break;
        case DIFFERENCE:
          if (first) {
            keep = position == Position.OUTSIDE || position == Position.SHARED_OPPOSITE;
          } else {
            keep = position == Position.INSIDE;
            reverse = true;
          }
          break;
        default:
          throw new GeometryException(
              GeometryError.Code.INTERNAL, "Unexpected overlay operation %s", op);
      }
      if (keep) {
        from.add(reverse ? edgeTo.getInt(e) : edgeFrom.getInt(e));
        to.add(reverse ? edgeFrom.getInt(e) : edgeTo.getInt(e));
      }
    }
    return assemble(linkRings(from, to));
  }

  /** Links the directed edges into closed node sequences, without repeated nodes. */
  private List<IntArrayList> linkRings(IntArrayList from, IntArrayList to) {
    Int2ObjectOpenHashMap<IntArrayList> outgoing = new Int2ObjectOpenHashMap<>();
    for (int e = 0; e < from.size(); e++) {
      IntArrayList edges = outgoing.get(from.getInt(e));
      if (edges == null) {
        edges = new IntArrayList();
        outgoing.put(from.getInt(e), edges);
      }
      edges.add(e);
    }

    boolean[] used = new boolean[from.size()];
    List<IntArrayList> rings = new ArrayList<>();
    for (int start = 0; start < from.size(); start++) {
      if (used[start]) {
        continue;
      }
      IntArrayList chain = new IntArrayList();
      int edge = start;
      boolean closed = false;
      while (true) {
        used[edge] = true;
        chain.add(from.getInt(edge));
        int node = to.getInt(edge);
        if (node == from.getInt(start)) {
          closed = true;
          break;
        }
        int next = mostLeftTurn(from.getInt(edge), node, outgoing.get(node), to, used);
        if (next < 0) {
          break;
        }
        edge = next;
      }
      if (closed) {
        splitAtRepeatedNodes(chain, rings);
      } else {
        log.fine("Dropping an overlay edge chain that does not close");
      }
    }
    return rings;
  }

  /**
   * Returns the unused edge leaving {@code node} that turns most to the left after arriving from
   * {@code previous}, or -1 if there is none.
   */
  private int mostLeftTurn(
      int previous, int node, IntArrayList candidates, IntArrayList to, boolean[] used) {
    if (candidates == null) {
      return -1;
    }
    Point v = nodes.get(node);
    Point u = nodes.get(previous);
    double back = atan2(u.y() - v.y(), u.x() - v.x());
    int best = -1;
    double bestAngle = Double.POSITIVE_INFINITY;
    for (int e : candidates) {
      if (used[e]) {
        continue;
      }
      Point w = nodes.get(to.getInt(e));
      // Clockwise angle from the way back to the outgoing edge, in (0, 2pi].
      double angle = back - atan2(w.y() - v.y(), w.x() - v.x());
      while (angle <= 0) {
        angle += 2 * PI;
      }
      while (angle > 2 * PI) {
        angle -= 2 * PI;
      }
      if (angle < bestAngle) {
        bestAngle = angle;
        best = e;
      }
    }
    return best;
  }

  private static void splitAtRepeatedNodes(IntArrayList chain, List<IntArrayList> rings) {
    IntArrayList stack = new IntArrayList();
    Int2IntOpenHashMap positions = new Int2IntOpenHashMap();
    positions.defaultReturnValue(-1);
    for (int k = 0; k <= chain.size(); k++) {
      int node = chain.getInt(k % chain.size());
      int position = positions.get(node);
      if (position < 0) {
        positions.put(node, stack.size());
        stack.add(node);
        continue;
      }
      rings.add(new IntArrayList(stack.subList(position, stack.size())));
      for (int i = stack.size() - 1; i > position; i--) {
        positions.remove(stack.removeInt(i));
      }
    }
  }

  private ImmutableList<Polygon> assemble(List<IntArrayList> rings) {
    List<List<Point>> shells = new ArrayList<>();
    List<List<Point>> holes = new ArrayList<>();
    for (IntArrayList ring : rings) {
      if (ring.size() < 3) {
        continue;
      }
      List<Point> points = new ArrayList<>(ring.size() + 1);
      for (int node : ring) {
        points.add(nodes.get(node));
      }
      points.add(points.get(0));
      double area = PlanarAlgorithms.signedArea(points);
      if (tolerance.isZero(area)) {
        log.fine("Dropping an overlay ring without area");
      } else if (area > 0) {
        shells.add(points);
      } else {
        holes.add(points);
      }
    }

    List<List<LinearRing>> shellHoles = new ArrayList<>(shells.size());
    for (int i = 0; i < shells.size(); i++) {
      shellHoles.add(new ArrayList<>());
    }
    for (List<Point> hole : holes) {
      int owner = -1;
      double ownerArea = Double.POSITIVE_INFINITY;
      for (int i = 0; i < shells.size(); i++) {
        List<Point> shell = shells.get(i);
        double area = PlanarAlgorithms.signedArea(shell);
        if (area < ownerArea && isInside(hole, shell)) {
          owner = i;
          ownerArea = area;
        }
      }
      if (owner < 0) {
        log.fine("Dropping an overlay hole outside every shell");
        continue;
      }
      shellHoles.get(owner).add(new LinearRing(hole, reference, tolerance));
    }

    ImmutableList.Builder<Polygon> result = ImmutableList.builder();
    for (int i = 0; i < shells.size(); i++) {
      result.add(
          new Polygon(
              new LinearRing(shells.get(i), reference, tolerance),
              shellHoles.get(i),
              reference,
              tolerance));
    }
    return result.build();
  }

  /** Returns true if some vertex or edge midpoint of the inner ring is inside the outer ring. */
  private boolean isInside(List<Point> inner, List<Point> outer) {
    for (int i = 0; i + 1 < inner.size(); i++) {
      Point a = inner.get(i);
      Point b = inner.get(i + 1);
      PlanarAlgorithms.Location location =
          PlanarAlgorithms.locatePointInRing(a, outer, tolerance);
      if (location == PlanarAlgorithms.Location.BOUNDARY) {
        location =
            PlanarAlgorithms.locatePointInRing(
                new Point(0.5 * (a.x() + b.x()), 0.5 * (a.y() + b.y())), outer, tolerance);
      }
      if (location != PlanarAlgorithms.Location.BOUNDARY) {
        return location == PlanarAlgorithms.Location.INTERIOR;
      }
    }
    return false;
  }
}
