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

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import it.unimi.dsi.fastutil.longs.Long2ObjectLinkedOpenHashMap;
import it.unimi.dsi.fastutil.longs.Long2ObjectMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * An index of the vertices, edges, and patch adjacency of a set of polygonal patches. Vertices that
 * are approximately equal are given the same id, and each undirected edge between two vertex ids
 * records every patch ring that traverses it, and in which direction.
 *
 * <p>The index is immutable once built. Owners rebuild it whenever their patches change.
 */
final strictfp class SurfaceTopology {
  private final Tolerance tolerance;

  /** Distinct vertices, by id. */
  private final List<Point> vertices = new ArrayList<>();

  /** Exact lookup of vertex ids, tried before the approximate scan. */
  private final Object2IntOpenHashMap<Point> vertexIds = new Object2IntOpenHashMap<>();

  /**
   * Maps each undirected edge key to its incidences. An incidence is {@code patch << 1 | reversed},
   * where reversed is 1 if the patch traverses the edge from the larger vertex id to the smaller.
   */
  private final Long2ObjectLinkedOpenHashMap<IntArrayList> edges =
      new Long2ObjectLinkedOpenHashMap<>();

  /** Sorted neighbor patch ids, by patch. */
  private final List<IntArrayList> neighbors;

  private final int numPatches;

  SurfaceTopology(List<? extends Polygon> patches, Tolerance tolerance) {
    this.tolerance = tolerance;
    this.numPatches = patches.size();
    vertexIds.defaultReturnValue(-1);
    for (int patch = 0; patch < patches.size(); patch++) {
      for (List<Point> ring : patches.get(patch).ringCoordinates()) {
        for (int i = 0; i + 1 < ring.size(); i++) {
          int a = vertexId(ring.get(i));
          int b = vertexId(ring.get(i + 1));
          if (a == b) {
            continue;
          }
          long key = edgeKey(a, b);
          IntArrayList incidences = edges.get(key);
          if (incidences == null) {
            incidences = new IntArrayList(2);
            edges.put(key, incidences);
          }
          incidences.add(patch << 1 | (a > b ? 1 : 0));
        }
      }
    }

    List<IntOpenHashSet> adjacent = new ArrayList<>(numPatches);
    for (int i = 0; i < numPatches; i++) {
      adjacent.add(new IntOpenHashSet());
    }
    for (IntArrayList incidences : edges.values()) {
      for (int i = 0; i < incidences.size(); i++) {
        for (int j = i + 1; j < incidences.size(); j++) {
          int p = incidences.getInt(i) >> 1;
          int q = incidences.getInt(j) >> 1;
          if (p != q) {
            adjacent.get(p).add(q);
            adjacent.get(q).add(p);
          }
        }
      }
    }
    neighbors = new ArrayList<>(numPatches);
    for (IntOpenHashSet set : adjacent) {
      int[] ids = set.toIntArray();
      Arrays.sort(ids);
      neighbors.add(IntArrayList.wrap(ids));
    }
  }

  private int vertexId(Point p) {
    int id = vertexIds.getInt(p);
    if (id >= 0) {
      return id;
    }
    for (int i = 0; i < vertices.size(); i++) {
      if (vertices.get(i).approxEquals(p, tolerance)) {
        vertexIds.put(p, i);
        return i;
      }
    }
    id = vertices.size();
    vertices.add(p);
    vertexIds.put(p, id);
    return id;
  }

  private static long edgeKey(int a, int b) {
    int lo = Math.min(a, b);
    int hi = Math.max(a, b);
    return ((long) lo << 32) | (hi & 0xffffffffL);
  }

  private static int keyStart(long key) {
    return (int) (key >>> 32);
  }

  private static int keyEnd(long key) {
    return (int) key;
  }

  int numVertices() {
    return vertices.size();
  }

  int numEdges() {
    return edges.size();
  }

  int numPatches() {
    return numPatches;
  }

  List<Point> vertices() {
    return vertices;
  }

  /** Returns the sorted ids of the patches sharing an edge with the given patch. */
  IntList neighbors(int patch) {
    return IntLists.unmodifiable(neighbors.get(patch));
  }

  /** Returns every distinct edge as a two-point LineString, in order of first appearance. */
  List<LineString> edges(SpatialReference reference) {
    List<LineString> result = new ArrayList<>(edges.size());
    for (long key : edges.keySet()) {
      result.add(segment(keyStart(key), keyEnd(key), reference));
    }
    return result;
  }

  /**
   * Returns the edges traversed by exactly one patch, each directed the way its patch traverses
   * it.
   */
  List<LineString> boundaryEdges(SpatialReference reference) {
    List<LineString> result = new ArrayList<>();
    for (Long2ObjectMap.Entry<IntArrayList> entry : edges.long2ObjectEntrySet()) {
      IntArrayList incidences = entry.getValue();
      if (incidences.size() == 1) {
        long key = entry.getLongKey();
        boolean reversed = (incidences.getInt(0) & 1) == 1;
        result.add(
            reversed
                ? segment(keyEnd(key), keyStart(key), reference)
                : segment(keyStart(key), keyEnd(key), reference));
      }
    }
    return result;
  }

  private LineString segment(int from, int to, SpatialReference reference) {
    List<Point> points = new ArrayList<>(2);
    points.add(vertices.get(from));
    points.add(vertices.get(to));
    return new LineString(points, reference, tolerance);
  }

  /** Returns the number of edges traversed by exactly one patch. */
  int numBoundaryEdges() {
    int count = 0;
    for (IntArrayList incidences : edges.values()) {
      if (incidences.size() == 1) {
        count++;
      }
    }
    return count;
  }

  /** Returns the largest number of patch traversals of any one edge. */
  int maxEdgeValence() {
    int max = 0;
    for (IntArrayList incidences : edges.values()) {
      max = Math.max(max, incidences.size());
    }
    return max;
  }

  /** Returns V - E + F. */
  int eulerCharacteristic() {
    return numVertices() - numEdges() + numPatches;
  }

  /**
   * Returns, for each patch, whether it must be reversed so that every pair of adjacent patches
   * traverses their shared edge in opposite directions, or null if no such assignment exists. Each
   * connected component keeps the orientation of its lowest numbered patch. Edges shared by more
   * than two patches cannot be consistently oriented.
   */
  boolean @Nullable [] consistentFlips() {
    if (maxEdgeValence() > 2) {
      return null;
    }
    // Edge indices traversed by each patch.
    List<IntArrayList> patchIncidences = new ArrayList<>(numPatches);
    for (int i = 0; i < numPatches; i++) {
      patchIncidences.add(new IntArrayList());
    }
    List<IntArrayList> edgeList = new ArrayList<>(edges.values());
    for (int e = 0; e < edgeList.size(); e++) {
      IntArrayList incidences = edgeList.get(e);
      for (int k = 0; k < incidences.size(); k++) {
        patchIncidences.get(incidences.getInt(k) >> 1).add(e);
      }
    }

    boolean[] flip = new boolean[numPatches];
    boolean[] visited = new boolean[numPatches];
    ArrayDeque<Integer> queue = new ArrayDeque<>();
    for (int start = 0; start < numPatches; start++) {
      if (visited[start]) {
        continue;
      }
      visited[start] = true;
      queue.add(start);
      while (!queue.isEmpty()) {
        int patch = queue.poll();
        for (int e : patchIncidences.get(patch)) {
          IntArrayList incidences = edgeList.get(e);
          if (incidences.size() != 2) {
            continue;
          }
          int mine = incidences.getInt(0) >> 1 == patch ? 0 : 1;
          int self = incidences.getInt(mine);
          int other = incidences.getInt(1 - mine);
          int neighbor = other >> 1;
          boolean selfReversed = ((self & 1) == 1) != flip[patch];
          if (neighbor == patch) {
            // A patch that traverses one edge twice.
            if (((other & 1) == 1) == ((self & 1) == 1)) {
              return null;
            }
            continue;
          }
          // The neighbor must traverse the edge in the opposite direction.
          boolean required = ((other & 1) == 1) == selfReversed;
          if (!visited[neighbor]) {
            visited[neighbor] = true;
            flip[neighbor] = required;
            queue.add(neighbor);
          } else if (flip[neighbor] != required) {
            return null;
          }
        }
      }
    }
    return flip;
  }
}
