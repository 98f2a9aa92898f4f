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
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import jsinterop.annotations.JsIgnore;
import jsinterop.annotations.JsType;

/**
 * An ordered collection of geometries of element type {@code T}. A plain GeometryCollection may
 * hold any mix of geometries, including other collections; the Multi* subclasses restrict their
 * members by type and through {@link #findMemberError}.
 *
 * <p>The collection owns its members: geometries are copied when added and when returned, and
 * membership tests compare by value with {@link Geometry#approxEquals}. Members keep their own
 * spatial reference and tolerance.
 *
 * @param <T> the type of the members
 */
@JsType
public strictfp class GeometryCollection<T extends Geometry> extends AbstractGeometry {
  private final List<T> geometries = new ArrayList<>();

  /** Constructs an empty collection. */
  public GeometryCollection() {
    this(SpatialReference.DEFAULT, Tolerance.DEFAULT);
  }

  /** Constructs an empty collection with the given reference and tolerance. */
  @JsIgnore
  public GeometryCollection(SpatialReference reference, Tolerance tolerance) {
    super(reference, tolerance);
  }

  /**
   * Constructs a collection of copies of the given geometries.
   *
   * @throws GeometryException if any geometry is rejected by {@link #add}
   */
  @JsIgnore
  public GeometryCollection(List<? extends T> geometries) {
    this(geometries, SpatialReference.DEFAULT, Tolerance.DEFAULT);
  }

  /** As {@link #GeometryCollection(List)}, with the given reference and tolerance. */
  @JsIgnore
  public GeometryCollection(
      List<? extends T> geometries, SpatialReference reference, Tolerance tolerance) {
    this(reference, tolerance);
    for (T geometry : geometries) {
      add(geometry);
    }
  }

  @Override
  public String getGeometryType() {
    return "GEOMETRYCOLLECTION";
  }

  /**
   * Returns true if the geometry may not be added to this collection, in which case the error is
   * set. Subclasses that restrict their members override this and call the superclass first.
   */
  protected boolean findMemberError(T geometry, GeometryError error) {
    Preconditions.checkNotNull(geometry);
    return false;
  }

  /**
   * Adds a copy of the geometry at the end of the collection.
   *
   * @throws GeometryException if the geometry is rejected by {@link #findMemberError}
   */
  public void add(T geometry) {
    GeometryError error = new GeometryError();
    if (findMemberError(geometry, error)) {
      throw new GeometryException(error);
    }
    geometries.add(copyOf(geometry));
  }

  @SuppressWarnings("unchecked")
  private static <T extends Geometry> T copyOf(T geometry) {
    // Every implementation of copy() returns an instance of its own class.
    return (T) geometry.copy();
  }

  /**
   * Removes the first member that approximately equals the geometry, and returns true if there
   * was one.
   */
  @CanIgnoreReturnValue
  public boolean remove(Geometry geometry) {
    int index = indexOf(geometry);
    if (index < 0) {
      return false;
    }
    geometries.remove(index);
    return true;
  }

  /**
   * Removes the n-th member, 1-based.
   *
   * @throws GeometryException with code INDEX_OUT_OF_RANGE if n is not in [1, numGeometries()]
   */
  public void removeGeometryN(int n) {
    checkIndex(n);
    geometries.remove(n - 1);
  }

  /** Returns true if some member approximately equals the geometry. */
  public boolean containsGeometry(Geometry geometry) {
    return indexOf(geometry) >= 0;
  }

  private int indexOf(Geometry geometry) {
    for (int i = 0; i < geometries.size(); i++) {
      if (geometries.get(i).approxEquals(geometry)) {
        return i;
      }
    }
    return -1;
  }

  /** Removes every member. */
  public void clear() {
    geometries.clear();
  }

  /** Returns the number of members. */
  public int numGeometries() {
    return geometries.size();
  }

  /**
   * Returns a copy of the n-th member, 1-based.
   *
   * @throws GeometryException with code INDEX_OUT_OF_RANGE if n is not in [1, numGeometries()]
   */
  public T geometryN(int n) {
    checkIndex(n);
    return copyOf(geometries.get(n - 1));
  }

  private void checkIndex(int n) {
    if (n < 1 || n > geometries.size()) {
      throw new GeometryException(
          GeometryError.Code.INDEX_OUT_OF_RANGE,
          "Geometry index %d is outside [1, %d]",
          n,
          geometries.size());
    }
  }

  /** Returns copies of all members, in order. */
  public ImmutableList<T> getGeometries() {
    ImmutableList.Builder<T> result = ImmutableList.builder();
    for (T geometry : geometries) {
      result.add(copyOf(geometry));
    }
    return result.build();
  }

  /** Returns the members without copying, for use within the package. */
  List<T> geometryList() {
    return Collections.unmodifiableList(geometries);
  }

  /**
   * Returns copies of the members with every nested collection replaced by its own members,
   * recursively. The result contains no GeometryCollection.
   */
  public ImmutableList<Geometry> flatten() {
    ImmutableList.Builder<Geometry> result = ImmutableList.builder();
    addFlattened(this, result);
    return result.build();
  }

  private static void addFlattened(
      GeometryCollection<?> collection, ImmutableList.Builder<Geometry> result) {
    for (Geometry geometry : collection.geometries) {
      if (geometry instanceof GeometryCollection) {
        addFlattened((GeometryCollection<?>) geometry, result);
      } else {
        result.add(geometry.copy());
      }
    }
  }

  /** Returns every vertex of every member, in order, including ring closing points. */
  public ImmutableList<Point> getAllPoints() {
    return ImmutableList.copyOf(GeometryComponents.vertices(this));
  }

  /** Returns the largest member dimension, or -1 if the collection has no members. */
  @Override
  public int dimension() {
    int dimension = -1;
    for (T geometry : geometries) {
      dimension = Math.max(dimension, geometry.dimension());
    }
    return dimension;
  }

  /** Returns true if there are no members, or every member is empty. */
  @Override
  public boolean isEmpty() {
    for (T geometry : geometries) {
      if (!geometry.isEmpty()) {
        return false;
      }
    }
    return true;
  }

  /** Returns true if every member is simple. */
  @Override
  public boolean isSimple() {
    for (T geometry : geometries) {
      if (!geometry.isSimple()) {
        return false;
      }
    }
    return true;
  }

  /** Returns true if there are members and every one of them has z coordinates. */
  @Override
  public boolean is3D() {
    if (geometries.isEmpty()) {
      return false;
    }
    for (T geometry : geometries) {
      if (!geometry.is3D()) {
        return false;
      }
    }
    return true;
  }

  /** Returns true if there are members and every one of them has m coordinates. */
  @Override
  public boolean isMeasured() {
    if (geometries.isEmpty()) {
      return false;
    }
    for (T geometry : geometries) {
      if (!geometry.isMeasured()) {
        return false;
      }
    }
    return true;
  }

  @Override
  public Envelope getEnvelope() {
    Envelope result = new Envelope();
    for (T geometry : geometries) {
      result.addEnvelope(geometry.getEnvelope());
    }
    return result;
  }

  /** Returns a collection of the non-empty boundaries of the members. */
  @Override
  public Geometry boundary() {
    GeometryCollection<Geometry> result =
        new GeometryCollection<>(getSpatialReference(), tolerance());
    for (T geometry : geometries) {
      Geometry boundary = geometry.boundary();
      if (!boundary.isEmpty()) {
        result.geometries.add(boundary);
      }
    }
    return result;
  }

  /** Returns true if some member contains the point. */
  @Override
  public boolean contains(Point point) {
    for (T geometry : geometries) {
      if (geometry.contains(point)) {
        return true;
      }
    }
    return false;
  }

  /** Returns a new empty collection of the same class, reference, and tolerance. */
  protected GeometryCollection<T> newInstance() {
    return new GeometryCollection<>(getSpatialReference(), tolerance());
  }

  @Override
  public GeometryCollection<T> copy() {
    GeometryCollection<T> result = newInstance();
    for (T geometry : geometries) {
      result.geometries.add(copyOf(geometry));
    }
    return result;
  }

  /**
   * Returns true if the other collection has the same type and pairwise approximately equal
   * members, in the same order.
   */
  @Override
  public boolean approxEquals(Geometry other) {
    if (!(other instanceof GeometryCollection)
        || !getGeometryType().equals(other.getGeometryType())) {
      return false;
    }
    List<?> otherGeometries = ((GeometryCollection<?>) other).geometries;
    if (otherGeometries.size() != geometries.size()) {
      return false;
    }
    for (int i = 0; i < geometries.size(); i++) {
      if (!geometries.get(i).approxEquals((Geometry) otherGeometries.get(i))) {
        return false;
      }
    }
    return true;
  }

  @Override
  public boolean equals(Object other) {
    return other != null
        && other.getClass() == getClass()
        && geometries.equals(((GeometryCollection<?>) other).geometries);
  }

  @Override
  public int hashCode() {
    return getClass().hashCode() * 31 + geometries.hashCode();
  }
}
