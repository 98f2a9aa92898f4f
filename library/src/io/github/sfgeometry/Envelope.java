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

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.errorprone.annotations.CheckReturnValue;

/**
 * An Envelope represents a closed axis-aligned rectangle in the (x,y) plane, the bounding box of a
 * geometry. This class is mutable to allow iteratively constructing bounds via e.g. {@link
 * #addPoint(Point)}; geometries always hand out fresh instances.
 *
 * <p>The empty envelope contains no points and is represented by minX > maxX.
 */
public final strictfp class Envelope {
  private double minX;
  private double minY;
  private double maxX;
  private double maxY;

  /** Creates an empty Envelope. */
  public Envelope() {
    setEmpty();
  }

  /**
   * Constructs an envelope from the given bounds. If either minimum is greater than the
   * corresponding maximum, the envelope is empty.
   */
  public Envelope(double minX, double minY, double maxX, double maxY) {
    if (minX > maxX || minY > maxY) {
      setEmpty();
    } else {
      this.minX = minX;
      this.minY = minY;
      this.maxX = maxX;
      this.maxY = maxY;
    }
  }

  /** Copy constructor. */
  public Envelope(Envelope other) {
    this.minX = other.minX;
    this.minY = other.minY;
    this.maxX = other.maxX;
    this.maxY = other.maxY;
  }

  /** Returns a new empty envelope. */
  public static Envelope empty() {
    return new Envelope();
  }

  /** Returns an envelope containing a single point. */
  public static Envelope fromPoint(Point p) {
    return new Envelope(p.x(), p.y(), p.x(), p.y());
  }

  /** Returns the minimal envelope containing all the given points. */
  public static Envelope fromPoints(Iterable<Point> points) {
    Envelope result = new Envelope();
    for (Point p : points) {
      result.addPoint(p);
    }
    return result;
  }

  private void setEmpty() {
    minX = 1;
    maxX = 0;
    minY = 1;
    maxY = 0;
  }

  public double minX() {
    return minX;
  }

  public double minY() {
    return minY;
  }

  public double maxX() {
    return maxX;
  }

  public double maxY() {
    return maxY;
  }

  /** Return true if this envelope is empty, i.e. it contains no points at all. */
  public boolean isEmpty() {
    return minX > maxX;
  }

  /** Returns the extent along the x-axis, or zero if empty. */
  public double getWidth() {
    return isEmpty() ? 0 : maxX - minX;
  }

  /** Returns the extent along the y-axis, or zero if empty. */
  public double getHeight() {
    return isEmpty() ? 0 : maxY - minY;
  }

  /** Returns the center of this envelope. For empty envelopes, the result is arbitrary. */
  public Point getCenter() {
    return new Point(0.5 * (minX + maxX), 0.5 * (minY + maxY));
  }

  /**
   * Returns true if this envelope contains the given point. Envelopes are closed regions, i.e.
   * they contain their boundary.
   */
  public boolean contains(Point p) {
    return p.x() >= minX && p.x() <= maxX && p.y() >= minY && p.y() <= maxY;
  }

  /** Returns true if this envelope contains the given other envelope. */
  public boolean contains(Envelope other) {
    if (other.isEmpty()) {
      return true;
    }
    return other.minX >= minX && other.maxX <= maxX && other.minY >= minY && other.maxY <= maxY;
  }

  /** Returns true if this envelope and the given other envelope have any points in common. */
  public boolean intersects(Envelope other) {
    if (isEmpty() || other.isEmpty()) {
      return false;
    }
    return other.minX <= maxX && other.maxX >= minX && other.minY <= maxY && other.maxY >= minY;
  }

  /**
   * As {@link #intersects(Envelope)}, but the envelopes are first grown by the given tolerance, so
   * that bounds which only miss each other by rounding error still intersect.
   */
  public boolean intersects(Envelope other, Tolerance tolerance) {
    return expanded(tolerance.epsilon()).intersects(other);
  }

  /**
   * Increases the size of the envelope to include the given point. This envelope is expanded by
   * the minimum amount possible.
   */
  @CanIgnoreReturnValue
  public Envelope addPoint(Point p) {
    if (isEmpty()) {
      minX = maxX = p.x();
      minY = maxY = p.y();
    } else {
      minX = Math.min(minX, p.x());
      maxX = Math.max(maxX, p.x());
      minY = Math.min(minY, p.y());
      maxY = Math.max(maxY, p.y());
    }
    return this;
  }

  /** Increases the size of this envelope to include the given envelope. */
  @CanIgnoreReturnValue
  public Envelope addEnvelope(Envelope other) {
    if (other.isEmpty()) {
      return this;
    }
    if (isEmpty()) {
      minX = other.minX;
      minY = other.minY;
      maxX = other.maxX;
      maxY = other.maxY;
    } else {
      minX = Math.min(minX, other.minX);
      maxX = Math.max(maxX, other.maxX);
      minY = Math.min(minY, other.minY);
      maxY = Math.max(maxY, other.maxY);
    }
    return this;
  }

  /**
   * Returns an envelope that has been expanded on each side by the given margin. Any expansion of
   * an empty envelope remains empty.
   */
  @CheckReturnValue
  public Envelope expanded(double margin) {
    if (isEmpty()) {
      return empty();
    }
    return new Envelope(minX - margin, minY - margin, maxX + margin, maxY + margin);
  }

  /** Returns the smallest envelope containing the union of this envelope and the given one. */
  @CheckReturnValue
  public Envelope union(Envelope other) {
    return new Envelope(this).addEnvelope(other);
  }

  /** Returns the intersection of this envelope and the given one, which may be empty. */
  @CheckReturnValue
  public Envelope intersection(Envelope other) {
    if (!intersects(other)) {
      return empty();
    }
    return new Envelope(
        Math.max(minX, other.minX),
        Math.max(minY, other.minY),
        Math.min(maxX, other.maxX),
        Math.min(maxY, other.maxY));
  }

  @Override
  public int hashCode() {
    if (isEmpty()) {
      return 17;
    }
    long value = 17;
    value += 37 * value + Platform.doubleHash(minX);
    value += 37 * value + Platform.doubleHash(minY);
    value += 37 * value + Platform.doubleHash(maxX);
    value += 37 * value + Platform.doubleHash(maxY);
    return (int) (value ^ (value >>> 32));
  }

  /** Returns true if two envelopes contain the same set of points. */
  @Override
  public boolean equals(Object other) {
    if (!(other instanceof Envelope)) {
      return false;
    }
    Envelope that = (Envelope) other;
    if (isEmpty() || that.isEmpty()) {
      return isEmpty() && that.isEmpty();
    }
    return minX == that.minX && minY == that.minY && maxX == that.maxX && maxY == that.maxY;
  }

  @Override
  public String toString() {
    if (isEmpty()) {
      return "Envelope[EMPTY]";
    }
    return "Envelope[" + minX + ", " + minY + ", " + maxX + ", " + maxY + "]";
  }
}
