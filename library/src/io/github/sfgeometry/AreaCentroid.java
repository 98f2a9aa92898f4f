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

import com.google.common.base.Objects;
import jsinterop.annotations.JsType;
import org.jspecify.annotations.Nullable;

/**
 * The area of a region together with its centroid. The centroid is null when the area is zero,
 * since the area-weighted centroid of a degenerate region is undefined. Note that the centroid of
 * a concave region may not be contained by the region.
 */
@JsType
public final class AreaCentroid {

  private final double area;
  private final @Nullable Point centroid;

  /** Constructs a new AreaCentroid with an area and optional centroid. */
  public AreaCentroid(double area, @Nullable Point centroid) {
    this.area = area;
    this.centroid = centroid;
  }

  /** Returns the non-negative area of the region. */
  public double getArea() {
    return area;
  }

  /** Returns the true centroid of the region, or null if the region has zero area. */
  public @Nullable Point getCentroid() {
    return centroid;
  }

  /**
   * Returns the area and centroid of the region made of this and {@code other}, assuming their
   * interiors are disjoint, or of this region with {@code other} removed if {@code subtract} is
   * true.
   */
  AreaCentroid combine(AreaCentroid other, boolean subtract) {
    double sign = subtract ? -1 : 1;
    double total = area + sign * other.area;
    if (total <= 0) {
      return new AreaCentroid(Math.max(0, total), null);
    }
    double cx = 0;
    double cy = 0;
    if (centroid != null) {
      cx += area * centroid.x();
      cy += area * centroid.y();
    }
    if (other.centroid != null) {
      cx += sign * other.area * other.centroid.x();
      cy += sign * other.area * other.centroid.y();
    }
    return new AreaCentroid(total, new Point(cx / total, cy / total));
  }

  @Override
  public boolean equals(Object obj) {
    if (obj instanceof AreaCentroid) {
      AreaCentroid that = (AreaCentroid) obj;
      return this.area == that.area && Objects.equal(this.centroid, that.centroid);
    }
    return false;
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(area, centroid);
  }

  @Override
  public String toString() {
    return "AreaCentroid(" + area + ", " + centroid + ")";
  }
}
