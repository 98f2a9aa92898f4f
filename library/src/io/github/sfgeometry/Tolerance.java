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
import com.google.errorprone.annotations.Immutable;
import jsinterop.annotations.JsType;

/**
 * The absolute tolerance used when comparing coordinates and classifying orientations. All the
 * algorithms in this package take a Tolerance explicitly, and geometries capture one at
 * construction, so numerical behavior is reproducible per call.
 *
 * <p>This is a floating point tolerance, not exact arithmetic: two coordinates are equal when
 * they differ by at most {@link #epsilon()}, and an orientation determinant is treated as zero
 * (collinear) when its magnitude is at most epsilon.
 */
@Immutable
@JsType
public final class Tolerance {
  /** The default tolerance of 1e-10. */
  public static final Tolerance DEFAULT = new Tolerance(1e-10);

  private final double epsilon;

  private Tolerance(double epsilon) {
    this.epsilon = epsilon;
  }

  /** Returns a tolerance with the given epsilon, which must be finite and non-negative. */
  public static Tolerance of(double epsilon) {
    Preconditions.checkArgument(
        epsilon >= 0 && Double.isFinite(epsilon), "Invalid tolerance: %s", epsilon);
    return epsilon == DEFAULT.epsilon ? DEFAULT : new Tolerance(epsilon);
  }

  /** Returns the absolute tolerance. */
  public double epsilon() {
    return epsilon;
  }

  /** Returns true if {@code a} and {@code b} differ by at most epsilon. */
  public boolean equal(double a, double b) {
    return Math.abs(a - b) <= epsilon;
  }

  /** Returns true if the magnitude of {@code value} is at most epsilon. */
  public boolean isZero(double value) {
    return Math.abs(value) <= epsilon;
  }

  /** Returns +1, -1, or 0 according to the sign of {@code value}, where near-zero values are 0. */
  public int sign(double value) {
    if (value > epsilon) {
      return 1;
    }
    if (value < -epsilon) {
      return -1;
    }
    return 0;
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof Tolerance && ((Tolerance) other).epsilon == epsilon;
  }

  @Override
  public int hashCode() {
    return Double.hashCode(epsilon);
  }

  @Override
  public String toString() {
    return "Tolerance(" + epsilon + ")";
  }
}
