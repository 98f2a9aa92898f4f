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

import com.google.common.base.Strings;
import jsinterop.annotations.JsType;

/**
 * An error code and text string describing the first problem encountered while validating or
 * mutating a geometry. Instances are reusable: validation methods such as
 * {@link Polygon#findValidationError(GeometryError)} fill in the code and text of the error they
 * are given, and {@link #clear()} resets it.
 */
@JsType
public class GeometryError {
  /** Numeric values for geometry errors. */
  @JsType
  public enum Code {
    /** No problems detected. */
    NO_ERROR(0),

    ////////////////////////////////////////////////////////////////////
    // Generic errors, not specific to geometric objects:

    /** Argument is out of range. */
    OUT_OF_RANGE(1002),
    /** Invalid argument (other than a range error). */
    INVALID_ARGUMENT(1003),
    /** An internal invariant has failed. */
    INTERNAL(1005),

    ////////////////////////////////////////////////////////////////////
    // Coordinate and point errors:

    /** A coordinate is inf or NaN, or outside the geographic range of its coordinate system. */
    INVALID_COORDINATE(1),
    /** Two input points that must be distinct are equal within tolerance. */
    DUPLICATE_POINT(2),

    ////////////////////////////////////////////////////////////////////
    // Curve and collection errors:

    /** An operation that requires at least one element was invoked on an empty geometry. */
    EMPTY_GEOMETRY(100),
    /** A 1-based accessor was called with an index outside [1, count]. */
    INDEX_OUT_OF_RANGE(101),

    ////////////////////////////////////////////////////////////////////
    // Surface errors:

    /** A ring is not closed, has too few points, self-intersects, or is not properly nested. */
    INVALID_RING(200),
    /** Three triangle vertices are collinear or coincident. */
    DEGENERATE_TRIANGLE(201),
    /** The operation is not supported by this geometry type, e.g. holes in a Triangle. */
    UNSUPPORTED_OPERATION(202),
    /** Two members of an aggregate overlap where they must not. */
    OVERLAPPING_GEOMETRY(203),

    ////////////////////////////////////////////////////////////////////
    // Polyhedral surface errors:

    /** The patch adjacency relation is inconsistent, or patches are not connected as required. */
    TOPOLOGY_ERROR(300);

    private final int code;

    private Code(int code) {
      this.code = code;
    }

    /** Returns the numeric value of this error code. */
    public int code() {
      return code;
    }
  }

  private Code code = Code.NO_ERROR;
  private String text = "";

  /** Prepares a GeometryError instance for reuse by resetting it to its original state. */
  public void clear() {
    code = Code.NO_ERROR;
    text = "";
  }

  /**
   * Sets the error code and text description; the description is formatted according to the rules
   * defined in {@link Strings#lenientFormat(String, Object...)}, except that '%d' positional
   * arguments are also handled.
   *
   * <p>This method may be called more than once, so that callers may surround the error message
   * with additional context:
   *
   * <pre>{@code
   * error.init(error.code(), "Interior ring %d: %s", i, error.text());
   * }</pre>
   */
  public void init(Code code, String format, Object... args) {
    this.code = code;
    format = format.replace("%d", "%s");
    this.text = Strings.lenientFormat(format, args);
  }

  /** Returns the code of this error. */
  public Code code() {
    return code;
  }

  /** Returns true if this error's code is NO_ERROR. */
  public boolean ok() {
    return code == Code.NO_ERROR;
  }

  /** Returns the text string. */
  public String text() {
    return text;
  }

  @Override
  public String toString() {
    if (code == Code.NO_ERROR) {
      return "OK";
    }
    return Strings.lenientFormat("%s: %s", code, text);
  }
}
