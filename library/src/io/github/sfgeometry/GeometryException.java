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

/**
 * An unchecked exception thrown when a geometry would be constructed or mutated into an invalid
 * state. Every GeometryException wraps a {@link GeometryError}, so callers can branch on the
 * {@link GeometryError.Code} rather than on message text.
 *
 * <p>Methods that can detect a problem without failing, such as {@link
 * Polygon#findValidationError(GeometryError)}, report into a GeometryError instead. Mutators and
 * constructors, which must never leave a partially invalid object behind, throw.
 */
public class GeometryException extends RuntimeException {

  private final GeometryError error;

  /** Creates a new GeometryException wrapping the given GeometryError. */
  public GeometryException(GeometryError error) {
    this.error = error;
  }

  /** Creates a new GeometryException with a fresh error built from the given code and text. */
  public GeometryException(GeometryError.Code code, String format, Object... args) {
    this.error = new GeometryError();
    this.error.init(code, format, args);
  }

  /** Returns the code of the GeometryError wrapped by this GeometryException. */
  public GeometryError.Code code() {
    return error.code();
  }

  /** Returns the wrapped error. */
  public GeometryError error() {
    return error;
  }

  @Override
  public String getMessage() {
    return error.toString();
  }
}
