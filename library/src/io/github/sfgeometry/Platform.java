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

import com.google.common.annotations.GwtCompatible;
import java.util.Locale;
import java.util.logging.Logger;

/**
 * Contains utility methods which require different GWT client and server implementations. This
 * contains the server side implementations.
 */
@GwtCompatible(emulated = true)
final class Platform {

  private Platform() {}

  /**
   * Returns the {@link Logger} for the class.
   *
   * @see Logger#getLogger(String)
   */
  static Logger getLoggerForClass(Class<?> clazz) {
    return Logger.getLogger(clazz.getCanonicalName());
  }

  /**
   * Returns {@code String.format} with the arguments, always using {@link Locale#US} so that the
   * decimal separator is a period.
   */
  static String formatString(String format, Object... params) {
    return String.format(Locale.US, format, params);
  }

  /**
   * Formats the double as a string and removes unneeded trailing zeros, to behave the same as
   * printf("%.15g",d) in C++. Zero, including negative zero, is formatted as "0", and integral
   * values have no decimal point, so a coordinate of 10.0 is written "10".
   */
  static String formatDouble(double d) {
    StringBuilder out = new StringBuilder();
    if (d == 0d) {
      return "0";
    }
    // Style 'g' uses either 'e' or 'f', depending on the magnitude of the number.
    out.append(String.format(Locale.US, "%.15g", d));

    // Trailing zeros are removed from the mantissa, which ends at the exponent if there is one.
    int exponent = out.indexOf("e");
    int end = exponent < 0 ? out.length() : exponent;
    if (out.lastIndexOf(".", end) >= 0) {
      int cut = end;
      while (out.charAt(cut - 1) == '0') {
        cut--;
      }
      // Remove trailing decimal point.
      if (out.charAt(cut - 1) == '.') {
        cut--;
      }
      out.delete(cut, end);
    }
    return out.toString();
  }

  /** A portable way to hash a double value. Positive and negative zero hash the same. */
  static long doubleHash(double value) {
    return Double.doubleToLongBits(value == 0 ? 0.0 : value);
  }
}
