/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.typedlogic.util;

import java.math.BigDecimal;
import java.util.Locale;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Utilities for formatting values. */
public class Static {
  private Static() {}

  /** Capitalizes a string: converts its first character to upper case and
   * the remaining characters to lower case.
   *
   * <p>For example, "hasParent" becomes "Hasparent". */
  public static String capitalize(String s) {
    if (s.isEmpty()) {
      return s;
    }
    return s.substring(0, 1).toUpperCase(Locale.ROOT)
        + s.substring(1).toLowerCase(Locale.ROOT);
  }

  /**
   * Returns the printable representation of a constant value.
   *
   * <p>Strings are quoted (by single quotes, unless the string contains a
   * single quote and no double quote); booleans are "True" and "False"; null
   * is "None"; doubles use the shortest form, with an exponent if very small
   * or very large. Many logic tools accept these forms.
   */
  public static String repr(@Nullable Object o) {
    if (o == null) {
      return "None";
    }
    if (o instanceof Boolean) {
      return (Boolean) o ? "True" : "False";
    }
    if (o instanceof String) {
      return reprString((String) o);
    }
    if (o instanceof Double || o instanceof Float) {
      return reprDouble(((Number) o).doubleValue());
    }
    return o.toString();
  }

  /** Returns a quoted string literal. */
  public static String reprString(String s) {
    final char quote = s.indexOf('\'') >= 0 && s.indexOf('"') < 0 ? '"' : '\'';
    final StringBuilder buf = new StringBuilder(s.length() + 2);
    buf.append(quote);
    for (int i = 0; i < s.length(); i++) {
      final char c = s.charAt(i);
      switch (c) {
      case '\t':
        buf.append("\\t");
        break;
      case '\n':
        buf.append("\\n");
        break;
      case '\r':
        buf.append("\\r");
        break;
      case '\\':
        buf.append("\\\\");
        break;
      default:
        if (c == quote) {
          buf.append('\\').append(c);
        } else if (c < ' ' || c >= 0x7f && c < 0xa0) {
          buf.append(String.format(Locale.ROOT, "\\x%02x", (int) c));
        } else {
          buf.append(c);
        }
      }
    }
    return buf.append(quote).toString();
  }

  /** Returns the shortest representation of a double.
   *
   * <p>Uses positional notation if the magnitude is between 1e-4 and 1e16,
   * otherwise scientific notation; for example "1.5", "100.0", "1e+16",
   * "2.5e-05". */
  public static String reprDouble(double d) {
    if (Double.isNaN(d)) {
      return "nan";
    }
    if (Double.isInfinite(d)) {
      return d > 0 ? "inf" : "-inf";
    }
    if (d == 0d) {
      return 1d / d < 0 ? "-0.0" : "0.0";
    }
    final BigDecimal b =
        new BigDecimal(Double.toString(d)).stripTrailingZeros();
    final double abs = Math.abs(d);
    if (abs >= 1e-4 && abs < 1e16) {
      final String s = b.toPlainString();
      return s.indexOf('.') >= 0 ? s : s + ".0";
    }
    final String digits = b.unscaledValue().abs().toString();
    final int exponent = b.precision() - b.scale() - 1;
    final StringBuilder buf = new StringBuilder();
    if (d < 0) {
      buf.append('-');
    }
    buf.append(digits.charAt(0));
    if (digits.length() > 1) {
      buf.append('.').append(digits, 1, digits.length());
    }
    buf.append('e').append(exponent < 0 ? '-' : '+');
    final String e = Integer.toString(Math.abs(exponent));
    if (e.length() < 2) {
      buf.append('0');
    }
    return buf.append(e).toString();
  }
}

// End Static.java
