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
package net.hydromatic.pydecompiler.util;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.Strings;
import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Renders literal values the way Python's {@code repr} function does, so that
 * the parser reads back the same value.
 */
public class Reprs {
  private Reprs() {}

  /** Returns whether {@link #number(Number)} can render a value. */
  public static boolean isSupportedNumber(Number n) {
    return n instanceof Integer
        || n instanceof Long
        || n instanceof BigInteger
        || n instanceof Double;
  }

  /** Returns whether a number is an integer, and therefore cannot be
   * directly followed by ".". */
  public static boolean isIntegral(Number n) {
    return n instanceof Integer || n instanceof Long || n instanceof BigInteger;
  }

  /**
   * Converts a number to source code.
   *
   * <p>{@link BigInteger} values are written as longs, with an "L" suffix.
   */
  public static String number(Number n) {
    checkArgument(isSupportedNumber(n), "unsupported number %s (%s)", n,
        n.getClass());
    if (n instanceof BigInteger) {
      return n + "L";
    }
    if (n instanceof Double) {
      return floatToString(n.doubleValue());
    }
    return n.toString();
  }

  /**
   * Converts a floating point value to the shortest string that Python reads
   * as the same value.
   *
   * <p>Uses exponent notation if the decimal exponent is less than -4 or at
   * least 16. For example, {@code 0.5} becomes "0.5", {@code 100} becomes
   * "100.0", {@code 1e16} becomes "1e+16", {@code 1e-5} becomes "1e-05".
   * Infinity becomes "1e999", a literal that the parser reads as infinity.
   */
  public static String floatToString(double d) {
    if (Double.isNaN(d)) {
      return "nan";
    }
    if (Double.isInfinite(d)) {
      // "inf" would read back as a name; 1e999 overflows to infinity
      return d > 0 ? "1e999" : "-1e999";
    }
    final String sign =
        d < 0 || d == 0 && 1 / d < 0 ? "-" : "";
    if (d == 0) {
      return sign + "0.0";
    }
    final BigDecimal decimal =
        new BigDecimal(Double.toString(Math.abs(d))).stripTrailingZeros();
    final String digits = decimal.unscaledValue().toString();
    final int exponent = digits.length() - 1 - decimal.scale();
    final StringBuilder b = new StringBuilder(sign);
    if (exponent < -4 || exponent >= 16) {
      b.append(digits.charAt(0));
      if (digits.length() > 1) {
        b.append('.').append(digits, 1, digits.length());
      }
      b.append('e')
          .append(exponent < 0 ? '-' : '+')
          .append(Strings.padStart(Integer.toString(Math.abs(exponent)), 2,
              '0'));
    } else if (exponent < 0) {
      b.append("0.")
          .append(Strings.repeat("0", -exponent - 1))
          .append(digits);
    } else if (digits.length() <= exponent + 1) {
      b.append(digits)
          .append(Strings.repeat("0", exponent + 1 - digits.length()))
          .append(".0");
    } else {
      b.append(digits, 0, exponent + 1)
          .append('.')
          .append(digits, exponent + 1, digits.length());
    }
    return b.toString();
  }

  /**
   * Converts a string to a quoted string literal.
   *
   * <p>Uses single quotes unless the string contains a single quote and no
   * double quote. A unicode string has a "u" prefix; a native string must
   * consist of characters no greater than 0xff, each representing a byte.
   *
   * @param s String value
   * @param unicode Whether the value is a unicode string (as opposed to a
   *     native, byte-oriented string)
   */
  public static String string(String s, boolean unicode) {
    final char quote = s.indexOf('\'') >= 0 && s.indexOf('"') < 0 ? '"' : '\'';
    final StringBuilder b = new StringBuilder();
    if (unicode) {
      b.append('u');
    }
    b.append(quote);
    s.codePoints().forEach(c -> appendCodePoint(b, c, quote, unicode));
    return b.append(quote).toString();
  }

  private static void appendCodePoint(StringBuilder b, int c, char quote,
      boolean unicode) {
    switch (c) {
    case '\\':
      b.append("\\\\");
      return;
    case '\t':
      b.append("\\t");
      return;
    case '\n':
      b.append("\\n");
      return;
    case '\r':
      b.append("\\r");
      return;
    default:
      break;
    }
    if (c == quote) {
      b.append('\\').append(quote);
    } else if (c >= ' ' && c < 0x7f) {
      b.append((char) c);
    } else if (c <= 0xff) {
      b.append("\\x").append(hex(c, 2));
    } else {
      checkArgument(unicode, "native string contains non-byte character %s",
          c);
      if (c <= 0xffff) {
        b.append("\\u").append(hex(c, 4));
      } else {
        b.append("\\U").append(hex(c, 8));
      }
    }
  }

  private static String hex(int c, int width) {
    return Strings.padStart(Integer.toHexString(c), width, '0');
  }
}

// End Reprs.java
