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

import static com.google.common.base.Preconditions.checkArgument;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Rational number.
 *
 * <p>Immutable, and always in lowest terms with a positive denominator.
 */
public class Fraction implements Comparable<Fraction> {
  public final BigInteger numerator;
  public final BigInteger denominator;

  private Fraction(BigInteger numerator, BigInteger denominator) {
    checkArgument(denominator.signum() != 0, "zero denominator");
    if (denominator.signum() < 0) {
      numerator = numerator.negate();
      denominator = denominator.negate();
    }
    final BigInteger gcd = numerator.gcd(denominator);
    if (!gcd.equals(BigInteger.ONE) && gcd.signum() != 0) {
      numerator = numerator.divide(gcd);
      denominator = denominator.divide(gcd);
    }
    this.numerator = numerator;
    this.denominator = denominator;
  }

  /** Creates a fraction. */
  public static Fraction of(long numerator, long denominator) {
    return of(BigInteger.valueOf(numerator), BigInteger.valueOf(denominator));
  }

  /** Creates a fraction. */
  public static Fraction of(BigInteger numerator, BigInteger denominator) {
    return new Fraction(numerator, denominator);
  }

  /** Creates a fraction that is exactly equal to a double.
   *
   * @throws IllegalArgumentException if the value is infinite or NaN */
  public static Fraction of(double d) {
    checkArgument(Double.isFinite(d), "cannot convert %s to fraction", d);
    final BigDecimal b = new BigDecimal(d);
    if (b.scale() <= 0) {
      return of(b.toBigIntegerExact(), BigInteger.ONE);
    }
    return of(b.unscaledValue(), BigInteger.TEN.pow(b.scale()));
  }

  /**
   * Returns the closest fraction to this one whose denominator is at most
   * {@code maxDenominator}.
   *
   * <p>For example, the double 0.1 is exactly
   * 3602879701896397 / 36028797018963968, and limiting its denominator to
   * 1,000,000 gives 1 / 10.
   */
  public Fraction limitDenominator(long maxDenominator) {
    checkArgument(maxDenominator >= 1, "maxDenominator should be at least 1");
    final BigInteger max = BigInteger.valueOf(maxDenominator);
    if (denominator.compareTo(max) <= 0) {
      return this;
    }
    if (numerator.signum() < 0) {
      final Fraction f =
          of(numerator.negate(), denominator).limitDenominator(maxDenominator);
      return of(f.numerator.negate(), f.denominator);
    }
    // Walk the continued fraction expansion until the denominator is too
    // big, then pick the closer of the last convergent and semiconvergent.
    BigInteger p0 = BigInteger.ZERO;
    BigInteger q0 = BigInteger.ONE;
    BigInteger p1 = BigInteger.ONE;
    BigInteger q1 = BigInteger.ZERO;
    BigInteger n = numerator;
    BigInteger d = denominator;
    for (;;) {
      final BigInteger a = n.divide(d);
      final BigInteger q2 = q0.add(a.multiply(q1));
      if (q2.compareTo(max) > 0) {
        break;
      }
      final BigInteger p2 = p0.add(a.multiply(p1));
      p0 = p1;
      q0 = q1;
      p1 = p2;
      q1 = q2;
      final BigInteger r = n.subtract(a.multiply(d));
      n = d;
      d = r;
    }
    final BigInteger k = max.subtract(q0).divide(q1);
    final Fraction bound1 =
        of(p0.add(k.multiply(p1)), q0.add(k.multiply(q1)));
    final Fraction bound2 = of(p1, q1);
    return bound2.distance(this).compareTo(bound1.distance(this)) <= 0
        ? bound2
        : bound1;
  }

  /** Returns the absolute difference between this and another fraction, as
   * a fraction. */
  private Fraction distance(Fraction f) {
    final BigInteger n =
        numerator.multiply(f.denominator)
            .subtract(f.numerator.multiply(denominator)).abs();
    return of(n, denominator.multiply(f.denominator));
  }

  @Override
  public int compareTo(Fraction f) {
    return numerator.multiply(f.denominator)
        .compareTo(f.numerator.multiply(denominator));
  }

  @Override
  public int hashCode() {
    return numerator.hashCode() * 31 + denominator.hashCode();
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Fraction
        && numerator.equals(((Fraction) o).numerator)
        && denominator.equals(((Fraction) o).denominator);
  }

  @Override
  public String toString() {
    return numerator + "/" + denominator;
  }
}

// End Fraction.java
