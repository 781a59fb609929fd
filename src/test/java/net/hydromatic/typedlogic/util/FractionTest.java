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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.greaterThan;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.Matchers.lessThan;
import static org.hamcrest.Matchers.sameInstance;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

/** Tests for {@link Fraction}. */
public class FractionTest {
  @Test void testOf() {
    assertThat(Fraction.of(6, -4), hasToString("-3/2"));
    assertThat(Fraction.of(0, 5), hasToString("0/1"));
    assertThat(Fraction.of(0.75), hasToString("3/4"));
    assertThat(Fraction.of(-2d), hasToString("-2/1"));
    assertThat(Fraction.of(1e20), hasToString("100000000000000000000/1"));
    assertThat(Fraction.of(0.1),
        hasToString("3602879701896397/36028797018963968"));
    assertThat(Fraction.of(2, 4), is(Fraction.of(1, 2)));
    assertThrows(IllegalArgumentException.class, () -> Fraction.of(1, 0));
    assertThrows(IllegalArgumentException.class,
        () -> Fraction.of(Double.NaN));
    assertThrows(IllegalArgumentException.class,
        () -> Fraction.of(Double.POSITIVE_INFINITY));
  }

  @Test void testLimitDenominator() {
    assertThat(Fraction.of(0.1).limitDenominator(1_000_000),
        hasToString("1/10"));
    assertThat(Fraction.of(-0.1).limitDenominator(1_000_000),
        hasToString("-1/10"));
    assertThat(Fraction.of(1.1).limitDenominator(1_000_000),
        hasToString("11/10"));
    assertThat(Fraction.of(Math.PI).limitDenominator(10), hasToString("22/7"));
    assertThat(Fraction.of(Math.PI).limitDenominator(100),
        hasToString("311/99"));
    assertThat(Fraction.of(Math.PI).limitDenominator(1000),
        hasToString("355/113"));
    final Fraction f = Fraction.of(3, 4);
    assertThat(f.limitDenominator(4), sameInstance(f));
    assertThrows(IllegalArgumentException.class,
        () -> f.limitDenominator(0));
  }

  @Test void testCompare() {
    assertThat(Fraction.of(1, 3).compareTo(Fraction.of(1, 2)), lessThan(0));
    assertThat(Fraction.of(-1, 3).compareTo(Fraction.of(-1, 2)),
        greaterThan(0));
    assertThat(Fraction.of(2, 6).compareTo(Fraction.of(1, 3)), is(0));
  }
}

// End FractionTest.java
