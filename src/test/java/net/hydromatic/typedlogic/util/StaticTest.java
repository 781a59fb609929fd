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
import static org.hamcrest.core.Is.is;

import org.junit.jupiter.api.Test;

/** Tests for {@link Static}, {@link Json} and {@link NameGenerator}. */
public class StaticTest {
  @Test void testCapitalize() {
    assertThat(Static.capitalize("hasParent"), is("Hasparent"));
    assertThat(Static.capitalize("p"), is("P"));
    assertThat(Static.capitalize("ABC"), is("Abc"));
    assertThat(Static.capitalize(""), is(""));
  }

  @Test void testRepr() {
    assertThat(Static.repr(null), is("None"));
    assertThat(Static.repr(true), is("True"));
    assertThat(Static.repr(false), is("False"));
    assertThat(Static.repr(42), is("42"));
    assertThat(Static.repr(-7L), is("-7"));
    assertThat(Static.repr("Alice"), is("'Alice'"));
    assertThat(Static.repr(1.5f), is("1.5"));
  }

  @Test void testReprString() {
    assertThat(Static.reprString(""), is("''"));
    assertThat(Static.reprString("it's"), is("\"it's\""));
    assertThat(Static.reprString("say \"hi\""), is("'say \"hi\"'"));
    assertThat(Static.reprString("it's \"x\""), is("'it\\'s \"x\"'"));
    assertThat(Static.reprString("a\tb\nc\\d"), is("'a\\tb\\nc\\\\d'"));
    assertThat(Static.reprString("\u0001\u007f"), is("'\\x01\\x7f'"));
    assertThat(Static.reprString("café"), is("'café'"));
  }

  @Test void testReprDouble() {
    assertThat(Static.reprDouble(1.5), is("1.5"));
    assertThat(Static.reprDouble(100d), is("100.0"));
    assertThat(Static.reprDouble(-1.5), is("-1.5"));
    assertThat(Static.reprDouble(0.1), is("0.1"));
    assertThat(Static.reprDouble(0.0001), is("0.0001"));
    assertThat(Static.reprDouble(123456.789), is("123456.789"));
    assertThat(Static.reprDouble(0d), is("0.0"));
    assertThat(Static.reprDouble(-0d), is("-0.0"));
    assertThat(Static.reprDouble(1e16), is("1e+16"));
    assertThat(Static.reprDouble(1.2345e20), is("1.2345e+20"));
    assertThat(Static.reprDouble(-1e22), is("-1e+22"));
    assertThat(Static.reprDouble(2.5e-5), is("2.5e-05"));
    assertThat(Static.reprDouble(1e-100), is("1e-100"));
    assertThat(Static.reprDouble(Double.NaN), is("nan"));
    assertThat(Static.reprDouble(Double.POSITIVE_INFINITY), is("inf"));
    assertThat(Static.reprDouble(Double.NEGATIVE_INFINITY), is("-inf"));
  }

  @Test void testJson() {
    assertThat(Json.str(null), is("null"));
    assertThat(Json.str(1), is("1"));
    assertThat(Json.str("a\"b"), is("\"a\\\"b\""));
    assertThat(Json.str("café"), is("\"caf\\u00E9\""));
  }

  @Test void testNameGenerator() {
    final NameGenerator generator = new NameGenerator("sk__");
    assertThat(generator.get(), is("sk__1"));
    assertThat(generator.get(), is("sk__2"));
    assertThat(new NameGenerator("sk__").get(), is("sk__1"));
  }
}

// End StaticTest.java
