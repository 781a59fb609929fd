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

import static java.util.Objects.requireNonNull;

/**
 * Generates unique names.
 *
 * <p>Names are a prefix followed by an ordinal; the first name has ordinal 1.
 * A generator is not thread-safe; create one per pass.
 */
public class NameGenerator {
  private final String prefix;
  private int id = 0;

  public NameGenerator(String prefix) {
    this.prefix = requireNonNull(prefix, "prefix");
  }

  /** Generates a name that is unique among the names generated by this
   * generator. */
  public String get() {
    return prefix + ++id;
  }
}

// End NameGenerator.java
