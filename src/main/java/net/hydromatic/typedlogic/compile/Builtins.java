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
package net.hydromatic.typedlogic.compile;

import com.google.common.collect.ImmutableMap;

/** Built-in predicates. */
public class Builtins {
  private Builtins() {}

  /** Predicates that are rendered as infix (or, with one argument, prefix)
   * operators, and the operator for each. */
  public static final ImmutableMap<String, String> NAME_TO_INFIX_OP =
      ImmutableMap.<String, String>builder()
          .put("add", "+")
          .put("sub", "-")
          .put("mul", "*")
          .put("truediv", "/")
          .put("floordiv", "//")
          .put("mod", "%")
          .put("pow", "**")
          .put("lshift", "<<")
          .put("rshift", ">>")
          .put("or", "|")
          .put("xor", "^")
          .put("and", "&")
          .put("matmul", "@")
          // comparison operators
          .put("eq", "==")
          .put("ne", "!=")
          .put("lt", "<")
          .put("le", "<=")
          .put("gt", ">")
          .put("ge", ">=")
          .put("is", "is")
          .put("is_not", "is not")
          .put("in", "in")
          .put("not_in", "not in")
          .build();
}

// End Builtins.java
