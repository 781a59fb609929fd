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

import static java.util.Objects.requireNonNull;

import net.hydromatic.typedlogic.model.Theory;

/** Compiles a theory to first-order logic notation, one sentence per
 * line. */
public class FolCompiler extends Compiler {
  private final PrologConfig config;

  public FolCompiler(PrologConfig config, boolean strict) {
    super(strict);
    this.config = requireNonNull(config);
  }

  @Override
  public String suffix() {
    return "fol";
  }

  @Override
  public String compile(Theory theory) {
    return new FolWriter(config).writeAll(theory.sentences());
  }
}

// End FolCompiler.java
