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

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import net.hydromatic.typedlogic.ast.Logic.Sentence;
import net.hydromatic.typedlogic.model.Theory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts a theory to text in a target syntax.
 *
 * <p>A compiler is stateless, and the same theory always produces the same
 * text.
 *
 * @see Compilers
 */
public abstract class Compiler {
  private static final Logger LOGGER = LoggerFactory.getLogger(Compiler.class);

  /** Whether to throw {@link NotInProfileError} for a sentence that cannot
   * be translated; if false, the compiler writes a comment and continues. */
  protected final boolean strict;

  protected Compiler(boolean strict) {
    this.strict = strict;
  }

  /** Returns the conventional file suffix of the target syntax, without a
   * leading dot; for example "pro". */
  public abstract String suffix();

  /** Compiles a theory. */
  public abstract String compile(Theory theory);

  /** Compiles a single sentence, as if it were the only sentence in an
   * anonymous theory. */
  public String compileSentence(Sentence sentence) {
    return compile(Theory.of(null).add(sentence));
  }

  /** Compiles a theory and writes the result to a file. */
  public void compile(Theory theory, Path path) throws IOException {
    Files.write(path, compile(theory).getBytes(StandardCharsets.UTF_8));
  }

  /**
   * Handles a sentence that cannot be translated.
   *
   * <p>If strict, rethrows; otherwise returns a comment that contains the
   * sentence in first-order logic notation.
   *
   * @param commentPrefix Characters that start a comment in the target
   *     syntax
   */
  protected String untranslatable(Sentence sentence, NotInProfileError e,
      String commentPrefix) {
    if (strict) {
      throw e;
    }
    LOGGER.warn("Cannot translate sentence {}: {}", sentence, e.getMessage());
    return commentPrefix + " UNTRANSLATABLE: "
        + FolWriter.DEFAULT.write(sentence).replace('\n', ' ');
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "{strict: " + strict + "}";
  }
}

// End Compiler.java
