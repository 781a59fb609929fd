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

import java.util.List;
import java.util.Map;
import net.hydromatic.typedlogic.ast.Logic.Sentence;
import net.hydromatic.typedlogic.model.Converters;
import net.hydromatic.typedlogic.model.Theory;
import net.hydromatic.typedlogic.util.Json;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Compiles a theory to an S-expression.
 *
 * <p>The head of each list is printed as is, and other atoms as JSON. Each
 * element after the head starts a new line, indented two spaces per level of
 * nesting. For example, the term "P(x, 1)" becomes
 *
 * <blockquote><pre>
 * (P
 *   (Variable
 *     "x")
 *   1)
 * </pre></blockquote>
 */
public class SexprCompiler extends Compiler {
  public SexprCompiler(boolean strict) {
    super(strict);
  }

  @Override
  public String suffix() {
    return "sexpr";
  }

  @Override
  public String compile(Theory theory) {
    return render(Converters.asSexpr(theory));
  }

  @Override
  public String compileSentence(Sentence sentence) {
    return render(Converters.asSexpr(sentence));
  }

  /** Renders an S-expression. */
  public static String render(@Nullable Object sexpr) {
    return render(new StringBuilder(), sexpr, 0, 0).toString();
  }

  private static StringBuilder render(StringBuilder buf,
      @Nullable Object sexpr, int position, int depth) {
    if (position > 0) {
      buf.append('\n');
      for (int i = 0; i < depth; i++) {
        buf.append("  ");
      }
    }
    if (sexpr instanceof List) {
      final List<?> list = (List<?>) sexpr;
      buf.append('(');
      for (int i = 0; i < list.size(); i++) {
        render(buf, list.get(i), i, depth + 1);
      }
      return buf.append(')');
    }
    if (sexpr instanceof Map) {
      throw new IllegalArgumentException("Cannot render map " + sexpr);
    }
    return buf.append(position == 0 ? String.valueOf(sexpr) : Json.str(sexpr));
  }
}

// End SexprCompiler.java
