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

import java.util.ArrayList;
import java.util.List;
import net.hydromatic.typedlogic.ast.Logic.Sentence;
import net.hydromatic.typedlogic.model.PredicateDefinition;
import net.hydromatic.typedlogic.model.SentenceGroup;
import net.hydromatic.typedlogic.model.Theory;

/**
 * Compiles a theory to Prolog.
 *
 * <p>The output starts with a comment for each predicate definition. Then,
 * for each sentence group, a comment with the group's name followed by the
 * group's sentences, each converted to Horn rules. For example,
 *
 * <blockquote><pre>
 * %% Predicate Definitions
 * % P(x: str)
 * % Q(x: str)
 *
 * %% Sentences
 *
 * q(X) :- p(X).
 * </pre></blockquote>
 */
public class PrologCompiler extends Compiler {
  private final PrologConfig config;

  public PrologCompiler(PrologConfig config, boolean strict) {
    super(strict);
    this.config = requireNonNull(config);
  }

  @Override
  public String suffix() {
    return "pro";
  }

  @Override
  public String compile(Theory theory) {
    final PrologWriter writer = new PrologWriter(config);
    final List<String> lines = new ArrayList<>();
    lines.add("%% Predicate Definitions");
    for (PredicateDefinition pd : theory.predicateDefinitions) {
      lines.add("% " + pd);
    }
    for (SentenceGroup group : theory.sentenceGroups) {
      lines.add("\n%% " + group.name + "\n");
      for (Sentence sentence : group.sentences) {
        try {
          lines.add(writer.write(sentence, true));
        } catch (NotInProfileError e) {
          lines.add(untranslatable(sentence, e, "%%"));
        }
      }
    }
    return String.join("\n", lines);
  }
}

// End PrologCompiler.java
