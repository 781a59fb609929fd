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
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.typedlogic.ast.Logic.Sentence;
import net.hydromatic.typedlogic.model.SentenceGroup;
import net.hydromatic.typedlogic.model.Theory;

/**
 * Compiles a theory to TPTP.
 *
 * <p>Each sentence becomes a "fof" formula. Sentences in goal groups are
 * conjectures, and others are axioms; each role is numbered separately. For
 * example,
 *
 * <blockquote><pre>
 * % Problem: example
 * fof(axiom1, axiom, (p(X) =&gt; q(X))).
 * fof(conjecture1, conjecture, ? [X] : q(X)).
 * </pre></blockquote>
 */
public class TptpCompiler extends Compiler {
  private final PrologConfig config;

  public TptpCompiler(PrologConfig config, boolean strict) {
    super(strict);
    this.config = requireNonNull(config);
  }

  @Override
  public String suffix() {
    return "tptp";
  }

  @Override
  public String compile(Theory theory) {
    final TptpWriter writer = new TptpWriter(config);
    final List<String> lines = new ArrayList<>();
    lines.add("% Problem: " + theory.name);
    final Map<String, Integer> counts = new HashMap<>();
    for (SentenceGroup group : theory.sentenceGroups) {
      final String role = group.isGoal() ? "conjecture" : "axiom";
      for (Sentence sentence : group.sentences) {
        final String formula;
        try {
          formula = writer.write(sentence);
        } catch (NotInProfileError e) {
          lines.add(untranslatable(sentence, e, "%"));
          continue;
        }
        final int n = counts.merge(role, 1, Integer::sum);
        lines.add("fof(" + role + n + ", " + role + ", " + formula + ").");
      }
    }
    return String.join("\n", lines);
  }
}

// End TptpCompiler.java
