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

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.typedlogic.ast.Logic.Sentence;
import net.hydromatic.typedlogic.model.SentenceGroup;
import net.hydromatic.typedlogic.model.Theory;

/**
 * Compiles a theory to the input language of Prover9.
 *
 * <p>Sentences in goal groups, and any extra goals, go into the
 * "formulas(goals)" list; all other sentences go into the
 * "formulas(assumptions)" list.
 */
public class Prover9Compiler extends Compiler {
  private final PrologConfig config;

  public Prover9Compiler(PrologConfig config, boolean strict) {
    super(strict);
    this.config = requireNonNull(config);
  }

  @Override
  public String suffix() {
    return "prover9";
  }

  @Override
  public String compile(Theory theory) {
    return compile(theory, ImmutableList.of());
  }

  /** Compiles a theory with extra goals. */
  public String compile(Theory theory, List<? extends Sentence> goals) {
    final Prover9Writer writer = new Prover9Writer(config);
    final List<String> lines = new ArrayList<>();
    lines.add("% Problem: " + theory.name);
    lines.add("formulas(assumptions).");
    for (SentenceGroup group : theory.sentenceGroups) {
      if (!group.isGoal()) {
        group.sentences.forEach(s -> lines.add(formula(writer, s)));
      }
    }
    lines.add("end_of_list.");
    lines.add("");
    lines.add("formulas(goals).");
    for (SentenceGroup group : theory.sentenceGroups) {
      if (group.isGoal()) {
        group.sentences.forEach(s -> lines.add(formula(writer, s)));
      }
    }
    goals.forEach(s -> lines.add(formula(writer, s)));
    lines.add("end_of_list.");
    return String.join("\n", lines);
  }

  private String formula(Prover9Writer writer, Sentence sentence) {
    try {
      return "    " + writer.write(sentence) + ".";
    } catch (NotInProfileError e) {
      return untranslatable(sentence, e, "%");
    }
  }
}

// End Prover9Compiler.java
