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
package net.hydromatic.typedlogic.transform;

import static com.google.common.base.Preconditions.checkArgument;
import static net.hydromatic.typedlogic.ast.LogicBuilder.logic;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.typedlogic.ast.Logic.Sentence;
import net.hydromatic.typedlogic.ast.Logic.Term;
import net.hydromatic.typedlogic.ast.Logic.Variable;
import net.hydromatic.typedlogic.ast.Shuttle;
import net.hydromatic.typedlogic.model.PredicateDefinition;
import net.hydromatic.typedlogic.model.SentenceGroup;
import net.hydromatic.typedlogic.model.Theory;

/** Passes that use the predicate definitions of a theory. */
public class Hierarchy {
  private Hierarchy() {}

  /** Name of the group that {@link #impliesFromParents(Theory)} adds. */
  public static final String INFERRED_GROUP_NAME = "Inferred";

  /**
   * Returns a sentence for each parent of each predicate definition.
   *
   * <p>If predicate "Person(name)" has parent "Thing", the sentence is
   * "&forall;name:str. Thing(name) &rarr; Person(name)". Sentences that are
   * already in the theory are skipped.
   *
   * @throws IllegalArgumentException if the theory has no predicate
   *     definitions
   */
  public static List<Sentence> sentencesFromPredicateHierarchy(Theory theory) {
    checkArgument(!theory.predicateDefinitions.isEmpty(),
        "Theory must have predicate definitions");
    final List<Sentence> existing = theory.sentences();
    final ImmutableList.Builder<Sentence> b = ImmutableList.builder();
    for (PredicateDefinition pd : theory.predicateDefinitions) {
      if (pd.parents == null) {
        continue;
      }
      for (String parent : pd.parents) {
        final List<Variable> variables = new ArrayList<>();
        final List<Variable> args = new ArrayList<>();
        pd.arguments.forEach((name, type) -> {
          variables.add(logic.variable(name, type));
          args.add(logic.variable(name));
        });
        final Sentence sentence =
            logic.forall(variables,
                logic.implies(logic.term(parent, args),
                    logic.term(pd.predicate, args)));
        if (!existing.contains(sentence)) {
          b.add(sentence);
        }
      }
    }
    return b.build();
  }

  /**
   * Returns a theory with an extra group, "Inferred", containing an
   * implication for each parent of each predicate.
   *
   * @see #sentencesFromPredicateHierarchy(Theory)
   */
  public static Theory impliesFromParents(Theory theory) {
    final List<Sentence> sentences = sentencesFromPredicateHierarchy(theory);
    return theory.toBuilder()
        .sentenceGroup(SentenceGroup.of(INFERRED_GROUP_NAME, sentences))
        .build();
  }

  /**
   * Returns a theory in which every term is bound by keyword, in the order of
   * its predicate's arguments.
   *
   * <p>A term whose predicate does not have exactly one definition (say, a
   * built-in such as "lt") is unchanged. Missing arguments are bound to
   * null.
   */
  public static Theory ensureTermsKeywordIndexed(Theory theory) {
    final Map<String, List<PredicateDefinition>> definitions = new HashMap<>();
    for (PredicateDefinition pd : theory.predicateDefinitions) {
      definitions.computeIfAbsent(pd.predicate, p -> new ArrayList<>())
          .add(pd);
    }
    final Shuttle reindexer = new Shuttle() {
      @Override
      protected Sentence visit(Term term) {
        final List<PredicateDefinition> pds = definitions.get(term.predicate);
        if (pds == null || pds.size() != 1) {
          return term;
        }
        return term.reindex(pds.get(0).argumentNames());
      }
    };
    final List<SentenceGroup> groups = new ArrayList<>();
    for (SentenceGroup group : theory.sentenceGroups) {
      final List<Sentence> sentences = new ArrayList<>();
      group.sentences.forEach(s -> sentences.add(s.accept(reindexer)));
      groups.add(group.withSentences(sentences));
    }
    return theory.toBuilder().sentenceGroups(groups).build();
  }
}

// End Hierarchy.java
