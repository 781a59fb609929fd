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

import static net.hydromatic.typedlogic.ast.LogicBuilder.logic;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.typedlogic.ast.Logic;
import net.hydromatic.typedlogic.ast.Logic.QuantifiedSentence;
import net.hydromatic.typedlogic.ast.Logic.Sentence;
import net.hydromatic.typedlogic.ast.Logic.Term;
import net.hydromatic.typedlogic.ast.Logic.Variable;
import net.hydromatic.typedlogic.ast.Op;
import net.hydromatic.typedlogic.ast.Shuttle;
import net.hydromatic.typedlogic.util.NameGenerator;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Replaces existentially quantified variables with Skolem function terms.
 *
 * <p>Each variable of an {@code Exists} that is not already universally
 * quantified is replaced by a term "sk__<i>n</i>(u<sub>1</sub>, ...,
 * u<sub>k</sub>)" whose arguments are the universally quantified variables in
 * scope. The {@code Exists} is removed; {@code Forall} is kept.
 *
 * <p>For example, "&forall;x. &exist;y, z. p(x, y, z)" becomes
 * "&forall;x. p(x, sk__1(x), sk__2(x))".
 *
 * <p>The counter that numbers Skolem functions belongs to one call of
 * {@link #skolemize(Sentence)}, and is shared by all branches of the
 * sentence, so numbers are unique within the result.
 */
public class Skolemizer extends Shuttle {
  private final NameGenerator nameGenerator;
  private final ImmutableList<Variable> universals;
  private final ImmutableMap<String, Term> substitutions;

  private Skolemizer(NameGenerator nameGenerator,
      ImmutableList<Variable> universals,
      ImmutableMap<String, Term> substitutions) {
    this.nameGenerator = nameGenerator;
    this.universals = universals;
    this.substitutions = substitutions;
  }

  /** Skolemizes a sentence. */
  public static Sentence skolemize(Sentence sentence) {
    final Skolemizer skolemizer =
        new Skolemizer(new NameGenerator(Logic.SKOLEM_PREFIX),
            ImmutableList.of(), ImmutableMap.of());
    return sentence.accept(skolemizer);
  }

  @Override
  protected Sentence visit(QuantifiedSentence q) {
    if (q.op == Op.FORALL) {
      final Skolemizer skolemizer =
          new Skolemizer(nameGenerator,
              ImmutableList.<Variable>builder().addAll(universals)
                  .addAll(q.variables).build(),
              substitutions);
      return q.copy(q.sentence.accept(skolemizer));
    }
    final Map<String, Term> map = new LinkedHashMap<>(substitutions);
    for (Variable v : q.variables) {
      if (!universals.contains(v)) {
        map.put(v.name, logic.term(nameGenerator.get(), universals));
      }
    }
    return q.sentence.accept(
        new Skolemizer(nameGenerator, universals, ImmutableMap.copyOf(map)));
  }

  @Override
  protected Sentence visit(Term term) {
    return substitute(term);
  }

  private Term substitute(Term term) {
    if (substitutions.isEmpty()) {
      return term;
    }
    final List<@Nullable Object> values = new ArrayList<>();
    boolean changed = false;
    for (Object value : term.values()) {
      Object value2 = value;
      if (value instanceof Variable) {
        final Term skolemTerm = substitutions.get(((Variable) value).name);
        if (skolemTerm != null) {
          value2 = skolemTerm;
        }
      } else if (value instanceof Term) {
        value2 = substitute((Term) value);
      }
      changed |= value2 != value;
      values.add(value2);
    }
    return changed ? term.withValues(values) : term;
  }
}

// End Skolemizer.java
