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
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasToString;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import net.hydromatic.typedlogic.ast.Logic.Sentence;
import net.hydromatic.typedlogic.ast.Logic.Term;
import net.hydromatic.typedlogic.ast.Logic.Variable;
import net.hydromatic.typedlogic.compile.NotInProfileError;
import org.junit.jupiter.api.Test;

/** Tests for {@link HornRules}. */
public class HornRulesTest {
  private final Term a = logic.term("A");
  private final Term b = logic.term("B");
  private final Term p = logic.term("P");
  private final Term q = logic.term("Q");
  private final Term r = logic.term("R");

  @Test void testToHornRules() {
    assertThat(HornRules.toHornRules(logic.implies(logic.and(p, q), r)),
        hasToString("[Implies(And(P, Q), R)]"));
    assertThat(HornRules.toHornRules(logic.implies(p, r)),
        hasToString("[Implies(P, R)]"));
    // A fact has an empty body
    assertThat(HornRules.toHornRules(p), hasToString("[Implies(And(), P)]"));
    // A conjunction in the head yields two rules
    assertThat(HornRules.toHornRules(logic.implies(p, logic.and(q, r))),
        hasToString("[Implies(P, Q), Implies(P, R)]"));
  }

  @Test void testMultiplePositiveLiterals() {
    final Sentence s = logic.or(a, b);
    // Last literal becomes the head
    assertThat(HornRules.toHornRules(s),
        hasToString("[Implies(And(Not(A)), B)]"));
    assertThat(HornRules.toHornRules(s, true),
        hasToString("[Implies(And(), Or(A, B))]"));
  }

  @Test void testGoalClauses() {
    final Sentence s = logic.not(a);
    assertThat(HornRules.toHornRules(s), empty());
    assertThat(HornRules.toHornRules(s, false, true),
        hasToString("[Implies(A, Or())]"));
    assertThat(HornRules.toHornRules(s, true),
        hasToString("[Implies(A, Or())]"));
  }

  @Test void testEmptyClause() {
    assertThat(HornRules.toHornRules(logic.or()), hasToString("[Or()]"));
  }

  @Test void testSimplePrologTransform() {
    final Variable x = logic.variable("x");
    final Sentence s =
        logic.forall(ImmutableList.of(x),
            logic.implies(logic.term("P", x),
                logic.and(logic.term("Q", x), logic.term("R", x))));
    assertThat(HornRules.simplePrologTransform(s, true),
        hasToString("[Forall([x] : Implies(And(P(?x)), R(?x))), "
            + "Forall([x] : Implies(And(P(?x)), Q(?x)))]"));

    // Disjunction in the body yields a rule per disjunct
    assertThat(
        HornRules.simplePrologTransform(logic.implies(logic.or(p, q), r),
            true),
        hasToString("[Forall([] : Implies(And(Q), R)), "
            + "Forall([] : Implies(And(P), R))]"));

    // Conjunction at the top level
    assertThat(
        HornRules.simplePrologTransform(logic.and(logic.implies(p, q), r),
            true),
        hasToString("[Forall([] : R), Forall([] : Implies(And(P), Q))]"));

    // Equivalence yields rules in both directions
    assertThat(HornRules.simplePrologTransform(logic.iff(p, q), true),
        hasToString("[Forall([] : Implies(And(Q), P)), "
            + "Forall([] : Implies(And(P), Q))]"));

    // Conjunction in the body is kept
    final Sentence rule = logic.implies(logic.and(p, q), r);
    assertThat(HornRules.simplePrologTransform(rule, true),
        hasToString("[Forall([] : Implies(And(P, Q), R))]"));
  }

  @Test void testSimplePrologTransformStrict() {
    final Sentence or = logic.or(p, q);
    assertThrows(NotInProfileError.class,
        () -> HornRules.simplePrologTransform(or, true));
    assertThat(HornRules.simplePrologTransform(or, false), empty());

    final Sentence disjunctiveHead = logic.implies(p, logic.or(q, r));
    assertThrows(NotInProfileError.class,
        () -> HornRules.simplePrologTransform(disjunctiveHead, true));
    assertThat(HornRules.simplePrologTransform(disjunctiveHead, false),
        empty());
  }
}

// End HornRulesTest.java
