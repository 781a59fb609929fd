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

import static net.hydromatic.typedlogic.ast.LogicBuilder.logic;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import net.hydromatic.typedlogic.ast.Logic.Sentence;
import net.hydromatic.typedlogic.ast.Logic.Term;
import net.hydromatic.typedlogic.ast.Logic.Variable;
import net.hydromatic.typedlogic.model.Theory;
import org.junit.jupiter.api.Test;

/** Tests for {@link FolWriter}, {@link TptpWriter} and
 * {@link Prover9Writer}. */
public class WritersTest {
  private final Term p = logic.term("P");
  private final Term q = logic.term("Q");
  private final Variable x = logic.variable("x");
  private final Variable xStr = logic.variable("x", "str");
  private final Variable y = logic.variable("y");

  /** "&forall;x. P(x) &rarr; Q(x)". */
  private Sentence rule() {
    return logic.forall(ImmutableList.of(x),
        logic.implies(logic.term("P", x), logic.term("Q", x)));
  }

  @Test void testFol() {
    final FolWriter w = FolWriter.DEFAULT;
    assertThat(
        w.write(
            logic.forall(ImmutableList.of(xStr),
                logic.implies(logic.term("P", xStr), logic.term("Q", xStr)))),
        is("∀[x:str]. P(x) → Q(x)"));
    assertThat(
        w.write(logic.exists(ImmutableList.of(x, y), logic.term("P", x, y))),
        is("∃[x y]. P(x, y)"));
    assertThat(w.write(logic.and(p, q)), is("P ∧ Q"));
    assertThat(w.write(logic.and()), is("⊤"));
    assertThat(w.write(logic.or(p, q)), is("(P ∨ Q)"));
    assertThat(w.write(logic.or()), is("⊥"));
    assertThat(w.write(logic.xor(p, q)), is("(P ⊕ Q)"));
    assertThat(w.write(logic.exactlyOne(p)), is("P"));
    assertThat(w.write(logic.not(p)), is("¬P"));
    assertThat(w.write(logic.negationAsFailure(p)), is("¬P"));
    assertThat(w.write(logic.implied(p, q)), is("P ← Q"));
    assertThat(w.write(logic.iff(p, q)), is("P ↔ Q"));
    assertThat(w.write(logic.term("lt", x, 3)), is("x < 3"));
    assertThat(w.write(logic.term("P", "a", 1.5, true, null)),
        is("P('a', 1.5, True, None)"));
    assertThat(w.writeAll(ImmutableList.of(p, q)), is("P\nQ"));

    // A conjunction under a negation or an implication is parenthesized
    final Sentence r = logic.term("R");
    assertThat(w.write(logic.not(logic.and(p, q))), is("¬(P ∧ Q)"));
    assertThat(w.write(logic.and(logic.not(p), q)), is("¬P ∧ Q"));
    assertThat(w.write(logic.implies(logic.and(p, q), r)),
        is("(P ∧ Q) → R"));
    assertThat(w.write(logic.implies(r, logic.and(p, q))),
        is("R → (P ∧ Q)"));
    assertThat(w.write(logic.implied(r, logic.and(p, q))),
        is("R ← (P ∧ Q)"));
    assertThat(w.write(logic.iff(logic.and(p, q), r)), is("(P ∧ Q) ↔ R"));
    assertThat(w.write(logic.not(logic.and(p))), is("¬P"));
    assertThat(w.write(logic.implies(logic.and(), r)), is("⊤ → R"));
  }

  @Test void testTptp() {
    final TptpWriter w = TptpWriter.DEFAULT;
    assertThat(w.write(rule()), is("! [X] : (p(X) => q(X))"));
    assertThat(
        w.write(logic.exists(ImmutableList.of(x, y), logic.term("P", x, y))),
        is("? [X, Y] : p(X, Y)"));
    assertThat(w.write(logic.and(p, q)), is("(p & q)"));
    assertThat(w.write(logic.and()), is("$true"));
    assertThat(w.write(logic.or(p, q)), is("(p | q)"));
    assertThat(w.write(logic.or()), is("$false"));
    assertThat(w.write(logic.xor(p, q)), is("(p <~> q)"));
    assertThat(w.write(logic.not(p)), is("~p"));
    assertThat(w.write(logic.implied(p, q)), is("(q => p)"));
    assertThat(w.write(logic.iff(p, q)), is("(p <=> q)"));
    assertThat(w.write(logic.term("P", "a", logic.term("f", x))),
        is("p('a', f(X))"));
    assertThrows(NotInProfileError.class,
        () -> w.write(logic.negationAsFailure(p)));
  }

  @Test void testTptpProblem() {
    final Theory theory = Theory.of("example").add(rule());
    final Sentence conjecture =
        logic.forall(ImmutableList.of(x),
            logic.implies(logic.term("Q", x), logic.term("P", x)));
    assertThat(TptpWriter.DEFAULT.problem(theory, conjecture),
        is("% Problem: example\n"
            + "fof(axiom1, axiom, ! [X] : (p(X) => q(X))).\n"
            + "fof(conjecture, conjecture, ! [X] : (q(X) => p(X)))."));
    assertThat(TptpWriter.DEFAULT.problem(theory, null),
        is("% Problem: example\n"
            + "fof(axiom1, axiom, ! [X] : (p(X) => q(X)))."));
  }

  @Test void testProver9() {
    final Prover9Writer w = Prover9Writer.DEFAULT;
    assertThat(w.write(rule()), is("all x ((P(x) -> Q(x)))"));
    assertThat(
        w.write(logic.exists(ImmutableList.of(x, y), logic.term("P", x, y))),
        is("exists x y (P(x, y))"));
    final Variable bigX = logic.variable("X");
    assertThat(
        w.write(logic.forall(ImmutableList.of(bigX), logic.term("P", bigX))),
        is("all x (P(x))"));
    assertThat(w.write(logic.and(p, q)), is("(P & Q)"));
    assertThat(w.write(logic.and()), is("$T"));
    assertThat(w.write(logic.or(p, q)), is("(P | Q)"));
    assertThat(w.write(logic.or()), is("$F"));
    assertThat(w.write(logic.not(p)), is("- ( P )"));
    assertThat(w.write(logic.implied(p, q)), is("(P <- Q)"));
    assertThat(w.write(logic.iff(p, q)), is("(P <-> Q)"));
    assertThat(w.write(logic.xor(p, q)), is("((P | Q) & - ( (P & Q) ))"));
    assertThrows(NotInProfileError.class,
        () -> w.write(logic.negationAsFailure(p)));

    final PrologConfig config =
        PrologConfig.DEFAULT.withUseUppercasePredicates(true);
    final Prover9Writer upper = new Prover9Writer(config);
    assertThat(upper.write(logic.term("hasParent", x)), is("HASPARENT(x)"));
  }

  @Test void testProver9Values() {
    assertThat(Prover9Writer.writeValue("hello world"), is("s_hello_world"));
    assertThat(Prover9Writer.writeValue("a-b.c"), is("s_a_b_c"));
    assertThat(Prover9Writer.writeValue(0.75), is("rational(3,4)"));
    assertThat(Prover9Writer.writeValue(0.1), is("rational(1,10)"));
    assertThat(Prover9Writer.writeValue(-2.5), is("rational(-5,2)"));
    assertThat(Prover9Writer.writeValue(3L), is("3"));
    assertThat(Prover9Writer.writeValue(true), is("True"));
    assertThat(Prover9Writer.writeValue(null), is("null"));
    assertThrows(NotInProfileError.class,
        () -> Prover9Writer.writeValue(Double.NaN));
    assertThat(
        Prover9Writer.DEFAULT.write(logic.term("Price", "tea", 1.5)),
        is("Price(s_tea, rational(3,2))"));
  }

  @Test void testProver9Problem() {
    final Theory theory = Theory.of("example").add(rule());
    final Sentence goal = logic.exists(ImmutableList.of(x),
        logic.term("Q", x));
    assertThat(Prover9Writer.DEFAULT.problem(theory, goal),
        is("formulas(assumptions).\n"
            + "    all x ((P(x) -> Q(x))).\n"
            + "end_of_list.\n"
            + "\n"
            + "formulas(goals).\n"
            + "    exists x (Q(x)).\n"
            + "end_of_list."));
    assertThat(Prover9Writer.DEFAULT.problem(theory, null),
        is("formulas(assumptions).\n"
            + "    all x ((P(x) -> Q(x))).\n"
            + "end_of_list.\n"));
  }
}

// End WritersTest.java
