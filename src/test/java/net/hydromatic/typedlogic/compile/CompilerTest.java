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
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.startsWith;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import net.hydromatic.typedlogic.TestUtils;
import net.hydromatic.typedlogic.ast.Logic.Sentence;
import net.hydromatic.typedlogic.ast.Logic.Term;
import net.hydromatic.typedlogic.ast.Logic.Variable;
import net.hydromatic.typedlogic.model.Theory;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

/** Tests for {@link Compiler} and its subclasses, and for
 * {@link Compilers}. */
public class CompilerTest {
  @Test void testProlog() {
    final String expected = "%% Predicate Definitions\n"
        + "% Parent(parent: Name, child: Name)\n"
        + "% Ancestor(ancestor: Name, descendant: Name)\n"
        + "\n"
        + "%% Rules\n"
        + "\n"
        + "ancestor(X, Y) :- parent(X, Y).\n"
        + "ancestor(X, Z) :- parent(X, Y), ancestor(Y, Z).\n"
        + "\n"
        + "%% Facts\n"
        + "\n"
        + "parent('Alice', 'Bob').\n"
        + "parent('Bob', 'Carol').\n"
        + "\n"
        + "%% Goals\n"
        + "\n"
        + "%% UNTRANSLATABLE: ∃[z:str]. Ancestor('Alice', z)";
    final Compiler compiler = Compilers.lookup("prolog");
    assertThat(compiler.suffix(), is("pro"));
    assertThat(compiler.compile(TestUtils.ancestry()), is(expected));

    // Horn rules are extracted without Skolemization, so the existential
    // goal has no rule form, even if Skolem terms are allowed
    final Compiler compiler2 =
        Compilers.lookup("prolog", ImmutableMap.of("allowSkolemTerms", true));
    assertThat(compiler2.compile(TestUtils.ancestry()), is(expected));
  }

  @Test void testPrologStrict() {
    final Compiler compiler =
        Compilers.lookup("prolog", ImmutableMap.of("strict", true));
    assertThat(compiler, hasToString("PrologCompiler{strict: true}"));
    final NotInProfileError e =
        assertThrows(NotInProfileError.class,
            () -> compiler.compile(TestUtils.ancestry()));
    assertThat(e.getMessage(), startsWith("Head of rule must be a term"));
  }

  @Test void testCompileSentence() {
    final Sentence s = logic.implies(logic.term("P"), logic.term("Q"));
    assertThat(Compilers.lookup("prolog").compileSentence(s),
        is("%% Predicate Definitions\n\n%% Sentences\n\nq :- p."));
    assertThat(Compilers.lookup("fol").compileSentence(s), is("P → Q"));
    assertThat(Compilers.lookup("tptp").compileSentence(s),
        is("% Problem: null\nfof(axiom1, axiom, (p => q))."));
  }

  @Test void testTptp() {
    final Compiler compiler = Compilers.lookup("tptp");
    assertThat(compiler.suffix(), is("tptp"));
    assertThat(compiler.compile(TestUtils.ancestry()),
        is("% Problem: ancestry\n"
            + "fof(axiom1, axiom, ! [X, Y] : (parent(X, Y) => "
            + "ancestor(X, Y))).\n"
            + "fof(axiom2, axiom, ! [X, Y, Z] : ((parent(X, Y) & "
            + "ancestor(Y, Z)) => ancestor(X, Z))).\n"
            + "fof(axiom3, axiom, parent('Alice', 'Bob')).\n"
            + "fof(axiom4, axiom, parent('Bob', 'Carol')).\n"
            + "fof(conjecture1, conjecture, ? [Z] : ancestor('Alice', Z))."));
  }

  @Test void testTptpUntranslatable() {
    final Term p = logic.term("P");
    final Theory theory =
        Theory.of("t").add(logic.negationAsFailure(p)).add(p);
    assertThat(Compilers.lookup("tptp").compile(theory),
        is("% Problem: t\n"
            + "% UNTRANSLATABLE: ¬P\n"
            + "fof(axiom1, axiom, p)."));
    assertThrows(NotInProfileError.class,
        () -> Compilers.lookup("tptp", ImmutableMap.of("strict", "true"))
            .compile(theory));
  }

  @Test void testProver9() {
    final Compiler compiler = Compilers.lookup("prover9");
    assertThat(compiler.suffix(), is("prover9"));
    final String expected = "% Problem: ancestry\n"
        + "formulas(assumptions).\n"
        + "    all x y ((Parent(x, y) -> Ancestor(x, y))).\n"
        + "    all x y z (((Parent(x, y) & Ancestor(y, z)) -> "
        + "Ancestor(x, z))).\n"
        + "    Parent(s_Alice, s_Bob).\n"
        + "    Parent(s_Bob, s_Carol).\n"
        + "end_of_list.\n"
        + "\n"
        + "formulas(goals).\n"
        + "    exists z (Ancestor(s_Alice, z)).\n"
        + "end_of_list.";
    assertThat(compiler.compile(TestUtils.ancestry()), is(expected));

    // Extra goals follow the goals of the theory
    final Variable x = logic.variable("x");
    final Sentence goal =
        logic.exists(ImmutableList.of(x), logic.term("Parent", x, "Carol"));
    assertThat(
        ((Prover9Compiler) compiler).compile(TestUtils.ancestry(),
            ImmutableList.of(goal)),
        is(expected.replace("end_of_list.\n\nformulas(goals).\n"
                + "    exists z (Ancestor(s_Alice, z)).\n",
            "end_of_list.\n\nformulas(goals).\n"
                + "    exists z (Ancestor(s_Alice, z)).\n"
                + "    exists x (Parent(x, s_Carol)).\n")));

    final Theory theory =
        Theory.of("t").add(logic.negationAsFailure(logic.term("P")));
    assertThat(compiler.compile(theory),
        is("% Problem: t\n"
            + "formulas(assumptions).\n"
            + "% UNTRANSLATABLE: ¬P\n"
            + "end_of_list.\n"
            + "\n"
            + "formulas(goals).\n"
            + "end_of_list."));
  }

  @Test void testFol() {
    final Compiler compiler = Compilers.lookup("fol");
    assertThat(compiler.suffix(), is("fol"));
    assertThat(compiler.compile(TestUtils.ancestry()),
        is("∀[x:str y:str]. Parent(x, y) → Ancestor(x, y)\n"
            + "∀[x:str y:str z:str]. (Parent(x, y) ∧ Ancestor(y, z)) "
            + "→ Ancestor(x, z)\n"
            + "Parent('Alice', 'Bob')\n"
            + "Parent('Bob', 'Carol')\n"
            + "∃[z:str]. Ancestor('Alice', z)"));
    // Properties override the defaults of the FOL compiler
    assertThat(
        Compilers.lookup("fol", ImmutableMap.of("useLowercaseVars", false))
            .compileSentence(logic.term("P", logic.variable("x"))),
        is("P(X)"));
  }

  @Test void testSexpr() {
    final Compiler compiler = Compilers.lookup("sexpr");
    assertThat(compiler.suffix(), is("sexpr"));
    final Sentence s = logic.term("P", logic.variable("x"), 1);
    assertThat(compiler.compileSentence(s),
        is("(P\n"
            + "  (Variable\n"
            + "    \"x\")\n"
            + "  1)"));
    assertThat(
        compiler.compileSentence(logic.not(logic.term("Q", "a b"))),
        is("(Not\n"
            + "  (Q\n"
            + "    \"a b\"))"));
    assertThat(compiler.compile(TestUtils.ancestry()),
        startsWith("(Theory\n  (name\n    \"ancestry\")"));
    assertThrows(IllegalArgumentException.class,
        () -> SexprCompiler.render(ImmutableMap.of("a", 1)));
  }

  @Test void testYaml() {
    final Compiler compiler = Compilers.lookup("yaml");
    assertThat(compiler.suffix(), is("yaml"));
    final Theory theory = TestUtils.ancestry();
    final String yaml = compiler.compile(theory);
    assertThat(yaml, startsWith("type: Theory\nname: ancestry\n"));
    assertThat(YamlCompiler.parseTheory(yaml), is(theory));

    final Sentence s =
        logic.forall(ImmutableList.of(logic.variable("x", "int")),
            logic.implies(
                logic.term("P", logic.variable("x"), "1", 2, 2.5, true,
                    null),
                logic.negationAsFailure(logic.term("Q"))));
    assertThat(YamlCompiler.parse(compiler.compileSentence(s)), is(s));

    assertThrows(IllegalArgumentException.class,
        () -> YamlCompiler.parseTheory(compiler.compileSentence(s)));

    // Plain words are unquoted; strings that look like other scalars are
    // quoted
    final String yaml2 =
        compiler.compileSentence(logic.term("P", "Alice", "0x10", "yes"));
    assertThat(yaml2, containsString("- Alice\n"));
    assertThat(yaml2, containsString("- \"0x10\"\n"));
    assertThat(yaml2, containsString("- \"yes\""));
  }

  /** A string that a YAML reader could take for a number, boolean or null
   * comes back as the same string, both as a term argument and as a theory
   * constant. */
  @ParameterizedTest
  @ValueSource(strings = {"0x10", "0o17", "1e3", "1_000", "+1", "-2.5", "1",
      ".inf", "-.inf", ".NaN", "true", "True", "yes", "off", "y", "null",
      "Null", "~", "", " ", "a b", "- x", "k: v", "#c", "'q'", "Alice",
      "two\nlines"})
  void testYamlStringRoundTrip(String value) {
    final Compiler compiler = Compilers.lookup("yaml");
    final Term term = logic.term("P", value);
    final Object parsed = YamlCompiler.parse(compiler.compileSentence(term));
    assertThat(parsed, is(term));
    assertThat(((Term) parsed).values().get(0), is(value));

    final Theory theory =
        Theory.builder().name("t").constant("c", value).build();
    final Theory theory2 = YamlCompiler.parseTheory(compiler.compile(theory));
    assertThat(theory2, is(theory));
    assertThat(theory2.constants.get("c"), is(value));
  }

  /** Compiling the same theory twice gives the same text. */
  @Test void testDeterministic() {
    for (String name : Compilers.names()) {
      final Compiler compiler = Compilers.lookup(name);
      assertThat(name, compiler.compile(TestUtils.ancestry()),
          is(compiler.compile(TestUtils.ancestry())));
    }
  }

  @Test void testCompilers() {
    assertThat(Compilers.names(),
        hasToString("[prolog, tptp, prover9, fol, sexpr, yaml]"));
    assertThat(Compilers.lookup("prolog"), instanceOf(PrologCompiler.class));
    assertThat(Compilers.lookup("yaml"), instanceOf(YamlCompiler.class));
    assertThat(Compilers.lookup("sexpr"),
        hasToString("SexprCompiler{strict: false}"));
    final IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class,
            () -> Compilers.lookup("cobol"));
    assertThat(e.getMessage(),
        is("Unknown compiler 'cobol'; expected one of "
            + "[prolog, tptp, prover9, fol, sexpr, yaml]"));
    assertThrows(IllegalArgumentException.class,
        () -> Compilers.lookup("prolog", ImmutableMap.of("colour", "red")));
  }

  @Test void testCompileToFile(@TempDir Path dir) throws IOException {
    final Path path = dir.resolve("ancestry.fol");
    Compilers.lookup("fol").compile(TestUtils.ancestry(), path);
    final String text =
        new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
    assertThat(text,
        is(Compilers.lookup("fol").compile(TestUtils.ancestry())));
  }
}

// End CompilerTest.java
