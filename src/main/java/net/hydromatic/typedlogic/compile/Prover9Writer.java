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
import java.util.Locale;
import java.util.stream.Collectors;
import net.hydromatic.typedlogic.ast.Logic.BooleanSentence;
import net.hydromatic.typedlogic.ast.Logic.QuantifiedSentence;
import net.hydromatic.typedlogic.ast.Logic.Sentence;
import net.hydromatic.typedlogic.ast.Logic.Term;
import net.hydromatic.typedlogic.ast.Logic.Variable;
import net.hydromatic.typedlogic.ast.Op;
import net.hydromatic.typedlogic.model.Theory;
import net.hydromatic.typedlogic.transform.Rules;
import net.hydromatic.typedlogic.util.Fraction;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Writes sentences in the syntax of the Prover9 theorem prover.
 *
 * <p>For example, "&forall;x. P(x) &rarr; Q(x)" becomes
 * "{@code all x ((P(x) -> Q(x)))}".
 *
 * <p>Variables are converted to lower case. String constants become symbols
 * with prefix "s_", and doubles become rational terms.
 */
public class Prover9Writer {
  /** Largest denominator when approximating a double by a fraction. */
  static final long MAX_DENOMINATOR = 1_000_000L;

  /** Writer with the default configuration. */
  public static final Prover9Writer DEFAULT =
      new Prover9Writer(PrologConfig.DEFAULT);

  private final PrologConfig config;

  public Prover9Writer(PrologConfig config) {
    this.config = requireNonNull(config);
  }

  /** Writes a sentence as a Prover9 formula. */
  public String write(Sentence sentence) {
    final Sentence s = sentence.canonical();
    switch (s.op) {
    case FORALL:
    case EXISTS:
      final QuantifiedSentence q = (QuantifiedSentence) s;
      return q.variables.stream()
          .map(Prover9Writer::writeVariable)
          .collect(
              Collectors.joining(" ", s.op == Op.FORALL ? "all " : "exists ",
                  " ("))
          + write(q.sentence) + ")";

    case AND:
      return join(s, " & ", "$T");

    case OR:
      return join(s, " | ", "$F");

    case XOR:
      return write(Rules.expandXor(s));

    case EXACTLY_ONE:
      return write(Rules.expandExactlyOne(s));

    case NOT:
      return "- ( " + write(((BooleanSentence) s).negated()) + " )";

    case IMPLIES:
      final BooleanSentence implies = (BooleanSentence) s;
      return "(" + write(implies.antecedent()) + " -> "
          + write(implies.consequent()) + ")";

    case IMPLIED:
      final BooleanSentence implied = (BooleanSentence) s;
      return "(" + write(implied.consequent()) + " <- "
          + write(implied.antecedent()) + ")";

    case IFF:
      final BooleanSentence iff = (BooleanSentence) s;
      return "(" + write(iff.operand(0)) + " <-> " + write(iff.operand(1))
          + ")";

    case TERM:
      return writeTerm((Term) s);

    default:
      throw new NotInProfileError("Unsupported sentence " + s);
    }
  }

  /**
   * Writes a problem: the assumptions, then the goals.
   *
   * <p>Each sentence of the theory is an assumption; the conjecture, if not
   * null, is a goal.
   */
  public String problem(Theory theory, @Nullable Sentence conjecture) {
    final List<String> lines = new ArrayList<>();
    lines.add("formulas(assumptions).");
    for (Sentence sentence : theory.sentences()) {
      lines.add("    " + write(sentence) + ".");
    }
    lines.add("end_of_list.");
    lines.add("");
    if (conjecture != null) {
      lines.add("formulas(goals).");
      lines.add("    " + write(conjecture) + ".");
      lines.add("end_of_list.");
    }
    return String.join("\n", lines);
  }

  private String join(Sentence s, String separator, String empty) {
    final List<Sentence> operands = ((BooleanSentence) s).operands;
    if (operands.isEmpty()) {
      return empty;
    }
    return operands.stream()
        .map(this::write)
        .collect(Collectors.joining(separator, "(", ")"));
  }

  private static String writeVariable(Variable v) {
    return v.name.toLowerCase(Locale.ROOT);
  }

  private String writeTerm(Term term) {
    final String predicate =
        config.useUppercasePredicates()
            ? term.predicate.toUpperCase(Locale.ROOT)
            : term.predicate;
    final List<@Nullable Object> values = term.values();
    if (values.isEmpty()) {
      return predicate;
    }
    return values.stream()
        .map(this::writeArg)
        .collect(Collectors.joining(", ", predicate + "(", ")"));
  }

  private String writeArg(@Nullable Object value) {
    if (value instanceof Variable) {
      return writeVariable((Variable) value);
    }
    if (value instanceof Term) {
      return writeTerm((Term) value);
    }
    return writeValue(value);
  }

  /** Writes a constant value.
   *
   * <p>A string becomes a symbol: "hello world" becomes "s_hello_world". A
   * double becomes a rational term: 0.75 becomes "rational(3,4)". */
  static String writeValue(@Nullable Object value) {
    if (value == null) {
      return "null";
    }
    if (value instanceof String) {
      return "s_" + ((String) value).replaceAll("[^A-Za-z0-9_]", "_");
    }
    if (value instanceof Double || value instanceof Float) {
      final double d = ((Number) value).doubleValue();
      if (!Double.isFinite(d)) {
        throw new NotInProfileError("Cannot convert " + d + " to rational");
      }
      final Fraction f = Fraction.of(d).limitDenominator(MAX_DENOMINATOR);
      return "rational(" + f.numerator + "," + f.denominator + ")";
    }
    if (value instanceof Boolean) {
      return (Boolean) value ? "True" : "False";
    }
    return value.toString();
  }
}

// End Prover9Writer.java
