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
import java.util.stream.Collectors;
import net.hydromatic.typedlogic.ast.Logic.BooleanSentence;
import net.hydromatic.typedlogic.ast.Logic.QuantifiedSentence;
import net.hydromatic.typedlogic.ast.Logic.Sentence;
import net.hydromatic.typedlogic.ast.Logic.Term;
import net.hydromatic.typedlogic.ast.Logic.Variable;
import net.hydromatic.typedlogic.ast.Op;
import net.hydromatic.typedlogic.model.Theory;
import net.hydromatic.typedlogic.transform.Rules;
import net.hydromatic.typedlogic.util.Static;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Writes sentences in the first-order form (FOF) of the TPTP language.
 *
 * <p>For example, "&forall;x. p(x) &rarr; q(x)" becomes
 * "{@code ! [X] : (p(X) => q(X))}". Variables are capitalized and predicates
 * are converted to lower case, unless the configuration says otherwise.
 *
 * <p>Negation as failure has no counterpart in TPTP, and causes
 * {@link NotInProfileError}.
 */
public class TptpWriter {
  /** Default configuration. */
  public static final PrologConfig DEFAULT_CONFIG = PrologConfig.DEFAULT;

  /** Writer with the default configuration. */
  public static final TptpWriter DEFAULT = new TptpWriter(DEFAULT_CONFIG);

  private final PrologConfig config;

  public TptpWriter(PrologConfig config) {
    this.config = requireNonNull(config);
  }

  /** Writes a sentence as a TPTP formula. */
  public String write(Sentence sentence) {
    final Sentence s = sentence.canonical();
    switch (s.op) {
    case FORALL:
    case EXISTS:
      final QuantifiedSentence q = (QuantifiedSentence) s;
      return q.variables.stream()
          .map(this::writeVariable)
          .collect(
              Collectors.joining(", ", s.op == Op.FORALL ? "! [" : "? [",
                  "] : "))
          + write(q.sentence);

    case AND:
      return join(s, " & ", "$true");

    case OR:
      return join(s, " | ", "$false");

    case XOR:
      return join(s, " <~> ", "$false");

    case EXACTLY_ONE:
      return write(Rules.expandExactlyOne(s));

    case NOT:
      return "~" + write(((BooleanSentence) s).negated());

    case IMPLIES:
    case IMPLIED:
      final BooleanSentence implies = (BooleanSentence) s;
      return "(" + write(implies.antecedent()) + " => "
          + write(implies.consequent()) + ")";

    case IFF:
      final BooleanSentence iff = (BooleanSentence) s;
      return "(" + write(iff.operand(0)) + " <=> " + write(iff.operand(1))
          + ")";

    case TERM:
      return writeTerm((Term) s);

    default:
      throw new NotInProfileError("Unsupported sentence " + s);
    }
  }

  /**
   * Writes a problem: each sentence of a theory as an axiom, and optionally
   * a conjecture.
   *
   * <p>For example,
   *
   * <blockquote><pre>
   * % Problem: example
   * fof(axiom1, axiom, ! [X] : (p(X) =&gt; q(X))).
   * fof(conjecture, conjecture, ! [X] : (q(X) =&gt; p(X))).
   * </pre></blockquote>
   */
  public String problem(Theory theory, @Nullable Sentence conjecture) {
    final List<String> lines = new ArrayList<>();
    lines.add("% Problem: " + theory.name);
    int i = 0;
    for (Sentence sentence : theory.sentences()) {
      lines.add("fof(axiom" + ++i + ", axiom, " + write(sentence) + ").");
    }
    if (conjecture != null) {
      lines.add("fof(conjecture, conjecture, " + write(conjecture) + ").");
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

  private String writeVariable(Variable v) {
    return config.useLowercaseVars() ? v.name : Static.capitalize(v.name);
  }

  private String writeTerm(Term term) {
    final String predicate = config.formatPredicate(term.predicate);
    final List<@Nullable Object> values = term.values();
    if (values.isEmpty() && !config.includeParensForZeroArgs()) {
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
    return Static.repr(value);
  }
}

// End TptpWriter.java
