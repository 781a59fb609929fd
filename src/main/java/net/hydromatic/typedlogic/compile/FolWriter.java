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

import java.util.List;
import java.util.stream.Collectors;
import net.hydromatic.typedlogic.ast.Logic.BooleanSentence;
import net.hydromatic.typedlogic.ast.Logic.QuantifiedSentence;
import net.hydromatic.typedlogic.ast.Logic.Sentence;
import net.hydromatic.typedlogic.ast.Logic.Term;
import net.hydromatic.typedlogic.ast.Logic.Variable;
import net.hydromatic.typedlogic.ast.Op;
import net.hydromatic.typedlogic.transform.Rules;
import net.hydromatic.typedlogic.util.Json;
import net.hydromatic.typedlogic.util.Static;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Writes sentences in first-order logic notation.
 *
 * <p>For example, "{@code ∀[x:str]. P(x) → Q(x)}".
 *
 * <p>Every sentence can be written; this writer never throws
 * {@link NotInProfileError}.
 */
public class FolWriter {
  /** Default configuration: variables and predicates as they are. */
  public static final PrologConfig DEFAULT_CONFIG =
      PrologConfig.DEFAULT.withUseLowercaseVars(true)
          .withUsePredicatesAsIs(true);

  /** Writer with the default configuration. */
  public static final FolWriter DEFAULT = new FolWriter(DEFAULT_CONFIG);

  private final PrologConfig config;

  public FolWriter(PrologConfig config) {
    this.config = requireNonNull(config);
  }

  /** Writes a sentence. */
  public String write(Sentence sentence) {
    final Sentence s = sentence.canonical();
    switch (s.op) {
    case FORALL:
    case EXISTS:
      final QuantifiedSentence q = (QuantifiedSentence) s;
      return q.variables.stream()
          .map(v -> v.domain == null ? v.name : v.name + ":" + v.domain)
          .collect(
              Collectors.joining(" ", s.op == Op.FORALL ? "∀[" : "∃[",
                  "]. "))
          + write(q.sentence);

    case AND:
      return join(s, " ∧ ", "", "", "⊤");

    case OR:
      return join(s, " ∨ ", "(", ")", "⊥");

    case XOR:
      return join(s, " ⊕ ", "(", ")", "⊥");

    case EXACTLY_ONE:
      return write(Rules.expandExactlyOne(s));

    case NOT:
    case NEGATION_AS_FAILURE:
      return "¬" + writeOperand(((BooleanSentence) s).negated());

    case IMPLIES:
      final BooleanSentence implies = (BooleanSentence) s;
      return writeOperand(implies.antecedent()) + " → "
          + writeOperand(implies.consequent());

    case IMPLIED:
      final BooleanSentence implied = (BooleanSentence) s;
      return writeOperand(implied.consequent()) + " ← "
          + writeOperand(implied.antecedent());

    case IFF:
      final BooleanSentence iff = (BooleanSentence) s;
      return writeOperand(iff.operand(0)) + " ↔ "
          + writeOperand(iff.operand(1));

    case TERM:
      return writeTerm((Term) s);

    default:
      throw new AssertionError("unexpected " + s.op);
    }
  }

  /** Writes a list of sentences, one per line. */
  public String writeAll(List<? extends Sentence> sentences) {
    return sentences.stream()
        .map(this::write)
        .collect(Collectors.joining("\n"));
  }

  /** Writes the operand of a negation or implication. A conjunction of
   * two or more sentences is parenthesized; other forms bind tightly enough
   * already. */
  private String writeOperand(Sentence s) {
    final Sentence c = s.canonical();
    if (c.op == Op.AND && ((BooleanSentence) c).operands.size() > 1) {
      return "(" + write(c) + ")";
    }
    return write(c);
  }

  private String join(Sentence s, String separator, String prefix,
      String suffix, String empty) {
    final List<Sentence> operands = ((BooleanSentence) s).operands;
    if (operands.isEmpty()) {
      return empty;
    }
    return operands.stream()
        .map(this::write)
        .collect(Collectors.joining(separator, prefix, suffix));
  }

  private String writeTerm(Term term) {
    final List<@Nullable Object> values = term.values();
    final String operator = config.operator(term.predicate);
    if (operator != null) {
      switch (values.size()) {
      case 2:
        return writeArg(values.get(0)) + " " + operator + " "
            + writeArg(values.get(1));
      case 1:
        return operator + " " + writeArg(values.get(0));
      default:
        break;
      }
    }
    final String predicate = config.formatPredicate(term.predicate);
    if (values.isEmpty() && !config.includeParensForZeroArgs()) {
      return predicate;
    }
    return values.stream()
        .map(this::writeArg)
        .collect(Collectors.joining(", ", predicate + "(", ")"));
  }

  private String writeArg(@Nullable Object value) {
    if (value instanceof Variable) {
      final String name = ((Variable) value).name;
      return config.useLowercaseVars() ? name : Static.capitalize(name);
    }
    if (value instanceof Term) {
      return writeTerm((Term) value);
    }
    return config.doubleQuoteStrings()
        ? Json.str(value)
        : Static.repr(value);
  }
}

// End FolWriter.java
