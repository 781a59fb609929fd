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
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import net.hydromatic.typedlogic.ast.Logic.BooleanSentence;
import net.hydromatic.typedlogic.ast.Logic.QuantifiedSentence;
import net.hydromatic.typedlogic.ast.Logic.Sentence;
import net.hydromatic.typedlogic.ast.Logic.Term;
import net.hydromatic.typedlogic.ast.Logic.Variable;
import net.hydromatic.typedlogic.ast.Op;
import net.hydromatic.typedlogic.transform.HornRules;
import net.hydromatic.typedlogic.util.Json;
import net.hydromatic.typedlogic.util.Static;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Writes sentences in Prolog syntax.
 *
 * <p>A sentence at the top level must be a term (a fact) or an implication
 * (a rule), optionally universally quantified. For example,
 * "&forall;x. p(x) &and; q(x) &rarr; r(x)" becomes "{@code r(X) :- p(X),
 * q(X).}".
 *
 * <p>A sentence that is not of this form can be converted to Horn rules first
 * by calling {@link #write(Sentence, boolean)} with {@code translate} true.
 * A sentence that cannot be written causes {@link NotInProfileError}.
 */
public class PrologWriter {
  private final PrologConfig config;

  public PrologWriter(PrologConfig config) {
    this.config = requireNonNull(config);
  }

  /** Writes a sentence. */
  public String write(Sentence sentence) {
    return write(sentence, false);
  }

  /** Writes a sentence, optionally converting it to Horn rules first.
   *
   * <p>If {@code translate}, writes one line per rule. */
  public String write(Sentence sentence, boolean translate) {
    if (translate) {
      final List<Sentence> rules =
          HornRules.toHornRules(sentence, config.disjunctiveDatalog());
      return writeAll(rules);
    }
    return write(sentence, 0);
  }

  /** Writes a list of sentences, one per line. */
  public String writeAll(List<? extends Sentence> sentences) {
    return sentences.stream()
        .map(s -> write(s, 0))
        .collect(Collectors.joining("\n"));
  }

  private String write(Sentence sentence, int depth) {
    Sentence s = sentence.canonical();
    if (s.op == Op.FORALL) {
      s = ((QuantifiedSentence) s).sentence;
    }
    if (depth == 0 && s.op != Op.IMPLIES && s.op != Op.TERM) {
      throw new NotInProfileError("Top level sentence must be an implication "
          + "or a term: " + s);
    }
    if (s.op == Op.EXISTS && depth > 0) {
      s = ((QuantifiedSentence) s).sentence;
    }
    switch (s.op) {
    case AND:
      final List<Sentence> conjuncts = ((BooleanSentence) s).operands;
      if (conjuncts.isEmpty()) {
        return "true";
      }
      return conjuncts.stream()
          .map(c -> write(c, depth + 1))
          .collect(Collectors.joining(", "));

    case OR:
      final List<Sentence> disjuncts = ((BooleanSentence) s).operands;
      if (disjuncts.isEmpty()) {
        return "fail";
      }
      return paren(
          disjuncts.stream()
              .map(d -> write(d, depth + 1))
              .collect(Collectors.joining("; ")));

    case NOT:
      return config.negationSymbol() + " "
          + paren(write(((BooleanSentence) s).negated(), depth + 1));

    case NEGATION_AS_FAILURE:
      return config.negationAsFailureSymbol() + " "
          + paren(write(((BooleanSentence) s).negated(), depth + 1));

    case TERM:
      return writeTerm((Term) s, depth);

    case IMPLIES:
      return writeRule((BooleanSentence) s, depth);

    default:
      throw new NotInProfileError("Unsupported sentence " + s);
    }
  }

  private String paren(String s) {
    return config.allowNesting() ? "(" + s + ")" : s;
  }

  private String writeTerm(Term term, int depth) {
    final List<@Nullable Object> values = term.values();
    if (!config.allowSkolemTerms()) {
      for (Object value : values) {
        if (value instanceof Term && ((Term) value).isSkolem()) {
          throw new NotInProfileError("Skolem term not supported: " + term);
        }
      }
    }
    final String operator = config.operator(term.predicate);
    if (operator != null) {
      switch (values.size()) {
      case 2:
        return writeArg(values.get(0), depth) + " " + operator + " "
            + writeArg(values.get(1), depth);
      case 1:
        return operator + " " + writeArg(values.get(0), depth);
      default:
        throw new NotInProfileError("Operator " + operator
            + " only supports 1 or 2 arguments: " + term);
      }
    }
    final String predicate = config.formatPredicate(term.predicate);
    if (values.isEmpty() && !config.includeParensForZeroArgs()) {
      return predicate;
    }
    return values.stream()
        .map(v -> writeArg(v, depth))
        .collect(Collectors.joining(", ", predicate + "(", ")"));
  }

  private String writeArg(@Nullable Object value, int depth) {
    if (value == null) {
      return depth > 0 ? "_" : config.nullTerm();
    }
    if (value instanceof Variable) {
      final String name = ((Variable) value).name;
      return config.useLowercaseVars() ? name : Static.capitalize(name);
    }
    if (value instanceof Term) {
      if (!config.allowFunctionTerms()) {
        throw new NotInProfileError("Nested term not supported: " + value);
      }
      return write((Term) value, depth + 1);
    }
    return config.doubleQuoteStrings()
        ? Json.str(value)
        : Static.repr(value);
  }

  /** Writes an implication "body &rarr; head" as "head :- body.". */
  private String writeRule(BooleanSentence implies, int depth) {
    final Sentence consequent = implies.consequent();
    final Sentence antecedent = implies.antecedent();
    if (consequent.op == Op.OR
        && ((BooleanSentence) consequent).operands.size() > 1
        && !config.disjunctiveDatalog()) {
      throw new NotInProfileError("Disjunctions on LHS not allowed "
          + implies);
    }
    if (consequent.op == Op.AND) {
      throw new NotInProfileError("Conjunctions on LHS not allowed "
          + implies);
    }

    // Every variable in the head must occur in a term in the body.
    final Set<String> bodyVariables = new HashSet<>();
    for (Sentence conjunct : operands(antecedent, Op.AND)) {
      if (conjunct.op == Op.EXISTS) {
        conjunct = ((QuantifiedSentence) conjunct).sentence;
      }
      if (conjunct.op == Op.TERM) {
        bodyVariables.addAll(((Term) conjunct).variableNames());
      }
    }
    for (Sentence head : operands(consequent, Op.OR)) {
      if (head.op == Op.NOT) {
        continue;
      }
      if (head.op != Op.TERM) {
        throw new NotInProfileError("Head of rule must be a term: " + head);
      }
      for (String name : ((Term) head).variableNames()) {
        if (!bodyVariables.contains(name)) {
          throw new NotInProfileError("Variable " + name
              + " in head not in body " + implies);
        }
      }
    }

    String head = write(consequent, depth + 1);
    final String body = write(antecedent, depth + 1);
    if (head.startsWith("(") && head.endsWith(")")) {
      head = head.substring(1, head.length() - 1);
    }
    if (body.equals("true")) {
      return head + ".";
    }
    if (head.equals("fail")) {
      return ":- " + body + ".";
    }
    return head + " :- " + body + ".";
  }

  /** Returns the operands of a sentence if it has a given operator,
   * otherwise a list containing just the sentence. */
  private static List<Sentence> operands(Sentence s, Op op) {
    return s.op == op
        ? ((BooleanSentence) s).operands
        : ImmutableList.of(s);
  }
}

// End PrologWriter.java
