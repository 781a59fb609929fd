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
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.function.UnaryOperator;
import net.hydromatic.typedlogic.ast.Logic.BooleanSentence;
import net.hydromatic.typedlogic.ast.Logic.QuantifiedSentence;
import net.hydromatic.typedlogic.ast.Logic.Sentence;
import net.hydromatic.typedlogic.ast.Logic.Variable;
import net.hydromatic.typedlogic.ast.Op;
import net.hydromatic.typedlogic.compile.NotInProfileError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts sentences to Horn rules.
 *
 * <p>A Horn rule is an implication "body &rarr; head" where the body is a
 * conjunction of literals and the head is a single term. A rule whose head
 * is {@code Or()} (false) is a goal clause, "{@code :- body}".
 */
public class HornRules {
  private static final Logger LOGGER = LoggerFactory.getLogger(HornRules.class);

  private HornRules() {}

  /** Converts a sentence to Horn rules, allowing neither disjunctive heads
   * nor goal clauses. */
  public static List<Sentence> toHornRules(Sentence sentence) {
    return toHornRules(sentence, false);
  }

  /** Converts a sentence to Horn rules, allowing goal clauses if and only if
   * disjunctions are allowed in the head. */
  public static List<Sentence> toHornRules(Sentence sentence,
      boolean allowDisjunctionsInHead) {
    return toHornRules(sentence, allowDisjunctionsInHead,
        allowDisjunctionsInHead);
  }

  /**
   * Converts a sentence to Horn rules.
   *
   * <p>The sentence is converted to clauses (see {@link
   * Normalizer#toCnfLol(Sentence)}). Each clause is split into positive
   * literals (the head) and negated literals (the body), and becomes one
   * rule:
   *
   * <ul>
   *   <li>the empty clause becomes {@code Or()} (false);
   *   <li>a clause with no positive literal becomes "body &rarr; false" if
   *       goal clauses are allowed, and is dropped otherwise;
   *   <li>a clause with one positive literal becomes "body &rarr; head";
   *   <li>a clause with several positive literals becomes "body &rarr;
   *       Or(heads)" if disjunctions are allowed in the head; otherwise the
   *       last positive literal becomes the head, and the negations of the
   *       others are appended to the body.
   * </ul>
   *
   * <p>The body is the negated literal itself if there is exactly one, and
   * a conjunction of them otherwise.
   */
  public static List<Sentence> toHornRules(Sentence sentence,
      boolean allowDisjunctionsInHead, boolean allowGoalClauses) {
    Sentence s = Rewriter.rewrite(sentence, UnaryOperator.identity());
    s = Normalizer.simplify(s);
    final List<List<Sentence>> clauses = Normalizer.toCnfLol(s);
    final ImmutableList.Builder<Sentence> rules = ImmutableList.builder();
    for (List<Sentence> clause : clauses) {
      final List<Sentence> positive = new ArrayList<>();
      final List<Sentence> negative = new ArrayList<>();
      for (Sentence literal : clause) {
        if (literal.op == Op.NOT) {
          negative.add(((BooleanSentence) literal).negated());
        } else {
          positive.add(literal);
        }
      }
      if (positive.isEmpty() && negative.isEmpty()) {
        rules.add(logic.or());
        continue;
      }
      if (positive.size() > 1 && !allowDisjunctionsInHead) {
        // Not a Horn clause. Keep the last positive literal as the head.
        final Sentence head = positive.get(positive.size() - 1);
        final List<Sentence> body = new ArrayList<>(negative);
        positive.subList(0, positive.size() - 1)
            .forEach(p -> body.add(logic.not(p)));
        LOGGER.debug("clause {} has {} positive literals; using head {}",
            clause, positive.size(), head);
        rules.add(logic.implies(logic.and(body), head));
        continue;
      }
      final Sentence body =
          negative.size() == 1 ? negative.get(0) : logic.and(negative);
      switch (positive.size()) {
      case 0:
        if (allowGoalClauses) {
          rules.add(logic.implies(body, logic.or()));
        } else {
          LOGGER.debug("dropping goal clause {}", clause);
        }
        break;
      case 1:
        rules.add(logic.implies(body, positive.get(0)));
        break;
      default:
        rules.add(logic.implies(body, logic.or(positive)));
      }
    }
    return rules.build();
  }

  /**
   * Splits a sentence into implications suitable for Prolog.
   *
   * <p>Each result is a universally quantified implication whose body is a
   * conjunction and whose head is a term, or a universally quantified term.
   * A conjunction at the top level yields several sentences, as does a
   * conjunction in the head or a disjunction in the body.
   *
   * <p>A part that cannot be converted is dropped, or, if {@code strict},
   * causes {@link NotInProfileError}.
   */
  public static List<Sentence> simplePrologTransform(Sentence sentence,
      boolean strict) {
    Sentence s = Rewriter.rewrite(sentence, Rules::reduceSingleton);
    s = Rewriter.rewrite(s, Rules::eliminateIff);
    final List<Variable> variables;
    if (s.op == Op.FORALL) {
      variables = ((QuantifiedSentence) s).variables;
      s = ((QuantifiedSentence) s).sentence;
    } else {
      variables = ImmutableList.of();
    }
    final Deque<Sentence> stack = new ArrayDeque<>();
    if (s.op == Op.AND) {
      ((BooleanSentence) s).operands.forEach(stack::push);
    } else {
      stack.push(s);
    }
    final ImmutableList.Builder<Sentence> results = ImmutableList.builder();
    while (!stack.isEmpty()) {
      final Sentence s2 = stack.pop();
      switch (s2.op) {
      case TERM:
        results.add(logic.forall(variables, s2));
        continue;

      case IMPLIED:
        final BooleanSentence implied = (BooleanSentence) s2;
        stack.push(logic.implies(implied.antecedent(), implied.consequent()));
        continue;

      case IFF:
        final BooleanSentence iff = (BooleanSentence) s2;
        stack.push(logic.implies(iff.operand(0), iff.operand(1)));
        stack.push(logic.implies(iff.operand(1), iff.operand(0)));
        continue;

      case IMPLIES:
        break;

      default:
        notInProfile(s2, strict);
        continue;
      }
      final BooleanSentence implies = (BooleanSentence) s2;
      final Sentence body = implies.antecedent();
      final Sentence head = implies.consequent();
      if (head.op == Op.AND) {
        ((BooleanSentence) head).operands
            .forEach(h -> stack.push(logic.implies(body, h)));
        continue;
      }
      if (head.op != Op.TERM) {
        notInProfile(s2, strict);
        continue;
      }
      switch (body.op) {
      case OR:
        ((BooleanSentence) body).operands
            .forEach(b -> stack.push(logic.implies(b, head)));
        break;
      case TERM:
        results.add(
            logic.forall(variables, logic.implies(logic.and(body), head)));
        break;
      case AND:
        results.add(logic.forall(variables, s2));
        break;
      default:
        notInProfile(s2, strict);
      }
    }
    return results.build();
  }

  private static void notInProfile(Sentence sentence, boolean strict) {
    if (strict) {
      throw new NotInProfileError("Unsupported sentence " + sentence);
    }
    LOGGER.debug("skipping unsupported sentence {}", sentence);
  }
}

// End HornRules.java
