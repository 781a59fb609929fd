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

import java.util.ArrayList;
import java.util.List;
import net.hydromatic.typedlogic.ast.Logic.BooleanSentence;
import net.hydromatic.typedlogic.ast.Logic.QuantifiedSentence;
import net.hydromatic.typedlogic.ast.Logic.Sentence;
import net.hydromatic.typedlogic.ast.Op;

/**
 * Single-step rewrite rules.
 *
 * <p>Each rule looks only at the root of its argument, and returns the
 * argument unchanged if it does not apply. Use {@link Rewriter#rewrite} to
 * apply a rule to every node.
 */
public class Rules {
  private Rules() {}

  /** Rewrites "a &oplus; b" as "(a &or; b) &and; &not;(a &and; b)". */
  public static Sentence expandXor(Sentence s) {
    if (s.op != Op.XOR) {
      return s;
    }
    return atMostOne(((BooleanSentence) s).operands);
  }

  /**
   * Expands "exactly one of a, b, c, ...".
   *
   * <p>With no operands, the result is false; with one operand, the result is
   * that operand; with two, the same as {@link #expandXor}; with more, a
   * disjunction, over each operand, of that operand and the negation of the
   * disjunction of the others.
   */
  public static Sentence expandExactlyOne(Sentence s) {
    if (s.op != Op.EXACTLY_ONE) {
      return s;
    }
    final List<Sentence> operands = ((BooleanSentence) s).operands;
    switch (operands.size()) {
    case 0:
      return logic.or();
    case 1:
      return operands.get(0);
    case 2:
      return atMostOne(operands);
    default:
      final List<Sentence> list = new ArrayList<>();
      for (int i = 0; i < operands.size(); i++) {
        final List<Sentence> others = new ArrayList<>(operands);
        final Sentence operand = others.remove(i);
        list.add(logic.and(operand, logic.not(logic.or(others))));
      }
      return logic.or(list);
    }
  }

  private static Sentence atMostOne(List<Sentence> operands) {
    return logic.and(logic.or(operands), logic.not(logic.and(operands)));
  }

  /** Rewrites "a &harr; b" as "(a &rarr; b) &and; (b &rarr; a)". */
  public static Sentence eliminateIff(Sentence s) {
    if (s.op != Op.IFF) {
      return s;
    }
    final BooleanSentence b = (BooleanSentence) s;
    return logic.and(logic.implies(b.operand(0), b.operand(1)),
        logic.implies(b.operand(1), b.operand(0)));
  }

  /** Rewrites "a &larr; b" as "b &rarr; a". */
  public static Sentence eliminateImplied(Sentence s) {
    if (s.op != Op.IMPLIED) {
      return s;
    }
    final BooleanSentence b = (BooleanSentence) s;
    return logic.implies(b.antecedent(), b.consequent());
  }

  /** Rewrites "a &rarr; b" as "&not;a &or; b". */
  public static Sentence eliminateImplies(Sentence s) {
    if (s.op != Op.IMPLIES) {
      return s;
    }
    final BooleanSentence b = (BooleanSentence) s;
    return logic.or(logic.not(b.antecedent()), b.consequent());
  }

  /** Rewrites "&not;&not;a" as "a". */
  public static Sentence eliminateDoubleNegation(Sentence s) {
    if (s.op != Op.NOT) {
      return s;
    }
    final Sentence negated = ((BooleanSentence) s).negated();
    return negated.op == Op.NOT ? ((BooleanSentence) negated).negated() : s;
  }

  /**
   * Applies De Morgan's laws.
   *
   * <p>Rewrites "&not;(a &and; b)" as "&not;a &or; &not;b", and
   * "&not;(a &or; b)" as "&not;a &and; &not;b".
   */
  public static Sentence applyDeMorgans(Sentence s) {
    if (s.op != Op.NOT) {
      return s;
    }
    final Sentence negated = ((BooleanSentence) s).negated();
    if (!negated.op.isJunction()) {
      return s;
    }
    final List<Sentence> list = new ArrayList<>();
    ((BooleanSentence) negated).operands.forEach(o -> list.add(logic.not(o)));
    return logic.booleanSentence(negated.op.dual(), list);
  }

  /**
   * Pushes negation through a quantifier.
   *
   * <p>Rewrites "&not;&forall;x. p" as "&exist;x. &not;p", and
   * "&not;&exist;x. p" as "&forall;x. &not;p".
   */
  public static Sentence applyQuantifierNegation(Sentence s) {
    if (s.op != Op.NOT) {
      return s;
    }
    final Sentence negated = ((BooleanSentence) s).negated();
    if (!negated.op.isQuantifier()) {
      return s;
    }
    final QuantifiedSentence q = (QuantifiedSentence) negated;
    return logic.quantified(q.op.dual(), q.variables, logic.not(q.sentence));
  }

  /** Replaces a conjunction or disjunction of one operand with that
   * operand. */
  public static Sentence reduceSingleton(Sentence s) {
    if (s.op.isJunction()) {
      final List<Sentence> operands = ((BooleanSentence) s).operands;
      if (operands.size() == 1) {
        return operands.get(0);
      }
    }
    return s;
  }

  /**
   * Lifts the operands of a nested conjunction (disjunction) into the
   * enclosing conjunction (disjunction).
   *
   * <p>For example, "(a &and; b) &and; c" becomes "a &and; b &and; c". Only
   * one level is flattened.
   */
  public static Sentence flattenNestedConjunctionsAndDisjunctions(
      Sentence s) {
    if (!s.op.isJunction()) {
      return s;
    }
    final BooleanSentence b = (BooleanSentence) s;
    final List<Sentence> list = new ArrayList<>();
    for (Sentence operand : b.operands) {
      if (operand.op == s.op) {
        list.addAll(((BooleanSentence) operand).operands);
      } else {
        list.add(operand);
      }
    }
    return b.copy(list);
  }

  /** Replaces a universally quantified sentence with its body. */
  public static Sentence dropUniversal(Sentence s) {
    return s.op == Op.FORALL ? ((QuantifiedSentence) s).sentence : s;
  }
}

// End Rules.java
