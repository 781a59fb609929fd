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
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.typedlogic.ast.Logic.BooleanSentence;
import net.hydromatic.typedlogic.ast.Logic.QuantifiedSentence;
import net.hydromatic.typedlogic.ast.Logic.Sentence;
import net.hydromatic.typedlogic.ast.Logic.Variable;
import net.hydromatic.typedlogic.ast.Op;

/**
 * Normal forms.
 *
 * <p>The main entry point is {@link #toCnf(Sentence, boolean)}, which converts
 * a sentence to conjunctive normal form: a conjunction of disjunctions of
 * literals, where a literal is a term or a negated term.
 */
public class Normalizer {
  private Normalizer() {}

  /**
   * Simplifies a sentence.
   *
   * <ul>
   *   <li>A conjunction or disjunction with one operand becomes that operand;
   *   <li>a conjunction (disjunction) nested in a conjunction (disjunction) is
   *       flattened;
   *   <li>a quantifier nested directly in a quantifier of the same kind is
   *       merged, concatenating the variable lists;
   *   <li>a double negation is removed.
   * </ul>
   *
   * <p>Simplification is applied to all operands; other kinds of sentence are
   * otherwise unchanged.
   */
  public static Sentence simplify(Sentence sentence) {
    final Sentence s = sentence.canonical();
    switch (s.op) {
    case TERM:
      return s;

    case AND:
    case OR:
      final List<Sentence> operands =
          simplifyList(((BooleanSentence) s).operands);
      if (operands.size() == 1) {
        return operands.get(0);
      }
      final List<Sentence> flat = new ArrayList<>();
      for (Sentence operand : operands) {
        if (operand.op == s.op) {
          flat.addAll(((BooleanSentence) operand).operands);
        } else {
          flat.add(operand);
        }
      }
      return ((BooleanSentence) s).copy(flat);

    case NOT:
      final Sentence negated = simplify(((BooleanSentence) s).negated());
      if (negated.op == Op.NOT) {
        return ((BooleanSentence) negated).negated();
      }
      return ((BooleanSentence) s).copy(ImmutableList.of(negated));

    case FORALL:
    case EXISTS:
      final QuantifiedSentence q = (QuantifiedSentence) s;
      if (q.sentence.op == q.op) {
        final QuantifiedSentence inner = (QuantifiedSentence) q.sentence;
        final List<Variable> variables = new ArrayList<>(q.variables);
        variables.addAll(inner.variables);
        return simplify(logic.quantified(q.op, variables, inner.sentence));
      }
      return q.copy(simplify(q.sentence));

    case EXTENSION:
      throw new AssertionError("not canonical: " + s);

    default:
      final BooleanSentence b = (BooleanSentence) s;
      return b.copy(simplifyList(b.operands));
    }
  }

  private static List<Sentence> simplifyList(List<Sentence> sentences) {
    final List<Sentence> list = new ArrayList<>(sentences.size());
    sentences.forEach(s -> list.add(simplify(s)));
    return list;
  }

  /**
   * Distributes conjunction over disjunction, at the root of a sentence.
   *
   * <p>"a &or; (b<sub>1</sub> &and; ... &and; b<sub>n</sub>)" becomes
   * "(b<sub>1</sub> &or; a) &and; ... &and; (b<sub>n</sub> &or; a)".
   * If the sentence is not a disjunction, returns it unchanged.
   */
  public static Sentence distributeAndOverOr(Sentence sentence) {
    if (sentence.op != Op.OR) {
      return sentence;
    }
    return distribute(sentence);
  }

  private static Sentence distribute(Sentence sentence) {
    final Sentence s = simplify(sentence);
    switch (s.op) {
    case OR:
      final List<Sentence> operands = ((BooleanSentence) s).operands;
      int i = 0;
      while (i < operands.size() && operands.get(i).op != Op.AND) {
        ++i;
      }
      if (i == operands.size()) {
        return s;
      }
      final BooleanSentence conj = (BooleanSentence) operands.get(i);
      final List<Sentence> others = new ArrayList<>(operands);
      others.remove(i);
      final Sentence rest = logic.or(others);
      final List<Sentence> mapped = new ArrayList<>();
      for (Sentence c : conj.operands) {
        mapped.add(distribute(logic.or(c, rest)));
      }
      return simplify(logic.and(mapped));

    case AND:
      final List<Sentence> mapped2 = new ArrayList<>();
      for (Sentence operand : ((BooleanSentence) s).operands) {
        mapped2.add(distribute(operand));
      }
      if (mapped2.size() == 1) {
        return mapped2.get(0);
      }
      return simplify(logic.and(mapped2));

    default:
      return s;
    }
  }

  /**
   * Eliminates equivalence and implication.
   *
   * <p>"a &harr; b" becomes "(a &rarr; b) &and; (b &rarr; a)", "a &larr; b"
   * becomes "b &rarr; a", and "a &rarr; b" becomes "&not;a &or; b".
   */
  public static Sentence eliminateAllImplications(Sentence sentence) {
    return Rewriter.rewrite(sentence, Rules::eliminateIff,
        Rules::eliminateImplied, Rules::eliminateImplies);
  }

  /** Converts a sentence to conjunctive normal form, Skolemizing existential
   * variables. */
  public static Sentence toCnf(Sentence sentence) {
    return toCnf(sentence, false);
  }

  /**
   * Converts a sentence to conjunctive normal form.
   *
   * <p>The steps are:
   *
   * <ol>
   *   <li>expand exclusive-or and exactly-one;
   *   <li>eliminate implications;
   *   <li>move negation inwards;
   *   <li>Skolemize, unless {@code skipSkolemization};
   *   <li>drop universal quantifiers;
   *   <li>distribute conjunction over disjunction.
   * </ol>
   *
   * <p>If Skolemization is skipped, existential quantifiers remain.
   */
  public static Sentence toCnf(Sentence sentence, boolean skipSkolemization) {
    Sentence s =
        Rewriter.rewrite(sentence, Rules::expandXor, Rules::expandExactlyOne);
    s = eliminateAllImplications(s);
    s = Rewriter.rewrite(s, Normalizer::moveNegationInwards);
    if (!skipSkolemization) {
      s = Skolemizer.skolemize(s);
    }
    s = Rewriter.rewrite(s, Rules::dropUniversal);
    return Rewriter.rewrite(s, Normalizer::distributeAndOverOr);
  }

  /** Moves a negation one step inwards, through a negation, a conjunction,
   * a disjunction or a quantifier. */
  private static Sentence moveNegationInwards(Sentence s) {
    Sentence s2 = Rules.eliminateDoubleNegation(s);
    if (s2 == s) {
      s2 = Rules.applyDeMorgans(s);
    }
    if (s2 == s) {
      s2 = Rules.applyQuantifierNegation(s);
    }
    return s2;
  }

  /**
   * Converts a sentence to a list of clauses, each a list of literals, without
   * Skolemizing.
   *
   * <p>For example, "(q(x) &and; r(y)) &or; s(z)" becomes
   * "[[q(x), s(z)], [r(y), s(z)]]". Free variables are implicitly universal.
   */
  public static List<List<Sentence>> toCnfLol(Sentence sentence) {
    return toCnfLol(sentence, true);
  }

  /** Converts a sentence to a list of clauses, each a list of literals. */
  public static List<List<Sentence>> toCnfLol(Sentence sentence,
      boolean skipSkolemization) {
    final Sentence s = simplify(toCnf(sentence, skipSkolemization));
    final List<Sentence> clauses =
        s.op == Op.AND ? ((BooleanSentence) s).operands : ImmutableList.of(s);
    final ImmutableList.Builder<List<Sentence>> b = ImmutableList.builder();
    for (Sentence clause : clauses) {
      b.add(clause.op == Op.OR
          ? ((BooleanSentence) clause).operands
          : ImmutableList.of(clause));
    }
    return b.build();
  }
}

// End Normalizer.java
