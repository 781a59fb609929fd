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

import static java.util.Objects.requireNonNull;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;
import net.hydromatic.typedlogic.ast.Logic.BooleanSentence;
import net.hydromatic.typedlogic.ast.Logic.QuantifiedSentence;
import net.hydromatic.typedlogic.ast.Logic.Sentence;
import net.hydromatic.typedlogic.ast.Logic.Term;
import net.hydromatic.typedlogic.ast.Logic.Variable;
import net.hydromatic.typedlogic.ast.Shuttle;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Applies rewrite rules to every node of a sentence.
 *
 * <p>A rule is a function from a sentence to a sentence. It returns its
 * argument (or null) if it does not apply.
 */
public class Rewriter {
  private Rewriter() {}

  /**
   * Rewrites a sentence using a rule.
   *
   * <p>The rule is applied to the sentence. If the result is different, the
   * result is rewritten in turn; this continues until the rule no longer
   * changes the node. Then the node is rebuilt from its rewritten children.
   * Terms are leaves. Extensions are converted to model objects first.
   *
   * <p>A rule that keeps producing different sentences will not terminate.
   */
  public static Sentence rewrite(Sentence sentence,
      UnaryOperator<Sentence> rule) {
    final Sentence s = sentence.canonical();
    final @Nullable Sentence s2 = rule.apply(s);
    if (s2 != null && !s2.equals(s)) {
      return rewrite(s2, rule);
    }
    switch (s.op) {
    case TERM:
      return s;

    case FORALL:
    case EXISTS:
      final QuantifiedSentence q = (QuantifiedSentence) s;
      return q.copy(rewrite(q.sentence, rule));

    case EXTENSION:
      throw new AssertionError("not canonical: " + s);

    default:
      final BooleanSentence b = (BooleanSentence) s;
      final List<Sentence> operands = new ArrayList<>(b.operands.size());
      b.operands.forEach(o -> operands.add(rewrite(o, rule)));
      return b.copy(operands);
    }
  }

  /** Rewrites a sentence using each rule in turn. */
  @SafeVarargs
  public static Sentence rewrite(Sentence sentence,
      UnaryOperator<Sentence>... rules) {
    return chain(sentence, List.of(rules));
  }

  /** Rewrites a sentence using each of a list of rules in turn. */
  public static Sentence chain(Sentence sentence,
      Iterable<? extends UnaryOperator<Sentence>> rules) {
    Sentence s = sentence;
    for (UnaryOperator<Sentence> rule : rules) {
      s = rewrite(s, rule);
    }
    return s;
  }

  /**
   * Replaces variables with constant values.
   *
   * <p>Every variable argument whose name is a key in the map is replaced by
   * the corresponding value; this includes arguments of nested function
   * terms. Quantifier variable lists are not changed.
   */
  public static Sentence replaceConstants(Sentence sentence,
      Map<String, ?> constants) {
    requireNonNull(constants, "constants");
    return sentence.accept(new ConstantReplacer(constants));
  }

  /** Shuttle that replaces variables by constants. */
  private static class ConstantReplacer extends Shuttle {
    private final Map<String, ?> constants;

    ConstantReplacer(Map<String, ?> constants) {
      this.constants = constants;
    }

    @Override
    protected Sentence visit(Term term) {
      return replace(term);
    }

    private Term replace(Term term) {
      final List<@Nullable Object> values = new ArrayList<>();
      boolean changed = false;
      for (Object value : term.values()) {
        final Object value2;
        if (value instanceof Variable
            && constants.containsKey(((Variable) value).name)) {
          value2 = constants.get(((Variable) value).name);
        } else if (value instanceof Term) {
          value2 = replace((Term) value);
        } else {
          value2 = value;
        }
        changed |= value2 != value;
        values.add(value2);
      }
      return changed ? term.withValues(values) : term;
    }
  }
}

// End Rewriter.java
