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
package net.hydromatic.typedlogic.ast;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import net.hydromatic.typedlogic.ast.Logic.Bindings;
import net.hydromatic.typedlogic.ast.Logic.BooleanSentence;
import net.hydromatic.typedlogic.ast.Logic.Keyword;
import net.hydromatic.typedlogic.ast.Logic.Positional;
import net.hydromatic.typedlogic.ast.Logic.QuantifiedSentence;
import net.hydromatic.typedlogic.ast.Logic.Sentence;
import net.hydromatic.typedlogic.ast.Logic.Term;
import net.hydromatic.typedlogic.ast.Logic.Variable;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Builds sentences. */
public enum LogicBuilder {
  /**
   * The singleton instance of the logic builder. The short name is convenient
   * for use via 'import static', but checkstyle does not approve.
   */
  // CHECKSTYLE: IGNORE 1
  logic;

  /** Creates a variable. */
  public Variable variable(String name) {
    return new Variable(name, null, null);
  }

  /** Creates a variable with a domain (type name). */
  public Variable variable(String name, @Nullable String domain) {
    return new Variable(name, domain, null);
  }

  /** Creates a variable with a domain and constraints. */
  public Variable variable(String name, @Nullable String domain,
      @Nullable List<String> constraints) {
    return new Variable(name, domain, constraints);
  }

  /** Creates a term with positional arguments. */
  public Term term(String predicate, @Nullable Object... args) {
    return term(predicate, Arrays.asList(args));
  }

  /** Creates a term with a list of positional arguments. */
  public Term term(String predicate, List<? extends @Nullable Object> args) {
    return new Term(predicate,
        args.isEmpty() ? Bindings.NONE : new Positional(args));
  }

  /** Creates a term whose arguments are bound by name. */
  public Term keywordTerm(
      String predicate, Map<String, ? extends @Nullable Object> args) {
    return new Term(predicate,
        args.isEmpty() ? Bindings.NONE : new Keyword(args));
  }

  /** Creates a term with given bindings. */
  public Term term(String predicate, Bindings bindings) {
    return new Term(predicate, bindings);
  }

  /** Creates a conjunction. With no arguments, means true. */
  public BooleanSentence and(Sentence... operands) {
    return and(ImmutableList.copyOf(operands));
  }

  public BooleanSentence and(Iterable<? extends Sentence> operands) {
    return booleanSentence(Op.AND, operands);
  }

  /** Creates a disjunction. With no arguments, means false. */
  public BooleanSentence or(Sentence... operands) {
    return or(ImmutableList.copyOf(operands));
  }

  public BooleanSentence or(Iterable<? extends Sentence> operands) {
    return booleanSentence(Op.OR, operands);
  }

  public BooleanSentence not(Sentence operand) {
    return booleanSentence(Op.NOT, ImmutableList.of(operand));
  }

  public BooleanSentence negationAsFailure(Sentence operand) {
    return booleanSentence(Op.NEGATION_AS_FAILURE, ImmutableList.of(operand));
  }

  public BooleanSentence xor(Sentence left, Sentence right) {
    return booleanSentence(Op.XOR, ImmutableList.of(left, right));
  }

  public BooleanSentence exactlyOne(Sentence... operands) {
    return exactlyOne(ImmutableList.copyOf(operands));
  }

  public BooleanSentence exactlyOne(Iterable<? extends Sentence> operands) {
    return booleanSentence(Op.EXACTLY_ONE, operands);
  }

  /** Creates "antecedent &rarr; consequent". */
  public BooleanSentence implies(Sentence antecedent, Sentence consequent) {
    return booleanSentence(Op.IMPLIES,
        ImmutableList.of(antecedent, consequent));
  }

  /** Creates "consequent &larr; antecedent". */
  public BooleanSentence implied(Sentence consequent, Sentence antecedent) {
    return booleanSentence(Op.IMPLIED,
        ImmutableList.of(consequent, antecedent));
  }

  public BooleanSentence iff(Sentence left, Sentence right) {
    return booleanSentence(Op.IFF, ImmutableList.of(left, right));
  }

  /** Creates a boolean sentence of a given kind. */
  public BooleanSentence booleanSentence(Op op,
      Iterable<? extends Sentence> operands) {
    return new BooleanSentence(op, ImmutableList.copyOf(operands));
  }

  public QuantifiedSentence forall(List<Variable> variables,
      Sentence sentence) {
    return quantified(Op.FORALL, variables, sentence);
  }

  public QuantifiedSentence exists(List<Variable> variables,
      Sentence sentence) {
    return quantified(Op.EXISTS, variables, sentence);
  }

  /** Creates a quantified sentence of a given kind. */
  public QuantifiedSentence quantified(Op op, List<Variable> variables,
      Sentence sentence) {
    return new QuantifiedSentence(op, variables, sentence);
  }

  /**
   * Creates a sentence of a given kind from its {@link Sentence#arguments()
   * arguments}.
   *
   * <p>For a term, the first argument is the predicate name.
   */
  @SuppressWarnings("unchecked")
  public Sentence sentence(Op op, List<? extends @Nullable Object> args) {
    switch (op) {
    case TERM:
      checkArgument(!args.isEmpty() && args.get(0) instanceof String,
          "term requires a predicate name: %s", args);
      return term((String) args.get(0), args.subList(1, args.size()));
    case FORALL:
    case EXISTS:
      checkArgument(args.size() == 2, "expected variables and sentence: %s",
          args);
      return quantified(op, (List<Variable>) args.get(0),
          (Sentence) args.get(1));
    case EXTENSION:
      throw new IllegalArgumentException("cannot construct an extension");
    default:
      final ImmutableList.Builder<Sentence> b = ImmutableList.builder();
      for (Object arg : args) {
        checkArgument(arg instanceof Sentence, "not a sentence: %s", arg);
        b.add((Sentence) arg);
      }
      return booleanSentence(op, b.build());
    }
  }
}

// End LogicBuilder.java
