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
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Logical sentences.
 *
 * <p>This class functions as a namespace, so that we can keep the class names
 * short. Sentences form a closed family, identified by {@link Op}; code that
 * needs to handle every kind of sentence should {@code switch} on {@link
 * Sentence#op}.
 *
 * <p>All sentences are immutable. A pass that rewrites a sentence creates new
 * nodes; nodes are never shared with back-references, so a sentence is always
 * a tree.
 */
public class Logic {
  private Logic() {}

  /** Prefix of the predicate of a Skolem function term. */
  public static final String SKOLEM_PREFIX = "sk__";

  /** Abstract base class of sentences. */
  public abstract static class Sentence {
    public final Op op;

    Sentence(Op op) {
      this.op = requireNonNull(op);
    }

    /** Accepts a shuttle, returning the transformed sentence. */
    public abstract Sentence accept(Shuttle shuttle);

    /** Accepts a visitor. */
    public abstract void accept(Visitor visitor);

    /**
     * Returns the arguments of this sentence: operands of a boolean sentence;
     * the variable list and inner sentence of a quantified sentence; the
     * predicate and argument values of a term.
     */
    public abstract List<Object> arguments();

    /** Converts this sentence to a nested list. */
    public abstract Object asSexpr();

    /** Returns this sentence with extensions expanded into model objects. */
    public Sentence canonical() {
      return this;
    }

    @Override
    public String toString() {
      return unparse(new StringBuilder()).toString();
    }

    abstract StringBuilder unparse(StringBuilder buf);
  }

  /**
   * A variable in a logical sentence.
   *
   * <p>Two variables are equal if they have the same name, regardless of
   * domain and constraints.
   */
  public static class Variable {
    public final String name;
    public final @Nullable String domain;
    public final @Nullable List<String> constraints;

    Variable(String name, @Nullable String domain,
        @Nullable List<String> constraints) {
      this.name = requireNonNull(name, "name");
      this.domain = domain;
      this.constraints =
          constraints == null ? null : ImmutableList.copyOf(constraints);
    }

    /** Creates variables from a space-separated list of names. */
    public static List<Variable> create(String names) {
      final ImmutableList.Builder<Variable> b = ImmutableList.builder();
      for (String name : names.trim().split("\\s+")) {
        if (!name.isEmpty()) {
          b.add(new Variable(name, null, null));
        }
      }
      return b.build();
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Variable && name.equals(((Variable) o).name);
    }

    @Override
    public int hashCode() {
      return name.hashCode();
    }

    @Override
    public String toString() {
      return "?" + name;
    }

    public Object asSexpr() {
      return domain == null
          ? ImmutableList.of("Variable", name)
          : ImmutableList.of("Variable", name, domain);
    }
  }

  /**
   * The arguments of a {@link Term}.
   *
   * <p>Arguments are either all positional or all keyword; a term with no
   * arguments has {@link #NONE} bindings.
   */
  public abstract static class Bindings {
    /** Bindings of a term that has no arguments. */
    public static final Bindings NONE = new Positional(ImmutableList.of());

    /** Argument values, in order. May contain nulls. */
    public abstract List<@Nullable Object> values();

    /** Whether arguments are bound by name. */
    public abstract boolean isKeyword();

    /** Argument names; for positional bindings, "arg0", "arg1", etc. */
    public abstract List<String> names();

    /** Returns bindings of the same kind with different values. */
    public abstract Bindings withValues(List<@Nullable Object> values);

    public int size() {
      return values().size();
    }
  }

  /** Bindings that are identified by position. */
  public static final class Positional extends Bindings {
    private final List<@Nullable Object> values;

    Positional(List<? extends @Nullable Object> values) {
      this.values = nullableCopy(values);
    }

    @Override
    public List<@Nullable Object> values() {
      return values;
    }

    @Override
    public boolean isKeyword() {
      return false;
    }

    @Override
    public List<String> names() {
      final ImmutableList.Builder<String> b = ImmutableList.builder();
      for (int i = 0; i < values.size(); i++) {
        b.add("arg" + i);
      }
      return b.build();
    }

    @Override
    public Bindings withValues(List<@Nullable Object> values) {
      return values.isEmpty() ? NONE : new Positional(values);
    }
  }

  /** Bindings that are identified by name, in a fixed order. */
  public static final class Keyword extends Bindings {
    public final Map<String, @Nullable Object> map;

    Keyword(Map<String, ? extends @Nullable Object> map) {
      final Map<String, @Nullable Object> copy = new LinkedHashMap<>();
      map.forEach((k, v) -> copy.put(requireNonNull(k), normalize(v)));
      this.map = Collections.unmodifiableMap(copy);
    }

    @Override
    public List<@Nullable Object> values() {
      return Collections.unmodifiableList(new ArrayList<>(map.values()));
    }

    @Override
    public boolean isKeyword() {
      return true;
    }

    @Override
    public List<String> names() {
      return ImmutableList.copyOf(map.keySet());
    }

    @Override
    public Bindings withValues(List<@Nullable Object> values) {
      checkArgument(values.size() == map.size(),
          "expected %s values, got %s", map.size(), values.size());
      final Map<String, @Nullable Object> newMap = new LinkedHashMap<>();
      int i = 0;
      for (String name : map.keySet()) {
        newMap.put(name, values.get(i++));
      }
      return new Keyword(newMap);
    }
  }

  /**
   * Atomic sentence; a predicate applied to zero or more arguments.
   *
   * <p>A term whose predicate starts with {@link #SKOLEM_PREFIX}, occurring as
   * the argument of another term, is a Skolem function term.
   *
   * <p>Equality is structural over the predicate and the argument values,
   * regardless of whether the arguments are bound by position or name.
   */
  public static class Term extends Sentence {
    public final String predicate;
    public final Bindings bindings;

    Term(String predicate, Bindings bindings) {
      super(Op.TERM);
      this.predicate = requireNonNull(predicate, "predicate");
      this.bindings = requireNonNull(bindings, "bindings");
    }

    /** Returns the argument values, in order. */
    public List<@Nullable Object> values() {
      return bindings.values();
    }

    /** Whether this term has no arguments. */
    public boolean isConstant() {
      return bindings.size() == 0;
    }

    /** Whether no argument is a variable. */
    public boolean isGround() {
      for (Object value : values()) {
        if (value instanceof Variable) {
          return false;
        }
      }
      return true;
    }

    /** Whether this term is a Skolem function term. */
    public boolean isSkolem() {
      return predicate.startsWith(SKOLEM_PREFIX);
    }

    /** Returns the arguments that are variables. */
    public List<Variable> variables() {
      final ImmutableList.Builder<Variable> b = ImmutableList.builder();
      for (Object value : values()) {
        if (value instanceof Variable) {
          b.add((Variable) value);
        }
      }
      return b.build();
    }

    public List<String> variableNames() {
      final ImmutableList.Builder<String> b = ImmutableList.builder();
      variables().forEach(v -> b.add(v.name));
      return b.build();
    }

    /** Returns a copy of this term with different argument values. */
    public Term withValues(List<@Nullable Object> values) {
      return new Term(predicate, bindings.withValues(values));
    }

    /**
     * Returns a copy of this term whose arguments are bound by name, in the
     * order given.
     *
     * <p>Positional values are matched to names in order; keyword values are
     * re-ordered; a name with no value is bound to null.
     */
    public Term reindex(List<String> names) {
      final Map<String, @Nullable Object> map = new LinkedHashMap<>();
      if (bindings.isKeyword()) {
        final Map<String, @Nullable Object> current =
            ((Keyword) bindings).map;
        for (String name : current.keySet()) {
          checkArgument(names.contains(name),
              "argument %s not in %s for %s", name, names, predicate);
        }
        names.forEach(name -> map.put(name, current.get(name)));
      } else {
        final List<@Nullable Object> values = values();
        checkArgument(values.size() <= names.size(),
            "too many arguments for %s: expected %s, got %s", predicate,
            names.size(), values.size());
        for (int i = 0; i < names.size(); i++) {
          map.put(names.get(i), i < values.size() ? values.get(i) : null);
        }
      }
      return new Term(predicate,
          map.isEmpty() ? Bindings.NONE : new Keyword(map));
    }

    @Override
    public Sentence accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    public List<Object> arguments() {
      final List<@Nullable Object> list = new ArrayList<>();
      list.add(predicate);
      list.addAll(values());
      return Collections.unmodifiableList(list);
    }

    @Override
    public Object asSexpr() {
      final List<@Nullable Object> list = new ArrayList<>();
      list.add(predicate);
      for (Object value : values()) {
        list.add(Logic.asSexpr(value));
      }
      return Collections.unmodifiableList(list);
    }

    @Override
    StringBuilder unparse(StringBuilder buf) {
      buf.append(predicate);
      if (isConstant()) {
        return buf;
      }
      buf.append('(');
      final List<@Nullable Object> values = values();
      for (int i = 0; i < values.size(); i++) {
        if (i > 0) {
          buf.append(", ");
        }
        buf.append(values.get(i));
      }
      return buf.append(')');
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Term
          && predicate.equals(((Term) o).predicate)
          && values().equals(((Term) o).values());
    }

    @Override
    public int hashCode() {
      return Objects.hash(predicate, values());
    }
  }

  /**
   * Sentence that combines other sentences with a boolean connective: {@link
   * Op#AND}, {@link Op#OR}, {@link Op#NOT}, {@link Op#XOR}, {@link
   * Op#EXACTLY_ONE}, {@link Op#IMPLIES}, {@link Op#IMPLIED}, {@link Op#IFF},
   * {@link Op#NEGATION_AS_FAILURE}.
   */
  public static class BooleanSentence extends Sentence {
    public final List<Sentence> operands;

    BooleanSentence(Op op, List<? extends Sentence> operands) {
      super(op);
      checkArgument(op.isBoolean(), "not a boolean operator: %s", op);
      this.operands = ImmutableList.copyOf(operands);
      checkArgument(op.arity < 0 || this.operands.size() == op.arity,
          "%s requires %s operands, got %s", op.opName, op.arity,
          this.operands.size());
    }

    public Sentence operand(int i) {
      return operands.get(i);
    }

    /** The negated sentence of a {@link Op#NOT} or
     * {@link Op#NEGATION_AS_FAILURE}. */
    public Sentence negated() {
      checkArgument(op == Op.NOT || op == Op.NEGATION_AS_FAILURE);
      return operands.get(0);
    }

    /** The "if" part of an {@link Op#IMPLIES} or {@link Op#IMPLIED}. */
    public Sentence antecedent() {
      switch (op) {
      case IMPLIES:
        return operands.get(0);
      case IMPLIED:
        return operands.get(1);
      default:
        throw new IllegalArgumentException("not an implication: " + this);
      }
    }

    /** The "then" part of an {@link Op#IMPLIES} or {@link Op#IMPLIED}. */
    public Sentence consequent() {
      switch (op) {
      case IMPLIES:
        return operands.get(1);
      case IMPLIED:
        return operands.get(0);
      default:
        throw new IllegalArgumentException("not an implication: " + this);
      }
    }

    /** Returns a sentence of the same kind with different operands, or this
     * sentence if the operands are the same objects. */
    public BooleanSentence copy(List<? extends Sentence> operands) {
      if (operands.size() == this.operands.size()) {
        boolean same = true;
        for (int i = 0; i < operands.size(); i++) {
          same &= operands.get(i) == this.operands.get(i);
        }
        if (same) {
          return this;
        }
      }
      return new BooleanSentence(op, operands);
    }

    @Override
    public Sentence accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    public List<Object> arguments() {
      return ImmutableList.copyOf(operands);
    }

    @Override
    public Object asSexpr() {
      final ImmutableList.Builder<Object> b = ImmutableList.builder();
      b.add(op.opName);
      operands.forEach(s -> b.add(s.asSexpr()));
      return b.build();
    }

    @Override
    StringBuilder unparse(StringBuilder buf) {
      buf.append(op.opName).append('(');
      for (int i = 0; i < operands.size(); i++) {
        if (i > 0) {
          buf.append(", ");
        }
        operands.get(i).unparse(buf);
      }
      return buf.append(')');
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof BooleanSentence
          && op == ((BooleanSentence) o).op
          && operands.equals(((BooleanSentence) o).operands);
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, operands);
    }
  }

  /** Sentence with a universal ({@link Op#FORALL}) or existential
   * ({@link Op#EXISTS}) quantifier. */
  public static class QuantifiedSentence extends Sentence {
    public final List<Variable> variables;
    public final Sentence sentence;

    QuantifiedSentence(Op op, List<Variable> variables, Sentence sentence) {
      super(op);
      checkArgument(op.isQuantifier(), "not a quantifier: %s", op);
      this.variables = ImmutableList.copyOf(variables);
      this.sentence = requireNonNull(sentence, "sentence");
    }

    /** Returns a sentence with the same quantifier and variables and a
     * different body. */
    public QuantifiedSentence copy(Sentence sentence) {
      return sentence == this.sentence
          ? this
          : new QuantifiedSentence(op, variables, sentence);
    }

    @Override
    public Sentence accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    public List<Object> arguments() {
      return ImmutableList.of(variables, sentence);
    }

    @Override
    public Object asSexpr() {
      final ImmutableList.Builder<Object> b = ImmutableList.builder();
      variables.forEach(v -> b.add(v.asSexpr()));
      return ImmutableList.of(op.opName, b.build(), sentence.asSexpr());
    }

    @Override
    StringBuilder unparse(StringBuilder buf) {
      buf.append(op.opName).append("([");
      for (int i = 0; i < variables.size(); i++) {
        final Variable v = variables.get(i);
        if (i > 0) {
          buf.append(", ");
        }
        buf.append(v.name);
        if (v.domain != null) {
          buf.append(": ").append(v.domain);
        }
      }
      buf.append("] : ");
      return sentence.unparse(buf).append(')');
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof QuantifiedSentence
          && op == ((QuantifiedSentence) o).op
          && variables.equals(((QuantifiedSentence) o).variables)
          && sentence.equals(((QuantifiedSentence) o).sentence);
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, variables, sentence);
    }
  }

  /**
   * Framework-specific sentence.
   *
   * <p>A front end may subclass this to represent domain objects (say,
   * instances of a fact class) as sentences. Every pass converts extensions to
   * model objects, by calling {@link #toModelObject()}, before it looks at
   * them.
   */
  public abstract static class Extension extends Sentence {
    protected Extension() {
      super(Op.EXTENSION);
    }

    /** Converts this extension to a standard model object. */
    public abstract Sentence toModelObject();

    @Override
    public Sentence canonical() {
      return toModelObject().canonical();
    }

    @Override
    public Sentence accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    public List<Object> arguments() {
      return toModelObject().arguments();
    }

    @Override
    public Object asSexpr() {
      return toModelObject().asSexpr();
    }

    @Override
    StringBuilder unparse(StringBuilder buf) {
      return toModelObject().unparse(buf);
    }
  }

  /** Converts a value that may occur in a sentence to a nested list. */
  public static @Nullable Object asSexpr(@Nullable Object o) {
    if (o instanceof Sentence) {
      return ((Sentence) o).asSexpr();
    }
    if (o instanceof Variable) {
      return ((Variable) o).asSexpr();
    }
    if (o instanceof List) {
      final List<@Nullable Object> list = new ArrayList<>();
      for (Object e : (List<?>) o) {
        list.add(asSexpr(e));
      }
      return Collections.unmodifiableList(list);
    }
    return o;
  }

  /** Normalizes an argument value: integral numbers become {@link Long},
   * floating point numbers become {@link Double}. */
  static @Nullable Object normalize(@Nullable Object o) {
    if (o instanceof Integer || o instanceof Short || o instanceof Byte) {
      return ((Number) o).longValue();
    }
    if (o instanceof BigInteger && ((BigInteger) o).bitLength() < 64) {
      return ((BigInteger) o).longValue();
    }
    if (o instanceof Float) {
      return ((Float) o).doubleValue();
    }
    return o;
  }

  /** Copies a list that may contain nulls, normalizing values. */
  static List<@Nullable Object> nullableCopy(
      List<? extends @Nullable Object> values) {
    final List<@Nullable Object> list = new ArrayList<>(values.size());
    values.forEach(v -> list.add(normalize(v)));
    return Collections.unmodifiableList(list);
  }
}

// End Logic.java
