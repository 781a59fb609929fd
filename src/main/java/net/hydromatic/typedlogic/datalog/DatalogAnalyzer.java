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
package net.hydromatic.typedlogic.datalog;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.typedlogic.ast.Logic.BooleanSentence;
import net.hydromatic.typedlogic.ast.Logic.QuantifiedSentence;
import net.hydromatic.typedlogic.ast.Logic.Sentence;
import net.hydromatic.typedlogic.ast.Logic.Term;
import net.hydromatic.typedlogic.ast.Op;
import net.hydromatic.typedlogic.datalog.DependencyGraph.Edge;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Analyzer for Datalog programs.
 *
 * <p>Performs stratification analysis. A program is stratified if no
 * predicate depends negatively on a predicate in its own strongly connected
 * component; that is, if there is no cycle in the dependency graph that
 * contains a negated edge.
 */
public class DatalogAnalyzer {
  private static final Logger LOGGER =
      LoggerFactory.getLogger(DatalogAnalyzer.class);

  private DatalogAnalyzer() {
    // Utility class
  }

  /**
   * Analyzes a Datalog program for stratification.
   *
   * @param rules the rules of the program, each a head predicate and the
   *     predicates that its body depends on
   */
  public static Analysis analyze(List<RuleDependencies> rules) {
    final DependencyGraph graph = new DependencyGraph();
    for (RuleDependencies rule : rules) {
      for (Dependency dependency : rule.dependencies) {
        graph.addEdge(rule.head, dependency.target, dependency.negated);
      }
    }
    final List<List<String>> sccs = graph.tarjan();
    final @Nullable Edge edge = graph.firstNegativeCycleEdge(sccs);
    return new Analysis(edge, sccs);
  }

  /**
   * Extracts the dependencies of a list of Horn rules.
   *
   * <p>A rule is an implication, optionally universally quantified, whose
   * consequent is a term. Each conjunct of its antecedent that is a term, or
   * a negated term, is a dependency. Other sentences are ignored.
   */
  public static List<RuleDependencies> dependencies(
      List<? extends Sentence> hornRules) {
    final ImmutableList.Builder<RuleDependencies> b = ImmutableList.builder();
    for (Sentence rule : hornRules) {
      final RuleDependencies dependencies = ruleDependencies(rule);
      if (dependencies != null) {
        b.add(dependencies);
      }
    }
    return b.build();
  }

  private static @Nullable RuleDependencies ruleDependencies(Sentence rule) {
    Sentence s = rule.canonical();
    if (s.op == Op.FORALL) {
      s = ((QuantifiedSentence) s).sentence;
    }
    if (s.op != Op.IMPLIES) {
      return null;
    }
    final BooleanSentence implies = (BooleanSentence) s;
    if (implies.consequent().op != Op.TERM) {
      return null;
    }
    final Term head = (Term) implies.consequent();
    final Sentence body = implies.antecedent();
    final List<Sentence> conjuncts =
        body.op == Op.AND
            ? ((BooleanSentence) body).operands
            : ImmutableList.of(body);
    final ImmutableList.Builder<Dependency> dependencies =
        ImmutableList.builder();
    for (Sentence conjunct : conjuncts) {
      boolean negated = false;
      if (conjunct.op == Op.NOT || conjunct.op == Op.NEGATION_AS_FAILURE) {
        conjunct = ((BooleanSentence) conjunct).negated();
        negated = true;
      }
      if (conjunct.op == Op.TERM) {
        dependencies.add(
            new Dependency(((Term) conjunct).predicate, negated));
      }
    }
    return new RuleDependencies(head.predicate, dependencies.build());
  }

  /** Returns whether a list of Horn rules is stratified. */
  public static boolean isStratified(List<? extends Sentence> hornRules) {
    return analyze(dependencies(hornRules)).stratified;
  }

  /**
   * Makes a list of Horn rules stratified by removing rules.
   *
   * <p>While the program is not stratified, finds the first offending
   * negative edge, and removes the first rule that contributes that edge.
   * The result is weaker than the given program, but is stratified.
   *
   * @throws IllegalStateException if the offending edge cannot be traced to
   *     a rule
   */
  public static List<Sentence> forceStratification(
      List<? extends Sentence> hornRules) {
    final List<Sentence> rules = new ArrayList<>(hornRules);
    for (;;) {
      final Map<Edge, List<Integer>> edgeRules = new LinkedHashMap<>();
      final List<RuleDependencies> ruleDependencies = new ArrayList<>();
      for (int i = 0; i < rules.size(); i++) {
        final RuleDependencies rd = ruleDependencies(rules.get(i));
        if (rd == null) {
          continue;
        }
        ruleDependencies.add(rd);
        for (Dependency dependency : rd.dependencies) {
          if (dependency.negated) {
            edgeRules.computeIfAbsent(new Edge(rd.head, dependency.target),
                e -> new ArrayList<>()).add(i);
          }
        }
      }
      final Analysis analysis = analyze(ruleDependencies);
      if (analysis.stratified) {
        return ImmutableList.copyOf(rules);
      }
      final Edge edge = requireNonNull(analysis.edge);
      final List<Integer> candidates = edgeRules.get(edge);
      if (candidates == null || candidates.isEmpty()) {
        throw new IllegalStateException("Stratification failed; cannot find "
            + edge + " in " + edgeRules);
      }
      final int i = candidates.get(0);
      LOGGER.debug("removing rule {} to break negative cycle on edge {}",
          rules.get(i), edge);
      rules.remove(i);
    }
  }

  /** A dependency of a rule on a predicate. */
  public static class Dependency {
    public final String target;
    public final boolean negated;

    public Dependency(String target, boolean negated) {
      this.target = requireNonNull(target);
      this.negated = negated;
    }

    @Override
    public String toString() {
      return "(" + target + ", " + negated + ")";
    }
  }

  /** The head predicate of a rule, and the predicates it depends on. */
  public static class RuleDependencies {
    public final String head;
    public final List<Dependency> dependencies;

    public RuleDependencies(String head, List<Dependency> dependencies) {
      this.head = requireNonNull(head);
      this.dependencies = ImmutableList.copyOf(dependencies);
    }

    /** Creates a rule dependency. */
    public static RuleDependencies of(String head,
        Dependency... dependencies) {
      return new RuleDependencies(head, ImmutableList.copyOf(dependencies));
    }

    @Override
    public String toString() {
      return "(" + head + ", " + dependencies + ")";
    }
  }

  /** Result of analyzing a program. */
  public static class Analysis {
    public final boolean stratified;
    /** The first negative edge within a strongly connected component, or
     * null if the program is stratified. */
    public final @Nullable Edge edge;
    /** Strongly connected components of the dependency graph. */
    public final List<List<String>> sccs;

    Analysis(@Nullable Edge edge, List<List<String>> sccs) {
      this.stratified = edge == null;
      this.edge = edge;
      this.sccs = ImmutableList.copyOf(sccs);
    }
  }
}

// End DatalogAnalyzer.java
