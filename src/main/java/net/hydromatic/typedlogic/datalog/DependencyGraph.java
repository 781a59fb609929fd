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
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Graph of dependencies between predicates.
 *
 * <p>There is an edge from predicate {@code p} to predicate {@code q} if a
 * rule with head {@code p} has {@code q} in its body. The edge is negative if
 * {@code q} is negated.
 *
 * <p>Nodes and edges are kept in the order they were added, so that the
 * results of {@link #tarjan()} and {@link #isStratified()} are deterministic.
 */
public class DependencyGraph {
  private final Map<String, Node> nodes = new LinkedHashMap<>();

  /** Adds an edge, creating its nodes if necessary. */
  public DependencyGraph addEdge(String from, String to, boolean negative) {
    final Node u = node(from);
    node(to);
    (negative ? u.negativeEdges : u.positiveEdges).add(to);
    return this;
  }

  private Node node(String name) {
    return nodes.computeIfAbsent(requireNonNull(name), Node::new);
  }

  /** Returns the names of the nodes, in the order they were added. */
  public Set<String> nodeNames() {
    return nodes.keySet();
  }

  /**
   * Returns the strongly connected components of this graph, in the order
   * that Tarjan's algorithm completes them.
   *
   * <p>A component is completed only after every component reachable from
   * it; so if a predicate depends on another predicate in a different
   * component, the other predicate's component comes first.
   */
  public List<List<String>> tarjan() {
    final Tarjan tarjan = new Tarjan();
    for (Node node : nodes.values()) {
      if (!tarjan.indexes.containsKey(node.name)) {
        tarjan.strongConnect(node);
      }
    }
    return tarjan.sccs.build();
  }

  /**
   * Returns the first negative edge between two predicates in the same
   * strongly connected component, or null if the graph is stratified.
   *
   * <p>Nodes are examined in the order they were added, and the negative
   * edges of each node in the order they were added.
   */
  public @Nullable Edge isStratified() {
    return firstNegativeCycleEdge(tarjan());
  }

  @Nullable Edge firstNegativeCycleEdge(List<List<String>> sccs) {
    final Map<String, Integer> sccIndexes = new HashMap<>();
    for (int i = 0; i < sccs.size(); i++) {
      for (String name : sccs.get(i)) {
        sccIndexes.put(name, i);
      }
    }
    for (Node node : nodes.values()) {
      final int index = requireNonNull(sccIndexes.get(node.name));
      for (String to : node.negativeEdges) {
        if (requireNonNull(sccIndexes.get(to)) == index) {
          return new Edge(node.name, to);
        }
      }
    }
    return null;
  }

  @Override
  public String toString() {
    final StringBuilder buf = new StringBuilder("{");
    for (Node node : nodes.values()) {
      if (buf.length() > 1) {
        buf.append(", ");
      }
      buf.append(node.name).append(": +").append(node.positiveEdges)
          .append(" -").append(node.negativeEdges);
    }
    return buf.append('}').toString();
  }

  /** Node in a dependency graph. */
  private static class Node {
    final String name;
    final Set<String> positiveEdges = new LinkedHashSet<>();
    final Set<String> negativeEdges = new LinkedHashSet<>();

    Node(String name) {
      this.name = name;
    }
  }

  /** Edge in a dependency graph. */
  public static class Edge {
    public final String from;
    public final String to;

    public Edge(String from, String to) {
      this.from = requireNonNull(from);
      this.to = requireNonNull(to);
    }

    @Override
    public int hashCode() {
      return from.hashCode() * 31 + to.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Edge
          && from.equals(((Edge) o).from)
          && to.equals(((Edge) o).to);
    }

    @Override
    public String toString() {
      return "(" + from + ", " + to + ")";
    }
  }

  /** State of one run of Tarjan's strongly connected components
   * algorithm. */
  private class Tarjan {
    final Map<String, Integer> indexes = new HashMap<>();
    final Map<String, Integer> lowlinks = new HashMap<>();
    final Deque<Node> stack = new ArrayDeque<>();
    final Set<String> onStack = new HashSet<>();
    final ImmutableList.Builder<List<String>> sccs = ImmutableList.builder();
    int index = 0;

    void strongConnect(Node v) {
      indexes.put(v.name, index);
      lowlinks.put(v.name, index);
      ++index;
      stack.push(v);
      onStack.add(v.name);

      final Set<String> successors = new LinkedHashSet<>(v.positiveEdges);
      successors.addAll(v.negativeEdges);
      for (String name : successors) {
        final Node w = requireNonNull(nodes.get(name));
        final Integer wIndex = indexes.get(w.name);
        if (wIndex == null) {
          strongConnect(w);
          lowlinks.put(v.name,
              Math.min(lowlinks.get(v.name), lowlinks.get(w.name)));
        } else if (onStack.contains(w.name)) {
          lowlinks.put(v.name, Math.min(lowlinks.get(v.name), wIndex));
        }
      }

      if (lowlinks.get(v.name).equals(indexes.get(v.name))) {
        final ImmutableList.Builder<String> scc = ImmutableList.builder();
        for (;;) {
          final Node w = stack.pop();
          onStack.remove(w.name);
          scc.add(w.name);
          if (w == v) {
            break;
          }
        }
        sccs.add(scc.build());
      }
    }
  }
}

// End DependencyGraph.java
