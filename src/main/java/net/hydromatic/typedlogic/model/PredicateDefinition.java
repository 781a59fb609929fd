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
package net.hydromatic.typedlogic.model;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Defines the name and arguments of a predicate.
 *
 * <p>Arguments map names to type names, in a stable order. A type name is
 * either a base type ("str", "int", "float") or the name of a type defined
 * in {@link Theory#typeDefinitions}.
 *
 * <p>A predicate may have parent predicates. The hierarchy is data; it is
 * converted into sentences ("parent(x) &rarr; child(x)") by
 * {@link net.hydromatic.typedlogic.transform.Hierarchy}.
 */
public class PredicateDefinition {
  public final String predicate;
  public final ImmutableMap<String, String> arguments;
  public final @Nullable String description;
  public final @Nullable ImmutableMap<String, Object> metadata;
  public final @Nullable ImmutableList<String> parents;

  public PredicateDefinition(String predicate, Map<String, String> arguments,
      @Nullable String description, @Nullable Map<String, Object> metadata,
      @Nullable List<String> parents) {
    this.predicate = requireNonNull(predicate, "predicate");
    this.arguments = ImmutableMap.copyOf(arguments);
    this.description = description;
    this.metadata = metadata == null ? null : ImmutableMap.copyOf(metadata);
    this.parents = parents == null ? null : ImmutableList.copyOf(parents);
  }

  /** Creates a predicate definition with no description, metadata or
   * parents. */
  public static PredicateDefinition of(String predicate,
      Map<String, String> arguments) {
    return new PredicateDefinition(predicate, arguments, null, null, null);
  }

  /** Returns a copy of this definition with given parents. */
  public PredicateDefinition withParents(List<String> parents) {
    return new PredicateDefinition(predicate, arguments, description,
        metadata, parents);
  }

  /** Returns the list of argument names. */
  public List<String> argumentNames() {
    return arguments.keySet().asList();
  }

  public int arity() {
    return arguments.size();
  }

  @Override
  public String toString() {
    final StringBuilder buf = new StringBuilder(predicate).append('(');
    arguments.forEach((name, type) -> {
      if (buf.charAt(buf.length() - 1) != '(') {
        buf.append(", ");
      }
      buf.append(name).append(": ").append(type);
    });
    return buf.append(')').toString();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof PredicateDefinition)) {
      return false;
    }
    final PredicateDefinition that = (PredicateDefinition) o;
    return predicate.equals(that.predicate)
        && arguments.equals(that.arguments)
        && Objects.equals(description, that.description)
        && Objects.equals(metadata, that.metadata)
        && Objects.equals(parents, that.parents);
  }

  @Override
  public int hashCode() {
    return Objects.hash(predicate, arguments);
  }
}

// End PredicateDefinition.java
