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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import net.hydromatic.typedlogic.ast.Logic.Sentence;
import net.hydromatic.typedlogic.ast.Logic.Term;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A collection of predicate definitions and sentences.
 *
 * <p>A theory is immutable. Methods such as {@link #add(Sentence)} return a
 * new theory.
 *
 * <p>A type definition maps a type name to either another type name (an
 * alias) or a list of type names (a union). Unions may nest; see {@link
 * #unrollType(Object)}.
 */
public class Theory {
  /** Name of the group that {@link #add(Sentence)} puts sentences in. */
  public static final String DEFAULT_GROUP_NAME = "Sentences";

  public final @Nullable String name;
  public final ImmutableMap<String, Object> constants;
  public final ImmutableMap<String, Object> typeDefinitions;
  public final ImmutableList<PredicateDefinition> predicateDefinitions;
  public final ImmutableList<SentenceGroup> sentenceGroups;
  public final ImmutableList<Term> groundTerms;

  public Theory(@Nullable String name, Map<String, Object> constants,
      Map<String, Object> typeDefinitions,
      List<PredicateDefinition> predicateDefinitions,
      List<SentenceGroup> sentenceGroups, List<Term> groundTerms) {
    this.name = name;
    this.constants = ImmutableMap.copyOf(constants);
    this.typeDefinitions = ImmutableMap.copyOf(typeDefinitions);
    this.predicateDefinitions = ImmutableList.copyOf(predicateDefinitions);
    this.sentenceGroups = ImmutableList.copyOf(sentenceGroups);
    this.groundTerms = ImmutableList.copyOf(groundTerms);
  }

  /** Creates a builder. */
  public static Builder builder() {
    return new Builder();
  }

  /** Creates an empty theory with a given name. */
  public static Theory of(@Nullable String name) {
    return builder().name(name).build();
  }

  /** Returns a builder initialized with the contents of this theory. */
  public Builder toBuilder() {
    return builder().name(name)
        .constants(constants)
        .typeDefinitions(typeDefinitions)
        .predicateDefinitions(predicateDefinitions)
        .sentenceGroups(sentenceGroups)
        .groundTerms(groundTerms);
  }

  /** Returns the predicate definitions, keyed by predicate name. */
  public Map<String, PredicateDefinition> predicateDefinitionMap() {
    final Map<String, PredicateDefinition> map = new LinkedHashMap<>();
    predicateDefinitions.forEach(pd -> map.put(pd.predicate, pd));
    return map;
  }

  /** Returns all sentences, in group order then sentence order. */
  public List<Sentence> sentences() {
    final ImmutableList.Builder<Sentence> b = ImmutableList.builder();
    sentenceGroups.forEach(g -> b.addAll(g.sentences));
    return b.build();
  }

  /** Returns the sentences in groups of type {@link SentenceGroupType#GOAL}. */
  public List<Sentence> goals() {
    final ImmutableList.Builder<Sentence> b = ImmutableList.builder();
    for (SentenceGroup group : sentenceGroups) {
      if (group.isGoal()) {
        b.addAll(group.sentences);
      }
    }
    return b.build();
  }

  /**
   * Returns a theory with a sentence added, in a new group.
   *
   * <p>Extensions are converted to model objects first.
   */
  public Theory add(Sentence sentence) {
    final SentenceGroup group =
        SentenceGroup.of(DEFAULT_GROUP_NAME,
            ImmutableList.of(sentence.canonical()));
    return toBuilder().sentenceGroup(group).build();
  }

  /** Returns a theory with several sentences added. */
  public Theory addAll(Iterable<? extends Sentence> sentences) {
    Theory theory = this;
    for (Sentence sentence : sentences) {
      theory = theory.add(sentence);
    }
    return theory;
  }

  /**
   * Returns a theory with every occurrence of a sentence removed.
   *
   * @param strict Whether to throw unless exactly one group contained the
   *     sentence
   */
  public Theory remove(Sentence sentence, boolean strict) {
    final Sentence target = sentence.canonical();
    final List<SentenceGroup> groups = new ArrayList<>();
    int n = 0;
    for (SentenceGroup group : sentenceGroups) {
      if (group.sentences.contains(target)) {
        ++n;
        final List<Sentence> remaining = new ArrayList<>(group.sentences);
        remaining.removeIf(target::equals);
        groups.add(group.withSentences(remaining));
      } else {
        groups.add(group);
      }
    }
    if (strict && n != 1) {
      throw new IllegalArgumentException("Removed " + n + " sentences");
    }
    return toBuilder().sentenceGroups(groups).build();
  }

  /**
   * Unrolls a defined type into its component base types.
   *
   * <p>A name that is defined in {@link #typeDefinitions} is replaced by its
   * definition, recursively; a list is replaced by the concatenation of its
   * unrolled elements; any other name is returned as is.
   */
  public List<String> unrollType(Object type) {
    final ImmutableList.Builder<String> b = ImmutableList.builder();
    unrollType(type, b, 0);
    return b.build();
  }

  private void unrollType(Object type, ImmutableList.Builder<String> b,
      int depth) {
    checkArgument(depth <= typeDefinitions.size(),
        "cyclic type definition: %s", type);
    if (type instanceof String) {
      final Object definition = typeDefinitions.get(type);
      if (definition != null) {
        unrollType(definition, b, depth + 1);
      } else {
        b.add((String) type);
      }
    } else if (type instanceof List) {
      for (Object t : (List<?>) type) {
        unrollType(t, b, depth + 1);
      }
    } else {
      throw new IllegalArgumentException("Unknown type " + type);
    }
  }

  @Override
  public String toString() {
    return "Theory(" + name + ", " + sentenceGroups + ")";
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Theory)) {
      return false;
    }
    final Theory that = (Theory) o;
    return Objects.equals(name, that.name)
        && constants.equals(that.constants)
        && typeDefinitions.equals(that.typeDefinitions)
        && predicateDefinitions.equals(that.predicateDefinitions)
        && sentenceGroups.equals(that.sentenceGroups)
        && groundTerms.equals(that.groundTerms);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, predicateDefinitions, sentenceGroups);
  }

  /** Builder for {@link Theory}. */
  public static class Builder {
    private @Nullable String name;
    private final Map<String, Object> constants = new LinkedHashMap<>();
    private final Map<String, Object> typeDefinitions = new LinkedHashMap<>();
    private final List<PredicateDefinition> predicateDefinitions =
        new ArrayList<>();
    private final List<SentenceGroup> sentenceGroups = new ArrayList<>();
    private final List<Term> groundTerms = new ArrayList<>();

    private Builder() {}

    public Builder name(@Nullable String name) {
      this.name = name;
      return this;
    }

    public Builder constant(String name, Object value) {
      constants.put(name, value);
      return this;
    }

    public Builder constants(Map<String, Object> constants) {
      this.constants.clear();
      this.constants.putAll(constants);
      return this;
    }

    /** Defines a type as an alias of another type name, or as a union (a
     * list of type names or nested lists). */
    public Builder typeDefinition(String name, Object definition) {
      checkArgument(definition instanceof String || definition instanceof List,
          "type definition must be a name or a list: %s", definition);
      typeDefinitions.put(name, definition);
      return this;
    }

    public Builder typeDefinitions(Map<String, Object> typeDefinitions) {
      this.typeDefinitions.clear();
      typeDefinitions.forEach(this::typeDefinition);
      return this;
    }

    public Builder predicateDefinition(PredicateDefinition pd) {
      predicateDefinitions.add(pd);
      return this;
    }

    public Builder predicateDefinitions(List<PredicateDefinition> pds) {
      predicateDefinitions.clear();
      predicateDefinitions.addAll(pds);
      return this;
    }

    public Builder sentenceGroup(SentenceGroup group) {
      sentenceGroups.add(group);
      return this;
    }

    public Builder sentenceGroups(List<SentenceGroup> groups) {
      sentenceGroups.clear();
      sentenceGroups.addAll(groups);
      return this;
    }

    public Builder groundTerm(Term term) {
      checkArgument(term.isGround(), "not ground: %s", term);
      groundTerms.add(term);
      return this;
    }

    public Builder groundTerms(List<Term> terms) {
      groundTerms.clear();
      terms.forEach(this::groundTerm);
      return this;
    }

    public Theory build() {
      return new Theory(name, constants, typeDefinitions,
          predicateDefinitions, sentenceGroups, groundTerms);
    }
  }
}

// End Theory.java
