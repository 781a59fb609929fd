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
import static net.hydromatic.typedlogic.ast.LogicBuilder.logic;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.typedlogic.ast.Logic;
import net.hydromatic.typedlogic.ast.Logic.Extension;
import net.hydromatic.typedlogic.ast.Logic.Sentence;
import net.hydromatic.typedlogic.ast.Logic.Term;
import net.hydromatic.typedlogic.ast.Logic.Variable;
import net.hydromatic.typedlogic.ast.Op;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Converts model values to and from generic structures.
 *
 * <p>There are two structural forms:
 *
 * <ul>
 *   <li>S-expressions ({@link #asSexpr}): nested lists whose head is a type
 *       name, operator name or predicate;
 *   <li>objects ({@link #asObject}): maps with a "type" entry, lists and
 *       atoms, suitable for serializing as YAML or JSON. {@link #fromObject}
 *       is the inverse.
 * </ul>
 *
 * <p>These forms are for archiving and exchange, not for reasoning.
 */
public class Converters {
  private Converters() {}

  /** Key of the entry that holds the type tag in the object form. */
  public static final String TYPE = "type";

  /** Key of the entry that holds the arguments of a sentence. */
  public static final String ARGUMENTS = "arguments";

  /** Key of the entry that holds the named arguments of a term whose
   * bindings are {@link Logic.Keyword keyword}. */
  public static final String BINDINGS = "bindings";

  /** Key of the entry that holds the constraints of a variable. */
  public static final String CONSTRAINTS = "constraints";

  /** Converts a value to an S-expression. */
  public static @Nullable Object asSexpr(@Nullable Object o) {
    if (o instanceof Sentence || o instanceof Variable) {
      return Logic.asSexpr(o);
    }
    if (o instanceof Theory
        || o instanceof SentenceGroup
        || o instanceof PredicateDefinition) {
      final List<@Nullable Object> list = new ArrayList<>();
      list.add(o.getClass().getSimpleName());
      fields(o).forEach((k, v) -> list.add(pair(k, asSexpr(v))));
      return Collections.unmodifiableList(list);
    }
    if (o instanceof List) {
      final List<@Nullable Object> list = new ArrayList<>();
      ((List<?>) o).forEach(e -> list.add(asSexpr(e)));
      return Collections.unmodifiableList(list);
    }
    if (o instanceof Map) {
      final List<@Nullable Object> entries = new ArrayList<>();
      ((Map<?, ?>) o).forEach((k, v) -> entries.add(pair(k, asSexpr(v))));
      return ImmutableList.of("dict", Collections.unmodifiableList(entries));
    }
    if (o instanceof SentenceGroupType) {
      return ((SentenceGroupType) o).value();
    }
    return o;
  }

  /** Converts a value to its object form. */
  public static @Nullable Object asObject(@Nullable Object o) {
    if (o instanceof Extension) {
      return asObject(((Extension) o).toModelObject());
    }
    if (o instanceof Term) {
      final Term term = (Term) o;
      final List<@Nullable Object> args = new ArrayList<>();
      args.add(term.predicate);
      if (term.bindings.isKeyword()) {
        final Map<String, @Nullable Object> bindings = new LinkedHashMap<>();
        ((Logic.Keyword) term.bindings).map
            .forEach((k, v) -> bindings.put(k, asObject(v)));
        final Map<String, @Nullable Object> map =
            typed(Op.TERM.opName, args);
        map.put(BINDINGS, bindings);
        return map;
      }
      term.values().forEach(v -> args.add(asObject(v)));
      return typed(Op.TERM.opName, args);
    }
    if (o instanceof Variable) {
      final Variable v = (Variable) o;
      final Map<String, @Nullable Object> map =
          typed("Variable",
              v.domain == null
                  ? ImmutableList.of(v.name)
                  : ImmutableList.of(v.name, v.domain));
      if (v.constraints != null) {
        map.put(CONSTRAINTS, new ArrayList<>(v.constraints));
      }
      return map;
    }
    if (o instanceof Sentence) {
      final Sentence s = (Sentence) o;
      final List<@Nullable Object> args = new ArrayList<>();
      s.arguments().forEach(a -> args.add(asObject(a)));
      return typed(s.op.opName, args);
    }
    if (o instanceof Theory
        || o instanceof SentenceGroup
        || o instanceof PredicateDefinition) {
      final Map<String, @Nullable Object> map = new LinkedHashMap<>();
      map.put(TYPE, o.getClass().getSimpleName());
      fields(o).forEach((k, v) -> {
        if (v != null) {
          map.put(k, asObject(v));
        }
      });
      return map;
    }
    if (o instanceof SentenceGroupType) {
      return ((SentenceGroupType) o).value();
    }
    if (o instanceof List) {
      final List<@Nullable Object> list = new ArrayList<>();
      ((List<?>) o).forEach(e -> list.add(asObject(e)));
      return list;
    }
    if (o instanceof Map) {
      final Map<Object, @Nullable Object> map = new LinkedHashMap<>();
      ((Map<?, ?>) o).forEach((k, v) -> map.put(k, asObject(v)));
      return map;
    }
    return o;
  }

  /**
   * Converts an object form back into model values.
   *
   * <p>A map with a "type" entry becomes an instance of that type; other maps
   * and lists are converted element-wise; atoms are returned as is.
   *
   * <p>A term map with a "bindings" entry becomes a term with keyword
   * bindings, in the order of the entries.
   */
  @SuppressWarnings("unchecked")
  public static @Nullable Object fromObject(@Nullable Object o) {
    if (o instanceof List) {
      final List<@Nullable Object> list = new ArrayList<>();
      ((List<?>) o).forEach(e -> list.add(fromObject(e)));
      return list;
    }
    if (!(o instanceof Map)) {
      return o;
    }
    final Map<String, @Nullable Object> map = (Map<String, @Nullable Object>) o;
    final Object type = map.get(TYPE);
    if (type == null) {
      final Map<String, @Nullable Object> result = new LinkedHashMap<>();
      map.forEach((k, v) -> result.put(k, fromObject(v)));
      return result;
    }
    switch ((String) type) {
    case "Theory":
      return theory(map);
    case "SentenceGroup":
      return sentenceGroup(map);
    case "PredicateDefinition":
      return predicateDefinition(map);
    case "Variable":
      final List<?> vargs = list(map.get(ARGUMENTS));
      checkArgument(!vargs.isEmpty(), "variable requires a name: %s", map);
      final Object constraints = map.get(CONSTRAINTS);
      return logic.variable((String) vargs.get(0),
          vargs.size() > 1 ? (String) vargs.get(1) : null,
          constraints == null ? null : (List<String>) list(constraints));
    case "Term":
      final Object bindings = map.get(BINDINGS);
      if (bindings == null) {
        break;
      }
      checkArgument(bindings instanceof Map, "expected map: %s", bindings);
      final List<?> targs = list(map.get(ARGUMENTS));
      checkArgument(targs.size() == 1 && targs.get(0) instanceof String,
          "keyword term requires just a predicate name: %s", map);
      return logic.keywordTerm((String) targs.get(0),
          (Map<String, @Nullable Object>) fromObject(bindings));
    default:
      break;
    }
    final Op op = Op.BY_OP_NAME.get(type);
    if (op == null) {
      throw new IllegalArgumentException("unknown type " + type);
    }
    final List<@Nullable Object> args =
        (List<@Nullable Object>) fromObject(list(map.get(ARGUMENTS)));
    return logic.sentence(op, args);
  }

  @SuppressWarnings("unchecked")
  private static Theory theory(Map<String, @Nullable Object> map) {
    final Theory.Builder b = Theory.builder();
    b.name((String) map.get("name"));
    final Object constants = fromObject(map.get("constants"));
    if (constants != null) {
      b.constants((Map<String, Object>) constants);
    }
    final Object typeDefinitions = map.get("type_definitions");
    if (typeDefinitions != null) {
      b.typeDefinitions((Map<String, Object>) typeDefinitions);
    }
    for (Object pd : list(map.get("predicate_definitions"))) {
      b.predicateDefinition((PredicateDefinition) fromObject(pd));
    }
    for (Object group : list(map.get("sentence_groups"))) {
      b.sentenceGroup((SentenceGroup) fromObject(group));
    }
    for (Object term : list(map.get("ground_terms"))) {
      b.groundTerm((Term) fromObject(term));
    }
    return b.build();
  }

  private static SentenceGroup sentenceGroup(
      Map<String, @Nullable Object> map) {
    final Object groupType = map.get("group_type");
    final ImmutableList.Builder<Sentence> sentences = ImmutableList.builder();
    for (Object s : list(map.get("sentences"))) {
      sentences.add((Sentence) fromObject(s));
    }
    return new SentenceGroup((String) map.get("name"),
        groupType == null ? null : SentenceGroupType.of((String) groupType),
        (String) map.get("docstring"), sentences.build());
  }

  @SuppressWarnings("unchecked")
  private static PredicateDefinition predicateDefinition(
      Map<String, @Nullable Object> map) {
    final Object arguments = map.get("arguments");
    final Map<String, String> args = new LinkedHashMap<>();
    if (arguments != null) {
      ((Map<String, Object>) arguments)
          .forEach((k, v) -> args.put(k, String.valueOf(v)));
    }
    final Object parents = map.get("parents");
    return new PredicateDefinition((String) map.get("predicate"), args,
        (String) map.get("description"),
        (Map<String, Object>) fromObject(map.get("metadata")),
        parents == null ? null : (List<String>) parents);
  }

  /** Returns the fields of a theory-level value, in a fixed order, with the
   * names used in serialized form. */
  private static Map<String, @Nullable Object> fields(Object o) {
    final Map<String, @Nullable Object> map = new LinkedHashMap<>();
    if (o instanceof Theory) {
      final Theory t = (Theory) o;
      map.put("name", t.name);
      map.put("constants", t.constants);
      map.put("type_definitions", t.typeDefinitions);
      map.put("predicate_definitions", t.predicateDefinitions);
      map.put("sentence_groups", t.sentenceGroups);
      map.put("ground_terms", t.groundTerms);
    } else if (o instanceof SentenceGroup) {
      final SentenceGroup g = (SentenceGroup) o;
      map.put("name", g.name);
      map.put("group_type", g.groupType);
      map.put("docstring", g.docstring);
      map.put("sentences", g.sentences);
    } else if (o instanceof PredicateDefinition) {
      final PredicateDefinition pd = (PredicateDefinition) o;
      map.put("predicate", pd.predicate);
      map.put("arguments", pd.arguments);
      map.put("description", pd.description);
      map.put("metadata", pd.metadata);
      map.put("parents", pd.parents);
    } else {
      throw new IllegalArgumentException("no fields: " + o.getClass());
    }
    return map;
  }

  private static Map<String, @Nullable Object> typed(String type,
      List<? extends @Nullable Object> args) {
    final Map<String, @Nullable Object> map = new LinkedHashMap<>();
    map.put(TYPE, type);
    map.put(ARGUMENTS, new ArrayList<>(args));
    return map;
  }

  private static List<@Nullable Object> pair(Object k,
      @Nullable Object v) {
    final List<@Nullable Object> list = new ArrayList<>(2);
    list.add(k);
    list.add(v);
    return Collections.unmodifiableList(list);
  }

  private static List<?> list(@Nullable Object o) {
    if (o == null) {
      return ImmutableList.of();
    }
    checkArgument(o instanceof List, "expected list: %s", o);
    return (List<?>) o;
  }
}

// End Converters.java
