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

import static net.hydromatic.typedlogic.ast.LogicBuilder.logic;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.typedlogic.TestUtils;
import net.hydromatic.typedlogic.ast.Logic.Sentence;
import net.hydromatic.typedlogic.ast.Logic.Term;
import net.hydromatic.typedlogic.ast.Logic.Variable;
import org.junit.jupiter.api.Test;

/** Tests for {@link Converters}. */
public class ConvertersTest {
  private final Variable x = logic.variable("x", "str");
  private final Term p = logic.term("P", x);
  private final Term q = logic.term("Q", x, "a", 1, 2.5, true, null);

  /** Converting to objects and back gives an equal value, for each kind of
   * entity. */
  @Test void testRoundTrip() {
    final List<Object> values =
        ImmutableList.of(x,
            p,
            q,
            logic.term("R"),
            logic.term("S", logic.term("sk__1", x)),
            logic.and(p, q),
            logic.or(),
            logic.not(p),
            logic.negationAsFailure(p),
            logic.xor(p, q),
            logic.exactlyOne(p, q, p),
            logic.implies(p, q),
            logic.implied(p, q),
            logic.iff(p, q),
            logic.forall(ImmutableList.of(x), logic.implies(p, q)),
            logic.exists(ImmutableList.of(x, logic.variable("y")), p),
            PredicateDefinition.of("P", ImmutableMap.of("x", "str")),
            SentenceGroup.goals("g", ImmutableList.of(p)),
            TestUtils.ancestry());
    for (Object value : values) {
      final Object o = Converters.asObject(value);
      assertThat(Converters.fromObject(o), is(value));
    }
  }

  @SuppressWarnings("unchecked")
  @Test void testAsObject() {
    final Map<String, Object> map =
        (Map<String, Object>) Converters.asObject(logic.not(p));
    assertThat(map,
        hasToString("{type=Not, arguments=[{type=Term, arguments=[P, "
            + "{type=Variable, arguments=[x, str]}]}]}"));

    final Map<String, Object> pdMap =
        (Map<String, Object>) Converters.asObject(
            PredicateDefinition.of("P", ImmutableMap.of("x", "str")));
    assertThat(pdMap,
        hasToString("{type=PredicateDefinition, predicate=P, "
            + "arguments={x=str}}"));
  }

  /** Keyword bindings and variable constraints survive a round trip,
   * although equality ignores them. */
  @SuppressWarnings("unchecked")
  @Test void testKeywordTermAndConstraints() {
    final Variable v =
        logic.variable("age", "int", ImmutableList.of("age >= 0"));
    final Term person =
        logic.keywordTerm("Person", ImmutableMap.of("name", "Fred", "age", v));
    final Map<String, Object> map =
        (Map<String, Object>) Converters.asObject(person);
    assertThat(map,
        hasToString("{type=Term, arguments=[Person], bindings={name=Fred, "
            + "age={type=Variable, arguments=[age, int], "
            + "constraints=[age >= 0]}}}"));

    final Term person2 = (Term) Converters.fromObject(map);
    assertThat(person2, is(person));
    assertThat(person2.bindings.isKeyword(), is(true));
    assertThat(person2.bindings.names(), hasToString("[name, age]"));
    final Variable v2 = (Variable) person2.values().get(1);
    assertThat(v2.domain, is("int"));
    assertThat(v2.constraints, hasToString("[age >= 0]"));

    // A variable without constraints has no "constraints" entry
    assertThat(Converters.asObject(logic.variable("y")),
        hasToString("{type=Variable, arguments=[y]}"));
    final Variable y = (Variable) Converters.fromObject(
        Converters.asObject(logic.variable("y")));
    assertThat(y.constraints == null, is(true));
  }

  @Test void testAsSexpr() {
    assertThat(Converters.asSexpr(logic.implies(p, logic.term("R"))),
        hasToString("[Implies, [P, [Variable, x, str]], [R]]"));
    assertThat(Converters.asSexpr(
            SentenceGroup.of("g", ImmutableList.<Sentence>of())),
        hasToString("[SentenceGroup, [name, g], [group_type, null], "
            + "[docstring, null], [sentences, []]]"));
    assertThat(Converters.asSexpr(ImmutableMap.of("a", 1)),
        hasToString("[dict, [[a, 1]]]"));
  }

  @Test void testFromObjectUnknownType() {
    assertThrows(IllegalArgumentException.class,
        () -> Converters.fromObject(
            ImmutableMap.of("type", "Nonsense", "arguments",
                ImmutableList.of())));
  }

  /** A map without a type entry is converted entry by entry. */
  @Test void testFromObjectPlainMap() {
    final Object o =
        Converters.fromObject(
            ImmutableMap.of("k",
                ImmutableMap.of("type", "Variable", "arguments",
                    ImmutableList.of("v"))));
    assertThat(o, is(ImmutableMap.of("k", logic.variable("v"))));
  }
}

// End ConvertersTest.java
