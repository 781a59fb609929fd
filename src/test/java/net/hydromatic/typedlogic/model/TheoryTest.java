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
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import net.hydromatic.typedlogic.TestUtils;
import net.hydromatic.typedlogic.ast.Logic.Term;
import org.junit.jupiter.api.Test;

/** Tests for {@link Theory} and the other model classes. */
public class TheoryTest {
  @Test void testSentencesAndGoals() {
    final Theory theory = TestUtils.ancestry();
    assertThat(theory.sentences(), hasSize(5));
    assertThat(theory.goals(), hasSize(1));
    assertThat(theory.goals().get(0),
        hasToString("Exists([z: str] : Ancestor(Alice, ?z))"));
    assertThat(theory.predicateDefinitionMap().keySet(),
        hasToString("[Parent, Ancestor]"));
    assertThat(theory.predicateDefinitionMap().get("Parent"),
        hasToString("Parent(parent: Name, child: Name)"));
  }

  @Test void testAdd() {
    final Term p = logic.term("P");
    final Theory theory = Theory.of("t").add(p);
    assertThat(theory.sentenceGroups, hasSize(1));
    assertThat(theory.sentenceGroups.get(0).name,
        is(Theory.DEFAULT_GROUP_NAME));
    final Theory theory2 = theory.addAll(ImmutableList.of(p, logic.term("Q")));
    assertThat(theory2.sentences(), hasToString("[P, P, Q]"));
    // The first theory is unchanged
    assertThat(theory.sentences(), hasSize(1));
  }

  @Test void testRemove() {
    final Term p = logic.term("P");
    final Term q = logic.term("Q");
    final Theory theory = Theory.of("t").addAll(ImmutableList.of(p, q, p));
    assertThat(theory.remove(q, true).sentences(), hasToString("[P, P]"));
    assertThat(theory.remove(p, false).sentences(), hasToString("[Q]"));
    assertThrows(IllegalArgumentException.class,
        () -> theory.remove(p, true));
    assertThrows(IllegalArgumentException.class,
        () -> theory.remove(logic.term("R"), true));
  }

  @Test void testUnrollType() {
    final Theory theory = Theory.builder()
        .typeDefinition("Name", "str")
        .typeDefinition("Thing", ImmutableList.of("Name", "int"))
        .typeDefinition("Loop1", "Loop2")
        .typeDefinition("Loop2", "Loop1")
        .build();
    assertThat(theory.unrollType("Thing"), hasToString("[str, int]"));
    assertThat(theory.unrollType("Name"), hasToString("[str]"));
    assertThat(theory.unrollType("float"), hasToString("[float]"));
    assertThrows(IllegalArgumentException.class,
        () -> theory.unrollType("Loop1"));
  }

  @Test void testGroundTermMustBeGround() {
    assertThrows(IllegalArgumentException.class,
        () -> Theory.builder()
            .groundTerm(logic.term("P", logic.variable("x"))));
  }

  @Test void testPredicateDefinition() {
    final PredicateDefinition pd =
        TestUtils.ancestry().predicateDefinitions.get(1);
    assertThat(pd.arity(), is(2));
    assertThat(pd.argumentNames(),
        is(ImmutableList.of("ancestor", "descendant")));
    assertThat(pd.withParents(ImmutableList.of("Relation")).parents,
        is(ImmutableList.of("Relation")));
  }
}

// End TheoryTest.java
