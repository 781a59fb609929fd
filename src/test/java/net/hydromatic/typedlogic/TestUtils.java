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
package net.hydromatic.typedlogic;

import static net.hydromatic.typedlogic.ast.LogicBuilder.logic;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import net.hydromatic.typedlogic.ast.Logic.Variable;
import net.hydromatic.typedlogic.model.PredicateDefinition;
import net.hydromatic.typedlogic.model.SentenceGroup;
import net.hydromatic.typedlogic.model.SentenceGroupType;
import net.hydromatic.typedlogic.model.Theory;

/** Utilities and data sets for tests. */
public class TestUtils {
  private TestUtils() {}

  /** Returns a theory of parents and ancestors.
   *
   * <p>It has two rules, two facts, and a goal. */
  public static Theory ancestry() {
    final Variable x = logic.variable("x", "str");
    final Variable y = logic.variable("y", "str");
    final Variable z = logic.variable("z", "str");
    return Theory.builder()
        .name("ancestry")
        .constant("root", "Alice")
        .typeDefinition("Name", "str")
        .predicateDefinition(
            new PredicateDefinition("Parent",
                ImmutableMap.of("parent", "Name", "child", "Name"),
                "One generation", ImmutableMap.of("source", "test"), null))
        .predicateDefinition(
            PredicateDefinition.of("Ancestor",
                ImmutableMap.of("ancestor", "Name", "descendant", "Name")))
        .sentenceGroup(
            SentenceGroup.of("Rules",
                ImmutableList.of(
                    logic.forall(ImmutableList.of(x, y),
                        logic.implies(logic.term("Parent", x, y),
                            logic.term("Ancestor", x, y))),
                    logic.forall(ImmutableList.of(x, y, z),
                        logic.implies(
                            logic.and(logic.term("Parent", x, y),
                                logic.term("Ancestor", y, z)),
                            logic.term("Ancestor", x, z))))))
        .sentenceGroup(
            new SentenceGroup("Facts", SentenceGroupType.AXIOM,
                "Who begat whom",
                ImmutableList.of(logic.term("Parent", "Alice", "Bob"),
                    logic.term("Parent", "Bob", "Carol"))))
        .sentenceGroup(
            SentenceGroup.goals("Goals",
                ImmutableList.of(
                    logic.exists(ImmutableList.of(z),
                        logic.term("Ancestor", "Alice", z)))))
        .groundTerm(logic.term("Parent", "Alice", "Bob"))
        .build();
  }
}

// End TestUtils.java
