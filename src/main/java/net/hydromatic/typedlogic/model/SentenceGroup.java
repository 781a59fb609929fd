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
import java.util.List;
import java.util.Objects;
import net.hydromatic.typedlogic.ast.Logic.Sentence;
import org.checkerframework.checker.nullness.qual.Nullable;

/** A named group of related sentences with common documentation. */
public class SentenceGroup {
  public final String name;
  public final @Nullable SentenceGroupType groupType;
  public final @Nullable String docstring;
  public final ImmutableList<Sentence> sentences;

  public SentenceGroup(String name, @Nullable SentenceGroupType groupType,
      @Nullable String docstring, List<? extends Sentence> sentences) {
    this.name = requireNonNull(name, "name");
    this.groupType = groupType;
    this.docstring = docstring;
    this.sentences = ImmutableList.copyOf(sentences);
  }

  /** Creates a group of axioms. */
  public static SentenceGroup of(String name,
      List<? extends Sentence> sentences) {
    return new SentenceGroup(name, null, null, sentences);
  }

  /** Creates a group of goals. */
  public static SentenceGroup goals(String name,
      List<? extends Sentence> sentences) {
    return new SentenceGroup(name, SentenceGroupType.GOAL, null, sentences);
  }

  public boolean isGoal() {
    return groupType == SentenceGroupType.GOAL;
  }

  /** Returns a copy of this group with different sentences. */
  public SentenceGroup withSentences(List<? extends Sentence> sentences) {
    return new SentenceGroup(name, groupType, docstring, sentences);
  }

  @Override
  public String toString() {
    return "SentenceGroup(" + name + ", " + sentences + ")";
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof SentenceGroup
        && name.equals(((SentenceGroup) o).name)
        && groupType == ((SentenceGroup) o).groupType
        && Objects.equals(docstring, ((SentenceGroup) o).docstring)
        && sentences.equals(((SentenceGroup) o).sentences);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, groupType, sentences);
  }
}

// End SentenceGroup.java
