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

import java.util.ArrayList;
import java.util.List;
import net.hydromatic.typedlogic.ast.Logic.BooleanSentence;
import net.hydromatic.typedlogic.ast.Logic.Extension;
import net.hydromatic.typedlogic.ast.Logic.QuantifiedSentence;
import net.hydromatic.typedlogic.ast.Logic.Sentence;
import net.hydromatic.typedlogic.ast.Logic.Term;

/**
 * Visits and transforms sentences.
 *
 * <p>The default implementation rebuilds each node from its transformed
 * children, and returns the same node if no child changed. Sub-classes
 * override the methods for the kinds of node they wish to change.
 */
public class Shuttle {
  /** Creates a Shuttle. */
  public Shuttle() {}

  protected List<Sentence> visitList(List<Sentence> sentences) {
    final List<Sentence> list = new ArrayList<>();
    for (Sentence sentence : sentences) {
      list.add(sentence.accept(this));
    }
    return list;
  }

  protected Sentence visit(Term term) {
    return term; // leaf
  }

  protected Sentence visit(BooleanSentence booleanSentence) {
    return booleanSentence.copy(visitList(booleanSentence.operands));
  }

  protected Sentence visit(QuantifiedSentence quantifiedSentence) {
    return quantifiedSentence.copy(quantifiedSentence.sentence.accept(this));
  }

  protected Sentence visit(Extension extension) {
    return extension.toModelObject().accept(this);
  }
}

// End Shuttle.java
