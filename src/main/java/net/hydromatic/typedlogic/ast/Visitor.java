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

import net.hydromatic.typedlogic.ast.Logic.BooleanSentence;
import net.hydromatic.typedlogic.ast.Logic.Extension;
import net.hydromatic.typedlogic.ast.Logic.QuantifiedSentence;
import net.hydromatic.typedlogic.ast.Logic.Sentence;
import net.hydromatic.typedlogic.ast.Logic.Term;
import net.hydromatic.typedlogic.ast.Logic.Variable;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Visits sentences. */
public class Visitor {

  /** For use as a method reference. */
  protected void accept(Sentence sentence) {
    sentence.accept(this);
  }

  /** Visits each argument of a term. A function term (such as a Skolem
   * term) is visited as a term. */
  protected void visit(Term term) {
    term.values().forEach(this::visitValue);
  }

  /** Visits an argument value of a term. */
  protected void visitValue(@Nullable Object value) {
    if (value instanceof Term) {
      ((Term) value).accept(this);
    } else if (value instanceof Variable) {
      visit((Variable) value);
    }
  }

  protected void visit(Variable variable) {}

  protected void visit(BooleanSentence booleanSentence) {
    booleanSentence.operands.forEach(this::accept);
  }

  protected void visit(QuantifiedSentence quantifiedSentence) {
    quantifiedSentence.variables.forEach(this::visit);
    quantifiedSentence.sentence.accept(this);
  }

  protected void visit(Extension extension) {
    extension.toModelObject().accept(this);
  }
}

// End Visitor.java
