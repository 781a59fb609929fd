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

import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.Map;

/** Kinds of {@link Logic.Sentence}. */
public enum Op {
  /** Atomic sentence, a predicate applied to arguments. */
  TERM("Term", Kind.TERM, -1),

  /** Conjunction. With no operands, means true. */
  AND("And", Kind.BOOLEAN, -1),
  /** Disjunction. With no operands, means false. */
  OR("Or", Kind.BOOLEAN, -1),
  /** Classical (strong) negation. */
  NOT("Not", Kind.BOOLEAN, 1),
  XOR("Xor", Kind.BOOLEAN, 2),
  /** Exactly one operand is true. */
  EXACTLY_ONE("ExactlyOne", Kind.BOOLEAN, -1),
  /** "a &rarr; b"; operands are antecedent, consequent. */
  IMPLIES("Implies", Kind.BOOLEAN, 2),
  /** "a &larr; b"; operands are consequent, antecedent. */
  IMPLIED("Implied", Kind.BOOLEAN, 2),
  IFF("Iff", Kind.BOOLEAN, 2),
  /** Negation interpreted as failure to prove. */
  NEGATION_AS_FAILURE("NegationAsFailure", Kind.BOOLEAN, 1),

  FORALL("Forall", Kind.QUANTIFIED, -1),
  EXISTS("Exists", Kind.QUANTIFIED, -1),

  /** Framework-specific sentence that canonicalizes to one of the others. */
  EXTENSION("Extension", Kind.EXTENSION, -1);

  /** Type name, as used in S-expressions and YAML. */
  public final String opName;
  public final Kind kind;
  /** Required number of operands, or -1 if any number is allowed. */
  public final int arity;

  /** Map from {@link #opName} to operator. */
  public static final ImmutableMap<String, Op> BY_OP_NAME;

  static {
    final Map<String, Op> map = new LinkedHashMap<>();
    for (Op op : values()) {
      map.put(op.opName, op);
    }
    BY_OP_NAME = ImmutableMap.copyOf(map);
  }

  Op(String opName, Kind kind, int arity) {
    this.opName = opName;
    this.kind = kind;
    this.arity = arity;
  }

  public boolean isBoolean() {
    return kind == Kind.BOOLEAN;
  }

  public boolean isQuantifier() {
    return kind == Kind.QUANTIFIED;
  }

  /** Whether this is {@link #AND} or {@link #OR}. */
  public boolean isJunction() {
    return this == AND || this == OR;
  }

  /** Returns the dual quantifier or junction; fails for other operators. */
  public Op dual() {
    switch (this) {
    case AND:
      return OR;
    case OR:
      return AND;
    case FORALL:
      return EXISTS;
    case EXISTS:
      return FORALL;
    default:
      throw new IllegalArgumentException("no dual: " + this);
    }
  }

  /** Family of an operator. */
  public enum Kind {
    TERM,
    BOOLEAN,
    QUANTIFIED,
    EXTENSION
  }
}

// End Op.java
