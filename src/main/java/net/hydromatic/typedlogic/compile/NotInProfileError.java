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
package net.hydromatic.typedlogic.compile;

/**
 * A sentence is outside the profile of a target syntax.
 *
 * <p>For example, Prolog does not allow a disjunction in the head of a rule
 * (unless disjunctive Datalog is enabled), or a variable in the head that does
 * not occur in the body.
 *
 * <p>This is the only error that compilers recover from. In non-strict mode,
 * a compiler replaces the sentence with a comment and continues.
 */
public class NotInProfileError extends IllegalArgumentException {
  public NotInProfileError(String message) {
    super(message);
  }
}

// End NotInProfileError.java
