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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableMap;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import net.hydromatic.typedlogic.util.Static;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Configuration for the writers of Prolog and of other logic syntaxes.
 *
 * <p>Immutable. Each property is a {@link Prop}; the operator map, which
 * maps predicate names to infix operators and extends
 * {@link Builtins#NAME_TO_INFIX_OP}, is held separately.
 */
public class PrologConfig {
  /** Configuration with every property at its default value. */
  public static final PrologConfig DEFAULT =
      new PrologConfig(ImmutableMap.of(), ImmutableMap.of());

  private final ImmutableMap<Prop, Object> map;
  public final ImmutableMap<String, String> operatorMap;

  private PrologConfig(Map<Prop, Object> map,
      Map<String, String> operatorMap) {
    this.map = ImmutableMap.copyOf(map);
    this.operatorMap = ImmutableMap.copyOf(operatorMap);
  }

  /** Creates a configuration from a map of property names to values.
   *
   * @throws IllegalArgumentException if a property is unknown or a value has
   *     the wrong type
   */
  public static PrologConfig of(Map<String, ?> properties) {
    return DEFAULT.withProperties(properties);
  }

  /** Returns a configuration with several properties set, each given by
   * name.
   *
   * @see #of(Map)
   */
  public PrologConfig withProperties(Map<String, ?> properties) {
    PrologConfig config = this;
    for (Map.Entry<String, ?> entry : properties.entrySet()) {
      config = config.withLenient(Prop.lookup(entry.getKey()),
          entry.getValue());
    }
    return config;
  }

  /** Returns a configuration with a property set to a given value, or reset
   * to its default value if the value is null. */
  public PrologConfig with(Prop prop, @Nullable Object value) {
    final Map<Prop, Object> map2 = new EnumMap<>(Prop.class);
    map2.putAll(map);
    prop.set(map2, value);
    return new PrologConfig(map2, operatorMap);
  }

  private PrologConfig withLenient(Prop prop, @Nullable Object value) {
    final Map<Prop, Object> map2 = new EnumMap<>(Prop.class);
    map2.putAll(map);
    prop.setLenient(map2, value);
    return new PrologConfig(map2, operatorMap);
  }

  /** Returns a configuration with an extra infix operator. */
  public PrologConfig withOperator(String predicate, String operator) {
    final Map<String, String> operatorMap2 = new LinkedHashMap<>(operatorMap);
    operatorMap2.put(requireNonNull(predicate), requireNonNull(operator));
    return new PrologConfig(map, operatorMap2);
  }

  public PrologConfig withUseLowercaseVars(boolean useLowercaseVars) {
    return with(Prop.USE_LOWERCASE_VARS, useLowercaseVars);
  }

  public PrologConfig withUseUppercasePredicates(
      boolean useUppercasePredicates) {
    return with(Prop.USE_UPPERCASE_PREDICATES, useUppercasePredicates);
  }

  public PrologConfig withUsePredicatesAsIs(boolean usePredicatesAsIs) {
    return with(Prop.USE_PREDICATES_AS_IS, usePredicatesAsIs);
  }

  public PrologConfig withDisjunctiveDatalog(boolean disjunctiveDatalog) {
    return with(Prop.DISJUNCTIVE_DATALOG, disjunctiveDatalog);
  }

  public PrologConfig withDoubleQuoteStrings(boolean doubleQuoteStrings) {
    return with(Prop.DOUBLE_QUOTE_STRINGS, doubleQuoteStrings);
  }

  public PrologConfig withIncludeParensForZeroArgs(
      boolean includeParensForZeroArgs) {
    return with(Prop.INCLUDE_PARENS_FOR_ZERO_ARGS, includeParensForZeroArgs);
  }

  public PrologConfig withAllowFunctionTerms(boolean allowFunctionTerms) {
    return with(Prop.ALLOW_FUNCTION_TERMS, allowFunctionTerms);
  }

  public PrologConfig withAllowNesting(boolean allowNesting) {
    return with(Prop.ALLOW_NESTING, allowNesting);
  }

  public PrologConfig withAllowSkolemTerms(boolean allowSkolemTerms) {
    return with(Prop.ALLOW_SKOLEM_TERMS, allowSkolemTerms);
  }

  public PrologConfig withNullTerm(String nullTerm) {
    return with(Prop.NULL_TERM, nullTerm);
  }

  public boolean useLowercaseVars() {
    return Prop.USE_LOWERCASE_VARS.booleanValue(map);
  }

  public boolean useUppercasePredicates() {
    return Prop.USE_UPPERCASE_PREDICATES.booleanValue(map);
  }

  public boolean usePredicatesAsIs() {
    return Prop.USE_PREDICATES_AS_IS.booleanValue(map);
  }

  public boolean disjunctiveDatalog() {
    return Prop.DISJUNCTIVE_DATALOG.booleanValue(map);
  }

  public String negationSymbol() {
    return Prop.NEGATION_SYMBOL.stringValue(map);
  }

  public String negationAsFailureSymbol() {
    return Prop.NEGATION_AS_FAILURE_SYMBOL.stringValue(map);
  }

  public boolean doubleQuoteStrings() {
    return Prop.DOUBLE_QUOTE_STRINGS.booleanValue(map);
  }

  public boolean includeParensForZeroArgs() {
    return Prop.INCLUDE_PARENS_FOR_ZERO_ARGS.booleanValue(map);
  }

  public boolean allowFunctionTerms() {
    return Prop.ALLOW_FUNCTION_TERMS.booleanValue(map);
  }

  public boolean allowNesting() {
    return Prop.ALLOW_NESTING.booleanValue(map);
  }

  public String nullTerm() {
    return Prop.NULL_TERM.stringValue(map);
  }

  public boolean allowSkolemTerms() {
    return Prop.ALLOW_SKOLEM_TERMS.booleanValue(map);
  }

  public boolean strict() {
    return Prop.STRICT.booleanValue(map);
  }

  /** Returns the operator for a predicate, or null if the predicate is not
   * an operator. */
  public @Nullable String operator(String predicate) {
    final String operator = operatorMap.get(predicate);
    return operator != null
        ? operator
        : Builtins.NAME_TO_INFIX_OP.get(predicate);
  }

  /** Formats a predicate name according to {@link Prop#USE_PREDICATES_AS_IS}
   * and {@link Prop#USE_UPPERCASE_PREDICATES}. */
  public String formatPredicate(String predicate) {
    if (usePredicatesAsIs()) {
      return predicate;
    }
    return useUppercasePredicates()
        ? Static.capitalize(predicate)
        : predicate.toLowerCase(Locale.ROOT);
  }

  @Override
  public String toString() {
    return "PrologConfig" + map + (operatorMap.isEmpty() ? "" : operatorMap);
  }

  @Override
  public int hashCode() {
    return map.hashCode() * 31 + operatorMap.hashCode();
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof PrologConfig
        && map.equals(((PrologConfig) o).map)
        && operatorMap.equals(((PrologConfig) o).operatorMap);
  }
}

// End PrologConfig.java
