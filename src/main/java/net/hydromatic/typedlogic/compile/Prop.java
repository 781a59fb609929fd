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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.CaseFormat;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Ordering;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Property of a compiler.
 *
 * @see PrologConfig
 * @see Compilers#lookup(String, Map)
 */
public enum Prop {
  /**
   * Boolean property "useLowercaseVars" controls whether variable names are
   * printed as they are. If false (the default), they are capitalized, as
   * Prolog requires.
   */
  USE_LOWERCASE_VARS("useLowercaseVars", Boolean.class, false),

  /**
   * Boolean property "useUppercasePredicates" controls whether predicate
   * names are capitalized. If false (the default), they are converted to
   * lower case.
   */
  USE_UPPERCASE_PREDICATES("useUppercasePredicates", Boolean.class, false),

  /**
   * Boolean property "usePredicatesAsIs" controls whether predicate names
   * are printed as they are, overriding {@link #USE_UPPERCASE_PREDICATES}.
   * Default is false.
   */
  USE_PREDICATES_AS_IS("usePredicatesAsIs", Boolean.class, false),

  /**
   * Boolean property "disjunctiveDatalog" controls whether a rule may have a
   * disjunction in its head. Default is false.
   */
  DISJUNCTIVE_DATALOG("disjunctiveDatalog", Boolean.class, false),

  /** String property "negationSymbol" is the prefix for classical
   * negation. Default is "\+". */
  NEGATION_SYMBOL("negationSymbol", String.class, "\\+"),

  /** String property "negationAsFailureSymbol" is the prefix for negation as
   * failure. Default is "\+". */
  NEGATION_AS_FAILURE_SYMBOL("negationAsFailureSymbol", String.class, "\\+"),

  /**
   * Boolean property "doubleQuoteStrings" controls how constant values are
   * printed. If true, as JSON, so that strings are in double quotes; if false
   * (the default), strings are in single quotes.
   */
  DOUBLE_QUOTE_STRINGS("doubleQuoteStrings", Boolean.class, false),

  /**
   * Boolean property "includeParensForZeroArgs" controls whether a term with
   * no arguments is printed "p()" rather than "p". Default is false.
   */
  INCLUDE_PARENS_FOR_ZERO_ARGS("includeParensForZeroArgs", Boolean.class,
      false),

  /**
   * Boolean property "allowFunctionTerms" controls whether a term may occur
   * as an argument of another term. Default is true.
   */
  ALLOW_FUNCTION_TERMS("allowFunctionTerms", Boolean.class, true),

  /**
   * Boolean property "allowNesting" controls whether disjunctions and
   * negated sentences are wrapped in parentheses. Default is true.
   */
  ALLOW_NESTING("allowNesting", Boolean.class, true),

  /** String property "nullTerm" is printed for a null argument of a
   * top-level term. Default is "null(_)". */
  NULL_TERM("nullTerm", String.class, "null(_)"),

  /**
   * Boolean property "allowSkolemTerms" controls whether a term may have an
   * argument that is a Skolem term. Default is false.
   */
  ALLOW_SKOLEM_TERMS("allowSkolemTerms", Boolean.class, false),

  /**
   * Boolean property "strict" controls what a compiler does with a sentence
   * that it cannot translate. If true, it throws {@link NotInProfileError};
   * if false (the default), it writes a comment and continues.
   */
  STRICT("strict", Boolean.class, false);

  public final String camelName;
  private final Class<?> type;
  private final Object defaultValue;

  /**
   * Map of all properties, keyed by both {@link #name()} and {@link
   * #camelName}.
   */
  public static final ImmutableMap<String, Prop> BY_NAME;

  /** List of all properties sorted by {@link #camelName}. */
  public static final List<Prop> BY_CAMEL_NAME;

  static {
    final List<Prop> list = Arrays.asList(values());
    final Ordering<Prop> ordering =
        Ordering.from(Comparator.comparing((Prop o) -> o.camelName));
    BY_CAMEL_NAME = ordering.sortedCopy(list);

    final Map<String, Prop> map = new LinkedHashMap<>();
    for (Prop value : BY_CAMEL_NAME) {
      map.put(value.name(), value);
      map.put(value.camelName, value);
    }
    BY_NAME = ImmutableMap.copyOf(map);
  }

  Prop(String camelName, Class<?> type, Object defaultValue) {
    this.camelName = camelName;
    this.type = type;
    this.defaultValue = defaultValue;
    checkArgument(
        CaseFormat.LOWER_CAMEL
            .to(CaseFormat.UPPER_UNDERSCORE, camelName)
            .equals(name()));
    checkArgument(type.isInstance(defaultValue));
  }

  /** Looks up a property by name. Throws if not found; never returns null. */
  public static Prop lookup(String propName) {
    Prop prop = BY_NAME.get(propName);
    if (prop == null) {
      throw new IllegalArgumentException("property " + propName
          + " not found");
    }
    return prop;
  }

  /** Returns the default value of this property. */
  public Object defaultValue() {
    return defaultValue;
  }

  /** Returns the value of a property. */
  public Object get(Map<Prop, Object> map) {
    Object o = map.get(this);
    return o != null ? o : defaultValue;
  }

  /** Throws if the requested type does not match this property's type. */
  private void checkType(Class<?> requestedType) {
    checkArgument(type == requestedType,
        "invalid type %s for property %s", type, camelName);
  }

  /** Returns the value of a boolean property. */
  public boolean booleanValue(Map<Prop, Object> map) {
    checkType(Boolean.class);
    return (Boolean) get(map);
  }

  /** Returns the value of a string property. */
  public String stringValue(Map<Prop, Object> map) {
    checkType(String.class);
    return (String) get(map);
  }

  /** Sets the value of a property, allowing strings for boolean types.
   * Checks that its type is valid. */
  public void setLenient(Map<Prop, Object> map, @Nullable Object value) {
    if (type == Boolean.class && value instanceof String) {
      switch ((String) value) {
      case "true":
        set(map, true);
        return;
      case "false":
        set(map, false);
        return;
      default:
        throw new IllegalArgumentException("value for property " + camelName
            + " must be 'true' or 'false'");
      }
    }
    set(map, value);
  }

  /** Sets the value of a property. Checks that its type is valid. A null
   * value reverts the property to its default. */
  public void set(Map<Prop, Object> map, @Nullable Object value) {
    if (value == null) {
      map.remove(this);
    } else {
      if (!type.isInstance(value)) {
        throw new IllegalArgumentException("value for property " + camelName
            + " must have type " + type);
      }
      map.put(this, value);
    }
  }
}

// End Prop.java
