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

import com.google.common.collect.ImmutableMap;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Registry of compilers, by name.
 *
 * <p>The names are "prolog", "tptp", "prover9", "fol", "sexpr" and "yaml".
 */
public class Compilers {
  private Compilers() {}

  private static final ImmutableMap<String, Function<PrologConfig, Compiler>>
      FACTORIES =
      ImmutableMap.<String, Function<PrologConfig, Compiler>>builder()
          .put("prolog", c -> new PrologCompiler(c, c.strict()))
          .put("tptp", c -> new TptpCompiler(c, c.strict()))
          .put("prover9", c -> new Prover9Compiler(c, c.strict()))
          .put("fol", c -> new FolCompiler(c, c.strict()))
          .put("sexpr", c -> new SexprCompiler(c.strict()))
          .put("yaml", c -> new YamlCompiler(c.strict()))
          .build();

  /** Default configuration of each compiler; compilers not listed use
   * {@link PrologConfig#DEFAULT}. */
  private static final ImmutableMap<String, PrologConfig> DEFAULT_CONFIGS =
      ImmutableMap.of("fol", FolWriter.DEFAULT_CONFIG);

  /** Returns the names of the registered compilers. */
  public static Set<String> names() {
    return FACTORIES.keySet();
  }

  /** Looks up a compiler with default properties. */
  public static Compiler lookup(String name) {
    return lookup(name, new HashMap<>());
  }

  /**
   * Looks up a compiler by name, and configures it.
   *
   * @param name Name of compiler, for example "prolog"
   * @param properties Property values, keyed by {@link Prop} name; for
   *     example, {"strict": true}
   *
   * @throws IllegalArgumentException if there is no such compiler, or if a
   *     property is invalid
   */
  public static Compiler lookup(String name, Map<String, ?> properties) {
    final Function<PrologConfig, Compiler> factory = FACTORIES.get(name);
    if (factory == null) {
      throw new IllegalArgumentException("Unknown compiler '" + name
          + "'; expected one of " + FACTORIES.keySet());
    }
    final PrologConfig config =
        DEFAULT_CONFIGS.getOrDefault(name, PrologConfig.DEFAULT)
            .withProperties(properties);
    return factory.apply(config);
  }
}

// End Compilers.java
