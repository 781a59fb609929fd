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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import com.fasterxml.jackson.dataformat.yaml.util.StringQuotingChecker;
import com.google.common.collect.ImmutableSet;
import java.io.UncheckedIOException;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import net.hydromatic.typedlogic.ast.Logic.Sentence;
import net.hydromatic.typedlogic.model.Converters;
import net.hydromatic.typedlogic.model.Theory;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Compiles a theory to YAML, and parses it back.
 *
 * <p>The document is the object form of the theory (see
 * {@link Converters#asObject}): a map with a "type" entry, whose sentences
 * are maps with "type" and "arguments" entries.
 *
 * <p>A string value is written without quotes only if it is a simple word
 * that a YAML reader cannot mistake for a number, boolean or null. So
 * "{@code Alice}" is plain, but "{@code 0x10}", "{@code .inf}",
 * "{@code yes}" and the empty string are quoted, and read back as strings.
 */
public class YamlCompiler extends Compiler {
  private static final YAMLMapper MAPPER =
      new YAMLMapper(YAMLFactory.builder()
          .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
          .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES)
          .enable(YAMLGenerator.Feature.ALWAYS_QUOTE_NUMBERS_AS_STRINGS)
          .stringQuotingChecker(new WordQuotingChecker())
          .build());

  public YamlCompiler(boolean strict) {
    super(strict);
  }

  @Override
  public String suffix() {
    return "yaml";
  }

  @Override
  public String compile(Theory theory) {
    return write(Converters.asObject(theory));
  }

  @Override
  public String compileSentence(Sentence sentence) {
    return write(Converters.asObject(sentence));
  }

  private static String write(@Nullable Object o) {
    try {
      return MAPPER.writeValueAsString(o);
    } catch (JsonProcessingException e) {
      throw new UncheckedIOException(e);
    }
  }

  /** Parses a YAML document into a model value, typically a
   * {@link Theory} or a sentence. */
  public static @Nullable Object parse(String yaml) {
    try {
      return Converters.fromObject(MAPPER.readValue(yaml, Object.class));
    } catch (JsonProcessingException e) {
      throw new UncheckedIOException(e);
    }
  }

  /** Parses a YAML document that contains a theory. */
  public static Theory parseTheory(String yaml) {
    final Object o = parse(yaml);
    if (!(o instanceof Theory)) {
      throw new IllegalArgumentException("not a theory: " + o);
    }
    return (Theory) o;
  }

  /** Quotes every string value that is not a plain word. */
  static class WordQuotingChecker extends StringQuotingChecker.Default {
    private static final long serialVersionUID = 1L;

    private static final Pattern WORD =
        Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    /** Words that YAML 1.1 reads as booleans or null, in lower case. */
    private static final Set<String> RESERVED =
        ImmutableSet.of("y", "n", "yes", "no", "on", "off", "true", "false",
            "null");

    @Override
    public boolean needToQuoteValue(String value) {
      return !WORD.matcher(value).matches()
          || RESERVED.contains(value.toLowerCase(Locale.ROOT))
          || super.needToQuoteValue(value);
    }
  }
}

// End YamlCompiler.java
