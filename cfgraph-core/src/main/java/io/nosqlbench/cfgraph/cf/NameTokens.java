package io.nosqlbench.cfgraph.cf;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */


import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// Tokenizers for name-valued CF attributes.
public final class NameTokens {

  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  /// `key: name` pairs as used by `cell_measures` and `formula_terms`
  private static final Pattern KEYED_NAME = Pattern.compile(
      "\\s*(?<key>[\\w-]+)\\s*:\\s*(?<name>[^\\s:]+)\\s*"
  );

  private NameTokens() {
  }

  /// One referenced variable name, with the key it was given when the attribute syntax has one.
  /// @param key the lower-cased key (`area`, `volume`, formula term names), or null
  /// @param name the referenced variable name
  public record Token(String key, String name) {
  }

  /// Split a whitespace separated list of names.
  /// @param value an attribute value, non-text values yield no names
  /// @return the names in attribute order, duplicates kept
  public static List<Token> names(Object value) {
    List<Token> tokens = new ArrayList<>();
    if (!(value instanceof String text)) {
      return tokens;
    }
    for (String name : WHITESPACE.split(text.trim())) {
      if (!name.isEmpty()) {
        tokens.add(new Token(null, name));
      }
    }
    return tokens;
  }

  /// Extract grid mapping names.
  ///
  /// The plain form names one mapping variable. The extended form lists mapping variables, each
  /// followed by a colon and the coordinates it applies to; only the mapping names are returned.
  /// @param value an attribute value, non-text values yield no names
  /// @return the grid mapping names in attribute order
  public static List<Token> mappingNames(Object value) {
    List<Token> all = names(value);
    if (!(value instanceof String text) || text.indexOf(':') < 0) {
      return all;
    }
    List<Token> mappings = new ArrayList<>();
    for (Token token : all) {
      String name = token.name();
      if (name.endsWith(":") && name.length() > 1) {
        mappings.add(new Token(null, name.substring(0, name.length() - 1)));
      }
    }
    return mappings;
  }

  /// Split a list of `key: name` pairs. Text that does not fit the pair syntax is skipped.
  /// @param value an attribute value, non-text values yield no names
  /// @return the pairs in attribute order
  public static List<Token> keyedNames(Object value) {
    List<Token> tokens = new ArrayList<>();
    if (!(value instanceof String text)) {
      return tokens;
    }
    Matcher matcher = KEYED_NAME.matcher(text);
    while (matcher.find()) {
      tokens.add(new Token(matcher.group("key").toLowerCase(Locale.ROOT), matcher.group("name")));
    }
    return tokens;
  }
}
