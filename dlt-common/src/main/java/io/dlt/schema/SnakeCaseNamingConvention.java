/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.dlt.schema;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * snake_case identifiers made of lower case ascii letters, digits and underscores. Nested identifiers are
 * joined with a double underscore.
 */
public class SnakeCaseNamingConvention implements NamingConvention {

  public static final String PATH_SEPARATOR = "__";

  private static final Pattern RE_NON_ALPHANUMERIC = Pattern.compile("[^a-zA-Z\\d_]+");
  private static final Pattern RE_SNAKE_CASE_BREAK_1 = Pattern.compile("([^_])([A-Z][a-z]+)");
  private static final Pattern RE_SNAKE_CASE_BREAK_2 = Pattern.compile("([a-z0-9])([A-Z])");
  private static final Pattern RE_LEADING_DIGITS = Pattern.compile("^\\d+.*");
  // repeated underscores not at the start of the identifier
  private static final Pattern RE_UNDERSCORES = Pattern.compile("(?<=[^_])__+");
  private static final String REDUCE_ALPHABET_FROM = "+-*@|";
  private static final String REDUCE_ALPHABET_TO = "x_xal";

  private final ConcurrentHashMap<String, String> cache = new ConcurrentHashMap<>();

  @Override
  public String normalizeIdentifier(String identifier) {
    if (identifier == null) {
      throw new IllegalArgumentException("Identifier must not be null");
    }
    return cache.computeIfAbsent(identifier, SnakeCaseNamingConvention::toSnakeCase);
  }

  @Override
  public String normalizePath(String path) {
    return makePath(breakPath(path).stream().map(this::normalizeIdentifier).toArray(String[]::new));
  }

  @Override
  public String makePath(String... identifiers) {
    return Arrays.stream(identifiers).filter(i -> i != null && !i.isEmpty())
        .collect(Collectors.joining(PATH_SEPARATOR));
  }

  @Override
  public List<String> breakPath(String path) {
    List<String> fragments = new ArrayList<>();
    for (String fragment : path.split(PATH_SEPARATOR)) {
      if (!fragment.trim().isEmpty()) {
        fragments.add(fragment);
      }
    }
    return fragments;
  }

  @Override
  public String getPathSeparator() {
    return PATH_SEPARATOR;
  }

  static String toSnakeCase(String identifier) {
    String ident = identifier.trim();
    if (ident.isEmpty()) {
      return "_empty";
    }
    StringBuilder reduced = new StringBuilder(ident.length());
    for (char c : ident.toCharArray()) {
      int idx = REDUCE_ALPHABET_FROM.indexOf(c);
      reduced.append(idx >= 0 ? REDUCE_ALPHABET_TO.charAt(idx) : c);
    }
    ident = RE_NON_ALPHANUMERIC.matcher(reduced).replaceAll("_");
    ident = RE_SNAKE_CASE_BREAK_1.matcher(ident).replaceAll("$1_$2");
    ident = RE_SNAKE_CASE_BREAK_2.matcher(ident).replaceAll("$1_$2").toLowerCase();
    if (RE_LEADING_DIGITS.matcher(ident).matches()) {
      ident = "_" + ident;
    }
    int end = ident.length();
    while (end > 0 && ident.charAt(end - 1) == '_') {
      end--;
    }
    StringBuilder stripped = new StringBuilder(ident.substring(0, end));
    for (int i = end; i < ident.length(); i++) {
      stripped.append('x');
    }
    return RE_UNDERSCORES.matcher(stripped).replaceAll("_");
  }
}
