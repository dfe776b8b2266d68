/*
 * Copyright 2025 The Typeblocks Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.typeblocks.util;

import java.util.function.IntFunction;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/** Static-only class with methods for building strings and checking names. */
public class StringUtil {

  private StringUtil() {}

  /**
   * Constructs a string by calling the given IntFunction for each int from 0 to size-1, calling
   * {@code String.valueOf()} on each element, separating them with {@code ", "}, and adding the
   * given prefix and suffix.
   */
  public static String joinElements(
      String prefix, String suffix, int size, IntFunction<Object> elements) {
    return joinElements(prefix, suffix, ", ", size, elements);
  }

  /** Like {@link #joinElements(String, String, int, IntFunction)}, with a given separator. */
  public static String joinElements(
      String prefix, String suffix, String separator, int size, IntFunction<Object> elements) {
    assert size >= 0;
    return IntStream.range(0, size)
        .mapToObj(i -> String.valueOf(elements.apply(i)))
        .collect(Collectors.joining(separator, prefix, suffix));
  }

  /**
   * Variable names start with a lower-case letter or underscore, followed by letters, digits,
   * underscores or primes.
   */
  private static final Pattern VARIABLE_NAME = Pattern.compile("[a-z_][A-Za-z0-9_']*");

  /** Names that can't be used for variables. */
  private static final Pattern KEYWORD =
      Pattern.compile("let|in|fun|match|with|if|then|else|rec|type|and|of|true|false");

  /** True if {@code name} can be used as the name of a variable. */
  public static boolean isValidVariableName(String name) {
    return name != null
        && VARIABLE_NAME.matcher(name).matches()
        && !KEYWORD.matcher(name).matches();
  }
}
