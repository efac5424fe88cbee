// Copyright 2026 The Bazel Authors. All rights reserved.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package io.dagbuild.selection.methods;

import com.google.common.cache.CacheBuilder;
import com.google.common.cache.CacheLoader;
import com.google.common.cache.LoadingCache;
import java.util.regex.Pattern;

/**
 * Shell-style wildcard matching with {@code *} and {@code ?}, as used in selection values.
 *
 * <p>{@link #matchesPath} treats {@code /} as a separator: single wildcards stay within one path
 * segment and {@code **} spans any number of directories.
 */
final class Globs {
  private static final LoadingCache<String, Pattern> patterns =
      CacheBuilder.newBuilder().maximumSize(1000).build(CacheLoader.from(Globs::compile));
  private static final LoadingCache<String, Pattern> pathPatterns =
      CacheBuilder.newBuilder().maximumSize(1000).build(CacheLoader.from(Globs::compilePath));

  private Globs() {}

  static boolean matches(String glob, String text) {
    if (!hasWildcard(glob)) {
      return glob.equals(text);
    }
    return patterns.getUnchecked(glob).matcher(text).matches();
  }

  static boolean matchesPath(String glob, String path) {
    if (!hasWildcard(glob)) {
      return glob.equals(path);
    }
    return pathPatterns.getUnchecked(glob).matcher(path).matches();
  }

  static boolean hasWildcard(String glob) {
    return glob.indexOf('*') >= 0 || glob.indexOf('?') >= 0;
  }

  private static Pattern compile(String glob) {
    StringBuilder regex = new StringBuilder();
    StringBuilder literal = new StringBuilder();
    for (char c : glob.toCharArray()) {
      if (c == '*' || c == '?') {
        flushLiteral(literal, regex);
        regex.append(c == '*' ? ".*" : ".");
      } else {
        literal.append(c);
      }
    }
    flushLiteral(literal, regex);
    return Pattern.compile(regex.toString(), Pattern.DOTALL);
  }

  private static Pattern compilePath(String glob) {
    StringBuilder regex = new StringBuilder();
    StringBuilder literal = new StringBuilder();
    int i = 0;
    while (i < glob.length()) {
      char c = glob.charAt(i);
      if (glob.startsWith("**", i)) {
        flushLiteral(literal, regex);
        if (glob.startsWith("**/", i)) {
          // Zero or more whole directories.
          regex.append("(?:[^/]*/)*");
          i += 3;
        } else {
          regex.append(".*");
          i += 2;
        }
      } else if (c == '*' || c == '?') {
        flushLiteral(literal, regex);
        regex.append(c == '*' ? "[^/]*" : "[^/]");
        i++;
      } else {
        literal.append(c);
        i++;
      }
    }
    flushLiteral(literal, regex);
    return Pattern.compile(regex.toString(), Pattern.DOTALL);
  }

  private static void flushLiteral(StringBuilder literal, StringBuilder regex) {
    if (literal.length() > 0) {
      regex.append(Pattern.quote(literal.toString()));
      literal.setLength(0);
    }
  }
}
