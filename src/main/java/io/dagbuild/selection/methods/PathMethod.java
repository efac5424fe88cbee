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

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import io.dagbuild.selection.graph.GraphMember;
import io.dagbuild.selection.graph.Manifest;
import java.util.List;

/**
 * Matches members by the project-relative file they were defined in. The value may name the file
 * itself or any directory above it, and may contain wildcards.
 */
final class PathMethod extends MemberMethod {
  static final String NAME = "path";

  private static final Splitter SLASH = Splitter.on('/').omitEmptyStrings();
  private static final CharMatcher SLASHES = CharMatcher.is('/');

  PathMethod(Manifest manifest) {
    super(manifest);
  }

  @Override
  boolean matches(GraphMember member, String value) {
    String path = member.getOriginalFilePath();
    if (path == null) {
      return false;
    }
    String pattern = SLASHES.trimTrailingFrom(value);
    if (pattern.startsWith("./")) {
      pattern = pattern.substring(2);
    }
    List<String> parts = SLASH.splitToList(path);
    StringBuilder prefix = new StringBuilder();
    for (String part : parts) {
      if (prefix.length() > 0) {
        prefix.append('/');
      }
      prefix.append(part);
      if (Globs.matchesPath(pattern, prefix.toString())) {
        return true;
      }
    }
    return false;
  }
}
