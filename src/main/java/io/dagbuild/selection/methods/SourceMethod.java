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

import com.google.common.base.Splitter;
import io.dagbuild.selection.graph.GraphMember;
import io.dagbuild.selection.graph.Manifest;
import io.dagbuild.selection.graph.MemberType;
import java.util.List;

/**
 * Matches sources as {@code source_name}, {@code source_name.table_name} or {@code
 * package.source_name.table_name}. Any part may be {@code *}.
 */
final class SourceMethod extends MemberMethod {
  static final String NAME = "source";

  private static final Splitter DOT = Splitter.on('.');

  SourceMethod(Manifest manifest) {
    super(manifest);
  }

  @Override
  void validate(String value) throws InvalidSelectorMethodException {
    int parts = DOT.splitToList(value).size();
    if (parts > 3) {
      throw new InvalidSelectorMethodException(
          NAME,
          "Invalid source selector value '"
              + value
              + "'. Sources must be of the form `${source_name}`, `${source_name}.${target_name}`,"
              + " or `${package_name}.${source_name}.${target_name}`");
    }
  }

  @Override
  boolean matches(GraphMember member, String value) {
    if (member.getMemberType() != MemberType.SOURCE) {
      return false;
    }
    List<String> parts = DOT.splitToList(value);
    String packagePattern = "*";
    String sourcePattern;
    String tablePattern = "*";
    if (parts.size() == 1) {
      sourcePattern = parts.get(0);
    } else if (parts.size() == 2) {
      sourcePattern = parts.get(0);
      tablePattern = parts.get(1);
    } else {
      packagePattern = parts.get(0);
      sourcePattern = parts.get(1);
      tablePattern = parts.get(2);
    }
    String sourceName = member.getSourceName();
    return Globs.matches(packagePattern, member.getFqn().get(0))
        && sourceName != null
        && Globs.matches(sourcePattern, sourceName)
        && Globs.matches(tablePattern, member.getName());
  }
}
