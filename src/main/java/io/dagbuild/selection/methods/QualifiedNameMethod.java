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
import com.google.common.collect.ImmutableList;
import io.dagbuild.selection.graph.GraphMember;
import io.dagbuild.selection.graph.Manifest;
import io.dagbuild.selection.graph.MemberType;
import java.util.List;

/**
 * Matches nodes by fully qualified name. {@code orders} matches the node named {@code orders};
 * {@code jaffle_shop.staging} matches every node under that package path; a {@code *} segment
 * matches everything below it, and other segments may contain wildcards.
 */
final class QualifiedNameMethod extends MemberMethod {
  static final String NAME = "fqn";

  private static final Splitter DOT = Splitter.on('.');

  QualifiedNameMethod(Manifest manifest) {
    super(manifest);
  }

  @Override
  boolean matches(GraphMember member, String value) {
    if (member.getMemberType() != MemberType.NODE) {
      return false;
    }
    return isSelectedNode(member.getFqn(), value);
  }

  static boolean isSelectedNode(List<String> fqn, String value) {
    if (!fqn.isEmpty() && fqn.get(fqn.size() - 1).equals(value)) {
      return true;
    }
    // Dots inside a segment act as namespace separators too.
    ImmutableList.Builder<String> flat = ImmutableList.builder();
    for (String segment : fqn) {
      flat.addAll(DOT.split(segment));
    }
    ImmutableList<String> flatFqn = flat.build();
    List<String> selectorParts = DOT.splitToList(value);
    if (flatFqn.size() < selectorParts.size()) {
      return false;
    }
    for (int i = 0; i < selectorParts.size(); i++) {
      String part = selectorParts.get(i);
      if (part.equals("*")) {
        return true;
      }
      if (!Globs.matches(part, flatFqn.get(i))) {
        return false;
      }
    }
    return true;
  }
}
