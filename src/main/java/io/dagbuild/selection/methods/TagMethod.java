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

import io.dagbuild.selection.graph.GraphMember;
import io.dagbuild.selection.graph.Manifest;

/** Matches members carrying a tag, e.g. {@code tag:nightly}. */
final class TagMethod extends MemberMethod {
  static final String NAME = "tag";

  TagMethod(Manifest manifest) {
    super(manifest);
  }

  @Override
  boolean matches(GraphMember member, String value) {
    return member.getTags().stream().anyMatch(tag -> Globs.matches(value, tag));
  }
}
