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

import com.google.common.collect.ImmutableSet;
import io.dagbuild.selection.graph.GraphMember;
import io.dagbuild.selection.graph.Manifest;
import io.dagbuild.selection.graph.NodeId;
import java.util.Set;

/** A {@link SelectorMethod} that decides one manifest member at a time. */
abstract class MemberMethod implements SelectorMethod {
  private final Manifest manifest;

  MemberMethod(Manifest manifest) {
    this.manifest = manifest;
  }

  /** Checks {@code value} once per search, before any member is looked at. */
  void validate(String value) throws InvalidSelectorMethodException {}

  abstract boolean matches(GraphMember member, String value);

  @Override
  public final ImmutableSet<NodeId> search(Set<NodeId> candidates, String value)
      throws InvalidSelectorMethodException {
    validate(value);
    ImmutableSet.Builder<NodeId> matched = ImmutableSet.builder();
    for (NodeId id : candidates) {
      if (matches(manifest.getOrThrow(id), value)) {
        matched.add(id);
      }
    }
    return matched.build();
  }
}
