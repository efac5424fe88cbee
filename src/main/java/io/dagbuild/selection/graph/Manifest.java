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
package io.dagbuild.selection.graph;

import com.google.common.collect.ImmutableSet;
import javax.annotation.Nullable;

/**
 * Lookup of {@link GraphMember}s by id over one snapshot of a project. Nodes, sources and
 * exposures share a single id space, so one lookup answers for all of them.
 */
public interface Manifest {

  /** Returns the member with the given id, or {@code null} if the manifest has none. */
  @Nullable
  GraphMember get(NodeId id);

  /** Returns the ids of every member, enabled or not. */
  ImmutableSet<NodeId> getIds();

  /**
   * Returns the member with the given id.
   *
   * @throws IllegalStateException if the manifest has no such member. Ids handed around during
   *     selection all come from the graph built off this manifest, so a miss is a bug, not a user
   *     error.
   */
  default GraphMember getOrThrow(NodeId id) {
    GraphMember member = get(id);
    if (member == null) {
      throw new IllegalStateException("Node " + id + " not found in the manifest!");
    }
    return member;
  }
}
