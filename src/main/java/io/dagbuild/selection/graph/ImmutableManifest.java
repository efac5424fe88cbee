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

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;

/** A {@link Manifest} backed by an immutable map. */
@Immutable
public final class ImmutableManifest implements Manifest {
  private final ImmutableMap<NodeId, GraphMember> members;

  private ImmutableManifest(ImmutableMap<NodeId, GraphMember> members) {
    this.members = members;
  }

  @Override
  @Nullable
  public GraphMember get(NodeId id) {
    return members.get(id);
  }

  @Override
  public ImmutableSet<NodeId> getIds() {
    return members.keySet();
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Builder for {@link ImmutableManifest}. Duplicate ids are rejected at build time. */
  public static final class Builder {
    private final ImmutableMap.Builder<NodeId, GraphMember> members = ImmutableMap.builder();

    private Builder() {}

    @CanIgnoreReturnValue
    public Builder add(GraphMember member) {
      members.put(member.getId(), member);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder addAll(Iterable<GraphMember> toAdd) {
      for (GraphMember member : toAdd) {
        add(member);
      }
      return this;
    }

    public ImmutableManifest build() {
      return new ImmutableManifest(members.buildOrThrow());
    }
  }
}
