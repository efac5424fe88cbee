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

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import javax.annotation.Nullable;

/**
 * A node, source or exposure as recorded in the {@link Manifest}. The selector only ever reads
 * members; they are owned by the manifest.
 */
@AutoValue
public abstract class GraphMember {

  public abstract NodeId getId();

  public abstract MemberType getMemberType();

  public abstract ResourceKind getResourceKind();

  /** Display name, e.g. the model name or the source table name. */
  public abstract String getName();

  public abstract boolean isEnabled();

  /** True if the member has no materializable content. */
  public abstract boolean isEmpty();

  /** The direct parents of this member, in declaration order. */
  public abstract ImmutableList<NodeId> getDependsOn();

  /** Fully qualified name segments, e.g. {@code [jaffle_shop, staging, stg_orders]}. */
  public abstract ImmutableList<String> getFqn();

  public abstract ImmutableSet<String> getTags();

  /** Flattened config values, e.g. {@code materialized -> view}. */
  public abstract ImmutableMap<String, String> getConfig();

  @Nullable
  public abstract String getOriginalFilePath();

  /** For sources, the name of the source the table belongs to. */
  @Nullable
  public abstract String getSourceName();

  /**
   * Returns a builder with the common defaults: enabled, non-empty, no parents and no tags. The
   * fully qualified name defaults to the display name.
   */
  public static Builder builder(NodeId id, MemberType memberType, ResourceKind resourceKind) {
    return new AutoValue_GraphMember.Builder()
        .setId(id)
        .setMemberType(memberType)
        .setResourceKind(resourceKind)
        .setEnabled(true)
        .setEmpty(false)
        .setDependsOn(ImmutableList.of())
        .setFqn(ImmutableList.of())
        .setTags(ImmutableSet.of())
        .setConfig(ImmutableMap.of());
  }

  public abstract Builder toBuilder();

  /** Builder for {@link GraphMember}. */
  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setId(NodeId id);

    public abstract Builder setMemberType(MemberType memberType);

    public abstract Builder setResourceKind(ResourceKind resourceKind);

    public abstract Builder setName(String name);

    public abstract Builder setEnabled(boolean enabled);

    public abstract Builder setEmpty(boolean empty);

    public abstract Builder setDependsOn(ImmutableList<NodeId> dependsOn);

    public abstract Builder setFqn(ImmutableList<String> fqn);

    public abstract Builder setTags(ImmutableSet<String> tags);

    public abstract Builder setConfig(ImmutableMap<String, String> config);

    public abstract Builder setOriginalFilePath(@Nullable String originalFilePath);

    public abstract Builder setSourceName(@Nullable String sourceName);

    abstract String getName();

    abstract ImmutableList<String> getFqn();

    abstract GraphMember autoBuild();

    public GraphMember build() {
      if (getFqn().isEmpty()) {
        setFqn(ImmutableList.of(getName()));
      }
      return autoBuild();
    }
  }
}
