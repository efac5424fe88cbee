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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.Interner;
import com.google.common.collect.Interners;
import javax.annotation.concurrent.Immutable;

/**
 * Unique identifier of a graph member, e.g. {@code model.jaffle_shop.orders}. Ids are stable for
 * the lifetime of one manifest snapshot and are interned, so equal ids are usually the same
 * instance.
 */
@Immutable
public final class NodeId implements Comparable<NodeId> {
  private static final Interner<NodeId> interner = Interners.newWeakInterner();

  private final String id;

  private NodeId(String id) {
    this.id = id;
  }

  public static NodeId of(String id) {
    checkNotNull(id, "id");
    checkArgument(!id.isEmpty(), "node id must not be empty");
    return interner.intern(new NodeId(id));
  }

  public String getId() {
    return id;
  }

  @Override
  public int compareTo(NodeId other) {
    return id.compareTo(other.id);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof NodeId)) {
      return false;
    }
    return id.equals(((NodeId) obj).id);
  }

  @Override
  public int hashCode() {
    return id.hashCode();
  }

  @Override
  public String toString() {
    return id;
  }
}
