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
import com.google.common.graph.ImmutableGraph;
import java.util.OptionalInt;
import java.util.Set;
import javax.annotation.concurrent.ThreadSafe;

/**
 * Read-only view of the dependency graph used by node selection. Edges point from a parent to the
 * members that depend on it, so successors are children and predecessors are parents.
 *
 * <p>Implementations are immutable snapshots: every query is pure, and derived graphs are new
 * objects that never alias or mutate this one.
 */
@ThreadSafe
public interface SelectableGraph {

  /** Returns every member id in the graph. */
  ImmutableSet<NodeId> nodes();

  /**
   * Returns the subgraph induced by {@code ids}: exactly those of {@code ids} that are in this
   * graph, and the edges between them. Ids not in this graph are ignored.
   */
  SelectableGraph subgraph(Set<NodeId> ids);

  /**
   * Returns every ancestor of {@code ids} reachable within {@code maxDepth} hops, or at any
   * distance when {@code maxDepth} is empty. A depth of 1 means direct parents only. Members of
   * {@code ids} are only returned if they are themselves an ancestor of another member of {@code
   * ids}.
   */
  ImmutableSet<NodeId> selectParents(Set<NodeId> ids, OptionalInt maxDepth);

  /** Descendant counterpart of {@link #selectParents}. */
  ImmutableSet<NodeId> selectChildren(Set<NodeId> ids, OptionalInt maxDepth);

  /**
   * Returns the children of {@code ids} together with {@code ids}, plus every ancestor of that
   * set. This pulls in whatever else a child needs to build.
   */
  ImmutableSet<NodeId> selectChildrensParents(Set<NodeId> ids);

  /** Returns the direct children of {@code ids}. */
  ImmutableSet<NodeId> selectSuccessors(Set<NodeId> ids);

  /**
   * Returns a graph over exactly {@code ids} that keeps the ordering of the full graph: if a
   * selected member transitively depends on another selected member through members outside
   * {@code ids}, the two are connected directly.
   *
   * @throws IllegalArgumentException if some id is not in this graph
   */
  SelectableGraph getSubsetGraph(Set<NodeId> ids);

  /** Returns the underlying directed graph, for handing off to a scheduler. */
  ImmutableGraph<NodeId> asGraph();
}
