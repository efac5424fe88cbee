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
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableSet;
import com.google.common.graph.ImmutableGraph;
import com.google.errorprone.annotations.concurrent.GuardedBy;
import java.util.HashSet;
import java.util.Set;
import javax.annotation.concurrent.ThreadSafe;

/**
 * Hands the selected members out in dependency order. A member becomes ready once every parent it
 * has in the graph is done. Workers may report completion concurrently.
 */
@ThreadSafe
public final class GraphQueue {
  private final ImmutableGraph<NodeId> graph;
  private final ImmutableSet<NodeId> selected;

  @GuardedBy("this")
  private final Set<NodeId> handedOut = new HashSet<>();

  @GuardedBy("this")
  private final Set<NodeId> done = new HashSet<>();

  public GraphQueue(ImmutableGraph<NodeId> graph, ImmutableSet<NodeId> selected) {
    checkArgument(
        graph.nodes().equals(selected),
        "queue graph must contain exactly the selected nodes: %s vs %s",
        graph.nodes(),
        selected);
    this.graph = graph;
    this.selected = selected;
  }

  public ImmutableGraph<NodeId> getGraph() {
    return graph;
  }

  public ImmutableSet<NodeId> getSelected() {
    return selected;
  }

  /**
   * Returns the members whose parents are all done and that have not been returned before. Each
   * member is returned at most once.
   */
  public synchronized ImmutableSet<NodeId> getReady() {
    ImmutableSet.Builder<NodeId> ready = ImmutableSet.builder();
    for (NodeId id : selected) {
      if (!handedOut.contains(id) && done.containsAll(graph.predecessors(id))) {
        handedOut.add(id);
        ready.add(id);
      }
    }
    return ready.build();
  }

  /** Records that {@code id}, previously returned by {@link #getReady}, has finished. */
  public synchronized void markDone(NodeId id) {
    checkArgument(selected.contains(id), "%s is not in the queue", id);
    checkState(handedOut.contains(id), "%s was marked done before it was handed out", id);
    done.add(id);
  }

  public synchronized boolean isComplete() {
    return done.size() == selected.size();
  }

  public synchronized int getRemainingCount() {
    return selected.size() - done.size();
  }
}
