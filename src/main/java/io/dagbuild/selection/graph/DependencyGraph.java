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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;
import com.google.common.graph.GraphBuilder;
import com.google.common.graph.Graphs;
import com.google.common.graph.ImmutableGraph;
import com.google.common.graph.MutableGraph;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.OptionalInt;
import java.util.Set;
import java.util.function.Function;
import javax.annotation.concurrent.Immutable;

/** {@link SelectableGraph} backed by a Guava {@link ImmutableGraph}. */
@Immutable
public final class DependencyGraph implements SelectableGraph {
  private final ImmutableGraph<NodeId> graph;

  private DependencyGraph(ImmutableGraph<NodeId> graph) {
    checkArgument(graph.isDirected(), "dependency graph must be directed: %s", graph);
    this.graph = graph;
  }

  public static DependencyGraph of(ImmutableGraph<NodeId> graph) {
    return new DependencyGraph(graph);
  }

  /**
   * Builds the graph of every member in {@code manifest}, with an edge from each {@code
   * depends_on} parent to the member that declares it.
   *
   * @throws IllegalStateException if a member depends on an id the manifest does not know
   */
  public static DependencyGraph fromManifest(Manifest manifest) {
    Builder builder = builder();
    for (NodeId id : manifest.getIds()) {
      builder.addNode(id);
    }
    for (NodeId id : manifest.getIds()) {
      for (NodeId parent : manifest.getOrThrow(id).getDependsOn()) {
        if (manifest.get(parent) == null) {
          throw new IllegalStateException(
              "Node " + id + " depends on " + parent + " which is not in the manifest");
        }
        builder.addDependency(parent, id);
      }
    }
    return builder.build();
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override
  public ImmutableSet<NodeId> nodes() {
    return ImmutableSet.copyOf(graph.nodes());
  }

  @Override
  public DependencyGraph subgraph(Set<NodeId> ids) {
    Set<NodeId> present = Sets.intersection(ids, graph.nodes());
    return new DependencyGraph(ImmutableGraph.copyOf(Graphs.inducedSubgraph(graph, present)));
  }

  @Override
  public ImmutableSet<NodeId> selectParents(Set<NodeId> ids, OptionalInt maxDepth) {
    return traverse(ids, maxDepth, graph::predecessors);
  }

  @Override
  public ImmutableSet<NodeId> selectChildren(Set<NodeId> ids, OptionalInt maxDepth) {
    return traverse(ids, maxDepth, graph::successors);
  }

  @Override
  public ImmutableSet<NodeId> selectChildrensParents(Set<NodeId> ids) {
    Set<NodeId> ancestorsFor = new LinkedHashSet<>(selectChildren(ids, OptionalInt.empty()));
    ancestorsFor.addAll(Sets.intersection(ids, graph.nodes()));
    return ImmutableSet.<NodeId>builder()
        .addAll(selectParents(ancestorsFor, OptionalInt.empty()))
        .addAll(ancestorsFor)
        .build();
  }

  @Override
  public ImmutableSet<NodeId> selectSuccessors(Set<NodeId> ids) {
    ImmutableSet.Builder<NodeId> successors = ImmutableSet.builder();
    for (NodeId id : ids) {
      if (graph.nodes().contains(id)) {
        successors.addAll(graph.successors(id));
      }
    }
    return successors.build();
  }

  @Override
  public DependencyGraph getSubsetGraph(Set<NodeId> ids) {
    for (NodeId id : ids) {
      checkArgument(graph.nodes().contains(id), "Node %s is not in the graph", id);
    }
    MutableGraph<NodeId> subset =
        GraphBuilder.directed().allowsSelfLoops(false).expectedNodeCount(ids.size()).build();
    ids.forEach(subset::addNode);
    for (NodeId id : ids) {
      // Walk down through unselected members until the next selected ones.
      Deque<NodeId> pending = new ArrayDeque<>(graph.successors(id));
      Set<NodeId> visited = new HashSet<>();
      while (!pending.isEmpty()) {
        NodeId next = pending.pop();
        if (!visited.add(next)) {
          continue;
        }
        if (ids.contains(next)) {
          subset.putEdge(id, next);
        } else {
          pending.addAll(graph.successors(next));
        }
      }
    }
    return new DependencyGraph(ImmutableGraph.copyOf(subset));
  }

  @Override
  public ImmutableGraph<NodeId> asGraph() {
    return graph;
  }

  /**
   * Breadth-first walk from each of {@code ids} separately, so that depth is counted from every
   * start node and start nodes are only reported when reachable from another one.
   */
  private ImmutableSet<NodeId> traverse(
      Set<NodeId> ids, OptionalInt maxDepth, Function<NodeId, Set<NodeId>> next) {
    checkArgument(
        maxDepth.isEmpty() || maxDepth.getAsInt() >= 0, "negative depth: %s", maxDepth);
    Set<NodeId> result = new LinkedHashSet<>();
    for (NodeId start : ids) {
      if (!graph.nodes().contains(start)) {
        continue;
      }
      Set<NodeId> seen = new HashSet<>();
      seen.add(start);
      List<NodeId> frontier = ImmutableList.of(start);
      int depth = 0;
      while (!frontier.isEmpty() && (maxDepth.isEmpty() || depth < maxDepth.getAsInt())) {
        List<NodeId> nextFrontier = new ArrayList<>();
        for (NodeId node : frontier) {
          for (NodeId neighbor : next.apply(node)) {
            if (seen.add(neighbor)) {
              nextFrontier.add(neighbor);
              result.add(neighbor);
            }
          }
        }
        frontier = nextFrontier;
        depth++;
      }
    }
    return ImmutableSet.copyOf(result);
  }

  @Override
  public String toString() {
    return "DependencyGraph{nodes="
        + graph.nodes().size()
        + ", edges="
        + graph.edges().size()
        + "}";
  }

  /** Builder for {@link DependencyGraph}. */
  public static final class Builder {
    private final MutableGraph<NodeId> graph =
        GraphBuilder.directed().allowsSelfLoops(false).build();

    private Builder() {}

    @CanIgnoreReturnValue
    public Builder addNode(NodeId id) {
      graph.addNode(id);
      return this;
    }

    /** Adds an edge meaning {@code child} depends on {@code parent}. */
    @CanIgnoreReturnValue
    public Builder addDependency(NodeId parent, NodeId child) {
      graph.putEdge(parent, child);
      return this;
    }

    public DependencyGraph build() {
      return new DependencyGraph(ImmutableGraph.copyOf(graph));
    }
  }
}
