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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.OptionalInt;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link DependencyGraph}. */
@RunWith(JUnit4.class)
public final class DependencyGraphTest {
  private static final NodeId A = NodeId.of("a");
  private static final NodeId B = NodeId.of("b");
  private static final NodeId C = NodeId.of("c");
  private static final NodeId D = NodeId.of("d");
  private static final NodeId X = NodeId.of("x");

  /**
   * <pre>
   * a -> b -> c -> d
   *           ^
   *           x
   * </pre>
   */
  private static DependencyGraph diamondish() {
    return DependencyGraph.builder()
        .addDependency(A, B)
        .addDependency(B, C)
        .addDependency(C, D)
        .addDependency(X, C)
        .build();
  }

  @Test
  public void selectParents_unbounded() {
    assertThat(diamondish().selectParents(ImmutableSet.of(C), OptionalInt.empty()))
        .containsExactly(A, B, X);
  }

  @Test
  public void selectParents_depthLimited() {
    DependencyGraph graph = diamondish();

    assertThat(graph.selectParents(ImmutableSet.of(D), OptionalInt.of(1))).containsExactly(C);
    assertThat(graph.selectParents(ImmutableSet.of(D), OptionalInt.of(2)))
        .containsExactly(C, B, X);
    assertThat(graph.selectParents(ImmutableSet.of(D), OptionalInt.of(0))).isEmpty();
  }

  @Test
  public void selectParents_excludesStartUnlessReachable() {
    DependencyGraph graph = diamondish();

    assertThat(graph.selectParents(ImmutableSet.of(B, C), OptionalInt.empty()))
        .containsExactly(A, B, X);
  }

  @Test
  public void selectParents_depthCountsFromEachStart() {
    DependencyGraph graph = diamondish();

    assertThat(graph.selectParents(ImmutableSet.of(B, D), OptionalInt.of(1)))
        .containsExactly(A, C);
  }

  @Test
  public void selectChildren() {
    DependencyGraph graph = diamondish();

    assertThat(graph.selectChildren(ImmutableSet.of(A), OptionalInt.empty()))
        .containsExactly(B, C, D);
    assertThat(graph.selectChildren(ImmutableSet.of(A), OptionalInt.of(2))).containsExactly(B, C);
    assertThat(graph.selectChildren(ImmutableSet.of(D), OptionalInt.empty())).isEmpty();
  }

  @Test
  public void selectChildrensParents() {
    assertThat(diamondish().selectChildrensParents(ImmutableSet.of(B)))
        .containsExactly(A, B, C, D, X);
  }

  @Test
  public void selectSuccessors_isOneHop() {
    assertThat(diamondish().selectSuccessors(ImmutableSet.of(A, X))).containsExactly(B, C);
  }

  @Test
  public void unknownIds_areIgnoredByQueries() {
    DependencyGraph graph = diamondish();
    NodeId missing = NodeId.of("missing");

    assertThat(graph.selectParents(ImmutableSet.of(missing), OptionalInt.empty())).isEmpty();
    assertThat(graph.selectSuccessors(ImmutableSet.of(missing))).isEmpty();
    assertThat(graph.subgraph(ImmutableSet.of(A, missing)).nodes()).containsExactly(A);
  }

  @Test
  public void negativeDepth_isRejected() {
    assertThrows(
        IllegalArgumentException.class,
        () -> diamondish().selectChildren(ImmutableSet.of(A), OptionalInt.of(-1)));
  }

  @Test
  public void subgraph_isInducedAndLeavesOriginalAlone() {
    DependencyGraph graph = diamondish();

    DependencyGraph subgraph = graph.subgraph(ImmutableSet.of(A, B, D));

    assertThat(subgraph.nodes()).containsExactly(A, B, D);
    assertThat(subgraph.asGraph().edges()).hasSize(1);
    assertThat(subgraph.asGraph().hasEdgeConnecting(A, B)).isTrue();
    assertThat(graph.nodes()).hasSize(5);
  }

  @Test
  public void getSubsetGraph_bridgesRemovedNodes() {
    DependencyGraph graph = diamondish();

    DependencyGraph subset = graph.getSubsetGraph(ImmutableSet.of(A, X, D));

    assertThat(subset.nodes()).containsExactly(A, X, D);
    assertThat(subset.asGraph().successors(A)).containsExactly(D);
    assertThat(subset.asGraph().successors(X)).containsExactly(D);
    assertThat(subset.asGraph().predecessors(A)).isEmpty();
  }

  @Test
  public void getSubsetGraph_rejectsUnknownIds() {
    assertThrows(
        IllegalArgumentException.class,
        () -> diamondish().getSubsetGraph(ImmutableSet.of(NodeId.of("missing"))));
  }

  @Test
  public void fromManifest_linksDependsOn() {
    NodeId orders = NodeId.of("model.shop.orders");
    NodeId check = NodeId.of("test.shop.not_null_orders_id");
    ImmutableManifest manifest =
        ImmutableManifest.builder()
            .add(
                GraphMember.builder(orders, MemberType.NODE, ResourceKind.MODEL)
                    .setName("orders")
                    .build())
            .add(
                GraphMember.builder(check, MemberType.NODE, ResourceKind.TEST)
                    .setName("not_null_orders_id")
                    .setDependsOn(ImmutableList.of(orders))
                    .build())
            .build();

    DependencyGraph graph = DependencyGraph.fromManifest(manifest);

    assertThat(graph.nodes()).containsExactly(orders, check);
    assertThat(graph.asGraph().successors(orders)).containsExactly(check);
  }

  @Test
  public void fromManifest_unknownParentIsInternalError() {
    ImmutableManifest manifest =
        ImmutableManifest.builder()
            .add(
                GraphMember.builder(A, MemberType.NODE, ResourceKind.MODEL)
                    .setName("a")
                    .setDependsOn(ImmutableList.of(B))
                    .build())
            .build();

    assertThrows(IllegalStateException.class, () -> DependencyGraph.fromManifest(manifest));
  }
}
