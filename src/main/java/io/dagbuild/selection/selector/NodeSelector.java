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
package io.dagbuild.selection.selector;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.collect.ImmutableList.toImmutableList;
import static com.google.common.collect.ImmutableSet.toImmutableSet;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.flogger.GoogleLogger;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import io.dagbuild.selection.events.Event;
import io.dagbuild.selection.events.EventHandler;
import io.dagbuild.selection.graph.GraphMember;
import io.dagbuild.selection.graph.GraphQueue;
import io.dagbuild.selection.graph.Manifest;
import io.dagbuild.selection.graph.NodeId;
import io.dagbuild.selection.graph.ResourceKind;
import io.dagbuild.selection.graph.SelectableGraph;
import io.dagbuild.selection.methods.DefaultMethodRegistry;
import io.dagbuild.selection.methods.InvalidSelectorMethodException;
import io.dagbuild.selection.methods.MethodRegistry;
import io.dagbuild.selection.methods.SelectorMethod;
import io.dagbuild.selection.spec.SelectionCriteria;
import io.dagbuild.selection.spec.SelectionSpec;
import io.dagbuild.selection.spec.SetOperationSpec;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import javax.annotation.Nullable;

/**
 * Resolves {@link SelectionSpec}s against one graph and manifest snapshot.
 *
 * <p>Selection happens in three steps:
 *
 * <ol>
 *   <li>Each criterion picks members with its method, then widens the pick with the parents,
 *       children and children's parents its modifiers ask for.
 *   <li>Tests that depend on the picked members are pulled in. In greedy mode one selected parent
 *       is enough; otherwise every parent must be selected, and tests that are short of parents
 *       are carried along as indirect candidates so that later set operations can still complete
 *       them.
 *   <li>Set operations combine the results of their components, and the result is filtered
 *       through the selector's {@link NodeMatcher}.
 * </ol>
 *
 * <p>Only enabled, non-empty nodes and enabled sources and exposures take part. The selector
 * keeps no state between calls, so one instance may serve concurrent selections.
 */
public final class NodeSelector {
  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  private static final Joiner LIST_JOINER = Joiner.on("\n  - ");

  private final SelectableGraph fullGraph;
  private final SelectableGraph graph;
  private final Manifest manifest;
  private final MethodRegistry methods;
  private final NodeMatcher nodeMatcher;
  private final EventHandler eventHandler;
  private final SelectorOptions options;

  private NodeSelector(
      SelectableGraph fullGraph,
      Manifest manifest,
      MethodRegistry methods,
      NodeMatcher nodeMatcher,
      EventHandler eventHandler,
      SelectorOptions options) {
    this.fullGraph = fullGraph;
    this.manifest = manifest;
    this.methods = methods;
    this.nodeMatcher = nodeMatcher;
    this.eventHandler = eventHandler;
    this.options = options;
    ImmutableSet<NodeId> members =
        fullGraph.nodes().stream()
            .filter(id -> isGraphMember(manifest.getOrThrow(id)))
            .collect(toImmutableSet());
    this.graph = fullGraph.subgraph(members);
    logger.atFine().log(
        "Selecting among %d of %d graph nodes", members.size(), fullGraph.nodes().size());
  }

  public static Builder builder(SelectableGraph graph, Manifest manifest) {
    return new Builder(graph, manifest);
  }

  /** The graph selection runs over: the full graph restricted to selectable members. */
  public SelectableGraph getMemberGraph() {
    return graph;
  }

  /**
   * Returns the members {@code spec} selects, after filtering. Tests left out because some parent
   * was not selected are reported to the event handler.
   *
   * @throws SelectionException if a diagnostic was promoted to an error
   */
  public ImmutableSet<NodeId> getSelected(SelectionSpec spec) throws SelectionException {
    SelectionResult result = selectNodes(spec);
    ImmutableSet<NodeId> filtered = filterSelection(result.direct());
    if (!result.indirectOnly().isEmpty()) {
      ImmutableSet<NodeId> filteredUnused = filterSelection(result.indirectOnly());
      if (!filteredUnused.isEmpty()) {
        alertUnusedNodes(filteredUnused);
      }
    }
    logger.atFine().log("Selected %d nodes for '%s'", filtered.size(), spec.raw());
    return filtered;
  }

  /**
   * Selects the members of {@code spec} and returns a queue over them, ordered by the full
   * graph's dependencies. The queue owns the returned graph and set.
   */
  public GraphQueue getGraphQueue(SelectionSpec spec) throws SelectionException {
    ImmutableSet<NodeId> selected = getSelected(spec);
    SelectableGraph subset = fullGraph.getSubsetGraph(selected);
    return new GraphQueue(subset.asGraph(), selected);
  }

  /** Evaluates {@code spec} without filtering. */
  public SelectionResult selectNodes(SelectionSpec spec) throws SelectionException {
    Expansion expansion = selectNodesRecursively(spec);
    ImmutableSet<NodeId> indirectOnly =
        expansion.indirect().stream()
            .filter(id -> !expansion.direct().contains(id))
            .collect(toImmutableSet());
    return new SelectionResult(expansion.direct(), indirectOnly);
  }

  @VisibleForTesting
  Expansion selectNodesRecursively(SelectionSpec spec) throws SelectionException {
    Expansion result;
    if (spec instanceof SelectionCriteria criteria) {
      result = getNodesFromCriteria(criteria);
    } else {
      SetOperationSpec composite = (SetOperationSpec) spec;
      List<Set<NodeId>> directSets = new ArrayList<>();
      List<Set<NodeId>> indirectSets = new ArrayList<>();
      for (SelectionSpec component : composite.components()) {
        Expansion bundle = selectNodesRecursively(component);
        directSets.add(bundle.direct());
        // A component's indirect candidates only count alongside its direct members.
        Set<NodeId> available = new LinkedHashSet<>(bundle.direct());
        available.addAll(bundle.indirect());
        indirectSets.add(available);
      }
      ImmutableSet<NodeId> initialDirect = composite.operation().combine(directSets);
      ImmutableSet<NodeId> indirect = composite.operation().combine(indirectSets);
      result = new Expansion(incorporateIndirectNodes(initialDirect, indirect), indirect);
    }
    if (spec.expectExists() && result.direct().isEmpty()) {
      alertNonExistence(spec.raw());
    }
    return result;
  }

  /**
   * Resolves a single criterion: the members its method matches, their requested neighbors, and
   * the tests those pull in.
   */
  @VisibleForTesting
  Expansion getNodesFromCriteria(SelectionCriteria criteria) {
    ImmutableSet<NodeId> collected;
    try {
      SelectorMethod method =
          methods.getMethod(criteria.methodName(), criteria.methodArguments());
      collected = method.search(graph.nodes(), criteria.value());
    } catch (InvalidSelectorMethodException e) {
      logger.atFine().withCause(e).log("Invalid selector in %s", criteria.raw());
      eventHandler.handle(Event.info(invalidSelectorMessage(criteria, e)));
      return Expansion.EMPTY;
    }
    logger.atFine().log("'%s' matched %d nodes", criteria.raw(), collected.size());

    Set<NodeId> selected = new LinkedHashSet<>(collected);
    selected.addAll(collectSpecifiedNeighbors(criteria, collected));
    return expandSelection(selected, criteria.greedy());
  }

  private String invalidSelectorMessage(
      SelectionCriteria criteria, InvalidSelectorMethodException e) {
    if (!methods.getMethodNames().contains(e.getMethodName())) {
      return String.format(
          "The '%s' selector specified in %s is invalid. Must be one of [%s]",
          e.getMethodName(), criteria.raw(), Joiner.on(", ").join(methods.getMethodNames()));
    }
    return String.format(
        "The '%s' selector specified in %s is invalid: %s",
        e.getMethodName(), criteria.raw(), e.getMessage());
  }

  /**
   * Returns the members the modifiers of {@code criteria} add around {@code selected}. The result
   * may overlap {@code selected}.
   */
  private ImmutableSet<NodeId> collectSpecifiedNeighbors(
      SelectionCriteria criteria, Set<NodeId> selected) {
    ImmutableSet.Builder<NodeId> additional = ImmutableSet.builder();
    if (criteria.includeChildrensParents()) {
      additional.addAll(graph.selectChildrensParents(selected));
    }
    if (criteria.includeParents()) {
      additional.addAll(graph.selectParents(selected, criteria.parentsDepth()));
    }
    if (criteria.includeChildren()) {
      additional.addAll(graph.selectChildren(selected, criteria.childrenDepth()));
    }
    return additional.build();
  }

  /**
   * Pulls in the tests that directly depend on {@code selected}. In greedy mode any selected parent
   * is enough, which suits exclusions. Otherwise a test is only selected when all of its parents
   * are; the rest come back as indirect candidates.
   */
  @VisibleForTesting
  Expansion expandSelection(Set<NodeId> selected, boolean greedy) {
    Set<NodeId> direct = new LinkedHashSet<>(selected);
    Set<NodeId> indirect = new LinkedHashSet<>();
    for (NodeId id : graph.selectSuccessors(selected)) {
      GraphMember member = manifest.getOrThrow(id);
      if (!canSelectIndirectly(member)) {
        continue;
      }
      if (greedy || selected.containsAll(member.getDependsOn())) {
        direct.add(id);
      } else {
        indirect.add(id);
      }
    }
    logger.atFinest().log(
        "Expanded %d nodes (greedy=%s): %d direct, %d indirect",
        selected.size(), greedy, direct.size(), indirect.size());
    return new Expansion(ImmutableSet.copyOf(direct), ImmutableSet.copyOf(indirect));
  }

  /**
   * Adds to {@code direct} every member of {@code indirect} whose parents are all in {@code
   * direct}. A single pass is enough since indirect candidates are tests, and tests have no tests
   * among their parents.
   */
  @VisibleForTesting
  ImmutableSet<NodeId> incorporateIndirectNodes(Set<NodeId> direct, Set<NodeId> indirect) {
    Set<NodeId> selected = new LinkedHashSet<>(direct);
    for (NodeId id : indirect) {
      if (selected.containsAll(manifest.getOrThrow(id).getDependsOn())) {
        selected.add(id);
      }
    }
    return ImmutableSet.copyOf(selected);
  }

  /** Returns the members of {@code selected} that this selector's {@link NodeMatcher} keeps. */
  public ImmutableSet<NodeId> filterSelection(Set<NodeId> selected) {
    return selected.stream()
        .filter(id -> nodeMatcher.matches(manifest.getOrThrow(id)))
        .collect(toImmutableSet());
  }

  /** Only tests may be selected without being named. */
  private static boolean canSelectIndirectly(GraphMember member) {
    return member.getResourceKind() == ResourceKind.TEST;
  }

  private static boolean isGraphMember(GraphMember member) {
    switch (member.getMemberType()) {
      case SOURCE:
        return member.isEnabled();
      case EXPOSURE:
        return true;
      case NODE:
        return member.isEnabled() && !member.isEmpty();
    }
    throw new IllegalStateException("Unknown member type: " + member.getMemberType());
  }

  private void alertNonExistence(String raw) throws SelectionException {
    String message = "The selection criterion '" + raw + "' does not match any nodes";
    if (options.warningsAsErrors()) {
      throw new SelectionException(message);
    }
    eventHandler.handle(Event.warn(message));
  }

  private void alertUnusedNodes(Set<NodeId> unused) {
    ImmutableList<String> names =
        ImmutableList.sortedCopyOf(
            unused.stream()
                .map(id -> manifest.getOrThrow(id).getName())
                .collect(toImmutableList()));
    int limit = options.excludedSummaryLimit();
    String header = "Some tests were excluded because at least one parent is missing:\n  - ";
    String footer =
        "\nUse the " + options.indirectSelectionOverrideFlag() + " flag to include them";
    String debugMessage = header + LIST_JOINER.join(names) + footer;
    // At most limit + 1 names are always listed in full.
    String summaryMessage =
        names.size() <= limit + 1
            ? debugMessage
            : header
                + LIST_JOINER.join(names.subList(0, limit))
                + "\n  - and "
                + (names.size() - limit)
                + " more"
                + footer;
    eventHandler.handle(Event.info(summaryMessage));
    eventHandler.handle(Event.debug(debugMessage));
  }

  /** Builder for {@link NodeSelector}. */
  public static final class Builder {
    private final SelectableGraph graph;
    private final Manifest manifest;
    @Nullable private MethodRegistry methods;
    private NodeMatcher nodeMatcher = NodeMatcher.ALL;
    private EventHandler eventHandler = EventHandler.NOOP;
    private SelectorOptions options = SelectorOptions.DEFAULT;

    private Builder(SelectableGraph graph, Manifest manifest) {
      this.graph = checkNotNull(graph);
      this.manifest = checkNotNull(manifest);
    }

    /** Defaults to a {@link DefaultMethodRegistry} over the manifest. */
    @CanIgnoreReturnValue
    public Builder setMethodRegistry(MethodRegistry methods) {
      this.methods = checkNotNull(methods);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setNodeMatcher(NodeMatcher nodeMatcher) {
      this.nodeMatcher = checkNotNull(nodeMatcher);
      return this;
    }

    /** Restricts results to the given kinds, see {@link ResourceTypeMatcher}. */
    @CanIgnoreReturnValue
    public Builder restrictToResourceTypes(Iterable<ResourceKind> resourceKinds) {
      return setNodeMatcher(new ResourceTypeMatcher(resourceKinds));
    }

    @CanIgnoreReturnValue
    public Builder setEventHandler(EventHandler eventHandler) {
      this.eventHandler = checkNotNull(eventHandler);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setOptions(SelectorOptions options) {
      this.options = checkNotNull(options);
      return this;
    }

    public NodeSelector build() {
      return new NodeSelector(
          graph,
          manifest,
          methods != null ? methods : new DefaultMethodRegistry(manifest),
          nodeMatcher,
          eventHandler,
          options);
    }
  }
}
