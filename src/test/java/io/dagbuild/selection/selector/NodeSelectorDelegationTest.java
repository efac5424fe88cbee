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

import static com.google.common.truth.Truth.assertThat;
import static io.dagbuild.selection.testutil.SelectionTestHelper.manifest;
import static io.dagbuild.selection.testutil.SelectionTestHelper.model;
import static io.dagbuild.selection.testutil.SelectionTestHelper.modelId;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoMoreInteractions;
import static org.mockito.Mockito.when;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import io.dagbuild.selection.events.Event;
import io.dagbuild.selection.events.EventHandler;
import io.dagbuild.selection.graph.DependencyGraph;
import io.dagbuild.selection.graph.ImmutableManifest;
import io.dagbuild.selection.methods.InvalidSelectorMethodException;
import io.dagbuild.selection.methods.MethodRegistry;
import io.dagbuild.selection.methods.SelectorMethod;
import io.dagbuild.selection.spec.SelectionCriteria;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests how {@link NodeSelector} uses its method registry and event handler. */
@RunWith(JUnit4.class)
public final class NodeSelectorDelegationTest {
  private final MethodRegistry registry = mock(MethodRegistry.class);
  private final SelectorMethod method = mock(SelectorMethod.class);
  private final EventHandler eventHandler = mock(EventHandler.class);

  private ImmutableManifest manifest;
  private NodeSelector selector;

  @Before
  public void setUp() {
    manifest =
        manifest(
            model("orders"),
            model("customers"),
            model("legacy", modelId("orders")).setEnabled(false));
    selector =
        NodeSelector.builder(DependencyGraph.fromManifest(manifest), manifest)
            .setMethodRegistry(registry)
            .setEventHandler(eventHandler)
            .build();
  }

  @Test
  public void methodIsLookedUpWithArgumentsAndSearchesMembersOnly() throws Exception {
    ImmutableMap<String, String> arguments = ImmutableMap.of("key", "materialized");
    when(registry.getMethod("config", arguments)).thenReturn(method);
    when(method.search(any(), eq("view"))).thenReturn(ImmutableSet.of(modelId("orders")));
    SelectionCriteria criteria =
        SelectionCriteria.builder("config", "view").setMethodArguments(arguments).build();

    assertThat(selector.getSelected(criteria)).containsExactly(modelId("orders"));

    verify(method).search(ImmutableSet.of(modelId("orders"), modelId("customers")), "view");
    verifyNoMoreInteractions(eventHandler);
  }

  @Test
  public void rejectedMethodIsReported() throws Exception {
    when(registry.getMethod("state", ImmutableMap.of()))
        .thenThrow(new InvalidSelectorMethodException("state", "no previous state"));
    when(registry.getMethodNames()).thenReturn(ImmutableSet.of("fqn", "tag"));

    assertThat(selector.getSelected(SelectionCriteria.builder("state", "modified").build()))
        .isEmpty();

    verify(eventHandler)
        .handle(
            Event.info(
                "The 'state' selector specified in state:modified is invalid. Must be one of"
                    + " [fqn, tag]"));
    verifyNoMoreInteractions(eventHandler);
  }
}
