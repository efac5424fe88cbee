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
import java.util.Arrays;
import java.util.function.Function;
import javax.annotation.Nullable;

/** The kind of resource a graph member represents. */
public enum ResourceKind {
  MODEL("model"),
  ANALYSIS("analysis"),
  TEST("test"),
  SNAPSHOT("snapshot"),
  OPERATION("operation"),
  SEED("seed"),
  RPC("rpc"),
  SQL_OPERATION("sql operation"),
  DOCUMENTATION("docs block"),
  SOURCE("source"),
  MACRO("macro"),
  EXPOSURE("exposure");

  private static final ImmutableMap<String, ResourceKind> BY_SELECTOR_NAME =
      Arrays.stream(values())
          .collect(ImmutableMap.toImmutableMap(ResourceKind::getSelectorName, Function.identity()));

  private final String selectorName;

  ResourceKind(String selectorName) {
    this.selectorName = selectorName;
  }

  /** The name used for this kind in {@code resource_type:} selections and in diagnostics. */
  public String getSelectorName() {
    return selectorName;
  }

  /** Returns the kind with the given selector name, or {@code null} if there is none. */
  @Nullable
  public static ResourceKind fromSelectorName(String selectorName) {
    return BY_SELECTOR_NAME.get(selectorName);
  }
}
