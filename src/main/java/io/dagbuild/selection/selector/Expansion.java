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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableSet;
import io.dagbuild.selection.graph.NodeId;

/**
 * The members one step of selection picked. {@code direct} members are selected outright; {@code
 * indirect} ones are tests that may still be selected once the rest of their parents are.
 */
public record Expansion(ImmutableSet<NodeId> direct, ImmutableSet<NodeId> indirect) {
  public static final Expansion EMPTY = new Expansion(ImmutableSet.of(), ImmutableSet.of());

  public Expansion {
    requireNonNull(direct, "direct");
    requireNonNull(indirect, "indirect");
  }
}
