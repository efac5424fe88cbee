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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;
import io.dagbuild.selection.graph.NodeId;

/**
 * Outcome of evaluating a whole spec, before filtering.
 *
 * @param direct the selected members
 * @param indirectOnly tests that were candidates for indirect selection but never had all their
 *     parents selected; disjoint from {@code direct}
 */
public record SelectionResult(ImmutableSet<NodeId> direct, ImmutableSet<NodeId> indirectOnly) {
  public SelectionResult {
    requireNonNull(direct, "direct");
    requireNonNull(indirectOnly, "indirectOnly");
    checkArgument(
        Sets.intersection(direct, indirectOnly).isEmpty(),
        "indirect-only members also selected directly: %s",
        Sets.intersection(direct, indirectOnly));
  }
}
