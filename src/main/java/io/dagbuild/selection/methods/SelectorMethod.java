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
package io.dagbuild.selection.methods;

import com.google.common.collect.ImmutableSet;
import io.dagbuild.selection.graph.NodeId;
import java.util.Set;

/** Picks the members a selection criterion names, e.g. every member tagged {@code nightly}. */
@FunctionalInterface
public interface SelectorMethod {

  /**
   * Returns the subset of {@code candidates} that matches {@code value}. Must not have side
   * effects.
   *
   * @throws InvalidSelectorMethodException if {@code value} is not valid for this method
   */
  ImmutableSet<NodeId> search(Set<NodeId> candidates, String value)
      throws InvalidSelectorMethodException;
}
