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

import io.dagbuild.selection.graph.GraphMember;

/**
 * Decides which selected members a {@link NodeSelector} returns. Members that do not match are
 * dropped after selection; they still take part in graph traversal.
 */
@FunctionalInterface
public interface NodeMatcher {

  /** Keeps every member. */
  NodeMatcher ALL = member -> true;

  boolean matches(GraphMember member);
}
