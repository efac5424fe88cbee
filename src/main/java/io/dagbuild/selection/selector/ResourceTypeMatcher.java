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

import com.google.common.collect.ImmutableSet;
import io.dagbuild.selection.graph.GraphMember;
import io.dagbuild.selection.graph.ResourceKind;

/** Keeps only members of the configured resource kinds, e.g. only tests for a test command. */
public final class ResourceTypeMatcher implements NodeMatcher {
  private final ImmutableSet<ResourceKind> resourceKinds;

  public ResourceTypeMatcher(Iterable<ResourceKind> resourceKinds) {
    this.resourceKinds = ImmutableSet.copyOf(resourceKinds);
  }

  public static ResourceTypeMatcher of(ResourceKind... resourceKinds) {
    return new ResourceTypeMatcher(ImmutableSet.copyOf(resourceKinds));
  }

  @Override
  public boolean matches(GraphMember member) {
    return resourceKinds.contains(member.getResourceKind());
  }

  @Override
  public String toString() {
    return "ResourceTypeMatcher" + resourceKinds;
  }
}
