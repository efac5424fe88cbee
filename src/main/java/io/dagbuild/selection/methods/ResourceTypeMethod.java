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

import io.dagbuild.selection.graph.GraphMember;
import io.dagbuild.selection.graph.Manifest;
import io.dagbuild.selection.graph.ResourceKind;

/** Matches members of one resource kind, e.g. {@code resource_type:seed}. */
final class ResourceTypeMethod extends MemberMethod {
  static final String NAME = "resource_type";

  ResourceTypeMethod(Manifest manifest) {
    super(manifest);
  }

  @Override
  void validate(String value) throws InvalidSelectorMethodException {
    if (ResourceKind.fromSelectorName(value) == null) {
      throw new InvalidSelectorMethodException(
          NAME, "Invalid resource_type selector '" + value + "'");
    }
  }

  @Override
  boolean matches(GraphMember member, String value) {
    return member.getResourceKind() == ResourceKind.fromSelectorName(value);
  }
}
