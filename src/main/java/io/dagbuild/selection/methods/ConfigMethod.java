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

/** Matches members by a config value, e.g. {@code config.materialized:view}. */
final class ConfigMethod extends MemberMethod {
  static final String NAME = "config";
  static final String KEY_ARGUMENT = "key";

  private final String key;

  ConfigMethod(Manifest manifest, String key) {
    super(manifest);
    this.key = key;
  }

  @Override
  boolean matches(GraphMember member, String value) {
    String configured = member.getConfig().get(key);
    return configured != null && Globs.matches(value, configured);
  }
}
