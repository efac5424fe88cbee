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

/**
 * Which manifest collection a {@link GraphMember} comes from. Each kind has its own rule for
 * whether it takes part in selection.
 */
public enum MemberType {
  /** A buildable node: model, test, seed, snapshot and so on. */
  NODE,
  /** A source table declared in the project. */
  SOURCE,
  /** A downstream use of the project, such as a dashboard. */
  EXPOSURE
}
