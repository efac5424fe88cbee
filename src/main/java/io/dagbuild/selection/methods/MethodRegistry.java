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

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

/** Looks up {@link SelectorMethod}s by the name used in selection syntax. */
public interface MethodRegistry {

  /**
   * Returns the method called {@code name}, configured with {@code arguments}.
   *
   * @throws InvalidSelectorMethodException if there is no such method or it rejects the arguments
   */
  SelectorMethod getMethod(String name, ImmutableMap<String, String> arguments)
      throws InvalidSelectorMethodException;

  /** The names {@link #getMethod} accepts, in a stable order. */
  ImmutableSet<String> getMethodNames();
}
