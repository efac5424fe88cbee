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
package io.dagbuild.selection.events;

import com.google.common.collect.ImmutableSet;
import java.util.EnumSet;

/** Severity of an {@link Event}. */
public enum EventKind {
  WARNING,
  INFO,
  /** Detail only shown when the user asks for verbose output. */
  DEBUG;

  public static final ImmutableSet<EventKind> ALL_EVENTS =
      ImmutableSet.copyOf(EnumSet.allOf(EventKind.class));

  /** The kinds shown by default: everything but {@link #DEBUG}. */
  public static final ImmutableSet<EventKind> ALL_EXCEPT_DEBUG =
      ImmutableSet.copyOf(EnumSet.complementOf(EnumSet.of(DEBUG)));
}
