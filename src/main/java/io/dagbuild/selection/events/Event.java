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

import com.google.auto.value.AutoValue;

/** A message for the user, such as a warning that part of a selection matched nothing. */
@AutoValue
public abstract class Event {

  public abstract EventKind getKind();

  public abstract String getMessage();

  public static Event of(EventKind kind, String message) {
    return new AutoValue_Event(kind, message);
  }

  public static Event warn(String message) {
    return of(EventKind.WARNING, message);
  }

  public static Event info(String message) {
    return of(EventKind.INFO, message);
  }

  public static Event debug(String message) {
    return of(EventKind.DEBUG, message);
  }

  @Override
  public final String toString() {
    return getKind() + ": " + getMessage();
  }
}
