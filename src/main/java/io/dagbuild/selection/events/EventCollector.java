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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/** Stores the events of the given kinds, in arrival order. */
public final class EventCollector implements EventHandler, Iterable<Event> {
  private final ImmutableSet<EventKind> mask;
  private final List<Event> events = new ArrayList<>();

  /** Collects events of every kind. */
  public EventCollector() {
    this(EventKind.ALL_EVENTS);
  }

  public EventCollector(ImmutableSet<EventKind> mask) {
    this.mask = mask;
  }

  @Override
  public synchronized void handle(Event event) {
    if (mask.contains(event.getKind())) {
      events.add(event);
    }
  }

  public synchronized ImmutableList<Event> getEvents() {
    return ImmutableList.copyOf(events);
  }

  /** Returns the collected events of one kind. */
  public synchronized ImmutableList<Event> filtered(EventKind kind) {
    return events.stream()
        .filter(event -> event.getKind() == kind)
        .collect(ImmutableList.toImmutableList());
  }

  public synchronized int count() {
    return events.size();
  }

  public synchronized void clear() {
    events.clear();
  }

  @Override
  public Iterator<Event> iterator() {
    return getEvents().iterator();
  }
}
