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
import java.io.PrintStream;

/**
 * Prints events of the given kinds. Warnings go to the error stream, everything else to the
 * output stream.
 */
public class PrintingEventHandler implements EventHandler {
  private final PrintStream out;
  private final PrintStream err;
  private final ImmutableSet<EventKind> mask;

  public PrintingEventHandler(PrintStream out, PrintStream err, ImmutableSet<EventKind> mask) {
    this.out = out;
    this.err = err;
    this.mask = mask;
  }

  @Override
  public void handle(Event event) {
    if (!mask.contains(event.getKind())) {
      return;
    }
    switch (event.getKind()) {
      case WARNING:
        err.println(format(event));
        break;
      case INFO:
      case DEBUG:
        out.println(format(event));
        break;
    }
  }

  private static String format(Event event) {
    return event.getKind().name() + ": " + event.getMessage();
  }
}
