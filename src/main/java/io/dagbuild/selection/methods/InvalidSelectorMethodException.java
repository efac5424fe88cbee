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

/** Thrown when a selection names an unknown method or passes a method an unusable value. */
public class InvalidSelectorMethodException extends Exception {
  private final String methodName;

  public InvalidSelectorMethodException(String methodName, String message) {
    super(message);
    this.methodName = methodName;
  }

  public String getMethodName() {
    return methodName;
  }
}
