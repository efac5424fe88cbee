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

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import io.dagbuild.selection.graph.Manifest;
import java.util.function.Function;

/**
 * The built-in selector methods, bound to one manifest: {@code fqn}, {@code tag}, {@code
 * resource_type}, {@code path}, {@code source}, {@code exposure} and {@code config}.
 */
public final class DefaultMethodRegistry implements MethodRegistry {
  private final Manifest manifest;
  private final ImmutableMap<String, Function<Manifest, SelectorMethod>> simpleMethods;

  public DefaultMethodRegistry(Manifest manifest) {
    this.manifest = manifest;
    this.simpleMethods =
        ImmutableMap.<String, Function<Manifest, SelectorMethod>>builder()
            .put(QualifiedNameMethod.NAME, QualifiedNameMethod::new)
            .put(TagMethod.NAME, TagMethod::new)
            .put(ResourceTypeMethod.NAME, ResourceTypeMethod::new)
            .put(PathMethod.NAME, PathMethod::new)
            .put(SourceMethod.NAME, SourceMethod::new)
            .put(ExposureMethod.NAME, ExposureMethod::new)
            .buildOrThrow();
  }

  @Override
  public SelectorMethod getMethod(String name, ImmutableMap<String, String> arguments)
      throws InvalidSelectorMethodException {
    if (name.equals(ConfigMethod.NAME)) {
      String key = arguments.get(ConfigMethod.KEY_ARGUMENT);
      if (key == null || key.isEmpty()) {
        throw new InvalidSelectorMethodException(
            name, "Invalid config selector: missing '" + ConfigMethod.KEY_ARGUMENT + "' argument");
      }
      return new ConfigMethod(manifest, key);
    }
    Function<Manifest, SelectorMethod> factory = simpleMethods.get(name);
    if (factory == null) {
      throw new InvalidSelectorMethodException(
          name,
          "Unknown selector method '"
              + name
              + "', must be one of ["
              + Joiner.on(", ").join(getMethodNames())
              + "]");
    }
    if (!arguments.isEmpty()) {
      throw new InvalidSelectorMethodException(
          name, "Selector method '" + name + "' takes no arguments, got " + arguments);
    }
    return factory.apply(manifest);
  }

  @Override
  public ImmutableSet<String> getMethodNames() {
    return ImmutableSet.<String>builder()
        .addAll(simpleMethods.keySet())
        .add(ConfigMethod.NAME)
        .build();
  }
}
