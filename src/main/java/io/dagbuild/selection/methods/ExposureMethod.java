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

import com.google.common.base.Splitter;
import io.dagbuild.selection.graph.GraphMember;
import io.dagbuild.selection.graph.Manifest;
import io.dagbuild.selection.graph.MemberType;
import java.util.List;

/** Matches exposures as {@code exposure_name} or {@code package.exposure_name}. */
final class ExposureMethod extends MemberMethod {
  static final String NAME = "exposure";

  private static final Splitter DOT = Splitter.on('.');

  ExposureMethod(Manifest manifest) {
    super(manifest);
  }

  @Override
  void validate(String value) throws InvalidSelectorMethodException {
    if (DOT.splitToList(value).size() > 2) {
      throw new InvalidSelectorMethodException(
          NAME,
          "Invalid exposure selector value '"
              + value
              + "'. Exposures must be of the form `${exposure_name}` or"
              + " `${exposure_package.exposure_name}`");
    }
  }

  @Override
  boolean matches(GraphMember member, String value) {
    if (member.getMemberType() != MemberType.EXPOSURE) {
      return false;
    }
    List<String> parts = DOT.splitToList(value);
    if (parts.size() == 2 && !Globs.matches(parts.get(0), member.getFqn().get(0))) {
      return false;
    }
    return Globs.matches(parts.get(parts.size() - 1), member.getName());
  }
}
