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
package io.dagbuild.selection.spec;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.OptionalInt;
import javax.annotation.Nullable;

/**
 * A single selection criterion such as {@code +tag:nightly+2}: a method and value that pick the
 * initial members, plus modifiers that widen the pick along the graph.
 *
 * @param methodName selector method, e.g. {@code fqn} or {@code tag}
 * @param methodArguments extra arguments to the method, e.g. for {@code config.materialized}
 * @param value the pattern handed to the method
 * @param includeParents whether to add ancestors of the matched members
 * @param parentsDepth how many hops of ancestors to add, unbounded if empty
 * @param includeChildren whether to add descendants of the matched members
 * @param childrenDepth how many hops of descendants to add, unbounded if empty
 * @param includeChildrensParents whether to add descendants and everything they depend on
 * @param greedy whether tests are pulled in when any, rather than all, of their parents are
 *     selected
 * @param expectExists whether matching nothing is reported to the user
 * @param raw the text this criterion was parsed from, quoted in diagnostics
 */
public record SelectionCriteria(
    String methodName,
    ImmutableMap<String, String> methodArguments,
    String value,
    boolean includeParents,
    OptionalInt parentsDepth,
    boolean includeChildren,
    OptionalInt childrenDepth,
    boolean includeChildrensParents,
    boolean greedy,
    boolean expectExists,
    String raw)
    implements SelectionSpec {

  /** The method used when the text names none, e.g. plain {@code my_model}. */
  public static final String DEFAULT_METHOD = "fqn";

  public SelectionCriteria {
    requireNonNull(methodName, "methodName");
    requireNonNull(methodArguments, "methodArguments");
    requireNonNull(value, "value");
    requireNonNull(parentsDepth, "parentsDepth");
    requireNonNull(childrenDepth, "childrenDepth");
    requireNonNull(raw, "raw");
    checkArgument(
        parentsDepth.isEmpty() || parentsDepth.getAsInt() >= 0,
        "negative parents depth in %s",
        raw);
    checkArgument(
        childrenDepth.isEmpty() || childrenDepth.getAsInt() >= 0,
        "negative children depth in %s",
        raw);
    checkArgument(
        !(includeChildrensParents && includeChildren),
        "Invalid node spec %s - '@' prefix and '+' suffix are incompatible",
        raw);
  }

  public static Builder builder(String methodName, String value) {
    return new Builder(methodName, value);
  }

  /** Shorthand for a criterion using the {@link #DEFAULT_METHOD} and no modifiers. */
  public static SelectionCriteria forValue(String value) {
    return builder(DEFAULT_METHOD, value).build();
  }

  /** Builder for {@link SelectionCriteria}. */
  public static final class Builder {
    private final String methodName;
    private final String value;
    private ImmutableMap<String, String> methodArguments = ImmutableMap.of();
    private boolean includeParents;
    private OptionalInt parentsDepth = OptionalInt.empty();
    private boolean includeChildren;
    private OptionalInt childrenDepth = OptionalInt.empty();
    private boolean includeChildrensParents;
    private boolean greedy;
    private boolean expectExists;
    @Nullable private String raw;

    private Builder(String methodName, String value) {
      this.methodName = methodName;
      this.value = value;
    }

    @CanIgnoreReturnValue
    public Builder setMethodArguments(ImmutableMap<String, String> methodArguments) {
      this.methodArguments = methodArguments;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder includeParents() {
      this.includeParents = true;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder includeParents(int depth) {
      this.includeParents = true;
      this.parentsDepth = OptionalInt.of(depth);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder includeChildren() {
      this.includeChildren = true;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder includeChildren(int depth) {
      this.includeChildren = true;
      this.childrenDepth = OptionalInt.of(depth);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder includeChildrensParents() {
      this.includeChildrensParents = true;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setGreedy(boolean greedy) {
      this.greedy = greedy;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setExpectExists(boolean expectExists) {
      this.expectExists = expectExists;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setRaw(String raw) {
      this.raw = raw;
      return this;
    }

    public SelectionCriteria build() {
      return new SelectionCriteria(
          methodName,
          methodArguments,
          value,
          includeParents,
          parentsDepth,
          includeChildren,
          childrenDepth,
          includeChildrensParents,
          greedy,
          expectExists,
          raw != null ? raw : defaultRaw());
    }

    /** Renders the criterion in selection syntax, e.g. {@code @tag:nightly} or {@code 2+a+}. */
    private String defaultRaw() {
      StringBuilder text = new StringBuilder();
      if (includeChildrensParents) {
        text.append('@');
      }
      if (includeParents) {
        parentsDepth.ifPresent(text::append);
        text.append('+');
      }
      if (!methodName.equals(DEFAULT_METHOD)) {
        text.append(methodName);
        methodArguments.values().forEach(argument -> text.append('.').append(argument));
        text.append(':');
      }
      text.append(value);
      if (includeChildren) {
        text.append('+');
        childrenDepth.ifPresent(text::append);
      }
      return text.toString();
    }
  }
}
