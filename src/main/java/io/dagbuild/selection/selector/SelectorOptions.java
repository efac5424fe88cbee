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
package io.dagbuild.selection.selector;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.errorprone.annotations.CanIgnoreReturnValue;

/** Settings for a {@link NodeSelector} that come from the invocation rather than the project. */
public final class SelectorOptions {
  public static final SelectorOptions DEFAULT = newBuilder().build();

  private final String indirectSelectionOverrideFlag;
  private final int excludedSummaryLimit;
  private final boolean warningsAsErrors;

  private SelectorOptions(
      String indirectSelectionOverrideFlag, int excludedSummaryLimit, boolean warningsAsErrors) {
    this.indirectSelectionOverrideFlag = indirectSelectionOverrideFlag;
    this.excludedSummaryLimit = excludedSummaryLimit;
    this.warningsAsErrors = warningsAsErrors;
  }

  /** The flag suggested to users for pulling in tests whose parents were not all selected. */
  public String indirectSelectionOverrideFlag() {
    return indirectSelectionOverrideFlag;
  }

  /** How many excluded tests are named in the summary before the rest are counted. Positive. */
  public int excludedSummaryLimit() {
    return excludedSummaryLimit;
  }

  /** Whether a selection that expected matches but found none fails instead of warning. */
  public boolean warningsAsErrors() {
    return warningsAsErrors;
  }

  public Builder toBuilder() {
    return newBuilder().copyFrom(this);
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  /** Builder for {@link SelectorOptions}. */
  public static final class Builder {
    private String indirectSelectionOverrideFlag = "--greedy";
    private int excludedSummaryLimit = 3;
    private boolean warningsAsErrors = false;

    private Builder() {}

    @CanIgnoreReturnValue
    private Builder copyFrom(SelectorOptions options) {
      this.indirectSelectionOverrideFlag = options.indirectSelectionOverrideFlag;
      this.excludedSummaryLimit = options.excludedSummaryLimit;
      this.warningsAsErrors = options.warningsAsErrors;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setIndirectSelectionOverrideFlag(String flag) {
      this.indirectSelectionOverrideFlag = checkNotNull(flag);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setExcludedSummaryLimit(int limit) {
      checkArgument(limit >= 1, "summary limit must be positive: %s", limit);
      this.excludedSummaryLimit = limit;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setWarningsAsErrors(boolean warningsAsErrors) {
      this.warningsAsErrors = warningsAsErrors;
      return this;
    }

    public SelectorOptions build() {
      return new SelectorOptions(
          indirectSelectionOverrideFlag, excludedSummaryLimit, warningsAsErrors);
    }
  }
}
