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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link SelectorOptions}. */
@RunWith(JUnit4.class)
public final class SelectorOptionsTest {

  @Test
  public void defaults() {
    assertThat(SelectorOptions.DEFAULT.indirectSelectionOverrideFlag()).isEqualTo("--greedy");
    assertThat(SelectorOptions.DEFAULT.excludedSummaryLimit()).isEqualTo(3);
    assertThat(SelectorOptions.DEFAULT.warningsAsErrors()).isFalse();
  }

  @Test
  public void toBuilder_keepsOtherSettings() {
    SelectorOptions options =
        SelectorOptions.newBuilder()
            .setIndirectSelectionOverrideFlag("--indirect-selection=eager")
            .setExcludedSummaryLimit(5)
            .build();

    SelectorOptions strict = options.toBuilder().setWarningsAsErrors(true).build();

    assertThat(strict.indirectSelectionOverrideFlag()).isEqualTo("--indirect-selection=eager");
    assertThat(strict.excludedSummaryLimit()).isEqualTo(5);
    assertThat(strict.warningsAsErrors()).isTrue();
    assertThat(options.warningsAsErrors()).isFalse();
  }

  @Test
  public void nonPositiveSummaryLimit_isRejected() {
    assertThrows(
        IllegalArgumentException.class,
        () -> SelectorOptions.newBuilder().setExcludedSummaryLimit(-1));
    assertThrows(
        IllegalArgumentException.class,
        () -> SelectorOptions.newBuilder().setExcludedSummaryLimit(0));
  }

  @Test
  public void summaryLimitOfOne_isAccepted() {
    SelectorOptions options = SelectorOptions.newBuilder().setExcludedSummaryLimit(1).build();

    assertThat(options.excludedSummaryLimit()).isEqualTo(1);
  }
}
