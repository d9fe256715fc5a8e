/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package io.zipkin.vulture;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.Test;
import zipkin2.Span;

import static org.assertj.core.api.Assertions.assertThat;

class TraceDiffTest {
  List<Span> expected = TraceInfo.create(1_700_000_010_000L, "test-org").constructTraceFromEpoch();

  @Test void equal_ignoresOrder() {
    List<Span> shuffled = new ArrayList<>(expected);
    Collections.reverse(shuffled);

    assertThat(TraceDiff.equal(expected, shuffled)).isTrue();
    assertThat(TraceDiff.diff(expected, shuffled)).isEmpty();
  }

  @Test void sorted_doesntModifyInput() {
    List<Span> reversed = new ArrayList<>(expected);
    Collections.reverse(reversed);
    List<Span> copy = new ArrayList<>(reversed);

    TraceDiff.sorted(reversed);

    assertThat(reversed).isEqualTo(copy);
  }

  @Test void diff_changedTag() {
    List<Span> actual = new ArrayList<>(expected);
    Span first = actual.get(0);
    actual.set(0, first.toBuilder().putTag("vulture-0", "changed").build());

    assertThat(TraceDiff.equal(expected, actual)).isFalse();
    assertThat(TraceDiff.diff(expected, actual))
      .singleElement().asString()
      .startsWith("span " + first.id() + ".tags: expected={");
  }

  @Test void diff_missingAndUnexpectedSpans() {
    List<Span> actual = new ArrayList<>(expected.subList(1, expected.size()));
    Span extra = Span.newBuilder().traceId(expected.get(0).traceId()).id("abc").build();
    actual.add(extra);

    assertThat(TraceDiff.diff(expected, actual)).containsExactlyInAnyOrder(
      "span " + expected.get(0).id() + ": missing",
      "span " + extra.id() + ": unexpected"
    );
  }

  @Test void diff_spanCount() {
    List<Span> actual = expected.subList(1, expected.size());

    assertThat(TraceDiff.diff(expected, actual))
      .contains("span count: expected=" + expected.size() + " actual=" + actual.size());
  }

  @Test void hasMissingSpans_dangling() {
    Span orphan = Span.newBuilder().traceId("1").parentId("01234").id("5").build();

    assertThat(TraceDiff.hasMissingSpans(List.of(orphan))).isTrue();
  }

  @Test void hasMissingSpans_complete() {
    Span root = Span.newBuilder().traceId("1").id("01234").build();
    Span child = Span.newBuilder().traceId("1").parentId("01234").id("5").build();

    assertThat(TraceDiff.hasMissingSpans(List.of(root, child))).isFalse();
    assertThat(TraceDiff.hasMissingSpans(expected)).isFalse();
  }
}
