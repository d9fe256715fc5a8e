/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package io.zipkin.vulture;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import zipkin2.Span;

/** Canonical ordering, equality and field-level differences of traces. */
public final class TraceDiff {
  static final Comparator<Span> CANONICAL = Comparator.comparing(Span::traceId)
    .thenComparing(Span::id)
    .thenComparing(Span::parentId, Comparator.nullsFirst(Comparator.naturalOrder()))
    .thenComparing(Span::name, Comparator.nullsFirst(Comparator.naturalOrder()))
    .thenComparing(Span::timestampAsLong)
    .thenComparing(Span::durationAsLong);

  /** Returns a copy of the spans in canonical order. Tags and annotations are already sorted. */
  public static List<Span> sorted(List<Span> spans) {
    List<Span> result = new ArrayList<>(spans);
    result.sort(CANONICAL);
    return result;
  }

  /** Returns true if both contain the same spans, regardless of order. */
  public static boolean equal(List<Span> expected, List<Span> actual) {
    return sorted(expected).equals(sorted(actual));
  }

  /**
   * Returns true if a span refers to a parent which isn't in the trace. This indicates the
   * backend hasn't assembled all batches of the trace.
   */
  public static boolean hasMissingSpans(List<Span> trace) {
    Set<String> ids = new LinkedHashSet<>();
    for (Span span : trace) ids.add(span.id());
    for (Span span : trace) {
      String parentId = span.parentId();
      if (parentId != null && !ids.contains(parentId)) return true;
    }
    return false;
  }

  /** Lists differences between traces, one line per span or field. Empty means equal. */
  public static List<String> diff(List<Span> expected, List<Span> actual) {
    List<String> result = new ArrayList<>();
    if (expected.size() != actual.size()) {
      result.add("span count: expected=" + expected.size() + " actual=" + actual.size());
    }
    Map<String, Span> actualById = byId(actual);
    for (Span e : sorted(expected)) {
      Span a = actualById.remove(e.id());
      if (a == null) {
        result.add("span " + e.id() + ": missing");
        continue;
      }
      compare(result, e.id(), "traceId", e.traceId(), a.traceId());
      compare(result, e.id(), "parentId", e.parentId(), a.parentId());
      compare(result, e.id(), "kind", e.kind(), a.kind());
      compare(result, e.id(), "name", e.name(), a.name());
      compare(result, e.id(), "timestamp", e.timestamp(), a.timestamp());
      compare(result, e.id(), "duration", e.duration(), a.duration());
      compare(result, e.id(), "localEndpoint", e.localEndpoint(), a.localEndpoint());
      compare(result, e.id(), "remoteEndpoint", e.remoteEndpoint(), a.remoteEndpoint());
      compare(result, e.id(), "annotations", e.annotations(), a.annotations());
      compare(result, e.id(), "tags", e.tags(), a.tags());
      compare(result, e.id(), "debug", e.debug(), a.debug());
      compare(result, e.id(), "shared", e.shared(), a.shared());
    }
    for (String unexpected : actualById.keySet()) {
      result.add("span " + unexpected + ": unexpected");
    }
    return result;
  }

  static Map<String, Span> byId(List<Span> spans) {
    Map<String, Span> result = new LinkedHashMap<>();
    for (Span span : sorted(spans)) result.put(span.id(), span);
    return result;
  }

  static void compare(List<String> result, String id, String field, Object e, Object a) {
    if (Objects.equals(e, a)) return;
    result.add("span " + id + "." + field + ": expected=" + e + " actual=" + a);
  }

  TraceDiff() {
  }
}
