/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package io.zipkin.vulture.http;

import com.linecorp.armeria.common.HttpData;
import io.zipkin.vulture.MetricSeries;
import io.zipkin.vulture.TraceInfo;
import io.zipkin.vulture.TraceSummary;
import java.util.List;
import org.junit.jupiter.api.Test;
import zipkin2.Span;
import zipkin2.codec.SpanBytesEncoder;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;

class BodyConvertersTest {
  @Test void spans() throws Exception {
    List<Span> trace = TraceInfo.create(1_700_000_010_000L, "").constructTraceFromEpoch();

    HttpData content = HttpData.wrap(SpanBytesEncoder.JSON_V2.encodeList(trace));

    assertThat(BodyConverters.SPANS.convert(content)).containsExactlyElementsOf(trace);
  }

  @Test void spans_empty() throws Exception {
    assertThat(BodyConverters.SPANS.convert(HttpData.empty())).isEmpty();
    assertThat(BodyConverters.SPANS.convert(HttpData.ofUtf8("[]"))).isEmpty();
  }

  @Test void traces_countsSpans() throws Exception {
    String json = "[[{\"traceId\":\"a\",\"id\":\"1\"},{\"traceId\":\"a\",\"id\":\"2\"}],"
      + "[{\"traceId\":\"b\",\"id\":\"3\"}],[]]";

    assertThat(BodyConverters.TRACES.convert(HttpData.ofUtf8(json))).containsExactly(
      TraceSummary.create("a", 2), TraceSummary.create("b", 1));
  }

  @Test void search_spanSets() throws Exception {
    String json = "{\"traces\":[{\"traceID\":\"abc\",\"spanSets\":["
      + "{\"matched\":2,\"spans\":[{},{}]},{\"spans\":[{}]}]}]}";

    assertThat(BodyConverters.SEARCH.convert(HttpData.ofUtf8(json)))
      .containsExactly(TraceSummary.create("abc", 3));
  }

  @Test void search_legacySpanSet() throws Exception {
    String json = "{\"traces\":[{\"traceID\":\"abc\",\"spanSet\":{\"matched\":4}},"
      + "{\"rootServiceName\":\"no-id\"}]}";

    assertThat(BodyConverters.SEARCH.convert(HttpData.ofUtf8(json)))
      .containsExactly(TraceSummary.create("abc", 4));
  }

  @Test void search_empty() throws Exception {
    assertThat(BodyConverters.SEARCH.convert(HttpData.empty())).isEmpty();
    assertThat(BodyConverters.SEARCH.convert(HttpData.ofUtf8("{}"))).isEmpty();
  }

  @Test void traces_skipsNestedFields() throws Exception {
    String json = "[[{\"id\":\"1\",\"annotations\":[{\"value\":\"traceId\"}],"
      + "\"tags\":{\"traceId\":\"x\"},\"traceId\":\"a\"}]]";

    assertThat(BodyConverters.TRACES.convert(HttpData.ofUtf8(json)))
      .containsExactly(TraceSummary.create("a", 1));
  }

  @Test void search_skipsUnrelatedFields() throws Exception {
    String json = "{\"metrics\":{\"inspectedTraces\":10},\"traces\":[{\"traceID\":\"abc\","
      + "\"rootServiceName\":\"zipkin-vulture\",\"spanSets\":[{\"spans\":[{\"attributes\":"
      + "[{\"key\":\"matched\"}]}]}]}]}";

    assertThat(BodyConverters.SEARCH.convert(HttpData.ofUtf8(json)))
      .containsExactly(TraceSummary.create("abc", 1));
  }

  @Test void series_typedAndPlainLabels() throws Exception {
    String json = "{\"series\":[{\"labels\":["
      + "{\"key\":\"status\",\"value\":{\"intValue\":\"2\"}},"
      + "{\"key\":\"span\",\"value\":\"get\"}],\"samples\":[]}]}";

    assertThat(BodyConverters.SERIES.convert(HttpData.ofUtf8(json))).singleElement()
      .satisfies(s -> assertThat(s.labels())
        .containsOnly(entry("status", "2"), entry("span", "get")));
  }

  @Test void series_empty() throws Exception {
    assertThat(BodyConverters.SERIES.convert(HttpData.empty())).isEmpty();
    assertThat(BodyConverters.SERIES.convert(HttpData.ofUtf8("{\"series\":null}"))).isEmpty();
  }

  @Test void series() throws Exception {
    String json = "{\"series\":[{"
      + "\"labels\":[{\"key\":\"service\",\"value\":{\"stringValue\":\"zipkin-vulture\"}}],"
      + "\"samples\":[{\"timestampMs\":\"1700000000000\",\"value\":2},"
      + "{\"timestampMs\":\"1700000015000\",\"value\":1.5}]}]}";

    List<MetricSeries> series = BodyConverters.SERIES.convert(HttpData.ofUtf8(json));

    assertThat(series).singleElement().satisfies(s -> {
      assertThat(s.labels()).containsExactly(entry("service", "zipkin-vulture"));
      assertThat(s.samples()).containsExactly(
        MetricSeries.Sample.create(1_700_000_000_000L, 2),
        MetricSeries.Sample.create(1_700_000_015_000L, 1.5));
      assertThat(s.sum()).isEqualTo(3.5);
    });
  }
}
