/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package io.zipkin.vulture.http;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.linecorp.armeria.common.HttpData;
import io.zipkin.vulture.MetricSeries;
import io.zipkin.vulture.TraceSummary;
import io.zipkin.vulture.http.HttpCall.BodyConverter;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import zipkin2.Span;
import zipkin2.codec.SpanBytesDecoder;
import zipkin2.internal.Nullable;

/**
 * Search and metrics responses can be large, so they are read with a streaming parser which skips
 * unrelated fields.
 */
final class BodyConverters {
  static final JsonFactory JSON_FACTORY = new JsonFactory();

  static final BodyConverter<Void> NULL = content -> null;

  /** Parses the v2 JSON span list returned when getting a trace by ID. */
  static final BodyConverter<List<Span>> SPANS = content -> {
    if (content.isEmpty()) return Collections.emptyList();
    List<Span> result = new ArrayList<>();
    if (!SpanBytesDecoder.JSON_V2.decodeList(content.array(), result)) {
      return Collections.emptyList();
    }
    return result;
  };

  /** Parses the list of traces returned by {@code /api/v2/traces}. Each span counts as a match. */
  static final BodyConverter<List<TraceSummary>> TRACES = content -> {
    List<TraceSummary> result = new ArrayList<>();
    try (JsonParser parser = parser(content)) {
      if (parser == null || parser.nextToken() != JsonToken.START_ARRAY) return result;
      JsonToken trace;
      while ((trace = parser.nextToken()) != JsonToken.END_ARRAY && trace != null) {
        if (trace != JsonToken.START_ARRAY) {
          parser.skipChildren();
          continue;
        }
        String traceId = null;
        int spanCount = 0;
        JsonToken span;
        while ((span = parser.nextToken()) != JsonToken.END_ARRAY && span != null) {
          spanCount++;
          if (span != JsonToken.START_OBJECT) continue;
          while (parser.nextToken() == JsonToken.FIELD_NAME) {
            String field = parser.getCurrentName();
            JsonToken value = parser.nextToken();
            if (spanCount == 1 && field.equals("traceId") && value == JsonToken.VALUE_STRING) {
              traceId = parser.getText();
            } else {
              parser.skipChildren();
            }
          }
        }
        if (traceId != null) result.add(TraceSummary.create(traceId, spanCount));
      }
    }
    return result;
  };

  /**
   * Parses the result of a structured search, which looks like:
   * <pre>{@code
   * {"traces": [{"traceID": "...", "spanSets": [{"matched": 2, "spans": [...]}]}]}
   * }</pre>
   *
   * <p>Older backends return a single {@code spanSet} per trace instead of {@code spanSets}.
   */
  static final BodyConverter<List<TraceSummary>> SEARCH = content -> {
    List<TraceSummary> result = new ArrayList<>();
    try (JsonParser parser = parser(content)) {
      if (parser == null || !enterField(parser, "traces")) return result;
      if (parser.currentToken() != JsonToken.START_ARRAY) return result;
      while (parser.nextToken() == JsonToken.START_OBJECT) {
        String traceId = null;
        int spanSetsMatched = 0, spanSetMatched = 0;
        boolean hasSpanSets = false;
        while (parser.nextToken() == JsonToken.FIELD_NAME) {
          String field = parser.getCurrentName();
          JsonToken value = parser.nextToken();
          if (field.equals("traceID") && value == JsonToken.VALUE_STRING) {
            traceId = parser.getText();
          } else if (field.equals("spanSets") && value == JsonToken.START_ARRAY) {
            hasSpanSets = true;
            while (parser.nextToken() == JsonToken.START_OBJECT) {
              spanSetsMatched += readMatched(parser);
            }
          } else if (field.equals("spanSet") && value == JsonToken.START_OBJECT) {
            spanSetMatched = readMatched(parser);
          } else {
            parser.skipChildren();
          }
        }
        if (traceId == null) continue;
        result.add(TraceSummary.create(traceId, hasSpanSets ? spanSetsMatched : spanSetMatched));
      }
    }
    return result;
  };

  /**
   * Parses the result of a metrics range query, which looks like:
   * <pre>{@code
   * {"series": [{"labels": [{"key": "k", "value": {"stringValue": "v"}}],
   *              "samples": [{"timestampMs": "1700000000000", "value": 2}]}]}
   * }</pre>
   */
  static final BodyConverter<List<MetricSeries>> SERIES = content -> {
    List<MetricSeries> result = new ArrayList<>();
    try (JsonParser parser = parser(content)) {
      if (parser == null || !enterField(parser, "series")) return result;
      if (parser.currentToken() != JsonToken.START_ARRAY) return result;
      while (parser.nextToken() == JsonToken.START_OBJECT) {
        Map<String, String> labels = new LinkedHashMap<>();
        List<MetricSeries.Sample> samples = new ArrayList<>();
        while (parser.nextToken() == JsonToken.FIELD_NAME) {
          String field = parser.getCurrentName();
          JsonToken value = parser.nextToken();
          if (field.equals("labels") && value == JsonToken.START_ARRAY) {
            while (parser.nextToken() == JsonToken.START_OBJECT) readLabel(parser, labels);
          } else if (field.equals("samples") && value == JsonToken.START_ARRAY) {
            while (parser.nextToken() == JsonToken.START_OBJECT) samples.add(readSample(parser));
          } else {
            parser.skipChildren();
          }
        }
        result.add(MetricSeries.create(labels, samples));
      }
    }
    return result;
  };

  @Nullable static JsonParser parser(HttpData content) throws IOException {
    if (content.isEmpty()) return null;
    return JSON_FACTORY.createParser(content.array());
  }

  /** Positions the parser at the value of a top-level field, or returns false if absent. */
  static boolean enterField(JsonParser parser, String name) throws IOException {
    if (parser.nextToken() != JsonToken.START_OBJECT) return false;
    while (parser.nextToken() == JsonToken.FIELD_NAME) {
      String field = parser.getCurrentName();
      JsonToken value = parser.nextToken();
      if (field.equals(name) && value != JsonToken.VALUE_NULL) return true;
      parser.skipChildren();
    }
    return false;
  }

  /** Reads a span set object, preferring its "matched" count over the size of its spans. */
  static int readMatched(JsonParser parser) throws IOException {
    int matched = -1, spans = 0;
    while (parser.nextToken() == JsonToken.FIELD_NAME) {
      String field = parser.getCurrentName();
      JsonToken value = parser.nextToken();
      if (field.equals("matched") && value.isNumeric()) {
        matched = parser.getIntValue();
      } else if (field.equals("spans") && value == JsonToken.START_ARRAY) {
        JsonToken span;
        while ((span = parser.nextToken()) != JsonToken.END_ARRAY && span != null) {
          spans++;
          parser.skipChildren();
        }
      } else {
        parser.skipChildren();
      }
    }
    return matched != -1 ? matched : spans;
  }

  static void readLabel(JsonParser parser, Map<String, String> labels) throws IOException {
    String key = null, text = "";
    while (parser.nextToken() == JsonToken.FIELD_NAME) {
      String field = parser.getCurrentName();
      JsonToken value = parser.nextToken();
      if (field.equals("key")) {
        key = parser.getValueAsString();
      } else if (field.equals("value") && value == JsonToken.START_OBJECT) {
        // typed value, ex. {"stringValue": "v"} or {"intValue": "1"}
        while (parser.nextToken() == JsonToken.FIELD_NAME) {
          if (parser.nextToken().isScalarValue()) {
            text = parser.getValueAsString("");
          } else {
            parser.skipChildren();
          }
        }
      } else if (field.equals("value") && value.isScalarValue()) {
        text = parser.getValueAsString("");
      } else {
        parser.skipChildren();
      }
    }
    if (key != null) labels.put(key, text);
  }

  static MetricSeries.Sample readSample(JsonParser parser) throws IOException {
    long timestamp = 0L;
    double value = 0d;
    while (parser.nextToken() == JsonToken.FIELD_NAME) {
      String field = parser.getCurrentName();
      parser.nextToken();
      if (field.equals("timestampMs")) {
        timestamp = parser.getValueAsLong();
      } else if (field.equals("value")) {
        value = parser.getValueAsDouble();
      } else {
        parser.skipChildren();
      }
    }
    return MetricSeries.Sample.create(timestamp, value);
  }

  BodyConverters() {
  }
}
