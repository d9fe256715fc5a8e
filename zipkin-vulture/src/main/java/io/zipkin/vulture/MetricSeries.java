/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package io.zipkin.vulture;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/** One time series of a metrics query. */
public final class MetricSeries {
  public static MetricSeries create(Map<String, String> labels, List<Sample> samples) {
    return new MetricSeries(labels, samples);
  }

  final Map<String, String> labels;
  final List<Sample> samples;

  MetricSeries(Map<String, String> labels, List<Sample> samples) {
    if (labels == null) throw new NullPointerException("labels == null");
    if (samples == null) throw new NullPointerException("samples == null");
    this.labels = Collections.unmodifiableMap(new TreeMap<>(labels));
    this.samples = Collections.unmodifiableList(new ArrayList<>(samples));
  }

  public Map<String, String> labels() {
    return labels;
  }

  public List<Sample> samples() {
    return samples;
  }

  /** Sum of all sample values, ex. the total count of a {@code count_over_time()} query. */
  public double sum() {
    double result = 0;
    for (Sample sample : samples) result += sample.value;
    return result;
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof MetricSeries)) return false;
    MetricSeries that = (MetricSeries) o;
    return labels.equals(that.labels) && samples.equals(that.samples);
  }

  @Override public int hashCode() {
    return 31 * labels.hashCode() + samples.hashCode();
  }

  @Override public String toString() {
    return "MetricSeries{labels=" + labels + ", samples=" + samples + "}";
  }

  public static final class Sample {
    public static Sample create(long timestamp, double value) {
      return new Sample(timestamp, value);
    }

    final long timestamp;
    final double value;

    Sample(long timestamp, double value) {
      this.timestamp = timestamp;
      this.value = value;
    }

    /** Epoch milliseconds */
    public long timestamp() {
      return timestamp;
    }

    public double value() {
      return value;
    }

    @Override public boolean equals(Object o) {
      if (o == this) return true;
      if (!(o instanceof Sample)) return false;
      Sample that = (Sample) o;
      return timestamp == that.timestamp
        && Double.doubleToLongBits(value) == Double.doubleToLongBits(that.value);
    }

    @Override public int hashCode() {
      return 31 * Long.hashCode(timestamp) + Double.hashCode(value);
    }

    @Override public String toString() {
      return "Sample{timestamp=" + timestamp + ", value=" + value + "}";
    }
  }
}
