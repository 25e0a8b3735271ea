/*
 * Copyright 2022 Rackspace US, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.rackspace.lumen.app.downsample;

import com.rackspace.lumen.app.model.Sample;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import lombok.extern.slf4j.Slf4j;

/**
 * Reduces a series to at most {@link SamplingConfig#getTargetPoints()} samples while keeping
 * its visual shape. Selection is steered by the values of a single sampling parameter; the
 * selected samples are returned whole with every parameter's readings.
 * <p>
 * Missing readings of the sampling parameter never take part in extrema or triangle areas.
 * A bucket without any reading contributes its first sample.
 * </p>
 */
@Slf4j
public final class SamplingEngine {

  private SamplingEngine() {
  }

  public static List<Sample> sample(List<Sample> series, SamplingConfig config) {
    return sampleWithInfo(series, config, null).getSamples();
  }

  public static List<Sample> sample(List<Sample> series, SamplingConfig config,
                                    String samplingParameter) {
    return sampleWithInfo(series, config, samplingParameter).getSamples();
  }

  /**
   * @param samplingParameter the parameter that steers selection; when absent or never present
   *                          in the series, the alphabetically first parameter carrying a reading
   *                          is used
   * @return the sampled series, which is the very same list instance when no reduction applies
   * @throws IllegalArgumentException if the configuration is malformed
   */
  public static SamplingResult sampleWithInfo(List<Sample> series, SamplingConfig config,
                                              String samplingParameter) {
    config.validate();
    if (!config.isEnabled()
        || series.size() <= config.getSamplingThreshold()
        || series.size() <= config.getTargetPoints()) {
      return SamplingResult.unsampled(series);
    }

    final String parameter = resolveSamplingParameter(series, samplingParameter);
    final double[] y = new double[series.size()];
    for (int i = 0; i < y.length; i++) {
      final Double value = parameter == null ? null : series.get(i).getValue(parameter);
      y[i] = value == null ? Double.NaN : value;
    }

    final int[] selected;
    switch (config.getMethod()) {
      case NTH:
        selected = nth(y, config.getTargetPoints(), config.isPreserveExtremes());
        break;
      case MIN_MAX:
        selected = minMax(y, config.getTargetPoints(), config.isPreserveExtremes());
        break;
      case LTTB:
        selected = lttb(timestamps(series), y, config.getTargetPoints(),
            config.isPreserveExtremes());
        break;
      default:
        throw new IllegalArgumentException("Unsupported sampling method " + config.getMethod());
    }

    final List<Sample> sampled = new ArrayList<>(selected.length);
    for (int index : selected) {
      sampled.add(series.get(index));
    }
    log.trace("Sampled {} samples down to {} using {} on {}",
        series.size(), sampled.size(), config.getMethod(), parameter);
    return new SamplingResult(sampled, series.size(), config.getMethod(), parameter);
  }

  static String resolveSamplingParameter(List<Sample> series, String requested) {
    if (requested != null) {
      for (Sample sample : series) {
        if (sample.hasValue(requested)) {
          return requested;
        }
      }
    }
    final TreeSet<String> candidates = new TreeSet<>();
    for (Sample sample : series) {
      for (Map.Entry<String, Double> entry : sample.getValues().entrySet()) {
        if (entry.getValue() != null && !entry.getValue().isNaN()) {
          candidates.add(entry.getKey());
        }
      }
    }
    final String fallback = candidates.isEmpty() ? null : candidates.first();
    log.debug("Sampling parameter {} not available, falling back to {}", requested, fallback);
    return fallback;
  }

  private static double[] timestamps(List<Sample> series) {
    final double[] x = new double[series.size()];
    final long origin = series.get(0).getTimestamp().toEpochMilli();
    for (int i = 0; i < x.length; i++) {
      x[i] = series.get(i).getTimestamp().toEpochMilli() - origin;
    }
    return x;
  }

  static int[] nth(double[] y, int targetPoints, boolean preserveExtremes) {
    final int n = y.length;
    final int step = (n + targetPoints - 1) / targetPoints;
    final IndexBuffer out = new IndexBuffer(targetPoints);
    for (int start = 0; start < n; start += step) {
      int pick = start;
      if (preserveExtremes && start > 0) {
        final int end = Math.min(start + step, n);
        for (int i = start; i < end; i++) {
          if (!Double.isNaN(y[i])) {
            pick = i;
            break;
          }
        }
      }
      out.add(pick);
    }
    if (preserveExtremes) {
      out.keepLast(n - 1, targetPoints);
    }
    return out.toArray();
  }

  static int[] minMax(double[] y, int targetPoints, boolean preserveExtremes) {
    final int reserved = preserveExtremes ? 2 : 0;
    if (targetPoints - reserved < 2) {
      return nth(y, targetPoints, preserveExtremes);
    }
    final int n = y.length;
    final int from = preserveExtremes ? 1 : 0;
    final int to = preserveExtremes ? n - 1 : n;
    final int buckets = (targetPoints - reserved) / 2;
    final int bucketSize = (to - from + buckets - 1) / buckets;

    final IndexBuffer out = new IndexBuffer(targetPoints);
    if (preserveExtremes) {
      out.add(0);
    }
    for (int start = from; start < to; start += bucketSize) {
      final int end = Math.min(start + bucketSize, to);
      int minIndex = -1;
      int maxIndex = -1;
      for (int i = start; i < end; i++) {
        if (Double.isNaN(y[i])) {
          continue;
        }
        if (minIndex < 0 || y[i] < y[minIndex]) {
          minIndex = i;
        }
        if (maxIndex < 0 || y[i] > y[maxIndex]) {
          maxIndex = i;
        }
      }
      if (minIndex < 0) {
        out.add(start);
      } else if (minIndex == maxIndex) {
        out.add(minIndex);
      } else {
        out.add(Math.min(minIndex, maxIndex));
        out.add(Math.max(minIndex, maxIndex));
      }
    }
    if (preserveExtremes) {
      out.add(n - 1);
    }
    return out.toArray();
  }

  static int[] lttb(double[] x, double[] y, int targetPoints, boolean preserveExtremes) {
    if (targetPoints < 3) {
      return nth(y, targetPoints, preserveExtremes);
    }
    final int n = y.length;
    final double every = (double) (n - 2) / (targetPoints - 2);
    final IndexBuffer out = new IndexBuffer(targetPoints);
    out.add(0);

    int anchor = 0;
    double anchorY = firstReading(y);
    for (int bucket = 0; bucket < targetPoints - 2; bucket++) {
      final int rangeStart = (int) Math.floor(bucket * every) + 1;
      final int rangeEnd = Math.min((int) Math.floor((bucket + 1) * every) + 1, n - 1);
      final int nextStart = rangeEnd;
      final int nextEnd = Math.min((int) Math.floor((bucket + 2) * every) + 1, n);

      // centroid of the following bucket, readings only
      double sumX = 0;
      double sumY = 0;
      int readings = 0;
      for (int i = nextStart; i < nextEnd; i++) {
        if (!Double.isNaN(y[i])) {
          sumX += x[i];
          sumY += y[i];
          readings++;
        }
      }
      final double centroidX;
      final double centroidY;
      if (readings > 0) {
        centroidX = sumX / readings;
        centroidY = sumY / readings;
      } else {
        centroidX = x[Math.min(nextStart, n - 1)];
        centroidY = anchorY;
      }

      final double anchorX = x[anchor];
      int chosen = -1;
      double maxArea = -1;
      for (int i = rangeStart; i < rangeEnd; i++) {
        if (Double.isNaN(y[i])) {
          continue;
        }
        final double area = Math.abs(
            (anchorX - centroidX) * (y[i] - anchorY) - (anchorX - x[i]) * (centroidY - anchorY));
        if (area > maxArea) {
          maxArea = area;
          chosen = i;
        }
      }
      if (chosen < 0) {
        chosen = rangeStart;
      } else {
        anchorY = y[chosen];
      }
      anchor = chosen;
      out.add(chosen);
    }

    out.add(n - 1);
    return out.toArray();
  }

  private static double firstReading(double[] y) {
    for (double value : y) {
      if (!Double.isNaN(value)) {
        return value;
      }
    }
    return 0;
  }

  /**
   * Growable list of selected indices, bounded by the target.
   */
  private static final class IndexBuffer {
    private final int[] indices;
    private int size;

    IndexBuffer(int capacity) {
      indices = new int[capacity];
    }

    void add(int index) {
      if (size > 0 && indices[size - 1] == index) {
        return;
      }
      indices[size++] = index;
    }

    /**
     * Ensures the given index is the final one without growing past the capacity.
     */
    void keepLast(int index, int capacity) {
      if (size > 0 && indices[size - 1] == index) {
        return;
      }
      if (size < capacity) {
        indices[size++] = index;
      } else {
        indices[size - 1] = index;
      }
    }

    int[] toArray() {
      final int[] result = new int[size];
      System.arraycopy(indices, 0, result, 0, size);
      return result;
    }
  }
}
