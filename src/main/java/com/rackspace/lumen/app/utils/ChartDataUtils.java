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
package com.rackspace.lumen.app.utils;

import com.rackspace.lumen.app.model.ChartConfiguration;
import com.rackspace.lumen.app.model.ChartPlotData;
import com.rackspace.lumen.app.model.ChartSeriesData;
import com.rackspace.lumen.app.model.DataRange;
import com.rackspace.lumen.app.model.DatasetMetadata;
import com.rackspace.lumen.app.model.DatasetSeries;
import com.rackspace.lumen.app.model.ParameterInfo;
import com.rackspace.lumen.app.model.Sample;
import com.rackspace.lumen.app.model.SampledDataset;
import com.rackspace.lumen.app.model.SamplingInfo;
import com.rackspace.lumen.app.model.TransformRequest;
import com.rackspace.lumen.app.model.Viewport;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Conversion of sampled datasets into plottable series.
 */
public class ChartDataUtils {

  /**
   * Fraction of the value span added on both sides of a data range.
   */
  static final double RANGE_PADDING = 0.05;

  /**
   * @return the padded extent of the values, ignoring gaps, or <code>[0, 1]</code> when there
   * are no values
   */
  public static DataRange calculateDataRange(Collection<Double> values) {
    double min = Double.POSITIVE_INFINITY;
    double max = Double.NEGATIVE_INFINITY;
    for (Double value : values) {
      if (value == null || value.isNaN()) {
        continue;
      }
      min = Math.min(min, value);
      max = Math.max(max, value);
    }
    if (min > max) {
      return DataRange.of(0, 1);
    }
    final double padding = (max - min) * RANGE_PADDING;
    return DataRange.of(min - padding, max + padding);
  }

  /**
   * Builds one series per y parameter of the configuration from a dataset's samples. For a
   * time-series chart the x values are the sample timestamps in epoch milliseconds; otherwise
   * they are the readings of the x parameter and samples without one are skipped.
   */
  public static DatasetSeries transformDataset(TransformRequest request) {
    final ChartConfiguration configuration = request.getConfiguration();
    final SampledDataset dataset = request.getDataset();
    final DatasetMetadata metadata = dataset.getMetadata();
    final String label = metadata != null
        ? metadata.getDisplayLabel() : "Dataset " + dataset.getDatasetId();
    final boolean timeSeries = configuration.isTimeSeries();

    final List<ChartSeriesData> series = new ArrayList<>();
    for (String parameterId : configuration.getYAxisParameters()) {
      final List<Double> xValues = new ArrayList<>(dataset.size());
      final List<Double> yValues = new ArrayList<>(dataset.size());
      for (Sample sample : dataset.getSamples()) {
        final Double x = timeSeries
            ? Double.valueOf(sample.getTimestamp().toEpochMilli())
            : sample.getValue(configuration.getXAxisParameter());
        if (x == null) {
          continue;
        }
        xValues.add(x);
        yValues.add(sample.getValue(parameterId));
      }
      final DataRange xRange = timeSeries ? timeRange(xValues) : calculateDataRange(xValues);
      series.add(new ChartSeriesData(dataset.getDatasetId(), label,
          request.getParameterInfo().getOrDefault(parameterId, ParameterInfo.unknown(parameterId)),
          xValues, yValues, xRange, calculateDataRange(yValues)));
    }
    return new DatasetSeries(dataset.getDatasetId(), series, dataset.getOriginalCount(),
        dataset.size(), dataset.getMethod());
  }

  /**
   * Combines the series of every dataset of a chart. All series share the combined y range;
   * time-series charts also share the combined time range.
   */
  public static ChartPlotData combine(ChartConfiguration configuration,
                                      List<DatasetSeries> datasets,
                                      Map<String, ParameterInfo> parameterInfo) {
    final List<ChartSeriesData> all = new ArrayList<>();
    int originalCount = 0;
    int sampledCount = 0;
    String method = "none";
    for (DatasetSeries dataset : datasets) {
      all.addAll(dataset.getSeries());
      originalCount += dataset.getOriginalCount();
      sampledCount += dataset.getSampledCount();
      if (!"none".equals(dataset.getMethod())) {
        method = dataset.getMethod();
      }
    }

    DataRange combinedY = null;
    DataRange combinedX = null;
    for (ChartSeriesData s : all) {
      combinedY = combinedY == null ? s.getYRange() : combinedY.union(s.getYRange());
      if (s.size() > 0) {
        combinedX = combinedX == null ? s.getXRange() : combinedX.union(s.getXRange());
      }
    }

    final List<ChartSeriesData> series = new ArrayList<>(all.size());
    for (ChartSeriesData s : all) {
      series.add(new ChartSeriesData(s.getDatasetId(), s.getDatasetLabel(), s.getParameterInfo(),
          s.getXValues(), s.getYValues(),
          configuration.isTimeSeries() && combinedX != null ? combinedX : s.getXRange(),
          combinedY));
    }

    final ParameterInfo xParameterInfo = configuration.isTimeSeries()
        ? null
        : parameterInfo.getOrDefault(configuration.getXAxisParameter(),
            ParameterInfo.unknown(configuration.getXAxisParameter()));
    return new ChartPlotData(xParameterInfo, series,
        new SamplingInfo(originalCount, sampledCount, sampledCount < originalCount, method));
  }

  /**
   * @return the extent of every series, widened by one unit on an axis whose span is zero
   */
  public static Viewport calculateViewport(ChartPlotData plotData) {
    if (plotData.getSeries().isEmpty()) {
      return Viewport.unit();
    }
    double xMin = Double.POSITIVE_INFINITY;
    double xMax = Double.NEGATIVE_INFINITY;
    double yMin = Double.POSITIVE_INFINITY;
    double yMax = Double.NEGATIVE_INFINITY;
    for (ChartSeriesData s : plotData.getSeries()) {
      xMin = Math.min(xMin, s.getXRange().getMin());
      xMax = Math.max(xMax, s.getXRange().getMax());
      yMin = Math.min(yMin, s.getYRange().getMin());
      yMax = Math.max(yMax, s.getYRange().getMax());
    }
    if (xMax - xMin == 0) {
      xMin -= 1;
      xMax += 1;
    }
    if (yMax - yMin == 0) {
      yMin -= 1;
      yMax += 1;
    }
    return new Viewport(xMin, xMax, yMin, yMax);
  }

  private static DataRange timeRange(List<Double> timestamps) {
    if (timestamps.isEmpty()) {
      return DataRange.of(0, 1);
    }
    // samples are in time order; a single sample yields a zero span widened by the viewport
    return DataRange.of(timestamps.get(0), timestamps.get(timestamps.size() - 1));
  }
}
