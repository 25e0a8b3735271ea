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
package com.rackspace.lumen.app.workers;

import com.rackspace.lumen.app.downsample.SamplingConfig;
import com.rackspace.lumen.app.downsample.SamplingEngine;
import com.rackspace.lumen.app.downsample.SamplingResult;
import com.rackspace.lumen.app.model.ChartPlotData;
import com.rackspace.lumen.app.model.DatasetSeries;
import com.rackspace.lumen.app.model.Sample;
import com.rackspace.lumen.app.model.TransformRequest;
import com.rackspace.lumen.app.model.Viewport;
import com.rackspace.lumen.app.utils.ChartDataUtils;
import java.util.List;
import java.util.Map;

/**
 * A unit of computation that can be handed to the {@link WorkerPool}. The set of jobs is
 * closed: instances are only created through the factory methods of this class. Inputs are
 * copied when the job is created so that a running job shares no mutable state with its
 * submitter.
 *
 * @param <R> the type of the job's result
 */
public abstract class WorkerJob<R> {

  public enum Operation {
    SAMPLE_DATA,
    TRANSFORM_DATA,
    CALCULATE_VIEWPORT
  }

  private final Operation operation;
  private final int size;

  private WorkerJob(Operation operation, int size) {
    this.operation = operation;
    this.size = size;
  }

  public Operation getOperation() {
    return operation;
  }

  /**
   * @return number of input elements, for diagnostics
   */
  public int getSize() {
    return size;
  }

  abstract R execute(ProgressListener progress);

  /**
   * @throws IllegalArgumentException if the sampling configuration is malformed
   */
  public static WorkerJob<SamplingResult> sample(List<Sample> series, SamplingConfig config,
                                                 String samplingParameter) {
    config.validate();
    return new SampleJob(List.copyOf(series), config, samplingParameter);
  }

  public static WorkerJob<DatasetSeries> transform(TransformRequest request) {
    return new TransformJob(new TransformRequest(request.getConfiguration(), request.getDataset(),
        Map.copyOf(request.getParameterInfo())));
  }

  public static WorkerJob<Viewport> viewport(ChartPlotData plotData) {
    return new ViewportJob(plotData);
  }

  private static final class SampleJob extends WorkerJob<SamplingResult> {
    private final List<Sample> series;
    private final SamplingConfig config;
    private final String samplingParameter;

    SampleJob(List<Sample> series, SamplingConfig config, String samplingParameter) {
      super(Operation.SAMPLE_DATA, series.size());
      this.series = series;
      this.config = config;
      this.samplingParameter = samplingParameter;
    }

    @Override
    SamplingResult execute(ProgressListener progress) {
      progress.onProgress(0, 1);
      final SamplingResult result =
          SamplingEngine.sampleWithInfo(series, config, samplingParameter);
      progress.onProgress(1, 1);
      return result;
    }
  }

  private static final class TransformJob extends WorkerJob<DatasetSeries> {
    private final TransformRequest request;

    TransformJob(TransformRequest request) {
      super(Operation.TRANSFORM_DATA, request.getDataset().size());
      this.request = request;
    }

    @Override
    DatasetSeries execute(ProgressListener progress) {
      return ChartDataUtils.transformDataset(request);
    }
  }

  private static final class ViewportJob extends WorkerJob<Viewport> {
    private final ChartPlotData plotData;

    ViewportJob(ChartPlotData plotData) {
      super(Operation.CALCULATE_VIEWPORT, plotData.getTotalPoints());
      this.plotData = plotData;
    }

    @Override
    Viewport execute(ProgressListener progress) {
      return ChartDataUtils.calculateViewport(plotData);
    }
  }
}
