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
package com.rackspace.lumen.app.services;

import com.github.benmanes.caffeine.cache.AsyncCache;
import com.rackspace.lumen.app.cache.EntryOptions;
import com.rackspace.lumen.app.cache.TieredCache;
import com.rackspace.lumen.app.config.WorkerProperties;
import com.rackspace.lumen.app.downsample.SamplingConfig;
import com.rackspace.lumen.app.exceptions.StoreFetchException;
import com.rackspace.lumen.app.model.BatchLoadResult;
import com.rackspace.lumen.app.model.CacheEntryType;
import com.rackspace.lumen.app.model.CacheKey;
import com.rackspace.lumen.app.model.ChartConfiguration;
import com.rackspace.lumen.app.model.ChartData;
import com.rackspace.lumen.app.model.ChartPlotData;
import com.rackspace.lumen.app.model.DatasetSeries;
import com.rackspace.lumen.app.model.ParameterInfo;
import com.rackspace.lumen.app.model.Sample;
import com.rackspace.lumen.app.model.SampledDataset;
import com.rackspace.lumen.app.model.SamplingInfo;
import com.rackspace.lumen.app.model.TransformRequest;
import com.rackspace.lumen.app.model.Viewport;
import com.rackspace.lumen.app.repos.DatasetStore;
import com.rackspace.lumen.app.utils.ChartDataUtils;
import com.rackspace.lumen.app.utils.SeriesUtils;
import com.rackspace.lumen.app.workers.ProgressListener;
import com.rackspace.lumen.app.workers.WorkerJob;
import com.rackspace.lumen.app.workers.WorkerPool;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Entry point for chart data. A request is answered from the most processed form available:
 * the assembled chart, a dataset's transformed series, its sampled samples (possibly of a
 * higher resolution, reduced further) and finally the raw columns through the
 * {@link BatchDataLoader}. Every product computed along the way is cached.
 */
@Service
@Slf4j
public class ChartDataService {

  private final TieredCache cache;
  private final BatchDataLoader batchDataLoader;
  private final SamplingService samplingService;
  private final WorkerPool workerPool;
  private final DatasetStore datasetStore;
  private final ChartKeyService chartKeyService;
  private final AsyncCache<String, ChartData> inFlightChartRequests;
  private final int offloadThreshold;

  @Autowired
  public ChartDataService(TieredCache cache,
                          BatchDataLoader batchDataLoader,
                          SamplingService samplingService,
                          WorkerPool workerPool,
                          DatasetStore datasetStore,
                          ChartKeyService chartKeyService,
                          AsyncCache<String, ChartData> inFlightChartRequests,
                          WorkerProperties workerProperties) {
    this.cache = cache;
    this.batchDataLoader = batchDataLoader;
    this.samplingService = samplingService;
    this.workerPool = workerPool;
    this.datasetStore = datasetStore;
    this.chartKeyService = chartKeyService;
    this.inFlightChartRequests = inFlightChartRequests;
    this.offloadThreshold = workerProperties.getOffloadThreshold();
  }

  public Mono<ChartData> getChartData(ChartConfiguration configuration,
                                      SamplingConfig samplingConfig) {
    return getChartData(configuration, samplingConfig, ProgressListener.NONE);
  }

  /**
   * Loads, samples and assembles the data of one chart. Identical concurrent requests share a
   * single computation.
   *
   * @param onProgress receives the number of datasets loaded out of the chart's total
   */
  public Mono<ChartData> getChartData(ChartConfiguration configuration,
                                      SamplingConfig samplingConfig,
                                      ProgressListener onProgress) {
    return Mono.defer(() -> {
      samplingConfig.validate();
      if (configuration.getDatasetIds().isEmpty()
          || configuration.getYAxisParameters().isEmpty()) {
        return Mono.just(new ChartData(
            new ChartPlotData(null, List.of(), SamplingInfo.none()), Viewport.unit()));
      }

      final String hash = chartKeyService.hash(configuration, samplingConfig);
      final CacheKey chartKey = CacheKey.chart(hash);
      final ChartData cached = cache.get(chartKey);
      if (cached != null) {
        log.trace("Serving chart {} from cache", configuration.getChartId());
        final int total = configuration.getDatasetIds().size();
        onProgress.onProgress(total, total);
        return Mono.just(cached);
      }

      final CompletableFuture<ChartData> result = inFlightChartRequests.get(hash,
          (key, executor) -> assemble(configuration, samplingConfig, onProgress)
              .doOnNext(chartData -> cache.set(chartKey, chartData,
                  EntryOptions.none().dependingOn(timeseriesKeys(configuration))))
              .toFuture());
      // a cancelled subscriber must not cancel the computation shared with the others
      return Mono.fromFuture(result.copy())
          .doFinally(signal -> inFlightChartRequests.asMap().remove(hash, result));
    });
  }

  /**
   * Loads several charts, reporting progress per completed chart.
   */
  public Mono<List<ChartData>> getChartsData(List<ChartConfiguration> configurations,
                                             SamplingConfig samplingConfig,
                                             ProgressListener onProgress) {
    final AtomicInteger loaded = new AtomicInteger();
    return Flux.fromIterable(configurations)
        .flatMapSequential(configuration -> getChartData(configuration, samplingConfig)
            .doOnNext(chartData ->
                onProgress.onProgress(loaded.incrementAndGet(), configurations.size())))
        .collectList();
  }

  public void clearChartCache() {
    cache.clear(CacheEntryType.CHART);
    cache.clear(CacheEntryType.TRANSFORM);
  }

  /**
   * Drops everything cached for a dataset so that the next request reloads it from the store.
   */
  public void invalidateDataset(int datasetId) {
    cache.delete(CacheKey.timeseries(datasetId));
    cache.delete(CacheKey.metadata(datasetId));
  }

  private Mono<ChartData> assemble(ChartConfiguration configuration,
                                   SamplingConfig samplingConfig,
                                   ProgressListener onProgress) {
    final List<Integer> datasetIds =
        new ArrayList<>(new LinkedHashSet<>(configuration.getDatasetIds()));
    final AtomicInteger loaded = new AtomicInteger();
    log.debug("Assembling chart {} from datasets {}", configuration.getChartId(), datasetIds);

    return loadParameterInfo(configuration)
        .flatMap(parameterInfo -> Flux.fromIterable(datasetIds)
            .flatMapSequential(datasetId ->
                datasetSeries(datasetId, configuration, samplingConfig, parameterInfo)
                    .doOnNext(series ->
                        onProgress.onProgress(loaded.incrementAndGet(), datasetIds.size())))
            .collectList()
            .map(datasets -> ChartDataUtils.combine(configuration, datasets, parameterInfo)))
        .flatMap(plotData -> viewport(plotData)
            .map(viewport -> new ChartData(plotData, viewport)));
  }

  private Mono<DatasetSeries> datasetSeries(int datasetId, ChartConfiguration configuration,
                                            SamplingConfig samplingConfig,
                                            Map<String, ParameterInfo> parameterInfo) {
    final CacheKey transformKey = CacheKey.transform(datasetId,
        configuration.getXAxisParameter(), configuration.getYAxisParameters(), samplingConfig);
    final DatasetSeries cached = cache.get(transformKey);
    if (cached != null) {
      return Mono.just(cached);
    }
    return sampledDataset(datasetId, configuration, samplingConfig)
        .flatMap(dataset -> transform(new TransformRequest(configuration, dataset, parameterInfo)))
        .doOnNext(series -> cache.set(transformKey, series,
            EntryOptions.none().dependingOn(CacheKey.timeseries(datasetId))));
  }

  private Mono<SampledDataset> sampledDataset(int datasetId, ChartConfiguration configuration,
                                              SamplingConfig samplingConfig) {
    final List<String> parameters = configuration.getRequiredParameters();
    final String samplingParameter = configuration.getYAxisParameters().get(0);

    if (!samplingConfig.isEnabled()) {
      return batchDataLoader.load(datasetId, parameters)
          .map(result -> new SampledDataset(datasetId, result.getMetadata(),
              columns(result, parameters), result.getData().size(), "none"));
    }

    final CacheKey samplingKey = CacheKey.sampling(List.of(datasetId), parameters, samplingParameter,
        samplingConfig);
    final SampledDataset cached = cache.get(samplingKey);
    if (cached != null) {
      if (cached.size() <= samplingConfig.getTargetPoints()) {
        return Mono.just(cached);
      }
      log.debug("Reducing {} cached samples of dataset {} to {}",
          cached.size(), datasetId, samplingConfig.getTargetPoints());
      return samplingService.sample(cached.getSamples(), samplingConfig.withThresholdAtTarget(),
              samplingParameter)
          .map(sampling -> new SampledDataset(datasetId, cached.getMetadata(),
              sampling.getSamples(), cached.getOriginalCount(), sampling.getMethodLabel()))
          .doOnNext(dataset -> storeSampled(samplingKey, dataset, samplingConfig));
    }

    return batchDataLoader.load(datasetId, parameters)
        .flatMap(result -> samplingService.sample(columns(result, parameters), samplingConfig,
                samplingParameter)
            .map(sampling -> new SampledDataset(datasetId, result.getMetadata(),
                sampling.getSamples(), sampling.getOriginalCount(), sampling.getMethodLabel())))
        .doOnNext(dataset -> storeSampled(samplingKey, dataset, samplingConfig));
  }

  private void storeSampled(CacheKey samplingKey, SampledDataset dataset,
                            SamplingConfig samplingConfig) {
    cache.set(samplingKey, dataset,
        EntryOptions.resolution(samplingConfig.getTargetPoints())
            .dependingOn(CacheKey.timeseries(dataset.getDatasetId())));
  }

  private static List<Sample> columns(BatchLoadResult result, List<String> parameters) {
    if (parameters.containsAll(result.getLoadedParameters())) {
      return result.getData();
    }
    return SeriesUtils.restrictTo(result.getData(), parameters);
  }

  private Mono<DatasetSeries> transform(TransformRequest request) {
    if (request.getDataset().size() >= offloadThreshold) {
      return Mono.defer(() -> workerPool.execute(WorkerJob.transform(request)));
    }
    return Mono.fromCallable(() -> ChartDataUtils.transformDataset(request));
  }

  private Mono<Viewport> viewport(ChartPlotData plotData) {
    if (plotData.getTotalPoints() >= offloadThreshold) {
      return Mono.defer(() -> workerPool.execute(WorkerJob.viewport(plotData)));
    }
    return Mono.fromCallable(() -> ChartDataUtils.calculateViewport(plotData));
  }

  private Mono<Map<String, ParameterInfo>> loadParameterInfo(ChartConfiguration configuration) {
    final Map<String, ParameterInfo> found = new HashMap<>();
    final Set<String> missing = new LinkedHashSet<>();
    for (String parameterId : configuration.getRequiredParameters()) {
      final ParameterInfo info = cache.get(CacheKey.parameterInfo(parameterId));
      if (info != null) {
        found.put(parameterId, info);
      } else {
        missing.add(parameterId);
      }
    }
    if (missing.isEmpty()) {
      return Mono.just(found);
    }

    return datasetStore.fetchParameterInfo(missing)
        .name("fetchParameterInfo")
        .metrics()
        .onErrorMap(throwable ->
            new StoreFetchException("Failed to fetch parameter info " + missing, throwable))
        .defaultIfEmpty(Map.of())
        .map(fetched -> {
          final Map<CacheKey, ParameterInfo> toCache = new HashMap<>();
          fetched.forEach((parameterId, info) -> {
            toCache.put(CacheKey.parameterInfo(parameterId), info);
            found.put(parameterId, info);
          });
          cache.setBatch(toCache);
          return found;
        });
  }

  private static CacheKey[] timeseriesKeys(ChartConfiguration configuration) {
    return configuration.getDatasetIds().stream()
        .distinct()
        .map(CacheKey::timeseries)
        .toArray(CacheKey[]::new);
  }
}
