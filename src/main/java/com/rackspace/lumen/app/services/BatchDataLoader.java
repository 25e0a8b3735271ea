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

import com.github.benmanes.caffeine.cache.RemovalCause;
import com.rackspace.lumen.app.cache.TieredCache;
import com.rackspace.lumen.app.config.AppProperties;
import com.rackspace.lumen.app.exceptions.StoreFetchException;
import com.rackspace.lumen.app.model.BatchLoadResult;
import com.rackspace.lumen.app.model.CacheEntryType;
import com.rackspace.lumen.app.model.CacheKey;
import com.rackspace.lumen.app.model.DatasetMetadata;
import com.rackspace.lumen.app.model.Sample;
import com.rackspace.lumen.app.repos.DatasetStore;
import com.rackspace.lumen.app.utils.SeriesUtils;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;
import javax.annotation.PostConstruct;
import javax.annotation.PreDestroy;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

/**
 * Coalesces data requests that arrive within a short window into one store fetch per dataset.
 * <p>
 * The first request of a window arms a timer. When it fires, the pending requests are grouped
 * by dataset and the union of their parameters is compared with what the
 * {@link ParameterTracker} says is already loaded. Only the missing columns are fetched; they
 * are merged by timestamp into the dataset's cached <code>timeseries</code> entry and every
 * request of the group receives the full merged data. Requests that arrive while a batch is
 * being processed are handled in the next window.
 * </p>
 */
@Service
@Slf4j
public class BatchDataLoader {

  private final DatasetStore datasetStore;
  private final TieredCache cache;
  private final ParameterTracker parameterTracker;
  private final ScheduledExecutorService scheduler;
  private final DistributionSummary batchSizes;
  private final AtomicLong requestIds = new AtomicLong();
  private final Object mergeLock = new Object();

  private final Object pendingLock = new Object();
  private List<PendingRequest> pending = new ArrayList<>();
  private ScheduledFuture<?> scheduledBatch;
  private volatile Duration batchWindow;

  @Autowired
  public BatchDataLoader(DatasetStore datasetStore,
                         TieredCache cache,
                         ParameterTracker parameterTracker,
                         ScheduledExecutorService scheduler,
                         AppProperties appProperties,
                         MeterRegistry meterRegistry) {
    this.datasetStore = datasetStore;
    this.cache = cache;
    this.parameterTracker = parameterTracker;
    this.scheduler = scheduler;
    this.batchWindow = appProperties.getBatch().getWindow();
    this.batchSizes = DistributionSummary.builder("lumen.batch.requests")
        .description("Requests coalesced per batch")
        .register(meterRegistry);

    // the loaded columns only live in the timeseries entry
    cache.addRemovalListener(CacheEntryType.TIMESERIES, (key, value, cause) -> {
      if (cause != RemovalCause.REPLACED) {
        key.getDatasetIds().forEach(parameterTracker::clear);
      }
    });
  }

  @PostConstruct
  public void printConfigurations() {
    log.info("batch-window: {}ms", batchWindow.toMillis());
  }

  /**
   * Requests the given parameters of a dataset. The returned mono completes once the batch
   * containing this request has been processed.
   */
  public Mono<BatchLoadResult> load(int datasetId, Collection<String> parameterIds) {
    final PendingRequest request = new PendingRequest(
        datasetId, new LinkedHashSet<>(parameterIds), "req-" + requestIds.incrementAndGet());
    synchronized (pendingLock) {
      pending.add(request);
      if (scheduledBatch == null) {
        scheduledBatch = scheduler.schedule(
            this::processBatch, batchWindow.toMillis(), TimeUnit.MILLISECONDS);
      }
    }
    log.trace("Queued {} for dataset {} with parameters {}",
        request.getRequestId(), datasetId, parameterIds);
    return request.getResult().asMono();
  }

  /**
   * Rejects and drops every request still waiting for its batch.
   */
  public void clearPending() {
    final List<PendingRequest> dropped;
    synchronized (pendingLock) {
      dropped = pending;
      pending = new ArrayList<>();
      if (scheduledBatch != null) {
        scheduledBatch.cancel(false);
        scheduledBatch = null;
      }
    }
    if (!dropped.isEmpty()) {
      log.debug("Rejecting {} pending requests", dropped.size());
    }
    final IllegalStateException cleared = new IllegalStateException("Pending requests cleared");
    for (PendingRequest request : dropped) {
      request.getResult().tryEmitError(cleared);
    }
  }

  public int getPendingCount() {
    synchronized (pendingLock) {
      return pending.size();
    }
  }

  public void setBatchWindow(Duration batchWindow) {
    this.batchWindow = batchWindow;
  }

  @PreDestroy
  public void dispose() {
    clearPending();
  }

  void processBatch() {
    final List<PendingRequest> batch;
    synchronized (pendingLock) {
      batch = pending;
      pending = new ArrayList<>();
      scheduledBatch = null;
    }
    if (batch.isEmpty()) {
      return;
    }
    batchSizes.record(batch.size());

    final Map<Integer, List<PendingRequest>> groups = batch.stream()
        .collect(Collectors.groupingBy(PendingRequest::getDatasetId, LinkedHashMap::new,
            Collectors.toList()));
    log.debug("Processing batch of {} requests across {} datasets", batch.size(), groups.size());

    Flux.fromIterable(groups.entrySet())
        .flatMap(group -> loadGroup(group.getKey(), group.getValue()))
        .subscribe();
  }

  private Mono<Void> loadGroup(int datasetId, List<PendingRequest> requests) {
    final Set<String> union = new LinkedHashSet<>();
    requests.forEach(request -> union.addAll(request.getParameterIds()));

    return loadDataset(datasetId, union)
        .doOnNext(result -> requests.forEach(request -> request.getResult().tryEmitValue(result)))
        .onErrorResume(throwable -> {
          final StoreFetchException failure = throwable instanceof StoreFetchException
              ? (StoreFetchException) throwable
              : new StoreFetchException(datasetId, throwable);
          log.warn("Loading dataset {} for {} requests failed", datasetId, requests.size(),
              failure);
          requests.forEach(request -> request.getResult().tryEmitError(failure));
          return Mono.empty();
        })
        .then();
  }

  private Mono<BatchLoadResult> loadDataset(int datasetId, Set<String> parameterIds) {
    return loadMetadata(datasetId)
        .flatMap(metadata -> {
          final CacheKey key = CacheKey.timeseries(datasetId);
          final List<Sample> cached = cache.get(key);
          final Set<String> missing = cached == null
              ? parameterIds
              : parameterTracker.getMissing(datasetId, parameterIds);

          if (missing.isEmpty()) {
            log.trace("All of {} already loaded for dataset {}", parameterIds, datasetId);
            return Mono.just(result(datasetId, cached, metadata.orElse(null)));
          }

          log.debug("Fetching {} of dataset {}", missing, datasetId);
          return datasetStore.fetchTimeSeries(datasetId, missing,
                  metadata.map(DatasetMetadata::getSelectedRange).orElse(null))
              .name("fetchTimeSeries")
              .metrics()
              .onErrorMap(throwable -> new StoreFetchException(datasetId, throwable))
              .defaultIfEmpty(List.of())
              .map(fetched -> mergeAndStore(datasetId, fetched, missing, metadata.orElse(null)));
        });
  }

  private Mono<Optional<DatasetMetadata>> loadMetadata(int datasetId) {
    final CacheKey key = CacheKey.metadata(datasetId);
    final DatasetMetadata cached = cache.get(key);
    if (cached != null) {
      return Mono.just(Optional.of(cached));
    }
    return datasetStore.fetchMetadata(datasetId)
        .name("fetchMetadata")
        .metrics()
        .onErrorMap(throwable -> new StoreFetchException(datasetId, throwable))
        .doOnNext(metadata -> cache.set(key, metadata))
        .map(Optional::of)
        .defaultIfEmpty(Optional.empty());
  }

  private BatchLoadResult mergeAndStore(int datasetId, List<Sample> fetched,
                                        Set<String> fetchedParameters,
                                        DatasetMetadata metadata) {
    final CacheKey key = CacheKey.timeseries(datasetId);
    // read-merge-write so that overlapping batches for a dataset never drop each other's columns
    synchronized (mergeLock) {
      final List<Sample> current = cache.get(key);
      final List<Sample> merged = current == null
          ? List.copyOf(fetched)
          : SeriesUtils.mergeByTimestamp(current, fetched);
      if (cache.set(key, merged)) {
        parameterTracker.markLoaded(datasetId, fetchedParameters);
        return result(datasetId, merged, metadata);
      }
      log.debug("Dataset {} with {} samples exceeds the timeseries cache", datasetId,
          merged.size());
      final Set<String> loaded = new LinkedHashSet<>(parameterTracker.getLoaded(datasetId));
      loaded.addAll(fetchedParameters);
      return new BatchLoadResult(datasetId, merged, metadata, loaded);
    }
  }

  private BatchLoadResult result(int datasetId, List<Sample> data, DatasetMetadata metadata) {
    return new BatchLoadResult(datasetId, data, metadata, parameterTracker.getLoaded(datasetId));
  }

  @Data
  static class PendingRequest {
    final int datasetId;
    final Set<String> parameterIds;
    final String requestId;
    final Sinks.One<BatchLoadResult> result = Sinks.one();
  }
}
