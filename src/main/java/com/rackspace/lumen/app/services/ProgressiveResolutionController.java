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

import com.rackspace.lumen.app.config.AppProperties;
import com.rackspace.lumen.app.model.ChartConfiguration;
import com.rackspace.lumen.app.model.ChartData;
import com.rackspace.lumen.app.model.ChartState;
import com.rackspace.lumen.app.model.Resolution;
import java.time.Duration;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import lombok.extern.slf4j.Slf4j;

/**
 * Drives the data of one chart through increasing resolutions. Loading starts with a cheap
 * preview and, once each level is ready, automatically upgrades to the next after a delay until
 * <code>high</code> is reached. <code>full</code> is only loaded on request.
 * <p>
 * Every request captures a generation number; a result that arrives after a newer request was
 * issued is discarded. Failures are recorded in the chart's loading state rather than thrown.
 * </p>
 */
@Slf4j
public class ProgressiveResolutionController {

  private final String chartId;
  private final ChartDataService chartDataService;
  private final AppProperties appProperties;
  private final ScheduledExecutorService scheduler;
  private final ChartDataListener listener;
  private final Duration upgradeDelay;
  private final AtomicLong generation = new AtomicLong();

  private volatile ChartConfiguration configuration;
  private volatile boolean autoUpgrade;
  private volatile boolean disposed;
  // guarded by this
  private ChartState state = ChartState.idle();
  private ScheduledFuture<?> pendingUpgrade;
  private boolean manualResolution;

  public ProgressiveResolutionController(String chartId,
                                         ChartConfiguration configuration,
                                         ChartDataService chartDataService,
                                         AppProperties appProperties,
                                         ScheduledExecutorService scheduler,
                                         ChartDataListener listener) {
    this.chartId = chartId;
    this.configuration = configuration;
    this.chartDataService = chartDataService;
    this.appProperties = appProperties;
    this.scheduler = scheduler;
    this.listener = listener;
    this.upgradeDelay = appProperties.getProgressive().getUpgradeDelay();
    this.autoUpgrade = appProperties.getProgressive().isAutoUpgrade();
  }

  public void start() {
    start(Resolution.PREVIEW);
  }

  /**
   * Loads the given resolution and, unless it is <code>full</code>, keeps upgrading from there.
   */
  public void start(Resolution initial) {
    synchronized (this) {
      manualResolution = false;
      cancelPendingUpgrade();
    }
    request(generation.incrementAndGet(), initial, true);
  }

  /**
   * Switches to the given resolution, superseding any load in progress and any scheduled
   * upgrade. Automatic upgrading does not resume afterwards.
   */
  public void setResolution(Resolution resolution) {
    synchronized (this) {
      manualResolution = true;
      cancelPendingUpgrade();
    }
    request(generation.incrementAndGet(), resolution, false);
  }

  /**
   * Replaces the chart's configuration and reloads. A chart following automatic upgrades starts
   * over from the preview; a chart pinned to a resolution reloads at that resolution.
   */
  public void updateConfiguration(ChartConfiguration configuration) {
    final Resolution resolution;
    final boolean upgrade;
    synchronized (this) {
      this.configuration = configuration;
      cancelPendingUpgrade();
      upgrade = !manualResolution;
      resolution = manualResolution && state.getRequested() != null
          ? state.getRequested() : Resolution.PREVIEW;
    }
    request(generation.incrementAndGet(), resolution, upgrade);
  }

  public void setAutoUpgrade(boolean autoUpgrade) {
    this.autoUpgrade = autoUpgrade;
    if (!autoUpgrade) {
      synchronized (this) {
        cancelPendingUpgrade();
      }
    }
  }

  public synchronized ChartState getState() {
    return state;
  }

  public String getChartId() {
    return chartId;
  }

  public ChartConfiguration getConfiguration() {
    return configuration;
  }

  /**
   * Stops all further loading; results still in flight are discarded.
   */
  public void dispose() {
    disposed = true;
    generation.incrementAndGet();
    synchronized (this) {
      cancelPendingUpgrade();
    }
    log.debug("Disposed controller of chart {}", chartId);
  }

  private void request(long requestGeneration, Resolution resolution, boolean continueUpgrade) {
    if (disposed) {
      return;
    }
    final ChartState loading;
    synchronized (this) {
      if (!isCurrent(requestGeneration)) {
        return;
      }
      state = state.loading(resolution);
      loading = state;
    }
    listener.onStateChange(loading);
    log.debug("Loading chart {} at {}", chartId, resolution);

    chartDataService.getChartData(configuration, appProperties.samplingConfigFor(resolution),
            (loaded, total) -> onProgress(requestGeneration, loaded, total))
        .subscribe(
            data -> onLoaded(requestGeneration, resolution, data, continueUpgrade),
            error -> onFailed(requestGeneration, resolution, error));
  }

  private void onProgress(long requestGeneration, int loaded, int total) {
    synchronized (this) {
      if (!isCurrent(requestGeneration)) {
        return;
      }
      state = state.withProgress(loaded, total);
    }
    listener.onProgress(loaded, total);
  }

  private void onLoaded(long requestGeneration, Resolution resolution, ChartData data,
                        boolean continueUpgrade) {
    final ChartState ready;
    synchronized (this) {
      if (!isCurrent(requestGeneration)) {
        log.trace("Discarding stale {} data of chart {}", resolution, chartId);
        return;
      }
      ready = state.ready(resolution, data);
      state = ready;
    }
    listener.onResolutionChange(resolution);
    listener.onViewportChange(data.getViewport());
    listener.onStateChange(ready);

    if (continueUpgrade && autoUpgrade) {
      scheduleUpgrade(requestGeneration, resolution);
    }
  }

  private void onFailed(long requestGeneration, Resolution resolution, Throwable error) {
    final ChartState failed;
    synchronized (this) {
      if (!isCurrent(requestGeneration)) {
        log.trace("Discarding stale {} failure of chart {}", resolution, chartId);
        return;
      }
      failed = state.failed(error.getMessage() != null
          ? error.getMessage() : error.getClass().getSimpleName());
      state = failed;
    }
    log.warn("Loading chart {} at {} failed", chartId, resolution, error);
    listener.onStateChange(failed);
  }

  private void scheduleUpgrade(long requestGeneration, Resolution from) {
    final Resolution next = from.nextAutomatic();
    if (next == null) {
      return;
    }
    synchronized (this) {
      if (!isCurrent(requestGeneration)) {
        return;
      }
      pendingUpgrade = scheduler.schedule(() -> upgrade(requestGeneration, next),
          upgradeDelay.toMillis(), TimeUnit.MILLISECONDS);
    }
  }

  private void upgrade(long fromGeneration, Resolution next) {
    // loses against any request issued since the upgrade was scheduled
    if (!generation.compareAndSet(fromGeneration, fromGeneration + 1)) {
      return;
    }
    synchronized (this) {
      pendingUpgrade = null;
    }
    log.debug("Upgrading chart {} to {}", chartId, next);
    request(fromGeneration + 1, next, true);
  }

  private boolean isCurrent(long requestGeneration) {
    return !disposed && generation.get() == requestGeneration;
  }

  private void cancelPendingUpgrade() {
    if (pendingUpgrade != null) {
      pendingUpgrade.cancel(false);
      pendingUpgrade = null;
    }
  }
}
