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
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import javax.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Creates and tracks the {@link ProgressiveResolutionController} of each visible chart.
 */
@Service
@Slf4j
public class ProgressiveChartService {

  private final ChartDataService chartDataService;
  private final AppProperties appProperties;
  private final ScheduledExecutorService scheduler;
  private final Map<String, ProgressiveResolutionController> controllers =
      new ConcurrentHashMap<>();

  @Autowired
  public ProgressiveChartService(ChartDataService chartDataService,
                                 AppProperties appProperties,
                                 ScheduledExecutorService scheduler) {
    this.chartDataService = chartDataService;
    this.appProperties = appProperties;
    this.scheduler = scheduler;
  }

  /**
   * Creates a controller for the chart, replacing and disposing any previous controller of the
   * same chart id. The controller does not load anything until started.
   */
  public ProgressiveResolutionController createController(ChartConfiguration configuration,
                                                          ChartDataListener listener) {
    final String chartId = configuration.getChartId() != null
        ? configuration.getChartId() : UUID.randomUUID().toString();
    final ProgressiveResolutionController controller = new ProgressiveResolutionController(
        chartId, configuration, chartDataService, appProperties, scheduler, listener);
    final ProgressiveResolutionController previous = controllers.put(chartId, controller);
    if (previous != null) {
      previous.dispose();
    }
    log.debug("Created controller for chart {}", chartId);
    return controller;
  }

  public Optional<ProgressiveResolutionController> getController(String chartId) {
    return Optional.ofNullable(controllers.get(chartId));
  }

  public void disposeController(String chartId) {
    final ProgressiveResolutionController controller = controllers.remove(chartId);
    if (controller != null) {
      controller.dispose();
    }
  }

  public int getControllerCount() {
    return controllers.size();
  }

  @PreDestroy
  public void disposeAll() {
    controllers.values().forEach(ProgressiveResolutionController::dispose);
    controllers.clear();
  }
}
