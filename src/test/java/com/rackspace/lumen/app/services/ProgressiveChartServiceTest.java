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

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.rackspace.lumen.app.config.AppProperties;
import com.rackspace.lumen.app.model.ChartConfiguration;
import com.rackspace.lumen.app.model.ChartData;
import com.rackspace.lumen.app.model.ChartPlotData;
import com.rackspace.lumen.app.model.ChartState;
import com.rackspace.lumen.app.model.SamplingInfo;
import com.rackspace.lumen.app.model.Viewport;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

public class ProgressiveChartServiceTest {

  private ChartDataService chartDataService;
  private ScheduledExecutorService scheduler;
  private ProgressiveChartService progressiveChartService;

  @BeforeEach
  public void setUp() {
    chartDataService = mock(ChartDataService.class);
    when(chartDataService.getChartData(any(), any(), any())).thenReturn(Mono.just(
        new ChartData(new ChartPlotData(null, List.of(), SamplingInfo.none()), Viewport.unit())));
    final AppProperties appProperties = new AppProperties();
    appProperties.getProgressive().setAutoUpgrade(false);
    appProperties.getProgressive().setUpgradeDelay(Duration.ofMillis(10));
    scheduler = Executors.newSingleThreadScheduledExecutor();
    progressiveChartService =
        new ProgressiveChartService(chartDataService, appProperties, scheduler);
  }

  @AfterEach
  public void tearDown() {
    progressiveChartService.disposeAll();
    scheduler.shutdownNow();
  }

  @Test
  public void testCreateController() {
    final ProgressiveResolutionController controller =
        progressiveChartService.createController(chart("c-1"), new ChartDataListener() {});

    assertThat(controller.getChartId()).isEqualTo("c-1");
    assertThat(progressiveChartService.getController("c-1")).containsSame(controller);
    assertThat(controller.getState().getStatus()).isEqualTo(ChartState.Status.IDLE);
    verify(chartDataService, never()).getChartData(any(), any(), any());

    controller.start();
    await().atMost(Duration.ofSeconds(5)).untilAsserted(() ->
        assertThat(controller.getState().getStatus()).isEqualTo(ChartState.Status.READY));
  }

  @Test
  public void testChartWithoutIdGetsOne() {
    final ProgressiveResolutionController controller =
        progressiveChartService.createController(chart(null), new ChartDataListener() {});

    assertThat(controller.getChartId()).isNotBlank();
    assertThat(progressiveChartService.getController(controller.getChartId())).isPresent();
  }

  @Test
  public void testReplacingControllerDisposesPrevious() {
    final ProgressiveResolutionController first =
        progressiveChartService.createController(chart("c-1"), new ChartDataListener() {});
    final ProgressiveResolutionController second =
        progressiveChartService.createController(chart("c-1"), new ChartDataListener() {});

    first.start();

    assertThat(progressiveChartService.getControllerCount()).isEqualTo(1);
    assertThat(progressiveChartService.getController("c-1")).containsSame(second);
    assertThat(first.getState().getStatus()).isEqualTo(ChartState.Status.IDLE);
    verify(chartDataService, never()).getChartData(any(), any(), any());
  }

  @Test
  public void testDisposeController() {
    final ProgressiveResolutionController controller =
        progressiveChartService.createController(chart("c-1"), new ChartDataListener() {});

    progressiveChartService.disposeController("c-1");
    progressiveChartService.disposeController("unknown");
    controller.start();

    assertThat(progressiveChartService.getController("c-1")).isEmpty();
    assertThat(progressiveChartService.getControllerCount()).isZero();
    verify(chartDataService, never()).getChartData(any(), any(), any());
  }

  private static ChartConfiguration chart(String chartId) {
    return new ChartConfiguration(chartId, ChartConfiguration.TIMESTAMP_AXIS, List.of("temp"),
        List.of(1));
  }
}
