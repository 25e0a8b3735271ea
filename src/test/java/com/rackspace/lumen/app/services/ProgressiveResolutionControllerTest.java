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
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.rackspace.lumen.app.config.AppProperties;
import com.rackspace.lumen.app.exceptions.StoreFetchException;
import com.rackspace.lumen.app.model.ChartConfiguration;
import com.rackspace.lumen.app.model.ChartData;
import com.rackspace.lumen.app.model.ChartPlotData;
import com.rackspace.lumen.app.model.ChartState;
import com.rackspace.lumen.app.model.Resolution;
import com.rackspace.lumen.app.model.SamplingInfo;
import com.rackspace.lumen.app.model.Viewport;
import com.rackspace.lumen.app.workers.ProgressListener;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

public class ProgressiveResolutionControllerTest {

  private final ChartConfiguration configuration =
      new ChartConfiguration("chart-1", "timestamp", List.of("temp"), List.of(1, 2));
  private AppProperties appProperties;
  private ChartDataService chartDataService;
  private ScheduledExecutorService scheduler;
  private RecordingListener listener;

  @BeforeEach
  public void setUp() {
    appProperties = new AppProperties();
    appProperties.getProgressive().setUpgradeDelay(Duration.ofMillis(20));
    chartDataService = mock(ChartDataService.class);
    scheduler = Executors.newSingleThreadScheduledExecutor();
    listener = new RecordingListener();
    for (Resolution resolution : Resolution.values()) {
      respond(resolution, Mono.just(chartData(resolution)));
    }
  }

  @AfterEach
  public void tearDown() {
    scheduler.shutdownNow();
  }

  @Test
  public void testUpgradesFromPreviewToHigh() {
    final ProgressiveResolutionController controller = controller();

    controller.start();

    await().atMost(Duration.ofSeconds(5)).untilAsserted(() ->
        assertThat(listener.resolutions)
            .containsExactly(Resolution.PREVIEW, Resolution.NORMAL, Resolution.HIGH));
    final ChartState state = controller.getState();
    assertThat(state.getStatus()).isEqualTo(ChartState.Status.READY);
    assertThat(state.getResolution()).isEqualTo(Resolution.HIGH);
    assertThat(state.getData()).isEqualTo(chartData(Resolution.HIGH));
    assertThat(state.getLoadingState().isLoading()).isFalse();
    assertThat(state.getLoadingState().getProgress()).isEqualTo(100);
    // full resolution is never loaded automatically
    await().during(Duration.ofMillis(100)).atMost(Duration.ofSeconds(1)).untilAsserted(() ->
        verify(chartDataService, never()).getChartData(eq(configuration),
            eq(appProperties.samplingConfigFor(Resolution.FULL)), any()));
  }

  @Test
  public void testDisabledAutoUpgradeStopsAtPreview() {
    appProperties.getProgressive().setAutoUpgrade(false);
    final ProgressiveResolutionController controller = controller();

    controller.start();

    await().during(Duration.ofMillis(100)).atMost(Duration.ofSeconds(1)).untilAsserted(() ->
        assertThat(listener.resolutions).containsExactly(Resolution.PREVIEW));
  }

  @Test
  public void testManualResolutionCancelsUpgrade() {
    appProperties.getProgressive().setUpgradeDelay(Duration.ofMillis(100));
    final ProgressiveResolutionController controller = controller();

    controller.start();
    controller.setResolution(Resolution.FULL);

    await().during(Duration.ofMillis(300)).atMost(Duration.ofSeconds(2)).untilAsserted(() ->
        assertThat(controller.getState().getResolution()).isEqualTo(Resolution.FULL));
    assertThat(listener.resolutions).containsExactly(Resolution.PREVIEW, Resolution.FULL);
    verify(chartDataService, never()).getChartData(eq(configuration),
        eq(appProperties.samplingConfigFor(Resolution.NORMAL)), any());
  }

  @Test
  public void testStaleResultIsDiscarded() {
    final Sinks.One<ChartData> slowPreview = Sinks.one();
    respond(Resolution.PREVIEW, slowPreview.asMono());
    final ProgressiveResolutionController controller = controller();

    controller.start();
    controller.setResolution(Resolution.HIGH);
    slowPreview.tryEmitValue(chartData(Resolution.PREVIEW));

    assertThat(controller.getState().getResolution()).isEqualTo(Resolution.HIGH);
    assertThat(controller.getState().getData()).isEqualTo(chartData(Resolution.HIGH));
    assertThat(listener.resolutions).containsExactly(Resolution.HIGH);
  }

  @Test
  public void testFailureIsRecordedInState() {
    respond(Resolution.PREVIEW,
        Mono.error(new StoreFetchException(1, new IllegalStateException("offline"))));
    final ProgressiveResolutionController controller = controller();

    controller.start();

    final ChartState state = controller.getState();
    assertThat(state.getLoadingState().getError()).contains("dataset 1");
    assertThat(state.getLoadingState().isLoading()).isFalse();
    assertThat(state.getData()).isNull();
    assertThat(listener.resolutions).isEmpty();
    assertThat(listener.states).last().isSameAs(state);
  }

  @Test
  public void testFailureKeepsPreviousData() {
    final ProgressiveResolutionController controller = controller();
    controller.setAutoUpgrade(false);
    controller.start();
    respond(Resolution.HIGH, Mono.error(new IllegalStateException("worker died")));

    controller.setResolution(Resolution.HIGH);

    final ChartState state = controller.getState();
    assertThat(state.getData()).isEqualTo(chartData(Resolution.PREVIEW));
    assertThat(state.getResolution()).isEqualTo(Resolution.PREVIEW);
    assertThat(state.getRequested()).isEqualTo(Resolution.HIGH);
    assertThat(state.getLoadingState().getError()).isEqualTo("worker died");
  }

  @Test
  public void testProgressIsReported() {
    when(chartDataService.getChartData(eq(configuration),
        eq(appProperties.samplingConfigFor(Resolution.PREVIEW)), any()))
        .thenAnswer(invocation -> {
          final ProgressListener onProgress = invocation.getArgument(2);
          return Mono.fromSupplier(() -> {
            onProgress.onProgress(1, 2);
            onProgress.onProgress(2, 2);
            return chartData(Resolution.PREVIEW);
          });
        });
    appProperties.getProgressive().setAutoUpgrade(false);
    final ProgressiveResolutionController controller = controller();

    controller.start();

    assertThat(listener.progress).containsExactly(50, 100);
  }

  @Test
  public void testPinnedConfigurationUpdateReloadsSameResolution() {
    final ProgressiveResolutionController controller = controller();
    controller.setResolution(Resolution.NORMAL);
    final ChartConfiguration updated =
        new ChartConfiguration("chart-1", "timestamp", List.of("pressure"), List.of(1));
    when(chartDataService.getChartData(eq(updated), any(), any()))
        .thenReturn(Mono.just(chartData(Resolution.NORMAL)));

    controller.updateConfiguration(updated);

    assertThat(controller.getConfiguration()).isSameAs(updated);
    verify(chartDataService, times(1)).getChartData(eq(updated),
        eq(appProperties.samplingConfigFor(Resolution.NORMAL)), any());
    assertThat(controller.getState().getResolution()).isEqualTo(Resolution.NORMAL);
  }

  @Test
  public void testDisposeDiscardsInFlightResults() {
    final Sinks.One<ChartData> slowPreview = Sinks.one();
    respond(Resolution.PREVIEW, slowPreview.asMono());
    final ProgressiveResolutionController controller = controller();

    controller.start();
    controller.dispose();
    slowPreview.tryEmitValue(chartData(Resolution.PREVIEW));

    assertThat(controller.getState().getStatus()).isEqualTo(ChartState.Status.LOADING);
    assertThat(listener.resolutions).isEmpty();
  }

  private ProgressiveResolutionController controller() {
    return new ProgressiveResolutionController("chart-1", configuration, chartDataService,
        appProperties, scheduler, listener);
  }

  private void respond(Resolution resolution, Mono<ChartData> response) {
    when(chartDataService.getChartData(eq(configuration),
        eq(appProperties.samplingConfigFor(resolution)), any()))
        .thenReturn(response);
  }

  private static ChartData chartData(Resolution resolution) {
    final double width = resolution.ordinal() + 1;
    return new ChartData(new ChartPlotData(null, List.of(), SamplingInfo.none()),
        new Viewport(0, width, 0, 1));
  }

  private static class RecordingListener implements ChartDataListener {
    final List<Resolution> resolutions = new CopyOnWriteArrayList<>();
    final List<ChartState> states = new CopyOnWriteArrayList<>();
    final List<Integer> progress = new CopyOnWriteArrayList<>();

    @Override
    public void onResolutionChange(Resolution resolution) {
      resolutions.add(resolution);
    }

    @Override
    public void onStateChange(ChartState state) {
      states.add(state);
    }

    @Override
    public void onProgress(int loaded, int total) {
      progress.add(loaded * 100 / total);
    }
  }
}
