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

import static com.rackspace.lumen.app.SampleFixtures.series;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

import com.rackspace.lumen.app.config.WorkerProperties;
import com.rackspace.lumen.app.downsample.SamplingConfig;
import com.rackspace.lumen.app.downsample.SamplingMethod;
import com.rackspace.lumen.app.downsample.SamplingResult;
import com.rackspace.lumen.app.exceptions.WorkerExecutionException;
import com.rackspace.lumen.app.model.DatasetSeries;
import com.rackspace.lumen.app.model.Sample;
import com.rackspace.lumen.app.model.SampledDataset;
import com.rackspace.lumen.app.model.TransformRequest;
import com.rackspace.lumen.app.model.WorkerPoolStats;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

public class WorkerPoolTest {

  private static List<Sample> largeSeries;

  private WorkerPool workerPool;

  @BeforeAll
  public static void createLargeSeries() {
    largeSeries = series(300_000, "v");
  }

  @AfterEach
  public void tearDown() {
    if (workerPool != null) {
      workerPool.shutdown();
    }
  }

  @Test
  public void testExecutesSamplingJob() {
    workerPool = pool(2, 10, Duration.ofSeconds(30));
    final List<Sample> input = series(1000, "v");

    StepVerifier.create(workerPool.execute(
        WorkerJob.sample(input, SamplingConfig.of(SamplingMethod.LTTB, 100), "v")))
        .assertNext(result -> {
          assertThat(result.getOriginalCount()).isEqualTo(1000);
          assertThat(result.getSampledCount()).isLessThanOrEqualTo(100);
          assertThat(result.getParameter()).isEqualTo("v");
        })
        .verifyComplete();

    final WorkerPoolStats stats = workerPool.getStats();
    assertThat(stats.getActiveWorkers()).isEqualTo(1);
    assertThat(stats.getIdleWorkers()).isEqualTo(1);
    assertThat(stats.getBusyWorkers()).isZero();
    assertThat(stats.getCompletedTasks()).isEqualTo(1);
  }

  @Test
  public void testReportsProgress() {
    workerPool = pool(1, 10, Duration.ofSeconds(30));
    final List<Integer> progress = new CopyOnWriteArrayList<>();

    StepVerifier.create(workerPool.execute(
        WorkerJob.sample(series(500, "v"), SamplingConfig.of(SamplingMethod.NTH, 10), null),
        (completed, total) -> progress.add(completed)))
        .expectNextCount(1)
        .verifyComplete();

    assertThat(progress).containsExactly(0, 1);
  }

  @Test
  public void testFailureOnlyRejectsItsOwnJob() {
    workerPool = pool(2, 10, Duration.ofSeconds(30));
    final SampledDataset dataset = new SampledDataset(1, null, series(10, "v"), 10, "none");
    // a transform without a chart configuration fails when run
    final CompletableFuture<DatasetSeries> failing = workerPool.execute(
        WorkerJob.transform(new TransformRequest(null, dataset, Map.of()))).toFuture();
    final CompletableFuture<SamplingResult> succeeding = workerPool.execute(
        WorkerJob.sample(series(200, "v"), SamplingConfig.of(SamplingMethod.MIN_MAX, 20), "v"))
        .toFuture();

    assertThatThrownBy(failing::get)
        .isInstanceOf(ExecutionException.class)
        .hasCauseInstanceOf(WorkerExecutionException.class)
        .hasMessageContaining("TRANSFORM_DATA failed");
    assertThat(succeeding.join().getSampledCount()).isLessThanOrEqualTo(20);

    StepVerifier.create(workerPool.execute(
        WorkerJob.sample(series(200, "v"), SamplingConfig.of(SamplingMethod.NTH, 20), "v")))
        .expectNextCount(1)
        .verifyComplete();
    assertThat(workerPool.getStats().getFailedTasks()).isEqualTo(1);
    assertThat(workerPool.getStats().getCompletedTasks()).isEqualTo(2);
  }

  @Test
  public void testQueuesBeyondMaxWorkers() {
    workerPool = pool(1, 10, Duration.ofSeconds(30));
    final List<CompletableFuture<SamplingResult>> results = new ArrayList<>();

    for (int i = 0; i < 5; i++) {
      results.add(workerPool.execute(
          WorkerJob.sample(series(300, "v"), SamplingConfig.of(SamplingMethod.LTTB, 30), "v"))
          .toFuture());
    }

    CompletableFuture.allOf(results.toArray(new CompletableFuture[0])).join();
    final WorkerPoolStats stats = workerPool.getStats();
    assertThat(stats.getActiveWorkers()).isEqualTo(1);
    assertThat(stats.getQueueLength()).isZero();
    assertThat(stats.getCompletedTasks()).isEqualTo(5);
  }

  @Test
  public void testRejectsWhenQueueIsFull() {
    workerPool = pool(1, 1, Duration.ofSeconds(30));
    final SamplingConfig config = SamplingConfig.of(SamplingMethod.LTTB, 100);

    final CompletableFuture<SamplingResult> running =
        workerPool.execute(WorkerJob.sample(largeSeries, config, "v")).toFuture();
    final CompletableFuture<SamplingResult> queued =
        workerPool.execute(WorkerJob.sample(largeSeries, config, "v")).toFuture();
    final CompletableFuture<SamplingResult> rejected =
        workerPool.execute(WorkerJob.sample(largeSeries, config, "v")).toFuture();

    assertThatThrownBy(rejected::get)
        .hasCauseInstanceOf(WorkerExecutionException.class)
        .hasMessageContaining("queue is full");
    assertThat(running.join().getSampledCount()).isLessThanOrEqualTo(100);
    assertThat(queued.join().getSampledCount()).isLessThanOrEqualTo(100);
  }

  @Test
  public void testTimedOutWorkerIsReplaced() {
    workerPool = pool(1, 10, Duration.ofMillis(1));

    StepVerifier.create(workerPool.execute(
        WorkerJob.sample(largeSeries, SamplingConfig.of(SamplingMethod.LTTB, 100), "v")))
        .expectErrorSatisfies(throwable -> assertThat(throwable)
            .isInstanceOf(WorkerExecutionException.class)
            .hasMessageContaining("timed out"))
        .verify(Duration.ofSeconds(10));

    await().atMost(Duration.ofSeconds(5)).untilAsserted(() -> {
      final WorkerPoolStats stats = workerPool.getStats();
      assertThat(stats.getFailedTasks()).isEqualTo(1);
      assertThat(stats.getActiveWorkers()).isZero();
    });
  }

  @Test
  public void testTerminateRejectsLaterJobs() {
    workerPool = pool(2, 10, Duration.ofSeconds(30));

    workerPool.terminate();

    StepVerifier.create(workerPool.execute(
        WorkerJob.sample(series(10, "v"), SamplingConfig.of(SamplingMethod.NTH, 5), "v")))
        .expectErrorSatisfies(throwable -> assertThat(throwable)
            .isInstanceOf(WorkerExecutionException.class)
            .hasMessageContaining("terminated"))
        .verify();
    assertThat(workerPool.getStats().getActiveWorkers()).isZero();
  }

  @Test
  public void testTerminateRejectsRunningAndQueuedJobs() {
    workerPool = pool(1, 10, Duration.ofSeconds(30));
    final SamplingConfig config = SamplingConfig.of(SamplingMethod.LTTB, 100);

    final CompletableFuture<SamplingResult> running =
        workerPool.execute(WorkerJob.sample(largeSeries, config, "v")).toFuture();
    final CompletableFuture<SamplingResult> queued =
        workerPool.execute(WorkerJob.sample(largeSeries, config, "v")).toFuture();
    workerPool.terminate();

    assertThatThrownBy(running::get)
        .hasCauseInstanceOf(WorkerExecutionException.class)
        .hasMessageContaining("terminated");
    assertThatThrownBy(queued::get)
        .hasCauseInstanceOf(WorkerExecutionException.class)
        .hasMessageContaining("terminated");
    final WorkerPoolStats stats = workerPool.getStats();
    assertThat(stats.getActiveWorkers()).isZero();
    assertThat(stats.getQueueLength()).isZero();
  }

  @Test
  public void testIgnoresResponsesOfUnknownJobs() {
    workerPool = pool(1, 10, Duration.ofSeconds(30));

    workerPool.onResponse(WorkerResponse.success("job-42", 1, "unexpected", 0));
    workerPool.onResponse(WorkerResponse.error("job-42", 1, new IllegalStateException(), 0));
    workerPool.onResponse(WorkerResponse.progress("job-42", 1, 1, 2));

    final WorkerPoolStats stats = workerPool.getStats();
    assertThat(stats.getCompletedTasks()).isZero();
    assertThat(stats.getFailedTasks()).isZero();
  }

  @Test
  public void testIgnoresResponsesFromOtherWorkersAndStaleResponses() {
    workerPool = pool(1, 10, Duration.ofSeconds(30));
    final List<Integer> progress = new CopyOnWriteArrayList<>();

    final CompletableFuture<SamplingResult> result = workerPool.execute(
        WorkerJob.sample(largeSeries, SamplingConfig.of(SamplingMethod.LTTB, 100), "v"),
        (completed, total) -> progress.add(completed)).toFuture();
    // the job runs on worker 1
    workerPool.onResponse(WorkerResponse.progress("job-1", 7, 5, 9));
    workerPool.onResponse(WorkerResponse.success("job-1", 7, "forged", 0));

    assertThat(result.join().getOriginalCount()).isEqualTo(300_000);
    assertThat(progress).doesNotContain(5);

    // a repeated answer for a finished job changes nothing
    workerPool.onResponse(WorkerResponse.success("job-1", 1, "late", 0));
    assertThat(workerPool.getStats().getCompletedTasks()).isEqualTo(1);
    assertThat(workerPool.getStats().getFailedTasks()).isZero();
  }

  @Test
  public void testPrefersIdleWorkerWithFewestCompletedTasks() {
    workerPool = pool(2, 10, Duration.ofSeconds(30));
    final SamplingConfig config = SamplingConfig.of(SamplingMethod.LTTB, 100);

    // two jobs at once start both workers, one task each
    final CompletableFuture<SamplingResult> first =
        workerPool.execute(WorkerJob.sample(largeSeries, config, "v")).toFuture();
    final CompletableFuture<SamplingResult> second =
        workerPool.execute(WorkerJob.sample(largeSeries, config, "v")).toFuture();
    CompletableFuture.allOf(first, second).join();
    assertThat(workerPool.getStats().getActiveWorkers()).isEqualTo(2);

    // tied, so the first worker runs the next job and gets ahead
    assertThat(workerThreadOf(series(10, "v"))).isEqualTo("lumen-worker-1");
    assertThat(workerThreadOf(series(10, "v"))).isEqualTo("lumen-worker-2");
    assertThat(workerThreadOf(series(10, "v"))).isEqualTo("lumen-worker-1");
  }

  @Test
  public void testMalformedSamplingJobIsRejectedUpFront() {
    assertThatThrownBy(() -> WorkerJob.sample(series(10, "v"),
        new SamplingConfig(true, SamplingMethod.NTH, -1, false, 0), "v"))
        .isInstanceOf(IllegalArgumentException.class);
  }

  private String workerThreadOf(List<Sample> input) {
    final List<String> threads = new CopyOnWriteArrayList<>();
    workerPool.execute(WorkerJob.sample(input, SamplingConfig.of(SamplingMethod.NTH, 5), "v"),
        (completed, total) -> threads.add(Thread.currentThread().getName()))
        .block(Duration.ofSeconds(10));
    assertThat(threads).isNotEmpty();
    return threads.get(0);
  }

  private static WorkerPool pool(int maxWorkers, int maxQueueSize, Duration jobTimeout) {
    final WorkerProperties properties = new WorkerProperties();
    properties.setMaxWorkers(maxWorkers);
    properties.setMaxQueueSize(maxQueueSize);
    properties.setJobTimeout(jobTimeout);
    return new WorkerPool(properties, new SimpleMeterRegistry());
  }
}
