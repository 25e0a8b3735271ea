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

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.rackspace.lumen.app.config.WorkerProperties;
import com.rackspace.lumen.app.exceptions.WorkerExecutionException;
import com.rackspace.lumen.app.model.WorkerPoolStats;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import javax.annotation.PostConstruct;
import javax.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.publisher.MonoSink;

/**
 * Bounded set of workers that run CPU-heavy {@link WorkerJob}s off the calling threads.
 * <p>
 * A submitted job goes to an idle worker, preferring the one with the fewest completed tasks.
 * Without an idle worker a new one is started while below the configured maximum; beyond that
 * jobs wait in FIFO order for the next worker to become idle. A failing job rejects only its
 * own result. A worker that does not answer within the job timeout is terminated and
 * replaced on demand.
 * </p>
 */
@Service
@Slf4j
public class WorkerPool {

  private final int maxWorkers;
  private final int maxQueueSize;
  private final Duration jobTimeout;
  private final ScheduledExecutorService timeouts;
  private final Timer jobTimer;
  private final AtomicLong jobIds = new AtomicLong();

  // all guarded by this
  private final List<Worker> workers = new ArrayList<>();
  private final Deque<PendingJob<?>> queue = new ArrayDeque<>();
  private final Map<String, PendingJob<?>> running = new HashMap<>();
  private int nextWorkerId = 1;
  private long completedTasks;
  private long failedTasks;
  private boolean terminated;

  @Autowired
  public WorkerPool(WorkerProperties properties, MeterRegistry meterRegistry) {
    this.maxWorkers = properties.getMaxWorkers();
    this.maxQueueSize = properties.getMaxQueueSize();
    this.jobTimeout = properties.getJobTimeout();
    this.timeouts = Executors.newSingleThreadScheduledExecutor(
        new ThreadFactoryBuilder()
            .setNameFormat("lumen-worker-timeouts")
            .setDaemon(true)
            .build());
    this.jobTimer = Timer.builder("lumen.workers.jobs")
        .description("Time spent running worker jobs")
        .register(meterRegistry);
  }

  @PostConstruct
  public void printConfigurations() {
    log.info("max-workers: {}", maxWorkers);
    log.info("max-queue-size: {}", maxQueueSize);
    log.info("job-timeout: {}s", jobTimeout.getSeconds());
  }

  public <R> Mono<R> execute(WorkerJob<R> job) {
    return execute(job, ProgressListener.NONE);
  }

  /**
   * Submits the job when the returned mono is subscribed.
   *
   * @param onProgress receives progress reported by the job, on the worker's thread
   */
  public <R> Mono<R> execute(WorkerJob<R> job, ProgressListener onProgress) {
    return Mono.create(sink -> submit(
        new PendingJob<>("job-" + jobIds.incrementAndGet(), job, sink, onProgress)));
  }

  /**
   * Stops every worker. Queued and running jobs are rejected and later submissions fail.
   */
  public void terminate() {
    final List<PendingJob<?>> abandoned = new ArrayList<>();
    synchronized (this) {
      terminated = true;
      abandoned.addAll(queue);
      abandoned.addAll(running.values());
      queue.clear();
      running.clear();
      workers.forEach(Worker::terminate);
      workers.clear();
    }
    if (!abandoned.isEmpty()) {
      log.debug("Rejecting {} jobs of terminated worker pool", abandoned.size());
    }
    for (PendingJob<?> job : abandoned) {
      job.cancelTimeout();
      job.fail(new WorkerExecutionException(job.id, "Worker pool terminated"));
    }
  }

  @PreDestroy
  public void shutdown() {
    terminate();
    timeouts.shutdownNow();
  }

  public synchronized WorkerPoolStats getStats() {
    int busy = 0;
    for (Worker worker : workers) {
      if (worker.isBusy()) {
        busy++;
      }
    }
    return new WorkerPoolStats(workers.size(), busy, workers.size() - busy, queue.size(),
        completedTasks, failedTasks);
  }

  private void submit(PendingJob<?> job) {
    final WorkerExecutionException rejection;
    synchronized (this) {
      if (terminated) {
        rejection = new WorkerExecutionException(job.id, "Worker pool terminated");
      } else {
        Worker worker = idleWorker();
        if (worker == null && workers.size() < maxWorkers) {
          worker = spawnWorker();
        }
        if (worker != null) {
          assign(worker, job);
          return;
        }
        if (queue.size() >= maxQueueSize) {
          rejection = new WorkerExecutionException(job.id,
              "Worker queue is full with " + queue.size() + " jobs");
        } else {
          queue.addLast(job);
          log.trace("Queued {}, {} waiting", job.id, queue.size());
          return;
        }
      }
    }
    job.fail(rejection);
  }

  private Worker idleWorker() {
    Worker selected = null;
    for (Worker worker : workers) {
      if (!worker.isBusy()
          && (selected == null || worker.getTasksCompleted() < selected.getTasksCompleted())) {
        selected = worker;
      }
    }
    return selected;
  }

  private Worker spawnWorker() {
    final Worker worker = new Worker(nextWorkerId++, this::onResponse);
    workers.add(worker);
    log.debug("Started worker {}, {} of {} running", worker.getId(), workers.size(), maxWorkers);
    return worker;
  }

  private void assign(Worker worker, PendingJob<?> job) {
    worker.assign();
    job.worker = worker;
    running.put(job.id, job);
    job.timeout = timeouts.schedule(() -> onTimeout(job),
        jobTimeout.toMillis(), TimeUnit.MILLISECONDS);
    worker.post(job.id, job.job);
  }

  /**
   * Handles a message of a worker. Messages for jobs that are not running, or that come from a
   * worker other than the job's, are ignored.
   */
  void onResponse(WorkerResponse response) {
    final PendingJob<?> job;
    synchronized (this) {
      final PendingJob<?> candidate = running.get(response.getJobId());
      if (candidate == null || candidate.worker.getId() != response.getWorkerId()) {
        log.trace("Ignoring {} for unknown job {}", response.getKind(), response.getJobId());
        return;
      }
      if (response.getKind() == WorkerResponse.Kind.PROGRESS) {
        job = null;
      } else {
        running.remove(response.getJobId());
        candidate.worker.release();
        if (response.getKind() == WorkerResponse.Kind.SUCCESS) {
          completedTasks++;
        } else {
          failedTasks++;
        }
        final PendingJob<?> next = queue.pollFirst();
        if (next != null) {
          assign(candidate.worker, next);
        }
        job = candidate;
      }
    }

    if (job == null) {
      reportProgress(response.getJobId(), response.getCompleted(), response.getTotal());
      return;
    }
    job.cancelTimeout();
    jobTimer.record(response.getElapsedNanos(), TimeUnit.NANOSECONDS);
    if (response.getKind() == WorkerResponse.Kind.SUCCESS) {
      job.complete(response.getResult());
    } else {
      log.debug("Job {} failed on worker {}", job.id, response.getWorkerId(), response.getError());
      job.fail(new WorkerExecutionException(job.id,
          job.job.getOperation() + " failed: " + response.getError().getMessage(),
          response.getError()));
    }
  }

  private void reportProgress(String jobId, int completed, int total) {
    final PendingJob<?> job;
    synchronized (this) {
      job = running.get(jobId);
    }
    if (job != null) {
      job.onProgress.onProgress(completed, total);
    }
  }

  private void onTimeout(PendingJob<?> job) {
    synchronized (this) {
      if (running.remove(job.id) == null) {
        return;
      }
      failedTasks++;
      job.worker.terminate();
      workers.remove(job.worker);
      log.warn("Worker {} did not finish {} within {}, terminating it",
          job.worker.getId(), job.id, jobTimeout);
      // the terminated worker's capacity is available again
      final PendingJob<?> next = queue.pollFirst();
      if (next != null) {
        assign(spawnWorker(), next);
      }
    }
    job.fail(new WorkerExecutionException(job.id,
        job.job.getOperation() + " timed out after " + jobTimeout));
  }

  private static class PendingJob<R> {
    final String id;
    final WorkerJob<R> job;
    final MonoSink<R> sink;
    final ProgressListener onProgress;
    Worker worker;
    ScheduledFuture<?> timeout;

    PendingJob(String id, WorkerJob<R> job, MonoSink<R> sink, ProgressListener onProgress) {
      this.id = id;
      this.job = job;
      this.sink = sink;
      this.onProgress = onProgress;
    }

    @SuppressWarnings("unchecked")
    void complete(Object result) {
      sink.success((R) result);
    }

    void fail(Throwable error) {
      sink.error(error);
    }

    void cancelTimeout() {
      if (timeout != null) {
        timeout.cancel(false);
      }
    }
  }
}
