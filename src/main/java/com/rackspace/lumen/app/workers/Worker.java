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
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Consumer;
import lombok.extern.slf4j.Slf4j;

/**
 * A dedicated thread that runs one job at a time and reports back only through
 * {@link WorkerResponse} messages.
 */
@Slf4j
class Worker {
  private final int id;
  private final ExecutorService thread;
  private final Consumer<WorkerResponse> responses;

  // guarded by the owning pool
  private boolean busy;
  private long tasksCompleted;

  Worker(int id, Consumer<WorkerResponse> responses) {
    this.id = id;
    this.responses = responses;
    this.thread = Executors.newSingleThreadExecutor(
        new ThreadFactoryBuilder()
            .setNameFormat("lumen-worker-" + id)
            .setDaemon(true)
            .build());
  }

  void post(String jobId, WorkerJob<?> job) {
    try {
      thread.execute(() -> run(jobId, job));
    } catch (RejectedExecutionException e) {
      responses.accept(WorkerResponse.error(jobId, id, e, 0));
    }
  }

  private void run(String jobId, WorkerJob<?> job) {
    final long start = System.nanoTime();
    log.trace("Worker {} running {} {} over {} elements", id, job.getOperation(), jobId,
        job.getSize());
    try {
      final Object result = job.execute(
          (completed, total) -> responses.accept(
              WorkerResponse.progress(jobId, id, completed, total)));
      responses.accept(WorkerResponse.success(jobId, id, result, System.nanoTime() - start));
    } catch (RuntimeException e) {
      responses.accept(WorkerResponse.error(jobId, id, e, System.nanoTime() - start));
    }
  }

  void terminate() {
    thread.shutdownNow();
  }

  int getId() {
    return id;
  }

  boolean isBusy() {
    return busy;
  }

  long getTasksCompleted() {
    return tasksCompleted;
  }

  void assign() {
    busy = true;
  }

  void release() {
    busy = false;
    tasksCompleted++;
  }
}
