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

import lombok.Data;

/**
 * Message sent by a {@link Worker} back to its pool, correlated by job id.
 */
@Data
class WorkerResponse {
  enum Kind {
    PROGRESS,
    SUCCESS,
    ERROR
  }

  final Kind kind;
  final String jobId;
  final int workerId;
  final Object result;
  final Throwable error;
  final int completed;
  final int total;
  final long elapsedNanos;

  static WorkerResponse progress(String jobId, int workerId, int completed, int total) {
    return new WorkerResponse(Kind.PROGRESS, jobId, workerId, null, null, completed, total, 0);
  }

  static WorkerResponse success(String jobId, int workerId, Object result, long elapsedNanos) {
    return new WorkerResponse(Kind.SUCCESS, jobId, workerId, result, null, 0, 0, elapsedNanos);
  }

  static WorkerResponse error(String jobId, int workerId, Throwable error, long elapsedNanos) {
    return new WorkerResponse(Kind.ERROR, jobId, workerId, null, error, 0, 0, elapsedNanos);
  }
}
