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
package com.rackspace.lumen.app.web;

import com.rackspace.lumen.app.model.WorkerPoolStats;
import com.rackspace.lumen.app.workers.WorkerPool;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/workers")
public class WorkerController {

  private final WorkerPool workerPool;

  @Autowired
  public WorkerController(WorkerPool workerPool) {
    this.workerPool = workerPool;
  }

  @GetMapping("/stats")
  public Mono<WorkerPoolStats> getStats() {
    return Mono.fromSupplier(workerPool::getStats);
  }
}
