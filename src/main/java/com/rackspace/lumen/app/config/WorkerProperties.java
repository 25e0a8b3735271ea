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
package com.rackspace.lumen.app.config;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties("lumen.workers")
@Component
@Data
@Validated
public class WorkerProperties {
  /**
   * Upper bound on concurrently running workers.
   * The default leaves one available processor to the request threads.
   */
  @Min(1)
  int maxWorkers = Math.max(1, Runtime.getRuntime().availableProcessors() - 1);

  /**
   * A worker that does not respond to a job within this time is terminated.
   */
  @NotNull
  @DurationUnit(ChronoUnit.SECONDS)
  Duration jobTimeout = Duration.ofSeconds(30);

  /**
   * Jobs submitted while this many are already queued are rejected.
   */
  @Min(1)
  int maxQueueSize = 100;

  /**
   * Series with at least this many samples are sampled and transformed on a worker
   * instead of the calling thread.
   */
  @Min(1)
  int offloadThreshold = 20000;
}
