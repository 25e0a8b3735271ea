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

import com.rackspace.lumen.app.config.WorkerProperties;
import com.rackspace.lumen.app.downsample.SamplingConfig;
import com.rackspace.lumen.app.downsample.SamplingEngine;
import com.rackspace.lumen.app.downsample.SamplingResult;
import com.rackspace.lumen.app.model.Sample;
import com.rackspace.lumen.app.workers.WorkerJob;
import com.rackspace.lumen.app.workers.WorkerPool;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Runs the {@link SamplingEngine} inline for small series and on the {@link WorkerPool} for
 * series of at least the configured offload threshold.
 */
@Service
@Slf4j
public class SamplingService {

  private final WorkerPool workerPool;
  private final int offloadThreshold;

  @Autowired
  public SamplingService(WorkerPool workerPool, WorkerProperties workerProperties) {
    this.workerPool = workerPool;
    this.offloadThreshold = workerProperties.getOffloadThreshold();
  }

  public Mono<SamplingResult> sample(List<Sample> series, SamplingConfig config,
                                     String samplingParameter) {
    if (requiresReduction(series, config) && series.size() >= offloadThreshold) {
      log.trace("Offloading sampling of {} samples", series.size());
      return Mono.defer(() -> workerPool.execute(
          WorkerJob.sample(series, config, samplingParameter)));
    }
    return Mono.fromCallable(
        () -> SamplingEngine.sampleWithInfo(series, config, samplingParameter));
  }

  private static boolean requiresReduction(List<Sample> series, SamplingConfig config) {
    return config.isEnabled()
        && series.size() > config.getSamplingThreshold()
        && series.size() > config.getTargetPoints();
  }
}
