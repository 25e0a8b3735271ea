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
import com.rackspace.lumen.app.model.MemoryPressure;
import com.rackspace.lumen.app.model.MemoryStats;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Derives memory pressure from the ratio of used to maximum JVM heap.
 */
@Service
public class RuntimeMemoryMonitor implements MemoryMonitor {
  private final Runtime runtime;
  private final double highRatio;
  private final double criticalRatio;

  @Autowired
  public RuntimeMemoryMonitor(AppProperties appProperties) {
    this(Runtime.getRuntime(), appProperties.getMemory().getHighRatio(),
        appProperties.getMemory().getCriticalRatio());
  }

  RuntimeMemoryMonitor(Runtime runtime, double highRatio, double criticalRatio) {
    this.runtime = runtime;
    this.highRatio = highRatio;
    this.criticalRatio = criticalRatio;
  }

  @Override
  public MemoryStats getMemoryStats() {
    final long max = runtime.maxMemory();
    final long used = runtime.totalMemory() - runtime.freeMemory();
    return new MemoryStats(classify((double) used / max), used, max);
  }

  MemoryPressure classify(double ratio) {
    if (ratio >= criticalRatio) {
      return MemoryPressure.CRITICAL;
    }
    if (ratio >= highRatio) {
      return MemoryPressure.HIGH;
    }
    return MemoryPressure.NORMAL;
  }
}
