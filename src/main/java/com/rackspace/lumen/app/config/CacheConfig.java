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

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.AsyncCache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import com.rackspace.lumen.app.cache.SizeEstimator;
import com.rackspace.lumen.app.cache.TieredCache;
import com.rackspace.lumen.app.model.ChartData;
import com.rackspace.lumen.app.services.MemoryMonitor;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.cache.CaffeineCacheMetrics;
import java.util.concurrent.ScheduledExecutorService;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class CacheConfig {

  private final MeterRegistry meterRegistry;
  private final CacheProperties cacheProperties;

  @Autowired
  public CacheConfig(MeterRegistry meterRegistry,
                     CacheProperties cacheProperties) {
    this.meterRegistry = meterRegistry;
    this.cacheProperties = cacheProperties;
  }

  @Bean
  public SizeEstimator sizeEstimator(ObjectProvider<ObjectMapper> objectMapper) {
    final ObjectMapper mapper = objectMapper.getIfAvailable();
    return mapper != null ? new SizeEstimator(mapper) : new SizeEstimator();
  }

  @Bean
  public TieredCache tieredCache(SizeEstimator sizeEstimator,
                                 MemoryMonitor memoryMonitor,
                                 ScheduledExecutorService scheduledExecutorService) {
    return new TieredCache(cacheProperties, sizeEstimator, memoryMonitor,
        scheduledExecutorService, meterRegistry, Ticker.systemTicker());
  }

  /**
   * Chart data computations currently in progress, keyed by chart configuration hash, so that
   * identical concurrent requests share one computation.
   */
  @Bean
  public AsyncCache<String, ChartData> inFlightChartRequests() {
    final AsyncCache<String, ChartData> cache = Caffeine
        .newBuilder()
        .maximumSize(1000)
        .recordStats()
        .buildAsync();
    CaffeineCacheMetrics.monitor(meterRegistry, cache, "inFlightChartRequests");
    return cache;
  }
}
