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

import com.rackspace.lumen.app.model.CacheEntryType;
import java.time.Duration;
import java.time.temporal.ChronoUnit;
import javax.validation.Valid;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * Ceilings of each cache entry type. Each type is bounded independently by entry count,
 * estimated memory and time-to-live.
 */
@ConfigurationProperties("lumen.cache")
@Component
@Data
@Validated
public class CacheProperties {

  @NotNull
  @Valid
  Tier timeseries = new Tier(20, 100, Duration.ofMinutes(5));

  @NotNull
  @Valid
  Tier metadata = new Tier(100, 10, Duration.ofMinutes(30));

  @NotNull
  @Valid
  Tier parameterInfo = new Tier(200, 5, Duration.ofHours(1));

  @NotNull
  @Valid
  Tier transform = new Tier(30, 50, Duration.ofMinutes(5));

  @NotNull
  @Valid
  Tier sampling = new Tier(50, 80, Duration.ofMinutes(5));

  @NotNull
  @Valid
  Tier chart = new Tier(20, 50, Duration.ofMinutes(5));

  /**
   * How often expired entries are swept and memory pressure is consulted.
   */
  @NotNull
  @DurationUnit(ChronoUnit.SECONDS)
  Duration sweepInterval = Duration.ofSeconds(60);

  public Tier tierFor(CacheEntryType type) {
    switch (type) {
      case TIMESERIES:
        return timeseries;
      case METADATA:
        return metadata;
      case PARAMETER_INFO:
        return parameterInfo;
      case TRANSFORM:
        return transform;
      case SAMPLING:
        return sampling;
      case CHART:
        return chart;
      default:
        throw new IllegalArgumentException("Unknown cache entry type: " + type);
    }
  }

  @Data
  public static class Tier {
    @Min(1)
    int maxEntries;

    @Min(1)
    long maxMemoryMb;

    @NotNull
    @DurationUnit(ChronoUnit.SECONDS)
    Duration ttl;

    public Tier() {
    }

    public Tier(int maxEntries, long maxMemoryMb, Duration ttl) {
      this.maxEntries = maxEntries;
      this.maxMemoryMb = maxMemoryMb;
      this.ttl = ttl;
    }

    public long getMaxMemoryBytes() {
      return maxMemoryMb * 1024 * 1024;
    }
  }
}
