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

import com.rackspace.lumen.app.downsample.SamplingConfig;
import com.rackspace.lumen.app.downsample.SamplingMethod;
import com.rackspace.lumen.app.model.Resolution;
import java.time.Duration;
import java.time.temporal.ChronoUnit;
import javax.validation.Valid;
import javax.validation.constraints.DecimalMax;
import javax.validation.constraints.DecimalMin;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties("lumen")
@Component
@Data
@Validated
public class AppProperties {

  @NotNull
  @Valid
  Resolutions resolution = new Resolutions();

  @NotNull
  @Valid
  Batch batch = new Batch();

  @NotNull
  @Valid
  Progressive progressive = new Progressive();

  @NotNull
  @Valid
  Memory memory = new Memory();

  /**
   * Number of threads backing the shared scheduler used for batch windows, resolution upgrades
   * and cache sweeps.
   */
  @Min(1)
  int schedulerThreads = 2;

  /**
   * Resolves the sampling configuration that produces the given resolution level.
   */
  public SamplingConfig samplingConfigFor(Resolution resolution) {
    switch (resolution) {
      case PREVIEW:
        return this.resolution.getPreview().toSamplingConfig();
      case NORMAL:
        return this.resolution.getNormal().toSamplingConfig();
      case HIGH:
        return this.resolution.getHigh().toSamplingConfig();
      case FULL:
        return SamplingConfig.disabled();
      default:
        throw new IllegalArgumentException("Unsupported resolution: " + resolution);
    }
  }

  @Data
  public static class Resolutions {
    @NotNull
    @Valid
    Level preview = new Level(100, SamplingMethod.NTH, 50, false);

    @NotNull
    @Valid
    Level normal = new Level(500, SamplingMethod.LTTB, 250, true);

    @NotNull
    @Valid
    Level high = new Level(1000, SamplingMethod.LTTB, 500, true);
  }

  @Data
  public static class Level {
    /**
     * Upper bound on the number of samples kept per dataset at this level.
     */
    @Min(1)
    int targetPoints;

    @NotNull
    SamplingMethod method;

    /**
     * Series at or below this length are delivered as-is.
     */
    @Min(0)
    int samplingThreshold;

    boolean preserveExtremes;

    public Level() {
    }

    public Level(int targetPoints, SamplingMethod method, int samplingThreshold,
                 boolean preserveExtremes) {
      this.targetPoints = targetPoints;
      this.method = method;
      this.samplingThreshold = samplingThreshold;
      this.preserveExtremes = preserveExtremes;
    }

    public SamplingConfig toSamplingConfig() {
      return new SamplingConfig(
          true, method, targetPoints, preserveExtremes, samplingThreshold);
    }
  }

  @Data
  public static class Batch {
    /**
     * How long the first request of a batch waits for others to join it.
     */
    @NotNull
    @DurationUnit(ChronoUnit.MILLIS)
    Duration window = Duration.ofMillis(10);
  }

  @Data
  public static class Progressive {
    /**
     * Delay between a resolution becoming ready and the automatic upgrade to the next one.
     */
    @NotNull
    @DurationUnit(ChronoUnit.MILLIS)
    Duration upgradeDelay = Duration.ofSeconds(1);

    boolean autoUpgrade = true;
  }

  @Data
  public static class Memory {
    /**
     * Fraction of the maximum heap above which memory pressure is reported as high.
     */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    double highRatio = 0.8;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    double criticalRatio = 0.9;
  }
}
