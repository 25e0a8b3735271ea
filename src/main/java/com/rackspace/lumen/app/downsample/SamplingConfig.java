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
package com.rackspace.lumen.app.downsample;

import lombok.Data;

@Data
public class SamplingConfig {
  final boolean enabled;
  final SamplingMethod method;
  /**
   * Upper bound on the length of a sampled series.
   */
  final int targetPoints;
  /**
   * When set, sampling always keeps the first and last samples and <code>nth</code> prefers
   * samples that carry a reading.
   */
  final boolean preserveExtremes;
  /**
   * Series no longer than this are returned untouched.
   */
  final int samplingThreshold;

  public static SamplingConfig of(SamplingMethod method, int targetPoints) {
    return new SamplingConfig(true, method, targetPoints, false, targetPoints);
  }

  public static SamplingConfig disabled() {
    return new SamplingConfig(false, null, 0, false, 0);
  }

  /**
   * @return a copy that reduces any series longer than the target, used when a higher
   * resolution result is narrowed down to this one
   */
  public SamplingConfig withThresholdAtTarget() {
    return new SamplingConfig(enabled, method, targetPoints, preserveExtremes, targetPoints);
  }

  /**
   * @throws IllegalArgumentException if an enabled configuration is malformed
   */
  public void validate() {
    if (!enabled) {
      return;
    }
    if (method == null) {
      throw new IllegalArgumentException("Sampling method is required");
    }
    if (targetPoints <= 0) {
      throw new IllegalArgumentException(
          "targetPoints must be positive, but was " + targetPoints);
    }
    if (samplingThreshold < 0) {
      throw new IllegalArgumentException(
          "samplingThreshold must not be negative, but was " + samplingThreshold);
    }
  }
}
