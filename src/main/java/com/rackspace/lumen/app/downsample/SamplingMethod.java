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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum SamplingMethod {
  /**
   * Keeps every n-th sample.
   */
  NTH("nth"),
  /**
   * Largest-Triangle-Three-Buckets, which keeps the visual shape of the series.
   */
  LTTB("lttb"),
  /**
   * Keeps the minimum and maximum of each bucket, which preserves spikes.
   */
  MIN_MAX("min-max");

  private final String label;

  SamplingMethod(String label) {
    this.label = label;
  }

  @JsonValue
  public String getLabel() {
    return label;
  }

  @JsonCreator
  public static SamplingMethod fromLabel(String label) {
    for (SamplingMethod method : values()) {
      if (method.label.equalsIgnoreCase(label) || method.name().equalsIgnoreCase(label)) {
        return method;
      }
    }
    throw new IllegalArgumentException("Unknown sampling method '" + label + "'");
  }
}
