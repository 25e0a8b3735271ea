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
package com.rackspace.lumen.app.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum CacheEntryType {
  TIMESERIES("timeseries"),
  METADATA("metadata"),
  PARAMETER_INFO("parameter-info"),
  TRANSFORM("transform"),
  SAMPLING("sampling"),
  CHART("chart");

  private final String label;

  CacheEntryType(String label) {
    this.label = label;
  }

  @JsonValue
  public String getLabel() {
    return label;
  }

  /**
   * Accepts either the label, such as <code>parameter-info</code>, or the constant name.
   *
   * @throws IllegalArgumentException if the name matches no type
   */
  public static CacheEntryType fromName(String name) {
    for (CacheEntryType type : values()) {
      if (type.label.equalsIgnoreCase(name) || type.name().equalsIgnoreCase(name)) {
        return type;
      }
    }
    throw new IllegalArgumentException(
        String.format(Locale.ROOT, "Unknown cache entry type '%s'", name));
  }

  @Override
  public String toString() {
    return label;
  }
}
