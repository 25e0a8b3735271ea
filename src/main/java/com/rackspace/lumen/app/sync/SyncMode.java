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
package com.rackspace.lumen.app.sync;

import com.fasterxml.jackson.annotation.JsonValue;

public enum SyncMode {
  /**
   * Charts zoom on their own.
   */
  INDEPENDENT("independent"),
  /**
   * The x range of a zoomed chart is applied to all other charts.
   */
  X_AXIS_ONLY("x-axis-only"),
  /**
   * The x range, and the y range when reported, are applied to all other charts.
   */
  FULL_SYNC("full-sync");

  private final String label;

  SyncMode(String label) {
    this.label = label;
  }

  @JsonValue
  public String getLabel() {
    return label;
  }
}
