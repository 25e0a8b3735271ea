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

import java.time.Instant;
import java.util.List;
import lombok.Data;

@Data
public class DatasetMetadata {
  int id;
  String label;
  String plant;
  String machineNo;
  /**
   * Optional user-selected window. When both ends are set only samples inside it are loaded.
   */
  Instant startTime;
  Instant endTime;
  /**
   * Actual extent of the stored data.
   */
  Instant dataStartTime;
  Instant dataEndTime;
  List<String> parameterIds;

  public TimeRange getSelectedRange() {
    if (startTime == null || endTime == null) {
      return null;
    }
    return new TimeRange(startTime, endTime);
  }

  public String getDisplayLabel() {
    if (label != null && !label.isBlank()) {
      return label;
    }
    return "Dataset " + id;
  }
}
