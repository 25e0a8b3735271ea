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

import lombok.Data;

/**
 * A closed numeric interval, used both for axis scales and for the extent of plotted values.
 */
@Data
public class DataRange {
  final double min;
  final double max;

  public static DataRange of(double min, double max) {
    return new DataRange(min, max);
  }

  public DataRange union(DataRange other) {
    return new DataRange(Math.min(min, other.min), Math.max(max, other.max));
  }
}
