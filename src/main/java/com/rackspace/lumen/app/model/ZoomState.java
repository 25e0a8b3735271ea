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
 * A zoom or pan result reported by a chart. The y range is optional.
 */
@Data
public class ZoomState {
  final DataRange x;
  final DataRange y;

  public static ZoomState ofX(double min, double max) {
    return new ZoomState(DataRange.of(min, max), null);
  }

  public static ZoomState of(DataRange x, DataRange y) {
    return new ZoomState(x, y);
  }

  public boolean hasY() {
    return y != null;
  }
}
