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

@Data
public class ChartLoadingState {
  final boolean loading;
  /**
   * Percentage of datasets loaded for the current request.
   */
  final int progress;
  final String error;

  public static ChartLoadingState idle() {
    return new ChartLoadingState(false, 0, null);
  }

  public static ChartLoadingState started() {
    return new ChartLoadingState(true, 0, null);
  }

  public static ChartLoadingState progress(int loaded, int total) {
    return new ChartLoadingState(true, total == 0 ? 100 : loaded * 100 / total, null);
  }

  public static ChartLoadingState done() {
    return new ChartLoadingState(false, 100, null);
  }

  public static ChartLoadingState failed(String error) {
    return new ChartLoadingState(false, 100, error);
  }
}
