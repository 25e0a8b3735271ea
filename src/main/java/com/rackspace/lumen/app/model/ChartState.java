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
 * Snapshot of a chart's progressive loading: <code>IDLE</code> until the first request,
 * then alternating between <code>LOADING</code> and <code>READY</code> as resolutions are
 * requested and delivered. The most recently delivered data is retained while a higher
 * resolution loads.
 */
@Data
public class ChartState {
  public enum Status {
    IDLE,
    LOADING,
    READY
  }

  final Status status;
  /**
   * Resolution of the delivered data.
   */
  final Resolution resolution;
  /**
   * Resolution of the latest request, which may still be loading.
   */
  final Resolution requested;
  final ChartData data;
  final ChartLoadingState loadingState;

  public static ChartState idle() {
    return new ChartState(Status.IDLE, null, null, null, ChartLoadingState.idle());
  }

  public ChartState loading(Resolution target) {
    return new ChartState(Status.LOADING, resolution, target, data, ChartLoadingState.started());
  }

  public ChartState withProgress(int loaded, int total) {
    return new ChartState(status, resolution, requested, data,
        ChartLoadingState.progress(loaded, total));
  }

  public ChartState ready(Resolution delivered, ChartData delivery) {
    return new ChartState(Status.READY, delivered, delivered, delivery, ChartLoadingState.done());
  }

  /**
   * Keeps the previously delivered data so the chart can continue to display it.
   */
  public ChartState failed(String error) {
    return new ChartState(Status.READY, resolution, requested, data,
        ChartLoadingState.failed(error));
  }
}
