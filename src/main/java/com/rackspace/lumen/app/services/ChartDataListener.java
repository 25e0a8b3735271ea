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
package com.rackspace.lumen.app.services;

import com.rackspace.lumen.app.model.ChartState;
import com.rackspace.lumen.app.model.Resolution;
import com.rackspace.lumen.app.model.Viewport;

/**
 * Rendering-side callbacks of a {@link ProgressiveResolutionController}. Callbacks may arrive
 * on any thread and are never invoked for superseded requests.
 */
public interface ChartDataListener {

  default void onProgress(int loaded, int total) {
  }

  default void onResolutionChange(Resolution resolution) {
  }

  default void onViewportChange(Viewport viewport) {
  }

  default void onStateChange(ChartState state) {
  }
}
