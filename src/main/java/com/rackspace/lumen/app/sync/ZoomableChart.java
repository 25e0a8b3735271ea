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

import com.rackspace.lumen.app.model.DataRange;
import java.util.Map;

/**
 * The rendering side of a chart as seen by the {@link ViewportSyncService}.
 */
public interface ZoomableChart {
  String X_SCALE = "x";

  /**
   * @return the current range of every scale, keyed by scale name. The horizontal scale is
   * named {@link #X_SCALE}.
   */
  Map<String, DataRange> getScales();

  void setScale(String scale, DataRange range);

  /**
   * Applies several scale changes as one redraw.
   */
  default void batch(Runnable updates) {
    updates.run();
  }

  void resetZoom();

  boolean isDestroyed();
}
