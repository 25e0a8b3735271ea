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
import com.rackspace.lumen.app.model.Viewport;
import com.rackspace.lumen.app.model.ZoomState;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Propagates zoom and reset actions of one chart to every other registered chart according to
 * the current {@link SyncMode}. Only scales change; no data is reloaded.
 * <p>
 * Applying a scale to a chart usually makes that chart report a zoom change of its own. Those
 * echoes arrive while the fan-out holds the {@link SyncGuard} and are ignored.
 * </p>
 */
@Service
@Slf4j
public class ViewportSyncService {

  private final Map<String, RegisteredChart> charts = new ConcurrentHashMap<>();
  private final AtomicBoolean updating = new AtomicBoolean();
  private final List<SyncModeListener> modeListeners = new CopyOnWriteArrayList<>();
  private final List<ViewportChangeListener> viewportListeners = new CopyOnWriteArrayList<>();
  private volatile SyncMode syncMode = SyncMode.INDEPENDENT;

  public void registerChart(String chartId, ZoomableChart chart, boolean timeSeries) {
    charts.put(chartId, new RegisteredChart(chart, timeSeries));
    log.debug("Registered chart {}, time series: {}", chartId, timeSeries);
  }

  public void unregisterChart(String chartId) {
    if (charts.remove(chartId) != null) {
      log.debug("Unregistered chart {}", chartId);
    }
  }

  public boolean isRegistered(String chartId) {
    return charts.containsKey(chartId);
  }

  public boolean isTimeSeries(String chartId) {
    final RegisteredChart registered = charts.get(chartId);
    return registered != null && registered.timeSeries;
  }

  public SyncMode getSyncMode() {
    return syncMode;
  }

  public void setSyncMode(SyncMode syncMode) {
    this.syncMode = syncMode;
    log.debug("Sync mode set to {}", syncMode);
    for (SyncModeListener listener : modeListeners) {
      listener.onSyncModeChange(syncMode);
    }
  }

  public void addModeChangeListener(SyncModeListener listener) {
    modeListeners.add(listener);
  }

  public void removeModeChangeListener(SyncModeListener listener) {
    modeListeners.remove(listener);
  }

  public void addViewportChangeListener(ViewportChangeListener listener) {
    viewportListeners.add(listener);
  }

  public void removeViewportChangeListener(ViewportChangeListener listener) {
    viewportListeners.remove(listener);
  }

  public boolean isCurrentlyUpdating() {
    return updating.get();
  }

  /**
   * Applies the zoom reported by the source chart to every other chart.
   */
  public void handleZoomChange(String sourceId, ZoomState zoom) {
    final SyncMode mode = syncMode;
    if (mode == SyncMode.INDEPENDENT) {
      return;
    }
    final SyncGuard guard = SyncGuard.tryAcquire(updating);
    if (guard == null) {
      log.trace("Ignoring zoom of {} during synchronization", sourceId);
      return;
    }
    try (guard) {
      for (Map.Entry<String, RegisteredChart> entry : charts.entrySet()) {
        final String chartId = entry.getKey();
        if (chartId.equals(sourceId) || removeIfDestroyed(chartId, entry.getValue())) {
          continue;
        }
        final ZoomableChart chart = entry.getValue().chart;
        try {
          chart.batch(() -> {
            chart.setScale(ZoomableChart.X_SCALE, zoom.getX());
            if (mode == SyncMode.FULL_SYNC && zoom.hasY()) {
              for (String scale : chart.getScales().keySet()) {
                if (!ZoomableChart.X_SCALE.equals(scale)) {
                  chart.setScale(scale, zoom.getY());
                }
              }
            }
          });
          notifyViewportChange(chartId, chart);
        } catch (RuntimeException e) {
          log.warn("Failed to synchronize zoom of chart {} from {}", chartId, sourceId, e);
        }
      }
    }
  }

  /**
   * Resets the zoom of every other chart. In x-axis-only mode each chart keeps its own y scales.
   */
  public void handleReset(String sourceId) {
    final SyncMode mode = syncMode;
    if (mode == SyncMode.INDEPENDENT) {
      return;
    }
    final SyncGuard guard = SyncGuard.tryAcquire(updating);
    if (guard == null) {
      log.trace("Ignoring reset of {} during synchronization", sourceId);
      return;
    }
    try (guard) {
      for (Map.Entry<String, RegisteredChart> entry : charts.entrySet()) {
        final String chartId = entry.getKey();
        if (chartId.equals(sourceId) || removeIfDestroyed(chartId, entry.getValue())) {
          continue;
        }
        final ZoomableChart chart = entry.getValue().chart;
        try {
          if (mode == SyncMode.X_AXIS_ONLY) {
            final Map<String, DataRange> saved = new HashMap<>(chart.getScales());
            saved.remove(ZoomableChart.X_SCALE);
            chart.resetZoom();
            chart.batch(() -> saved.forEach(chart::setScale));
          } else {
            chart.resetZoom();
          }
          notifyViewportChange(chartId, chart);
        } catch (RuntimeException e) {
          log.warn("Failed to synchronize reset of chart {} from {}", chartId, sourceId, e);
        }
      }
    }
  }

  private boolean removeIfDestroyed(String chartId, RegisteredChart registered) {
    if (registered.chart.isDestroyed()) {
      charts.remove(chartId, registered);
      log.debug("Removed destroyed chart {}", chartId);
      return true;
    }
    return false;
  }

  private void notifyViewportChange(String chartId, ZoomableChart chart) {
    if (viewportListeners.isEmpty()) {
      return;
    }
    final Map<String, DataRange> scales = chart.getScales();
    final DataRange x = scales.get(ZoomableChart.X_SCALE);
    if (x == null) {
      return;
    }
    DataRange y = null;
    for (Map.Entry<String, DataRange> scale : scales.entrySet()) {
      if (!ZoomableChart.X_SCALE.equals(scale.getKey())) {
        y = scale.getValue();
        break;
      }
    }
    final Viewport viewport = Viewport.of(x, y != null ? y : DataRange.of(0, 1));
    for (ViewportChangeListener listener : viewportListeners) {
      listener.onViewportChange(chartId, viewport);
    }
  }

  private static class RegisteredChart {
    final ZoomableChart chart;
    final boolean timeSeries;

    RegisteredChart(ZoomableChart chart, boolean timeSeries) {
      this.chart = chart;
      this.timeSeries = timeSeries;
    }
  }
}
