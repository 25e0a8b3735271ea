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
package com.rackspace.lumen.app.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rackspace.lumen.app.model.ChartData;
import com.rackspace.lumen.app.model.ChartSeriesData;
import com.rackspace.lumen.app.model.DatasetSeries;
import com.rackspace.lumen.app.model.Sample;
import com.rackspace.lumen.app.model.SampledDataset;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/**
 * Cheap approximation of the heap retained by a cached value. Collections are estimated as
 * their length times a per-element estimate; arbitrary objects as twice the length of their
 * JSON form.
 */
@Slf4j
public class SizeEstimator {
  static final long OBJECT_BYTES = 100;
  static final long NUMBER_BYTES = 8;
  static final long SAMPLE_BYTES = 48;
  static final long READING_BYTES = 40;
  /**
   * A plotted point holds a boxed x and a boxed y.
   */
  static final long PLOTTED_POINT_BYTES = 48;

  private final ObjectMapper objectMapper;

  public SizeEstimator() {
    this(new ObjectMapper().findAndRegisterModules());
  }

  public SizeEstimator(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  public long estimate(Object value) {
    if (value == null) {
      return 0;
    }
    if (value instanceof Collection) {
      return estimateCollection((Collection<?>) value);
    }
    if (value instanceof Map) {
      return ((Map<?, ?>) value).size() * OBJECT_BYTES;
    }
    if (value instanceof SampledDataset) {
      return estimateCollection(((SampledDataset) value).getSamples()) + OBJECT_BYTES;
    }
    if (value instanceof DatasetSeries) {
      return estimateSeries(((DatasetSeries) value).getSeries()) + OBJECT_BYTES;
    }
    if (value instanceof ChartData) {
      return estimateSeries(((ChartData) value).getPlotData().getSeries()) + OBJECT_BYTES;
    }
    if (value instanceof Number) {
      return NUMBER_BYTES;
    }
    if (value instanceof CharSequence) {
      return 2L * ((CharSequence) value).length();
    }
    return estimateSerialized(value);
  }

  private long estimateCollection(Collection<?> values) {
    if (values.isEmpty()) {
      return 0;
    }
    final Object first = values.iterator().next();
    return values.size() * estimateElement(first);
  }

  private long estimateElement(Object element) {
    if (element instanceof Sample) {
      return SAMPLE_BYTES + ((Sample) element).getValues().size() * READING_BYTES;
    }
    if (element instanceof Number) {
      return NUMBER_BYTES;
    }
    return OBJECT_BYTES;
  }

  private long estimateSeries(List<ChartSeriesData> series) {
    long bytes = 0;
    for (ChartSeriesData s : series) {
      bytes += s.size() * PLOTTED_POINT_BYTES + OBJECT_BYTES;
    }
    return bytes;
  }

  private long estimateSerialized(Object value) {
    try {
      return 2L * objectMapper.writeValueAsString(value).length();
    } catch (JsonProcessingException e) {
      log.debug("Unable to serialize {} for size estimation", value.getClass().getName(), e);
      return OBJECT_BYTES;
    }
  }
}
