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
package com.rackspace.lumen.app.repos;

import com.rackspace.lumen.app.model.DatasetMetadata;
import com.rackspace.lumen.app.model.ParameterInfo;
import com.rackspace.lumen.app.model.Sample;
import com.rackspace.lumen.app.model.TimeRange;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

/**
 * Dataset store held in memory. Datasets are registered programmatically.
 */
@Repository
@Slf4j
public class InMemoryDatasetStore implements DatasetStore {

  private final Map<Integer, List<Sample>> series = new ConcurrentHashMap<>();
  private final Map<Integer, DatasetMetadata> metadata = new ConcurrentHashMap<>();
  private final Map<String, ParameterInfo> parameters = new ConcurrentHashMap<>();

  public void putDataset(DatasetMetadata datasetMetadata, List<Sample> samples) {
    final List<Sample> sorted = new ArrayList<>(samples);
    sorted.sort(Comparator.comparing(Sample::getTimestamp));
    series.put(datasetMetadata.getId(), List.copyOf(sorted));
    metadata.put(datasetMetadata.getId(), datasetMetadata);
    log.debug("Stored dataset {} with {} samples", datasetMetadata.getId(), sorted.size());
  }

  public void putParameterInfo(ParameterInfo parameterInfo) {
    parameters.put(parameterInfo.getParameterId(), parameterInfo);
  }

  public void removeDataset(int datasetId) {
    series.remove(datasetId);
    metadata.remove(datasetId);
  }

  @Override
  public Mono<List<Sample>> fetchTimeSeries(int datasetId, Set<String> parameterIds,
                                           TimeRange range) {
    return Mono.fromCallable(() -> {
      final List<Sample> stored = series.get(datasetId);
      if (stored == null) {
        throw new IllegalArgumentException("Unknown dataset " + datasetId);
      }
      final List<Sample> columns = new ArrayList<>();
      for (Sample sample : stored) {
        if (range != null && !range.contains(sample.getTimestamp())) {
          continue;
        }
        final Sample restricted = sample.restrictTo(parameterIds);
        if (!restricted.getValues().isEmpty()) {
          columns.add(restricted);
        }
      }
      return columns;
    });
  }

  @Override
  public Mono<DatasetMetadata> fetchMetadata(int datasetId) {
    return Mono.justOrEmpty(metadata.get(datasetId));
  }

  @Override
  public Mono<Map<String, ParameterInfo>> fetchParameterInfo(Set<String> parameterIds) {
    return Mono.fromCallable(() -> {
      final Map<String, ParameterInfo> found = new HashMap<>();
      for (String parameterId : parameterIds) {
        final ParameterInfo info = parameters.get(parameterId);
        if (info != null) {
          found.put(parameterId, info);
        }
      }
      return found;
    });
  }
}
