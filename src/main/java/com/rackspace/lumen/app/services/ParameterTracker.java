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

import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Remembers which parameter columns of each dataset have already been loaded so that
 * subsequent loads fetch only the missing ones. The loaded set of a dataset only grows until
 * the dataset is cleared.
 */
@Service
@Slf4j
public class ParameterTracker {

  private final Map<Integer, Set<String>> loaded = new HashMap<>();

  /**
   * @return the requested parameters not yet loaded, in request order
   */
  public synchronized Set<String> getMissing(int datasetId, Collection<String> requested) {
    final Set<String> present = loaded.getOrDefault(datasetId, Set.of());
    final Set<String> missing = new LinkedHashSet<>();
    for (String parameterId : requested) {
      if (!present.contains(parameterId)) {
        missing.add(parameterId);
      }
    }
    return missing;
  }

  public synchronized void markLoaded(int datasetId, Collection<String> parameterIds) {
    loaded.computeIfAbsent(datasetId, id -> new HashSet<>()).addAll(parameterIds);
  }

  public synchronized boolean hasAll(int datasetId, Collection<String> parameterIds) {
    return loaded.getOrDefault(datasetId, Set.of()).containsAll(parameterIds);
  }

  public synchronized Set<String> getLoaded(int datasetId) {
    return Set.copyOf(loaded.getOrDefault(datasetId, Set.of()));
  }

  public synchronized void clear(int datasetId) {
    if (loaded.remove(datasetId) != null) {
      log.debug("Cleared loaded parameters of dataset {}", datasetId);
    }
  }

  public synchronized void clearAll() {
    loaded.clear();
  }

  public synchronized Stats getStats() {
    int parameters = 0;
    for (Set<String> columns : loaded.values()) {
      parameters += columns.size();
    }
    return new Stats(loaded.size(), parameters);
  }

  @Data
  public static class Stats {
    final int datasets;
    final int parameters;
  }
}
