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

import com.rackspace.lumen.app.model.CacheKey;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;
import lombok.Data;

/**
 * Tracks, per dataset-set, parameter-set, method and sampling options, which resolutions of sampled data are
 * cached. A result sampled down to more points can always be reduced further, so a lookup
 * for resolution R is satisfied by any indexed resolution above it.
 */
class ResolutionIndex {

  private final Map<Group, NavigableMap<Integer, CacheKey>> groups = new HashMap<>();

  synchronized void add(CacheKey key, int resolution) {
    groups.computeIfAbsent(Group.of(key), group -> new TreeMap<>()).put(resolution, key);
  }

  synchronized void remove(CacheKey key) {
    final Group group = Group.of(key);
    final NavigableMap<Integer, CacheKey> resolutions = groups.get(group);
    if (resolutions == null) {
      return;
    }
    resolutions.values().removeIf(key::equals);
    if (resolutions.isEmpty()) {
      groups.remove(group);
    }
  }

  /**
   * @return keys of the same group cached above the key's resolution, closest first
   */
  synchronized List<CacheKey> higherThan(CacheKey key) {
    final NavigableMap<Integer, CacheKey> resolutions = groups.get(Group.of(key));
    if (resolutions == null || key.getResolution() == null) {
      return List.of();
    }
    return new ArrayList<>(resolutions.tailMap(key.getResolution(), false).values());
  }

  synchronized void clear() {
    groups.clear();
  }

  synchronized int size() {
    int size = 0;
    for (NavigableMap<Integer, CacheKey> resolutions : groups.values()) {
      size += resolutions.size();
    }
    return size;
  }

  @Data
  static class Group {
    final List<Integer> datasetIds;
    final List<String> parameterIds;
    final String method;
    final String extra;

    static Group of(CacheKey key) {
      return new Group(key.getDatasetIds(), key.getParameterIds(), key.getMethod(),
          key.getExtra());
    }
  }
}
