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
package com.rackspace.lumen.app.utils;

import com.rackspace.lumen.app.model.Sample;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

public class SeriesUtils {

  /**
   * Merges two timestamp-ordered series into one. Samples with equal timestamps are combined,
   * with the readings of <code>added</code> taking precedence.
   */
  public static List<Sample> mergeByTimestamp(List<Sample> existing, List<Sample> added) {
    if (existing.isEmpty()) {
      return List.copyOf(added);
    }
    if (added.isEmpty()) {
      return List.copyOf(existing);
    }
    final List<Sample> merged = new ArrayList<>(Math.max(existing.size(), added.size()));
    int i = 0;
    int j = 0;
    while (i < existing.size() && j < added.size()) {
      final Sample left = existing.get(i);
      final Sample right = added.get(j);
      final int order = left.getTimestamp().compareTo(right.getTimestamp());
      if (order < 0) {
        merged.add(left);
        i++;
      } else if (order > 0) {
        merged.add(right);
        j++;
      } else {
        merged.add(left.merge(right));
        i++;
        j++;
      }
    }
    while (i < existing.size()) {
      merged.add(existing.get(i++));
    }
    while (j < added.size()) {
      merged.add(added.get(j++));
    }
    return List.copyOf(merged);
  }

  /**
   * @return the series with each sample narrowed down to the given parameters
   */
  public static List<Sample> restrictTo(List<Sample> series, Collection<String> parameterIds) {
    final List<Sample> restricted = new ArrayList<>(series.size());
    for (Sample sample : series) {
      restricted.add(sample.restrictTo(parameterIds));
    }
    return restricted;
  }
}
