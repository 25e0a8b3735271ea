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

import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import lombok.Data;

/**
 * One row of a dataset: a timestamp and the readings of any number of parameters at that
 * instant. A parameter that is absent or maps to <code>null</code> has no reading.
 * <p>
 * Samples are immutable; merging or restricting produces new instances.
 * </p>
 */
@Data
public class Sample {
  final Instant timestamp;
  final Map<String, Double> values;

  public Sample(Instant timestamp, Map<String, Double> values) {
    this.timestamp = Objects.requireNonNull(timestamp, "timestamp is required");
    // null readings are legal, which rules out Map.copyOf
    this.values = Collections.unmodifiableMap(new HashMap<>(values));
  }

  public static Sample of(Instant timestamp, Map<String, Double> values) {
    return new Sample(timestamp, values);
  }

  public Double getValue(String parameterId) {
    return values.get(parameterId);
  }

  public boolean hasValue(String parameterId) {
    final Double value = values.get(parameterId);
    return value != null && !value.isNaN();
  }

  /**
   * @return a new sample with this sample's values overlaid by the other's non-absent values
   */
  public Sample merge(Sample other) {
    final Map<String, Double> merged = new HashMap<>(values);
    other.values.forEach((key, value) -> {
      if (value != null || !merged.containsKey(key)) {
        merged.put(key, value);
      }
    });
    return new Sample(timestamp, merged);
  }

  public Sample restrictTo(Collection<String> parameterIds) {
    final Map<String, Double> restricted = new HashMap<>();
    for (String parameterId : parameterIds) {
      if (values.containsKey(parameterId)) {
        restricted.put(parameterId, values.get(parameterId));
      }
    }
    return new Sample(timestamp, restricted);
  }
}
