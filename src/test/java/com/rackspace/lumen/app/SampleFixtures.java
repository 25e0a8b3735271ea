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
package com.rackspace.lumen.app;

import com.rackspace.lumen.app.model.Sample;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.IntToDoubleFunction;

public final class SampleFixtures {

  public static final Instant START = Instant.parse("2021-03-01T00:00:00Z");

  private SampleFixtures() {
  }

  /**
   * Builds a series one second apart where each parameter's reading is computed from the index.
   */
  public static List<Sample> series(int size, Map<String, IntToDoubleFunction> parameters) {
    final List<Sample> samples = new ArrayList<>(size);
    for (int i = 0; i < size; i++) {
      final Map<String, Double> values = new LinkedHashMap<>();
      for (Map.Entry<String, IntToDoubleFunction> entry : parameters.entrySet()) {
        values.put(entry.getKey(), entry.getValue().applyAsDouble(i));
      }
      samples.add(new Sample(START.plusSeconds(i), values));
    }
    return samples;
  }

  public static List<Sample> series(int size, String parameter) {
    return series(size, Map.of(parameter, i -> Math.sin(i / 10.0) * 100 + i % 7));
  }

  public static Sample sample(long second, String parameter, Double value) {
    final Map<String, Double> values = new LinkedHashMap<>();
    values.put(parameter, value);
    return new Sample(START.plusSeconds(second), values);
  }
}
