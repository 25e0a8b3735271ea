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

import java.util.List;
import lombok.Data;

/**
 * The reduced samples of one dataset, cached as a <code>sampling</code> entry.
 */
@Data
public class SampledDataset {
  final int datasetId;
  final DatasetMetadata metadata;
  final List<Sample> samples;
  /**
   * Length of the raw series this was reduced from.
   */
  final int originalCount;
  final String method;

  public int size() {
    return samples.size();
  }

  public boolean isSampled() {
    return samples.size() < originalCount;
  }
}
