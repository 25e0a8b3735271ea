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
import java.util.List;
import java.util.Map;
import java.util.Set;
import reactor.core.publisher.Mono;

/**
 * Asynchronous query interface of the persistent dataset store.
 */
public interface DatasetStore {

  /**
   * @param range restricts the samples to this window when not <code>null</code>
   * @return the requested columns of the dataset ordered by timestamp. Samples without any of
   * the requested readings may be omitted.
   */
  Mono<List<Sample>> fetchTimeSeries(int datasetId, Set<String> parameterIds, TimeRange range);

  /**
   * @return the metadata, or empty when the dataset is unknown
   */
  Mono<DatasetMetadata> fetchMetadata(int datasetId);

  /**
   * @return what is known about the given parameters; unknown parameters are omitted
   */
  Mono<Map<String, ParameterInfo>> fetchParameterInfo(Set<String> parameterIds);
}
