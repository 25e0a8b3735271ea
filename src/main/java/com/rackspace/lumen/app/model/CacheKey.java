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

import com.rackspace.lumen.app.downsample.SamplingConfig;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import lombok.Data;

/**
 * Identifies one entry of the tiered cache. Dataset and parameter ids are normalized to sorted,
 * distinct lists so that keys built from differently ordered inputs are equal.
 */
@Data
public class CacheKey {
  final CacheEntryType type;
  final List<Integer> datasetIds;
  final List<String> parameterIds;
  final Integer resolution;
  final String method;
  final String extra;

  public CacheKey(CacheEntryType type, Collection<Integer> datasetIds,
                  Collection<String> parameterIds, Integer resolution, String method,
                  String extra) {
    this.type = Objects.requireNonNull(type, "type is required");
    this.datasetIds = datasetIds.stream().sorted().distinct()
        .collect(Collectors.toUnmodifiableList());
    this.parameterIds = parameterIds.stream().sorted().distinct()
        .collect(Collectors.toUnmodifiableList());
    this.resolution = resolution;
    this.method = method;
    this.extra = extra;
  }

  public static CacheKey timeseries(int datasetId) {
    return new CacheKey(CacheEntryType.TIMESERIES, List.of(datasetId), List.of(), null, null, null);
  }

  public static CacheKey metadata(int datasetId) {
    return new CacheKey(CacheEntryType.METADATA, List.of(datasetId), List.of(), null, null, null);
  }

  public static CacheKey parameterInfo(String parameterId) {
    return new CacheKey(CacheEntryType.PARAMETER_INFO, List.of(), List.of(parameterId),
        null, null, null);
  }

  /**
   * @param samplingParameter the column that drove bucket and extrema selection
   */
  public static CacheKey sampling(Collection<Integer> datasetIds, Collection<String> parameterIds,
                                  String samplingParameter, SamplingConfig config) {
    return new CacheKey(CacheEntryType.SAMPLING, datasetIds, parameterIds,
        resolutionOf(config), methodOf(config),
        "by=" + samplingParameter + (config.isPreserveExtremes() ? ";extremes" : ""));
  }

  public static CacheKey transform(int datasetId, String xAxisParameter,
                                   Collection<String> yAxisParameters, SamplingConfig config) {
    // the y order determines series order, so it is kept verbatim in extra
    return new CacheKey(CacheEntryType.TRANSFORM, List.of(datasetId), yAxisParameters,
        resolutionOf(config), methodOf(config),
        "x=" + xAxisParameter + ";y=" + String.join(",", yAxisParameters)
            + (config.isPreserveExtremes() ? ";extremes" : ""));
  }

  public static CacheKey chart(String configurationHash) {
    return new CacheKey(CacheEntryType.CHART, List.of(), List.of(), null, null, configurationHash);
  }

  private static Integer resolutionOf(SamplingConfig config) {
    return config.isEnabled() ? config.getTargetPoints() : null;
  }

  private static String methodOf(SamplingConfig config) {
    return config.isEnabled() ? config.getMethod().getLabel() : "none";
  }

  @Override
  public String toString() {
    final StringBuilder sb = new StringBuilder(type.getLabel());
    if (!datasetIds.isEmpty()) {
      sb.append(":ds=").append(datasetIds.stream().map(String::valueOf)
          .collect(Collectors.joining(",")));
    }
    if (!parameterIds.isEmpty()) {
      sb.append(":p=").append(String.join(",", parameterIds));
    }
    if (resolution != null) {
      sb.append(":r=").append(resolution);
    }
    if (method != null) {
      sb.append(':').append(method);
    }
    if (extra != null) {
      sb.append(':').append(extra);
    }
    return sb.toString();
  }
}
