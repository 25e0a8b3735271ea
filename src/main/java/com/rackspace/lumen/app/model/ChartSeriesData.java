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

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonAutoDetect.Visibility;
import java.util.List;
import lombok.Data;

/**
 * One plotted line: a y parameter of one dataset against the chart's x axis. Time-series
 * x values are epoch milliseconds. A <code>null</code> y value is a gap.
 */
@JsonAutoDetect(fieldVisibility = Visibility.ANY, getterVisibility = Visibility.NONE,
    isGetterVisibility = Visibility.NONE, setterVisibility = Visibility.NONE)
@Data
public class ChartSeriesData {
  final int datasetId;
  final String datasetLabel;
  final ParameterInfo parameterInfo;
  final List<Double> xValues;
  final List<Double> yValues;
  final DataRange xRange;
  final DataRange yRange;

  public int size() {
    return xValues.size();
  }
}
