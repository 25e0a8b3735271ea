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
import java.util.ArrayList;
import java.util.List;
import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotEmpty;
import lombok.Data;
import lombok.NoArgsConstructor;

@JsonAutoDetect(fieldVisibility = Visibility.ANY, getterVisibility = Visibility.NONE,
    isGetterVisibility = Visibility.NONE, setterVisibility = Visibility.NONE)
@Data
@NoArgsConstructor
public class ChartConfiguration {
  public static final String TIMESTAMP_AXIS = "timestamp";

  String chartId;
  String title;
  String chartType = "line";

  /**
   * Either a parameter id or <code>timestamp</code> for a time-series chart.
   */
  @NotBlank
  String xAxisParameter = TIMESTAMP_AXIS;

  @NotEmpty
  List<String> yAxisParameters = new ArrayList<>();

  @NotEmpty
  List<Integer> datasetIds = new ArrayList<>();

  public ChartConfiguration(String chartId, String xAxisParameter, List<String> yAxisParameters,
                            List<Integer> datasetIds) {
    this.chartId = chartId;
    this.xAxisParameter = xAxisParameter;
    this.yAxisParameters = new ArrayList<>(yAxisParameters);
    this.datasetIds = new ArrayList<>(datasetIds);
  }

  public boolean isTimeSeries() {
    return TIMESTAMP_AXIS.equals(xAxisParameter);
  }

  /**
   * @return the parameter columns that must be loaded to plot this chart
   */
  public List<String> getRequiredParameters() {
    final List<String> required = new ArrayList<>();
    if (!isTimeSeries()) {
      required.add(xAxisParameter);
    }
    for (String parameterId : yAxisParameters) {
      if (!required.contains(parameterId)) {
        required.add(parameterId);
      }
    }
    return required;
  }
}
