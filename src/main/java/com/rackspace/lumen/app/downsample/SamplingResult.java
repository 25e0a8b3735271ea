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
package com.rackspace.lumen.app.downsample;

import com.rackspace.lumen.app.model.Sample;
import java.util.List;
import lombok.Data;

@Data
public class SamplingResult {
  final List<Sample> samples;
  final int originalCount;
  /**
   * <code>null</code> when the input was returned untouched.
   */
  final SamplingMethod method;
  /**
   * The parameter whose values steered the selection, if any.
   */
  final String parameter;

  public static SamplingResult unsampled(List<Sample> series) {
    return new SamplingResult(series, series.size(), null, null);
  }

  public boolean wasSampled() {
    return method != null;
  }

  public int getSampledCount() {
    return samples.size();
  }

  public String getMethodLabel() {
    return method == null ? "none" : method.getLabel();
  }
}
