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
import lombok.Data;

@JsonAutoDetect(fieldVisibility = Visibility.ANY, getterVisibility = Visibility.NONE,
    isGetterVisibility = Visibility.NONE, setterVisibility = Visibility.NONE)
@Data
public class Viewport {
  final double xMin;
  final double xMax;
  final double yMin;
  final double yMax;

  public static Viewport of(DataRange x, DataRange y) {
    return new Viewport(x.getMin(), x.getMax(), y.getMin(), y.getMax());
  }

  public static Viewport unit() {
    return new Viewport(0, 1, 0, 1);
  }

  public DataRange getXRange() {
    return new DataRange(xMin, xMax);
  }

  public DataRange getYRange() {
    return new DataRange(yMin, yMax);
  }
}
