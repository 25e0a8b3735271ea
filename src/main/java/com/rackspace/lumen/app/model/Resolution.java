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

import com.fasterxml.jackson.annotation.JsonValue;

public enum Resolution {
  PREVIEW,
  NORMAL,
  HIGH,
  FULL;

  /**
   * @return the level reached by automatic upgrade from this one, or <code>null</code> when
   * automatic upgrading stops here
   */
  public Resolution nextAutomatic() {
    switch (this) {
      case PREVIEW:
        return NORMAL;
      case NORMAL:
        return HIGH;
      default:
        return null;
    }
  }

  @JsonValue
  public String getLabel() {
    return name().toLowerCase();
  }

  public static Resolution fromName(String name) {
    for (Resolution resolution : values()) {
      if (resolution.name().equalsIgnoreCase(name)) {
        return resolution;
      }
    }
    throw new IllegalArgumentException("Unknown resolution '" + name + "'");
  }
}
