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
package com.rackspace.lumen.app.cache;

import com.rackspace.lumen.app.model.CacheKey;
import java.util.Arrays;
import java.util.Set;
import lombok.Data;

@Data
public class EntryOptions {
  private static final EntryOptions NONE = new EntryOptions(null, Set.of());

  /**
   * The target point count a <code>sampling</code> entry was produced for. Defaults to the
   * resolution of the key.
   */
  final Integer resolution;
  /**
   * Entries that, when explicitly deleted, also remove this one.
   */
  final Set<CacheKey> dependsOn;

  public static EntryOptions none() {
    return NONE;
  }

  public static EntryOptions resolution(int resolution) {
    return new EntryOptions(resolution, Set.of());
  }

  public EntryOptions dependingOn(CacheKey... keys) {
    return new EntryOptions(resolution, Set.copyOf(Arrays.asList(keys)));
  }
}
