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

import java.util.Map;
import lombok.Data;

@Data
public class CacheStats {
  final int totalEntries;
  final long totalMemoryBytes;
  final double hitRate;
  final long evictions;
  final Map<CacheEntryType, TypeStats> byType;

  @Data
  public static class TypeStats {
    final int count;
    final long memoryBytes;
    final double hitRate;
    final long evictions;
    final int maxEntries;
    final long maxMemoryBytes;
  }
}
