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
import java.time.Duration;
import java.util.Set;
import lombok.Data;

@Data
class CacheEntry {
  final Object value;
  /**
   * Ticker reading at insertion, in nanoseconds.
   */
  final long createdAt;
  final long estimatedBytes;
  final Integer resolution;
  final Set<CacheKey> dependsOn;

  boolean isExpired(long now, Duration ttl) {
    return now - createdAt >= ttl.toNanos();
  }
}
