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

import com.github.benmanes.caffeine.cache.RemovalCause;
import com.rackspace.lumen.app.model.CacheKey;

/**
 * Notified after an entry has left the cache, outside of any cache lock.
 * A value that was overwritten by a new one for the same key is reported with
 * {@link RemovalCause#REPLACED}.
 */
@FunctionalInterface
public interface CacheRemovalListener {
  void onRemoval(CacheKey key, Object value, RemovalCause cause);
}
