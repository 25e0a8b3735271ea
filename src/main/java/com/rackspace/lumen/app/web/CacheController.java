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
package com.rackspace.lumen.app.web;

import com.rackspace.lumen.app.cache.TieredCache;
import com.rackspace.lumen.app.model.CacheEntryType;
import com.rackspace.lumen.app.model.CacheStats;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/cache")
@Slf4j
public class CacheController {

  private final TieredCache cache;

  @Autowired
  public CacheController(TieredCache cache) {
    this.cache = cache;
  }

  @GetMapping("/stats")
  public Mono<CacheStats> getStats() {
    return Mono.fromSupplier(cache::getStats);
  }

  @DeleteMapping
  @ResponseStatus(HttpStatus.NO_CONTENT)
  public Mono<Void> clear(@RequestParam(required = false) String type) {
    return Mono.fromRunnable(() -> {
      if (type == null) {
        log.info("Clearing all cache entries on request");
        cache.clear();
      } else {
        final CacheEntryType entryType = CacheEntryType.fromName(type);
        log.info("Clearing {} cache entries on request", entryType);
        cache.clear(entryType);
      }
    });
  }
}
