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
import com.github.benmanes.caffeine.cache.Ticker;
import com.rackspace.lumen.app.config.CacheProperties;
import com.rackspace.lumen.app.model.CacheEntryType;
import com.rackspace.lumen.app.model.CacheKey;
import com.rackspace.lumen.app.model.CacheStats.TypeStats;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

/**
 * The entries of one {@link CacheEntryType}, kept in least-recently-used order and bounded by
 * entry count, estimated memory and time-to-live.
 * <p>
 * All state changes happen under this region's monitor; removal notifications are delivered
 * after the monitor is released.
 * </p>
 */
@Slf4j
class CacheRegion {

  private final CacheEntryType type;
  private final int maxEntries;
  private final long maxMemoryBytes;
  private final Duration ttl;
  private final Ticker ticker;
  private final RemovalHandler removalHandler;

  // access-ordered, so iteration starts at the least recently used entry
  private final LinkedHashMap<CacheKey, CacheEntry> entries =
      new LinkedHashMap<>(16, 0.75f, true);
  private long memoryBytes;
  private long hits;
  private long misses;
  private long evictions;

  CacheRegion(CacheEntryType type, CacheProperties.Tier tier, Ticker ticker,
              RemovalHandler removalHandler) {
    this.type = type;
    this.maxEntries = tier.getMaxEntries();
    this.maxMemoryBytes = tier.getMaxMemoryBytes();
    this.ttl = tier.getTtl();
    this.ticker = ticker;
    this.removalHandler = removalHandler;
  }

  CacheEntry get(CacheKey key) {
    final List<Removal> removals = new ArrayList<>(1);
    CacheEntry entry;
    synchronized (this) {
      entry = entries.get(key);
      if (entry != null && entry.isExpired(ticker.read(), ttl)) {
        removeLocked(key, RemovalCause.EXPIRED, removals);
        entry = null;
      }
    }
    dispatch(removals);
    return entry;
  }

  /**
   * Evicts least recently used entries until the new entry fits within both ceilings, then
   * stores it.
   *
   * @return false if the entry cannot fit even in an empty region, in which case nothing changes
   */
  boolean put(CacheKey key, CacheEntry entry) {
    final List<Removal> removals = new ArrayList<>();
    synchronized (this) {
      if (entry.getEstimatedBytes() > maxMemoryBytes) {
        log.warn("Cache capacity violation: {} needs {} bytes but {} entries are limited to {}",
            key, entry.getEstimatedBytes(), type, maxMemoryBytes);
        return false;
      }
      final CacheEntry previous = entries.remove(key);
      if (previous != null) {
        memoryBytes -= previous.getEstimatedBytes();
        removals.add(new Removal(key, previous, RemovalCause.REPLACED));
      }
      final Iterator<Map.Entry<CacheKey, CacheEntry>> eldest = entries.entrySet().iterator();
      while (eldest.hasNext()
          && (entries.size() + 1 > maxEntries
          || memoryBytes + entry.getEstimatedBytes() > maxMemoryBytes)) {
        final Map.Entry<CacheKey, CacheEntry> victim = eldest.next();
        eldest.remove();
        memoryBytes -= victim.getValue().getEstimatedBytes();
        evictions++;
        removals.add(new Removal(victim.getKey(), victim.getValue(), RemovalCause.SIZE));
      }
      entries.put(key, entry);
      memoryBytes += entry.getEstimatedBytes();
    }
    dispatch(removals);
    return true;
  }

  boolean remove(CacheKey key, RemovalCause cause) {
    final List<Removal> removals = new ArrayList<>(1);
    synchronized (this) {
      removeLocked(key, cause, removals);
    }
    dispatch(removals);
    return !removals.isEmpty();
  }

  int clear(RemovalCause cause) {
    final List<Removal> removals = new ArrayList<>();
    synchronized (this) {
      for (Map.Entry<CacheKey, CacheEntry> entry : entries.entrySet()) {
        removals.add(new Removal(entry.getKey(), entry.getValue(), cause));
      }
      entries.clear();
      memoryBytes = 0;
      if (cause.wasEvicted()) {
        evictions += removals.size();
      }
    }
    dispatch(removals);
    return removals.size();
  }

  int sweepExpired() {
    final List<Removal> removals = new ArrayList<>();
    synchronized (this) {
      final long now = ticker.read();
      final Iterator<Map.Entry<CacheKey, CacheEntry>> it = entries.entrySet().iterator();
      while (it.hasNext()) {
        final Map.Entry<CacheKey, CacheEntry> entry = it.next();
        if (entry.getValue().isExpired(now, ttl)) {
          it.remove();
          memoryBytes -= entry.getValue().getEstimatedBytes();
          evictions++;
          removals.add(new Removal(entry.getKey(), entry.getValue(), RemovalCause.EXPIRED));
        }
      }
    }
    dispatch(removals);
    return removals.size();
  }

  /**
   * Evicts the given fraction of entries, least recently used first.
   */
  int evictOldest(double fraction) {
    final List<Removal> removals = new ArrayList<>();
    synchronized (this) {
      final int count = (int) Math.ceil(entries.size() * fraction);
      final Iterator<Map.Entry<CacheKey, CacheEntry>> it = entries.entrySet().iterator();
      while (it.hasNext() && removals.size() < count) {
        final Map.Entry<CacheKey, CacheEntry> entry = it.next();
        it.remove();
        memoryBytes -= entry.getValue().getEstimatedBytes();
        evictions++;
        removals.add(new Removal(entry.getKey(), entry.getValue(), RemovalCause.SIZE));
      }
    }
    dispatch(removals);
    return removals.size();
  }

  synchronized void recordHit() {
    hits++;
  }

  synchronized void recordMiss() {
    misses++;
  }

  synchronized int size() {
    return entries.size();
  }

  synchronized long memoryBytes() {
    return memoryBytes;
  }

  synchronized long requests() {
    return hits + misses;
  }

  synchronized long hits() {
    return hits;
  }

  synchronized TypeStats stats() {
    final long requests = hits + misses;
    return new TypeStats(entries.size(), memoryBytes,
        requests == 0 ? 0 : (double) hits / requests, evictions, maxEntries, maxMemoryBytes);
  }

  CacheEntryType getType() {
    return type;
  }

  private void removeLocked(CacheKey key, RemovalCause cause, List<Removal> removals) {
    final CacheEntry removed = entries.remove(key);
    if (removed != null) {
      memoryBytes -= removed.getEstimatedBytes();
      if (cause.wasEvicted()) {
        evictions++;
      }
      removals.add(new Removal(key, removed, cause));
    }
  }

  private void dispatch(List<Removal> removals) {
    for (Removal removal : removals) {
      removalHandler.onRemoval(type, removal);
    }
  }

  @FunctionalInterface
  interface RemovalHandler {
    void onRemoval(CacheEntryType type, Removal removal);
  }

  @Data
  static class Removal {
    final CacheKey key;
    final CacheEntry entry;
    final RemovalCause cause;
  }
}
