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
import com.rackspace.lumen.app.cache.CacheRegion.Removal;
import com.rackspace.lumen.app.config.CacheProperties;
import com.rackspace.lumen.app.model.CacheEntryType;
import com.rackspace.lumen.app.model.CacheKey;
import com.rackspace.lumen.app.model.CacheStats;
import com.rackspace.lumen.app.model.CacheStats.TypeStats;
import com.rackspace.lumen.app.model.MemoryStats;
import com.rackspace.lumen.app.services.MemoryMonitor;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import javax.annotation.PostConstruct;
import javax.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;

/**
 * In-memory cache of every intermediate product of chart data delivery, partitioned by
 * {@link CacheEntryType}. Each type has its own entry, memory and time-to-live ceilings and
 * its own least-recently-used eviction.
 * <p>
 * Lookups of <code>sampling</code> entries fall back to the closest cached entry of a higher
 * resolution with the same method, which callers can reduce further instead of recomputing.
 * A periodic sweep removes expired entries and sheds entries under memory pressure.
 * </p>
 */
@Slf4j
public class TieredCache {

  private final Map<CacheEntryType, CacheRegion> regions = new EnumMap<>(CacheEntryType.class);
  private final Map<CacheEntryType, List<CacheRemovalListener>> listeners =
      new EnumMap<>(CacheEntryType.class);
  private final ResolutionIndex resolutionIndex = new ResolutionIndex();
  /**
   * Keys of entries declared dependent on the key.
   */
  private final Map<CacheKey, Set<CacheKey>> dependents = new ConcurrentHashMap<>();

  private final CacheProperties cacheProperties;
  private final SizeEstimator sizeEstimator;
  private final MemoryMonitor memoryMonitor;
  private final ScheduledExecutorService scheduler;
  private final Ticker ticker;
  private final Map<CacheEntryType, Counter> hitCounters = new EnumMap<>(CacheEntryType.class);
  private final Map<CacheEntryType, Counter> missCounters = new EnumMap<>(CacheEntryType.class);
  private final Map<CacheEntryType, Counter> evictionCounters =
      new EnumMap<>(CacheEntryType.class);
  private ScheduledFuture<?> sweepTask;

  public TieredCache(CacheProperties cacheProperties,
                     SizeEstimator sizeEstimator,
                     MemoryMonitor memoryMonitor,
                     ScheduledExecutorService scheduler,
                     MeterRegistry meterRegistry,
                     Ticker ticker) {
    this.cacheProperties = cacheProperties;
    this.sizeEstimator = sizeEstimator;
    this.memoryMonitor = memoryMonitor;
    this.scheduler = scheduler;
    this.ticker = ticker;

    for (CacheEntryType type : CacheEntryType.values()) {
      final CacheRegion region = new CacheRegion(
          type, cacheProperties.tierFor(type), ticker, this::handleRemoval);
      regions.put(type, region);
      listeners.put(type, new CopyOnWriteArrayList<>());

      hitCounters.put(type, meterRegistry.counter("lumen.cache.requests",
          "type", type.getLabel(), "result", "hit"));
      missCounters.put(type, meterRegistry.counter("lumen.cache.requests",
          "type", type.getLabel(), "result", "miss"));
      evictionCounters.put(type, meterRegistry.counter("lumen.cache.evictions",
          "type", type.getLabel()));
      Gauge.builder("lumen.cache.entries", region, CacheRegion::size)
          .tag("type", type.getLabel())
          .register(meterRegistry);
      Gauge.builder("lumen.cache.memory", region, CacheRegion::memoryBytes)
          .tag("type", type.getLabel())
          .baseUnit("bytes")
          .register(meterRegistry);
    }
  }

  @PostConstruct
  public void start() {
    final Duration interval = cacheProperties.getSweepInterval();
    for (CacheEntryType type : CacheEntryType.values()) {
      final CacheProperties.Tier tier = cacheProperties.tierFor(type);
      log.info("Cache type {} limited to {} entries, {} MB, ttl {}",
          type, tier.getMaxEntries(), tier.getMaxMemoryMb(), tier.getTtl());
    }
    sweepTask = scheduler.scheduleAtFixedRate(this::scheduledSweep,
        interval.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);
  }

  @PreDestroy
  public void dispose() {
    if (sweepTask != null) {
      sweepTask.cancel(false);
      sweepTask = null;
    }
    clear();
  }

  /**
   * @return the cached value, or <code>null</code> when absent or expired. For
   * <code>sampling</code> keys the value may come from a higher resolution entry.
   */
  @SuppressWarnings("unchecked")
  public <T> T get(CacheKey key) {
    final CacheRegion region = regions.get(key.getType());
    CacheEntry entry = region.get(key);
    if (entry == null && key.getType() == CacheEntryType.SAMPLING) {
      entry = findHigherResolution(region, key);
    }
    if (entry == null) {
      region.recordMiss();
      missCounters.get(key.getType()).increment();
      return null;
    }
    region.recordHit();
    hitCounters.get(key.getType()).increment();
    return (T) entry.getValue();
  }

  public <T> Map<CacheKey, T> getBatch(Collection<CacheKey> keys) {
    final Map<CacheKey, T> found = new LinkedHashMap<>();
    for (CacheKey key : keys) {
      final T value = get(key);
      if (value != null) {
        found.put(key, value);
      }
    }
    return found;
  }

  public boolean has(CacheKey key) {
    return regions.get(key.getType()).get(key) != null;
  }

  public boolean set(CacheKey key, Object value) {
    return set(key, value, EntryOptions.none());
  }

  /**
   * Stores the value, evicting least recently used entries of the same type as needed to stay
   * within its ceilings. A value too large for the type's memory ceiling is not stored.
   *
   * @return true if the value was stored
   */
  public boolean set(CacheKey key, Object value, EntryOptions options) {
    final Integer resolution =
        options.getResolution() != null ? options.getResolution() : key.getResolution();
    final CacheEntry entry = new CacheEntry(value, ticker.read(), sizeEstimator.estimate(value),
        resolution, options.getDependsOn());
    if (!regions.get(key.getType()).put(key, entry)) {
      return false;
    }
    if (key.getType() == CacheEntryType.SAMPLING && resolution != null) {
      resolutionIndex.add(key, resolution);
    }
    for (CacheKey parent : options.getDependsOn()) {
      dependents.computeIfAbsent(parent, k -> ConcurrentHashMap.newKeySet()).add(key);
    }
    return true;
  }

  /**
   * @return the number of values stored
   */
  public int setBatch(Map<CacheKey, ?> values) {
    int stored = 0;
    for (Map.Entry<CacheKey, ?> entry : values.entrySet()) {
      if (set(entry.getKey(), entry.getValue())) {
        stored++;
      }
    }
    return stored;
  }

  /**
   * Removes the entry along with any entries declared dependent on it.
   */
  public boolean delete(CacheKey key) {
    return regions.get(key.getType()).remove(key, RemovalCause.EXPLICIT);
  }

  public void clear() {
    for (CacheRegion region : regions.values()) {
      region.clear(RemovalCause.EXPLICIT);
    }
    resolutionIndex.clear();
    dependents.clear();
  }

  public void clear(CacheEntryType type) {
    final int removed = regions.get(type).clear(RemovalCause.EXPLICIT);
    log.debug("Cleared {} {} entries", removed, type);
  }

  public void addRemovalListener(CacheEntryType type, CacheRemovalListener listener) {
    listeners.get(type).add(listener);
  }

  public CacheStats getStats() {
    final Map<CacheEntryType, TypeStats> byType = new EnumMap<>(CacheEntryType.class);
    int totalEntries = 0;
    long totalMemory = 0;
    long evictions = 0;
    long hits = 0;
    long requests = 0;
    for (CacheRegion region : regions.values()) {
      final TypeStats stats = region.stats();
      byType.put(region.getType(), stats);
      totalEntries += stats.getCount();
      totalMemory += stats.getMemoryBytes();
      evictions += stats.getEvictions();
      hits += region.hits();
      requests += region.requests();
    }
    return new CacheStats(totalEntries, totalMemory,
        requests == 0 ? 0 : (double) hits / requests, evictions, byType);
  }

  /**
   * Removes expired entries of every type, then reacts to memory pressure: high pressure
   * evicts the older half of every type and critical pressure empties the cache.
   */
  public void sweep() {
    int expired = 0;
    for (CacheRegion region : regions.values()) {
      expired += region.sweepExpired();
    }
    if (expired > 0) {
      log.debug("Swept {} expired cache entries", expired);
    }

    final MemoryStats memory = memoryMonitor.getMemoryStats();
    switch (memory.getPressure()) {
      case CRITICAL:
        log.warn("Critical memory pressure, {} of {} bytes used, clearing all cache entries",
            memory.getUsedBytes(), memory.getMaxBytes());
        for (CacheRegion region : regions.values()) {
          region.clear(RemovalCause.SIZE);
        }
        resolutionIndex.clear();
        break;
      case HIGH:
        int evicted = 0;
        for (CacheRegion region : regions.values()) {
          evicted += region.evictOldest(0.5);
        }
        log.warn("High memory pressure, {} of {} bytes used, evicted {} cache entries",
            memory.getUsedBytes(), memory.getMaxBytes(), evicted);
        break;
      default:
        break;
    }
  }

  private void scheduledSweep() {
    try {
      sweep();
    } catch (RuntimeException e) {
      // an exception would cancel the periodic task
      log.error("Cache sweep failed", e);
    }
  }

  private CacheEntry findHigherResolution(CacheRegion region, CacheKey key) {
    for (CacheKey candidate : resolutionIndex.higherThan(key)) {
      final CacheEntry entry = region.get(candidate);
      if (entry != null) {
        log.trace("Serving {} from higher resolution entry {}", key, candidate);
        return entry;
      }
      resolutionIndex.remove(candidate);
    }
    return null;
  }

  private void handleRemoval(CacheEntryType type, Removal removal) {
    final CacheKey key = removal.getKey();
    final RemovalCause cause = removal.getCause();
    if (cause != RemovalCause.REPLACED) {
      if (type == CacheEntryType.SAMPLING) {
        resolutionIndex.remove(key);
      }
      if (cause.wasEvicted()) {
        evictionCounters.get(type).increment();
      }
      for (CacheKey parent : removal.getEntry().getDependsOn()) {
        dependents.computeIfPresent(parent, (k, children) -> {
          children.remove(key);
          return children.isEmpty() ? null : children;
        });
      }
      final Set<CacheKey> children = dependents.remove(key);
      if (children != null && cause == RemovalCause.EXPLICIT) {
        children.forEach(this::delete);
      }
    }

    for (CacheRemovalListener listener : listeners.get(type)) {
      try {
        listener.onRemoval(key, removal.getEntry().getValue(), cause);
      } catch (RuntimeException e) {
        log.warn("Removal listener failed for {}", key, e);
      }
    }
  }
}
