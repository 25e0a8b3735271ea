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

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.github.benmanes.caffeine.cache.RemovalCause;
import com.rackspace.lumen.app.config.CacheProperties;
import com.rackspace.lumen.app.config.CacheProperties.Tier;
import com.rackspace.lumen.app.downsample.SamplingConfig;
import com.rackspace.lumen.app.downsample.SamplingMethod;
import com.rackspace.lumen.app.model.CacheEntryType;
import com.rackspace.lumen.app.model.CacheKey;
import com.rackspace.lumen.app.model.CacheStats;
import com.rackspace.lumen.app.model.MemoryPressure;
import com.rackspace.lumen.app.model.MemoryStats;
import com.rackspace.lumen.app.services.MemoryMonitor;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import org.apache.commons.lang3.RandomStringUtils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class TieredCacheTest {

  private static final SamplingConfig HIGH = SamplingConfig.of(SamplingMethod.LTTB, 1000);
  private static final SamplingConfig NORMAL = SamplingConfig.of(SamplingMethod.LTTB, 500);
  private static final SamplingConfig PREVIEW = SamplingConfig.of(SamplingMethod.LTTB, 100);

  private final AtomicLong now = new AtomicLong();
  private CacheProperties properties;
  private MemoryMonitor memoryMonitor;
  private ScheduledExecutorService scheduler;
  private MeterRegistry meterRegistry;
  private TieredCache cache;

  @BeforeEach
  public void setUp() {
    properties = new CacheProperties();
    properties.setTimeseries(new Tier(3, 1, Duration.ofMinutes(5)));
    memoryMonitor = mock(MemoryMonitor.class);
    when(memoryMonitor.getMemoryStats())
        .thenReturn(new MemoryStats(MemoryPressure.NORMAL, 10, 100));
    scheduler = mock(ScheduledExecutorService.class);
    meterRegistry = new SimpleMeterRegistry();
    cache = new TieredCache(properties, new SizeEstimator(), memoryMonitor, scheduler,
        meterRegistry, now::get);
  }

  @Test
  public void testGetAndSet() {
    final CacheKey key = CacheKey.metadata(7);

    assertThat(cache.<String>get(key)).isNull();
    assertThat(cache.set(key, "plant-a")).isTrue();

    assertThat(cache.<String>get(key)).isEqualTo("plant-a");
    assertThat(cache.has(key)).isTrue();
    assertThat(cache.has(CacheKey.metadata(8))).isFalse();
    assertThat(meterRegistry.get("lumen.cache.requests")
        .tag("type", "metadata").tag("result", "hit").counter().count()).isEqualTo(1);
    assertThat(meterRegistry.get("lumen.cache.requests")
        .tag("type", "metadata").tag("result", "miss").counter().count()).isEqualTo(1);
  }

  @Test
  public void testKeysIgnoreIdOrder() {
    cache.set(CacheKey.sampling(List.of(2, 1), List.of("b", "a"), "a", NORMAL), "value");

    assertThat(cache.<String>get(CacheKey.sampling(List.of(1, 2), List.of("a", "b"), "a", NORMAL)))
        .isEqualTo("value");
  }

  @Test
  public void testEntryLimitEvictsLeastRecentlyUsed() {
    cache.set(CacheKey.timeseries(1), List.of(1));
    cache.set(CacheKey.timeseries(2), List.of(2));
    cache.set(CacheKey.timeseries(3), List.of(3));
    // touch 1 so that 2 becomes the eldest
    cache.get(CacheKey.timeseries(1));

    cache.set(CacheKey.timeseries(4), List.of(4));

    assertThat(cache.has(CacheKey.timeseries(1))).isTrue();
    assertThat(cache.has(CacheKey.timeseries(2))).isFalse();
    assertThat(cache.has(CacheKey.timeseries(4))).isTrue();
    assertThat(cache.getStats().getByType().get(CacheEntryType.TIMESERIES).getEvictions())
        .isEqualTo(1);
    assertThat(meterRegistry.get("lumen.cache.evictions").tag("type", "timeseries").counter()
        .count()).isEqualTo(1);
  }

  @Test
  public void testMemoryStaysWithinCeiling() {
    final long ceiling = properties.getTimeseries().getMaxMemoryBytes();
    // each string is estimated at two bytes per character
    final int length = (int) (ceiling / 2 / 2.5);

    for (int i = 0; i < 3; i++) {
      cache.set(CacheKey.timeseries(i), RandomStringUtils.randomAlphabetic(length));
      assertThat(cache.getStats().getByType().get(CacheEntryType.TIMESERIES).getMemoryBytes())
          .isLessThanOrEqualTo(ceiling);
    }

    assertThat(cache.has(CacheKey.timeseries(0))).isFalse();
    assertThat(cache.has(CacheKey.timeseries(1))).isTrue();
    assertThat(cache.has(CacheKey.timeseries(2))).isTrue();
  }

  @Test
  public void testCapacityViolationIsSkipped() {
    final CacheKey key = CacheKey.timeseries(1);
    cache.set(key, "small");
    final long ceiling = properties.getTimeseries().getMaxMemoryBytes();

    final boolean stored = cache.set(key, RandomStringUtils.randomAlphabetic((int) ceiling));

    assertThat(stored).isFalse();
    assertThat(cache.<String>get(key)).isEqualTo("small");
  }

  @Test
  public void testEntriesExpire() {
    final CacheKey key = CacheKey.metadata(1);
    cache.set(key, "value");

    now.addAndGet(properties.getMetadata().getTtl().toNanos() - 1);
    assertThat(cache.has(key)).isTrue();

    now.addAndGet(2);
    assertThat(cache.<String>get(key)).isNull();
    assertThat(cache.getStats().getByType().get(CacheEntryType.METADATA).getEvictions())
        .isEqualTo(1);
  }

  @Test
  public void testSweepRemovesExpired() {
    cache.set(CacheKey.metadata(1), "a");
    cache.set(CacheKey.chart("abc"), "b");
    now.addAndGet(Duration.ofMinutes(6).toNanos());

    cache.sweep();

    // chart entries expire after 5 minutes, metadata after 30
    assertThat(cache.has(CacheKey.metadata(1))).isTrue();
    assertThat(cache.getStats().getByType().get(CacheEntryType.CHART).getCount()).isZero();
  }

  @Test
  public void testHigherResolutionServesLowerRequest() {
    final CacheKey high = CacheKey.sampling(List.of(1), List.of("temp"), "temp", HIGH);
    cache.set(high, "sampled-at-1000");

    assertThat(cache.<String>get(CacheKey.sampling(List.of(1), List.of("temp"), "temp", NORMAL)))
        .isEqualTo("sampled-at-1000");
    assertThat(cache.<String>get(CacheKey.sampling(List.of(1), List.of("temp"), "temp",
        SamplingConfig.of(SamplingMethod.NTH, 500))))
        .isNull();
    assertThat(cache.<String>get(
        CacheKey.sampling(List.of(1), List.of("pressure"), "pressure", NORMAL)))
        .isNull();
    assertThat(cache.<String>get(CacheKey.sampling(List.of(1), List.of("temp"), "temp",
        SamplingConfig.of(SamplingMethod.LTTB, 2000))))
        .isNull();
  }

  @Test
  public void testHigherResolutionMustMatchSamplingOptions() {
    cache.set(CacheKey.sampling(List.of(1), List.of("rpm", "temp"), "rpm", HIGH), "by-rpm");
    cache.set(CacheKey.sampling(List.of(1), List.of("temp"), "temp",
        new SamplingConfig(true, SamplingMethod.LTTB, 1000, false, 0)), "no-extremes");

    // same columns, different driving column
    assertThat(cache.<String>get(
        CacheKey.sampling(List.of(1), List.of("rpm", "temp"), "temp", NORMAL)))
        .isNull();
    assertThat(cache.<String>get(
        CacheKey.sampling(List.of(1), List.of("rpm", "temp"), "rpm", NORMAL)))
        .isEqualTo("by-rpm");
    // extremes requested, but only an entry without them is cached
    assertThat(cache.<String>get(CacheKey.sampling(List.of(1), List.of("temp"), "temp",
        new SamplingConfig(true, SamplingMethod.LTTB, 500, true, 0))))
        .isNull();
  }

  @Test
  public void testClosestHigherResolutionWins() {
    cache.set(CacheKey.sampling(List.of(1), List.of("temp"), "temp", HIGH), "1000");
    cache.set(CacheKey.sampling(List.of(1), List.of("temp"), "temp", NORMAL), "500");

    assertThat(cache.<String>get(CacheKey.sampling(List.of(1), List.of("temp"), "temp", PREVIEW)))
        .isEqualTo("500");
  }

  @Test
  public void testRemovedHigherResolutionIsNotServed() {
    final CacheKey high = CacheKey.sampling(List.of(1), List.of("temp"), "temp", HIGH);
    cache.set(high, "sampled-at-1000");

    cache.delete(high);

    assertThat(cache.<String>get(CacheKey.sampling(List.of(1), List.of("temp"), "temp", NORMAL)))
        .isNull();
  }

  @Test
  public void testCriticalPressureClearsEverything() {
    cache.set(CacheKey.metadata(1), "a");
    cache.set(CacheKey.timeseries(1), List.of(1));
    cache.set(CacheKey.sampling(List.of(1), List.of("temp"), "temp", HIGH), "s");
    cache.set(CacheKey.chart("abc"), "c");
    when(memoryMonitor.getMemoryStats())
        .thenReturn(new MemoryStats(MemoryPressure.CRITICAL, 95, 100));

    cache.sweep();

    final CacheStats stats = cache.getStats();
    assertThat(stats.getTotalEntries()).isZero();
    assertThat(stats.getTotalMemoryBytes()).isZero();
    assertThat(stats.getEvictions()).isEqualTo(4);
    assertThat(cache.<String>get(CacheKey.sampling(List.of(1), List.of("temp"), "temp", NORMAL)))
        .isNull();
  }

  @Test
  public void testHighPressureEvictsOlderHalf() {
    for (int i = 0; i < 4; i++) {
      cache.set(CacheKey.metadata(i), "m" + i);
    }
    when(memoryMonitor.getMemoryStats())
        .thenReturn(new MemoryStats(MemoryPressure.HIGH, 85, 100));

    cache.sweep();

    assertThat(cache.has(CacheKey.metadata(0))).isFalse();
    assertThat(cache.has(CacheKey.metadata(1))).isFalse();
    assertThat(cache.has(CacheKey.metadata(2))).isTrue();
    assertThat(cache.has(CacheKey.metadata(3))).isTrue();
  }

  @Test
  public void testRemovalListenerReceivesCause() {
    final List<RemovalCause> causes = new ArrayList<>();
    cache.addRemovalListener(CacheEntryType.METADATA, (key, value, cause) -> causes.add(cause));

    cache.set(CacheKey.metadata(1), "a");
    cache.set(CacheKey.metadata(1), "b");
    cache.delete(CacheKey.metadata(1));

    assertThat(causes).containsExactly(RemovalCause.REPLACED, RemovalCause.EXPLICIT);
  }

  @Test
  public void testDeleteCascadesToDependents() {
    final CacheKey timeseries = CacheKey.timeseries(1);
    final CacheKey sampling = CacheKey.sampling(List.of(1), List.of("temp"), "temp", NORMAL);
    final CacheKey unrelated = CacheKey.metadata(1);
    cache.set(timeseries, List.of(1));
    cache.set(sampling, "s", EntryOptions.resolution(500).dependingOn(timeseries));
    cache.set(unrelated, "m");

    cache.delete(timeseries);

    assertThat(cache.has(sampling)).isFalse();
    assertThat(cache.has(unrelated)).isTrue();
  }

  @Test
  public void testEvictionDoesNotCascade() {
    final CacheKey timeseries = CacheKey.timeseries(1);
    final CacheKey sampling = CacheKey.sampling(List.of(1), List.of("temp"), "temp", NORMAL);
    cache.set(timeseries, List.of(1));
    cache.set(sampling, "s", EntryOptions.resolution(500).dependingOn(timeseries));

    for (int i = 2; i <= 4; i++) {
      cache.set(CacheKey.timeseries(i), List.of(i));
    }

    assertThat(cache.has(timeseries)).isFalse();
    assertThat(cache.has(sampling)).isTrue();
  }

  @Test
  public void testClearByType() {
    cache.set(CacheKey.metadata(1), "a");
    cache.set(CacheKey.chart("abc"), "c");

    cache.clear(CacheEntryType.CHART);

    assertThat(cache.has(CacheKey.metadata(1))).isTrue();
    assertThat(cache.has(CacheKey.chart("abc"))).isFalse();
  }

  @Test
  public void testBatchOperations() {
    final int stored = cache.setBatch(Map.of(
        CacheKey.metadata(1), "a",
        CacheKey.metadata(2), "b"));

    final Map<CacheKey, String> found = cache.getBatch(
        List.of(CacheKey.metadata(1), CacheKey.metadata(2), CacheKey.metadata(3)));

    assertThat(stored).isEqualTo(2);
    assertThat(found).containsOnlyKeys(CacheKey.metadata(1), CacheKey.metadata(2));
  }

  @Test
  public void testStatsHitRate() {
    cache.set(CacheKey.metadata(1), "a");
    cache.get(CacheKey.metadata(1));
    cache.get(CacheKey.metadata(1));
    cache.get(CacheKey.metadata(1));
    cache.get(CacheKey.metadata(2));

    final CacheStats stats = cache.getStats();

    assertThat(stats.getHitRate()).isEqualTo(0.75);
    assertThat(stats.getByType().get(CacheEntryType.METADATA).getCount()).isEqualTo(1);
    assertThat(stats.getByType().get(CacheEntryType.METADATA).getMaxEntries()).isEqualTo(100);
  }

  @Test
  public void testStartSchedulesSweep() {
    cache.start();

    verify(scheduler).scheduleAtFixedRate(any(Runnable.class), anyLong(), eq(60_000L),
        eq(TimeUnit.MILLISECONDS));
  }
}
