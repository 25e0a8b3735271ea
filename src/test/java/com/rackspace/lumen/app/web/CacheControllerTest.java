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

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.rackspace.lumen.app.cache.TieredCache;
import com.rackspace.lumen.app.model.CacheEntryType;
import com.rackspace.lumen.app.model.CacheStats;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.AutoConfigureWebFlux;
import org.springframework.boot.test.autoconfigure.web.reactive.AutoConfigureWebTestClient;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.reactive.server.WebTestClient;

@ActiveProfiles("test")
@SpringBootTest(classes = {CacheController.class, RestWebExceptionHandler.class,
    SimpleMeterRegistry.class})
@AutoConfigureWebTestClient
@AutoConfigureWebFlux
public class CacheControllerTest {

  @MockBean
  TieredCache cache;

  @Autowired
  private WebTestClient webTestClient;

  @Test
  public void testGetStats() {
    when(cache.getStats()).thenReturn(new CacheStats(12, 4096, 0.75, 3, Map.of(
        CacheEntryType.TIMESERIES, new CacheStats.TypeStats(12, 4096, 0.75, 3, 50, 1 << 20))));

    webTestClient.get().uri("/api/cache/stats")
        .exchange().expectStatus().isOk()
        .expectBody()
        .jsonPath("$.totalEntries").isEqualTo(12)
        .jsonPath("$.totalMemoryBytes").isEqualTo(4096)
        .jsonPath("$.hitRate").isEqualTo(0.75)
        .jsonPath("$.evictions").isEqualTo(3);
  }

  @Test
  public void testClearAll() {
    webTestClient.delete().uri("/api/cache")
        .exchange().expectStatus().isNoContent();

    verify(cache).clear();
    verify(cache, never()).clear(any(CacheEntryType.class));
  }

  @Test
  public void testClearByType() {
    webTestClient.delete()
        .uri(uriBuilder -> uriBuilder.path("/api/cache").queryParam("type", "sampling").build())
        .exchange().expectStatus().isNoContent();

    verify(cache).clear(CacheEntryType.SAMPLING);
    verify(cache, never()).clear();
  }

  @Test
  public void testClearUnknownTypeIsBadRequest() {
    webTestClient.delete()
        .uri(uriBuilder -> uriBuilder.path("/api/cache").queryParam("type", "bogus").build())
        .exchange().expectStatus().isBadRequest();

    verify(cache, never()).clear();
    verify(cache, never()).clear(any(CacheEntryType.class));
  }
}
