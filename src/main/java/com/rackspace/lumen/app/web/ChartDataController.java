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

import com.rackspace.lumen.app.config.AppProperties;
import com.rackspace.lumen.app.model.ChartConfiguration;
import com.rackspace.lumen.app.model.ChartData;
import com.rackspace.lumen.app.model.Resolution;
import com.rackspace.lumen.app.services.ChartDataService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/charts")
public class ChartDataController {

  private final ChartDataService chartDataService;
  private final AppProperties appProperties;

  @Autowired
  public ChartDataController(ChartDataService chartDataService, AppProperties appProperties) {
    this.chartDataService = chartDataService;
    this.appProperties = appProperties;
  }

  /**
   * Loads one chart at the given resolution, sampled with the configured settings for that level.
   */
  @PostMapping("/data")
  public Mono<ChartData> getChartData(@RequestBody @Validated ChartConfiguration configuration,
      @RequestParam(defaultValue = "normal") String resolution) {
    return Mono.fromSupplier(() -> Resolution.fromName(resolution))
        .flatMap(level -> chartDataService.getChartData(configuration,
            appProperties.samplingConfigFor(level)));
  }
}
