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
package com.rackspace.lumen.app.services;

import com.google.common.hash.HashCode;
import com.google.common.hash.HashFunction;
import com.google.common.hash.Hasher;
import com.google.common.hash.Hashing;
import com.rackspace.lumen.app.downsample.SamplingConfig;
import com.rackspace.lumen.app.model.ChartConfiguration;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Base64.Encoder;
import org.springframework.stereotype.Service;

/**
 * Derives the key under which a chart's assembled data is cached and de-duplicated. Two
 * configurations that would produce identical data hash identically, regardless of chart id
 * or title.
 */
@SuppressWarnings("UnstableApiUsage") // due to guava
@Service
public class ChartKeyService {
  private static final Charset CHARSET = StandardCharsets.UTF_8;
  private final HashFunction hashFunction;
  private final Encoder base64Encoder;

  public ChartKeyService() {
    hashFunction = Hashing.murmur3_128();
    base64Encoder = Base64.getUrlEncoder();
  }

  public String hash(ChartConfiguration configuration, SamplingConfig samplingConfig) {
    final Hasher hasher = hashFunction.newHasher()
        .putString(configuration.getXAxisParameter(), CHARSET)
        .putChar('|');
    // order matters since it determines series order
    configuration.getYAxisParameters().forEach(parameterId ->
        hasher.putString(parameterId, CHARSET).putChar(','));
    hasher.putChar('|');
    configuration.getDatasetIds().forEach(hasher::putInt);
    hasher.putChar('|')
        .putBoolean(samplingConfig.isEnabled());
    if (samplingConfig.isEnabled()) {
      hasher.putString(samplingConfig.getMethod().getLabel(), CHARSET)
          .putInt(samplingConfig.getTargetPoints())
          .putInt(samplingConfig.getSamplingThreshold())
          .putBoolean(samplingConfig.isPreserveExtremes());
    }

    final HashCode hashCode = hasher.hash();
    // 128 bits encode to 22 base64 characters plus two padding characters
    return base64Encoder.encodeToString(hashCode.asBytes()).substring(0, 22);
  }
}
