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
package com.rackspace.lumen.app.exceptions;

/**
 * The dataset store failed to deliver data. Every request that depended on the failed fetch
 * observes the same instance.
 */
public class StoreFetchException extends RuntimeException {
  private final Integer datasetId;

  public StoreFetchException(int datasetId, Throwable cause) {
    super("Failed to fetch dataset " + datasetId + ": " + cause.getMessage(), cause);
    this.datasetId = datasetId;
  }

  public StoreFetchException(String message, Throwable cause) {
    super(message + ": " + cause.getMessage(), cause);
    this.datasetId = null;
  }

  /**
   * @return the dataset whose fetch failed, or <code>null</code> for fetches not tied to one
   */
  public Integer getDatasetId() {
    return datasetId;
  }
}
