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
package com.rackspace.lumen.app.sync;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Marks a synchronization fan-out in progress for the duration of a try-with-resources block.
 * Zoom events that the fan-out itself triggers find the guard held and are ignored.
 */
final class SyncGuard implements AutoCloseable {
  private final AtomicBoolean flag;

  private SyncGuard(AtomicBoolean flag) {
    this.flag = flag;
  }

  /**
   * @return the acquired guard, or <code>null</code> if a fan-out is already in progress
   */
  static SyncGuard tryAcquire(AtomicBoolean flag) {
    return flag.compareAndSet(false, true) ? new SyncGuard(flag) : null;
  }

  @Override
  public void close() {
    flag.set(false);
  }
}
