/*
 * Copyright © 2017 Google Inc.
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
package com.weathersync.sdk.sync;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Strings.isNullOrEmpty;

import com.google.common.util.concurrent.Striped;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.Lock;

/** {@link CursorStore} held in memory, for tests and single-process experiments. */
public class InMemoryCursorStore implements CursorStore {
  private final ConcurrentMap<String, Cursor> cursors = new ConcurrentHashMap<>();
  private final Striped<Lock> locks = Striped.lock(64);

  @Override
  public Cursor load(String entityId) {
    checkArgument(!isNullOrEmpty(entityId), "entity id can not be null or empty");
    return cursors.getOrDefault(entityId, Cursor.initial());
  }

  @Override
  public void commit(String entityId, String newPosition, String batchToken)
      throws CommitException {
    checkArgument(!isNullOrEmpty(entityId), "entity id can not be null or empty");
    checkArgument(!isNullOrEmpty(newPosition), "position can not be null or empty");
    Lock lock = locks.get(entityId);
    lock.lock();
    try {
      Cursor current = load(entityId);
      if (batchToken != null && batchToken.equals(current.getBatchToken())) {
        return;
      }
      cursors.put(entityId, Cursor.of(newPosition, batchToken));
    } finally {
      lock.unlock();
    }
  }
}
