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

import java.io.IOException;

/**
 * Durable per-entity cursor storage.
 *
 * <p>Commits for the same entity are serialized; commits for different entities don't block each
 * other.
 */
public interface CursorStore {

  /**
   * Loads the committed cursor of an entity.
   *
   * @param entityId entity identifier
   * @return the committed cursor, or {@link Cursor#initial()} if the entity was never committed
   * @throws IOException if the storage is unreadable or corrupt
   */
  Cursor load(String entityId) throws IOException;

  /**
   * Atomically replaces the cursor of an entity. A commit repeating the stored batch token is a
   * no-op. Failures are reported, never retried.
   *
   * @param entityId entity identifier
   * @param newPosition canonical position of the new cursor
   * @param batchToken token of the batch this position covers
   * @throws CommitException if the cursor could not be stored
   */
  void commit(String entityId, String newPosition, String batchToken) throws CommitException;
}
