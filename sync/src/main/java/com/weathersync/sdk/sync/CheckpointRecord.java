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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.MoreObjects;
import java.util.Objects;
import javax.annotation.Nullable;

/**
 * Checkpoint delivered to the sink with a batch.
 *
 * <p>The cursor is {@code null} when the batch doesn't move the cursor of a never committed
 * entity.
 */
public final class CheckpointRecord {
  private final String entityId;
  @Nullable private final String cursor;
  private final String batchToken;

  public CheckpointRecord(String entityId, @Nullable String cursor, String batchToken) {
    this.entityId = checkNotNull(entityId);
    this.cursor = cursor;
    this.batchToken = checkNotNull(batchToken);
  }

  public String getEntityId() {
    return entityId;
  }

  @Nullable
  public String getCursor() {
    return cursor;
  }

  public String getBatchToken() {
    return batchToken;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof CheckpointRecord)) {
      return false;
    }
    CheckpointRecord other = (CheckpointRecord) o;
    return entityId.equals(other.entityId)
        && Objects.equals(cursor, other.cursor)
        && batchToken.equals(other.batchToken);
  }

  @Override
  public int hashCode() {
    return Objects.hash(entityId, cursor, batchToken);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("entityId", entityId)
        .add("cursor", cursor)
        .add("batchToken", batchToken)
        .toString();
  }
}
