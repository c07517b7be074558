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
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import java.util.List;

/** Rows emitted since the previous checkpoint, paired with the checkpoint that covers them. */
public final class SinkBatch {
  private final String entityId;
  private final ImmutableList<Row> rows;
  private final CheckpointRecord checkpoint;

  public SinkBatch(String entityId, List<Row> rows, CheckpointRecord checkpoint) {
    this.entityId = checkNotNull(entityId, "entity id can not be null");
    this.rows = ImmutableList.copyOf(checkNotNull(rows, "rows can not be null"));
    this.checkpoint = checkNotNull(checkpoint, "checkpoint can not be null");
    checkArgument(entityId.equals(checkpoint.getEntityId()),
        "checkpoint of %s in batch of %s", checkpoint.getEntityId(), entityId);
  }

  public String getEntityId() {
    return entityId;
  }

  /** Gets all rows in emit order. */
  public ImmutableList<Row> getRows() {
    return rows;
  }

  public ImmutableList<Row> getUpserts() {
    return filter(Row.Operation.UPSERT);
  }

  public ImmutableList<Row> getDeletes() {
    return filter(Row.Operation.DELETE);
  }

  public CheckpointRecord getCheckpoint() {
    return checkpoint;
  }

  private ImmutableList<Row> filter(Row.Operation operation) {
    return rows.stream()
        .filter(r -> r.getOperation() == operation)
        .collect(ImmutableList.toImmutableList());
  }

  @Override
  public String toString() {
    return "SinkBatch [entityId=" + entityId + ", rows=" + rows.size() + ", checkpoint="
        + checkpoint + "]";
  }
}
