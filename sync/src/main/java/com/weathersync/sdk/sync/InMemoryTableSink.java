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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** {@link RowSink} holding upserted rows in memory, keyed by entity and primary key. */
public class InMemoryTableSink implements RowSink {
  private final Map<String, Map<String, Row>> tables = new HashMap<>();
  private final List<CheckpointRecord> checkpoints = new ArrayList<>();
  private int batchesWritten;

  @Override
  public synchronized void write(SinkBatch batch) {
    Map<String, Row> table =
        tables.computeIfAbsent(batch.getEntityId(), k -> new LinkedHashMap<>());
    for (Row row : batch.getRows()) {
      if (row.getOperation() == Row.Operation.DELETE) {
        table.remove(row.getKeyString());
      } else {
        table.put(row.getKeyString(), row);
      }
    }
    checkpoints.add(batch.getCheckpoint());
    batchesWritten++;
  }

  /** Gets the current rows of an entity, in first insertion order. */
  public synchronized ImmutableList<Row> getRows(String entityId) {
    return ImmutableList.copyOf(tables.getOrDefault(entityId, ImmutableMap.of()).values());
  }

  public synchronized ImmutableList<CheckpointRecord> getCheckpoints() {
    return ImmutableList.copyOf(checkpoints);
  }

  public synchronized int getBatchesWritten() {
    return batchesWritten;
  }
}
