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

import com.google.common.base.Ticker;
import com.google.common.collect.ImmutableList;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/** Entities, records and clocks shared by the sync tests. */
final class SyncTestData {
  static final Instant NOW = Instant.parse("2024-03-10T00:00:00Z");
  static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);
  static final Ticker FROZEN_TICKER =
      new Ticker() {
        @Override
        public long read() {
          return 0;
        }
      };

  private SyncTestData() {}

  static TableSchema observationSchema() {
    return new TableSchema(
        "hourly_observations",
        ImmutableList.of(
            new ColumnSpec.Builder("location_id", ColumnType.STRING).build(),
            new ColumnSpec.Builder("observed_at", ColumnType.TIMESTAMP).build(),
            new ColumnSpec.Builder("temperature_c", ColumnType.DOUBLE)
                .setSourcePath("main.temp")
                .setNullable(true)
                .build(),
            new ColumnSpec.Builder("conditions", ColumnType.STRING).setNullable(true).build()));
  }

  static EntityDescriptor observations(String id) {
    return new EntityDescriptor.Builder()
        .setId(id)
        .setSchema(observationSchema())
        .setPrimaryKey(ImmutableList.of("location_id", "observed_at"))
        .setOrderingColumn("observed_at")
        .setDeleteMarkerField("deleted")
        .build();
  }

  static Map<String, Object> record(String location, Instant observedAt, Object temperature) {
    Map<String, Object> main = new HashMap<>();
    main.put("temp", temperature);
    Map<String, Object> record = new HashMap<>();
    record.put("location_id", location);
    record.put("observed_at", observedAt.toString());
    record.put("main", main);
    record.put("conditions", "clear");
    return record;
  }

  /** Records one minute apart, starting at {@code start}. */
  static List<Map<String, Object>> records(String location, Instant start, int count) {
    List<Map<String, Object>> records = new ArrayList<>();
    for (int i = 0; i < count; i++) {
      records.add(record(location, start.plus(Duration.ofMinutes(i)), 10.0 + i));
    }
    return records;
  }
}
