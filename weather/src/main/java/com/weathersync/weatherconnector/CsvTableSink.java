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
package com.weathersync.weatherconnector;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Joiner;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.util.concurrent.Striped;
import com.weathersync.sdk.sync.CheckpointRecord;
import com.weathersync.sdk.sync.ColumnSpec;
import com.weathersync.sdk.sync.EntityDescriptor;
import com.weathersync.sdk.sync.Row;
import com.weathersync.sdk.sync.RowSink;
import com.weathersync.sdk.sync.SinkBatch;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.Lock;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.csv.CSVRecord;

/**
 * {@link RowSink} keeping one CSV table per entity in a local directory.
 *
 * <p>A table file is named after its entity id and starts with a header of the schema's column
 * names. Each batch is applied to the current table by primary key: upserts replace or append a
 * line, deletes drop it. The new table is written to a temporary file and moved over the old one
 * atomically. An empty cell stands for a null value.
 *
 * <p>Once the table is replaced, the batch's checkpoint record is appended to
 * {@value #CHECKPOINT_FILE} in the same directory.
 */
public class CsvTableSink implements RowSink {
  private static final Logger logger = Logger.getLogger(CsvTableSink.class.getName());

  @VisibleForTesting static final String CHECKPOINT_FILE = "_checkpoints.csv";
  @VisibleForTesting static final String TABLE_SUFFIX = ".csv";
  @VisibleForTesting
  static final ImmutableList<String> CHECKPOINT_HEADER =
      ImmutableList.of("entity_id", "cursor", "batch_token", "written_at");

  private static final Joiner KEY_JOINER = Joiner.on('|');
  private static final CSVFormat TABLE_FORMAT = CSVFormat.DEFAULT;

  private final Path directory;
  private final ImmutableMap<String, EntityDescriptor> entities;
  private final Clock clock;
  private final Striped<Lock> tableLocks = Striped.lock(16);
  private final Object checkpointLock = new Object();

  public CsvTableSink(Path directory, Collection<EntityDescriptor> entities) {
    this(directory, entities, Clock.systemUTC());
  }

  @VisibleForTesting
  CsvTableSink(Path directory, Collection<EntityDescriptor> entities, Clock clock) {
    this.directory = checkNotNull(directory, "directory can not be null");
    ImmutableMap.Builder<String, EntityDescriptor> byId = ImmutableMap.builder();
    checkNotNull(entities, "entities can not be null").forEach(e -> byId.put(e.getId(), e));
    this.entities = byId.build();
    this.clock = checkNotNull(clock, "clock can not be null");
  }

  @Override
  public void write(SinkBatch batch) throws IOException {
    EntityDescriptor entity = entities.get(batch.getEntityId());
    if (entity == null) {
      throw new IOException("no table for entity " + batch.getEntityId());
    }
    Lock lock = tableLocks.get(entity.getId());
    lock.lock();
    try {
      Files.createDirectories(directory);
      Path table = getTablePath(entity.getId());
      Map<String, List<String>> lines = readTable(entity, table);
      for (Row row : batch.getRows()) {
        String key = KEY_JOINER.join(row.getKey());
        if (row.getOperation() == Row.Operation.DELETE) {
          lines.remove(key);
        } else {
          lines.put(key, toLine(entity, row));
        }
      }
      replaceTable(entity, table, lines.values());
      appendCheckpoint(batch.getCheckpoint());
      logger.log(
          Level.FINE,
          "Wrote {0} rows to {1}, table now has {2} rows",
          new Object[] {batch.getRows().size(), table, lines.size()});
    } finally {
      lock.unlock();
    }
  }

  @VisibleForTesting
  Path getTablePath(String entityId) {
    checkArgument(!Strings.isNullOrEmpty(entityId), "entity id can't be null or empty");
    return directory.resolve(entityId + TABLE_SUFFIX);
  }

  @VisibleForTesting
  Path getCheckpointPath() {
    return directory.resolve(CHECKPOINT_FILE);
  }

  /** Reads the lines of a table keyed by primary key, in file order. */
  private static Map<String, List<String>> readTable(EntityDescriptor entity, Path table)
      throws IOException {
    Map<String, List<String>> lines = new LinkedHashMap<>();
    if (!Files.exists(table)) {
      return lines;
    }
    List<String> columns = entity.getSchema().getColumnNames();
    CSVFormat format = TABLE_FORMAT.builder().setHeader().setSkipHeaderRecord(true).build();
    try (Reader reader = Files.newBufferedReader(table, UTF_8);
        CSVParser parser = format.parse(reader)) {
      if (!columns.equals(parser.getHeaderNames())) {
        throw new IOException(
            String.format(
                "table %s has columns %s, expected %s", table, parser.getHeaderNames(), columns));
      }
      for (CSVRecord record : parser) {
        if (record.size() != columns.size()) {
          throw new IOException(
              String.format("malformed line %d in table %s", record.getRecordNumber(), table));
        }
        List<String> line = new ArrayList<>(columns.size());
        record.forEach(line::add);
        List<String> key = new ArrayList<>();
        for (String keyColumn : entity.getPrimaryKey()) {
          key.add(line.get(columns.indexOf(keyColumn)));
        }
        lines.put(KEY_JOINER.join(key), line);
      }
    } catch (IllegalArgumentException | IllegalStateException e) {
      throw new IOException("unreadable table " + table, e);
    }
    return lines;
  }

  private static List<String> toLine(EntityDescriptor entity, Row row) {
    List<String> line = new ArrayList<>();
    for (ColumnSpec column : entity.getSchema().getColumns()) {
      Object value = row.getValues().get(column.getName());
      line.add(value == null ? "" : column.getType().toCanonical(value));
    }
    return line;
  }

  private void replaceTable(EntityDescriptor entity, Path table, Collection<List<String>> lines)
      throws IOException {
    Path tmp = Files.createTempFile(directory, entity.getId(), ".tmp");
    try {
      CSVFormat format =
          TABLE_FORMAT.builder()
              .setHeader(entity.getSchema().getColumnNames().toArray(new String[0]))
              .build();
      try (BufferedWriter writer = Files.newBufferedWriter(tmp, UTF_8);
          CSVPrinter printer = new CSVPrinter(writer, format)) {
        printer.printRecords(lines);
      }
      Files.move(
          tmp, table, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    } finally {
      Files.deleteIfExists(tmp);
    }
  }

  private void appendCheckpoint(CheckpointRecord checkpoint) throws IOException {
    synchronized (checkpointLock) {
      Path path = getCheckpointPath();
      CSVFormat format =
          Files.exists(path)
              ? TABLE_FORMAT
              : TABLE_FORMAT.builder().setHeader(CHECKPOINT_HEADER.toArray(new String[0])).build();
      try (BufferedWriter writer =
              Files.newBufferedWriter(
                  path, UTF_8, StandardOpenOption.CREATE, StandardOpenOption.APPEND);
          CSVPrinter printer = new CSVPrinter(writer, format)) {
        printer.printRecord(
            checkpoint.getEntityId(),
            Strings.nullToEmpty(checkpoint.getCursor()),
            checkpoint.getBatchToken(),
            clock.instant().toString());
      }
    }
  }
}
