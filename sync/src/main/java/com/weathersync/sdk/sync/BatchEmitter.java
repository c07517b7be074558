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
import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Strings;
import com.google.common.base.Ticker;
import com.google.common.hash.Hasher;
import com.google.common.hash.Hashing;
import com.weathersync.sdk.BatchPolicy;
import com.weathersync.sdk.StatsManager;
import com.weathersync.sdk.StatsManager.OperationStats;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;

/**
 * Buffers the rows of one entity and checkpoints them together with the cursor.
 *
 * <p>A flush writes the buffered rows and one {@link CheckpointRecord} to the {@link RowSink} as a
 * single {@link SinkBatch}. Only after the sink confirms the write is the cursor committed to the
 * {@link CursorStore}. A failed flush keeps the rows buffered and the cursor where it was.
 *
 * <p>{@link #add} flushes by itself once {@link BatchPolicy#getMaxRows()} rows are buffered or
 * {@link BatchPolicy#getMaxDelay()} has passed since the previous flush; {@link #flushIfDue}
 * applies the delay alone. The cursor of such a flush comes from the safe cursor supplier, which
 * returns {@code null} to hold the cursor.
 *
 * <p>Not thread-safe; one emitter serves one sync task.
 */
public class BatchEmitter {
  private static final Logger logger = Logger.getLogger(BatchEmitter.class.getName());
  private static final OperationStats emitterStats = StatsManager.getComponent("emitter");

  private final EntityDescriptor entity;
  private final CursorStore cursorStore;
  private final RowSink sink;
  private final BatchPolicy batchPolicy;
  private final Ticker ticker;
  private final Supplier<String> safeCursorCandidate;
  private final List<Row> buffer = new ArrayList<>();

  private Cursor committed;
  private long lastFlushNanos;

  private BatchEmitter(Builder builder) {
    this.entity = builder.entity;
    this.cursorStore = builder.cursorStore;
    this.sink = builder.sink;
    this.batchPolicy = builder.batchPolicy;
    this.ticker = builder.ticker;
    this.safeCursorCandidate = builder.safeCursorCandidate;
    this.committed = builder.committed;
    this.lastFlushNanos = ticker.read();
  }

  /**
   * Buffers a row, flushing when the batch policy says so.
   *
   * @throws CommitException if the triggered flush fails
   */
  public void add(Row row) throws CommitException {
    buffer.add(checkNotNull(row, "row can not be null"));
    if (buffer.size() >= batchPolicy.getMaxRows() || isDelayElapsed()) {
      flush(safeCursorCandidate.get());
    }
  }

  /**
   * Flushes the buffered rows with the safe cursor candidate once {@link
   * BatchPolicy#getMaxDelay()} has passed since the previous flush. Called between fetches, so
   * rows do not wait on a slow or empty page.
   *
   * @return {@code true} if a flush happened
   * @throws CommitException if the flush fails
   */
  public boolean flushIfDue() throws CommitException {
    if (buffer.isEmpty() || !isDelayElapsed()) {
      return false;
    }
    flush(safeCursorCandidate.get());
    return true;
  }

  private boolean isDelayElapsed() {
    return ticker.read() - lastFlushNanos >= batchPolicy.getMaxDelayNanos();
  }

  /**
   * Writes the buffered rows and commits the cursor.
   *
   * <p>The new cursor is the larger of the committed position and {@code cursorCandidate}; it
   * never moves backwards. A flush with no rows and no cursor movement does nothing.
   *
   * @param cursorCandidate canonical position covered by the buffered rows, or {@code null} to
   *     keep the committed position
   * @return the committed cursor after the flush
   * @throws CommitException if the sink write or the cursor commit fails
   */
  public Cursor flush(@Nullable String cursorCandidate) throws CommitException {
    String previous = committed.getPosition();
    String next = maxPosition(previous, cursorCandidate);
    boolean moves = next != null && !next.equals(previous);
    if (buffer.isEmpty() && !moves) {
      lastFlushNanos = ticker.read();
      return committed;
    }
    String token = batchToken(entity.getId(), previous, buffer);
    SinkBatch batch =
        new SinkBatch(entity.getId(), buffer, new CheckpointRecord(entity.getId(), next, token));
    OperationStats.Event event = emitterStats.event("flush");
    try {
      sink.write(batch);
    } catch (IOException e) {
      event.failure();
      throw new CommitException(
          "Failed to write batch " + token + " of " + entity.getId() + " to sink", e);
    }
    if (moves) {
      try {
        cursorStore.commit(entity.getId(), next, token);
      } catch (CommitException e) {
        event.failure();
        throw e;
      }
      committed = Cursor.of(next, token);
      emitterStats.register("commit");
    }
    event.success();
    emitterStats.register("rows", buffer.size());
    logger.log(Level.FINE, "Flushed {0} rows of {1}, cursor {2}",
        new Object[] {buffer.size(), entity.getId(), committed.getPosition()});
    buffer.clear();
    lastFlushNanos = ticker.read();
    return committed;
  }

  /** Drops the buffered rows without committing anything. */
  public void discard() {
    if (!buffer.isEmpty()) {
      logger.log(Level.FINE, "Discarding {0} buffered rows of {1}",
          new Object[] {buffer.size(), entity.getId()});
      emitterStats.register("discardedRows", buffer.size());
    }
    buffer.clear();
  }

  public Cursor getCommitted() {
    return committed;
  }

  public int getBufferedCount() {
    return buffer.size();
  }

  @Nullable
  private String maxPosition(@Nullable String current, @Nullable String candidate) {
    if (candidate == null) {
      return current;
    }
    if (current == null) {
      return candidate;
    }
    return entity.getOrderingType().compareCanonical(candidate, current) > 0 ? candidate : current;
  }

  /**
   * Computes the deterministic token of a batch: the same rows flushed on top of the same cursor
   * always get the same token.
   */
  @VisibleForTesting
  static String batchToken(String entityId, @Nullable String previousPosition, List<Row> rows) {
    Hasher hasher = Hashing.sha256().newHasher();
    hasher.putString(entityId, UTF_8).putByte((byte) 0);
    hasher.putString(Strings.nullToEmpty(previousPosition), UTF_8).putByte((byte) 0);
    for (Row row : rows) {
      hasher.putString(row.getOperation().name(), UTF_8)
          .putString(row.getKeyString(), UTF_8)
          .putByte((byte) 0);
    }
    return hasher.hash().toString();
  }

  /** Builder for {@link BatchEmitter}. */
  public static class Builder {
    private EntityDescriptor entity;
    private Cursor committed = Cursor.initial();
    private CursorStore cursorStore;
    private RowSink sink;
    private BatchPolicy batchPolicy = new BatchPolicy.Builder().build();
    private Ticker ticker = Ticker.systemTicker();
    private Supplier<String> safeCursorCandidate = () -> null;

    public Builder setEntity(EntityDescriptor entity) {
      this.entity = entity;
      return this;
    }

    /** Sets the cursor committed before this emitter was created. */
    public Builder setCommitted(Cursor committed) {
      this.committed = committed;
      return this;
    }

    public Builder setCursorStore(CursorStore cursorStore) {
      this.cursorStore = cursorStore;
      return this;
    }

    public Builder setRowSink(RowSink sink) {
      this.sink = sink;
      return this;
    }

    public Builder setBatchPolicy(BatchPolicy batchPolicy) {
      this.batchPolicy = batchPolicy;
      return this;
    }

    public Builder setTicker(Ticker ticker) {
      this.ticker = ticker;
      return this;
    }

    public Builder setSafeCursorCandidate(Supplier<String> safeCursorCandidate) {
      this.safeCursorCandidate = safeCursorCandidate;
      return this;
    }

    public BatchEmitter build() {
      checkNotNull(entity, "entity can not be null");
      checkNotNull(committed, "committed cursor can not be null");
      checkNotNull(cursorStore, "cursor store can not be null");
      checkNotNull(sink, "sink can not be null");
      checkNotNull(batchPolicy, "batch policy can not be null");
      checkNotNull(ticker, "ticker can not be null");
      checkNotNull(safeCursorCandidate, "safe cursor supplier can not be null");
      return new BatchEmitter(this);
    }
  }
}
