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
import static com.google.common.base.Preconditions.checkState;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Ticker;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.weathersync.sdk.BatchPolicy;
import com.weathersync.sdk.StatsManager;
import com.weathersync.sdk.StatsManager.OperationStats;
import com.weathersync.sdk.sync.SyncSettings.EmptyWindowPolicy;
import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;

/**
 * Drives the sync of one entity as an explicit state machine.
 *
 * <pre>
 *   IDLE -> FETCHING -> PAGINATING -> CHECKPOINTING -> IDLE
 *              |  ^          |             |
 *              |  +----------+             +--> FETCHING (next window)
 *              +--> CHECKPOINTING (empty last page)
 * </pre>
 *
 * <p>Any state except {@link State#FAILED} may move to {@link State#FAILED}, which is terminal.
 *
 * <p>The time range between the committed cursor and now is split into windows of
 * {@link SyncSettings#getWindowSize()}. Windows have inclusive bounds, so records sharing the
 * cursor's ordering value are fetched again by the next run and absorbed by the upserting sink.
 * Each window ends with a checkpoint; the cursor of a mid-window flush is held at the ordering
 * value of the last emitted row, or not moved at all once the window returned rows out of order.
 *
 * <p>A planner runs once. Build a new one for every sync of the entity.
 */
public class SyncPlanner {
  private static final Logger logger = Logger.getLogger(SyncPlanner.class.getName());
  private static final OperationStats plannerStats = StatsManager.getComponent("planner");

  /** States of the sync of one entity. */
  public enum State {
    IDLE,
    FETCHING,
    PAGINATING,
    CHECKPOINTING,
    FAILED
  }

  private static final ImmutableMap<State, ImmutableSet<State>> TRANSITIONS =
      ImmutableMap.of(
          State.IDLE, ImmutableSet.of(State.FETCHING, State.FAILED),
          State.FETCHING, ImmutableSet.of(State.PAGINATING, State.CHECKPOINTING, State.FAILED),
          State.PAGINATING, ImmutableSet.of(State.FETCHING, State.CHECKPOINTING, State.FAILED),
          State.CHECKPOINTING, ImmutableSet.of(State.IDLE, State.FETCHING, State.FAILED),
          State.FAILED, ImmutableSet.of());

  private final EntityDescriptor entity;
  private final ColumnType orderingType;
  private final CursorStore cursorStore;
  private final PageFetcher fetcher;
  private final RecordMapper mapper;
  private final RowSink sink;
  private final SyncSettings settings;
  private final BatchPolicy batchPolicy;
  private final Clock clock;
  private final Ticker ticker;

  private volatile State state = State.IDLE;
  private boolean started;
  private BatchEmitter emitter;
  private int pagesFetched;
  private int rowsEmitted;
  private int mappingErrors;

  // Window state, reset by openWindow.
  private Instant windowStart;
  private Instant windowEnd;
  private Cursor windowCursor;
  @Nullable private String pageToken;
  private int pageNumber;
  @Nullable private Page currentPage;
  @Nullable private String lastWatermark;
  @Nullable private Object maxObserved;
  @Nullable private Object lastEmitted;
  private boolean outOfOrder;
  private final Set<String> seenPageTokens = new HashSet<>();

  private SyncPlanner(Builder builder) {
    this.entity = builder.entity;
    this.orderingType = entity.getOrderingType();
    this.cursorStore = builder.cursorStore;
    this.fetcher = builder.fetcher;
    this.mapper = builder.mapper;
    this.sink = builder.sink;
    this.settings = builder.settings;
    this.batchPolicy = builder.batchPolicy;
    this.clock = builder.clock;
    this.ticker = builder.ticker;
  }

  /**
   * Syncs the entity from its committed cursor up to now.
   *
   * <p>Failures are not thrown; they end up in the returned report. An interrupt cancels the
   * sync, discards the buffered rows and leaves the thread's interrupt flag set.
   *
   * @return report of the sync
   */
  public EntitySyncReport run() {
    checkState(!started, "planner of %s already ran", entity.getId());
    started = true;
    OperationStats.Event event = plannerStats.event("sync");
    Cursor committed;
    try {
      committed = cursorStore.load(entity.getId());
    } catch (IOException e) {
      event.failure();
      return fail(ErrorKind.INTERNAL, "failed to load cursor: " + e.getMessage(), e);
    }
    emitter =
        new BatchEmitter.Builder()
            .setEntity(entity)
            .setCommitted(committed)
            .setCursorStore(cursorStore)
            .setRowSink(sink)
            .setBatchPolicy(batchPolicy)
            .setTicker(ticker)
            .setSafeCursorCandidate(this::safeCursorCandidate)
            .build();
    logger.log(Level.INFO, "Syncing {0} from cursor {1}",
        new Object[] {entity.getId(), committed.getPosition()});
    try {
      Instant now = clock.instant();
      windowStart = committed.isInitial()
          ? now.minus(settings.getInitialLookback())
          : orderingType.toInstant(orderingType.fromCanonical(committed.getPosition()));
      do {
        openWindow(now);
        while (state != State.CHECKPOINTING) {
          if (Thread.interrupted()) {
            throw new InterruptedException("sync of " + entity.getId() + " interrupted");
          }
          if (state == State.FETCHING) {
            emitter.flushIfDue();
            fetchPage();
          } else {
            paginate();
          }
        }
        checkpointWindow();
        windowStart = windowEnd;
      } while (windowStart.isBefore(now));
      transition(State.IDLE);
    } catch (SyncAbortedException e) {
      event.failure();
      return fail(e.kind, e.getMessage(), e.getCause());
    } catch (CommitException e) {
      event.failure();
      return fail(ErrorKind.COMMIT, e.getMessage(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      event.failure();
      return fail(ErrorKind.CANCELLED, "sync cancelled", e);
    } catch (RuntimeException e) {
      event.failure();
      return fail(ErrorKind.INTERNAL, String.valueOf(e), e);
    }
    event.success();
    plannerStats.logResult("sync", "OK");
    logger.log(Level.INFO, "Synced {0}: {1} pages, {2} rows, {3} mapping errors, cursor {4}",
        new Object[] {entity.getId(), pagesFetched, rowsEmitted, mappingErrors,
            emitter.getCommitted().getPosition()});
    return newReport().build();
  }

  public State getState() {
    return state;
  }

  private void openWindow(Instant now) {
    Instant end = windowStart.plus(settings.getWindowSize());
    if (end.isAfter(now)) {
      end = now;
    }
    windowEnd = end.isBefore(windowStart) ? windowStart : end;
    windowCursor = emitter.getCommitted();
    pageToken = null;
    pageNumber = 1;
    currentPage = null;
    lastWatermark = null;
    maxObserved = null;
    lastEmitted = null;
    outOfOrder = false;
    seenPageTokens.clear();
    logger.log(Level.FINE, "Opening window [{0}, {1}] of {2}",
        new Object[] {windowStart, windowEnd, entity.getId()});
    transition(State.FETCHING);
  }

  private void fetchPage() throws InterruptedException, SyncAbortedException {
    FetchRequest request =
        new FetchRequest.Builder()
            .setEntityId(entity.getId())
            .setCursor(windowCursor)
            .setPageToken(pageToken)
            .setWindow(windowStart, windowEnd)
            .setPageNumber(pageNumber)
            .build();
    FetchResult result = fetcher.fetch(request);
    if (result.isError()) {
      FetchError error = result.getError();
      throw new SyncAbortedException(ErrorKind.FATAL_FETCH,
          "fetch of page " + pageNumber + " failed: " + error.getMessage(), error.getCause());
    }
    Page page = result.getPage();
    pagesFetched++;
    plannerStats.register("pages");
    lastWatermark = page.getWatermark();
    String next = page.getNextPageToken();
    if (next != null && !seenPageTokens.add(next)) {
      throw new SyncAbortedException(ErrorKind.FATAL_FETCH,
          "pagination did not advance: page token " + next + " repeated", null);
    }
    logger.log(Level.FINE, "Fetched {0}", page);
    if (!page.getRecords().isEmpty()) {
      currentPage = page;
      transition(State.PAGINATING);
    } else if (next == null) {
      transition(State.CHECKPOINTING);
    } else {
      pageToken = next;
      pageNumber++;
    }
  }

  private void paginate() throws SyncAbortedException, CommitException {
    Page page = checkNotNull(currentPage);
    currentPage = null;
    List<Row> rows = new ArrayList<>(page.getRecords().size());
    int errors = 0;
    for (Map<String, Object> record : page.getRecords()) {
      try {
        rows.add(mapper.map(record, entity));
      } catch (MappingException e) {
        errors++;
        logger.log(Level.WARNING, "Skipping record of {0} on page {1}, column {2}: {3}",
            new Object[] {entity.getId(), pageNumber, e.getColumn(), e.getMessage()});
      }
    }
    if (errors > 0) {
      mappingErrors += errors;
      plannerStats.register("mappingErrors", errors);
    }
    if (errors > settings.getMaxMappingErrorsPerPage()) {
      throw new SyncAbortedException(ErrorKind.MAPPING_THRESHOLD,
          String.format("%d of %d records on page %d failed mapping, at most %d allowed",
              errors, page.getRecords().size(), pageNumber,
              settings.getMaxMappingErrorsPerPage()),
          null);
    }
    for (Row row : rows) {
      observe(row.getOrderingValue());
      rowsEmitted++;
      emitter.add(row);
    }
    String next = page.getNextPageToken();
    if (next == null) {
      transition(State.CHECKPOINTING);
    } else {
      pageToken = next;
      pageNumber++;
      transition(State.FETCHING);
    }
  }

  private void observe(Object orderingValue) {
    if (maxObserved == null || orderingType.compare(orderingValue, maxObserved) > 0) {
      maxObserved = orderingValue;
    } else if (orderingType.compare(orderingValue, maxObserved) < 0 && !outOfOrder) {
      logger.log(Level.FINE, "Out of order rows in window [{0}, {1}] of {2}",
          new Object[] {windowStart, windowEnd, entity.getId()});
      outOfOrder = true;
    }
    lastEmitted = orderingValue;
  }

  private void checkpointWindow() throws SyncAbortedException, CommitException {
    String candidate = windowCheckpointCandidate();
    Cursor cursor = emitter.flush(candidate);
    logger.log(Level.FINE, "Checkpointed window [{0}, {1}] of {2} at {3}",
        new Object[] {windowStart, windowEnd, entity.getId(), cursor.getPosition()});
  }

  /** Cursor candidate of a mid-window flush, or {@code null} to hold the cursor. */
  @VisibleForTesting
  @Nullable
  String safeCursorCandidate() {
    if (outOfOrder || lastEmitted == null) {
      return null;
    }
    return orderingType.toCanonical(lastEmitted);
  }

  /**
   * Cursor candidate of a completed window: the upstream watermark of its last page capped at the
   * window end, else the largest ordering value of its rows, else what the empty window policy
   * says.
   */
  @Nullable
  private String windowCheckpointCandidate() throws SyncAbortedException {
    if (lastWatermark != null) {
      Object watermark;
      try {
        watermark = mapper.coerce(
            entity.getSchema().getColumn(entity.getOrderingColumn()).get(), lastWatermark);
      } catch (MappingException e) {
        throw new SyncAbortedException(ErrorKind.FATAL_FETCH,
            "invalid watermark [" + lastWatermark + "]: " + e.getMessage(), e);
      }
      if (orderingType.toInstant(watermark).isAfter(windowEnd)) {
        watermark = orderingType.fromInstant(windowEnd);
      }
      return orderingType.toCanonical(watermark);
    }
    if (maxObserved != null) {
      return orderingType.toCanonical(maxObserved);
    }
    if (settings.getEmptyWindowPolicy() == EmptyWindowPolicy.ADVANCE_TO_WINDOW_END) {
      return orderingType.toCanonical(orderingType.fromInstant(windowEnd));
    }
    return null;
  }

  private void transition(State next) {
    State current = state;
    checkState(TRANSITIONS.get(current).contains(next),
        "illegal transition %s -> %s for %s", current, next, entity.getId());
    logger.log(Level.FINE, "{0}: {1} -> {2}", new Object[] {entity.getId(), current, next});
    state = next;
  }

  private EntitySyncReport fail(ErrorKind kind, String message, @Nullable Throwable cause) {
    if (state != State.FAILED) {
      transition(State.FAILED);
    }
    if (emitter != null) {
      emitter.discard();
    }
    plannerStats.logResult("sync", kind.name());
    logger.log(Level.WARNING,
        String.format("Sync of %s failed (%s): %s", entity.getId(), kind, message), cause);
    return newReport().setFailure(kind, message).build();
  }

  private EntitySyncReport.Builder newReport() {
    return new EntitySyncReport.Builder(entity.getId())
        .setLastGoodCursor(emitter == null ? null : emitter.getCommitted())
        .setCounts(pagesFetched, rowsEmitted, mappingErrors);
  }

  /** Aborts the sync of the entity with a classified failure. */
  private static class SyncAbortedException extends Exception {
    private final ErrorKind kind;

    SyncAbortedException(ErrorKind kind, String message, @Nullable Throwable cause) {
      super(message, cause);
      this.kind = kind;
    }
  }

  /** Builder for {@link SyncPlanner}. */
  public static class Builder {
    private EntityDescriptor entity;
    private CursorStore cursorStore;
    private PageFetcher fetcher;
    private RecordMapper mapper = new RecordMapper();
    private RowSink sink;
    private SyncSettings settings = new SyncSettings.Builder().build();
    private BatchPolicy batchPolicy = new BatchPolicy.Builder().build();
    private Clock clock = Clock.systemUTC();
    private Ticker ticker = Ticker.systemTicker();

    public Builder setEntity(EntityDescriptor entity) {
      this.entity = entity;
      return this;
    }

    public Builder setCursorStore(CursorStore cursorStore) {
      this.cursorStore = cursorStore;
      return this;
    }

    /** Sets the fetcher; wrap it in a {@link RetryingPageFetcher} to retry transient errors. */
    public Builder setPageFetcher(PageFetcher fetcher) {
      this.fetcher = fetcher;
      return this;
    }

    public Builder setRecordMapper(RecordMapper mapper) {
      this.mapper = mapper;
      return this;
    }

    public Builder setRowSink(RowSink sink) {
      this.sink = sink;
      return this;
    }

    public Builder setSettings(SyncSettings settings) {
      this.settings = settings;
      return this;
    }

    public Builder setBatchPolicy(BatchPolicy batchPolicy) {
      this.batchPolicy = batchPolicy;
      return this;
    }

    public Builder setClock(Clock clock) {
      this.clock = clock;
      return this;
    }

    public Builder setTicker(Ticker ticker) {
      this.ticker = ticker;
      return this;
    }

    public SyncPlanner build() {
      checkNotNull(entity, "entity can not be null");
      checkNotNull(cursorStore, "cursor store can not be null");
      checkNotNull(fetcher, "page fetcher can not be null");
      checkNotNull(mapper, "record mapper can not be null");
      checkNotNull(sink, "sink can not be null");
      checkNotNull(settings, "settings can not be null");
      checkNotNull(batchPolicy, "batch policy can not be null");
      checkNotNull(clock, "clock can not be null");
      checkNotNull(ticker, "ticker can not be null");
      return new SyncPlanner(this);
    }
  }
}
