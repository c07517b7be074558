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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Ticker;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.weathersync.sdk.BatchPolicy;
import com.weathersync.sdk.RetryPolicy;
import com.weathersync.sdk.StatsManager;
import com.weathersync.sdk.StatsManager.OperationStats;
import java.io.Closeable;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;

/**
 * Runs the sync of many entities in parallel, one {@link SyncPlanner} per entity.
 *
 * <p>Entities are independent failure domains: a failed entity never aborts the others. At most
 * {@link SyncSettings#getMaxConcurrentEntities()} entities sync at a time, and an entity is never
 * synced by two runs at once. When the deadline passes or {@link #cancel()} is called, running
 * syncs are interrupted and reported as {@link ErrorKind#CANCELLED} once they stopped.
 */
public class SyncRunner implements Closeable {
  private static final Logger logger = Logger.getLogger(SyncRunner.class.getName());
  private static final OperationStats runnerStats = StatsManager.getComponent("runner");
  private static final long SHUTDOWN_TIMEOUT_SECONDS = 30;
  private static final long CANCEL_GRACE_SECONDS = 10;

  private final ImmutableMap<String, EntityDescriptor> entities;
  private final CursorStore cursorStore;
  private final PageFetcher fetcher;
  private final RecordMapper mapper;
  private final RowSink sink;
  private final SyncSettings settings;
  private final BatchPolicy batchPolicy;
  private final Clock clock;
  private final Ticker ticker;
  private final ListeningExecutorService executor;
  private final ConcurrentMap<String, ReentrantLock> entityLocks = new ConcurrentHashMap<>();
  private final Set<Future<?>> inFlight = ConcurrentHashMap.newKeySet();

  private SyncRunner(Builder builder) {
    ImmutableMap.Builder<String, EntityDescriptor> byId = ImmutableMap.builder();
    builder.entities.forEach(e -> byId.put(e.getId(), e));
    this.entities = byId.build();
    this.cursorStore = builder.cursorStore;
    this.fetcher = new RetryingPageFetcher(builder.fetcher, builder.retryPolicy);
    this.mapper = builder.mapper;
    this.sink = builder.sink;
    this.settings = builder.settings;
    this.batchPolicy = builder.batchPolicy;
    this.clock = builder.clock;
    this.ticker = builder.ticker;
    this.executor =
        MoreExecutors.listeningDecorator(
            Executors.newFixedThreadPool(
                settings.getMaxConcurrentEntities(),
                new ThreadFactoryBuilder()
                    .setNameFormat("sync-entity-%d")
                    .setDaemon(true)
                    .build()));
  }

  public ImmutableSet<String> getEntityIds() {
    return entities.keySet();
  }

  /**
   * Syncs the given entities and waits until all are done or {@code deadline} passes.
   *
   * @param entityIds ids of the entities to sync, each known to this runner
   * @param deadline point in time at which unfinished syncs are cancelled
   * @return one report per entity, in the order of {@code entityIds}
   * @throws InterruptedException if the calling thread is interrupted; running syncs are
   *     cancelled first
   */
  public SyncRunReport run(Collection<String> entityIds, Instant deadline)
      throws InterruptedException {
    checkNotNull(entityIds, "entity ids can not be null");
    checkNotNull(deadline, "deadline can not be null");
    for (String id : entityIds) {
      checkArgument(entities.containsKey(id), "unknown entity %s", id);
    }
    logger.log(Level.INFO, "Starting sync run of {0} entities, deadline {1}",
        new Object[] {entityIds.size(), deadline});
    List<String> ids = new ArrayList<>(entityIds);
    List<EntityTask> tasks = new ArrayList<>();
    List<ListenableFuture<EntitySyncReport>> futures = new ArrayList<>();
    for (String id : ids) {
      EntityTask task = new EntityTask(entities.get(id));
      tasks.add(task);
      futures.add(executor.submit(task));
    }
    inFlight.addAll(futures);
    try {
      long remainingNanos = Duration.between(clock.instant(), deadline).toNanos();
      try {
        Futures.successfulAsList(futures).get(Math.max(0, remainingNanos), TimeUnit.NANOSECONDS);
      } catch (TimeoutException e) {
        logger.log(Level.WARNING, "Sync run passed its deadline {0}, cancelling", deadline);
        futures.forEach(f -> f.cancel(true));
      } catch (InterruptedException e) {
        futures.forEach(f -> f.cancel(true));
        throw e;
      } catch (ExecutionException e) {
        throw new IllegalStateException("unexpected failure waiting for entity syncs", e);
      }
      awaitCancelled(futures, tasks);
      List<EntitySyncReport> reports = new ArrayList<>();
      for (int i = 0; i < ids.size(); i++) {
        reports.add(collect(ids.get(i), futures.get(i)));
      }
      SyncRunReport runReport = new SyncRunReport(reports);
      logger.log(runReport.isSuccess() ? Level.INFO : Level.WARNING,
          "Sync run finished: {0}", runReport);
      return runReport;
    } finally {
      inFlight.removeAll(futures);
    }
  }

  /** Cancels all running entity syncs. Their buffered rows are discarded. */
  public void cancel() {
    logger.log(Level.INFO, "Cancelling {0} running entity syncs", inFlight.size());
    inFlight.forEach(f -> f.cancel(true));
  }

  /** Cancels running syncs and shuts down the worker threads. */
  @Override
  public void close() {
    cancel();
    MoreExecutors.shutdownAndAwaitTermination(executor, SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS);
  }

  @VisibleForTesting
  EntitySyncReport syncEntity(EntityDescriptor entity) throws InterruptedException {
    ReentrantLock lock = entityLocks.computeIfAbsent(entity.getId(), k -> new ReentrantLock());
    lock.lockInterruptibly();
    try {
      EntitySyncReport report =
          new SyncPlanner.Builder()
              .setEntity(entity)
              .setCursorStore(cursorStore)
              .setPageFetcher(fetcher)
              .setRecordMapper(mapper)
              .setRowSink(sink)
              .setSettings(settings)
              .setBatchPolicy(batchPolicy)
              .setClock(clock)
              .setTicker(ticker)
              .build()
              .run();
      runnerStats.logResult("entity",
          report.isSuccess() ? "OK" : report.getErrorKind().name());
      return report;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Waits for the cancelled syncs that already started to stop, so that their reports carry the
   * cursor they actually left behind. A sync blocked in an uninterruptible sink write may still
   * commit.
   */
  private void awaitCancelled(
      List<ListenableFuture<EntitySyncReport>> futures, List<EntityTask> tasks)
      throws InterruptedException {
    long graceEnd = System.nanoTime() + TimeUnit.SECONDS.toNanos(CANCEL_GRACE_SECONDS);
    for (int i = 0; i < futures.size(); i++) {
      if (!futures.get(i).isCancelled()) {
        continue;
      }
      EntityTask task = tasks.get(i);
      long remaining = Math.max(0, graceEnd - System.nanoTime());
      if (!task.awaitStopped(remaining, TimeUnit.NANOSECONDS)) {
        logger.log(Level.WARNING, "Cancelled sync of {0} did not stop within {1} seconds",
            new Object[] {task.entity.getId(), CANCEL_GRACE_SECONDS});
      }
    }
  }

  private EntitySyncReport collect(String entityId, ListenableFuture<EntitySyncReport> future) {
    if (future.isCancelled()) {
      runnerStats.logResult("entity", ErrorKind.CANCELLED.name());
      return new EntitySyncReport.Builder(entityId)
          .setFailure(ErrorKind.CANCELLED, "sync cancelled")
          .setLastGoodCursor(loadCursor(entityId))
          .build();
    }
    try {
      return Futures.getDone(future);
    } catch (ExecutionException e) {
      logger.log(Level.WARNING, "Sync of " + entityId + " failed", e.getCause());
      runnerStats.logResult("entity", ErrorKind.INTERNAL.name());
      return new EntitySyncReport.Builder(entityId)
          .setFailure(ErrorKind.INTERNAL, String.valueOf(e.getCause()))
          .setLastGoodCursor(loadCursor(entityId))
          .build();
    }
  }

  @Nullable
  private Cursor loadCursor(String entityId) {
    try {
      return cursorStore.load(entityId);
    } catch (IOException e) {
      logger.log(Level.WARNING, "Failed to load cursor of " + entityId, e);
      return null;
    }
  }

  /** Sync of one entity whose end can be awaited after its future was cancelled. */
  private class EntityTask implements Callable<EntitySyncReport> {
    private final EntityDescriptor entity;
    private final AtomicBoolean claimed = new AtomicBoolean();
    private final CountDownLatch stopped = new CountDownLatch(1);

    EntityTask(EntityDescriptor entity) {
      this.entity = entity;
    }

    @Override
    public EntitySyncReport call() throws InterruptedException {
      if (!claimed.compareAndSet(false, true)) {
        throw new CancellationException("sync of " + entity.getId() + " cancelled before start");
      }
      try {
        return syncEntity(entity);
      } finally {
        stopped.countDown();
      }
    }

    /** Returns {@code true} once the sync stopped, or right away if it never started. */
    boolean awaitStopped(long timeout, TimeUnit unit) throws InterruptedException {
      if (claimed.compareAndSet(false, true)) {
        return true;
      }
      return stopped.await(timeout, unit);
    }
  }

  /** Builder for {@link SyncRunner}. */
  public static class Builder {
    private Collection<EntityDescriptor> entities;
    private CursorStore cursorStore;
    private PageFetcher fetcher;
    private RecordMapper mapper = new RecordMapper();
    private RowSink sink;
    private SyncSettings settings = new SyncSettings.Builder().build();
    private BatchPolicy batchPolicy = new BatchPolicy.Builder().build();
    private RetryPolicy retryPolicy = new RetryPolicy.Builder().build();
    private Clock clock = Clock.systemUTC();
    private Ticker ticker = Ticker.systemTicker();

    public Builder setEntities(Collection<EntityDescriptor> entities) {
      this.entities = entities;
      return this;
    }

    public Builder setCursorStore(CursorStore cursorStore) {
      this.cursorStore = cursorStore;
      return this;
    }

    /** Sets the fetcher of the upstream; the runner adds retries with the retry policy. */
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

    public Builder setRetryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
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

    public SyncRunner build() {
      checkNotNull(entities, "entities can not be null");
      checkNotNull(cursorStore, "cursor store can not be null");
      checkNotNull(fetcher, "page fetcher can not be null");
      checkNotNull(mapper, "record mapper can not be null");
      checkNotNull(sink, "sink can not be null");
      checkNotNull(settings, "settings can not be null");
      checkNotNull(batchPolicy, "batch policy can not be null");
      checkNotNull(retryPolicy, "retry policy can not be null");
      checkNotNull(clock, "clock can not be null");
      checkNotNull(ticker, "ticker can not be null");
      long distinct = entities.stream().map(EntityDescriptor::getId).distinct().count();
      checkArgument(distinct == entities.size(), "duplicate entity ids in %s", entities);
      return new SyncRunner(this);
    }
  }
}
