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
import com.weathersync.sdk.BatchPolicy;
import com.weathersync.sdk.Connector;
import com.weathersync.sdk.ConnectorContext;
import com.weathersync.sdk.RetryPolicy;
import com.weathersync.sdk.config.Configuration;
import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link Connector} that incrementally syncs the entities of a {@link SyncRepository}.
 *
 * <p>Sample usage:
 *
 * <pre>{@code
 * public static void main(String[] args) throws IOException, InterruptedException {
 *   Application application = new Application.Builder(
 *       new IncrementalSyncConnector(new MyRepository()), args).build();
 *   application.start();
 * }
 * }</pre>
 *
 * <p>Each {@link #traverse()} syncs every entity once, bounded by
 * {@value SyncSettings#CONFIG_RUN_DEADLINE_SECONDS}. Cursors are kept in a
 * {@link LocalFileCursorStore} unless another {@link CursorStore} is supplied.
 */
public class IncrementalSyncConnector implements Connector {
  private static final Logger logger =
      Logger.getLogger(IncrementalSyncConnector.class.getName());

  private final SyncRepository repository;
  private final Clock clock;
  private CursorStore cursorStore;
  private SyncSettings settings;
  private SyncRunner runner;

  public IncrementalSyncConnector(SyncRepository repository) {
    this(repository, null, Clock.systemUTC());
  }

  @VisibleForTesting
  IncrementalSyncConnector(SyncRepository repository, CursorStore cursorStore, Clock clock) {
    this.repository = checkNotNull(repository, "repository can not be null");
    this.cursorStore = cursorStore;
    this.clock = checkNotNull(clock);
  }

  /** Uses the repository class name for the default ID, rather than this class name. */
  @Override
  public String getDefaultId() {
    return repository.getClass().getName();
  }

  @Override
  public void init(ConnectorContext context) throws Exception {
    checkState(Configuration.isInitialized(), "configuration not initialized");
    if (cursorStore == null) {
      cursorStore = LocalFileCursorStore.fromConfiguration();
    }
    settings = SyncSettings.fromConfiguration();
    RecordMapper mapper = RecordMapper.fromConfiguration();
    BatchPolicy batchPolicy = BatchPolicy.fromConfiguration();
    RetryPolicy retryPolicy = RetryPolicy.fromConfiguration();
    repository.init();
    runner =
        new SyncRunner.Builder()
            .setEntities(repository.getEntities())
            .setCursorStore(cursorStore)
            .setPageFetcher(repository.getPageFetcher())
            .setRecordMapper(mapper)
            .setRowSink(repository.getRowSink())
            .setSettings(settings)
            .setBatchPolicy(batchPolicy)
            .setRetryPolicy(retryPolicy)
            .setClock(clock)
            .build();
    logger.log(Level.INFO, "Initialized incremental sync of {0} entities with {1}",
        new Object[] {runner.getEntityIds().size(), settings});
  }

  /**
   * Syncs all entities once.
   *
   * @throws IOException if the sync of any entity failed; the others are synced regardless
   * @throws InterruptedException if the run is interrupted
   */
  @Override
  public void traverse() throws IOException, InterruptedException {
    checkState(runner != null, "connector not initialized");
    Instant deadline = clock.instant().plus(settings.getRunDeadline());
    SyncRunReport report = runner.run(runner.getEntityIds(), deadline);
    if (!report.isSuccess()) {
      throw new IOException(String.format("Sync of %d of %d entities failed: %s",
          report.getFailures().size(), report.getReports().size(), report.getFailures()));
    }
  }

  @Override
  public void destroy() {
    if (runner != null) {
      logger.log(Level.INFO, "Shutting down the incremental sync runner");
      runner.close();
    }
    repository.close();
  }
}
