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
package com.weathersync.sdk;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.weathersync.sdk.config.Configuration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Triggers {@link Connector#traverse} on a schedule.
 *
 * <p>Optional configuration parameters:
 *
 * <ul>
 *   <li>{@value #TRAVERSE_INTERVAL_SECONDS} - seconds between two sync runs, default 3600
 *   <li>{@value #TRAVERSE_ON_START} - run immediately at start, default true
 *   <li>{@value #RUN_ONCE} - exit after a single run, default false
 * </ul>
 *
 * <p>Runs never overlap: a trigger that fires while the previous run is still active is skipped.
 */
public class ConnectorScheduler {
  private static final Logger logger = Logger.getLogger(ConnectorScheduler.class.getName());

  public static final String TRAVERSE_INTERVAL_SECONDS = "schedule.traversalIntervalSecs";
  public static final String TRAVERSE_ON_START = "schedule.performTraversalOnStart";
  public static final String RUN_ONCE = "connector.runOnce";

  private static final int DEFAULT_TRAVERSE_INTERVAL_SECONDS = 3600;

  private final Connector connector;
  private final ConnectorContext context;
  private final ShutdownHolder shutdownHolder;
  private final AtomicBoolean isRunning = new AtomicBoolean(false);

  /** Single threaded; only hands work over to {@link #backgroundExecutor}. */
  private ScheduledExecutorService scheduleExecutor;

  private ExecutorService backgroundExecutor;

  /** Shutdown method to be executed when a run-once traversal is complete. */
  @FunctionalInterface
  public interface ShutdownHolder {
    void shutdown();
  }

  protected ConnectorScheduler(Builder builder) {
    this.connector = checkNotNull(builder.connector, "connector can not be null");
    this.context = checkNotNull(builder.context, "context can not be null");
    this.shutdownHolder = checkNotNull(builder.shutdownHolder);
  }

  /** Starts scheduling sync runs. */
  public synchronized void start() {
    checkState(!isRunning.get(), "Connector scheduler already started.");
    ConnectorSchedule schedule = new ConnectorSchedule();
    isRunning.set(true);
    // Non-daemon threads keep the connector process alive between runs.
    scheduleExecutor =
        Executors.newSingleThreadScheduledExecutor(
            new ThreadFactoryBuilder().setDaemon(false).setNameFormat("schedule").build());
    backgroundExecutor =
        Executors.newCachedThreadPool(
            new ThreadFactoryBuilder().setDaemon(false).setNameFormat("background-%d").build());
    long initialDelay =
        schedule.isPerformTraversalOnStart() ? 0 : schedule.getTraversalIntervalSeconds();
    ConnectorTraversal traversal =
        new ConnectorTraversal(connector, context.getTraversalExceptionHandler());
    if (schedule.isRunOnce()) {
      scheduleExecutor.schedule(
          new BackgroundRunnable(new ShutdownAfterCompleteRunnable(traversal)),
          initialDelay,
          TimeUnit.SECONDS);
    } else {
      scheduleExecutor.scheduleAtFixedRate(
          new BackgroundRunnable(new OneAtATimeRunnable(traversal, "Sync run")),
          initialDelay,
          schedule.getTraversalIntervalSeconds(),
          TimeUnit.SECONDS);
    }
    scheduleExecutor.scheduleAtFixedRate(
        () -> logger.info(StatsManager.getInstance().printStats()), 5, 5, TimeUnit.MINUTES);
  }

  /** Stops scheduling and interrupts an active run. */
  public synchronized void stop() {
    checkState(isRunning.get(), "Connector scheduler not started.");
    shutdownExecutor(scheduleExecutor);
    shutdownExecutor(backgroundExecutor);
    isRunning.set(false);
    logger.info(StatsManager.getInstance().printStats());
  }

  public boolean isStarted() {
    return isRunning.get();
  }

  private void shutdownExecutor(ExecutorService executor) {
    if ((executor == null) || executor.isShutdown()) {
      return;
    }
    executor.shutdown();
    try {
      executor.awaitTermination(10L, TimeUnit.SECONDS);
    } catch (InterruptedException ex) {
      logger.log(Level.WARNING, "Interrupted during executor termination.", ex);
      Thread.currentThread().interrupt();
    }
    executor.shutdownNow();
  }

  /** Builder for {@link ConnectorScheduler} instances. */
  public static class Builder {
    private Connector connector;
    private ConnectorContext context;
    private ShutdownHolder shutdownHolder = () -> {};

    public Builder setConnector(Connector connector) {
      this.connector = connector;
      return this;
    }

    public Builder setContext(ConnectorContext context) {
      this.context = context;
      return this;
    }

    public Builder setShutdownHolder(ShutdownHolder shutdownHolder) {
      this.shutdownHolder = shutdownHolder;
      return this;
    }

    public ConnectorScheduler build() {
      return new ConnectorScheduler(this);
    }
  }

  /** Traversal schedule read from the configuration. */
  @VisibleForTesting
  static class ConnectorSchedule {
    private final int traversalIntervalSecs;
    private final boolean performTraversalOnStart;
    private final boolean runOnce;

    ConnectorSchedule() {
      checkState(Configuration.isInitialized(), "configuration should be initialized");
      traversalIntervalSecs =
          Configuration.getInteger(TRAVERSE_INTERVAL_SECONDS, DEFAULT_TRAVERSE_INTERVAL_SECONDS)
              .get();
      Configuration.checkConfiguration(traversalIntervalSecs > 0,
          "%s must be positive", TRAVERSE_INTERVAL_SECONDS);
      performTraversalOnStart = Configuration.getBoolean(TRAVERSE_ON_START, true).get();
      runOnce = Configuration.getBoolean(RUN_ONCE, false).get();
    }

    int getTraversalIntervalSeconds() {
      return traversalIntervalSecs;
    }

    boolean isPerformTraversalOnStart() {
      return performTraversalOnStart;
    }

    boolean isRunOnce() {
      return runOnce;
    }
  }

  private static class ConnectorTraversal implements Runnable {
    private final Connector connector;
    private final ExceptionHandler handler;

    private ConnectorTraversal(Connector connector, ExceptionHandler handler) {
      this.connector = checkNotNull(connector);
      this.handler = checkNotNull(handler);
    }

    private void connectorTraversal() throws InterruptedException {
      logger.info("Beginning sync run.");
      for (int ntries = 1; ; ntries++) {
        try {
          connector.traverse();
          break;
        } catch (InterruptedException ex) {
          throw ex;
        } catch (Exception ex) {
          logger.log(Level.WARNING, "Exception during sync run.", ex);
          if (!handler.handleException(ex, ntries)) {
            logger.warning("Failed sync run.");
            return;
          }
        }
        logger.log(Level.INFO, "Trying again... Number of attempts: {0}", ntries);
      }
      logger.info("Completed sync run.");
    }

    @Override
    public void run() {
      try {
        connectorTraversal();
      } catch (InterruptedException ex) {
        logger.log(Level.WARNING, "Interrupted. Aborted sync run.", ex);
        Thread.currentThread().interrupt();
      } catch (Throwable t) {
        logger.log(Level.WARNING, "Failure during sync run", t);
      }
    }
  }

  /** Hands {@code delegate} over to the background executor and returns immediately. */
  private class BackgroundRunnable implements Runnable {
    private final Runnable delegate;

    BackgroundRunnable(Runnable delegate) {
      this.delegate = checkNotNull(delegate);
    }

    @Override
    public void run() {
      try {
        backgroundExecutor.execute(delegate);
      } catch (Throwable t) {
        logger.log(Level.WARNING, "Failed to start background runnable", t);
      }
    }
  }

  private class ShutdownAfterCompleteRunnable implements Runnable {
    private final Runnable toRun;

    ShutdownAfterCompleteRunnable(Runnable toRun) {
      this.toRun = toRun;
    }

    @Override
    public void run() {
      try {
        toRun.run();
      } finally {
        shutdownHolder.shutdown();
      }
    }
  }

  /** Runs {@code toRun} unless a previous invocation is still active. */
  @VisibleForTesting
  public static class OneAtATimeRunnable implements Runnable {
    private final AtomicBoolean isRunning = new AtomicBoolean();
    private final Runnable toRun;
    private final String tag;

    public OneAtATimeRunnable(Runnable toRun, String tag) {
      this.toRun = checkNotNull(toRun);
      this.tag = checkNotNull(tag);
    }

    @Override
    public void run() {
      if (!isRunning.compareAndSet(false, true)) {
        logger.log(
            Level.INFO, "Skipping current run for {0}. Previous invocation is still running.", tag);
        return;
      }
      try {
        toRun.run();
      } finally {
        isRunning.set(false);
      }
    }
  }
}
