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
import com.google.common.util.concurrent.AbstractIdleService;
import com.weathersync.sdk.ConnectorScheduler.ShutdownHolder;
import com.weathersync.sdk.config.Configuration;
import java.io.IOException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Main object and access point for a connector process.
 *
 * <p>Sample usage:
 * <pre>{@code
 *   public static void main(String[] args) throws InterruptedException {
 *     Application application = new Application.Builder(new MyConnector(), args).build();
 *     application.start();
 *   } }
 * </pre>
 *
 * <p>See {@link ConnectorScheduler} for the schedule parameters.
 */
public class Application extends AbstractIdleService {
  private static Logger logger = Logger.getLogger(Application.class.getName());

  static final ExceptionHandler DEFAULT_EXCEPTION_HANDLER =
      new ExponentialBackoffExceptionHandler(10, 5, TimeUnit.SECONDS);

  private final AtomicBoolean started = new AtomicBoolean(false);
  private final Connector connector;
  private final ApplicationHelper helper;

  private ConnectorScheduler connectorScheduler;
  private Thread shutdownThread;
  private ShutdownHolder shutdownHolder;

  private Application(Builder builder) {
    this.helper = checkNotNull(builder.helper);
    this.connector = checkNotNull(builder.connector);
  }

  /**
   * Initializes the connector and starts the scheduler.
   *
   * @throws InterruptedException if aborted during start up
   */
  public void start() throws InterruptedException {
    startAsync().awaitRunning();
  }

  private void startApplication() {
    synchronized (this) {
      checkState(started.compareAndSet(false, true), "Application already started");
      shutdownThread = helper.createShutdownHookThread(new ShutdownHook());
      helper.addShutdownHook(shutdownThread);
      shutdownHolder = () -> shutdownThread.start();
    }
  }

  @VisibleForTesting
  ConnectorContext startConnector() throws InterruptedException {
    ExceptionHandler exceptionHandler = helper.getDefaultExceptionHandler();
    int tries = 1;
    ConnectorContext context;
    while (true) {
      try {
        context = checkNotNull(helper.createContextBuilderInstance().build());
        connector.init(context);
        break;
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        throw ex;
      } catch (StartupException ex) {
        throw ex;
      } catch (RuntimeException ex) {
        throw new StartupException("Failed to initialize connector", ex);
      } catch (Exception ex) {
        logger.log(Level.WARNING, "Failed to initialize connector", ex);
        if (!exceptionHandler.handleException(ex, tries)) {
          throw new StartupException("Failed to initialize connector", ex);
        }
        tries++;
      }
    }
    return context;
  }

  private void startScheduler(ConnectorContext context) {
    connectorScheduler =
        helper
            .createSchedulerBuilderInstance()
            .setConnector(connector)
            .setContext(context)
            .setShutdownHolder(shutdownHolder)
            .build();
    connectorScheduler.start();
  }

  /**
   * Shuts the connector down in response to an event.
   *
   * @param event triggering shutdown
   */
  public synchronized void shutdown(String event) {
    logger.log(Level.INFO, "Shutdown Connector {0}", event);
    stopAsync().awaitTerminated();
  }

  /** Registered with {@link Runtime#addShutdownHook}. */
  @VisibleForTesting
  public class ShutdownHook implements Runnable {
    @Override
    public void run() {
      shutdown("ShutdownHook initiated");
    }
  }

  @VisibleForTesting
  static void setLogger(Logger logger) {
    Application.logger = logger;
  }

  @Override
  protected void startUp() throws Exception {
    startApplication();
    ConnectorContext context = startConnector();
    startScheduler(context);
  }

  @Override
  protected void shutDown() throws Exception {
    if ((connectorScheduler != null) && connectorScheduler.isStarted()) {
      connectorScheduler.stop();
    }
    connector.destroy();
  }

  /** Builder for {@link Application} instances. */
  public static class Builder {
    private final Connector connector;
    private final String[] args;
    private ApplicationHelper helper = new ApplicationHelper();

    /**
     * @param connector instance
     * @param args command line arguments
     */
    public Builder(Connector connector, String[] args) {
      this.connector = checkNotNull(connector);
      this.args = checkNotNull(args);
    }

    @VisibleForTesting
    Builder setHelper(ApplicationHelper helper) {
      this.helper = helper;
      return this;
    }

    /**
     * Loads the configuration, unless already initialized, and creates the application.
     *
     * @throws StartupException if the configuration file can not be read
     */
    public Application build() {
      try {
        if (!Configuration.isInitialized()) {
          Configuration.initConfig(args);
        }
      } catch (IOException configException) {
        throw new StartupException("failed to load configuration", configException);
      }
      return new Application(this);
    }
  }

  /** Factory and util methods, replaced in tests. */
  @VisibleForTesting
  static class ApplicationHelper {
    ConnectorContextImpl.Builder createContextBuilderInstance() {
      return new ConnectorContextImpl.Builder();
    }

    ConnectorScheduler.Builder createSchedulerBuilderInstance() {
      return new ConnectorScheduler.Builder();
    }

    Thread createShutdownHookThread(Runnable task) {
      return new Thread(task, "connector-shutdown");
    }

    void addShutdownHook(Thread hook) {
      Runtime.getRuntime().addShutdownHook(hook);
    }

    ExceptionHandler getDefaultExceptionHandler() {
      return DEFAULT_EXCEPTION_HANDLER;
    }
  }
}
