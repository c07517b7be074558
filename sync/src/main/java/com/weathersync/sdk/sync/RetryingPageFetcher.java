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

import com.google.api.client.util.BackOff;
import com.weathersync.sdk.RetryPolicy;
import com.weathersync.sdk.StatsManager;
import com.weathersync.sdk.StatsManager.OperationStats;
import java.io.IOException;
import java.time.Duration;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link PageFetcher} that retries transient failures of a delegate with jittered exponential
 * backoff.
 *
 * <p>A transient failure on the last allowed attempt is promoted to {@link FetchError.Kind#FATAL}.
 * Fatal failures are returned without retry. A server-requested delay replaces the computed
 * backoff when it is longer.
 */
public class RetryingPageFetcher implements PageFetcher {
  private static final Logger logger = Logger.getLogger(RetryingPageFetcher.class.getName());
  private static final OperationStats fetchStats = StatsManager.getComponent("fetch");

  private final PageFetcher delegate;
  private final RetryPolicy retryPolicy;

  public RetryingPageFetcher(PageFetcher delegate, RetryPolicy retryPolicy) {
    this.delegate = checkNotNull(delegate, "delegate can not be null");
    this.retryPolicy = checkNotNull(retryPolicy, "retry policy can not be null");
  }

  @Override
  public FetchResult fetch(FetchRequest request) throws InterruptedException {
    BackOff backOff = retryPolicy.getBackOffFactory().createBackOffInstance();
    for (int attempt = 1; ; attempt++) {
      OperationStats.Event event = fetchStats.event("page");
      FetchResult result = delegate.fetch(request);
      if (!result.isError()) {
        event.success();
        return result;
      }
      event.failure();
      FetchError error = result.getError();
      if (!error.isTransient()) {
        fetchStats.logResult("page", FetchError.Kind.FATAL.name());
        return result;
      }
      if (attempt >= retryPolicy.getMaxAttempts()) {
        fetchStats.logResult("page", "RETRIES_EXHAUSTED");
        return FetchResult.error(FetchError.fatal(
            String.format("gave up after %d attempts: %s", attempt, error.getMessage()),
            error.getCause()));
      }
      long sleepMillis;
      try {
        sleepMillis = backOff.nextBackOffMillis();
      } catch (IOException e) {
        return FetchResult.error(FetchError.fatal("backoff failed: " + error.getMessage(), e));
      }
      if (sleepMillis == BackOff.STOP) {
        return FetchResult.error(FetchError.fatal(
            "backoff stopped after " + attempt + " attempts: " + error.getMessage(),
            error.getCause()));
      }
      sleepMillis = Math.max(sleepMillis, error.getRetryAfter().map(Duration::toMillis).orElse(0L));
      fetchStats.register("retry");
      logger.log(Level.WARNING,
          "Transient failure fetching {0} (attempt {1}), retrying in {2} ms: {3}",
          new Object[] {request, attempt, sleepMillis, error.getMessage()});
      retryPolicy.getSleeper().sleep(sleepMillis);
    }
  }
}
