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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.annotations.VisibleForTesting;
import com.weathersync.sdk.config.Configuration;
import java.util.concurrent.TimeUnit;

/**
 * Policy for flushing buffered rows to the sink.
 *
 * <p>A flush is triggered by either the number of buffered rows or the time elapsed since the
 * previous flush, whichever comes first. Both limits bound the memory and the staleness of the
 * data held by the connector.
 */
public class BatchPolicy {
  private static final int DEFAULT_MAX_ROWS = 500;
  private static final int DEFAULT_MAX_DELAY_SECONDS = 30;

  @VisibleForTesting static final String CONFIG_MAX_ROWS = "batch.maxRows";
  @VisibleForTesting static final String CONFIG_MAX_DELAY_SECONDS = "batch.maxDelaySeconds";

  private final int maxRows;
  private final long maxDelay;
  private final TimeUnit maxDelayUnit;

  private BatchPolicy(Builder builder) {
    maxRows = builder.maxRows;
    maxDelay = builder.maxDelay;
    maxDelayUnit = builder.maxDelayUnit;
  }

  /**
   * Creates a batch policy from configuration file parameters.
   *
   * <ul>
   *   <li>{@value #CONFIG_MAX_ROWS} = 500 rows buffered before a flush
   *   <li>{@value #CONFIG_MAX_DELAY_SECONDS} = 30 seconds since the last flush before buffered
   *       rows are flushed
   * </ul>
   */
  public static BatchPolicy fromConfiguration() {
    checkState(Configuration.isInitialized(), "config not initialized");
    int rows = Configuration.getInteger(CONFIG_MAX_ROWS, DEFAULT_MAX_ROWS).get();
    int delay = Configuration.getInteger(CONFIG_MAX_DELAY_SECONDS, DEFAULT_MAX_DELAY_SECONDS).get();
    Configuration.checkConfiguration(rows > 0, "%s must be positive", CONFIG_MAX_ROWS);
    Configuration.checkConfiguration(delay > 0, "%s must be positive", CONFIG_MAX_DELAY_SECONDS);
    return new BatchPolicy.Builder()
        .setMaxRows(rows)
        .setMaxDelay(delay, TimeUnit.SECONDS)
        .build();
  }

  /** Gets the maximum number of rows buffered before a flush. */
  public int getMaxRows() {
    return maxRows;
  }

  /** Gets the maximum delay between two flushes. */
  public long getMaxDelay() {
    return maxDelay;
  }

  public TimeUnit getMaxDelayUnit() {
    return maxDelayUnit;
  }

  /** Gets the maximum delay between two flushes in nanoseconds. */
  public long getMaxDelayNanos() {
    return maxDelayUnit.toNanos(maxDelay);
  }

  @Override
  public String toString() {
    return "BatchPolicy [maxRows=" + maxRows + ", maxDelay=" + maxDelay + " " + maxDelayUnit + "]";
  }

  /** Builder for {@link BatchPolicy} instances. */
  public static class Builder {
    private int maxRows = DEFAULT_MAX_ROWS;
    private long maxDelay = DEFAULT_MAX_DELAY_SECONDS;
    private TimeUnit maxDelayUnit = TimeUnit.SECONDS;

    public Builder setMaxRows(int maxRows) {
      this.maxRows = maxRows;
      return this;
    }

    public Builder setMaxDelay(long maxDelay, TimeUnit unit) {
      this.maxDelay = maxDelay;
      this.maxDelayUnit = unit;
      return this;
    }

    public BatchPolicy build() {
      checkArgument(maxRows > 0, "maxRows must be positive");
      checkArgument(maxDelay > 0, "maxDelay must be positive");
      checkNotNull(maxDelayUnit, "maxDelayUnit can not be null");
      return new BatchPolicy(this);
    }
  }
}
