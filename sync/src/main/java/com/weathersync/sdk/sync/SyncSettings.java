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
import static com.google.common.base.Preconditions.checkState;

import com.google.common.annotations.VisibleForTesting;
import com.weathersync.sdk.config.Configuration;
import java.time.Duration;

/**
 * Windowing, failure and concurrency parameters of the sync engine.
 *
 * <p>Optional configuration parameters:
 *
 * <ul>
 *   <li>{@value #CONFIG_WINDOW_HOURS} - size of one polling window, default 168 (one week)
 *   <li>{@value #CONFIG_INITIAL_LOOKBACK_DAYS} - start of the first window of a never synced
 *       entity, default 730 (two years)
 *   <li>{@value #CONFIG_EMPTY_WINDOW_POLICY} - {@code HOLD} or {@code ADVANCE_TO_WINDOW_END},
 *       default {@code HOLD}
 *   <li>{@value #CONFIG_MAX_MAPPING_ERRORS} - mapping errors tolerated per page, default 10
 *   <li>{@value #CONFIG_MAX_CONCURRENT_ENTITIES} - entities synced in parallel, default 4
 *   <li>{@value #CONFIG_RUN_DEADLINE_SECONDS} - deadline of one run, default 3600
 * </ul>
 */
public class SyncSettings {
  public static final String CONFIG_WINDOW_HOURS = "sync.windowHours";
  public static final String CONFIG_INITIAL_LOOKBACK_DAYS = "sync.initialLookbackDays";
  public static final String CONFIG_EMPTY_WINDOW_POLICY = "sync.emptyWindowPolicy";
  public static final String CONFIG_MAX_MAPPING_ERRORS = "sync.maxMappingErrorsPerPage";
  public static final String CONFIG_MAX_CONCURRENT_ENTITIES = "sync.maxConcurrentEntities";
  public static final String CONFIG_RUN_DEADLINE_SECONDS = "sync.runDeadlineSeconds";

  @VisibleForTesting static final int DEFAULT_WINDOW_HOURS = 168;
  @VisibleForTesting static final int DEFAULT_INITIAL_LOOKBACK_DAYS = 730;
  @VisibleForTesting static final int DEFAULT_MAX_MAPPING_ERRORS = 10;
  @VisibleForTesting static final int DEFAULT_MAX_CONCURRENT_ENTITIES = 4;
  @VisibleForTesting static final int DEFAULT_RUN_DEADLINE_SECONDS = 3600;

  /** What happens to the cursor when a window yields no rows. */
  public enum EmptyWindowPolicy {
    /** Keep the cursor; the next run queries the same range again. */
    HOLD,
    /** Move the cursor to the end of the empty window. */
    ADVANCE_TO_WINDOW_END
  }

  private final Duration windowSize;
  private final Duration initialLookback;
  private final EmptyWindowPolicy emptyWindowPolicy;
  private final int maxMappingErrorsPerPage;
  private final int maxConcurrentEntities;
  private final Duration runDeadline;

  private SyncSettings(Builder builder) {
    this.windowSize = builder.windowSize;
    this.initialLookback = builder.initialLookback;
    this.emptyWindowPolicy = builder.emptyWindowPolicy;
    this.maxMappingErrorsPerPage = builder.maxMappingErrorsPerPage;
    this.maxConcurrentEntities = builder.maxConcurrentEntities;
    this.runDeadline = builder.runDeadline;
  }

  public static SyncSettings fromConfiguration() {
    checkState(Configuration.isInitialized(), "config not initialized");
    int windowHours = Configuration.getInteger(CONFIG_WINDOW_HOURS, DEFAULT_WINDOW_HOURS).get();
    int lookbackDays =
        Configuration.getInteger(CONFIG_INITIAL_LOOKBACK_DAYS, DEFAULT_INITIAL_LOOKBACK_DAYS)
            .get();
    EmptyWindowPolicy policy =
        Configuration.getValue(
                CONFIG_EMPTY_WINDOW_POLICY,
                EmptyWindowPolicy.HOLD,
                Configuration.enumParser(EmptyWindowPolicy.class))
            .get();
    int maxErrors =
        Configuration.getInteger(CONFIG_MAX_MAPPING_ERRORS, DEFAULT_MAX_MAPPING_ERRORS).get();
    int concurrency =
        Configuration.getInteger(CONFIG_MAX_CONCURRENT_ENTITIES, DEFAULT_MAX_CONCURRENT_ENTITIES)
            .get();
    int deadlineSeconds =
        Configuration.getInteger(CONFIG_RUN_DEADLINE_SECONDS, DEFAULT_RUN_DEADLINE_SECONDS).get();
    Configuration.checkConfiguration(windowHours > 0, "%s must be positive", CONFIG_WINDOW_HOURS);
    Configuration.checkConfiguration(lookbackDays >= 0, "%s can not be negative",
        CONFIG_INITIAL_LOOKBACK_DAYS);
    Configuration.checkConfiguration(maxErrors >= 0, "%s can not be negative",
        CONFIG_MAX_MAPPING_ERRORS);
    Configuration.checkConfiguration(concurrency > 0, "%s must be positive",
        CONFIG_MAX_CONCURRENT_ENTITIES);
    Configuration.checkConfiguration(deadlineSeconds > 0, "%s must be positive",
        CONFIG_RUN_DEADLINE_SECONDS);
    return new Builder()
        .setWindowSize(Duration.ofHours(windowHours))
        .setInitialLookback(Duration.ofDays(lookbackDays))
        .setEmptyWindowPolicy(policy)
        .setMaxMappingErrorsPerPage(maxErrors)
        .setMaxConcurrentEntities(concurrency)
        .setRunDeadline(Duration.ofSeconds(deadlineSeconds))
        .build();
  }

  public Duration getWindowSize() {
    return windowSize;
  }

  public Duration getInitialLookback() {
    return initialLookback;
  }

  public EmptyWindowPolicy getEmptyWindowPolicy() {
    return emptyWindowPolicy;
  }

  /** Gets the number of mapping errors one page may have; one more aborts the entity. */
  public int getMaxMappingErrorsPerPage() {
    return maxMappingErrorsPerPage;
  }

  public int getMaxConcurrentEntities() {
    return maxConcurrentEntities;
  }

  public Duration getRunDeadline() {
    return runDeadline;
  }

  @Override
  public String toString() {
    return "SyncSettings [windowSize=" + windowSize + ", initialLookback=" + initialLookback
        + ", emptyWindowPolicy=" + emptyWindowPolicy + ", maxMappingErrorsPerPage="
        + maxMappingErrorsPerPage + ", maxConcurrentEntities=" + maxConcurrentEntities
        + ", runDeadline=" + runDeadline + "]";
  }

  /** Builder for {@link SyncSettings}, initialized with the defaults. */
  public static class Builder {
    private Duration windowSize = Duration.ofHours(DEFAULT_WINDOW_HOURS);
    private Duration initialLookback = Duration.ofDays(DEFAULT_INITIAL_LOOKBACK_DAYS);
    private EmptyWindowPolicy emptyWindowPolicy = EmptyWindowPolicy.HOLD;
    private int maxMappingErrorsPerPage = DEFAULT_MAX_MAPPING_ERRORS;
    private int maxConcurrentEntities = DEFAULT_MAX_CONCURRENT_ENTITIES;
    private Duration runDeadline = Duration.ofSeconds(DEFAULT_RUN_DEADLINE_SECONDS);

    public Builder setWindowSize(Duration windowSize) {
      this.windowSize = windowSize;
      return this;
    }

    public Builder setInitialLookback(Duration initialLookback) {
      this.initialLookback = initialLookback;
      return this;
    }

    public Builder setEmptyWindowPolicy(EmptyWindowPolicy emptyWindowPolicy) {
      this.emptyWindowPolicy = emptyWindowPolicy;
      return this;
    }

    public Builder setMaxMappingErrorsPerPage(int maxMappingErrorsPerPage) {
      this.maxMappingErrorsPerPage = maxMappingErrorsPerPage;
      return this;
    }

    public Builder setMaxConcurrentEntities(int maxConcurrentEntities) {
      this.maxConcurrentEntities = maxConcurrentEntities;
      return this;
    }

    public Builder setRunDeadline(Duration runDeadline) {
      this.runDeadline = runDeadline;
      return this;
    }

    public SyncSettings build() {
      checkNotNull(windowSize, "window size can not be null");
      checkArgument(!windowSize.isNegative() && !windowSize.isZero(),
          "window size must be positive");
      checkNotNull(initialLookback, "initial lookback can not be null");
      checkArgument(!initialLookback.isNegative(), "initial lookback can not be negative");
      checkNotNull(emptyWindowPolicy, "empty window policy can not be null");
      checkArgument(maxMappingErrorsPerPage >= 0, "mapping error limit can not be negative");
      checkArgument(maxConcurrentEntities > 0, "concurrency must be positive");
      checkNotNull(runDeadline, "run deadline can not be null");
      checkArgument(!runDeadline.isNegative() && !runDeadline.isZero(),
          "run deadline must be positive");
      return new SyncSettings(this);
    }
  }
}
