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
import static java.net.HttpURLConnection.HTTP_CLIENT_TIMEOUT;
import static java.net.HttpURLConnection.HTTP_INTERNAL_ERROR;

import com.google.api.client.util.BackOff;
import com.google.api.client.util.ExponentialBackOff;
import com.google.api.client.util.Sleeper;
import com.weathersync.sdk.config.Configuration;

/**
 * Backoff and retry parameters for recoverable upstream failures.
 *
 * <p>Holds the retry ceiling (maximum number of attempts for one request, the first attempt
 * included) and the factory for the jittered exponential {@link BackOff} applied between
 * attempts.
 */
public class RetryPolicy {

  public static final String CONFIG_MAX_ATTEMPTS = "retry.maxAttempts";
  public static final String CONFIG_INITIAL_INTERVAL_MILLIS = "retry.initialIntervalMillis";
  public static final String CONFIG_MULTIPLIER = "retry.multiplier";
  public static final String CONFIG_MAX_INTERVAL_MILLIS = "retry.maxIntervalMillis";
  public static final String CONFIG_RANDOMIZATION_FACTOR = "retry.randomizationFactor";

  public static final int DEFAULT_MAX_ATTEMPTS = 5;
  public static final int DEFAULT_INITIAL_INTERVAL_MILLIS = 1000;
  public static final double DEFAULT_MULTIPLIER = 2.0;
  public static final int DEFAULT_MAX_INTERVAL_MILLIS = 60000;
  public static final double DEFAULT_RANDOMIZATION_FACTOR = 0.5;

  private static final int HTTP_TOO_MANY_REQUESTS = 429;

  private final int maxAttempts;
  private final BackOffFactory backOffFactory;
  private final Sleeper sleeper;

  private RetryPolicy(Builder builder) {
    this.maxAttempts = builder.maxAttempts;
    this.backOffFactory = builder.backOffFactory;
    this.sleeper = builder.sleeper;
  }

  /**
   * Creates a retry policy from the connector configuration.
   *
   * <ul>
   *   <li>{@value #CONFIG_MAX_ATTEMPTS} - attempts per request before giving up, default 5
   *   <li>{@value #CONFIG_INITIAL_INTERVAL_MILLIS} - first backoff, default 1000
   *   <li>{@value #CONFIG_MULTIPLIER} - growth of each backoff, default 2.0
   *   <li>{@value #CONFIG_MAX_INTERVAL_MILLIS} - cap of a single backoff, default 60000
   *   <li>{@value #CONFIG_RANDOMIZATION_FACTOR} - jitter, default 0.5
   * </ul>
   */
  public static RetryPolicy fromConfiguration() {
    checkState(Configuration.isInitialized(), "config not initialized");
    int initialInterval =
        Configuration.getInteger(CONFIG_INITIAL_INTERVAL_MILLIS, DEFAULT_INITIAL_INTERVAL_MILLIS)
            .get();
    double multiplier = Configuration.getDouble(CONFIG_MULTIPLIER, DEFAULT_MULTIPLIER).get();
    int maxInterval =
        Configuration.getInteger(CONFIG_MAX_INTERVAL_MILLIS, DEFAULT_MAX_INTERVAL_MILLIS).get();
    double randomization =
        Configuration.getDouble(CONFIG_RANDOMIZATION_FACTOR, DEFAULT_RANDOMIZATION_FACTOR).get();
    Configuration.checkConfiguration(initialInterval > 0,
        "%s must be positive", CONFIG_INITIAL_INTERVAL_MILLIS);
    Configuration.checkConfiguration(multiplier >= 1.0,
        "%s must be at least 1.0", CONFIG_MULTIPLIER);
    Configuration.checkConfiguration(maxInterval >= initialInterval,
        "%s must not be lower than %s", CONFIG_MAX_INTERVAL_MILLIS,
        CONFIG_INITIAL_INTERVAL_MILLIS);
    Configuration.checkConfiguration(randomization >= 0 && randomization < 1,
        "%s must be in [0, 1)", CONFIG_RANDOMIZATION_FACTOR);
    int maxAttempts = Configuration.getInteger(CONFIG_MAX_ATTEMPTS, DEFAULT_MAX_ATTEMPTS).get();
    Configuration.checkConfiguration(maxAttempts >= 1, "%s must be at least 1",
        CONFIG_MAX_ATTEMPTS);
    return new RetryPolicy.Builder()
        .setMaxAttempts(maxAttempts)
        .setBackOffFactory(
            new DefaultBackOffFactoryImpl(
                initialInterval, multiplier, maxInterval, randomization))
        .build();
  }

  /** Creates a fresh {@link BackOff} for each request that needs retrying. */
  public interface BackOffFactory {
    BackOff createBackOffInstance();
  }

  /** Factory of jittered {@link ExponentialBackOff} instances. */
  public static class DefaultBackOffFactoryImpl implements BackOffFactory {
    private final int initialIntervalMillis;
    private final double multiplier;
    private final int maxIntervalMillis;
    private final double randomizationFactor;

    public DefaultBackOffFactoryImpl() {
      this(DEFAULT_INITIAL_INTERVAL_MILLIS, DEFAULT_MULTIPLIER, DEFAULT_MAX_INTERVAL_MILLIS,
          DEFAULT_RANDOMIZATION_FACTOR);
    }

    public DefaultBackOffFactoryImpl(int initialIntervalMillis, double multiplier,
        int maxIntervalMillis, double randomizationFactor) {
      this.initialIntervalMillis = initialIntervalMillis;
      this.multiplier = multiplier;
      this.maxIntervalMillis = maxIntervalMillis;
      this.randomizationFactor = randomizationFactor;
    }

    @Override
    public BackOff createBackOffInstance() {
      // Elapsed time is bounded by the attempt ceiling and the run deadline instead.
      return new ExponentialBackOff.Builder()
          .setInitialIntervalMillis(initialIntervalMillis)
          .setMultiplier(multiplier)
          .setMaxIntervalMillis(maxIntervalMillis)
          .setRandomizationFactor(randomizationFactor)
          .setMaxElapsedTimeMillis(Integer.MAX_VALUE)
          .build();
    }
  }

  /** Builder for {@link RetryPolicy}. */
  public static final class Builder {
    private BackOffFactory backOffFactory = new DefaultBackOffFactoryImpl();
    private int maxAttempts = DEFAULT_MAX_ATTEMPTS;
    private Sleeper sleeper = Sleeper.DEFAULT;

    public Builder setMaxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
      return this;
    }

    public Builder setBackOffFactory(BackOffFactory factory) {
      this.backOffFactory = factory;
      return this;
    }

    /** Sets the {@link Sleeper} used to wait between attempts. Tests replace the default. */
    public Builder setSleeper(Sleeper sleeper) {
      this.sleeper = sleeper;
      return this;
    }

    public RetryPolicy build() {
      checkArgument(maxAttempts >= 1, "maxAttempts must be at least 1");
      checkNotNull(backOffFactory, "backOffFactory can not be null");
      checkNotNull(sleeper, "sleeper can not be null");
      return new RetryPolicy(this);
    }
  }

  /** Gets the maximum number of attempts for one request, the first attempt included. */
  public int getMaxAttempts() {
    return maxAttempts;
  }

  public BackOffFactory getBackOffFactory() {
    return backOffFactory;
  }

  public Sleeper getSleeper() {
    return sleeper;
  }

  /**
   * Checks whether an HTTP status denotes a recoverable failure: request timeout, rate limiting
   * or any server error.
   *
   * @param statusCode HTTP status of the failed response
   * @return {@code true} if the request may be retried
   */
  public boolean isRetryableStatusCode(int statusCode) {
    return statusCode == HTTP_CLIENT_TIMEOUT
        || statusCode == HTTP_TOO_MANY_REQUESTS
        || statusCode >= HTTP_INTERNAL_ERROR;
  }
}
