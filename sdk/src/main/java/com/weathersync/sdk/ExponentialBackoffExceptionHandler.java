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

import com.google.common.annotations.VisibleForTesting;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * {@link ExceptionHandler} that doubles its wait before each retry and gives up after
 * {@code maximumTries} failures.
 *
 * <p>The wait before retry {@code n} is {@code initialSleep * 2^(n - 1)}, capped at
 * {@code maxSleep}. Used for connector initialization and whole-run retries; page fetch retries
 * have their own backoff loop in the sync engine.
 */
public class ExponentialBackoffExceptionHandler implements ExceptionHandler {

  private final int maximumTries;
  private final long initialSleep;
  private final long maxSleep;
  private final TimeUnit sleepUnit;

  /**
   * @param maximumTries how many failures are tolerated before giving up
   * @param initialSleep wait before the first retry
   * @param sleepUnit time unit of the waits
   */
  public ExponentialBackoffExceptionHandler(
      int maximumTries, long initialSleep, TimeUnit sleepUnit) {
    this(maximumTries, initialSleep, Long.MAX_VALUE, sleepUnit);
  }

  /**
   * @param maximumTries how many failures are tolerated before giving up
   * @param initialSleep wait before the first retry
   * @param maxSleep upper bound for any single wait
   * @param sleepUnit time unit of the waits
   */
  public ExponentialBackoffExceptionHandler(
      int maximumTries, long initialSleep, long maxSleep, TimeUnit sleepUnit) {
    checkArgument(maximumTries >= 0, "maximumTries can not be negative");
    checkArgument(initialSleep >= 0 && maxSleep >= initialSleep,
        "invalid sleep bounds [%s, %s]", initialSleep, maxSleep);
    this.maximumTries = maximumTries;
    this.initialSleep = initialSleep;
    this.maxSleep = maxSleep;
    this.sleepUnit = checkNotNull(sleepUnit);
  }

  @Override
  public boolean handleException(Exception ex, int ntries) throws InterruptedException {
    if (ntries > maximumTries) {
      return false;
    }
    sleepUnit.sleep(sleepFor(ntries));
    return true;
  }

  @VisibleForTesting
  long sleepFor(int ntries) {
    int shift = Math.min(Math.max(ntries - 1, 0), 62);
    long multiplier = 1L << shift;
    if (initialSleep != 0 && multiplier > maxSleep / initialSleep) {
      return maxSleep;
    }
    return Math.min(initialSleep * multiplier, maxSleep);
  }

  @Override
  public int hashCode() {
    return Objects.hash(maximumTries, initialSleep, maxSleep, sleepUnit);
  }

  @Override
  public boolean equals(Object obj) {
    if (obj == this) {
      return true;
    }
    if (!(obj instanceof ExponentialBackoffExceptionHandler)) {
      return false;
    }
    ExponentialBackoffExceptionHandler other = (ExponentialBackoffExceptionHandler) obj;
    return maximumTries == other.maximumTries
        && initialSleep == other.initialSleep
        && maxSleep == other.maxSleep
        && Objects.equals(sleepUnit, other.sleepUnit);
  }
}
