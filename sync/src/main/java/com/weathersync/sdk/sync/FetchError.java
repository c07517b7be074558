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

import java.time.Duration;
import java.util.Optional;
import javax.annotation.Nullable;

/** A classified fetch failure. */
public final class FetchError {

  /** Whether retrying the same request can succeed. */
  public enum Kind {
    /** Network timeout, server error, request timeout or rate limiting. */
    TRANSIENT,
    /** Authentication, validation, malformed request or payload. */
    FATAL
  }

  private final Kind kind;
  private final String message;
  @Nullable private final Duration retryAfter;
  @Nullable private final Throwable cause;

  private FetchError(Kind kind, String message, @Nullable Duration retryAfter,
      @Nullable Throwable cause) {
    this.kind = checkNotNull(kind);
    this.message = checkNotNull(message, "message can not be null");
    checkArgument(retryAfter == null || !retryAfter.isNegative(), "negative retry delay");
    this.retryAfter = retryAfter;
    this.cause = cause;
  }

  public static FetchError transientError(String message, @Nullable Throwable cause) {
    return new FetchError(Kind.TRANSIENT, message, null, cause);
  }

  /** Creates a transient error with a server-requested delay before the next attempt. */
  public static FetchError transientError(String message, Duration retryAfter,
      @Nullable Throwable cause) {
    return new FetchError(Kind.TRANSIENT, message, checkNotNull(retryAfter), cause);
  }

  public static FetchError fatal(String message, @Nullable Throwable cause) {
    return new FetchError(Kind.FATAL, message, null, cause);
  }

  public Kind getKind() {
    return kind;
  }

  public boolean isTransient() {
    return kind == Kind.TRANSIENT;
  }

  public String getMessage() {
    return message;
  }

  public Optional<Duration> getRetryAfter() {
    return Optional.ofNullable(retryAfter);
  }

  @Nullable
  public Throwable getCause() {
    return cause;
  }

  @Override
  public String toString() {
    return kind + ": " + message + (retryAfter == null ? "" : " (retry after " + retryAfter + ")");
  }
}
