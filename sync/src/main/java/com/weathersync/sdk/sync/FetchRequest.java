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

import com.google.common.base.MoreObjects;
import java.time.Instant;
import java.util.Objects;
import javax.annotation.Nullable;

/**
 * Request for one page of an entity.
 *
 * <p>The window bounds are both inclusive: a fetcher returns records with
 * {@code windowStart <= ordering <= windowEnd}, ascending by ordering value where the upstream
 * allows it.
 */
public final class FetchRequest {
  private final String entityId;
  private final Cursor cursor;
  @Nullable private final String pageToken;
  private final Instant windowStart;
  private final Instant windowEnd;
  private final int pageNumber;

  private FetchRequest(Builder builder) {
    this.entityId = builder.entityId;
    this.cursor = builder.cursor;
    this.pageToken = builder.pageToken;
    this.windowStart = builder.windowStart;
    this.windowEnd = builder.windowEnd;
    this.pageNumber = builder.pageNumber;
  }

  public String getEntityId() {
    return entityId;
  }

  /** Gets the committed cursor the run started from. */
  public Cursor getCursor() {
    return cursor;
  }

  /** Gets the continuation token, {@code null} for the first page of a window. */
  @Nullable
  public String getPageToken() {
    return pageToken;
  }

  public Instant getWindowStart() {
    return windowStart;
  }

  public Instant getWindowEnd() {
    return windowEnd;
  }

  /** Gets the 1-based page number within the window. */
  public int getPageNumber() {
    return pageNumber;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof FetchRequest)) {
      return false;
    }
    FetchRequest other = (FetchRequest) o;
    return pageNumber == other.pageNumber
        && entityId.equals(other.entityId)
        && cursor.equals(other.cursor)
        && Objects.equals(pageToken, other.pageToken)
        && windowStart.equals(other.windowStart)
        && windowEnd.equals(other.windowEnd);
  }

  @Override
  public int hashCode() {
    return Objects.hash(entityId, cursor, pageToken, windowStart, windowEnd, pageNumber);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("entityId", entityId)
        .add("window", "[" + windowStart + ", " + windowEnd + "]")
        .add("pageNumber", pageNumber)
        .add("pageToken", pageToken)
        .toString();
  }

  /** Builder for {@link FetchRequest}. */
  public static class Builder {
    private String entityId;
    private Cursor cursor = Cursor.initial();
    private String pageToken;
    private Instant windowStart;
    private Instant windowEnd;
    private int pageNumber = 1;

    public Builder setEntityId(String entityId) {
      this.entityId = entityId;
      return this;
    }

    public Builder setCursor(Cursor cursor) {
      this.cursor = cursor;
      return this;
    }

    public Builder setPageToken(@Nullable String pageToken) {
      this.pageToken = pageToken;
      return this;
    }

    public Builder setWindow(Instant windowStart, Instant windowEnd) {
      this.windowStart = windowStart;
      this.windowEnd = windowEnd;
      return this;
    }

    public Builder setPageNumber(int pageNumber) {
      this.pageNumber = pageNumber;
      return this;
    }

    public FetchRequest build() {
      checkNotNull(entityId, "entity id can not be null");
      checkNotNull(cursor, "cursor can not be null");
      checkNotNull(windowStart, "window start can not be null");
      checkNotNull(windowEnd, "window end can not be null");
      checkArgument(!windowEnd.isBefore(windowStart),
          "window end %s before window start %s", windowEnd, windowStart);
      checkArgument(pageNumber >= 1, "page number must be positive");
      return new FetchRequest(this);
    }
  }
}
