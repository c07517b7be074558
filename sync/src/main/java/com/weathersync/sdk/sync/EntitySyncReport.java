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

import com.google.common.base.MoreObjects;
import javax.annotation.Nullable;

/**
 * Outcome of syncing one entity in one run.
 *
 * <p>A failed sync carries its {@link ErrorKind}, a message and the last cursor known to be
 * committed; the next run resumes from there.
 */
public final class EntitySyncReport {
  private final String entityId;
  @Nullable private final ErrorKind errorKind;
  @Nullable private final String message;
  @Nullable private final Cursor lastGoodCursor;
  private final int pagesFetched;
  private final int rowsEmitted;
  private final int mappingErrors;

  private EntitySyncReport(Builder builder) {
    this.entityId = checkNotNull(builder.entityId);
    this.errorKind = builder.errorKind;
    this.message = builder.message;
    this.lastGoodCursor = builder.lastGoodCursor;
    this.pagesFetched = builder.pagesFetched;
    this.rowsEmitted = builder.rowsEmitted;
    this.mappingErrors = builder.mappingErrors;
  }

  public String getEntityId() {
    return entityId;
  }

  public boolean isSuccess() {
    return errorKind == null;
  }

  /** Gets the failure kind, {@code null} on success. */
  @Nullable
  public ErrorKind getErrorKind() {
    return errorKind;
  }

  @Nullable
  public String getMessage() {
    return message;
  }

  /** Gets the committed cursor after the run, {@code null} if it could not be determined. */
  @Nullable
  public Cursor getLastGoodCursor() {
    return lastGoodCursor;
  }

  public int getPagesFetched() {
    return pagesFetched;
  }

  /** Gets the rows handed to the emitter, committed or not. */
  public int getRowsEmitted() {
    return rowsEmitted;
  }

  public int getMappingErrors() {
    return mappingErrors;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .omitNullValues()
        .add("entityId", entityId)
        .add("errorKind", errorKind)
        .add("message", message)
        .add("lastGoodCursor", lastGoodCursor == null ? null : lastGoodCursor.getPosition())
        .add("pagesFetched", pagesFetched)
        .add("rowsEmitted", rowsEmitted)
        .add("mappingErrors", mappingErrors)
        .toString();
  }

  static class Builder {
    private final String entityId;
    private ErrorKind errorKind;
    private String message;
    private Cursor lastGoodCursor;
    private int pagesFetched;
    private int rowsEmitted;
    private int mappingErrors;

    Builder(String entityId) {
      this.entityId = entityId;
    }

    Builder setFailure(ErrorKind errorKind, String message) {
      this.errorKind = checkNotNull(errorKind);
      this.message = message;
      return this;
    }

    Builder setLastGoodCursor(@Nullable Cursor lastGoodCursor) {
      this.lastGoodCursor = lastGoodCursor;
      return this;
    }

    Builder setCounts(int pagesFetched, int rowsEmitted, int mappingErrors) {
      this.pagesFetched = pagesFetched;
      this.rowsEmitted = rowsEmitted;
      this.mappingErrors = mappingErrors;
      return this;
    }

    EntitySyncReport build() {
      return new EntitySyncReport(this);
    }
  }
}
