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
import java.util.Objects;
import javax.annotation.Nullable;

/**
 * Durable position of an entity's sync progress.
 *
 * <p>The position is the canonical string of the last committed ordering value; the batch token
 * identifies the batch that committed it. The initial cursor has neither.
 */
public final class Cursor {
  private static final Cursor INITIAL = new Cursor(null, null);

  @Nullable private final String position;
  @Nullable private final String batchToken;

  private Cursor(@Nullable String position, @Nullable String batchToken) {
    this.position = position;
    this.batchToken = batchToken;
  }

  /** Returns the cursor of an entity that was never synced. */
  public static Cursor initial() {
    return INITIAL;
  }

  public static Cursor of(String position, @Nullable String batchToken) {
    return new Cursor(checkNotNull(position, "position can not be null"), batchToken);
  }

  public boolean isInitial() {
    return position == null;
  }

  @Nullable
  public String getPosition() {
    return position;
  }

  @Nullable
  public String getBatchToken() {
    return batchToken;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Cursor)) {
      return false;
    }
    Cursor other = (Cursor) o;
    return Objects.equals(position, other.position)
        && Objects.equals(batchToken, other.batchToken);
  }

  @Override
  public int hashCode() {
    return Objects.hash(position, batchToken);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("position", position)
        .add("batchToken", batchToken)
        .toString();
  }
}
