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

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;

/**
 * One fetch response: an ordered batch of raw records, the continuation token and an optional
 * upstream watermark.
 *
 * <p>An absent continuation token ends the stream for the current window.
 */
public final class Page {
  private final ImmutableList<Map<String, Object>> records;
  @Nullable private final String nextPageToken;
  @Nullable private final String watermark;

  public Page(List<Map<String, Object>> records, @Nullable String nextPageToken,
      @Nullable String watermark) {
    this.records = ImmutableList.copyOf(checkNotNull(records, "records can not be null"));
    this.nextPageToken = emptyToNull(nextPageToken);
    this.watermark = emptyToNull(watermark);
  }

  public static Page last(List<Map<String, Object>> records) {
    return new Page(records, null, null);
  }

  public ImmutableList<Map<String, Object>> getRecords() {
    return records;
  }

  @Nullable
  public String getNextPageToken() {
    return nextPageToken;
  }

  /**
   * Gets the upstream's statement that no record below this ordering value is still to come, or
   * {@code null}.
   */
  @Nullable
  public String getWatermark() {
    return watermark;
  }

  private static String emptyToNull(String value) {
    return (value == null || value.isEmpty()) ? null : value;
  }

  @Override
  public String toString() {
    return "Page [records=" + records.size() + ", nextPageToken=" + nextPageToken
        + ", watermark=" + watermark + "]";
  }
}
