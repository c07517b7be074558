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
import static com.google.common.base.Preconditions.checkState;

/** Either a {@link Page} or a {@link FetchError}. */
public final class FetchResult {
  private final Page page;
  private final FetchError error;

  private FetchResult(Page page, FetchError error) {
    this.page = page;
    this.error = error;
  }

  public static FetchResult of(Page page) {
    return new FetchResult(checkNotNull(page), null);
  }

  public static FetchResult error(FetchError error) {
    return new FetchResult(null, checkNotNull(error));
  }

  public boolean isError() {
    return error != null;
  }

  public Page getPage() {
    checkState(page != null, "fetch failed: %s", error);
    return page;
  }

  public FetchError getError() {
    checkState(error != null, "fetch succeeded");
    return error;
  }

  @Override
  public String toString() {
    return isError() ? "FetchResult [" + error + "]" : "FetchResult [" + page + "]";
  }
}
