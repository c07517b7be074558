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

/**
 * Fetches one page of an entity from the upstream.
 *
 * <p>Classified failures are returned as {@link FetchError}, never thrown. Implementations must
 * be safe for concurrent use by different entities.
 */
public interface PageFetcher {

  /**
   * Fetches the page described by {@code request}.
   *
   * @throws InterruptedException if the calling sync task is cancelled
   */
  FetchResult fetch(FetchRequest request) throws InterruptedException;
}
