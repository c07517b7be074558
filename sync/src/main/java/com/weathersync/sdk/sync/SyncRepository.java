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

import java.io.IOException;
import java.util.List;

/**
 * The upstream and downstream of an {@link IncrementalSyncConnector}.
 *
 * <p>A repository names the entities to sync, fetches their pages and stores their rows. The
 * connector owns the cursors, the windowing and the retries.
 */
public interface SyncRepository {

  /**
   * Initializes the repository from configuration, once, before any other method.
   *
   * @throws IOException if the upstream or the sink can not be set up
   */
  void init() throws IOException;

  /** Gets the entities to sync. Entity ids must be unique. */
  List<EntityDescriptor> getEntities();

  /**
   * Gets the fetcher of upstream pages. It is called from several threads, one entity per thread.
   */
  PageFetcher getPageFetcher();

  /** Gets the sink of the synced rows. It is called from several threads. */
  RowSink getRowSink();

  /** Releases the resources of the repository. */
  void close();
}
