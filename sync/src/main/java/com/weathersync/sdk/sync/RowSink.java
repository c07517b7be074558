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

/**
 * Destination of mapped rows.
 *
 * <p>A write applies all rows of a batch, upserts and deletes keyed by primary key, together with
 * its checkpoint record. It returns only once the batch is durable. Writing the same batch twice
 * must leave the same result as writing it once.
 */
public interface RowSink {

  /**
   * Persists one batch.
   *
   * @throws IOException if the batch was not, or not entirely, persisted
   */
  void write(SinkBatch batch) throws IOException;
}
