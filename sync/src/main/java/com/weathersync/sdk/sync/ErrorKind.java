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

/** Why the sync of an entity failed. */
public enum ErrorKind {
  /** The upstream refused a request, or transient failures outlasted the retry ceiling. */
  FATAL_FETCH,
  /** More records of one page failed mapping than allowed. */
  MAPPING_THRESHOLD,
  /** The sink write or the cursor commit failed. */
  COMMIT,
  /** The run was cancelled or hit its deadline. */
  CANCELLED,
  /** Anything else. */
  INTERNAL
}
