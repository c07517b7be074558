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
package com.weathersync.sdk;

import java.io.IOException;

/**
 * A connector driven by {@link Application} and {@link ConnectorScheduler}.
 *
 * <p>Implementations must be thread-safe. Sync progress belongs in a durable store, not in
 * connector fields.
 */
public interface Connector {

  /**
   * Initializes the connector.
   *
   * <p>Throw {@link StartupException} for unrecoverable errors. Other exceptions cause a retry of
   * initialization after a back off.
   *
   * @param context {@link ConnectorContext} instance for accessing framework objects
   * @throws Exception if errors occur during connector initialization
   */
  void init(ConnectorContext context) throws Exception;

  /**
   * Performs one sync run.
   *
   * <p>In the case of an error, the {@link ExceptionHandler} from {@link ConnectorContext}
   * determines if and when to retry.
   *
   * @throws IOException if the run fails as a whole
   * @throws InterruptedException if the run is interrupted
   */
  void traverse() throws IOException, InterruptedException;

  /** Shuts down and releases connector resources. */
  void destroy();

  /** Gets the default connector ID. */
  default String getDefaultId() {
    return getClass().getName();
  }
}
