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
package com.weathersync.weatherconnector;

import com.weathersync.sdk.Application;
import com.weathersync.sdk.sync.IncrementalSyncConnector;

/**
 * Connector syncing hourly weather observations into local CSV tables.
 *
 * <p>Usage:
 *
 * <pre>
 *   java -jar weathersync-weather-connector.jar -Dconfig=connector-config.properties
 * </pre>
 *
 * <p>See {@link WeatherRepository} for the connector specific configuration.
 */
public class WeatherConnector {

  /**
   * Main entry point of the connector.
   *
   * @param args program command line arguments
   * @throws InterruptedException thrown if an abort is issued during initialization
   */
  public static void main(String[] args) throws InterruptedException {
    Application application =
        new Application.Builder(new IncrementalSyncConnector(new WeatherRepository()), args)
            .build();
    application.start();
  }
}
