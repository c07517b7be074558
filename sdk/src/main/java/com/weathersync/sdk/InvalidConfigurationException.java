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

/**
 * Thrown for a missing or malformed configuration value.
 *
 * <p>Invalid configuration is never retried: the connector exits at startup.
 */
public class InvalidConfigurationException extends StartupException {

  public InvalidConfigurationException() {
    super();
  }

  /**
   * @param message the message, retrievable using the {@link #getMessage()} method
   */
  public InvalidConfigurationException(String message) {
    super(message);
  }

  /**
   * @param message the message, retrievable using the {@link #getMessage()} method
   * @param cause failure cause
   */
  public InvalidConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }

  public InvalidConfigurationException(Throwable cause) {
    super(cause);
  }
}
