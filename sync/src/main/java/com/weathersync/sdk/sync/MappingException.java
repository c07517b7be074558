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

/** A raw record could not be mapped to a row. The record is skipped and counted. */
public class MappingException extends Exception {
  private static final long serialVersionUID = 1L;

  private final String column;

  public MappingException(String column, String message) {
    super(column + ": " + message);
    this.column = column;
  }

  public MappingException(String column, String message, Throwable cause) {
    super(column + ": " + message, cause);
    this.column = column;
  }

  /** Gets the column whose value failed. */
  public String getColumn() {
    return column;
  }
}
