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

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.concurrent.TimeUnit;

/** Default {@link ConnectorContext}. */
class ConnectorContextImpl implements ConnectorContext {
  // A failed run is not retried immediately; the next scheduled run resumes from its cursors.
  private static final ExceptionHandler DEFAULT_TRAVERSAL_HANDLER =
      new ExponentialBackoffExceptionHandler(0, 0, TimeUnit.SECONDS);

  private final ExceptionHandler traversalExceptionHandler;

  private ConnectorContextImpl(Builder builder) {
    this.traversalExceptionHandler = builder.traversalExceptionHandler;
  }

  @Override
  public ExceptionHandler getTraversalExceptionHandler() {
    return traversalExceptionHandler;
  }

  static class Builder {
    private ExceptionHandler traversalExceptionHandler = DEFAULT_TRAVERSAL_HANDLER;

    Builder setTraversalExceptionHandler(ExceptionHandler handler) {
      this.traversalExceptionHandler = handler;
      return this;
    }

    ConnectorContext build() {
      checkNotNull(traversalExceptionHandler, "traversal exception handler can not be null");
      return new ConnectorContextImpl(this);
    }
  }
}
