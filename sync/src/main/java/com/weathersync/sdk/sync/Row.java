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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.Joiner;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A mapped, typed record ready for the sink.
 *
 * <p>Values are keyed by column name in schema order and may hold {@code null} for nullable
 * columns. A {@link Operation#DELETE} row only carries its key and ordering columns.
 */
public final class Row {
  private static final Joiner KEY_JOINER = Joiner.on('|');

  /** Sink operation of a row. */
  public enum Operation {
    UPSERT,
    DELETE
  }

  private final Operation operation;
  private final ImmutableList<Object> key;
  private final Map<String, Object> values;
  private final Object orderingValue;

  private Row(Operation operation, List<Object> key, Map<String, Object> values,
      Object orderingValue) {
    this.operation = checkNotNull(operation);
    checkArgument(!checkNotNull(key, "key can not be null").isEmpty(), "key can not be empty");
    this.key = ImmutableList.copyOf(key);
    this.values = Collections.unmodifiableMap(new LinkedHashMap<>(checkNotNull(values)));
    this.orderingValue = checkNotNull(orderingValue, "ordering value can not be null");
  }

  public static Row upsert(List<Object> key, Map<String, Object> values, Object orderingValue) {
    return new Row(Operation.UPSERT, key, values, orderingValue);
  }

  public static Row delete(List<Object> key, Map<String, Object> values, Object orderingValue) {
    return new Row(Operation.DELETE, key, values, orderingValue);
  }

  public Operation getOperation() {
    return operation;
  }

  /** Gets the primary key values, in key column order. */
  public ImmutableList<Object> getKey() {
    return key;
  }

  /** Gets the key as one string, the identity of the row in sinks and batch tokens. */
  public String getKeyString() {
    return KEY_JOINER.join(key);
  }

  public Map<String, Object> getValues() {
    return values;
  }

  public Object getOrderingValue() {
    return orderingValue;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Row)) {
      return false;
    }
    Row other = (Row) o;
    return operation == other.operation
        && key.equals(other.key)
        && values.equals(other.values)
        && orderingValue.equals(other.orderingValue);
  }

  @Override
  public int hashCode() {
    return Objects.hash(operation, key, values, orderingValue);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("operation", operation)
        .add("key", key)
        .add("values", values)
        .toString();
  }
}
