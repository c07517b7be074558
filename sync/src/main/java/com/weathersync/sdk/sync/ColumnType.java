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

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

/**
 * Type of a sink column.
 *
 * <p>Every coerced value has a canonical string form ({@link #toCanonical}) used for cursor
 * positions, batch tokens and text sinks. {@link #fromCanonical} reverses it.
 */
public enum ColumnType {
  STRING,
  LONG,
  DOUBLE,
  BOOLEAN,
  /** An instant on the UTC time line, held as {@link Instant}. */
  TIMESTAMP,
  /** A calendar date without zone, held as {@link LocalDate}. */
  NAIVE_DATE;

  /** Whether values of this type map onto the time line, a requirement for ordering columns. */
  public boolean isTemporal() {
    return this == TIMESTAMP || this == NAIVE_DATE;
  }

  public String toCanonical(Object value) {
    checkNotNull(value, "value can not be null");
    return value.toString();
  }

  /**
   * Parses a canonical string back to a value of this type.
   *
   * @throws IllegalArgumentException if {@code canonical} is not a valid value
   */
  public Object fromCanonical(String canonical) {
    checkNotNull(canonical, "canonical value can not be null");
    try {
      switch (this) {
        case STRING:
          return canonical;
        case LONG:
          return Long.parseLong(canonical);
        case DOUBLE:
          return Double.parseDouble(canonical);
        case BOOLEAN:
          return Boolean.parseBoolean(canonical);
        case TIMESTAMP:
          return Instant.parse(canonical);
        case NAIVE_DATE:
          return LocalDate.parse(canonical);
        default:
          throw new AssertionError(this);
      }
    } catch (RuntimeException e) {
      throw new IllegalArgumentException(
          String.format("Invalid %s value [%s]", this, canonical), e);
    }
  }

  /** Compares two values of this type. */
  @SuppressWarnings("unchecked")
  public int compare(Object left, Object right) {
    return ((Comparable<Object>) checkNotNull(left)).compareTo(checkNotNull(right));
  }

  /** Compares two canonical strings by value, not lexically. */
  public int compareCanonical(String left, String right) {
    return compare(fromCanonical(left), fromCanonical(right));
  }

  /** Maps a temporal value onto the time line. Dates map to their start of day in UTC. */
  public Instant toInstant(Object value) {
    checkState(isTemporal(), "%s is not a temporal type", this);
    if (this == TIMESTAMP) {
      return (Instant) value;
    }
    return ((LocalDate) value).atStartOfDay(ZoneOffset.UTC).toInstant();
  }

  /** Converts an instant to a value of this temporal type. */
  public Object fromInstant(Instant instant) {
    checkState(isTemporal(), "%s is not a temporal type", this);
    checkNotNull(instant);
    if (this == TIMESTAMP) {
      return instant;
    }
    return instant.atZone(ZoneOffset.UTC).toLocalDate();
  }
}
