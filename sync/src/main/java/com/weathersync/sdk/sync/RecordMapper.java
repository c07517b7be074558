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

import com.google.api.client.util.Data;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.weathersync.sdk.InvalidConfigurationException;
import com.weathersync.sdk.config.Configuration;
import java.math.BigDecimal;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Maps raw upstream records to typed {@link Row}s of an entity.
 *
 * <p>Source fields are looked up by their full name first, then as a dotted path through nested
 * objects. Coercions:
 *
 * <ul>
 *   <li>{@code STRING} - any scalar, by its string form
 *   <li>{@code LONG} - integral numbers and numeric strings without fraction
 *   <li>{@code DOUBLE} - numbers and numeric strings
 *   <li>{@code BOOLEAN} - booleans, {@code "true"}/{@code "false"}, {@code 1}/{@code 0}
 *   <li>{@code TIMESTAMP} - epoch seconds, ISO-8601 instants and offset date-times, configured
 *       patterns, and local date-times taken as UTC
 *   <li>{@code NAIVE_DATE} - ISO dates ({@code 2024-03-01}) and basic ISO dates
 *       ({@code 20240301})
 * </ul>
 *
 * <p>Blank strings count as missing for every type but {@code STRING}.
 */
public class RecordMapper {

  /** Semicolon separated {@link DateTimeFormatter} patterns tried for timestamps. */
  public static final String CONFIG_TIMESTAMP_PATTERNS = "sync.timestampPatterns";

  private static final Splitter PATH_SPLITTER = Splitter.on('.');
  private static final CharMatcher DIGITS = CharMatcher.inRange('0', '9');

  private final ImmutableList<DateTimeFormatter> timestampFormats;

  public RecordMapper() {
    this(ImmutableList.of());
  }

  /**
   * @param timestampPatterns extra timestamp patterns, tried after the ISO formats. Patterns
   *     without a zone are read as UTC.
   * @throws IllegalArgumentException for an invalid pattern
   */
  public RecordMapper(List<String> timestampPatterns) {
    ImmutableList.Builder<DateTimeFormatter> formats = ImmutableList.builder();
    formats.add(DateTimeFormatter.ISO_INSTANT, DateTimeFormatter.ISO_OFFSET_DATE_TIME);
    for (String pattern : checkNotNull(timestampPatterns)) {
      formats.add(DateTimeFormatter.ofPattern(pattern, Locale.ROOT).withZone(ZoneOffset.UTC));
    }
    formats.add(DateTimeFormatter.ISO_LOCAL_DATE_TIME.withZone(ZoneOffset.UTC));
    this.timestampFormats = formats.build();
  }

  public static RecordMapper fromConfiguration() {
    checkState(Configuration.isInitialized(), "config not initialized");
    List<String> patterns =
        Configuration.getMultiValue(
                CONFIG_TIMESTAMP_PATTERNS,
                Collections.emptyList(),
                Configuration.STRING_PARSER,
                ";")
            .get();
    try {
      return new RecordMapper(patterns);
    } catch (IllegalArgumentException e) {
      throw new InvalidConfigurationException(
          "Invalid timestamp pattern in " + CONFIG_TIMESTAMP_PATTERNS + ": " + patterns, e);
    }
  }

  /**
   * Maps one record.
   *
   * <p>A record whose delete marker is {@code true} maps to a {@link Row.Operation#DELETE} row
   * holding only the key and ordering columns.
   *
   * @throws MappingException if a required value is missing or a value can't be coerced
   */
  public Row map(Map<String, Object> record, EntityDescriptor entity) throws MappingException {
    checkNotNull(record, "record can not be null");
    checkNotNull(entity, "entity can not be null");
    boolean deleted = isDeleted(record, entity);
    Map<String, Object> values = new LinkedHashMap<>();
    for (ColumnSpec column : entity.getSchema().getColumns()) {
      boolean keyColumn = entity.isKeyColumn(column.getName());
      if (deleted && !keyColumn) {
        continue;
      }
      Object raw = resolve(record, column.getSourcePath());
      if (isMissing(raw, column.getType())) {
        if (keyColumn || !column.isNullable()) {
          throw new MappingException(column.getName(), "required value is missing");
        }
        values.put(column.getName(), null);
      } else {
        values.put(column.getName(), coerce(column, raw));
      }
    }
    List<Object> key = new ArrayList<>();
    entity.getPrimaryKey().forEach(c -> key.add(values.get(c)));
    Object ordering = values.get(entity.getOrderingColumn());
    return deleted ? Row.delete(key, values, ordering) : Row.upsert(key, values, ordering);
  }

  private boolean isDeleted(Map<String, Object> record, EntityDescriptor entity)
      throws MappingException {
    String marker = entity.getDeleteMarkerField();
    if (marker == null) {
      return false;
    }
    Object raw = resolve(record, marker);
    if (isMissing(raw, ColumnType.BOOLEAN)) {
      return false;
    }
    return toBoolean(marker, raw);
  }

  /**
   * Coerces a raw value to the type of {@code column}.
   *
   * @throws MappingException if the value can't be represented in the column type
   */
  public Object coerce(ColumnSpec column, Object raw) throws MappingException {
    checkNotNull(raw);
    String name = column.getName();
    switch (column.getType()) {
      case STRING:
        return raw.toString();
      case LONG:
        return toLong(name, raw);
      case DOUBLE:
        return toDouble(name, raw);
      case BOOLEAN:
        return toBoolean(name, raw);
      case TIMESTAMP:
        return toInstant(name, raw);
      case NAIVE_DATE:
        return toDate(name, raw);
      default:
        throw new AssertionError(column.getType());
    }
  }

  @VisibleForTesting
  static Object resolve(Map<String, Object> record, String path) {
    if (record.containsKey(path)) {
      return record.get(path);
    }
    Object current = record;
    for (String segment : PATH_SPLITTER.split(path)) {
      if (!(current instanceof Map)) {
        return null;
      }
      current = ((Map<?, ?>) current).get(segment);
    }
    return current;
  }

  private static boolean isMissing(Object raw, ColumnType type) {
    if (raw == null || Data.isNull(raw)) {
      return true;
    }
    return type != ColumnType.STRING && raw instanceof String && ((String) raw).trim().isEmpty();
  }

  private static long toLong(String column, Object raw) throws MappingException {
    try {
      if (raw instanceof Long || raw instanceof Integer || raw instanceof Short) {
        return ((Number) raw).longValue();
      }
      return toBigDecimal(column, raw).longValueExact();
    } catch (ArithmeticException e) {
      throw new MappingException(column, "not an integral value [" + raw + "]", e);
    }
  }

  private static double toDouble(String column, Object raw) throws MappingException {
    if (raw instanceof Number) {
      return ((Number) raw).doubleValue();
    }
    try {
      return Double.parseDouble(raw.toString().trim());
    } catch (NumberFormatException e) {
      throw new MappingException(column, "not a number [" + raw + "]", e);
    }
  }

  private static BigDecimal toBigDecimal(String column, Object raw) throws MappingException {
    if (raw instanceof BigDecimal) {
      return (BigDecimal) raw;
    }
    try {
      return new BigDecimal(raw.toString().trim());
    } catch (NumberFormatException e) {
      throw new MappingException(column, "not a number [" + raw + "]", e);
    }
  }

  private static boolean toBoolean(String column, Object raw) throws MappingException {
    if (raw instanceof Boolean) {
      return (Boolean) raw;
    }
    String value = raw.toString().trim();
    if ("true".equalsIgnoreCase(value) || "1".equals(value)) {
      return true;
    }
    if ("false".equalsIgnoreCase(value) || "0".equals(value)) {
      return false;
    }
    throw new MappingException(column, "not a boolean [" + raw + "]");
  }

  private Instant toInstant(String column, Object raw) throws MappingException {
    if (raw instanceof Number) {
      return epochSeconds(column, toBigDecimal(column, raw));
    }
    String value = raw.toString().trim();
    if (DIGITS.matchesAllOf(value)) {
      return epochSeconds(column, new BigDecimal(value));
    }
    DateTimeParseException failure = null;
    for (DateTimeFormatter format : timestampFormats) {
      try {
        return format.parse(value, Instant::from);
      } catch (DateTimeParseException e) {
        failure = e;
      }
    }
    throw new MappingException(column, "not a timestamp [" + raw + "]", failure);
  }

  private static Instant epochSeconds(String column, BigDecimal seconds)
      throws MappingException {
    try {
      return Instant.ofEpochSecond(seconds.longValueExact());
    } catch (ArithmeticException | DateTimeException e) {
      throw new MappingException(column, "not epoch seconds [" + seconds + "]", e);
    }
  }

  private static LocalDate toDate(String column, Object raw) throws MappingException {
    String value = raw.toString().trim();
    DateTimeFormatter format =
        DIGITS.matchesAllOf(value) ? DateTimeFormatter.BASIC_ISO_DATE : DateTimeFormatter.ISO_DATE;
    try {
      return LocalDate.parse(value, format);
    } catch (DateTimeParseException e) {
      throw new MappingException(column, "not a date [" + raw + "]", e);
    }
  }
}
