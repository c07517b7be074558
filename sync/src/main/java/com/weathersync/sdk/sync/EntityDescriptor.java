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

import com.google.common.base.CharMatcher;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import java.util.List;
import javax.annotation.Nullable;

/**
 * One independently synced logical resource, for example the hourly observations of one
 * location.
 *
 * <p>The identifier is limited to letters, digits, {@code '.'}, {@code '_'} and {@code '-'} so that
 * it can name files of local stores and sinks.
 */
public final class EntityDescriptor {
  private static final CharMatcher ID_CHARS =
      CharMatcher.inRange('a', 'z')
          .or(CharMatcher.inRange('A', 'Z'))
          .or(CharMatcher.inRange('0', '9'))
          .or(CharMatcher.anyOf("._-"));

  private final String id;
  private final TableSchema schema;
  private final ImmutableList<String> primaryKey;
  private final String orderingColumn;
  @Nullable private final String deleteMarkerField;

  private EntityDescriptor(Builder builder) {
    this.id = builder.id;
    this.schema = builder.schema;
    this.primaryKey = ImmutableList.copyOf(builder.primaryKey);
    this.orderingColumn = builder.orderingColumn;
    this.deleteMarkerField = builder.deleteMarkerField;
  }

  public String getId() {
    return id;
  }

  public TableSchema getSchema() {
    return schema;
  }

  /** Gets the primary key column names, in key order. */
  public ImmutableList<String> getPrimaryKey() {
    return primaryKey;
  }

  /** Gets the column whose values drive the cursor. */
  public String getOrderingColumn() {
    return orderingColumn;
  }

  public ColumnType getOrderingType() {
    return schema.getColumn(orderingColumn).get().getType();
  }

  /**
   * Gets the source field which marks a record as deleted when {@code true}, or {@code null} if
   * the upstream never reports deletions.
   */
  @Nullable
  public String getDeleteMarkerField() {
    return deleteMarkerField;
  }

  /** Whether a column is part of the primary key or is the ordering column. */
  public boolean isKeyColumn(String columnName) {
    return primaryKey.contains(columnName) || orderingColumn.equals(columnName);
  }

  @Override
  public String toString() {
    return "EntityDescriptor [id=" + id + ", table=" + schema.getName() + "]";
  }

  /** Builder for {@link EntityDescriptor}. */
  public static class Builder {
    private String id;
    private TableSchema schema;
    private List<String> primaryKey = ImmutableList.of();
    private String orderingColumn;
    private String deleteMarkerField;

    public Builder setId(String id) {
      this.id = id;
      return this;
    }

    public Builder setSchema(TableSchema schema) {
      this.schema = schema;
      return this;
    }

    public Builder setPrimaryKey(List<String> primaryKey) {
      this.primaryKey = primaryKey;
      return this;
    }

    public Builder setOrderingColumn(String orderingColumn) {
      this.orderingColumn = orderingColumn;
      return this;
    }

    public Builder setDeleteMarkerField(String deleteMarkerField) {
      this.deleteMarkerField = deleteMarkerField;
      return this;
    }

    public EntityDescriptor build() {
      checkArgument(!Strings.isNullOrEmpty(id), "entity id can not be null or empty");
      checkArgument(ID_CHARS.matchesAllOf(id), "invalid characters in entity id [%s]", id);
      checkNotNull(schema, "schema can not be null");
      checkNotNull(primaryKey, "primary key can not be null");
      checkArgument(!primaryKey.isEmpty(), "entity %s has no primary key", id);
      for (String column : primaryKey) {
        checkArgument(schema.getColumn(column).isPresent(),
            "primary key column %s not in table %s", column, schema.getName());
      }
      checkArgument(!Strings.isNullOrEmpty(orderingColumn), "ordering column can not be empty");
      ColumnSpec ordering = schema.getColumn(orderingColumn).orElseThrow(
          () -> new IllegalArgumentException(
              "ordering column " + orderingColumn + " not in table " + schema.getName()));
      checkArgument(ordering.getType().isTemporal(),
          "ordering column %s must be TIMESTAMP or NAIVE_DATE, not %s",
          orderingColumn, ordering.getType());
      return new EntityDescriptor(this);
    }
  }
}
