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

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Optional;

/** Ordered, named set of typed columns making up a sink table. */
public final class TableSchema {
  private final String name;
  private final ImmutableList<ColumnSpec> columns;
  private final ImmutableMap<String, ColumnSpec> columnsByName;

  public TableSchema(String name, List<ColumnSpec> columns) {
    checkArgument(!Strings.isNullOrEmpty(name), "table name can not be null or empty");
    checkNotNull(columns, "columns can not be null");
    checkArgument(!columns.isEmpty(), "table %s has no columns", name);
    this.name = name;
    this.columns = ImmutableList.copyOf(columns);
    ImmutableMap.Builder<String, ColumnSpec> byName = ImmutableMap.builder();
    columns.forEach(c -> byName.put(c.getName(), c));
    // fails on duplicate column names
    this.columnsByName = byName.build();
  }

  public String getName() {
    return name;
  }

  public ImmutableList<ColumnSpec> getColumns() {
    return columns;
  }

  public ImmutableList<String> getColumnNames() {
    return columns.stream().map(ColumnSpec::getName).collect(ImmutableList.toImmutableList());
  }

  public Optional<ColumnSpec> getColumn(String columnName) {
    return Optional.ofNullable(columnsByName.get(columnName));
  }

  @Override
  public String toString() {
    return "TableSchema [name=" + name + ", columns=" + getColumnNames() + "]";
  }
}
