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

import com.google.common.base.MoreObjects;
import com.google.common.base.Strings;
import java.util.Objects;

/** One column of a {@link TableSchema} and the source field it is read from. */
public final class ColumnSpec {
  private final String name;
  private final String sourcePath;
  private final ColumnType type;
  private final boolean nullable;

  private ColumnSpec(Builder builder) {
    this.name = builder.name;
    this.sourcePath = builder.sourcePath == null ? builder.name : builder.sourcePath;
    this.type = builder.type;
    this.nullable = builder.nullable;
  }

  /** Gets the sink column name. */
  public String getName() {
    return name;
  }

  /**
   * Gets the source field, dotted for nested objects ({@code main.temp}). Defaults to the column
   * name.
   */
  public String getSourcePath() {
    return sourcePath;
  }

  public ColumnType getType() {
    return type;
  }

  public boolean isNullable() {
    return nullable;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ColumnSpec)) {
      return false;
    }
    ColumnSpec other = (ColumnSpec) o;
    return nullable == other.nullable
        && name.equals(other.name)
        && sourcePath.equals(other.sourcePath)
        && type == other.type;
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, sourcePath, type, nullable);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("name", name)
        .add("sourcePath", sourcePath)
        .add("type", type)
        .add("nullable", nullable)
        .toString();
  }

  /** Builder for {@link ColumnSpec}. Columns are required unless marked nullable. */
  public static class Builder {
    private final String name;
    private final ColumnType type;
    private String sourcePath;
    private boolean nullable;

    public Builder(String name, ColumnType type) {
      this.name = name;
      this.type = type;
    }

    public Builder setSourcePath(String sourcePath) {
      this.sourcePath = sourcePath;
      return this;
    }

    public Builder setNullable(boolean nullable) {
      this.nullable = nullable;
      return this;
    }

    public ColumnSpec build() {
      checkArgument(!Strings.isNullOrEmpty(name), "column name can not be null or empty");
      checkNotNull(type, "column type can not be null");
      checkArgument(sourcePath == null || !sourcePath.trim().isEmpty(),
          "source path of %s can not be empty", name);
      return new ColumnSpec(this);
    }
  }
}
