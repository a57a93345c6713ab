/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.dlt.schema;

import java.io.Serializable;
import java.util.Objects;

/**
 * Immutable definition of a table column.
 */
public class ColumnSchema implements Serializable {

  private final String name;
  private final DataType dataType;
  private final boolean nullable;
  private final Integer precision;
  private final Integer scale;
  private final boolean variant;

  public ColumnSchema(String name, DataType dataType, boolean nullable, Integer precision, Integer scale,
                      boolean variant) {
    this.name = name;
    this.dataType = dataType;
    this.nullable = nullable;
    this.precision = precision;
    this.scale = scale;
    this.variant = variant;
  }

  /**
   * Nullable column without hints.
   */
  public static ColumnSchema of(String name, DataType dataType) {
    return new ColumnSchema(name, dataType, true, null, null, false);
  }

  public String getName() {
    return name;
  }

  public DataType getDataType() {
    return dataType;
  }

  public boolean isNullable() {
    return nullable;
  }

  public Integer getPrecision() {
    return precision;
  }

  public Integer getScale() {
    return scale;
  }

  public boolean isVariant() {
    return variant;
  }

  public ColumnSchema withPrecision(Integer precision) {
    return new ColumnSchema(name, dataType, nullable, precision, scale, variant);
  }

  public ColumnSchema withPrecision(Integer precision, Integer scale) {
    return new ColumnSchema(name, dataType, nullable, precision, scale, variant);
  }

  public ColumnSchema withNullable(boolean nullable) {
    return new ColumnSchema(name, dataType, nullable, precision, scale, variant);
  }

  public ColumnSchema withVariant(boolean variant) {
    return new ColumnSchema(name, dataType, nullable, precision, scale, variant);
  }

  /**
   * Takes hints set on {@code other}, keeping the hints of this column that {@code other} leaves unset.
   */
  public ColumnSchema mergeHints(ColumnSchema other) {
    return new ColumnSchema(name, dataType, other.nullable,
        other.precision != null ? other.precision : precision,
        other.scale != null ? other.scale : scale,
        variant || other.variant);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    ColumnSchema that = (ColumnSchema) o;
    return nullable == that.nullable && variant == that.variant && Objects.equals(name, that.name)
        && dataType == that.dataType && Objects.equals(precision, that.precision) && Objects.equals(scale, that.scale);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, dataType, nullable, precision, scale, variant);
  }

  @Override
  public String toString() {
    return "ColumnSchema{name='" + name + '\'' + ", dataType=" + dataType + ", nullable=" + nullable
        + ", precision=" + precision + ", scale=" + scale + ", variant=" + variant + '}';
  }
}
