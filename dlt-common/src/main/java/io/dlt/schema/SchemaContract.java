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
 * Evolution modes for new tables, new columns and new data types (variant columns). A {@code null} mode
 * is unset and resolves to {@link SchemaEvolutionMode#EVOLVE}.
 */
public class SchemaContract implements Serializable {

  public static final SchemaContract DEFAULT =
      new SchemaContract(SchemaEvolutionMode.EVOLVE, SchemaEvolutionMode.EVOLVE, SchemaEvolutionMode.EVOLVE);

  private final SchemaEvolutionMode tables;
  private final SchemaEvolutionMode columns;
  private final SchemaEvolutionMode dataType;

  public SchemaContract(SchemaEvolutionMode tables, SchemaEvolutionMode columns, SchemaEvolutionMode dataType) {
    this.tables = tables;
    this.columns = columns;
    this.dataType = dataType;
  }

  /**
   * Same mode for all entities.
   */
  public static SchemaContract of(SchemaEvolutionMode mode) {
    return new SchemaContract(mode, mode, mode);
  }

  public SchemaEvolutionMode getTables() {
    return tables;
  }

  public SchemaEvolutionMode getColumns() {
    return columns;
  }

  public SchemaEvolutionMode getDataType() {
    return dataType;
  }

  public SchemaEvolutionMode getMode(ContractEntity entity) {
    switch (entity) {
      case TABLES:
        return tables;
      case COLUMNS:
        return columns;
      default:
        return dataType;
    }
  }

  /**
   * Replaces unset modes with {@code evolve}.
   */
  public SchemaContract withDefaults() {
    return new SchemaContract(
        tables == null ? SchemaEvolutionMode.EVOLVE : tables,
        columns == null ? SchemaEvolutionMode.EVOLVE : columns,
        dataType == null ? SchemaEvolutionMode.EVOLVE : dataType);
  }

  public boolean isAllEvolve() {
    return DEFAULT.equals(withDefaults());
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    SchemaContract that = (SchemaContract) o;
    return tables == that.tables && columns == that.columns && dataType == that.dataType;
  }

  @Override
  public int hashCode() {
    return Objects.hash(tables, columns, dataType);
  }

  @Override
  public String toString() {
    return "SchemaContract{tables=" + tables + ", columns=" + columns + ", data_type=" + dataType + '}';
  }
}
