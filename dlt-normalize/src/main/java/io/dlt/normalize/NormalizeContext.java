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

package io.dlt.normalize;

import io.dlt.schema.ColumnSchema;
import io.dlt.schema.SchemaContract;
import io.dlt.schema.SchemaEvolutionMode;

import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Per file state of a normalizer: contract decisions taken so far, resolved contracts and the column
 * schemas used by the writers. Not shared between files.
 */
public class NormalizeContext {

  private final Set<String> filteredTables = new HashSet<>();
  private final Map<String, Map<String, SchemaEvolutionMode>> filteredColumns = new HashMap<>();
  private final Map<String, Map<String, ColumnSchema>> columnSchemas = new HashMap<>();
  private final Map<String, SchemaContract> tableContracts = new HashMap<>();

  public boolean isTableFiltered(String tableName) {
    return filteredTables.contains(tableName);
  }

  public void filterTable(String tableName) {
    filteredTables.add(tableName);
  }

  /**
   * @return column modes of the table, {@code null} if no column of the table is filtered
   */
  public Map<String, SchemaEvolutionMode> getFilteredColumns(String tableName) {
    return filteredColumns.get(tableName);
  }

  public void filterColumn(String tableName, String columnName, SchemaEvolutionMode mode) {
    filteredColumns.computeIfAbsent(tableName, k -> new LinkedHashMap<>()).put(columnName, mode);
  }

  public Map<String, ColumnSchema> getColumnSchema(String tableName) {
    return columnSchemas.get(tableName);
  }

  public void putColumnSchema(String tableName, Map<String, ColumnSchema> columns) {
    columnSchemas.put(tableName, columns);
  }

  public SchemaContract getTableContract(String tableName) {
    return tableContracts.get(tableName);
  }

  public void putTableContract(String tableName, SchemaContract contract) {
    tableContracts.put(tableName, contract);
  }
}
