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

import io.dlt.exception.CannotCoerceColumnException;
import io.dlt.exception.CannotCoerceNullException;
import io.dlt.exception.DataValidationException;
import io.dlt.exception.ParentTableNotFoundException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Versioned collection of tables. Rows are coerced into the tables and the tables evolve with the
 * partial updates that coercion produces, subject to the schema contracts.
 *
 * <p>A schema is mutable and not thread safe. Callers normalizing several files against one schema
 * must serialize access.
 */
public class Schema {

  private static final Logger LOG = LoggerFactory.getLogger(Schema.class);

  public static final String DLT_PREFIX = "_dlt";
  public static final String LOAD_ID_COLUMN = "_dlt_load_id";
  public static final String ID_COLUMN = "_dlt_id";
  public static final String PARENT_ID_COLUMN = "_dlt_parent_id";
  public static final String ROOT_ID_COLUMN = "_dlt_root_id";
  public static final String LIST_IDX_COLUMN = "_dlt_list_idx";

  private final String name;
  private final NamingConvention naming;
  private final LinkedHashMap<String, TableSchema> tables = new LinkedHashMap<>();
  private final Map<String, Pattern> compiledFilters = new HashMap<>();
  private SchemaContract schemaContract;
  private int version;

  public Schema(String name, NamingConvention naming) {
    this.name = name;
    this.naming = naming;
  }

  public Schema(String name) {
    this(name, new SnakeCaseNamingConvention());
  }

  public String getName() {
    return name;
  }

  public int getVersion() {
    return version;
  }

  public NamingConvention getNaming() {
    return naming;
  }

  /**
   * @return schema level contract or {@code null} if not set
   */
  public SchemaContract getSchemaContract() {
    return schemaContract;
  }

  public void setSchemaContract(SchemaContract schemaContract) {
    this.schemaContract = schemaContract;
  }

  public Map<String, TableSchema> getTables() {
    return Collections.unmodifiableMap(tables);
  }

  public TableSchema getTable(String tableName) {
    return tables.get(tableName);
  }

  public boolean hasTable(String tableName) {
    return tables.containsKey(tableName);
  }

  /**
   * Whether the table exists and ever received data.
   */
  public boolean hasTableSeenData(String tableName) {
    TableSchema table = tables.get(tableName);
    return table != null && table.isSeenData();
  }

  /**
   * Ordered copy of the table columns, empty for unknown tables.
   */
  public Map<String, ColumnSchema> getTableColumns(String tableName) {
    TableSchema table = tables.get(tableName);
    return table == null ? new LinkedHashMap<>() : new LinkedHashMap<>(table.getColumns());
  }

  /**
   * Top most existing ancestor of a table, the table itself for root tables, {@code null} for unknown tables.
   */
  public TableSchema getRootTable(String tableName) {
    TableSchema table = tables.get(tableName);
    while (table != null && table.getParent() != null && tables.containsKey(table.getParent())) {
      table = tables.get(table.getParent());
    }
    return table;
  }

  /**
   * Write disposition set on the root table of {@code tableName}, {@code append} when not set.
   */
  public WriteDisposition getWriteDisposition(String tableName) {
    TableSchema root = getRootTable(tableName);
    if (root == null || root.getWriteDisposition() == null) {
      return WriteDisposition.APPEND;
    }
    return root.getWriteDisposition();
  }

  /**
   * Removes the fields excluded by the column filters of the table or of its ancestors. A field is
   * excluded when its path, relative to the table declaring the filter, matches an exclude and no include.
   * The row is modified in place.
   */
  public DataRow filterRow(String tableName, DataRow row) {
    for (TableSchema filterTable : tables.values()) {
      if (filterTable.getExcludes().isEmpty()) {
        continue;
      }
      String relativePath;
      if (tableName.equals(filterTable.getName())) {
        relativePath = "";
      } else if (tableName.startsWith(filterTable.getName() + naming.getPathSeparator())) {
        relativePath = tableName.substring(filterTable.getName().length() + naming.getPathSeparator().length());
      } else {
        continue;
      }
      for (String fieldName : new ArrayList<>(row.keySet())) {
        String path = naming.makePath(relativePath, fieldName);
        if (isExcluded(path, filterTable.getExcludes(), filterTable.getIncludes())) {
          row.remove(fieldName);
        }
      }
      if (row.isEmpty()) {
        break;
      }
    }
    return row;
  }

  private boolean isExcluded(String path, List<String> excludes, List<String> includes) {
    boolean excluded = excludes.stream().anyMatch(regex -> compile(regex).matcher(path).find());
    return excluded && includes.stream().noneMatch(regex -> compile(regex).matcher(path).find());
  }

  private Pattern compile(String regex) {
    return compiledFilters.computeIfAbsent(regex, Pattern::compile);
  }

  /**
   * Coerces the row values into the columns of {@code tableName}. Null values are dropped. Values that
   * cannot be coerced into an existing column go into a variant column named after the value type.
   *
   * @return coerced row and a partial table with the new columns, or no partial if the row fits the table
   */
  public CoercedRow coerceRow(String tableName, String parentTable, DataRow row) {
    TableSchema table = tables.get(tableName);
    Map<String, ColumnSchema> tableColumns = table == null ? Collections.emptyMap() : table.getColumns();
    DataRow newRow = new DataRow();
    TableSchema partial = null;

    for (Map.Entry<String, Object> entry : row) {
      String columnName = entry.getKey();
      Object value = entry.getValue();
      if (value == null) {
        coerceNullValue(tableColumns, tableName, columnName);
        continue;
      }
      CoercedValue coerced = coerceNonNullValue(tableColumns, tableName, columnName, value, false);
      newRow.put(coerced.columnName, coerced.value);
      if (coerced.newColumn != null) {
        if (partial == null) {
          partial = new TableSchema(tableName, parentTable);
        }
        partial.addColumn(coerced.newColumn);
      }
    }
    return new CoercedRow(newRow, partial);
  }

  private void coerceNullValue(Map<String, ColumnSchema> tableColumns, String tableName, String columnName) {
    ColumnSchema column = tableColumns.get(columnName);
    if (column != null && !column.isNullable()) {
      throw new CannotCoerceNullException(name, tableName, columnName);
    }
  }

  private CoercedValue coerceNonNullValue(Map<String, ColumnSchema> tableColumns, String tableName,
                                          String columnName, Object value, boolean isVariant) {
    ColumnSchema existing = tableColumns.get(columnName);
    DataType valueType = DataTypeUtils.inferDataType(value);
    if (existing != null) {
      if (existing.getDataType() == valueType) {
        return new CoercedValue(columnName, value, null);
      }
      try {
        return new CoercedValue(columnName, DataTypeUtils.coerceValue(existing.getDataType(), valueType, value), null);
      } catch (IllegalArgumentException e) {
        if (isVariant) {
          throw new CannotCoerceColumnException(name, tableName, columnName, valueType, existing.getDataType(), value);
        }
      }
      String variantName = naming.normalizePath(naming.makePath(columnName, "v_" + valueType.value()));
      return coerceNonNullValue(tableColumns, tableName, variantName, value, true);
    }
    ColumnSchema newColumn = new ColumnSchema(columnName, valueType, true, null, null, isVariant);
    return new CoercedValue(columnName, value, newColumn);
  }

  /**
   * Creates or merges a table. Columns of the partial are added or, if present, have their hints merged.
   *
   * @return the partial table
   * @throws ParentTableNotFoundException if the partial names a parent that does not exist
   * @throws CannotCoerceColumnException if a column changes its data type
   */
  public TableSchema updateTable(TableSchema partial) {
    String parentName = partial.getParent();
    if (parentName != null && !tables.containsKey(parentName)) {
      throw new ParentTableNotFoundException(name, partial.getName(), parentName);
    }
    TableSchema table = tables.get(partial.getName());
    if (table == null) {
      tables.put(partial.getName(), partial.copy());
    } else {
      mergeTable(table, partial);
    }
    version++;
    LOG.debug("Schema {} updated to version {} with table {}", name, version, partial.getName());
    return partial;
  }

  private void mergeTable(TableSchema table, TableSchema partial) {
    for (ColumnSchema column : partial.getColumns().values()) {
      ColumnSchema existing = table.getColumn(column.getName());
      if (existing == null) {
        table.addColumn(column);
      } else if (existing.getDataType() != column.getDataType()) {
        throw new CannotCoerceColumnException(name, table.getName(), column.getName(), column.getDataType(),
            existing.getDataType(), null);
      } else {
        table.addColumn(existing.mergeHints(column));
      }
    }
    if (partial.getWriteDisposition() != null) {
      table.setWriteDisposition(partial.getWriteDisposition());
    }
    if (partial.getSchemaContract() != null) {
      table.setSchemaContract(partial.getSchemaContract());
    }
    table.setSeenData(table.isSeenData() || partial.isSeenData());
    for (String exclude : partial.getExcludes()) {
      if (!table.getExcludes().contains(exclude)) {
        table.addExclude(exclude);
      }
    }
    for (String include : partial.getIncludes()) {
      if (!table.getIncludes().contains(include)) {
        table.addInclude(include);
      }
    }
  }

  /**
   * Contract of the root table of {@code tableName} if set, else the schema level contract. Unset modes
   * resolve to {@code evolve}.
   */
  public SchemaContract resolveContractSettingsForTable(String tableName) {
    SchemaContract contract = null;
    TableSchema root = getRootTable(tableName);
    if (root != null) {
      contract = root.getSchemaContract();
    }
    if (contract == null) {
      contract = schemaContract;
    }
    return contract == null ? SchemaContract.DEFAULT : contract.withDefaults();
  }

  /**
   * Checks a partial table against a resolved contract.
   *
   * <p>New tables (absent or never received data) are checked against the {@code tables} mode, their
   * columns always evolve. For existing tables new columns are checked against the {@code columns} mode
   * and new variant columns against the {@code data_type} mode. Columns of the {@code _dlt} namespace are
   * always accepted. Discarded columns are removed from the returned partial and reported as filters.
   *
   * @return the partial to commit, or no partial if the table was discarded, and the filters to apply
   * @throws DataValidationException if a {@code freeze} mode rejects the change
   */
  public ContractApplyResult applySchemaContract(SchemaContract contract, TableSchema partial, Object dataItem) {
    if (contract.isAllEvolve()) {
      return new ContractApplyResult(partial, Collections.emptyList());
    }
    String tableName = partial.getName();
    TableSchema existing = tables.get(tableName);
    boolean isNewTable = existing == null || !existing.isSeenData();

    if (isNewTable && contract.getTables() != SchemaEvolutionMode.EVOLVE) {
      if (contract.getTables() == SchemaEvolutionMode.FREEZE) {
        throw new DataValidationException(name, tableName, ContractEntity.TABLES, tableName,
            SchemaEvolutionMode.FREEZE, dataItem, "Trying to add table " + tableName + " but new tables are frozen.");
      }
      List<FilterDecision> filters = new ArrayList<>();
      filters.add(new FilterDecision(ContractEntity.TABLES, tableName, contract.getTables()));
      return new ContractApplyResult(null, filters);
    }

    SchemaEvolutionMode columnMode = contract.getColumns();
    SchemaEvolutionMode dataMode = contract.getDataType();
    if (isNewTable || (columnMode == SchemaEvolutionMode.EVOLVE && dataMode == SchemaEvolutionMode.EVOLVE)) {
      return new ContractApplyResult(partial, Collections.emptyList());
    }

    TableSchema checked = partial.copy();
    List<FilterDecision> filters = new ArrayList<>();
    for (ColumnSchema column : partial.getColumns().values()) {
      String columnName = column.getName();
      if (columnName.startsWith(DLT_PREFIX) || existing.hasColumn(columnName)) {
        continue;
      }
      ContractEntity entity = column.isVariant() ? ContractEntity.DATA_TYPE : ContractEntity.COLUMNS;
      SchemaEvolutionMode mode = column.isVariant() ? dataMode : columnMode;
      if (mode == SchemaEvolutionMode.EVOLVE) {
        continue;
      }
      if (mode == SchemaEvolutionMode.FREEZE) {
        String details = column.isVariant()
            ? "Can't add variant column " + columnName + " for table " + tableName + " because data types are frozen."
            : "Can't add table column " + columnName + " to table " + tableName + " because columns are frozen.";
        throw new DataValidationException(name, tableName, entity, columnName, SchemaEvolutionMode.FREEZE,
            dataItem, details);
      }
      checked.removeColumn(columnName);
      filters.add(new FilterDecision(ContractEntity.COLUMNS, columnName, mode));
    }
    return new ContractApplyResult(checked, filters);
  }

  private static class CoercedValue {
    private final String columnName;
    private final Object value;
    private final ColumnSchema newColumn;

    CoercedValue(String columnName, Object value, ColumnSchema newColumn) {
      this.columnName = columnName;
      this.value = value;
      this.newColumn = newColumn;
    }
  }
}
