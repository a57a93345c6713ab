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
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Table definition held by a {@link Schema}. A partial table update is a {@code TableSchema} carrying only
 * the new or changed columns; unset table level properties of a partial leave the stored table unchanged.
 */
public class TableSchema implements Serializable {

  private final String name;
  private final String parent;
  private final LinkedHashMap<String, ColumnSchema> columns = new LinkedHashMap<>();
  private WriteDisposition writeDisposition;
  private SchemaContract schemaContract;
  private boolean seenData;
  private final List<String> excludes = new ArrayList<>();
  private final List<String> includes = new ArrayList<>();

  public TableSchema(String name, String parent) {
    this.name = name;
    this.parent = parent;
  }

  public TableSchema(String name) {
    this(name, null);
  }

  /**
   * Partial table with given columns.
   */
  public static TableSchema partial(String name, String parent, ColumnSchema... columns) {
    TableSchema table = new TableSchema(name, parent);
    for (ColumnSchema column : columns) {
      table.addColumn(column);
    }
    return table;
  }

  public String getName() {
    return name;
  }

  public String getParent() {
    return parent;
  }

  public boolean isRoot() {
    return parent == null;
  }

  public Map<String, ColumnSchema> getColumns() {
    return Collections.unmodifiableMap(columns);
  }

  public ColumnSchema getColumn(String columnName) {
    return columns.get(columnName);
  }

  public boolean hasColumn(String columnName) {
    return columns.containsKey(columnName);
  }

  public TableSchema addColumn(ColumnSchema column) {
    columns.put(column.getName(), column);
    return this;
  }

  public ColumnSchema removeColumn(String columnName) {
    return columns.remove(columnName);
  }

  public WriteDisposition getWriteDisposition() {
    return writeDisposition;
  }

  public TableSchema setWriteDisposition(WriteDisposition writeDisposition) {
    this.writeDisposition = writeDisposition;
    return this;
  }

  public SchemaContract getSchemaContract() {
    return schemaContract;
  }

  public TableSchema setSchemaContract(SchemaContract schemaContract) {
    this.schemaContract = schemaContract;
    return this;
  }

  public boolean isSeenData() {
    return seenData;
  }

  public TableSchema setSeenData(boolean seenData) {
    this.seenData = seenData;
    return this;
  }

  public List<String> getExcludes() {
    return excludes;
  }

  public List<String> getIncludes() {
    return includes;
  }

  public TableSchema addExclude(String regex) {
    excludes.add(regex);
    return this;
  }

  public TableSchema addInclude(String regex) {
    includes.add(regex);
    return this;
  }

  public TableSchema copy() {
    TableSchema copy = new TableSchema(name, parent);
    copy.columns.putAll(columns);
    copy.writeDisposition = writeDisposition;
    copy.schemaContract = schemaContract;
    copy.seenData = seenData;
    copy.excludes.addAll(excludes);
    copy.includes.addAll(includes);
    return copy;
  }

  @Override
  public String toString() {
    return "TableSchema{name='" + name + '\'' + ", parent='" + parent + '\'' + ", columns=" + columns.values()
        + ", writeDisposition=" + writeDisposition + ", seenData=" + seenData + '}';
  }
}
