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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Partial tables committed to a {@link Schema}, per table name in commit order. Returned to the caller
 * that persists the schema.
 */
public class SchemaUpdate {

  private final Map<String, List<TableSchema>> tables = new LinkedHashMap<>();

  public SchemaUpdate add(TableSchema partialTable) {
    tables.computeIfAbsent(partialTable.getName(), k -> new ArrayList<>()).add(partialTable);
    return this;
  }

  public SchemaUpdate merge(SchemaUpdate other) {
    for (Map.Entry<String, List<TableSchema>> entry : other.tables.entrySet()) {
      tables.computeIfAbsent(entry.getKey(), k -> new ArrayList<>()).addAll(entry.getValue());
    }
    return this;
  }

  public static SchemaUpdate mergeAll(List<SchemaUpdate> updates) {
    SchemaUpdate merged = new SchemaUpdate();
    for (SchemaUpdate update : updates) {
      merged.merge(update);
    }
    return merged;
  }

  public List<TableSchema> get(String tableName) {
    List<TableSchema> partials = tables.get(tableName);
    return partials == null ? Collections.emptyList() : Collections.unmodifiableList(partials);
  }

  public Map<String, List<TableSchema>> getTables() {
    return Collections.unmodifiableMap(tables);
  }

  public boolean isEmpty() {
    return tables.isEmpty();
  }

  @Override
  public String toString() {
    return "SchemaUpdate" + tables;
  }
}
