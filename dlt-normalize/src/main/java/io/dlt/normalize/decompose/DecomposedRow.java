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

package io.dlt.normalize.decompose;

import io.dlt.schema.DataRow;

/**
 * A flat row produced by the decomposer, with the table it belongs to and that table's parent.
 */
public class DecomposedRow {

  private final String table;
  private final String parentTable;
  private final DataRow row;

  public DecomposedRow(String table, String parentTable, DataRow row) {
    this.table = table;
    this.parentTable = parentTable;
    this.row = row;
  }

  public String getTable() {
    return table;
  }

  /**
   * @return parent table or {@code null} for rows of the root table
   */
  public String getParentTable() {
    return parentTable;
  }

  public DataRow getRow() {
    return row;
  }

  @Override
  public String toString() {
    return "DecomposedRow{table='" + table + '\'' + ", parentTable='" + parentTable + '\'' + ", row=" + row + '}';
  }
}
