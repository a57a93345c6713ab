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

/**
 * A row coerced into a table and the partial table with the columns the row added, if any.
 */
public class CoercedRow {

  private final DataRow row;
  private final TableSchema partialTable;

  public CoercedRow(DataRow row, TableSchema partialTable) {
    this.row = row;
    this.partialTable = partialTable;
  }

  public DataRow getRow() {
    return row;
  }

  /**
   * @return partial table with new columns or {@code null} if the row fits the table
   */
  public TableSchema getPartialTable() {
    return partialTable;
  }
}
