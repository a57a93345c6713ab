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

package io.dlt.exception;

import io.dlt.schema.DataType;

/**
 * Thrown when a column cannot take a value or a definition of another data type.
 */
public class CannotCoerceColumnException extends SchemaException {

  private final String tableName;
  private final String columnName;
  private final DataType fromType;
  private final DataType toType;

  public CannotCoerceColumnException(String schemaName, String tableName, String columnName,
                                     DataType fromType, DataType toType, Object value) {
    super(schemaName, String.format("Cannot coerce type in table %s column %s existing type %s coerced type %s value: %s",
        tableName, columnName, toType, fromType, value));
    this.tableName = tableName;
    this.columnName = columnName;
    this.fromType = fromType;
    this.toType = toType;
  }

  public String getTableName() {
    return tableName;
  }

  public String getColumnName() {
    return columnName;
  }

  public DataType getFromType() {
    return fromType;
  }

  public DataType getToType() {
    return toType;
  }
}
