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
 * Data types of table columns.
 */
public enum DataType {
  TEXT("text"),
  DOUBLE("double"),
  BOOL("bool"),
  TIMESTAMP("timestamp"),
  BIGINT("bigint"),
  BINARY("binary"),
  JSON("json"),
  DECIMAL("decimal"),
  WEI("wei"),
  DATE("date"),
  TIME("time");

  private final String value;

  DataType(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  public static DataType fromValue(String value) {
    for (DataType dataType : values()) {
      if (dataType.value.equals(value)) {
        return dataType;
      }
    }
    throw new IllegalArgumentException("Unknown data type " + value);
  }

  @Override
  public String toString() {
    return value;
  }
}
