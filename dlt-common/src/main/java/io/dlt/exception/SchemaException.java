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

/**
 * Base class for failures raised by the schema layer: coercion, table merges and contracts.
 */
public class SchemaException extends DltException {

  private final String schemaName;

  public SchemaException(String schemaName, String message) {
    super(message);
    this.schemaName = schemaName;
  }

  public SchemaException(String schemaName, String message, Throwable t) {
    super(message, t);
    this.schemaName = schemaName;
  }

  public String getSchemaName() {
    return schemaName;
  }
}
