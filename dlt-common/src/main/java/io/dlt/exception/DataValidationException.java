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

import io.dlt.schema.ContractEntity;
import io.dlt.schema.SchemaEvolutionMode;

/**
 * Thrown when a frozen schema contract rejects a new table, a new column or a new data type.
 */
public class DataValidationException extends SchemaException {

  private final String tableName;
  private final ContractEntity entity;
  private final String entityName;
  private final SchemaEvolutionMode mode;
  private final transient Object dataItem;

  public DataValidationException(String schemaName, String tableName, ContractEntity entity, String entityName,
                                 SchemaEvolutionMode mode, Object dataItem, String details) {
    super(schemaName, String.format("In schema %s: In table %s: %s %s is frozen by contract mode %s: %s",
        schemaName, tableName, entity.value(), entityName, mode.value(), details));
    this.tableName = tableName;
    this.entity = entity;
    this.entityName = entityName;
    this.mode = mode;
    this.dataItem = dataItem;
  }

  public String getTableName() {
    return tableName;
  }

  public ContractEntity getEntity() {
    return entity;
  }

  public String getEntityName() {
    return entityName;
  }

  public SchemaEvolutionMode getMode() {
    return mode;
  }

  public Object getDataItem() {
    return dataItem;
  }
}
