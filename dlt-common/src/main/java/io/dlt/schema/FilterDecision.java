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
 * A contract decision to exclude a whole table or to discard rows or values of a column.
 */
public class FilterDecision {

  private final ContractEntity entity;
  private final String name;
  private final SchemaEvolutionMode mode;

  public FilterDecision(ContractEntity entity, String name, SchemaEvolutionMode mode) {
    this.entity = entity;
    this.name = name;
    this.mode = mode;
  }

  public ContractEntity getEntity() {
    return entity;
  }

  public String getName() {
    return name;
  }

  public SchemaEvolutionMode getMode() {
    return mode;
  }

  @Override
  public String toString() {
    return "FilterDecision{" + entity.value() + ", " + name + ", " + mode + '}';
  }
}
