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
 * What happens when data does not fit the current schema.
 */
public enum SchemaEvolutionMode {
  EVOLVE("evolve"),
  FREEZE("freeze"),
  DISCARD_ROW("discard_row"),
  DISCARD_VALUE("discard_value");

  private final String value;

  SchemaEvolutionMode(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  public static SchemaEvolutionMode fromValue(String value) {
    for (SchemaEvolutionMode mode : values()) {
      if (mode.value.equals(value)) {
        return mode;
      }
    }
    throw new IllegalArgumentException("Unknown schema evolution mode " + value);
  }

  @Override
  public String toString() {
    return value;
  }
}
