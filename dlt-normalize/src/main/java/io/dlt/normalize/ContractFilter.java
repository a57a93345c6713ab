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

package io.dlt.normalize;

import io.dlt.schema.DataRow;
import io.dlt.schema.SchemaEvolutionMode;

import java.util.Map;

/**
 * Applies column decisions of schema contracts to rows before they are coerced.
 */
public class ContractFilter {

  private ContractFilter() {
  }

  /**
   * Removes the fields with mode {@code discard_value} from the row.
   *
   * @return the row, or {@code null} if a field with mode {@code discard_row} is present
   */
  public static DataRow filterColumns(Map<String, SchemaEvolutionMode> filteredColumns, DataRow row) {
    for (Map.Entry<String, SchemaEvolutionMode> entry : filteredColumns.entrySet()) {
      if (!row.containsKey(entry.getKey())) {
        continue;
      }
      if (entry.getValue() == SchemaEvolutionMode.DISCARD_ROW) {
        return null;
      } else if (entry.getValue() == SchemaEvolutionMode.DISCARD_VALUE) {
        row.remove(entry.getKey());
      }
    }
    return row;
  }
}
