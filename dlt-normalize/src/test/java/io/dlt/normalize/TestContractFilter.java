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

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;

public class TestContractFilter {

  @Test
  public void testDiscardValueRemovesColumn() {
    Map<String, SchemaEvolutionMode> filtered = new HashMap<>();
    filtered.put("b", SchemaEvolutionMode.DISCARD_VALUE);
    DataRow row = DataRow.of("a", 1L, "b", 2L);

    DataRow result = ContractFilter.filterColumns(filtered, row);
    assertSame(row, result);
    assertEquals(1, result.size());
    assertFalse(result.containsKey("b"));
  }

  @Test
  public void testDiscardRowDropsRow() {
    Map<String, SchemaEvolutionMode> filtered = new HashMap<>();
    filtered.put("b", SchemaEvolutionMode.DISCARD_VALUE);
    filtered.put("c", SchemaEvolutionMode.DISCARD_ROW);

    assertNull(ContractFilter.filterColumns(filtered, DataRow.of("a", 1L, "c", "x")));
    // the column is not in the row
    assertEquals(DataRow.of("a", 1L), ContractFilter.filterColumns(filtered, DataRow.of("a", 1L, "b", 2L)));
  }
}
