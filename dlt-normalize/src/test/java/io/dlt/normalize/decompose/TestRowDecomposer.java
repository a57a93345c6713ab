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

import io.dlt.common.json.JsonUtils;
import io.dlt.common.util.UniqueIds;
import io.dlt.schema.ColumnSchema;
import io.dlt.schema.DataRow;
import io.dlt.schema.DataType;
import io.dlt.schema.Schema;
import io.dlt.schema.TableSchema;
import io.dlt.schema.WriteDisposition;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class TestRowDecomposer {

  private static final String LOAD_ID = "1700000000.5";

  private Schema schema;

  @BeforeEach
  public void setUp() {
    schema = new Schema("event");
  }

  private List<DecomposedRow> decomposeAll(RowDecomposer decomposer, String json, String table) {
    RowTraversal traversal = decomposer.decompose(JsonUtils.fromJson(json), LOAD_ID, table);
    List<DecomposedRow> rows = new ArrayList<>();
    while (traversal.hasNext(true)) {
      rows.add(traversal.next());
    }
    return rows;
  }

  private static List<String> tables(List<DecomposedRow> rows) {
    return rows.stream().map(DecomposedRow::getTable).collect(Collectors.toList());
  }

  @Test
  public void testFlattensNestedObjects() {
    List<DecomposedRow> rows = decomposeAll(new RowDecomposer(schema, 1000),
        "{\"id\": 1, \"Customer\": {\"Name\": \"anna\", \"address\": {\"city\": \"Berlin\"}}}", "Orders");

    assertEquals(1, rows.size());
    DecomposedRow root = rows.get(0);
    assertEquals("orders", root.getTable());
    assertNull(root.getParentTable());
    DataRow row = root.getRow();
    assertEquals("anna", row.get("customer__name"));
    assertEquals("Berlin", row.get("customer__address__city"));
    assertEquals(LOAD_ID, row.get(Schema.LOAD_ID_COLUMN));
    assertEquals(14, ((String) row.get(Schema.ID_COLUMN)).length());
    assertFalse(row.containsKey(Schema.PARENT_ID_COLUMN));
  }

  @Test
  public void testChildTablesAreLinkedToParents() {
    List<DecomposedRow> rows = decomposeAll(new RowDecomposer(schema, 1000),
        "{\"id\": 1, \"items\": [{\"sku\": \"a\", \"tags\": [{\"t\": \"x\"}]}, {\"sku\": \"b\"}], \"notes\": [{\"n\": 1}]}",
        "orders");

    assertEquals(Arrays.asList("orders", "orders__items", "orders__items__tags", "orders__items", "orders__notes"),
        tables(rows));
    String rootId = (String) rows.get(0).getRow().get(Schema.ID_COLUMN);
    DataRow firstItem = rows.get(1).getRow();
    assertEquals("orders", rows.get(1).getParentTable());
    assertEquals(rootId, firstItem.get(Schema.PARENT_ID_COLUMN));
    assertEquals(0L, firstItem.get(Schema.LIST_IDX_COLUMN));
    assertEquals(1L, rows.get(3).getRow().get(Schema.LIST_IDX_COLUMN));
    assertEquals("orders__items", rows.get(2).getParentTable());
    assertEquals(firstItem.get(Schema.ID_COLUMN), rows.get(2).getRow().get(Schema.PARENT_ID_COLUMN));
    // only the root row carries the load id
    assertFalse(firstItem.containsKey(Schema.LOAD_ID_COLUMN));
    assertFalse(firstItem.containsKey("items"));
  }

  @Test
  public void testScalarListElements() {
    List<DecomposedRow> rows = decomposeAll(new RowDecomposer(schema, 1000),
        "{\"tags\": [\"red\", null, 3]}", "orders");

    assertEquals(4, rows.size());
    String rootId = (String) rows.get(0).getRow().get(Schema.ID_COLUMN);
    for (int i = 1; i < 4; i++) {
      DataRow row = rows.get(i).getRow();
      assertEquals("orders__tags", rows.get(i).getTable());
      assertEquals(rootId, row.get(Schema.PARENT_ID_COLUMN));
      assertEquals((long) (i - 1), row.get(Schema.LIST_IDX_COLUMN));
      assertEquals(UniqueIds.childRowId(rootId, "orders__tags", i - 1), row.get(Schema.ID_COLUMN));
    }
    assertEquals("red", rows.get(1).getRow().get(RowDecomposer.VALUE_FIELD));
    assertNull(rows.get(2).getRow().get(RowDecomposer.VALUE_FIELD));
  }

  @Test
  public void testListOfLists() {
    List<DecomposedRow> rows = decomposeAll(new RowDecomposer(schema, 1000),
        "{\"matrix\": [[1, 2], [3]]}", "orders");

    assertEquals(Arrays.asList("orders", "orders__matrix", "orders__matrix__list", "orders__matrix__list",
        "orders__matrix", "orders__matrix__list"), tables(rows));
    DataRow intermediate = rows.get(1).getRow();
    assertFalse(intermediate.containsKey(RowDecomposer.LIST_FIELD));
    assertEquals(intermediate.get(Schema.ID_COLUMN), rows.get(2).getRow().get(Schema.PARENT_ID_COLUMN));
    assertEquals(3L, ((Number) rows.get(5).getRow().get(RowDecomposer.VALUE_FIELD)).longValue());
  }

  @Test
  public void testMaxNestingKeepsJson() {
    List<DecomposedRow> rows = decomposeAll(new RowDecomposer(schema, 1),
        "{\"a\": {\"b\": {\"c\": 1}, \"l\": [1, 2]}, \"top\": [1]}", "orders");

    // level 0 lists still become child tables, deeper values stay json
    assertEquals(Arrays.asList("orders", "orders__top"), tables(rows));
    DataRow root = rows.get(0).getRow();
    assertTrue(root.get("a__b") instanceof java.util.Map);
    assertTrue(root.get("a__l") instanceof List);
  }

  @Test
  public void testJsonColumnIsNotFlattened() {
    schema.updateTable(TableSchema.partial("orders", null, ColumnSchema.of("payload", DataType.JSON)));
    List<DecomposedRow> rows = decomposeAll(new RowDecomposer(schema, 1000),
        "{\"payload\": {\"k\": [1, 2]}, \"other\": {\"k\": 1}}", "orders");

    assertEquals(1, rows.size());
    DataRow root = rows.get(0).getRow();
    assertTrue(root.get("payload") instanceof java.util.Map);
    assertEquals(1L, ((Number) root.get("other__k")).longValue());
  }

  @Test
  public void testMergeDispositionUsesDeterministicChildIds() {
    schema.updateTable(new TableSchema("orders", null).setWriteDisposition(WriteDisposition.MERGE));
    RowDecomposer decomposer = new RowDecomposer(schema, 1000);
    String json = "{\"_dlt_id\": \"fixed-root\", \"items\": [{\"sku\": \"a\", \"parts\": [{\"p\": 1}]}]}";

    List<DecomposedRow> first = decomposeAll(decomposer, json, "orders");
    List<DecomposedRow> second = decomposeAll(decomposer, json, "orders");

    assertEquals("fixed-root", first.get(0).getRow().get(Schema.ID_COLUMN));
    assertEquals(UniqueIds.childRowId("fixed-root", "orders__items", 0), first.get(1).getRow().get(Schema.ID_COLUMN));
    assertEquals(first.get(2).getRow().get(Schema.ID_COLUMN), second.get(2).getRow().get(Schema.ID_COLUMN));
    // every descendant points at the root row
    assertEquals("fixed-root", first.get(1).getRow().get(Schema.ROOT_ID_COLUMN));
    assertEquals("fixed-root", first.get(2).getRow().get(Schema.ROOT_ID_COLUMN));
    assertFalse(first.get(0).getRow().containsKey(Schema.ROOT_ID_COLUMN));
  }

  @Test
  public void testAppendDispositionUsesRandomChildIds() {
    RowDecomposer decomposer = new RowDecomposer(schema, 1000);
    String json = "{\"_dlt_id\": \"fixed-root\", \"items\": [{\"sku\": \"a\"}]}";

    List<DecomposedRow> first = decomposeAll(decomposer, json, "orders");
    List<DecomposedRow> second = decomposeAll(decomposer, json, "orders");

    assertNotEquals(first.get(1).getRow().get(Schema.ID_COLUMN), second.get(1).getRow().get(Schema.ID_COLUMN));
    assertFalse(first.get(1).getRow().containsKey(Schema.ROOT_ID_COLUMN));
  }

  @Test
  public void testSkipsChildrenWhenNotDescending() {
    RowTraversal traversal = new RowDecomposer(schema, 1000).decompose(
        JsonUtils.fromJson("{\"items\": [{\"tags\": [1, 2]}, {\"tags\": [3]}], \"notes\": [1]}"), LOAD_ID, "orders");

    List<String> visited = new ArrayList<>();
    boolean descend = true;
    while (traversal.hasNext(descend)) {
      DecomposedRow row = traversal.next();
      visited.add(row.getTable());
      descend = !row.getTable().equals("orders__items");
    }

    assertEquals(Arrays.asList("orders", "orders__items", "orders__items", "orders__notes"), visited);
    assertThrows(NoSuchElementException.class, traversal::next);
  }

  @Test
  public void testWrapsScalarItemsAndNormalizesKeys() {
    List<DecomposedRow> rows = decomposeAll(new RowDecomposer(schema, 1000), "42", "Raw Values");
    assertEquals("raw_values", rows.get(0).getTable());
    assertEquals(42L, ((Number) rows.get(0).getRow().get(RowDecomposer.VALUE_FIELD)).longValue());

    rows = decomposeAll(new RowDecomposer(schema, 1000), "{\"\": 1, \"Camel Key\": 2}", "orders");
    DataRow row = rows.get(0).getRow();
    assertTrue(row.containsKey(RowDecomposer.EMPTY_KEY_IDENTIFIER));
    assertTrue(row.containsKey("camel_key"));
  }
}
