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

import io.dlt.common.json.JsonUtils;
import io.dlt.common.json.PuaCodec;
import io.dlt.config.NormalizeConfig;
import io.dlt.exception.DataValidationException;
import io.dlt.exception.DltIOException;
import io.dlt.exception.SignalReceivedException;
import io.dlt.normalize.metrics.NormalizeMetrics;
import io.dlt.schema.ColumnSchema;
import io.dlt.schema.DataType;
import io.dlt.schema.Schema;
import io.dlt.schema.SchemaContract;
import io.dlt.schema.SchemaEvolutionMode;
import io.dlt.schema.SchemaUpdate;
import io.dlt.schema.TableSchema;
import io.dlt.storage.DataItemStorage;
import io.dlt.storage.DataWriteStat;
import io.dlt.storage.FileFormat;
import io.dlt.storage.ItemFormat;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class TestJsonLItemsNormalizer extends NormalizeTestHarness {

  private NormalizeConfig config;
  private DataItemStorage itemStorage;
  private NormalizeMetrics metrics;
  private JsonLItemsNormalizer normalizer;

  @BeforeEach
  public void setUp() {
    config = configBuilder().build();
    itemStorage = itemStorage(FileFormat.JSONL, ItemFormat.OBJECT, config, capabilitiesBuilder().build());
    metrics = new NormalizeMetrics(config, SCHEMA_NAME);
    normalizer = jsonlNormalizer(itemStorage, config, metrics);
  }

  private List<DataWriteStat> closeAndCollect() {
    itemStorage.closeWriters(LOAD_ID);
    return itemStorage.closedFiles();
  }

  @Test
  public void testSchemaUpdatePerLine() throws Exception {
    String file = writeExtractedJsonl("items", "{\"a\": 1}", "{\"a\": 1, \"b\": 2}");

    List<SchemaUpdate> updates = normalizer.process(file, "items");

    assertEquals(2, updates.size());
    Map<String, ColumnSchema> firstColumns = updates.get(0).get("items").get(0).getColumns();
    assertTrue(firstColumns.keySet().containsAll(Arrays.asList("a", Schema.LOAD_ID_COLUMN, Schema.ID_COLUMN)));
    assertEquals(DataType.BIGINT, firstColumns.get("a").getDataType());
    List<TableSchema> second = updates.get(1).get("items");
    assertEquals(1, second.size());
    assertEquals(Collections.singleton("b"), second.get(0).getColumns().keySet());

    List<Map<String, Object>> rows = readJsonlRows(statsOf(closeAndCollect(), "items"));
    assertEquals(2, rows.size());
    assertEquals(LOAD_ID, rows.get(1).get(Schema.LOAD_ID_COLUMN));
    assertEquals(2L, ((Number) rows.get(1).get("b")).longValue());
    assertEquals(2L, metrics.getRowsWritten());
  }

  @Test
  public void testChildTablesAreWritten() throws Exception {
    String file = writeExtractedJsonl("orders",
        "[{\"id\": 1, \"items\": [{\"sku\": \"a\"}, {\"sku\": \"b\"}]}, {\"id\": 2, \"items\": []}]");

    normalizer.process(file, "orders");

    assertEquals("orders", schema.getTable("orders__items").getParent());
    List<DataWriteStat> stats = closeAndCollect();
    List<Map<String, Object>> orders = readJsonlRows(statsOf(stats, "orders"));
    List<Map<String, Object>> items = readJsonlRows(statsOf(stats, "orders__items"));
    assertEquals(2, orders.size());
    assertEquals(2, items.size());
    assertEquals(orders.get(0).get(Schema.ID_COLUMN), items.get(1).get(Schema.PARENT_ID_COLUMN));
    assertEquals(1L, ((Number) items.get(1).get(Schema.LIST_IDX_COLUMN)).longValue());
  }

  @Test
  public void testDiscardRowTableContract() throws Exception {
    schema.setSchemaContract(new SchemaContract(SchemaEvolutionMode.DISCARD_ROW, null, null));
    String file = writeExtractedJsonl("events", "{\"a\": 1, \"children\": [{\"c\": 1}]}", "{\"a\": 2}");

    List<SchemaUpdate> updates = normalizer.process(file, "events");

    assertTrue(updates.stream().allMatch(SchemaUpdate::isEmpty));
    assertFalse(schema.hasTable("events"));
    assertTrue(normalizer.getContext().isTableFiltered("events"));
    assertTrue(closeAndCollect().isEmpty());
    assertEquals(1L, metrics.getTablesFiltered());
    assertEquals(1L, metrics.getRowsDiscarded());
  }

  @Test
  public void testFrozenTablesRaise() throws Exception {
    schema.setSchemaContract(SchemaContract.of(SchemaEvolutionMode.FREEZE));
    String file = writeExtractedJsonl("events", "{\"a\": 1}");

    assertThrows(DataValidationException.class, () -> normalizer.process(file, "events"));
  }

  private void prepareSeenTable(SchemaEvolutionMode columnMode) {
    schema.updateTable(TableSchema.partial("events", null,
        ColumnSchema.of("a", DataType.BIGINT),
        new ColumnSchema(Schema.LOAD_ID_COLUMN, DataType.TEXT, false, null, null, false),
        new ColumnSchema(Schema.ID_COLUMN, DataType.TEXT, false, null, null, false))
        .setSeenData(true)
        .setSchemaContract(new SchemaContract(SchemaEvolutionMode.EVOLVE, columnMode, SchemaEvolutionMode.EVOLVE)));
  }

  @Test
  public void testDiscardRowTableContractPrunesNewChildTables() throws Exception {
    schema.updateTable(TableSchema.partial("events", null,
        ColumnSchema.of("a", DataType.BIGINT),
        new ColumnSchema(Schema.LOAD_ID_COLUMN, DataType.TEXT, false, null, null, false),
        new ColumnSchema(Schema.ID_COLUMN, DataType.TEXT, false, null, null, false))
        .setSeenData(true)
        .setSchemaContract(new SchemaContract(SchemaEvolutionMode.DISCARD_ROW, SchemaEvolutionMode.EVOLVE,
            SchemaEvolutionMode.EVOLVE)));
    String file = writeExtractedJsonl("events",
        "{\"a\": 1, \"kids\": [{\"k\": 1, \"toys\": [{\"t\": 1}]}]}", "{\"a\": 2}");

    normalizer.process(file, "events");

    List<DataWriteStat> stats = closeAndCollect();
    List<Map<String, Object>> rows = readJsonlRows(statsOf(stats, "events"));
    assertEquals(2, rows.size());
    assertEquals(1L, ((Number) rows.get(0).get("a")).longValue());
    assertEquals(2L, ((Number) rows.get(1).get("a")).longValue());
    assertTrue(statsOf(stats, "events__kids").isEmpty());
    assertTrue(statsOf(stats, "events__kids__toys").isEmpty());
    assertFalse(schema.hasTable("events__kids"));
    assertFalse(schema.hasTable("events__kids__toys"));
    assertTrue(normalizer.getContext().isTableFiltered("events__kids"));
  }

  @Test
  public void testDiscardValueColumnContract() throws Exception {
    prepareSeenTable(SchemaEvolutionMode.DISCARD_VALUE);
    String file = writeExtractedJsonl("events", "{\"a\": 1, \"b\": 2}", "{\"a\": 3, \"b\": 4}");

    normalizer.process(file, "events");

    assertFalse(schema.getTable("events").hasColumn("b"));
    assertEquals(SchemaEvolutionMode.DISCARD_VALUE, normalizer.getContext().getFilteredColumns("events").get("b"));
    List<Map<String, Object>> rows = readJsonlRows(statsOf(closeAndCollect(), "events"));
    assertEquals(2, rows.size());
    assertFalse(rows.get(0).containsKey("b"));
    assertFalse(rows.get(1).containsKey("b"));
    assertEquals(3L, ((Number) rows.get(1).get("a")).longValue());
    assertEquals(1L, metrics.getColumnsFiltered());
  }

  @Test
  public void testDiscardRowColumnContract() throws Exception {
    prepareSeenTable(SchemaEvolutionMode.DISCARD_ROW);
    String file = writeExtractedJsonl("events", "{\"a\": 1, \"b\": 2}", "{\"a\": 3}", "{\"a\": 5, \"b\": 6}");

    normalizer.process(file, "events");

    List<Map<String, Object>> rows = readJsonlRows(statsOf(closeAndCollect(), "events"));
    assertEquals(1, rows.size());
    assertEquals(3L, ((Number) rows.get(0).get("a")).longValue());
    assertEquals(2L, metrics.getRowsDiscarded());
  }

  @Test
  public void testEmptyFileOfNewTable() throws Exception {
    String file = writeExtractedJsonl("events");

    List<SchemaUpdate> updates = normalizer.process(file, "events");

    assertEquals(1, updates.size());
    Map<String, ColumnSchema> columns = updates.get(0).get("events").get(0).getColumns();
    assertTrue(columns.containsKey(Schema.LOAD_ID_COLUMN));
    assertTrue(columns.containsKey(Schema.ID_COLUMN));
    assertFalse(schema.hasTableSeenData("events"));
    List<DataWriteStat> stats = statsOf(closeAndCollect(), "events");
    assertEquals(1, stats.size());
    assertEquals(0L, stats.get(0).getItemCount());
    assertEquals(0L, metrics.getRowsWritten());
  }

  @Test
  public void testEmptyFileOfTableWithData() throws Exception {
    prepareSeenTable(SchemaEvolutionMode.EVOLVE);
    int version = schema.getVersion();
    String file = writeExtractedJsonl("events", "", "  ");

    List<SchemaUpdate> updates = normalizer.process(file, "events");

    assertTrue(updates.isEmpty());
    assertEquals(version, schema.getVersion());
    List<DataWriteStat> stats = statsOf(closeAndCollect(), "events");
    assertEquals(1, stats.size());
    assertEquals(0L, stats.get(0).getItemCount());
  }

  @Test
  public void testDecodesPrivateUseAreaValues() throws Exception {
    Map<String, Object> item = new LinkedHashMap<>();
    item.put("amount", PuaCodec.encode(new BigDecimal("12.50")));
    item.put("created_at", PuaCodec.encode(Instant.parse("2024-01-02T03:04:05Z")));
    item.put("plain", "text");
    String file = writeExtractedJsonl("payments", JsonUtils.toJson(item));

    normalizer.process(file, "payments");

    assertEquals(DataType.DECIMAL, schema.getTable("payments").getColumn("amount").getDataType());
    assertEquals(DataType.TIMESTAMP, schema.getTable("payments").getColumn("created_at").getDataType());
    assertEquals(DataType.TEXT, schema.getTable("payments").getColumn("plain").getDataType());
  }

  @Test
  public void testReadsLinesAsUtf8Bytes() throws Exception {
    String content = "{\"name\": \"Zo\u00eb \u65e5\u672c\"}\r\n\r\n{\"name\": \"plain\"}";
    String file = writeExtractedJsonlBytes("people", content.getBytes(StandardCharsets.UTF_8));

    normalizer.process(file, "people");

    List<Map<String, Object>> rows = readJsonlRows(statsOf(closeAndCollect(), "people"));
    assertEquals(2, rows.size());
    assertEquals("Zo\u00eb \u65e5\u672c", rows.get(0).get("name"));
    assertEquals("plain", rows.get(1).get("name"));
  }

  @Test
  public void testMalformedUtf8Fails() throws Exception {
    ByteArrayOutputStream content = new ByteArrayOutputStream();
    content.write("{\"name\": \"a".getBytes(StandardCharsets.UTF_8));
    // lead byte of a two byte sequence followed by an ascii byte
    content.write(0xC3);
    content.write(0x28);
    content.write("\"}".getBytes(StandardCharsets.UTF_8));
    String file = writeExtractedJsonlBytes("people", content.toByteArray());

    assertThrows(DltIOException.class, () -> normalizer.process(file, "people"));
    assertFalse(schema.hasTable("people"));
  }

  @Test
  public void testStopsWhenSignalled() throws Exception {
    String file = writeExtractedJsonl("events", "{\"a\": 1}", "{\"a\": 2}");
    signals.signal(15);

    SignalReceivedException e = assertThrows(SignalReceivedException.class, () -> normalizer.process(file, "events"));
    assertEquals(15, e.getSignalNumber());
  }

  @Test
  public void testSkipWriteOnlyEvolvesSchema() {
    SchemaUpdate update = normalizer.normalizeChunk("events",
        Arrays.<Object>asList(JsonUtils.fromJson("{\"a\": 1}")), false, true);

    assertFalse(update.get("events").isEmpty());
    assertTrue(schema.hasTable("events"));
    assertTrue(closeAndCollect().isEmpty());
    assertNull(normalizer.getContext().getFilteredColumns("events"));
  }
}
