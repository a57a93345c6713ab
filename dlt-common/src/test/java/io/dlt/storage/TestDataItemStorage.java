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

package io.dlt.storage;

import io.dlt.avro.ParquetUtils;
import io.dlt.common.fs.FSUtils;
import io.dlt.config.DestinationCapabilities;
import io.dlt.config.NormalizeConfig;
import io.dlt.schema.ColumnSchema;
import io.dlt.schema.DataRow;
import io.dlt.schema.DataType;

import org.apache.avro.generic.GenericRecord;
import org.apache.hadoop.conf.Configuration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class TestDataItemStorage {

  private static final String LOAD_ID = "1700000000.1";

  @TempDir
  Path storageRoot;

  private final Configuration hadoopConf = FSUtils.getDefaultHadoopConf();
  private final DestinationCapabilities capabilities = DestinationCapabilities.newBuilder().build();
  private NormalizeConfig config;
  private Map<String, ColumnSchema> columns;

  @BeforeEach
  public void setUp() {
    config = NormalizeConfig.newBuilder().withParquetCompressionCodec("UNCOMPRESSED").build();
    columns = new LinkedHashMap<>();
    columns.put("id", ColumnSchema.of("id", DataType.BIGINT));
    columns.put("name", ColumnSchema.of("name", DataType.TEXT));
  }

  @Test
  public void testWriteJsonl() throws Exception {
    DataItemStorage storage = new DataItemStorage(storageRoot, new WriterSpec(FileFormat.JSONL, ItemFormat.OBJECT),
        config, capabilities, hadoopConf);
    storage.writeDataItem(LOAD_ID, "event", "items", DataRow.of("id", 1, "name", "a"), columns);
    storage.writeDataItem(LOAD_ID, "event", "items", DataRow.of("id", 2), columns);
    storage.closeWriters(LOAD_ID);

    List<DataWriteStat> stats = storage.closedFiles();
    assertEquals(1, stats.size());
    DataWriteStat stat = stats.get(0);
    assertEquals(2, stat.getItemCount());
    assertEquals("items", stat.getTableName());
    assertEquals(Arrays.asList("id", "name"), stat.getColumns());
    Path jobFile = Paths.get(stat.getPath());
    assertEquals(storage.getNewJobsDir(LOAD_ID), jobFile.getParent());
    assertEquals("items", LoadJobFileName.parse(jobFile.toString()).getTableName());
    List<String> lines = Files.readAllLines(jobFile, StandardCharsets.UTF_8);
    assertEquals(Arrays.asList("{\"id\":1,\"name\":\"a\"}", "{\"id\":2}"), lines);
  }

  @Test
  public void testWriteParquetRotatesOnMaxItems() {
    NormalizeConfig rotating = NormalizeConfig.newBuilder().withParquetCompressionCodec("UNCOMPRESSED")
        .withFileMaxItems(2).build();
    DataItemStorage storage = new DataItemStorage(storageRoot, new WriterSpec(FileFormat.PARQUET, ItemFormat.OBJECT),
        rotating, capabilities, hadoopConf);
    for (int i = 0; i < 5; i++) {
      storage.writeDataItem(LOAD_ID, "event", "items", DataRow.of("id", i, "name", "n" + i), columns);
    }
    storage.closeWriters(LOAD_ID);

    List<DataWriteStat> stats = storage.closedFiles();
    assertEquals(3, stats.size());
    long total = 0;
    for (DataWriteStat stat : stats) {
      List<GenericRecord> records = ParquetUtils.readAvroRecords(hadoopConf, new org.apache.hadoop.fs.Path(stat.getPath()));
      assertEquals(stat.getItemCount(), records.size());
      total += records.size();
    }
    assertEquals(5, total);
    GenericRecord first = ParquetUtils.readAvroRecords(hadoopConf, new org.apache.hadoop.fs.Path(stats.get(0).getPath())).get(0);
    assertEquals(0L, first.get("id"));
    assertEquals("n0", first.get("name").toString());
  }

  @Test
  public void testWriteEmptyItemsFile() {
    DataItemStorage storage = new DataItemStorage(storageRoot, new WriterSpec(FileFormat.PARQUET, ItemFormat.OBJECT),
        config, capabilities, hadoopConf);
    DataWriteStat stat = storage.writeEmptyItemsFile(LOAD_ID, "event", "items", columns);
    assertEquals(0, stat.getItemCount());
    org.apache.hadoop.fs.Path path = new org.apache.hadoop.fs.Path(stat.getPath());
    assertEquals(0, ParquetUtils.readRowCount(hadoopConf, path));
    assertEquals(2, ParquetUtils.readAvroSchema(hadoopConf, path).getFields().size());

    DataWriteStat noColumns = storage.writeEmptyItemsFile(LOAD_ID, "event", "other", new LinkedHashMap<>());
    assertTrue(Files.exists(Paths.get(noColumns.getPath())));
  }

  @Test
  public void testImportItemsFile() throws Exception {
    Path source = storageRoot.resolve("source.parquet");
    byte[] content = "not really parquet".getBytes(StandardCharsets.UTF_8);
    Files.write(source, content);
    DataWriteStat metrics = new DataWriteStat();
    metrics.setItemCount(7);
    metrics.setFileSizeInBytes(content.length);

    DataItemStorage storage = new DataItemStorage(storageRoot, new WriterSpec(FileFormat.PARQUET, ItemFormat.ARROW),
        config, capabilities, hadoopConf);
    DataWriteStat stat = storage.importItemsFile(LOAD_ID, "event", "items", source, metrics);
    assertTrue(stat.isImported());
    assertEquals(7, stat.getItemCount());
    assertArrayEquals(content, Files.readAllBytes(Paths.get(stat.getPath())));
    storage.closeWriters(LOAD_ID);
    assertEquals(1, storage.closedFiles().size());
  }
}
