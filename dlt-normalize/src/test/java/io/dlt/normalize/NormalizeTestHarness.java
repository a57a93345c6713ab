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

import io.dlt.avro.ParquetUtils;
import io.dlt.common.fs.FSUtils;
import io.dlt.common.json.JsonUtils;
import io.dlt.common.runtime.Signals;
import io.dlt.config.DestinationCapabilities;
import io.dlt.config.NormalizeConfig;
import io.dlt.normalize.metrics.NormalizeMetrics;
import io.dlt.schema.Schema;
import io.dlt.storage.DataItemStorage;
import io.dlt.storage.DataWriteStat;
import io.dlt.storage.ExtractedItemsStorage;
import io.dlt.storage.FileFormat;
import io.dlt.storage.ItemFormat;
import io.dlt.storage.LoadJobFileName;
import io.dlt.storage.WriterSpec;

import org.apache.avro.generic.GenericRecord;
import org.apache.hadoop.conf.Configuration;
import org.apache.parquet.avro.AvroParquetWriter;
import org.apache.parquet.hadoop.ParquetWriter;
import org.apache.parquet.hadoop.util.HadoopOutputFile;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Storage roots, schema and helpers shared by the normalizer tests.
 */
public abstract class NormalizeTestHarness {

  protected static final String LOAD_ID = "1700000000.123";
  protected static final String SCHEMA_NAME = "event";

  @TempDir
  protected Path tempDir;

  protected final Configuration hadoopConf = FSUtils.getDefaultHadoopConf();
  protected ExtractedItemsStorage extractedStorage;
  protected Path loadStorageRoot;
  protected Schema schema;
  protected Signals signals;

  @BeforeEach
  public void initHarness() throws IOException {
    extractedStorage = new ExtractedItemsStorage(Files.createDirectories(tempDir.resolve("extracted")));
    loadStorageRoot = Files.createDirectories(tempDir.resolve("load"));
    schema = new Schema(SCHEMA_NAME);
    signals = new Signals();
  }

  protected NormalizeConfig.Builder configBuilder() {
    return NormalizeConfig.newBuilder().withParquetCompressionCodec("UNCOMPRESSED");
  }

  protected DestinationCapabilities.Builder capabilitiesBuilder() {
    return DestinationCapabilities.newBuilder();
  }

  protected DataItemStorage itemStorage(FileFormat fileFormat, ItemFormat itemFormat, NormalizeConfig config,
                                        DestinationCapabilities capabilities) {
    return new DataItemStorage(loadStorageRoot, new WriterSpec(fileFormat, itemFormat), config, capabilities,
        hadoopConf);
  }

  protected JsonLItemsNormalizer jsonlNormalizer(DataItemStorage itemStorage, NormalizeConfig config,
                                                 NormalizeMetrics metrics) {
    return new JsonLItemsNormalizer(itemStorage, extractedStorage, schema, LOAD_ID, config,
        capabilitiesBuilder().build(), signals, metrics);
  }

  /**
   * Writes lines into a new extracted jsonl file of the table.
   *
   * @return path relative to the extracted storage
   */
  protected String writeExtractedJsonl(String tableName, String... lines) throws IOException {
    String relativePath = extractedStorage.makeRelativePath(LOAD_ID,
        LoadJobFileName.newJob(tableName, FileFormat.JSONL).fileName());
    Path fullPath = extractedStorage.makeFullPath(relativePath);
    Files.createDirectories(fullPath.getParent());
    Files.write(fullPath, Arrays.asList(lines), StandardCharsets.UTF_8);
    return relativePath;
  }

  /**
   * Writes raw content into a new extracted jsonl file of the table.
   *
   * @return path relative to the extracted storage
   */
  protected String writeExtractedJsonlBytes(String tableName, byte[] content) throws IOException {
    String relativePath = extractedStorage.makeRelativePath(LOAD_ID,
        LoadJobFileName.newJob(tableName, FileFormat.JSONL).fileName());
    Path fullPath = extractedStorage.makeFullPath(relativePath);
    Files.createDirectories(fullPath.getParent());
    Files.write(fullPath, content);
    return relativePath;
  }

  /**
   * Writes the records into a new extracted parquet file of the table.
   *
   * @return path relative to the extracted storage
   */
  protected String writeExtractedParquet(String tableName, org.apache.avro.Schema avroSchema,
                                         List<GenericRecord> records) throws IOException {
    return writeExtractedParquet(tableName, avroSchema, records, ParquetWriter.DEFAULT_BLOCK_SIZE);
  }

  /**
   * Writes the records into a new extracted parquet file, row groups are flushed once they exceed
   * {@code rowGroupSize} bytes.
   */
  protected String writeExtractedParquet(String tableName, org.apache.avro.Schema avroSchema,
                                         List<GenericRecord> records, int rowGroupSize) throws IOException {
    String relativePath = extractedStorage.makeRelativePath(LOAD_ID,
        LoadJobFileName.newJob(tableName, FileFormat.PARQUET).fileName());
    Path fullPath = extractedStorage.makeFullPath(relativePath);
    Files.createDirectories(fullPath.getParent());
    try (ParquetWriter<GenericRecord> writer = AvroParquetWriter.<GenericRecord>builder(
        HadoopOutputFile.fromPath(FSUtils.toHadoopPath(fullPath), hadoopConf))
        .withSchema(avroSchema).withConf(hadoopConf).withRowGroupSize(rowGroupSize).build()) {
      for (GenericRecord record : records) {
        writer.write(record);
      }
    }
    return relativePath;
  }

  protected static List<DataWriteStat> statsOf(List<DataWriteStat> stats, String tableName) {
    return stats.stream().filter(s -> tableName.equals(s.getTableName())).collect(Collectors.toList());
  }

  /**
   * Rows of jsonl job files, in file order.
   */
  @SuppressWarnings("unchecked")
  protected static List<Map<String, Object>> readJsonlRows(List<DataWriteStat> stats) throws IOException {
    List<Map<String, Object>> rows = new ArrayList<>();
    for (DataWriteStat stat : stats) {
      for (String line : Files.readAllLines(Paths.get(stat.getPath()), StandardCharsets.UTF_8)) {
        rows.add((Map<String, Object>) JsonUtils.fromJson(line));
      }
    }
    return rows;
  }

  protected List<GenericRecord> readParquetRecords(List<DataWriteStat> stats) {
    List<GenericRecord> records = new ArrayList<>();
    for (DataWriteStat stat : stats) {
      records.addAll(ParquetUtils.readAvroRecords(hadoopConf, FSUtils.toHadoopPath(Paths.get(stat.getPath()))));
    }
    return records;
  }
}
