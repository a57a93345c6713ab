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

package io.dlt.storage.writer;

import io.dlt.avro.ParquetUtils;
import io.dlt.avro.RecordBatch;
import io.dlt.common.fs.FSUtils;
import io.dlt.schema.DataRow;

import org.apache.avro.Schema;
import org.apache.avro.SchemaBuilder;
import org.apache.avro.generic.GenericData;
import org.apache.avro.generic.GenericRecord;
import org.apache.hadoop.conf.Configuration;
import org.apache.parquet.hadoop.metadata.CompressionCodecName;
import org.apache.parquet.hadoop.metadata.ParquetMetadata;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Tests the parquet job file writer.
 */
public class TestParquetDataItemWriter {

  private static final Schema SCHEMA = SchemaBuilder.record("events").fields()
      .requiredLong("id")
      .optionalString("name")
      .endRecord();

  private final Configuration conf = FSUtils.getDefaultHadoopConf();

  @TempDir
  Path tempDir;

  @Test
  public void testWritesRowsBatchesAndFooterMetadata() throws Exception {
    Path file = tempDir.resolve("events.1234.0.parquet");
    DltParquetConfig parquetConfig = new DltParquetConfig(CompressionCodecName.UNCOMPRESSED, conf);

    GenericRecord batchRecord = new GenericData.Record(SCHEMA);
    batchRecord.put("id", 2L);
    batchRecord.put("name", "second");
    try (ParquetDataItemWriter writer = new ParquetDataItemWriter(file, SCHEMA, parquetConfig, "1234", "events")) {
      writer.writeRow(DataRow.of("id", 1L, "name", "first"));
      writer.writeBatch(new RecordBatch(SCHEMA, Collections.singletonList(batchRecord)));
      assertEquals(2, writer.getItemCount());
    }

    ParquetMetadata metadata = ParquetUtils.readMetadata(conf, FSUtils.toHadoopPath(file));
    Map<String, String> footer = metadata.getFileMetaData().getKeyValueMetaData();
    assertEquals("1234", footer.get(DltAvroWriteSupport.DLT_LOAD_ID_FOOTER));
    assertEquals("events", footer.get(DltAvroWriteSupport.DLT_TABLE_NAME_FOOTER));
    assertEquals(SCHEMA, ParquetUtils.readAvroSchema(conf, metadata));

    List<GenericRecord> records = ParquetUtils.readAvroRecords(conf, FSUtils.toHadoopPath(file));
    assertEquals(2, records.size());
    assertEquals(1L, records.get(0).get("id"));
    assertEquals("first", records.get(0).get("name").toString());
    assertEquals("second", records.get(1).get("name").toString());
  }
}
