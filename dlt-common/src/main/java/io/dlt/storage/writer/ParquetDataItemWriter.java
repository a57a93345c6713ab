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

import io.dlt.avro.AvroConversions;
import io.dlt.avro.RecordBatch;
import io.dlt.common.fs.FSUtils;
import io.dlt.schema.DataRow;

import org.apache.avro.Schema;
import org.apache.avro.generic.GenericRecord;
import org.apache.avro.generic.IndexedRecord;
import org.apache.hadoop.conf.Configuration;
import org.apache.parquet.avro.AvroSchemaConverter;
import org.apache.parquet.hadoop.ParquetFileWriter;
import org.apache.parquet.hadoop.ParquetWriter;
import org.apache.parquet.hadoop.api.WriteSupport;
import org.apache.parquet.hadoop.util.HadoopOutputFile;
import org.apache.parquet.io.OutputFile;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Writes a parquet job file with a fixed Avro schema. Rows are converted to records of that schema,
 * batches must carry the same schema.
 */
public class ParquetDataItemWriter implements DataItemWriter {

  private final Path path;
  private final Schema schema;
  private final ParquetWriter<IndexedRecord> parquetWriter;
  private long itemCount = 0;

  public ParquetDataItemWriter(Path path, Schema schema, DltParquetConfig parquetConfig, String loadId,
                               String tableName) throws IOException {
    this.path = path;
    this.schema = schema;
    Configuration conf = parquetConfig.getHadoopConf();
    WriteSupport<IndexedRecord> writeSupport =
        new DltAvroWriteSupport<>(new AvroSchemaConverter(conf).convert(schema), schema, loadId, tableName);
    OutputFile outputFile = HadoopOutputFile.fromPath(FSUtils.toHadoopPath(path), conf);
    this.parquetWriter = new ParquetWriterBuilder(outputFile, writeSupport)
        .withParquetConfig(parquetConfig)
        .withConf(conf)
        .withWriteMode(ParquetFileWriter.Mode.CREATE)
        .build();
  }

  @Override
  public void writeRow(DataRow row) throws IOException {
    parquetWriter.write(AvroConversions.toGenericRecord(schema, row));
    itemCount++;
  }

  @Override
  public void writeBatch(RecordBatch batch) throws IOException {
    for (GenericRecord record : batch.getRecords()) {
      parquetWriter.write(record);
    }
    itemCount += batch.getNumRows();
  }

  @Override
  public long getItemCount() {
    return itemCount;
  }

  @Override
  public Path getPath() {
    return path;
  }

  @Override
  public void close() throws IOException {
    parquetWriter.close();
  }

  private static class ParquetWriterBuilder extends ParquetWriter.Builder<IndexedRecord, ParquetWriterBuilder> {

    private final WriteSupport<IndexedRecord> writeSupport;

    private ParquetWriterBuilder(OutputFile file, WriteSupport<IndexedRecord> writeSupport) {
      super(file);
      this.writeSupport = writeSupport;
    }

    private ParquetWriterBuilder withParquetConfig(DltParquetConfig parquetConfig) {
      super.withCompressionCodec(parquetConfig.getCompressionCodecName());
      super.withRowGroupSize(parquetConfig.getBlockSize());
      super.withPageSize(parquetConfig.getPageSize());
      super.withDictionaryPageSize(parquetConfig.getPageSize());
      // repeated values such as the load id column are dictionary encoded
      super.withDictionaryEncoding(true);
      return this;
    }

    @Override
    protected ParquetWriterBuilder self() {
      return this;
    }

    @Override
    protected WriteSupport<IndexedRecord> getWriteSupport(Configuration conf) {
      return writeSupport;
    }
  }
}
