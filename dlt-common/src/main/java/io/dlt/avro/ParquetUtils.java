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

package io.dlt.avro;

import io.dlt.common.util.collection.ClosableIterator;
import io.dlt.exception.DltIOException;

import org.apache.avro.Schema;
import org.apache.avro.generic.GenericRecord;
import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.fs.Path;
import org.apache.parquet.avro.AvroParquetReader;
import org.apache.parquet.avro.AvroSchemaConverter;
import org.apache.parquet.hadoop.ParquetFileReader;
import org.apache.parquet.hadoop.ParquetReader;
import org.apache.parquet.hadoop.metadata.BlockMetaData;
import org.apache.parquet.hadoop.metadata.ParquetMetadata;
import org.apache.parquet.hadoop.util.HadoopInputFile;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.stream.Collectors;

/**
 * Utility functions involving with parquet.
 */
public class ParquetUtils {

  // footer key under which parquet-avro stores the writer's Avro schema
  public static final String AVRO_SCHEMA_METADATA_KEY = "parquet.avro.schema";

  private ParquetUtils() {
  }

  public static ParquetMetadata readMetadata(Configuration conf, Path parquetFilePath) {
    try (ParquetFileReader reader = ParquetFileReader.open(HadoopInputFile.fromPath(parquetFilePath, conf))) {
      return reader.getFooter();
    } catch (IOException e) {
      throw new DltIOException("Failed to read footer for parquet " + parquetFilePath, e);
    }
  }

  public static Schema readAvroSchema(Configuration conf, Path parquetFilePath) {
    return readAvroSchema(conf, readMetadata(conf, parquetFilePath));
  }

  /**
   * Avro schema stored in the footer by parquet-avro writers, otherwise converted from the parquet schema.
   */
  public static Schema readAvroSchema(Configuration conf, ParquetMetadata metadata) {
    Map<String, String> keyValues = metadata.getFileMetaData().getKeyValueMetaData();
    String avroSchema = keyValues.get(AVRO_SCHEMA_METADATA_KEY);
    if (avroSchema != null) {
      return new Schema.Parser().parse(avroSchema);
    }
    return new AvroSchemaConverter(conf).convert(metadata.getFileMetaData().getSchema());
  }

  public static long readRowCount(Configuration conf, Path parquetFilePath) {
    return rowCount(readMetadata(conf, parquetFilePath));
  }

  public static long rowCount(ParquetMetadata metadata) {
    long rowCount = 0;
    for (BlockMetaData block : metadata.getBlocks()) {
      rowCount += block.getRowCount();
    }
    return rowCount;
  }

  public static List<Long> readRowGroupRowCounts(Configuration conf, Path parquetFilePath) {
    return readMetadata(conf, parquetFilePath).getBlocks().stream()
        .map(BlockMetaData::getRowCount)
        .collect(Collectors.toList());
  }

  /**
   * NOTE: This literally reads the entire file contents, thus should be used with caution.
   */
  public static List<GenericRecord> readAvroRecords(Configuration conf, Path filePath) {
    List<GenericRecord> records = new ArrayList<>();
    try (ParquetReader<GenericRecord> reader =
             AvroParquetReader.<GenericRecord>builder(HadoopInputFile.fromPath(filePath, conf)).withConf(conf).build()) {
      GenericRecord record = reader.read();
      while (record != null) {
        records.add(record);
        record = reader.read();
      }
    } catch (IOException e) {
      throw new DltIOException("Failed to read avro records from Parquet " + filePath, e);
    }
    return records;
  }

  /**
   * Streams the file in chunks of {@code rowGroupsPerChunk} row groups. Only one chunk is held in memory.
   */
  public static ClosableIterator<RecordBatch> readInChunks(Configuration conf, Path filePath, int rowGroupsPerChunk) {
    ParquetMetadata metadata = readMetadata(conf, filePath);
    Schema schema = readAvroSchema(conf, metadata);
    List<Long> chunkSizes = new ArrayList<>();
    List<BlockMetaData> blocks = metadata.getBlocks();
    for (int i = 0; i < blocks.size(); i += rowGroupsPerChunk) {
      long size = 0;
      for (int j = i; j < Math.min(i + rowGroupsPerChunk, blocks.size()); j++) {
        size += blocks.get(j).getRowCount();
      }
      chunkSizes.add(size);
    }
    try {
      ParquetReader<GenericRecord> reader =
          AvroParquetReader.<GenericRecord>builder(HadoopInputFile.fromPath(filePath, conf)).withConf(conf).build();
      return new ChunkIterator(filePath, reader, schema, chunkSizes);
    } catch (IOException e) {
      throw new DltIOException("Failed to open Parquet " + filePath, e);
    }
  }

  private static class ChunkIterator implements ClosableIterator<RecordBatch> {

    private final Path filePath;
    private final ParquetReader<GenericRecord> reader;
    private final Schema schema;
    private final List<Long> chunkSizes;
    private int chunk = 0;

    ChunkIterator(Path filePath, ParquetReader<GenericRecord> reader, Schema schema, List<Long> chunkSizes) {
      this.filePath = filePath;
      this.reader = reader;
      this.schema = schema;
      this.chunkSizes = chunkSizes;
    }

    @Override
    public boolean hasNext() {
      return chunk < chunkSizes.size();
    }

    @Override
    public RecordBatch next() {
      if (!hasNext()) {
        throw new NoSuchElementException("No more chunks in " + filePath);
      }
      long size = chunkSizes.get(chunk++);
      List<GenericRecord> records = new ArrayList<>((int) size);
      try {
        for (long i = 0; i < size; i++) {
          GenericRecord record = reader.read();
          if (record == null) {
            break;
          }
          records.add(record);
        }
      } catch (IOException e) {
        throw new DltIOException("Failed to read chunk " + chunk + " of Parquet " + filePath, e);
      }
      return new RecordBatch(records.isEmpty() ? schema : records.get(0).getSchema(), records);
    }

    @Override
    public void close() {
      try {
        reader.close();
      } catch (IOException e) {
        throw new DltIOException("Failed to close Parquet reader of " + filePath, e);
      }
    }
  }
}
