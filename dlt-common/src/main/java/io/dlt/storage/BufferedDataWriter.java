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

import io.dlt.avro.AvroSchemaUtils;
import io.dlt.avro.RecordBatch;
import io.dlt.config.DestinationCapabilities;
import io.dlt.exception.DltIOException;
import io.dlt.schema.ColumnSchema;
import io.dlt.schema.DataRow;
import io.dlt.storage.writer.DataItemWriter;
import io.dlt.storage.writer.DltParquetConfig;
import io.dlt.storage.writer.JsonlDataItemWriter;
import io.dlt.storage.writer.ParquetDataItemWriter;

import org.apache.avro.Schema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes the items of one table into a sequence of job files. A new file is started when the parquet
 * schema changes or when the current file holds the maximum number of items.
 */
public class BufferedDataWriter {

  private static final Logger LOG = LoggerFactory.getLogger(BufferedDataWriter.class);

  private final Path directory;
  private final String loadId;
  private final String tableName;
  private final WriterSpec writerSpec;
  private final long fileMaxItems;
  private final DltParquetConfig parquetConfig;
  private final DestinationCapabilities capabilities;
  private final List<DataWriteStat> closedFiles = new ArrayList<>();

  private DataItemWriter writer;
  private Map<String, ColumnSchema> currentColumns;
  private Schema currentSchema;

  public BufferedDataWriter(Path directory, String loadId, String tableName, WriterSpec writerSpec, long fileMaxItems,
                            DltParquetConfig parquetConfig, DestinationCapabilities capabilities) {
    this.directory = directory;
    this.loadId = loadId;
    this.tableName = tableName;
    this.writerSpec = writerSpec;
    this.fileMaxItems = fileMaxItems;
    this.parquetConfig = parquetConfig;
    this.capabilities = capabilities;
  }

  /**
   * @return number of items in the current file after the write
   */
  public long write(DataRow row, Map<String, ColumnSchema> columns) {
    try {
      ensureWriter(columns, null);
      writer.writeRow(row);
      long count = writer.getItemCount();
      rotateIfFull();
      return count;
    } catch (IOException e) {
      throw new DltIOException("Failed to write row of table " + tableName, e);
    }
  }

  public long write(RecordBatch batch, Map<String, ColumnSchema> columns) {
    try {
      ensureWriter(columns, batch.getSchema());
      writer.writeBatch(batch);
      long count = writer.getItemCount();
      rotateIfFull();
      return count;
    } catch (IOException e) {
      throw new DltIOException("Failed to write batch of table " + tableName, e);
    }
  }

  /**
   * Closes the current file and writes a file without items, carrying the table columns where the format
   * has a schema.
   */
  public DataWriteStat writeEmptyFile(Map<String, ColumnSchema> columns) {
    try {
      closeCurrent();
      DataWriteStat stat;
      if (writerSpec.getFileFormat() == FileFormat.PARQUET && columns.isEmpty()) {
        // parquet cannot hold a schema without fields
        stat = createEmptyFile();
      } else {
        ensureWriter(columns, null);
        stat = closeCurrent();
      }
      LOG.debug("Written empty job file {} for table {}", stat.getPath(), tableName);
      return stat;
    } catch (IOException e) {
      throw new DltIOException("Failed to write empty job file of table " + tableName, e);
    }
  }

  /**
   * Links or copies a file as a new job file of the table.
   */
  public DataWriteStat importFile(Path sourceFile, DataWriteStat metrics) {
    LoadJobFileName jobFileName = LoadJobFileName.newJob(tableName, writerSpec.getFileFormat());
    Path target = directory.resolve(jobFileName.fileName());
    try {
      try {
        Files.createLink(target, sourceFile);
      } catch (IOException | UnsupportedOperationException e) {
        LOG.debug("Cannot link {} to {}, copying", sourceFile, target);
        Files.copy(sourceFile, target);
      }
    } catch (IOException e) {
      throw new DltIOException("Failed to import " + sourceFile + " as job file of table " + tableName, e);
    }
    DataWriteStat stat = new DataWriteStat();
    stat.setPath(target.toString());
    stat.setTableName(tableName);
    stat.setFileFormat(writerSpec.getFileFormat().value());
    stat.setItemCount(metrics.getItemCount());
    stat.setFileSizeInBytes(metrics.getFileSizeInBytes());
    stat.setImported(true);
    closedFiles.add(stat);
    return stat;
  }

  private DataWriteStat createEmptyFile() throws IOException {
    Path path = directory.resolve(LoadJobFileName.newJob(tableName, writerSpec.getFileFormat()).fileName());
    Files.createFile(path);
    DataWriteStat stat = new DataWriteStat();
    stat.setPath(path.toString());
    stat.setTableName(tableName);
    stat.setFileFormat(writerSpec.getFileFormat().value());
    closedFiles.add(stat);
    return stat;
  }

  public void close() {
    try {
      closeCurrent();
    } catch (IOException e) {
      throw new DltIOException("Failed to close job file of table " + tableName, e);
    }
  }

  public List<DataWriteStat> getClosedFiles() {
    return Collections.unmodifiableList(closedFiles);
  }

  private void ensureWriter(Map<String, ColumnSchema> columns, Schema batchSchema) throws IOException {
    if (writer != null && writerSpec.getFileFormat() == FileFormat.PARQUET) {
      boolean schemaChanged = batchSchema != null ? !batchSchema.equals(currentSchema) : !columns.equals(currentColumns);
      if (schemaChanged) {
        LOG.debug("Schema of table {} changed, rotating job file {}", tableName, writer.getPath());
        closeCurrent();
      }
    }
    if (writer == null) {
      openWriter(columns, batchSchema);
    }
  }

  private void openWriter(Map<String, ColumnSchema> columns, Schema batchSchema) throws IOException {
    LoadJobFileName jobFileName = LoadJobFileName.newJob(tableName, writerSpec.getFileFormat());
    Path path = directory.resolve(jobFileName.fileName());
    currentColumns = new LinkedHashMap<>(columns);
    switch (writerSpec.getFileFormat()) {
      case PARQUET:
        currentSchema = batchSchema != null ? batchSchema : AvroSchemaUtils.toAvroSchema(tableName, columns, capabilities);
        writer = new ParquetDataItemWriter(path, currentSchema, parquetConfig, loadId, tableName);
        break;
      case JSONL:
        writer = new JsonlDataItemWriter(path, false);
        break;
      case TYPED_JSONL:
        writer = new JsonlDataItemWriter(path, true);
        break;
      default:
        throw new IllegalStateException("File format " + writerSpec.getFileFormat() + " cannot be written");
    }
  }

  private void rotateIfFull() throws IOException {
    if (fileMaxItems > 0 && writer.getItemCount() >= fileMaxItems) {
      closeCurrent();
    }
  }

  private DataWriteStat closeCurrent() throws IOException {
    if (writer == null) {
      return null;
    }
    writer.close();
    DataWriteStat stat = new DataWriteStat();
    stat.setPath(writer.getPath().toString());
    stat.setTableName(tableName);
    stat.setFileFormat(writerSpec.getFileFormat().value());
    stat.setItemCount(writer.getItemCount());
    stat.setFileSizeInBytes(Files.size(writer.getPath()));
    stat.setColumns(new ArrayList<>(currentColumns.keySet()));
    closedFiles.add(stat);
    writer = null;
    currentSchema = null;
    currentColumns = null;
    return stat;
  }
}
