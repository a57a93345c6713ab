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

import io.dlt.avro.RecordBatch;
import io.dlt.config.DestinationCapabilities;
import io.dlt.config.NormalizeConfig;
import io.dlt.exception.DltIOException;
import io.dlt.schema.ColumnSchema;
import io.dlt.schema.DataRow;
import io.dlt.storage.writer.DltParquetConfig;

import org.apache.hadoop.conf.Configuration;
import org.apache.parquet.hadoop.metadata.CompressionCodecName;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes normalized items into the job files of load packages: {@code <root>/<load_id>/new_jobs/<job file>}.
 * Keeps one {@link BufferedDataWriter} per load id, schema and table.
 */
public class DataItemStorage {

  private static final Logger LOG = LoggerFactory.getLogger(DataItemStorage.class);

  public static final String NEW_JOBS_FOLDER = "new_jobs";

  private final Path storageRoot;
  private final WriterSpec writerSpec;
  private final long fileMaxItems;
  private final DltParquetConfig parquetConfig;
  private final DestinationCapabilities capabilities;
  private final Map<String, BufferedDataWriter> writers = new LinkedHashMap<>();
  private final List<DataWriteStat> closedFiles = new ArrayList<>();

  public DataItemStorage(Path storageRoot, WriterSpec writerSpec, NormalizeConfig config,
                         DestinationCapabilities capabilities, Configuration hadoopConf) {
    this.storageRoot = storageRoot;
    this.writerSpec = writerSpec;
    this.fileMaxItems = config.getFileMaxItems();
    this.parquetConfig = new DltParquetConfig(
        CompressionCodecName.fromConf(config.getParquetCompressionCodec()), hadoopConf);
    this.capabilities = capabilities;
  }

  public WriterSpec getWriterSpec() {
    return writerSpec;
  }

  public Path getNewJobsDir(String loadId) {
    return storageRoot.resolve(loadId).resolve(NEW_JOBS_FOLDER);
  }

  /**
   * @return number of items in the current job file of the table
   */
  public long writeDataItem(String loadId, String schemaName, String tableName, DataRow row,
                            Map<String, ColumnSchema> columns) {
    return getWriter(loadId, schemaName, tableName).write(row, columns);
  }

  public long writeDataItem(String loadId, String schemaName, String tableName, RecordBatch batch,
                            Map<String, ColumnSchema> columns) {
    return getWriter(loadId, schemaName, tableName).write(batch, columns);
  }

  public DataWriteStat writeEmptyItemsFile(String loadId, String schemaName, String tableName,
                                           Map<String, ColumnSchema> columns) {
    return getWriter(loadId, schemaName, tableName).writeEmptyFile(columns);
  }

  /**
   * Registers an existing file as a job file without rewriting it. The file is hard linked into the
   * package, or copied where links are not supported.
   */
  public DataWriteStat importItemsFile(String loadId, String schemaName, String tableName, Path sourceFile,
                                       DataWriteStat metrics) {
    DataWriteStat stat = getWriter(loadId, schemaName, tableName).importFile(sourceFile, metrics);
    LOG.debug("Imported {} as job file {}", sourceFile, stat.getPath());
    return stat;
  }

  /**
   * Closes all writers of the load id and collects the stats of their job files.
   */
  public void closeWriters(String loadId) {
    String prefix = loadId + ".";
    writers.entrySet().removeIf(entry -> {
      if (entry.getKey().startsWith(prefix)) {
        BufferedDataWriter writer = entry.getValue();
        writer.close();
        closedFiles.addAll(writer.getClosedFiles());
        return true;
      }
      return false;
    });
  }

  /**
   * Stats of the job files of closed writers.
   */
  public List<DataWriteStat> closedFiles() {
    return new ArrayList<>(closedFiles);
  }

  private BufferedDataWriter getWriter(String loadId, String schemaName, String tableName) {
    String key = loadId + "." + schemaName + "." + tableName;
    BufferedDataWriter writer = writers.get(key);
    if (writer == null) {
      Path directory = getNewJobsDir(loadId);
      try {
        Files.createDirectories(directory);
      } catch (IOException e) {
        throw new DltIOException("Failed to create job folder " + directory, e);
      }
      writer = new BufferedDataWriter(directory, loadId, tableName, writerSpec, fileMaxItems, parquetConfig,
          capabilities);
      writers.put(key, writer);
    }
    return writer;
  }
}
