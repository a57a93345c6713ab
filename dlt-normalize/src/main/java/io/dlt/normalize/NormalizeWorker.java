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

import io.dlt.common.fs.FSUtils;
import io.dlt.common.runtime.Signals;
import io.dlt.config.DestinationCapabilities;
import io.dlt.config.NormalizeConfig;
import io.dlt.exception.DltException;
import io.dlt.normalize.metrics.NormalizeMetrics;
import io.dlt.schema.Schema;
import io.dlt.schema.SchemaUpdate;
import io.dlt.schema.TableSchema;
import io.dlt.storage.DataItemStorage;
import io.dlt.storage.DataWriteStat;
import io.dlt.storage.ExtractedItemsStorage;
import io.dlt.storage.FileFormat;
import io.dlt.storage.ItemFormat;
import io.dlt.storage.LoadJobFileName;
import io.dlt.storage.WriterSpec;

import com.codahale.metrics.Timer;
import org.apache.hadoop.conf.Configuration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Normalizes the extracted files of one load package against a schema. Files are processed one after
 * another, each with its own normalizer, and their rows end up in job files under the load storage.
 */
public class NormalizeWorker {

  private static final Logger LOG = LoggerFactory.getLogger(NormalizeWorker.class);

  private final Schema schema;
  private final String loadId;
  private final ExtractedItemsStorage extractedStorage;
  private final Path loadStorageRoot;
  private final NormalizeConfig config;
  private final DestinationCapabilities capabilities;
  private final Signals signals;
  private final Configuration hadoopConf;
  private final NormalizeMetrics metrics;
  private final Map<ItemFormat, DataItemStorage> itemStorages = new EnumMap<>(ItemFormat.class);

  public NormalizeWorker(Schema schema, String loadId, ExtractedItemsStorage extractedStorage, Path loadStorageRoot,
                         NormalizeConfig config, DestinationCapabilities capabilities, Signals signals,
                         Configuration hadoopConf) {
    this.schema = schema;
    this.loadId = loadId;
    this.extractedStorage = extractedStorage;
    this.loadStorageRoot = loadStorageRoot;
    this.config = config;
    this.capabilities = capabilities;
    this.signals = signals;
    this.hadoopConf = FSUtils.prepareHadoopConf(hadoopConf);
    this.metrics = new NormalizeMetrics(config, schema.getName());
  }

  public NormalizeMetrics getMetrics() {
    return metrics;
  }

  /**
   * @param extractedItemsFiles paths relative to the extracted storage
   * @throws io.dlt.exception.UnsupportedFileFormatException if no job file format fits the destination
   * @throws io.dlt.exception.SignalReceivedException if processing was cancelled
   */
  public NormalizeResult normalizeFiles(List<String> extractedItemsFiles) {
    List<SchemaUpdate> schemaUpdates = new ArrayList<>();
    for (String extractedItemsFile : extractedItemsFiles) {
      LoadJobFileName parsed = LoadJobFileName.parse(extractedItemsFile);
      String rootTable = parsed.getTableName();
      ItemsNormalizer normalizer = getItemsNormalizer(parsed);
      LOG.debug("Processing extracted items in {} in load_id {} with table name {} and schema {}",
          extractedItemsFile, loadId, rootTable, schema.getName());
      Timer.Context timer = metrics.getFileTimerContext();
      schemaUpdates.addAll(normalizer.process(extractedItemsFile, rootTable));
      if (timer != null) {
        timer.stop();
      }
      metrics.incFilesNormalized();
      LOG.debug("Processed file {}", extractedItemsFile);
    }

    List<DataWriteStat> writerMetrics = new ArrayList<>();
    for (DataItemStorage itemStorage : itemStorages.values()) {
      itemStorage.closeWriters(loadId);
      writerMetrics.addAll(itemStorage.closedFiles());
    }
    SchemaUpdate seenDataUpdate = markTablesSeenData(writerMetrics);
    if (!seenDataUpdate.isEmpty()) {
      schemaUpdates.add(seenDataUpdate);
    }
    LOG.info("Normalized {} files of load {} into {} job files", extractedItemsFiles.size(), loadId,
        writerMetrics.size());
    metrics.report();
    return new NormalizeResult(schemaUpdates, writerMetrics);
  }

  private SchemaUpdate markTablesSeenData(List<DataWriteStat> writerMetrics) {
    Set<String> tablesWithData = new LinkedHashSet<>();
    for (DataWriteStat stat : writerMetrics) {
      if (stat.getItemCount() > 0) {
        tablesWithData.add(stat.getTableName());
      }
    }
    SchemaUpdate schemaUpdate = new SchemaUpdate();
    for (String tableName : tablesWithData) {
      TableSchema table = schema.getTable(tableName);
      if (table != null && !table.isSeenData()) {
        schemaUpdate.add(schema.updateTable(new TableSchema(tableName, table.getParent()).setSeenData(true)));
      }
    }
    return schemaUpdate;
  }

  private ItemsNormalizer getItemsNormalizer(LoadJobFileName parsed) {
    FileFormat fileFormat = FileFormat.fromValue(parsed.getFileFormat());
    if (fileFormat == FileFormat.JSONL || fileFormat == FileFormat.TYPED_JSONL) {
      return new JsonLItemsNormalizer(getItemStorage(ItemFormat.OBJECT), extractedStorage, schema, loadId, config,
          capabilities, signals, metrics);
    }
    if (fileFormat == FileFormat.PARQUET) {
      return new ColumnarItemsNormalizer(getItemStorage(ItemFormat.ARROW), extractedStorage, schema, loadId, config,
          capabilities, signals, metrics, hadoopConf);
    }
    throw new DltException("Don't know how to normalize file with format " + parsed.getFileFormat());
  }

  private DataItemStorage getItemStorage(ItemFormat itemFormat) {
    DataItemStorage itemStorage = itemStorages.get(itemFormat);
    if (itemStorage == null) {
      WriterSpec writerSpec = WriterSpec.resolve(capabilities, config, itemFormat);
      LOG.info("Created items normalizer for {} items with writer spec {}", itemFormat, writerSpec);
      itemStorage = new DataItemStorage(loadStorageRoot, writerSpec, config, capabilities, hadoopConf);
      itemStorages.put(itemFormat, itemStorage);
    }
    return itemStorage;
  }
}
