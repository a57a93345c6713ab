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

import io.dlt.avro.ArrowSchemaNormalizer;
import io.dlt.avro.AvroSchemaUtils;
import io.dlt.avro.ParquetUtils;
import io.dlt.avro.RecordBatch;
import io.dlt.common.fs.FSUtils;
import io.dlt.common.runtime.Signals;
import io.dlt.common.util.UniqueIds;
import io.dlt.common.util.collection.ClosableIterator;
import io.dlt.config.DestinationCapabilities;
import io.dlt.config.NormalizeConfig;
import io.dlt.normalize.metrics.NormalizeMetrics;
import io.dlt.schema.ColumnSchema;
import io.dlt.schema.DataType;
import io.dlt.schema.Schema;
import io.dlt.schema.SchemaUpdate;
import io.dlt.schema.TableSchema;
import io.dlt.storage.DataItemStorage;
import io.dlt.storage.DataWriteStat;
import io.dlt.storage.ExtractedItemsStorage;
import io.dlt.storage.FileFormat;
import io.dlt.storage.LoadJobFileName;

import org.apache.avro.generic.GenericRecord;
import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.fs.Path;
import org.apache.parquet.hadoop.metadata.ParquetMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Normalizes parquet extracted files. Files that already match the destination table and need no system
 * columns are imported as they are. All other files are streamed in row group chunks, get the system
 * columns injected and are reshaped to the table columns before being written.
 */
public class ColumnarItemsNormalizer extends ItemsNormalizer {

  private static final Logger LOG = LoggerFactory.getLogger(ColumnarItemsNormalizer.class);

  private final Configuration hadoopConf;

  public ColumnarItemsNormalizer(DataItemStorage itemStorage, ExtractedItemsStorage extractedStorage, Schema schema,
                                 String loadId, NormalizeConfig config, DestinationCapabilities capabilities,
                                 Signals signals, NormalizeMetrics metrics, Configuration hadoopConf) {
    super(itemStorage, extractedStorage, schema, loadId, config, capabilities, signals, metrics);
    this.hadoopConf = hadoopConf;
  }

  @Override
  public List<SchemaUpdate> process(String extractedItemsFile, String rootTable) {
    List<SchemaUpdate> baseSchemaUpdate = fixSchemaPrecisions(rootTable);

    Path filePath = FSUtils.toHadoopPath(extractedStorage.makeFullPath(extractedItemsFile));
    ParquetMetadata metadata = ParquetUtils.readMetadata(hadoopConf, filePath);
    org.apache.avro.Schema fileSchema = ParquetUtils.readAvroSchema(hadoopConf, metadata);
    DataWriteStat fileMetrics = new DataWriteStat();
    fileMetrics.setPath(extractedItemsFile);
    fileMetrics.setItemCount(ParquetUtils.rowCount(metadata));
    fileMetrics.setFileSizeInBytes(extractedStorage.getFileSize(extractedItemsFile));

    boolean addDltId = config.addDltId();
    boolean addDltLoadId = config.addDltLoadId();
    FileFormat fileFormat = itemStorage.getWriterSpec().getFileFormat();
    boolean mustRewrite = addDltId || addDltLoadId || fileFormat != FileFormat.PARQUET;
    if (!mustRewrite) {
      // shape of the file differs from the table
      mustRewrite = ArrowSchemaNormalizer.shouldNormalize(fileSchema, schema.getTableColumns(rootTable),
          schema.getNaming());
    }
    if (mustRewrite) {
      LOG.info("Table {} parquet file {} must be rewritten: add_dlt_id: {} add_dlt_load_id: {} destination file"
          + " format: {} or due to required normalization", rootTable, extractedItemsFile, addDltId, addDltLoadId,
          fileFormat.value());
      List<SchemaUpdate> schemaUpdates = new ArrayList<>(baseSchemaUpdate);
      schemaUpdates.add(writeWithDltColumns(filePath, rootTable, addDltLoadId, addDltId));
      metrics.incFilesRewritten();
      return schemaUpdates;
    }

    LOG.info("Table {} parquet file {} will be directly imported without normalization", rootTable,
        extractedItemsFile);
    LoadJobFileName parts = LoadJobFileName.parse(extractedItemsFile);
    itemStorage.importItemsFile(loadId, schema.getName(), parts.getTableName(),
        extractedStorage.makeFullPath(extractedItemsFile), fileMetrics);
    metrics.incFilesImported();
    metrics.incRowsWritten(fileMetrics.getItemCount());
    return baseSchemaUpdate;
  }

  /**
   * Lowers the precision of timestamp and time columns to the maximum the destination supports.
   *
   * @return a single update with the changed columns or nothing if no column exceeds the maximum
   */
  List<SchemaUpdate> fixSchemaPrecisions(String rootTable) {
    TableSchema table = schema.getTable(rootTable);
    if (table == null) {
      return new ArrayList<>();
    }
    int maxPrecision = capabilities.getTimestampPrecision();
    TableSchema partial = new TableSchema(rootTable, table.getParent());
    for (ColumnSchema column : table.getColumns().values()) {
      if (column.getDataType() != DataType.TIMESTAMP && column.getDataType() != DataType.TIME) {
        continue;
      }
      Integer precision = column.getPrecision();
      if (precision != null && precision > maxPrecision) {
        partial.addColumn(column.withPrecision(maxPrecision));
      }
    }
    if (partial.getColumns().isEmpty()) {
      return new ArrayList<>();
    }
    List<SchemaUpdate> updates = new ArrayList<>();
    updates.add(new SchemaUpdate().add(schema.updateTable(partial)));
    return updates;
  }

  private SchemaUpdate writeWithDltColumns(Path filePath, String rootTable, boolean addLoadId, boolean addDltId) {
    SchemaUpdate schemaUpdate = new SchemaUpdate();
    List<String> newColumns = new ArrayList<>();
    if (addLoadId) {
      schemaUpdate.add(schema.updateTable(TableSchema.partial(rootTable, null,
          ColumnSchema.of(Schema.LOAD_ID_COLUMN, DataType.TEXT).withNullable(false))));
      newColumns.add(Schema.LOAD_ID_COLUMN);
    }
    if (addDltId) {
      schemaUpdate.add(schema.updateTable(TableSchema.partial(rootTable, null,
          ColumnSchema.of(Schema.ID_COLUMN, DataType.TEXT).withNullable(false))));
      newColumns.add(Schema.ID_COLUMN);
    }

    long itemsCount = 0;
    Map<String, ColumnSchema> columnsSchema = schema.getTableColumns(rootTable);
    // object writers adapt every row to the columns themselves
    boolean mayNormalize = !itemStorage.getWriterSpec().isObjectAdapter();
    Boolean shouldNormalize = null;
    try (ClosableIterator<RecordBatch> batches =
             ParquetUtils.readInChunks(hadoopConf, filePath, config.getRewriteRowGroups())) {
      while (batches.hasNext()) {
        signals.raiseIfSignalled();
        RecordBatch batch = withNewColumns(batches.next(), newColumns);
        itemsCount += batch.getNumRows();
        if (mayNormalize && shouldNormalize == null) {
          shouldNormalize = ArrowSchemaNormalizer.shouldNormalize(batch.getSchema(), columnsSchema,
              schema.getNaming());
          if (shouldNormalize) {
            LOG.info("When writing arrow table to {} the schema requires normalization because its shape does not"
                + " match the actual schema of destination table. Arrow table columns will be reordered and"
                + " missing columns will be added if needed.", rootTable);
          }
        }
        if (Boolean.TRUE.equals(shouldNormalize)) {
          batch = ArrowSchemaNormalizer.normalize(batch, columnsSchema, schema.getNaming(), capabilities);
        }
        itemStorage.writeDataItem(loadId, schema.getName(), rootTable, batch, columnsSchema);
      }
    }
    if (itemsCount == 0) {
      itemStorage.writeEmptyItemsFile(loadId, schema.getName(), rootTable, columnsSchema);
    }
    metrics.incRowsWritten(itemsCount);
    return schemaUpdate;
  }

  /**
   * Sets the load id and fresh row ids on every record. Fields already present in the batch are
   * overwritten in place, missing ones are appended.
   */
  private RecordBatch withNewColumns(RecordBatch batch, List<String> newColumns) {
    if (newColumns.isEmpty()) {
      return batch;
    }
    org.apache.avro.Schema batchSchema = batch.getSchema();
    List<org.apache.avro.Schema.Field> fields = new ArrayList<>();
    for (org.apache.avro.Schema.Field field : batchSchema.getFields()) {
      fields.add(newColumns.contains(field.name()) ? textField(field.name()) : AvroSchemaUtils.copyField(field));
    }
    for (String column : newColumns) {
      if (batchSchema.getField(column) == null) {
        fields.add(textField(column));
      }
    }
    org.apache.avro.Schema newSchema = AvroSchemaUtils.createRecord(batchSchema, fields);

    List<String> ids = newColumns.contains(Schema.ID_COLUMN)
        ? UniqueIds.uniqueIds(batch.getNumRows()) : Collections.emptyList();
    List<GenericRecord> records = new ArrayList<>(batch.getNumRows());
    int idx = 0;
    for (GenericRecord record : batch.getRecords()) {
      GenericRecord newRecord = AvroSchemaUtils.rewriteRecord(record, newSchema);
      if (newColumns.contains(Schema.LOAD_ID_COLUMN)) {
        newRecord.put(Schema.LOAD_ID_COLUMN, loadId);
      }
      if (newColumns.contains(Schema.ID_COLUMN)) {
        newRecord.put(Schema.ID_COLUMN, ids.get(idx));
      }
      records.add(newRecord);
      idx++;
    }
    return new RecordBatch(newSchema, records);
  }

  private static org.apache.avro.Schema.Field textField(String name) {
    return new org.apache.avro.Schema.Field(name, org.apache.avro.Schema.create(org.apache.avro.Schema.Type.STRING),
        null, (Object) null);
  }
}
