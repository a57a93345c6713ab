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
import io.dlt.common.runtime.Signals;
import io.dlt.config.DestinationCapabilities;
import io.dlt.config.NormalizeConfig;
import io.dlt.exception.DltIOException;
import io.dlt.normalize.decompose.DecomposedRow;
import io.dlt.normalize.decompose.RowDecomposer;
import io.dlt.normalize.decompose.RowTraversal;
import io.dlt.normalize.metrics.NormalizeMetrics;
import io.dlt.schema.CoercedRow;
import io.dlt.schema.ColumnSchema;
import io.dlt.schema.ContractApplyResult;
import io.dlt.schema.ContractEntity;
import io.dlt.schema.DataRow;
import io.dlt.schema.FilterDecision;
import io.dlt.schema.Schema;
import io.dlt.schema.SchemaContract;
import io.dlt.schema.SchemaEvolutionMode;
import io.dlt.schema.SchemaUpdate;
import io.dlt.schema.TableSchema;
import io.dlt.storage.DataItemStorage;
import io.dlt.storage.ExtractedItemsStorage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Normalizes JSONL extracted files. Every line holds an item or a list of items, each item is decomposed
 * into rows that are filtered, coerced into the schema and written to the job file of their table.
 */
public class JsonLItemsNormalizer extends ItemsNormalizer {

  private static final Logger LOG = LoggerFactory.getLogger(JsonLItemsNormalizer.class);

  private final RowDecomposer decomposer;
  private final NormalizeContext context = new NormalizeContext();

  public JsonLItemsNormalizer(DataItemStorage itemStorage, ExtractedItemsStorage extractedStorage, Schema schema,
                              String loadId, NormalizeConfig config, DestinationCapabilities capabilities,
                              Signals signals, NormalizeMetrics metrics) {
    super(itemStorage, extractedStorage, schema, loadId, config, capabilities, signals, metrics);
    this.decomposer = new RowDecomposer(schema, config.getMaxNesting());
  }

  public NormalizeContext getContext() {
    return context;
  }

  @Override
  public List<SchemaUpdate> process(String extractedItemsFile, String rootTable) {
    List<SchemaUpdate> schemaUpdates = new ArrayList<>();
    int lineNo = 0;
    // lines are handed to the json parser as raw bytes, malformed utf-8 fails the parse
    try (InputStream in = new BufferedInputStream(extractedStorage.openFile(extractedItemsFile))) {
      byte[] lineBytes;
      while ((lineBytes = readLine(in)) != null) {
        if (isBlank(lineBytes)) {
          continue;
        }
        List<Object> items = JsonUtils.parseItems(lineBytes);
        schemaUpdates.add(normalizeChunk(rootTable, items, PuaCodec.mayHavePua(lineBytes), false));
        lineNo++;
        LOG.debug("Processed {} lines from file {}", lineNo, extractedItemsFile);
      }
    } catch (IOException e) {
      throw new DltIOException("Failed to read extracted file " + extractedItemsFile, e);
    }

    if (lineNo == 0) {
      if (!schema.hasTableSeenData(rootTable)) {
        // materializes the system columns of a new root table
        schemaUpdates.add(normalizeChunk(rootTable, Collections.<Object>singletonList(Collections.emptyMap()), false, true));
      }
      if (schema.hasTable(rootTable)) {
        itemStorage.writeEmptyItemsFile(loadId, schema.getName(), rootTable, schema.getTableColumns(rootTable));
        LOG.debug("No lines in file {}, written empty load job file", extractedItemsFile);
      }
    }
    return schemaUpdates;
  }

  /**
   * @return bytes of the next line without the line terminator, {@code null} at the end of the stream
   */
  private static byte[] readLine(InputStream in) throws IOException {
    ByteArrayOutputStream line = new ByteArrayOutputStream();
    int b = in.read();
    if (b == -1) {
      return null;
    }
    while (b != -1 && b != '\n') {
      line.write(b);
      b = in.read();
    }
    byte[] bytes = line.toByteArray();
    if (bytes.length > 0 && bytes[bytes.length - 1] == '\r') {
      return Arrays.copyOf(bytes, bytes.length - 1);
    }
    return bytes;
  }

  private static boolean isBlank(byte[] line) {
    for (byte b : line) {
      if (b != ' ' && b != '\t' && b != '\r') {
        return false;
      }
    }
    return true;
  }

  /**
   * Decomposes, filters, coerces and writes the rows of the items.
   *
   * @param skipWrite evolves the schema without writing rows
   */
  SchemaUpdate normalizeChunk(String rootTable, List<Object> items, boolean mayHavePua, boolean skipWrite) {
    SchemaUpdate schemaUpdate = new SchemaUpdate();
    String schemaName = schema.getName();
    for (Object item : items) {
      RowTraversal traversal = decomposer.decompose(item, loadId, rootTable);
      boolean descend = true;
      while (traversal.hasNext(descend)) {
        DecomposedRow decomposed = traversal.next();
        descend = normalizeRow(decomposed, schemaUpdate, mayHavePua, skipWrite, schemaName);
      }
      signals.raiseIfSignalled();
    }
    return schemaUpdate;
  }

  /**
   * @return whether to descend into the child rows
   */
  private boolean normalizeRow(DecomposedRow decomposed, SchemaUpdate schemaUpdate, boolean mayHavePua,
                               boolean skipWrite, String schemaName) {
    String tableName = decomposed.getTable();
    String parentTable = decomposed.getParentTable();

    if (context.isTableFiltered(tableName)) {
      return false;
    }

    DataRow row = schema.filterRow(tableName, decomposed.getRow());
    if (row.isEmpty()) {
      return false;
    }

    // filtered before coercion so discarded columns do not trigger migrations
    Map<String, SchemaEvolutionMode> filteredColumns = context.getFilteredColumns(tableName);
    if (filteredColumns != null && !filteredColumns.isEmpty()) {
      row = ContractFilter.filterColumns(filteredColumns, row);
      if (row == null) {
        metrics.incRowsDiscarded();
        return false;
      }
    }

    if (mayHavePua) {
      for (String column : new ArrayList<>(row.keySet())) {
        row.put(column, PuaCodec.decode(row.get(column)));
      }
    }

    CoercedRow coerced = schema.coerceRow(tableName, parentTable, row);
    row = coerced.getRow();
    TableSchema partialTable = coerced.getPartialTable();

    if (partialTable != null) {
      SchemaContract contract = context.getTableContract(tableName);
      if (contract == null) {
        // a parent table is always present in the schema, a new child table is not
        contract = schema.resolveContractSettingsForTable(parentTable != null ? parentTable : tableName);
        context.putTableContract(tableName, contract);
      }
      ContractApplyResult result = schema.applySchemaContract(contract, partialTable, row);
      List<FilterDecision> filters = result.getFilters();
      for (FilterDecision filter : filters) {
        if (filter.getEntity() == ContractEntity.TABLES) {
          LOG.warn("Table {} of schema {} is filtered with mode {}", filter.getName(), schemaName, filter.getMode());
          context.filterTable(filter.getName());
          metrics.incTablesFiltered();
        } else if (filter.getEntity() == ContractEntity.COLUMNS) {
          LOG.warn("Column {} of table {} in schema {} is filtered with mode {}", filter.getName(), tableName,
              schemaName, filter.getMode());
          context.filterColumn(tableName, filter.getName(), filter.getMode());
          metrics.incColumnsFiltered();
        }
      }

      partialTable = result.getPartialTable();
      if (partialTable == null) {
        metrics.incRowsDiscarded();
        return false;
      }
      schema.updateTable(partialTable);
      schemaUpdate.add(partialTable);
      context.putColumnSchema(tableName, schema.getTableColumns(tableName));

      filteredColumns = context.getFilteredColumns(tableName);
      if (filteredColumns != null && !filters.isEmpty()) {
        row = ContractFilter.filterColumns(filteredColumns, row);
        if (row == null) {
          metrics.incRowsDiscarded();
          return false;
        }
      }
    }

    Map<String, ColumnSchema> columns = context.getColumnSchema(tableName);
    if (columns == null || columns.isEmpty()) {
      columns = schema.getTableColumns(tableName);
      context.putColumnSchema(tableName, columns);
    }
    if (!skipWrite) {
      itemStorage.writeDataItem(loadId, schemaName, tableName, row, columns);
      metrics.incRowsWritten(1);
    }
    return true;
  }
}
