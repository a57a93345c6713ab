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

import io.dlt.config.DestinationCapabilities;
import io.dlt.exception.DltException;
import io.dlt.schema.ColumnSchema;
import io.dlt.schema.NamingConvention;
import io.dlt.schema.Schema;

import org.apache.avro.generic.GenericData;
import org.apache.avro.generic.GenericRecord;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Brings columnar batches into the shape of a destination table: field names normalized by the naming
 * convention, fields in table column order, missing table columns added as nulls and field nullability
 * aligned with the columns. Fields unknown to the table are kept after the table columns.
 */
public class ArrowSchemaNormalizer {

  private ArrowSchemaNormalizer() {
  }

  /**
   * Result of comparing a batch schema with table columns.
   */
  public static class NormalizationPlan {

    private final boolean shouldNormalize;
    // normalized name -> field name
    private final LinkedHashMap<String, String> reverseMapping;
    private final Map<String, Boolean> nullableUpdates;
    private final LinkedHashMap<String, ColumnSchema> columns;

    NormalizationPlan(boolean shouldNormalize, LinkedHashMap<String, String> reverseMapping,
                      Map<String, Boolean> nullableUpdates, LinkedHashMap<String, ColumnSchema> columns) {
      this.shouldNormalize = shouldNormalize;
      this.reverseMapping = reverseMapping;
      this.nullableUpdates = nullableUpdates;
      this.columns = columns;
    }

    public boolean shouldNormalize() {
      return shouldNormalize;
    }

    public Map<String, Boolean> getNullableUpdates() {
      return nullableUpdates;
    }

    public Map<String, ColumnSchema> getColumns() {
      return columns;
    }
  }

  public static boolean shouldNormalize(org.apache.avro.Schema schema, Map<String, ColumnSchema> columns,
                                        NamingConvention naming) {
    return plan(schema, columns, naming).shouldNormalize();
  }

  /**
   * Compares the batch schema with the table columns. System columns absent from the batch are not
   * considered, those are added by the normalizer.
   */
  public static NormalizationPlan plan(org.apache.avro.Schema schema, Map<String, ColumnSchema> columns,
                                       NamingConvention naming) {
    LinkedHashMap<String, String> renameMapping = new LinkedHashMap<>();
    LinkedHashMap<String, String> reverseMapping = new LinkedHashMap<>();
    for (org.apache.avro.Schema.Field field : schema.getFields()) {
      String normalized = naming.normalizeIdentifier(field.name());
      String previous = reverseMapping.put(normalized, field.name());
      if (previous != null) {
        throw new DltException(String.format("Arrow schema fields %s and %s normalize to the same name %s",
            previous, field.name(), normalized));
      }
      renameMapping.put(field.name(), normalized);
    }

    Map<String, Boolean> nullableUpdates = new HashMap<>();
    for (org.apache.avro.Schema.Field field : schema.getFields()) {
      String normalized = renameMapping.get(field.name());
      ColumnSchema column = columns.get(normalized);
      if (column != null && AvroSchemaUtils.isNullable(field.schema()) != column.isNullable()) {
        nullableUpdates.put(normalized, column.isNullable());
      }
    }

    String loadIdColumn = naming.normalizeTableIdentifier(Schema.LOAD_ID_COLUMN);
    String idColumn = naming.normalizeTableIdentifier(Schema.ID_COLUMN);
    LinkedHashMap<String, ColumnSchema> tableColumns = new LinkedHashMap<>();
    for (Map.Entry<String, ColumnSchema> entry : columns.entrySet()) {
      String name = entry.getKey();
      boolean dltColumn = name.equals(loadIdColumn) || name.equals(idColumn);
      if (!dltColumn || reverseMapping.containsKey(name)) {
        tableColumns.put(name, entry.getValue());
      }
    }

    boolean skipNormalize = new ArrayList<>(renameMapping.keySet()).equals(new ArrayList<>(renameMapping.values()))
        && new ArrayList<>(renameMapping.values()).equals(new ArrayList<>(tableColumns.keySet()))
        && nullableUpdates.isEmpty();
    return new NormalizationPlan(!skipNormalize, reverseMapping, nullableUpdates, tableColumns);
  }

  /**
   * Renames, reorders and pads the batch to match the table columns. Returns the batch unchanged if it
   * already matches.
   */
  public static RecordBatch normalize(RecordBatch batch, Map<String, ColumnSchema> columns, NamingConvention naming,
                                      DestinationCapabilities capabilities) {
    org.apache.avro.Schema schema = batch.getSchema();
    NormalizationPlan plan = plan(schema, columns, naming);
    if (!plan.shouldNormalize()) {
      return batch;
    }
    LinkedHashMap<String, String> remaining = new LinkedHashMap<>(plan.reverseMapping);
    List<org.apache.avro.Schema.Field> newFields = new ArrayList<>();
    // position of the source field for each new field, -1 for added columns
    List<Integer> sourcePositions = new ArrayList<>();

    for (Map.Entry<String, ColumnSchema> entry : plan.columns.entrySet()) {
      String columnName = entry.getKey();
      String fieldName = remaining.remove(columnName);
      if (fieldName != null) {
        org.apache.avro.Schema.Field field = schema.getField(fieldName);
        boolean nullable = plan.nullableUpdates.containsKey(columnName)
            ? plan.nullableUpdates.get(columnName) : AvroSchemaUtils.isNullable(field.schema());
        newFields.add(AvroSchemaUtils.copyField(field, columnName, nullable));
        sourcePositions.add(field.pos());
      } else {
        newFields.add(AvroSchemaUtils.toAvroField(entry.getValue().withNullable(true), capabilities));
        sourcePositions.add(-1);
      }
    }
    for (Map.Entry<String, String> entry : remaining.entrySet()) {
      org.apache.avro.Schema.Field field = schema.getField(entry.getValue());
      newFields.add(AvroSchemaUtils.copyField(field, entry.getKey(), AvroSchemaUtils.isNullable(field.schema())));
      sourcePositions.add(field.pos());
    }

    org.apache.avro.Schema newSchema = AvroSchemaUtils.createRecord(schema, newFields);
    List<GenericRecord> records = new ArrayList<>(batch.getNumRows());
    for (GenericRecord record : batch.getRecords()) {
      GenericRecord newRecord = new GenericData.Record(newSchema);
      for (int i = 0; i < sourcePositions.size(); i++) {
        int source = sourcePositions.get(i);
        newRecord.put(i, source < 0 ? null : record.get(source));
      }
      records.add(newRecord);
    }
    return new RecordBatch(newSchema, records);
  }
}
