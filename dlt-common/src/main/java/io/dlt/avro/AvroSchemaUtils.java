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
import io.dlt.schema.ColumnSchema;

import org.apache.avro.JsonProperties;
import org.apache.avro.LogicalType;
import org.apache.avro.LogicalTypes;
import org.apache.avro.Schema;
import org.apache.avro.generic.GenericData;
import org.apache.avro.generic.GenericRecord;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Maps table columns to Avro record schemas and manipulates record schemas.
 */
public class AvroSchemaUtils {

  public static final String NAMESPACE = "io.dlt";

  private static final int DEFAULT_DECIMAL_PRECISION = 38;
  private static final int DEFAULT_DECIMAL_SCALE = 9;
  private static final int DEFAULT_WEI_PRECISION = 76;
  private static final int DEFAULT_WEI_SCALE = 0;
  private static final int DEFAULT_TIMESTAMP_PRECISION = 6;

  private AvroSchemaUtils() {
  }

  public static Schema toAvroSchema(String tableName, Map<String, ColumnSchema> columns) {
    return toAvroSchema(tableName, columns, null);
  }

  /**
   * Record schema with one field per column, in column order.
   *
   * @param capabilities supply decimal and wei precision for columns without hints, may be {@code null}
   */
  public static Schema toAvroSchema(String tableName, Map<String, ColumnSchema> columns,
                                    DestinationCapabilities capabilities) {
    List<Schema.Field> fields = new ArrayList<>(columns.size());
    for (ColumnSchema column : columns.values()) {
      fields.add(toAvroField(column, capabilities));
    }
    Schema record = Schema.createRecord(tableName, null, NAMESPACE, false);
    record.setFields(fields);
    return record;
  }

  public static Schema.Field toAvroField(ColumnSchema column, DestinationCapabilities capabilities) {
    Schema type = toAvroType(column, capabilities);
    if (column.isNullable()) {
      return new Schema.Field(column.getName(), createNullableSchema(type), null, JsonProperties.NULL_VALUE);
    }
    return new Schema.Field(column.getName(), type, null, (Object) null);
  }

  /**
   * Non null Avro type of a column.
   */
  public static Schema toAvroType(ColumnSchema column, DestinationCapabilities capabilities) {
    switch (column.getDataType()) {
      case TEXT:
      case JSON:
        return Schema.create(Schema.Type.STRING);
      case DOUBLE:
        return Schema.create(Schema.Type.DOUBLE);
      case BOOL:
        return Schema.create(Schema.Type.BOOLEAN);
      case BIGINT:
        return Schema.create(Schema.Type.LONG);
      case BINARY:
        return Schema.create(Schema.Type.BYTES);
      case DATE:
        return LogicalTypes.date().addToSchema(Schema.create(Schema.Type.INT));
      case TIMESTAMP:
        return timePrecisionType(column, capabilities, LogicalTypes.timestampMillis(), LogicalTypes.timestampMicros());
      case TIME:
        return timePrecisionType(column, capabilities, LogicalTypes.timeMillis(), LogicalTypes.timeMicros());
      case DECIMAL:
        return decimalType(column,
            capabilities == null ? DEFAULT_DECIMAL_PRECISION : capabilities.getDecimalPrecision(),
            capabilities == null ? DEFAULT_DECIMAL_SCALE : capabilities.getDecimalScale());
      case WEI:
        return decimalType(column,
            capabilities == null ? DEFAULT_WEI_PRECISION : capabilities.getWeiPrecision(),
            capabilities == null ? DEFAULT_WEI_SCALE : capabilities.getWeiScale());
      default:
        throw new IllegalArgumentException("Unsupported data type " + column.getDataType());
    }
  }

  private static Schema timePrecisionType(ColumnSchema column, DestinationCapabilities capabilities,
                                          LogicalType millis, LogicalType micros) {
    int precision = column.getPrecision() != null ? column.getPrecision()
        : capabilities == null ? DEFAULT_TIMESTAMP_PRECISION : capabilities.getTimestampPrecision();
    // time-millis is an int, time-micros and both timestamps are longs
    Schema.Type millisType = millis instanceof LogicalTypes.TimeMillis ? Schema.Type.INT : Schema.Type.LONG;
    if (precision <= 3) {
      return millis.addToSchema(Schema.create(millisType));
    }
    return micros.addToSchema(Schema.create(Schema.Type.LONG));
  }

  private static Schema decimalType(ColumnSchema column, int defaultPrecision, int defaultScale) {
    int precision = column.getPrecision() != null ? column.getPrecision() : defaultPrecision;
    int scale = column.getScale() != null ? column.getScale() : defaultScale;
    return LogicalTypes.decimal(precision, scale).addToSchema(Schema.create(Schema.Type.BYTES));
  }

  public static Schema createNullableSchema(Schema schema) {
    if (isNullable(schema)) {
      return schema;
    }
    return Schema.createUnion(Arrays.asList(Schema.create(Schema.Type.NULL), schema));
  }

  public static boolean isNullable(Schema schema) {
    if (schema.getType() == Schema.Type.NULL) {
      return true;
    }
    if (schema.getType() != Schema.Type.UNION) {
      return false;
    }
    return schema.getTypes().stream().anyMatch(s -> s.getType() == Schema.Type.NULL);
  }

  /**
   * Non null branch of a nullable union, the schema itself otherwise.
   */
  public static Schema getNonNullType(Schema schema) {
    if (schema.getType() != Schema.Type.UNION) {
      return schema;
    }
    for (Schema type : schema.getTypes()) {
      if (type.getType() != Schema.Type.NULL) {
        return type;
      }
    }
    throw new IllegalArgumentException("Union schema has no non null type: " + schema);
  }

  /**
   * Copy of a field under a new name and nullability. The default value survives only if the field schema
   * did not change.
   */
  public static Schema.Field copyField(Schema.Field field, String name, boolean nullable) {
    Schema schema = nullable ? createNullableSchema(field.schema()) : getNonNullType(field.schema());
    if (schema.equals(field.schema())) {
      return new Schema.Field(name, schema, field.doc(), field.defaultVal());
    }
    return new Schema.Field(name, schema, field.doc(), nullable ? JsonProperties.NULL_VALUE : null);
  }

  public static Schema.Field copyField(Schema.Field field) {
    return new Schema.Field(field.name(), field.schema(), field.doc(), field.defaultVal());
  }

  /**
   * Record schema named like {@code template} with the given fields.
   */
  public static Schema createRecord(Schema template, List<Schema.Field> fields) {
    Schema record = Schema.createRecord(template.getName(), template.getDoc(), template.getNamespace(), false);
    for (Map.Entry<String, Object> prop : template.getObjectProps().entrySet()) {
      record.addProp(prop.getKey(), prop.getValue());
    }
    record.setFields(fields);
    return record;
  }

  /**
   * Copies the values of the fields present in both schemas into a record of {@code newSchema}.
   */
  public static GenericRecord rewriteRecord(GenericRecord oldRecord, Schema newSchema) {
    GenericRecord newRecord = new GenericData.Record(newSchema);
    for (Schema.Field field : newSchema.getFields()) {
      Schema.Field oldField = oldRecord.getSchema().getField(field.name());
      if (oldField != null) {
        newRecord.put(field.pos(), oldRecord.get(oldField.pos()));
      }
    }
    return newRecord;
  }
}
