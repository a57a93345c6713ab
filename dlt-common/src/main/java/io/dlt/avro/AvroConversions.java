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

import io.dlt.common.json.JsonUtils;
import io.dlt.schema.DataRow;

import org.apache.avro.Conversions;
import org.apache.avro.LogicalType;
import org.apache.avro.LogicalTypes;
import org.apache.avro.Schema;
import org.apache.avro.generic.GenericData;
import org.apache.avro.generic.GenericFixed;
import org.apache.avro.generic.GenericRecord;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.nio.ByteBuffer;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts row values to and from their Avro representation.
 */
public class AvroConversions {

  private static final Conversions.DecimalConversion DECIMAL_CONVERSION = new Conversions.DecimalConversion();
  private static final Instant EPOCH = Instant.EPOCH;

  private AvroConversions() {
  }

  public static GenericRecord toGenericRecord(Schema recordSchema, DataRow row) {
    GenericRecord record = new GenericData.Record(recordSchema);
    for (Schema.Field field : recordSchema.getFields()) {
      record.put(field.pos(), toAvroValue(field.schema(), row.get(field.name())));
    }
    return record;
  }

  /**
   * Avro representation of a row value for a field of the given schema.
   */
  public static Object toAvroValue(Schema fieldSchema, Object value) {
    if (value == null) {
      return null;
    }
    Schema schema = AvroSchemaUtils.getNonNullType(fieldSchema);
    LogicalType logicalType = schema.getLogicalType();
    switch (schema.getType()) {
      case STRING:
        if (value instanceof Map || value instanceof List) {
          return JsonUtils.toJson(value);
        }
        return value.toString();
      case LONG:
        if (logicalType instanceof LogicalTypes.TimestampMicros) {
          return ChronoUnit.MICROS.between(EPOCH, (Instant) value);
        } else if (logicalType instanceof LogicalTypes.TimestampMillis) {
          return ((Instant) value).toEpochMilli();
        } else if (logicalType instanceof LogicalTypes.TimeMicros) {
          return ((LocalTime) value).toNanoOfDay() / 1000;
        }
        return ((Number) value).longValue();
      case INT:
        if (logicalType instanceof LogicalTypes.Date) {
          return (int) ((LocalDate) value).toEpochDay();
        } else if (logicalType instanceof LogicalTypes.TimeMillis) {
          return (int) (((LocalTime) value).toNanoOfDay() / 1_000_000);
        }
        return ((Number) value).intValue();
      case DOUBLE:
        return ((Number) value).doubleValue();
      case FLOAT:
        return ((Number) value).floatValue();
      case BOOLEAN:
        return value;
      case BYTES:
        if (logicalType instanceof LogicalTypes.Decimal) {
          LogicalTypes.Decimal decimal = (LogicalTypes.Decimal) logicalType;
          BigDecimal bigDecimal = value instanceof BigInteger ? new BigDecimal((BigInteger) value) : (BigDecimal) value;
          return DECIMAL_CONVERSION.toBytes(bigDecimal.setScale(decimal.getScale(), RoundingMode.HALF_UP), schema,
              decimal);
        }
        return ByteBuffer.wrap((byte[]) value);
      default:
        throw new IllegalArgumentException("Unsupported Avro type " + schema.getType() + " for value " + value);
    }
  }

  /**
   * Row of the values of an Avro record, in field order.
   */
  public static DataRow toDataRow(GenericRecord record) {
    DataRow row = new DataRow();
    for (Schema.Field field : record.getSchema().getFields()) {
      row.put(field.name(), fromAvroValue(field.schema(), record.get(field.pos())));
    }
    return row;
  }

  /**
   * Java value of an Avro value, as accepted by {@link DataRow}.
   */
  public static Object fromAvroValue(Schema fieldSchema, Object value) {
    if (value == null) {
      return null;
    }
    Schema schema = AvroSchemaUtils.getNonNullType(fieldSchema);
    LogicalType logicalType = schema.getLogicalType();
    switch (schema.getType()) {
      case STRING:
      case ENUM:
        return value.toString();
      case LONG:
        long l = ((Number) value).longValue();
        if (logicalType instanceof LogicalTypes.TimestampMicros) {
          return EPOCH.plus(l, ChronoUnit.MICROS);
        } else if (logicalType instanceof LogicalTypes.TimestampMillis) {
          return Instant.ofEpochMilli(l);
        } else if (logicalType instanceof LogicalTypes.TimeMicros) {
          return LocalTime.ofNanoOfDay(l * 1000);
        }
        return l;
      case INT:
        int i = ((Number) value).intValue();
        if (logicalType instanceof LogicalTypes.Date) {
          return LocalDate.ofEpochDay(i);
        } else if (logicalType instanceof LogicalTypes.TimeMillis) {
          return LocalTime.ofNanoOfDay(i * 1_000_000L);
        }
        return (long) i;
      case FLOAT:
      case DOUBLE:
        return ((Number) value).doubleValue();
      case BOOLEAN:
        return value;
      case BYTES:
        ByteBuffer buffer = ((ByteBuffer) value).duplicate();
        if (logicalType instanceof LogicalTypes.Decimal) {
          return DECIMAL_CONVERSION.fromBytes(buffer, schema, logicalType);
        }
        byte[] bytes = new byte[buffer.remaining()];
        buffer.get(bytes);
        return bytes;
      case FIXED:
        if (logicalType instanceof LogicalTypes.Decimal) {
          return DECIMAL_CONVERSION.fromFixed((GenericFixed) value, schema, logicalType);
        }
        return ((GenericFixed) value).bytes().clone();
      case RECORD:
        GenericRecord record = (GenericRecord) value;
        Map<String, Object> nested = new LinkedHashMap<>();
        for (Schema.Field field : record.getSchema().getFields()) {
          nested.put(field.name(), fromAvroValue(field.schema(), record.get(field.pos())));
        }
        return nested;
      case ARRAY:
        List<Object> elements = new ArrayList<>();
        for (Object element : (Collection<?>) value) {
          elements.add(fromAvroValue(schema.getElementType(), element));
        }
        return elements;
      case MAP:
        Map<String, Object> map = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
          map.put(entry.getKey().toString(), fromAvroValue(schema.getValueType(), entry.getValue()));
        }
        return map;
      default:
        throw new IllegalArgumentException("Unsupported Avro type " + schema.getType());
    }
  }
}
