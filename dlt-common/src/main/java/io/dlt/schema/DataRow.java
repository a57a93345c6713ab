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

package io.dlt.schema;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Ordered, mutable row of column values.
 *
 * <p>Values are limited to the Java representations of {@link DataType}s: {@code String}, {@code Long},
 * {@code Double}, {@code Boolean}, {@code BigDecimal}, {@code BigInteger}, {@code Instant},
 * {@code LocalDate}, {@code LocalTime}, {@code byte[]}, and {@code Map} or {@code List} for json.
 * Narrower numeric types and other date-time types are widened on {@link #put}. Null values are kept.
 */
public class DataRow implements Iterable<Map.Entry<String, Object>> {

  private final LinkedHashMap<String, Object> values;

  public DataRow() {
    this.values = new LinkedHashMap<>();
  }

  public DataRow(Map<String, ?> values) {
    this.values = new LinkedHashMap<>(Math.max(16, values.size() * 2));
    for (Map.Entry<String, ?> entry : values.entrySet()) {
      put(entry.getKey(), entry.getValue());
    }
  }

  public static DataRow of(Object... keysAndValues) {
    if (keysAndValues.length % 2 != 0) {
      throw new IllegalArgumentException("Expected key value pairs");
    }
    DataRow row = new DataRow();
    for (int i = 0; i < keysAndValues.length; i += 2) {
      row.put((String) keysAndValues[i], keysAndValues[i + 1]);
    }
    return row;
  }

  public DataRow put(String column, Object value) {
    values.put(column, checkValue(column, value));
    return this;
  }

  public Object get(String column) {
    return values.get(column);
  }

  public Object remove(String column) {
    return values.remove(column);
  }

  public boolean containsKey(String column) {
    return values.containsKey(column);
  }

  public Set<String> keySet() {
    return values.keySet();
  }

  public int size() {
    return values.size();
  }

  public boolean isEmpty() {
    return values.isEmpty();
  }

  public Map<String, Object> asMap() {
    return Collections.unmodifiableMap(values);
  }

  public DataRow copy() {
    DataRow copy = new DataRow();
    copy.values.putAll(values);
    return copy;
  }

  @Override
  public Iterator<Map.Entry<String, Object>> iterator() {
    return values.entrySet().iterator();
  }

  static Object checkValue(String column, Object value) {
    if (value == null
        || value instanceof String
        || value instanceof Long
        || value instanceof Double
        || value instanceof Boolean
        || value instanceof BigDecimal
        || value instanceof BigInteger
        || value instanceof Instant
        || value instanceof LocalDate
        || value instanceof LocalTime
        || value instanceof byte[]
        || value instanceof Map
        || value instanceof List) {
      return value;
    }
    if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
      return ((Number) value).longValue();
    }
    if (value instanceof Float) {
      return ((Float) value).doubleValue();
    }
    if (value instanceof OffsetDateTime) {
      return ((OffsetDateTime) value).toInstant();
    }
    if (value instanceof ZonedDateTime) {
      return ((ZonedDateTime) value).toInstant();
    }
    if (value instanceof UUID || value instanceof CharSequence) {
      return value.toString();
    }
    throw new IllegalArgumentException(
        "Value of type " + value.getClass().getName() + " is not supported in column " + column);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    return values.equals(((DataRow) o).values);
  }

  @Override
  public int hashCode() {
    return values.hashCode();
  }

  @Override
  public String toString() {
    return values.toString();
  }
}
