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

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class TestDataTypeUtils {

  @Test
  public void testInferDataType() {
    assertEquals(DataType.TEXT, DataTypeUtils.inferDataType("a"));
    assertEquals(DataType.BIGINT, DataTypeUtils.inferDataType(1L));
    assertEquals(DataType.DOUBLE, DataTypeUtils.inferDataType(1.0d));
    assertEquals(DataType.BOOL, DataTypeUtils.inferDataType(true));
    assertEquals(DataType.DECIMAL, DataTypeUtils.inferDataType(BigDecimal.ONE));
    assertEquals(DataType.WEI, DataTypeUtils.inferDataType(BigInteger.TEN));
    assertEquals(DataType.TIMESTAMP, DataTypeUtils.inferDataType(Instant.EPOCH));
    assertEquals(DataType.DATE, DataTypeUtils.inferDataType(LocalDate.of(2024, 1, 1)));
    assertEquals(DataType.JSON, DataTypeUtils.inferDataType(Collections.emptyMap()));
  }

  @Test
  public void testCoerceValue() {
    assertEquals(5L, DataTypeUtils.coerceValue(DataType.BIGINT, DataType.TEXT, " 5 "));
    assertEquals(5L, DataTypeUtils.coerceValue(DataType.BIGINT, DataType.DOUBLE, 5.0d));
    assertEquals("5", DataTypeUtils.coerceValue(DataType.TEXT, DataType.BIGINT, 5L));
    assertEquals(Instant.parse("2024-01-01T00:00:00Z"),
        DataTypeUtils.coerceValue(DataType.TIMESTAMP, DataType.TEXT, "2024-01-01T00:00:00Z"));
    assertEquals(Instant.ofEpochSecond(60), DataTypeUtils.coerceValue(DataType.TIMESTAMP, DataType.BIGINT, 60L));
  }

  @Test
  public void testCoerceValueFailures() {
    assertThrows(IllegalArgumentException.class,
        () -> DataTypeUtils.coerceValue(DataType.BIGINT, DataType.DOUBLE, 5.5d));
    assertThrows(IllegalArgumentException.class,
        () -> DataTypeUtils.coerceValue(DataType.BIGINT, DataType.TEXT, "abc"));
    assertThrows(IllegalArgumentException.class,
        () -> DataTypeUtils.coerceValue(DataType.DATE, DataType.BOOL, true));
  }
}
