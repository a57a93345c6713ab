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

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class TestDataRow {

  @Test
  public void testValuesAreWidened() {
    UUID uuid = UUID.randomUUID();
    DataRow row = DataRow.of("int", 1, "float", 1.5f, "uuid", uuid,
        "ts", OffsetDateTime.of(2024, 1, 1, 12, 0, 0, 0, ZoneOffset.ofHours(2)), "none", null);
    assertEquals(1L, row.get("int"));
    assertEquals(1.5d, row.get("float"));
    assertEquals(uuid.toString(), row.get("uuid"));
    assertEquals(Instant.parse("2024-01-01T10:00:00Z"), row.get("ts"));
    assertTrue(row.containsKey("none"));
    assertNull(row.get("none"));
  }

  @Test
  public void testKeepsInsertionOrder() {
    DataRow row = DataRow.of("b", 1, "a", 2);
    row.put("c", 3);
    row.remove("b");
    assertEquals(Arrays.asList("a", "c"), Arrays.asList(row.keySet().toArray()));
  }

  @Test
  public void testRejectsUnsupportedValues() {
    assertThrows(IllegalArgumentException.class, () -> new DataRow().put("x", new Object()));
  }
}
