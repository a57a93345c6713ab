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

package io.dlt.common.util;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;

public class TestUniqueIds {

  @Test
  public void testUniqueIds() {
    List<String> ids = UniqueIds.uniqueIds(1000);
    assertEquals(1000, new HashSet<>(ids).size());
    assertEquals(14, ids.get(0).length());
  }

  @Test
  public void testChildRowIdIsStable() {
    String id = UniqueIds.childRowId("parent", "items__child", 1);
    assertEquals(id, UniqueIds.childRowId("parent", "items__child", 1));
    assertNotEquals(id, UniqueIds.childRowId("parent", "items__child", 2));
    assertEquals(14, id.length());
  }
}
