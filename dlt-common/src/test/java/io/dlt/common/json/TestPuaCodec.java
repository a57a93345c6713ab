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

package io.dlt.common.json;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class TestPuaCodec {

  @Test
  public void testDecode() {
    assertEquals(new BigDecimal("10.25"), PuaCodec.decode(PuaCodec.PuaType.DECIMAL.prefix() + "10.25"));
    assertEquals(Instant.parse("2024-03-01T10:00:00Z"),
        PuaCodec.decode(PuaCodec.PuaType.DATETIME.prefix() + "2024-03-01T12:00:00+02:00"));
    assertEquals(Instant.parse("2024-03-01T10:00:00Z"),
        PuaCodec.decode(PuaCodec.PuaType.DATETIME.prefix() + "2024-03-01T10:00:00"));
    assertEquals(LocalDate.of(2024, 3, 1), PuaCodec.decode(PuaCodec.PuaType.DATE.prefix() + "2024-03-01"));
    assertArrayEquals(new byte[] {1, (byte) 0xff}, (byte[]) PuaCodec.decode(PuaCodec.PuaType.HEXBYTES.prefix() + "01ff"));
    assertEquals(new BigInteger("340282366920938463463374607431768211455"),
        PuaCodec.decode(PuaCodec.PuaType.WEI.prefix() + "340282366920938463463374607431768211455"));
    assertEquals(LocalTime.of(10, 30), PuaCodec.decode(PuaCodec.PuaType.TIME.prefix() + "10:30"));
  }

  @Test
  public void testPlainValuesAreUnchanged() {
    String text = "plain";
    assertSame(text, PuaCodec.decode(text));
    assertEquals(5L, PuaCodec.decode(5L));
    assertEquals("x", PuaCodec.decode("x"));
  }

  @Test
  public void testEncodeDecodesBack() {
    Object encoded = PuaCodec.encode(new BigDecimal("1.5"));
    assertEquals(new BigDecimal("1.5"), PuaCodec.decode(encoded));
    assertEquals("text", PuaCodec.encode("text"));
  }

  @Test
  public void testMayHavePua() {
    assertTrue(PuaCodec.mayHavePua(("{\"a\": \"" + PuaCodec.PuaType.DECIMAL.prefix() + "1.0\"}")
        .getBytes(StandardCharsets.UTF_8)));
    assertFalse(PuaCodec.mayHavePua("{\"a\": \"1.0\"}".getBytes(StandardCharsets.UTF_8)));
  }
}
