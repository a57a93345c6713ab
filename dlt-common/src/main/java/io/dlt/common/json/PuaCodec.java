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

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Base64;
import java.util.UUID;

/**
 * Encodes values that JSON cannot represent natively as strings prefixed with a character from the
 * Unicode private use area. The prefix selects the decoder. Extracted item files carry such values
 * and the normalizer decodes them before coercion.
 */
public class PuaCodec {

  public static final int PUA_START = 0xF026;

  // UTF-8 prefix shared by all code points in U+F000..U+F0FF
  private static final byte MAGIC_0 = (byte) 0xEF;
  private static final byte MAGIC_1 = (byte) 0x80;

  /**
   * Encoded types, in PUA offset order.
   */
  public enum PuaType {
    DECIMAL,
    DATETIME,
    DATE,
    UUID,
    HEXBYTES,
    B64BYTES,
    WEI,
    TIME;

    public char prefix() {
      return (char) (PUA_START + ordinal());
    }
  }

  private static final PuaType[] TYPES = PuaType.values();

  private PuaCodec() {
  }

  /**
   * Cheap pre-scan of an encoded line: {@code false} guarantees that no value in the line needs decoding.
   */
  public static boolean mayHavePua(byte[] line) {
    for (int i = 0; i < line.length - 1; i++) {
      if (line[i] == MAGIC_0 && line[i + 1] == MAGIC_1) {
        return true;
      }
    }
    return false;
  }

  /**
   * Decodes a single value. Values that are not PUA encoded strings are returned unchanged.
   */
  public static Object decode(Object value) {
    if (!(value instanceof String)) {
      return value;
    }
    String s = (String) value;
    if (s.length() < 2) {
      return value;
    }
    int offset = s.charAt(0) - PUA_START;
    if (offset < 0 || offset >= TYPES.length) {
      return value;
    }
    String payload = s.substring(1);
    switch (TYPES[offset]) {
      case DECIMAL:
        return new BigDecimal(payload);
      case DATETIME:
        return parseInstant(payload);
      case DATE:
        return LocalDate.parse(payload);
      case UUID:
        return payload;
      case HEXBYTES:
        return hexToBytes(payload);
      case B64BYTES:
        return Base64.getDecoder().decode(payload);
      case WEI:
        return new BigInteger(payload);
      case TIME:
        return LocalTime.parse(payload);
      default:
        return value;
    }
  }

  /**
   * Encodes a value for an extracted items file; plain JSON values are returned unchanged.
   */
  public static Object encode(Object value) {
    if (value instanceof BigDecimal) {
      return PuaType.DECIMAL.prefix() + ((BigDecimal) value).toPlainString();
    } else if (value instanceof Instant) {
      return PuaType.DATETIME.prefix() + value.toString();
    } else if (value instanceof OffsetDateTime) {
      return PuaType.DATETIME.prefix() + value.toString();
    } else if (value instanceof LocalDate) {
      return PuaType.DATE.prefix() + value.toString();
    } else if (value instanceof UUID) {
      return PuaType.UUID.prefix() + value.toString();
    } else if (value instanceof byte[]) {
      return PuaType.B64BYTES.prefix() + Base64.getEncoder().encodeToString((byte[]) value);
    } else if (value instanceof BigInteger) {
      return PuaType.WEI.prefix() + value.toString();
    } else if (value instanceof LocalTime) {
      return PuaType.TIME.prefix() + value.toString();
    }
    return value;
  }

  static Instant parseInstant(String text) {
    try {
      return OffsetDateTime.parse(text).toInstant();
    } catch (DateTimeParseException e) {
      // naive datetimes are UTC
      return LocalDateTime.parse(text).toInstant(ZoneOffset.UTC);
    }
  }

  private static byte[] hexToBytes(String hex) {
    String digits = hex.startsWith("0x") ? hex.substring(2) : hex;
    byte[] bytes = new byte[digits.length() / 2];
    for (int i = 0; i < bytes.length; i++) {
      bytes[i] = (byte) Integer.parseInt(digits.substring(2 * i, 2 * i + 2), 16);
    }
    return bytes;
  }
}
