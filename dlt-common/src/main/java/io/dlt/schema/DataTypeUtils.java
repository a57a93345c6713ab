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

import io.dlt.common.json.JsonUtils;

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
import java.util.List;
import java.util.Map;

/**
 * Infers data types of row values and coerces values between data types.
 */
public class DataTypeUtils {

  private static final BigInteger LONG_MIN = BigInteger.valueOf(Long.MIN_VALUE);
  private static final BigInteger LONG_MAX = BigInteger.valueOf(Long.MAX_VALUE);

  private DataTypeUtils() {
  }

  /**
   * Data type of a non null row value.
   */
  public static DataType inferDataType(Object value) {
    if (value instanceof String) {
      return DataType.TEXT;
    } else if (value instanceof Boolean) {
      return DataType.BOOL;
    } else if (value instanceof Long) {
      return DataType.BIGINT;
    } else if (value instanceof Double) {
      return DataType.DOUBLE;
    } else if (value instanceof BigDecimal) {
      return DataType.DECIMAL;
    } else if (value instanceof BigInteger) {
      return DataType.WEI;
    } else if (value instanceof Instant) {
      return DataType.TIMESTAMP;
    } else if (value instanceof LocalDate) {
      return DataType.DATE;
    } else if (value instanceof LocalTime) {
      return DataType.TIME;
    } else if (value instanceof byte[]) {
      return DataType.BINARY;
    } else if (value instanceof Map || value instanceof List) {
      return DataType.JSON;
    }
    throw new IllegalArgumentException("Cannot infer data type of " + value.getClass().getName());
  }

  /**
   * Coerces {@code value} of type {@code fromType} into {@code toType}.
   *
   * @throws IllegalArgumentException if the value cannot be represented in {@code toType}
   */
  public static Object coerceValue(DataType toType, DataType fromType, Object value) {
    if (toType == fromType) {
      return value;
    }
    try {
      switch (toType) {
        case TEXT:
          return toText(fromType, value);
        case JSON:
          if (fromType == DataType.TEXT) {
            Object parsed = JsonUtils.fromJson((String) value);
            if (parsed instanceof Map || parsed instanceof List) {
              return parsed;
            }
          }
          break;
        case BINARY:
          if (fromType == DataType.TEXT) {
            return Base64.getDecoder().decode((String) value);
          }
          break;
        case BIGINT:
          return toBigint(fromType, value);
        case DOUBLE:
          if (value instanceof Number) {
            return ((Number) value).doubleValue();
          }
          if (fromType == DataType.TEXT) {
            return Double.parseDouble((String) value);
          }
          break;
        case DECIMAL:
          return toDecimal(fromType, value);
        case WEI:
          return toWei(fromType, value);
        case BOOL:
          return toBool(fromType, value);
        case TIMESTAMP:
          return toTimestamp(fromType, value);
        case DATE:
          return toDate(fromType, value);
        case TIME:
          if (fromType == DataType.TEXT) {
            return LocalTime.parse((String) value);
          }
          if (fromType == DataType.TIMESTAMP) {
            return LocalTime.ofInstant((Instant) value, ZoneOffset.UTC);
          }
          break;
        default:
          break;
      }
    } catch (NumberFormatException | DateTimeParseException | ArithmeticException e) {
      throw new IllegalArgumentException(
          String.format("Cannot coerce %s value %s to %s", fromType, value, toType), e);
    }
    throw new IllegalArgumentException(String.format("Cannot coerce %s value %s to %s", fromType, value, toType));
  }

  private static Object toText(DataType fromType, Object value) {
    switch (fromType) {
      case JSON:
        return JsonUtils.toJson(value);
      case BINARY:
        return Base64.getEncoder().encodeToString((byte[]) value);
      case DECIMAL:
        return ((BigDecimal) value).toPlainString();
      default:
        return value.toString();
    }
  }

  private static Object toBigint(DataType fromType, Object value) {
    switch (fromType) {
      case DOUBLE:
        double d = (Double) value;
        if (d % 1 != 0) {
          throw new IllegalArgumentException("Double " + d + " has a fraction");
        }
        return (long) d;
      case DECIMAL:
        return ((BigDecimal) value).longValueExact();
      case WEI:
        BigInteger wei = (BigInteger) value;
        if (wei.compareTo(LONG_MIN) < 0 || wei.compareTo(LONG_MAX) > 0) {
          throw new IllegalArgumentException("Wei " + wei + " does not fit into bigint");
        }
        return wei.longValue();
      case TEXT:
        return Long.parseLong(((String) value).trim());
      case BOOL:
        return ((Boolean) value) ? 1L : 0L;
      default:
        throw new IllegalArgumentException("Cannot coerce " + fromType + " to bigint");
    }
  }

  private static Object toDecimal(DataType fromType, Object value) {
    switch (fromType) {
      case BIGINT:
        return BigDecimal.valueOf((Long) value);
      case DOUBLE:
        return BigDecimal.valueOf((Double) value);
      case WEI:
        return new BigDecimal((BigInteger) value);
      case TEXT:
        return new BigDecimal(((String) value).trim());
      default:
        throw new IllegalArgumentException("Cannot coerce " + fromType + " to decimal");
    }
  }

  private static Object toWei(DataType fromType, Object value) {
    switch (fromType) {
      case BIGINT:
        return BigInteger.valueOf((Long) value);
      case DECIMAL:
        return ((BigDecimal) value).toBigIntegerExact();
      case TEXT:
        return new BigInteger(((String) value).trim());
      default:
        throw new IllegalArgumentException("Cannot coerce " + fromType + " to wei");
    }
  }

  private static Object toBool(DataType fromType, Object value) {
    if (fromType == DataType.TEXT) {
      String s = ((String) value).trim().toLowerCase();
      if ("true".equals(s)) {
        return Boolean.TRUE;
      } else if ("false".equals(s)) {
        return Boolean.FALSE;
      }
    } else if (fromType == DataType.BIGINT) {
      long l = (Long) value;
      if (l == 0 || l == 1) {
        return l == 1;
      }
    }
    throw new IllegalArgumentException("Cannot coerce " + value + " to bool");
  }

  private static Object toTimestamp(DataType fromType, Object value) {
    switch (fromType) {
      case TEXT:
        return parseTimestamp(((String) value).trim());
      case BIGINT:
        return Instant.ofEpochSecond((Long) value);
      case DOUBLE:
        double seconds = (Double) value;
        long whole = (long) Math.floor(seconds);
        return Instant.ofEpochSecond(whole, Math.round((seconds - whole) * 1_000_000) * 1000);
      case DATE:
        return ((LocalDate) value).atStartOfDay(ZoneOffset.UTC).toInstant();
      default:
        throw new IllegalArgumentException("Cannot coerce " + fromType + " to timestamp");
    }
  }

  private static Object toDate(DataType fromType, Object value) {
    switch (fromType) {
      case TEXT:
        return LocalDate.parse(((String) value).trim());
      case TIMESTAMP:
        return LocalDate.ofInstant((Instant) value, ZoneOffset.UTC);
      case BIGINT:
        return LocalDate.ofInstant(Instant.ofEpochSecond((Long) value), ZoneOffset.UTC);
      default:
        throw new IllegalArgumentException("Cannot coerce " + fromType + " to date");
    }
  }

  /**
   * Parses an ISO timestamp, timestamps without an offset are UTC.
   */
  public static Instant parseTimestamp(String text) {
    try {
      return OffsetDateTime.parse(text).toInstant();
    } catch (DateTimeParseException e) {
      try {
        return LocalDateTime.parse(text).toInstant(ZoneOffset.UTC);
      } catch (DateTimeParseException e2) {
        return LocalDate.parse(text).atStartOfDay(ZoneOffset.UTC).toInstant();
      }
    }
  }
}
