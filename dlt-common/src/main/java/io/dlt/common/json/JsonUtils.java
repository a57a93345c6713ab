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

import io.dlt.exception.DltException;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.util.Collections;
import java.util.List;

/**
 * Shared Jackson mapper and helpers to read and write items in newline-delimited files.
 */
public class JsonUtils {

  private static final ObjectMapper MAPPER = new ObjectMapper()
      .registerModule(new JavaTimeModule())
      .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
      .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

  private JsonUtils() {
  }

  public static ObjectMapper getObjectMapper() {
    return MAPPER;
  }

  /**
   * Parses one line of an extracted items file. A line holds either a JSON array of items or a single item.
   */
  @SuppressWarnings("unchecked")
  public static List<Object> parseItems(byte[] line) throws IOException {
    Object parsed = MAPPER.readValue(line, Object.class);
    if (parsed == null) {
      return Collections.emptyList();
    }
    if (parsed instanceof List) {
      return (List<Object>) parsed;
    }
    return Collections.singletonList(parsed);
  }

  public static String toJson(Object value) {
    try {
      return MAPPER.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new DltException("Could not serialize value to json", e);
    }
  }

  public static Object fromJson(String json) {
    try {
      return MAPPER.readValue(json, Object.class);
    } catch (IOException e) {
      throw new DltException("Could not parse json " + json, e);
    }
  }
}
