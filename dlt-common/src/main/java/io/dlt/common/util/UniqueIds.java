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

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;

/**
 * Generates the identifiers stored in the {@code _dlt_id} column.
 */
public class UniqueIds {

  // 14 base64 characters, the length of ids produced for every row
  private static final int ID_BYTES = 10;
  private static final int ID_LENGTH = 14;
  private static final SecureRandom RANDOM = new SecureRandom();
  private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();

  private UniqueIds() {
  }

  /**
   * Random, url safe identifier.
   */
  public static String uniqueId() {
    byte[] bytes = new byte[ID_BYTES];
    RANDOM.nextBytes(bytes);
    return ENCODER.encodeToString(bytes).substring(0, ID_LENGTH);
  }

  public static List<String> uniqueIds(int count) {
    List<String> ids = new ArrayList<>(count);
    for (int i = 0; i < count; i++) {
      ids.add(uniqueId());
    }
    return ids;
  }

  /**
   * Deterministic identifier of the same shape as {@link #uniqueId()}, derived from the given value.
   */
  public static String digest(String value) {
    try {
      byte[] hash = MessageDigest.getInstance("SHA-256").digest(value.getBytes(StandardCharsets.UTF_8));
      return ENCODER.encodeToString(hash).substring(0, ID_LENGTH);
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 is not available", e);
    }
  }

  /**
   * Identifier of a child row, stable for the same parent, table and list position.
   */
  public static String childRowId(String parentRowId, String tableName, int position) {
    return digest(parentRowId + "_" + tableName + "_" + position);
  }
}
