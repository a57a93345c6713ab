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

package io.dlt.storage;

/**
 * Encodings of extracted items files and load job files.
 */
public enum FileFormat {
  JSONL("jsonl", true),
  // jsonl with values that json cannot represent encoded in the private use area
  TYPED_JSONL("typed-jsonl", true),
  PARQUET("parquet", true),
  // produced by destinations themselves, never written here
  INSERT_VALUES("insert_values", false);

  private final String value;
  private final boolean writable;

  FileFormat(String value, boolean writable) {
    this.value = value;
    this.writable = writable;
  }

  public String value() {
    return value;
  }

  public boolean isWritable() {
    return writable;
  }

  /**
   * @return format with given name or {@code null} if unknown
   */
  public static FileFormat fromValue(String value) {
    for (FileFormat format : values()) {
      if (format.value.equals(value)) {
        return format;
      }
    }
    return null;
  }

  @Override
  public String toString() {
    return value;
  }
}
