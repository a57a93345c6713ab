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

import io.dlt.common.util.UniqueIds;
import io.dlt.exception.InvalidJobFileNameException;

import java.util.Objects;

/**
 * Name of an extracted items file or load job file: {@code table.file_id.retry_count.format}.
 */
public class LoadJobFileName {

  private final String tableName;
  private final String fileId;
  private final int retryCount;
  private final String fileFormat;

  public LoadJobFileName(String tableName, String fileId, int retryCount, String fileFormat) {
    this.tableName = tableName;
    this.fileId = fileId;
    this.retryCount = retryCount;
    this.fileFormat = fileFormat;
  }

  public static LoadJobFileName newJob(String tableName, FileFormat fileFormat) {
    return new LoadJobFileName(tableName, newFileId(), 0, fileFormat.value());
  }

  public static String newFileId() {
    return UniqueIds.uniqueId().substring(0, 10);
  }

  /**
   * Parses the last segment of a path.
   */
  public static LoadJobFileName parse(String path) {
    String fileName = path;
    int slash = Math.max(path.lastIndexOf('/'), path.lastIndexOf('\\'));
    if (slash >= 0) {
      fileName = path.substring(slash + 1);
    }
    String[] parts = fileName.split("\\.");
    if (parts.length != 4 || parts[0].isEmpty() || parts[1].isEmpty() || parts[3].isEmpty()) {
      throw new InvalidJobFileNameException(fileName);
    }
    try {
      return new LoadJobFileName(parts[0], parts[1], Integer.parseInt(parts[2]), parts[3]);
    } catch (NumberFormatException e) {
      throw new InvalidJobFileNameException(fileName);
    }
  }

  public String getTableName() {
    return tableName;
  }

  public String getFileId() {
    return fileId;
  }

  public int getRetryCount() {
    return retryCount;
  }

  public String getFileFormat() {
    return fileFormat;
  }

  public String fileName() {
    return tableName + "." + fileId + "." + retryCount + "." + fileFormat;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    LoadJobFileName that = (LoadJobFileName) o;
    return retryCount == that.retryCount && tableName.equals(that.tableName) && fileId.equals(that.fileId)
        && fileFormat.equals(that.fileFormat);
  }

  @Override
  public int hashCode() {
    return Objects.hash(tableName, fileId, retryCount, fileFormat);
  }

  @Override
  public String toString() {
    return fileName();
  }
}
