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

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * Statistics about a single load job file.
 */
public class DataWriteStat implements Serializable {

  private String path;
  private String tableName;
  private String fileFormat;
  private long itemCount;
  private long fileSizeInBytes;
  // columns the file was written with, empty for imported files
  private List<String> columns = new ArrayList<>();
  private boolean imported;

  public String getPath() {
    return path;
  }

  public void setPath(String path) {
    this.path = path;
  }

  public String getTableName() {
    return tableName;
  }

  public void setTableName(String tableName) {
    this.tableName = tableName;
  }

  public String getFileFormat() {
    return fileFormat;
  }

  public void setFileFormat(String fileFormat) {
    this.fileFormat = fileFormat;
  }

  public long getItemCount() {
    return itemCount;
  }

  public void setItemCount(long itemCount) {
    this.itemCount = itemCount;
  }

  public long getFileSizeInBytes() {
    return fileSizeInBytes;
  }

  public void setFileSizeInBytes(long fileSizeInBytes) {
    this.fileSizeInBytes = fileSizeInBytes;
  }

  public List<String> getColumns() {
    return columns;
  }

  public void setColumns(List<String> columns) {
    this.columns = columns;
  }

  public boolean isImported() {
    return imported;
  }

  public void setImported(boolean imported) {
    this.imported = imported;
  }

  @Override
  public String toString() {
    return "DataWriteStat{path='" + path + '\'' + ", tableName='" + tableName + '\'' + ", fileFormat='" + fileFormat
        + '\'' + ", itemCount=" + itemCount + ", fileSizeInBytes=" + fileSizeInBytes + ", columns=" + columns
        + ", imported=" + imported + '}';
  }
}
