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

import io.dlt.config.DestinationCapabilities;
import io.dlt.config.NormalizeConfig;
import io.dlt.exception.UnsupportedFileFormatException;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * File format a writer produces for items of a given shape.
 */
public class WriterSpec {

  private final FileFormat fileFormat;
  private final ItemFormat itemFormat;

  public WriterSpec(FileFormat fileFormat, ItemFormat itemFormat) {
    this.fileFormat = fileFormat;
    this.itemFormat = itemFormat;
  }

  /**
   * Picks the job file format for the destination, or for its staging area when staging is used. The
   * explicitly configured format, else the destination preference, must be supported; the first writable
   * format of the preference followed by the supported formats wins.
   *
   * @throws UnsupportedFileFormatException if the preferred format is not supported or none can be written
   */
  public static WriterSpec resolve(DestinationCapabilities capabilities, NormalizeConfig config, ItemFormat itemFormat) {
    boolean staging = config.useStaging();
    List<String> supported = staging
        ? capabilities.getSupportedStagingFileFormats() : capabilities.getSupportedLoaderFileFormats();
    String preferred = config.getLoaderFileFormat();
    if (preferred == null) {
      preferred = staging ? capabilities.getPreferredStagingFileFormat() : capabilities.getPreferredLoaderFileFormat();
    }
    if (preferred != null && !supported.contains(preferred)) {
      throw new UnsupportedFileFormatException(preferred, supported, staging);
    }
    List<String> candidates = new ArrayList<>();
    if (preferred != null) {
      candidates.add(preferred);
    }
    candidates.addAll(supported);
    for (String candidate : candidates) {
      FileFormat fileFormat = FileFormat.fromValue(candidate);
      if (fileFormat != null && fileFormat.isWritable()) {
        return new WriterSpec(fileFormat, itemFormat);
      }
    }
    throw new UnsupportedFileFormatException(preferred, supported, staging);
  }

  public FileFormat getFileFormat() {
    return fileFormat;
  }

  public ItemFormat getItemFormat() {
    return itemFormat;
  }

  /**
   * Whether columnar batches are written as single rows, which needs no schema normalization of the batches.
   */
  public boolean isObjectAdapter() {
    return itemFormat == ItemFormat.ARROW && fileFormat != FileFormat.PARQUET;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    WriterSpec that = (WriterSpec) o;
    return fileFormat == that.fileFormat && itemFormat == that.itemFormat;
  }

  @Override
  public int hashCode() {
    return Objects.hash(fileFormat, itemFormat);
  }

  @Override
  public String toString() {
    return "WriterSpec{fileFormat=" + fileFormat + ", itemFormat=" + itemFormat + '}';
  }
}
