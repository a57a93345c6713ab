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

import io.dlt.exception.DltIOException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Extracted load packages waiting for normalization: {@code <root>/<load_id>/new_jobs/<items file>}. Files are
 * addressed by paths relative to the storage root.
 */
public class ExtractedItemsStorage {

  private final Path storageRoot;

  public ExtractedItemsStorage(Path storageRoot) {
    this.storageRoot = storageRoot;
  }

  public Path getStorageRoot() {
    return storageRoot;
  }

  public Path makeFullPath(String relativePath) {
    return storageRoot.resolve(relativePath);
  }

  public String makeRelativePath(String loadId, String fileName) {
    return loadId + "/" + DataItemStorage.NEW_JOBS_FOLDER + "/" + fileName;
  }

  public InputStream openFile(String relativePath) {
    try {
      return Files.newInputStream(makeFullPath(relativePath));
    } catch (IOException e) {
      throw new DltIOException("Failed to open extracted file " + relativePath, e);
    }
  }

  public long getFileSize(String relativePath) {
    try {
      return Files.size(makeFullPath(relativePath));
    } catch (IOException e) {
      throw new DltIOException("Failed to stat extracted file " + relativePath, e);
    }
  }

  /**
   * Relative paths of the items files of a load package, sorted by name.
   */
  public List<String> listNewJobs(String loadId) {
    Path newJobs = storageRoot.resolve(loadId).resolve(DataItemStorage.NEW_JOBS_FOLDER);
    if (!Files.isDirectory(newJobs)) {
      return Collections.emptyList();
    }
    try (Stream<Path> files = Files.list(newJobs)) {
      return files.filter(Files::isRegularFile)
          .map(p -> makeRelativePath(loadId, p.getFileName().toString()))
          .sorted()
          .collect(Collectors.toList());
    } catch (IOException e) {
      throw new DltIOException("Failed to list extracted files of load " + loadId, e);
    }
  }
}
