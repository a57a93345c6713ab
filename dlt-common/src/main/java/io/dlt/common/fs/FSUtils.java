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

package io.dlt.common.fs;

import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.fs.Path;
import org.apache.hadoop.fs.RawLocalFileSystem;

/**
 * Utility functions related to accessing the file storage through Hadoop.
 */
public class FSUtils {

  private FSUtils() {
  }

  /**
   * Returns a copy of {@code conf} that reads and writes job files through the raw local file system.
   * The passed configuration is left untouched.
   */
  public static Configuration prepareHadoopConf(Configuration conf) {
    Configuration prepared = new Configuration(conf);
    // raw local file system does not write .crc side files next to job files
    prepared.set("fs.file.impl", RawLocalFileSystem.class.getName());
    prepared.setBoolean("fs.file.impl.disable.cache", true);
    return prepared;
  }

  public static Configuration getDefaultHadoopConf() {
    return prepareHadoopConf(new Configuration());
  }

  public static Path toHadoopPath(java.nio.file.Path path) {
    return new Path(path.toAbsolutePath().toUri());
  }
}
