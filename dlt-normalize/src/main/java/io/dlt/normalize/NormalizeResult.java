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

package io.dlt.normalize;

import io.dlt.schema.SchemaUpdate;
import io.dlt.storage.DataWriteStat;

import java.util.Collections;
import java.util.List;

/**
 * Outcome of normalizing the files of one load package.
 */
public class NormalizeResult {

  private final List<SchemaUpdate> schemaUpdates;
  private final List<DataWriteStat> writerMetrics;

  public NormalizeResult(List<SchemaUpdate> schemaUpdates, List<DataWriteStat> writerMetrics) {
    this.schemaUpdates = Collections.unmodifiableList(schemaUpdates);
    this.writerMetrics = Collections.unmodifiableList(writerMetrics);
  }

  /**
   * Schema updates in the order they were applied.
   */
  public List<SchemaUpdate> getSchemaUpdates() {
    return schemaUpdates;
  }

  public SchemaUpdate getMergedSchemaUpdate() {
    return SchemaUpdate.mergeAll(schemaUpdates);
  }

  /**
   * Stats of the job files written or imported.
   */
  public List<DataWriteStat> getWriterMetrics() {
    return writerMetrics;
  }
}
