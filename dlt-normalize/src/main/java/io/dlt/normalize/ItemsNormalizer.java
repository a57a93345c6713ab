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

import io.dlt.common.runtime.Signals;
import io.dlt.config.DestinationCapabilities;
import io.dlt.config.NormalizeConfig;
import io.dlt.normalize.metrics.NormalizeMetrics;
import io.dlt.schema.Schema;
import io.dlt.schema.SchemaUpdate;
import io.dlt.storage.DataItemStorage;
import io.dlt.storage.ExtractedItemsStorage;

import java.util.List;

/**
 * Normalizes one extracted items file of a load package into job files, evolving the schema as needed.
 * An instance processes a single file and must have exclusive access to the schema while doing so.
 */
public abstract class ItemsNormalizer {

  protected final DataItemStorage itemStorage;
  protected final ExtractedItemsStorage extractedStorage;
  protected final Schema schema;
  protected final String loadId;
  protected final NormalizeConfig config;
  protected final DestinationCapabilities capabilities;
  protected final Signals signals;
  protected final NormalizeMetrics metrics;

  protected ItemsNormalizer(DataItemStorage itemStorage, ExtractedItemsStorage extractedStorage, Schema schema,
                            String loadId, NormalizeConfig config, DestinationCapabilities capabilities,
                            Signals signals, NormalizeMetrics metrics) {
    this.itemStorage = itemStorage;
    this.extractedStorage = extractedStorage;
    this.schema = schema;
    this.loadId = loadId;
    this.config = config;
    this.capabilities = capabilities;
    this.signals = signals;
    this.metrics = metrics;
  }

  /**
   * @param extractedItemsFile path of the file relative to the extracted storage
   * @param rootTable          table the items of the file belong to
   * @return schema updates committed while processing, in the order they were applied
   * @throws io.dlt.exception.SignalReceivedException if processing was cancelled
   */
  public abstract List<SchemaUpdate> process(String extractedItemsFile, String rootTable);
}
