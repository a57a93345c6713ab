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

package io.dlt.storage.writer;

import org.apache.avro.Schema;
import org.apache.avro.generic.GenericData;
import org.apache.parquet.avro.AvroWriteSupport;
import org.apache.parquet.hadoop.api.WriteSupport;
import org.apache.parquet.schema.MessageType;

import java.util.HashMap;
import java.util.Map;

/**
 * Wrap AvroWriteSupport for adding the load id and table name to the parquet footer.
 */
public class DltAvroWriteSupport<T> extends AvroWriteSupport<T> {

  public static final String DLT_LOAD_ID_FOOTER = "dlt.load_id";
  public static final String DLT_TABLE_NAME_FOOTER = "dlt.table_name";

  private final Map<String, String> footerMetadata = new HashMap<>();

  public DltAvroWriteSupport(MessageType schema, Schema avroSchema, String loadId, String tableName) {
    super(schema, avroSchema, GenericData.get());
    footerMetadata.put(DLT_LOAD_ID_FOOTER, loadId);
    footerMetadata.put(DLT_TABLE_NAME_FOOTER, tableName);
  }

  @Override
  public WriteSupport.FinalizedWriteContext finalizeWrite() {
    return new WriteSupport.FinalizedWriteContext(footerMetadata);
  }
}
