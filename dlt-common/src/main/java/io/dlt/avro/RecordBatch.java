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

package io.dlt.avro;

import org.apache.avro.Schema;
import org.apache.avro.generic.GenericRecord;

import java.util.Collections;
import java.util.List;

/**
 * Chunk of columnar data: records that share one Avro schema.
 */
public class RecordBatch {

  private final Schema schema;
  private final List<GenericRecord> records;

  public RecordBatch(Schema schema, List<GenericRecord> records) {
    this.schema = schema;
    this.records = records;
  }

  public Schema getSchema() {
    return schema;
  }

  public List<GenericRecord> getRecords() {
    return Collections.unmodifiableList(records);
  }

  public int getNumRows() {
    return records.size();
  }

  public boolean isEmpty() {
    return records.isEmpty();
  }
}
