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

import io.dlt.avro.AvroConversions;
import io.dlt.avro.RecordBatch;
import io.dlt.common.json.JsonUtils;
import io.dlt.common.json.PuaCodec;
import io.dlt.schema.DataRow;

import com.fasterxml.jackson.databind.ObjectWriter;
import org.apache.avro.generic.GenericRecord;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Writes one json document per line. Columnar batches are written row by row.
 */
public class JsonlDataItemWriter implements DataItemWriter {

  private static final byte NEW_LINE = '\n';

  private final Path path;
  private final boolean puaEncode;
  private final OutputStream out;
  private final ObjectWriter writer = JsonUtils.getObjectMapper().writer();
  private long itemCount = 0;

  /**
   * @param puaEncode encode values json cannot represent with the private use area codec
   */
  public JsonlDataItemWriter(Path path, boolean puaEncode) throws IOException {
    this.path = path;
    this.puaEncode = puaEncode;
    this.out = new BufferedOutputStream(Files.newOutputStream(path));
  }

  @Override
  public void writeRow(DataRow row) throws IOException {
    Map<String, Object> values = row.asMap();
    if (puaEncode) {
      Map<String, Object> encoded = new LinkedHashMap<>();
      for (Map.Entry<String, Object> entry : values.entrySet()) {
        encoded.put(entry.getKey(), PuaCodec.encode(entry.getValue()));
      }
      values = encoded;
    }
    out.write(writer.writeValueAsBytes(values));
    out.write(NEW_LINE);
    itemCount++;
  }

  @Override
  public void writeBatch(RecordBatch batch) throws IOException {
    for (GenericRecord record : batch.getRecords()) {
      writeRow(AvroConversions.toDataRow(record));
    }
  }

  @Override
  public long getItemCount() {
    return itemCount;
  }

  @Override
  public Path getPath() {
    return path;
  }

  @Override
  public void close() throws IOException {
    out.close();
  }
}
