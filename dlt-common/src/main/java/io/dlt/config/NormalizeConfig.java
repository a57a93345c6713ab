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

package io.dlt.config;

import javax.annotation.concurrent.Immutable;

import java.io.File;
import java.io.FileReader;
import java.io.IOException;
import java.util.Properties;

import static io.dlt.common.util.ValidationUtils.checkArgument;

/**
 * Normalize stage related config.
 */
@Immutable
public class NormalizeConfig extends DefaultDltConfig {

  // Inject the load id column into every row of a rewritten parquet file
  public static final String PARQUET_ADD_DLT_LOAD_ID_PROP = "dlt.normalize.parquet.add_dlt_load_id";
  public static final String DEFAULT_PARQUET_ADD_DLT_LOAD_ID = "false";
  // Inject a unique row id column into every row of a rewritten parquet file
  public static final String PARQUET_ADD_DLT_ID_PROP = "dlt.normalize.parquet.add_dlt_id";
  public static final String DEFAULT_PARQUET_ADD_DLT_ID = "false";
  // Number of row groups read into a single chunk when a parquet file is rewritten
  public static final String PARQUET_REWRITE_ROW_GROUPS_PROP = "dlt.normalize.parquet.rewrite_row_groups";
  public static final String DEFAULT_PARQUET_REWRITE_ROW_GROUPS = String.valueOf(1);
  public static final String PARQUET_COMPRESSION_CODEC_PROP = "dlt.normalize.parquet.compression";
  public static final String DEFAULT_PARQUET_COMPRESSION_CODEC = "SNAPPY";
  // Nesting level at which nested values are kept as json columns
  public static final String JSON_MAX_NESTING_PROP = "dlt.normalize.json.max_nesting";
  public static final String DEFAULT_JSON_MAX_NESTING = String.valueOf(1000);
  // Explicit loader file format, overrides the destination preference. No default
  public static final String LOADER_FILE_FORMAT_PROP = "dlt.normalize.loader_file_format";
  public static final String USE_STAGING_PROP = "dlt.normalize.use_staging";
  public static final String DEFAULT_USE_STAGING = "false";
  // Rotate a table's job file after that many items, 0 never rotates
  public static final String FILE_MAX_ITEMS_PROP = "dlt.normalize.file_max_items";
  public static final String DEFAULT_FILE_MAX_ITEMS = String.valueOf(0);
  public static final String METRICS_ON_PROP = "dlt.normalize.metrics.on";
  public static final String DEFAULT_METRICS_ON = "false";

  private NormalizeConfig(Properties props) {
    super(props);
  }

  public static NormalizeConfig.Builder newBuilder() {
    return new Builder();
  }

  public boolean addDltLoadId() {
    return Boolean.parseBoolean(props.getProperty(PARQUET_ADD_DLT_LOAD_ID_PROP));
  }

  public boolean addDltId() {
    return Boolean.parseBoolean(props.getProperty(PARQUET_ADD_DLT_ID_PROP));
  }

  public int getRewriteRowGroups() {
    return Integer.parseInt(props.getProperty(PARQUET_REWRITE_ROW_GROUPS_PROP));
  }

  public String getParquetCompressionCodec() {
    return props.getProperty(PARQUET_COMPRESSION_CODEC_PROP);
  }

  public int getMaxNesting() {
    return Integer.parseInt(props.getProperty(JSON_MAX_NESTING_PROP));
  }

  /**
   * @return explicitly requested loader file format or {@code null} to use the destination preference
   */
  public String getLoaderFileFormat() {
    return props.getProperty(LOADER_FILE_FORMAT_PROP);
  }

  public boolean useStaging() {
    return Boolean.parseBoolean(props.getProperty(USE_STAGING_PROP));
  }

  public long getFileMaxItems() {
    return Long.parseLong(props.getProperty(FILE_MAX_ITEMS_PROP));
  }

  public boolean isMetricsOn() {
    return Boolean.parseBoolean(props.getProperty(METRICS_ON_PROP));
  }

  public static class Builder {

    private final Properties props = new Properties();

    public Builder fromFile(File propertiesFile) throws IOException {
      try (FileReader reader = new FileReader(propertiesFile)) {
        this.props.load(reader);
        return this;
      }
    }

    public Builder fromProperties(Properties props) {
      this.props.putAll(props);
      return this;
    }

    public Builder withAddDltLoadId(boolean addDltLoadId) {
      props.setProperty(PARQUET_ADD_DLT_LOAD_ID_PROP, String.valueOf(addDltLoadId));
      return this;
    }

    public Builder withAddDltId(boolean addDltId) {
      props.setProperty(PARQUET_ADD_DLT_ID_PROP, String.valueOf(addDltId));
      return this;
    }

    public Builder withRewriteRowGroups(int rowGroups) {
      props.setProperty(PARQUET_REWRITE_ROW_GROUPS_PROP, String.valueOf(rowGroups));
      return this;
    }

    public Builder withParquetCompressionCodec(String codec) {
      props.setProperty(PARQUET_COMPRESSION_CODEC_PROP, codec);
      return this;
    }

    public Builder withMaxNesting(int maxNesting) {
      props.setProperty(JSON_MAX_NESTING_PROP, String.valueOf(maxNesting));
      return this;
    }

    public Builder withLoaderFileFormat(String fileFormat) {
      props.setProperty(LOADER_FILE_FORMAT_PROP, fileFormat);
      return this;
    }

    public Builder withUseStaging(boolean useStaging) {
      props.setProperty(USE_STAGING_PROP, String.valueOf(useStaging));
      return this;
    }

    public Builder withFileMaxItems(long fileMaxItems) {
      props.setProperty(FILE_MAX_ITEMS_PROP, String.valueOf(fileMaxItems));
      return this;
    }

    public Builder withMetricsOn(boolean metricsOn) {
      props.setProperty(METRICS_ON_PROP, String.valueOf(metricsOn));
      return this;
    }

    public NormalizeConfig build() {
      NormalizeConfig config = new NormalizeConfig(props);
      setDefaultOnCondition(props, !props.containsKey(PARQUET_ADD_DLT_LOAD_ID_PROP), PARQUET_ADD_DLT_LOAD_ID_PROP,
          DEFAULT_PARQUET_ADD_DLT_LOAD_ID);
      setDefaultOnCondition(props, !props.containsKey(PARQUET_ADD_DLT_ID_PROP), PARQUET_ADD_DLT_ID_PROP,
          DEFAULT_PARQUET_ADD_DLT_ID);
      setDefaultOnCondition(props, !props.containsKey(PARQUET_REWRITE_ROW_GROUPS_PROP),
          PARQUET_REWRITE_ROW_GROUPS_PROP, DEFAULT_PARQUET_REWRITE_ROW_GROUPS);
      setDefaultOnCondition(props, !props.containsKey(PARQUET_COMPRESSION_CODEC_PROP),
          PARQUET_COMPRESSION_CODEC_PROP, DEFAULT_PARQUET_COMPRESSION_CODEC);
      setDefaultOnCondition(props, !props.containsKey(JSON_MAX_NESTING_PROP), JSON_MAX_NESTING_PROP,
          DEFAULT_JSON_MAX_NESTING);
      setDefaultOnCondition(props, !props.containsKey(USE_STAGING_PROP), USE_STAGING_PROP, DEFAULT_USE_STAGING);
      setDefaultOnCondition(props, !props.containsKey(FILE_MAX_ITEMS_PROP), FILE_MAX_ITEMS_PROP,
          DEFAULT_FILE_MAX_ITEMS);
      setDefaultOnCondition(props, !props.containsKey(METRICS_ON_PROP), METRICS_ON_PROP, DEFAULT_METRICS_ON);
      checkArgument(config.getRewriteRowGroups() > 0, PARQUET_REWRITE_ROW_GROUPS_PROP + " must be positive");
      checkArgument(config.getMaxNesting() >= 0, JSON_MAX_NESTING_PROP + " must not be negative");
      checkArgument(config.getFileMaxItems() >= 0, FILE_MAX_ITEMS_PROP + " must not be negative");
      return config;
    }
  }
}
