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
import java.util.List;
import java.util.Properties;

/**
 * Capabilities of the destination the normalized files are loaded into.
 */
@Immutable
public class DestinationCapabilities extends DefaultDltConfig {

  public static final String PREFERRED_LOADER_FILE_FORMAT_PROP = "dlt.destination.preferred_loader_file_format";
  public static final String DEFAULT_PREFERRED_LOADER_FILE_FORMAT = "jsonl";
  // Comma separated
  public static final String SUPPORTED_LOADER_FILE_FORMATS_PROP = "dlt.destination.supported_loader_file_formats";
  public static final String DEFAULT_SUPPORTED_LOADER_FILE_FORMATS = "jsonl,parquet";
  // Destinations without staging support leave both staging properties unset
  public static final String PREFERRED_STAGING_FILE_FORMAT_PROP = "dlt.destination.preferred_staging_file_format";
  public static final String SUPPORTED_STAGING_FILE_FORMATS_PROP = "dlt.destination.supported_staging_file_formats";
  public static final String TIMESTAMP_PRECISION_PROP = "dlt.destination.timestamp_precision";
  public static final String DEFAULT_TIMESTAMP_PRECISION = String.valueOf(6);
  public static final String DECIMAL_PRECISION_PROP = "dlt.destination.decimal_precision";
  public static final String DEFAULT_DECIMAL_PRECISION = String.valueOf(38);
  public static final String DECIMAL_SCALE_PROP = "dlt.destination.decimal_scale";
  public static final String DEFAULT_DECIMAL_SCALE = String.valueOf(9);
  public static final String WEI_PRECISION_PROP = "dlt.destination.wei_precision";
  public static final String DEFAULT_WEI_PRECISION = String.valueOf(76);
  public static final String WEI_SCALE_PROP = "dlt.destination.wei_scale";
  public static final String DEFAULT_WEI_SCALE = String.valueOf(0);

  private DestinationCapabilities(Properties props) {
    super(props);
  }

  public static DestinationCapabilities.Builder newBuilder() {
    return new Builder();
  }

  public String getPreferredLoaderFileFormat() {
    return props.getProperty(PREFERRED_LOADER_FILE_FORMAT_PROP);
  }

  public List<String> getSupportedLoaderFileFormats() {
    return splitList(props.getProperty(SUPPORTED_LOADER_FILE_FORMATS_PROP));
  }

  public String getPreferredStagingFileFormat() {
    return props.getProperty(PREFERRED_STAGING_FILE_FORMAT_PROP);
  }

  public List<String> getSupportedStagingFileFormats() {
    return splitList(props.getProperty(SUPPORTED_STAGING_FILE_FORMATS_PROP));
  }

  public int getTimestampPrecision() {
    return Integer.parseInt(props.getProperty(TIMESTAMP_PRECISION_PROP));
  }

  public int getDecimalPrecision() {
    return Integer.parseInt(props.getProperty(DECIMAL_PRECISION_PROP));
  }

  public int getDecimalScale() {
    return Integer.parseInt(props.getProperty(DECIMAL_SCALE_PROP));
  }

  public int getWeiPrecision() {
    return Integer.parseInt(props.getProperty(WEI_PRECISION_PROP));
  }

  public int getWeiScale() {
    return Integer.parseInt(props.getProperty(WEI_SCALE_PROP));
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

    public Builder withPreferredLoaderFileFormat(String fileFormat) {
      props.setProperty(PREFERRED_LOADER_FILE_FORMAT_PROP, fileFormat);
      return this;
    }

    public Builder withSupportedLoaderFileFormats(String... fileFormats) {
      props.setProperty(SUPPORTED_LOADER_FILE_FORMATS_PROP, String.join(",", fileFormats));
      return this;
    }

    public Builder withPreferredStagingFileFormat(String fileFormat) {
      props.setProperty(PREFERRED_STAGING_FILE_FORMAT_PROP, fileFormat);
      return this;
    }

    public Builder withSupportedStagingFileFormats(String... fileFormats) {
      props.setProperty(SUPPORTED_STAGING_FILE_FORMATS_PROP, String.join(",", fileFormats));
      return this;
    }

    public Builder withTimestampPrecision(int precision) {
      props.setProperty(TIMESTAMP_PRECISION_PROP, String.valueOf(precision));
      return this;
    }

    public Builder withDecimalPrecision(int precision, int scale) {
      props.setProperty(DECIMAL_PRECISION_PROP, String.valueOf(precision));
      props.setProperty(DECIMAL_SCALE_PROP, String.valueOf(scale));
      return this;
    }

    public Builder withWeiPrecision(int precision, int scale) {
      props.setProperty(WEI_PRECISION_PROP, String.valueOf(precision));
      props.setProperty(WEI_SCALE_PROP, String.valueOf(scale));
      return this;
    }

    public DestinationCapabilities build() {
      DestinationCapabilities capabilities = new DestinationCapabilities(props);
      setDefaultOnCondition(props, !props.containsKey(PREFERRED_LOADER_FILE_FORMAT_PROP),
          PREFERRED_LOADER_FILE_FORMAT_PROP, DEFAULT_PREFERRED_LOADER_FILE_FORMAT);
      setDefaultOnCondition(props, !props.containsKey(SUPPORTED_LOADER_FILE_FORMATS_PROP),
          SUPPORTED_LOADER_FILE_FORMATS_PROP, DEFAULT_SUPPORTED_LOADER_FILE_FORMATS);
      setDefaultOnCondition(props, !props.containsKey(TIMESTAMP_PRECISION_PROP), TIMESTAMP_PRECISION_PROP,
          DEFAULT_TIMESTAMP_PRECISION);
      setDefaultOnCondition(props, !props.containsKey(DECIMAL_PRECISION_PROP), DECIMAL_PRECISION_PROP,
          DEFAULT_DECIMAL_PRECISION);
      setDefaultOnCondition(props, !props.containsKey(DECIMAL_SCALE_PROP), DECIMAL_SCALE_PROP, DEFAULT_DECIMAL_SCALE);
      setDefaultOnCondition(props, !props.containsKey(WEI_PRECISION_PROP), WEI_PRECISION_PROP, DEFAULT_WEI_PRECISION);
      setDefaultOnCondition(props, !props.containsKey(WEI_SCALE_PROP), WEI_SCALE_PROP, DEFAULT_WEI_SCALE);
      return capabilities;
    }
  }
}
