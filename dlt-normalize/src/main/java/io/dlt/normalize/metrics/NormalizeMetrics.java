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

package io.dlt.normalize.metrics;

import io.dlt.config.NormalizeConfig;

import com.codahale.metrics.Counter;
import com.codahale.metrics.MetricFilter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Slf4jReporter;
import com.codahale.metrics.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;

/**
 * Counters of one normalize run. Counts are always kept, they are reported to the log only when metrics
 * are enabled.
 */
public class NormalizeMetrics {

  private static final Logger LOG = LoggerFactory.getLogger(NormalizeMetrics.class);

  private final NormalizeConfig config;
  private final String schemaName;
  private final MetricRegistry registry = new MetricRegistry();
  private final Counter rowsWritten;
  private final Counter rowsDiscarded;
  private final Counter tablesFiltered;
  private final Counter columnsFiltered;
  private final Counter filesImported;
  private final Counter filesRewritten;
  private final Counter filesNormalized;
  private Timer fileTimer;

  public NormalizeMetrics(NormalizeConfig config, String schemaName) {
    this.config = config;
    this.schemaName = schemaName;
    this.rowsWritten = registry.counter(getMetricsName("rows", "written"));
    this.rowsDiscarded = registry.counter(getMetricsName("rows", "discarded"));
    this.tablesFiltered = registry.counter(getMetricsName("tables", "filtered"));
    this.columnsFiltered = registry.counter(getMetricsName("columns", "filtered"));
    this.filesImported = registry.counter(getMetricsName("files", "imported"));
    this.filesRewritten = registry.counter(getMetricsName("files", "rewritten"));
    this.filesNormalized = registry.counter(getMetricsName("files", "normalized"));
  }

  String getMetricsName(String action, String metric) {
    return String.format("%s.%s.%s", schemaName, action, metric);
  }

  public MetricRegistry getRegistry() {
    return registry;
  }

  /**
   * @return timer context of one file, {@code null} when metrics are off
   */
  public Timer.Context getFileTimerContext() {
    if (config.isMetricsOn() && fileTimer == null) {
      fileTimer = registry.timer(getMetricsName("timer", "file"));
    }
    return fileTimer == null ? null : fileTimer.time();
  }

  public void incRowsWritten(long count) {
    rowsWritten.inc(count);
  }

  public void incRowsDiscarded() {
    rowsDiscarded.inc();
  }

  public void incTablesFiltered() {
    tablesFiltered.inc();
  }

  public void incColumnsFiltered() {
    columnsFiltered.inc();
  }

  public void incFilesImported() {
    filesImported.inc();
  }

  public void incFilesRewritten() {
    filesRewritten.inc();
  }

  public void incFilesNormalized() {
    filesNormalized.inc();
  }

  public long getRowsWritten() {
    return rowsWritten.getCount();
  }

  public long getRowsDiscarded() {
    return rowsDiscarded.getCount();
  }

  public long getTablesFiltered() {
    return tablesFiltered.getCount();
  }

  public long getColumnsFiltered() {
    return columnsFiltered.getCount();
  }

  public long getFilesImported() {
    return filesImported.getCount();
  }

  public long getFilesRewritten() {
    return filesRewritten.getCount();
  }

  public long getFilesNormalized() {
    return filesNormalized.getCount();
  }

  /**
   * Writes all metrics to the log once, if metrics are on.
   */
  public void report() {
    if (!config.isMetricsOn()) {
      return;
    }
    Slf4jReporter reporter = Slf4jReporter.forRegistry(registry)
        .outputTo(LOG)
        .convertRatesTo(TimeUnit.SECONDS)
        .convertDurationsTo(TimeUnit.MILLISECONDS)
        .filter(MetricFilter.ALL)
        .build();
    reporter.report();
  }
}
