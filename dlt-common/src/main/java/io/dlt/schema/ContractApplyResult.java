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

package io.dlt.schema;

import java.util.Collections;
import java.util.List;

/**
 * Partial table left after a contract was applied, {@code null} when the whole table was rejected, and the
 * filters the contract produced.
 */
public class ContractApplyResult {

  private final TableSchema partialTable;
  private final List<FilterDecision> filters;

  public ContractApplyResult(TableSchema partialTable, List<FilterDecision> filters) {
    this.partialTable = partialTable;
    this.filters = filters == null ? Collections.emptyList() : filters;
  }

  public TableSchema getPartialTable() {
    return partialTable;
  }

  public List<FilterDecision> getFilters() {
    return filters;
  }
}
