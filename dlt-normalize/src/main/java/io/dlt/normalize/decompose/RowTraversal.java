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

package io.dlt.normalize.decompose;

import java.util.NoSuchElementException;

/**
 * Depth first traversal over the rows decomposed from one item. The caller decides after every row whether
 * the rows nested under it are visited:
 *
 * <pre>
 *   boolean descend = true;
 *   while (traversal.hasNext(descend)) {
 *     DecomposedRow row = traversal.next();
 *     descend = process(row);
 *   }
 * </pre>
 */
public interface RowTraversal {

  /**
   * @param descend whether to visit the rows nested under the row returned by the last {@link #next()},
   *                ignored before the first row
   * @return {@code false} when the traversal is complete
   */
  boolean hasNext(boolean descend);

  /**
   * @throws NoSuchElementException if the traversal is complete
   */
  DecomposedRow next();
}
