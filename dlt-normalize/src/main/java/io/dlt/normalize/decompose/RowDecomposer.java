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

import io.dlt.common.util.UniqueIds;
import io.dlt.schema.ColumnSchema;
import io.dlt.schema.DataRow;
import io.dlt.schema.DataType;
import io.dlt.schema.NamingConvention;
import io.dlt.schema.Schema;
import io.dlt.schema.TableSchema;
import io.dlt.schema.WriteDisposition;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * Decomposes nested items into flat rows of a root table and of child tables.
 *
 * <p>Nested objects are flattened into the row with their keys joined by the path separator. Lists become
 * child tables named after the path of the list, and every child row is linked to its parent row with
 * {@code _dlt_parent_id} and {@code _dlt_list_idx}. List elements that are not objects are wrapped in a
 * {@code value} column, nested lists go through an intermediate row with a {@code list} field. Values at
 * the maximum nesting level, or in columns the schema declares as json, are kept as json.
 */
public class RowDecomposer {

  public static final String VALUE_FIELD = "value";
  public static final String LIST_FIELD = "list";
  public static final String EMPTY_KEY_IDENTIFIER = "_empty";

  private final Schema schema;
  private final NamingConvention naming;
  private final int maxNesting;

  public RowDecomposer(Schema schema, int maxNesting) {
    this.schema = schema;
    this.naming = schema.getNaming();
    this.maxNesting = maxNesting;
  }

  /**
   * Starts a traversal over the rows of one item. Items that are not objects are wrapped in a
   * {@code value} field.
   */
  @SuppressWarnings("unchecked")
  public RowTraversal decompose(Object item, String loadId, String rootTable) {
    Map<String, Object> row;
    if (item instanceof Map) {
      row = new LinkedHashMap<>((Map<String, Object>) item);
    } else {
      row = new LinkedHashMap<>();
      row.put(VALUE_FIELD, item);
    }
    row.put(Schema.LOAD_ID_COLUMN, loadId);
    String table = naming.normalizeTableIdentifier(rootTable);
    boolean merge = schema.getWriteDisposition(table) == WriteDisposition.MERGE;
    return new StackTraversal(new RowNode(row, Collections.emptyMap(), Collections.singletonList(table),
        Collections.emptyList(), null, -1, 0), merge);
  }

  private String tableName(List<String> parentPath, List<String> identPath) {
    List<String> path = new ArrayList<>(parentPath);
    path.addAll(identPath);
    return naming.makePath(path.toArray(new String[0]));
  }

  private boolean isJsonType(String table, String fieldName, int level) {
    if (level >= maxNesting) {
      return true;
    }
    TableSchema tableSchema = schema.getTable(table);
    if (tableSchema == null) {
      return false;
    }
    ColumnSchema column = tableSchema.getColumn(fieldName);
    return column != null && column.getDataType() == DataType.JSON;
  }

  @SuppressWarnings("unchecked")
  private void flatten(String table, Map<String, Object> dictRow, int level, List<String> path,
                       DataRow flattened, LinkedHashMap<List<String>, List<Object>> lists) {
    for (Map.Entry<String, Object> entry : dictRow.entrySet()) {
      String key = entry.getKey();
      Object value = entry.getValue();
      String normKey = key == null || key.trim().isEmpty() ? EMPTY_KEY_IDENTIFIER : naming.normalizeIdentifier(key);
      List<String> nestedPath = new ArrayList<>(path);
      nestedPath.add(normKey);
      String nestedName = naming.makePath(nestedPath.toArray(new String[0]));
      if ((value instanceof Map || value instanceof List) && !isJsonType(table, nestedName, level)) {
        if (value instanceof Map) {
          flatten(table, (Map<String, Object>) value, level + 1, nestedPath, flattened, lists);
        } else {
          lists.put(nestedPath, (List<Object>) value);
        }
        continue;
      }
      flattened.put(nestedName, value);
    }
  }

  /**
   * A pending unit of traversal work.
   */
  private interface Node {
  }

  /**
   * An object that becomes one row.
   */
  private class RowNode implements Node {
    final Map<String, Object> dictRow;
    final Map<String, Object> extend;
    final List<String> identPath;
    final List<String> parentPath;
    final String parentRowId;
    final int position;
    final int level;

    RowNode(Map<String, Object> dictRow, Map<String, Object> extend, List<String> identPath, List<String> parentPath,
            String parentRowId, int position, int level) {
      this.dictRow = dictRow;
      this.extend = extend;
      this.identPath = identPath;
      this.parentPath = parentPath;
      this.parentRowId = parentRowId;
      this.position = position;
      this.level = level;
    }
  }

  /**
   * A list whose elements become rows of a child table.
   */
  private final class ListNode implements Node {
    private final List<Object> elements;
    private final Map<String, Object> extend;
    private final List<String> identPath;
    private final List<String> parentPath;
    private final String parentRowId;
    private final int level;

    ListNode(List<Object> elements, Map<String, Object> extend, List<String> identPath, List<String> parentPath,
             String parentRowId, int level) {
      this.elements = elements;
      this.extend = extend;
      this.identPath = identPath;
      this.parentPath = parentPath;
      this.parentRowId = parentRowId;
      this.level = level;
    }
  }

  private final class StackTraversal implements RowTraversal {

    private final Deque<Node> stack = new ArrayDeque<>();
    private final boolean merge;
    // children of the last returned row, pushed only if the caller descends
    private List<Node> pendingChildren = Collections.emptyList();

    StackTraversal(RowNode root, boolean merge) {
      this.merge = merge;
      stack.push(root);
    }

    @Override
    public boolean hasNext(boolean descend) {
      if (descend) {
        pushAll(pendingChildren);
      }
      pendingChildren = Collections.emptyList();
      while (!stack.isEmpty() && stack.peek() instanceof ListNode) {
        pushAll(expand((ListNode) stack.pop()));
      }
      return !stack.isEmpty();
    }

    @Override
    public DecomposedRow next() {
      if (!hasNext(false)) {
        throw new NoSuchElementException("Traversal is complete");
      }
      return emit((RowNode) stack.pop());
    }

    // pushes in reverse so the first node is visited first
    private void pushAll(List<Node> nodes) {
      for (int i = nodes.size() - 1; i >= 0; i--) {
        stack.push(nodes.get(i));
      }
    }

    @SuppressWarnings("unchecked")
    private List<Node> expand(ListNode list) {
      List<Node> nodes = new ArrayList<>(list.elements.size());
      for (int idx = 0; idx < list.elements.size(); idx++) {
        Object element = list.elements.get(idx);
        if (element instanceof Map) {
          nodes.add(new RowNode((Map<String, Object>) element, list.extend, list.identPath, list.parentPath,
              list.parentRowId, idx, list.level));
        } else if (element instanceof List) {
          Map<String, Object> intermediate = new LinkedHashMap<>();
          intermediate.put(LIST_FIELD, element);
          nodes.add(new RowNode(intermediate, list.extend, list.identPath, list.parentPath, list.parentRowId, idx,
              list.level + 1));
        } else {
          nodes.add(new ScalarNode(element, list, idx));
        }
      }
      return nodes;
    }

    private DecomposedRow emit(RowNode node) {
      if (node instanceof ScalarNode) {
        return emitScalar((ScalarNode) node);
      }
      String table = tableName(node.parentPath, node.identPath);
      String parentTable = node.parentPath.isEmpty() ? null : tableName(Collections.emptyList(), node.parentPath);
      DataRow flattened = new DataRow();
      LinkedHashMap<List<String>, List<Object>> lists = new LinkedHashMap<>();
      flatten(table, node.dictRow, node.level, Collections.emptyList(), flattened, lists);
      for (Map.Entry<String, Object> entry : node.extend.entrySet()) {
        flattened.put(entry.getKey(), entry.getValue());
      }

      Object existingId = flattened.get(Schema.ID_COLUMN);
      String rowId;
      if (existingId instanceof String && !((String) existingId).isEmpty()) {
        rowId = (String) existingId;
      } else {
        rowId = merge && node.parentRowId != null
            ? UniqueIds.childRowId(node.parentRowId, table, node.position)
            : UniqueIds.uniqueId();
        flattened.put(Schema.ID_COLUMN, rowId);
      }
      if (node.parentRowId != null) {
        flattened.put(Schema.PARENT_ID_COLUMN, node.parentRowId);
        flattened.put(Schema.LIST_IDX_COLUMN, (long) node.position);
      }

      Map<String, Object> childExtend = node.extend;
      if (merge && node.parentRowId == null) {
        childExtend = new LinkedHashMap<>(node.extend);
        childExtend.put(Schema.ROOT_ID_COLUMN, rowId);
      }
      List<String> childParentPath = new ArrayList<>(node.parentPath);
      childParentPath.addAll(node.identPath);
      List<Node> children = new ArrayList<>(lists.size());
      for (Map.Entry<List<String>, List<Object>> list : lists.entrySet()) {
        children.add(new ListNode(list.getValue(), childExtend, list.getKey(), childParentPath, rowId,
            node.level + 1));
      }
      pendingChildren = children;
      return new DecomposedRow(table, parentTable, flattened);
    }

    private DecomposedRow emitScalar(ScalarNode node) {
      String table = tableName(node.list.parentPath, node.list.identPath);
      String parentTable = tableName(Collections.emptyList(), node.list.parentPath);
      DataRow row = new DataRow();
      row.put(VALUE_FIELD, node.value);
      for (Map.Entry<String, Object> entry : node.list.extend.entrySet()) {
        row.put(entry.getKey(), entry.getValue());
      }
      row.put(Schema.ID_COLUMN, UniqueIds.childRowId(node.list.parentRowId, table, node.position));
      row.put(Schema.PARENT_ID_COLUMN, node.list.parentRowId);
      row.put(Schema.LIST_IDX_COLUMN, (long) node.position);
      pendingChildren = Collections.emptyList();
      return new DecomposedRow(table, parentTable, row);
    }
  }

  /**
   * A list element that is neither an object nor a list.
   */
  private final class ScalarNode extends RowNode {
    private final Object value;
    private final ListNode list;

    ScalarNode(Object value, ListNode list, int position) {
      super(Collections.emptyMap(), list.extend, list.identPath, list.parentPath, list.parentRowId, position,
          list.level);
      this.value = value;
      this.list = list;
    }
  }
}
