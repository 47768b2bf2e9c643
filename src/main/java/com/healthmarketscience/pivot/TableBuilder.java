/*
Copyright (c) 2024 James Ahlborn

Licensed under the Apache License, Version 2.0 (the "License");
you may not use this file except in compliance with the License.
You may obtain a copy of the License at

    http://www.apache.org/licenses/LICENSE-2.0

Unless required by applicable law or agreed to in writing, software
distributed under the License is distributed on an "AS IS" BASIS,
WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
See the License for the specific language governing permissions and
limitations under the License.
*/

package com.healthmarketscience.pivot;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.healthmarketscience.pivot.impl.RowImpl;
import com.healthmarketscience.pivot.impl.TableImpl;

/**
 * Builder style class for constructing a {@link Table}.
 * <p/>
 * Example:
 * <pre>
 *   Table table = new TableBuilder()
 *     .addRow("row 1", "nb_visits", 10, "nb_actions", 15)
 *     .withSubtable(subtable)
 *     .addRow("row 2", "nb_visits", 13)
 *     .toTable();
 * </pre>
 *
 * @author James Ahlborn
 * @usage _general_class_
 */
public class TableBuilder
{
  private final List<RowInfo> _rows = new ArrayList<RowInfo>();
  private final Map<String,Object> _metadata =
    new LinkedHashMap<String,Object>();

  public TableBuilder() {
  }

  /**
   * Adds a row with the given label and column values, given as alternating
   * column name and value ({@code Number} or {@code null} for absent).
   * @usage _general_method_
   */
  public TableBuilder addRow(String label, Object... columnsAndValues) {
    return addRow(createRow(label, columnsAndValues));
  }

  /**
   * Adds a copy of the given row.
   * @usage _general_method_
   */
  public TableBuilder addRow(Row row) {
    _rows.add(new RowInfo(new RowImpl(row)));
    return this;
  }

  /**
   * Attaches the given table as subtable of the most recently added row.
   * @usage _general_method_
   */
  public TableBuilder withSubtable(Table subtable) {
    lastRow()._subtable = subtable;
    return this;
  }

  /**
   * Sets a metadata value on the most recently added row.
   * @usage _intermediate_method_
   */
  public TableBuilder withRowMetadata(String name, Object value) {
    lastRow()._row.getMetadata().put(name, value);
    return this;
  }

  /**
   * Sets a table level metadata value.
   * @usage _intermediate_method_
   */
  public TableBuilder putMetadata(String name, Object value) {
    _metadata.put(name, value);
    return this;
  }

  /**
   * Creates a new Table with the configured rows.
   * @usage _general_method_
   */
  public Table toTable() {
    TableImpl table = new TableImpl();
    for(RowInfo info : _rows) {
      Row row = new RowImpl(info._row);
      table.addRow(row);
      if(info._subtable != null) {
        table.setSubtable(row, info._subtable);
      }
    }
    for(Map.Entry<String,Object> e : _metadata.entrySet()) {
      table.putMetadata(e.getKey(), e.getValue());
    }
    return table;
  }

  /**
   * Creates a new row with the given label and column values, given as
   * alternating column name and value ({@code Number} or {@code null} for
   * absent).  The row does not belong to any table.
   * @usage _general_method_
   */
  public static Row createRow(String label, Object... columnsAndValues) {
    if((columnsAndValues.length % 2) != 0) {
      throw new IllegalArgumentException(
          "Expected column name/value pairs for row '" + label + "'");
    }
    RowImpl row = new RowImpl(label, columnsAndValues.length / 2);
    for(int i = 0; i < columnsAndValues.length; i += 2) {
      Object value = columnsAndValues[i + 1];
      if((value != null) && !(value instanceof Number)) {
        throw new IllegalArgumentException(
            "Value for column '" + columnsAndValues[i] + "' of row '" +
            label + "' is not numeric: " + value);
      }
      row.put((String)columnsAndValues[i], (Number)value);
    }
    return row;
  }

  private RowInfo lastRow() {
    if(_rows.isEmpty()) {
      throw new IllegalStateException("No row added yet");
    }
    return _rows.get(_rows.size() - 1);
  }

  private static final class RowInfo
  {
    private final RowImpl _row;
    private Table _subtable;

    private RowInfo(RowImpl row) {
      _row = row;
    }
  }
}
