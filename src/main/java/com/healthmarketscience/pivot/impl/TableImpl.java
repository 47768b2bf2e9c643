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

package com.healthmarketscience.pivot.impl;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.healthmarketscience.pivot.Row;
import com.healthmarketscience.pivot.Table;

/**
 * In-memory table of rows.  Subtables are kept in a list owned by this table
 * and rows point into it by index.
 *
 * @author James Ahlborn
 */
public class TableImpl implements Table
{
  private final List<Row> _rows = new ArrayList<Row>();
  private final List<Row> _rowsView = Collections.unmodifiableList(_rows);
  /** subtables of this table's rows, indexed by row subtable id */
  private final List<Table> _subtables = new ArrayList<Table>();
  private final Map<String,Object> _metadata =
    new LinkedHashMap<String,Object>();

  public TableImpl() {
  }

  public int getRowCount() {
    return _rows.size();
  }

  public List<Row> getRows() {
    return _rowsView;
  }

  public Iterator<Row> iterator() {
    return _rowsView.iterator();
  }

  public void addRow(Row row) {
    _rows.add(toOwnedRow(row));
  }

  public void setRows(Collection<? extends Row> rows) {
    List<Row> newRows = new ArrayList<Row>(rows.size());
    for(Row row : rows) {
      newRows.add(toOwnedRow(row));
    }
    _rows.clear();
    _subtables.clear();
    _rows.addAll(newRows);
  }

  public Table getSubtable(Row row) {
    int id = row.getSubtableId();
    if(id == Row.NO_SUBTABLE) {
      return null;
    }
    if((id < 0) || (id >= _subtables.size())) {
      throw new IllegalArgumentException(withErrorContext(
          "Row '" + row.getLabel() + "' refers to unknown subtable " + id));
    }
    return _subtables.get(id);
  }

  public void setSubtable(Row row, Table subtable) {
    if(!(row instanceof RowImpl)) {
      throw new IllegalArgumentException(withErrorContext(
          "Row '" + row.getLabel() + "' is not a row of this table"));
    }
    RowImpl rowImpl = (RowImpl)row;

    if(subtable == null) {
      if(rowImpl.hasSubtable()) {
        // the slot stays, ids of other rows must not shift
        _subtables.set(rowImpl.getSubtableId(), null);
        rowImpl.setSubtableId(Row.NO_SUBTABLE);
      }
      return;
    }

    if(rowImpl.hasSubtable()) {
      _subtables.set(rowImpl.getSubtableId(), subtable);
    } else {
      _subtables.add(subtable);
      rowImpl.setSubtableId(_subtables.size() - 1);
    }
  }

  public int getSubtableCount() {
    int count = 0;
    for(Table subtable : _subtables) {
      if(subtable != null) {
        ++count;
      }
    }
    return count;
  }

  public Object getMetadata(String name) {
    return _metadata.get(name);
  }

  public Map<String,Object> getMetadata() {
    return Collections.unmodifiableMap(_metadata);
  }

  public void putMetadata(String name, Object value) {
    _metadata.put(name, value);
  }

  private RowImpl toOwnedRow(Row row) {
    if(row.hasSubtable()) {
      throw new IllegalArgumentException(withErrorContext(
          "Row '" + row.getLabel() + "' already owns a subtable"));
    }
    return ((row instanceof RowImpl) ? (RowImpl)row : new RowImpl(row));
  }

  private String withErrorContext(String msg) {
    return msg + " (Table rows=" + _rows.size() + ")";
  }

  @Override
  public String toString() {
    return CustomToStringStyle.builder(this)
      .append("rowCount", _rows.size())
      .append("subtableCount", getSubtableCount())
      .append("metadata", _metadata)
      .toString();
  }
}
