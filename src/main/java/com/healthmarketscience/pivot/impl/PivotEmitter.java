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
import java.util.Collections;
import java.util.List;
import java.util.Map;

import com.healthmarketscience.pivot.Row;
import com.healthmarketscience.pivot.Table;
import com.healthmarketscience.pivot.util.RowFilter;

/**
 * Writes pivot cells back into a table, replacing its rows.  Each new row
 * keeps the label and metadata of its source row, holds the pivot columns
 * in matrix column order and owns no subtable.  The configured row filters
 * run in order over the new rows, only rows matched by all of them are kept.
 *
 * @author James Ahlborn
 */
public class PivotEmitter
{
  private final List<RowFilter> _rowFilters;

  public PivotEmitter(List<RowFilter> rowFilters) {
    _rowFilters = Collections.unmodifiableList(
        new ArrayList<RowFilter>(rowFilters));
  }

  public void emit(Table table, List<Row> sourceRows, DenseMatrix matrix)
  {
    if(sourceRows.size() != matrix.getRowCount()) {
      throw new IllegalStateException(
          "Pivot matrix has " + matrix.getRowCount() + " rows, expected " +
          sourceRows.size());
    }

    List<Row> newRows = new ArrayList<Row>(sourceRows.size());
    for(int i = 0; i < sourceRows.size(); ++i) {
      Row source = sourceRows.get(i);
      Map<String,Number> cells = matrix.getRows().get(i);
      RowImpl row = new RowImpl(source.getLabel(), cells.size());
      row.putAll(cells);
      row.getMetadata().putAll(source.getMetadata());
      newRows.add(row);
    }

    Iterable<Row> rows = newRows;
    for(RowFilter filter : _rowFilters) {
      rows = filter.apply(rows);
    }

    List<Row> keptRows = new ArrayList<Row>(newRows.size());
    for(Row row : rows) {
      keptRows.add(row);
    }

    table.setRows(keptRows);
  }
}
