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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Collects the sparse cells of a pivot table as the strategies discover them
 * and turns them into a {@link DenseMatrix} once all rows are done.  Cells
 * which were never recorded, and cells recorded as {@code null}, are absent.
 * <p>
 * An instance belongs to a single pivot operation and is not thread-safe.
 *
 * @author James Ahlborn
 */
public class PivotMatrix
{
  private final ColumnAccumulator _columns = new ColumnAccumulator();
  private final List<Map<String,Number>> _cells;

  public PivotMatrix(int rowCount) {
    _cells = new ArrayList<Map<String,Number>>(rowCount);
    for(int i = 0; i < rowCount; ++i) {
      _cells.add(new LinkedHashMap<String,Number>());
    }
  }

  public int getRowCount() {
    return _cells.size();
  }

  public ColumnAccumulator getColumns() {
    return _columns;
  }

  /**
   * Records the value of the given column for the source row with the given
   * index, registering the column if it is new.  A later value for the same
   * cell replaces an earlier one.
   *
   * @param rowIdx index of the source row
   * @param column pivot column label
   * @param value cell value, {@code null} if absent
   */
  public void record(int rowIdx, String column, Number value) {
    _columns.register(column);
    _cells.get(rowIdx).put(column, value);
  }

  /**
   * @return the recorded value for the given cell, {@code null} if absent
   */
  public Number get(int rowIdx, String column) {
    return _cells.get(rowIdx).get(column);
  }

  /**
   * Builds the dense view: every row gets an entry for every column, in
   * first-seen column order.
   */
  public DenseMatrix toDense() {
    List<String> columns = new ArrayList<String>(_columns.getColumns());
    List<Map<String,Number>> rows =
      new ArrayList<Map<String,Number>>(_cells.size());
    for(Map<String,Number> sparse : _cells) {
      Map<String,Number> dense =
        new LinkedHashMap<String,Number>(columns.size() * 2);
      for(String column : columns) {
        dense.put(column, sparse.get(column));
      }
      rows.add(dense);
    }
    return new DenseMatrix(columns, rows);
  }
}
