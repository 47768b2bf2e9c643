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

import java.util.List;

import com.healthmarketscience.pivot.Row;
import com.healthmarketscience.pivot.Table;

/**
 * Takes the pivot cells of each row from the row's subtable: every subtable
 * row is a pivot column, its value for the value column is the cell.
 *
 * @author James Ahlborn
 */
class SubtableStrategy implements PivotStrategy
{
  private final String _valueColumn;

  SubtableStrategy(String valueColumn) {
    _valueColumn = valueColumn;
  }

  public void collect(Table table, List<Row> rows, PivotMatrix matrix)
  {
    for(int i = 0; i < rows.size(); ++i) {
      Table subtable = table.getSubtable(rows.get(i));
      if(subtable == null) {
        continue;
      }
      for(Row subRow : subtable) {
        // the column is registered even if the metric is missing
        matrix.record(i, subRow.getLabel(), subRow.getValue(_valueColumn));
      }
    }
  }
}
