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

import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.apache.commons.lang3.builder.ToStringBuilder;

/**
 * Pivot table cells where every row holds an entry (possibly absent) for
 * every column, in column order.
 *
 * @author James Ahlborn
 */
public class DenseMatrix
{
  private final List<String> _columns;
  private final List<Map<String,Number>> _rows;

  public DenseMatrix(List<String> columns, List<Map<String,Number>> rows) {
    _columns = Collections.unmodifiableList(columns);
    _rows = Collections.unmodifiableList(rows);
  }

  public List<String> getColumns() {
    return _columns;
  }

  public int getColumnCount() {
    return _columns.size();
  }

  public List<Map<String,Number>> getRows() {
    return _rows;
  }

  public int getRowCount() {
    return _rows.size();
  }

  @Override
  public String toString() {
    ToStringBuilder sb = CustomToStringStyle.builder(this)
      .append("columns", _columns);
    for(int i = 0; i < _rows.size(); ++i) {
      sb.append(String.valueOf(i), _rows.get(i));
    }
    return sb.toString();
  }
}
