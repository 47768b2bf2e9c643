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
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Collects pivot column labels in the order they are first seen.  That order,
 * not any sort, is the column order of a pivot table.
 *
 * @author James Ahlborn
 */
public class ColumnAccumulator
{
  private final Map<String,Integer> _indexes = new HashMap<String,Integer>();
  private final List<String> _columns = new ArrayList<String>();

  public ColumnAccumulator() {
  }

  /**
   * Registers the given column label if it has not been seen yet.
   *
   * @return the index of the column in first-seen order
   */
  public int register(String column) {
    Integer idx = _indexes.get(column);
    if(idx == null) {
      idx = _columns.size();
      _indexes.put(column, idx);
      _columns.add(column);
    }
    return idx;
  }

  public boolean contains(String column) {
    return _indexes.containsKey(column);
  }

  /**
   * @return the index of the given column, {@code -1} if not registered
   */
  public int indexOf(String column) {
    Integer idx = _indexes.get(column);
    return ((idx != null) ? idx : -1);
  }

  public int size() {
    return _columns.size();
  }

  /**
   * @return the registered columns in first-seen order (unmodifiable List)
   */
  public List<String> getColumns() {
    return Collections.unmodifiableList(_columns);
  }

  @Override
  public String toString() {
    return CustomToStringStyle.valueBuilder(this)
      .append("columns", _columns)
      .toString();
  }
}
