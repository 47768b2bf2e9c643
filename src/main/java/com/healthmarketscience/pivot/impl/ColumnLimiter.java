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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

/**
 * Caps the number of columns of a pivot table.  When there are more columns
 * than the limit, the {@code limit - 1} columns with the largest totals are
 * kept (in their original order) and all other columns are summed up into a
 * trailing "Others" column.
 * <p>
 * Absent cells count as zero for the totals and the "Others" sums only, a
 * kept column's absent cells stay absent.  A discovered column which happens
 * to carry the "Others" label is always folded.
 *
 * @author James Ahlborn
 */
public class ColumnLimiter
{
  private static final Log LOG = LogFactory.getLog(ColumnLimiter.class);

  private final int _columnLimit;
  private final String _othersLabel;

  public ColumnLimiter(int columnLimit, String othersLabel) {
    _columnLimit = columnLimit;
    _othersLabel = othersLabel;
  }

  public boolean isLimiting(DenseMatrix matrix) {
    return ((_columnLimit > 0) && (matrix.getColumnCount() > _columnLimit));
  }

  public DenseMatrix apply(DenseMatrix matrix)
  {
    if(!isLimiting(matrix)) {
      return matrix;
    }

    List<String> columns = matrix.getColumns();
    final Number[] totals = computeTotals(matrix);

    List<Integer> ranked = new ArrayList<Integer>(columns.size());
    for(int i = 0; i < columns.size(); ++i) {
      if(!_othersLabel.equals(columns.get(i))) {
        ranked.add(i);
      }
    }
    // stable sort, equal totals keep first-seen order
    Collections.sort(ranked,
                     (i1, i2) -> NumberSupport.compare(totals[i2], totals[i1]));

    boolean[] kept = new boolean[columns.size()];
    int numKept = Math.min(_columnLimit - 1, ranked.size());
    for(int i = 0; i < numKept; ++i) {
      kept[ranked.get(i)] = true;
    }

    List<String> newColumns = new ArrayList<String>(numKept + 1);
    for(int i = 0; i < columns.size(); ++i) {
      if(kept[i]) {
        newColumns.add(columns.get(i));
      }
    }
    newColumns.add(_othersLabel);

    if(LOG.isDebugEnabled()) {
      LOG.debug("Limiting " + columns.size() + " pivot columns to " +
                newColumns + " (limit " + _columnLimit + ")");
    }

    List<Map<String,Number>> newRows =
      new ArrayList<Map<String,Number>>(matrix.getRowCount());
    for(Map<String,Number> row : matrix.getRows()) {
      Map<String,Number> newRow =
        new LinkedHashMap<String,Number>(newColumns.size() * 2);
      Number others = NumberSupport.ZERO;
      for(int i = 0; i < columns.size(); ++i) {
        String column = columns.get(i);
        if(kept[i]) {
          newRow.put(column, row.get(column));
        } else {
          others = NumberSupport.add(others, row.get(column));
        }
      }
      newRow.put(_othersLabel, others);
      newRows.add(newRow);
    }

    return new DenseMatrix(newColumns, newRows);
  }

  private static Number[] computeTotals(DenseMatrix matrix)
  {
    List<String> columns = matrix.getColumns();
    Number[] totals = new Number[columns.size()];
    for(int i = 0; i < totals.length; ++i) {
      totals[i] = NumberSupport.ZERO;
    }
    for(Map<String,Number> row : matrix.getRows()) {
      for(int i = 0; i < totals.length; ++i) {
        totals[i] = NumberSupport.add(totals[i], row.get(columns.get(i)));
      }
    }
    return totals;
  }
}
