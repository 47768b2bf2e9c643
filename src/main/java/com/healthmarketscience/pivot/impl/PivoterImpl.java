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

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;

import com.healthmarketscience.pivot.PivotRequest;
import com.healthmarketscience.pivot.Pivoter;
import com.healthmarketscience.pivot.PreparedPivot;
import com.healthmarketscience.pivot.QueryExecutor;
import com.healthmarketscience.pivot.Row;
import com.healthmarketscience.pivot.SegmentSource;
import com.healthmarketscience.pivot.Table;
import com.healthmarketscience.pivot.meta.MetadataRegistry;
import com.healthmarketscience.pivot.util.RowFilter;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

/**
 * Pivoter implementation: resolves a request, collects the pivot cells with
 * the matching strategy, limits the columns and writes the result back into
 * the table.
 *
 * @author James Ahlborn
 * @usage _intermediate_class_
 */
public class PivoterImpl implements Pivoter
{
  private static final Log LOG = LogFactory.getLog(PivoterImpl.class);

  private final PivotResolver _resolver;
  private final QueryExecutor _queryExecutor;
  private final SegmentSource _segmentSource;
  private final PivotEmitter _emitter;
  private final String _othersLabel;
  private final ExecutorService _fetchExecutor;
  private final int _maxConcurrentFetches;

  public PivoterImpl(MetadataRegistry registry, QueryExecutor queryExecutor,
                     SegmentSource segmentSource, List<RowFilter> rowFilters,
                     String othersLabel, ExecutorService fetchExecutor,
                     int maxConcurrentFetches)
  {
    _resolver = new PivotResolver(registry);
    _queryExecutor = queryExecutor;
    _segmentSource = ((segmentSource != null) ? segmentSource :
                      SegmentSource.NONE);
    _emitter = new PivotEmitter(rowFilters);
    _othersLabel = othersLabel;
    _fetchExecutor = fetchExecutor;
    _maxConcurrentFetches = maxConcurrentFetches;
  }

  public String getOthersLabel() {
    return _othersLabel;
  }

  public int getMaxConcurrentFetches() {
    return _maxConcurrentFetches;
  }

  public PreparedPivot prepare(PivotRequest request)
  {
    ResolvedPivot resolved = _resolver.resolve(request);

    PivotStrategy strategy = null;
    switch(resolved.getSource()) {
    case SUBTABLE:
      strategy = new SubtableStrategy(resolved.getValueColumn());
      break;
    case SEGMENT:
      if(_queryExecutor == null) {
        throw new IllegalStateException(
            "Pivot of report '" + resolved.getReport().getId() +
            "' needs to fetch columns by segment, but no QueryExecutor " +
            "is configured");
      }
      strategy = new SegmentStrategy(resolved, _queryExecutor, _segmentSource,
                                     _fetchExecutor, _maxConcurrentFetches);
      break;
    default:
      throw new IllegalStateException("Unknown source " +
                                      resolved.getSource());
    }

    return new PreparedPivotImpl(resolved, strategy);
  }

  public Table pivot(PivotRequest request, Table table) throws IOException {
    return prepare(request).apply(table);
  }

  private class PreparedPivotImpl implements PreparedPivot
  {
    private final ResolvedPivot _resolved;
    private final PivotStrategy _strategy;
    private final ColumnLimiter _limiter;

    private PreparedPivotImpl(ResolvedPivot resolved, PivotStrategy strategy) {
      _resolved = resolved;
      _strategy = strategy;
      _limiter = new ColumnLimiter(resolved.getRequest().getColumnLimit(),
                                   _othersLabel);
    }

    public PivotRequest getRequest() {
      return _resolved.getRequest();
    }

    public Source getSource() {
      return _resolved.getSource();
    }

    public String getValueColumn() {
      return _resolved.getValueColumn();
    }

    public Table apply(Table table) throws IOException
    {
      // snapshot, the emitter replaces the table's rows
      List<Row> rows = new ArrayList<Row>(table.getRows());

      PivotMatrix matrix = new PivotMatrix(rows.size());
      _strategy.collect(table, rows, matrix);

      DenseMatrix dense = _limiter.apply(matrix.toDense());
      _emitter.emit(table, rows, dense);

      if(LOG.isDebugEnabled()) {
        LOG.debug("Pivoted " + rows.size() + " rows of report '" +
                  _resolved.getReport().getId() + "' by '" +
                  _resolved.getPivotDimension().getId() + "' into columns " +
                  dense.getColumns());
      }
      return table;
    }

    @Override
    public String toString() {
      return _resolved.toString();
    }
  }
}
