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
import java.io.InterruptedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import com.healthmarketscience.pivot.QueryExecutor;
import com.healthmarketscience.pivot.Row;
import com.healthmarketscience.pivot.SegmentSource;
import com.healthmarketscience.pivot.Table;
import com.healthmarketscience.pivot.util.SegmentExpression;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

/**
 * Fetches the pivot cells of each row by running the report keyed by the
 * pivot dimension, restricted to the data of that row (a segment on the
 * row's label, and'ed to the request's own segment if any).  Every row of a
 * query result is a pivot column.
 * <p>
 * The queries are independent and may run concurrently, but each result is
 * kept in the slot of its row and recorded in row order, so the column order
 * never depends on which query finishes first.  The first failed query
 * cancels the rest and its exception is rethrown as is.
 *
 * @author James Ahlborn
 */
class SegmentStrategy implements PivotStrategy
{
  private static final Log LOG = LogFactory.getLog(SegmentStrategy.class);

  private final ResolvedPivot _pivot;
  private final QueryExecutor _queryExecutor;
  private final SegmentSource _segmentSource;
  /** optional caller supplied executor, never shut down here */
  private final ExecutorService _fetchExecutor;
  private final int _maxConcurrentFetches;

  SegmentStrategy(ResolvedPivot pivot, QueryExecutor queryExecutor,
                  SegmentSource segmentSource, ExecutorService fetchExecutor,
                  int maxConcurrentFetches) {
    _pivot = pivot;
    _queryExecutor = queryExecutor;
    _segmentSource = segmentSource;
    _fetchExecutor = fetchExecutor;
    _maxConcurrentFetches = maxConcurrentFetches;
  }

  public void collect(Table table, List<Row> rows, PivotMatrix matrix)
    throws IOException
  {
    if(rows.isEmpty()) {
      return;
    }

    String ambientSegment = _segmentSource.getSegment();
    List<String> segments = new ArrayList<String>(rows.size());
    for(Row row : rows) {
      segments.add(SegmentExpression.and(
                       ambientSegment,
                       SegmentExpression.equalTo(_pivot.getSegmentName(),
                                                 row.getLabel())));
    }

    Table[] results = fetchAll(segments);

    String valueColumn = _pivot.getValueColumn();
    for(int i = 0; i < results.length; ++i) {
      for(Row colRow : results[i]) {
        matrix.record(i, colRow.getLabel(), colRow.getValue(valueColumn));
      }
    }
  }

  private Table[] fetchAll(List<String> segments) throws IOException
  {
    Table[] results = new Table[segments.size()];

    if((_fetchExecutor == null) &&
       ((_maxConcurrentFetches <= 1) || (segments.size() == 1))) {
      for(int i = 0; i < results.length; ++i) {
        results[i] = fetch(segments.get(i));
      }
      return results;
    }

    ExecutorService executor = _fetchExecutor;
    if(executor == null) {
      executor = Executors.newFixedThreadPool(
          Math.min(_maxConcurrentFetches, segments.size()));
    }
    try {
      fetchConcurrently(executor, segments, results);
    } finally {
      if(executor != _fetchExecutor) {
        executor.shutdownNow();
      }
    }
    return results;
  }

  private void fetchConcurrently(ExecutorService executor,
                                 List<String> segments, Table[] results)
    throws IOException
  {
    CompletionService<Integer> completion =
      new ExecutorCompletionService<Integer>(executor);
    List<Future<Integer>> futures =
      new ArrayList<Future<Integer>>(segments.size());
    boolean done = false;
    try {
      for(int i = 0; i < segments.size(); ++i) {
        final int idx = i;
        final String segment = segments.get(i);
        futures.add(completion.submit(() -> {
              results[idx] = fetch(segment);
              return idx;
            }));
      }

      for(int i = 0; i < segments.size(); ++i) {
        completion.take().get();
      }
      done = true;

    } catch(InterruptedException e) {
      Thread.currentThread().interrupt();
      InterruptedIOException ioe = new InterruptedIOException(
          withErrorContext("Interrupted while fetching pivot columns"));
      ioe.initCause(e);
      throw ioe;
    } catch(ExecutionException e) {
      throw unwrap(e);
    } finally {
      if(!done) {
        for(Future<Integer> future : futures) {
          future.cancel(true);
        }
      }
    }
  }

  private Table fetch(String segment) throws IOException
  {
    String reportId = _pivot.getPivotReport().getId();
    if(LOG.isDebugEnabled()) {
      LOG.debug(withErrorContext("Fetching pivot columns with segment '" +
                                 segment + "'"));
    }
    Table result = _queryExecutor.execute(reportId, segment);
    if(result == null) {
      throw new IllegalStateException(withErrorContext(
          "Query executor returned no table for segment '" + segment + "'"));
    }
    return result;
  }

  private IOException unwrap(ExecutionException e)
  {
    Throwable cause = e.getCause();
    if(cause instanceof IOException) {
      return (IOException)cause;
    }
    if(cause instanceof RuntimeException) {
      throw (RuntimeException)cause;
    }
    if(cause instanceof Error) {
      throw (Error)cause;
    }
    return new IOException(withErrorContext("Failed fetching pivot columns"),
                           cause);
  }

  private String withErrorContext(String msg) {
    return msg + " (Report=" + _pivot.getPivotReport().getId() +
      ", Pivot=" + _pivot.getReport().getId() + ")";
  }
}
