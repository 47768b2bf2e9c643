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
import java.util.List;
import java.util.concurrent.ExecutorService;

import com.healthmarketscience.pivot.impl.PivoterImpl;
import com.healthmarketscience.pivot.meta.MetadataRegistry;
import com.healthmarketscience.pivot.util.RowFilter;

/**
 * Builder style class for constructing a {@link Pivoter}.
 * <p/>
 * Simple example usage:
 * <pre>
 *   Pivoter pivoter = new PivoterBuilder(registry).toPivoter();
 * </pre>
 * <p/>
 * Advanced example usage:
 * <pre>
 *   Pivoter pivoter = new PivoterBuilder(registry)
 *     .setQueryExecutor(executor)
 *     .setSegmentSource(() -&gt; request.getParameter("segment"))
 *     .addRowFilter(RowFilter.hasAnyValue())
 *     .setMaxConcurrentFetches(8)
 *     .toPivoter();
 * </pre>
 *
 * @author James Ahlborn
 * @usage _general_class_
 */
public class PivoterBuilder
{
  /** label of the column summing up the columns cut by the column limit */
  public static final String DEFAULT_OTHERS_LABEL = "Others";

  /** default number of segment queries run at once */
  public static final int DEFAULT_MAX_CONCURRENT_FETCHES = 4;

  /** system property which can be used to set the default number of segment
   *  queries run at once.  Value should be a positive integer, {@code 1}
   *  runs the queries one by one on the calling thread.
   * @usage _intermediate_field_
   */
  public static final String MAX_CONCURRENT_FETCHES_PROPERTY =
    "com.healthmarketscience.pivot.maxConcurrentFetches";

  /** the source of report and dimension descriptors */
  private MetadataRegistry _registry;
  /** optional runner of segmented queries */
  private QueryExecutor _queryExecutor;
  /** optional source of the request's own segment */
  private SegmentSource _segmentSource = SegmentSource.NONE;
  /** filters applied to the pivoted rows, in order */
  private final List<RowFilter> _rowFilters = new ArrayList<RowFilter>();
  /** label of the overflow column */
  private String _othersLabel = DEFAULT_OTHERS_LABEL;
  /** optional executor for segment queries, _not_ shut down by the Pivoter */
  private ExecutorService _fetchExecutor;
  /** bound on concurrent segment queries when no executor is given */
  private int _maxConcurrentFetches = getDefaultMaxConcurrentFetches();

  public PivoterBuilder() {
    this(null);
  }

  public PivoterBuilder(MetadataRegistry registry) {
    _registry = registry;
  }

  /**
   * Sets the registry used to validate requests (required).
   * @usage _general_method_
   */
  public PivoterBuilder setMetadataRegistry(MetadataRegistry registry) {
    _registry = registry;
    return this;
  }

  /**
   * Sets the executor used to fetch pivot columns by segment.  Required for
   * requests which can not be satisfied from subtables.
   * @usage _general_method_
   */
  public PivoterBuilder setQueryExecutor(QueryExecutor queryExecutor) {
    _queryExecutor = queryExecutor;
    return this;
  }

  /**
   * Sets the source of the segment applied to the whole request, which is
   * combined with the per-row segments.  If {@code null}, no such segment is
   * used.
   * @usage _general_method_
   */
  public PivoterBuilder setSegmentSource(SegmentSource segmentSource) {
    _segmentSource = ((segmentSource != null) ? segmentSource :
                      SegmentSource.NONE);
    return this;
  }

  /**
   * Adds a filter run over the pivoted rows.  Filters run in the order they
   * were added and only rows matched by all filters are kept.
   * @usage _general_method_
   */
  public PivoterBuilder addRowFilter(RowFilter rowFilter) {
    _rowFilters.add(rowFilter);
    return this;
  }

  /**
   * Sets the label of the column summing up the columns cut by the column
   * limit.
   * @usage _intermediate_method_
   */
  public PivoterBuilder setOthersLabel(String othersLabel) {
    _othersLabel = othersLabel;
    return this;
  }

  /**
   * Sets a pre-existing executor on which to run segment queries.  If
   * provided explicitly, <i>it will not be shut down by the Pivoter</i> and
   * the max concurrent fetches setting is ignored.
   * @usage _advanced_method_
   */
  public PivoterBuilder setFetchExecutor(ExecutorService fetchExecutor) {
    _fetchExecutor = fetchExecutor;
    return this;
  }

  /**
   * Sets the maximum number of segment queries run at once by a single pivot
   * when no fetch executor is given.  {@code 1} runs them one by one on the
   * calling thread.
   * @usage _intermediate_method_
   */
  public PivoterBuilder setMaxConcurrentFetches(int maxConcurrentFetches) {
    _maxConcurrentFetches = maxConcurrentFetches;
    return this;
  }

  /**
   * Creates a new Pivoter with the current configuration.
   * @usage _general_method_
   */
  public Pivoter toPivoter() {
    if(_registry == null) {
      throw new IllegalStateException("A MetadataRegistry is required");
    }
    if((_othersLabel == null) || _othersLabel.isEmpty()) {
      throw new IllegalStateException("The others label may not be empty");
    }
    if(_maxConcurrentFetches < 1) {
      throw new IllegalStateException(
          "Max concurrent fetches must be positive, got " +
          _maxConcurrentFetches);
    }
    return new PivoterImpl(_registry, _queryExecutor, _segmentSource,
                           _rowFilters, _othersLabel, _fetchExecutor,
                           _maxConcurrentFetches);
  }

  /**
   * Returns the default number of concurrent segment queries.  This defaults
   * to {@link #DEFAULT_MAX_CONCURRENT_FETCHES}, but can be overridden using
   * the system property {@value #MAX_CONCURRENT_FETCHES_PROPERTY}.
   * @usage _advanced_method_
   */
  public static int getDefaultMaxConcurrentFetches()
  {
    String prop = System.getProperty(MAX_CONCURRENT_FETCHES_PROPERTY);
    if(prop != null) {
      prop = prop.trim();
      if(prop.length() > 0) {
        return Integer.parseInt(prop);
      }
    }
    return DEFAULT_MAX_CONCURRENT_FETCHES;
  }
}
