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

/**
 * Builder style class for constructing a {@link PivotRequest}.
 * <p/>
 * Example:
 * <pre>
 *   PivotRequest request =
 *     new PivotRequestBuilder("Referrers.getKeywords", "Referrers.SearchEngine")
 *     .setValueColumn("nb_visits")
 *     .setColumnLimit(5)
 *     .toRequest();
 * </pre>
 *
 * @author James Ahlborn
 * @usage _general_class_
 */
public class PivotRequestBuilder
{
  /** the report whose rows are pivoted */
  private String _sourceReportId;
  /** the dimension whose values become the columns */
  private String _pivotDimensionId;
  /** optional metric to show, defaults to the report's default metric */
  private String _valueColumn;
  /** max number of columns, including "Others" */
  private int _columnLimit = PivotRequest.getDefaultColumnLimit();
  /** whether columns may be fetched with segmented queries */
  private boolean _allowSegmentFetch =
    PivotRequest.getDefaultAllowSegmentFetch();

  public PivotRequestBuilder() {
    this(null, null);
  }

  public PivotRequestBuilder(String sourceReportId, String pivotDimensionId) {
    _sourceReportId = sourceReportId;
    _pivotDimensionId = pivotDimensionId;
  }

  /**
   * @usage _general_method_
   */
  public PivotRequestBuilder setSourceReportId(String sourceReportId) {
    _sourceReportId = sourceReportId;
    return this;
  }

  /**
   * @usage _general_method_
   */
  public PivotRequestBuilder setPivotDimensionId(String pivotDimensionId) {
    _pivotDimensionId = pivotDimensionId;
    return this;
  }

  /**
   * Sets the metric shown in the pivot cells.  If {@code null}, the source
   * report's default metric is used.
   * @usage _general_method_
   */
  public PivotRequestBuilder setValueColumn(String valueColumn) {
    _valueColumn = valueColumn;
    return this;
  }

  /**
   * Sets the maximum number of pivot columns.  When more columns are found,
   * the columns with the largest totals are kept and the rest are summed up
   * in an "Others" column.  {@link PivotRequest#UNLIMITED} (or any value of
   * {@code 0} or less) disables limiting.
   * @usage _general_method_
   */
  public PivotRequestBuilder setColumnLimit(int columnLimit) {
    _columnLimit = columnLimit;
    return this;
  }

  /**
   * Sets whether pivot columns may be fetched with one segmented query per
   * row when the source report has no subtables by the pivot dimension.
   * @usage _general_method_
   */
  public PivotRequestBuilder setAllowSegmentFetch(boolean allowSegmentFetch) {
    _allowSegmentFetch = allowSegmentFetch;
    return this;
  }

  /**
   * Creates a new PivotRequest with the current configuration.
   * @usage _general_method_
   */
  public PivotRequest toRequest() {
    return new PivotRequest(_sourceReportId, _pivotDimensionId, _valueColumn,
                            _columnLimit, _allowSegmentFetch);
  }
}
