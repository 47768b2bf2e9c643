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

import com.healthmarketscience.pivot.impl.CustomToStringStyle;

/**
 * Describes a single pivot of a report by a dimension.  Instances are
 * immutable and are created with a {@link PivotRequestBuilder}.
 *
 * @author James Ahlborn
 * @usage _general_class_
 */
public final class PivotRequest
{
  /** column limit which disables column limiting
   * @usage _general_field_
   */
  public static final int UNLIMITED = -1;

  /** the default column limit if not configured otherwise
   * @usage _general_field_
   */
  public static final int DEFAULT_COLUMN_LIMIT = 7;

  /** system property which can be used to set the default column limit of
   *  new requests.  Value should be an integer, {@code -1} disables limiting.
   * @usage _intermediate_field_
   */
  public static final String COLUMN_LIMIT_PROPERTY =
    "com.healthmarketscience.pivot.columnLimit";

  /** system property which can be used to set the default for fetching
   *  pivot columns by segment.  Value should be {@code "true"} or
   *  {@code "false"}.
   * @usage _intermediate_field_
   */
  public static final String ENABLE_FETCH_BY_SEGMENT_PROPERTY =
    "com.healthmarketscience.pivot.enableFetchBySegment";

  private final String _sourceReportId;
  private final String _pivotDimensionId;
  private final String _valueColumn;
  private final int _columnLimit;
  private final boolean _allowSegmentFetch;

  PivotRequest(String sourceReportId, String pivotDimensionId,
               String valueColumn, int columnLimit,
               boolean allowSegmentFetch)
  {
    _sourceReportId = sourceReportId;
    _pivotDimensionId = pivotDimensionId;
    _valueColumn = valueColumn;
    _columnLimit = columnLimit;
    _allowSegmentFetch = allowSegmentFetch;
  }

  /**
   * @return the id of the report whose rows are pivoted
   */
  public String getSourceReportId() {
    return _sourceReportId;
  }

  /**
   * @return the id of the dimension whose values become the pivot columns
   */
  public String getPivotDimensionId() {
    return _pivotDimensionId;
  }

  /**
   * @return the metric shown in the pivot cells, {@code null} to use the
   *         source report's default metric
   */
  public String getValueColumn() {
    return _valueColumn;
  }

  /**
   * @return the maximum number of pivot columns (including the "Others"
   *         column), {@code 0} or less for no limit
   */
  public int getColumnLimit() {
    return _columnLimit;
  }

  /**
   * @return whether pivot columns may be fetched with one segmented query
   *         per row when the source report has no matching subtables
   */
  public boolean isAllowSegmentFetch() {
    return _allowSegmentFetch;
  }

  /**
   * Returns the default column limit.  This defaults to
   * {@link #DEFAULT_COLUMN_LIMIT}, but can be overridden using the system
   * property {@value #COLUMN_LIMIT_PROPERTY}.
   * @usage _advanced_method_
   */
  public static int getDefaultColumnLimit()
  {
    String prop = System.getProperty(COLUMN_LIMIT_PROPERTY);
    if(prop != null) {
      prop = prop.trim();
      if(prop.length() > 0) {
        return Integer.parseInt(prop);
      }
    }
    return DEFAULT_COLUMN_LIMIT;
  }

  /**
   * Returns the default fetch by segment policy.  This defaults to
   * {@code false}, but can be overridden using the system property
   * {@value #ENABLE_FETCH_BY_SEGMENT_PROPERTY}.
   * @usage _advanced_method_
   */
  public static boolean getDefaultAllowSegmentFetch()
  {
    String prop = System.getProperty(ENABLE_FETCH_BY_SEGMENT_PROPERTY);
    if(prop != null) {
      return Boolean.TRUE.toString().equalsIgnoreCase(prop.trim());
    }
    return false;
  }

  @Override
  public String toString() {
    return CustomToStringStyle.valueBuilder(this)
      .append("sourceReportId", _sourceReportId)
      .append("pivotDimensionId", _pivotDimensionId)
      .append("valueColumn", _valueColumn)
      .append("columnLimit", _columnLimit)
      .append("allowSegmentFetch", _allowSegmentFetch)
      .toString();
  }
}
