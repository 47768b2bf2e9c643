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

import com.healthmarketscience.pivot.PivotRequest;
import com.healthmarketscience.pivot.PreparedPivot;
import com.healthmarketscience.pivot.meta.DimensionMetadata;
import com.healthmarketscience.pivot.meta.ReportMetadata;

/**
 * Outcome of resolving a {@link PivotRequest} against the metadata registry.
 *
 * @author James Ahlborn
 */
public class ResolvedPivot
{
  private final PivotRequest _request;
  private final PreparedPivot.Source _source;
  private final ReportMetadata _report;
  private final DimensionMetadata _pivotDimension;
  private final String _valueColumn;
  /** report keyed by the pivot dimension, segment pivots only */
  private final ReportMetadata _pivotReport;
  /** segment name of the source report's dimension, segment pivots only */
  private final String _segmentName;

  private ResolvedPivot(PivotRequest request, PreparedPivot.Source source,
                        ReportMetadata report,
                        DimensionMetadata pivotDimension, String valueColumn,
                        ReportMetadata pivotReport, String segmentName) {
    _request = request;
    _source = source;
    _report = report;
    _pivotDimension = pivotDimension;
    _valueColumn = valueColumn;
    _pivotReport = pivotReport;
    _segmentName = segmentName;
  }

  static ResolvedPivot forSubtables(PivotRequest request,
                                    ReportMetadata report,
                                    DimensionMetadata pivotDimension,
                                    String valueColumn) {
    return new ResolvedPivot(request, PreparedPivot.Source.SUBTABLE, report,
                             pivotDimension, valueColumn, null, null);
  }

  static ResolvedPivot forSegments(PivotRequest request,
                                   ReportMetadata report,
                                   DimensionMetadata pivotDimension,
                                   String valueColumn,
                                   ReportMetadata pivotReport,
                                   String segmentName) {
    return new ResolvedPivot(request, PreparedPivot.Source.SEGMENT, report,
                             pivotDimension, valueColumn, pivotReport,
                             segmentName);
  }

  public PivotRequest getRequest() {
    return _request;
  }

  public PreparedPivot.Source getSource() {
    return _source;
  }

  public ReportMetadata getReport() {
    return _report;
  }

  public DimensionMetadata getPivotDimension() {
    return _pivotDimension;
  }

  public String getValueColumn() {
    return _valueColumn;
  }

  public ReportMetadata getPivotReport() {
    return _pivotReport;
  }

  public String getSegmentName() {
    return _segmentName;
  }

  @Override
  public String toString() {
    return CustomToStringStyle.builder(this)
      .append("source", _source)
      .append("report", _report.getId())
      .append("pivotDimension", _pivotDimension.getId())
      .append("valueColumn", _valueColumn)
      .append("pivotReport",
              ((_pivotReport != null) ? _pivotReport.getId() : null))
      .append("segmentName", _segmentName)
      .toString();
  }
}
