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

import com.healthmarketscience.pivot.PivotException;
import com.healthmarketscience.pivot.PivotRequest;
import com.healthmarketscience.pivot.meta.DimensionMetadata;
import com.healthmarketscience.pivot.meta.MetadataRegistry;
import com.healthmarketscience.pivot.meta.ReportMetadata;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

/**
 * Validates pivot requests and decides where the pivot columns come from.
 * A report whose subtables are keyed by the pivot dimension is pivoted using
 * those subtables.  Otherwise, if allowed by the request, the columns are
 * fetched by running the report keyed by the pivot dimension once per row,
 * restricted by a segment on the row's label.
 *
 * @author James Ahlborn
 */
public class PivotResolver
{
  private static final Log LOG = LogFactory.getLog(PivotResolver.class);

  private final MetadataRegistry _registry;

  public PivotResolver(MetadataRegistry registry) {
    _registry = registry;
  }

  public ResolvedPivot resolve(PivotRequest request)
  {
    String dimensionId = request.getPivotDimensionId();
    if(StringUtils.isBlank(dimensionId)) {
      throw new PivotException(PivotException.Kind.INVALID_DIMENSION,
                               "Invalid dimension '" +
                               StringUtils.defaultString(dimensionId) + "'");
    }
    DimensionMetadata pivotDimension = _registry.getDimension(dimensionId);
    if(pivotDimension == null) {
      throw new PivotException(PivotException.Kind.UNKNOWN_DIMENSION,
                               "Invalid dimension '" + dimensionId + "'");
    }

    String reportId = request.getSourceReportId();
    ReportMetadata report = (StringUtils.isBlank(reportId) ? null :
                             _registry.getReport(reportId));
    if(report == null) {
      throw new PivotException(PivotException.Kind.UNKNOWN_REPORT,
                               "Unable to find report '" +
                               StringUtils.defaultString(reportId) + "'");
    }

    String valueColumn = StringUtils.defaultIfBlank(
        request.getValueColumn(), report.getDefaultMetric());

    ResolvedPivot resolved = null;
    if(pivotDimension.getId().equalsIgnoreCase(
           report.getSubtableDimensionId())) {
      resolved = ResolvedPivot.forSubtables(request, report, pivotDimension,
                                            valueColumn);
    } else if(request.isAllowSegmentFetch()) {
      resolved = resolveSegmentPivot(request, report, pivotDimension,
                                     valueColumn);
    } else if(report.getSubtableDimensionId() == null) {
      throw new PivotException(
          PivotException.Kind.UNSUPPORTED_PIVOT_NO_SUBTABLE,
          "Unsupported pivot: report '" + report.getId() +
          "' has no subtable dimension.");
    } else {
      throw new PivotException(
          PivotException.Kind.UNSUPPORTED_PIVOT_DIMENSION_MISMATCH,
          "Unsupported pivot: the subtable dimension for '" + report.getId() +
          "' does not match the requested pivotBy dimension.");
    }

    if(LOG.isDebugEnabled()) {
      LOG.debug("Resolved pivot " + request + " to " + resolved);
    }
    return resolved;
  }

  private ResolvedPivot resolveSegmentPivot(PivotRequest request,
                                            ReportMetadata report,
                                            DimensionMetadata pivotDimension,
                                            String valueColumn)
  {
    ReportMetadata pivotReport =
      _registry.findReportForDimension(pivotDimension.getId());
    if(pivotReport == null) {
      throw new PivotException(
          PivotException.Kind.NO_REPORT_FOR_DIMENSION,
          "Unsupported pivot: No report for pivot dimension '" +
          pivotDimension.getId() + "'");
    }

    // each row is selected by a segment on the report's own dimension
    DimensionMetadata reportDimension = ((report.getDimensionId() != null) ?
                                         _registry.getDimension(
                                             report.getDimensionId()) :
                                         null);
    if((reportDimension == null) ||
       (reportDimension.getSegmentName() == null)) {
      throw new PivotException(
          PivotException.Kind.NO_SEGMENT_FOR_DIMENSION,
          "Unsupported pivot: No segment for dimension of report '" +
          report.getId() + "'");
    }

    return ResolvedPivot.forSegments(request, report, pivotDimension,
                                     valueColumn, pivotReport,
                                     reportDimension.getSegmentName());
  }
}
