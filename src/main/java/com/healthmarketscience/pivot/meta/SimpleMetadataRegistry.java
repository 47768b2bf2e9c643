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

package com.healthmarketscience.pivot.meta;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import com.healthmarketscience.pivot.impl.CustomToStringStyle;
import org.apache.commons.lang3.StringUtils;

/**
 * Fixed, explicitly constructed {@link MetadataRegistry}.  Ids are matched
 * case-insensitively, the descriptors always report the id they were
 * registered with.
 * <p/>
 * Example:
 * <pre>
 *   MetadataRegistry registry = new SimpleMetadataRegistry.Builder()
 *     .addDimension("Referrers.Keyword", "referrerKeyword")
 *     .addDimension("Referrers.SearchEngine", "referrerName")
 *     .addReport("Referrers.getKeywords", "Referrers.Keyword",
 *                "Referrers.SearchEngine", "nb_visits")
 *     .toRegistry();
 * </pre>
 *
 * @author James Ahlborn
 * @usage _general_class_
 */
public class SimpleMetadataRegistry implements MetadataRegistry
{
  /** metric used for reports registered without a default metric */
  public static final String DEFAULT_METRIC = "nb_visits";

  private final Map<String,ReportMetadata> _reports;
  private final Map<String,DimensionMetadata> _dimensions;
  /** reports in registration order, searched by findReportForDimension */
  private final List<ReportMetadata> _reportList;

  private SimpleMetadataRegistry(Builder builder) {
    // the builder may be reused, so this registry gets its own copies
    _reports = Collections.unmodifiableMap(copyOf(builder._reports));
    _dimensions = Collections.unmodifiableMap(copyOf(builder._dimensions));
    _reportList = Collections.unmodifiableList(
        new ArrayList<ReportMetadata>(builder._reportList));
  }

  private static <V> Map<String,V> copyOf(Map<String,V> map) {
    Map<String,V> copy = new TreeMap<String,V>(String.CASE_INSENSITIVE_ORDER);
    copy.putAll(map);
    return copy;
  }

  public ReportMetadata getReport(String reportId) {
    return ((reportId != null) ? _reports.get(reportId) : null);
  }

  public DimensionMetadata getDimension(String dimensionId) {
    return ((dimensionId != null) ? _dimensions.get(dimensionId) : null);
  }

  public ReportMetadata findReportForDimension(String dimensionId) {
    if(dimensionId == null) {
      return null;
    }
    for(ReportMetadata report : _reportList) {
      if(dimensionId.equalsIgnoreCase(report.getDimensionId())) {
        return report;
      }
    }
    return null;
  }

  public List<ReportMetadata> getReports() {
    return _reportList;
  }

  @Override
  public String toString() {
    return CustomToStringStyle.builder(this)
      .append("reports", _reports.keySet())
      .append("dimensions", _dimensions.keySet())
      .toString();
  }

  /**
   * Builder style class for constructing a {@link SimpleMetadataRegistry}.
   */
  public static class Builder
  {
    private final Map<String,ReportMetadata> _reports =
      new TreeMap<String,ReportMetadata>(String.CASE_INSENSITIVE_ORDER);
    private final Map<String,DimensionMetadata> _dimensions =
      new TreeMap<String,DimensionMetadata>(String.CASE_INSENSITIVE_ORDER);
    private final List<ReportMetadata> _reportList =
      new ArrayList<ReportMetadata>();

    public Builder() {
    }

    /**
     * Registers a dimension.
     *
     * @param id the dimension id
     * @param segmentName the name of the dimension in segment expressions,
     *                    {@code null} if it can not be segmented on
     */
    public Builder addDimension(String id, String segmentName) {
      checkId(id, _dimensions, "dimension");
      _dimensions.put(id, new Dimension(id, StringUtils.trimToNull(segmentName)));
      return this;
    }

    /**
     * Registers a report without subtables.
     */
    public Builder addReport(String id, String dimensionId,
                             String defaultMetric) {
      return addReport(id, dimensionId, null, defaultMetric);
    }

    /**
     * Registers a report.
     *
     * @param id the report id
     * @param dimensionId the dimension the report rows are keyed by, may be
     *                    {@code null}
     * @param subtableDimensionId the dimension the report's subtables are
     *                            keyed by, may be {@code null}
     * @param defaultMetric the default metric,
     *                      {@link SimpleMetadataRegistry#DEFAULT_METRIC} if
     *                      {@code null}
     */
    public Builder addReport(String id, String dimensionId,
                             String subtableDimensionId,
                             String defaultMetric) {
      checkId(id, _reports, "report");
      ReportMetadata report = new Report(
          id, StringUtils.trimToNull(dimensionId),
          StringUtils.trimToNull(subtableDimensionId),
          StringUtils.defaultIfBlank(defaultMetric, DEFAULT_METRIC));
      _reports.put(id, report);
      _reportList.add(report);
      return this;
    }

    public SimpleMetadataRegistry toRegistry() {
      return new SimpleMetadataRegistry(this);
    }

    private static void checkId(String id, Map<String,?> existing,
                                String type) {
      if(StringUtils.isBlank(id)) {
        throw new IllegalArgumentException("Missing " + type + " id");
      }
      if(existing.containsKey(id)) {
        throw new IllegalArgumentException(
            "Duplicate " + type + " id '" + id + "'");
      }
    }
  }

  private static final class Report implements ReportMetadata
  {
    private final String _id;
    private final String _dimensionId;
    private final String _subtableDimensionId;
    private final String _defaultMetric;

    private Report(String id, String dimensionId, String subtableDimensionId,
                   String defaultMetric) {
      _id = id;
      _dimensionId = dimensionId;
      _subtableDimensionId = subtableDimensionId;
      _defaultMetric = defaultMetric;
    }

    public String getId() {
      return _id;
    }

    public String getDimensionId() {
      return _dimensionId;
    }

    public String getSubtableDimensionId() {
      return _subtableDimensionId;
    }

    public String getDefaultMetric() {
      return _defaultMetric;
    }

    @Override
    public String toString() {
      return CustomToStringStyle.valueBuilder("Report")
        .append("id", _id)
        .append("dimensionId", _dimensionId)
        .append("subtableDimensionId", _subtableDimensionId)
        .append("defaultMetric", _defaultMetric)
        .toString();
    }
  }

  private static final class Dimension implements DimensionMetadata
  {
    private final String _id;
    private final String _segmentName;

    private Dimension(String id, String segmentName) {
      _id = id;
      _segmentName = segmentName;
    }

    public String getId() {
      return _id;
    }

    public String getSegmentName() {
      return _segmentName;
    }

    @Override
    public String toString() {
      return CustomToStringStyle.valueBuilder("Dimension")
        .append("id", _id)
        .append("segmentName", _segmentName)
        .toString();
    }
  }
}
