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

/**
 * Descriptor of a report known to a {@link MetadataRegistry}.
 *
 * @author James Ahlborn
 * @usage _general_class_
 */
public interface ReportMetadata
{
  /**
   * @return the canonical id of the report, e.g. "Referrers.getKeywords"
   */
  public String getId();

  /**
   * @return the id of the dimension the report's rows are keyed by,
   *         {@code null} if the report is not keyed by a dimension
   */
  public String getDimensionId();

  /**
   * @return the id of the dimension the report's subtables are keyed by,
   *         {@code null} if the report has no subtables
   */
  public String getSubtableDimensionId();

  /**
   * @return the metric shown by default for this report
   */
  public String getDefaultMetric();
}
