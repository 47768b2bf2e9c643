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
 * Source of report and dimension descriptors used to validate pivot
 * requests.  Lookups return {@code null} for unknown ids.
 *
 * @author James Ahlborn
 * @usage _general_class_
 */
public interface MetadataRegistry
{
  /**
   * @return the report with the given id, {@code null} if unknown
   */
  public ReportMetadata getReport(String reportId);

  /**
   * @return the dimension with the given id, {@code null} if unknown
   */
  public DimensionMetadata getDimension(String dimensionId);

  /**
   * @return the report whose rows are keyed by the given dimension,
   *         {@code null} if there is none
   */
  public ReportMetadata findReportForDimension(String dimensionId);
}
