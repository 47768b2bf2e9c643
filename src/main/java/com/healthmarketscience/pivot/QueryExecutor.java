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

import java.io.IOException;

/**
 * Runs a report restricted to a segment.  Used to fetch the pivot columns of
 * a row when the source report has no suitable subtables.  Implementations
 * may be called from several threads at once.
 *
 * @author James Ahlborn
 * @usage _general_class_
 */
@FunctionalInterface
public interface QueryExecutor
{
  /**
   * Runs the report with the given id over the data matched by the given
   * segment expression.
   *
   * @param reportId the id of the report to run
   * @param segment the segment expression restricting the report data
   *
   * @return the report's rows, never {@code null}
   * @throws IOException if the report could not be run; the exception is
   *                     propagated unchanged to the caller of the pivot
   */
  public Table execute(String reportId, String segment) throws IOException;
}
