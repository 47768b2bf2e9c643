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
 * Turns report tables into pivot tables, where the columns are the values of
 * a second dimension.  Instances are created with a {@link PivoterBuilder}
 * and are thread-safe.
 * <p/>
 * Simple example usage:
 * <pre>
 *   Pivoter pivoter = new PivoterBuilder(registry).toPivoter();
 *   pivoter.pivot(new PivotRequestBuilder("Referrers.getKeywords",
 *                                         "Referrers.SearchEngine")
 *                 .toRequest(), table);
 * </pre>
 *
 * @author James Ahlborn
 * @usage _general_class_
 */
public interface Pivoter
{
  /**
   * Validates the given request and picks the data source for the pivot
   * columns.  No table data is touched.
   *
   * @throws PivotException if the request names unknown reports or
   *                        dimensions or the report can not be pivoted by
   *                        the requested dimension
   * @usage _general_method_
   */
  public PreparedPivot prepare(PivotRequest request);

  /**
   * Convenience method which prepares the given request and applies it to
   * the given table.
   *
   * @return the given table, now pivoted
   * @throws PivotException if the request is invalid (see {@link #prepare})
   * @throws IOException if fetching the columns of any row failed
   * @usage _general_method_
   */
  public Table pivot(PivotRequest request, Table table) throws IOException;
}
