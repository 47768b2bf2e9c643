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
 * A {@link PivotRequest} which has been validated against the metadata
 * registry and bound to a data source.  A prepared pivot may be applied to
 * any number of tables, one at a time or concurrently, each application uses
 * its own working state.
 *
 * @author James Ahlborn
 * @usage _general_class_
 */
public interface PreparedPivot
{
  /** where the pivot columns of each row come from */
  public enum Source {
    /** the rows' own subtables */
    SUBTABLE,
    /** one segmented query per row */
    SEGMENT;
  }

  /**
   * @return the request this pivot was prepared from
   */
  public PivotRequest getRequest();

  /**
   * @return the source of the pivot columns
   */
  public Source getSource();

  /**
   * @return the metric shown in the pivot cells, never {@code null}
   */
  public String getValueColumn();

  /**
   * Pivots the given table in place: its rows are replaced by one row per
   * original row, holding a value (or absent) for every pivot column.
   *
   * @return the given table
   * @throws IOException if fetching the columns of any row failed, in which
   *                     case the table is left unchanged
   */
  public Table apply(Table table) throws IOException;
}
