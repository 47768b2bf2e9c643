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

import java.math.BigDecimal;
import java.util.Map;


/**
 * A row of report data as a label plus column name-&gt;value pairs.  Values
 * are numeric, column names are case sensitive and iterate in insertion
 * order.
 * <p>
 * A column which maps to {@code null} is <i>absent</i>: the row has a slot for
 * the column but no value was recorded for it.  Absence is distinct from a
 * recorded zero, see {@link #hasValue}.
 * <p>
 * A row may own at most one subtable, held by the {@link Table} which owns
 * the row.  The row itself only knows the subtable's id, see {@link
 * Table#getSubtable}.
 *
 * @author James Ahlborn
 * @usage _general_class_
 */
public interface Row extends Map<String,Number>
{
  /** subtable id of a row which has no subtable */
  public static final int NO_SUBTABLE = -1;

  /**
   * @return the label of this row, the value of the row's dimension
   * @usage _general_method_
   */
  public String getLabel();

  /**
   * @return the value for the column with the given name, {@code null} if the
   *         column is absent or unknown
   * @usage _general_method_
   */
  public Number getValue(String name);

  /**
   * @return {@code true} if this row has a non-absent value for the column
   *         with the given name, {@code false} otherwise
   * @usage _general_method_
   */
  public boolean hasValue(String name);

  /**
   * Convenience method which gets the value for the column with the given
   * name, converting it to a Long.
   */
  public Long getLong(String name);

  /**
   * Convenience method which gets the value for the column with the given
   * name, converting it to a Double.
   */
  public Double getDouble(String name);

  /**
   * Convenience method which gets the value for the column with the given
   * name, converting it to a BigDecimal.
   */
  public BigDecimal getBigDecimal(String name);

  /**
   * @return the id of this row's subtable within its owning table, or
   *         {@link #NO_SUBTABLE}
   * @usage _intermediate_method_
   */
  public int getSubtableId();

  /**
   * @return {@code true} if this row owns a subtable
   * @usage _general_method_
   */
  public boolean hasSubtable();

  /**
   * Free-form, non-metric information attached to this row (e.g. urls or
   * logos).  Metadata is carried through a pivot unchanged.
   * @usage _intermediate_method_
   */
  public Map<String,Object> getMetadata();
}
