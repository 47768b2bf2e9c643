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

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * An ordered sequence of report {@link Row}s.  A Table is rendering agnostic,
 * it is filled by a report and handed on to whoever stores or displays it.
 * New Tables can be created using a {@link TableBuilder}.
 * <p>
 * A Table owns the subtables of its rows.  Subtables are held in a per-table
 * list and each row refers to its subtable by index, so a subtable lives
 * exactly as long as the table holding it.
 * <p>
 * A Table instance is not thread-safe.
 *
 * @author James Ahlborn
 * @usage _general_class_
 */
public interface Table extends Iterable<Row>
{
  /**
   * @usage _general_method_
   */
  public int getRowCount();

  /**
   * @return All of the rows in this table, in order (unmodifiable List)
   * @usage _general_method_
   */
  public List<Row> getRows();

  /**
   * Appends the given row to this table.  The row must not refer to a
   * subtable, use {@link #setSubtable} to attach one.
   * @usage _general_method_
   */
  public void addRow(Row row);

  /**
   * Replaces all rows of this table with the given rows.  All subtables
   * currently owned by this table are discarded, so the given rows must not
   * refer to any.
   * @usage _intermediate_method_
   */
  public void setRows(Collection<? extends Row> rows);

  /**
   * @return the subtable owned by the given row of this table, or {@code null}
   *         if the row has none
   * @usage _general_method_
   */
  public Table getSubtable(Row row);

  /**
   * Attaches the given table as the subtable of the given row of this table,
   * replacing any subtable the row previously had.
   * @usage _general_method_
   */
  public void setSubtable(Row row, Table subtable);

  /**
   * @return the number of subtables currently owned by this table
   * @usage _intermediate_method_
   */
  public int getSubtableCount();

  /**
   * @return the table level metadata value with the given name, {@code null}
   *         if none
   * @usage _intermediate_method_
   */
  public Object getMetadata(String name);

  /**
   * @return all table level metadata (unmodifiable Map)
   * @usage _intermediate_method_
   */
  public Map<String,Object> getMetadata();

  /**
   * Sets the table level metadata value with the given name.
   * @usage _intermediate_method_
   */
  public void putMetadata(String name, Object value);

  /**
   * @return a Stream using the default Iterator.
   */
  public default Stream<Row> stream() {
    return StreamSupport.stream(spliterator(), false);
  }
}
