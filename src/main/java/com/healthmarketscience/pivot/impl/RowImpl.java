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

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import com.healthmarketscience.pivot.Row;


/**
 * A row of data as label plus column-&gt;value pairs.
 * <p>
 * Note that the {@link #equals} and {@link #hashCode} methods work on the
 * label and the column contents <i>only</i> (i.e. they ignore the subtable id
 * and the metadata).
 *
 * @author James Ahlborn
 */
public class RowImpl extends LinkedHashMap<String,Number> implements Row
{
  private static final long serialVersionUID = 20240611L;

  private final String _label;
  private int _subtableId = NO_SUBTABLE;
  private final Map<String,Object> _metadata = new LinkedHashMap<String,Object>();

  public RowImpl(String label) {
    _label = label;
  }

  public RowImpl(String label, int expectedSize) {
    super(expectedSize);
    _label = label;
  }

  /**
   * Copies the label, columns and metadata of the given row.  The copy does
   * not own a subtable.
   */
  public RowImpl(Row row) {
    super(row);
    _label = row.getLabel();
    _metadata.putAll(row.getMetadata());
  }

  public String getLabel() {
    return _label;
  }

  public Number getValue(String name) {
    return get(name);
  }

  public boolean hasValue(String name) {
    return (get(name) != null);
  }

  public Long getLong(String name) {
    Number val = get(name);
    return ((val != null) ? val.longValue() : null);
  }

  public Double getDouble(String name) {
    Number val = get(name);
    return ((val != null) ? val.doubleValue() : null);
  }

  public BigDecimal getBigDecimal(String name) {
    return NumberSupport.toBigDecimal(get(name));
  }

  public int getSubtableId() {
    return _subtableId;
  }

  void setSubtableId(int subtableId) {
    _subtableId = subtableId;
  }

  public boolean hasSubtable() {
    return (_subtableId != NO_SUBTABLE);
  }

  public Map<String,Object> getMetadata() {
    return _metadata;
  }

  @Override
  public boolean equals(Object o) {
    return ((this == o) ||
            ((o instanceof Row) && super.equals(o) &&
             Objects.equals(_label, ((Row)o).getLabel())));
  }

  @Override
  public int hashCode() {
    return (31 * super.hashCode()) + Objects.hashCode(_label);
  }

  @Override
  public String toString() {
    return CustomToStringStyle.formatRow(_label, this);
  }
}
