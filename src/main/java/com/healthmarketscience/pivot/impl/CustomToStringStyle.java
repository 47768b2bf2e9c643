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
import java.util.Iterator;
import java.util.Map;

import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.builder.StandardToStringStyle;
import org.apache.commons.lang3.builder.ToStringBuilder;

/**
 * ToStringStyle for the pivot types.  Maps are rendered as pivot cells,
 * {@code {col=value, ...}}, with absent cells shown as {@value #ABSENT_TEXT}
 * and decimals in plain notation.  Rows render as
 * {@code label: {col=value, ...}}, see {@link #formatRow}.
 *
 * @author James Ahlborn
 */
public class CustomToStringStyle extends StandardToStringStyle
{
  private static final long serialVersionUID = 0L;

  private static final String LINE_SEP = System.lineSeparator();
  private static final String ML_FIELD_SEP = LINE_SEP + "  ";
  private static final String IMPL_SUFFIX = "Impl";
  private static final String CELL_SEP = ", ";
  static final String ABSENT_TEXT = "<absent>";

  /** one field per line, for tables and matrices */
  public static final CustomToStringStyle INSTANCE = new CustomToStringStyle() {
    private static final long serialVersionUID = 0L;
    {
      setFieldSeparator(ML_FIELD_SEP);
      setFieldSeparatorAtStart(true);
      setFieldNameValueSeparator(": ");
      setContentEnd(LINE_SEP + "]");
    }
  };

  /** single line, for small value objects */
  public static final CustomToStringStyle VALUE_INSTANCE =
    new CustomToStringStyle();

  private CustomToStringStyle() {
    setUseShortClassName(true);
    setUseIdentityHashCode(false);
  }

  public static ToStringBuilder builder(Object obj) {
    return new ToStringBuilder(obj, INSTANCE);
  }

  public static ToStringBuilder valueBuilder(Object obj) {
    return new ToStringBuilder(obj, VALUE_INSTANCE);
  }

  /**
   * @return the given cells as {@code label: {col=value, ...}}, or just the
   *         cells if the label is {@code null}
   */
  public static String formatRow(String label, Map<String,?> cells) {
    StringBuilder sb = new StringBuilder();
    if(label != null) {
      sb.append(label).append(": ");
    }
    appendCells(sb, cells);
    return sb.toString();
  }

  /**
   * @return the display text of a single cell value
   */
  public static String formatValue(Object value) {
    if(value == null) {
      return ABSENT_TEXT;
    }
    if(value instanceof BigDecimal) {
      return ((BigDecimal)value).toPlainString();
    }
    return value.toString();
  }

  private static void appendCells(StringBuilder sb, Map<?,?> cells) {
    sb.append("{");
    Iterator<? extends Map.Entry<?,?>> iter = cells.entrySet().iterator();
    while(iter.hasNext()) {
      Map.Entry<?,?> e = iter.next();
      sb.append(e.getKey()).append("=").append(formatValue(e.getValue()));
      if(iter.hasNext()) {
        sb.append(CELL_SEP);
      }
    }
    sb.append("}");
  }

  @Override
  protected void appendClassName(StringBuffer buffer, Object obj) {
    if(obj instanceof String) {
      // explicit name given by the caller
      buffer.append(obj);
    } else {
      super.appendClassName(buffer, obj);
    }
  }

  @Override
  protected String getShortClassName(Class<?> clss) {
    String shortName = StringUtils.removeEnd(super.getShortClassName(clss),
                                             IMPL_SUFFIX);
    // drop the outer class of nested classes
    return shortName.substring(shortName.lastIndexOf('.') + 1);
  }

  @Override
  protected void appendDetail(StringBuffer buffer, String fieldName,
                              Object value) {
    // nested multi-line values are indented one more level
    buffer.append(formatValue(value).replace(LINE_SEP, ML_FIELD_SEP));
  }

  @Override
  protected void appendDetail(StringBuffer buffer, String fieldName,
                              Map<?,?> value) {
    StringBuilder sb = new StringBuilder();
    appendCells(sb, value);
    buffer.append(sb);
  }
}
