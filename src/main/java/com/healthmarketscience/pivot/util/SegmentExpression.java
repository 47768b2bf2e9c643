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

package com.healthmarketscience.pivot.util;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

import org.apache.commons.lang3.StringUtils;

/**
 * Helpers for building segment expressions.  A segment expression selects
 * tracked data by dimension values, e.g. {@code "referrerKeyword==row+1"}.
 * Conditions which must all hold are joined with {@value #AND_DELIMITER}.
 *
 * @author James Ahlborn
 */
public final class SegmentExpression
{
  public static final String AND_DELIMITER = ";";
  public static final String MATCH_EQUAL = "==";

  private SegmentExpression() {
  }

  /**
   * Returns an expression matching data whose dimension with the given
   * segment name equals the given value.  The value is form-url encoded
   * (spaces become {@code '+'}).
   */
  public static String equalTo(String segmentName, String value)
  {
    return segmentName + MATCH_EQUAL + encode(value);
  }

  /**
   * Combines the two expressions with a logical AND, {@code expr1} first.
   * Blank expressions are ignored.
   *
   * @return the combined expression, or the non-blank one of the two,
   *         {@code ""} if both are blank
   */
  public static String and(String expr1, String expr2)
  {
    if(StringUtils.isBlank(expr1)) {
      return StringUtils.defaultString(StringUtils.trimToNull(expr2));
    }
    if(StringUtils.isBlank(expr2)) {
      return expr1.trim();
    }
    return expr1.trim() + AND_DELIMITER + expr2.trim();
  }

  private static String encode(String value)
  {
    if(value == null) {
      return "";
    }
    // URLEncoder keeps '*', which is an operator in segment expressions
    return StringUtils.replace(URLEncoder.encode(value, StandardCharsets.UTF_8),
                               "*", "%2A");
  }
}
