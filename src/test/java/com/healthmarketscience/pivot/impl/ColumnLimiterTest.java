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
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import org.junit.jupiter.api.Test;

/**
 * @author James Ahlborn
 */
public class ColumnLimiterTest
{
  private static final String OTHERS = "Others";

  @Test
  public void testNotLimiting() throws Exception
  {
    DenseMatrix matrix = createMatrix(Arrays.asList("a", "b", "c"),
                                      new Number[]{1, 2, 3});

    for(int limit : new int[]{-1, 0, 3, 10}) {
      ColumnLimiter limiter = new ColumnLimiter(limit, OTHERS);
      assertFalse(limiter.isLimiting(matrix));
      assertSame(matrix, limiter.apply(matrix));
    }
  }

  @Test
  public void testLimitKeepsFirstSeenOrder() throws Exception
  {
    DenseMatrix matrix = createMatrix(Arrays.asList("a", "b", "c", "d"),
                                      new Number[]{1, 2, null, 40},
                                      new Number[]{null, 5, 7, null});

    DenseMatrix limited = new ColumnLimiter(3, OTHERS).apply(matrix);

    assertEquals(Arrays.asList("b", "d", OTHERS), limited.getColumns());
    assertEquals(row("b", 2, "d", 40, OTHERS, 1L), limited.getRows().get(0));
    assertEquals(row("b", 5, "d", null, OTHERS, 7L),
                 limited.getRows().get(1));
  }

  @Test
  public void testTiesPreferFirstSeen() throws Exception
  {
    DenseMatrix matrix = createMatrix(Arrays.asList("a", "b", "c", "d"),
                                      new Number[]{5, 5, 5, 1});

    DenseMatrix limited = new ColumnLimiter(3, OTHERS).apply(matrix);

    assertEquals(Arrays.asList("a", "b", OTHERS), limited.getColumns());
    assertEquals(row("a", 5, "b", 5, OTHERS, 6L), limited.getRows().get(0));
  }

  @Test
  public void testAllAbsentOthers() throws Exception
  {
    DenseMatrix matrix = createMatrix(Arrays.asList("a", "b", "c"),
                                      new Number[]{10, null, null},
                                      new Number[]{20, 3, null});

    DenseMatrix limited = new ColumnLimiter(2, OTHERS).apply(matrix);

    assertEquals(Arrays.asList("a", OTHERS), limited.getColumns());
    assertEquals(row("a", 10, OTHERS, 0L), limited.getRows().get(0));
    assertEquals(row("a", 20, OTHERS, 3L), limited.getRows().get(1));
  }

  @Test
  public void testLimitOfOne() throws Exception
  {
    DenseMatrix matrix = createMatrix(Arrays.asList("a", "b"),
                                      new Number[]{1, 2});

    DenseMatrix limited = new ColumnLimiter(1, OTHERS).apply(matrix);

    assertEquals(Arrays.asList(OTHERS), limited.getColumns());
    assertEquals(row(OTHERS, 3L), limited.getRows().get(0));
  }

  @Test
  public void testFloatingSums() throws Exception
  {
    DenseMatrix matrix = createMatrix(Arrays.asList("a", "b", "c"),
                                      new Number[]{100, 1.5d, 2});

    DenseMatrix limited = new ColumnLimiter(2, OTHERS).apply(matrix);

    assertEquals(row("a", 100, OTHERS, 3.5d), limited.getRows().get(0));
  }

  @Test
  public void testNonFiniteWithDecimals() throws Exception
  {
    DenseMatrix matrix = createMatrix(Arrays.asList("a", "b", "c"),
                                      new Number[]{BigDecimal.ONE, Double.NaN,
                                                   2});

    DenseMatrix limited = new ColumnLimiter(2, OTHERS).apply(matrix);

    // NaN ranks above every number
    assertEquals(Arrays.asList("b", OTHERS), limited.getColumns());
    assertEquals(row("b", Double.NaN, OTHERS, new BigDecimal("3")),
                 limited.getRows().get(0));

    matrix = createMatrix(Arrays.asList("a", "b", "c"),
                          new Number[]{100, new BigDecimal("1.5"),
                                       Double.POSITIVE_INFINITY});

    limited = new ColumnLimiter(2, OTHERS).apply(matrix);

    assertEquals(Arrays.asList("c", OTHERS), limited.getColumns());
    assertEquals(row("c", Double.POSITIVE_INFINITY,
                     OTHERS, new BigDecimal("101.5")),
                 limited.getRows().get(0));
  }

  @Test
  public void testDiscoveredOthersColumnIsFolded() throws Exception
  {
    DenseMatrix matrix = createMatrix(Arrays.asList(OTHERS, "x", "y"),
                                      new Number[]{100, 1, 2});

    DenseMatrix limited = new ColumnLimiter(2, OTHERS).apply(matrix);

    assertEquals(Arrays.asList("y", OTHERS), limited.getColumns());
    assertEquals(row("y", 2, OTHERS, 101L), limited.getRows().get(0));
  }

  private static DenseMatrix createMatrix(List<String> columns,
                                          Number[]... rows)
  {
    List<Map<String,Number>> rowMaps = new ArrayList<Map<String,Number>>();
    for(Number[] values : rows) {
      Map<String,Number> rowMap = new LinkedHashMap<String,Number>();
      for(int i = 0; i < columns.size(); ++i) {
        rowMap.put(columns.get(i), values[i]);
      }
      rowMaps.add(rowMap);
    }
    return new DenseMatrix(new ArrayList<String>(columns), rowMaps);
  }

  private static Map<String,Number> row(Object... columnsAndValues)
  {
    Map<String,Number> rowMap = new LinkedHashMap<String,Number>();
    for(int i = 0; i < columnsAndValues.length; i += 2) {
      rowMap.put((String)columnsAndValues[i], (Number)columnsAndValues[i + 1]);
    }
    return rowMap;
  }
}
