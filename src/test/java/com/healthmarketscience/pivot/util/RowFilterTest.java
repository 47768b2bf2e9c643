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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

import com.healthmarketscience.pivot.Row;
import static com.healthmarketscience.pivot.TestUtil.*;
import static org.junit.jupiter.api.Assertions.*;
import org.junit.jupiter.api.Test;

/**
 * @author James Ahlborn
 */
public class RowFilterTest
{
  private static final String COL1 = "col1";
  private static final String COL2 = "col2";
  private static final String COL3 = "col3";

  @Test
  public void testFilter() throws Exception
  {
    Row row0 = createExpectedRow("row 0", COL1, 7, COL2, 13, COL3, 1);
    Row row1 = createExpectedRow("row 1", COL1, 3, COL2, 42, COL3, null);
    Row row2 = createExpectedRow("row 2", COL1, 7, COL2, 55, COL3, 1);
    Row row3 = createExpectedRow("row 3", COL1, 9, COL2, 42, COL3, 1);
    Row row4 = createExpectedRow("row 4", COL1, 7, COL2, 13, COL3, null);
    Row row5 = createExpectedRow("row 5", COL1, null, COL2, null, COL3, null);

    List<Row> rows = Arrays.asList(row0, row1, row2, row3, row4, row5);

    assertEquals(Arrays.asList(row0, row2, row4),
                 toList(RowFilter.matchPattern(pattern(COL1, 7))
                        .apply(rows)));
    assertEquals(Arrays.asList(row1, row3, row5),
                 toList(RowFilter.invert(
                            RowFilter.matchPattern(pattern(COL1, 7)))
                        .apply(rows)));
    assertEquals(Arrays.asList(row0, row2),
                 toList(RowFilter.matchPattern(pattern(COL1, 7, COL3, 1))
                        .apply(rows)));
    assertEquals(Arrays.asList(row4),
                 toList(RowFilter.matchPattern(pattern(COL1, 7, COL3, null))
                        .apply(rows)));
    assertEquals(Arrays.asList(row0, row4),
                 toList(RowFilter.matchPattern(pattern(COL2, 13))
                        .apply(rows)));
    assertEquals(Arrays.asList(row1),
                 toList(RowFilter.matchPattern(row1).apply(rows)));

    assertEquals(Arrays.asList(row3),
                 toList(RowFilter.matchLabel("row 3").apply(rows)));
    assertEquals(Arrays.asList(row0, row1, row2, row3, row4),
                 toList(RowFilter.hasAnyValue().apply(rows)));

    assertEquals(rows, toList(RowFilter.apply(null, rows)));
    assertEquals(Arrays.asList(row1),
                 toList(RowFilter.apply(RowFilter.matchPattern(row1),
                                        rows)));
  }

  @Test
  public void testIterator() throws Exception
  {
    List<Row> rows = Arrays.asList(createExpectedRow("row 0", COL1, 1),
                                   createExpectedRow("row 1", COL1, 2));

    Iterator<Row> iter = RowFilter.matchLabel("row 1").apply(rows).iterator();
    assertTrue(iter.hasNext());
    assertTrue(iter.hasNext());
    assertEquals("row 1", iter.next().getLabel());
    assertFalse(iter.hasNext());
    assertThrows(NoSuchElementException.class, () -> iter.next());
  }

  public static List<Row> toList(Iterable<Row> rows)
  {
    List<Row> rowList = new ArrayList<Row>();
    for(Row row : rows) {
      rowList.add(row);
    }
    return rowList;
  }

  private static Map<String,Object> pattern(Object... columnsAndValues)
  {
    Map<String,Object> pattern = new HashMap<String,Object>();
    for(int i = 0; i < columnsAndValues.length; i += 2) {
      pattern.put((String)columnsAndValues[i], columnsAndValues[i + 1]);
    }
    return pattern;
  }

}
